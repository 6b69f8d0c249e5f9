/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.maketen;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.maketen.compile.Solver;
import net.hydromatic.maketen.compile.Tracer;
import net.hydromatic.maketen.compile.Tracers;
import net.hydromatic.maketen.eval.Prop;

/** Command-line entry point.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * maketen [--trace] [--name=value]... number...
 * }</pre>
 *
 * <p>Prints each solution on its own line. */
public class Main {
  private final List<String> argList;
  private final PrintWriter out;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main = new Main(ImmutableList.copyOf(args), System.out);
    try {
      main.run();
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      final PrintWriter err = new PrintWriter(System.err);
      usage(err);
      err.flush();
      System.exit(1);
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> argList, PrintStream out) {
    this(argList, new OutputStreamWriter(out));
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out) {
    this.argList = ImmutableList.copyOf(argList);
    this.out = out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
  }

  private static void usage(PrintWriter w) {
    w.println("Usage: maketen [--trace] [--name=value]... number...");
    w.println();
    w.println("Prints the ways to combine the numbers, in order, using");
    w.println("+, -, *, / and ^, to reach the target value.");
    w.println();
    w.println("Properties:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      w.println("  --" + prop.camelName + "="
          + prop.get(ImmutableMap.of()));
    }
  }

  /**
   * Parses the arguments, solves, and prints the solutions.
   *
   * @throws IllegalArgumentException if an argument is not valid
   */
  public void run() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final List<Integer> numbers = new ArrayList<>();
    boolean trace = false;
    for (String arg : argList) {
      if (arg.equals("--help")) {
        usage(out);
        out.flush();
        return;
      } else if (arg.equals("--trace")) {
        trace = true;
      } else if (arg.startsWith("--")) {
        final int i = arg.indexOf('=');
        if (i < 0) {
          throw new IllegalArgumentException("expected --name=value: " + arg);
        }
        Prop.lookup(arg.substring(2, i)).setLenient(propMap,
            arg.substring(i + 1));
      } else {
        numbers.add(parseNumber(arg));
      }
    }
    final Tracer tracer = trace ? Tracers.printTracer(out) : Tracers.empty();
    final Solver solver = Solver.create(propMap, tracer);
    for (String solution : solver.render(numbers)) {
      out.println(solution);
    }
    out.flush();
  }

  private static int parseNumber(String arg) {
    try {
      return Integer.parseInt(arg.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not an integer: " + arg, e);
    }
  }
}

// End Main.java
