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
package net.hydromatic.maketen.compile;

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.maketen.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes one line per event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that performs the given action on each rewrite,
   * then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer,
      Consumer<Rewrite> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(Rewrite rewrite, Ast.Operation before,
          Ast.Operation after) {
        consumer.accept(rewrite);
        super.onRewrite(rewrite, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on each canonical
   * expression, then calls the underlying tracer. */
  public static Tracer withOnCanonical(Tracer tracer,
      Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCanonical(Ast.Exp exp, Ast.Exp canonical,
          int passCount) {
        consumer.accept(canonical);
        super.onCanonical(exp, canonical, passCount);
      }
    };
  }

  /** Returns a tracer that performs the given action on each discarded
   * duplicate and the solution it duplicates, then calls the underlying
   * tracer. */
  public static Tracer withOnDuplicate(Tracer tracer,
      BiConsumer<Ast.Exp, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDuplicate(Ast.Exp exp, Ast.Exp kept) {
        consumer.accept(exp, kept);
        super.onDuplicate(exp, kept);
      }
    };
  }

  /** Returns a tracer that performs the given action on each solution,
   * then calls the underlying tracer. */
  public static Tracer withOnSolution(Tracer tracer,
      Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolution(Ast.Exp exp, long score) {
        consumer.accept(exp);
        super.onSolution(exp, score);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRewrite(Rewrite rewrite, Ast.Operation before,
        Ast.Operation after) {
    }

    @Override public void onCanonical(Ast.Exp exp, Ast.Exp canonical,
        int passCount) {
    }

    @Override public void onDuplicate(Ast.Exp exp, Ast.Exp kept) {
    }

    @Override public void onSolution(Ast.Exp exp, long score) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onRewrite(Rewrite rewrite, Ast.Operation before,
        Ast.Operation after) {
      tracer.onRewrite(rewrite, before, after);
    }

    @Override public void onCanonical(Ast.Exp exp, Ast.Exp canonical,
        int passCount) {
      tracer.onCanonical(exp, canonical, passCount);
    }

    @Override public void onDuplicate(Ast.Exp exp, Ast.Exp kept) {
      tracer.onDuplicate(exp, kept);
    }

    @Override public void onSolution(Ast.Exp exp, long score) {
      tracer.onSolution(exp, score);
    }
  }

  /** Tracer that writes debugging messages to a writer. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    @Override public void onRewrite(Rewrite rewrite, Ast.Operation before,
        Ast.Operation after) {
      w.println("rewrite " + rewrite + ": " + before + " => " + after);
      w.flush();
    }

    @Override public void onCanonical(Ast.Exp exp, Ast.Exp canonical,
        int passCount) {
      if (passCount > 0) {
        w.println("canonical: " + exp + " => " + canonical + " ("
            + passCount + " passes)");
        w.flush();
      }
    }

    @Override public void onDuplicate(Ast.Exp exp, Ast.Exp kept) {
      w.println("duplicate: " + exp + " ~ " + kept);
      w.flush();
    }

    @Override public void onSolution(Ast.Exp exp, long score) {
      w.println("solution: " + exp + " (score " + score + ")");
      w.flush();
    }
  }
}

// End Tracers.java
