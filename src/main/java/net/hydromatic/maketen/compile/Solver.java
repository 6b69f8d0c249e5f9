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
import static net.hydromatic.maketen.util.Static.find;
import static net.hydromatic.maketen.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.maketen.ast.Ast;
import net.hydromatic.maketen.ast.Pruning;
import net.hydromatic.maketen.eval.Prop;

/**
 * Finds the distinct expressions over a list of numbers that reach a
 * target value.
 *
 * <p>The steps are:
 *
 * <ol>
 *   <li>generate every expression ({@link Generator});
 *   <li>keep those whose value is the target;
 *   <li>canonicalize each ({@link Canonicalizer});
 *   <li>discard each that is {@link Equivalence equivalent} to one already
 *       kept;
 *   <li>sort by {@link Complexity} score, keeping discovery order among
 *       equal scores;
 *   <li>render each as a string.
 * </ol>
 *
 * <p>A Solver holds no state between calls, and may be used from several
 * threads.
 */
public class Solver {
  private static final Ordering<Ast.Exp> BY_SCORE =
      Ordering.<Long>natural().onResultOf(Complexity::score);

  private final ImmutableMap<Prop, Object> propMap;
  private final Pruning pruning;
  private final Canonicalizer canonicalizer;
  private final Tracer tracer;

  private Solver(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer, "tracer");
    this.pruning =
        Pruning.of(Prop.PRUNE_REDUNDANT.booleanValue(this.propMap));
    this.canonicalizer = Canonicalizer.create(this.propMap, tracer);
  }

  /** Creates a Solver with given properties and tracer. */
  public static Solver create(Map<Prop, Object> propMap, Tracer tracer) {
    return new Solver(propMap, tracer);
  }

  /** Creates a Solver with default properties. */
  public static Solver create() {
    return create(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Returns the rendered solutions that combine {@code numbers}, in order,
   * to reach {@code target}, simplest first.
   *
   * <p>Returns an empty list if {@code numbers} is empty or if no
   * combination reaches the target.
   */
  public static List<String> solve(List<Integer> numbers, int target) {
    return create().render(numbers, target);
  }

  /** Returns the rendered solutions for the target given by the
   * {@link Prop#TARGET} property. */
  public List<String> render(List<Integer> numbers) {
    return render(numbers, Prop.TARGET.intValue(propMap));
  }

  /** Returns the rendered solutions that reach {@code target}. */
  public List<String> render(List<Integer> numbers, int target) {
    return transformEager(solutions(numbers, target), Ast.Exp::toString);
  }

  /** Returns the canonical, distinct solutions that reach {@code target},
   * simplest first. */
  public List<Ast.Exp> solutions(List<Integer> numbers, int target) {
    requireNonNull(numbers, "numbers");
    final List<Ast.Exp> kept = new ArrayList<>();
    for (Ast.Exp exp
        : Generator.withValue(Generator.generate(numbers, pruning), target)) {
      final Ast.Exp canonical = canonicalizer.canonicalize(exp);
      final Ast.Exp duplicate =
          find(kept, e -> Equivalence.equivalent(e, canonical));
      if (duplicate != null) {
        tracer.onDuplicate(canonical, duplicate);
        continue;
      }
      kept.add(canonical);
    }
    final List<Ast.Exp> sorted = BY_SCORE.sortedCopy(kept);
    for (Ast.Exp exp : sorted) {
      tracer.onSolution(exp, Complexity.score(exp));
    }
    return ImmutableList.copyOf(sorted);
  }
}

// End Solver.java
