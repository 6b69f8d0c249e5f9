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
import static net.hydromatic.maketen.ast.AstBuilder.ast;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.maketen.ast.Ast;
import net.hydromatic.maketen.ast.Op;
import net.hydromatic.maketen.ast.Pruning;

/**
 * Generates every expression that combines a list of numbers, in order,
 * using the operators in {@link Op}.
 *
 * <p>Numbers are never reordered except as the two operands of a
 * non-commutative operator; the generator chooses only where to split the
 * list and which operator joins each split. Operations that {@link
 * net.hydromatic.maketen.ast.AstBuilder} rejects are not generated.
 *
 * <p>Expressions are produced lazily. For each split point, the candidates
 * for the shorter side are collected into a list and the candidates for the
 * longer side are streamed past them, so memory use is proportional to the
 * shorter side's candidates rather than to the cross product.
 */
public class Generator {
  private final Pruning pruning;

  private Generator(Pruning pruning) {
    this.pruning = requireNonNull(pruning, "pruning");
  }

  /**
   * Returns every expression over a list of numbers.
   *
   * <p>The result is lazy; each call to {@code iterator()} generates the
   * expressions again. Returns an empty iterable if the list is empty.
   */
  public static Iterable<Ast.Exp> generate(List<Integer> numbers,
      Pruning pruning) {
    final List<Integer> list = ImmutableList.copyOf(numbers);
    if (list.isEmpty()) {
      return ImmutableList.of();
    }
    return new Generator(pruning).expressions(list);
  }

  /** Returns the expressions whose value is {@code target}. */
  public static Iterable<Ast.Exp> withValue(Iterable<Ast.Exp> exps,
      int target) {
    return Iterables.filter(exps, e -> e.value == target);
  }

  private Iterable<Ast.Exp> expressions(List<Integer> numbers) {
    if (numbers.size() == 1) {
      return ImmutableList.of(ast.num(numbers.get(0)));
    }
    final List<Iterable<Ast.Exp>> splits = new ArrayList<>();
    for (int i = 1; i < numbers.size(); i++) {
      splits.add(split(numbers, i));
    }
    return Iterables.concat(splits);
  }

  /** Returns the expressions whose top-level operation joins
   * {@code numbers[0, i)} and {@code numbers[i, n)}. */
  private Iterable<Ast.Exp> split(List<Integer> numbers, int i) {
    final List<Integer> leftNumbers = numbers.subList(0, i);
    final List<Integer> rightNumbers = numbers.subList(i, numbers.size());
    final boolean collectLeft = leftNumbers.size() <= rightNumbers.size();
    return () -> {
      // Deferred until iteration reaches this split.
      final List<Ast.Exp> collected =
          ImmutableList.copyOf(
              expressions(collectLeft ? leftNumbers : rightNumbers));
      return FluentIterable.from(
              expressions(collectLeft ? rightNumbers : leftNumbers))
          .<Ast.Exp>transformAndConcat(streamed ->
              FluentIterable.from(collected)
                  .<Ast.Exp>transformAndConcat(c ->
                      collectLeft
                          ? combine(c, streamed)
                          : combine(streamed, c)))
          .iterator();
    };
  }

  /** Returns every allowed operation joining two expressions.
   *
   * <p>Operands of a commutative operator keep their order. A
   * non-commutative operator is applied in both orders, unless the
   * operands have the same value, in which case swapping them would only
   * produce a duplicate. */
  List<Ast.Exp> combine(Ast.Exp left, Ast.Exp right) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (Op op : Op.values()) {
      add(list, op, left, right);
      if (!op.commutative && left.value != right.value) {
        add(list, op, right, left);
      }
    }
    return list;
  }

  private void add(List<Ast.Exp> list, Op op, Ast.Exp left, Ast.Exp right) {
    final Ast.Operation e = ast.tryOperation(op, left, right, pruning);
    if (e != null) {
      list.add(e);
    }
  }
}

// End Generator.java
