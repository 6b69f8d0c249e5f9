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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.maketen.TestUtils;
import net.hydromatic.maketen.ast.Ast;
import net.hydromatic.maketen.ast.Pruning;
import org.junit.jupiter.api.Test;

/** Tests for {@link Generator}. */
public class GeneratorTest {
  private static List<String> generate(Pruning pruning, Integer... numbers) {
    return ImmutableList.copyOf(
        Iterables.transform(
            Generator.generate(Arrays.asList(numbers), pruning),
            Ast.Exp::toString));
  }

  @Test void testEmpty() {
    assertThat(generate(Pruning.STRICT), empty());
  }

  @Test void testSingle() {
    assertThat(generate(Pruning.STRICT, 7), is(ImmutableList.of("7")));
    assertThat(generate(Pruning.LENIENT, 0), is(ImmutableList.of("0")));
  }

  @Test void testPair() {
    assertThat(generate(Pruning.STRICT, 2, 3),
        is(ImmutableList.of("2 + 3", "3 - 2", "2 * 3", "2 ^ 3", "3 ^ 2")));
  }

  /** Operands with equal values are not swapped. */
  @Test void testPairEqual() {
    assertThat(generate(Pruning.STRICT, 5, 5),
        is(ImmutableList.of("5 + 5", "5 - 5", "5 * 5", "5 / 5", "5 ^ 5")));
  }

  @Test void testPruning() {
    assertThat(generate(Pruning.STRICT, 2, 1),
        is(ImmutableList.of("2 + 1", "2 - 1", "2 * 1", "1 ^ 2")));
    assertThat(generate(Pruning.LENIENT, 2, 1),
        is(
            ImmutableList.of(
                "2 + 1", "2 - 1", "2 * 1", "2 / 1", "2 ^ 1", "1 ^ 2")));
  }

  /** Every expression uses every number exactly once. */
  @Test void testUsesAllNumbers() {
    final List<Integer> numbers = ImmutableList.of(1, 2, 3, 4);
    int count = 0;
    for (Ast.Exp exp : Generator.generate(numbers, Pruning.STRICT)) {
      final List<Integer> used = new ArrayList<>(TestUtils.numbers(exp));
      used.sort(null);
      assertThat(used, is(numbers));
      ++count;
    }
    assertThat(count > 100, is(true));
  }

  /** Each split is generated in its original order; leaves within commutative
   * operations keep their positions. */
  @Test void testOrder() {
    final List<String> list = generate(Pruning.STRICT, 1, 2, 3);
    assertThat(list.get(0), is("1 + 2 + 3"));
    assertThat(list.contains("1 + 2 * 3"), is(true));
    assertThat(list.contains("(1 + 2) * 3"), is(true));
    assertThat(list.contains("2 * 3 + 1"), is(false));
  }

  /** Generation is lazy: the first expression over many numbers is
   * available without generating the rest. */
  @Test void testLazy() {
    final Iterable<Ast.Exp> exps =
        Generator.generate(ImmutableList.of(1, 2, 3, 4, 5, 6, 7, 8, 9),
            Pruning.STRICT);
    final Ast.Exp first = Iterables.getFirst(exps, null);
    assertThat(first, hasToString("1 + 2 + 3 + 4 + 5 + 6 + 7 + 8 + 9"));
    assertThat(first.value, is(45));
    assertThat(ImmutableList.copyOf(Iterables.limit(exps, 1000)),
        hasSize(1000));
  }

  @Test void testWithValue() {
    final List<Integer> numbers = ImmutableList.of(1, 2, 3, 4);
    final Iterable<Ast.Exp> all = Generator.generate(numbers, Pruning.STRICT);
    int expected = 0;
    for (Ast.Exp exp : all) {
      if (exp.value == 10) {
        ++expected;
      }
    }
    int actual = 0;
    for (Ast.Exp exp : Generator.withValue(all, 10)) {
      assertThat(exp.value, is(10));
      ++actual;
    }
    assertThat(actual, is(expected));
    assertThat(actual > 0, is(true));

    assertThat(Iterables.isEmpty(Generator.withValue(all, -1)), is(true));
  }
}

// End GeneratorTest.java
