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

import static net.hydromatic.maketen.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.maketen.ast.Ast;
import net.hydromatic.maketen.ast.Pruning;
import org.junit.jupiter.api.Test;

/** Tests for {@link Canonicalizer} and {@link Rewrite}. */
public class CanonicalizerTest {
  private static Ast.Num n(int i) {
    return ast.num(i);
  }

  /** Canonicalizes an expression and checks the result and the rewrites that
   * fired. */
  private static void check(Ast.Exp exp, String expected,
      Rewrite... expectedRewrites) {
    final Fixture f = new Fixture(Pruning.STRICT, 100);
    final Ast.Exp canonical = f.canonicalizer.canonicalize(exp);
    assertThat(canonical, hasToString(expected));
    assertThat(canonical.value, is(exp.value));
    assertThat(f.rewrites, is(ImmutableList.copyOf(expectedRewrites)));
  }

  @Test void testCommute() {
    check(ast.plus(n(2), n(3)), "3 + 2", Rewrite.COMMUTE);
    check(ast.times(n(2), n(3)), "3 * 2", Rewrite.COMMUTE);
    check(ast.plus(n(3), n(2)), "3 + 2");
    // Operations rank above numbers
    check(ast.times(n(4), ast.plus(n(1), n(2))), "(2 + 1) * 4",
        Rewrite.COMMUTE, Rewrite.COMMUTE);
  }

  @Test void testLiftLeft() {
    check(ast.plus(ast.minus(n(7), n(2)), n(4)), "7 + 4 - 2",
        Rewrite.LIFT_LEFT);
    check(ast.times(ast.divide(n(8), n(2)), n(3)), "8 * 3 / 2",
        Rewrite.LIFT_LEFT);
    check(ast.plus(n(4), ast.minus(n(7), n(2))), "7 + 4 - 2",
        Rewrite.COMMUTE, Rewrite.LIFT_LEFT);
  }

  @Test void testLiftRight() {
    check(ast.plus(ast.times(n(3), n(3)), ast.minus(n(7), n(2))),
        "3 * 3 + 7 - 2",
        Rewrite.LIFT_RIGHT);
  }

  @Test void testFoldReverse() {
    check(ast.minus(n(9), ast.plus(n(2), n(3))), "9 - 3 - 2",
        Rewrite.COMMUTE, Rewrite.FOLD_REVERSE, Rewrite.ORDER_CHAIN);
  }

  @Test void testFoldSame() {
    check(ast.minus(n(9), ast.minus(n(5), n(2))), "9 + 2 - 5",
        Rewrite.FOLD_SAME);
    check(ast.divide(n(12), ast.divide(n(6), n(3))), "12 * 3 / 6",
        Rewrite.FOLD_SAME);
  }

  @Test void testOrderChain() {
    check(ast.plus(ast.plus(n(1), n(2)), n(3)), "3 + 2 + 1",
        Rewrite.COMMUTE, Rewrite.ORDER_CHAIN, Rewrite.COMMUTE);
    check(ast.minus(ast.minus(n(9), n(1)), n(3)), "9 - 3 - 1",
        Rewrite.ORDER_CHAIN);
    check(ast.power(ast.power(n(2), n(2)), n(3)), "(2 ^ 3) ^ 2",
        Rewrite.ORDER_CHAIN);
  }

  @Test void testOrderReverse() {
    check(ast.minus(ast.plus(n(5), n(2)), ast.divide(n(6), n(3))),
        "6 / 3 + 5 - 2",
        Rewrite.ORDER_REVERSE, Rewrite.COMMUTE);
  }

  /** Tests that {@code (1 + 2) + (3 + 4)} and {@code 1 + (2 + (3 + 4))}
   * reach the same form. */
  @Test void testSum() {
    final Fixture f = new Fixture(Pruning.STRICT, 100);
    final Ast.Exp e0 =
        f.canonicalizer.canonicalize(
            ast.plus(ast.plus(n(1), n(2)), ast.plus(n(3), n(4))));
    final Ast.Exp e1 =
        f.canonicalizer.canonicalize(
            ast.plus(n(1), ast.plus(n(2), ast.plus(n(3), n(4)))));
    assertThat(e0, hasToString("4 + 3 + 2 + 1"));
    assertThat(e1, is(e0));
  }

  /** A rewrite that would build a redundant operation does not fire under
   * strict pruning. */
  @Test void testPruning() {
    final Ast.Exp e = ast.minus(n(5), ast.plus(n(3), n(0)));

    final Fixture strict = new Fixture(Pruning.STRICT, 100);
    assertThat(strict.canonicalizer.canonicalize(e), sameInstance(e));
    assertThat(strict.rewrites, empty());

    final Fixture lenient = new Fixture(Pruning.LENIENT, 100);
    assertThat(lenient.canonicalizer.canonicalize(e),
        hasToString("5 - 3 - 0"));
    assertThat(lenient.rewrites,
        is(ImmutableList.of(Rewrite.FOLD_REVERSE, Rewrite.ORDER_CHAIN)));
  }

  /** Canonicalizing a canonical expression returns the same object and fires
   * no rewrites. */
  @Test void testIdempotent() {
    final Fixture f = new Fixture(Pruning.STRICT, 100);
    final List<Ast.Exp> canonicals = new ArrayList<>();
    for (Ast.Exp exp
        : Generator.withValue(
            Generator.generate(ImmutableList.of(1, 2, 3, 4), Pruning.STRICT),
            10)) {
      canonicals.add(f.canonicalizer.canonicalize(exp));
    }
    assertThat(canonicals.isEmpty(), is(false));

    final Fixture f2 = new Fixture(Pruning.STRICT, 100);
    for (Ast.Exp canonical : canonicals) {
      assertThat(f2.canonicalizer.canonicalize(canonical),
          sameInstance(canonical));
    }
    assertThat(f2.rewrites, empty());
  }

  /** Tests that the number of passes is capped. {@code (1 + 2) + 3} changes
   * in two passes, and a third pass confirms that it has converged. */
  @Test void testMaxPasses() {
    final Ast.Exp e = ast.plus(ast.plus(n(1), n(2)), n(3));
    assertThat(new Fixture(Pruning.STRICT, 3).canonicalizer.canonicalize(e),
        hasToString("3 + 2 + 1"));

    final CanonicalizeException x =
        assertThrows(CanonicalizeException.class,
            () -> new Fixture(Pruning.STRICT, 2).canonicalizer
                .canonicalize(e));
    assertThat(x.exp(), sameInstance(e));
    assertThat(x.getMessage(),
        is("did not converge after 2 passes; last form 3 + 2 + 1"));

    assertThrows(IllegalArgumentException.class,
        () -> new Canonicalizer(Pruning.STRICT, 0, Tracers.empty()));
  }

  @Test void testNum() {
    final Fixture f = new Fixture(Pruning.STRICT, 1);
    final Ast.Exp e = n(10);
    assertThat(f.canonicalizer.canonicalize(e), sameInstance(e));
  }

  /** Test fixture that records the rewrites that fire. */
  private static class Fixture {
    final List<Rewrite> rewrites = new ArrayList<>();
    final Canonicalizer canonicalizer;

    Fixture(Pruning pruning, int maxPasses) {
      canonicalizer =
          new Canonicalizer(pruning, maxPasses,
              Tracers.withOnRewrite(Tracers.empty(), rewrites::add));
    }
  }
}

// End CanonicalizerTest.java
