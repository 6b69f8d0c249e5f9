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
import static net.hydromatic.maketen.compile.Comparators.ranksBelow;

import net.hydromatic.maketen.ast.Ast;
import net.hydromatic.maketen.ast.Op;
import net.hydromatic.maketen.ast.Pruning;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Local rewrite of an operation, preserving its value.
 *
 * <p>{@link Canonicalizer} tries the rewrites in declaration order at each
 * node. A rewrite returns null if it does not apply, or if one of the nodes
 * it would build is not allowed under the current {@link Pruning}.
 *
 * <p>In the examples, "+" and "-" stand for an operator and its reverse;
 * "*" and "/" behave the same way. {@link #COMMUTE}, {@link #LIFT_LEFT}
 * and {@link #LIFT_RIGHT} apply only to "+" and "*"; {@link #FOLD_REVERSE}
 * and {@link #FOLD_SAME} only to "-" and "/". {@link #ORDER_CHAIN} applies
 * to a chain of any one operator, including "^", as in
 * {@code (2 ^ 2) ^ 3} &rarr; {@code (2 ^ 3) ^ 2}.
 */
public enum Rewrite {
  /** Puts the higher-ranked operand of a commutative operator on the left:
   * {@code 2 + 3} &rarr; {@code 3 + 2}. */
  COMMUTE {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      if (!e.op.commutative || !ranksBelow(e.left, e.right)) {
        return null;
      }
      return ast.tryOperation(e.op, e.right, e.left, pruning);
    }
  },

  /** Moves a reverse operator out of the left operand:
   * {@code (a - x) + y} &rarr; {@code (a + y) - x}. */
  LIFT_LEFT {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      final Ast.Operation left = e.leftOperation();
      if (!e.op.commutative
          || left == null
          || !left.op.isReverseOf(e.op)) {
        return null;
      }
      return build(left.op, build(e.op, left.left, e.right, pruning),
          left.right, pruning);
    }
  },

  /** Moves a reverse operator out of the right operand:
   * {@code y + (a - x)} &rarr; {@code (y + a) - x}. */
  LIFT_RIGHT {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      final Ast.Operation right = e.rightOperation();
      if (!e.op.commutative
          || right == null
          || !right.op.isReverseOf(e.op)) {
        return null;
      }
      return build(right.op, build(e.op, e.left, right.left, pruning),
          right.right, pruning);
    }
  },

  /** Unwraps a right operand that uses the reverse operator:
   * {@code a - (b + c)} &rarr; {@code (a - c) - b}. */
  FOLD_REVERSE {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      final Ast.Operation right = e.rightOperation();
      if (!isInverse(e.op)
          || right == null
          || !right.op.isReverseOf(e.op)) {
        return null;
      }
      return build(e.op, build(e.op, e.left, right.right, pruning),
          right.left, pruning);
    }
  },

  /** Unwraps a right operand that uses the same operator:
   * {@code a - (b - c)} &rarr; {@code (a + c) - b}. */
  FOLD_SAME {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      final Ast.Operation right = e.rightOperation();
      final Op reverse = e.op.reverse();
      if (!isInverse(e.op)
          || reverse == null
          || right == null
          || right.op != e.op) {
        return null;
      }
      return build(e.op, build(reverse, e.left, right.right, pruning),
          right.left, pruning);
    }
  },

  /** Orders the operands of a chain of the same operator:
   * {@code (a + 2) + 3} &rarr; {@code (a + 3) + 2}. */
  ORDER_CHAIN {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      final Ast.Operation left = e.leftOperation();
      if (left == null
          || left.op != e.op
          || !ranksBelow(left.right, e.right)) {
        return null;
      }
      return build(e.op, build(e.op, left.left, e.right, pruning),
          left.right, pruning);
    }
  },

  /** Orders equal-valued operands of an operator and its reverse:
   * {@code (a + 2) - (4 - 2)} &rarr; {@code (a + (4 - 2)) - 2}. */
  ORDER_REVERSE {
    @Override Ast.@Nullable Operation apply(Ast.Operation e,
        Pruning pruning) {
      final Ast.Operation left = e.leftOperation();
      if (left == null
          || !left.op.isReverseOf(e.op)
          || left.right.value != e.right.value
          || !ranksBelow(left.right, e.right)) {
        return null;
      }
      return build(e.op, build(left.op, left.left, e.right, pruning),
          left.right, pruning);
    }
  };

  /** Applies this rewrite to an operation. Returns the rewritten operation,
   * or null if the rewrite does not apply. */
  abstract Ast.@Nullable Operation apply(Ast.Operation e, Pruning pruning);

  /** Returns whether an operator is subtraction or division, the operators
   * whose reverse is commutative. */
  private static boolean isInverse(Op op) {
    return op == Op.SUBTRACT || op == Op.DIVIDE;
  }

  /** Builds an operation, propagating null if an operand could not be
   * built. */
  private static Ast.@Nullable Operation build(Op op,
      Ast.@Nullable Exp left, Ast.Exp right, Pruning pruning) {
    return left == null ? null : ast.tryOperation(op, left, right, pruning);
  }
}

// End Rewrite.java
