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

import net.hydromatic.maketen.ast.Ast;

/**
 * Decides whether two canonical expressions are the same solution.
 *
 * <p>Two expressions are equivalent if they have the same shape, allowing
 * the operands of {@code +} and {@code *} to be swapped at any level.
 * In addition, operations that only use an identity or absorbing operand
 * are equivalent whatever the other operand:
 *
 * <ul>
 *   <li>{@code 1 ^ x} and {@code 1 ^ y}; {@code x ^ 0} and {@code y ^ 0};
 *   <li>{@code x / 1} and {@code y / 1}; {@code 0 / x} and {@code 0 / y};
 *   <li>{@code 0 * x} and {@code 0 * y}; {@code x * 0} and {@code y * 0}.
 * </ul>
 *
 * <p>Equivalence does not replace {@link Canonicalizer}; it removes the
 * duplicates that canonical forms leave behind.
 */
public abstract class Equivalence {
  private Equivalence() {}

  /** Returns whether two expressions are equivalent. */
  public static boolean equivalent(Ast.Exp e0, Ast.Exp e1) {
    if (e0.isNum() || e1.isNum()) {
      return e0.isNum() && e1.isNum() && e0.value == e1.value;
    }
    final Ast.Operation o0 = (Ast.Operation) e0;
    final Ast.Operation o1 = (Ast.Operation) e1;
    if (o0.op != o1.op) {
      return false;
    }
    if (degenerate(o0, o1)) {
      return true;
    }
    if (equivalent(o0.left, o1.left) && equivalent(o0.right, o1.right)) {
      return true;
    }
    return o0.op.commutative
        && equivalent(o0.left, o1.right)
        && equivalent(o0.right, o1.left);
  }

  /** Returns whether two operations with the same operator both have an
   * identity or absorbing operand in the same position. */
  private static boolean degenerate(Ast.Operation o0, Ast.Operation o1) {
    switch (o0.op) {
      case POWER:
        return both(o0.left, o1.left, 1) || both(o0.right, o1.right, 0);
      case DIVIDE:
        return both(o0.right, o1.right, 1) || both(o0.left, o1.left, 0);
      case MULTIPLY:
        return both(o0.left, o1.left, 0) || both(o0.right, o1.right, 0);
      default:
        return false;
    }
  }

  private static boolean both(Ast.Exp e0, Ast.Exp e1, int value) {
    return e0.value == value && e1.value == value;
  }
}

// End Equivalence.java
