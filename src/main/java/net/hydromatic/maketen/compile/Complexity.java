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
import net.hydromatic.maketen.ast.Op;

/**
 * Scores how complex an expression looks; solutions are presented in
 * increasing order of score.
 *
 * <p>Addition and subtraction are cheap, multiplication and division cost
 * more, powers cost most. Every pair of parentheses that the rendered
 * string needs, including those around a negative number, adds a
 * penalty.
 */
public abstract class Complexity {
  private Complexity() {}

  /** Cost of a number. */
  public static final long NUM_COST = 10;

  /** Cost added for an operand that must be parenthesized. */
  public static final long PARENTHESES_COST = 10;

  /** Returns the complexity score of an expression. */
  public static long score(Ast.Exp exp) {
    if (exp.isNum()) {
      return NUM_COST;
    }
    final Ast.Operation operation = (Ast.Operation) exp;
    final long sum =
        operand(operation.left, operation.op, false)
            + operand(operation.right, operation.op, true);
    return sum * weight(operation.op);
  }

  /** Returns the score of an expression as an operand of {@code parent}. */
  private static long operand(Ast.Exp exp, Op parent, boolean right) {
    final long score = score(exp);
    return exp.needsParentheses(parent, right)
        ? score + PARENTHESES_COST
        : score;
  }

  /** Returns the factor by which an operator multiplies the score of its
   * operands. */
  static int weight(Op op) {
    switch (op) {
      case ADD:
      case SUBTRACT:
        return 1;
      case MULTIPLY:
      case DIVIDE:
        return 2;
      case POWER:
        return 5;
      default:
        throw new AssertionError(op);
    }
  }
}

// End Complexity.java
