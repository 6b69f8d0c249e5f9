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
package net.hydromatic.maketen.eval;

import com.google.common.math.IntMath;
import java.math.RoundingMode;
import net.hydromatic.maketen.ast.Op;

/** Integer arithmetic over expression values. */
public abstract class Codes {
  private Codes() {}

  /**
   * Applies an operator to two values.
   *
   * <p>Never wraps around: overflow, division by zero, inexact division and
   * negative exponents all throw.
   *
   * @throws ArithmeticException if the result is not a well-defined
   *     {@code int}
   */
  public static int apply(Op op, int left, int right) {
    switch (op) {
      case ADD:
        return IntMath.checkedAdd(left, right);
      case SUBTRACT:
        return IntMath.checkedSubtract(left, right);
      case MULTIPLY:
        return IntMath.checkedMultiply(left, right);
      case DIVIDE:
        if (left == Integer.MIN_VALUE && right == -1) {
          throw new ArithmeticException("overflow: divide(" + left + ", "
              + right + ")");
        }
        return IntMath.divide(left, right, RoundingMode.UNNECESSARY);
      case POWER:
        if (right < 0) {
          throw new ArithmeticException("negative exponent " + right);
        }
        return IntMath.checkedPow(left, right);
      default:
        throw new AssertionError("unknown operator " + op);
    }
  }

  /** Returns whether an operation is undefined over the non-negative
   * integers, even though {@link #apply} might give it a value.
   *
   * <p>A subtraction whose result would be negative is the only such
   * case. */
  public static boolean isOutOfDomain(Op op, int left, int right) {
    return op == Op.SUBTRACT && left < right;
  }

  /** Returns whether an operation is redundant: it has a value, but the
   * same value is produced by a simpler combination of the same
   * operands. */
  public static boolean isRedundant(Op op, int left, int right) {
    switch (op) {
      case SUBTRACT:
        // "x - 0" duplicates "x + 0"
        return right == 0;
      case DIVIDE:
        // "0 / x" duplicates "0 * x"; "x / 1" duplicates "x * 1"
        return left == 0 || right == 1;
      case POWER:
        // "x ^ 1" duplicates "x * 1"
        return right == 1;
      default:
        return false;
    }
  }
}

// End Codes.java
