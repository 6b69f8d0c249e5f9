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
package net.hydromatic.maketen.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Arithmetic operator of an {@link Ast.Operation}. */
public enum Op {
  ADD(" + ", 6, true),
  SUBTRACT(" - ", 6, false),
  MULTIPLY(" * ", 7, true),
  DIVIDE(" / ", 7, false),
  POWER(" ^ ", 8, false);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Precedence; higher binds tighter. */
  public final int precedence;
  /** Whether {@code a op b} always equals {@code b op a}. */
  public final boolean commutative;

  /** Map from an operator to its reverse; {@link #POWER} has none. */
  private static final ImmutableMap<Op, Op> REVERSE =
      ImmutableMap.<Op, Op>builder()
          .put(ADD, SUBTRACT)
          .put(SUBTRACT, ADD)
          .put(MULTIPLY, DIVIDE)
          .put(DIVIDE, MULTIPLY)
          .build();

  Op(String padded, int precedence, boolean commutative) {
    this.padded = padded;
    this.precedence = precedence;
    this.commutative = commutative;
  }

  /** Returns the operator that undoes this one, or null.
   *
   * <p>{@code SUBTRACT} reverses {@code ADD} and {@code DIVIDE} reverses
   * {@code MULTIPLY}, and vice versa. */
  public @Nullable Op reverse() {
    return REVERSE.get(this);
  }

  /** Returns whether this operator is the reverse of another. */
  public boolean isReverseOf(Op op) {
    return REVERSE.get(op) == this;
  }

  /** Returns whether an operation using this operator must be
   * parenthesized when it is an operand of {@code parent}.
   *
   * <p>It must if it binds more loosely than the parent; if it is the
   * right operand of a non-commutative parent; or if it is a power that is
   * the left operand of a power (because {@code ^} is conventionally
   * right-associative).
   *
   * @param parent Operator of the enclosing operation
   * @param right Whether this is the right operand
   */
  public boolean needsParentheses(Op parent, boolean right) {
    if (precedence < parent.precedence) {
      return true;
    }
    if (right) {
      return !parent.commutative;
    }
    return this == POWER && parent == POWER;
  }
}

// End Op.java
