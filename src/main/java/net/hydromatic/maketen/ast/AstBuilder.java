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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import net.hydromatic.maketen.eval.Codes;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expression tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a number. */
  public Ast.Num num(int value) {
    return new Ast.Num(value);
  }

  /**
   * Creates an operation, or returns null if the operation is not allowed.
   *
   * <p>Rejects:
   *
   * <ul>
   *   <li>an operation whose value is not a well-defined {@code int}
   *       (division by zero, inexact division, negative exponent,
   *       overflow);
   *   <li>a subtraction whose result would be negative;
   *   <li>if {@code pruning} is {@link Pruning#STRICT}, a redundant
   *       operation: dividing zero, dividing by one, subtracting zero,
   *       raising to the power one.
   * </ul>
   */
  public Ast.@Nullable Operation tryOperation(Op op, Ast.Exp left,
      Ast.Exp right, Pruning pruning) {
    requireNonNull(pruning, "pruning");
    if (Codes.isOutOfDomain(op, left.value, right.value)) {
      return null;
    }
    if (pruning == Pruning.STRICT
        && Codes.isRedundant(op, left.value, right.value)) {
      return null;
    }
    final int value;
    try {
      value = Codes.apply(op, left.value, right.value);
    } catch (ArithmeticException e) {
      // Not a value; the operation does not exist.
      return null;
    }
    return new Ast.Operation(op, left, right, value);
  }

  /** Creates an operation, applying {@link Pruning#STRICT} rules, or returns
   * null if the operation is not allowed. */
  public Ast.@Nullable Operation tryOperation(Op op, Ast.Exp left,
      Ast.Exp right) {
    return tryOperation(op, left, right, Pruning.STRICT);
  }

  /**
   * Creates an operation, throwing if it is not allowed.
   *
   * @throws IllegalArgumentException if the operation is rejected by
   *     {@link #tryOperation(Op, Ast.Exp, Ast.Exp, Pruning)}
   */
  public Ast.Operation operation(Op op, Ast.Exp left, Ast.Exp right,
      Pruning pruning) {
    final Ast.Operation operation = tryOperation(op, left, right, pruning);
    if (operation == null) {
      throw new IllegalArgumentException(
          format("invalid operation: %s%s%s", left, op.padded, right));
    }
    return operation;
  }

  /** Creates an operation under {@link Pruning#LENIENT} rules, throwing if
   * it is not allowed. */
  public Ast.Operation operation(Op op, Ast.Exp left, Ast.Exp right) {
    return operation(op, left, right, Pruning.LENIENT);
  }

  public Ast.Operation plus(Ast.Exp left, Ast.Exp right) {
    return operation(Op.ADD, left, right);
  }

  public Ast.Operation minus(Ast.Exp left, Ast.Exp right) {
    return operation(Op.SUBTRACT, left, right);
  }

  public Ast.Operation times(Ast.Exp left, Ast.Exp right) {
    return operation(Op.MULTIPLY, left, right);
  }

  public Ast.Operation divide(Ast.Exp left, Ast.Exp right) {
    return operation(Op.DIVIDE, left, right);
  }

  public Ast.Operation power(Ast.Exp left, Ast.Exp right) {
    return operation(Op.POWER, left, right);
  }
}

// End AstBuilder.java
