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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Expression tree.
 *
 * <p>A tree is immutable. Each node caches its value when it is built, so
 * the cache always equals the recursive evaluation of the node. Use
 * {@link AstBuilder} to create nodes. */
public class Ast {
  private Ast() {}

  /** Base class of an expression: a number or an operation. */
  public abstract static class Exp {
    /** Value of this expression. */
    public final int value;
    /** Depth of this expression; 1 for a number. */
    public final int depth;

    Exp(int value, int depth) {
      this.value = value;
      this.depth = depth;
    }

    /**
     * Converts this expression into an infix string.
     *
     * <p>Operands are parenthesized where operator precedence requires it,
     * wherever an operation is the right operand of a non-commutative
     * operator, and wherever a negative number is an operand.
     */
    @Override public final String toString() {
      return unparse(new AstWriter()).toString();
    }

    /** Converts this expression into an infix string, with a given writer. */
    public final AstWriter unparse(AstWriter w) {
      return unparse(w, null, false);
    }

    /** Writes this expression, as an operand of {@code parent} (or the top
     * level if {@code parent} is null). */
    abstract AstWriter unparse(AstWriter w, @Nullable Op parent,
        boolean isRight);

    /** Returns whether this is a number. */
    public abstract boolean isNum();

    /** Returns whether this expression must be parenthesized when it is an
     * operand of {@code parent}. */
    public abstract boolean needsParentheses(Op parent, boolean isRight);
  }

  /** Number. A leaf of the tree. */
  public static class Num extends Exp {
    Num(int value) {
      super(value, 1);
    }

    @Override AstWriter unparse(AstWriter w, @Nullable Op parent,
        boolean isRight) {
      if (parent != null && needsParentheses(parent, isRight)) {
        return w.append("(").append(value).append(")");
      }
      return w.append(value);
    }

    @Override public boolean isNum() {
      return true;
    }

    /** {@inheritDoc}
     *
     * <p>A negative number is parenthesized, so that {@code (-3) ^ 2} and
     * {@code 4 - (-6)} read as intended. */
    @Override public boolean needsParentheses(Op parent, boolean isRight) {
      return value < 0;
    }

    @Override public int hashCode() {
      return value;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Num
          && value == ((Num) o).value;
    }
  }

  /** Call to a binary operator. */
  public static class Operation extends Exp {
    public final Op op;
    public final Exp left;
    public final Exp right;

    /** Creates an Operation. The value must already have been computed;
     * {@link AstBuilder} is responsible for that. */
    Operation(Op op, Exp left, Exp right, int value) {
      super(value, Math.max(left.depth, right.depth) + 1);
      this.op = requireNonNull(op, "op");
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override AstWriter unparse(AstWriter w, @Nullable Op parent,
        boolean isRight) {
      return parent == null
          ? w.infix(left, op, right)
          : w.infix(left, op, right, parent, isRight);
    }

    @Override public boolean isNum() {
      return false;
    }

    @Override public boolean needsParentheses(Op parent, boolean isRight) {
      return op.needsParentheses(parent, isRight);
    }

    /** Returns the left operand if it is an operation, otherwise null. */
    public @Nullable Operation leftOperation() {
      return left instanceof Operation ? (Operation) left : null;
    }

    /** Returns the right operand if it is an operation, otherwise null. */
    public @Nullable Operation rightOperation() {
      return right instanceof Operation ? (Operation) right : null;
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Operation
          && op == ((Operation) o).op
          && left.equals(((Operation) o).left)
          && right.equals(((Operation) o).right);
    }
  }
}

// End Ast.java
