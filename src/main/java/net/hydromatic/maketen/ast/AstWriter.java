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

/** Context for writing an expression out as an infix string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an integer to the output. */
  public AstWriter append(int i) {
    b.append(i);
    return this;
  }

  /** Appends a call to an infix operator, with parentheses if the
   * operation is an operand of {@code parent} that needs them. */
  public AstWriter infix(Ast.Exp a0, Op op, Ast.Exp a1, Op parent,
      boolean right) {
    if (op.needsParentheses(parent, right)) {
      append("(");
      infix(a0, op, a1);
      return append(")");
    }
    return infix(a0, op, a1);
  }

  /** Appends a call to an infix operator at the top level. */
  public AstWriter infix(Ast.Exp a0, Op op, Ast.Exp a1) {
    a0.unparse(this, op, false);
    append(op.padded);
    a1.unparse(this, op, true);
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
