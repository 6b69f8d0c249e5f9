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

/** The canonicalizer's rewrite rules failed to reach a fixed point, or a
 * rewrite changed the value of an expression.
 *
 * <p>Either indicates a bug in the rules, not bad input. */
public class CanonicalizeException extends RuntimeException {
  private final Ast.Exp exp;

  public CanonicalizeException(String message, Ast.Exp exp) {
    super(message);
    this.exp = exp;
  }

  /** Returns the expression that was being canonicalized. */
  public Ast.Exp exp() {
    return exp;
  }

  @Override public String toString() {
    return super.toString() + " in " + exp;
  }
}

// End CanonicalizeException.java
