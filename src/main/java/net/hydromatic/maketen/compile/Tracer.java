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

/** Called on various events while solving. */
public interface Tracer {
  /** Called when a rewrite rule fires during canonicalization. */
  void onRewrite(Rewrite rewrite, Ast.Operation before, Ast.Operation after);

  /**
   * Called when an expression has been canonicalized.
   *
   * @param exp Expression as generated
   * @param canonical Canonical form; the same object as {@code exp} if no
   *     rewrite fired
   * @param passCount Number of passes that changed the expression
   */
  void onCanonical(Ast.Exp exp, Ast.Exp canonical, int passCount);

  /** Called when a canonical expression is discarded because it is
   * equivalent to a solution that has already been kept. */
  void onDuplicate(Ast.Exp exp, Ast.Exp kept);

  /** Called for each solution, in ranked order, with its complexity
   * score. */
  void onSolution(Ast.Exp exp, long score);
}

// End Tracer.java
