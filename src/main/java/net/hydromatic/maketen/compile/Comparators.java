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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import net.hydromatic.maketen.ast.Ast;

/** Orderings of expressions. */
public abstract class Comparators {
  private Comparators() {}

  /**
   * Ordering used by the canonicalizer to decide which of two operands comes
   * first.
   *
   * <p>Numbers rank below operations. Numbers are ordered by value;
   * operations by depth, then by value. Two distinct expressions may rank
   * equal.
   */
  public static final Ordering<Ast.Exp> RANK =
      new Ordering<Ast.Exp>() {
        @Override public int compare(Ast.Exp e0, Ast.Exp e1) {
          if (e0.isNum()) {
            return e1.isNum() ? Integer.compare(e0.value, e1.value) : -1;
          }
          if (e1.isNum()) {
            return 1;
          }
          return ComparisonChain.start()
              .compare(e0.depth, e1.depth)
              .compare(e0.value, e1.value)
              .result();
        }
      };

  /** Returns whether {@code e0} ranks strictly below {@code e1}. */
  public static boolean ranksBelow(Ast.Exp e0, Ast.Exp e1) {
    return RANK.compare(e0, e1) < 0;
  }
}

// End Comparators.java
