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

/** Which construction rules {@link AstBuilder} applies.
 *
 * <p>Hard rules reject operations that are not defined over the
 * non-negative integers (division by zero, inexact division, a negative
 * difference, a negative exponent, overflow). Style rules reject
 * operations that are valid but redundant, because the same value is
 * reachable through a simpler operator (dividing by one, subtracting
 * zero, raising to the power one, dividing zero). */
public enum Pruning {
  /** Applies hard rules and style rules. The default. */
  STRICT,
  /** Applies hard rules only. */
  LENIENT;

  /** Returns {@link #STRICT} if redundant operations are to be pruned,
   * otherwise {@link #LENIENT}. */
  public static Pruning of(boolean pruneRedundant) {
    return pruneRedundant ? STRICT : LENIENT;
  }
}

// End Pruning.java
