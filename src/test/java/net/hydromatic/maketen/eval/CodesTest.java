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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.maketen.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link Codes}. */
public class CodesTest {
  @Test void testApply() {
    assertThat(Codes.apply(Op.ADD, 3, 4), is(7));
    assertThat(Codes.apply(Op.SUBTRACT, 3, 4), is(-1));
    assertThat(Codes.apply(Op.MULTIPLY, 3, 4), is(12));
    assertThat(Codes.apply(Op.DIVIDE, 12, 4), is(3));
    assertThat(Codes.apply(Op.DIVIDE, -12, 4), is(-3));
    assertThat(Codes.apply(Op.POWER, 3, 4), is(81));
    assertThat(Codes.apply(Op.POWER, -2, 3), is(-8));
    assertThat(Codes.apply(Op.POWER, 7, 0), is(1));
  }

  @Test void testApplyThrows() {
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.DIVIDE, 1, 0));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.DIVIDE, 7, 2));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.DIVIDE, Integer.MIN_VALUE, -1));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.POWER, 2, -1));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.POWER, 10, 10));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.ADD, Integer.MAX_VALUE, 1));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.SUBTRACT, Integer.MIN_VALUE, 1));
    assertThrows(ArithmeticException.class,
        () -> Codes.apply(Op.MULTIPLY, 1 << 16, 1 << 16));
  }

  @Test void testIsOutOfDomain() {
    assertThat(Codes.isOutOfDomain(Op.SUBTRACT, 3, 4), is(true));
    assertThat(Codes.isOutOfDomain(Op.SUBTRACT, 4, 4), is(false));
    assertThat(Codes.isOutOfDomain(Op.ADD, 3, 4), is(false));
    assertThat(Codes.isOutOfDomain(Op.DIVIDE, 3, 4), is(false));
  }

  @Test void testIsRedundant() {
    assertThat(Codes.isRedundant(Op.SUBTRACT, 5, 0), is(true));
    assertThat(Codes.isRedundant(Op.SUBTRACT, 5, 1), is(false));
    assertThat(Codes.isRedundant(Op.DIVIDE, 0, 5), is(true));
    assertThat(Codes.isRedundant(Op.DIVIDE, 5, 1), is(true));
    assertThat(Codes.isRedundant(Op.DIVIDE, 5, 5), is(false));
    assertThat(Codes.isRedundant(Op.POWER, 5, 1), is(true));
    assertThat(Codes.isRedundant(Op.POWER, 1, 5), is(false));
    assertThat(Codes.isRedundant(Op.ADD, 5, 0), is(false));
    assertThat(Codes.isRedundant(Op.MULTIPLY, 5, 1), is(false));
    assertThat(Codes.isRedundant(Op.MULTIPLY, 0, 5), is(false));
  }
}

// End CodesTest.java
