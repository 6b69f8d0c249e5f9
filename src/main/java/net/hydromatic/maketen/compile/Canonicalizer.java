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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.maketen.ast.AstBuilder.ast;

import java.util.Map;
import net.hydromatic.maketen.ast.Ast;
import net.hydromatic.maketen.ast.Pruning;
import net.hydromatic.maketen.eval.Prop;

/**
 * Rewrites an expression into canonical form, so that expressions that are
 * equal by commutativity or associativity tend to become identical.
 *
 * <p>A pass visits the tree bottom up. At each operation, it tries each
 * {@link Rewrite} in order; a rewrite sees the result of the rewrites before
 * it. Passes repeat until one changes nothing. The rules are not proven to
 * converge, so the number of passes is capped by {@link Prop#MAX_PASSES}.
 *
 * <p>Every rewrite preserves the value of the node it rewrites. If no
 * rewrite fires, canonicalization returns the same object.
 */
public class Canonicalizer {
  private final Pruning pruning;
  private final int maxPasses;
  private final Tracer tracer;

  public Canonicalizer(Pruning pruning, int maxPasses, Tracer tracer) {
    checkArgument(maxPasses > 0, "maxPasses must be positive: %s",
        maxPasses);
    this.pruning = requireNonNull(pruning, "pruning");
    this.maxPasses = maxPasses;
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a Canonicalizer configured by properties. */
  public static Canonicalizer create(Map<Prop, Object> propMap,
      Tracer tracer) {
    return new Canonicalizer(
        Pruning.of(Prop.PRUNE_REDUNDANT.booleanValue(propMap)),
        Prop.MAX_PASSES.intValue(propMap), tracer);
  }

  /**
   * Returns the canonical form of an expression.
   *
   * @throws CanonicalizeException if the expression is still changing after
   *     the maximum number of passes
   */
  public Ast.Exp canonicalize(Ast.Exp exp) {
    Ast.Exp e = exp;
    for (int pass = 0; pass < maxPasses; pass++) {
      final Ast.Exp e2 = rewrite(e);
      if (e2 == e) {
        tracer.onCanonical(exp, e, pass);
        return e;
      }
      e = e2;
    }
    throw new CanonicalizeException("did not converge after " + maxPasses
        + " passes; last form " + e, exp);
  }

  /** Makes one pass over an expression. Returns the expression itself if
   * nothing changed. */
  Ast.Exp rewrite(Ast.Exp exp) {
    if (exp.isNum()) {
      return exp;
    }
    final Ast.Operation operation = (Ast.Operation) exp;
    final Ast.Exp left = rewrite(operation.left);
    final Ast.Exp right = rewrite(operation.right);
    Ast.Operation e =
        left == operation.left && right == operation.right
            ? operation
            : rebuild(operation, left, right);
    for (Rewrite rewrite : Rewrite.values()) {
      final Ast.Operation e2 = rewrite.apply(e, pruning);
      if (e2 != null) {
        if (e2.value != e.value) {
          throw new CanonicalizeException("rewrite " + rewrite
              + " changed value of " + e + " to " + e2, exp);
        }
        tracer.onRewrite(rewrite, e, e2);
        e = e2;
      }
    }
    return e;
  }

  /** Rebuilds an operation whose operands have been rewritten. The operands
   * have the same values as before, so the operation is still allowed. */
  private Ast.Operation rebuild(Ast.Operation operation, Ast.Exp left,
      Ast.Exp right) {
    final Ast.Operation e =
        ast.tryOperation(operation.op, left, right, pruning);
    if (e == null) {
      throw new CanonicalizeException("rewritten operands of " + operation
          + " are not allowed: " + left + ", " + right, operation);
    }
    return e;
  }
}

// End Canonicalizer.java
