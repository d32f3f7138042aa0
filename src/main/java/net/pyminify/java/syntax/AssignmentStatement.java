// Copyright 2014 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pyminify.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for an assignment statement. It covers four forms:
 *
 * <ul>
 *   <li>ordinary, possibly chained: {@code a = b = rhs} (targets {@code [a, b]});
 *   <li>augmented: {@code lhs op= rhs};
 *   <li>annotated: {@code lhs: annotation = rhs};
 *   <li>bare annotation: {@code lhs: annotation}, with no RHS.
 * </ul>
 */
public final class AssignmentStatement extends Statement {

  private final ImmutableList<Expression> targets; // = IDENTIFIER | DOT | INDEX | LIST_EXPR | STARRED

  // non-null only for an annotated assignment
  @Nullable private final Expression annotation;

  @Nullable private final TokenKind op; // binary operator of an augmented assignment
  @Nullable private final Expression rhs;

  /**
   * Constructs an assignment statement. An augmented or annotated assignment has exactly one
   * target; only an annotated assignment may lack a RHS.
   */
  AssignmentStatement(
      FileLocations locs,
      ImmutableList<Expression> targets,
      @Nullable Expression annotation,
      @Nullable TokenKind op,
      @Nullable Expression rhs) {
    super(locs, Kind.ASSIGNMENT);
    Preconditions.checkArgument(!targets.isEmpty());
    if (annotation != null || op != null) {
      Preconditions.checkArgument(targets.size() == 1, "multiple targets");
      Preconditions.checkArgument(annotation == null || op == null);
    }
    Preconditions.checkArgument(rhs != null || annotation != null, "missing right-hand side");
    this.targets = targets;
    this.annotation = annotation;
    this.op = op;
    this.rhs = rhs;
  }

  /** Returns the targets of the assignment, in source order. */
  public ImmutableList<Expression> getTargets() {
    return targets;
  }

  /** Returns the annotation of an annotated assignment, or null. */
  @Nullable
  public Expression getAnnotation() {
    return annotation;
  }

  /** Returns the operator of an augmented assignment, or null for any other assignment. */
  @Nullable
  public TokenKind getOperator() {
    return op;
  }

  /** Reports whether this is an augmented assignment ({@code getOperator() != null}). */
  public boolean isAugmented() {
    return op != null;
  }

  /** Returns the RHS of the assignment, or null for a bare annotation. */
  @Nullable
  public Expression getRHS() {
    return rhs;
  }

  @Override
  public int getStartOffset() {
    return targets.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rhs != null ? rhs.getEndOffset() : annotation.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
