// Copyright 2026 The Pyminify Authors. All rights reserved.
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

/**
 * Syntax node for a (possibly chained) comparison, {@code a < b <= c}. There is one operator per
 * comparator; operators include {@code in}, {@code not in}, {@code is} and {@code is not}.
 */
public final class ComparisonExpression extends Expression {

  private final Expression left;
  private final ImmutableList<TokenKind> operators;
  private final ImmutableList<Expression> comparators;

  ComparisonExpression(
      FileLocations locs,
      Expression left,
      ImmutableList<TokenKind> operators,
      ImmutableList<Expression> comparators) {
    super(locs, Kind.COMPARISON);
    Preconditions.checkArgument(!operators.isEmpty() && operators.size() == comparators.size());
    this.left = left;
    this.operators = operators;
    this.comparators = comparators;
  }

  public Expression getLeft() {
    return left;
  }

  public ImmutableList<TokenKind> getOperators() {
    return operators;
  }

  public ImmutableList<Expression> getComparators() {
    return comparators;
  }

  @Override
  public int getStartOffset() {
    return left.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return comparators.get(comparators.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
