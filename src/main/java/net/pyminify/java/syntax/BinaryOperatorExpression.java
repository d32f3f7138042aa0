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

import com.google.common.collect.ImmutableSet;

/**
 * A BinaryExpression represents a binary operator expression 'x op y', including the short-circuit
 * operators {@code and} and {@code or}. Comparisons are {@link ComparisonExpression}s.
 */
public final class BinaryOperatorExpression extends Expression {

  private final Expression x;
  private final TokenKind op; // one of 'operators'
  private final int opOffset;
  private final Expression y;

  /** operators is the set of valid binary operators. */
  public static final ImmutableSet<TokenKind> operators =
      ImmutableSet.of(
          TokenKind.AND,
          TokenKind.AMPERSAND,
          TokenKind.AT,
          TokenKind.CARET,
          TokenKind.GREATER_GREATER,
          TokenKind.LESS_LESS,
          TokenKind.MINUS,
          TokenKind.OR,
          TokenKind.PERCENT,
          TokenKind.PIPE,
          TokenKind.PLUS,
          TokenKind.SLASH,
          TokenKind.SLASH_SLASH,
          TokenKind.STAR,
          TokenKind.STAR_STAR);

  BinaryOperatorExpression(
      FileLocations locs, Expression x, TokenKind op, int opOffset, Expression y) {
    super(locs, Kind.BINARY_OPERATOR);
    this.x = x;
    this.op = op;
    this.opOffset = opOffset;
    this.y = y;
  }

  /** Returns the left operand. */
  public Expression getX() {
    return x;
  }

  /** Returns the operator kind. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the operator location. */
  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  /** Returns the right operand. */
  public Expression getY() {
    return y;
  }

  @Override
  public int getStartOffset() {
    return x.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return y.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
