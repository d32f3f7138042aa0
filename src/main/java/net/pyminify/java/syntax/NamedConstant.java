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

/** Syntax node for one of the keyword constants {@code True}, {@code False} and {@code None}. */
public final class NamedConstant extends Expression {

  private final TokenKind value;
  private final int tokenOffset;

  NamedConstant(FileLocations locs, TokenKind value, int tokenOffset) {
    super(locs, Kind.NAMED_CONSTANT);
    Preconditions.checkArgument(
        value == TokenKind.TRUE || value == TokenKind.FALSE || value == TokenKind.NONE);
    this.value = value;
    this.tokenOffset = tokenOffset;
  }

  /** Returns TRUE, FALSE or NONE. */
  public TokenKind getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return tokenOffset;
  }

  @Override
  public int getEndOffset() {
    return tokenOffset + value.toString().length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
