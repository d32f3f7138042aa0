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

/** Syntax node for {@code global a, b} and {@code nonlocal a, b}. */
public final class DeclarationStatement extends Statement {

  private final TokenKind token; // GLOBAL or NONLOCAL
  private final int offset;
  private final ImmutableList<Identifier> names;

  DeclarationStatement(
      FileLocations locs, TokenKind token, int offset, ImmutableList<Identifier> names) {
    super(locs, Kind.DECLARATION);
    Preconditions.checkArgument(token == TokenKind.GLOBAL || token == TokenKind.NONLOCAL);
    this.token = token;
    this.offset = offset;
    this.names = names;
  }

  public boolean isGlobal() {
    return token == TokenKind.GLOBAL;
  }

  public boolean isNonlocal() {
    return token == TokenKind.NONLOCAL;
  }

  public ImmutableList<Identifier> getNames() {
    return names;
  }

  @Override
  public int getStartOffset() {
    return offset;
  }

  @Override
  public int getEndOffset() {
    return names.isEmpty()
        ? offset + token.toString().length()
        : names.get(names.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
