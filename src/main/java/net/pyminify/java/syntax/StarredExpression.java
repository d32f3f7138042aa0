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

/**
 * Syntax node for a starred expression, {@code *value}, as it appears in displays, unpacking
 * assignment targets, and subscripts.
 */
public final class StarredExpression extends Expression {

  private final int starOffset;
  private final Expression value;

  StarredExpression(FileLocations locs, int starOffset, Expression value) {
    super(locs, Kind.STARRED);
    this.starOffset = starOffset;
    this.value = value;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return starOffset;
  }

  @Override
  public int getEndOffset() {
    return value.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
