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

/** Syntax node for a set display, {@code {a, *b}}. A set display is never empty. */
public final class SetExpression extends Expression {

  private final int lbraceOffset;
  private final ImmutableList<Expression> elements;
  private final int rbraceOffset;

  SetExpression(
      FileLocations locs, int lbraceOffset, ImmutableList<Expression> elements, int rbraceOffset) {
    super(locs, Kind.SET_EXPR);
    Preconditions.checkArgument(!elements.isEmpty());
    this.lbraceOffset = lbraceOffset;
    this.elements = elements;
    this.rbraceOffset = rbraceOffset;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  @Override
  public int getStartOffset() {
    return lbraceOffset;
  }

  @Override
  public int getEndOffset() {
    return rbraceOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
