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
 * Syntax node for adjacent string literals, {@code "a" f"{b}" 'c'}, which Python concatenates
 * implicitly. Each part is a {@link StringLiteral} or a {@link FormattedString}.
 */
public final class StringConcatenation extends Expression {

  private final ImmutableList<Expression> parts;

  StringConcatenation(FileLocations locs, ImmutableList<Expression> parts) {
    super(locs, Kind.STRING_CONCATENATION);
    Preconditions.checkArgument(parts.size() >= 2);
    this.parts = parts;
  }

  public ImmutableList<Expression> getParts() {
    return parts;
  }

  @Override
  public int getStartOffset() {
    return parts.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return parts.get(parts.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
