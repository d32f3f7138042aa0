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

/**
 * Syntax node for a string or bytes literal without replacement fields.
 *
 * <p>The literal keeps its raw source text, including prefix and quotes, so that the printer can
 * reproduce it exactly. The decoded value is used by analyses that inspect string contents, such
 * as the recognition of {@code __all__}.
 */
public final class StringLiteral extends Expression {

  private final int startOffset;
  private final String raw;
  private final String value;

  StringLiteral(FileLocations locs, int startOffset, String raw, String value) {
    super(locs, Kind.STRING_LITERAL);
    this.startOffset = startOffset;
    this.raw = raw;
    this.value = value;
  }

  /** Returns the value denoted by the string literal. */
  public String getValue() {
    return value;
  }

  /** Returns the source text of the literal, including prefix and quotes. */
  public String getRaw() {
    return raw;
  }

  /** Reports whether the literal denotes a bytes value. */
  public boolean isBytes() {
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == '\'' || c == '"') {
        return false;
      }
      if (c == 'b' || c == 'B') {
        return true;
      }
    }
    return false;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return startOffset + raw.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
