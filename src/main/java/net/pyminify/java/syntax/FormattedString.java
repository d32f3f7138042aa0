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
import javax.annotation.Nullable;

/**
 * Syntax node for an f-string literal, {@code f"text {expr!r:spec} more"}.
 *
 * <p>The literal is a sequence of {@link Part}s: runs of literal {@link Text}, kept in raw source
 * form (doubled braces and escapes included), and replacement {@link Field}s, whose expressions
 * are ordinary syntax nodes.
 */
public final class FormattedString extends Expression {

  private final int startOffset;
  private final String prefix; // e.g. "f", "rf", "Fr"
  private final String quote; // one of ' " ''' """
  private final ImmutableList<Part> parts;
  private final int endOffset;

  FormattedString(
      FileLocations locs,
      int startOffset,
      String prefix,
      String quote,
      ImmutableList<Part> parts,
      int endOffset) {
    super(locs, Kind.FORMATTED_STRING);
    this.startOffset = startOffset;
    this.prefix = prefix;
    this.quote = quote;
    this.parts = Preconditions.checkNotNull(parts);
    this.endOffset = endOffset;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getQuote() {
    return quote;
  }

  public ImmutableList<Part> getParts() {
    return parts;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** A part of an f-string: either literal text or a replacement field. */
  public abstract static class Part extends Node {
    Part(FileLocations locs) {
      super(locs);
    }
  }

  /** A run of literal text, in raw source form. */
  public static final class Text extends Part {
    private final int startOffset;
    private final String raw;

    Text(FileLocations locs, int startOffset, String raw) {
      super(locs);
      this.startOffset = startOffset;
      this.raw = raw;
    }

    public String getRaw() {
      return raw;
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

  /**
   * A replacement field, {@code {expr=!conversion:spec}}.
   *
   * <p>A self-documenting field ({@code {expr=}}) also prints the source text of its expression,
   * so the text is retained verbatim and the names in it must keep their spelling.
   */
  public static final class Field extends Part {
    private final int lbraceOffset;
    private final Expression value;
    @Nullable private final String selfDocumentingText; // "x =", including the '='
    private final char conversion; // 0 if absent
    @Nullable private final ImmutableList<Part> formatSpec;
    private final int rbraceOffset;

    Field(
        FileLocations locs,
        int lbraceOffset,
        Expression value,
        @Nullable String selfDocumentingText,
        char conversion,
        @Nullable ImmutableList<Part> formatSpec,
        int rbraceOffset) {
      super(locs);
      this.lbraceOffset = lbraceOffset;
      this.value = Preconditions.checkNotNull(value);
      this.selfDocumentingText = selfDocumentingText;
      this.conversion = conversion;
      this.formatSpec = formatSpec;
      this.rbraceOffset = rbraceOffset;
    }

    public Expression getValue() {
      return value;
    }

    public boolean isSelfDocumenting() {
      return selfDocumentingText != null;
    }

    /** Returns the verbatim text of a self-documenting field up to and including '='. */
    @Nullable
    public String getSelfDocumentingText() {
      return selfDocumentingText;
    }

    /** Returns the conversion character ({@code r}, {@code s} or {@code a}), or 0 if absent. */
    public char getConversion() {
      return conversion;
    }

    /** Returns the parts of the format specification, or null if there is none. */
    @Nullable
    public ImmutableList<Part> getFormatSpec() {
      return formatSpec;
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
}
