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
 * Base class for the patterns of a {@code match} statement's cases.
 *
 * <p>Patterns bind names through {@link As} (capture patterns), {@link Star} (the rest of a
 * sequence) and the rest entry of a {@link Mapping}; every such name is an {@link Identifier} with
 * {@link Identifier.Context#STORE}. The keyword names of a {@link ClassPattern} are attribute names
 * and do not denote variables.
 */
public abstract class Pattern extends Node {

  private boolean parenthesized;

  Pattern(FileLocations locs) {
    super(locs);
  }

  /** Reports whether the pattern was written as a parenthesized group. */
  public final boolean isParenthesized() {
    return parenthesized;
  }

  final void setParenthesized(boolean parenthesized) {
    this.parenthesized = parenthesized;
  }

  /** A literal or dotted-name value pattern, e.g. {@code 1}, {@code "x"} or {@code Color.RED}. */
  public static final class Value extends Pattern {
    private final Expression value;

    Value(FileLocations locs, Expression value) {
      super(locs);
      this.value = value;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public int getStartOffset() {
      return value.getStartOffset();
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

  /** A capture, wildcard or as-pattern: {@code x}, {@code _}, or {@code pattern as x}. */
  public static final class As extends Pattern {
    private final int startOffset;
    @Nullable private final Pattern pattern;
    @Nullable private final Identifier name; // null for the wildcard '_'

    As(FileLocations locs, int startOffset, @Nullable Pattern pattern, @Nullable Identifier name) {
      super(locs);
      Preconditions.checkArgument(pattern == null || name != null, "'as' requires a name");
      this.startOffset = startOffset;
      this.pattern = pattern;
      this.name = name;
    }

    /** Returns the sub-pattern of {@code pattern as x}, or null for a bare capture or wildcard. */
    @Nullable
    public Pattern getPattern() {
      return pattern;
    }

    /** Returns the captured name, or null for the wildcard {@code _}. */
    @Nullable
    public Identifier getName() {
      return name;
    }

    public boolean isWildcard() {
      return name == null;
    }

    @Override
    public int getStartOffset() {
      return startOffset;
    }

    @Override
    public int getEndOffset() {
      return name != null ? name.getEndOffset() : startOffset + 1;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** The alternatives {@code p1 | p2 | ...}. */
  public static final class Or extends Pattern {
    private final ImmutableList<Pattern> patterns;

    Or(FileLocations locs, ImmutableList<Pattern> patterns) {
      super(locs);
      Preconditions.checkArgument(patterns.size() >= 2);
      this.patterns = patterns;
    }

    public ImmutableList<Pattern> getPatterns() {
      return patterns;
    }

    @Override
    public int getStartOffset() {
      return patterns.get(0).getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return patterns.get(patterns.size() - 1).getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * A sequence pattern, {@code [a, *rest]} or {@code (a, b)}. The bracket offsets are -1 for an
   * open sequence such as {@code case a, b:}.
   */
  public static final class Sequence extends Pattern {
    private final boolean isTuple;
    private final int lbracketOffset;
    private final ImmutableList<Pattern> patterns;
    private final int rbracketOffset;

    Sequence(
        FileLocations locs,
        boolean isTuple,
        int lbracketOffset,
        ImmutableList<Pattern> patterns,
        int rbracketOffset) {
      super(locs);
      this.isTuple = isTuple;
      this.lbracketOffset = lbracketOffset;
      this.patterns = patterns;
      this.rbracketOffset = rbracketOffset;
    }

    /** Reports whether the sequence was written with parentheses or none, rather than brackets. */
    public boolean isTuple() {
      return isTuple;
    }

    public ImmutableList<Pattern> getPatterns() {
      return patterns;
    }

    // An open sequence has no brackets at all, as in "case a, b:".
    boolean isOpen() {
      return lbracketOffset < 0;
    }

    @Override
    public int getStartOffset() {
      return lbracketOffset < 0 ? patterns.get(0).getStartOffset() : lbracketOffset;
    }

    @Override
    public int getEndOffset() {
      return rbracketOffset < 0
          ? patterns.get(patterns.size() - 1).getEndOffset()
          : rbracketOffset + 1;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** A star pattern within a sequence, {@code *rest} or {@code *_}. */
  public static final class Star extends Pattern {
    private final int starOffset;
    @Nullable private final Identifier name; // null for '*_'

    Star(FileLocations locs, int starOffset, @Nullable Identifier name) {
      super(locs);
      this.starOffset = starOffset;
      this.name = name;
    }

    @Nullable
    public Identifier getName() {
      return name;
    }

    @Override
    public int getStartOffset() {
      return starOffset;
    }

    @Override
    public int getEndOffset() {
      return name != null ? name.getEndOffset() : starOffset + 2;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** A mapping pattern, {@code {"k": p, **rest}}. */
  public static final class Mapping extends Pattern {
    private final int lbraceOffset;
    private final ImmutableList<Expression> keys;
    private final ImmutableList<Pattern> patterns;
    @Nullable private final Identifier rest;
    private final int rbraceOffset;

    Mapping(
        FileLocations locs,
        int lbraceOffset,
        ImmutableList<Expression> keys,
        ImmutableList<Pattern> patterns,
        @Nullable Identifier rest,
        int rbraceOffset) {
      super(locs);
      Preconditions.checkArgument(keys.size() == patterns.size());
      this.lbraceOffset = lbraceOffset;
      this.keys = keys;
      this.patterns = patterns;
      this.rest = rest;
      this.rbraceOffset = rbraceOffset;
    }

    public ImmutableList<Expression> getKeys() {
      return keys;
    }

    public ImmutableList<Pattern> getPatterns() {
      return patterns;
    }

    /** Returns the identifier of the {@code **rest} entry, or null. */
    @Nullable
    public Identifier getRest() {
      return rest;
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

  /** A class pattern, {@code Point(x, y=0)}. */
  public static final class ClassPattern extends Pattern {
    private final Expression cls;
    private final ImmutableList<Pattern> patterns;
    private final ImmutableList<Identifier> keywords; // attribute names, not symbols
    private final ImmutableList<Pattern> keywordPatterns;
    private final int rparenOffset;

    ClassPattern(
        FileLocations locs,
        Expression cls,
        ImmutableList<Pattern> patterns,
        ImmutableList<Identifier> keywords,
        ImmutableList<Pattern> keywordPatterns,
        int rparenOffset) {
      super(locs);
      Preconditions.checkArgument(keywords.size() == keywordPatterns.size());
      this.cls = cls;
      this.patterns = patterns;
      this.keywords = keywords;
      this.keywordPatterns = keywordPatterns;
      this.rparenOffset = rparenOffset;
    }

    public Expression getCls() {
      return cls;
    }

    public ImmutableList<Pattern> getPatterns() {
      return patterns;
    }

    public ImmutableList<Identifier> getKeywords() {
      return keywords;
    }

    public ImmutableList<Pattern> getKeywordPatterns() {
      return keywordPatterns;
    }

    @Override
    public int getStartOffset() {
      return cls.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return rparenOffset + 1;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }
}
