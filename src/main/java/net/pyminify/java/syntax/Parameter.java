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

import javax.annotation.Nullable;

/**
 * Syntax node for a parameter in a function (or lambda) definition.
 *
 * <p>Parameters may be of four forms, as in {@code def f(a, b=c, *args, d=e, **kwargs)}. They are
 * represented by the subclasses Mandatory, Optional, Star, and StarStar. A bare {@code *}, which
 * introduces keyword-only parameters, is a Star with no identifier. Parameters before a {@code /}
 * marker are {@link #isPositionalOnly positional-only}.
 */
public abstract class Parameter extends Node {

  @Nullable private final Identifier id;
  @Nullable private final Expression annotation;
  private boolean positionalOnly;

  private Parameter(FileLocations locs, @Nullable Identifier id, @Nullable Expression annotation) {
    super(locs);
    this.id = id;
    this.annotation = annotation;
  }

  @Nullable
  public String getName() {
    return id != null ? id.getName() : null;
  }

  @Nullable
  public Identifier getIdentifier() {
    return id;
  }

  @Nullable
  public Expression getDefaultValue() {
    return null;
  }

  /** Returns the annotation, {@code x: annotation}, or null. Lambda parameters have none. */
  @Nullable
  public Expression getAnnotation() {
    return annotation;
  }

  /** Reports whether the parameter precedes a {@code /} marker. */
  public boolean isPositionalOnly() {
    return positionalOnly;
  }

  void setPositionalOnly(boolean positionalOnly) {
    this.positionalOnly = positionalOnly;
  }

  @Override
  public int getEndOffset() {
    if (getDefaultValue() != null) {
      return getDefaultValue().getEndOffset();
    }
    if (annotation != null) {
      return annotation.getEndOffset();
    }
    return id != null ? id.getEndOffset() : getStartOffset() + 1;
  }

  /**
   * Syntax node for a mandatory parameter, {@code f(id)}. It may be positional or keyword-only
   * depending on its position.
   */
  public static final class Mandatory extends Parameter {
    Mandatory(FileLocations locs, Identifier id, @Nullable Expression annotation) {
      super(locs, id, annotation);
    }

    @Override
    public int getStartOffset() {
      return getIdentifier().getStartOffset();
    }
  }

  /**
   * Syntax node for an optional parameter, {@code f(id=expr).}. It may be positional or
   * keyword-only depending on its position.
   */
  public static final class Optional extends Parameter {

    private final Expression defaultValue;

    Optional(
        FileLocations locs,
        Identifier id,
        @Nullable Expression annotation,
        @Nullable Expression defaultValue) {
      super(locs, id, annotation);
      this.defaultValue = defaultValue;
    }

    @Override
    @Nullable
    public Expression getDefaultValue() {
      return defaultValue;
    }

    @Override
    public int getStartOffset() {
      return getIdentifier().getStartOffset();
    }
  }

  /** Syntax node for a star parameter, {@code f(*id)} or {@code f(..., *, ...)}. */
  public static final class Star extends Parameter {
    private final int starOffset;

    Star(
        FileLocations locs,
        int starOffset,
        @Nullable Identifier id,
        @Nullable Expression annotation) {
      super(locs, id, annotation);
      this.starOffset = starOffset;
    }

    @Override
    public int getStartOffset() {
      return starOffset;
    }
  }

  /** Syntax node for a parameter of the form {@code f(**id)}. */
  public static final class StarStar extends Parameter {
    private final int starStarOffset;

    StarStar(FileLocations locs, int starStarOffset, Identifier id, @Nullable Expression annotation) {
      super(locs, id, annotation);
      this.starStarOffset = starStarOffset;
    }

    @Override
    public int getStartOffset() {
      return starStarOffset;
    }
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
