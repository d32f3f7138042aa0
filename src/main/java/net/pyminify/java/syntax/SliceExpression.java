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
 * Syntax node for a slice, {@code start:stop:step}, which appears only as (part of) the key of an
 * {@link IndexExpression}. Each component is optional.
 */
public final class SliceExpression extends Expression {

  private final int startOffset;
  @Nullable private final Expression start;
  @Nullable private final Expression stop;
  @Nullable private final Expression step;
  private final boolean hasSecondColon;
  private final int endOffset;

  SliceExpression(
      FileLocations locs,
      int startOffset,
      @Nullable Expression start,
      @Nullable Expression stop,
      @Nullable Expression step,
      boolean hasSecondColon,
      int endOffset) {
    super(locs, Kind.SLICE);
    this.startOffset = startOffset;
    this.start = start;
    this.stop = stop;
    this.step = step;
    this.hasSecondColon = hasSecondColon;
    this.endOffset = endOffset;
  }

  @Nullable
  public Expression getStart() {
    return start;
  }

  @Nullable
  public Expression getStop() {
    return stop;
  }

  @Nullable
  public Expression getStep() {
    return step;
  }

  /** Reports whether the source spelled a second colon, as in {@code x[::]}. */
  public boolean hasSecondColon() {
    return hasSecondColon;
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
}
