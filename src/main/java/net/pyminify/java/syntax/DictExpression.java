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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for dict expression. */
public final class DictExpression extends Expression {

  /**
   * A key/value pair in a dict expression or comprehension. An entry with a null key is a
   * dictionary unpacking, {@code **value}.
   */
  public static final class Entry extends Node {

    private final int startOffset;
    @Nullable private final Expression key;
    private final Expression value;

    Entry(FileLocations locs, int startOffset, @Nullable Expression key, Expression value) {
      super(locs);
      this.startOffset = startOffset;
      this.key = key;
      this.value = value;
    }

    /** Returns the key, or null for a {@code **value} unpacking. */
    @Nullable
    public Expression getKey() {
      return key;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public int getStartOffset() {
      return startOffset;
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

  private final int lbraceOffset;
  private final ImmutableList<Entry> entries;
  private final int rbraceOffset;

  DictExpression(
      FileLocations locs, int lbraceOffset, ImmutableList<Entry> entries, int rbraceOffset) {
    super(locs, Kind.DICT_EXPR);
    this.lbraceOffset = lbraceOffset;
    this.entries = entries;
    this.rbraceOffset = rbraceOffset;
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
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
