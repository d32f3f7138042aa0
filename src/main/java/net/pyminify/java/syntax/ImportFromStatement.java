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

/** Syntax node for {@code from ..module import a as b, c} and {@code from module import *}. */
public final class ImportFromStatement extends Statement {

  private final int fromOffset;
  private final int level; // number of leading dots
  @Nullable private final String module; // null for 'from . import x'
  private final ImmutableList<ImportStatement.Alias> aliases; // empty for a star import
  private final boolean isStar;
  private final int endOffset;

  ImportFromStatement(
      FileLocations locs,
      int fromOffset,
      int level,
      @Nullable String module,
      ImmutableList<ImportStatement.Alias> aliases,
      boolean isStar,
      int endOffset) {
    super(locs, Kind.IMPORT_FROM);
    this.fromOffset = fromOffset;
    this.level = level;
    this.module = module;
    this.aliases = aliases;
    this.isStar = isStar;
    this.endOffset = endOffset;
  }

  /** Returns the number of leading dots of a relative import; zero for an absolute import. */
  public int getLevel() {
    return level;
  }

  /** Returns the dotted module name, or null if the import names only a package level. */
  @Nullable
  public String getModule() {
    return module;
  }

  public ImmutableList<ImportStatement.Alias> getAliases() {
    return aliases;
  }

  /** Reports whether this is {@code from m import *}. */
  public boolean isStar() {
    return isStar;
  }

  @Override
  public int getStartOffset() {
    return fromOffset;
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
