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

/**
 * Syntax node for {@code import a.b as c, d}.
 *
 * <p>Each imported module is an {@link Alias}. The local name of {@code import a.b} is {@code a},
 * the root of the dotted path.
 */
public final class ImportStatement extends Statement {

  /**
   * One imported name of an import statement. The imported name is a (possibly dotted) module path
   * or, within {@code from ... import}, an attribute name; it is not a symbol of this file and is
   * never renamed. The local identifier is the name the import binds.
   */
  public static final class Alias extends Node {
    private final int startOffset;
    private final String importedName;
    private final Identifier local;
    private final boolean explicit;

    Alias(
        FileLocations locs,
        int startOffset,
        String importedName,
        Identifier local,
        boolean explicit) {
      super(locs);
      this.startOffset = startOffset;
      this.importedName = importedName;
      this.local = local;
      this.explicit = explicit;
    }

    /** Returns the imported module path or attribute name, as written. */
    public String getImportedName() {
      return importedName;
    }

    /** Returns the identifier bound in the importing namespace. */
    public Identifier getLocal() {
      return local;
    }

    /** Reports whether the import has an explicit {@code as} clause. */
    public boolean hasExplicitAlias() {
      return explicit;
    }

    /** Reports whether the imported module path is dotted, e.g. {@code import os.path}. */
    public boolean isDotted() {
      return importedName.indexOf('.') >= 0;
    }

    @Override
    public int getStartOffset() {
      return startOffset;
    }

    @Override
    public int getEndOffset() {
      return explicit ? local.getEndOffset() : startOffset + importedName.length();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int importOffset;
  private final ImmutableList<Alias> aliases; // non-empty if well formed

  ImportStatement(FileLocations locs, int importOffset, ImmutableList<Alias> aliases) {
    super(locs, Kind.IMPORT);
    this.importOffset = importOffset;
    this.aliases = aliases;
  }

  public ImmutableList<Alias> getAliases() {
    return aliases;
  }

  @Override
  public int getStartOffset() {
    return importOffset;
  }

  @Override
  public int getEndOffset() {
    return aliases.isEmpty()
        ? importOffset + "import".length()
        : aliases.get(aliases.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
