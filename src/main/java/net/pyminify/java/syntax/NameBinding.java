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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A NameBinding is the identity a name denotes within a namespace, shared by every occurrence of
 * the name (binding or use) that refers to it.
 *
 * <p>A binding starts out with its original spelling and may be renamed exactly once, which
 * rewrites every reference. Whether a binding may be renamed is decided as it is discovered, and
 * may later be revoked but never granted.
 */
public final class NameBinding {

  /** Kind discriminates the origin of a binding. */
  public enum Kind {
    /** A name bound by the program, or an implicit global. */
    LOCAL,
    /** A name that resolved to no binding but is a builtin. Always in the module namespace. */
    BUILTIN,
    /** A variable introduced by literal hoisting. */
    HOISTED_LITERAL;
  }

  private final String originalName;
  private String name;
  private final Kind kind;
  private final Namespace namespace;
  private boolean renameable;
  private boolean renamed;
  private final List<Identifier> references = new ArrayList<>();

  NameBinding(String name, Kind kind, Namespace namespace) {
    this.originalName = name;
    this.name = name;
    this.kind = kind;
    this.namespace = namespace;
    this.renameable = kind != Kind.BUILTIN;
  }

  /** Returns the spelling of the name in the source, or given by the hoister. */
  public String getOriginalName() {
    return originalName;
  }

  /** Returns the current name, which differs from the original name once renamed. */
  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  /** Returns the namespace that owns this binding. */
  public Namespace getNamespace() {
    return namespace;
  }

  public boolean isRenameable() {
    return renameable;
  }

  /** Forbids renaming of this binding. There is no way to undo this. */
  public void disallowRename() {
    renameable = false;
  }

  /** Returns every identifier that binds or uses this binding, in discovery order. */
  public List<Identifier> getReferences() {
    return Collections.unmodifiableList(references);
  }

  /** Attaches an identifier to this binding. */
  public void addReference(Identifier id) {
    Preconditions.checkNotNull(id);
    references.add(id);
    id.setBinding(this);
  }

  /**
   * Makes every reference of this binding a reference of the other binding instead, leaving this
   * binding with none. Used to redirect the uses of a name to a binding introduced in its place.
   */
  public void moveReferencesTo(NameBinding other) {
    Preconditions.checkArgument(other != this, "cannot move references of '%s' to itself", name);
    Preconditions.checkState(!renamed, "binding '%s' was already renamed", originalName);
    for (Identifier id : references) {
      other.addReference(id);
    }
    references.clear();
  }

  /** Reports whether {@link #rename} has been called. */
  public boolean isRenamed() {
    return renamed;
  }

  /**
   * Gives the binding a new name and rewrites every reference to it.
   *
   * @throws IllegalStateException if the binding is not renameable or was already renamed
   */
  public void rename(String newName) {
    Preconditions.checkState(renameable, "binding '%s' may not be renamed", originalName);
    Preconditions.checkState(!renamed, "binding '%s' was already renamed", originalName);
    Preconditions.checkArgument(Identifier.isValid(newName), "invalid name '%s'", newName);
    this.name = newName;
    this.renamed = true;
    for (Identifier id : references) {
      id.setName(newName);
    }
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    switch (kind) {
      case LOCAL:
        buf.append("Local");
        break;
      case BUILTIN:
        buf.append("Builtin");
        break;
      case HOISTED_LITERAL:
        buf.append("HoistedLiteral");
        break;
    }
    buf.append("(name='").append(originalName).append('\'');
    if (renamed) {
      buf.append(", renamed='").append(name).append('\'');
    }
    if (kind != Kind.BUILTIN) {
      buf.append(", renameable=").append(renameable);
    }
    buf.append(") <references=").append(references.size()).append('>');
    return buf.toString();
  }
}
