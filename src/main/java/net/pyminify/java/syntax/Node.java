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
import javax.annotation.Nullable;

/**
 * A Node is a node in a Python syntax tree.
 *
 * <p>Besides its syntactic content, every node carries two fields that are filled in by scope
 * analysis: its {@link #getParent parent}, set by the {@link TreeAnnotator}, and the {@link
 * #getNamespace namespace} that governs the names it binds or uses, set by the {@link
 * NamespaceBuilder}. Both are overwritten whenever the analysis is re-run.
 */
public abstract class Node {

  // Maps offsets to Locations. Shared by all nodes of a file.
  final FileLocations locs;

  @Nullable private Node parent;

  @Nullable private Namespace namespace;

  Node(FileLocations locs) {
    this.locs = Preconditions.checkNotNull(locs);
  }

  /**
   * Returns the node's start offset, as a char index (zero-based count of UTF-16 codes) from the
   * start of the file.
   */
  public abstract int getStartOffset();

  /** Returns the char offset of the source position immediately after this node. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this syntax node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this syntax node. */
  public final Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /** Returns the name of the file containing this node. */
  public final String getFile() {
    return locs.file();
  }

  /**
   * Returns the syntactically enclosing node, or null for the root of the tree or a node that has
   * not been annotated.
   */
  @Nullable
  public final Node getParent() {
    return parent;
  }

  final void setParent(@Nullable Node parent) {
    this.parent = parent;
  }

  /** Returns the namespace governing this node, or null before namespace construction. */
  @Nullable
  public final Namespace getNamespace() {
    return namespace;
  }

  final void setNamespace(Namespace namespace) {
    this.namespace = namespace;
  }

  /**
   * Returns a compact source-like rendering of the node, as produced by {@link NodePrinter}. The
   * result is not necessarily a complete program.
   */
  @Override
  public String toString() {
    return NodePrinter.print(this);
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);
}
