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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * TreeAnnotator links every node of a syntax tree to its syntactic parent, so that later stages can
 * walk upward from any node. The root has a null parent.
 */
public final class TreeAnnotator extends NodeVisitor {

  private final Deque<Node> ancestors = new ArrayDeque<>();

  private TreeAnnotator() {}

  /** Sets the parent of every node in the file, overwriting any earlier annotation. */
  public static void annotate(PythonFile file) {
    TreeAnnotator annotator = new TreeAnnotator();
    annotator.visit((Node) file);
  }

  @Override
  public void visit(Node node) {
    node.setParent(ancestors.peek());
    ancestors.push(node);
    node.accept(this);
    ancestors.pop();
  }

  /**
   * Returns the parent of a node that is not the root of its tree.
   *
   * @throws StructuralException if the node has no parent
   */
  static Node parentOf(Node node) {
    Node parent = node.getParent();
    if (parent == null) {
      throw new StructuralException(node, "node has no parent");
    }
    return parent;
  }

  /**
   * Returns the namespace of a node.
   *
   * @throws StructuralException if the node was not assigned a namespace
   */
  static Namespace namespaceOf(Node node) {
    Namespace ns = node.getNamespace();
    if (ns == null) {
      throw new StructuralException(node, "node has no namespace");
    }
    return ns;
  }
}
