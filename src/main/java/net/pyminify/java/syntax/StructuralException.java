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

/**
 * An unchecked exception reporting that a syntax tree violates a structural contract of scope
 * analysis: a node lacks its parent or namespace, or a binding-creating node lacks a name. It
 * indicates a defect in whatever produced or modified the tree, not a problem in the Python
 * program, and aborts analysis of the file.
 */
public final class StructuralException extends RuntimeException {

  private final Node node;

  StructuralException(Node node, String message) {
    super(describe(node) + ": " + message);
    this.node = node;
  }

  /** Returns the offending node. */
  public Node getNode() {
    return node;
  }

  private static String describe(Node node) {
    return node.getStartLocation() + ": " + node.getClass().getSimpleName();
  }
}
