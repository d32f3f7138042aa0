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

/**
 * NamespaceBuilder creates the tree of {@link Namespace}s of a file and assigns every node to the
 * namespace that governs the names it binds and uses.
 *
 * <p>A node belongs to the closest enclosing namespace, except for the parts of a definition that
 * are evaluated where the definition appears rather than inside it: parameter defaults,
 * decorators, annotations, class bases and keywords, and the iterable of the first {@code for}
 * clause of a comprehension. When a definition has type parameters, its annotations and bases are
 * evaluated in the annotation scope that holds the type parameters instead.
 *
 * <p>The names of {@code global} and {@code nonlocal} statements are recorded in their namespace.
 * Once all namespaces exist, each class body is scanned for names it looks up directly; those are
 * recorded as nonlocal to the class, since an assignment in the class body cannot be proven to
 * precede the lookup.
 *
 * <p>The tree must have been annotated by the {@link TreeAnnotator}.
 */
public final class NamespaceBuilder extends NodeVisitor {

  private final FileOptions options;
  private Namespace current;

  private NamespaceBuilder(Namespace module, FileOptions options) {
    this.current = module;
    this.options = options;
  }

  /** Builds the namespaces of the file, and returns the module namespace. */
  public static Namespace build(PythonFile file, FileOptions options) {
    Namespace module = new Namespace(Namespace.Kind.MODULE, file, null);
    NamespaceBuilder builder = new NamespaceBuilder(module, options);
    builder.visit((Node) file);
    new ClassBodyScanner().visit((Node) file);
    return module;
  }

  @Override
  public void visit(Node node) {
    node.setNamespace(current);
    node.accept(this);
  }

  // Visits the node, if any, with the given namespace as the current one.
  private void visitIn(Namespace ns, @Nullable Node node) {
    if (node == null) {
      return;
    }
    Namespace saved = current;
    current = ns;
    try {
      visit(node);
    } finally {
      current = saved;
    }
  }

  private void visitAllIn(Namespace ns, ImmutableList<? extends Node> nodes) {
    for (Node node : nodes) {
      visitIn(ns, node);
    }
  }

  @Override
  public void visit(Identifier node) {
    // Clear any binding from an earlier analysis.
    node.setBinding(null);
  }

  @Override
  public void visit(DeclarationStatement node) {
    for (Identifier id : node.getNames()) {
      if (node.isGlobal()) {
        current.addGlobalName(id.getName());
      } else {
        current.addNonlocalName(id.getName());
      }
    }
    super.visit(node);
  }

  @Override
  public void visit(DefStatement node) {
    Namespace enclosing = current;
    visitAllIn(enclosing, node.getDecorators());
    visitIn(enclosing, node.getIdentifier());

    Namespace annotationScope = enclosing;
    if (!node.getTypeParameters().isEmpty()) {
      annotationScope = new Namespace(Namespace.Kind.ANNOTATION, node, enclosing);
      visitAllIn(annotationScope, node.getTypeParameters());
    }

    Namespace function = new Namespace(Namespace.Kind.FUNCTION, node, annotationScope);
    for (Parameter param : node.getParameters()) {
      visitParameter(param, enclosing, annotationScope, function);
    }
    visitIn(annotationScope, node.getReturns());
    visitAllIn(function, node.getBody());
  }

  @Override
  public void visit(LambdaExpression node) {
    Namespace enclosing = current;
    Namespace function = new Namespace(Namespace.Kind.FUNCTION, node, enclosing);
    for (Parameter param : node.getParameters()) {
      visitParameter(param, enclosing, enclosing, function);
    }
    visitIn(function, node.getBody());
  }

  private void visitParameter(
      Parameter param, Namespace enclosing, Namespace annotationScope, Namespace function) {
    param.setNamespace(function);
    visitIn(function, param.getIdentifier());
    visitIn(annotationScope, param.getAnnotation());
    visitIn(enclosing, param.getDefaultValue());
  }

  @Override
  public void visit(ClassStatement node) {
    Namespace enclosing = current;
    visitAllIn(enclosing, node.getDecorators());
    visitIn(enclosing, node.getIdentifier());

    Namespace annotationScope = enclosing;
    if (!node.getTypeParameters().isEmpty()) {
      annotationScope = new Namespace(Namespace.Kind.ANNOTATION, node, enclosing);
      visitAllIn(annotationScope, node.getTypeParameters());
    }
    visitAllIn(annotationScope, node.getArguments());

    Namespace body = new Namespace(Namespace.Kind.CLASS, node, annotationScope);
    visitAllIn(body, node.getBody());
  }

  @Override
  public void visit(Comprehension node) {
    if (node.getComprehensionKind() == Comprehension.ComprehensionKind.LIST
        && !options.listComprehensionHasOwnScope()) {
      super.visit(node);
      return;
    }
    Namespace enclosing = current;
    Namespace comprehension = new Namespace(Namespace.Kind.FUNCTION, node, enclosing);
    visitIn(comprehension, node.getBody());
    boolean first = true;
    for (Comprehension.Clause clause : node.getClauses()) {
      clause.setNamespace(comprehension);
      if (clause instanceof Comprehension.For forClause) {
        visitIn(comprehension, forClause.getVars());
        visitIn(first ? enclosing : comprehension, forClause.getIterable());
        first = false;
      } else {
        visitIn(comprehension, ((Comprehension.If) clause).getCondition());
      }
    }
  }

  @Override
  public void visit(NamedExpression node) {
    // The target of := within a comprehension binds in the scope containing the comprehension.
    Namespace target = current;
    while (target.isComprehension()) {
      target = target.getParent();
    }
    visitIn(target, node.getTarget());
    visit(node.getValue());
  }

  /**
   * Records, for each class body, the names it looks up directly as nonlocal to the class. A
   * direct lookup is a load whose namespace is the class, or the target of an augmented
   * assignment, which reads the name before assigning it.
   */
  private static final class ClassBodyScanner extends NodeVisitor {

    ClassBodyScanner() {
      this.skipNonSymbolIdentifiers = true;
    }

    @Override
    public void visit(Identifier id) {
      Namespace ns = TreeAnnotator.namespaceOf(id);
      if (ns.getKind() != Namespace.Kind.CLASS) {
        return;
      }
      Node parent = TreeAnnotator.parentOf(id);
      if (parent instanceof DeclarationStatement) {
        return;
      }
      if (id.getContext() == Identifier.Context.LOAD || isAugmentedTarget(id, parent)) {
        ns.addNonlocalName(id.getName());
      }
    }

    private static boolean isAugmentedTarget(Identifier id, Node parent) {
      return parent instanceof AssignmentStatement assign
          && assign.isAugmented()
          && assign.getTargets().get(0) == id;
    }
  }
}
