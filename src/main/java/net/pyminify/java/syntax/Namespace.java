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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A Namespace is one lexical scope of a Python file: the module, a function (including lambdas and
 * comprehensions), a class body, or the annotation scope that holds the type parameters of a
 * generic function or class.
 *
 * <p>Namespaces form a tree rooted at the module namespace, created by the {@link
 * NamespaceBuilder}. Each namespace owns the {@link NameBinding}s of the names bound in it, in the
 * order in which they were discovered.
 */
public final class Namespace {

  /** Kind discriminates the four kinds of lexical scope. */
  public enum Kind {
    MODULE,
    FUNCTION,
    ANNOTATION,
    CLASS;
  }

  private final Kind kind;
  private final Node node;
  @Nullable private final Namespace parent;
  private final List<Namespace> children = new ArrayList<>();

  private final Set<String> globalNames = new LinkedHashSet<>();
  private final Set<String> nonlocalNames = new LinkedHashSet<>();

  private final List<NameBinding> bindings = new ArrayList<>();
  // Local and Builtin bindings by name; hoisted literals are only in the list.
  private final Map<String, NameBinding> bindingsByName = new LinkedHashMap<>();

  private boolean tainted;

  Namespace(Kind kind, Node node, @Nullable Namespace parent) {
    Preconditions.checkArgument((kind == Kind.MODULE) == (parent == null));
    this.kind = kind;
    this.node = node;
    this.parent = parent;
    if (parent != null) {
      parent.children.add(this);
    }
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the syntax node that introduces this namespace: the {@link PythonFile}, a {@link
   * DefStatement}, {@link ClassStatement}, {@link LambdaExpression} or {@link Comprehension}.
   */
  public Node getNode() {
    return node;
  }

  /** Returns the enclosing namespace, or null for the module namespace. */
  @Nullable
  public Namespace getParent() {
    return parent;
  }

  /** Returns the nested namespaces, in lexical order. */
  public List<Namespace> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /** Returns the names declared {@code global} in this namespace, in order of declaration. */
  public Set<String> getGlobalNames() {
    return Collections.unmodifiableSet(globalNames);
  }

  /**
   * Returns the names that are not bound in this namespace even though they may be assigned in it:
   * those declared {@code nonlocal}, and, for a class body, those looked up directly in the body.
   */
  public Set<String> getNonlocalNames() {
    return Collections.unmodifiableSet(nonlocalNames);
  }

  void addGlobalName(String name) {
    globalNames.add(name);
  }

  void addNonlocalName(String name) {
    nonlocalNames.add(name);
  }

  /** Returns the bindings owned by this namespace, in discovery order. */
  public List<NameBinding> getBindings() {
    return Collections.unmodifiableList(bindings);
  }

  /** Returns the Local or Builtin binding of the given name in this namespace, or null. */
  @Nullable
  public NameBinding getBinding(String name) {
    return bindingsByName.get(name);
  }

  /** Returns the Local binding of the name, creating it if necessary. */
  NameBinding bindLocal(String name) {
    NameBinding binding = bindingsByName.get(name);
    if (binding == null) {
      binding = new NameBinding(name, NameBinding.Kind.LOCAL, this);
      addBinding(binding);
    }
    return binding;
  }

  /** Returns the Builtin binding of the name, creating it if necessary. Module namespace only. */
  NameBinding bindBuiltin(String name) {
    Preconditions.checkState(kind == Kind.MODULE, "builtins are bound in the module namespace");
    NameBinding binding = bindingsByName.get(name);
    if (binding == null) {
      binding = new NameBinding(name, NameBinding.Kind.BUILTIN, this);
      addBinding(binding);
    }
    return binding;
  }

  /**
   * Creates a binding for a literal value hoisted into a variable of this namespace. The caller
   * attaches the binding's references with {@link NameBinding#addReference}.
   */
  public NameBinding addHoistedLiteral(String name) {
    Preconditions.checkArgument(Identifier.isValid(name), "invalid name '%s'", name);
    NameBinding binding = new NameBinding(name, NameBinding.Kind.HOISTED_LITERAL, this);
    bindings.add(binding);
    return binding;
  }

  private void addBinding(NameBinding binding) {
    bindings.add(binding);
    bindingsByName.put(binding.getOriginalName(), binding);
  }

  /**
   * Reports whether the namespace contains untraceable uses of names, such as a call to {@code
   * eval}, in which case none of its bindings may be renamed.
   */
  public boolean isTainted() {
    return tainted;
  }

  void taint() {
    tainted = true;
  }

  /** Returns the module namespace at the root of the tree. */
  public Namespace getModule() {
    Namespace ns = this;
    while (ns.parent != null) {
      ns = ns.parent;
    }
    return ns;
  }

  /**
   * Returns the namespace in which a name not bound here is looked up: the parent, skipping class
   * bodies, whose names are invisible to nested scopes. Returns null for the module namespace.
   */
  @Nullable
  Namespace getEnclosingScope() {
    Namespace ns = parent;
    while (ns != null && ns.kind == Kind.CLASS) {
      ns = ns.parent;
    }
    return ns;
  }

  /** Reports whether this is the namespace of a list, set, dict or generator comprehension. */
  public boolean isComprehension() {
    return node instanceof Comprehension;
  }

  /** Returns this namespace and all of its descendants, in pre-order. */
  public ImmutableList<Namespace> preOrder() {
    ImmutableList.Builder<Namespace> result = ImmutableList.builder();
    collectPreOrder(this, result);
    return result.build();
  }

  private static void collectPreOrder(Namespace ns, ImmutableList.Builder<Namespace> result) {
    result.add(ns);
    for (Namespace child : ns.children) {
      collectPreOrder(child, result);
    }
  }

  /** Returns a short description of the namespace, such as {@code Function f}. */
  public String getDescription() {
    switch (kind) {
      case MODULE:
        return "Module";
      case CLASS:
        return "Class " + ((ClassStatement) node).getIdentifier().getName();
      case ANNOTATION:
        return "Annotation " + nameOf(node);
      case FUNCTION:
        if (node instanceof DefStatement def) {
          return "Function " + def.getIdentifier().getName();
        } else if (node instanceof LambdaExpression) {
          return "Lambda";
        }
        switch (((Comprehension) node).getComprehensionKind()) {
          case LIST:
            return "ListComprehension";
          case SET:
            return "SetComprehension";
          case DICT:
            return "DictComprehension";
          case GENERATOR:
            return "Generator";
        }
        throw new IllegalStateException(node.toString());
    }
    throw new IllegalStateException(kind.toString());
  }

  private static String nameOf(Node node) {
    return node instanceof DefStatement def
        ? def.getIdentifier().getName()
        : ((ClassStatement) node).getIdentifier().getName();
  }

  /**
   * Returns a multi-line dump of this namespace and its descendants, listing the declared names and
   * the bindings of each, for use in tests and diagnostics. Declared names are sorted; bindings
   * appear in discovery order.
   */
  public String dump() {
    StringBuilder buf = new StringBuilder();
    dump(buf, "");
    return buf.toString();
  }

  private void dump(StringBuilder buf, String indent) {
    buf.append(indent).append("+ ").append(getDescription()).append('\n');
    if (tainted) {
      buf.append(indent).append("  - tainted\n");
    }
    for (String name : ImmutableList.sortedCopyOf(globalNames)) {
      buf.append(indent).append("  - global ").append(name).append('\n');
    }
    for (String name : ImmutableList.sortedCopyOf(nonlocalNames)) {
      buf.append(indent).append("  - nonlocal ").append(name).append('\n');
    }
    for (NameBinding binding : bindings) {
      buf.append(indent).append("  - ").append(binding).append('\n');
    }
    for (Namespace child : children) {
      child.dump(buf, indent + "  ");
    }
  }

  @Override
  public String toString() {
    return getDescription();
  }
}
