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

import java.util.List;

/**
 * Binder creates a {@link NameBinding} for every name bound in a file: the names of {@code def}
 * and {@code class} statements, parameters, assignment, {@code for}, {@code with}, {@code except}
 * and {@code del} targets, imports, pattern captures, type parameters and {@code :=} targets.
 *
 * <p>All occurrences of a name bound in one namespace share a single binding. A name declared
 * {@code global} or {@code nonlocal} in its namespace, or looked up directly in a class body, is
 * bound elsewhere; such occurrences are left to the {@link Resolver}.
 *
 * <p>A binding is marked unrenameable if any of its occurrences exposes its spelling outside the
 * file's own scopes; see {@link #forbidsRename}.
 */
public final class Binder extends NodeVisitor {

  private Binder() {
    this.skipNonSymbolIdentifiers = true;
  }

  /**
   * Binds the names of a file whose namespaces were built by the {@link NamespaceBuilder}.
   *
   * @throws StructuralException if a node lacks its namespace or an identifier its name
   */
  public static void bind(PythonFile file, Namespace module) {
    if (file.getNamespace() != module) {
      throw new StructuralException(file, "file does not belong to the module namespace");
    }
    new Binder().visit((Node) file);
  }

  @Override
  public void visit(Identifier id) {
    if (id.getContext() == Identifier.Context.LOAD) {
      return;
    }
    if (id.getName().isEmpty()) {
      throw new StructuralException(id, "binding identifier has no name");
    }
    if (isDeferred(id)) {
      return;
    }
    Namespace ns = TreeAnnotator.namespaceOf(id);
    NameBinding binding = ns.bindLocal(id.getName());
    binding.addReference(id);
    if (ns.getKind() == Namespace.Kind.MODULE && ns.getNonlocalNames().contains(id.getName())) {
      // Only reachable by malformed input; keep the name as written.
      binding.disallowRename();
    }
    // A name bound in a class body becomes an attribute of the class.
    if (ns.getKind() == Namespace.Kind.CLASS || forbidsRename(id)) {
      binding.disallowRename();
    }
  }

  /**
   * Reports whether a binding occurrence is bound in some other namespace than its own, because
   * the name is declared {@code global} or {@code nonlocal} there.
   */
  static boolean isDeferred(Identifier id) {
    Namespace ns = TreeAnnotator.namespaceOf(id);
    return ns.getKind() != Namespace.Kind.MODULE
        && (ns.getGlobalNames().contains(id.getName())
            || ns.getNonlocalNames().contains(id.getName()));
  }

  /**
   * Reports whether a binding occurrence prevents renaming of the binding it belongs to, wherever
   * that binding lives. That is the case for:
   *
   * <ul>
   *   <li>parameters, which callers may pass by keyword, except for positional-only parameters,
   *       {@code *args} and {@code **kwargs}, and the first parameter of a method that is not
   *       decorated, or decorated only with {@code classmethod};
   *   <li>names bound by a relative import, or by a dotted import without {@code as};
   *   <li>{@code __dunder__} names.
   * </ul>
   */
  static boolean forbidsRename(Identifier id) {
    if (Identifier.isDunder(id.getName())) {
      return true;
    }
    Node parent = TreeAnnotator.parentOf(id);
    if (parent instanceof Parameter param) {
      return !isParameterRenameable(param);
    }
    if (parent instanceof ImportStatement.Alias alias) {
      Node statement = TreeAnnotator.parentOf(alias);
      if (statement instanceof ImportFromStatement from && from.getLevel() > 0) {
        return true;
      }
      return alias.isDotted() && !alias.hasExplicitAlias();
    }
    return false;
  }

  private static boolean isParameterRenameable(Parameter param) {
    if (param instanceof Parameter.Star
        || param instanceof Parameter.StarStar
        || param.isPositionalOnly()) {
      return true;
    }
    Node function = TreeAnnotator.parentOf(param);
    if (!(function instanceof DefStatement def)) {
      return false; // lambda
    }
    // The receiver of a method is never passed by keyword.
    return TreeAnnotator.namespaceOf(def).getKind() == Namespace.Kind.CLASS
        && def.getParameters().get(0) == param
        && isPlainOrClassMethod(def.getDecorators());
  }

  private static boolean isPlainOrClassMethod(List<Expression> decorators) {
    return decorators.isEmpty()
        || (decorators.size() == 1
            && decorators.get(0) instanceof Identifier id
            && id.getName().equals("classmethod"));
  }
}
