// Copyright 2014 The Bazel Authors. All rights reserved.
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

import java.util.HashSet;
import java.util.Set;

/**
 * Resolver attaches each remaining name occurrence of a file to the {@link NameBinding} it denotes:
 * every name use, every name of a {@code global} or {@code nonlocal} statement, and every binding
 * occurrence the {@link Binder} deferred because its name is bound in an outer namespace.
 *
 * <p>A name is looked up starting in the occurrence's own namespace:
 *
 * <ol>
 *   <li>A name declared {@code global} is looked up in the module namespace.
 *   <li>A name declared {@code nonlocal} (or looked up directly in a class body) is looked up
 *       starting in the enclosing namespace.
 *   <li>Otherwise the bindings of the namespace are searched, and then those of the enclosing
 *       namespaces, skipping class bodies, whose names are invisible to nested scopes.
 *   <li>A name not bound in the module namespace is bound there, to a builtin if it is one, and
 *       otherwise as an implicit global.
 * </ol>
 *
 * <p>A class-body assignment to a name the class body also reads is a reference to the outer
 * binding, and is renamed along with it. When there is no outer binding, the assignment creates an
 * attribute of the class, and the implicit global it resolves to keeps its name.
 *
 * <p>The resolver also revokes renameability where the spelling of a name is observable: a name
 * used in a self-documenting f-string field ({@code f"{x=}"}), and every binding of a namespace
 * whose names may be accessed by reflection, through {@code eval}, {@code locals} and the like, or
 * bound by {@code from m import *}.
 */
public final class Resolver extends NodeVisitor {

  private final Namespace module;
  private final Builtins builtins;

  // Module bindings created by lookup because nothing in the file binds the name.
  private final Set<NameBinding> implicitGlobals = new HashSet<>();

  private Resolver(Namespace module, Builtins builtins) {
    this.module = module;
    this.builtins = builtins;
    this.skipNonSymbolIdentifiers = true;
  }

  /**
   * Resolves the names of a file after the {@link Binder} has run.
   *
   * @throws StructuralException if a node lacks its parent or namespace
   */
  public static void resolve(PythonFile file, Namespace module, Builtins builtins) {
    if (file.getNamespace() != module) {
      throw new StructuralException(file, "file does not belong to the module namespace");
    }
    new Resolver(module, builtins).visit((Node) file);
    for (Namespace ns : module.preOrder()) {
      if (ns.isTainted()) {
        for (NameBinding binding : ns.getBindings()) {
          binding.disallowRename();
        }
      }
    }
  }

  @Override
  public void visit(Identifier id) {
    // Identifiers of declarations are handled below.
    if (id.getParent() instanceof DeclarationStatement) {
      return;
    }
    switch (id.getContext()) {
      case LOAD:
        NameBinding binding = use(id);
        if (binding.getKind() == NameBinding.Kind.BUILTIN && Builtins.isReflective(id.getName())) {
          for (Namespace ns = TreeAnnotator.namespaceOf(id); ns != null; ns = ns.getParent()) {
            ns.taint();
          }
        }
        break;
      case STORE:
      case DEL:
        if (Binder.isDeferred(id)) {
          NameBinding outer = use(id);
          if (Binder.forbidsRename(id) || bindsClassAttribute(id, outer)) {
            outer.disallowRename();
          }
        }
        break;
    }
  }

  @Override
  public void visit(DeclarationStatement node) {
    for (Identifier id : node.getNames()) {
      use(id);
    }
  }

  @Override
  public void visit(ImportFromStatement node) {
    if (node.isStar()) {
      TreeAnnotator.namespaceOf(node).taint();
    }
    super.visit(node);
  }

  // Finds the binding of an occurrence and records the occurrence as a reference to it.
  private NameBinding use(Identifier id) {
    NameBinding binding = lookup(id.getName(), TreeAnnotator.namespaceOf(id));
    binding.addReference(id);
    if (binding.getNamespace() == module && module.getNonlocalNames().contains(id.getName())) {
      binding.disallowRename();
    }
    if (inSelfDocumentingField(id)) {
      binding.disallowRename();
    }
    return binding;
  }

  private NameBinding lookup(String name, Namespace ns) {
    while (true) {
      if (ns.getKind() != Namespace.Kind.MODULE) {
        if (ns.getGlobalNames().contains(name)) {
          ns = module;
          continue;
        }
        if (ns.getNonlocalNames().contains(name)) {
          ns = ns.getEnclosingScope();
          continue;
        }
      }
      NameBinding binding = ns.getBinding(name);
      if (binding != null) {
        return binding;
      }
      if (ns.getKind() == Namespace.Kind.MODULE) {
        if (builtins.contains(name)) {
          return ns.bindBuiltin(name);
        }
        NameBinding global = ns.bindLocal(name);
        implicitGlobals.add(global);
        return global;
      }
      ns = ns.getEnclosingScope();
    }
  }

  // Reports whether a deferred binding occurrence in a class body resolved to an implicit global.
  // Unless the class declares the name global, the occurrence binds an attribute of the class.
  private boolean bindsClassAttribute(Identifier id, NameBinding binding) {
    Namespace ns = TreeAnnotator.namespaceOf(id);
    return ns.getKind() == Namespace.Kind.CLASS
        && !ns.getGlobalNames().contains(id.getName())
        && implicitGlobals.contains(binding);
  }

  // Reports whether the identifier lies within a self-documenting field of an f-string, whose
  // text is printed verbatim.
  private static boolean inSelfDocumentingField(Identifier id) {
    for (Node node = TreeAnnotator.parentOf(id);
        !(node instanceof Statement || node instanceof PythonFile);
        node = TreeAnnotator.parentOf(node)) {
      if (node instanceof FormattedString.Field field && field.isSelfDocumenting()) {
        return true;
      }
    }
    return false;
  }
}
