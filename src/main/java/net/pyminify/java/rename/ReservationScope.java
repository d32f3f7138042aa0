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

package net.pyminify.java.rename;

import com.google.common.collect.ImmutableSet;
import net.pyminify.java.syntax.Identifier;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.NamedExpression;
import net.pyminify.java.syntax.Namespace;

/**
 * The set of namespaces in which the name of a binding must be unique: its own namespace, the
 * namespace of each of its references, and every namespace between a reference and the binding.
 * A name given to the binding shadows that name in all of these.
 *
 * <p>The target of an assignment expression within a comprehension binds in the enclosing scope,
 * but may not share its name with an iteration variable of the comprehensions it appears in, so
 * those comprehensions are part of the scope too.
 */
final class ReservationScope {

  private ReservationScope() {}

  /** Returns the reservation scope of the binding, in discovery order. */
  static ImmutableSet<Namespace> of(NameBinding binding) {
    Namespace home = binding.getNamespace();
    ImmutableSet.Builder<Namespace> scope = ImmutableSet.builder();
    scope.add(home);
    for (Identifier ref : binding.getReferences()) {
      for (Namespace ns = textualNamespaceOf(ref);
          ns != null && ns != home;
          ns = ns.getParent()) {
        scope.add(ns);
      }
    }
    return scope.build();
  }

  // Returns the namespace in which the reference is written.
  private static Namespace textualNamespaceOf(Identifier ref) {
    if (ref.getParent() instanceof NamedExpression named && named.getTarget() == ref) {
      return named.getNamespace();
    }
    return ref.getNamespace();
  }
}
