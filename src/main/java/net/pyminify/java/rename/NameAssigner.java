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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.pyminify.java.syntax.Identifier;
import net.pyminify.java.syntax.ImportStatement;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.Namespace;

/**
 * NameAssigner gives short names to the renameable bindings of a resolved module.
 *
 * <p>Bindings are named greedily in order of decreasing estimated savings, ties broken by discovery
 * order. Each receives the first name of the {@link NameGenerator} sequence that no other binding
 * holds in any namespace of its {@link ReservationScope}. Names of bindings that may not be renamed
 * are held from the start. Bindings in unrelated namespaces, such as the locals of two sibling
 * functions, may therefore receive the same name.
 *
 * <p>A binding whose best candidate would not shorten the program keeps its original name when no
 * other binding holds it; otherwise it takes the candidate regardless.
 */
public final class NameAssigner {

  // The bytes added by " as " when an import without one must bind a different name.
  private static final int ALIAS_OVERHEAD = 4;

  // Per namespace, the names given to bindings by this assigner, and all names held there.
  private final Map<Namespace, Set<String>> assigned = new HashMap<>();
  private final Map<Namespace, Set<String>> reserved = new HashMap<>();

  private int renamed;
  private long bytesSaved;

  private NameAssigner() {}

  /** Assigns names to the bindings of the module and all nested namespaces. */
  public static RenameReport assign(Namespace module) {
    return new NameAssigner().run(module);
  }

  private RenameReport run(Namespace module) {
    List<NameBinding> bindings = new ArrayList<>();
    for (Namespace ns : module.preOrder()) {
      bindings.addAll(ns.getBindings());
    }

    for (NameBinding binding : bindings) {
      if (!isCandidate(binding)) {
        for (Namespace ns : ReservationScope.of(binding)) {
          reserved(ns).add(binding.getName());
        }
      }
    }

    for (NameBinding binding : rankedBindings(module)) {
      ImmutableSet<Namespace> scope = ReservationScope.of(binding);
      String candidate = firstFreeName(scope);
      String name = candidate;
      if (estimatedSavings(binding, candidate.length()) <= 0
          && isFree(binding.getOriginalName(), scope)) {
        name = binding.getOriginalName();
      }
      for (Namespace ns : scope) {
        assigned(ns).add(name);
        reserved(ns).add(name);
      }
      if (!name.equals(binding.getOriginalName())) {
        bytesSaved += estimatedSavings(binding, name.length());
        binding.rename(name);
        renamed++;
      }
    }
    return RenameReport.create(bindings.size(), renamed, bytesSaved);
  }

  private static boolean isCandidate(NameBinding binding) {
    return binding.isRenameable() && !binding.isRenamed();
  }

  private String firstFreeName(ImmutableSet<Namespace> scope) {
    NameGenerator names = new NameGenerator();
    while (true) {
      String name = names.next();
      if (isFree(name, scope)) {
        return name;
      }
    }
  }

  private boolean isFree(String name, ImmutableSet<Namespace> scope) {
    for (Namespace ns : scope) {
      if (assigned(ns).contains(name) || reserved(ns).contains(name)) {
        return false;
      }
    }
    return true;
  }

  private Set<String> assigned(Namespace ns) {
    return assigned.computeIfAbsent(ns, k -> new HashSet<>());
  }

  private Set<String> reserved(Namespace ns) {
    return reserved.computeIfAbsent(ns, k -> new HashSet<>());
  }

  /**
   * Returns the number of bytes saved by giving the binding a name of the given length. A
   * reference that is the local name of an import without {@code as} saves nothing and costs the
   * clause {@code " as " + name} instead.
   */
  static long estimatedSavings(NameBinding binding, int newLength) {
    long savings = 0;
    int oldLength = binding.getOriginalName().length();
    for (Identifier ref : binding.getReferences()) {
      if (isUnaliasedImport(ref)) {
        savings -= ALIAS_OVERHEAD + newLength;
      } else {
        savings += oldLength - newLength;
      }
    }
    return savings;
  }

  private static boolean isUnaliasedImport(Identifier ref) {
    return ref.getParent() instanceof ImportStatement.Alias alias && !alias.hasExplicitAlias();
  }

  /** Returns the bindings of the module and its nested namespaces in the order they are named. */
  static ImmutableList<NameBinding> rankedBindings(Namespace module) {
    List<NameBinding> result = new ArrayList<>();
    for (Namespace ns : module.preOrder()) {
      for (NameBinding binding : ns.getBindings()) {
        if (isCandidate(binding)) {
          result.add(binding);
        }
      }
    }
    // List.sort is stable, so ties keep discovery order.
    result.sort(Comparator.comparingLong((NameBinding b) -> estimatedSavings(b, 1)).reversed());
    return ImmutableList.copyOf(result);
  }
}
