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
import com.google.common.flogger.GoogleLogger;
import java.util.HashSet;
import java.util.Set;
import net.pyminify.java.syntax.AssignmentStatement;
import net.pyminify.java.syntax.DeclarationStatement;
import net.pyminify.java.syntax.FormattedString;
import net.pyminify.java.syntax.Identifier;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.Node;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.Statement;

/**
 * BuiltinAliaser gives builtins that a module uses often a module-level alias, as in {@code
 * A=sorted}, and makes their uses refer to the alias. The alias is added as a hoisted literal, so
 * the {@link NameAssigner} names it; the builtin itself keeps its name.
 *
 * <p>A builtin is aliased only if the program binds its name nowhere, every use of it is a plain
 * lookup, and the uses are frequent enough to pay for the assignment. Nothing is aliased in a
 * module whose names may be accessed by reflection.
 */
final class BuiltinAliaser implements LiteralHoister {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // The assumed length of an alias name.
  private static final int ALIAS_LENGTH = 2;

  @Override
  public void hoist(PythonFile file, Namespace module) {
    if (module.isTainted()) {
      return;
    }
    Set<String> bound = new HashSet<>();
    for (Namespace ns : module.preOrder()) {
      for (NameBinding binding : ns.getBindings()) {
        if (binding.getKind() != NameBinding.Kind.BUILTIN) {
          bound.add(binding.getOriginalName());
        }
      }
    }
    // Aliases are added to the module's bindings as we go.
    for (NameBinding builtin : ImmutableList.copyOf(module.getBindings())) {
      String name = builtin.getOriginalName();
      if (builtin.getKind() != NameBinding.Kind.BUILTIN
          || bound.contains(name)
          || Identifier.isDunder(name)
          || !isProfitable(name.length(), builtin.getReferences().size())
          || !builtin.getReferences().stream().allMatch(BuiltinAliaser::isPlainUse)) {
        continue;
      }
      int uses = builtin.getReferences().size();
      AssignmentStatement statement = file.insertAlias(name, name);
      NameBinding alias = module.addHoistedLiteral(name);
      alias.addReference((Identifier) statement.getTargets().get(0));
      builtin.moveReferencesTo(alias);
      builtin.addReference((Identifier) statement.getRHS());
      logger.atFine().log("%s: aliased builtin %s with %d uses", file.getFile(), name, uses);
    }
  }

  /**
   * Reports whether aliasing a builtin of the given length with the given number of uses shortens
   * the program, counting the assignment {@code alias=name} and its newline.
   */
  static boolean isProfitable(int length, int uses) {
    long saved = (long) uses * (length - ALIAS_LENGTH);
    long cost = ALIAS_LENGTH + 1 + length + 1;
    return saved > cost;
  }

  // A plain use is a lookup outside of declarations and self-documenting f-string fields, whose
  // text shows the name.
  private static boolean isPlainUse(Identifier id) {
    if (id.getContext() != Identifier.Context.LOAD
        || id.getParent() instanceof DeclarationStatement) {
      return false;
    }
    for (Node node = id.getParent();
        node != null && !(node instanceof Statement);
        node = node.getParent()) {
      if (node instanceof FormattedString.Field field && field.isSelfDocumenting()) {
        return false;
      }
    }
    return true;
  }
}
