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
import java.util.Set;
import net.pyminify.java.syntax.AssignmentStatement;
import net.pyminify.java.syntax.Expression;
import net.pyminify.java.syntax.Identifier;
import net.pyminify.java.syntax.ListExpression;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.Statement;
import net.pyminify.java.syntax.StringLiteral;

/**
 * RenamePolicy applies the {@link RenameOptions} to a resolved module, revoking renameability of
 * the bindings the options protect. It never makes a binding renameable, and leaves the bindings
 * of hoisted literals alone.
 */
public final class RenamePolicy {

  private RenamePolicy() {}

  /** Applies the options to the bindings of the module and all nested namespaces. */
  public static void apply(Namespace module, RenameOptions options) {
    Set<String> preservedGlobals =
        ImmutableSet.<String>builder()
            .addAll(options.preserveNames())
            .addAll(exportedNames((PythonFile) module.getNode()))
            .build();
    for (Namespace ns : module.preOrder()) {
      boolean isModule = ns == module;
      boolean renameAll = isModule ? options.renameGlobals() : options.renameLocals();
      Set<String> preserved = isModule ? preservedGlobals : options.preserveNames();
      for (NameBinding binding : ns.getBindings()) {
        // Hoisted literals are introduced by the minifier, so no other code can name them.
        if (binding.getKind() == NameBinding.Kind.HOISTED_LITERAL) {
          continue;
        }
        if (!renameAll || preserved.contains(binding.getOriginalName())) {
          binding.disallowRename();
        }
      }
    }
  }

  /**
   * Returns the string elements of the list assigned to {@code __all__} at module level, by plain,
   * augmented or annotated assignment.
   */
  static ImmutableSet<String> exportedNames(PythonFile file) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (Statement stmt : file.getStatements()) {
      if (!(stmt instanceof AssignmentStatement assign) || !assignsAll(assign)) {
        continue;
      }
      if (!(assign.getRHS() instanceof ListExpression list) || list.isTuple()) {
        continue;
      }
      for (Expression elem : list.getElements()) {
        if (elem instanceof StringLiteral str && !str.isBytes()) {
          names.add(str.getValue());
        }
      }
    }
    return names.build();
  }

  private static boolean assignsAll(AssignmentStatement assign) {
    for (Expression target : assign.getTargets()) {
      if (target instanceof Identifier id && id.getName().equals("__all__")) {
        return true;
      }
    }
    return false;
  }
}
