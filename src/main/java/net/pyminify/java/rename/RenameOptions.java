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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import net.pyminify.java.syntax.Builtins;
import net.pyminify.java.syntax.FileOptions;
import net.pyminify.java.syntax.Identifier;

/**
 * RenameOptions controls which bindings the {@link Renamer} may rename.
 *
 * <p>The {@link #DEFAULT} options rename local names but keep the module's global names, which
 * other modules may import.
 */
@AutoValue
public abstract class RenameOptions {

  /** The default options. */
  public static final RenameOptions DEFAULT = builder().build();

  /** Rename names bound in functions, lambdas, comprehensions and annotation scopes. */
  public abstract boolean renameLocals();

  /** Rename names bound in the module namespace. */
  public abstract boolean renameGlobals();

  /**
   * Give builtins that the module uses often a short module-level alias, such as {@code A=sorted}.
   */
  public abstract boolean aliasBuiltins();

  /**
   * Names that keep their spelling wherever they are bound. Module names listed in a module-level
   * {@code __all__} are kept in addition.
   */
  public abstract ImmutableSet<String> preserveNames();

  /** The names available to the program without being bound. */
  public abstract Builtins builtins();

  /** Options for parsing and analyzing the file. */
  public abstract FileOptions fileOptions();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_RenameOptions.Builder()
        .renameLocals(true)
        .renameGlobals(false)
        .aliasBuiltins(false)
        .preserveNames(ImmutableSet.of())
        .builtins(Builtins.python3())
        .fileOptions(FileOptions.DEFAULT);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link RenameOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder renameLocals(boolean value);

    public abstract Builder renameGlobals(boolean value);

    public abstract Builder aliasBuiltins(boolean value);

    public abstract Builder preserveNames(Iterable<String> names);

    public abstract Builder builtins(Builtins builtins);

    public abstract Builder fileOptions(FileOptions options);

    abstract RenameOptions autoBuild();

    public RenameOptions build() {
      RenameOptions options = autoBuild();
      for (String name : options.preserveNames()) {
        Preconditions.checkArgument(
            Identifier.isValid(name), "preserved name '%s' is not an identifier", name);
      }
      return options;
    }
  }
}
