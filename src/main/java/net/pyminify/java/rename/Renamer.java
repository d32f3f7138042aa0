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

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.ScopeAnalyzer;

/**
 * Renamer shortens the identifiers of a parsed Python file in place, without changing what the
 * program does. After renaming, the file may be printed with its new names.
 *
 * <p>A Renamer holds no state between files.
 */
public final class Renamer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final RenameOptions options;

  public Renamer(RenameOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public Renamer() {
    this(RenameOptions.DEFAULT);
  }

  /** Renames the identifiers of the file. */
  public RenameReport rename(PythonFile file) {
    return rename(file, LiteralHoister.NONE);
  }

  /**
   * Renames the identifiers of the file, giving the hoister the chance to add bindings first.
   * Builtin aliases, if enabled, are added after the hoister's bindings.
   *
   * @throws IllegalArgumentException if the file has syntax errors, or was not parsed with the
   *     file options of this renamer
   * @throws net.pyminify.java.syntax.StructuralException if the tree is malformed
   */
  public RenameReport rename(PythonFile file, LiteralHoister hoister) {
    Preconditions.checkArgument(
        file.ok(),
        "%s: cannot rename a file with %s syntax errors",
        file.getFile(),
        file.errors().size());
    Preconditions.checkArgument(
        file.getOptions().equals(options.fileOptions()),
        "%s: file was parsed with %s, but renaming uses %s",
        file.getFile(),
        file.getOptions(),
        options.fileOptions());
    Namespace module = ScopeAnalyzer.analyze(file, options.builtins());
    hoister.hoist(file, module);
    if (options.aliasBuiltins()) {
      new BuiltinAliaser().hoist(file, module);
    }
    RenamePolicy.apply(module, options);
    if (module.isTainted()) {
      logger.atInfo().log(
          "%s: names may be accessed reflectively; module names are kept", file.getFile());
    }
    RenameReport report = NameAssigner.assign(module);
    logger.atFine().log(
        "%s: renamed %d of %d bindings, saving %d bytes",
        file.getFile(), report.bindingsRenamed(), report.bindingsConsidered(), report.bytesSaved());
    return report;
  }
}
