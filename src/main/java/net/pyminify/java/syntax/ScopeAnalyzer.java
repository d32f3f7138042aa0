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

import com.google.common.flogger.GoogleLogger;

/**
 * ScopeAnalyzer runs the scope analysis of a file: parent annotation, namespace construction,
 * binding and resolution. Afterwards every symbol {@link Identifier} of the file refers to a
 * {@link NameBinding}.
 *
 * <p>Analysis may be repeated on an unmodified tree; each run overwrites the node state of the
 * previous one and yields an identical namespace tree.
 */
public final class ScopeAnalyzer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private ScopeAnalyzer() {}

  /**
   * Analyzes the file with its own options, and returns its module namespace.
   *
   * @throws StructuralException if the tree is malformed
   */
  public static Namespace analyze(PythonFile file, Builtins builtins) {
    TreeAnnotator.annotate(file);
    Namespace module = NamespaceBuilder.build(file, file.getOptions());
    Binder.bind(file, module);
    Resolver.resolve(file, module, builtins);
    logger.atFine().log(
        "%s: %d namespaces, tainted=%s",
        file.getFile(), module.preOrder().size(), module.isTainted());
    return module;
  }

  /** Analyzes the file with the Python 3 builtins. */
  public static Namespace analyze(PythonFile file) {
    return analyze(file, Builtins.python3());
  }
}
