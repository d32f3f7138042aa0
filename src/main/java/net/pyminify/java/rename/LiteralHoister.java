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

import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.PythonFile;

/**
 * A pass that moves repeated literals into variables, run by the {@link Renamer} after scope
 * analysis and before names are assigned. It adds its variables with {@link
 * Namespace#addHoistedLiteral}, so that they are named together with the program's own bindings.
 */
@FunctionalInterface
public interface LiteralHoister {

  /** A hoister that does nothing. */
  LiteralHoister NONE = (file, module) -> {};

  void hoist(PythonFile file, Namespace module);
}
