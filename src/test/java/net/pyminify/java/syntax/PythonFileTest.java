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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link PythonFile#insertAlias}. */
@RunWith(JUnit4.class)
public final class PythonFileTest {

  private static PythonFile analyzed(String... lines) {
    PythonFile file = PythonFile.parse(ParserInput.fromLines(lines));
    ScopeAnalyzer.analyze(file);
    return file;
  }

  @Test
  public void testAliasIsInsertedAfterDocstringAndFutureImports() throws Exception {
    PythonFile file =
        analyzed(
            "'Module docstring.'",
            "from __future__ import annotations",
            "from __future__ import division",
            "import os");
    AssignmentStatement alias = file.insertAlias("L", "len");
    assertThat(file.getStatements().indexOf(alias)).isEqualTo(3);
    assertThat(NodePrinter.print(file))
        .isEqualTo(
            "'Module docstring.'\n"
                + "from __future__ import annotations\n"
                + "from __future__ import division\n"
                + "L=len\n"
                + "import os\n");
  }

  @Test
  public void testAliasLeadsFileWithoutPreamble() throws Exception {
    PythonFile file = analyzed("x = 1", "'not a docstring'");
    file.insertAlias("P", "print");
    assertThat(NodePrinter.print(file)).isEqualTo("P=print\nx=1\n'not a docstring'\n");

    PythonFile empty = analyzed();
    empty.insertAlias("P", "print");
    assertThat(empty.getStatements()).hasSize(1);
  }

  @Test
  public void testAliasNodesBelongToModule() throws Exception {
    PythonFile file = analyzed("x = 1");
    AssignmentStatement alias = file.insertAlias("P", "print");
    Identifier target = (Identifier) alias.getTargets().get(0);
    Identifier value = (Identifier) alias.getRHS();

    assertThat(alias.getParent()).isSameInstanceAs(file);
    assertThat(target.getParent()).isSameInstanceAs(alias);
    assertThat(value.getParent()).isSameInstanceAs(alias);
    assertThat(target.getNamespace()).isSameInstanceAs(file.getNamespace());
    assertThat(value.getNamespace()).isSameInstanceAs(file.getNamespace());
    assertThat(target.getContext()).isEqualTo(Identifier.Context.STORE);
    assertThat(value.getContext()).isEqualTo(Identifier.Context.LOAD);
    assertThat(target.getBinding()).isNull();
  }

  @Test
  public void testAliasRequiresNamespaces() throws Exception {
    PythonFile file = PythonFile.parse(ParserInput.fromLines("x = 1"));
    assertThrows(IllegalStateException.class, () -> file.insertAlias("P", "print"));
    assertThrows(IllegalArgumentException.class, () -> file.insertAlias("not valid", "print"));
  }
}
