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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.ParserInput;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.ScopeAnalyzer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link RenamePolicy}. */
@RunWith(JUnit4.class)
public final class RenamePolicyTest {

  private static PythonFile parse(String... lines) {
    return PythonFile.parse(ParserInput.fromLines(lines));
  }

  @Test
  public void exportedNames() {
    PythonFile file =
        parse(
            "__all__ = ['a', 'b', b'c', 1]",
            "__all__ += ['d']",
            "__all__ = ('e',)",
            "def f():",
            "  __all__ = ['g']");
    assertThat(RenamePolicy.exportedNames(file)).containsExactly("a", "b", "d").inOrder();
  }

  @Test
  public void defaultOptionsKeepModuleNames() {
    Namespace module = ScopeAnalyzer.analyze(parse("x = 1", "def f():", "  y = x"));
    RenamePolicy.apply(module, RenameOptions.DEFAULT);
    assertThat(module.getBinding("x").isRenameable()).isFalse();
    assertThat(module.getBinding("f").isRenameable()).isFalse();
    assertThat(module.getChildren().get(0).getBinding("y").isRenameable()).isTrue();
  }

  @Test
  public void preservedNamesApplyInEveryNamespace() {
    Namespace module = ScopeAnalyzer.analyze(parse("x = 1", "def f():", "  x = 2", "  y = x"));
    RenameOptions options =
        RenameOptions.builder().renameGlobals(true).preserveNames(ImmutableList.of("x")).build();
    RenamePolicy.apply(module, options);
    Namespace f = module.getChildren().get(0);
    assertThat(module.getBinding("x").isRenameable()).isFalse();
    assertThat(module.getBinding("f").isRenameable()).isTrue();
    assertThat(f.getBinding("x").isRenameable()).isFalse();
    assertThat(f.getBinding("y").isRenameable()).isTrue();
  }

  @Test
  public void policyNeverGrantsRenaming() {
    Namespace module = ScopeAnalyzer.analyze(parse("class C:", "  attr = 1"));
    RenameOptions options = RenameOptions.builder().renameGlobals(true).build();
    RenamePolicy.apply(module, options);
    assertThat(module.getChildren().get(0).getBinding("attr").isRenameable()).isFalse();
  }
}
