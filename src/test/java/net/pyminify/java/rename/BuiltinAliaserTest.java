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

import com.google.common.base.Joiner;
import net.pyminify.java.syntax.Identifier;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.ParserInput;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.ScopeAnalyzer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link BuiltinAliaser}. */
@RunWith(JUnit4.class)
public final class BuiltinAliaserTest {

  private static Namespace aliased(PythonFile file) {
    Namespace module = ScopeAnalyzer.analyze(file);
    new BuiltinAliaser().hoist(file, module);
    return module;
  }

  @Test
  public void usesAreMovedToTheAlias() {
    PythonFile file =
        PythonFile.parse(
            ParserInput.fromLines(
                "sorted(a)", "sorted(b)", "sorted(c)", "def f():", "  return sorted(d)"));
    Namespace module = aliased(file);
    assertThat(module.dump())
        .isEqualTo(
            Joiner.on('\n')
                    .join(
                        "+ Module",
                        "  - Local(name='f', renameable=true) <references=1>",
                        "  - Builtin(name='sorted') <references=1>",
                        "  - Local(name='a', renameable=true) <references=1>",
                        "  - Local(name='b', renameable=true) <references=1>",
                        "  - Local(name='c', renameable=true) <references=1>",
                        "  - Local(name='d', renameable=true) <references=1>",
                        "  - HoistedLiteral(name='sorted', renameable=true) <references=5>",
                        "  + Function f")
                + "\n");

    NameBinding alias = module.getBindings().get(module.getBindings().size() - 1);
    for (Identifier ref : alias.getReferences()) {
      assertThat(ref.getBinding()).isSameInstanceAs(alias);
    }
    assertThat(file.getStatements()).hasSize(5);
  }

  @Test
  public void declaredNameIsNotAliased() {
    PythonFile file =
        PythonFile.parse(
            ParserInput.fromLines(
                "def f():",
                "  global sorted",
                "  return sorted(a) + sorted(b) + sorted(c) + sorted(d) + sorted(e)"));
    Namespace module = aliased(file);
    assertThat(file.getStatements()).hasSize(1);
    for (NameBinding binding : module.getBindings()) {
      assertThat(binding.getKind()).isNotEqualTo(NameBinding.Kind.HOISTED_LITERAL);
    }
  }

  @Test
  public void selfDocumentingFieldIsNotAliased() {
    PythonFile file =
        PythonFile.parse(
            ParserInput.fromLines(
                "sorted()", "sorted()", "sorted()", "sorted()", "s = f'{sorted=}'"));
    aliased(file);
    assertThat(file.getStatements()).hasSize(5);
  }

  @Test
  public void aliasMustPayForItsAssignment() {
    // An assignment such as "aa=sorted\n" costs ten bytes, against four saved per use.
    assertThat(BuiltinAliaser.isProfitable(6, 2)).isFalse();
    assertThat(BuiltinAliaser.isProfitable(6, 3)).isTrue();
    assertThat(BuiltinAliaser.isProfitable(3, 7)).isFalse();
    assertThat(BuiltinAliaser.isProfitable(3, 8)).isTrue();
    assertThat(BuiltinAliaser.isProfitable(2, 100)).isFalse();
  }
}
