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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.ParserInput;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.ScopeAnalyzer;
import net.pyminify.java.syntax.SyntaxError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link NameAssigner} and {@link ReservationScope}. */
@RunWith(JUnit4.class)
public final class NameAssignerTest {

  private static PythonFile parse(String... lines) {
    PythonFile file = PythonFile.parse(ParserInput.fromLines(lines));
    if (!file.ok()) {
      throw new AssertionError(SyntaxError.summarize(file.errors()));
    }
    return file;
  }

  private static List<NameBinding> allBindings(Namespace module) {
    List<NameBinding> bindings = new ArrayList<>();
    for (Namespace ns : module.preOrder()) {
      bindings.addAll(ns.getBindings());
    }
    return bindings;
  }

  private static NameBinding onlyBinding(Namespace ns, String name) {
    NameBinding binding = ns.getBinding(name);
    assertThat(binding).isNotNull();
    return binding;
  }

  private static final String[] NESTED =
      new String[] {
        "value = 1",
        "def outer():",
        "  def middle():",
        "    def inner():",
        "      return value",
        "    return inner",
        "  return middle"
      };

  @Test
  public void testReservationScopeSpansPathToEachReference() throws Exception {
    Namespace module = ScopeAnalyzer.analyze(parse(NESTED));
    Namespace outer = module.getChildren().get(0);
    Namespace middle = outer.getChildren().get(0);
    Namespace inner = middle.getChildren().get(0);

    ImmutableSet<Namespace> scope = ReservationScope.of(onlyBinding(module, "value"));
    assertThat(scope).containsExactly(module, inner, middle, outer).inOrder();

    assertThat(ReservationScope.of(onlyBinding(outer, "middle"))).containsExactly(outer);
    assertThat(ReservationScope.of(onlyBinding(middle, "inner"))).containsExactly(middle);
  }

  @Test
  public void testNestedReferenceAvoidsNamesOfEveryNamespaceOnThePath() throws Exception {
    Namespace module = ScopeAnalyzer.analyze(parse(NESTED));
    RenameReport report = NameAssigner.assign(module);

    Namespace outer = module.getChildren().get(0);
    Namespace middle = outer.getChildren().get(0);
    // "middle" saves the most and is named first; "value" must then avoid its name in "outer".
    assertThat(onlyBinding(outer, "middle").getName()).isEqualTo("a");
    assertThat(onlyBinding(module, "value").getName()).isEqualTo("b");
    assertThat(onlyBinding(middle, "inner").getName()).isEqualTo("a");
    assertThat(onlyBinding(module, "outer").getName()).isEqualTo("a");

    assertThat(report.bindingsConsidered()).isEqualTo(4);
    assertThat(report.bindingsRenamed()).isEqualTo(4);
    assertThat(report.bytesSaved()).isEqualTo(10L + 8 + 8 + 4);
  }

  @Test
  public void testRankingIsBySavingsThenDiscoveryOrder() throws Exception {
    Namespace module = ScopeAnalyzer.analyze(parse(NESTED));
    List<String> ranked = new ArrayList<>();
    for (NameBinding binding : NameAssigner.rankedBindings(module)) {
      ranked.add(binding.getOriginalName());
    }
    assertThat(ranked).containsExactly("middle", "value", "inner", "outer").inOrder();
  }

  @Test
  public void testUnprofitableRenameKeepsFreeOriginalName() throws Exception {
    Namespace module = ScopeAnalyzer.analyze(parse("def f():", "  x = 1", "  return x"));
    RenameReport report = NameAssigner.assign(module);
    NameBinding x = onlyBinding(module.getChildren().get(0), "x");
    assertThat(x.getName()).isEqualTo("x");
    assertThat(x.isRenamed()).isFalse();
    assertThat(report.bindingsRenamed()).isEqualTo(0);
  }

  @Test
  public void testOriginalNameTakenByAnotherBindingIsGivenUp() throws Exception {
    Namespace module =
        ScopeAnalyzer.analyze(
            parse(
                "def f(items):",
                "  a = len(items)",
                "  length = len(items)",
                "  return a + length"));
    Namespace f = module.getChildren().get(0);
    onlyBinding(module, "f").disallowRename();
    NameAssigner.assign(module);
    assertThat(onlyBinding(f, "length").getName()).isEqualTo("a");
    assertThat(onlyBinding(f, "a").getName()).isEqualTo("b");
    assertThat(onlyBinding(f, "items").getName()).isEqualTo("items");
  }

  @Test
  public void testUnaliasedImportCostsAsClause() throws Exception {
    Namespace module =
        ScopeAnalyzer.analyze(parse("import collections", "collections.OrderedDict()"));
    NameBinding collections = onlyBinding(module, "collections");
    assertThat(NameAssigner.estimatedSavings(collections, 1)).isEqualTo(-5L + 10);

    module = ScopeAnalyzer.analyze(parse("import os", "os.sep"));
    assertThat(NameAssigner.estimatedSavings(onlyBinding(module, "os"), 1)).isEqualTo(-5L + 1);
  }

  @Test
  public void testRenamedBindingsNeverShareANameInOverlappingScopes() throws Exception {
    Namespace module =
        ScopeAnalyzer.analyze(
            parse(
                "import functools",
                "counter_total = 0",
                "def decorate(function):",
                "  @functools.wraps(function)",
                "  def wrapper(*arguments, **keywords):",
                "    global counter_total",
                "    counter_total += 1",
                "    result = function(*arguments, **keywords)",
                "    return [element for element in result if element]",
                "  return wrapper",
                "class Holder:",
                "  items = [counter_total for _ in range(3)]",
                "  def method(self):",
                "    return lambda item: (item, self, counter_total)"));
    NameAssigner.assign(module);

    List<NameBinding> bindings = allBindings(module);
    for (NameBinding a : bindings) {
      for (NameBinding b : bindings) {
        if (a == b || !(a.isRenamed() || b.isRenamed())) {
          continue;
        }
        boolean overlap = false;
        for (Namespace ns : ReservationScope.of(a)) {
          overlap |= ReservationScope.of(b).contains(ns);
        }
        if (overlap) {
          assertThat(a.getName()).isNotEqualTo(b.getName());
        }
      }
    }
  }

  @Test
  public void testAssignmentIsDeterministic() throws Exception {
    String[] source = {
      "def first(alpha, /, beta_value):",
      "  gamma = alpha + beta_value",
      "  return [delta * gamma for delta in range(gamma)]",
      "def second(*epsilon):",
      "  zeta = sum(epsilon)",
      "  return zeta"
    };
    List<String> runs = new ArrayList<>();
    for (int i = 0; i < 2; i++) {
      Namespace module = ScopeAnalyzer.analyze(parse(source));
      NameAssigner.assign(module);
      runs.add(module.dump());
    }
    assertThat(runs.get(1)).isEqualTo(runs.get(0));
    assertThat(Joiner.on('\n').join(runs)).doesNotContain("name='beta_value', renamed");
  }
}
