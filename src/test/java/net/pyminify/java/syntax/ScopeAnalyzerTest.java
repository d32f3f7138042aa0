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

import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests of the namespaces and bindings produced by the {@link NamespaceBuilder}, {@link Binder} and
 * {@link Resolver}, as run by the {@link ScopeAnalyzer}.
 */
@RunWith(JUnit4.class)
public final class ScopeAnalyzerTest {

  private static PythonFile parse(String... lines) {
    PythonFile file = PythonFile.parse(ParserInput.fromLines(lines));
    if (!file.ok()) {
      throw new AssertionError(SyntaxError.summarize(file.errors()));
    }
    return file;
  }

  private static Namespace analyze(String... lines) {
    return ScopeAnalyzer.analyze(parse(lines));
  }

  // Asserts that the dump of the analyzed module is the expected lines.
  private static void assertDump(String[] source, String... expected) {
    assertThat(analyze(source).dump()).isEqualTo(Joiner.on('\n').join(expected) + "\n");
  }

  private static String[] source(String... lines) {
    return lines;
  }

  @Test
  public void testFunctionAssignmentMakesNameLocalThroughout() throws Exception {
    assertDump(
        source(
            "a = 5", //
            "def A():",
            "  print(a)",
            "  a = 6"),
        "+ Module",
        "  - Local(name='a', renameable=true) <references=1>",
        "  - Local(name='A', renameable=true) <references=1>",
        "  - Builtin(name='print') <references=1>",
        "  + Function A",
        "    - Local(name='a', renameable=true) <references=2>");
  }

  @Test
  public void testClassBodyLookupExtendsOuterBinding() throws Exception {
    assertDump(
        source(
            "message = 'hello'",
            "class A:",
            "  if cond:",
            "    message = message + ' world'"),
        "+ Module",
        "  - Local(name='message', renameable=true) <references=3>",
        "  - Local(name='A', renameable=true) <references=1>",
        "  - Local(name='cond', renameable=true) <references=1>",
        "  + Class A",
        "    - nonlocal cond",
        "    - nonlocal message");
  }

  @Test
  public void testClassAugmentedAssignmentReadsOuterBinding() throws Exception {
    assertDump(
        source(
            "A = 1", //
            "class Class:",
            "  A += 2"),
        "+ Module",
        "  - Local(name='A', renameable=true) <references=2>",
        "  - Local(name='Class', renameable=true) <references=1>",
        "  + Class Class",
        "    - nonlocal A");
  }

  @Test
  public void testClassAttributeWithoutOuterBindingIsNotRenameable() throws Exception {
    assertDump(
        source(
            "class Account:", //
            "  balance = 1",
            "  doubled = balance * 2"),
        "+ Module",
        "  - Local(name='Account', renameable=true) <references=1>",
        "  - Local(name='balance', renameable=false) <references=2>",
        "  + Class Account",
        "    - nonlocal balance",
        "    - Local(name='doubled', renameable=false) <references=1>");
  }

  @Test
  public void testClassGlobalDeclarationKeepsImplicitGlobalRenameable() throws Exception {
    assertDump(
        source(
            "class Config:", //
            "  global level",
            "  level = 3"),
        "+ Module",
        "  - Local(name='Config', renameable=true) <references=1>",
        "  - Local(name='level', renameable=true) <references=2>",
        "  + Class Config",
        "    - global level");
  }

  @Test
  public void testClassScopeIsSkippedByNestedFunctions() throws Exception {
    assertDump(
        source(
            "x = 1",
            "class C:",
            "  x = 2",
            "  def m(self):",
            "    return x"),
        "+ Module",
        "  - Local(name='x', renameable=true) <references=2>",
        "  - Local(name='C', renameable=true) <references=1>",
        "  + Class C",
        "    - Local(name='x', renameable=false) <references=1>",
        "    - Local(name='m', renameable=false) <references=1>",
        "    + Function m",
        "      - Local(name='self', renameable=true) <references=1>");
  }

  @Test
  public void testParameterRenameability() throws Exception {
    assertDump(
        source(
            "class C(Base):",
            "  def method(self, arg, *args, **kwargs):",
            "    return self, arg, args, kwargs",
            "  @staticmethod",
            "  def helper(first, /, second):",
            "    return first, second"),
        "+ Module",
        "  - Local(name='C', renameable=true) <references=1>",
        "  - Local(name='Base', renameable=true) <references=1>",
        "  - Builtin(name='staticmethod') <references=1>",
        "  + Class C",
        "    - nonlocal staticmethod",
        "    - Local(name='method', renameable=false) <references=1>",
        "    - Local(name='helper', renameable=false) <references=1>",
        "    + Function method",
        "      - Local(name='self', renameable=true) <references=2>",
        "      - Local(name='arg', renameable=false) <references=2>",
        "      - Local(name='args', renameable=true) <references=2>",
        "      - Local(name='kwargs', renameable=true) <references=2>",
        "    + Function helper",
        "      - Local(name='first', renameable=true) <references=2>",
        "      - Local(name='second', renameable=false) <references=2>");
  }

  @Test
  public void testLambdaParametersAreNotRenameable() throws Exception {
    assertDump(
        source("f = lambda x, y=z: x + y"),
        "+ Module",
        "  - Local(name='f', renameable=true) <references=1>",
        "  - Local(name='z', renameable=true) <references=1>",
        "  + Lambda",
        "    - Local(name='x', renameable=false) <references=2>",
        "    - Local(name='y', renameable=false) <references=2>");
  }

  @Test
  public void testGeneratorFirstIterableIsEvaluatedOutside() throws Exception {
    assertDump(
        source("x = []; f = []; a = (x for x in f for x in x)"),
        "+ Module",
        "  - Local(name='x', renameable=true) <references=1>",
        "  - Local(name='f', renameable=true) <references=2>",
        "  - Local(name='a', renameable=true) <references=1>",
        "  + Generator",
        "    - Local(name='x', renameable=true) <references=4>");
  }

  @Test
  public void testListComprehensionScopeIsConfigurable() throws Exception {
    FileOptions python2 = FileOptions.builder().listComprehensionHasOwnScope(false).build();
    PythonFile file = PythonFile.parse(ParserInput.fromLines("y = [x for x in z]"), python2);
    assertThat(ScopeAnalyzer.analyze(file).dump())
        .isEqualTo(
            Joiner.on('\n')
                .join(
                    "+ Module",
                    "  - Local(name='y', renameable=true) <references=1>",
                    "  - Local(name='x', renameable=true) <references=2>",
                    "  - Local(name='z', renameable=true) <references=1>",
                    ""));

    assertDump(
        source("y = [x for x in z]"),
        "+ Module",
        "  - Local(name='y', renameable=true) <references=1>",
        "  - Local(name='z', renameable=true) <references=1>",
        "  + ListComprehension",
        "    - Local(name='x', renameable=true) <references=2>");
  }

  @Test
  public void testGlobalAndNonlocalDeclarations() throws Exception {
    assertDump(
        source(
            "x = 1",
            "def f():",
            "  global x",
            "  x = 2",
            "  y = 3",
            "  def g():",
            "    nonlocal y",
            "    y = 4",
            "    return y",
            "  return g"),
        "+ Module",
        "  - Local(name='x', renameable=true) <references=3>",
        "  - Local(name='f', renameable=true) <references=1>",
        "  + Function f",
        "    - global x",
        "    - Local(name='y', renameable=true) <references=4>",
        "    - Local(name='g', renameable=true) <references=2>",
        "    + Function g",
        "      - nonlocal y");
  }

  @Test
  public void testNonlocalAtModuleScopeIsNotRenamed() throws Exception {
    Namespace module = analyze("nonlocal x", "x = 1");
    assertThat(module.getBinding("x").isRenameable()).isFalse();
  }

  @Test
  public void testTypeParametersLiveInAnnotationScope() throws Exception {
    assertDump(
        source(
            "def f[T](x: T) -> T:", //
            "  return x"),
        "+ Module",
        "  - Local(name='f', renameable=true) <references=1>",
        "  + Annotation f",
        "    - Local(name='T', renameable=true) <references=3>",
        "    + Function f",
        "      - Local(name='x', renameable=false) <references=2>");
  }

  @Test
  public void testReflectiveBuiltinTaintsEnclosingNamespaces() throws Exception {
    assertDump(
        source(
            "def f():", //
            "  a = 1",
            "  return eval('a')"),
        "+ Module",
        "  - tainted",
        "  - Local(name='f', renameable=false) <references=1>",
        "  - Builtin(name='eval') <references=1>",
        "  + Function f",
        "    - tainted",
        "    - Local(name='a', renameable=false) <references=1>");
  }

  @Test
  public void testStarImportTaintsItsNamespace() throws Exception {
    Namespace module = analyze("from m import *", "def f():", "  b = 2", "  return b");
    assertThat(module.isTainted()).isTrue();
    Namespace function = module.getChildren().get(0);
    assertThat(function.isTainted()).isFalse();
    assertThat(function.getBinding("b").isRenameable()).isTrue();
    assertThat(module.getBinding("f").isRenameable()).isFalse();
  }

  @Test
  public void testImportBindings() throws Exception {
    Namespace module =
        analyze(
            "import os", //
            "import a.b",
            "import c.d as e",
            "from m import n as o",
            "from . import p");
    assertThat(module.getBinding("os").isRenameable()).isTrue();
    assertThat(module.getBinding("a").isRenameable()).isFalse();
    assertThat(module.getBinding("e").isRenameable()).isTrue();
    assertThat(module.getBinding("o").isRenameable()).isTrue();
    assertThat(module.getBinding("p").isRenameable()).isFalse();
    assertThat(module.getBinding("c")).isNull();
    assertThat(module.getBinding("n")).isNull();
  }

  @Test
  public void testSelfDocumentingFieldPreventsRename() throws Exception {
    Namespace module = analyze("x = 1", "y = 2", "s = f'{x=} {y}'");
    assertThat(module.getBinding("x").isRenameable()).isFalse();
    assertThat(module.getBinding("y").isRenameable()).isTrue();
  }

  @Test
  public void testDunderNamesAreNotRenameable() throws Exception {
    Namespace module = analyze("__version__ = '1.0'", "print(__name__)");
    assertThat(module.getBinding("__version__").isRenameable()).isFalse();
    assertThat(module.getBinding("__name__").getKind()).isEqualTo(NameBinding.Kind.BUILTIN);
  }

  @Test
  public void testAttributeAndKeywordNamesAreNotBound() throws Exception {
    Namespace module = analyze("obj.attr = f(key=1)");
    assertThat(module.getBinding("obj")).isNotNull();
    assertThat(module.getBinding("f")).isNotNull();
    assertThat(module.getBinding("attr")).isNull();
    assertThat(module.getBinding("key")).isNull();
  }

  @Test
  public void testWalrusInComprehensionBindsInEnclosingFunction() throws Exception {
    Namespace module = analyze("def f(data):", "  return [(y := v) for v in data]");
    Namespace function = module.getChildren().get(0);
    assertThat(function.getBinding("y")).isNotNull();
    Namespace comprehension = function.getChildren().get(0);
    assertThat(comprehension.getDescription()).isEqualTo("ListComprehension");
    assertThat(comprehension.getBinding("y")).isNull();
    assertThat(comprehension.getBinding("v")).isNotNull();
  }

  @Test
  public void testMatchCapturesAreBound() throws Exception {
    Namespace module =
        analyze(
            "match command:",
            "  case [action, *rest]:",
            "    pass",
            "  case {'k': value, **others}:",
            "    pass",
            "  case Point(x=px) as point:",
            "    pass");
    for (String name : new String[] {"action", "rest", "value", "others", "px", "point"}) {
      assertThat(module.getBinding(name)).isNotNull();
    }
    assertThat(module.getBinding("x")).isNull();
  }

  @Test
  public void testEveryIdentifierIsBound() throws Exception {
    PythonFile file =
        parse(
            "import sys",
            "def main(argv=sys.argv):",
            "  total = 0",
            "  for arg in argv[1:]:",
            "    total += len(arg)",
            "  return total");
    ScopeAnalyzer.analyze(file);
    new NodeVisitor() {
      {
        this.skipNonSymbolIdentifiers = true;
      }

      @Override
      public void visit(Identifier id) {
        assertThat(id.getBinding()).isNotNull();
        assertThat(id.getBinding().getReferences()).contains(id);
      }
    }.visit((Node) file);
  }

  @Test
  public void testAnalysisIsIdempotent() throws Exception {
    PythonFile file =
        parse(
            "import os",
            "class A(object):",
            "  x = os.sep",
            "  def f(self, *a):",
            "    return [i for i in a if i != self.x]");
    String first = ScopeAnalyzer.analyze(file).dump();
    String second = ScopeAnalyzer.analyze(file).dump();
    assertThat(second).isEqualTo(first);
  }

  @Test
  public void testCustomBuiltins() throws Exception {
    PythonFile file = parse("print(native)");
    Namespace module = ScopeAnalyzer.analyze(file, Builtins.python3().extend("native"));
    assertThat(module.getBinding("native").getKind()).isEqualTo(NameBinding.Kind.BUILTIN);
    assertThat(module.getBinding("native").isRenameable()).isFalse();
  }

  @Test
  public void testBindingWithoutNamespacesIsStructuralError() throws Exception {
    PythonFile file = parse("x = 1");
    Namespace module = new Namespace(Namespace.Kind.MODULE, file, null);
    StructuralException ex =
        assertThrows(StructuralException.class, () -> Binder.bind(file, module));
    assertThat(ex.getNode()).isSameInstanceAs(file);
  }

  @Test
  public void testUnannotatedTreeIsStructuralError() throws Exception {
    PythonFile file = parse("class A:", "  x = y");
    assertThrows(
        StructuralException.class, () -> NamespaceBuilder.build(file, FileOptions.DEFAULT));
  }
}
