// Copyright 2014 The Bazel Authors. All rights reserved.
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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parser behavior. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private static PythonFile parseFile(String... lines) {
    return PythonFile.parse(ParserInput.fromLines(lines));
  }

  private static PythonFile parseFileOK(String... lines) {
    PythonFile file = parseFile(lines);
    if (!file.ok()) {
      throw new AssertionError(SyntaxError.summarize(file.errors()));
    }
    return file;
  }

  private static Expression parseExpression(String... lines) throws SyntaxError.Exception {
    return Expression.parse(ParserInput.fromLines(lines));
  }

  private static List<Statement.Kind> kinds(PythonFile file) {
    List<Statement.Kind> kinds = new ArrayList<>();
    for (Statement stmt : file.getStatements()) {
      kinds.add(stmt.kind());
    }
    return kinds;
  }

  private static void assertContainsError(PythonFile file, String message) {
    for (SyntaxError error : file.errors()) {
      if (error.message().contains(message)) {
        return;
      }
    }
    throw new AssertionError(
        "no error containing '" + message + "' in: " + file.errors());
  }

  @Test
  public void testStatementKinds() throws Exception {
    PythonFile file =
        parseFileOK(
            "import os",
            "from a import b",
            "x = 1",
            "x += 1",
            "def f():",
            "  global x",
            "  return x",
            "class C:",
            "  pass",
            "for i in x:",
            "  break",
            "while x:",
            "  continue",
            "if x:",
            "  del x",
            "try:",
            "  raise E",
            "except E:",
            "  pass",
            "with x as y:",
            "  assert y",
            "f()");
    assertThat(kinds(file))
        .containsExactly(
            Statement.Kind.IMPORT,
            Statement.Kind.IMPORT_FROM,
            Statement.Kind.ASSIGNMENT,
            Statement.Kind.ASSIGNMENT,
            Statement.Kind.DEF,
            Statement.Kind.CLASS,
            Statement.Kind.FOR,
            Statement.Kind.WHILE,
            Statement.Kind.IF,
            Statement.Kind.TRY,
            Statement.Kind.WITH,
            Statement.Kind.EXPRESSION)
        .inOrder();
  }

  @Test
  public void testMatchIsSoftKeyword() throws Exception {
    PythonFile file =
        parseFileOK(
            "match = 1", //
            "match x:",
            "  case [a, *rest]:",
            "    pass",
            "  case _:",
            "    pass");
    assertThat(kinds(file))
        .containsExactly(Statement.Kind.ASSIGNMENT, Statement.Kind.MATCH)
        .inOrder();
    MatchStatement match = (MatchStatement) file.getStatements().get(1);
    assertThat(match.getCases()).hasSize(2);
  }

  @Test
  public void testAssignmentTargetsAreStores() throws Exception {
    PythonFile file = parseFileOK("a, b = c = d");
    AssignmentStatement assign = (AssignmentStatement) file.getStatements().get(0);
    assertThat(assign.getTargets()).hasSize(2);
    ImmutableList<Identifier> bound = Identifier.boundIdentifiers(assign.getTargets().get(0));
    assertThat(bound).hasSize(2);
    for (Identifier id : bound) {
      assertThat(id.getContext()).isEqualTo(Identifier.Context.STORE);
    }
    assertThat(((Identifier) assign.getRHS()).getContext()).isEqualTo(Identifier.Context.LOAD);
  }

  @Test
  public void testDelTargetsAreDels() throws Exception {
    PythonFile file = parseFileOK("del x");
    DelStatement del = (DelStatement) file.getStatements().get(0);
    assertThat(((Identifier) del.getTargets().get(0)).getContext())
        .isEqualTo(Identifier.Context.DEL);
  }

  @Test
  public void testDottedImportBindsRootPackage() throws Exception {
    PythonFile file = parseFileOK("import a.b.c, d.e as f");
    ImportStatement imp = (ImportStatement) file.getStatements().get(0);
    ImportStatement.Alias first = imp.getAliases().get(0);
    assertThat(first.getImportedName()).isEqualTo("a.b.c");
    assertThat(first.getLocal().getName()).isEqualTo("a");
    assertThat(first.hasExplicitAlias()).isFalse();
    assertThat(first.isDotted()).isTrue();
    ImportStatement.Alias second = imp.getAliases().get(1);
    assertThat(second.getLocal().getName()).isEqualTo("f");
    assertThat(second.hasExplicitAlias()).isTrue();
  }

  @Test
  public void testDefParameters() throws Exception {
    PythonFile file = parseFileOK("def f(a, /, b=1, *args, c, **kw):", "  pass");
    DefStatement def = (DefStatement) file.getStatements().get(0);
    List<Parameter> params = def.getParameters();
    assertThat(params).hasSize(5);
    assertThat(params.get(0).isPositionalOnly()).isTrue();
    assertThat(params.get(1).isPositionalOnly()).isFalse();
    assertThat(params.get(1).getDefaultValue()).isNotNull();
    assertThat(params.get(2)).isInstanceOf(Parameter.Star.class);
    assertThat(params.get(4)).isInstanceOf(Parameter.StarStar.class);
  }

  @Test
  public void testExpressionPrecedence() throws Exception {
    Expression e = parseExpression("a + b * c");
    assertThat(e).isInstanceOf(BinaryOperatorExpression.class);
    BinaryOperatorExpression plus = (BinaryOperatorExpression) e;
    assertThat(plus.getOperator()).isEqualTo(TokenKind.PLUS);
    assertThat(plus.getY()).isInstanceOf(BinaryOperatorExpression.class);
  }

  @Test
  public void testParenthesizedExpressionIsMarked() throws Exception {
    Expression e = parseExpression("(a + b) * c");
    BinaryOperatorExpression times = (BinaryOperatorExpression) e;
    assertThat(times.getX().isParenthesized()).isTrue();
    assertThat(times.getY().isParenthesized()).isFalse();
  }

  @Test
  public void testComprehensionKinds() throws Exception {
    assertThat(((Comprehension) parseExpression("[x for x in y]")).getComprehensionKind())
        .isEqualTo(Comprehension.ComprehensionKind.LIST);
    assertThat(((Comprehension) parseExpression("{x for x in y}")).getComprehensionKind())
        .isEqualTo(Comprehension.ComprehensionKind.SET);
    assertThat(((Comprehension) parseExpression("{x: 1 for x in y}")).getComprehensionKind())
        .isEqualTo(Comprehension.ComprehensionKind.DICT);
    assertThat(((Comprehension) parseExpression("(x for x in y)")).getComprehensionKind())
        .isEqualTo(Comprehension.ComprehensionKind.GENERATOR);
  }

  @Test
  public void testExpressionSyntaxErrorThrows() {
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> parseExpression("a +"));
    assertThat(ex.errors()).isNotEmpty();
  }

  @Test
  public void testErrorsAreCollected() throws Exception {
    PythonFile file = parseFile("def f():", "x = 1");
    assertThat(file.ok()).isFalse();
    assertContainsError(file, "expected an indented block");
  }

  @Test
  public void testIllegalAssignmentTarget() throws Exception {
    assertContainsError(parseFile("f() = 1"), "cannot assign to this expression");
    assertContainsError(parseFile("a, b += 1"), "illegal expression for augmented assignment");
    assertContainsError(
        parseFile("a, b: int = 1"), "only single target (not tuple) can be annotated");
  }

  @Test
  public void testTypeParametersCanBeDisabled() throws Exception {
    FileOptions options = FileOptions.builder().allowTypeParameters(false).build();
    PythonFile file =
        PythonFile.parse(ParserInput.fromLines("def f[T](x: T):", "  pass"), options);
    assertContainsError(file, "type parameter lists are not supported");

    PythonFile ok = parseFileOK("def f[T](x: T):", "  pass");
    assertThat(((DefStatement) ok.getStatements().get(0)).getTypeParameters()).hasSize(1);
  }

  @Test
  public void testErrorLocation() throws Exception {
    PythonFile file = parseFile("x = 1", "y = )");
    assertThat(file.ok()).isFalse();
    assertThat(file.errors().get(0).location().line()).isEqualTo(2);
  }
}
