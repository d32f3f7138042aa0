// Copyright 2017 The Bazel Authors. All Rights Reserved.
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

import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link NodePrinter}. */
@RunWith(JUnit4.class)
public final class NodePrinterTest {

  // Parses the input and asserts that its compact form is the expected text.
  private static void assertPrettyMatches(String source, String... expected) {
    PythonFile file = PythonFile.parse(ParserInput.fromString(source, "test.py"));
    if (!file.ok()) {
      throw new AssertionError(SyntaxError.summarize(file.errors()));
    }
    String printed = NodePrinter.print(file);
    assertThat(printed).isEqualTo(Joiner.on('\n').join(expected) + "\n");

    // The compact form is itself a fixed point.
    PythonFile reparsed = PythonFile.parse(ParserInput.fromString(printed, "printed.py"));
    assertThat(reparsed.errors()).isEmpty();
    assertThat(NodePrinter.print(reparsed)).isEqualTo(printed);
  }

  @Test
  public void assignment() {
    assertPrettyMatches("x = 1", "x=1");
    assertPrettyMatches("a, b = b, a", "a,b=b,a");
    assertPrettyMatches("x += y * 2", "x+=y*2");
    assertPrettyMatches("x: int = 3", "x:int=3");
  }

  @Test
  public void keywordsAreSeparatedOnlyWhenNeeded() {
    assertPrettyMatches("y = not x", "y=not x");
    assertPrettyMatches("y = a if b else c", "y=a if b else c");
    assertPrettyMatches("y = [a for a in b if a]", "y=[a for a in b if a]");
    assertPrettyMatches("y = 'a' in s", "y='a'in s");
  }

  @Test
  public void blocksUseOneSpacePerLevel() {
    assertPrettyMatches(
        "def f(a, b=1, *args, c, **kw):\n    if a:\n        return b\n    return c\n",
        "def f(a,b=1,*args,c,**kw):",
        " if a:",
        "  return b",
        " return c");
  }

  @Test
  public void classWithDecorator() {
    assertPrettyMatches(
        "@dataclass\nclass A(B, metaclass=M):\n    x = 1\n",
        "@dataclass",
        "class A(B,metaclass=M):",
        " x=1");
  }

  @Test
  public void ifElifElse() {
    assertPrettyMatches(
        "if a:\n  pass\nelif b:\n  pass\nelse:\n  pass\n",
        "if a:",
        " pass",
        "elif b:",
        " pass",
        "else:",
        " pass");
  }

  @Test
  public void parenthesesArePreserved() {
    assertPrettyMatches("x = (a + b) * c", "x=(a+b)*c");
    assertPrettyMatches("x = ((1, 2),)", "x=((1,2),)");
  }

  @Test
  public void generatorArgumentSharesCallParentheses() {
    assertPrettyMatches("print(x for x in y)", "print(x for x in y)");
  }

  @Test
  public void attributeOfIntLiteral() {
    assertPrettyMatches("x = 1 .real", "x=1 .real");
  }

  @Test
  public void imports() {
    assertPrettyMatches("import a.b", "import a.b");
    assertPrettyMatches("import a.b as c", "import a.b as c");
    assertPrettyMatches("import os as os", "import os");
    assertPrettyMatches("from a import b as c, d", "from a import b as c,d");
  }

  @Test
  public void lambda() {
    assertPrettyMatches("f = lambda x, *y: x", "f=lambda x,*y:x");
  }

  @Test
  public void selfDocumentingFieldIsExpanded() {
    assertPrettyMatches("s = f'{x=}'", "s=f'x={x!r}'");
  }

  @Test
  public void tryExceptFinally() {
    assertPrettyMatches(
        "try:\n  f()\nexcept E as e:\n  pass\nfinally:\n  g()\n",
        "try:",
        " f()",
        "except E as e:",
        " pass",
        "finally:",
        " g()");
  }

  @Test
  public void printsRenamedIdentifiers() {
    PythonFile file = PythonFile.parse(ParserInput.fromLines("longname = 1", "print(longname)"));
    ScopeAnalyzer.analyze(file);
    Namespace module = TreeAnnotator.namespaceOf(file);
    module.getBinding("longname").rename("a");
    assertThat(NodePrinter.print(file)).isEqualTo("a=1\nprint(a)\n");
  }
}
