// Copyright 2015 The Bazel Authors. All rights reserved.
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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@code NodeVisitor} */
@RunWith(JUnit4.class)
public final class NodeVisitorTest {

  Supplier<IdentGatherer> gathererFactory = IdentGatherer::new;

  private static PythonFile parse(String src) throws SyntaxError.Exception {
    PythonFile file = PythonFile.parse(ParserInput.fromString(src, "test.py"));
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }

  /** Records all identifiers in the order they were seen, including duplicates. */
  private static class IdentGatherer extends NodeVisitor {
    final List<String> idents = new ArrayList<>();

    static IdentGatherer skippingNonSymbolIdentifiers() {
      IdentGatherer gatherer = new IdentGatherer();
      gatherer.skipNonSymbolIdentifiers = true;
      return gatherer;
    }

    @Override
    public void visit(Identifier node) {
      idents.add(node.getName());
    }
  }

  /**
   * Asserts that the traversed identifiers (in order, including duplicates) of the given source
   * code match the expected identifiers, which is supplied as a space-delimited string.
   */
  private void assertIdentsAre(String src, String expectedIdents) throws Exception {
    PythonFile file = parse(src);
    IdentGatherer visitor = gathererFactory.get();
    visitor.visit(file);
    assertThat(visitor.idents).containsExactlyElementsIn(expectedIdents.split(" ")).inOrder();
  }

  @Test
  public void simpleStatements() throws Exception {
    assertIdentsAre(
        """
        import a.b, c as d
        from e import f as g, h
        i = j
        k
        pass
        l, m[n] = o + 1 + "xyz" + 0.0
        del p
        """,
        // Module paths and imported names are not identifiers; only the bound names are visited.
        "a d g h i j k l m n o p");
  }

  @Test
  public void controlStatements() throws Exception {
    assertIdentsAre(
        """
        for a in b:
          if c:
            break
          else:
            continue
        while d:
          raise e from f
        with g as h, i:
          assert j, k
        """,
        "a b c d e f g h i j k");
  }

  @Test
  public void tryStatement() throws Exception {
    assertIdentsAre(
        """
        try:
          a
        except b as c:
          d
        else:
          e
        finally:
          f
        """,
        "a b c d e f");
  }

  @Test
  public void simpleExpressions() throws Exception {
    assertIdentsAre(
        """
        a + b if c else d.e
        {f: g, h: [i, j], **k}
        not l[m:n]
        (o := p)
        """,
        "a b c d e f g h i j k l m n o p");
  }

  @Test
  public void comprehensions() throws Exception {
    assertIdentsAre(
        """
        [a for b, c in d if e for f in {g: h for i in j}]
        """,
        "a b c d e f g h i j");
  }

  @Test
  public void calls() throws Exception {
    assertIdentsAre(
        """
        a(b, c=d, *e, **f)
        """,
        "a b c d e f");
  }

  @Test
  public void functionDefs() throws Exception {
    assertIdentsAre(
        """
        @a
        def b(c, d=e, *f, **g):
          h
        """,
        "a b c d e f g h");
    assertIdentsAre(
        """
        def a(*, b, c=d):
          return
        """,
        "a b c d");
    assertIdentsAre(
        """
        f = lambda a, b=c: a
        """,
        "f a b c a");
  }

  @Test
  public void classDefs() throws Exception {
    assertIdentsAre(
        """
        @a
        class b[c](d, metaclass=e):
          f = g
        """,
        "a b c d metaclass e f g");
  }

  @Test
  public void typeAnnotations() throws Exception {
    assertIdentsAre(
        """
        def a[b, c](d : e[f], g: h) -> i:
          pass
        """,
        "a b c d e f g h i");

    assertIdentsAre(
        """
        a : b
        c : d = e
        """,
        "a b c d e");
  }

  @Test
  public void declarations() throws Exception {
    assertIdentsAre(
        """
        def a():
          global b, c
          nonlocal d
        """,
        "a b c d");
  }

  @Test
  public void formattedStrings() throws Exception {
    assertIdentsAre(
        """
        f"{a} and {b!r:{c}} and {d=}"
        """,
        "a b c d");
  }

  @Test
  public void patterns() throws Exception {
    assertIdentsAre(
        """
        match a:
          case [b, *c] if d:
            pass
          case {"k": e, **f}:
            pass
          case g.h(i, j=k) | l as m:
            pass
        """,
        "a b c d e f g h i j k l m");
  }

  @Test
  public void skipNonSymbolIdentifiers() throws Exception {
    gathererFactory = IdentGatherer::skippingNonSymbolIdentifiers;

    assertIdentsAre(
        """
        a(b=c.d)
        match e:
          case f(g=h):
            pass
        """,
        // No b, no d, no g.
        "a c e f h");
  }
}
