// Copyright 2006 The Bazel Authors. All Rights Reserved.
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  // Creates a lexer which takes input from the specified string. Resets the errors beforehand.
  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, ""), errors);
  }

  private static class Token {
    TokenKind kind;
    int start;
    int end;
    String raw;
    Object value;
  }

  private static ArrayList<Token> allTokens(Lexer lexer) {
    ArrayList<Token> result = new ArrayList<>();
    do {
      lexer.nextToken();
      Token tok = new Token();
      tok.kind = lexer.kind;
      tok.start = lexer.start;
      tok.end = lexer.end;
      tok.raw = lexer.raw;
      tok.value = lexer.value;
      result.add(tok);
    } while (lexer.kind != TokenKind.EOF);
    return result;
  }

  private Token[] tokens(String input) {
    return allTokens(createLexer(input)).toArray(new Token[0]);
  }

  /**
   * Returns a string containing the names of the tokens and their associated values. (String
   * literals are printed without escaping.)
   */
  private static String values(Token[] tokens) {
    StringBuilder buffer = new StringBuilder();
    for (Token token : tokens) {
      if (buffer.length() > 0) {
        buffer.append(' ');
      }
      buffer.append(token.kind.name());
      if (token.value != null) {
        buffer.append('(').append(token.value).append(')');
      }
    }
    return buffer.toString();
  }

  // Returns the raw text of each INT, FLOAT or STRING token.
  private static String raws(Token[] tokens) {
    List<String> result = new ArrayList<>();
    for (Token token : tokens) {
      if (token.raw != null && token.kind != TokenKind.IDENTIFIER) {
        result.add(token.raw);
      }
    }
    return Joiner.on(' ').join(result);
  }

  // Scans src, and asserts that the tokens match wantTokens and that there are no errors.
  private void check(String src, String wantTokens) {
    assertThat(values(tokens(src))).isEqualTo(wantTokens);
    assertThat(errors).isEmpty();
  }

  // Scans src, and asserts that the tokens match wantTokens and the errors match wantErrors.
  // Errors are formatted with a caret ^ under the errant column.
  private void checkErrors(String src, String wantTokens, String... wantErrors) {
    assertThat(values(tokens(src))).isEqualTo(wantTokens);

    List<String> gotErrors = new ArrayList<>();
    for (SyntaxError err : errors) {
      String msg = " ".repeat(err.location().column() - 1) + "^ " + err.message();
      if (err.location().line() != 1) {
        msg = String.format("%s (line %d)", msg, err.location().line());
      }
      gotErrors.add(msg);
    }
    assertThat(gotErrors).isEqualTo(Arrays.asList(wantErrors));
  }

  @Test
  public void testBasics() {
    check("x = 1\n", "IDENTIFIER(x) EQUALS INT NEWLINE EOF");
    check("x = 1", "IDENTIFIER(x) EQUALS INT NEWLINE EOF");
    check("", "NEWLINE EOF");
    check("x # comment\ny\n", "IDENTIFIER(x) NEWLINE IDENTIFIER(y) NEWLINE EOF");
  }

  @Test
  public void testKeywordsAndSoftKeywords() {
    check(
        "def f(): return None",
        "DEF IDENTIFIER(f) LPAREN RPAREN COLON RETURN NONE NEWLINE EOF");
    // match, case, type and _ are ordinary identifiers to the lexer.
    check(
        "match case type _",
        "IDENTIFIER(match) IDENTIFIER(case) IDENTIFIER(type) IDENTIFIER(_) NEWLINE EOF");
  }

  @Test
  public void testOperators() {
    check(
        "a := b ** c @= d -> e ... //= **=",
        "IDENTIFIER(a) COLON_EQUALS IDENTIFIER(b) STAR_STAR IDENTIFIER(c) AT_EQUALS IDENTIFIER(d)"
            + " ARROW IDENTIFIER(e) ELLIPSIS SLASH_SLASH_EQUALS STAR_STAR_EQUALS NEWLINE EOF");
    check(
        "a<<=b>>=c!=d<=e",
        "IDENTIFIER(a) LESS_LESS_EQUALS IDENTIFIER(b) GREATER_GREATER_EQUALS IDENTIFIER(c)"
            + " NOT_EQUALS IDENTIFIER(d) LESS_EQUALS IDENTIFIER(e) NEWLINE EOF");
  }

  @Test
  public void testIndentation() {
    check(
        "if x:\n  y\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT NEWLINE EOF");
    // A tab advances to the next multiple of eight columns.
    check(
        "if x:\n\ty\n        z\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE IDENTIFIER(z) NEWLINE"
            + " OUTDENT NEWLINE EOF");
    // Blank and comment-only lines do not affect indentation.
    check(
        "if x:\n  y\n\n    # c\n  z\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE IDENTIFIER(z) NEWLINE"
            + " OUTDENT NEWLINE EOF");
  }

  @Test
  public void testBadUnindent() {
    checkErrors(
        "if x:\n    y\n  z\n",
        "IF IDENTIFIER(x) COLON NEWLINE INDENT IDENTIFIER(y) NEWLINE OUTDENT IDENTIFIER(z) NEWLINE"
            + " EOF",
        " ^ unindent does not match any outer indentation level (line 3)");
  }

  @Test
  public void testNewlinesInsideBrackets() {
    check(
        "f(a,\n  b)\n",
        "IDENTIFIER(f) LPAREN IDENTIFIER(a) COMMA IDENTIFIER(b) RPAREN NEWLINE EOF");
    check("x = \\\n  1\n", "IDENTIFIER(x) EQUALS INT NEWLINE EOF");
  }

  @Test
  public void testNumbers() {
    Token[] tokens = tokens("0x_1f 1_000 1.5e-3 3j .5 0o17 0b101\n");
    assertThat(values(tokens)).isEqualTo("INT INT FLOAT FLOAT FLOAT INT INT NEWLINE EOF");
    assertThat(raws(tokens)).isEqualTo("0x_1f 1_000 1.5e-3 3j .5 0o17 0b101");
    assertThat(errors).isEmpty();

    checkErrors("1__0\n", "INT NEWLINE EOF", "^ invalid decimal literal");
    checkErrors("0x\n", "INT NEWLINE EOF", "^ invalid hexadecimal literal");
  }

  @Test
  public void testStrings() {
    Token[] tokens = tokens("'a\\tb' r'a\\tb' b'x' \"q'\"\n");
    assertThat(tokens[0].value).isEqualTo("a\tb");
    assertThat(tokens[1].value).isEqualTo("a\\tb");
    assertThat(tokens[2].value).isEqualTo("x");
    assertThat(tokens[3].value).isEqualTo("q'");
    assertThat(raws(tokens)).isEqualTo("'a\\tb' r'a\\tb' b'x' \"q'\"");
    assertThat(errors).isEmpty();

    check("'''a\nb'''\n", "STRING(a\nb) NEWLINE EOF");
    check("'\\x41\\u00e9'\n", "STRING(A\u00e9) NEWLINE EOF");
  }

  @Test
  public void testFormattedStringIsOneToken() {
    Token[] tokens = tokens("f'{x!r:>{width}}' + 1\n");
    assertThat(tokens[0].kind).isEqualTo(TokenKind.FSTRING);
    assertThat(tokens[0].raw).isEqualTo("f'{x!r:>{width}}'");
    assertThat(tokens[0].value).isNull();
    assertThat(tokens[1].kind).isEqualTo(TokenKind.PLUS);
  }

  @Test
  public void testUnclosedString() {
    checkErrors("'abc\n", "STRING(abc) NEWLINE EOF", "^ unclosed string literal");
  }

  @Test
  public void testPositions() {
    Token[] tokens = tokens("ab = 'c'");
    assertThat(tokens[0].start).isEqualTo(0);
    assertThat(tokens[0].end).isEqualTo(2);
    assertThat(tokens[2].start).isEqualTo(5);
    assertThat(tokens[2].end).isEqualTo(8);
  }

  @Test
  public void testSaveAndRestore() {
    Lexer lexer = createLexer("a b c");
    lexer.nextToken();
    Lexer.State state = lexer.save();
    lexer.nextToken();
    lexer.nextToken();
    assertThat(lexer.value).isEqualTo("c");
    lexer.restore(state);
    assertThat(lexer.value).isEqualTo("a");
    lexer.nextToken();
    assertThat(lexer.value).isEqualTo("b");
  }

  @Test
  public void testInvalidCharacter() {
    checkErrors("a $ b\n", "IDENTIFIER(a) IDENTIFIER(b) NEWLINE EOF", "  ^ invalid character: '$'");
  }
}
