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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

/** A scanner for Python 3. */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  // raw is defined for IDENTIFIER, INT, FLOAT, STRING and FSTRING; value only for IDENTIFIER and
  // STRING.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token
  Object value; // the name of an IDENTIFIER or the decoded contents of a STRING

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position. Only buffer[0:limit] is scanned.
  private final char[] buffer;
  private int pos;
  private final int limit;

  // Set for a lexer that scans the expression of an f-string replacement field. Such a lexer
  // behaves as if inside brackets, and does not end its input with a NEWLINE.
  private final boolean embedded;

  // The stack of enclosing indentation levels in columns.
  // The first (outermost) element is always zero.
  private Stack<Integer> indentStack = new Stack<>();

  // The number of unclosed open-parens ("(", '{', '[') at the current point in
  // the stream. Whitespace is handled differently when this is nonzero.
  private int openParenStackDepth = 0;

  // True after a NEWLINE token. In other words, we are outside an
  // expression and we have to check the indentation.
  private boolean checkIndentation;

  // Number of saved INDENT (>0) or OUTDENT (<0) tokens detected but not yet returned.
  private int dents;

  // Characters that can come immediately prior to an '=' character to generate
  // a different token
  private static final ImmutableMap<Character, TokenKind> EQUAL_TOKENS =
      ImmutableMap.<Character, TokenKind>builder()
          .put('=', TokenKind.EQUALS_EQUALS)
          .put('!', TokenKind.NOT_EQUALS)
          .put('>', TokenKind.GREATER_EQUALS)
          .put('<', TokenKind.LESS_EQUALS)
          .put('+', TokenKind.PLUS_EQUALS)
          .put('-', TokenKind.MINUS_EQUALS)
          .put('*', TokenKind.STAR_EQUALS)
          .put('/', TokenKind.SLASH_EQUALS)
          .put('%', TokenKind.PERCENT_EQUALS)
          .put('^', TokenKind.CARET_EQUALS)
          .put('&', TokenKind.AMPERSAND_EQUALS)
          .put('|', TokenKind.PIPE_EQUALS)
          .put('@', TokenKind.AT_EQUALS)
          .put(':', TokenKind.COLON_EQUALS)
          .build();

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.limit = buffer.length;
    this.embedded = false;
    this.errors = errors;
    this.checkIndentation = true;
    this.dents = 0;

    indentStack.push(0);
  }

  // Constructs a lexer for buffer[start:end] of the given lexer's input, which is the
  // expression of an f-string replacement field. Errors are reported to the outer lexer's list.
  Lexer(Lexer outer, int start, int end) {
    this.locs = outer.locs;
    this.buffer = outer.buffer;
    this.pos = start;
    this.limit = end;
    this.embedded = true;
    this.errors = outer.errors;
    this.checkIndentation = false;
    this.openParenStackDepth = 1;

    indentStack.push(0);
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    boolean afterNewline = kind == TokenKind.NEWLINE;
    tokenize();
    Preconditions.checkState(kind != null);

    // Like Python, always end with a NEWLINE token, even if no '\n' in input:
    if (kind == TokenKind.EOF && !afterNewline && !embedded) {
      kind = TokenKind.NEWLINE;
    }
  }

  /** A snapshot of the scanner's state, from which scanning may be resumed. */
  static final class State {
    private final TokenKind kind;
    private final int start;
    private final int end;
    private final String raw;
    private final Object value;
    private final int pos;
    private final Stack<Integer> indentStack;
    private final int openParenStackDepth;
    private final boolean checkIndentation;
    private final int dents;
    private final int errorCount;

    private State(Lexer lexer) {
      this.kind = lexer.kind;
      this.start = lexer.start;
      this.end = lexer.end;
      this.raw = lexer.raw;
      this.value = lexer.value;
      this.pos = lexer.pos;
      this.indentStack = copy(lexer.indentStack);
      this.openParenStackDepth = lexer.openParenStackDepth;
      this.checkIndentation = lexer.checkIndentation;
      this.dents = lexer.dents;
      this.errorCount = lexer.errors.size();
    }
  }

  private static Stack<Integer> copy(Stack<Integer> stack) {
    Stack<Integer> result = new Stack<>();
    result.addAll(stack);
    return result;
  }

  /** Returns the current state, including the current token. */
  State save() {
    return new State(this);
  }

  /**
   * Restores a state returned by {@link #save}. Errors reported since the state was saved are
   * discarded.
   */
  void restore(State state) {
    kind = state.kind;
    start = state.start;
    end = state.end;
    raw = state.raw;
    value = state.value;
    pos = state.pos;
    indentStack = copy(state.indentStack);
    openParenStackDepth = state.openParenStackDepth;
    checkIndentation = state.checkIndentation;
    dents = state.dents;
    errors.subList(state.errorCount, errors.size()).clear();
  }

  private void popParen(char c) {
    if (openParenStackDepth == 0) {
      error("unmatched '" + c + "'", pos - 1);
    } else {
      openParenStackDepth--;
    }
  }

  private void error(String message, int pos) {
    errors.add(new SyntaxError(locs.getLocation(pos), message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
    this.raw = null;
  }

  // setValue sets the value associated with a STRING or IDENTIFIER token, and records the raw
  // text of the token.
  private void setValue(Object value) {
    this.value = value;
    this.raw = bufferSlice(start, end);
  }

  /**
   * Parses an end-of-line sequence, handling statement indentation correctly.
   *
   * <p>UNIX newlines are assumed (LF). Carriage returns are always ignored.
   */
  private void newline() {
    if (openParenStackDepth > 0) {
      newlineInsideExpression(); // in an expression: ignore space
    } else {
      checkIndentation = true;
      setToken(TokenKind.NEWLINE, pos - 1, pos);
    }
  }

  private void newlineInsideExpression() {
    while (pos < limit) {
      switch (buffer[pos]) {
        case ' ': case '\t': case '\r': case '\f':
          pos++;
          break;
        default:
          return;
      }
    }
  }

  /** Computes indentation (updates dent) and advances pos. */
  private void computeIndentation() {
    // we're in a stmt: suck up space at beginning of next line
    int indentLen = 0;
    while (pos < limit) {
      char c = buffer[pos];
      if (c == ' ') {
        indentLen++;
        pos++;
      } else if (c == '\r') {
        pos++;
      } else if (c == '\t') {
        indentLen += 8 - indentLen % 8;
        pos++;
      } else if (c == '\f') {
        indentLen = 0;
        pos++;
      } else if (c == '\n') { // entirely blank line: discard
        indentLen = 0;
        pos++;
      } else if (c == '#') { // line containing only indented comment
        while (pos < limit && buffer[pos] != '\n') {
          pos++;
        }
      } else if (c == '\\' && peek(1) == '\n') { // continuation of a blank line
        pos += 2;
      } else { // printing character
        break;
      }
    }

    if (pos == limit) {
      indentLen = 0;
    } // trailing space on last line

    int peekedIndent = indentStack.peek();
    if (peekedIndent < indentLen) { // push a level
      indentStack.push(indentLen);
      dents++;

    } else if (peekedIndent > indentLen) { // pop one or more levels
      while (peekedIndent > indentLen) {
        indentStack.pop();
        dents--;
        peekedIndent = indentStack.peek();
      }

      if (peekedIndent < indentLen) {
        error("unindent does not match any outer indentation level", pos - 1);
      }
    }
  }

  /**
   * Returns true if current position is in the middle of a triple quote
   * delimiter (3 x quot), and advances 'pos' by two if so.
   */
  private boolean skipTripleQuote(char quot) {
    if (peek(0) == quot && peek(1) == quot) {
      pos += 2;
      return true;
    } else {
      return false;
    }
  }

  /**
   * Scans a string, bytes or f-string literal delimited by 'quot'.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first delimiter. ON EXIT: 'pos' is 1 + the index
   * of the last delimiter.
   *
   * <p>An f-string is scanned as a single FSTRING token whose replacement fields are parsed later.
   * As in Python before 3.12, a field cannot contain the literal's own quote character, so the
   * closing delimiter is found without regard to braces.
   *
   * @param literalStart the offset of the first char of the prefix, or of the delimiter
   * @param prefix the string prefix, e.g. "" or "rb"
   */
  private void stringLiteral(int literalStart, String prefix, char quot) {
    String lower = Ascii.toLowerCase(prefix);
    boolean isRaw = lower.indexOf('r') >= 0;
    boolean isBytes = lower.indexOf('b') >= 0;
    TokenKind kind = lower.indexOf('f') >= 0 ? TokenKind.FSTRING : TokenKind.STRING;
    boolean inTriplequote = skipTripleQuote(quot);
    StringBuilder literal = new StringBuilder();
    while (pos < limit) {
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '\n':
          if (inTriplequote) {
            literal.append(c);
            break;
          }
          error("unclosed string literal", literalStart);
          pos--; // the newline still ends the line
          finishString(kind, literalStart, literal);
          return;
        case '\\':
          if (pos == limit) {
            break;
          }
          if (isRaw || kind == TokenKind.FSTRING) {
            // Insert \ and the following character, which cannot close the literal.
            // As in Python, it means that a raw string can never end with a single \.
            literal.append('\\').append(buffer[pos]);
            pos++;
          } else {
            escape(literal, isBytes);
          }
          break;
        case '\'':
        case '"':
          if (c != quot || (inTriplequote && !skipTripleQuote(quot))) {
            // Non-matching quote, treat it like a regular char.
            literal.append(c);
          } else {
            // Matching close-delimiter, all done.
            finishString(kind, literalStart, literal);
            return;
          }
          break;
        default:
          literal.append(c);
          break;
      }
    }
    error("unclosed string literal", literalStart);
    finishString(kind, literalStart, literal);
  }

  private void finishString(TokenKind kind, int literalStart, StringBuilder literal) {
    setToken(kind, literalStart, pos);
    setValue(kind == TokenKind.STRING ? literal.toString() : null);
  }

  /**
   * Decodes the escape sequence whose backslash has just been consumed.
   *
   * <p>ON ENTRY: 'pos' is the index of the char following the backslash.
   */
  private void escape(StringBuilder literal, boolean isBytes) {
    char c = buffer[pos];
    pos++;
    switch (c) {
      case '\r':
        if (peek(0) == '\n') {
          pos++;
        }
        break;
      case '\n':
        // ignore end of line character
        break;
      case 'n':
        literal.append('\n');
        break;
      case 'r':
        literal.append('\r');
        break;
      case 't':
        literal.append('\t');
        break;
      case 'a':
        literal.append('\u0007');
        break;
      case 'b':
        literal.append('\b');
        break;
      case 'f':
        literal.append('\f');
        break;
      case 'v':
        literal.append('\u000b');
        break;
      case '\\':
      case '\'':
      case '"':
        literal.append(c);
        break;
      case '0': case '1': case '2': case '3':
      case '4': case '5': case '6': case '7':
        { // octal escape
          int octal = c - '0';
          for (int i = 0; i < 2 && isodigit(peek(0)); i++) {
            octal = (octal << 3) | (buffer[pos] - '0');
            pos++;
          }
          literal.append((char) octal);
          break;
        }
      case 'x':
        hexEscape(literal, 2, c);
        break;
      case 'u':
      case 'U':
        if (isBytes) {
          literal.append('\\').append(c);
        } else {
          hexEscape(literal, c == 'u' ? 4 : 8, c);
        }
        break;
      default:
        // unknown char escape, or \N{name} => "\literal"
        literal.append('\\');
        literal.append(c);
        break;
    }
  }

  private void hexEscape(StringBuilder literal, int digits, char c) {
    int code = 0;
    for (int i = 0; i < digits; i++) {
      int d = peek(0);
      if (!isxdigit(d)) {
        error("truncated \\" + c + " escape sequence", pos - 1);
        return;
      }
      code = code * 16 + Character.digit(d, 16);
      pos++;
    }
    if (!Character.isValidCodePoint(code)) {
      error("invalid \\" + c + " escape sequence", pos - 1);
      return;
    }
    literal.appendCodePoint(code);
  }

  private static final Map<String, TokenKind> keywordMap = new HashMap<>();

  static {
    keywordMap.put("False", TokenKind.FALSE);
    keywordMap.put("None", TokenKind.NONE);
    keywordMap.put("True", TokenKind.TRUE);
    keywordMap.put("and", TokenKind.AND);
    keywordMap.put("as", TokenKind.AS);
    keywordMap.put("assert", TokenKind.ASSERT);
    keywordMap.put("async", TokenKind.ASYNC);
    keywordMap.put("await", TokenKind.AWAIT);
    keywordMap.put("break", TokenKind.BREAK);
    keywordMap.put("class", TokenKind.CLASS);
    keywordMap.put("continue", TokenKind.CONTINUE);
    keywordMap.put("def", TokenKind.DEF);
    keywordMap.put("del", TokenKind.DEL);
    keywordMap.put("elif", TokenKind.ELIF);
    keywordMap.put("else", TokenKind.ELSE);
    keywordMap.put("except", TokenKind.EXCEPT);
    keywordMap.put("finally", TokenKind.FINALLY);
    keywordMap.put("for", TokenKind.FOR);
    keywordMap.put("from", TokenKind.FROM);
    keywordMap.put("global", TokenKind.GLOBAL);
    keywordMap.put("if", TokenKind.IF);
    keywordMap.put("import", TokenKind.IMPORT);
    keywordMap.put("in", TokenKind.IN);
    keywordMap.put("is", TokenKind.IS);
    keywordMap.put("lambda", TokenKind.LAMBDA);
    keywordMap.put("nonlocal", TokenKind.NONLOCAL);
    keywordMap.put("not", TokenKind.NOT);
    keywordMap.put("or", TokenKind.OR);
    keywordMap.put("pass", TokenKind.PASS);
    keywordMap.put("raise", TokenKind.RAISE);
    keywordMap.put("return", TokenKind.RETURN);
    keywordMap.put("try", TokenKind.TRY);
    keywordMap.put("while", TokenKind.WHILE);
    keywordMap.put("with", TokenKind.WITH);
    keywordMap.put("yield", TokenKind.YIELD);
  }

  /** Reports whether the name is a reserved (hard) keyword of Python 3. */
  static boolean isKeyword(String name) {
    return keywordMap.containsKey(name);
  }

  /**
   * Scans an identifier, keyword, or a string literal with a prefix such as {@code rb"..."}.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier.
   * ON EXIT: 'pos' is 1 + the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    String id = scanIdentifier();
    int c = peek(0);
    if ((c == '\'' || c == '"') && STRING_PREFIXES.contains(Ascii.toLowerCase(id))) {
      pos++;
      stringLiteral(oldPos, id, (char) c);
      return;
    }
    TokenKind kind = keywordMap.get(id);
    if (kind == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      setValue(id);
    } else {
      setToken(kind, oldPos, pos);
    }
  }

  private String scanIdentifier() {
    // Keep consistent with Identifier.isValid.
    int oldPos = pos - 1;
    while (pos < limit && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    return bufferSlice(oldPos, pos);
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c > 0x7f;
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isdigit(c);
  }

  /**
   * Tokenizes a two-char operator.
   * @return true if it tokenized an operator
   */
  private boolean tokenizeTwoChars() {
    if (pos + 1 >= limit) {
      return false;
    }
    char c1 = buffer[pos];
    char c2 = buffer[pos + 1];
    TokenKind tok = null;
    if (c2 == '=') {
      tok = EQUAL_TOKENS.get(c1);
    } else if (c2 == '*' && c1 == '*' && peek(2) != '=') {
      tok = TokenKind.STAR_STAR;
    } else if (c2 == '>' && c1 == '-') {
      tok = TokenKind.ARROW;
    }
    if (tok == null) {
      return false;
    } else {
      setToken(tok, pos, pos + 2);
      return true;
    }
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < limit ? buffer[pos + i] : -1;
  }

  // Consumes a char and returns the next unconsumed char, or -1 for EOF.
  private int next() {
    pos++;
    return peek(0);
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor. At
   * least one token will be added to the tokens queue.
   */
  private void tokenize() {
    if (checkIndentation) {
      checkIndentation = false;
      computeIndentation();
    }

    // Return saved indentation tokens.
    if (dents != 0) {
      if (dents < 0) {
        dents++;
        setToken(TokenKind.OUTDENT, pos - 1, pos);
      } else {
        dents--;
        setToken(TokenKind.INDENT, pos - 1, pos);
      }
      return;
    }

    kind = null;
    while (pos < limit) {
      if (tokenizeTwoChars()) {
        pos += 2;
        return;
      }
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '{':
          setToken(TokenKind.LBRACE, pos - 1, pos);
          openParenStackDepth++;
          break;
        case '}':
          setToken(TokenKind.RBRACE, pos - 1, pos);
          popParen(c);
          break;
        case '(':
          setToken(TokenKind.LPAREN, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ')':
          setToken(TokenKind.RPAREN, pos - 1, pos);
          popParen(c);
          break;
        case '[':
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ']':
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          popParen(c);
          break;
        case '>':
          if (peek(0) == '>' && peek(1) == '=') {
            setToken(TokenKind.GREATER_GREATER_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '>') {
            setToken(TokenKind.GREATER_GREATER, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.GREATER, pos - 1, pos);
          }
          break;
        case '<':
          if (peek(0) == '<' && peek(1) == '=') {
            setToken(TokenKind.LESS_LESS_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '<') {
            setToken(TokenKind.LESS_LESS, pos - 1, pos + 1);
            pos += 1;
          } else {
            setToken(TokenKind.LESS, pos - 1, pos);
          }
          break;
        case ':':
          setToken(TokenKind.COLON, pos - 1, pos);
          break;
        case ',':
          setToken(TokenKind.COMMA, pos - 1, pos);
          break;
        case '+':
          setToken(TokenKind.PLUS, pos - 1, pos);
          break;
        case '-':
          setToken(TokenKind.MINUS, pos - 1, pos);
          break;
        case '|':
          setToken(TokenKind.PIPE, pos - 1, pos);
          break;
        case '=':
          setToken(TokenKind.EQUALS, pos - 1, pos);
          break;
        case '%':
          setToken(TokenKind.PERCENT, pos - 1, pos);
          break;
        case '~':
          setToken(TokenKind.TILDE, pos - 1, pos);
          break;
        case '&':
          setToken(TokenKind.AMPERSAND, pos - 1, pos);
          break;
        case '^':
          setToken(TokenKind.CARET, pos - 1, pos);
          break;
        case '@':
          setToken(TokenKind.AT, pos - 1, pos);
          break;
        case '/':
          if (peek(0) == '/' && peek(1) == '=') {
            setToken(TokenKind.SLASH_SLASH_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else if (peek(0) == '/') {
            setToken(TokenKind.SLASH_SLASH, pos - 1, pos + 1);
            pos += 1;
          } else {
            // /= is handled by tokenizeTwoChars.
            setToken(TokenKind.SLASH, pos - 1, pos);
          }
          break;
        case ';':
          setToken(TokenKind.SEMI, pos - 1, pos);
          break;
        case '*':
          if (peek(0) == '*' && peek(1) == '=') {
            setToken(TokenKind.STAR_STAR_EQUALS, pos - 1, pos + 2);
            pos += 2;
          } else {
            // ** and *= are handled by tokenizeTwoChars.
            setToken(TokenKind.STAR, pos - 1, pos);
          }
          break;
        case ' ':
        case '\t':
        case '\r':
        case '\f':
          /* ignore */
          break;
        case '\\':
          // Backslash character is valid only at the end of a line (or in a string)
          if (peek(0) == '\n') {
            pos += 1; // skip the end of line character
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2; // skip the CRLF at the end of line
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setValue(Character.toString(c));
          }
          break;
        case '\n':
          newline();
          break;
        case '#':
          while (pos < limit && buffer[pos] != '\n') {
            pos++;
          }
          break;
        case '\'':
        case '\"':
          stringLiteral(pos - 1, "", c);
          break;
        default:
          // int or float literal, or dot
          if (c == '.' || isdigit(c)) {
            pos--; // unconsume
            scanNumberOrDot(c);
            break;
          }

          if (isIdentifierStart(c)) {
            identifierOrKeyword();
          } else {
            error("invalid character: '" + c + "'", pos - 1);
          }
          break;
      } // switch
      if (kind != null) { // stop here if we scanned a token
        return;
      }
    } // while

    if (embedded) {
      setToken(TokenKind.EOF, pos, pos);
      return;
    }

    if (indentStack.size() > 1) { // top of stack is always zero
      setToken(TokenKind.NEWLINE, pos - 1, pos);
      while (indentStack.size() > 1) {
        indentStack.pop();
        dents--;
      }
      return;
    }

    setToken(TokenKind.EOF, pos, pos);
  }

  // Scans a number (INT or FLOAT), DOT, or ELLIPSIS. Imaginary literals are FLOAT tokens.
  // Precondition: c == peek(0) (a dot or digit)
  private void scanNumberOrDot(int c) {
    int start = this.pos;
    boolean fraction = false;
    boolean exponent = false;

    if (c == '.') {
      if (peek(1) == '.' && peek(2) == '.') {
        pos += 3;
        setToken(TokenKind.ELLIPSIS, start, pos);
        return;
      }
      // dot or start of fraction
      if (!isdigit(peek(1))) {
        pos++; // consume '.'
        setToken(TokenKind.DOT, start, pos);
        return;
      }
      fraction = true;

    } else if (c == '0') {
      // hex, octal, binary or float
      c = next();
      if (c == 'x' || c == 'X') {
        // hex
        c = next();
        if (!isxdigit(c) && c != '_') {
          error("invalid hexadecimal literal", start);
        }
        while (isxdigit(c) || c == '_') {
          c = next();
        }

      } else if (c == 'o' || c == 'O') {
        // octal
        c = next();
        if (!isodigit(c) && c != '_') {
          error("invalid octal literal", start);
        }
        while (isodigit(c) || c == '_') {
          c = next();
        }

      } else if (c == 'b' || c == 'B') {
        // binary
        c = next();
        if (!isbdigit(c) && c != '_') {
          error("invalid binary literal", start);
        }
        while (isbdigit(c) || c == '_') {
          c = next();
        }

      } else {
        // "0" or float
        while (isdigit(c) || c == '_') {
          c = next();
        }
        if (c == '.') {
          fraction = true;
        } else if (c == 'e' || c == 'E') {
          exponent = true;
        }
      }

    } else {
      // decimal
      while (isdigit(c) || c == '_') {
        c = next();
      }
      if (c == '.') {
        fraction = true;
      } else if (c == 'e' || c == 'E') {
        exponent = true;
      }
    }

    if (fraction) {
      c = next(); // consume '.'
      while (isdigit(c) || c == '_') {
        c = next();
      }

      if (c == 'e' || c == 'E') {
        exponent = true;
      }
    }

    if (exponent) {
      c = next(); // consume [eE]
      if (c == '+' || c == '-') {
        c = next();
      }
      if (!isdigit(c)) {
        error("invalid float literal", start);
      }
      while (isdigit(c) || c == '_') {
        c = next();
      }
    }

    boolean imaginary = false;
    if (c == 'j' || c == 'J') {
      imaginary = true;
      next();
    }

    setToken(fraction || exponent || imaginary ? TokenKind.FLOAT : TokenKind.INT, start, pos);
    this.raw = bufferSlice(start, pos);
    if (raw.endsWith("_") || raw.contains("__")) {
      error("invalid decimal literal", start);
    }
  }

  private static boolean isdigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isodigit(int c) {
    return '0' <= c && c <= '7';
  }

  private static boolean isxdigit(int c) {
    return isdigit(c) || ('A' <= c && c <= 'F') || ('a' <= c && c <= 'f');
  }

  private static boolean isbdigit(int c) {
    return c == '0' || c == '1';
  }

  /**
   * Returns parts of the source buffer based on offsets
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }

  // Returns the char at the given offset of the input buffer.
  char charAt(int offset) {
    return buffer[offset];
  }
}
