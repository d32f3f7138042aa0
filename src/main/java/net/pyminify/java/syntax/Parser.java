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
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/** Parser is a recursive-descent parser for Python 3. */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    // Maps char offsets in the file to Locations.
    final FileLocations locs;

    /** The top-level statements of the parsed file. */
    final ImmutableList<Statement> statements;

    // Errors encountered during scanning or parsing.
    // These lists are ultimately owned by PythonFile.
    final List<SyntaxError> errors;

    private ParseResult(
        FileLocations locs, ImmutableList<Statement> statements, List<SyntaxError> errors) {
      this.locs = locs;
      // No need to copy here; when the object is created, the parser instance is just about to go
      // out of scope and be garbage collected.
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
    }
  }

  private static final EnumSet<TokenKind> STATEMENT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.NEWLINE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> LIST_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.RBRACKET, TokenKind.SEMI);

  private static final EnumSet<TokenKind> DICT_TERMINATOR_SET =
      EnumSet.of(TokenKind.EOF, TokenKind.RBRACE, TokenKind.SEMI);

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.EOF,
          TokenKind.EQUALS,
          TokenKind.NEWLINE,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN,
          TokenKind.SEMI);

  /** Current lookahead token. May be mutated by the parser. */
  private final Lexer token; // token.kind is a prettier alias for lexer.kind

  private final FileOptions options;

  private final Lexer lexer;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  private static final Map<TokenKind, TokenKind> augmentedAssignments =
      new ImmutableMap.Builder<TokenKind, TokenKind>()
          .put(TokenKind.PLUS_EQUALS, TokenKind.PLUS)
          .put(TokenKind.MINUS_EQUALS, TokenKind.MINUS)
          .put(TokenKind.STAR_EQUALS, TokenKind.STAR)
          .put(TokenKind.SLASH_EQUALS, TokenKind.SLASH)
          .put(TokenKind.SLASH_SLASH_EQUALS, TokenKind.SLASH_SLASH)
          .put(TokenKind.PERCENT_EQUALS, TokenKind.PERCENT)
          .put(TokenKind.AMPERSAND_EQUALS, TokenKind.AMPERSAND)
          .put(TokenKind.CARET_EQUALS, TokenKind.CARET)
          .put(TokenKind.PIPE_EQUALS, TokenKind.PIPE)
          .put(TokenKind.GREATER_GREATER_EQUALS, TokenKind.GREATER_GREATER)
          .put(TokenKind.LESS_LESS_EQUALS, TokenKind.LESS_LESS)
          .put(TokenKind.AT_EQUALS, TokenKind.AT)
          .put(TokenKind.STAR_STAR_EQUALS, TokenKind.STAR_STAR)
          .buildOrThrow();

  /**
   * Highest precedence goes last. Based on:
   * https://docs.python.org/3/reference/expressions.html#operator-precedence
   *
   * <p>Unary operators, {@code **} and {@code await} bind tighter than every level listed here and
   * are handled by {@link #parseFactor}.
   */
  private static final List<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.of(
              TokenKind.EQUALS_EQUALS,
              TokenKind.NOT_EQUALS,
              TokenKind.LESS,
              TokenKind.LESS_EQUALS,
              TokenKind.GREATER,
              TokenKind.GREATER_EQUALS,
              TokenKind.IN,
              TokenKind.NOT_IN,
              TokenKind.IS,
              TokenKind.IS_NOT),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.GREATER_GREATER, TokenKind.LESS_LESS),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(
              TokenKind.SLASH,
              TokenKind.SLASH_SLASH,
              TokenKind.STAR,
              TokenKind.PERCENT,
              TokenKind.AT));

  // Indices into operatorPrecedence.
  private static final int NOT_PREC = 2;
  private static final int COMPARISON_PREC = 3;
  private static final int BITWISE_OR_PREC = 4;
  private static final int ARITH_PREC = 8;

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  // Intern string literals, as some files contain many literals for the same string.
  private final Map<String, String> stringInterner = new HashMap<>();

  private Parser(Lexer lexer, List<SyntaxError> errors, FileOptions options) {
    this.lexer = lexer;
    this.locs = lexer.locs;
    this.errors = errors;
    this.token = lexer;
    this.options = options;
    nextToken();
  }

  private String intern(String s) {
    String prev = stringInterner.putIfAbsent(s, s);
    return prev != null ? prev : s;
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(TokenKind kind, @Nullable Object value) {
    return kind == TokenKind.STRING
        ? "\"" + value + "\""
        : value == null ? kind.toString() : value.toString();
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input, FileOptions options) {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors, options);
    ImmutableList<Statement> statements = parser.parseFileInput();
    return new ParseResult(lexer.locs, statements, errors);
  }

  /** Parses an expression, possibly followed by newlines. */
  static Expression parseExpression(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(input, errors);
    Parser parser = new Parser(lexer, errors, options);
    Expression result = null;
    try {
      result = parser.parseExpr();
      while (parser.token.kind == TokenKind.NEWLINE) {
        parser.nextToken();
      }
      parser.expect(TokenKind.EOF);
    } catch (StackOverflowError ex) {
      // See rationale at parseFileInput.
      parser.reportError(
          lexer.end,
          "internal error: stack overflow while parsing Python expression <<%s>>. Please report"
              + " the bug.\n"
              + "%s",
          new String(input.getContent()),
          Throwables.getStackTraceAsString(ex));
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      Location location = locs.getLocation(offset);
      errors.add(new SyntaxError(location, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    syntaxError(token.start, token.kind, token.value, message);
  }

  private void syntaxError(int offset, TokenKind tokenKind, Object tokenValue, String message) {
    if (!recoveryMode) {
      if (tokenKind == TokenKind.INDENT) {
        reportError(offset, "indentation error");
      } else {
        reportError(
            offset, "syntax error at '%s': %s", tokenString(tokenKind, tokenValue), message);
      }
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns its position, like nextToken.
  // Reports a syntax error if the new token is not of the expected kind.
  private int expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Like expect, but stops recovery mode if the token was expected.
  private int expectAndRecover(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    } else {
      recoveryMode = false;
    }
    return nextToken();
  }

  // Consumes tokens past the first token belonging to terminatingTokens.
  // It returns the end offset of the terminating token.
  private int syncPast(EnumSet<TokenKind> terminatingTokens) {
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
    }
    int end = token.end;
    // read past the synchronization token
    nextToken();
    return end;
  }

  /**
   * Consume tokens until we reach the first token that has a kind that is in the set of
   * terminatingTokens.
   *
   * @return the end offset of the last token consumed.
   */
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    // read past the problematic token
    int previous = token.end;
    nextToken();
    int current = previous;
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
      previous = current;
      current = token.end;
    }
    return previous;
  }

  private int nextToken() {
    int prev = token.start;
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
    return prev;
  }

  // Returns the kind of the token after the current one, without consuming anything.
  private TokenKind peekKind() {
    if (token.kind == TokenKind.EOF) {
      return TokenKind.EOF;
    }
    Lexer.State state = lexer.save();
    lexer.nextToken();
    TokenKind next = token.kind;
    lexer.restore(state);
    return next;
  }

  // Reports whether the current token is the given soft keyword, such as "match" or "case".
  private boolean atSoftKeyword(String keyword) {
    return token.kind == TokenKind.IDENTIFIER && keyword.equals(token.value);
  }

  // Returns an "Identifier" whose content is the input from start to end.
  private Identifier makeErrorExpression(int start, int end) {
    // It's tempting to define a dedicated BadExpression type,
    // but it is convenient for parseIdent to return an Identifier
    // even when it fails.
    return new Identifier(locs, lexer.bufferSlice(start, end), start);
  }

  // A speculative parse. The parser state is captured on creation, and either kept by commit or
  // rolled back by abandon.
  private final class Speculation {
    private final Lexer.State state = lexer.save();
    private final int savedErrorsCount = errorsCount;
    private final int savedErrorListSize = errors.size();
    private final boolean savedRecoveryMode = recoveryMode;

    Speculation() {
      // Errors must be observable while speculating.
      recoveryMode = false;
    }

    boolean failed() {
      return errorsCount != savedErrorsCount || errors.size() != savedErrorListSize;
    }

    void commit() {
      recoveryMode = savedRecoveryMode;
    }

    void abandon() {
      lexer.restore(state);
      errorsCount = savedErrorsCount;
      recoveryMode = savedRecoveryMode;
    }
  }

  // file_input = ('\n' | stmt)* EOF
  // The terminating newline is injected by the lexer even if not present in the input.
  private ImmutableList<Statement> parseFileInput() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    try {
      while (token.kind != TokenKind.EOF) {
        if (token.kind == TokenKind.NEWLINE) {
          expectAndRecover(TokenKind.NEWLINE);
        } else if (recoveryMode) {
          // If there was a parse error, we want to recover here
          // before starting a new top-level statement.
          syncTo(STATEMENT_TERMINATOR_SET);
          recoveryMode = false;
        } else {
          parseStatement(list);
        }
      }
    } catch (StackOverflowError ex) {
      // JVM threads have very limited stack, and deeply nested inputs can
      // easily cause the parser to consume all available stack. It is hard
      // to anticipate all the possible recursions in the parser, especially
      // when considering error recovery.
      //
      // So, for robustness, the parser treats StackOverflowError as a parse
      // error, exhorting the user to report a bug.
      reportError(
          token.end,
          "internal error: stack overflow in parser. Please report the bug and include the text"
              + " of %s.\n"
              + "%s",
          locs.file(),
          Throwables.getStackTraceAsString(ex));
    }
    return list.build();
  }

  // stmt = simple_stmt
  //      | decorated | async_stmt | class_stmt | def_stmt
  //      | for_stmt | if_stmt | match_stmt | try_stmt | while_stmt | with_stmt
  private void parseStatement(ImmutableList.Builder<Statement> list) {
    switch (token.kind) {
      case AT -> list.add(parseDecoratedStatement());
      case ASYNC -> list.add(parseAsyncStatement());
      case CLASS -> list.add(parseClassStatement(token.start, ImmutableList.of()));
      case DEF -> list.add(parseDefStatement(token.start, ImmutableList.of(), false));
      case FOR -> list.add(parseForStatement(token.start, false));
      case IF -> list.add(parseIfStatement());
      case TRY -> list.add(parseTryStatement());
      case WHILE -> list.add(parseWhileStatement());
      case WITH -> list.add(parseWithStatement(token.start, false));
      default -> {
        MatchStatement match = atSoftKeyword("match") ? tryParseMatchStatement() : null;
        if (match != null) {
          list.add(match);
        } else {
          parseSimpleStatement(list);
        }
      }
    }
  }

  // Returns a placeholder for a statement that could not be parsed, and skips to its end.
  private Statement makeErrorStatement(int start) {
    int end = syncTo(STATEMENT_TERMINATOR_SET);
    return new ExpressionStatement(locs, makeErrorExpression(start, end));
  }

  // decorated = ('@' test NEWLINE)+ (class_stmt | ['async'] def_stmt)
  private Statement parseDecoratedStatement() {
    int startOffset = token.start;
    ImmutableList.Builder<Expression> decorators = ImmutableList.builder();
    while (token.kind == TokenKind.AT) {
      nextToken();
      decorators.add(parseTest());
      expect(TokenKind.NEWLINE);
    }
    switch (token.kind) {
      case CLASS:
        return parseClassStatement(startOffset, decorators.build());
      case DEF:
        return parseDefStatement(startOffset, decorators.build(), false);
      case ASYNC:
        nextToken();
        return parseDefStatement(startOffset, decorators.build(), true);
      default:
        syntaxError("expected 'def' or 'class' after decorator");
        return makeErrorStatement(startOffset);
    }
  }

  // async_stmt = 'async' (def_stmt | for_stmt | with_stmt)
  private Statement parseAsyncStatement() {
    int asyncOffset = expect(TokenKind.ASYNC);
    switch (token.kind) {
      case DEF:
        return parseDefStatement(asyncOffset, ImmutableList.of(), true);
      case FOR:
        return parseForStatement(asyncOffset, true);
      case WITH:
        return parseWithStatement(asyncOffset, true);
      default:
        syntaxError("expected 'def', 'for' or 'with' after 'async'");
        return makeErrorStatement(asyncOffset);
    }
  }

  // def_stmt = DEF IDENTIFIER optional_type_parameters '(' parameters ')' ['->' test] ':' suite
  private DefStatement parseDefStatement(
      int startOffset, ImmutableList<Expression> decorators, boolean isAsync) {
    expect(TokenKind.DEF);
    Identifier ident = parseStoreIdent();
    ImmutableList<TypeParameter> typeParams = parseOptionalTypeParameters();
    expect(TokenKind.LPAREN);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ true);
    expect(TokenKind.RPAREN);
    Expression returns = null;
    if (token.kind == TokenKind.ARROW) {
      nextToken();
      returns = parseTest();
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return new DefStatement(
        locs, startOffset, decorators, isAsync, ident, typeParams, params, returns, block);
  }

  // class_stmt = CLASS IDENTIFIER optional_type_parameters ['(' arguments ')'] ':' suite
  private ClassStatement parseClassStatement(
      int startOffset, ImmutableList<Expression> decorators) {
    expect(TokenKind.CLASS);
    Identifier ident = parseStoreIdent();
    ImmutableList<TypeParameter> typeParams = parseOptionalTypeParameters();
    ImmutableList<Argument> bases = ImmutableList.of();
    boolean hasParens = false;
    if (token.kind == TokenKind.LPAREN) {
      int lparenOffset = nextToken();
      hasParens = true;
      bases = parseArguments(lparenOffset);
      expect(TokenKind.RPAREN);
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> block = parseSuite();
    return new ClassStatement(
        locs, startOffset, decorators, ident, typeParams, bases, hasParens, block);
  }

  // Parse a list of function or lambda parameters.
  //
  // A '/' marker makes all preceding parameters positional-only; it does not appear in the list.
  private ImmutableList<Parameter> parseParameters(boolean defStatement) {
    boolean hasParam = false;
    boolean hasSlash = false;
    List<Parameter> list = new ArrayList<>();

    while (token.kind != TokenKind.RPAREN
        && token.kind != TokenKind.COLON
        && token.kind != TokenKind.EOF) {
      if (hasParam) {
        expect(TokenKind.COMMA);
        // The list may end with a comma.
        if (token.kind == TokenKind.RPAREN || token.kind == TokenKind.COLON) {
          break;
        }
      }
      hasParam = true;
      if (token.kind == TokenKind.SLASH) {
        int slashOffset = nextToken();
        if (list.isEmpty() || hasSlash) {
          reportError(slashOffset, "'/' must follow at least one parameter, and appear once");
        }
        hasSlash = true;
        for (Parameter param : list) {
          param.setPositionalOnly(true);
        }
        continue;
      }
      list.add(parseParameter(defStatement));
    }
    return ImmutableList.copyOf(list);
  }

  // param = IDENTIFIER [':' test] ['=' test]
  //       | '*' [IDENTIFIER [':' star_or_test]]
  //       | '**' IDENTIFIER [':' test]
  // Annotations are only available on def statements (not lambdas).
  private Parameter parseParameter(boolean defStatement) {
    Expression annotation = null;

    // **kwargs
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      Identifier id = parseStoreIdent();
      if (defStatement && token.kind == TokenKind.COLON) {
        nextToken();
        annotation = parseTest();
      }
      return new Parameter.StarStar(locs, starStarOffset, id, annotation);
    }

    // * or *args
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      if (token.kind != TokenKind.IDENTIFIER) {
        return new Parameter.Star(locs, starOffset, null, null);
      }
      Identifier id = parseStoreIdent();
      if (defStatement && token.kind == TokenKind.COLON) {
        nextToken();
        annotation = parseStarOrTest();
      }
      return new Parameter.Star(locs, starOffset, id, annotation);
    }

    Identifier id = parseStoreIdent();
    if (defStatement && token.kind == TokenKind.COLON) {
      nextToken();
      annotation = parseTest();
    }
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      Expression defaultValue = parseTest();
      return new Parameter.Optional(locs, id, annotation, defaultValue);
    }
    return new Parameter.Mandatory(locs, id, annotation);
  }

  // optional_type_parameters = ['[' type_param (',' type_param)* [','] ']']
  private ImmutableList<TypeParameter> parseOptionalTypeParameters() {
    if (token.kind != TokenKind.LBRACKET) {
      return ImmutableList.of();
    }
    if (!options.allowTypeParameters()) {
      reportError(token.start, "type parameter lists are not supported");
    }
    nextToken();
    ImmutableList.Builder<TypeParameter> parameters = ImmutableList.builder();
    Set<String> uniqueParameterNames = new HashSet<>();
    parameters.add(parseTypeParameter(uniqueParameterNames));
    while (token.kind != TokenKind.RBRACKET && token.kind != TokenKind.EOF) {
      expect(TokenKind.COMMA);
      if (token.kind == TokenKind.RBRACKET) {
        break;
      }
      parameters.add(parseTypeParameter(uniqueParameterNames));
    }
    expect(TokenKind.RBRACKET);
    return parameters.build();
  }

  // type_param = IDENTIFIER [':' test] ['=' test]
  //            | '*' IDENTIFIER ['=' star_or_test]
  //            | '**' IDENTIFIER ['=' test]
  private TypeParameter parseTypeParameter(Set<String> uniqueParameterNames) {
    int startOffset = token.start;
    TypeParameter.TypeParameterKind kind = TypeParameter.TypeParameterKind.TYPE_VAR;
    if (token.kind == TokenKind.STAR) {
      nextToken();
      kind = TypeParameter.TypeParameterKind.TYPE_VAR_TUPLE;
    } else if (token.kind == TokenKind.STAR_STAR) {
      nextToken();
      kind = TypeParameter.TypeParameterKind.PARAM_SPEC;
    }
    int tokenStart = token.start;
    TokenKind tokenKind = token.kind;
    Object tokenValue = token.value;
    Identifier name = parseStoreIdent();
    // If parseIdent() encountered a syntax error, Identifier.isValid(name.getName()) would be
    // false, and in that case, there's no need to check for the name's uniqueness.
    if (Identifier.isValid(name.getName()) && !uniqueParameterNames.add(name.getName())) {
      syntaxError(tokenStart, tokenKind, tokenValue, "duplicate type parameter");
    }
    Expression bound = null;
    if (kind == TypeParameter.TypeParameterKind.TYPE_VAR && token.kind == TokenKind.COLON) {
      nextToken();
      bound = parseTest();
    }
    Expression defaultValue = null;
    if (token.kind == TokenKind.EQUALS) {
      nextToken();
      defaultValue =
          kind == TypeParameter.TypeParameterKind.TYPE_VAR_TUPLE
              ? parseStarOrTest()
              : parseTest();
    }
    return new TypeParameter(locs, kind, startOffset, name, bound, defaultValue);
  }

  // suite is typically what follows a colon (e.g. after def or for).
  // suite = simple_stmt
  //       | NEWLINE INDENT stmt+ OUTDENT
  private ImmutableList<Statement> parseSuite() {
    ImmutableList.Builder<Statement> list = ImmutableList.builder();
    if (token.kind == TokenKind.NEWLINE) {
      expect(TokenKind.NEWLINE);
      if (token.kind != TokenKind.INDENT) {
        reportError(token.start, "expected an indented block");
        return list.build();
      }
      expect(TokenKind.INDENT);
      while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
        parseStatement(list);
      }
      expectAndRecover(TokenKind.OUTDENT);
    } else {
      parseSimpleStatement(list);
    }
    return list.build();
  }

  // simple_stmt = small_stmt (';' small_stmt)* ';'? NEWLINE
  private void parseSimpleStatement(ImmutableList.Builder<Statement> list) {
    list.add(parseSmallStatement());

    while (token.kind == TokenKind.SEMI) {
      nextToken();
      if (token.kind == TokenKind.NEWLINE) {
        break;
      }
      list.add(parseSmallStatement());
    }
    expectAndRecover(TokenKind.NEWLINE);
  }

  //     small_stmt = assign_stmt
  //                | expr
  //                | return_stmt | raise_stmt | del_stmt | assert_stmt
  //                | import_stmt | global_stmt | nonlocal_stmt
  //                | BREAK | CONTINUE | PASS
  //
  //     assign_stmt = (target '=')+ (yield_expr | star_exprs)
  //                 | target ':' test ['=' (yield_expr | star_exprs)]
  //                 | target augassign (yield_expr | star_exprs)
  private Statement parseSmallStatement() {
    switch (token.kind) {
      case RETURN:
        return parseReturnStatement();
      case BREAK:
      case CONTINUE:
      case PASS:
        {
          TokenKind kind = token.kind;
          int offset = nextToken();
          return new FlowStatement(locs, kind, offset);
        }
      case RAISE:
        return parseRaiseStatement();
      case GLOBAL:
      case NONLOCAL:
        return parseDeclarationStatement();
      case DEL:
        return parseDelStatement();
      case ASSERT:
        return parseAssertStatement();
      case IMPORT:
        return parseImportStatement();
      case FROM:
        return parseImportFromStatement();
      default:
        break;
    }

    // "type" is a keyword iff it precedes an identifier, as in a type alias statement.
    if (atSoftKeyword("type") && peekKind() == TokenKind.IDENTIFIER) {
      int start = token.start;
      reportError(start, "type alias statements are not supported");
      return makeErrorStatement(start);
    }

    Expression lhs = parseYieldOrStarExpressions();

    // lhs: annotation [= rhs]
    if (token.kind == TokenKind.COLON) {
      nextToken();
      if (lhs instanceof ListExpression) {
        reportError(lhs.getStartOffset(), "only single target (not tuple) can be annotated");
      }
      setTargetContext(lhs, Identifier.Context.STORE);
      Expression annotation = parseTest();
      Expression rhs = null;
      if (token.kind == TokenKind.EQUALS) {
        nextToken();
        rhs = parseYieldOrStarExpressions();
      }
      return new AssignmentStatement(locs, ImmutableList.of(lhs), annotation, null, rhs);
    }

    // lhs += rhs
    TokenKind op = augmentedAssignments.get(token.kind);
    if (op != null) {
      nextToken();
      if (lhs instanceof Identifier
          || lhs instanceof DotExpression
          || lhs instanceof IndexExpression) {
        setTargetContext(lhs, Identifier.Context.STORE);
      } else {
        reportError(lhs.getStartOffset(), "illegal expression for augmented assignment");
      }
      Expression rhs = parseYieldOrStarExpressions();
      return new AssignmentStatement(locs, ImmutableList.of(lhs), null, op, rhs);
    }

    // lhs = ... = rhs
    if (token.kind == TokenKind.EQUALS) {
      List<Expression> exprs = new ArrayList<>();
      exprs.add(lhs);
      while (token.kind == TokenKind.EQUALS) {
        nextToken();
        exprs.add(parseYieldOrStarExpressions());
      }
      Expression rhs = exprs.remove(exprs.size() - 1);
      for (Expression target : exprs) {
        setTargetContext(target, Identifier.Context.STORE);
      }
      return new AssignmentStatement(locs, ImmutableList.copyOf(exprs), null, null, rhs);
    }

    return new ExpressionStatement(locs, lhs);
  }

  // Marks the identifiers of an assignment or deletion target with the given context, and reports
  // an error if the expression cannot be a target.
  private void setTargetContext(Expression expr, Identifier.Context context) {
    switch (expr.kind()) {
      case IDENTIFIER:
        ((Identifier) expr).setContext(context);
        return;
      case LIST_EXPR:
        for (Expression elem : ((ListExpression) expr).getElements()) {
          setTargetContext(elem, context);
        }
        return;
      case STARRED:
        if (context != Identifier.Context.DEL) {
          setTargetContext(((StarredExpression) expr).getValue(), context);
          return;
        }
        break;
      case DOT:
      case INDEX:
        return;
      default:
        break;
    }
    reportError(
        expr.getStartOffset(),
        "cannot %s %s",
        context == Identifier.Context.DEL ? "delete" : "assign to",
        "this expression");
  }

  // return_stmt = RETURN [star_exprs]
  private ReturnStatement parseReturnStatement() {
    int returnOffset = expect(TokenKind.RETURN);

    Expression result = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      result = parseExpr();
    }
    return new ReturnStatement(locs, returnOffset, result);
  }

  // raise_stmt = RAISE [test [FROM test]]
  private RaiseStatement parseRaiseStatement() {
    int raiseOffset = expect(TokenKind.RAISE);
    Expression exception = null;
    Expression cause = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind)) {
      exception = parseTest();
      if (token.kind == TokenKind.FROM) {
        nextToken();
        cause = parseTest();
      }
    }
    return new RaiseStatement(locs, raiseOffset, exception, cause);
  }

  // global_stmt = GLOBAL IDENTIFIER (',' IDENTIFIER)*
  // nonlocal_stmt = NONLOCAL IDENTIFIER (',' IDENTIFIER)*
  private DeclarationStatement parseDeclarationStatement() {
    TokenKind kind = token.kind;
    int offset = nextToken();
    ImmutableList.Builder<Identifier> names = ImmutableList.builder();
    names.add(parseIdent());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      names.add(parseIdent());
    }
    return new DeclarationStatement(locs, kind, offset, names.build());
  }

  // del_stmt = DEL target (',' target)* [',']
  private DelStatement parseDelStatement() {
    int delOffset = expect(TokenKind.DEL);
    ImmutableList.Builder<Expression> targets = ImmutableList.builder();
    targets.add(parseDelTarget());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (STATEMENT_TERMINATOR_SET.contains(token.kind)) {
        break;
      }
      targets.add(parseDelTarget());
    }
    return new DelStatement(locs, delOffset, targets.build());
  }

  private Expression parseDelTarget() {
    Expression target = parsePrimaryWithSuffix();
    setTargetContext(target, Identifier.Context.DEL);
    return target;
  }

  // assert_stmt = ASSERT test [',' test]
  private AssertStatement parseAssertStatement() {
    int assertOffset = expect(TokenKind.ASSERT);
    Expression condition = parseTest();
    Expression message = null;
    if (token.kind == TokenKind.COMMA) {
      nextToken();
      message = parseTest();
    }
    return new AssertStatement(locs, assertOffset, condition, message);
  }

  // import_stmt = IMPORT dotted_as_name (',' dotted_as_name)*
  private ImportStatement parseImportStatement() {
    int importOffset = expect(TokenKind.IMPORT);
    ImmutableList.Builder<ImportStatement.Alias> aliases = ImmutableList.builder();
    aliases.add(parseDottedAsName());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      aliases.add(parseDottedAsName());
    }
    return new ImportStatement(locs, importOffset, aliases.build());
  }

  // dotted_as_name = dotted_name [AS IDENTIFIER]
  //
  // Without an alias, "import a.b.c" binds the root package name, "a".
  private ImportStatement.Alias parseDottedAsName() {
    int startOffset = token.start;
    String name = parseDottedName();
    if (token.kind == TokenKind.AS) {
      nextToken();
      Identifier local = parseStoreIdent();
      return new ImportStatement.Alias(locs, startOffset, name, local, /* explicit= */ true);
    }
    int dot = name.indexOf('.');
    String root = dot < 0 ? name : name.substring(0, dot);
    Identifier local = new Identifier(locs, root, startOffset, Identifier.Context.STORE);
    return new ImportStatement.Alias(locs, startOffset, name, local, /* explicit= */ false);
  }

  // dotted_name = IDENTIFIER ('.' IDENTIFIER)*
  private String parseDottedName() {
    StringBuilder name = new StringBuilder(parseIdent().getName());
    while (token.kind == TokenKind.DOT) {
      nextToken();
      name.append('.').append(parseIdent().getName());
    }
    return intern(name.toString());
  }

  // import_from = FROM ('.' | '...')* dotted_name IMPORT import_targets
  //             | FROM ('.' | '...')+ IMPORT import_targets
  // import_targets = '*' | '(' import_as_names [','] ')' | import_as_names
  private ImportFromStatement parseImportFromStatement() {
    int fromOffset = expect(TokenKind.FROM);
    int level = 0;
    while (token.kind == TokenKind.DOT || token.kind == TokenKind.ELLIPSIS) {
      level += token.kind == TokenKind.DOT ? 1 : 3;
      nextToken();
    }
    String module = null;
    if (level == 0 || token.kind != TokenKind.IMPORT) {
      module = parseDottedName();
    }
    expect(TokenKind.IMPORT);

    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      return new ImportFromStatement(
          locs, fromOffset, level, module, ImmutableList.of(), /* isStar= */ true, starOffset + 1);
    }

    boolean parenthesized = token.kind == TokenKind.LPAREN;
    if (parenthesized) {
      nextToken();
    }
    ImmutableList.Builder<ImportStatement.Alias> builder = ImmutableList.builder();
    builder.add(parseImportAsName());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (parenthesized && token.kind == TokenKind.RPAREN) {
        break;
      }
      builder.add(parseImportAsName());
    }
    ImmutableList<ImportStatement.Alias> aliases = builder.build();
    int endOffset =
        parenthesized
            ? expect(TokenKind.RPAREN) + 1
            : aliases.get(aliases.size() - 1).getEndOffset();
    return new ImportFromStatement(
        locs, fromOffset, level, module, aliases, /* isStar= */ false, endOffset);
  }

  // import_as_name = IDENTIFIER [AS IDENTIFIER]
  private ImportStatement.Alias parseImportAsName() {
    int startOffset = token.start;
    Identifier name = parseIdent();
    if (token.kind == TokenKind.AS) {
      nextToken();
      Identifier local = parseStoreIdent();
      return new ImportStatement.Alias(
          locs, startOffset, name.getName(), local, /* explicit= */ true);
    }
    name.setContext(Identifier.Context.STORE);
    return new ImportStatement.Alias(
        locs, startOffset, name.getName(), name, /* explicit= */ false);
  }

  // if_stmt = IF test ':' suite [ELIF test ':' suite]* [ELSE ':' suite]?
  private IfStatement parseIfStatement() {
    int ifOffset = expect(TokenKind.IF);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    IfStatement ifStmt = new IfStatement(locs, TokenKind.IF, ifOffset, cond, body);
    IfStatement tail = ifStmt;
    while (token.kind == TokenKind.ELIF) {
      int elifOffset = expect(TokenKind.ELIF);
      cond = parseTest();
      expect(TokenKind.COLON);
      body = parseSuite();
      IfStatement elif = new IfStatement(locs, TokenKind.ELIF, elifOffset, cond, body);
      tail.setElseBlock(ImmutableList.of(elif));
      tail = elif;
    }
    if (token.kind == TokenKind.ELSE) {
      expect(TokenKind.ELSE);
      expect(TokenKind.COLON);
      body = parseSuite();
      tail.setElseBlock(body);
    }
    return ifStmt;
  }

  // [ELSE ':' suite]
  private ImmutableList<Statement> parseOptionalElse() {
    if (token.kind != TokenKind.ELSE) {
      return ImmutableList.of();
    }
    nextToken();
    expect(TokenKind.COLON);
    return parseSuite();
  }

  // while_stmt = WHILE test ':' suite [ELSE ':' suite]
  private WhileStatement parseWhileStatement() {
    int whileOffset = expect(TokenKind.WHILE);
    Expression cond = parseTest();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return new WhileStatement(locs, whileOffset, cond, body, elseBlock);
  }

  // for_stmt = FOR target_list IN star_exprs ':' suite [ELSE ':' suite]
  private ForStatement parseForStatement(int startOffset, boolean isAsync) {
    expect(TokenKind.FOR);
    Expression vars = parseTargetList();
    setTargetContext(vars, Identifier.Context.STORE);
    expect(TokenKind.IN);
    Expression iterable = parseExpr();
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    ImmutableList<Statement> elseBlock = parseOptionalElse();
    return new ForStatement(locs, startOffset, isAsync, vars, iterable, body, elseBlock);
  }

  // with_stmt = WITH '(' with_item (',' with_item)* [','] ')' ':' suite
  //           | WITH with_item (',' with_item)* ':' suite
  private WithStatement parseWithStatement(int startOffset, boolean isAsync) {
    expect(TokenKind.WITH);
    ImmutableList<WithStatement.Item> items = null;
    if (token.kind == TokenKind.LPAREN) {
      items = tryParseParenthesizedWithItems();
    }
    if (items == null) {
      ImmutableList.Builder<WithStatement.Item> builder = ImmutableList.builder();
      builder.add(parseWithItem());
      while (token.kind == TokenKind.COMMA) {
        nextToken();
        builder.add(parseWithItem());
      }
      items = builder.build();
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    return new WithStatement(locs, startOffset, isAsync, items, body);
  }

  // Parses a parenthesized list of with-items, or returns null (consuming nothing) if the
  // parenthesis instead begins the context expression, as in "with (a) as b:".
  @Nullable
  private ImmutableList<WithStatement.Item> tryParseParenthesizedWithItems() {
    Speculation speculation = new Speculation();
    nextToken();
    ImmutableList.Builder<WithStatement.Item> items = ImmutableList.builder();
    items.add(parseWithItem());
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RPAREN) {
        break;
      }
      items.add(parseWithItem());
    }
    if (speculation.failed()
        || token.kind != TokenKind.RPAREN
        || peekKind() != TokenKind.COLON) {
      speculation.abandon();
      return null;
    }
    speculation.commit();
    nextToken();
    return items.build();
  }

  // with_item = test [AS target]
  private WithStatement.Item parseWithItem() {
    Expression context = parseTest();
    Expression target = null;
    if (token.kind == TokenKind.AS) {
      nextToken();
      target = parseTarget();
      setTargetContext(target, Identifier.Context.STORE);
    }
    return new WithStatement.Item(locs, context, target);
  }

  // try_stmt = TRY ':' suite except_clause+ [ELSE ':' suite] [FINALLY ':' suite]
  //          | TRY ':' suite FINALLY ':' suite
  // except_clause = EXCEPT ['*'] [test [AS IDENTIFIER]] ':' suite
  private TryStatement parseTryStatement() {
    int tryOffset = expect(TokenKind.TRY);
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();

    ImmutableList.Builder<TryStatement.ExceptHandler> builder = ImmutableList.builder();
    boolean isStar = false;
    while (token.kind == TokenKind.EXCEPT) {
      int exceptOffset = nextToken();
      if (token.kind == TokenKind.STAR) {
        nextToken();
        isStar = true;
      }
      Expression type = null;
      Identifier name = null;
      if (token.kind != TokenKind.COLON) {
        type = parseTest();
        if (token.kind == TokenKind.AS) {
          nextToken();
          name = parseStoreIdent();
        }
      }
      expect(TokenKind.COLON);
      ImmutableList<Statement> handlerBody = parseSuite();
      builder.add(new TryStatement.ExceptHandler(locs, exceptOffset, type, name, handlerBody));
    }
    ImmutableList<TryStatement.ExceptHandler> handlers = builder.build();

    ImmutableList<Statement> elseBlock = ImmutableList.of();
    if (token.kind == TokenKind.ELSE) {
      if (handlers.isEmpty()) {
        syntaxError("expected 'except' or 'finally' block");
      }
      elseBlock = parseOptionalElse();
    }

    ImmutableList<Statement> finallyBlock = ImmutableList.of();
    boolean hasFinally = token.kind == TokenKind.FINALLY;
    if (hasFinally) {
      nextToken();
      expect(TokenKind.COLON);
      finallyBlock = parseSuite();
    }
    if (handlers.isEmpty() && !hasFinally) {
      reportError(tryOffset, "expected 'except' or 'finally' block");
    }
    return new TryStatement(locs, tryOffset, body, handlers, isStar, elseBlock, finallyBlock);
  }

  // match_stmt = "match" star_exprs ':' NEWLINE INDENT case_block+ OUTDENT
  //
  // "match" is a soft keyword: if the statement does not have this form, nothing is consumed, null
  // is returned, and the line is parsed as an ordinary statement, as in "match = 1".
  @Nullable
  private MatchStatement tryParseMatchStatement() {
    Speculation speculation = new Speculation();
    int matchOffset = nextToken();
    Expression subject = null;
    if (!STATEMENT_TERMINATOR_SET.contains(token.kind) && token.kind != TokenKind.COLON) {
      subject = parseExpr();
    }
    if (subject == null
        || speculation.failed()
        || token.kind != TokenKind.COLON
        || peekKind() != TokenKind.NEWLINE) {
      speculation.abandon();
      return null;
    }
    speculation.commit();
    expect(TokenKind.COLON);
    expect(TokenKind.NEWLINE);

    ImmutableList.Builder<MatchStatement.Case> cases = ImmutableList.builder();
    if (token.kind != TokenKind.INDENT) {
      reportError(token.start, "expected an indented block");
      return new MatchStatement(locs, matchOffset, subject, cases.build());
    }
    expect(TokenKind.INDENT);
    while (token.kind != TokenKind.OUTDENT && token.kind != TokenKind.EOF) {
      if (!atSoftKeyword("case")) {
        syntaxError("expected 'case'");
        syncPast(STATEMENT_TERMINATOR_SET);
        continue;
      }
      cases.add(parseCaseBlock());
    }
    expectAndRecover(TokenKind.OUTDENT);
    return new MatchStatement(locs, matchOffset, subject, cases.build());
  }

  // case_block = "case" patterns [IF test] ':' suite
  private MatchStatement.Case parseCaseBlock() {
    int caseOffset = nextToken();
    Pattern pattern = parsePatterns();
    Expression guard = null;
    if (token.kind == TokenKind.IF) {
      nextToken();
      guard = parseTest();
    }
    expect(TokenKind.COLON);
    ImmutableList<Statement> body = parseSuite();
    return new MatchStatement.Case(locs, caseOffset, pattern, guard, body);
  }

  // patterns = maybe_star_pattern (',' maybe_star_pattern)* [',']   -- an open sequence
  //          | pattern
  private Pattern parsePatterns() {
    Pattern first = parseMaybeStarPattern();
    if (token.kind != TokenKind.COMMA && !(first instanceof Pattern.Star)) {
      return first;
    }
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    patterns.add(first);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.COLON || token.kind == TokenKind.IF) {
        break;
      }
      patterns.add(parseMaybeStarPattern());
    }
    return new Pattern.Sequence(locs, /* isTuple= */ true, -1, patterns.build(), -1);
  }

  // maybe_star_pattern = '*' IDENTIFIER | pattern
  private Pattern parseMaybeStarPattern() {
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      Identifier name = parseIdent();
      return new Pattern.Star(locs, starOffset, captureName(name));
    }
    return parsePattern();
  }

  // Returns the identifier of a capture, marked as a binding, or null for the wildcard "_".
  @Nullable
  private static Identifier captureName(Identifier id) {
    if (id.getName().equals("_")) {
      return null;
    }
    id.setContext(Identifier.Context.STORE);
    return id;
  }

  // pattern = or_pattern [AS IDENTIFIER]
  private Pattern parsePattern() {
    Pattern pattern = parseOrPattern();
    if (token.kind != TokenKind.AS) {
      return pattern;
    }
    nextToken();
    Identifier name = parseIdent();
    if (name.getName().equals("_")) {
      reportError(name.getStartOffset(), "cannot use '_' as a target");
    }
    name.setContext(Identifier.Context.STORE);
    return new Pattern.As(locs, pattern.getStartOffset(), pattern, name);
  }

  // or_pattern = closed_pattern ('|' closed_pattern)*
  private Pattern parseOrPattern() {
    Pattern first = parseClosedPattern();
    if (token.kind != TokenKind.PIPE) {
      return first;
    }
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    patterns.add(first);
    while (token.kind == TokenKind.PIPE) {
      nextToken();
      patterns.add(parseClosedPattern());
    }
    return new Pattern.Or(locs, patterns.build());
  }

  // closed_pattern = literal | capture | wildcard | dotted_name | class_pattern
  //                | '(' pattern ')' | '(' [open_sequence] ')' | '[' [sequence] ']'
  //                | mapping_pattern
  private Pattern parseClosedPattern() {
    switch (token.kind) {
      case IDENTIFIER:
        return parseNamePattern();

      case LPAREN:
        {
          int lparenOffset = nextToken();
          if (token.kind == TokenKind.RPAREN) {
            int rparenOffset = nextToken();
            return new Pattern.Sequence(
                locs, /* isTuple= */ true, lparenOffset, ImmutableList.of(), rparenOffset);
          }
          Pattern first = parseMaybeStarPattern();
          if (token.kind == TokenKind.RPAREN && !(first instanceof Pattern.Star)) {
            // group: (p)
            nextToken();
            first.setParenthesized(true);
            return first;
          }
          ImmutableList<Pattern> patterns = parsePatternList(first, TokenKind.RPAREN);
          int rparenOffset = expect(TokenKind.RPAREN);
          return new Pattern.Sequence(
              locs, /* isTuple= */ true, lparenOffset, patterns, rparenOffset);
        }

      case LBRACKET:
        {
          int lbracketOffset = nextToken();
          ImmutableList<Pattern> patterns = ImmutableList.of();
          if (token.kind != TokenKind.RBRACKET) {
            patterns = parsePatternList(parseMaybeStarPattern(), TokenKind.RBRACKET);
          }
          int rbracketOffset = expect(TokenKind.RBRACKET);
          return new Pattern.Sequence(
              locs, /* isTuple= */ false, lbracketOffset, patterns, rbracketOffset);
        }

      case LBRACE:
        return parseMappingPattern();

      default:
        // Literal values, including signed numbers and complex literals such as -1+2j.
        return new Pattern.Value(locs, parseTest(ARITH_PREC));
    }
  }

  // Parses the rest of a comma-separated pattern list whose first element has been parsed.
  private ImmutableList<Pattern> parsePatternList(Pattern first, TokenKind closing) {
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    patterns.add(first);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == closing) {
        break;
      }
      patterns.add(parseMaybeStarPattern());
    }
    return patterns.build();
  }

  // capture, wildcard, value and class patterns, all of which start with a name.
  private Pattern parseNamePattern() {
    int startOffset = token.start;
    Identifier id = parseIdent();
    if (token.kind != TokenKind.DOT && token.kind != TokenKind.LPAREN) {
      return new Pattern.As(locs, startOffset, null, captureName(id));
    }
    Expression name = id;
    while (token.kind == TokenKind.DOT) {
      name = parseSelectorSuffix(name);
    }
    if (token.kind != TokenKind.LPAREN) {
      return new Pattern.Value(locs, name);
    }

    // class_pattern = name_or_attr '(' [pattern (',' pattern)*] [IDENTIFIER '=' pattern ...] ')'
    nextToken();
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    ImmutableList.Builder<Identifier> keywords = ImmutableList.builder();
    ImmutableList.Builder<Pattern> keywordPatterns = ImmutableList.builder();
    boolean seenKeyword = false;
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.IDENTIFIER && peekKind() == TokenKind.EQUALS) {
        keywords.add(parseIdent());
        expect(TokenKind.EQUALS);
        keywordPatterns.add(parsePattern());
        seenKeyword = true;
      } else {
        if (seenKeyword) {
          reportError(token.start, "positional patterns follow keyword patterns");
        }
        patterns.add(parsePattern());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rparenOffset = expect(TokenKind.RPAREN);
    return new Pattern.ClassPattern(
        locs, name, patterns.build(), keywords.build(), keywordPatterns.build(), rparenOffset);
  }

  // mapping_pattern = '{' [key ':' pattern (',' key ':' pattern)*] [',' '**' IDENTIFIER] '}'
  private Pattern parseMappingPattern() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    ImmutableList.Builder<Expression> keys = ImmutableList.builder();
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    Identifier rest = null;
    while (token.kind != TokenKind.RBRACE && token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.STAR_STAR) {
        nextToken();
        rest = parseStoreIdent();
      } else {
        Expression key;
        if (token.kind == TokenKind.IDENTIFIER) {
          key = parseIdent();
          while (token.kind == TokenKind.DOT) {
            key = parseSelectorSuffix(key);
          }
        } else {
          key = parseTest(ARITH_PREC);
        }
        expect(TokenKind.COLON);
        keys.add(key);
        patterns.add(parsePattern());
      }
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    int rbraceOffset = expect(TokenKind.RBRACE);
    return new Pattern.Mapping(
        locs, lbraceOffset, keys.build(), patterns.build(), rest, rbraceOffset);
  }

  // Parses every kind of expression, including unparenthesized tuples and starred elements.
  //
  // In Python the corresponding grammar production is called `star_expressions`.
  //
  // In many cases we need to use parseTest() in place of parseExpr() to avoid ambiguity, e.g.:
  //
  //   f(x, y)  vs  f((x, y))
  private Expression parseExpr() {
    Expression e = parseStarOrTest();
    if (token.kind != TokenKind.COMMA) {
      return e;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (isExprListTerminator(token.kind)) {
        break;
      }
      elems.add(parseStarOrTest());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // Reports whether the token ends an unparenthesized tuple.
  private static boolean isExprListTerminator(TokenKind kind) {
    switch (kind) {
      case EOF:
      case NEWLINE:
      case SEMI:
      case EQUALS:
      case COLON:
      case IN:
      case RPAREN:
      case RBRACKET:
      case RBRACE:
        return true;
      default:
        return augmentedAssignments.containsKey(kind);
    }
  }

  // yield_or_star_exprs = yield_expr | star_exprs
  private Expression parseYieldOrStarExpressions() {
    return token.kind == TokenKind.YIELD ? parseYieldExpression() : parseExpr();
  }

  // yield_expr = YIELD FROM test | YIELD [star_exprs]
  private YieldExpression parseYieldExpression() {
    int yieldOffset = expect(TokenKind.YIELD);
    if (token.kind == TokenKind.FROM) {
      nextToken();
      return new YieldExpression(locs, yieldOffset, /* isFrom= */ true, parseTest());
    }
    Expression value = null;
    if (!isExprListTerminator(token.kind)) {
      value = parseExpr();
    }
    return new YieldExpression(locs, yieldOffset, /* isFrom= */ false, value);
  }

  // star_or_test = '*' bitwise_or | test
  private Expression parseStarOrTest() {
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      return new StarredExpression(locs, starOffset, parseTest(BITWISE_OR_PREC));
    }
    return parseTest();
  }

  // Parses any expression except for an unparenthesized tuple.
  //
  // In Python the corresponding grammar production is called `named_expression` (or previously,
  // in Python 3.7 and older, `test`).
  private Expression parseTest() {
    int start = token.start;
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ true);
    }

    Expression expr = parseTest(0);
    if (token.kind == TokenKind.COLON_EQUALS) {
      return parseNamedExpressionTail(expr);
    }
    if (token.kind == TokenKind.IF) {
      nextToken();
      Expression condition = parseTest(0);
      if (token.kind == TokenKind.ELSE) {
        nextToken();
        Expression elseClause = parseTest();
        return new ConditionalExpression(locs, expr, condition, elseClause);
      } else {
        reportError(start, "missing else clause in conditional expression or semicolon before if");
        return expr; // Try to recover from error: drop the if and the expression after it. Ouch.
      }
    }
    return expr;
  }

  // named_expression = IDENTIFIER ':=' test
  private Expression parseNamedExpressionTail(Expression target) {
    int opOffset = expect(TokenKind.COLON_EQUALS);
    Expression value = parseTest();
    if (!(target instanceof Identifier) || target.isParenthesized()) {
      reportError(opOffset, "cannot use assignment expressions with this expression");
      return value;
    }
    Identifier id = (Identifier) target;
    id.setContext(Identifier.Context.STORE);
    return new NamedExpression(locs, id, value);
  }

  private Expression parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parseFactor();
    }
    if (prec == NOT_PREC) {
      return token.kind == TokenKind.NOT ? parseNotExpression(prec) : parseTest(prec + 1);
    }
    if (prec == COMPARISON_PREC) {
      return parseComparison();
    }
    return parseBinOpExpression(prec);
  }

  // parseLambda parses a lambda expression.
  // The allowCond flag allows the body to be an 'a if b else c' conditional.
  private LambdaExpression parseLambda(boolean allowCond) {
    int lambdaOffset = expect(TokenKind.LAMBDA);
    ImmutableList<Parameter> params = parseParameters(/* defStatement= */ false);
    expect(TokenKind.COLON);
    Expression body = allowCond ? parseTest() : parseTestNoCond();
    return new LambdaExpression(locs, lambdaOffset, params, body);
  }

  // parseTestNoCond parses a single-component expression without
  // consuming a trailing 'if expr else expr'.
  private Expression parseTestNoCond() {
    if (token.kind == TokenKind.LAMBDA) {
      return parseLambda(/* allowCond= */ false);
    }
    return parseTest(0);
  }

  // not_expr = 'not' expr
  private Expression parseNotExpression(int prec) {
    int notOffset = expect(TokenKind.NOT);
    Expression x = parseTest(prec);
    return new UnaryOperatorExpression(locs, TokenKind.NOT, notOffset, x);
  }

  // comparison = bitwise_or (comp_op bitwise_or)*
  //
  // A chain such as a < b < c is a single node.
  private Expression parseComparison() {
    Expression x = parseTest(COMPARISON_PREC + 1);
    ImmutableList.Builder<TokenKind> ops = ImmutableList.builder();
    ImmutableList.Builder<Expression> comparators = ImmutableList.builder();
    boolean chained = false;
    for (; ; ) {
      if (token.kind == TokenKind.NOT) {
        // If NOT appears when we expect a binary operator, it must be followed by IN.
        // Since the code expects every operator to be a single token, we push a NOT_IN token.
        expect(TokenKind.NOT);
        if (token.kind != TokenKind.IN) {
          syntaxError("expected 'in'");
        }
        token.kind = TokenKind.NOT_IN;
      }

      TokenKind op = token.kind;
      if (!operatorPrecedence.get(COMPARISON_PREC).contains(op)) {
        break;
      }
      nextToken();
      if (op == TokenKind.IS && token.kind == TokenKind.NOT) {
        nextToken();
        op = TokenKind.IS_NOT;
      }
      ops.add(op);
      comparators.add(parseTest(COMPARISON_PREC + 1));
      chained = true;
    }
    return chained ? new ComparisonExpression(locs, x, ops.build(), comparators.build()) : x;
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | factor
  // This function takes care of precedence between operators (see operatorPrecedence for
  // the order), and it assumes left-to-right associativity.
  private Expression parseBinOpExpression(int prec) {
    Expression x = parseTest(prec + 1);
    // The loop is not strictly needed, but it prevents risks of stack overflow. Depth is
    // limited to number of different precedence levels (operatorPrecedence.size()).
    for (; ; ) {
      TokenKind op = token.kind;
      if (!operatorPrecedence.get(prec).contains(op)) {
        return x;
      }
      int opOffset = nextToken();
      Expression y = parseTest(prec + 1);
      x = new BinaryOperatorExpression(locs, x, op, opOffset, y);
    }
  }

  // factor = ('+' | '-' | '~') factor | power
  private Expression parseFactor() {
    if (token.kind == TokenKind.MINUS
        || token.kind == TokenKind.PLUS
        || token.kind == TokenKind.TILDE) {
      TokenKind op = token.kind;
      int offset = nextToken();
      Expression x = parseFactor();
      return new UnaryOperatorExpression(locs, op, offset, x);
    }
    return parsePower();
  }

  // power = [AWAIT] primary_with_suffix ['**' factor]
  //
  // The exponent is a factor, so ** is right-associative and binds tighter than a unary operator
  // on its left: -x**2 is -(x**2).
  private Expression parsePower() {
    Expression x;
    if (token.kind == TokenKind.AWAIT) {
      int awaitOffset = nextToken();
      x = new AwaitExpression(locs, awaitOffset, parsePrimaryWithSuffix());
    } else {
      x = parsePrimaryWithSuffix();
    }
    if (token.kind == TokenKind.STAR_STAR) {
      int opOffset = nextToken();
      Expression y = parseFactor();
      return new BinaryOperatorExpression(locs, x, TokenKind.STAR_STAR, opOffset, y);
    }
    return x;
  }

  private Identifier parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      int start = token.start;
      int end = expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, end);
    }

    String name = (String) token.value;
    int offset = nextToken();
    return new Identifier(locs, name, offset);
  }

  // Parses an identifier that introduces a binding, such as a parameter or a def name.
  private Identifier parseStoreIdent() {
    Identifier id = parseIdent();
    id.setContext(Identifier.Context.STORE);
    return id;
  }

  //  primary = INT | FLOAT | STRING+ | IDENTIFIER
  //          | 'True' | 'False' | 'None' | '...'
  //          | list_display | dict_or_set_display | parenthesized
  private Expression parsePrimary() {
    switch (token.kind) {
      case INT:
        {
          IntLiteral literal = new IntLiteral(locs, token.raw, token.start);
          nextToken();
          return literal;
        }

      case FLOAT:
        {
          FloatLiteral literal = new FloatLiteral(locs, token.raw, token.start);
          nextToken();
          return literal;
        }

      case STRING:
      case FSTRING:
        return parseStrings();

      case IDENTIFIER:
        return parseIdent();

      case TRUE:
      case FALSE:
      case NONE:
        {
          NamedConstant constant = new NamedConstant(locs, token.kind, token.start);
          nextToken();
          return constant;
        }

      case ELLIPSIS:
        return new Ellipsis(locs, nextToken());

      case LBRACKET: // [...]
        return parseListMaker();

      case LBRACE: // {...}
        return parseDictOrSetDisplay();

      case LPAREN: // (...)
        return parseParenthesized();

      default:
        {
          int start = token.start;
          syntaxError("expected expression");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // primary_with_suffix = primary (selector_suffix | subscript_suffix | call_suffix)*
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      if (token.kind == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.kind == TokenKind.LBRACKET) {
        e = parseSubscriptSuffix(e);
      } else if (token.kind == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else {
        return e;
      }
    }
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(Expression e) {
    int dotOffset = expect(TokenKind.DOT);
    if (token.kind == TokenKind.IDENTIFIER) {
      Identifier id = parseIdent();
      return new DotExpression(locs, e, dotOffset, id);
    }

    syntaxError("expected identifier after dot");
    syncTo(EXPR_TERMINATOR_SET);
    return e;
  }

  // call_suffix = '(' arg_list? ')'
  private Expression parseCallSuffix(Expression fn) {
    int lparenOffset = expect(TokenKind.LPAREN);
    ImmutableList<Argument> args = parseArguments(lparenOffset);
    int rparenOffset = expect(TokenKind.RPAREN);
    return new CallExpression(locs, fn, args, rparenOffset);
  }

  // Parse a list of call arguments, or of class bases.
  //
  // arg_list = ( (arg ',')* arg ','? )?
  //          | test comprehension_clauses     -- f(x for x in y)
  private ImmutableList<Argument> parseArguments(int lparenOffset) {
    boolean seenArg = false;
    ImmutableList.Builder<Argument> list = ImmutableList.builder();
    while (token.kind != TokenKind.RPAREN && token.kind != TokenKind.EOF) {
      if (seenArg) {
        expect(TokenKind.COMMA);
        // If nonempty, the list may end with a comma.
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
      }
      Argument arg = parseArgument();
      seenArg = true;
      if (arg instanceof Argument.Positional
          && (token.kind == TokenKind.FOR || token.kind == TokenKind.ASYNC)) {
        // The call's parentheses double as those of the generator expression.
        ImmutableList<Comprehension.Clause> clauses = parseComprehensionClauses(TokenKind.RPAREN);
        Comprehension generator =
            new Comprehension(
                locs,
                Comprehension.ComprehensionKind.GENERATOR,
                lparenOffset,
                arg.getValue(),
                clauses,
                token.start);
        arg = new Argument.Positional(locs, generator);
      }
      list.add(arg);
    }
    return list.build();
  }

  // arg = IDENTIFIER '=' test
  //     | test
  //     | *args
  //     | **kwargs
  private Argument parseArgument() {
    Expression expr;

    // parse **expr
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      expr = parseTest();
      return new Argument.StarStar(locs, starStarOffset, expr);
    }

    // parse *expr
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      expr = parseTest();
      return new Argument.Star(locs, starOffset, expr);
    }

    // IDENTIFIER  or  IDENTIFIER = test
    expr = parseTest();
    if (expr instanceof Identifier id && !id.isParenthesized()) {
      // parse a named argument
      if (token.kind == TokenKind.EQUALS) {
        nextToken();
        Expression arg = parseTest();
        return new Argument.Keyword(locs, id, arg);
      }
    }

    // parse a positional argument
    return new Argument.Positional(locs, expr);
  }

  // subscript_suffix = '[' subscript (',' subscript)* [','] ']'
  //
  // Several subscripts form an unparenthesized tuple key, as in x[1:2, ::3].
  private Expression parseSubscriptSuffix(Expression e) {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    Expression key = parseSubscript();
    if (token.kind == TokenKind.COMMA) {
      ImmutableList.Builder<Expression> elems = ImmutableList.builder();
      elems.add(key);
      while (token.kind == TokenKind.COMMA) {
        nextToken();
        if (token.kind == TokenKind.RBRACKET) {
          break;
        }
        elems.add(parseSubscript());
      }
      key = new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
    }
    int rbracketOffset = expect(TokenKind.RBRACKET);
    return new IndexExpression(locs, e, lbracketOffset, key, rbracketOffset);
  }

  // subscript = star_or_test
  //           | [test] ':' [test] [':' [test]]
  private Expression parseSubscript() {
    int startOffset = token.start;
    Expression start = null;
    if (token.kind != TokenKind.COLON) {
      start = parseStarOrTest();
      if (token.kind != TokenKind.COLON) {
        return start;
      }
    }

    int colonOffset = expect(TokenKind.COLON);
    int endOffset = colonOffset + 1;
    Expression stop = null;
    Expression step = null;
    if (!isSubscriptEnd(token.kind) && token.kind != TokenKind.COLON) {
      stop = parseTest();
      endOffset = stop.getEndOffset();
    }
    boolean hasSecondColon = token.kind == TokenKind.COLON;
    if (hasSecondColon) {
      endOffset = nextToken() + 1;
      if (!isSubscriptEnd(token.kind)) {
        step = parseTest();
        endOffset = step.getEndOffset();
      }
    }
    return new SliceExpression(locs, startOffset, start, stop, step, hasSecondColon, endOffset);
  }

  private static boolean isSubscriptEnd(TokenKind kind) {
    return kind == TokenKind.RBRACKET || kind == TokenKind.COMMA || kind == TokenKind.EOF;
  }

  // Equivalent to 'star_targets' rule in Python grammar.
  // target_list = target ( ',' target )* ','?
  private Expression parseTargetList() {
    // We cannot reuse parseExpr because it would parse the 'in' operator.
    // e.g.  "for i in e: pass"  -> we want to parse only "i" here.
    Expression e1 = parseTarget();
    if (token.kind != TokenKind.COMMA) {
      return e1;
    }

    // unparenthesized tuple
    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(e1);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (isExprListTerminator(token.kind)) {
        break;
      }
      elems.add(parseTarget());
    }
    return new ListExpression(locs, /* isTuple= */ true, -1, elems.build(), -1);
  }

  // target = '*' primary_with_suffix | primary_with_suffix
  private Expression parseTarget() {
    if (token.kind == TokenKind.STAR) {
      int starOffset = nextToken();
      return new StarredExpression(locs, starOffset, parsePrimaryWithSuffix());
    }
    return parsePrimaryWithSuffix();
  }

  // comprehension_clauses = (['async'] 'for' target_list 'in' or_test | 'if' test_nocond)+
  //
  // Parsing stops before the closing bracket, which the caller consumes.
  private ImmutableList<Comprehension.Clause> parseComprehensionClauses(TokenKind closingBracket) {
    ImmutableList.Builder<Comprehension.Clause> clauses = ImmutableList.builder();
    while (true) {
      if (token.kind == TokenKind.FOR || token.kind == TokenKind.ASYNC) {
        int forOffset = token.start;
        boolean isAsync = token.kind == TokenKind.ASYNC;
        if (isAsync) {
          nextToken();
        }
        expect(TokenKind.FOR);
        Expression vars = parseTargetList();
        setTargetContext(vars, Identifier.Context.STORE);
        expect(TokenKind.IN);
        // The expression cannot be a ternary expression ('x if y else z') due to
        // conflicts in Python grammar ('if' is used by the comprehension).
        Expression iterable = parseTest(0);
        clauses.add(new Comprehension.For(locs, forOffset, isAsync, vars, iterable));
      } else if (token.kind == TokenKind.IF) {
        int ifOffset = nextToken();
        // [x for x in li if 1, 2]  # parse error
        // [x for x in li if (1, 2)]  # ok
        Expression cond = parseTestNoCond();
        clauses.add(new Comprehension.If(locs, ifOffset, cond));
      } else if (token.kind == closingBracket) {
        break;
      } else {
        syntaxError("expected '" + closingBracket + "', 'for' or 'if'");
        break;
      }
    }
    return clauses.build();
  }

  private static boolean atComprehension(TokenKind kind) {
    return kind == TokenKind.FOR || kind == TokenKind.ASYNC;
  }

  // list_display = '[' ']'
  //              | '[' star_or_test (',' star_or_test)* [','] ']'
  //              | '[' test comprehension_clauses ']'
  private Expression parseListMaker() {
    int lbracketOffset = expect(TokenKind.LBRACKET);
    if (token.kind == TokenKind.RBRACKET) { // empty List
      int rbracketOffset = nextToken();
      return new ListExpression(
          locs, /* isTuple= */ false, lbracketOffset, ImmutableList.of(), rbracketOffset);
    }

    Expression first = parseStarOrTest();
    if (atComprehension(token.kind)) {
      // [e for x in y], list comprehension
      ImmutableList<Comprehension.Clause> clauses =
          parseComprehensionClauses(TokenKind.RBRACKET);
      int rbracketOffset = expect(TokenKind.RBRACKET);
      return new Comprehension(
          locs,
          Comprehension.ComprehensionKind.LIST,
          lbracketOffset,
          first,
          clauses,
          rbracketOffset);
    }

    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(first);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RBRACKET) {
        break;
      }
      elems.add(parseStarOrTest());
    }
    if (token.kind == TokenKind.RBRACKET) {
      int rbracketOffset = nextToken();
      return new ListExpression(
          locs, /* isTuple= */ false, lbracketOffset, elems.build(), rbracketOffset);
    }

    expect(TokenKind.RBRACKET);
    int end = syncPast(LIST_TERMINATOR_SET);
    return makeErrorExpression(lbracketOffset, end);
  }

  // dict_or_set_display = '{' '}'
  //                     | '{' dict_entry (',' dict_entry)* [','] '}'
  //                     | '{' dict_entry comprehension_clauses '}'
  //                     | '{' star_or_test (',' star_or_test)* [','] '}'
  //                     | '{' test comprehension_clauses '}'
  private Expression parseDictOrSetDisplay() {
    int lbraceOffset = expect(TokenKind.LBRACE);
    if (token.kind == TokenKind.RBRACE) { // empty Dict
      int rbraceOffset = nextToken();
      return new DictExpression(locs, lbraceOffset, ImmutableList.of(), rbraceOffset);
    }

    DictExpression.Entry entry;
    if (token.kind == TokenKind.STAR_STAR) {
      entry = parseDictEntry();
    } else {
      Expression first = parseStarOrTest();
      if (token.kind != TokenKind.COLON) {
        return parseSetDisplayTail(lbraceOffset, first);
      }
      nextToken();
      Expression value = parseTest();
      entry = new DictExpression.Entry(locs, first.getStartOffset(), first, value);
    }

    if (entry.getKey() != null && atComprehension(token.kind)) {
      // Dict comprehension
      ImmutableList<Comprehension.Clause> clauses = parseComprehensionClauses(TokenKind.RBRACE);
      int rbraceOffset = expect(TokenKind.RBRACE);
      return new Comprehension(
          locs, Comprehension.ComprehensionKind.DICT, lbraceOffset, entry, clauses, rbraceOffset);
    }

    ImmutableList.Builder<DictExpression.Entry> entries = ImmutableList.builder();
    entries.add(entry);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RBRACE) {
        break;
      }
      entries.add(parseDictEntry());
    }
    if (token.kind == TokenKind.RBRACE) {
      int rbraceOffset = nextToken();
      return new DictExpression(locs, lbraceOffset, entries.build(), rbraceOffset);
    }

    expect(TokenKind.RBRACE);
    int end = syncPast(DICT_TERMINATOR_SET);
    return makeErrorExpression(lbraceOffset, end);
  }

  // dict_entry = test ':' test | '**' bitwise_or
  private DictExpression.Entry parseDictEntry() {
    if (token.kind == TokenKind.STAR_STAR) {
      int starStarOffset = nextToken();
      Expression value = parseTest(BITWISE_OR_PREC);
      return new DictExpression.Entry(locs, starStarOffset, null, value);
    }
    Expression key = parseTest();
    expect(TokenKind.COLON);
    Expression value = parseTest();
    return new DictExpression.Entry(locs, key.getStartOffset(), key, value);
  }

  // Parses the remainder of a set display or set comprehension after its first element.
  private Expression parseSetDisplayTail(int lbraceOffset, Expression first) {
    if (atComprehension(token.kind)) {
      ImmutableList<Comprehension.Clause> clauses = parseComprehensionClauses(TokenKind.RBRACE);
      int rbraceOffset = expect(TokenKind.RBRACE);
      return new Comprehension(
          locs, Comprehension.ComprehensionKind.SET, lbraceOffset, first, clauses, rbraceOffset);
    }

    ImmutableList.Builder<Expression> elems = ImmutableList.builder();
    elems.add(first);
    while (token.kind == TokenKind.COMMA) {
      nextToken();
      if (token.kind == TokenKind.RBRACE) {
        break;
      }
      elems.add(parseStarOrTest());
    }
    if (token.kind == TokenKind.RBRACE) {
      int rbraceOffset = nextToken();
      return new SetExpression(locs, lbraceOffset, elems.build(), rbraceOffset);
    }

    expect(TokenKind.RBRACE);
    int end = syncPast(DICT_TERMINATOR_SET);
    return makeErrorExpression(lbraceOffset, end);
  }

  // parenthesized = '(' ')'                          -- the empty tuple
  //               | '(' yield_expr ')'
  //               | '(' star_or_test ')'             -- a parenthesized expression
  //               | '(' test comprehension_clauses ')'
  //               | '(' star_or_test (',' star_or_test)* [','] ')'
  private Expression parseParenthesized() {
    int lparenOffset = expect(TokenKind.LPAREN);

    // empty tuple: ()
    if (token.kind == TokenKind.RPAREN) {
      int rparenOffset = nextToken();
      ListExpression tuple =
          new ListExpression(
              locs, /* isTuple= */ true, lparenOffset, ImmutableList.of(), rparenOffset);
      tuple.setParenthesized(true);
      return tuple;
    }

    if (token.kind == TokenKind.YIELD) {
      Expression e = parseYieldExpression();
      expect(TokenKind.RPAREN);
      e.setParenthesized(true);
      return e;
    }

    Expression e = parseStarOrTest();

    // parenthesized expression: (e)
    if (token.kind == TokenKind.RPAREN) {
      nextToken();
      e.setParenthesized(true);
      return e;
    }

    // generator expression: (e for x in y)
    if (atComprehension(token.kind)) {
      ImmutableList<Comprehension.Clause> clauses = parseComprehensionClauses(TokenKind.RPAREN);
      int rparenOffset = expect(TokenKind.RPAREN);
      return new Comprehension(
          locs,
          Comprehension.ComprehensionKind.GENERATOR,
          lparenOffset,
          e,
          clauses,
          rparenOffset);
    }

    // non-empty tuple: (e,) or (e, ..., e)
    if (token.kind == TokenKind.COMMA) {
      ImmutableList.Builder<Expression> elems = ImmutableList.builder();
      elems.add(e);
      while (token.kind == TokenKind.COMMA) {
        nextToken();
        if (token.kind == TokenKind.RPAREN) {
          break;
        }
        elems.add(parseStarOrTest());
      }
      int rparenOffset = expect(TokenKind.RPAREN);
      ListExpression tuple =
          new ListExpression(locs, /* isTuple= */ true, lparenOffset, elems.build(), rparenOffset);
      tuple.setParenthesized(true);
      return tuple;
    }

    expect(TokenKind.RPAREN);
    int end = syncTo(EXPR_TERMINATOR_SET);
    return makeErrorExpression(lparenOffset, end);
  }

  // strings = (STRING | FSTRING)+
  //
  // Adjacent literals are implicitly concatenated.
  private Expression parseStrings() {
    ImmutableList.Builder<Expression> builder = ImmutableList.builder();
    while (token.kind == TokenKind.STRING || token.kind == TokenKind.FSTRING) {
      if (token.kind == TokenKind.STRING) {
        builder.add(
            new StringLiteral(locs, token.start, token.raw, intern((String) token.value)));
      } else {
        builder.add(parseFormattedString());
      }
      nextToken();
    }
    ImmutableList<Expression> parts = builder.build();
    return parts.size() == 1 ? parts.get(0) : new StringConcatenation(locs, parts);
  }

  // Parses the replacement fields of the current FSTRING token, without consuming it.
  private FormattedString parseFormattedString() {
    String raw = token.raw;
    int i = 0;
    while (i < raw.length() && raw.charAt(i) != '\'' && raw.charAt(i) != '"') {
      i++;
    }
    String prefix = raw.substring(0, i);
    String quote = "";
    if (i < raw.length()) {
      String triple = raw.substring(i, i + 1).repeat(3);
      quote = raw.startsWith(triple, i) && raw.length() >= i + 6 ? triple : raw.substring(i, i + 1);
    }
    int contentStart = token.start + i + quote.length();
    int contentEnd = raw.endsWith(quote) ? token.end - quote.length() : token.end;
    contentEnd = Math.max(contentStart, contentEnd);
    boolean isRaw = Ascii.toLowerCase(prefix).indexOf('r') >= 0;
    ImmutableList<FormattedString.Part> parts =
        new FormattedStringParser(contentStart, contentEnd, isRaw).parseParts(false);
    return new FormattedString(locs, token.start, prefix, quote, parts, token.end);
  }

  // Parses an f-string's text and replacement fields, given the char offsets of its contents.
  //
  // Field expressions are located by scanning, then handed to a parser of their own whose lexer
  // reads just that region of the file, so their nodes carry true file offsets.
  private final class FormattedStringParser {
    private int pos;
    private final int limit;
    private final boolean isRaw;

    FormattedStringParser(int start, int limit, boolean isRaw) {
      this.pos = start;
      this.limit = limit;
      this.isRaw = isRaw;
    }

    private char peek(int offset) {
      return offset < limit ? lexer.charAt(offset) : 0;
    }

    // parts = (TEXT | '{{' | '}}' | field)*
    //
    // Within a format spec, a '}' ends the parts instead.
    ImmutableList<FormattedString.Part> parseParts(boolean inFormatSpec) {
      ImmutableList.Builder<FormattedString.Part> parts = ImmutableList.builder();
      int textStart = pos;
      while (pos < limit) {
        char c = lexer.charAt(pos);
        if (c == '{') {
          if (!inFormatSpec && peek(pos + 1) == '{') {
            pos += 2;
            continue;
          }
          addText(parts, textStart);
          parts.add(parseField());
          textStart = pos;
        } else if (c == '}') {
          if (inFormatSpec) {
            break;
          }
          if (peek(pos + 1) == '}') {
            pos += 2;
            continue;
          }
          reportError(pos, "f-string: single '}' is not allowed");
          pos++;
        } else if (c == '\\' && !isRaw && pos + 1 < limit) {
          if (peek(pos + 1) == 'N' && peek(pos + 2) == '{') {
            // A named unicode escape; its braces do not start a field.
            pos += 3;
            while (pos < limit && lexer.charAt(pos) != '}') {
              pos++;
            }
            pos = Math.min(pos + 1, limit);
          } else {
            pos += 2;
          }
        } else {
          pos++;
        }
      }
      addText(parts, textStart);
      return parts.build();
    }

    private void addText(ImmutableList.Builder<FormattedString.Part> parts, int textStart) {
      if (pos > textStart) {
        parts.add(new FormattedString.Text(locs, textStart, lexer.bufferSlice(textStart, pos)));
      }
    }

    // field = '{' expr ['='] ['!' CONVERSION] [':' format_spec] '}'
    private FormattedString.Field parseField() {
      int lbraceOffset = pos;
      int exprStart = ++pos;
      int exprEnd = scanFieldExpression(exprStart);
      Expression value;
      if (lexer.bufferSlice(exprStart, exprEnd).trim().isEmpty()) {
        reportError(lbraceOffset, "f-string: empty expression not allowed");
        value = makeErrorExpression(exprStart, exprEnd);
      } else {
        value = parseFieldExpression(exprStart, exprEnd);
      }
      pos = exprEnd;

      String selfDocumentingText = null;
      if (peek(pos) == '=') {
        pos++;
        while (pos < limit && Character.isWhitespace(lexer.charAt(pos))) {
          pos++;
        }
        selfDocumentingText = lexer.bufferSlice(exprStart, pos);
      }

      char conversion = 0;
      if (peek(pos) == '!') {
        pos++;
        char c = peek(pos);
        if (c != 0 && "sra".indexOf(c) >= 0) {
          conversion = c;
          pos++;
        } else {
          reportError(pos, "f-string: invalid conversion character: expected 's', 'r', or 'a'");
        }
      }

      ImmutableList<FormattedString.Part> formatSpec = null;
      if (peek(pos) == ':') {
        pos++;
        formatSpec = parseParts(true);
      }

      int rbraceOffset;
      if (peek(pos) == '}') {
        rbraceOffset = pos++;
      } else {
        reportError(lbraceOffset, "f-string: expecting '}'");
        rbraceOffset = Math.max(lbraceOffset, pos - 1);
      }
      return new FormattedString.Field(
          locs,
          lbraceOffset,
          value,
          selfDocumentingText,
          conversion,
          formatSpec,
          rbraceOffset);
    }

    // Returns the offset just past the field's expression: the first '}', '!', ':' or '=' outside
    // of brackets and strings that does not belong to an operator such as '!=' or '=='.
    private int scanFieldExpression(int start) {
      int depth = 0;
      int i = start;
      while (i < limit) {
        char c = lexer.charAt(i);
        switch (c) {
          case '(', '[', '{' -> depth++;
          case ')', ']' -> depth--;
          case '}' -> {
            if (depth == 0) {
              return i;
            }
            depth--;
          }
          case '\'', '"' -> {
            i = skipString(i);
            continue;
          }
          case '!' -> {
            if (depth == 0 && peek(i + 1) != '=') {
              return i;
            }
          }
          case ':' -> {
            if (depth == 0) {
              return i;
            }
          }
          case '=' -> {
            if (peek(i + 1) == '=') {
              i += 2;
              continue;
            }
            char prev = i > start ? lexer.charAt(i - 1) : 0;
            if (depth == 0 && prev != '!' && prev != '<' && prev != '>' && prev != '=') {
              return i;
            }
          }
          default -> {}
        }
        i++;
      }
      return limit;
    }

    // Returns the offset just past the string literal that starts at the given quote.
    private int skipString(int start) {
      char quote = lexer.charAt(start);
      boolean triple = peek(start + 1) == quote && peek(start + 2) == quote;
      int i = start + (triple ? 3 : 1);
      while (i < limit) {
        char c = lexer.charAt(i);
        if (c == '\\') {
          i += 2;
          continue;
        }
        if (c == quote) {
          if (!triple) {
            return i + 1;
          }
          if (peek(i + 1) == quote && peek(i + 2) == quote) {
            return i + 3;
          }
        }
        i++;
      }
      return limit;
    }

    private Expression parseFieldExpression(int start, int end) {
      Parser fieldParser = new Parser(new Lexer(lexer, start, end), errors, options);
      Expression e = fieldParser.parseYieldOrStarExpressions();
      fieldParser.expect(TokenKind.EOF);
      errorsCount += fieldParser.errorsCount;
      return e;
    }
  }
}
