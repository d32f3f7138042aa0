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

/**
 * Base class for all expression nodes in the AST.
 *
 * <p>Parentheses are not materialized as nodes. Instead, an expression that appeared inside
 * grouping parentheses in the source is marked {@link #isParenthesized parenthesized}, and the
 * printer reproduces them.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    AWAIT,
    BINARY_OPERATOR,
    CALL,
    COMPARISON,
    COMPREHENSION,
    CONDITIONAL,
    DICT_EXPR,
    DOT,
    ELLIPSIS,
    FLOAT_LITERAL,
    FORMATTED_STRING,
    IDENTIFIER,
    INDEX,
    INT_LITERAL,
    LAMBDA,
    LIST_EXPR,
    NAMED,
    NAMED_CONSTANT,
    SET_EXPR,
    SLICE,
    STARRED,
    STRING_CONCATENATION,
    STRING_LITERAL,
    UNARY_OPERATOR,
    YIELD,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  private boolean parenthesized;

  Expression(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }

  /** Reports whether the expression was enclosed in grouping parentheses in the source. */
  public final boolean isParenthesized() {
    return parenthesized;
  }

  final void setParenthesized(boolean parenthesized) {
    this.parenthesized = parenthesized;
  }

  /** Parses an expression. */
  public static Expression parse(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    return Parser.parseExpression(input, options);
  }

  /** Parses an expression with default options. */
  public static Expression parse(ParserInput input) throws SyntaxError.Exception {
    return parse(input, FileOptions.DEFAULT);
  }
}
