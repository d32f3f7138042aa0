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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;

/**
 * Syntax tree for a Python file, the root of every tree handled by scope analysis.
 *
 * <p>Its namespace, once built, is the module namespace.
 */
public final class PythonFile extends Node {

  private ImmutableList<Statement> statements;
  private final FileOptions options;
  private final List<SyntaxError> errors;

  private PythonFile(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      List<SyntaxError> errors) {
    super(locs);
    this.statements = statements;
    this.options = options;
    this.errors = errors;
  }

  // Creates a PythonFile from the given effective list of statements.
  static PythonFile create(
      FileLocations locs,
      ImmutableList<Statement> statements,
      FileOptions options,
      Parser.ParseResult result) {
    return new PythonFile(locs, statements, options, result.errors);
  }

  /** Returns an unmodifiable view of the list of scanner, parser, and (perhaps) analysis errors. */
  public List<SyntaxError> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** Returns true if there were no errors during scanning and parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns an (immutable, ordered) list of statements in this Python file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /**
   * Inserts the statement {@code target = value} at the start of the file, after its docstring and
   * {@code from __future__} imports, and returns it. The new nodes belong to the module namespace;
   * their identifiers are not attached to any binding. They have no source text of their own, and
   * report the start of the file as their location.
   *
   * @throws IllegalStateException if the namespaces of the file have not been built
   */
  public AssignmentStatement insertAlias(String target, String value) {
    Preconditions.checkArgument(Identifier.isValid(target), "invalid name '%s'", target);
    Preconditions.checkArgument(Identifier.isValid(value), "invalid name '%s'", value);
    Namespace module = getNamespace();
    Preconditions.checkState(module != null, "%s: namespaces have not been built", getFile());

    Identifier lhs = new Identifier(locs, target, 0, Identifier.Context.STORE);
    Identifier rhs = new Identifier(locs, value, 0);
    AssignmentStatement alias =
        new AssignmentStatement(locs, ImmutableList.of(lhs), null, null, rhs);
    alias.setParent(this);
    alias.setNamespace(module);
    for (Identifier id : ImmutableList.of(lhs, rhs)) {
      id.setParent(alias);
      id.setNamespace(module);
    }

    int index = 0;
    if (!statements.isEmpty() && isDocstring(statements.get(0))) {
      index++;
    }
    while (index < statements.size() && isFutureImport(statements.get(index))) {
      index++;
    }
    statements =
        ImmutableList.<Statement>builder()
            .addAll(statements.subList(0, index))
            .add(alias)
            .addAll(statements.subList(index, statements.size()))
            .build();
    return alias;
  }

  private static boolean isDocstring(Statement stmt) {
    return stmt instanceof ExpressionStatement expr
        && expr.getExpression() instanceof StringLiteral str
        && !str.isBytes();
  }

  private static boolean isFutureImport(Statement stmt) {
    return stmt instanceof ImportFromStatement from
        && from.getLevel() == 0
        && "__future__".equals(from.getModule());
  }

  /** Returns the options specified when parsing this file. */
  public FileOptions getOptions() {
    return options;
  }

  /**
   * Parse the specified file, returning its syntax tree with its errors list.
   *
   * <p>A syntax tree with errors may be incomplete; it should not be analyzed or renamed.
   */
  public static PythonFile parse(ParserInput input, FileOptions options) {
    Parser.ParseResult result = Parser.parseFile(input, options);
    return create(result.locs, ImmutableList.copyOf(result.statements), options, result);
  }

  /** Parse a Python file with default options. */
  public static PythonFile parse(ParserInput input) {
    return parse(input, FileOptions.DEFAULT);
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return locs.size();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
