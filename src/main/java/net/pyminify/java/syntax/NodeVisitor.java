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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>A subclass can change the traversal logic by setting {@link #skipNonSymbolIdentifiers}.
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields.
 *
 * <p>Every child is reached through {@link #visit(Node)}, so a subclass that overrides it sees
 * every node of the tree exactly once. Children whose static type is {@link Identifier} are
 * therefore passed as {@code visit((Node) id)} rather than to the Identifier overload directly.
 *
 * <p>Contrary to usual Java style, it is *not* recommended to strictly group all overloads of
 * {@code visit()} together, but rather to place helper methods for a specific node type next to its
 * associated {@code visit()} overload.
 */
public class NodeVisitor {

  /**
   * If set, we only visit {@link Identifier}s that correspond to a definition or use of a symbol in
   * the current file. Specifically, this omits:
   *
   * <ul>
   *   <li>names of keyword arguments (but not names of keyword parameters!)
   *   <li>field names in dot expressions
   *   <li>keyword names of class patterns, {@code case Point(x=0)}
   * </ul>
   *
   * <p>Note that {@code Identifier}s in such contexts have no {@link NameBinding} set for them by
   * the resolver. Imported module paths are plain strings and are never visited.
   */
  protected boolean skipNonSymbolIdentifiers = false;

  // visit() overloads in this class are ordered by node type, first by category (misc / statement /
  // pattern / expression), then alphabetically within category. (Subclasses are not obliged to
  // maintain the same method ordering.)

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  private void visitIfPresent(Node node) {
    if (node != null) {
      visit(node);
    }
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles all four Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    if (!skipNonSymbolIdentifiers && node instanceof Argument.Keyword keyword) {
      visit((Node) keyword.getIdentifier());
    }
    visit(node.getValue());
  }

  /**
   * Handles all four Parameter node types uniformly. Subclasses should not add an overload for a
   * concrete Parameter subclass; it won't be called.
   */
  public void visit(Parameter node) {
    visitIfPresent(node.getIdentifier());
    visitIfPresent(node.getAnnotation());
    visitIfPresent(node.getDefaultValue());
  }

  public void visit(PythonFile node) {
    visitBlock(node.getStatements());
  }

  public void visit(TypeParameter node) {
    visit((Node) node.getIdentifier());
    visitIfPresent(node.getBound());
    visitIfPresent(node.getDefaultValue());
  }

  // ==== Statement nodes ====

  public void visit(AssertStatement node) {
    visit(node.getCondition());
    visitIfPresent(node.getMessage());
  }

  public void visit(AssignmentStatement node) {
    visitAll(node.getTargets());
    visitIfPresent(node.getAnnotation());
    visitIfPresent(node.getRHS());
  }

  public void visit(ClassStatement node) {
    visitAll(node.getDecorators());
    visit((Node) node.getIdentifier());
    visitAll(node.getTypeParameters());
    visitAll(node.getArguments());
    visitBlock(node.getBody());
  }

  public void visit(DeclarationStatement node) {
    visitAll(node.getNames());
  }

  public void visit(DefStatement node) {
    visitAll(node.getDecorators());
    visit((Node) node.getIdentifier());
    visitAll(node.getTypeParameters());
    visitAll(node.getParameters());
    visitIfPresent(node.getReturns());
    visitBlock(node.getBody());
  }

  public void visit(DelStatement node) {
    visitAll(node.getTargets());
  }

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(FlowStatement node) {}

  public void visit(ForStatement node) {
    visit(node.getVars());
    visit(node.getIterable());
    visitBlock(node.getBody());
    visitBlock(node.getElseBlock());
  }

  public void visit(IfStatement node) {
    visit(node.getCondition());
    visitBlock(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(ImportFromStatement node) {
    visitAll(node.getAliases());
  }

  public void visit(ImportStatement node) {
    visitAll(node.getAliases());
  }

  public void visit(ImportStatement.Alias node) {
    // The imported name is a module path or attribute, not an identifier.
    visit((Node) node.getLocal());
  }

  public void visit(MatchStatement node) {
    visit(node.getSubject());
    visitAll(node.getCases());
  }

  public void visit(MatchStatement.Case node) {
    visit(node.getPattern());
    visitIfPresent(node.getGuard());
    visitBlock(node.getBody());
  }

  public void visit(RaiseStatement node) {
    visitIfPresent(node.getException());
    visitIfPresent(node.getCause());
  }

  public void visit(ReturnStatement node) {
    visitIfPresent(node.getResult());
  }

  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    visitAll(node.getHandlers());
    visitBlock(node.getElseBlock());
    visitBlock(node.getFinallyBlock());
  }

  public void visit(TryStatement.ExceptHandler node) {
    visitIfPresent(node.getType());
    visitIfPresent(node.getName());
    visitBlock(node.getBody());
  }

  public void visit(WhileStatement node) {
    visit(node.getCondition());
    visitBlock(node.getBody());
    visitBlock(node.getElseBlock());
  }

  public void visit(WithStatement node) {
    visitAll(node.getItems());
    visitBlock(node.getBody());
  }

  public void visit(WithStatement.Item node) {
    visit(node.getContextExpression());
    visitIfPresent(node.getTarget());
  }

  // ==== Pattern nodes ====

  public void visit(Pattern.As node) {
    visitIfPresent(node.getPattern());
    visitIfPresent(node.getName());
  }

  public void visit(Pattern.ClassPattern node) {
    visit(node.getCls());
    visitAll(node.getPatterns());
    for (int i = 0; i < node.getKeywords().size(); i++) {
      if (!skipNonSymbolIdentifiers) {
        visit((Node) node.getKeywords().get(i));
      }
      visit(node.getKeywordPatterns().get(i));
    }
  }

  public void visit(Pattern.Mapping node) {
    for (int i = 0; i < node.getKeys().size(); i++) {
      visit(node.getKeys().get(i));
      visit(node.getPatterns().get(i));
    }
    visitIfPresent(node.getRest());
  }

  public void visit(Pattern.Or node) {
    visitAll(node.getPatterns());
  }

  public void visit(Pattern.Sequence node) {
    visitAll(node.getPatterns());
  }

  public void visit(Pattern.Star node) {
    visitIfPresent(node.getName());
  }

  public void visit(Pattern.Value node) {
    visit(node.getValue());
  }

  // ==== Expression nodes ====

  public void visit(AwaitExpression node) {
    visit(node.getValue());
  }

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(ComparisonExpression node) {
    visit(node.getLeft());
    visitAll(node.getComparators());
  }

  public void visit(Comprehension node) {
    visit(node.getBody());
    visitAll(node.getClauses());
  }

  public void visit(Comprehension.For node) {
    visit(node.getVars());
    visit(node.getIterable());
  }

  public void visit(Comprehension.If node) {
    visit(node.getCondition());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getThenCase());
    visit(node.getCondition());
    visit(node.getElseCase());
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  public void visit(DictExpression.Entry node) {
    visitIfPresent(node.getKey());
    visit(node.getValue());
  }

  public void visit(DotExpression node) {
    visit(node.getObject());
    if (!skipNonSymbolIdentifiers) {
      visit((Node) node.getField());
    }
  }

  public void visit(@SuppressWarnings("unused") Ellipsis node) {}

  public void visit(@SuppressWarnings("unused") FloatLiteral node) {}

  public void visit(FormattedString node) {
    visitAll(node.getParts());
  }

  public void visit(FormattedString.Field node) {
    visit(node.getValue());
    if (node.getFormatSpec() != null) {
      visitAll(node.getFormatSpec());
    }
  }

  public void visit(@SuppressWarnings("unused") FormattedString.Text node) {}

  public void visit(Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(LambdaExpression node) {
    visitAll(node.getParameters());
    visit(node.getBody());
  }

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(NamedExpression node) {
    visit((Node) node.getTarget());
    visit(node.getValue());
  }

  public void visit(@SuppressWarnings("unused") NamedConstant node) {}

  public void visit(SetExpression node) {
    visitAll(node.getElements());
  }

  public void visit(SliceExpression node) {
    visitIfPresent(node.getStart());
    visitIfPresent(node.getStop());
    visitIfPresent(node.getStep());
  }

  public void visit(StarredExpression node) {
    visit(node.getValue());
  }

  public void visit(StringConcatenation node) {
    visitAll(node.getParts());
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  public void visit(YieldExpression node) {
    visitIfPresent(node.getValue());
  }

  // ==== Helpers for sequences of nodes ====

  /**
   * Visits a sequence of nodes (e.g. a list of arguments).
   *
   * <p>See {@link #visitBlock} for a common case.
   */
  // Final because this method is called across completely different categories of nodes, so it is
  // usually a mistake to attempt to override it.
  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /** Convenience/readability method for visiting a block of statements (e.g. an if branch). */
  public final void visitBlock(List<Statement> statements) {
    visitAll(statements);
  }
}
