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

import java.util.List;

/**
 * A NodePrinter prints a syntax tree as compact Python source.
 *
 * <p>Whitespace is emitted only where a token boundary requires it, and each nesting level of a
 * block is indented by a single space. Grouping parentheses are reproduced from {@link
 * Expression#isParenthesized}, so a tree printed after renaming parses back to the same shape.
 */
public final class NodePrinter extends NodeVisitor {

  private final StringBuilder buf;
  private int indent;

  NodePrinter(StringBuilder buf) {
    this(buf, 0);
  }

  NodePrinter(StringBuilder buf, int indent) {
    this.buf = buf;
    this.indent = indent;
  }

  /** Returns the compact source form of a node, using the current names of its identifiers. */
  public static String print(Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNode(node);
    return buf.toString();
  }

  void printNode(Node node) {
    if (node instanceof Expression expr) {
      printExpr(expr);
    } else {
      node.accept(this);
    }
  }

  // Appends a token, separated from the previous one by a space only if the two would otherwise
  // run together into a single name, keyword or number.
  private void emit(String s) {
    if (s.isEmpty()) {
      return;
    }
    int n = buf.length();
    if (n > 0 && isNameChar(buf.charAt(n - 1)) && isNameChar(s.charAt(0))) {
      buf.append(' ');
    }
    buf.append(s);
  }

  private void emit(char c) {
    emit(String.valueOf(c));
  }

  private static boolean isNameChar(char c) {
    return ('a' <= c && c <= 'z')
        || ('A' <= c && c <= 'Z')
        || ('0' <= c && c <= '9')
        || c == '_'
        || c > 0x7f;
  }

  private void printIndent() {
    for (int i = 0; i < indent; i++) {
      buf.append(' ');
    }
  }

  private void printSuite(List<Statement> statements) {
    emit(':');
    buf.append('\n');
    indent++;
    for (Statement stmt : statements) {
      stmt.accept(this);
    }
    indent--;
  }

  private void startLine() {
    printIndent();
  }

  private void endLine() {
    buf.append('\n');
  }

  private void printExpr(Expression expr) {
    boolean parens =
        expr.isParenthesized() && !(expr instanceof Comprehension comp && isGenerator(comp));
    if (parens) {
      emit('(');
    }
    expr.accept(this);
    if (parens) {
      emit(')');
    }
  }

  private static boolean isGenerator(Comprehension comp) {
    return comp.getComprehensionKind() == Comprehension.ComprehensionKind.GENERATOR;
  }

  private void printExprList(List<? extends Expression> list) {
    String sep = "";
    for (Expression expr : list) {
      emit(sep);
      printExpr(expr);
      sep = ",";
    }
  }

  private void printNodeList(List<? extends Node> list) {
    String sep = "";
    for (Node node : list) {
      emit(sep);
      printNode(node);
      sep = ",";
    }
  }

  private void printDecorators(List<Expression> decorators) {
    for (Expression decorator : decorators) {
      startLine();
      emit('@');
      printExpr(decorator);
      endLine();
    }
  }

  private void printTypeParameters(List<TypeParameter> typeParameters) {
    if (!typeParameters.isEmpty()) {
      emit('[');
      printNodeList(typeParameters);
      emit(']');
    }
  }

  // Prints the parameter list, with a '/' marker after the last positional-only parameter.
  private void printParameters(List<Parameter> params) {
    int lastPositionalOnly = -1;
    for (int i = 0; i < params.size(); i++) {
      if (params.get(i).isPositionalOnly()) {
        lastPositionalOnly = i;
      }
    }
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        emit(',');
      }
      printNode(params.get(i));
      if (i == lastPositionalOnly) {
        emit(",/");
      }
    }
  }

  // --- files and statements ---

  @Override
  public void visit(PythonFile node) {
    for (Statement stmt : node.getStatements()) {
      stmt.accept(this);
    }
  }

  @Override
  public void visit(ExpressionStatement node) {
    startLine();
    printExpr(node.getExpression());
    endLine();
  }

  @Override
  public void visit(AssignmentStatement node) {
    startLine();
    if (node.getAnnotation() != null) {
      printExpr(node.getTargets().get(0));
      emit(':');
      printExpr(node.getAnnotation());
      if (node.getRHS() != null) {
        emit('=');
        printExpr(node.getRHS());
      }
    } else if (node.isAugmented()) {
      printExpr(node.getTargets().get(0));
      emit(node.getOperator() + "=");
      printExpr(node.getRHS());
    } else {
      for (Expression target : node.getTargets()) {
        printExpr(target);
        emit('=');
      }
      printExpr(node.getRHS());
    }
    endLine();
  }

  @Override
  public void visit(DefStatement node) {
    printDecorators(node.getDecorators());
    startLine();
    if (node.isAsync()) {
      emit("async");
    }
    emit("def");
    emit(node.getIdentifier().getName());
    printTypeParameters(node.getTypeParameters());
    emit('(');
    printParameters(node.getParameters());
    emit(')');
    if (node.getReturns() != null) {
      emit("->");
      printExpr(node.getReturns());
    }
    printSuite(node.getBody());
  }

  @Override
  public void visit(ClassStatement node) {
    printDecorators(node.getDecorators());
    startLine();
    emit("class");
    emit(node.getIdentifier().getName());
    printTypeParameters(node.getTypeParameters());
    if (!node.getArguments().isEmpty()) {
      emit('(');
      printNodeList(node.getArguments());
      emit(')');
    }
    printSuite(node.getBody());
  }

  @Override
  public void visit(ReturnStatement node) {
    startLine();
    emit("return");
    if (node.getResult() != null) {
      printExpr(node.getResult());
    }
    endLine();
  }

  @Override
  public void visit(FlowStatement node) {
    startLine();
    emit(node.getFlowKind().toString());
    endLine();
  }

  @Override
  public void visit(RaiseStatement node) {
    startLine();
    emit("raise");
    if (node.getException() != null) {
      printExpr(node.getException());
      if (node.getCause() != null) {
        emit("from");
        printExpr(node.getCause());
      }
    }
    endLine();
  }

  @Override
  public void visit(AssertStatement node) {
    startLine();
    emit("assert");
    printExpr(node.getCondition());
    if (node.getMessage() != null) {
      emit(',');
      printExpr(node.getMessage());
    }
    endLine();
  }

  @Override
  public void visit(DelStatement node) {
    startLine();
    emit("del");
    printExprList(node.getTargets());
    endLine();
  }

  @Override
  public void visit(DeclarationStatement node) {
    startLine();
    emit(node.isGlobal() ? "global" : "nonlocal");
    printExprList(node.getNames());
    endLine();
  }

  @Override
  public void visit(ImportStatement node) {
    startLine();
    emit("import");
    printNodeList(node.getAliases());
    endLine();
  }

  @Override
  public void visit(ImportFromStatement node) {
    startLine();
    emit("from");
    emit(".".repeat(node.getLevel()));
    if (node.getModule() != null) {
      emit(node.getModule());
    }
    emit("import");
    if (node.isStar()) {
      emit('*');
    } else {
      printNodeList(node.getAliases());
    }
    endLine();
  }

  // An alias needs an explicit "as" unless the name it binds is the one the import would bind
  // anyway. "import a.b as a" binds a different module than "import a.b", so it keeps its "as".
  @Override
  public void visit(ImportStatement.Alias node) {
    emit(node.getImportedName());
    String importedName = node.getImportedName();
    String implicit =
        node.isDotted() ? importedName.substring(0, importedName.indexOf('.')) : importedName;
    String local = node.getLocal().getName();
    if (node.hasExplicitAlias() ? node.isDotted() || !local.equals(importedName)
        : !local.equals(implicit)) {
      emit("as");
      emit(local);
    }
  }

  @Override
  public void visit(IfStatement node) {
    startLine();
    emit(node.isElif() ? "elif" : "if");
    printExpr(node.getCondition());
    printSuite(node.getThenBlock());
    List<Statement> elseBlock = node.getElseBlock();
    if (elseBlock == null || elseBlock.isEmpty()) {
      return;
    }
    if (elseBlock.size() == 1
        && elseBlock.get(0) instanceof IfStatement elif
        && elif.isElif()) {
      elif.accept(this);
    } else {
      startLine();
      emit("else");
      printSuite(elseBlock);
    }
  }

  private void printElse(List<Statement> elseBlock) {
    if (!elseBlock.isEmpty()) {
      startLine();
      emit("else");
      printSuite(elseBlock);
    }
  }

  @Override
  public void visit(ForStatement node) {
    startLine();
    if (node.isAsync()) {
      emit("async");
    }
    emit("for");
    printExpr(node.getVars());
    emit("in");
    printExpr(node.getIterable());
    printSuite(node.getBody());
    printElse(node.getElseBlock());
  }

  @Override
  public void visit(WhileStatement node) {
    startLine();
    emit("while");
    printExpr(node.getCondition());
    printSuite(node.getBody());
    printElse(node.getElseBlock());
  }

  @Override
  public void visit(WithStatement node) {
    startLine();
    if (node.isAsync()) {
      emit("async");
    }
    emit("with");
    printNodeList(node.getItems());
    printSuite(node.getBody());
  }

  @Override
  public void visit(WithStatement.Item node) {
    printExpr(node.getContextExpression());
    if (node.getTarget() != null) {
      emit("as");
      printExpr(node.getTarget());
    }
  }

  @Override
  public void visit(TryStatement node) {
    startLine();
    emit("try");
    printSuite(node.getBody());
    for (TryStatement.ExceptHandler handler : node.getHandlers()) {
      startLine();
      emit("except");
      if (node.isStar()) {
        emit('*');
      }
      if (handler.getType() != null) {
        printExpr(handler.getType());
        if (handler.getName() != null) {
          emit("as");
          emit(handler.getName().getName());
        }
      }
      printSuite(handler.getBody());
    }
    printElse(node.getElseBlock());
    if (!node.getFinallyBlock().isEmpty()) {
      startLine();
      emit("finally");
      printSuite(node.getFinallyBlock());
    }
  }

  @Override
  public void visit(MatchStatement node) {
    startLine();
    emit("match");
    printExpr(node.getSubject());
    emit(':');
    endLine();
    indent++;
    for (MatchStatement.Case c : node.getCases()) {
      c.accept(this);
    }
    indent--;
  }

  @Override
  public void visit(MatchStatement.Case node) {
    startLine();
    emit("case");
    printNode(node.getPattern());
    if (node.getGuard() != null) {
      emit("if");
      printExpr(node.getGuard());
    }
    printSuite(node.getBody());
  }

  // --- parameters and arguments ---

  @Override
  public void visit(Parameter node) {
    if (node instanceof Parameter.Star) {
      emit('*');
    } else if (node instanceof Parameter.StarStar) {
      emit("**");
    }
    if (node.getIdentifier() != null) {
      emit(node.getIdentifier().getName());
    }
    if (node.getAnnotation() != null) {
      emit(':');
      printExpr(node.getAnnotation());
    }
    if (node.getDefaultValue() != null) {
      emit('=');
      printExpr(node.getDefaultValue());
    }
  }

  @Override
  public void visit(Argument node) {
    if (node instanceof Argument.Star) {
      emit('*');
    } else if (node instanceof Argument.StarStar) {
      emit("**");
    } else if (node instanceof Argument.Keyword keyword) {
      emit(keyword.getName());
      emit('=');
    }
    printExpr(node.getValue());
  }

  @Override
  public void visit(TypeParameter node) {
    switch (node.getTypeParameterKind()) {
      case TYPE_VAR_TUPLE -> emit('*');
      case PARAM_SPEC -> emit("**");
      case TYPE_VAR -> {}
    }
    emit(node.getIdentifier().getName());
    if (node.getBound() != null) {
      emit(':');
      printExpr(node.getBound());
    }
    if (node.getDefaultValue() != null) {
      emit('=');
      printExpr(node.getDefaultValue());
    }
  }

  // --- patterns ---

  private void printPattern(Pattern pattern) {
    if (pattern.isParenthesized()) {
      emit('(');
      pattern.accept(this);
      emit(')');
    } else {
      pattern.accept(this);
    }
  }

  private void printPatternList(List<Pattern> patterns) {
    String sep = "";
    for (Pattern p : patterns) {
      emit(sep);
      printPattern(p);
      sep = ",";
    }
  }

  @Override
  public void visit(Pattern.Value node) {
    printExpr(node.getValue());
  }

  @Override
  public void visit(Pattern.As node) {
    if (node.getPattern() != null) {
      printPattern(node.getPattern());
      emit("as");
    }
    emit(node.getName() != null ? node.getName().getName() : "_");
  }

  @Override
  public void visit(Pattern.Or node) {
    String sep = "";
    for (Pattern p : node.getPatterns()) {
      emit(sep);
      printPattern(p);
      sep = "|";
    }
  }

  @Override
  public void visit(Pattern.Sequence node) {
    boolean open = node.isOpen();
    if (!open) {
      emit(node.isTuple() ? '(' : '[');
    }
    printPatternList(node.getPatterns());
    if (node.isTuple() && node.getPatterns().size() == 1) {
      emit(',');
    }
    if (!open) {
      emit(node.isTuple() ? ')' : ']');
    }
  }

  @Override
  public void visit(Pattern.Star node) {
    emit('*');
    emit(node.getName() != null ? node.getName().getName() : "_");
  }

  @Override
  public void visit(Pattern.Mapping node) {
    emit('{');
    String sep = "";
    for (int i = 0; i < node.getKeys().size(); i++) {
      emit(sep);
      printExpr(node.getKeys().get(i));
      emit(':');
      printPattern(node.getPatterns().get(i));
      sep = ",";
    }
    if (node.getRest() != null) {
      emit(sep);
      emit("**");
      emit(node.getRest().getName());
    }
    emit('}');
  }

  @Override
  public void visit(Pattern.ClassPattern node) {
    printExpr(node.getCls());
    emit('(');
    printPatternList(node.getPatterns());
    String sep = node.getPatterns().isEmpty() ? "" : ",";
    for (int i = 0; i < node.getKeywords().size(); i++) {
      emit(sep);
      emit(node.getKeywords().get(i).getName());
      emit('=');
      printPattern(node.getKeywordPatterns().get(i));
      sep = ",";
    }
    emit(')');
  }

  // --- expressions ---

  @Override
  public void visit(Identifier node) {
    emit(node.getName());
  }

  @Override
  public void visit(IntLiteral node) {
    emit(node.getRaw());
  }

  @Override
  public void visit(FloatLiteral node) {
    emit(node.getRaw());
  }

  @Override
  public void visit(StringLiteral node) {
    emit(node.getRaw());
  }

  @Override
  public void visit(StringConcatenation node) {
    for (Expression part : node.getParts()) {
      printExpr(part);
    }
  }

  @Override
  public void visit(NamedConstant node) {
    emit(node.getValue().toString());
  }

  @Override
  public void visit(Ellipsis node) {
    emit("...");
  }

  @Override
  public void visit(FormattedString node) {
    emit(node.getPrefix() + node.getQuote());
    printParts(node.getParts());
    buf.append(node.getQuote());
  }

  private void printParts(List<FormattedString.Part> parts) {
    for (FormattedString.Part part : parts) {
      part.accept(this);
    }
  }

  @Override
  public void visit(FormattedString.Text node) {
    buf.append(node.getRaw());
  }

  // A self-documenting field {x=} is printed in the equivalent form x={x!r}, so that its text
  // survives renaming of the expression.
  @Override
  public void visit(FormattedString.Field node) {
    char conversion = node.getConversion();
    if (node.isSelfDocumenting()) {
      buf.append(node.getSelfDocumentingText().replace("{", "{{").replace("}", "}}"));
      if (conversion == 0 && node.getFormatSpec() == null) {
        conversion = 'r';
      }
    }
    buf.append('{');
    String value = print(node.getValue());
    if (value.startsWith("{")) {
      buf.append(' ');
    }
    buf.append(value);
    if (conversion != 0) {
      buf.append('!').append(conversion);
    }
    if (node.getFormatSpec() != null) {
      buf.append(':');
      printParts(node.getFormatSpec());
    }
    buf.append('}');
  }

  @Override
  public void visit(BinaryOperatorExpression node) {
    printExpr(node.getX());
    emit(node.getOperator().toString());
    printExpr(node.getY());
  }

  @Override
  public void visit(ComparisonExpression node) {
    printExpr(node.getLeft());
    for (int i = 0; i < node.getOperators().size(); i++) {
      emit(node.getOperators().get(i).toString());
      printExpr(node.getComparators().get(i));
    }
  }

  @Override
  public void visit(UnaryOperatorExpression node) {
    emit(node.getOperator().toString());
    printExpr(node.getX());
  }

  @Override
  public void visit(ConditionalExpression node) {
    printExpr(node.getThenCase());
    emit("if");
    printExpr(node.getCondition());
    emit("else");
    printExpr(node.getElseCase());
  }

  @Override
  public void visit(LambdaExpression node) {
    emit("lambda");
    printParameters(node.getParameters());
    emit(':');
    printExpr(node.getBody());
  }

  @Override
  public void visit(CallExpression node) {
    printExpr(node.getFunction());
    emit('(');
    List<Argument> args = node.getArguments();
    if (args.size() == 1
        && args.get(0) instanceof Argument.Positional
        && args.get(0).getValue() instanceof Comprehension comp
        && isGenerator(comp)) {
      // The call's parentheses serve the generator too.
      printComprehensionContents(comp);
    } else {
      printNodeList(args);
    }
    emit(')');
  }

  @Override
  public void visit(DotExpression node) {
    Expression object = node.getObject();
    printExpr(object);
    if (object instanceof IntLiteral && !object.isParenthesized()) {
      buf.append(' '); // "1.real" would scan as a float
    }
    emit('.');
    emit(node.getField().getName());
  }

  @Override
  public void visit(IndexExpression node) {
    printExpr(node.getObject());
    emit('[');
    printExpr(node.getKey());
    emit(']');
  }

  @Override
  public void visit(SliceExpression node) {
    if (node.getStart() != null) {
      printExpr(node.getStart());
    }
    emit(':');
    if (node.getStop() != null) {
      printExpr(node.getStop());
    }
    if (node.getStep() != null) {
      emit(':');
      printExpr(node.getStep());
    }
  }

  @Override
  public void visit(ListExpression node) {
    if (!node.isTuple()) {
      emit('[');
    }
    printExprList(node.getElements());
    if (node.isTuple() && node.getElements().size() == 1) {
      emit(',');
    }
    if (!node.isTuple()) {
      emit(']');
    }
  }

  @Override
  public void visit(SetExpression node) {
    emit('{');
    printExprList(node.getElements());
    emit('}');
  }

  @Override
  public void visit(DictExpression node) {
    emit('{');
    printNodeList(node.getEntries());
    emit('}');
  }

  @Override
  public void visit(DictExpression.Entry node) {
    if (node.getKey() != null) {
      printExpr(node.getKey());
      emit(':');
    } else {
      emit("**");
    }
    printExpr(node.getValue());
  }

  @Override
  public void visit(Comprehension node) {
    switch (node.getComprehensionKind()) {
      case LIST -> {
        emit('[');
        printComprehensionContents(node);
        emit(']');
      }
      case SET, DICT -> {
        emit('{');
        printComprehensionContents(node);
        emit('}');
      }
      case GENERATOR -> {
        emit('(');
        printComprehensionContents(node);
        emit(')');
      }
    }
  }

  private void printComprehensionContents(Comprehension node) {
    printNode(node.getBody());
    for (Comprehension.Clause clause : node.getClauses()) {
      clause.accept(this);
    }
  }

  @Override
  public void visit(Comprehension.For node) {
    if (node.isAsync()) {
      emit("async");
    }
    emit("for");
    printExpr(node.getVars());
    emit("in");
    printExpr(node.getIterable());
  }

  @Override
  public void visit(Comprehension.If node) {
    emit("if");
    printExpr(node.getCondition());
  }

  @Override
  public void visit(StarredExpression node) {
    emit('*');
    printExpr(node.getValue());
  }

  @Override
  public void visit(NamedExpression node) {
    emit(node.getTarget().getName());
    emit(":=");
    printExpr(node.getValue());
  }

  @Override
  public void visit(YieldExpression node) {
    emit("yield");
    if (node.isFrom()) {
      emit("from");
    }
    if (node.getValue() != null) {
      printExpr(node.getValue());
    }
  }

  @Override
  public void visit(AwaitExpression node) {
    emit("await");
    printExpr(node.getValue());
  }
}
