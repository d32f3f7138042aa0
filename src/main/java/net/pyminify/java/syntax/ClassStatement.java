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

import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a class definition, {@code class C[T](bases, metaclass=M): body}. The bases and
 * keywords are represented as call {@link Argument}s.
 */
public final class ClassStatement extends Statement {

  private final int startOffset; // offset of the first decorator, or of 'class'
  private final ImmutableList<Expression> decorators;
  private final Identifier identifier;
  private final ImmutableList<TypeParameter> typeParameters;
  private final ImmutableList<Argument> arguments;
  private final boolean hasParens;
  private final ImmutableList<Statement> body; // non-empty if well formed

  ClassStatement(
      FileLocations locs,
      int startOffset,
      ImmutableList<Expression> decorators,
      Identifier identifier,
      ImmutableList<TypeParameter> typeParameters,
      ImmutableList<Argument> arguments,
      boolean hasParens,
      ImmutableList<Statement> body) {
    super(locs, Kind.CLASS);
    this.startOffset = startOffset;
    this.decorators = decorators;
    this.identifier = identifier;
    this.typeParameters = typeParameters;
    this.arguments = arguments;
    this.hasParens = hasParens;
    this.body = body;
  }

  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public ImmutableList<TypeParameter> getTypeParameters() {
    return typeParameters;
  }

  /** Returns the base classes and class keywords, in source order. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  /** Reports whether the source wrote a (possibly empty) parenthesized base list. */
  public boolean hasParens() {
    return hasParens;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOfBlock(body, identifier.getEndOffset());
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
