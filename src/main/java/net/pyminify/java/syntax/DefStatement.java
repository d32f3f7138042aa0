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
import javax.annotation.Nullable;

/** Syntax node for a function definition, {@code [async] def f[T](params) -> returns: body}. */
public final class DefStatement extends Statement {

  private final int startOffset; // offset of the first decorator, or of 'def'/'async'
  private final ImmutableList<Expression> decorators;
  private final boolean isAsync;
  private final Identifier identifier;
  private final ImmutableList<TypeParameter> typeParameters;
  private final ImmutableList<Parameter> parameters;
  @Nullable private final Expression returns;
  private final ImmutableList<Statement> body; // non-empty if well formed

  DefStatement(
      FileLocations locs,
      int startOffset,
      ImmutableList<Expression> decorators,
      boolean isAsync,
      Identifier identifier,
      ImmutableList<TypeParameter> typeParameters,
      ImmutableList<Parameter> parameters,
      @Nullable Expression returns,
      ImmutableList<Statement> body) {
    super(locs, Kind.DEF);
    this.startOffset = startOffset;
    this.decorators = decorators;
    this.isAsync = isAsync;
    this.identifier = identifier;
    this.typeParameters = typeParameters;
    this.parameters = parameters;
    this.returns = returns;
    this.body = body;
  }

  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public boolean isAsync() {
    return isAsync;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public ImmutableList<TypeParameter> getTypeParameters() {
    return typeParameters;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  /** Returns the return annotation, or null. */
  @Nullable
  public Expression getReturns() {
    return returns;
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
