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
import javax.annotation.Nullable;

/**
 * Syntax node for a PEP 695 type parameter of a generic {@code def} or {@code class}: {@code T},
 * {@code T: bound}, {@code *Ts}, or {@code **P}, each with an optional {@code = default}.
 */
public final class TypeParameter extends Node {

  /** The three forms of type parameter. */
  public enum TypeParameterKind {
    TYPE_VAR,
    TYPE_VAR_TUPLE,
    PARAM_SPEC,
  }

  private final TypeParameterKind typeParameterKind;
  private final int startOffset;
  private final Identifier name;
  @Nullable private final Expression bound;
  @Nullable private final Expression defaultValue;

  TypeParameter(
      FileLocations locs,
      TypeParameterKind typeParameterKind,
      int startOffset,
      Identifier name,
      @Nullable Expression bound,
      @Nullable Expression defaultValue) {
    super(locs);
    Preconditions.checkArgument(bound == null || typeParameterKind == TypeParameterKind.TYPE_VAR);
    this.typeParameterKind = typeParameterKind;
    this.startOffset = startOffset;
    this.name = name;
    this.bound = bound;
    this.defaultValue = defaultValue;
  }

  public TypeParameterKind getTypeParameterKind() {
    return typeParameterKind;
  }

  public Identifier getIdentifier() {
    return name;
  }

  /** Returns the bound or constraint tuple of a TypeVar, or null. */
  @Nullable
  public Expression getBound() {
    return bound;
  }

  @Nullable
  public Expression getDefaultValue() {
    return defaultValue;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    if (defaultValue != null) {
      return defaultValue.getEndOffset();
    }
    return bound != null ? bound.getEndOffset() : name.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
