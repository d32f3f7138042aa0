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

/** Syntax node for an assignment expression, {@code target := value}. */
public final class NamedExpression extends Expression {

  private final Identifier target;
  private final Expression value;

  NamedExpression(FileLocations locs, Identifier target, Expression value) {
    super(locs, Kind.NAMED);
    this.target = target;
    this.value = value;
  }

  /** Returns the assigned variable. Inside a comprehension it binds in the enclosing scope. */
  public Identifier getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return target.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return value.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
