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

import javax.annotation.Nullable;

/** Syntax node for {@code raise [exc [from cause]]}. */
public final class RaiseStatement extends Statement {

  private final int raiseOffset;
  @Nullable private final Expression exception;
  @Nullable private final Expression cause;

  RaiseStatement(
      FileLocations locs,
      int raiseOffset,
      @Nullable Expression exception,
      @Nullable Expression cause) {
    super(locs, Kind.RAISE);
    this.raiseOffset = raiseOffset;
    this.exception = exception;
    this.cause = cause;
  }

  @Nullable
  public Expression getException() {
    return exception;
  }

  @Nullable
  public Expression getCause() {
    return cause;
  }

  @Override
  public int getStartOffset() {
    return raiseOffset;
  }

  @Override
  public int getEndOffset() {
    if (cause != null) {
      return cause.getEndOffset();
    }
    return exception != null ? exception.getEndOffset() : raiseOffset + "raise".length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
