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

/**
 * Syntax node for a try statement, with its except handlers and optional else and finally blocks.
 * A {@code try/except*} statement is represented with {@link #isStar} set.
 */
public final class TryStatement extends Statement {

  /** An except clause, {@code except [type [as name]]: body}. */
  public static final class ExceptHandler extends Node {
    private final int exceptOffset;
    @Nullable private final Expression type;
    @Nullable private final Identifier name;
    private final ImmutableList<Statement> body;

    ExceptHandler(
        FileLocations locs,
        int exceptOffset,
        @Nullable Expression type,
        @Nullable Identifier name,
        ImmutableList<Statement> body) {
      super(locs);
      this.exceptOffset = exceptOffset;
      this.type = type;
      this.name = name;
      this.body = body;
    }

    /** Returns the exception type expression, or null for a bare {@code except:}. */
    @Nullable
    public Expression getType() {
      return type;
    }

    /** Returns the identifier bound by {@code as name}, or null. */
    @Nullable
    public Identifier getName() {
      return name;
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    @Override
    public int getStartOffset() {
      return exceptOffset;
    }

    @Override
    public int getEndOffset() {
      return endOfBlock(body, exceptOffset + "except".length());
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int tryOffset;
  private final ImmutableList<Statement> body;
  private final ImmutableList<ExceptHandler> handlers;
  private final boolean isStar;
  private final ImmutableList<Statement> elseBlock; // empty if absent
  private final ImmutableList<Statement> finallyBlock; // empty if absent

  TryStatement(
      FileLocations locs,
      int tryOffset,
      ImmutableList<Statement> body,
      ImmutableList<ExceptHandler> handlers,
      boolean isStar,
      ImmutableList<Statement> elseBlock,
      ImmutableList<Statement> finallyBlock) {
    super(locs, Kind.TRY);
    this.tryOffset = tryOffset;
    this.body = body;
    this.handlers = handlers;
    this.isStar = isStar;
    this.elseBlock = elseBlock;
    this.finallyBlock = finallyBlock;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<ExceptHandler> getHandlers() {
    return handlers;
  }

  /** Reports whether the handlers are {@code except*} clauses. */
  public boolean isStar() {
    return isStar;
  }

  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }

  public ImmutableList<Statement> getFinallyBlock() {
    return finallyBlock;
  }

  @Override
  public int getStartOffset() {
    return tryOffset;
  }

  @Override
  public int getEndOffset() {
    if (!finallyBlock.isEmpty()) {
      return endOfBlock(finallyBlock, 0);
    }
    if (!elseBlock.isEmpty()) {
      return endOfBlock(elseBlock, 0);
    }
    if (!handlers.isEmpty()) {
      return handlers.get(handlers.size() - 1).getEndOffset();
    }
    return endOfBlock(body, tryOffset + "try".length());
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
