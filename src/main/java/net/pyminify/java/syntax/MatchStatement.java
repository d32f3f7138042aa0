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

/** Syntax node for a {@code match subject:} statement and its cases. */
public final class MatchStatement extends Statement {

  /** A {@code case pattern [if guard]: body} clause. */
  public static final class Case extends Node {
    private final int caseOffset;
    private final Pattern pattern;
    @Nullable private final Expression guard;
    private final ImmutableList<Statement> body;

    Case(
        FileLocations locs,
        int caseOffset,
        Pattern pattern,
        @Nullable Expression guard,
        ImmutableList<Statement> body) {
      super(locs);
      this.caseOffset = caseOffset;
      this.pattern = pattern;
      this.guard = guard;
      this.body = body;
    }

    public Pattern getPattern() {
      return pattern;
    }

    @Nullable
    public Expression getGuard() {
      return guard;
    }

    public ImmutableList<Statement> getBody() {
      return body;
    }

    @Override
    public int getStartOffset() {
      return caseOffset;
    }

    @Override
    public int getEndOffset() {
      return endOfBlock(body, pattern.getEndOffset());
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int matchOffset;
  private final Expression subject;
  private final ImmutableList<Case> cases;

  MatchStatement(
      FileLocations locs, int matchOffset, Expression subject, ImmutableList<Case> cases) {
    super(locs, Kind.MATCH);
    this.matchOffset = matchOffset;
    this.subject = subject;
    this.cases = cases;
  }

  public Expression getSubject() {
    return subject;
  }

  public ImmutableList<Case> getCases() {
    return cases;
  }

  @Override
  public int getStartOffset() {
    return matchOffset;
  }

  @Override
  public int getEndOffset() {
    return cases.isEmpty()
        ? subject.getEndOffset()
        : cases.get(cases.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
