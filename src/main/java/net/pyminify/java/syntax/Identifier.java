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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax node for an identifier.
 *
 * <p>Every occurrence of a name in the program is an Identifier: variable uses, assignment targets,
 * parameter names, the names of {@code def} and {@code class} statements, import bindings,
 * exception and pattern captures, and the names listed by {@code global} and {@code nonlocal}. A
 * few identifiers do not denote a variable at all (attribute fields, keyword-argument names, and
 * class-pattern keywords); {@link NodeVisitor#skipNonSymbolIdentifiers} skips them.
 */
public final class Identifier extends Expression {

  /** The way an identifier occurrence uses its name. */
  public enum Context {
    LOAD,
    STORE,
    DEL,
  }

  private String name;
  private final int nameOffset;
  private final int nameLength;
  private Context context;

  // set by Resolver (or Binder, for identifiers that create bindings)
  @Nullable private NameBinding binding;

  Identifier(FileLocations locs, String name, int nameOffset) {
    this(locs, name, nameOffset, Context.LOAD);
  }

  Identifier(FileLocations locs, String name, int nameOffset, Context context) {
    super(locs, Kind.IDENTIFIER);
    this.name = name;
    this.nameOffset = nameOffset;
    this.nameLength = name.length();
    this.context = context;
  }

  @Override
  public int getStartOffset() {
    return nameOffset;
  }

  // The extent of the identifier in the source, which is unaffected by renaming.
  @Override
  public int getEndOffset() {
    return nameOffset + nameLength;
  }

  /**
   * Returns the current name of the Identifier. After renaming, this is the assigned name, and
   * differs from the source text. If there were parse errors, misparsed regions may be represented
   * as an Identifier for which {@code !isValid(getName())}.
   */
  public String getName() {
    return name;
  }

  /** Rewrites the name of this occurrence. Only a {@link NameBinding} renames its references. */
  void setName(String name) {
    this.name = name;
  }

  public Context getContext() {
    return context;
  }

  void setContext(Context context) {
    this.context = context;
  }

  /** Returns the binding this identifier denotes, or null before (or outside) resolution. */
  @Nullable
  public NameBinding getBinding() {
    return binding;
  }

  void setBinding(@Nullable NameBinding binding) {
    this.binding = binding;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Reports whether the string is a valid (ASCII) identifier. */
  public static boolean isValid(String name) {
    // Keep consistent with Lexer.scanIdentifier.
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(('a' <= c && c <= 'z')
          || ('A' <= c && c <= 'Z')
          || (i > 0 && '0' <= c && c <= '9')
          || (c == '_')
          || c > 0x7f)) {
        return false;
      }
    }
    return !name.isEmpty();
  }

  /** Reports whether the name has the reserved {@code __dunder__} form. */
  public static boolean isDunder(String name) {
    return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
  }

  /**
   * Returns all names bound by an assignment target.
   *
   * <p>Examples:
   *
   * <ul>
   *   <li>{@code x = ...} binds x.
   *   <li>{@code x, [y, *z] = ..} binds x, y, z.
   *   <li>{@code x[5] = ..} and {@code x.f = ...} do not bind any names.
   * </ul>
   */
  public static ImmutableList<Identifier> boundIdentifiers(Expression expr) {
    if (expr instanceof Identifier id) {
      // Common case/fast path - skip the builder.
      return ImmutableList.of(id);
    }
    ImmutableList.Builder<Identifier> result = ImmutableList.builder();
    collectBoundIdentifiers(expr, result);
    return result.build();
  }

  private static void collectBoundIdentifiers(
      Expression lhs, ImmutableList.Builder<Identifier> result) {
    if (lhs instanceof Identifier id) {
      result.add(id);
    } else if (lhs instanceof ListExpression list) {
      for (Expression elem : list.getElements()) {
        collectBoundIdentifiers(elem, result);
      }
    } else if (lhs instanceof StarredExpression starred) {
      collectBoundIdentifiers(starred.getValue(), result);
    }
  }
}
