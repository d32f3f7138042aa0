// Copyright 2020 The Bazel Authors. All rights reserved.
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

import com.google.auto.value.AutoValue;

/**
 * FileOptions is a set of options that affect the static processing (scanning, parsing and scope
 * analysis) of a single Python file. These options select the dialect of the target language
 * version, analogous to the target-version flags of a typical compiler.
 *
 * <p>The {@link #DEFAULT} options describe current Python 3.
 */
@AutoValue
public abstract class FileOptions {

  /** The default options: current Python 3 semantics. */
  public static final FileOptions DEFAULT = builder().build();

  /**
   * During namespace construction, give list comprehensions their own function scope, as Python 3
   * does. When false, the comprehension's loop variables are bound in the enclosing scope, as in
   * Python 2.
   */
  public abstract boolean listComprehensionHasOwnScope();

  /**
   * During parsing, accept PEP 695 type parameter lists on {@code def} and {@code class}
   * statements.
   */
  public abstract boolean allowTypeParameters();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FileOptions.Builder()
        .listComprehensionHasOwnScope(true)
        .allowTypeParameters(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link FileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder listComprehensionHasOwnScope(boolean value);

    public abstract Builder allowTypeParameters(boolean value);

    public abstract FileOptions build();
  }
}
