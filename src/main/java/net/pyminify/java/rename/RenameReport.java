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

package net.pyminify.java.rename;

import com.google.auto.value.AutoValue;

/** RenameReport summarizes the outcome of renaming one file. */
@AutoValue
public abstract class RenameReport {

  /** The number of bindings of the file, renameable or not. */
  public abstract int bindingsConsidered();

  /** The number of bindings given a new name. */
  public abstract int bindingsRenamed();

  /** The number of bytes by which renaming shortens the program. */
  public abstract long bytesSaved();

  static RenameReport create(int bindingsConsidered, int bindingsRenamed, long bytesSaved) {
    return new AutoValue_RenameReport(bindingsConsidered, bindingsRenamed, bytesSaved);
  }
}
