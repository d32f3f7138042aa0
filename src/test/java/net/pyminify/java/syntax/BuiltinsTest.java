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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Builtins}. */
@RunWith(JUnit4.class)
public final class BuiltinsTest {

  @Test
  public void python3ContainsFunctionsExceptionsAndModuleNames() {
    Builtins builtins = Builtins.python3();
    assertThat(builtins.contains("len")).isTrue();
    assertThat(builtins.contains("ValueError")).isTrue();
    assertThat(builtins.contains("__name__")).isTrue();
    assertThat(builtins.contains("foo")).isFalse();
  }

  @Test
  public void extendDoesNotModifyOriginal() {
    Builtins base = Builtins.of(java.util.Arrays.asList("a", "b"));
    Builtins extended = base.extend("c");
    assertThat(extended.names()).containsExactly("a", "b", "c");
    assertThat(base.contains("c")).isFalse();
  }

  @Test
  public void reflectiveNames() {
    assertThat(Builtins.isReflective("eval")).isTrue();
    assertThat(Builtins.isReflective("locals")).isTrue();
    assertThat(Builtins.isReflective("print")).isFalse();
  }
}
