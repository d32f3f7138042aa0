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

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import net.pyminify.java.syntax.Identifier;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of {@link NameGenerator}. */
@RunWith(TestParameterInjector.class)
public final class NameGeneratorTest {

  private static List<String> take(NameGenerator names, int n) {
    List<String> result = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      result.add(names.next());
    }
    return result;
  }

  @Test
  public void singleLettersComeFirst() {
    List<String> names = take(new NameGenerator(), 53);
    assertThat(names.get(0)).isEqualTo("a");
    assertThat(names.get(25)).isEqualTo("z");
    assertThat(names.get(26)).isEqualTo("A");
    assertThat(names.get(51)).isEqualTo("Z");
    assertThat(names.get(52)).isEqualTo("aa");
  }

  @Test
  public void keywordsAreSkipped() {
    NameGenerator generator = new NameGenerator();
    // 52 single letters, then the 52 * 63 two-character names less the five keywords among them.
    List<String> names = take(generator, 52 + 52 * 63 - 5);
    assertThat(names).containsNoneOf("as", "if", "in", "is", "or");
    assertThat(names).containsAtLeast("ab", "a_", "Z9");
    assertThat(names).containsNoDuplicates();
    assertThat(generator.next()).isEqualTo("aaa");
  }

  @Test
  public void nameAt() {
    assertThat(NameGenerator.nameAt(0)).isEqualTo("a");
    assertThat(NameGenerator.nameAt(52)).isEqualTo("aa");
    assertThat(NameGenerator.nameAt(53)).isEqualTo("ab");
    assertThat(NameGenerator.nameAt(52 + 62)).isEqualTo("a_");
    assertThat(NameGenerator.nameAt(52 + 63)).isEqualTo("ba");
  }

  @Test
  public void everyNameIsAnIdentifier(
      @TestParameter({"0", "51", "52", "3000", "200000", "10000000"}) int index) {
    String name = NameGenerator.nameAt(index);
    assertThat(Identifier.isValid(name)).isTrue();
  }
}
