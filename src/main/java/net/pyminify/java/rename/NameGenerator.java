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

import com.google.common.collect.ImmutableSet;
import java.util.Iterator;

/**
 * NameGenerator yields candidate names in order of increasing length: {@code a} to {@code z},
 * {@code A} to {@code Z}, then two-character names and so on. A name starts with a letter and
 * continues with letters, digits and underscores. Keywords (including the soft keywords) are
 * skipped, so every name yielded is a valid identifier.
 *
 * <p>The sequence is infinite and the same on every run.
 */
public final class NameGenerator implements Iterator<String> {

  static final String FIRST = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
  static final String REST = FIRST + "0123456789_";

  /** The reserved words of Python 3, including soft keywords, which are never yielded. */
  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "case",
          "class", "continue", "def", "del", "elif", "else", "except", "finally", "for", "from",
          "global", "if", "import", "in", "is", "lambda", "match", "nonlocal", "not", "or",
          "pass", "raise", "return", "try", "type", "while", "with", "yield");

  private long index;

  @Override
  public boolean hasNext() {
    return true;
  }

  @Override
  public String next() {
    while (true) {
      String name = nameAt(index++);
      if (!KEYWORDS.contains(name)) {
        return name;
      }
    }
  }

  /** Returns the name at the given position of the sequence, keywords included. */
  static String nameAt(long index) {
    int length = 1;
    long count = FIRST.length();
    while (index >= count) {
      index -= count;
      count *= REST.length();
      length++;
    }
    char[] name = new char[length];
    for (int i = length - 1; i > 0; i--) {
      name[i] = REST.charAt((int) (index % REST.length()));
      index /= REST.length();
    }
    name[0] = FIRST.charAt((int) index);
    return new String(name);
  }
}
