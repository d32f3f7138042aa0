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

import java.util.Arrays;

/**
 * FileLocations maps each source offset within a file to a Location. An offset is a (UTF-16) char
 * index such that {@code 0 <= offs <= size}.
 */
final class FileLocations {

  private final int[] linestart; // maps line number (line >= 1) to char offset
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    return new FileLocations(computeLinestart(buffer), file, buffer.length);
  }

  private static int[] computeLinestart(char[] buffer) {
    int[] linestart = new int[64];
    int lines = 0;
    linestart[lines++] = 0; // line 0 is unused; see getLineAt
    linestart[lines++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (lines == linestart.length) {
          linestart = Arrays.copyOf(linestart, lines * 2);
        }
        linestart[lines++] = i + 1;
      }
    }
    return Arrays.copyOf(linestart, lines);
  }

  String file() {
    return file;
  }

  int size() {
    return size;
  }

  // Returns the 1-based line number for the given offset.
  private int getLineAt(int offset) {
    if (offset < 0 || offset > size) {
      throw new IllegalStateException("Illegal position: " + offset);
    }
    int index = Arrays.binarySearch(linestart, 1, linestart.length, offset);
    if (index < 0) {
      index = -index - 2; // the line containing offset
    }
    return index;
  }

  /** Returns the location of the given char offset. */
  Location getLocation(int offset) {
    int line = getLineAt(offset);
    int column = offset - linestart[line] + 1;
    return new Location(file, line, column);
  }
}
