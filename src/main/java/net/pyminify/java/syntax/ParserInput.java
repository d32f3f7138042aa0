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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** The input to parsing: the contents of a Python source file and its name. */
public final class ParserInput {

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = file;
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the (non-null) file name of the input source. */
  public String getFile() {
    return file;
  }

  /**
   * Returns an input source that reads from a UTF-8-encoded byte array. A leading byte-order mark
   * is dropped.
   */
  public static ParserInput fromUTF8(byte[] bytes, String file) {
    String text = new String(bytes, UTF_8);
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    return fromString(text, file);
  }

  /** Returns an unnamed input source that reads from a list of lines joined by newlines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines), "");
  }

  /** Returns an input source that reads from the given text. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /** Returns an input source that reads from the named UTF-8 file. */
  public static ParserInput readFile(String filename) throws IOException {
    Path path = Paths.get(filename);
    return fromUTF8(Files.readAllBytes(path), filename);
  }
}
