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

package net.pyminify.java.cmd;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import net.pyminify.java.rename.RenameOptions;
import net.pyminify.java.syntax.ParserInput;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the command-line driver. */
@RunWith(JUnit4.class)
public final class MainTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private PrintStream savedOut;
  private PrintStream savedErr;

  @Before
  public void redirect() {
    savedOut = System.out;
    savedErr = System.err;
    System.setOut(new PrintStream(out, true, UTF_8));
    System.setErr(new PrintStream(err, true, UTF_8));
  }

  @After
  public void restore() {
    System.setOut(savedOut);
    System.setErr(savedErr);
  }

  @Test
  public void flagsSetOptions() throws Exception {
    RenameOptions.Builder builder = RenameOptions.builder();
    int i =
        Main.parseFlags(
            new String[] {
              "--rename-globals", "--no-list-comp-scope", "--preserve", "a, b", "file.py"
            },
            builder);
    RenameOptions options = builder.build();
    assertThat(i).isEqualTo(4);
    assertThat(options.renameGlobals()).isTrue();
    assertThat(options.renameLocals()).isTrue();
    assertThat(options.preserveNames()).containsExactly("a", "b");
    assertThat(options.fileOptions().listComprehensionHasOwnScope()).isFalse();
    assertThat(options.aliasBuiltins()).isFalse();
  }

  @Test
  public void aliasBuiltinsFlag() throws Exception {
    RenameOptions.Builder builder = RenameOptions.builder();
    int i = Main.parseFlags(new String[] {"--alias-builtins", "--", "-file.py"}, builder);
    assertThat(i).isEqualTo(2);
    assertThat(builder.build().aliasBuiltins()).isTrue();
  }

  @Test
  public void unknownFlagIsRejected() {
    IOException ex =
        assertThrows(
            IOException.class,
            () -> Main.parseFlags(new String[] {"--shorten"}, RenameOptions.builder()));
    assertThat(ex).hasMessageThat().isEqualTo("unknown flag: --shorten");
  }

  @Test
  public void printsRenamedProgram() {
    int exit =
        Main.run(
            ParserInput.fromLines("def f(items):", "  total = 0", "  return total"),
            RenameOptions.DEFAULT);
    assertThat(exit).isEqualTo(0);
    assertThat(out.toString(UTF_8)).isEqualTo("def f(items):\n a=0\n return a\n");
  }

  @Test
  public void syntaxErrorsAreReported() {
    int exit = Main.run(ParserInput.fromString("x = )", "bad.py"), RenameOptions.DEFAULT);
    assertThat(exit).isEqualTo(1);
    assertThat(out.toString(UTF_8)).isEmpty();
    assertThat(err.toString(UTF_8)).startsWith("bad.py:1:");
  }
}
