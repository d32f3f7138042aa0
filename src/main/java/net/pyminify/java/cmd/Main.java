// Copyright 2016 The Bazel Authors. All rights reserved.
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

import com.google.common.base.Splitter;
import java.io.IOException;
import net.pyminify.java.rename.RenameOptions;
import net.pyminify.java.rename.Renamer;
import net.pyminify.java.syntax.FileOptions;
import net.pyminify.java.syntax.NodePrinter;
import net.pyminify.java.syntax.ParserInput;
import net.pyminify.java.syntax.PythonFile;
import net.pyminify.java.syntax.StructuralException;
import net.pyminify.java.syntax.SyntaxError;

/**
 * Main shortens the identifiers of a Python file and prints the result on standard output.
 *
 * <pre>
 * usage: pyminify-rename [--rename-globals] [--no-rename-locals] [--alias-builtins]
 *                        [--preserve a,b] [--no-list-comp-scope] file.py
 * </pre>
 */
class Main {

  private static final String USAGE =
      "usage: pyminify-rename [--rename-globals] [--no-rename-locals] [--alias-builtins]"
          + " [--preserve a,b] [--no-list-comp-scope] file.py";

  // Parses the flags into options, and returns the index of the first positional argument.
  static int parseFlags(String[] args, RenameOptions.Builder options) throws IOException {
    FileOptions.Builder fileOptions = FileOptions.builder();
    int i;
    for (i = 0; i < args.length; i++) {
      if (!args[i].startsWith("-")) {
        break;
      }
      if (args[i].equals("--")) {
        i++;
        break;
      }
      switch (args[i]) {
        case "--rename-globals":
          options.renameGlobals(true);
          break;
        case "--no-rename-locals":
          options.renameLocals(false);
          break;
        case "--alias-builtins":
          options.aliasBuiltins(true);
          break;
        case "--no-list-comp-scope":
          fileOptions.listComprehensionHasOwnScope(false);
          break;
        case "--preserve":
          if (i + 1 == args.length) {
            throw new IOException("--preserve <names> flag needs an argument");
          }
          options.preserveNames(Splitter.on(',').omitEmptyStrings().trimResults().split(args[++i]));
          break;
        default:
          throw new IOException("unknown flag: " + args[i]);
      }
    }
    options.fileOptions(fileOptions.build());
    return i;
  }

  /** Renames the file and prints it, returning the exit status. */
  static int run(ParserInput input, RenameOptions options) {
    PythonFile file = PythonFile.parse(input, options.fileOptions());
    if (!file.ok()) {
      for (SyntaxError error : file.errors()) {
        System.err.println(error);
      }
      return 1;
    }
    try {
      new Renamer(options).rename(file);
    } catch (StructuralException ex) {
      System.err.println("internal error: " + ex.getMessage());
      return 2;
    }
    System.out.print(NodePrinter.print(file));
    return 0;
  }

  public static void main(String[] args) throws IOException {
    RenameOptions.Builder options = RenameOptions.builder();
    int i = parseFlags(args, options);
    if (i + 1 != args.length) {
      System.err.println(USAGE);
      System.exit(1);
    }

    String file = args[i];
    int exit;
    try {
      exit = run(ParserInput.readFile(file), options.build());
    } catch (IOException e) {
      System.err.format("Error reading %s: %s\n", file, e);
      exit = 1;
    }
    System.exit(exit);
  }
}
