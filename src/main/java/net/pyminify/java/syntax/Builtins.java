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

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;

/**
 * Builtins is the set of names that are available in every module without being bound, such as
 * {@code print} and {@code len}. A name that resolves to no binding of the file is bound to a
 * builtin if it is a member of this set, and is then never renamed.
 *
 * <p>The set depends on the Python version the program targets, so it is supplied by the caller;
 * {@link #python3} is a reasonable default.
 */
public final class Builtins {

  // Names whose use gives the program access to its own variables by name.
  private static final ImmutableSet<String> REFLECTIVE =
      ImmutableSet.of("eval", "exec", "locals", "globals", "vars");

  private static final ImmutableSet<String> PYTHON3_NAMES =
      ImmutableSet.of(
          // constants
          "True", "False", "None", "Ellipsis", "NotImplemented", "__debug__",
          // module attributes
          "__name__", "__doc__", "__file__", "__package__", "__spec__", "__loader__",
          "__builtins__", "__build_class__", "__import__", "__cached__", "__annotations__",
          // functions and types
          "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint", "bytearray",
          "bytes", "callable", "chr", "classmethod", "compile", "complex", "copyright", "credits",
          "delattr", "dict", "dir", "divmod", "enumerate", "eval", "exec", "exit", "filter",
          "float", "format", "frozenset", "getattr", "globals", "hasattr", "hash", "help", "hex",
          "id", "input", "int", "isinstance", "issubclass", "iter", "len", "license", "list",
          "locals", "map", "max", "memoryview", "min", "next", "object", "oct", "open", "ord",
          "pow", "print", "property", "quit", "range", "repr", "reversed", "round", "set",
          "setattr", "slice", "sorted", "staticmethod", "str", "sum", "super", "tuple", "type",
          "vars", "zip",
          // exceptions and warnings
          "ArithmeticError", "AssertionError", "AttributeError", "BaseException",
          "BaseExceptionGroup", "BlockingIOError", "BrokenPipeError", "BufferError",
          "BytesWarning", "ChildProcessError", "ConnectionAbortedError", "ConnectionError",
          "ConnectionRefusedError", "ConnectionResetError", "DeprecationWarning", "EOFError",
          "EncodingWarning", "EnvironmentError", "Exception", "ExceptionGroup",
          "FileExistsError", "FileNotFoundError", "FloatingPointError", "FutureWarning",
          "GeneratorExit", "IOError", "ImportError", "ImportWarning", "IndentationError",
          "IndexError", "InterruptedError", "IsADirectoryError", "KeyError", "KeyboardInterrupt",
          "LookupError", "MemoryError", "ModuleNotFoundError", "NameError", "NotADirectoryError",
          "NotImplementedError", "OSError", "OverflowError", "PendingDeprecationWarning",
          "PermissionError", "ProcessLookupError", "RecursionError", "ReferenceError",
          "ResourceWarning", "RuntimeError", "RuntimeWarning", "StopAsyncIteration",
          "StopIteration", "SyntaxError", "SyntaxWarning", "SystemError", "SystemExit",
          "TabError", "TimeoutError", "TypeError", "UnboundLocalError", "UnicodeDecodeError",
          "UnicodeEncodeError", "UnicodeError", "UnicodeTranslateError", "UnicodeWarning",
          "UserWarning", "ValueError", "Warning", "ZeroDivisionError");

  private static final Builtins PYTHON3 = new Builtins(PYTHON3_NAMES);

  private final ImmutableSet<String> names;

  private Builtins(ImmutableSet<String> names) {
    this.names = names;
  }

  /** Returns the builtins of Python 3, together with the implicit module attributes. */
  public static Builtins python3() {
    return PYTHON3;
  }

  /** Returns a set of builtins consisting of exactly the given names. */
  public static Builtins of(Iterable<String> names) {
    return new Builtins(ImmutableSet.copyOf(names));
  }

  /** Returns a set of builtins consisting of this set and the given names. */
  public Builtins extend(String... extra) {
    return new Builtins(
        ImmutableSet.<String>builder().addAll(names).addAll(Arrays.asList(extra)).build());
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  /** Returns the names of this set, in a fixed order. */
  public ImmutableSet<String> names() {
    return names;
  }

  /**
   * Reports whether a use of the builtin may read or write variables by name ({@code eval}, {@code
   * exec}, {@code locals}, {@code globals}, {@code vars}), defeating static renaming.
   */
  public static boolean isReflective(String name) {
    return REFLECTIVE.contains(name);
  }
}
