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
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.pyminify.java.syntax.Builtins;
import net.pyminify.java.syntax.FileOptions;
import net.pyminify.java.syntax.NameBinding;
import net.pyminify.java.syntax.Namespace;
import net.pyminify.java.syntax.NodePrinter;
import net.pyminify.java.syntax.ParserInput;
import net.pyminify.java.syntax.PythonFile;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Renamer}, end to end from source text to printed output. */
@RunWith(JUnit4.class)
public final class RenamerTest {

  private static final RenameOptions GLOBALS =
      RenameOptions.builder().renameGlobals(true).build();

  private static final RenameOptions ALIASES =
      RenameOptions.builder().aliasBuiltins(true).build();

  private static String[] source(String... lines) {
    return lines;
  }

  private static String rename(RenameOptions options, String... lines) {
    PythonFile file = PythonFile.parse(ParserInput.fromLines(lines), options.fileOptions());
    new Renamer(options).rename(file);
    return NodePrinter.print(file);
  }

  private static void assertRenamed(RenameOptions options, String[] source, String... expected) {
    assertThat(rename(options, source)).isEqualTo(Joiner.on('\n').join(expected) + "\n");
  }

  @Test
  public void functionLocalIsIndependentOfModuleBinding() {
    assertRenamed(
        RenameOptions.DEFAULT,
        source(
            "value = 5", //
            "def A():",
            "  print(value)",
            "  value = 6"),
        "value=5",
        "def A():",
        " print(a)",
        " a=6");
  }

  @Test
  public void classBodyAssignmentIsRenamedWithModuleBinding() {
    assertRenamed(
        GLOBALS,
        source(
            "message = 'hello'",
            "class A:",
            "  if cond:",
            "    message = message + ' world'"),
        "a='hello'",
        "class A:",
        " if b:",
        "  a=a+' world'");
  }

  @Test
  public void siblingFunctionsReuseTheSameName() {
    assertRenamed(
        RenameOptions.DEFAULT,
        source(
            "def f():",
            "  counter = 0",
            "  return counter",
            "def g():",
            "  counter = 1",
            "  return counter"),
        "def f():",
        " a=0",
        " return a",
        "def g():",
        " a=1",
        " return a");
  }

  @Test
  public void nestedReferencesAvoidShadowing() {
    assertRenamed(
        GLOBALS,
        source(
            "value = 1",
            "def outer():",
            "  def middle():",
            "    def inner():",
            "      return value",
            "    return inner",
            "  return middle"),
        "b=1",
        "def a():",
        " def a():",
        "  def a():",
        "   return b",
        "  return a",
        " return a");
  }

  @Test
  public void classAttributesAndParametersKeepTheirNames() {
    assertRenamed(
        RenameOptions.DEFAULT,
        source(
            "class Config:",
            "  timeout = 30",
            "  def method(self, argument):",
            "    return self.timeout + argument"),
        "class Config:",
        " timeout=30",
        " def method(a,argument):",
        "  return a.timeout+argument");
  }

  @Test
  public void builtinsAreNeverShadowed() {
    RenameOptions options =
        RenameOptions.builder().builtins(Builtins.python3().extend("a")).build();
    assertRenamed(
        options,
        source(
            "def f():", //
            "  total = 1",
            "  return a(total)"),
        "def f():",
        " b=1",
        " return a(b)");
  }

  @Test
  public void exportedAndPreservedNamesAreKept() {
    assertRenamed(
        GLOBALS,
        source(
            "__all__ = ['public_name']", //
            "public_name = 1",
            "private_name = 2"),
        "__all__=['public_name']",
        "public_name=1",
        "a=2");

    RenameOptions preserve =
        RenameOptions.builder().preserveNames(ImmutableList.of("keep_me")).build();
    assertRenamed(
        preserve,
        source(
            "def f():",
            "  keep_me = 1",
            "  other = 2",
            "  return keep_me + other"),
        "def f():",
        " keep_me=1",
        " a=2",
        " return keep_me+a");
  }

  @Test
  public void localsCanBeKept() {
    RenameOptions options = RenameOptions.builder().renameLocals(false).build();
    assertRenamed(
        options,
        source("def f():", "  counter = 0", "  return counter"),
        "def f():",
        " counter=0",
        " return counter");
  }

  @Test
  public void importIsAliasedOnlyWhenItPays() {
    assertRenamed(
        GLOBALS,
        source(
            "import collections", //
            "import os",
            "collections.OrderedDict()",
            "os.sep"),
        "import collections as a",
        "import os",
        "a.OrderedDict()",
        "os.sep");
  }

  @Test
  public void reflectionKeepsNames() {
    assertRenamed(
        GLOBALS,
        source(
            "def function():", //
            "  longname = 1",
            "  return eval('longname')"),
        "def function():",
        " longname=1",
        " return eval('longname')");
  }

  @Test
  public void renamingIsDeterministic() {
    String[] source = {
      "import itertools",
      "def pairs(sequence):",
      "  first, second = itertools.tee(sequence)",
      "  next(second, None)",
      "  return zip(first, second)",
      "result = [pair for pair in pairs(range(10))]"
    };
    assertThat(rename(GLOBALS, source)).isEqualTo(rename(GLOBALS, source));
  }

  @Test
  public void hoisterRunsBeforeNamesAreAssigned() {
    PythonFile file = PythonFile.parse(ParserInput.fromLines("x = 'literal'", "y = 'literal'"));
    List<Namespace> seen = new ArrayList<>();
    RenameReport report =
        new Renamer(GLOBALS)
            .rename(
                file,
                (f, module) -> {
                  seen.add(module);
                  module.addHoistedLiteral("hoisted");
                });
    assertThat(seen).hasSize(1);
    Namespace module = seen.get(0);
    NameBinding hoisted = module.getBindings().get(module.getBindings().size() - 1);
    assertThat(hoisted.getKind()).isEqualTo(NameBinding.Kind.HOISTED_LITERAL);
    assertThat(hoisted.isRenameable()).isTrue();
    assertThat(report.bindingsConsidered()).isEqualTo(3);
  }

  @Test
  public void walrusTargetAvoidsIterationVariablesOfItsComprehension() {
    assertRenamed(
        RenameOptions.DEFAULT,
        source(
            "def f(data):",
            "  if any((hit := item) > 3 for item in data):",
            "    return hit"),
        "def f(data):",
        " if any((b:=a)>3 for a in data):",
        "  return b");

    assertRenamed(
        RenameOptions.DEFAULT,
        source(
            "def g(data):", //
            "  [last := value for value in data]",
            "  return last"),
        "def g(data):",
        " [b:=a for a in data]",
        " return b");
  }

  @Test
  public void classAttributeReadInClassBodyKeepsItsName() {
    assertRenamed(
        GLOBALS,
        source(
            "class Account:",
            "  balance = 1",
            "  doubled = balance * 2",
            "print(Account.balance, Account.doubled)"),
        "class a:",
        " balance=1",
        " doubled=balance*2",
        "print(a.balance,a.doubled)");
  }

  @Test
  public void frequentBuiltinIsAliased() {
    assertRenamed(
        ALIASES,
        source("sorted()", "sorted()", "sorted()", "sorted()", "sorted()"),
        "a=sorted",
        "a()",
        "a()",
        "a()",
        "a()",
        "a()");
  }

  @Test
  public void builtinUsedInFunctionIsAliasedAtModuleLevel() {
    RenameOptions options = GLOBALS.toBuilder().aliasBuiltins(true).build();
    assertRenamed(
        options,
        source(
            "def t():",
            "  sorted()",
            "  sorted()",
            "  sorted()",
            "  sorted()",
            "  sorted()"),
        "a=sorted",
        "def t():",
        " a()",
        " a()",
        " a()",
        " a()",
        " a()");
  }

  @Test
  public void builtinAliasFollowsDocstringAndFutureImports() {
    assertRenamed(
        ALIASES,
        source(
            "'doc'",
            "from __future__ import annotations",
            "sorted()",
            "sorted()",
            "sorted()",
            "sorted()",
            "sorted()"),
        "'doc'",
        "from __future__ import annotations",
        "a=sorted",
        "a()",
        "a()",
        "a()",
        "a()",
        "a()");
  }

  @Test
  public void builtinBoundByTheProgramIsNotAliased() {
    assertRenamed(
        ALIASES,
        source(
            "def f():",
            "  sorted = str",
            "  return sorted",
            "sorted()",
            "sorted()",
            "sorted()",
            "sorted()",
            "sorted()"),
        "def f():",
        " a=str",
        " return a",
        "sorted()",
        "sorted()",
        "sorted()",
        "sorted()",
        "sorted()");

    assertRenamed(
        ALIASES,
        source(
            "if choice:",
            "  sorted = str",
            "sorted()",
            "sorted()",
            "sorted()",
            "sorted()",
            "sorted()"),
        "if choice:",
        " sorted=str",
        "sorted()",
        "sorted()",
        "sorted()",
        "sorted()",
        "sorted()");
  }

  @Test
  public void builtinIsNotAliasedWhenItDoesNotPay() {
    assertRenamed(
        ALIASES,
        source("len(items)", "len(items)"),
        "len(items)",
        "len(items)");
  }

  @Test
  public void builtinIsNotAliasedUnderReflection() {
    assertRenamed(
        ALIASES,
        source("sorted()", "sorted()", "sorted()", "sorted()", "sorted()", "eval('x')"),
        "sorted()",
        "sorted()",
        "sorted()",
        "sorted()",
        "sorted()",
        "eval('x')");
  }

  @Test
  public void fileParsedWithOtherOptionsIsRejected() {
    FileOptions python2 = FileOptions.builder().listComprehensionHasOwnScope(false).build();
    PythonFile file = PythonFile.parse(ParserInput.fromLines("x = [y for y in z]"), python2);
    assertThrows(IllegalArgumentException.class, () -> new Renamer().rename(file));
  }

  @Test
  public void fileWithSyntaxErrorsIsRejected() {
    PythonFile file = PythonFile.parse(ParserInput.fromLines("def f(:"));
    assertThrows(IllegalArgumentException.class, () -> new Renamer().rename(file));
  }

  @Test
  public void invalidPreservedNameIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RenameOptions.builder().preserveNames(ImmutableList.of("not a name")).build());
  }
}
