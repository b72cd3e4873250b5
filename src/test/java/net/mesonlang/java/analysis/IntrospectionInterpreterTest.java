// Copyright 2026 The Mesonlang Java Authors. All rights reserved.
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

package net.mesonlang.java.analysis;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link IntrospectionInterpreter}. */
@RunWith(JUnit4.class)
public final class IntrospectionInterpreterTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private void write(String path, String... lines) throws IOException {
    Path file = tmp.getRoot().toPath().resolve(path);
    Files.createDirectories(file.getParent());
    Files.write(file, (Joiner.on('\n').join(lines) + "\n").getBytes(UTF_8));
  }

  private IntrospectionInterpreter analyze(InterpreterOptions options) throws Exception {
    IntrospectionInterpreter interpreter =
        new IntrospectionInterpreter(
            new FilesystemFileAccessor(tmp.getRoot().toPath()), options, ImmutableList.of());
    interpreter.analyze();
    return interpreter;
  }

  private IntrospectionInterpreter analyze(String... lines) throws Exception {
    write("meson.build", lines);
    return analyze(InterpreterOptions.DEFAULT);
  }

  @Test
  public void testProjectInfo() throws Exception {
    IntrospectionInterpreter interpreter =
        analyze(
            "project('demo', 'C', ['cpp'],",
            "  version: '1.2',",
            "  license: ['MIT', 'BSD'],",
            "  default_options: ['warning_level=3', 'cpp_std = c++17', 'bogus'])",
            "add_languages('rust', 'c')");
    ProjectInfo project = interpreter.getProject();
    assertThat(project.name()).isEqualTo("demo");
    assertThat(project.version()).isEqualTo("1.2");
    assertThat(project.languages()).containsExactly("c", "cpp", "rust").inOrder();
    assertThat(project.licenses()).containsExactly("MIT", "BSD").inOrder();
    assertThat(project.defaultOptions())
        .containsExactly("warning_level", "3", "cpp_std", "c++17")
        .inOrder();
    assertThat(project.directory()).isEmpty();
    assertThat(project.subprojects()).isEmpty();
    assertThat(interpreter.getDiagnostics()).isEmpty();
  }

  @Test
  public void testProjectDefaults() throws Exception {
    ProjectInfo project = analyze("project('p', license: 'MIT')").getProject();
    assertThat(project.version()).isEqualTo("undefined");
    assertThat(project.languages()).isEmpty();
    assertThat(project.licenses()).containsExactly("MIT");
    assertThat(project.defaultOptions()).isEmpty();
  }

  @Test
  public void testFirstStatementMustBeProject() throws Exception {
    IntrospectionInterpreter interpreter = analyze("x = 1", "project('late')");
    assertThat(interpreter.getDiagnostics().get(0).toString())
        .isEqualTo("meson.build:1:1: error: First statement must be a call to project()");
    // The rest of the file is still interpreted.
    assertThat(interpreter.lookup("x")).isEqualTo(1L);
    assertThat(interpreter.getProject().name()).isEqualTo("late");

    interpreter = analyze("# nothing");
    assertThat(interpreter.getDiagnostics()).hasSize(1);
    assertThat(interpreter.getProject()).isNull();
  }

  @Test
  public void testProjectWithoutName() throws Exception {
    IntrospectionInterpreter interpreter = analyze("project(version: '1')");
    assertThat(interpreter.getProject()).isNull();
    assertThat(interpreter.getDiagnostics()).hasSize(1);
    assertThat(interpreter.getDiagnostics().get(0).message())
        .isEqualTo("Not enough arguments to project(). Needs at least the project name.");
  }

  @Test
  public void testProjectCalledTwice() throws Exception {
    IntrospectionInterpreter interpreter = analyze("project('a')", "project('b')");
    assertThat(interpreter.getProject().name()).isEqualTo("a");
    Diagnostic d = interpreter.getDiagnostics().get(0);
    assertThat(d.severity()).isEqualTo(Diagnostic.Severity.WARNING);
    assertThat(d.message()).isEqualTo("project() called more than once; ignoring");
    assertThat(d.location().line()).isEqualTo(2);
  }

  @Test
  public void testTargets() throws Exception {
    write("sub/meson.build", "static_library('util', 'util.c')");
    IntrospectionInterpreter interpreter =
        analyze(
            "project('p', 'c')",
            "srcs = ['a.c', 'b.c']",
            "exe = executable('app', srcs, 'main.c', install: true)",
            "lib = build_target('foo', sources: files('x.c'), target_type: 'shared_library')",
            "if get_option('tests')",
            "  executable('test', 'test.c', get_option('extra'))",
            "endif",
            "subdir('sub')",
            "custom_target(get_option('name'), input: 'in.txt')");
    List<BuildTarget> targets = interpreter.getTargets();
    assertThat(targets).hasSize(5);

    BuildTarget app = targets.get(0);
    assertThat(app.name()).isEqualTo("app");
    assertThat(app.kind()).isEqualTo("executable");
    assertThat(app.subdir()).isEmpty();
    assertThat(app.sources()).containsExactly("a.c", "b.c", "main.c").inOrder();
    assertThat(app.keywordArguments()).containsExactly("install", true);
    assertThat(app.conditional()).isFalse();
    assertThat(app.node().getFunctionName()).isEqualTo("executable");
    assertThat(app.node().getStartLocation().line()).isEqualTo(3);

    BuildTarget foo = targets.get(1);
    assertThat(foo.kind()).isEqualTo("shared_library");
    assertThat(foo.sources()).containsExactly("x.c");

    BuildTarget test = targets.get(2);
    assertThat(test.name()).isEqualTo("test");
    assertThat(test.sources()).containsExactly("test.c");
    assertThat(test.conditional()).isTrue();

    BuildTarget util = targets.get(3);
    assertThat(util.kind()).isEqualTo("static_library");
    assertThat(util.subdir()).isEqualTo("sub");

    BuildTarget custom = targets.get(4);
    assertThat(custom.name()).isNull();
    assertThat(custom.sources()).containsExactly("in.txt");
  }

  @Test
  public void testDependencies() throws Exception {
    IntrospectionInterpreter interpreter =
        analyze(
            "project('p')",
            "zlib = dependency('zlib', version: '>=1.2')",
            "if get_option('ssl')",
            "  ssl = dependency('openssl', required: false, version: ['>=1.1', '<4'])",
            "endif",
            "glib = dependency('glib-2.0', required: get_option('glib'))",
            "executable('app', dependencies: [zlib, glib])");
    List<Dependency> deps = interpreter.getDependencies();
    assertThat(deps).hasSize(3);

    assertThat(deps.get(0).name()).isEqualTo("zlib");
    assertThat(deps.get(0).versionConstraints()).containsExactly(">=1.2");
    assertThat(deps.get(0).required()).isTrue();
    assertThat(deps.get(0).conditional()).isFalse();

    assertThat(deps.get(1).name()).isEqualTo("openssl");
    assertThat(deps.get(1).versionConstraints()).containsExactly(">=1.1", "<4").inOrder();
    assertThat(deps.get(1).required()).isFalse();
    assertThat(deps.get(1).conditional()).isTrue();

    // A requirement that is not statically true is reported as optional.
    assertThat(deps.get(2).required()).isFalse();
    assertThat(interpreter.getDiagnostics()).isEmpty();
  }

  @Test
  public void testSubprojectCalls() throws Exception {
    IntrospectionInterpreter interpreter =
        analyze(
            "project('p')",
            "foo = subproject('foo')",
            "subproject(get_option('x'))",
            "bar_dep = subproject('bar').get_variable('bar_dep')");
    assertThat(interpreter.getSubprojectCalls()).containsExactly("foo", "bar").inOrder();
  }

  @Test
  public void testScansSubprojects() throws Exception {
    write(
        "subprojects/foo/meson.build",
        "project('foo', 'c', version: '0.1')",
        "executable('fooexe', 'f.c')",
        "x = nosuch");
    write("subprojects/foo/subprojects/inner/meson.build", "project('inner')");
    Files.createDirectories(tmp.getRoot().toPath().resolve("subprojects/bar"));
    IntrospectionInterpreter interpreter = analyze("project('root')");

    ProjectInfo project = interpreter.getProject();
    assertThat(project.subprojects()).hasSize(1);
    ProjectInfo foo = project.subprojects().get(0);
    assertThat(foo.name()).isEqualTo("foo");
    assertThat(foo.version()).isEqualTo("0.1");
    assertThat(foo.languages()).containsExactly("c");
    assertThat(foo.directory()).isEqualTo("subprojects/foo");
    // Only the top-level project scans for subprojects.
    assertThat(foo.subprojects()).isEmpty();
    // Targets of subprojects are not targets of the project.
    assertThat(interpreter.getTargets()).isEmpty();

    List<Diagnostic> diagnostics = interpreter.getDiagnostics();
    assertThat(diagnostics).hasSize(2);
    assertThat(diagnostics.get(0).location().file()).isEqualTo("subprojects/bar");
    assertThat(diagnostics.get(0).message()).startsWith("Unable to analyze subproject bar: ");
    assertThat(diagnostics.get(1).location().file()).isEqualTo("subprojects/foo/meson.build");
    assertThat(diagnostics.get(1).message()).isEqualTo("undefined variable 'nosuch'");
  }

  @Test
  public void testSubprojectDirArgument() throws Exception {
    write("deps/baz/meson.build", "project('baz')");
    write("subprojects/ignored/meson.build", "project('ignored')");
    ProjectInfo project = analyze("project('root', subproject_dir: 'deps')").getProject();
    assertThat(project.subprojects()).hasSize(1);
    assertThat(project.subprojects().get(0).name()).isEqualTo("baz");
    assertThat(project.subprojects().get(0).directory()).isEqualTo("deps/baz");
  }

  @Test
  public void testSubprojectScanningDisabled() throws Exception {
    write("subprojects/foo/meson.build", "project('foo')");
    write("meson.build", "project('root')");
    IntrospectionInterpreter interpreter =
        analyze(InterpreterOptions.builder().scanSubprojects(false).build());
    assertThat(interpreter.getProject().subprojects()).isEmpty();
  }

  @Test
  public void testBuildFileName() throws Exception {
    write("build.meson", "project('renamed')", "subdir('sub')");
    write("sub/build.meson", "executable('x')");
    write("sub/meson.build", "executable('ignored')");
    IntrospectionInterpreter interpreter =
        analyze(InterpreterOptions.builder().buildFileName("build.meson").build());
    assertThat(interpreter.getProject().name()).isEqualTo("renamed");
    assertThat(interpreter.getTargets()).hasSize(1);
    assertThat(interpreter.getTargets().get(0).name()).isEqualTo("x");
  }

  @Test
  public void testKeywordArgumentsAreResolved() throws Exception {
    IntrospectionInterpreter interpreter =
        analyze(
            "project('p')",
            "flags = ['-O2']",
            "shared_library('l', 'l.c', c_args: flags + ['-g'], version: '1.0')");
    assertThat(interpreter.getTargets().get(0).keywordArguments())
        .containsExactly("c_args", ImmutableList.of("-O2", "-g"), "version", "1.0");
  }
}
