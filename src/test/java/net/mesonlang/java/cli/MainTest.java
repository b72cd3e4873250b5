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

package net.mesonlang.java.cli;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the command-line front end. */
@RunWith(JUnit4.class)
public final class MainTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    return new Main(new PrintStream(out, true), new PrintStream(err, true)).run(args);
  }

  private String out() {
    return new String(out.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(err.toByteArray(), UTF_8);
  }

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private String write(String path, String content) throws IOException {
    Path file = tmp.getRoot().toPath().resolve(path);
    Files.createDirectories(file.getParent());
    Files.write(file, content.getBytes(UTF_8));
    return file.toString();
  }

  @Test
  public void testUsageErrors() {
    assertThat(run()).isEqualTo(2);
    assertThat(err()).startsWith("usage: mesonlang format");

    err.reset();
    assertThat(run("frob")).isEqualTo(2);
    assertThat(err()).startsWith("error: unknown command: frob\n");

    err.reset();
    assertThat(run("format", "--bogus", "x")).isEqualTo(2);
    assertThat(err()).startsWith("error: unknown flag: --bogus\n");

    err.reset();
    assertThat(run("format", "--indent=two", "x")).isEqualTo(2);
    assertThat(err()).startsWith("error: flag --indent needs an integer\n");

    err.reset();
    assertThat(run("format", "--indent=-1", "x")).isEqualTo(2);
    assertThat(err()).startsWith("error: negative indent\n");

    err.reset();
    assertThat(run("introspect", "--build_file=a/b", ".")).isEqualTo(2);
    assertThat(err()).startsWith("error: invalid build file name: a/b\n");

    assertThat(run("format")).isEqualTo(2);
    assertThat(run("check")).isEqualTo(2);
    assertThat(run("introspect")).isEqualTo(2);
    assertThat(run("introspect", "a", "b")).isEqualTo(2);
    assertThat(out()).isEmpty();
  }

  @Test
  public void testFormat() throws Exception {
    String a = write("a/meson.build", lines("x=1", "if a", "b=2", "endif"));
    String b = write("b/meson.build", lines("y=[1,2]"));
    assertThat(run("format", a, b)).isEqualTo(0);
    assertThat(out()).isEqualTo(lines("x = 1", "if a", "  b = 2", "endif", "y = [1, 2]"));
    assertThat(err()).isEmpty();
  }

  @Test
  public void testFormatOptions() throws Exception {
    String file = write("meson.build", lines("if a", "f(1, 2, 3)", "endif"));
    assertThat(run("format", "--indent=4", "--argument_cutoff=2", file)).isEqualTo(0);
    assertThat(out())
        .isEqualTo(
            lines("if a", "    f(", "        1,", "        2,", "        3,", "    )", "endif"));
  }

  @Test
  public void testFormatInPlace() throws Exception {
    String file = write("meson.build", lines("x=1   # one"));
    assertThat(run("format", "--in_place", file)).isEqualTo(0);
    assertThat(out()).isEmpty();
    assertThat(new String(Files.readAllBytes(tmp.getRoot().toPath().resolve("meson.build")), UTF_8))
        .isEqualTo(lines("x = 1  # one"));
  }

  @Test
  public void testFormatReportsUnplacedComments() throws Exception {
    String file = write("meson.build", lines("x = (1 # mid", "  + 2)"));
    assertThat(run("format", file)).isEqualTo(0);
    assertThat(err()).contains(": warning: comment could not be placed: ");
  }

  @Test
  public void testSyntaxErrors() throws Exception {
    String bad = write("bad/meson.build", lines("if a", "  x = 1"));
    String good = write("good/meson.build", lines("x=1"));
    assertThat(run("format", bad, good)).isEqualTo(1);
    assertThat(err()).contains(": Expecting endif got EOF.\n");
    assertThat(err()).contains(": block started here\n");
    // The other files are still formatted.
    assertThat(out()).isEqualTo(lines("x = 1"));
  }

  @Test
  public void testMissingFile() {
    String missing = tmp.getRoot().toPath().resolve("nope.build").toString();
    assertThat(run("check", missing)).isEqualTo(1);
    assertThat(err()).startsWith("error: " + missing + ": ");
  }

  @Test
  public void testCheck() throws Exception {
    String good = write("good/meson.build", lines("f(1, a: 2)"));
    assertThat(run("check", good)).isEqualTo(0);
    assertThat(err()).isEmpty();

    String bad = write("bad/meson.build", lines("x = 1", "f(a: 1, 2)"));
    assertThat(run("check", good, bad)).isEqualTo(1);
    assertThat(err()).startsWith(bad + ":2:");
    assertThat(err())
        .endsWith(": error: All keyword arguments must be after positional arguments.\n");
    assertThat(out()).isEmpty();
  }

  @Test
  public void testIntrospect() throws Exception {
    write(
        "meson.build",
        lines(
            "project('demo', 'c', version: '1.0')",
            "exe = executable('app', 'main.c', install: true)",
            "dep = dependency('zlib', required: false)",
            "x = nosuch"));
    write("subprojects/lib/meson.build", lines("project('lib')"));
    assertThat(run("introspect", tmp.getRoot().toString())).isEqualTo(0);

    JsonObject json = JsonParser.parseString(out()).getAsJsonObject();
    JsonObject project = json.getAsJsonObject("project");
    assertThat(project.get("name").getAsString()).isEqualTo("demo");
    assertThat(project.get("version").getAsString()).isEqualTo("1.0");
    assertThat(project.getAsJsonArray("languages").get(0).getAsString()).isEqualTo("c");
    JsonArray subprojects = project.getAsJsonArray("subprojects");
    assertThat(subprojects.size()).isEqualTo(1);
    assertThat(subprojects.get(0).getAsJsonObject().get("directory").getAsString())
        .isEqualTo("subprojects/lib");

    JsonObject target = json.getAsJsonArray("targets").get(0).getAsJsonObject();
    assertThat(target.get("name").getAsString()).isEqualTo("app");
    assertThat(target.get("type").getAsString()).isEqualTo("executable");
    assertThat(target.get("location").getAsString()).isEqualTo("meson.build:2:7");
    assertThat(target.getAsJsonArray("sources").get(0).getAsString()).isEqualTo("main.c");
    assertThat(target.getAsJsonObject("keyword_arguments").get("install").getAsBoolean())
        .isTrue();

    JsonObject dep = json.getAsJsonArray("dependencies").get(0).getAsJsonObject();
    assertThat(dep.get("name").getAsString()).isEqualTo("zlib");
    assertThat(dep.get("required").getAsBoolean()).isFalse();

    JsonArray diagnostics = json.getAsJsonArray("diagnostics");
    assertThat(diagnostics.size()).isEqualTo(1);
    assertThat(diagnostics.get(0).getAsString())
        .isEqualTo("meson.build:4:5: warning: undefined variable 'nosuch'");
  }

  @Test
  public void testIntrospectWithoutProject() throws Exception {
    write("meson.build", lines("x = 1"));
    assertThat(run("introspect", "--no_subprojects", tmp.getRoot().toString())).isEqualTo(0);
    JsonObject json = JsonParser.parseString(out()).getAsJsonObject();
    assertThat(json.get("project").isJsonNull()).isTrue();
    assertThat(json.getAsJsonArray("diagnostics").get(0).getAsString())
        .isEqualTo("meson.build:1:1: error: First statement must be a call to project()");
  }

  @Test
  public void testIntrospectFailures() throws Exception {
    assertThat(run("introspect", tmp.getRoot().toString())).isEqualTo(1);
    assertThat(err()).startsWith("error: ");

    err.reset();
    write("meson.build", lines("project('p'"));
    assertThat(run("introspect", tmp.getRoot().toString())).isEqualTo(1);
    assertThat(err()).contains("meson.build:");
    assertThat(out()).isEmpty();
  }
}
