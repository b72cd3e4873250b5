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

package net.mesonlang.java.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Formatter}, in particular of comment placement. */
@RunWith(JUnit4.class)
public final class FormatterTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private static Formatter.Result format(String source) throws SyntaxError.Exception {
    return Formatter.format(ParserInput.fromString(source, "meson.build"));
  }

  // Checks the formatted text, that no comment was lost, and that formatting is idempotent.
  private static void assertFormats(String source, String expected) throws Exception {
    Formatter.Result result = format(source);
    assertThat(result.text()).isEqualTo(expected);
    assertThat(result.unattachedComments()).isEmpty();
    assertThat(format(result.text()).text()).isEqualTo(expected);
  }

  @Test
  public void testLeadingAndTrailingComments() throws Exception {
    assertFormats(
        lines("# header", "project('x')   # trailing", "# lead", "x=1"),
        lines("# header", "project('x')  # trailing", "# lead", "x = 1"));
  }

  @Test
  public void testSingleBlankLinesArePreserved() throws Exception {
    assertFormats(
        lines("a = 1", "", "", "", "# about b", "b = 2", "c = 3", "", "d = 4"),
        lines("a = 1", "", "# about b", "b = 2", "c = 3", "", "d = 4"));
  }

  @Test
  public void testNoBlankLineAtBlockStart() throws Exception {
    assertFormats(
        lines("if a", "", "  b = 1", "", "  c = 2", "endif"),
        lines("if a", "  b = 1", "", "  c = 2", "endif"));
  }

  @Test
  public void testBlockHeaderComments() throws Exception {
    assertFormats(
        lines(
            "foreach x : xs  # loop",
            "message(x)",
            "endforeach",
            "if a # first",
            "elif b    # second",
            "else  # otherwise",
            "endif"),
        lines(
            "foreach x : xs  # loop",
            "  message(x)",
            "endforeach",
            "if a  # first",
            "elif b  # second",
            "else  # otherwise",
            "endif"));
  }

  @Test
  public void testEndOfBlockComments() throws Exception {
    assertFormats(
        lines("if true", "  x = 1", "", "    # done", "endif", "# end of file"),
        lines("if true", "  x = 1", "", "  # done", "endif", "# end of file"));
  }

  @Test
  public void testElementCommentsForceOneElementPerLine() throws Exception {
    assertFormats(
        lines("srcs = ['a.c',  # first", "  'b.c']"),
        lines("srcs = [", "  'a.c',  # first", "  'b.c',", "]"));
    assertFormats(
        lines("executable('app', # name", "  install: true)"),
        lines("executable(", "  'app',  # name", "  install: true,", ")"));
  }

  @Test
  public void testCommentsInsideExpressionsAreReported() throws Exception {
    Formatter.Result result = format(lines("x = (1 # mid", "  + 2)", "y = 3"));
    assertThat(result.text()).isEqualTo(lines("x = (1 + 2)", "y = 3"));
    assertThat(result.unattachedComments()).hasSize(1);
    assertThat(result.unattachedComments().get(0).getText()).isEqualTo("# mid");
    assertThat(result.unattachedComments().get(0).getLine()).isEqualTo(1);
  }

  @Test
  public void testEveryCommentIsPlacedOrReported() throws Exception {
    String source =
        lines(
            "# a",
            "project('p', 'c',",
            "  version: '1.0', # b",
            ")",
            "# c",
            "deps = [dependency('z'), # d",
            "  dependency('m', required: false ? true : false)]",
            "foreach d : deps # e",
            "  # f",
            "  message(d) # g",
            "  # h",
            "endforeach",
            "x = {'k': 1, # i",
            "}",
            "# j");
    Formatter.Result result = format(source);
    int placed = 0;
    for (String letter : new String[] {"a", "b", "c", "d", "e", "f", "g", "h", "i", "j"}) {
      if (result.text().contains("# " + letter)) {
        placed++;
      }
    }
    assertThat(placed + result.unattachedComments().size()).isEqualTo(10);
    assertThat(result.unattachedComments()).isEmpty();
  }

  @Test
  public void testOptions() throws Exception {
    BuildFile file = BuildFile.parse(ParserInput.fromLines("if a", "b = 1  # c", "endif"));
    PrinterOptions options = PrinterOptions.builder().indent(4).build();
    assertThat(Formatter.format(file, options).text())
        .isEqualTo(lines("if a", "    b = 1  # c", "endif"));
  }

  @Test
  public void testSyntaxErrorsAreRejected() {
    assertThrows(SyntaxError.Exception.class, () -> format("if a\n"));
    BuildFile file = BuildFile.parse(ParserInput.fromLines("x = "));
    assertThrows(IllegalArgumentException.class, () -> Formatter.format(file));
  }
}
