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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private Lexer createLexer(String input) {
    errors.clear();
    return new Lexer(ParserInput.fromString(input, ""), errors);
  }

  /**
   * Returns the names of the tokens of the input with their values, for example {@code
   * IDENTIFIER(x) EQUALS INT(1) EOF}.
   */
  private String values(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    do {
      lexer.nextToken();
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.kind.name());
      if (lexer.value != null) {
        buf.append('(').append(lexer.value).append(')');
      }
    } while (lexer.kind != TokenKind.EOF);
    return buf.toString();
  }

  /** Returns the line numbers of the tokens of the input. */
  private String linenums(String input) {
    Lexer lexer = createLexer(input);
    StringBuilder buf = new StringBuilder();
    do {
      lexer.nextToken();
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(lexer.locs.getLocation(lexer.start).line());
    } while (lexer.kind != TokenKind.EOF);
    return buf.toString();
  }

  private String lastError() {
    return errors.isEmpty() ? null : errors.get(errors.size() - 1).toString();
  }

  @Test
  public void testBasics() {
    assertThat(values("x = 'a' + 1"))
        .isEqualTo("IDENTIFIER(x) EQUALS STRING(a) PLUS INT(1) EOF");
    assertThat(values("foo(bar, baz: 2)\n"))
        .isEqualTo(
            "IDENTIFIER(foo) LPAREN IDENTIFIER(bar) COMMA IDENTIFIER(baz) COLON INT(2) RPAREN"
                + " NEWLINE EOF");
    assertThat(values("a.b()[0]"))
        .isEqualTo("IDENTIFIER(a) DOT IDENTIFIER(b) LPAREN RPAREN LBRACKET INT(0) RBRACKET EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testTwoCharOperatorsBeforeTheirPrefixes() {
    assertThat(values("<= < >= > == = != += + ? : % / * -"))
        .isEqualTo(
            "LESS_EQUALS LESS GREATER_EQUALS GREATER EQUALS_EQUALS EQUALS NOT_EQUALS PLUS_EQUALS"
                + " PLUS QUESTION COLON PERCENT SLASH STAR MINUS EOF");
  }

  @Test
  public void testKeywords() {
    assertThat(
            values(
                "if elif else endif foreach endforeach and or not in true false break continue"))
        .isEqualTo(
            "IF ELIF ELSE ENDIF FOREACH ENDFOREACH AND OR NOT IN TRUE FALSE BREAK CONTINUE EOF");
    assertThat(values("iffy endif_ True"))
        .isEqualTo("IDENTIFIER(iffy) IDENTIFIER(endif_) IDENTIFIER(True) EOF");
    assertThat(TokenKind.ENDFOREACH.isKeyword()).isTrue();
    assertThat(TokenKind.PLUS.isKeyword()).isFalse();
  }

  @Test
  public void testIntegers() {
    assertThat(values("0 42 0x1F 0o17 0b101"))
        .isEqualTo("INT(0) INT(42) INT(31) INT(15) INT(5) EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testStringEscapes() {
    // Only \' \\ and \n are escapes; any other backslash is kept.
    assertThat(values("'a\\'b\\\\c\\nd\\te'")).isEqualTo("STRING(a'b\\c\nd\\te) EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testMultilineStringIsVerbatimAndAdvancesLines() {
    Lexer lexer = createLexer("x = '''a\\n\nb'''\ny");
    lexer.nextToken(); // x
    lexer.nextToken(); // =
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.STRING);
    assertThat(lexer.value).isEqualTo("a\\n\nb");
    assertThat(lexer.multiline).isTrue();
    assertThat(linenums("x = '''a\n\nb'''\ny")).isEqualTo("1 1 1 3 4 4");
  }

  @Test
  public void testFormatString() {
    assertThat(values("f'lib@name@' fx")).isEqualTo("FSTRING(lib@name@) IDENTIFIER(fx) EOF");
  }

  @Test
  public void testNewlinesInsideBracketsAreNotTokens() {
    assertThat(values("f(1,\n2)\n[\n]\n{\n}\n"))
        .isEqualTo(
            "IDENTIFIER(f) LPAREN INT(1) COMMA INT(2) RPAREN NEWLINE LBRACKET RBRACKET NEWLINE"
                + " LBRACE RBRACE NEWLINE EOF");
  }

  @Test
  public void testLineContinuation() {
    assertThat(values("a = 1 + \\\n  2\n"))
        .isEqualTo("IDENTIFIER(a) EQUALS INT(1) PLUS INT(2) NEWLINE EOF");
    assertThat(linenums("a = 1 + \\\n  2\n")).isEqualTo("1 1 1 1 2 2 3");
  }

  @Test
  public void testComments() {
    Lexer lexer = createLexer("# one\nx = 1 # two\r\n#three");
    do {
      lexer.nextToken();
    } while (lexer.kind != TokenKind.EOF);
    List<String> texts = new ArrayList<>();
    for (Comment c : lexer.getComments()) {
      texts.add(c.getLine() + ":" + c.getColumn() + ":" + c.getText());
    }
    assertThat(texts).containsExactly("1:1:# one", "2:7:# two", "3:1:#three").inOrder();
  }

  @Test
  public void testDoubleQuotesAreAnError() {
    assertThat(values("x = \"a\"")).startsWith("IDENTIFIER(x) EQUALS ILLEGAL(\")");
    assertThat(errors.get(0).toString())
        .isEqualTo(":1:5: Double quotes are not supported. Use single quotes.");
    assertThat(errors.get(0).kind()).isEqualTo(SyntaxError.Kind.LEXICAL);
  }

  @Test
  public void testInvalidCharacter() {
    values("a $ b");
    assertThat(lastError()).isEqualTo(":1:3: invalid character: '$'");
    assertThat(errors.get(0).lineText()).isEqualTo("a $ b");
  }

  @Test
  public void testNewlineInString() {
    values("x = 'abc\ny'");
    assertThat(errors.get(0).message())
        .isEqualTo(
            "Newline character in a string detected, use ''' (three single quotes) for multiline"
                + " strings instead.");
    assertThat(errors.get(0).location().line()).isEqualTo(1);
  }

  @Test
  public void testUnterminatedString() {
    values("x = 'abc");
    assertThat(lastError()).isEqualTo(":1:5: unterminated string literal");
  }

  @Test
  public void testEofRepeats() {
    Lexer lexer = createLexer("");
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.EOF);
    lexer.nextToken();
    assertThat(lexer.kind).isEqualTo(TokenKind.EOF);
  }

  @Test
  public void testTokenPositionsAreMonotonic() {
    String src =
        "project('x', 'c',\n"
            + "  version : '1.0')  # c\n"
            + "s = '''multi\n"
            + "line''' + f'@x@'\n"
            + "if a != b and not c\n"
            + "  foreach i : [1, \\\n"
            + "    2]\n"
            + "  endforeach\n"
            + "endif\n";
    Iterator<Token> it = Token.tokenize(ParserInput.fromString(src, "meson.build"), errors);
    List<Token> tokens = ImmutableList.copyOf(it);
    assertThat(errors).isEmpty();
    assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.EOF);
    for (int i = 1; i < tokens.size(); i++) {
      Token prev = tokens.get(i - 1);
      Token tok = tokens.get(i);
      boolean ordered =
          prev.line() < tok.line() || (prev.line() == tok.line() && prev.column() <= tok.column());
      assertThat(ordered).isTrue();
      assertThat(tok.start()).isAtLeast(prev.end());
    }
  }

  @Test
  public void testTokenFields() {
    Iterator<Token> it = Token.tokenize(ParserInput.fromString("a\n  bc", "f"), errors);
    Token a = it.next();
    assertThat(a.kind()).isEqualTo(TokenKind.IDENTIFIER);
    assertThat(a.file()).isEqualTo("f");
    assertThat(a.line()).isEqualTo(1);
    assertThat(a.column()).isEqualTo(1);
    it.next(); // newline
    Token bc = it.next();
    assertThat(bc.value()).isEqualTo("bc");
    assertThat(bc.line()).isEqualTo(2);
    assertThat(bc.column()).isEqualTo(3);
    assertThat(bc.lineStartOffset()).isEqualTo(2);
    assertThat(bc.start()).isEqualTo(4);
    assertThat(bc.end()).isEqualTo(6);
  }
}
