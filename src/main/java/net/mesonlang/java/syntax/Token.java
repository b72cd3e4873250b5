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

import com.google.common.base.MoreObjects;
import com.google.common.collect.AbstractIterator;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A lexical token of a build file, with its position. Tokens are immutable.
 *
 * <p>Most clients never see tokens: the parser pulls them directly from the scanner. {@link
 * #tokenize} exposes the token stream for tools and tests.
 */
public final class Token {

  private final TokenKind kind;
  private final String file;
  private final int lineStartOffset;
  private final int line;
  private final int column;
  private final int start;
  private final int end;
  @Nullable private final Object value;
  private final boolean multiline;

  Token(
      TokenKind kind,
      String file,
      int lineStartOffset,
      int line,
      int column,
      int start,
      int end,
      @Nullable Object value,
      boolean multiline) {
    this.kind = kind;
    this.file = file;
    this.lineStartOffset = lineStartOffset;
    this.line = line;
    this.column = column;
    this.start = start;
    this.end = end;
    this.value = value;
    this.multiline = multiline;
  }

  public TokenKind kind() {
    return kind;
  }

  /** Returns the source id of the file containing this token. */
  public String file() {
    return file;
  }

  /** Returns the offset of the first char of the line on which this token starts. */
  public int lineStartOffset() {
    return lineStartOffset;
  }

  /** Returns the 1-based line of the token. */
  public int line() {
    return line;
  }

  /** Returns the 1-based column of the token. */
  public int column() {
    return column;
  }

  /** Returns the offset of the first char of the token. */
  public int start() {
    return start;
  }

  /** Returns the offset immediately after the last char of the token. */
  public int end() {
    return end;
  }

  /**
   * Returns the literal value of the token: a String for identifiers and (format) strings, a Long
   * for integers, the offending text for illegal tokens, and null otherwise.
   */
  @Nullable
  public Object value() {
    return value;
  }

  /** Reports whether a string token was written with triple quotes. */
  public boolean isMultiline() {
    return multiline;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("location", file + ":" + line + ":" + column)
        .add("value", value)
        .omitNullValues()
        .toString();
  }

  /**
   * Returns a lazy iterator over the tokens of the input. The last token returned is always {@link
   * TokenKind#EOF}. Newlines inside parentheses, brackets or braces are not tokens. Comments are
   * skipped, and lexical errors are appended to {@code errors} as they are encountered; the
   * offending text is returned as an {@link TokenKind#ILLEGAL} token.
   *
   * <p>Each call scans the input afresh.
   */
  public static Iterator<Token> tokenize(ParserInput input, List<SyntaxError> errors) {
    Lexer lexer = new Lexer(input, errors);
    return new AbstractIterator<Token>() {
      @Override
      @Nullable
      protected Token computeNext() {
        if (lexer.kind == TokenKind.EOF) {
          return endOfData();
        }
        lexer.nextToken();
        return lexer.toToken();
      }
    };
  }
}
