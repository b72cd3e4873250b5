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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;

/** A scanner for build files. */
final class Lexer {

  // --- These fields are accessed directly by the parser: ---

  // Mapping from file offsets to Locations.
  final FileLocations locs;

  // Information about current token. Updated by nextToken.
  // raw and value are defined only for STRING, FSTRING, INT and IDENTIFIER.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  String raw; // source text of token
  Object value; // String or Long value of token
  boolean multiline; // STRING or FSTRING written with triple quotes

  // --- end of parser-visible fields ---

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  private final ImmutableList.Builder<Comment> comments = ImmutableList.builder();

  // The number of unclosed open-parens ("(", '{', '[') at the current point in
  // the stream. Newlines are not tokens when this is nonzero.
  private int openParenStackDepth = 0;

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("and", TokenKind.AND)
          .put("break", TokenKind.BREAK)
          .put("continue", TokenKind.CONTINUE)
          .put("elif", TokenKind.ELIF)
          .put("else", TokenKind.ELSE)
          .put("endforeach", TokenKind.ENDFOREACH)
          .put("endif", TokenKind.ENDIF)
          .put("false", TokenKind.FALSE)
          .put("foreach", TokenKind.FOREACH)
          .put("if", TokenKind.IF)
          .put("in", TokenKind.IN)
          .put("not", TokenKind.NOT)
          .put("or", TokenKind.OR)
          .put("true", TokenKind.TRUE)
          .buildOrThrow();

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
  }

  ImmutableList<Comment> getComments() {
    return comments.build();
  }

  /** Reports whether the given word is reserved. */
  static boolean isKeyword(String word) {
    return KEYWORDS.containsKey(word);
  }

  /**
   * Reads the next token, updating the Lexer's token fields. After the EOF token has been read,
   * further calls return EOF again.
   */
  void nextToken() {
    if (kind == TokenKind.EOF) {
      return;
    }
    tokenize();
    Preconditions.checkState(kind != null);
  }

  /** Returns an immutable copy of the current token. */
  Token toToken() {
    int lineStart = locs.getLineStartOffset(start);
    Location loc = locs.getLocation(start);
    return new Token(
        kind, locs.file(), lineStart, loc.line(), loc.column(), start, end, value, multiline);
  }

  private void error(String message, int pos) {
    Location loc = locs.getLocation(pos);
    errors.add(
        new SyntaxError(
            SyntaxError.Kind.LEXICAL, loc, message, locs.getLineText(loc.line()), null, null));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.value = null;
    this.raw = null;
    this.multiline = false;
  }

  // setValue sets the value associated with a STRING, FSTRING, INT or IDENTIFIER token, and
  // records the raw text of the token.
  private void setValue(Object value) {
    this.value = value;
    this.raw = bufferSlice(start, end);
  }

  private void popParen() {
    if (openParenStackDepth > 0) {
      openParenStackDepth--;
    }
  }

  /**
   * Scans a string literal. Single-quoted literals interpret the escapes {@code \'}, {@code \\}
   * and {@code \n}; any other backslash is kept verbatim. Triple-quoted literals are verbatim and
   * may span lines.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the opening quote. ON EXIT: 'pos' is 1 + the index of
   * the last closing quote.
   *
   * @param literalStartPos offset of the first char of the token, including any 'f' prefix
   */
  private void stringLiteral(int literalStartPos, TokenKind tokenKind) {
    if (peek(0) == '\'' && peek(1) == '\'') {
      pos += 2;
      multilineStringLiteral(literalStartPos, tokenKind);
      return;
    }
    StringBuilder literal = new StringBuilder();
    while (pos < buffer.length) {
      char c = buffer[pos++];
      switch (c) {
        case '\n':
          error(
              "Newline character in a string detected, use ''' (three single quotes) for"
                  + " multiline strings instead.",
              pos - 1);
          setToken(tokenKind, literalStartPos, pos - 1);
          setValue(literal.toString());
          return;
        case '\\':
          int next = peek(0);
          if (next == '\'' || next == '\\') {
            literal.append((char) next);
            pos++;
          } else if (next == 'n') {
            literal.append('\n');
            pos++;
          } else {
            literal.append(c);
          }
          break;
        case '\'':
          setToken(tokenKind, literalStartPos, pos);
          setValue(literal.toString());
          return;
        default:
          literal.append(c);
          break;
      }
    }
    error("unterminated string literal", literalStartPos);
    setToken(tokenKind, literalStartPos, pos);
    setValue(literal.toString());
  }

  // ON ENTRY: 'pos' is 1 + the index of the last char of the opening '''.
  private void multilineStringLiteral(int literalStartPos, TokenKind tokenKind) {
    int contentStart = pos;
    while (pos < buffer.length) {
      if (buffer[pos] == '\'' && peek(1) == '\'' && peek(2) == '\'') {
        String content = bufferSlice(contentStart, pos);
        pos += 3;
        setToken(tokenKind, literalStartPos, pos);
        setValue(content);
        multiline = true;
        return;
      }
      pos++;
    }
    error("unterminated multiline string literal", literalStartPos);
    setToken(tokenKind, literalStartPos, pos);
    setValue(bufferSlice(contentStart, pos));
    multiline = true;
  }

  /**
   * Scans an identifier or keyword.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier. ON EXIT: 'pos' is 1 +
   * the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    String id = scanIdentifier();
    TokenKind kind = KEYWORDS.get(id);
    if (kind == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      setValue(id);
    } else {
      setToken(kind, oldPos, pos);
    }
  }

  private String scanIdentifier() {
    // Keep consistent with Identifier.isValid.
    int oldPos = pos - 1;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '_' || ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || isdigit(c)) {
        pos++;
      } else {
        break;
      }
    }
    return bufferSlice(oldPos, pos);
  }

  // Scans a decimal, hex (0x), octal (0o) or binary (0b) integer.
  // Precondition: pos is the index of the first digit.
  private void scanNumber() {
    int start = pos;
    int c = peek(0);
    if (c == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
      pos += 2;
      while (isxdigit(peek(0))) {
        pos++;
      }
    } else if (c == '0'
        && (peek(1) == 'o' || peek(1) == 'O' || peek(1) == 'b' || peek(1) == 'B')) {
      pos += 2;
      while (isdigit(peek(0))) {
        pos++;
      }
    } else {
      while (isdigit(peek(0))) {
        pos++;
      }
    }
    setToken(TokenKind.INT, start, pos);
    long value = 0;
    try {
      value = IntLiteral.scan(bufferSlice(start, pos));
    } catch (NumberFormatException ex) {
      error(ex.getMessage(), start);
    }
    setValue(value);
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor,
   * setting exactly one token.
   */
  private void tokenize() {
    kind = null;
    while (pos < buffer.length) {
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '{' -> {
          setToken(TokenKind.LBRACE, pos - 1, pos);
          openParenStackDepth++;
        }
        case '}' -> {
          setToken(TokenKind.RBRACE, pos - 1, pos);
          popParen();
        }
        case '(' -> {
          setToken(TokenKind.LPAREN, pos - 1, pos);
          openParenStackDepth++;
        }
        case ')' -> {
          setToken(TokenKind.RPAREN, pos - 1, pos);
          popParen();
        }
        case '[' -> {
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          openParenStackDepth++;
        }
        case ']' -> {
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          popParen();
        }
        case '=' -> twoCharOrOne('=', TokenKind.EQUALS_EQUALS, TokenKind.EQUALS);
        case '<' -> twoCharOrOne('=', TokenKind.LESS_EQUALS, TokenKind.LESS);
        case '>' -> twoCharOrOne('=', TokenKind.GREATER_EQUALS, TokenKind.GREATER);
        case '+' -> twoCharOrOne('=', TokenKind.PLUS_EQUALS, TokenKind.PLUS);
        case '!' -> {
          if (peek(0) == '=') {
            setToken(TokenKind.NOT_EQUALS, pos - 1, pos + 1);
            pos++;
          } else {
            illegal(c);
          }
        }
        case ':' -> setToken(TokenKind.COLON, pos - 1, pos);
        case ',' -> setToken(TokenKind.COMMA, pos - 1, pos);
        case '.' -> setToken(TokenKind.DOT, pos - 1, pos);
        case '?' -> setToken(TokenKind.QUESTION, pos - 1, pos);
        case '-' -> setToken(TokenKind.MINUS, pos - 1, pos);
        case '*' -> setToken(TokenKind.STAR, pos - 1, pos);
        case '/' -> setToken(TokenKind.SLASH, pos - 1, pos);
        case '%' -> setToken(TokenKind.PERCENT, pos - 1, pos);
        case ' ', '\t', '\r' -> {
          /* ignore */
        }
        case '\\' -> {
          // Backslash is valid only at the end of a line (or in a string)
          if (peek(0) == '\n') {
            pos += 1; // skip the end of line character
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2; // skip the CRLF at the end of line
          } else {
            illegal(c);
          }
        }
        case '\n' -> {
          if (openParenStackDepth == 0) {
            setToken(TokenKind.NEWLINE, pos - 1, pos);
          }
        }
        case '#' -> {
          int oldPos = pos - 1;
          while (pos < buffer.length && buffer[pos] != '\n') {
            pos++;
          }
          int commentEnd = pos;
          if (commentEnd > oldPos + 1 && buffer[commentEnd - 1] == '\r') {
            commentEnd--;
          }
          addComment(oldPos, commentEnd);
        }
        case '\'' -> stringLiteral(pos - 1, TokenKind.STRING);
        case '"' -> {
          error("Double quotes are not supported. Use single quotes.", pos - 1);
          setToken(TokenKind.ILLEGAL, pos - 1, pos);
          setValue(Character.toString(c));
        }
        default -> {
          if (c == 'f' && peek(0) == '\'') {
            pos++;
            stringLiteral(pos - 2, TokenKind.FSTRING);
          } else if (isdigit(c)) {
            pos--; // unconsume
            scanNumber();
          } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') {
            identifierOrKeyword();
          } else {
            illegal(c);
          }
        }
      }
      if (kind != null) { // stop here if we scanned a token
        return;
      }
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  private void twoCharOrOne(char second, TokenKind twoChar, TokenKind oneChar) {
    if (peek(0) == second) {
      setToken(twoChar, pos - 1, pos + 1);
      pos++;
    } else {
      setToken(oneChar, pos - 1, pos);
    }
  }

  private void illegal(char c) {
    error("invalid character: '" + c + "'", pos - 1);
    setToken(TokenKind.ILLEGAL, pos - 1, pos);
    setValue(Character.toString(c));
  }

  private static boolean isdigit(int c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isxdigit(int c) {
    return isdigit(c) || ('A' <= c && c <= 'F') || ('a' <= c && c <= 'f');
  }

  /** Returns the text at offset start with length end - start. */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }

  private void addComment(int start, int end) {
    comments.add(new Comment(locs, start, bufferSlice(start, end)));
  }
}
