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

/**
 * Syntax node for a string literal, either a single-quoted string with escapes or a verbatim
 * triple-quoted multi-line string.
 */
public final class StringLiteral extends Expression {

  private final int startOffset;
  private final String value;
  private final int endOffset;
  private final boolean multiline;

  StringLiteral(
      FileLocations locs, int startOffset, String value, int endOffset, boolean multiline) {
    super(locs, Kind.STRING_LITERAL);
    this.startOffset = startOffset;
    this.value = value;
    this.endOffset = endOffset;
    this.multiline = multiline;
  }

  /** Returns the value denoted by the string literal. */
  public String getValue() {
    return value;
  }

  /** Reports whether the literal was written with triple quotes. */
  public boolean isMultiline() {
    return multiline;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /**
   * Returns the single-quoted source form of a string value, escaping quotes and newlines. A
   * backslash is escaped only where the scanner would otherwise read it as part of an escape
   * sequence, so {@code '\t'} keeps its source form.
   */
  public static String quote(String value) {
    StringBuilder buf = new StringBuilder(value.length() + 2);
    buf.append('\'');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\'' -> buf.append("\\'");
        case '\n' -> buf.append("\\n");
        case '\\' -> {
          char next = i + 1 < value.length() ? value.charAt(i + 1) : '\\';
          buf.append(next == '\'' || next == '\\' || next == 'n' || next == '\n' ? "\\\\" : "\\");
        }
        default -> buf.append(c);
      }
    }
    return buf.append('\'').toString();
  }
}
