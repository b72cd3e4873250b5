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

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Accumulates printed source text, inserting indentation at the start of each line and tracking
 * the current column. Shared by the printers.
 */
final class SourceWriter {

  private final StringBuilder buf = new StringBuilder();
  private final String indentUnit;
  private int indentLevel = 0;
  private boolean atLineStart = true;

  SourceWriter(int indent) {
    this.indentUnit = Strings.repeat(" ", indent);
  }

  /** Appends text, which must not start a new line except inside a multi-line string. */
  @CanIgnoreReturnValue
  SourceWriter append(String s) {
    if (s.isEmpty()) {
      return this;
    }
    if (atLineStart) {
      buf.append(Strings.repeat(indentUnit, indentLevel));
      atLineStart = false;
    }
    buf.append(s);
    return this;
  }

  /** Ends the current line. Trailing blanks are removed. */
  void newline() {
    int n = buf.length();
    while (n > 0 && buf.charAt(n - 1) == ' ') {
      n--;
    }
    buf.setLength(n);
    buf.append('\n');
    atLineStart = true;
  }

  /** Emits an empty line, unless the output is empty or already ends with one. */
  void blankLine() {
    if (!atLineStart) {
      newline();
    }
    int n = buf.length();
    if (n == 0 || (n >= 2 && buf.charAt(n - 2) == '\n')) {
      return;
    }
    buf.append('\n');
  }

  void indent() {
    indentLevel++;
  }

  void dedent() {
    indentLevel--;
  }

  boolean atLineStart() {
    return atLineStart;
  }

  /** Returns the 0-based column at which the next appended text will start. */
  int column() {
    if (atLineStart) {
      return indentLevel * indentUnit.length();
    }
    int lastNewline = buf.lastIndexOf("\n");
    return buf.length() - (lastNewline + 1);
  }

  @Override
  public String toString() {
    return buf.toString();
  }
}
