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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A SyntaxError represents a lexical or parse error in a build file. It carries the text of the
 * offending line so that callers can render a caret diagnostic without access to the source.
 *
 * <p>Errors of kind {@link Kind#UNTERMINATED_BLOCK} additionally carry the location and line text
 * of the keyword that opened the block.
 */
public final class SyntaxError {

  /** The category of a syntax error. */
  public enum Kind {
    /** An unrecognized character or malformed literal. */
    LEXICAL,
    /** A grammar violation at a single point. */
    PARSE,
    /** A block construct without its closing keyword. */
    UNTERMINATED_BLOCK,
  }

  private final Kind kind;
  private final Location location;
  private final String message;
  private final String lineText;
  @Nullable private final Location blockStart;
  @Nullable private final String blockStartLineText;

  SyntaxError(
      Kind kind,
      Location location,
      String message,
      String lineText,
      @Nullable Location blockStart,
      @Nullable String blockStartLineText) {
    Preconditions.checkArgument(
        (kind == Kind.UNTERMINATED_BLOCK) == (blockStart != null),
        "block start location must be given exactly for unterminated block errors");
    this.kind = kind;
    this.location = Preconditions.checkNotNull(location);
    this.message = Preconditions.checkNotNull(message);
    this.lineText = Preconditions.checkNotNull(lineText);
    this.blockStart = blockStart;
    this.blockStartLineText = blockStartLineText;
  }

  /** Returns the kind of this error. */
  public Kind kind() {
    return kind;
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns the text of the line on which the error occurred. */
  public String lineText() {
    return lineText;
  }

  /** Returns the location of the keyword opening an unterminated block, or null. */
  @Nullable
  public Location blockStart() {
    return blockStart;
  }

  /** Returns the text of the line opening an unterminated block, or null. */
  @Nullable
  public String blockStartLineText() {
    return blockStartLineText;
  }

  /** Returns a string of the form {@code "file:line:col: message"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * Returns a multi-line, human-readable rendering of this error: the one-line summary followed by
   * the offending line and a caret under the error column. Unterminated block errors also show the
   * line that opened the block.
   */
  public String format() {
    StringBuilder buf = new StringBuilder();
    buf.append(this).append('\n');
    appendCaret(buf, lineText, location.column());
    if (blockStart != null) {
      buf.append(blockStart).append(": block started here\n");
      appendCaret(buf, blockStartLineText, blockStart.column());
    }
    return buf.toString();
  }

  private static void appendCaret(StringBuilder buf, String line, int column) {
    buf.append(line).append('\n');
    buf.append(Strings.repeat(" ", Math.max(0, column - 1))).append("^\n");
  }

  /**
   * Returns a string version of the errors, one per line, suitable for an exception message or a
   * log entry.
   */
  public static String toString(List<SyntaxError> errors) {
    return Joiner.on('\n').join(errors);
  }

  /** A SyntaxError.Exception is an exception holding one or more syntax errors. */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Constructs an exception from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      Preconditions.checkArgument(!errors.isEmpty(), "no errors");
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }

    @Override
    public String getMessage() {
      return SyntaxError.toString(errors);
    }
  }
}
