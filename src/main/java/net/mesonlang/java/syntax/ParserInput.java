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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * The apparent name and contents of a source file, for consumption by the parser. The file name
 * is the source id used in diagnostics and node locations; this class never reads the file system.
 */
public final class ParserInput {

  private final char[] content;
  private final String file;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = Preconditions.checkNotNull(file);
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the source id of the input source. */
  public String getFile() {
    return file;
  }

  /** Returns an input source that decodes the given UTF-8 bytes. */
  public static ParserInput fromUtf8(byte[] bytes, String file) {
    return new ParserInput(new String(bytes, UTF_8).toCharArray(), file);
  }

  /** Returns an input source that reads from the given string. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /** Returns an input source that reads from a char array, which the caller must not modify. */
  public static ParserInput fromCharArray(char[] content, String file) {
    return new ParserInput(content, file);
  }

  /**
   * Returns an unnamed input source that reads from a list of strings, joined by newlines.
   *
   * <p>Use this function for tests only.
   */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines), "");
  }
}
