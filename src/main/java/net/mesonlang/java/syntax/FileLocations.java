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
import java.util.Arrays;

/**
 * FileLocations maps char offsets within a file to {@link Location}s, and exposes the text of each
 * line for diagnostics. One instance is shared by the lexer, the parser and every node of a file.
 */
final class FileLocations {

  private final char[] buffer;
  private final int[] linestart; // offset of start of each line, ascending
  private final String file;

  private FileLocations(char[] buffer, int[] linestart, String file) {
    this.buffer = buffer;
    this.linestart = linestart;
    this.file = file;
  }

  static FileLocations create(char[] buffer, String file) {
    int[] linestart = new int[16];
    int n = 0;
    linestart[n++] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (n == linestart.length) {
          linestart = Arrays.copyOf(linestart, 2 * n);
        }
        linestart[n++] = i + 1;
      }
    }
    return new FileLocations(buffer, Arrays.copyOf(linestart, n), file);
  }

  String file() {
    return file;
  }

  /** Returns the number of chars in the file. */
  int size() {
    return buffer.length;
  }

  // Returns the 0-based index of the line containing the given offset.
  private int lineIndex(int offset) {
    Preconditions.checkArgument(
        0 <= offset && offset <= buffer.length, "offset %s out of range", offset);
    int i = Arrays.binarySearch(linestart, offset);
    if (i < 0) {
      i = -i - 2; // index of the greatest line start below offset
    }
    return i;
  }

  /** Returns the 1-based line number of the given offset. */
  int getLine(int offset) {
    return lineIndex(offset) + 1;
  }

  /** Returns the offset of the first char of the line containing the given offset. */
  int getLineStartOffset(int offset) {
    return linestart[lineIndex(offset)];
  }

  Location getLocation(int offset) {
    int i = lineIndex(offset);
    return new Location(file, i + 1, offset - linestart[i] + 1);
  }

  /** Returns the text of the given 1-based line, without its line terminator. */
  String getLineText(int line) {
    if (line < 1 || line > linestart.length) {
      return "";
    }
    int start = linestart[line - 1];
    int end = line < linestart.length ? linestart[line] - 1 : buffer.length;
    if (end > start && buffer[end - 1] == '\r') {
      end--;
    }
    return new String(buffer, start, Math.max(0, end - start));
  }

  /** Returns the source text between two offsets. */
  String slice(int start, int end) {
    return new String(buffer, start, end - start);
  }
}
