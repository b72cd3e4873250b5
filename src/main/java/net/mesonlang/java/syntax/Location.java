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
import java.util.Objects;

/**
 * A Location denotes a position within a build file, identified by the source id of the file (the
 * logical subdirectory path it was read from), a 1-based line number and a 1-based column number.
 * Lines and columns are never zero except in {@link #BUILTIN}.
 */
public final class Location implements Comparable<Location> {

  /** A location for builtin values and synthesized nodes that have no position in any file. */
  public static final Location BUILTIN = new Location("<builtin>", 0, 0);

  private final String file;
  private final int line;
  private final int column;

  public Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns the source id of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the 1-based line number. */
  public int line() {
    return line;
  }

  /** Returns the 1-based column number, counted in chars. */
  public int column() {
    return column;
  }

  /** Returns a location for the given file with neither line nor column information. */
  public static Location fromFile(String file) {
    return new Location(file, 0, 0);
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(this.line, that.line);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(this.column, that.column);
  }

  /** Formats the location as {@code "file:line:column"}, omitting absent parts. */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location loc
            && this.file.equals(loc.file)
            && this.line == loc.line
            && this.column == loc.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }
}
