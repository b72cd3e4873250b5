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

package net.mesonlang.java.analysis;

import com.google.common.collect.ImmutableList;
import java.io.IOException;

/**
 * Gives the interpreter read access to a source tree. Paths are relative to the root of the tree,
 * use '/' as separator, and the empty string denotes the root itself.
 */
public interface SourceFileAccessor {

  /**
   * Returns a canonical name for a directory, the same for every path that denotes it (through
   * "..", "." or symbolic links).
   *
   * @throws IOException if the directory does not exist
   */
  String canonicalDirectory(String path) throws IOException;

  /** Reports whether the path names a regular file. */
  boolean isFile(String path);

  /** Returns the contents of a file. */
  byte[] readFile(String path) throws IOException;

  /** Returns the names of the immediate subdirectories of a directory, sorted. */
  ImmutableList<String> listDirectories(String path) throws IOException;
}
