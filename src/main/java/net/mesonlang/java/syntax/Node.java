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

/**
 * A Node is a node in a build file syntax tree.
 *
 * <p>Every node records the char offsets of its first and last characters; line and column
 * information is derived from them on demand. The span of a node encloses the spans of all of its
 * children.
 *
 * <p>Nodes reachable from a {@link BuildFile} have a unique id, assigned in lexical (pre-)order
 * once parsing is complete. Ids are stable for a given input and are used as keys by analyses.
 */
public abstract class Node {

  final FileLocations locs;
  private int id = -1;

  Node(FileLocations locs) {
    this.locs = Preconditions.checkNotNull(locs);
  }

  /** Returns the char offset of the first character of this node. */
  public abstract int getStartOffset();

  /** Returns the char offset of the character immediately after this node. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the last character of this node. */
  public final Location getEndLocation() {
    int end = getEndOffset();
    return locs.getLocation(end > getStartOffset() ? end - 1 : end);
  }

  /** Synonym for {@link #getStartLocation}. */
  public final Location getLocation() {
    return getStartLocation();
  }

  /** Returns the source id of the file containing this node. */
  public final String getFile() {
    return locs.file();
  }

  /**
   * Returns the per-parse unique id of this node, or -1 for a node not reachable from a parsed
   * file (for example a comment, or an expression parsed on its own).
   */
  public final int getId() {
    return id;
  }

  final void setId(int id) {
    Preconditions.checkState(this.id == -1, "node id already assigned");
    this.id = id;
  }

  /** Returns the source text of this node. */
  public final String getSourceText() {
    return locs.slice(getStartOffset(), getEndOffset());
  }

  /**
   * Returns a pretty-printed representation of this node on a single line. Used for diagnostics
   * and debugging.
   */
  @Override
  public String toString() {
    return NodePrinter.printCompact(this);
  }

  /** Implements the double dispatch by calling into the node specific visit method. */
  public abstract void accept(NodeVisitor visitor);
}
