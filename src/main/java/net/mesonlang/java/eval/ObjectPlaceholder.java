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

package net.mesonlang.java.eval;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import javax.annotation.Nullable;
import net.mesonlang.java.syntax.Node;

/**
 * Stands in for a domain object, such as a build target or a dependency, that only a real build
 * would create. A placeholder records the function that would have created the object, the name
 * it was given (if statically known), and the call that defines it.
 *
 * <p>Two placeholders are equal if they stand for the same object, that is, if they were created
 * by the same call.
 */
public final class ObjectPlaceholder {

  private final String kind;
  @Nullable private final String name;
  private final Node definingNode;

  public ObjectPlaceholder(String kind, @Nullable String name, Node definingNode) {
    this.kind = Preconditions.checkNotNull(kind);
    this.name = name;
    this.definingNode = Preconditions.checkNotNull(definingNode);
  }

  /** Returns the name of the function that creates the object, for example "executable". */
  public String getKind() {
    return kind;
  }

  /** Returns the name of the object, or null if it is not statically known. */
  @Nullable
  public String getName() {
    return name;
  }

  /** Returns the call that creates the object. */
  public Node getDefiningNode() {
    return definingNode;
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof ObjectPlaceholder other
        && this.definingNode == other.definingNode
        && this.kind.equals(other.kind);
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(definingNode) * 31 + kind.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("name", name)
        .add("location", definingNode.getStartLocation())
        .omitNullValues()
        .toString();
  }
}
