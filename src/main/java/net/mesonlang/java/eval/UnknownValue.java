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

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;
import net.mesonlang.java.syntax.Node;

/**
 * A statically indeterminate value.
 *
 * <p>Every occurrence is a distinct instance, compared by identity, so that each one can be traced
 * to the node and the reason that produced it.
 */
public final class UnknownValue {

  @Nullable private final Node origin;
  private final String reason;

  public UnknownValue(@Nullable Node origin, String reason) {
    this.origin = origin;
    this.reason = Preconditions.checkNotNull(reason);
  }

  /** Returns the node whose value is unknown, or null for a synthetic join of several values. */
  @Nullable
  public Node getOrigin() {
    return origin;
  }

  /** Returns a short description of why the value is unknown. */
  public String getReason() {
    return reason;
  }

  /** Reports whether the given value is unknown. */
  public static boolean isUnknown(Object value) {
    return value instanceof UnknownValue;
  }

  @Override
  public String toString() {
    return origin == null
        ? "<unknown: " + reason + ">"
        : "<unknown at " + origin.getStartLocation() + ": " + reason + ">";
  }
}
