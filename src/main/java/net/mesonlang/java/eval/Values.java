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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;

/** Helper functions over resolved values. */
public final class Values {

  private Values() {}

  /** Returns the elements of a value, recursively flattening nested arrays, in order. */
  public static ImmutableList<Object> flatten(Object value) {
    ImmutableList.Builder<Object> out = ImmutableList.builder();
    flattenInto(value, out);
    return out.build();
  }

  private static void flattenInto(Object value, ImmutableList.Builder<Object> out) {
    if (value instanceof List<?> list) {
      for (Object elem : list) {
        flattenInto(elem, out);
      }
    } else {
      out.add(value);
    }
  }

  /** Reports whether a value is unknown or contains an unknown value at any depth. */
  public static boolean containsUnknown(Object value) {
    if (value instanceof UnknownValue) {
      return true;
    } else if (value instanceof List<?> list) {
      return list.stream().anyMatch(Values::containsUnknown);
    } else if (value instanceof Map<?, ?> map) {
      return map.values().stream().anyMatch(Values::containsUnknown);
    }
    return false;
  }
}
