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
import java.util.List;
import java.util.Map;

/**
 * The types of runtime-shaped values produced by static resolution.
 *
 * <p>Values are plain Java objects: {@link String}, {@link Long}, {@link Boolean}, {@link
 * com.google.common.collect.ImmutableList} for arrays, {@link
 * com.google.common.collect.ImmutableMap} with String keys for dictionaries, {@link
 * ObjectPlaceholder} for domain objects and {@link UnknownValue} for statically indeterminate
 * values.
 */
public enum ValueType {
  STRING("str"),
  INT("int"),
  BOOL("bool"),
  LIST("list"),
  DICT("dict"),
  OBJECT("object"),
  UNKNOWN("unknown");

  private final String name;

  ValueType(String name) {
    this.name = name;
  }

  /** Returns the type of a value. */
  public static ValueType of(Object value) {
    Preconditions.checkNotNull(value);
    if (value instanceof String) {
      return STRING;
    } else if (value instanceof Long) {
      return INT;
    } else if (value instanceof Boolean) {
      return BOOL;
    } else if (value instanceof List) {
      return LIST;
    } else if (value instanceof Map) {
      return DICT;
    } else if (value instanceof ObjectPlaceholder) {
      return OBJECT;
    } else if (value instanceof UnknownValue) {
      return UNKNOWN;
    }
    throw new IllegalArgumentException("not a value: " + value.getClass().getName());
  }

  /** Returns the name of the type of a value, as used in error messages. */
  public static String typeName(Object value) {
    return of(value).name;
  }

  @Override
  public String toString() {
    return name;
  }
}
