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
import com.google.common.collect.ImmutableMap;

/**
 * A pure method of a builtin type. Methods see only known values: the receiver and every argument
 * have been resolved statically before the call.
 */
@FunctionalInterface
public interface BuiltinMethod {

  /**
   * Calls the method.
   *
   * @param receiver the value the method is called on
   * @param positional the positional arguments, in order
   * @param named the keyword arguments
   */
  Object call(Object receiver, ImmutableList<Object> positional, ImmutableMap<String, Object> named)
      throws InterpretationException;
}
