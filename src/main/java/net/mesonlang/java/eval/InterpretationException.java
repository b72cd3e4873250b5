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

import com.google.errorprone.annotations.FormatMethod;

/**
 * An InterpretationException indicates that a value could not be computed statically: an operator
 * was applied to operands of the wrong type, a method does not exist, an index is out of range,
 * and so on. Static resolution recovers from it by substituting an {@link UnknownValue}.
 */
public class InterpretationException extends Exception {

  public InterpretationException(String message) {
    super(message);
  }

  public InterpretationException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns a new exception with a formatted message. */
  @FormatMethod
  public static InterpretationException errorf(String format, Object... args) {
    return new InterpretationException(String.format(format, args));
  }
}
