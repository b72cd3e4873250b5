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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import net.mesonlang.java.syntax.FormatStringLiteral;
import net.mesonlang.java.syntax.TokenKind;

/**
 * The deterministic semantics of the operators of the build language, applied to known values.
 * Operands are never {@link UnknownValue}s, except as the right operand of {@code +} on an array,
 * which appends it like any other element.
 */
public final class Operators {

  private Operators() {}

  /**
   * Applies a binary operator.
   *
   * <ul>
   *   <li>{@code +} concatenates strings, adds integers, merges dictionaries (right operand wins)
   *       and concatenates arrays, wrapping a right operand that is not an array;
   *   <li>{@code - * %} apply to integers; {@code %} has the sign of the divisor;
   *   <li>{@code /} is floor division on integers and joins paths on strings;
   *   <li>{@code == !=} compare any values; {@code < <= > >=} compare integers or strings;
   *   <li>{@code in} and {@code not in} test membership in an array or among the keys of a
   *       dictionary;
   *   <li>{@code and} and {@code or} apply to booleans.
   * </ul>
   */
  public static Object binaryOp(TokenKind op, Object x, Object y) throws InterpretationException {
    switch (op) {
      case PLUS:
        return plus(x, y);
      case MINUS:
      case STAR:
      case PERCENT:
        return intArithmetic(op, x, y);
      case SLASH:
        return divide(x, y);
      case EQUALS_EQUALS:
        return x.equals(y);
      case NOT_EQUALS:
        return !x.equals(y);
      case LESS:
        return compare(op, x, y) < 0;
      case LESS_EQUALS:
        return compare(op, x, y) <= 0;
      case GREATER:
        return compare(op, x, y) > 0;
      case GREATER_EQUALS:
        return compare(op, x, y) >= 0;
      case IN:
        return in(x, y);
      case NOT_IN:
        return !in(x, y);
      case AND:
        return truth(x) && truth(y);
      case OR:
        return truth(x) || truth(y);
      default:
        throw new IllegalArgumentException("not a binary operator: " + op);
    }
  }

  private static Object plus(Object x, Object y) throws InterpretationException {
    if (x instanceof String xs && y instanceof String ys) {
      return xs + ys;
    } else if (x instanceof Long xi && y instanceof Long yi) {
      try {
        return Math.addExact(xi, yi);
      } catch (ArithmeticException ex) {
        throw new InterpretationException("integer overflow", ex);
      }
    } else if (x instanceof List<?> xl) {
      ImmutableList.Builder<Object> result = ImmutableList.builder();
      result.addAll(xl);
      if (y instanceof List<?> yl) {
        result.addAll(yl);
      } else {
        result.add(y);
      }
      return result.build();
    } else if (x instanceof Map<?, ?> xm && y instanceof Map<?, ?> ym) {
      Map<Object, Object> merged = new LinkedHashMap<>(xm);
      merged.putAll(ym);
      return ImmutableMap.copyOf(merged);
    }
    throw unsupported(TokenKind.PLUS, x, y);
  }

  private static Object intArithmetic(TokenKind op, Object x, Object y)
      throws InterpretationException {
    if (!(x instanceof Long xi) || !(y instanceof Long yi)) {
      throw unsupported(op, x, y);
    }
    try {
      switch (op) {
        case MINUS:
          return Math.subtractExact(xi, yi);
        case STAR:
          return Math.multiplyExact(xi, yi);
        default:
          if (yi == 0) {
            throw new InterpretationException("modulo by zero");
          }
          return Math.floorMod(xi, yi);
      }
    } catch (ArithmeticException ex) {
      throw new InterpretationException("integer overflow", ex);
    }
  }

  private static Object divide(Object x, Object y) throws InterpretationException {
    if (x instanceof Long xi && y instanceof Long yi) {
      if (yi == 0) {
        throw new InterpretationException("division by zero");
      }
      return Math.floorDiv(xi, yi);
    } else if (x instanceof String xs && y instanceof String ys) {
      return joinPaths(xs, ys);
    }
    throw unsupported(TokenKind.SLASH, x, y);
  }

  /**
   * Joins two path segments with a single '/'. An absolute right operand replaces the left one,
   * and an empty left operand is dropped.
   */
  public static String joinPaths(String x, String y) {
    if (y.startsWith("/") || x.isEmpty()) {
      return y;
    }
    return x.endsWith("/") ? x + y : x + "/" + y;
  }

  private static int compare(TokenKind op, Object x, Object y) throws InterpretationException {
    if (x instanceof Long xi && y instanceof Long yi) {
      return Long.compare(xi, yi);
    } else if (x instanceof String xs && y instanceof String ys) {
      return xs.compareTo(ys);
    }
    throw unsupported(op, x, y);
  }

  private static boolean in(Object x, Object y) throws InterpretationException {
    if (y instanceof List<?> list) {
      return list.contains(x);
    } else if (y instanceof Map<?, ?> map) {
      if (!(x instanceof String)) {
        throw InterpretationException.errorf(
            "dictionary keys are strings, not %s", ValueType.typeName(x));
      }
      return map.containsKey(x);
    }
    throw unsupported(TokenKind.IN, x, y);
  }

  /** Applies {@code not} to a boolean or unary {@code -} to an integer. */
  public static Object unaryOp(TokenKind op, Object x) throws InterpretationException {
    if (op == TokenKind.NOT && x instanceof Boolean b) {
      return !b;
    } else if (op == TokenKind.MINUS && x instanceof Long i) {
      if (i == Long.MIN_VALUE) {
        throw new InterpretationException("integer overflow");
      }
      return -i;
    }
    throw InterpretationException.errorf(
        "unsupported unary operation: %s%s",
        op == TokenKind.NOT ? "not " : op,
        ValueType.typeName(x));
  }

  /** Returns the value of a condition, which must be a boolean. */
  public static boolean truth(Object x) throws InterpretationException {
    if (x instanceof Boolean b) {
      return b;
    }
    throw InterpretationException.errorf("expected a boolean, got %s", ValueType.typeName(x));
  }

  /**
   * Indexes an array by an integer, counting from the end if negative, or a dictionary by a
   * string key.
   */
  public static Object index(Object object, Object key) throws InterpretationException {
    if (object instanceof List<?> list) {
      if (!(key instanceof Long i)) {
        throw InterpretationException.errorf(
            "array index must be an int, not %s", ValueType.typeName(key));
      }
      long index = i < 0 ? i + list.size() : i;
      if (index < 0 || index >= list.size()) {
        throw InterpretationException.errorf(
            "index %d out of range for array of length %d", i, list.size());
      }
      return list.get((int) index);
    } else if (object instanceof Map<?, ?> map) {
      if (!(key instanceof String)) {
        throw InterpretationException.errorf(
            "dictionary key must be a string, not %s", ValueType.typeName(key));
      }
      Object value = map.get(key);
      if (value == null) {
        throw InterpretationException.errorf("key '%s' is not in the dictionary", key);
      }
      return value;
    }
    throw InterpretationException.errorf("%s is not indexable", ValueType.typeName(object));
  }

  /**
   * Returns the string form of a scalar, as substituted into format strings and messages:
   * strings as-is, integers in decimal, booleans as {@code true} or {@code false}.
   */
  public static String str(Object x) throws InterpretationException {
    if (x instanceof String s) {
      return s;
    } else if (x instanceof Long || x instanceof Boolean) {
      return x.toString();
    }
    throw InterpretationException.errorf(
        "cannot convert %s to a string", ValueType.typeName(x));
  }

  /**
   * Expands the {@code @name@} placeholders of a format string.
   *
   * @param lookup returns the value of a variable, or null if it is undefined
   */
  public static String format(String template, Function<String, Object> lookup)
      throws InterpretationException {
    Matcher m = FormatStringLiteral.placeholderPattern().matcher(template);
    StringBuilder buf = new StringBuilder();
    int last = 0;
    while (m.find()) {
      Object value = lookup.apply(m.group(1));
      if (value == null) {
        throw InterpretationException.errorf(
            "undefined variable '%s' in format string", m.group(1));
      }
      buf.append(template, last, m.start()).append(str(value));
      last = m.end();
    }
    return buf.append(template.substring(last)).toString();
  }

  private static InterpretationException unsupported(TokenKind op, Object x, Object y) {
    return InterpretationException.errorf(
        "unsupported binary operation: %s %s %s",
        ValueType.typeName(x), op, ValueType.typeName(y));
  }
}
