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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * The pure methods of the builtin value types: strings, integers, booleans, arrays and
 * dictionaries.
 *
 * <p>Each method is registered under the {@link ValueType} of its receiver. Methods of domain
 * objects are not modelled; calling them yields an unknown value.
 */
public final class MethodLibrary {

  private static final CharMatcher WHITESPACE = CharMatcher.anyOf(" \t\n\r\u000b\f");
  private static final CharMatcher IDENTIFIER_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .precomputed();
  private static final Pattern FORMAT_ARG = Pattern.compile("@(\\d+)@");

  private static final ImmutableTable<ValueType, String, BuiltinMethod> METHODS =
      ImmutableTable.<ValueType, String, BuiltinMethod>builder()
          // str
          .put(ValueType.STRING, "strip", MethodLibrary::strip)
          .put(ValueType.STRING, "format", MethodLibrary::format)
          .put(ValueType.STRING, "to_upper", (s, args, kw) -> Ascii.toUpperCase(self(s)))
          .put(ValueType.STRING, "to_lower", (s, args, kw) -> Ascii.toLowerCase(self(s)))
          .put(
              ValueType.STRING,
              "underscorify",
              (s, args, kw) -> IDENTIFIER_CHARS.negate().replaceFrom(self(s), '_'))
          .put(ValueType.STRING, "split", MethodLibrary::split)
          .put(
              ValueType.STRING,
              "startswith",
              (s, args, kw) -> self(s).startsWith(stringArg("startswith", args, 0)))
          .put(
              ValueType.STRING,
              "endswith",
              (s, args, kw) -> self(s).endsWith(stringArg("endswith", args, 0)))
          .put(
              ValueType.STRING,
              "contains",
              (s, args, kw) -> self(s).contains(stringArg("contains", args, 0)))
          .put(ValueType.STRING, "to_int", MethodLibrary::toInt)
          .put(ValueType.STRING, "join", MethodLibrary::join)
          .put(ValueType.STRING, "substring", MethodLibrary::substring)
          .put(
              ValueType.STRING,
              "replace",
              (s, args, kw) ->
                  self(s).replace(stringArg("replace", args, 0), stringArg("replace", args, 1)))
          // int
          .put(ValueType.INT, "is_even", (i, args, kw) -> (Long) i % 2 == 0)
          .put(ValueType.INT, "is_odd", (i, args, kw) -> (Long) i % 2 != 0)
          .put(ValueType.INT, "to_string", (i, args, kw) -> i.toString())
          // bool
          .put(ValueType.BOOL, "to_string", MethodLibrary::boolToString)
          .put(ValueType.BOOL, "to_int", (b, args, kw) -> (Boolean) b ? 1L : 0L)
          // list
          .put(ValueType.LIST, "length", (l, args, kw) -> (long) ((List<?>) l).size())
          .put(
              ValueType.LIST,
              "contains",
              (l, args, kw) -> containsDeep((List<?>) l, arg("contains", args, 0)))
          .put(ValueType.LIST, "get", MethodLibrary::listGet)
          // dict
          .put(
              ValueType.DICT,
              "has_key",
              (d, args, kw) -> ((Map<?, ?>) d).containsKey(stringArg("has_key", args, 0)))
          .put(ValueType.DICT, "get", MethodLibrary::dictGet)
          .put(ValueType.DICT, "keys", MethodLibrary::dictKeys)
          .buildOrThrow();

  private MethodLibrary() {}

  /** Returns the method of the given name of a type, or null if there is none. */
  @Nullable
  public static BuiltinMethod getMethod(ValueType type, String name) {
    return METHODS.get(type, name);
  }

  /** Returns the names of the methods of a type, in sorted order. */
  public static ImmutableSortedSet<String> getMethodNames(ValueType type) {
    return ImmutableSortedSet.copyOf(METHODS.row(type).keySet());
  }

  /** Calls a method on a known receiver. */
  public static Object call(
      Object receiver,
      String name,
      ImmutableList<Object> positional,
      ImmutableMap<String, Object> named)
      throws InterpretationException {
    ValueType type = ValueType.of(receiver);
    BuiltinMethod method = METHODS.get(type, name);
    if (method == null) {
      throw InterpretationException.errorf("'%s' value has no method '%s'", type, name);
    }
    return method.call(receiver, positional, named);
  }

  private static String self(Object receiver) {
    return (String) receiver;
  }

  private static Object arg(String method, List<Object> args, int i)
      throws InterpretationException {
    if (i >= args.size()) {
      throw InterpretationException.errorf(
          "%s() missing positional argument %d", method, i + 1);
    }
    return args.get(i);
  }

  private static String stringArg(String method, List<Object> args, int i)
      throws InterpretationException {
    Object x = arg(method, args, i);
    if (!(x instanceof String s)) {
      throw InterpretationException.errorf(
          "%s() argument %d must be a string, not %s", method, i + 1, ValueType.typeName(x));
    }
    return s;
  }

  private static long intArg(String method, List<Object> args, int i)
      throws InterpretationException {
    Object x = arg(method, args, i);
    if (!(x instanceof Long n)) {
      throw InterpretationException.errorf(
          "%s() argument %d must be an int, not %s", method, i + 1, ValueType.typeName(x));
    }
    return n;
  }

  private static Object strip(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    CharMatcher chars =
        args.isEmpty() ? WHITESPACE : CharMatcher.anyOf(stringArg("strip", args, 0));
    return chars.trimFrom(self(receiver));
  }

  /** Replaces each {@code @N@} in the receiver by the string form of the N-th argument. */
  private static Object format(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    String template = self(receiver);
    Matcher m = FORMAT_ARG.matcher(template);
    StringBuilder buf = new StringBuilder();
    int last = 0;
    while (m.find()) {
      String digits = CharMatcher.is('0').trimLeadingFrom(m.group(1));
      // Indices too long for an int are out of range anyway.
      int i = digits.isEmpty() ? 0 : digits.length() > 9 ? -1 : Integer.parseInt(digits);
      if (i < 0 || i >= args.size()) {
        throw InterpretationException.errorf(
            "format placeholder @%s@ out of range: %d arguments", m.group(1), args.size());
      }
      buf.append(template, last, m.start()).append(Operators.str(args.get(i)));
      last = m.end();
    }
    return buf.append(template.substring(last)).toString();
  }

  /**
   * Splits on a separator, or on runs of whitespace (dropping empty pieces) if there is none.
   */
  private static Object split(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    String s = self(receiver);
    if (args.isEmpty()) {
      return ImmutableList.<Object>copyOf(
          Splitter.on(WHITESPACE).omitEmptyStrings().split(s));
    }
    String sep = stringArg("split", args, 0);
    if (sep.isEmpty()) {
      throw new InterpretationException("split() separator must not be empty");
    }
    return ImmutableList.<Object>copyOf(Splitter.on(sep).split(s));
  }

  private static Object toInt(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    String s = self(receiver);
    try {
      return Long.parseLong(s);
    } catch (NumberFormatException ex) {
      throw InterpretationException.errorf("string '%s' cannot be converted to int", s);
    }
  }

  /** Joins the strings among the arguments, flattening arrays, with the receiver in between. */
  private static Object join(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    List<String> parts = new ArrayList<>();
    for (Object x : Values.flatten(args)) {
      if (!(x instanceof String s)) {
        throw InterpretationException.errorf(
            "join() arguments must be strings, not %s", ValueType.typeName(x));
      }
      parts.add(s);
    }
    return Joiner.on(self(receiver)).join(parts);
  }

  /** Returns the slice [start, end), counting negative indices from the end and clamping. */
  private static Object substring(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    String s = self(receiver);
    int len = s.length();
    long start = args.size() > 0 ? intArg("substring", args, 0) : 0;
    long end = args.size() > 1 ? intArg("substring", args, 1) : len;
    start = clamp(start < 0 ? start + len : start, len);
    end = clamp(end < 0 ? end + len : end, len);
    return start < end ? s.substring((int) start, (int) end) : "";
  }

  private static long clamp(long i, int len) {
    return Math.max(0, Math.min(i, len));
  }

  private static Object boolToString(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    String t = args.size() > 0 ? stringArg("to_string", args, 0) : "true";
    String f = args.size() > 1 ? stringArg("to_string", args, 1) : "false";
    return (Boolean) receiver ? t : f;
  }

  /** Reports whether an array, or any array nested in it, contains the value. */
  private static boolean containsDeep(List<?> list, Object x) {
    for (Object elem : list) {
      if (elem.equals(x) || (elem instanceof List<?> nested && containsDeep(nested, x))) {
        return true;
      }
    }
    return false;
  }

  private static Object listGet(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    List<?> list = (List<?>) receiver;
    long i = intArg("get", args, 0);
    long index = i < 0 ? i + list.size() : i;
    if (index >= 0 && index < list.size()) {
      return list.get((int) index);
    }
    if (args.size() > 1) {
      return args.get(1);
    }
    throw InterpretationException.errorf(
        "index %d out of range for array of length %d", i, list.size());
  }

  private static Object dictKeys(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw) {
    ImmutableSortedSet.Builder<String> keys = ImmutableSortedSet.naturalOrder();
    for (Object key : ((Map<?, ?>) receiver).keySet()) {
      keys.add((String) key);
    }
    return ImmutableList.<Object>copyOf(keys.build());
  }

  private static Object dictGet(
      Object receiver, ImmutableList<Object> args, ImmutableMap<String, Object> kw)
      throws InterpretationException {
    Map<?, ?> dict = (Map<?, ?>) receiver;
    String key = stringArg("get", args, 0);
    Object value = dict.get(key);
    if (value != null) {
      return value;
    }
    if (args.size() > 1) {
      return args.get(1);
    }
    throw InterpretationException.errorf("key '%s' is not in the dictionary", key);
  }
}
