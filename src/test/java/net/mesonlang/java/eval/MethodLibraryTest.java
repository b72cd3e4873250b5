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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the built-in methods of {@link MethodLibrary}. */
@RunWith(JUnit4.class)
public final class MethodLibraryTest {

  private static Object call(Object receiver, String name, Object... args) throws Exception {
    return MethodLibrary.call(receiver, name, ImmutableList.copyOf(args), ImmutableMap.of());
  }

  private static String error(Object receiver, String name, Object... args) {
    return assertThrows(InterpretationException.class, () -> call(receiver, name, args))
        .getMessage();
  }

  @Test
  public void testStringMethods() throws Exception {
    assertThat(call("  a b \n", "strip")).isEqualTo("a b");
    assertThat(call("xxaxx", "strip", "x")).isEqualTo("a");
    assertThat(call("Foo", "to_upper")).isEqualTo("FOO");
    assertThat(call("Foo", "to_lower")).isEqualTo("foo");
    assertThat(call("lib-foo.so+1", "underscorify")).isEqualTo("lib_foo_so_1");
    assertThat(call("foobar", "startswith", "foo")).isEqualTo(true);
    assertThat(call("foobar", "endswith", "foo")).isEqualTo(false);
    assertThat(call("foobar", "contains", "oba")).isEqualTo(true);
    assertThat(call("a-b-a", "replace", "a", "c")).isEqualTo("c-b-c");
    assertThat(call("42", "to_int")).isEqualTo(42L);
    assertThat(error("4x", "to_int")).isEqualTo("string '4x' cannot be converted to int");
  }

  @Test
  public void testFormat() throws Exception {
    assertThat(call("@0@-@1@-@0@", "format", "a", 2L)).isEqualTo("a-2-a");
    assertThat(error("@2@", "format", "a"))
        .isEqualTo("format placeholder @2@ out of range: 1 arguments");
    assertThat(error("@99999999999@", "format", "a"))
        .isEqualTo("format placeholder @99999999999@ out of range: 1 arguments");
    assertThat(call("@000@", "format", "a")).isEqualTo("a");
  }

  @Test
  public void testSplit() throws Exception {
    assertThat(call(" a  b\tc ", "split")).isEqualTo(ImmutableList.of("a", "b", "c"));
    assertThat(call("a,,b", "split", ",")).isEqualTo(ImmutableList.of("a", "", "b"));
    assertThat(error("a", "split", "")).isEqualTo("split() separator must not be empty");
  }

  @Test
  public void testJoinFlattensArrays() throws Exception {
    assertThat(call("/", "join", "a", ImmutableList.of("b", ImmutableList.of("c"))))
        .isEqualTo("a/b/c");
    assertThat(error(", ", "join", "a", 1L)).isEqualTo("join() arguments must be strings, not int");
  }

  @Test
  public void testSubstring() throws Exception {
    assertThat(call("abcdef", "substring", 1L, 3L)).isEqualTo("bc");
    assertThat(call("abcdef", "substring", -2L)).isEqualTo("ef");
    assertThat(call("abcdef", "substring", 4L, 100L)).isEqualTo("ef");
    assertThat(call("abcdef", "substring", 4L, 2L)).isEqualTo("");
    assertThat(call("abcdef", "substring")).isEqualTo("abcdef");
  }

  @Test
  public void testIntAndBoolMethods() throws Exception {
    assertThat(call(4L, "is_even")).isEqualTo(true);
    assertThat(call(-3L, "is_odd")).isEqualTo(true);
    assertThat(call(12L, "to_string")).isEqualTo("12");
    assertThat(call(true, "to_string")).isEqualTo("true");
    assertThat(call(false, "to_string", "yes", "no")).isEqualTo("no");
    assertThat(call(true, "to_int")).isEqualTo(1L);
  }

  @Test
  public void testArrayMethods() throws Exception {
    ImmutableList<Object> list = ImmutableList.of("a", ImmutableList.of("b"));
    assertThat(call(list, "length")).isEqualTo(2L);
    assertThat(call(list, "contains", "b")).isEqualTo(true);
    assertThat(call(list, "contains", "c")).isEqualTo(false);
    assertThat(call(list, "get", -2L)).isEqualTo("a");
    assertThat(call(list, "get", 5L, "fallback")).isEqualTo("fallback");
    assertThat(error(list, "get", 5L)).isEqualTo("index 5 out of range for array of length 2");
  }

  @Test
  public void testDictMethods() throws Exception {
    ImmutableMap<String, Object> dict = ImmutableMap.of("b", 1L, "a", 2L);
    assertThat(call(dict, "has_key", "a")).isEqualTo(true);
    assertThat(call(dict, "get", "b")).isEqualTo(1L);
    assertThat(call(dict, "get", "c", 0L)).isEqualTo(0L);
    assertThat(call(dict, "keys")).isEqualTo(ImmutableList.of("a", "b"));
    assertThat(error(dict, "get", "c")).isEqualTo("key 'c' is not in the dictionary");
  }

  @Test
  public void testArgumentChecks() {
    assertThat(error("abc", "startswith")).isEqualTo("startswith() missing positional argument 1");
    assertThat(error("abc", "startswith", 1L))
        .isEqualTo("startswith() argument 1 must be a string, not int");
    assertThat(error("abc", "no_such_method"))
        .isEqualTo("'str' value has no method 'no_such_method'");
  }

  @Test
  public void testLookup() {
    assertThat(MethodLibrary.getMethod(ValueType.STRING, "strip")).isNotNull();
    assertThat(MethodLibrary.getMethod(ValueType.OBJECT, "strip")).isNull();
    assertThat(MethodLibrary.getMethodNames(ValueType.DICT))
        .containsExactly("get", "has_key", "keys")
        .inOrder();
  }
}
