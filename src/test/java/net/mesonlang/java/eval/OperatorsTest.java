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
import java.util.Map;
import net.mesonlang.java.syntax.TokenKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Operators}. */
@RunWith(JUnit4.class)
public final class OperatorsTest {

  private static Object binary(TokenKind op, Object x, Object y) throws Exception {
    return Operators.binaryOp(op, x, y);
  }

  private static String binaryError(TokenKind op, Object x, Object y) {
    return assertThrows(InterpretationException.class, () -> Operators.binaryOp(op, x, y))
        .getMessage();
  }

  @Test
  public void testPlus() throws Exception {
    assertThat(binary(TokenKind.PLUS, "foo", "123")).isEqualTo("foo123");
    assertThat(binary(TokenKind.PLUS, 2L, 3L)).isEqualTo(5L);
    assertThat(binary(TokenKind.PLUS, ImmutableList.of("a"), ImmutableList.of("b", "c")))
        .isEqualTo(ImmutableList.of("a", "b", "c"));
    // A right operand that is not an array is appended.
    assertThat(binary(TokenKind.PLUS, ImmutableList.of("a"), "b"))
        .isEqualTo(ImmutableList.of("a", "b"));
    assertThat(binary(TokenKind.PLUS, ImmutableList.of(), ImmutableList.of(ImmutableList.of())))
        .isEqualTo(ImmutableList.of(ImmutableList.of()));
  }

  @Test
  public void testDictionaryMergeRightWins() throws Exception {
    Object merged =
        binary(
            TokenKind.PLUS, ImmutableMap.of("a", 1L, "b", 2L), ImmutableMap.of("b", 3L, "c", 4L));
    assertThat((Map<?, ?>) merged).containsExactly("a", 1L, "b", 3L, "c", 4L).inOrder();
  }

  @Test
  public void testIntegerArithmetic() throws Exception {
    assertThat(binary(TokenKind.MINUS, 7L, 10L)).isEqualTo(-3L);
    assertThat(binary(TokenKind.STAR, 6L, 7L)).isEqualTo(42L);
    assertThat(binary(TokenKind.SLASH, 7L, 2L)).isEqualTo(3L);
    assertThat(binary(TokenKind.SLASH, -7L, 2L)).isEqualTo(-4L);
    assertThat(binary(TokenKind.PERCENT, 7L, 3L)).isEqualTo(1L);
    assertThat(binary(TokenKind.PERCENT, -7L, 3L)).isEqualTo(2L);
    assertThat(binaryError(TokenKind.SLASH, 1L, 0L)).isEqualTo("division by zero");
    assertThat(binaryError(TokenKind.PERCENT, 1L, 0L)).isEqualTo("modulo by zero");
    assertThat(binaryError(TokenKind.PLUS, Long.MAX_VALUE, 1L)).isEqualTo("integer overflow");
  }

  @Test
  public void testSlashJoinsPaths() throws Exception {
    assertThat(binary(TokenKind.SLASH, "a", "b")).isEqualTo("a/b");
    assertThat(binary(TokenKind.SLASH, "a/", "b")).isEqualTo("a/b");
    assertThat(binary(TokenKind.SLASH, "a", "/abs")).isEqualTo("/abs");
    assertThat(Operators.joinPaths("", "b")).isEqualTo("b");
  }

  @Test
  public void testComparisons() throws Exception {
    assertThat(binary(TokenKind.EQUALS_EQUALS, "a", "a")).isEqualTo(true);
    assertThat(binary(TokenKind.EQUALS_EQUALS, 1L, "1")).isEqualTo(false);
    assertThat(binary(TokenKind.NOT_EQUALS, ImmutableList.of(1L), ImmutableList.of(2L)))
        .isEqualTo(true);
    assertThat(binary(TokenKind.LESS, 1L, 2L)).isEqualTo(true);
    assertThat(binary(TokenKind.GREATER_EQUALS, "abc", "abd")).isEqualTo(false);
    assertThat(binaryError(TokenKind.LESS, 1L, "2"))
        .isEqualTo("unsupported binary operation: int < str");
  }

  @Test
  public void testMembership() throws Exception {
    assertThat(binary(TokenKind.IN, "b", ImmutableList.of("a", "b"))).isEqualTo(true);
    assertThat(binary(TokenKind.NOT_IN, "c", ImmutableList.of("a", "b"))).isEqualTo(true);
    assertThat(binary(TokenKind.IN, "k", ImmutableMap.of("k", 1L))).isEqualTo(true);
    assertThat(binaryError(TokenKind.IN, 1L, ImmutableMap.of("k", 1L)))
        .isEqualTo("dictionary keys are strings, not int");
    assertThat(binaryError(TokenKind.IN, "a", "abc"))
        .isEqualTo("unsupported binary operation: str in str");
  }

  @Test
  public void testLogicalOperators() throws Exception {
    assertThat(binary(TokenKind.AND, true, false)).isEqualTo(false);
    assertThat(binary(TokenKind.OR, false, true)).isEqualTo(true);
    assertThat(binaryError(TokenKind.AND, true, 1L)).isEqualTo("expected a boolean, got int");
  }

  @Test
  public void testUnsupportedOperands() {
    assertThat(binaryError(TokenKind.PLUS, "a", 1L))
        .isEqualTo("unsupported binary operation: str + int");
    assertThat(binaryError(TokenKind.MINUS, ImmutableList.of(), ImmutableList.of()))
        .isEqualTo("unsupported binary operation: list - list");
  }

  @Test
  public void testUnary() throws Exception {
    assertThat(Operators.unaryOp(TokenKind.NOT, true)).isEqualTo(false);
    assertThat(Operators.unaryOp(TokenKind.MINUS, 5L)).isEqualTo(-5L);
    InterpretationException ex =
        assertThrows(InterpretationException.class, () -> Operators.unaryOp(TokenKind.NOT, "x"));
    assertThat(ex).hasMessageThat().isEqualTo("unsupported unary operation: not str");
  }

  @Test
  public void testIndex() throws Exception {
    ImmutableList<Object> list = ImmutableList.of("a", "b", "c");
    assertThat(Operators.index(list, 0L)).isEqualTo("a");
    assertThat(Operators.index(list, -1L)).isEqualTo("c");
    assertThat(assertThrows(InterpretationException.class, () -> Operators.index(list, 3L)))
        .hasMessageThat()
        .isEqualTo("index 3 out of range for array of length 3");
    assertThat(Operators.index(ImmutableMap.of("k", "v"), "k")).isEqualTo("v");
    assertThat(
            assertThrows(
                InterpretationException.class,
                () -> Operators.index(ImmutableMap.of("k", "v"), "x")))
        .hasMessageThat()
        .isEqualTo("key 'x' is not in the dictionary");
    assertThat(assertThrows(InterpretationException.class, () -> Operators.index(1L, 0L)))
        .hasMessageThat()
        .isEqualTo("int is not indexable");
  }

  @Test
  public void testFormat() throws Exception {
    ImmutableMap<String, Object> vars = ImmutableMap.of("name", "foo", "n", 3L, "b", true);
    assertThat(Operators.format("lib@name@-@n@.@b@", vars::get)).isEqualTo("libfoo-3.true");
    assertThat(Operators.format("no placeholders @", vars::get)).isEqualTo("no placeholders @");
    assertThat(
            assertThrows(
                InterpretationException.class, () -> Operators.format("@missing@", vars::get)))
        .hasMessageThat()
        .isEqualTo("undefined variable 'missing' in format string");
    ImmutableMap<String, Object> lists = ImmutableMap.of("l", ImmutableList.of());
    assertThat(
            assertThrows(
                InterpretationException.class, () -> Operators.format("@l@", lists::get)))
        .hasMessageThat()
        .isEqualTo("cannot convert list to a string");
  }
}
