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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ValuesTest {

  private final UnknownValue unknown = new UnknownValue(null, "test");

  @Test
  public void testFlatten() {
    assertThat(Values.flatten("a")).containsExactly("a");
    ImmutableList<Object> nested =
        ImmutableList.of("a", ImmutableList.of(), ImmutableList.of("b", ImmutableList.of(1L)));
    assertThat(Values.flatten(nested))
        .containsExactly("a", "b", 1L)
        .inOrder();
  }

  @Test
  public void testContainsUnknown() {
    assertThat(Values.containsUnknown(unknown)).isTrue();
    assertThat(Values.containsUnknown(ImmutableList.of("a", ImmutableList.of(unknown)))).isTrue();
    assertThat(Values.containsUnknown(ImmutableMap.of("k", unknown))).isTrue();
    assertThat(Values.containsUnknown(ImmutableMap.of("k", ImmutableList.of("v")))).isFalse();
    assertThat(Values.containsUnknown("x")).isFalse();
  }

  @Test
  public void testTypes() {
    assertThat(ValueType.of(1L)).isEqualTo(ValueType.INT);
    assertThat(ValueType.typeName(ImmutableMap.of())).isEqualTo("dict");
    assertThat(ValueType.of(unknown)).isEqualTo(ValueType.UNKNOWN);
    assertThat(UnknownValue.isUnknown(unknown)).isTrue();
    // Unknown values are equal only to themselves.
    assertThat(unknown).isNotEqualTo(new UnknownValue(null, "test"));
  }
}
