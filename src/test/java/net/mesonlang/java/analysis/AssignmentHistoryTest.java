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

package net.mesonlang.java.analysis;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.mesonlang.java.analysis.AssignmentHistory.Binding;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link AssignmentHistory}. */
@RunWith(JUnit4.class)
public final class AssignmentHistoryTest {

  private final AssignmentHistory history = new AssignmentHistory();

  @Test
  public void testLookupSeesBindingsOnPrefixPaths() {
    history.bind("x", ImmutableList.of(), "top", 1L);
    history.bind("x", ImmutableList.of(0), "arm0", 2L);
    history.bind("x", ImmutableList.of(1), "arm1", 3L);

    assertThat(history.lookup("x", ImmutableList.of()).value()).isEqualTo(1L);
    assertThat(history.lookup("x", ImmutableList.of(0)).value()).isEqualTo(2L);
    assertThat(history.lookup("x", ImmutableList.of(0, 5)).value()).isEqualTo(2L);
    assertThat(history.lookup("x", ImmutableList.of(1)).source()).isEqualTo("arm1");
    assertThat(history.lookup("x", ImmutableList.of(2)).value()).isEqualTo(1L);
    assertThat(history.lookup("y", ImmutableList.of())).isNull();
  }

  @Test
  public void testMostRecentBindingWins() {
    history.bind("x", ImmutableList.of(), "first", 1L);
    history.bind("x", ImmutableList.of(), "second", 2L);
    Binding b = history.lookup("x", ImmutableList.of());
    assertThat(b.source()).isEqualTo("second");
    assertThat(b.branchPath()).isEmpty();
  }

  @Test
  public void testHistoryKeepsEveryBinding() {
    history.bind("b", ImmutableList.of(), "s1", "v1");
    history.bind("a", ImmutableList.of(3), "s2", "v2");
    history.bind("b", ImmutableList.of(3, 4), "s3", "v3");

    assertThat(history.names()).containsExactly("b", "a").inOrder();
    assertThat(history.getHistory("b")).hasSize(2);
    assertThat(history.getHistory("b").get(1).branchPath()).containsExactly(3, 4).inOrder();
    assertThat(history.getHistory("c")).isEmpty();
    // Visible from any path that extends its own.
    assertThat(history.getHistory("a").get(0))
        .isEqualTo(history.lookup("a", ImmutableList.of(3, 7)));
  }
}
