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
import static org.junit.Assert.assertThrows;

import net.mesonlang.java.eval.UnknownValue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link DataFlowGraph}. */
@RunWith(JUnit4.class)
public final class DataFlowGraphTest {

  private final DataFlowGraph graph = new DataFlowGraph();

  private static UnknownValue vertex(String name) {
    return new UnknownValue(null, name);
  }

  @Test
  public void testEdges() {
    UnknownValue a = vertex("a");
    UnknownValue b = vertex("b");
    UnknownValue c = vertex("c");
    graph.addVertex(c);
    graph.addEdge(a, b, false);
    graph.addEdge(b, a, true);
    graph.addEdge(a, a, false);

    assertThat(graph.vertices()).containsExactly(c, a, b).inOrder();
    assertThat(graph.contains(vertex("a"))).isFalse();
    assertThat(graph.hasEdge(a, b)).isTrue();
    assertThat(graph.hasEdge(a, a)).isFalse();
    assertThat(graph.isOpaque(b, a)).isTrue();
    assertThat(graph.successors(a)).containsExactly(b);
    assertThat(graph.predecessors(a)).containsExactly(b);
    assertThat(graph.edgeCount()).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> graph.isOpaque(a, c));
  }

  @Test
  public void testRepeatedEdgeIsOpaqueOnlyIfAlwaysOpaque() {
    UnknownValue a = vertex("a");
    UnknownValue b = vertex("b");
    graph.addEdge(a, b, true);
    assertThat(graph.isOpaque(a, b)).isTrue();
    graph.addEdge(a, b, false);
    assertThat(graph.isOpaque(a, b)).isFalse();
    graph.addEdge(a, b, true);
    assertThat(graph.isOpaque(a, b)).isFalse();
    assertThat(graph.edgeCount()).isEqualTo(1);
  }

  @Test
  public void testReachabilityStopsAtOpaqueEdges() {
    UnknownValue a = vertex("a");
    UnknownValue b = vertex("b");
    UnknownValue c = vertex("c");
    UnknownValue d = vertex("d");
    UnknownValue e = vertex("e");
    graph.addEdge(a, b, false);
    graph.addEdge(b, c, false);
    graph.addEdge(a, d, true);
    graph.addEdge(d, e, false);
    graph.addEdge(c, e, false);

    assertThat(graph.reachableFrom(a)).containsExactly(b, c, e);
    assertThat(graph.reachableFrom(d)).containsExactly(e);
    assertThat(graph.reaching(e)).containsExactly(d, c, b, a);
    assertThat(graph.reaching(d)).isEmpty();
    assertThat(graph.reachableFrom(vertex("absent"))).isEmpty();
  }

  @Test
  public void testRejectsOtherVertices() {
    assertThrows(IllegalArgumentException.class, () -> graph.addVertex("a string"));
    assertThrows(IllegalArgumentException.class, () -> graph.addEdge(vertex("a"), 1L, false));
  }
}
