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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import net.mesonlang.java.eval.UnknownValue;
import net.mesonlang.java.syntax.Node;

/**
 * A directed graph of the ways values may flow between the nodes of interpreted build files.
 *
 * <p>Vertices are syntax nodes or {@link UnknownValue}s (compared by identity). An edge from
 * {@code a} to {@code b} means that a value computed at {@code a} may flow into {@code b}. Edges
 * are added in traversal order only, from values already computed to the node being computed, so
 * the graph is acyclic. Edges that pass into or out of a call the interpreter cannot see through
 * are marked opaque; reachability queries do not follow them.
 *
 * <p>Where the same pair of vertices is connected more than once the flow is recorded once, and is
 * opaque only if every recorded flow was.
 */
public final class DataFlowGraph {

  private final MutableValueGraph<Object, Boolean> graph =
      ValueGraphBuilder.directed()
          .allowsSelfLoops(false)
          .nodeOrder(ElementOrder.insertion())
          .build();

  private static void checkVertex(Object v) {
    Preconditions.checkArgument(
        v instanceof Node || v instanceof UnknownValue, "not a data-flow vertex: %s", v);
  }

  /** Adds a vertex with no edges, if it is not already present. */
  void addVertex(Object v) {
    checkVertex(v);
    graph.addNode(v);
  }

  /** Records that a value may flow from {@code from} into {@code to}. Self-flows are ignored. */
  void addEdge(Object from, Object to, boolean opaque) {
    checkVertex(from);
    checkVertex(to);
    if (from == to) {
      return;
    }
    Boolean previous = graph.edgeValueOrDefault(from, to, null);
    graph.putEdgeValue(from, to, previous == null ? opaque : previous && opaque);
  }

  /** Returns every vertex, in the order it was added. */
  public Set<Object> vertices() {
    return graph.nodes();
  }

  public boolean contains(Object v) {
    return graph.nodes().contains(v);
  }

  public Set<Object> successors(Object v) {
    return graph.successors(v);
  }

  public Set<Object> predecessors(Object v) {
    return graph.predecessors(v);
  }

  /** Reports whether there is an edge from {@code from} to {@code to}. */
  public boolean hasEdge(Object from, Object to) {
    return graph.hasEdgeConnecting(from, to);
  }

  /**
   * Reports whether the edge from {@code from} to {@code to} is opaque.
   *
   * @throws IllegalArgumentException if there is no such edge
   */
  public boolean isOpaque(Object from, Object to) {
    Boolean opaque = graph.edgeValueOrDefault(from, to, null);
    Preconditions.checkArgument(opaque != null, "no edge from %s to %s", from, to);
    return opaque;
  }

  public int edgeCount() {
    return graph.edges().size();
  }

  /**
   * Returns the vertices a value computed at {@code start} may flow into, following transparent
   * edges only. The result excludes {@code start} itself.
   */
  public ImmutableSet<Object> reachableFrom(Object start) {
    return reach(start, graph::successors, true);
  }

  /**
   * Returns the vertices whose values may flow into {@code start}, following transparent edges
   * only. The result excludes {@code start} itself.
   */
  public ImmutableSet<Object> reaching(Object start) {
    return reach(start, graph::predecessors, false);
  }

  private ImmutableSet<Object> reach(
      Object start, Function<Object, Set<Object>> next, boolean forward) {
    if (!graph.nodes().contains(start)) {
      return ImmutableSet.of();
    }
    Set<Object> seen = new LinkedHashSet<>();
    Deque<Object> work = new ArrayDeque<>();
    work.add(start);
    while (!work.isEmpty()) {
      Object v = work.remove();
      for (Object w : next.apply(v)) {
        boolean opaque = forward ? graph.edgeValue(v, w).get() : graph.edgeValue(w, v).get();
        if (!opaque && w != start && seen.add(w)) {
          work.add(w);
        }
      }
    }
    return ImmutableSet.copyOf(seen);
  }
}
