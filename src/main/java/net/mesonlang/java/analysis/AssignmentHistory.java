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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The bindings made to each variable during interpretation, in the order they were made.
 *
 * <p>Each binding records the branch path under which it was made: the sequence of conditional
 * arms and loop bodies enclosing the assignment, each identified by a number unique within the
 * interpretation. A binding is visible from an active path if its own path is a prefix of it, and
 * a lookup yields the most recent visible binding. Interpreting a conditional or a loop ends by
 * adding a binding on the enclosing path for every variable the construct assigned, so bindings
 * on a finished arm's path are never seen again.
 */
public final class AssignmentHistory {

  /** A single binding of a variable. */
  @AutoValue
  public abstract static class Binding {

    /** The branch path under which the binding was made. */
    public abstract ImmutableList<Integer> branchPath();

    /**
     * The data-flow vertex that defines the value: the assignment statement, or an {@link
     * net.mesonlang.java.eval.UnknownValue} standing for a join of several definitions.
     */
    public abstract Object source();

    /** The value bound, which may be unknown. */
    public abstract Object value();

    static Binding create(ImmutableList<Integer> branchPath, Object source, Object value) {
      return new AutoValue_AssignmentHistory_Binding(branchPath, source, value);
    }
  }

  private final Map<String, List<Binding>> bindings = new LinkedHashMap<>();

  Binding bind(String name, List<Integer> branchPath, Object source, Object value) {
    Binding binding = Binding.create(ImmutableList.copyOf(branchPath), source, value);
    bindings.computeIfAbsent(name, k -> new ArrayList<>()).add(binding);
    return binding;
  }

  /** Returns the binding of {@code name} visible from {@code activePath}, or null if none. */
  @Nullable
  public Binding lookup(String name, List<Integer> activePath) {
    List<Binding> list = bindings.get(name);
    if (list == null) {
      return null;
    }
    for (int i = list.size() - 1; i >= 0; i--) {
      Binding b = list.get(i);
      if (isPrefix(b.branchPath(), activePath)) {
        return b;
      }
    }
    return null;
  }

  private static boolean isPrefix(List<Integer> prefix, List<Integer> path) {
    return prefix.size() <= path.size() && path.subList(0, prefix.size()).equals(prefix);
  }

  /** Returns every binding ever made to {@code name}, oldest first. */
  public ImmutableList<Binding> getHistory(String name) {
    List<Binding> list = bindings.get(name);
    return list == null ? ImmutableList.of() : ImmutableList.copyOf(list);
  }

  /** Returns the names of all variables bound so far, in order of first binding. */
  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(bindings.keySet());
  }
}
