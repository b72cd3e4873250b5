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
import javax.annotation.Nullable;
import net.mesonlang.java.syntax.CallExpression;

/** An external dependency looked up by a {@code dependency()} call. */
@AutoValue
public abstract class Dependency {

  /** The name of the dependency, or null if it is not statically known. */
  @Nullable
  public abstract String name();

  /** The version constraints, such as {@code >=1.2}. */
  public abstract ImmutableList<String> versionConstraints();

  /**
   * Whether the dependency is required. True if the {@code required} argument is absent, and
   * false unless it is statically {@code true} otherwise.
   */
  public abstract boolean required();

  /** Whether the lookup happens inside a conditional or a loop. */
  public abstract boolean conditional();

  public abstract CallExpression node();

  static Dependency create(
      @Nullable String name,
      ImmutableList<String> versionConstraints,
      boolean required,
      boolean conditional,
      CallExpression node) {
    return new AutoValue_Dependency(name, versionConstraints, required, conditional, node);
  }
}
