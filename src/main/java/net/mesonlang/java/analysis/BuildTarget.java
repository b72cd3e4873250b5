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
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;
import net.mesonlang.java.syntax.CallExpression;

/** A build target declared by a call such as {@code executable()} or {@code library()}. */
@AutoValue
public abstract class BuildTarget {

  /** The name of the target, or null if it is not statically known. */
  @Nullable
  public abstract String name();

  /**
   * The kind of target: the function that declares it, or for {@code build_target()} the value of
   * its {@code target_type} argument when known.
   */
  public abstract String kind();

  /** The directory of the declaring build file, relative to the project root. */
  public abstract String subdir();

  /** The source files known statically, in order. */
  public abstract ImmutableList<String> sources();

  /** The resolved keyword arguments of the call. Values may be unknown. */
  public abstract ImmutableMap<String, Object> keywordArguments();

  /** Whether the target is declared inside a conditional or a loop. */
  public abstract boolean conditional();

  /** The declaring call. */
  public abstract CallExpression node();

  static BuildTarget create(
      @Nullable String name,
      String kind,
      String subdir,
      ImmutableList<String> sources,
      ImmutableMap<String, Object> keywordArguments,
      boolean conditional,
      CallExpression node) {
    return new AutoValue_BuildTarget(
        name, kind, subdir, sources, keywordArguments, conditional, node);
  }
}
