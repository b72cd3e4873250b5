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

package net.mesonlang.java.syntax;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Syntax node for the arguments of a call, in source order. The node spans the text between the
 * parentheses.
 *
 * <p>Positional arguments must precede keyword arguments. A positional argument that follows a
 * keyword argument is accepted by the parser but recorded as an order error, which consumers
 * report as a semantic error.
 */
public final class ArgumentList extends Node {

  private final int startOffset;
  private final ImmutableList<Argument> arguments;
  private final int endOffset;
  private final boolean orderError;

  ArgumentList(
      FileLocations locs,
      int startOffset,
      ImmutableList<Argument> arguments,
      int endOffset,
      boolean orderError) {
    super(locs);
    this.startOffset = startOffset;
    this.arguments = arguments;
    this.endOffset = endOffset;
    this.orderError = orderError;
  }

  /** Returns all arguments, positional and keyword, in source order. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  /** Returns the values of the positional arguments, in order. */
  public ImmutableList<Expression> getPositionals() {
    ImmutableList.Builder<Expression> result = ImmutableList.builder();
    for (Argument arg : arguments) {
      if (arg instanceof Argument.Positional) {
        result.add(arg.getValue());
      }
    }
    return result.build();
  }

  /**
   * Returns the keyword arguments as a map from name to value, in order of first appearance. If a
   * keyword is repeated, the last value wins.
   */
  public ImmutableMap<String, Expression> getKeywords() {
    Map<String, Expression> result = new LinkedHashMap<>();
    for (Argument arg : arguments) {
      if (arg instanceof Argument.Keyword) {
        result.put(arg.getName(), arg.getValue());
      }
    }
    return ImmutableMap.copyOf(result);
  }

  /** Returns the value of the named keyword argument, or null if it is absent. */
  @Nullable
  public Expression getKeyword(String name) {
    return getKeywords().get(name);
  }

  /** Reports whether a positional argument follows a keyword argument. */
  public boolean hasOrderError() {
    return orderError;
  }

  public boolean isEmpty() {
    return arguments.isEmpty();
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
