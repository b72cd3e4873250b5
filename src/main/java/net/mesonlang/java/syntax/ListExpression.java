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

/** Syntax node for an array literal, {@code [a, b, c]}. */
public final class ListExpression extends Expression {

  private final int lbracketOffset;
  private final ImmutableList<Expression> elements;
  private final int rbracketOffset;

  ListExpression(
      FileLocations locs,
      int lbracketOffset,
      ImmutableList<Expression> elements,
      int rbracketOffset) {
    super(locs, Kind.LIST_EXPR);
    this.lbracketOffset = lbracketOffset;
    this.elements = elements;
    this.rbracketOffset = rbracketOffset;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  @Override
  public int getStartOffset() {
    return lbracketOffset;
  }

  @Override
  public int getEndOffset() {
    return rbracketOffset + 1;
  }

  /** Returns the offset of the closing bracket. */
  public int getRbracketOffset() {
    return rbracketOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
