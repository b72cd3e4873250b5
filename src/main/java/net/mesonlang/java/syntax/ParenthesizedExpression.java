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

/**
 * Syntax node for a parenthesized expression. Parentheses are kept in the tree so that printers
 * can reproduce them; they have no effect on evaluation.
 */
public final class ParenthesizedExpression extends Expression {

  private final int lparenOffset;
  private final Expression x;
  private final int rparenOffset;

  ParenthesizedExpression(FileLocations locs, int lparenOffset, Expression x, int rparenOffset) {
    super(locs, Kind.PARENTHESIZED);
    this.lparenOffset = lparenOffset;
    this.x = x;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the enclosed expression. */
  public Expression getX() {
    return x;
  }

  @Override
  public int getStartOffset() {
    return lparenOffset;
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
