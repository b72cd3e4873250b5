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

import com.google.common.collect.ImmutableSet;

/**
 * Syntax node for a binary operator expression: {@code or}, {@code and}, a comparison, membership
 * or one of the arithmetic operators {@code + - * / %}.
 */
public final class BinaryOperatorExpression extends Expression {

  /** The set of binary operators. */
  public static final ImmutableSet<TokenKind> OPERATORS =
      ImmutableSet.of(
          TokenKind.AND,
          TokenKind.EQUALS_EQUALS,
          TokenKind.GREATER,
          TokenKind.GREATER_EQUALS,
          TokenKind.IN,
          TokenKind.LESS,
          TokenKind.LESS_EQUALS,
          TokenKind.MINUS,
          TokenKind.NOT_EQUALS,
          TokenKind.NOT_IN,
          TokenKind.OR,
          TokenKind.PERCENT,
          TokenKind.PLUS,
          TokenKind.SLASH,
          TokenKind.STAR);

  /** The comparison and membership operators. */
  public static final ImmutableSet<TokenKind> COMPARISONS =
      ImmutableSet.of(
          TokenKind.EQUALS_EQUALS,
          TokenKind.NOT_EQUALS,
          TokenKind.LESS,
          TokenKind.LESS_EQUALS,
          TokenKind.GREATER,
          TokenKind.GREATER_EQUALS,
          TokenKind.IN,
          TokenKind.NOT_IN);

  private final Expression x;
  private final TokenKind op;
  private final int opOffset;
  private final Expression y;

  BinaryOperatorExpression(
      FileLocations locs, Expression x, TokenKind op, int opOffset, Expression y) {
    super(locs, Kind.BINARY_OPERATOR);
    this.x = x;
    this.op = op;
    this.opOffset = opOffset;
    this.y = y;
  }

  /** Returns the left operand. */
  public Expression getX() {
    return x;
  }

  /** Returns the operator kind. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the location of the operator token. */
  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  /** Returns the right operand. */
  public Expression getY() {
    return y;
  }

  @Override
  public int getStartOffset() {
    return x.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return y.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
