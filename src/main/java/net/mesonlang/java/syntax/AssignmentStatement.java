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

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Syntax node for an assignment statement ({@code name = rhs}) or append assignment statement
 * ({@code name += rhs}). The target of an assignment is always a plain identifier.
 */
public final class AssignmentStatement extends Statement {

  private final Identifier lhs;
  @Nullable private final TokenKind op; // null | PLUS
  private final int opOffset;
  private final Expression rhs;

  AssignmentStatement(
      FileLocations locs, Identifier lhs, @Nullable TokenKind op, int opOffset, Expression rhs) {
    super(locs, Kind.ASSIGNMENT);
    Preconditions.checkArgument(op == null || op == TokenKind.PLUS, "invalid operator %s", op);
    this.lhs = lhs;
    this.op = op;
    this.opOffset = opOffset;
    this.rhs = rhs;
  }

  /** Returns the assigned variable. */
  public Identifier getLHS() {
    return lhs;
  }

  /** Returns {@link TokenKind#PLUS} for {@code +=}, or null for an ordinary assignment. */
  @Nullable
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the location of the assignment operator. */
  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  /** Reports whether this is an append assignment ({@code +=}). */
  public boolean isAugmented() {
    return op != null;
  }

  /** Returns the RHS of the assignment. */
  public Expression getRHS() {
    return rhs;
  }

  @Override
  public int getStartOffset() {
    return lhs.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rhs.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
