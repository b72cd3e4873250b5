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

/** Syntax node for the ternary operator, {@code cond ? a : b}. */
public final class ConditionalExpression extends Expression {

  private final Expression condition;
  private final Expression thenCase;
  private final Expression elseCase;

  ConditionalExpression(
      FileLocations locs, Expression condition, Expression thenCase, Expression elseCase) {
    super(locs, Kind.CONDITIONAL);
    this.condition = condition;
    this.thenCase = thenCase;
    this.elseCase = elseCase;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getThenCase() {
    return thenCase;
  }

  public Expression getElseCase() {
    return elseCase;
  }

  @Override
  public int getStartOffset() {
    return condition.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return elseCase.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
