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
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a loop, {@code foreach vars : iterable ... endforeach}. A loop over an array
 * binds one variable; a loop over a dictionary binds two, the key and the value.
 */
public final class ForeachStatement extends Statement {

  private final int foreachOffset;
  private final ImmutableList<Identifier> vars;
  private final Expression iterable;
  private final CodeBlock body;
  private final int endforeachOffset;

  ForeachStatement(
      FileLocations locs,
      int foreachOffset,
      ImmutableList<Identifier> vars,
      Expression iterable,
      CodeBlock body,
      int endforeachOffset) {
    super(locs, Kind.FOREACH);
    Preconditions.checkArgument(vars.size() == 1 || vars.size() == 2, "bad loop variables");
    this.foreachOffset = foreachOffset;
    this.vars = vars;
    this.iterable = Preconditions.checkNotNull(iterable);
    this.body = body;
    this.endforeachOffset = endforeachOffset;
  }

  /** Returns the variables assigned by each iteration. */
  public ImmutableList<Identifier> getVars() {
    return vars;
  }

  /** Returns the iterated value. */
  public Expression getIterable() {
    return iterable;
  }

  public CodeBlock getBody() {
    return body;
  }

  /** Returns the location of the {@code endforeach} keyword. */
  public Location getEndforeachLocation() {
    return locs.getLocation(endforeachOffset);
  }

  @Override
  public int getStartOffset() {
    return foreachOffset;
  }

  @Override
  public int getEndOffset() {
    return endforeachOffset + TokenKind.ENDFOREACH.toString().length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
