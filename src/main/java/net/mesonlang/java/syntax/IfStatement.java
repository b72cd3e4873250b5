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
import javax.annotation.Nullable;

/**
 * Syntax node for an if statement: one {@code if} arm, any number of {@code elif} arms, an
 * optional {@code else} arm, and the closing {@code endif}.
 */
public final class IfStatement extends Statement {

  /** An {@code if} or {@code elif} arm: a condition and the block it guards. */
  public static final class Conditional extends Node {

    private final TokenKind token; // IF | ELIF
    private final int tokenOffset;
    private final Expression condition;
    private final CodeBlock body;

    Conditional(
        FileLocations locs,
        TokenKind token,
        int tokenOffset,
        Expression condition,
        CodeBlock body) {
      super(locs);
      this.token = token;
      this.tokenOffset = tokenOffset;
      this.condition = condition;
      this.body = body;
    }

    /** Returns {@link TokenKind#IF} or {@link TokenKind#ELIF}. */
    public TokenKind getToken() {
      return token;
    }

    public Expression getCondition() {
      return condition;
    }

    public CodeBlock getBody() {
      return body;
    }

    @Override
    public int getStartOffset() {
      return tokenOffset;
    }

    @Override
    public int getEndOffset() {
      return body.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** The {@code else} arm. */
  public static final class Else extends Node {

    private final int elseOffset;
    private final CodeBlock body;

    Else(FileLocations locs, int elseOffset, CodeBlock body) {
      super(locs);
      this.elseOffset = elseOffset;
      this.body = body;
    }

    public CodeBlock getBody() {
      return body;
    }

    @Override
    public int getStartOffset() {
      return elseOffset;
    }

    @Override
    public int getEndOffset() {
      return body.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final ImmutableList<Conditional> arms;
  @Nullable private final Else elseArm;
  private final int endifOffset;

  IfStatement(
      FileLocations locs,
      ImmutableList<Conditional> arms,
      @Nullable Else elseArm,
      int endifOffset) {
    super(locs, Kind.IF);
    Preconditions.checkArgument(!arms.isEmpty(), "if statement without arms");
    this.arms = arms;
    this.elseArm = elseArm;
    this.endifOffset = endifOffset;
  }

  /** Returns the {@code if} arm followed by the {@code elif} arms. Never empty. */
  public ImmutableList<Conditional> getArms() {
    return arms;
  }

  /** Returns the {@code else} arm, or null if there is none. */
  @Nullable
  public Else getElse() {
    return elseArm;
  }

  /** Returns the location of the {@code endif} keyword. */
  public Location getEndifLocation() {
    return locs.getLocation(endifOffset);
  }

  @Override
  public int getStartOffset() {
    return arms.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return endifOffset + TokenKind.ENDIF.toString().length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
