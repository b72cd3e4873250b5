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

/**
 * Syntax node for a sequence of statements: the top level of a file, or the body of an {@code if}
 * arm, an {@code else} arm or a {@code foreach} loop. The span of a body runs from the end of its
 * header to the start of the keyword that closes it.
 */
public final class CodeBlock extends Node {

  private final int startOffset;
  private final ImmutableList<Statement> statements;
  private final int endOffset;

  CodeBlock(
      FileLocations locs, int startOffset, ImmutableList<Statement> statements, int endOffset) {
    super(locs);
    this.startOffset = startOffset;
    this.statements = statements;
    this.endOffset = endOffset;
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  public boolean isEmpty() {
    return statements.isEmpty();
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
