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

/** Syntax node for the literals {@code true} and {@code false}. */
public final class BooleanLiteral extends Expression {

  private final int offset;
  private final boolean value;

  BooleanLiteral(FileLocations locs, int offset, boolean value) {
    super(locs, Kind.BOOLEAN_LITERAL);
    this.offset = offset;
    this.value = value;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public int getStartOffset() {
    return offset;
  }

  @Override
  public int getEndOffset() {
    return offset + (value ? 4 : 5);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
