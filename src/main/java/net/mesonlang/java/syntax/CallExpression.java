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

/** Syntax node for a function call expression, {@code name(args)}. */
public final class CallExpression extends Expression {

  private final Identifier function;
  private final int lparenOffset;
  private final ArgumentList arguments;
  private final int rparenOffset;

  CallExpression(
      FileLocations locs,
      Identifier function,
      int lparenOffset,
      ArgumentList arguments,
      int rparenOffset) {
    super(locs, Kind.CALL);
    this.function = function;
    this.lparenOffset = lparenOffset;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the callee. Only plain identifiers may be called. */
  public Identifier getFunction() {
    return function;
  }

  /** Returns the name of the called function. */
  public String getFunctionName() {
    return function.getName();
  }

  public ArgumentList getArguments() {
    return arguments;
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  public Location getLparenLocation() {
    return locs.getLocation(lparenOffset);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
