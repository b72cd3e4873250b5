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

/** Syntax node for a method call, {@code object.name(args)}. */
public final class MethodCallExpression extends Expression {

  private final Expression object;
  private final int dotOffset;
  private final Identifier method;
  private final ArgumentList arguments;
  private final int rparenOffset;

  MethodCallExpression(
      FileLocations locs,
      Expression object,
      int dotOffset,
      Identifier method,
      ArgumentList arguments,
      int rparenOffset) {
    super(locs, Kind.METHOD_CALL);
    this.object = object;
    this.dotOffset = dotOffset;
    this.method = method;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the receiver of the call. */
  public Expression getObject() {
    return object;
  }

  public Identifier getMethod() {
    return method;
  }

  public String getMethodName() {
    return method.getName();
  }

  public ArgumentList getArguments() {
    return arguments;
  }

  public Location getDotLocation() {
    return locs.getLocation(dotOffset);
  }

  @Override
  public int getStartOffset() {
    return object.getStartOffset();
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
