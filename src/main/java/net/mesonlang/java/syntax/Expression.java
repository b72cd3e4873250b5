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
 * Base class for all expression nodes in the AST.
 *
 * <p>Assignments are statements, not expressions, and their target is always an {@link
 * Identifier}.
 */
public abstract class Expression extends Node {

  /**
   * Kind of the expression. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    BINARY_OPERATOR,
    BOOLEAN_LITERAL,
    CALL,
    CONDITIONAL,
    DICT_EXPR,
    FORMAT_STRING_LITERAL,
    IDENTIFIER,
    INDEX,
    INT_LITERAL,
    LIST_EXPR,
    METHOD_CALL,
    PARENTHESIZED,
    STRING_LITERAL,
    UNARY_OPERATOR,
  }

  // Materialize kind as a field so its accessor can be non-virtual.
  private final Kind kind;

  Expression(FileLocations locs, Kind kind) {
    super(locs);
    this.kind = kind;
  }

  /** Kind of the expression. */
  public final Kind kind() {
    return kind;
  }

  /** Parses an expression. */
  public static Expression parse(ParserInput input) throws SyntaxError.Exception {
    return Parser.parseExpression(input);
  }
}
