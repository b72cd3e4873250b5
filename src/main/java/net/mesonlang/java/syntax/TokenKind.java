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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AND("and"),
  BREAK("break"),
  COLON(":"),
  COMMA(","),
  CONTINUE("continue"),
  DOT("."),
  ELIF("elif"),
  ELSE("else"),
  ENDFOREACH("endforeach"),
  ENDIF("endif"),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  FALSE("false"),
  FOREACH("foreach"),
  FSTRING("format string"),
  GREATER(">"),
  GREATER_EQUALS(">="),
  IDENTIFIER("identifier"),
  IF("if"),
  ILLEGAL("illegal character"),
  IN("in"),
  INT("integer"),
  LBRACE("{"),
  LBRACKET("["),
  LESS("<"),
  LESS_EQUALS("<="),
  LPAREN("("),
  MINUS("-"),
  NEWLINE("newline"),
  NOT("not"),
  NOT_EQUALS("!="),
  NOT_IN("not in"),
  OR("or"),
  PERCENT("%"),
  PLUS("+"),
  PLUS_EQUALS("+="),
  QUESTION("?"),
  RBRACE("}"),
  RBRACKET("]"),
  RPAREN(")"),
  SLASH("/"),
  STAR("*"),
  STRING("string"),
  TRUE("true");

  private final String name;

  TokenKind(String name) {
    this.name = name;
  }

  /** Reports whether this kind of token is a reserved word. */
  public boolean isKeyword() {
    return Lexer.isKeyword(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
