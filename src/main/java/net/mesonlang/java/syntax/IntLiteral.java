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

/** Syntax node for an integer literal. */
public final class IntLiteral extends Expression {

  private final String raw;
  private final int tokenOffset;
  private final long value;

  IntLiteral(FileLocations locs, String raw, int tokenOffset, long value) {
    super(locs, Kind.INT_LITERAL);
    this.raw = raw;
    this.tokenOffset = tokenOffset;
    this.value = value;
  }

  /** Returns the value denoted by this literal. */
  public long getValue() {
    return value;
  }

  /** Returns the raw source text of the literal, for example {@code 0x1F}. */
  public String getRaw() {
    return raw;
  }

  @Override
  public int getStartOffset() {
    return tokenOffset;
  }

  @Override
  public int getEndOffset() {
    return tokenOffset + raw.length();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /**
   * Returns the value denoted by a decimal, hexadecimal ({@code 0x}), octal ({@code 0o}) or binary
   * ({@code 0b}) integer literal.
   *
   * @throws NumberFormatException if the literal is malformed or out of range
   */
  static long scan(String str) {
    String s = str;
    int radix = 10;
    if (s.length() > 1 && s.charAt(0) == '0') {
      char c = s.charAt(1);
      if (c == 'x' || c == 'X') {
        radix = 16;
        s = s.substring(2);
      } else if (c == 'o' || c == 'O') {
        radix = 8;
        s = s.substring(2);
      } else if (c == 'b' || c == 'B') {
        radix = 2;
        s = s.substring(2);
      }
    }
    try {
      return Long.parseLong(s, radix);
    } catch (NumberFormatException unused) {
      throw new NumberFormatException("invalid integer literal: " + str);
    }
  }
}
