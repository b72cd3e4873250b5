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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syntax node for a format string such as {@code f'lib@name@.so'}. Each {@code @id@} occurrence is
 * replaced by the value of the named variable when the string is evaluated.
 */
public final class FormatStringLiteral extends Expression {

  private static final Pattern PLACEHOLDER = Pattern.compile("@([_a-zA-Z][_0-9a-zA-Z]*)@");

  private final int startOffset;
  private final String value;
  private final int endOffset;
  private final boolean multiline;

  FormatStringLiteral(
      FileLocations locs, int startOffset, String value, int endOffset, boolean multiline) {
    super(locs, Kind.FORMAT_STRING_LITERAL);
    this.startOffset = startOffset;
    this.value = value;
    this.endOffset = endOffset;
    this.multiline = multiline;
  }

  /** Returns the template text, with placeholders unexpanded. */
  public String getValue() {
    return value;
  }

  public boolean isMultiline() {
    return multiline;
  }

  /** Returns the names of the variables referenced by the template, in order of appearance. */
  public ImmutableList<String> getReferencedNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    Matcher m = PLACEHOLDER.matcher(value);
    while (m.find()) {
      names.add(m.group(1));
    }
    return names.build();
  }

  /** Returns the pattern matching one {@code @id@} placeholder; group 1 is the name. */
  public static Pattern placeholderPattern() {
    return PLACEHOLDER;
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
