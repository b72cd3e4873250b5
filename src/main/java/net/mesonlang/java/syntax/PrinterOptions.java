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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * PrinterOptions controls the layout chosen by {@link NodePrinter} and {@link Formatter}. Layout
 * decisions depend only on these options and the syntax tree, so printing is deterministic and
 * printing the output again yields the same text.
 */
@AutoValue
public abstract class PrinterOptions {

  /** The default layout: two-space indentation, 80 columns, at most five arguments per line. */
  public static final PrinterOptions DEFAULT = builder().build();

  /** The number of spaces per indentation level. */
  public abstract int indent();

  /**
   * The preferred maximum line length. An argument list, array or dictionary that would extend
   * past this column is broken, one element per line.
   */
  public abstract int maxLineLength();

  /**
   * The largest number of elements an argument list, array or dictionary may have and still be
   * printed on one line.
   */
  public abstract int argumentCutoff();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_PrinterOptions.Builder().indent(2).maxLineLength(80).argumentCutoff(5);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link PrinterOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder indent(int value);

    public abstract Builder maxLineLength(int value);

    public abstract Builder argumentCutoff(int value);

    abstract PrinterOptions autoBuild();

    public PrinterOptions build() {
      PrinterOptions options = autoBuild();
      Preconditions.checkArgument(options.indent() >= 0, "negative indent");
      Preconditions.checkArgument(options.maxLineLength() > 0, "line length must be positive");
      Preconditions.checkArgument(options.argumentCutoff() >= 0, "negative argument cutoff");
      return options;
    }
  }
}
