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

package net.mesonlang.java.cli;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.mesonlang.java.analysis.InterpreterOptions;
import net.mesonlang.java.syntax.PrinterOptions;

/** Command-line options, given as {@code --name=value}, followed by positional arguments. */
final class Options {

  /** Thrown for a malformed command line. */
  static final class UsageException extends Exception {
    UsageException(String message) {
      super(message);
    }
  }

  PrinterOptions printer = PrinterOptions.DEFAULT;
  InterpreterOptions interpreter = InterpreterOptions.DEFAULT;
  boolean inPlace;
  ImmutableList<String> positional = ImmutableList.of();

  static Options parse(List<String> args) throws UsageException {
    Options opts = new Options();
    PrinterOptions.Builder printer = PrinterOptions.builder();
    InterpreterOptions.Builder interpreter = InterpreterOptions.builder();
    List<String> positional = new ArrayList<>();
    boolean flags = true;
    for (String arg : args) {
      if (!flags || !arg.startsWith("--")) {
        positional.add(arg);
      } else if (arg.equals("--")) {
        flags = false;
      } else if (arg.equals("--in_place")) {
        opts.inPlace = true;
      } else if (arg.equals("--no_subprojects")) {
        interpreter.scanSubprojects(false);
      } else if (arg.startsWith("--indent=")) {
        printer.indent(intValue(arg));
      } else if (arg.startsWith("--max_line_length=")) {
        printer.maxLineLength(intValue(arg));
      } else if (arg.startsWith("--argument_cutoff=")) {
        printer.argumentCutoff(intValue(arg));
      } else if (arg.startsWith("--subproject_dir=")) {
        interpreter.subprojectDir(value(arg));
      } else if (arg.startsWith("--build_file=")) {
        interpreter.buildFileName(value(arg));
      } else {
        throw new UsageException("unknown flag: " + arg);
      }
    }
    try {
      opts.printer = printer.build();
      opts.interpreter = interpreter.build();
    } catch (IllegalArgumentException ex) {
      throw new UsageException(ex.getMessage());
    }
    opts.positional = ImmutableList.copyOf(positional);
    return opts;
  }

  private static String value(String arg) {
    return arg.substring(arg.indexOf('=') + 1);
  }

  private static int intValue(String arg) throws UsageException {
    try {
      return Integer.parseInt(value(arg));
    } catch (NumberFormatException ex) {
      throw new UsageException("flag " + arg.substring(0, arg.indexOf('=')) + " needs an integer");
    }
  }
}
