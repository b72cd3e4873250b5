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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.mesonlang.java.analysis.FilesystemFileAccessor;
import net.mesonlang.java.analysis.IntrospectionInterpreter;
import net.mesonlang.java.syntax.ArgumentList;
import net.mesonlang.java.syntax.BuildFile;
import net.mesonlang.java.syntax.Comment;
import net.mesonlang.java.syntax.Formatter;
import net.mesonlang.java.syntax.NodeVisitor;
import net.mesonlang.java.syntax.ParserInput;
import net.mesonlang.java.syntax.SyntaxError;

/**
 * Command-line front end.
 *
 * <pre>
 * mesonlang format [--indent=N] [--max_line_length=N] [--argument_cutoff=N] [--in_place] FILE...
 * mesonlang check FILE...
 * mesonlang introspect [--subproject_dir=DIR] [--no_subprojects] [--build_file=NAME] DIR
 * </pre>
 *
 * Exits with status 0 on success, 1 if any input has errors, and 2 for a malformed command line.
 */
public final class Main {

  private static final String USAGE =
      "usage: mesonlang format [--indent=N] [--max_line_length=N] [--argument_cutoff=N]"
          + " [--in_place] FILE...\n"
          + "       mesonlang check FILE...\n"
          + "       mesonlang introspect [--subproject_dir=DIR] [--no_subprojects]"
          + " [--build_file=NAME] DIR";

  private final PrintStream out;
  private final PrintStream err;

  @VisibleForTesting
  Main(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new Main(System.out, System.err).run(args));
  }

  @VisibleForTesting
  int run(String... args) {
    if (args.length == 0) {
      err.println(USAGE);
      return 2;
    }
    Options opts;
    try {
      opts = Options.parse(Arrays.asList(args).subList(1, args.length));
    } catch (Options.UsageException ex) {
      err.println("error: " + ex.getMessage());
      err.println(USAGE);
      return 2;
    }
    switch (args[0]) {
      case "format":
        return forEachFile(opts, this::format);
      case "check":
        return forEachFile(opts, this::check);
      case "introspect":
        if (opts.positional.size() != 1) {
          err.println(USAGE);
          return 2;
        }
        return introspect(opts, Paths.get(opts.positional.get(0)));
      default:
        err.println("error: unknown command: " + args[0]);
        err.println(USAGE);
        return 2;
    }
  }

  private interface FileCommand {
    boolean apply(Options opts, Path file, BuildFile parsed) throws IOException;
  }

  private int forEachFile(Options opts, FileCommand command) {
    if (opts.positional.isEmpty()) {
      err.println(USAGE);
      return 2;
    }
    int status = 0;
    for (String name : opts.positional) {
      Path path = Paths.get(name);
      try {
        BuildFile file = BuildFile.parse(ParserInput.fromUtf8(Files.readAllBytes(path), name));
        if (!file.ok()) {
          for (SyntaxError error : file.errors()) {
            err.println(error.format());
          }
          status = 1;
        } else if (!command.apply(opts, path, file)) {
          status = 1;
        }
      } catch (IOException ex) {
        err.println("error: " + name + ": " + ex.getMessage());
        status = 1;
      }
    }
    return status;
  }

  private boolean format(Options opts, Path path, BuildFile file) throws IOException {
    Formatter.Result result = Formatter.format(file, opts.printer);
    for (Comment comment : result.unattachedComments()) {
      err.println(
          file.getFile() + ":" + comment.getLine() + ":" + comment.getColumn()
              + ": warning: comment could not be placed: " + comment.getText());
    }
    if (!opts.inPlace) {
      out.print(result.text());
    } else if (!result.text().equals(new String(Files.readAllBytes(path), UTF_8))) {
      Files.write(path, result.text().getBytes(UTF_8));
    }
    return true;
  }

  /** Reports argument lists that give a positional argument after a keyword argument. */
  private boolean check(Options opts, Path path, BuildFile file) {
    List<ArgumentList> misordered = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(ArgumentList node) {
        if (node.hasOrderError()) {
          misordered.add(node);
        }
        super.visit(node);
      }
    }.visit(file.getRoot());
    for (ArgumentList args : misordered) {
      err.println(
          args.getStartLocation()
              + ": error: All keyword arguments must be after positional arguments.");
    }
    return misordered.isEmpty();
  }

  private int introspect(Options opts, Path dir) {
    IntrospectionInterpreter interp =
        new IntrospectionInterpreter(
            new FilesystemFileAccessor(dir), opts.interpreter, ImmutableList.of());
    try {
      interp.analyze();
    } catch (SyntaxError.Exception ex) {
      for (SyntaxError error : ex.errors()) {
        err.println(error.format());
      }
      return 1;
    } catch (IOException ex) {
      err.println("error: " + ex.getMessage());
      return 1;
    }
    out.println(IntrospectionJson.toJson(interp));
    return 0;
  }
}
