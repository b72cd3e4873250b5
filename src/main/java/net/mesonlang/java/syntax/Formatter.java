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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A printer that emits a parsed build file in canonical layout and puts the original comments
 * back.
 *
 * <p>Comments are not part of the tree, so each one is matched against the statements by its
 * position in the original source:
 *
 * <ul>
 *   <li>comments before a statement and after the previous one are printed on their own lines
 *       above it;
 *   <li>a comment on the last line of a statement, separated from it only by blanks or commas,
 *       trails it on the same line; the same holds for the header line of a block and for each
 *       element of an argument list, array or dictionary, which is then broken one element per
 *       line;
 *   <li>comments after the last statement of a block are printed before its closing keyword.
 * </ul>
 *
 * Any other comment, for example one in the middle of a single-line expression, cannot be
 * re-attached. Such comments are reported in {@link Result#unattachedComments()} and are missing
 * from the output.
 *
 * <p>A single blank line is kept wherever the original had one or more between two statements or
 * comments of the same block.
 */
public final class Formatter extends NodePrinter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final CharMatcher TRAILING_GAP = CharMatcher.anyOf(" \t\r,");

  /** The text of a formatted file and the comments that could not be placed in it. */
  public static final class Result {
    private final String text;
    private final ImmutableList<Comment> unattachedComments;

    private Result(String text, ImmutableList<Comment> unattachedComments) {
      this.text = text;
      this.unattachedComments = unattachedComments;
    }

    /** Returns the formatted source text. */
    public String text() {
      return text;
    }

    /** Returns the comments missing from {@link #text}, in source order. */
    public ImmutableList<Comment> unattachedComments() {
      return unattachedComments;
    }
  }

  private final FileLocations locs;
  private final List<Comment> backlog; // not yet placed, in source order
  private final List<Comment> unattached = new ArrayList<>();

  // Last line of the original source accounted for in the current block, or 0 at the start of a
  // block, where no blank line is wanted.
  private int lastLine = 0;

  private Formatter(PrinterOptions options, FileLocations locs, List<Comment> comments) {
    super(options, /* flat= */ false);
    this.locs = locs;
    this.backlog = new ArrayList<>(comments);
  }

  /** Formats a file with the default options. */
  public static Result format(BuildFile file) {
    return format(file, PrinterOptions.DEFAULT);
  }

  /** Formats a file. The file must have been parsed without errors. */
  public static Result format(BuildFile file, PrinterOptions options) {
    Preconditions.checkArgument(file.ok(), "cannot format a file with syntax errors");
    CodeBlock root = file.getRoot();
    Formatter formatter = new Formatter(options, root.locs, file.getComments());
    formatter.printTopLevel(root);
    List<Comment> leftover = new ArrayList<>(formatter.unattached);
    leftover.addAll(formatter.backlog);
    leftover.sort((x, y) -> Integer.compare(x.getStartOffset(), y.getStartOffset()));
    for (Comment comment : leftover) {
      logger.atWarning().log(
          "%s: unable to re-attach comment %s", comment.getStartLocation(), comment.getText());
    }
    return new Result(formatter.out.toString(), ImmutableList.copyOf(leftover));
  }

  /** Parses and formats source text with the default options. */
  public static Result format(ParserInput input) throws SyntaxError.Exception {
    BuildFile file = BuildFile.parse(input);
    file.getRootOrThrow();
    return format(file);
  }

  private int line(int offset) {
    return locs.getLine(offset);
  }

  // Emits a blank line if the original had one between lastLine and the given line.
  private void separateFrom(int line) {
    if (lastLine == 0 || line <= lastLine + 1) {
      return;
    }
    for (int i = lastLine + 1; i < line; i++) {
      if (locs.getLineText(i).isBlank()) {
        out.blankLine();
        return;
      }
    }
  }

  // Prints and consumes every pending comment that starts before the given offset, one per line.
  private void printCommentsBefore(int offset) {
    Iterator<Comment> it = backlog.iterator();
    while (it.hasNext()) {
      Comment comment = it.next();
      if (comment.getStartOffset() >= offset) {
        break;
      }
      it.remove();
      int commentLine = comment.getLine();
      separateFrom(commentLine);
      out.append(comment.getText());
      out.newline();
      lastLine = commentLine;
    }
  }

  // Returns the pending comment that trails the text ending at the given offset, or null.
  @Nullable
  private Comment findTrailing(int endOffset) {
    int endLine = line(Math.max(0, endOffset - 1));
    for (Comment comment : backlog) {
      int start = comment.getStartOffset();
      if (start < endOffset) {
        continue;
      }
      if (line(start) != endLine) {
        return null;
      }
      return TRAILING_GAP.matchesAllOf(locs.slice(endOffset, start)) ? comment : null;
    }
    return null;
  }

  private void attachTrailing(int endOffset) {
    Comment comment = findTrailing(endOffset);
    if (comment != null) {
      backlog.remove(comment);
      out.append("  ").append(comment.getText());
    }
  }

  @Override
  protected void beforeStatement(Statement stmt) {
    printCommentsBefore(stmt.getStartOffset());
    separateFrom(line(stmt.getStartOffset()));
  }

  @Override
  protected void afterStatement(Statement stmt) {
    attachTrailing(stmt.getEndOffset());
    Iterator<Comment> it = backlog.iterator();
    while (it.hasNext()) {
      Comment comment = it.next();
      if (comment.getStartOffset() >= stmt.getEndOffset()) {
        break;
      }
      if (comment.getStartOffset() >= stmt.getStartOffset()) {
        it.remove();
        unattached.add(comment);
      }
    }
    lastLine = line(stmt.getEndOffset() - 1);
  }

  @Override
  protected void afterBlockHeader(int headerEndOffset) {
    attachTrailing(headerEndOffset);
    lastLine = 0;
  }

  @Override
  protected void beforeBlockEnd(CodeBlock block) {
    printCommentsBefore(block.getEndOffset());
  }

  @Override
  protected boolean mustBreak(List<? extends Node> elements) {
    for (Node element : elements) {
      if (findTrailing(element.getEndOffset()) != null) {
        return true;
      }
    }
    return false;
  }

  @Override
  protected void afterElement(Node element) {
    attachTrailing(element.getEndOffset());
  }
}
