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

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;

/**
 * A printer that emits build file source text in canonical layout, ignoring the layout of the
 * original source.
 *
 * <p>Each statement goes on its own line and block bodies are indented. An argument list, array or
 * dictionary is printed on one line unless it has more than {@link
 * PrinterOptions#argumentCutoff()} elements or would extend past {@link
 * PrinterOptions#maxLineLength()}; otherwise each element goes on its own line, followed by a
 * comma. Parentheses are kept exactly where the tree has them.
 *
 * <p>Reparsing the output yields a tree of the same shape as the input, and printing that tree
 * again yields the same text.
 *
 * <p>{@link Formatter} extends this printer with comment re-attachment through the protected
 * hooks.
 */
public class NodePrinter extends NodeVisitor {

  protected final PrinterOptions options;
  protected final SourceWriter out;
  private final boolean flat; // never break lines; used for measuring and toString
  private boolean forcedBreak; // a flat rendering contains a sequence above the cutoff

  NodePrinter(PrinterOptions options, boolean flat) {
    this.options = options;
    this.out = new SourceWriter(options.indent());
    this.flat = flat;
  }

  /** Prints a file, a statement or an expression in canonical layout with default options. */
  public static String print(Node node) {
    return print(node, PrinterOptions.DEFAULT);
  }

  /** Prints a file, a statement or an expression in canonical layout. */
  public static String print(Node node, PrinterOptions options) {
    NodePrinter printer = new NodePrinter(options, /* flat= */ false);
    printer.printTopLevel(node);
    return printer.out.toString();
  }

  /** Prints the tree of a parsed file. */
  public static String print(BuildFile file, PrinterOptions options) {
    return print(file.getRoot(), options);
  }

  // Returns a single-line rendering of the node, for diagnostics.
  static String printCompact(Node node) {
    NodePrinter printer = new NodePrinter(PrinterOptions.DEFAULT, /* flat= */ true);
    printer.printTopLevel(node);
    return printer.out.toString().stripTrailing();
  }

  // Returns the length of the node's rendering on a single line, or MAX_VALUE if the node
  // contains a sequence that is always broken.
  private int flatLength(Node node) {
    NodePrinter printer = new NodePrinter(options, /* flat= */ true);
    printer.visit(node);
    return printer.forcedBreak ? Integer.MAX_VALUE : printer.out.toString().length();
  }

  final void printTopLevel(Node node) {
    if (node instanceof CodeBlock block) {
      printBlock(block);
    } else if (node instanceof Statement stmt) {
      printStatement(stmt);
    } else {
      visit(node);
    }
  }

  // ==== Hooks for Formatter ====

  /** Called before a statement is printed. */
  protected void beforeStatement(Statement stmt) {}

  /** Called after a statement is printed, before the line is ended. */
  protected void afterStatement(Statement stmt) {}

  /**
   * Called after the header of a block ({@code if cond}, {@code else}, {@code foreach ...}) is
   * printed, before the line is ended.
   *
   * @param headerEndOffset offset of the end of the header in the original source
   */
  protected void afterBlockHeader(int headerEndOffset) {}

  /** Called after the statements of a block are printed, before the closing keyword. */
  protected void beforeBlockEnd(CodeBlock block) {}

  /** Reports whether a sequence must be broken one element per line regardless of its length. */
  protected boolean mustBreak(List<? extends Node> elements) {
    return false;
  }

  /** Called after an element of a broken sequence and its comma are printed. */
  protected void afterElement(Node element) {}

  // ==== Blocks and statements ====

  /** Prints the statements of a block, each on its own line, at the current indentation. */
  protected void printBlock(CodeBlock block) {
    for (Statement stmt : block.getStatements()) {
      printStatement(stmt);
    }
    beforeBlockEnd(block);
  }

  private void printStatement(Statement stmt) {
    beforeStatement(stmt);
    visit(stmt);
    afterStatement(stmt);
    out.newline();
  }

  private void printBody(CodeBlock body) {
    out.newline();
    out.indent();
    printBlock(body);
    out.dedent();
  }

  @Override
  public void visit(CodeBlock node) {
    printBlock(node);
  }

  @Override
  public void visit(AssignmentStatement node) {
    visit(node.getLHS());
    out.append(node.isAugmented() ? " += " : " = ");
    visit(node.getRHS());
  }

  @Override
  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  @Override
  public void visit(FlowStatement node) {
    out.append(node.getFlowKind().toString());
  }

  @Override
  public void visit(ForeachStatement node) {
    out.append("foreach ");
    List<String> names = new ArrayList<>();
    for (Identifier id : node.getVars()) {
      names.add(id.getName());
    }
    out.append(Joiner.on(", ").join(names));
    out.append(" : ");
    visit(node.getIterable());
    afterBlockHeader(node.getIterable().getEndOffset());
    printBody(node.getBody());
    out.append("endforeach");
  }

  @Override
  public void visit(IfStatement node) {
    for (IfStatement.Conditional arm : node.getArms()) {
      visit(arm);
    }
    if (node.getElse() != null) {
      visit(node.getElse());
    }
    out.append("endif");
  }

  @Override
  public void visit(IfStatement.Conditional node) {
    out.append(node.getToken() == TokenKind.IF ? "if " : "elif ");
    visit(node.getCondition());
    afterBlockHeader(node.getCondition().getEndOffset());
    printBody(node.getBody());
  }

  @Override
  public void visit(IfStatement.Else node) {
    out.append("else");
    afterBlockHeader(node.getStartOffset() + TokenKind.ELSE.toString().length());
    printBody(node.getBody());
  }

  @Override
  public void visit(Comment node) {
    out.append(node.getText());
  }

  // ==== Sequences ====

  // Prints open, the elements separated by commas, and close, breaking the sequence one element
  // per line if it is too long.
  private void printSequence(String open, List<? extends Node> elements, String close) {
    if (elements.isEmpty()) {
      out.append(open).append(close);
      return;
    }
    if (flat && elements.size() > options.argumentCutoff()) {
      forcedBreak = true;
    }
    if (!flat && shouldBreak(open, elements, close)) {
      out.append(open);
      out.newline();
      out.indent();
      for (Node element : elements) {
        visit(element);
        out.append(",");
        afterElement(element);
        out.newline();
      }
      out.dedent();
      out.append(close);
      return;
    }
    out.append(open);
    boolean first = true;
    for (Node element : elements) {
      if (!first) {
        out.append(", ");
      }
      first = false;
      visit(element);
    }
    out.append(close);
  }

  private boolean shouldBreak(String open, List<? extends Node> elements, String close) {
    if (elements.size() > options.argumentCutoff() || mustBreak(elements)) {
      return true;
    }
    long length = open.length() + close.length() + 2L * (elements.size() - 1);
    for (Node element : elements) {
      length += flatLength(element);
    }
    return out.column() + length > options.maxLineLength();
  }

  @Override
  public void visit(ArgumentList node) {
    printSequence("(", node.getArguments(), ")");
  }

  @Override
  public void visit(Argument node) {
    if (node instanceof Argument.Keyword keyword) {
      out.append(keyword.getName()).append(": ");
    }
    visit(node.getValue());
  }

  @Override
  public void visit(ListExpression node) {
    printSequence("[", node.getElements(), "]");
  }

  @Override
  public void visit(DictExpression node) {
    printSequence("{", node.getEntries(), "}");
  }

  @Override
  public void visit(DictExpression.Entry node) {
    visit(node.getKey());
    out.append(": ");
    visit(node.getValue());
  }

  // ==== Expressions ====

  @Override
  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    out.append(" ").append(node.getOperator().toString()).append(" ");
    visit(node.getY());
  }

  @Override
  public void visit(BooleanLiteral node) {
    out.append(node.getValue() ? "true" : "false");
  }

  @Override
  public void visit(CallExpression node) {
    out.append(node.getFunctionName());
    visit(node.getArguments());
  }

  @Override
  public void visit(ConditionalExpression node) {
    visit(node.getCondition());
    out.append(" ? ");
    visit(node.getThenCase());
    out.append(" : ");
    visit(node.getElseCase());
  }

  @Override
  public void visit(FormatStringLiteral node) {
    out.append("f");
    out.append(quote(node.getValue(), node.isMultiline()));
  }

  @Override
  public void visit(Identifier node) {
    out.append(node.getName());
  }

  @Override
  public void visit(IndexExpression node) {
    visit(node.getObject());
    out.append("[");
    visit(node.getKey());
    out.append("]");
  }

  @Override
  public void visit(IntLiteral node) {
    out.append(node.getRaw());
  }

  @Override
  public void visit(MethodCallExpression node) {
    visit(node.getObject());
    out.append(".").append(node.getMethodName());
    visit(node.getArguments());
  }

  @Override
  public void visit(ParenthesizedExpression node) {
    out.append("(");
    visit(node.getX());
    out.append(")");
  }

  @Override
  public void visit(StringLiteral node) {
    out.append(quote(node.getValue(), node.isMultiline()));
  }

  private static String quote(String value, boolean multiline) {
    return multiline ? "'''" + value + "'''" : StringLiteral.quote(value);
  }

  @Override
  public void visit(UnaryOperatorExpression node) {
    out.append(node.getOperator() == TokenKind.NOT ? "not " : "-");
    visit(node.getX());
  }
}
