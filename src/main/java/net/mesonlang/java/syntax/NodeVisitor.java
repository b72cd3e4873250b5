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

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Comments are *not* visited.
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields.
 *
 * <p>A subclass that must not descend into some subtree, for example a {@code subdir} it has
 * already entered, simply overrides the relevant overload without calling {@code super}.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles both Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    if (node instanceof Argument.Keyword keyword) {
      visit(keyword.getIdentifier());
    }
    visit(node.getValue());
  }

  public void visit(ArgumentList node) {
    visitAll(node.getArguments());
  }

  public void visit(CodeBlock node) {
    visitAll(node.getStatements());
  }

  /**
   * @deprecated Not supported.
   * @throws UnsupportedOperationException always.
   */
  @Deprecated
  public void visit(@SuppressWarnings("unused") Comment node) {
    throw new UnsupportedOperationException("NodeVisitor does not support visiting comments");
  }

  // ==== Statements ====

  public void visit(AssignmentStatement node) {
    visit(node.getLHS());
    visit(node.getRHS());
  }

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(@SuppressWarnings("unused") FlowStatement node) {}

  public void visit(ForeachStatement node) {
    visitAll(node.getVars());
    visit(node.getIterable());
    visitBlock(node.getBody());
  }

  public void visit(IfStatement node) {
    visitAll(node.getArms());
    if (node.getElse() != null) {
      visit(node.getElse());
    }
  }

  public void visit(IfStatement.Conditional node) {
    visit(node.getCondition());
    visitBlock(node.getBody());
  }

  public void visit(IfStatement.Else node) {
    visitBlock(node.getBody());
  }

  // ==== Expressions ====

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(@SuppressWarnings("unused") BooleanLiteral node) {}

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visit(node.getArguments());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getCondition());
    visit(node.getThenCase());
    visit(node.getElseCase());
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  public void visit(DictExpression.Entry node) {
    visit(node.getKey());
    visit(node.getValue());
  }

  public void visit(@SuppressWarnings("unused") FormatStringLiteral node) {}

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(@SuppressWarnings("unused") IntLiteral node) {}

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(MethodCallExpression node) {
    visit(node.getObject());
    visit(node.getMethod());
    visit(node.getArguments());
  }

  public void visit(ParenthesizedExpression node) {
    visit(node.getX());
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  // ==== Helpers ====

  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /**
   * Visits a block of statements. The default implementation dispatches to the block's {@code
   * visit(CodeBlock)} overload, so subclasses may intercept every nested block in one place.
   */
  public final void visitBlock(CodeBlock block) {
    visit(block);
  }
}
