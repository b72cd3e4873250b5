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
import java.util.Collections;
import java.util.List;

/**
 * Syntax tree for a build file. A build file is parsed in one step; if there are syntax errors the
 * tree is empty and {@link #errors} describes them.
 *
 * <p>Every node reachable from the root, including argument lists, dict entries and the arms of
 * if statements, receives a unique id in lexical order.
 */
public final class BuildFile {

  private final FileLocations locs;
  private final CodeBlock root;
  private final ImmutableList<Comment> comments;
  private final List<SyntaxError> errors; // appended to by later passes
  private final int nodeCount;

  private BuildFile(
      FileLocations locs,
      CodeBlock root,
      ImmutableList<Comment> comments,
      List<SyntaxError> errors) {
    this.locs = locs;
    this.root = root;
    this.comments = comments;
    this.errors = errors;
    IdAssigner ids = new IdAssigner();
    ids.visit(root);
    this.nodeCount = ids.next;
  }

  // Assigns ids in pre-order. Some children are dispatched to their specific overload without
  // passing through visit(Node), so each of those overloads assigns too.
  private static final class IdAssigner extends NodeVisitor {
    int next = 0;

    private void assign(Node node) {
      if (node.getId() == -1) {
        node.setId(next++);
      }
    }

    @Override
    public void visit(Node node) {
      assign(node);
      super.visit(node);
    }

    @Override
    public void visit(CodeBlock node) {
      assign(node);
      super.visit(node);
    }

    @Override
    public void visit(ArgumentList node) {
      assign(node);
      super.visit(node);
    }

    @Override
    public void visit(IfStatement.Else node) {
      assign(node);
      super.visit(node);
    }

    @Override
    public void visit(Identifier node) {
      assign(node);
    }
  }

  /**
   * Parse a build file.
   *
   * <p>In addition to the syntax tree, the result contains the comments of the file, in source
   * order, and any syntax errors. Scan and parse errors are fatal for the file: the first one stops
   * parsing.
   */
  public static BuildFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new BuildFile(result.locs, result.root, result.comments, result.errors);
  }

  /** Returns the top-level block of the file. */
  public CodeBlock getRoot() {
    return root;
  }

  /** Returns the top-level statements of the file. */
  public ImmutableList<Statement> getStatements() {
    return root.getStatements();
  }

  /** Returns the comments of the file, in source order. */
  public ImmutableList<Comment> getComments() {
    return comments;
  }

  /** Returns an unmodifiable view of the list of scanner and parser errors. */
  public List<SyntaxError> errors() {
    return Collections.unmodifiableList(errors);
  }

  /** Returns true if there were no errors during scanning and parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the source id of the file. */
  public String getFile() {
    return locs.file();
  }

  /** Returns the text of the given 1-based line of the file, without its terminator. */
  public String getLineText(int line) {
    return locs.getLineText(line);
  }

  /** Returns the number of nodes in the tree; node ids are in [0, getNodeCount()). */
  public int getNodeCount() {
    return nodeCount;
  }

  /**
   * Returns the tree if parsing succeeded, or throws an exception holding the syntax errors.
   */
  public CodeBlock getRootOrThrow() throws SyntaxError.Exception {
    if (!ok()) {
      throw new SyntaxError.Exception(errors);
    }
    return root;
  }

  @Override
  public String toString() {
    return "<build file " + locs.file() + ">";
  }
}
