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

package net.mesonlang.java.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.mesonlang.java.analysis.AssignmentHistory.Binding;
import net.mesonlang.java.eval.InterpretationException;
import net.mesonlang.java.eval.MethodLibrary;
import net.mesonlang.java.eval.ObjectPlaceholder;
import net.mesonlang.java.eval.Operators;
import net.mesonlang.java.eval.UnknownValue;
import net.mesonlang.java.eval.Values;
import net.mesonlang.java.syntax.Argument;
import net.mesonlang.java.syntax.ArgumentList;
import net.mesonlang.java.syntax.AssignmentStatement;
import net.mesonlang.java.syntax.BinaryOperatorExpression;
import net.mesonlang.java.syntax.BooleanLiteral;
import net.mesonlang.java.syntax.BuildFile;
import net.mesonlang.java.syntax.CallExpression;
import net.mesonlang.java.syntax.CodeBlock;
import net.mesonlang.java.syntax.ConditionalExpression;
import net.mesonlang.java.syntax.DictExpression;
import net.mesonlang.java.syntax.Expression;
import net.mesonlang.java.syntax.ExpressionStatement;
import net.mesonlang.java.syntax.FlowStatement;
import net.mesonlang.java.syntax.ForeachStatement;
import net.mesonlang.java.syntax.FormatStringLiteral;
import net.mesonlang.java.syntax.Identifier;
import net.mesonlang.java.syntax.IfStatement;
import net.mesonlang.java.syntax.IndexExpression;
import net.mesonlang.java.syntax.IntLiteral;
import net.mesonlang.java.syntax.ListExpression;
import net.mesonlang.java.syntax.MethodCallExpression;
import net.mesonlang.java.syntax.Node;
import net.mesonlang.java.syntax.NodeVisitor;
import net.mesonlang.java.syntax.ParenthesizedExpression;
import net.mesonlang.java.syntax.ParserInput;
import net.mesonlang.java.syntax.StringLiteral;
import net.mesonlang.java.syntax.SyntaxError;
import net.mesonlang.java.syntax.TokenKind;
import net.mesonlang.java.syntax.UnaryOperatorExpression;

/**
 * An interpreter that walks build files without performing any of their effects, computing for
 * every expression the value it would have at run time where that value can be known statically.
 *
 * <p>While walking, the interpreter records every binding of every variable in an {@link
 * AssignmentHistory} and every flow of a value from one node to another in a {@link
 * DataFlowGraph}. Values that depend on the environment, on which branch of a conditional ran, or
 * on the number of iterations of a loop are represented by {@link UnknownValue}s:
 *
 * <ul>
 *   <li>after an {@code if} whose taken arm cannot be decided statically, a variable assigned in
 *       some arm is unknown unless every possible arm leaves it with the same known value;
 *   <li>a variable assigned anywhere in a {@code foreach} body, and each loop variable, is unknown
 *       throughout the body and after the loop;
 *   <li>any operation on an unknown operand is unknown, except that adding an unknown to an array
 *       yields the array with the unknown appended.
 * </ul>
 *
 * <p>{@code subdir()} calls are followed through a {@link SourceFileAccessor}; a directory is
 * entered at most once. Variables are shared between a file and the subdirectories it enters.
 *
 * <p>Errors found in the input never escape: they become unknown values and {@link Diagnostic}s.
 * Subclasses interpret particular functions by overriding {@link #callFunction}.
 */
public class AstInterpreter extends NodeVisitor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Functions whose result depends on their arguments alone. */
  private static final ImmutableSet<String> PURE_FUNCTIONS = ImmutableSet.of("join_paths");

  /** Functions that create a domain object, usually named by their first argument. */
  private static final ImmutableSet<String> OBJECT_FUNCTIONS =
      ImmutableSet.of(
          "both_libraries",
          "build_target",
          "configuration_data",
          "custom_target",
          "declare_dependency",
          "dependency",
          "environment",
          "executable",
          "find_library",
          "find_program",
          "generator",
          "import",
          "include_directories",
          "jar",
          "library",
          "run_target",
          "shared_library",
          "shared_module",
          "static_library",
          "subproject",
          "vcs_tag");

  /** Objects that are predefined in every build file. */
  private static final ImmutableSet<String> BUILTIN_OBJECTS =
      ImmutableSet.of("meson", "build_machine", "host_machine", "target_machine");

  private final SourceFileAccessor files;
  private final InterpreterOptions options;
  private final String rootDir;
  private final ImmutableList<NodeVisitor> visitors;

  private final AssignmentHistory history = new AssignmentHistory();
  private final DataFlowGraph graph = new DataFlowGraph();
  private final Map<Node, Object> values = new HashMap<>();
  private final Set<Node> liveCalls = new HashSet<>();
  private final Set<String> visitedDirs = new HashSet<>();
  private final List<BuildFile> buildFiles = new ArrayList<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  // The branch path of the statement being interpreted.
  private final List<Integer> activePath = new ArrayList<>();
  private int nextArm = 0;
  private String subdir = "";

  /**
   * Creates an interpreter for the project whose root build file is at the root of {@code files}.
   *
   * @param visitors visitors run over each build file after it is parsed, before it is
   *     interpreted
   */
  public AstInterpreter(
      SourceFileAccessor files, InterpreterOptions options, List<? extends NodeVisitor> visitors) {
    this(files, options, "", visitors);
  }

  /** Creates an interpreter for the project whose root is the directory {@code rootDir}. */
  protected AstInterpreter(
      SourceFileAccessor files,
      InterpreterOptions options,
      String rootDir,
      List<? extends NodeVisitor> visitors) {
    this.files = Preconditions.checkNotNull(files);
    this.options = Preconditions.checkNotNull(options);
    this.rootDir = Preconditions.checkNotNull(rootDir);
    this.visitors = ImmutableList.copyOf(visitors);
  }

  /**
   * Reads, parses and interprets the root build file, and every build file it enters.
   *
   * @throws IOException if the root build file cannot be read
   * @throws SyntaxError.Exception if the root build file has syntax errors
   */
  public void run() throws IOException, SyntaxError.Exception {
    String path = joinPath(rootDir, options.buildFileName());
    BuildFile file = BuildFile.parse(ParserInput.fromUtf8(files.readFile(path), path));
    file.getRootOrThrow();
    run(file);
  }

  /** Interprets a parsed root build file, and every build file it enters. */
  public void run(BuildFile file) {
    Preconditions.checkArgument(file.ok(), "build file has syntax errors");
    Preconditions.checkState(buildFiles.isEmpty(), "interpreter already run");
    try {
      visitedDirs.add(files.canonicalDirectory(rootDir));
    } catch (IOException ex) {
      // Only reachable for a file parsed from memory; nothing to guard against re-entering.
      logger.atFine().withCause(ex).log("no root directory for %s", file.getFile());
    }
    interpretFile(file);
  }

  private void interpretFile(BuildFile file) {
    logger.atFine().log("interpreting %s", file.getFile());
    buildFiles.add(file);
    for (NodeVisitor visitor : visitors) {
      visitor.visit(file.getRoot());
    }
    visitBlock(file.getRoot());
  }

  // ==== Queries ====

  /**
   * Returns the value of a node as computed during interpretation: a String, Long, Boolean, list,
   * dict, {@link ObjectPlaceholder} or {@link UnknownValue}. A node that was never interpreted has
   * an unknown value.
   */
  public Object resolve(Node node) {
    if (node instanceof Argument arg) {
      return resolve(arg.getValue());
    } else if (node instanceof ExpressionStatement stmt) {
      return resolve(stmt.getExpression());
    }
    Object value = values.get(node);
    return value != null ? value : new UnknownValue(node, "not interpreted");
  }

  /**
   * Resolves the nodes and returns their scalar values in order, expanding arrays at any depth.
   *
   * @param includeUnknown whether to keep values that are not strings, integers or booleans
   *     (unknown values, domain objects and dicts); if false they are dropped
   */
  public ImmutableList<Object> flatten(List<? extends Node> nodes, boolean includeUnknown) {
    List<Object> resolved = new ArrayList<>();
    for (Node node : nodes) {
      resolved.add(resolve(node));
    }
    return flattenValues(resolved, includeUnknown);
  }

  /** Like {@link #flatten}, for values already resolved. */
  public static ImmutableList<Object> flattenValues(List<?> resolved, boolean includeUnknown) {
    ImmutableList.Builder<Object> out = ImmutableList.builder();
    for (Object value : Values.flatten(resolved)) {
      if (includeUnknown
          || value instanceof String
          || value instanceof Long
          || value instanceof Boolean) {
        out.add(value);
      }
    }
    return out.build();
  }

  /** Returns the value of a variable as it stands at the top level, or null if it is unbound. */
  @Nullable
  public Object lookup(String name) {
    Binding binding = history.lookup(name, activePath);
    return binding == null ? null : binding.value();
  }

  public AssignmentHistory getAssignmentHistory() {
    return history;
  }

  public DataFlowGraph getDataFlowGraph() {
    return graph;
  }

  /** Returns the diagnostics reported so far, in the order they were found. */
  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the build files interpreted, the root first, then in the order they were entered. */
  public ImmutableList<BuildFile> getBuildFiles() {
    return ImmutableList.copyOf(buildFiles);
  }

  // ==== For subclasses ====

  protected final SourceFileAccessor getFileAccessor() {
    return files;
  }

  protected final InterpreterOptions getOptions() {
    return options;
  }

  protected final ImmutableList<NodeVisitor> getVisitors() {
    return visitors;
  }

  /** Returns the directory of the project root, relative to the root of the file accessor. */
  protected final String getRootDir() {
    return rootDir;
  }

  /** Returns the directory of the build file being interpreted, relative to the project root. */
  protected final String getSubdir() {
    return subdir;
  }

  /** Reports whether the statement being interpreted is inside a conditional or a loop. */
  protected final boolean isConditional() {
    return !activePath.isEmpty();
  }

  protected final void addDiagnostic(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  @FormatMethod
  protected final void warn(Node node, String format, Object... args) {
    Diagnostic d = Diagnostic.warning(node.getStartLocation(), String.format(format, args));
    logger.atWarning().log("%s", d);
    diagnostics.add(d);
  }

  @FormatMethod
  protected final void error(Node node, String format, Object... args) {
    Diagnostic d = Diagnostic.error(node.getStartLocation(), String.format(format, args));
    logger.atWarning().log("%s", d);
    diagnostics.add(d);
  }

  /** Joins the non-empty path segments with '/'. */
  protected static String joinPath(String... segments) {
    StringBuilder buf = new StringBuilder();
    for (String segment : segments) {
      if (!segment.isEmpty()) {
        if (buf.length() > 0) {
          buf.append('/');
        }
        buf.append(segment);
      }
    }
    return buf.toString();
  }

  /**
   * Computes the result of a call to a global function. Arguments are already resolved, and the
   * keyword arguments are known to follow the positional ones.
   *
   * <p>The default implementation enters {@code subdir()}, computes {@code join_paths()} and
   * {@code files()}, returns an {@link ObjectPlaceholder} from functions that create a domain
   * object, and an unknown value from any other function.
   */
  protected Object callFunction(
      CallExpression call, ImmutableList<Object> positional, ImmutableMap<String, Object> named)
      throws InterpretationException {
    String name = call.getFunctionName();
    switch (name) {
      case "subdir":
        subdir(call, positional);
        return new UnknownValue(call, "subdir() has no value");
      case "join_paths":
        return joinPaths(call, positional);
      case "files":
        return Values.flatten(positional);
      default:
        if (OBJECT_FUNCTIONS.contains(name)) {
          return new ObjectPlaceholder(name, firstString(positional), call);
        }
        return new UnknownValue(call, "result of " + name + "()");
    }
  }

  /** Returns the first positional argument if it is a string, or null. */
  @Nullable
  protected static String firstString(List<Object> positional) {
    return !positional.isEmpty() && positional.get(0) instanceof String s ? s : null;
  }

  private static Object joinPaths(CallExpression call, List<Object> args)
      throws InterpretationException {
    if (args.isEmpty()) {
      throw new InterpretationException("join_paths() requires at least one argument");
    }
    String result = "";
    for (Object arg : args) {
      if (UnknownValue.isUnknown(arg)) {
        return new UnknownValue(call, "join_paths() of an unknown value");
      } else if (!(arg instanceof String s)) {
        throw new InterpretationException("join_paths() arguments must be strings");
      } else {
        result = Operators.joinPaths(result, s);
      }
    }
    return result;
  }

  private void subdir(CallExpression call, List<Object> positional) {
    ImmutableList<Object> args = Values.flatten(positional);
    if (args.size() != 1 || !(args.get(0) instanceof String name)) {
      warn(call, "Unable to evaluate subdir(%s); skipping", args);
      return;
    }
    String dir = joinPath(subdir, name);
    String path = joinPath(rootDir, dir, options.buildFileName());
    String canonical;
    try {
      canonical = files.canonicalDirectory(joinPath(rootDir, dir));
    } catch (IOException ex) {
      warn(call, "Unable to find build file %s; skipping", path);
      return;
    }
    if (!visitedDirs.add(canonical)) {
      warn(call, "Trying to enter %s which has already been visited; skipping", name);
      return;
    }
    if (!files.isFile(path)) {
      warn(call, "Unable to find build file %s; skipping", path);
      return;
    }
    BuildFile file;
    try {
      file = BuildFile.parse(ParserInput.fromUtf8(files.readFile(path), path));
    } catch (IOException ex) {
      error(call, "Unable to read build file %s: %s", path, ex.getMessage());
      return;
    }
    if (!file.ok()) {
      for (SyntaxError err : file.errors()) {
        diagnostics.add(Diagnostic.error(err.location(), err.message()));
      }
      return;
    }
    String prev = subdir;
    subdir = dir;
    try {
      interpretFile(file);
    } finally {
      subdir = prev;
    }
  }

  // ==== Statements ====

  @Override
  public void visit(AssignmentStatement node) {
    Identifier lhs = node.getLHS();
    Object value = eval(node.getRHS());
    flow(node.getRHS(), node);
    if (node.isAugmented()) {
      Binding old = history.lookup(lhs.getName(), activePath);
      if (old == null) {
        error(lhs, "undefined variable '%s'", lhs.getName());
        value = new UnknownValue(node, "undefined variable '" + lhs.getName() + "'");
      } else {
        graph.addEdge(old.source(), node, false);
        try {
          value = applyBinary(node, TokenKind.PLUS, old.value(), value);
        } catch (InterpretationException ex) {
          warn(node, "%s", ex.getMessage());
          value = new UnknownValue(node, ex.getMessage());
        }
      }
    }
    values.put(node, value);
    values.put(lhs, value);
    graph.addVertex(node);
    history.bind(lhs.getName(), activePath, node, value);
  }

  @Override
  public void visit(ExpressionStatement node) {
    eval(node.getExpression());
  }

  @Override
  public void visit(FlowStatement node) {
    // Loops are interpreted conservatively, so break and continue change nothing.
  }

  @Override
  public void visit(IfStatement node) {
    List<List<Integer>> armPaths = new ArrayList<>();
    boolean decided = true;
    int taken = -1;
    for (IfStatement.Conditional arm : node.getArms()) {
      Object cond = eval(arm.getCondition());
      if (decided && taken < 0) {
        Boolean truth = staticTruth(arm.getCondition(), cond);
        if (truth == null) {
          decided = false;
        } else if (truth) {
          taken = armPaths.size();
        }
      }
      armPaths.add(interpretArm(arm.getBody()));
    }
    if (node.getElse() != null) {
      if (decided && taken < 0) {
        taken = armPaths.size();
      }
      armPaths.add(interpretArm(node.getElse().getBody()));
    }
    join(node, armPaths, decided ? taken : null, node.getElse() != null);
  }

  private List<Integer> interpretArm(CodeBlock body) {
    activePath.add(nextArm++);
    List<Integer> path = ImmutableList.copyOf(activePath);
    visitBlock(body);
    activePath.remove(activePath.size() - 1);
    return path;
  }

  /** Returns the value of a condition, or null if it cannot be decided statically. */
  @Nullable
  private Boolean staticTruth(Expression condition, Object value) {
    if (Values.containsUnknown(value)) {
      return null;
    }
    try {
      return Operators.truth(value);
    } catch (InterpretationException ex) {
      warn(condition, "%s", ex.getMessage());
      return null;
    }
  }

  /**
   * Merges the bindings made by the arms of a conditional into the enclosing path.
   *
   * @param taken the index of the arm statically known to run, -1 if statically no arm runs, or
   *     null if it cannot be decided
   * @param exhaustive whether some arm always runs
   */
  private void join(
      IfStatement node, List<List<Integer>> armPaths, @Nullable Integer taken, boolean exhaustive) {
    for (String name : history.names()) {
      List<Binding> armBindings = new ArrayList<>();
      boolean someArmKeeps = !exhaustive;
      boolean assigned = false;
      for (List<Integer> path : armPaths) {
        Binding b = history.lookup(name, path);
        if (b != null && b.branchPath().size() >= path.size()) {
          armBindings.add(b);
          assigned = true;
        } else {
          armBindings.add(null);
          someArmKeeps = true;
        }
      }
      if (!assigned) {
        continue;
      }
      if (taken != null) {
        Binding chosen = taken >= 0 ? armBindings.get(taken) : null;
        if (chosen != null) {
          history.bind(name, activePath, chosen.source(), chosen.value());
        }
        continue;
      }
      List<Binding> candidates = new ArrayList<>();
      boolean maybeUnbound = false;
      for (Binding b : armBindings) {
        if (b != null) {
          candidates.add(b);
        }
      }
      if (someArmKeeps) {
        Binding outer = history.lookup(name, activePath);
        if (outer != null) {
          candidates.add(outer);
        } else {
          maybeUnbound = true;
        }
      }
      if (!maybeUnbound && allSameKnownValue(candidates)) {
        Binding first = candidates.get(0);
        history.bind(name, activePath, first.source(), first.value());
      } else {
        UnknownValue joined =
            new UnknownValue(node, "value of '" + name + "' depends on the branch taken");
        for (Binding b : candidates) {
          graph.addEdge(b.source(), joined, false);
        }
        history.bind(name, activePath, joined, joined);
      }
    }
  }

  private static boolean allSameKnownValue(List<Binding> candidates) {
    Object first = candidates.get(0).value();
    if (Values.containsUnknown(first)) {
      return false;
    }
    for (Binding b : candidates) {
      if (!first.equals(b.value())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void visit(ForeachStatement node) {
    eval(node.getIterable());
    Set<String> loopVars = new LinkedHashSet<>();
    for (Identifier var : node.getVars()) {
      loopVars.add(var.getName());
    }
    Set<String> names = new LinkedHashSet<>(loopVars);
    AssignedNames collector = new AssignedNames();
    collector.visitBlock(node.getBody());
    names.addAll(collector.names);

    activePath.add(nextArm++);
    List<Integer> loopPath = ImmutableList.copyOf(activePath);
    for (String name : names) {
      UnknownValue unknown = new UnknownValue(node, "'" + name + "' is assigned in a loop");
      Binding outer = history.lookup(name, activePath);
      if (outer != null) {
        graph.addEdge(outer.source(), unknown, false);
      }
      if (loopVars.contains(name)) {
        graph.addEdge(node.getIterable(), unknown, liveCalls.contains(node.getIterable()));
      }
      history.bind(name, activePath, unknown, unknown);
    }
    for (Identifier var : node.getVars()) {
      Binding b = history.lookup(var.getName(), activePath);
      graph.addEdge(b.source(), var, false);
      values.put(var, b.value());
    }
    visitBlock(node.getBody());
    activePath.remove(activePath.size() - 1);

    // Includes names bound by build files entered from the body.
    for (String name : history.names()) {
      Binding inner = history.lookup(name, loopPath);
      if (inner == null || inner.branchPath().size() < loopPath.size()) {
        continue;
      }
      UnknownValue unknown = new UnknownValue(node, "'" + name + "' is assigned in a loop");
      Binding outer = history.lookup(name, activePath);
      if (outer != null) {
        graph.addEdge(outer.source(), unknown, false);
      }
      graph.addEdge(inner.source(), unknown, false);
      history.bind(name, activePath, unknown, unknown);
    }
  }

  /** Collects the names of the variables a block may assign. */
  private static final class AssignedNames extends NodeVisitor {
    final Set<String> names = new LinkedHashSet<>();

    @Override
    public void visit(AssignmentStatement node) {
      names.add(node.getLHS().getName());
    }

    @Override
    public void visit(ForeachStatement node) {
      for (Identifier var : node.getVars()) {
        names.add(var.getName());
      }
      visitBlock(node.getBody());
    }

    @Override
    public void visit(ExpressionStatement node) {}
  }

  // ==== Expressions ====

  /** Evaluates an expression in the current scope, recording its value and its data flow. */
  private Object eval(Expression expr) {
    Object value;
    try {
      value = doEval(expr);
    } catch (InterpretationException ex) {
      logger.atFine().log("%s: %s", expr.getStartLocation(), ex.getMessage());
      value = new UnknownValue(expr, ex.getMessage());
    }
    values.put(expr, value);
    graph.addVertex(expr);
    return value;
  }

  private Object doEval(Expression expr) throws InterpretationException {
    switch (expr.kind()) {
      case BINARY_OPERATOR:
        return evalBinary((BinaryOperatorExpression) expr);
      case BOOLEAN_LITERAL:
        return ((BooleanLiteral) expr).getValue();
      case CALL:
        return evalCall((CallExpression) expr);
      case CONDITIONAL:
        return evalConditional((ConditionalExpression) expr);
      case DICT_EXPR:
        return evalDict((DictExpression) expr);
      case FORMAT_STRING_LITERAL:
        return evalFormat((FormatStringLiteral) expr);
      case IDENTIFIER:
        return evalIdentifier((Identifier) expr);
      case INDEX:
        return evalIndex((IndexExpression) expr);
      case INT_LITERAL:
        return ((IntLiteral) expr).getValue();
      case LIST_EXPR:
        return evalList((ListExpression) expr);
      case METHOD_CALL:
        return evalMethodCall((MethodCallExpression) expr);
      case PARENTHESIZED:
        {
          Expression x = ((ParenthesizedExpression) expr).getX();
          Object value = eval(x);
          flow(x, expr);
          return value;
        }
      case STRING_LITERAL:
        return ((StringLiteral) expr).getValue();
      case UNARY_OPERATOR:
        return evalUnary((UnaryOperatorExpression) expr);
    }
    throw new IllegalArgumentException("unexpected expression: " + expr.kind());
  }

  /** Records that the value of {@code from} flows into {@code to}. */
  private void flow(Node from, Node to) {
    graph.addEdge(from, to, liveCalls.contains(from));
  }

  private Object evalIdentifier(Identifier id) throws InterpretationException {
    String name = id.getName();
    Binding binding = history.lookup(name, activePath);
    if (binding == null) {
      if (BUILTIN_OBJECTS.contains(name)) {
        return new UnknownValue(id, "builtin object '" + name + "'");
      }
      warn(id, "undefined variable '%s'", name);
      throw InterpretationException.errorf("undefined variable '%s'", name);
    }
    graph.addEdge(binding.source(), id, false);
    return binding.value();
  }

  private Object evalFormat(FormatStringLiteral node) throws InterpretationException {
    Map<String, Object> vars = new HashMap<>();
    for (String name : node.getReferencedNames()) {
      Binding binding = history.lookup(name, activePath);
      if (binding == null) {
        throw InterpretationException.errorf("undefined variable '%s' in format string", name);
      }
      graph.addEdge(binding.source(), node, false);
      vars.put(name, binding.value());
    }
    for (Object value : vars.values()) {
      if (Values.containsUnknown(value)) {
        return new UnknownValue(node, "format string refers to an unknown value");
      }
    }
    return Operators.format(node.getValue(), vars::get);
  }

  private Object evalList(ListExpression node) {
    ImmutableList.Builder<Object> list = ImmutableList.builder();
    for (Expression elem : node.getElements()) {
      list.add(eval(elem));
      flow(elem, node);
    }
    return list.build();
  }

  private Object evalDict(DictExpression node) throws InterpretationException {
    Map<String, Object> dict = new LinkedHashMap<>();
    boolean unknownKey = false;
    String badKey = null;
    for (DictExpression.Entry entry : node.getEntries()) {
      Object key = eval(entry.getKey());
      Object value = eval(entry.getValue());
      flow(entry.getKey(), node);
      flow(entry.getValue(), node);
      if (UnknownValue.isUnknown(key)) {
        unknownKey = true;
      } else if (key instanceof String s) {
        dict.put(s, value);
      } else if (badKey == null) {
        badKey = key.toString();
      }
    }
    if (badKey != null) {
      throw InterpretationException.errorf("dictionary keys must be strings, got %s", badKey);
    } else if (unknownKey) {
      return new UnknownValue(node, "dictionary key is unknown");
    }
    return ImmutableMap.copyOf(dict);
  }

  private Object evalUnary(UnaryOperatorExpression node) throws InterpretationException {
    Object x = eval(node.getX());
    flow(node.getX(), node);
    if (Values.containsUnknown(x)) {
      return new UnknownValue(node, "operand is unknown");
    }
    return Operators.unaryOp(node.getOperator(), x);
  }

  private Object evalBinary(BinaryOperatorExpression node) throws InterpretationException {
    Object x = eval(node.getX());
    Object y = eval(node.getY());
    flow(node.getX(), node);
    flow(node.getY(), node);
    TokenKind op = node.getOperator();
    if ((op == TokenKind.AND || op == TokenKind.OR) && !Values.containsUnknown(x)) {
      // A known left operand may decide the result on its own.
      boolean truth = Operators.truth(x);
      if (truth == (op == TokenKind.OR)) {
        return truth;
      }
    }
    return applyBinary(node, op, x, y);
  }

  /** Applies a binary operator to operands that may be unknown. */
  private static Object applyBinary(Node node, TokenKind op, Object x, Object y)
      throws InterpretationException {
    boolean append = op == TokenKind.PLUS && x instanceof List;
    if (UnknownValue.isUnknown(x)
        || (!append && (Values.containsUnknown(x) || Values.containsUnknown(y)))) {
      return new UnknownValue(node, "operand is unknown");
    }
    return Operators.binaryOp(op, x, y);
  }

  private Object evalConditional(ConditionalExpression node) throws InterpretationException {
    Object cond = eval(node.getCondition());
    Object then = eval(node.getThenCase());
    Object otherwise = eval(node.getElseCase());
    flow(node.getCondition(), node);
    flow(node.getThenCase(), node);
    flow(node.getElseCase(), node);
    if (!Values.containsUnknown(cond)) {
      return Operators.truth(cond) ? then : otherwise;
    } else if (!Values.containsUnknown(then) && then.equals(otherwise)) {
      return then;
    }
    return new UnknownValue(node, "condition is unknown");
  }

  private Object evalIndex(IndexExpression node) throws InterpretationException {
    Object object = eval(node.getObject());
    Object key = eval(node.getKey());
    flow(node.getObject(), node);
    flow(node.getKey(), node);
    if (UnknownValue.isUnknown(object) || Values.containsUnknown(key)) {
      return new UnknownValue(node, "operand is unknown");
    }
    return Operators.index(object, key);
  }

  /** The resolved arguments of a call. */
  private static final class Arguments {
    final ImmutableList<Object> positional;
    final ImmutableMap<String, Object> named;

    Arguments(ImmutableList<Object> positional, ImmutableMap<String, Object> named) {
      this.positional = positional;
      this.named = named;
    }

    boolean containUnknown() {
      return Values.containsUnknown(positional) || Values.containsUnknown(named);
    }
  }

  private Arguments evalArguments(ArgumentList args, Node call, boolean live) {
    ImmutableList.Builder<Object> positional = ImmutableList.builder();
    Map<String, Object> named = new LinkedHashMap<>();
    for (Argument arg : args.getArguments()) {
      Object value = eval(arg.getValue());
      graph.addEdge(arg.getValue(), call, live || liveCalls.contains(arg.getValue()));
      if (arg.getName() == null) {
        positional.add(value);
      } else {
        named.put(arg.getName(), value);
      }
    }
    return new Arguments(positional.build(), ImmutableMap.copyOf(named));
  }

  private Object evalCall(CallExpression call) throws InterpretationException {
    String name = call.getFunctionName();
    boolean live = !PURE_FUNCTIONS.contains(name);
    if (live) {
      liveCalls.add(call);
    }
    Arguments args = evalArguments(call.getArguments(), call, live);
    if (call.getArguments().hasOrderError()) {
      error(call, "All keyword arguments must be after positional arguments.");
      return new UnknownValue(call, "invalid argument order");
    }
    return callFunction(call, args.positional, args.named);
  }

  private Object evalMethodCall(MethodCallExpression call) throws InterpretationException {
    Object receiver = eval(call.getObject());
    boolean live = UnknownValue.isUnknown(receiver) || receiver instanceof ObjectPlaceholder;
    if (live) {
      liveCalls.add(call);
    }
    graph.addEdge(call.getObject(), call, live || liveCalls.contains(call.getObject()));
    Arguments args = evalArguments(call.getArguments(), call, live);
    if (call.getArguments().hasOrderError()) {
      error(call, "All keyword arguments must be after positional arguments.");
      return new UnknownValue(call, "invalid argument order");
    } else if (live) {
      return new UnknownValue(call, "result of method " + call.getMethodName() + "()");
    } else if (Values.containsUnknown(receiver) || args.containUnknown()) {
      return new UnknownValue(call, "operand is unknown");
    }
    return MethodLibrary.call(receiver, call.getMethodName(), args.positional, args.named);
  }
}
