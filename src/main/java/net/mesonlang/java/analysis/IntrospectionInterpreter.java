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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.mesonlang.java.eval.InterpretationException;
import net.mesonlang.java.eval.ObjectPlaceholder;
import net.mesonlang.java.syntax.BuildFile;
import net.mesonlang.java.syntax.CallExpression;
import net.mesonlang.java.syntax.ExpressionStatement;
import net.mesonlang.java.syntax.Location;
import net.mesonlang.java.syntax.NodeVisitor;
import net.mesonlang.java.syntax.Statement;
import net.mesonlang.java.syntax.SyntaxError;

/**
 * An {@link AstInterpreter} that recovers the static metadata of a project: the project
 * declaration, the build targets and the external dependencies, without configuring a build.
 *
 * <p>A top-level project also analyzes each directory of its subprojects directory as a project
 * of its own.
 */
public class IntrospectionInterpreter extends AstInterpreter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Functions that declare a build target. */
  public static final ImmutableSet<String> TARGET_FUNCTIONS =
      ImmutableSet.of(
          "executable",
          "static_library",
          "shared_library",
          "library",
          "both_libraries",
          "shared_module",
          "jar",
          "build_target",
          "custom_target",
          "run_target");

  private final boolean isSubproject;

  // Set by project().
  @Nullable private ProjectInfo declared;
  private final Set<String> languages = new LinkedHashSet<>();
  private final List<ProjectInfo> subprojects = new ArrayList<>();

  private final List<BuildTarget> targets = new ArrayList<>();
  private final List<Dependency> dependencies = new ArrayList<>();
  private final List<String> subprojectCalls = new ArrayList<>();

  public IntrospectionInterpreter(
      SourceFileAccessor files, InterpreterOptions options, List<? extends NodeVisitor> visitors) {
    this(files, options, "", visitors, false);
  }

  private IntrospectionInterpreter(
      SourceFileAccessor files,
      InterpreterOptions options,
      String rootDir,
      List<? extends NodeVisitor> visitors,
      boolean isSubproject) {
    super(files, options, rootDir, visitors);
    this.isSubproject = isSubproject;
  }

  /**
   * Reads and interprets the project.
   *
   * @throws IOException if the root build file cannot be read
   * @throws SyntaxError.Exception if the root build file has syntax errors
   */
  public void analyze() throws IOException, SyntaxError.Exception {
    run();
  }

  @Override
  public void run(BuildFile file) {
    ImmutableList<Statement> stmts = file.getStatements();
    if (stmts.isEmpty()
        || !(stmts.get(0) instanceof ExpressionStatement first)
        || !(first.getExpression() instanceof CallExpression call)
        || !call.getFunctionName().equals("project")) {
      Location loc =
          stmts.isEmpty() ? file.getRoot().getStartLocation() : stmts.get(0).getStartLocation();
      addDiagnostic(Diagnostic.error(loc, "First statement must be a call to project()"));
    }
    super.run(file);
  }

  /** Returns the project declaration, or null if there was no valid {@code project()} call. */
  @Nullable
  public ProjectInfo getProject() {
    if (declared == null) {
      return null;
    }
    ProjectInfo.Builder b =
        ProjectInfo.builder()
            .setName(declared.name())
            .setVersion(declared.version())
            .setLicenses(declared.licenses())
            .setDefaultOptions(declared.defaultOptions())
            .setDirectory(getRootDir());
    b.languagesBuilder().addAll(languages);
    b.subprojectsBuilder().addAll(subprojects);
    return b.build();
  }

  /** Returns the build targets, in the order they were declared. */
  public ImmutableList<BuildTarget> getTargets() {
    return ImmutableList.copyOf(targets);
  }

  /** Returns the dependencies, in the order they were looked up. */
  public ImmutableList<Dependency> getDependencies() {
    return ImmutableList.copyOf(dependencies);
  }

  /** Returns the names passed to {@code subproject()}, in call order. */
  public ImmutableList<String> getSubprojectCalls() {
    return ImmutableList.copyOf(subprojectCalls);
  }

  @Override
  protected Object callFunction(
      CallExpression call, ImmutableList<Object> positional, ImmutableMap<String, Object> named)
      throws InterpretationException {
    String name = call.getFunctionName();
    if (name.equals("project")) {
      project(call, positional, named);
    } else if (name.equals("add_languages")) {
      addLanguages(flattenValues(positional, false));
    } else if (name.equals("dependency")) {
      dependency(call, positional, named);
    } else if (name.equals("subproject")) {
      String sub = firstString(positional);
      if (sub != null) {
        subprojectCalls.add(sub);
      }
    } else if (TARGET_FUNCTIONS.contains(name)) {
      return target(call, positional, named);
    }
    return super.callFunction(call, positional, named);
  }

  private void project(
      CallExpression call, ImmutableList<Object> positional, ImmutableMap<String, Object> named)
      throws InterpretationException {
    if (declared != null) {
      warn(call, "project() called more than once; ignoring");
      return;
    }
    String projectName = firstString(positional);
    if (projectName == null) {
      error(call, "Not enough arguments to project(). Needs at least the project name.");
      throw new InterpretationException("project() requires a name");
    }
    Object version = named.get("version");
    declared =
        ProjectInfo.builder()
            .setName(projectName)
            .setVersion(version instanceof String v ? v : "undefined")
            .setLicenses(strings(named.get("license")))
            .setDefaultOptions(optionsDict(strings(named.get("default_options"))))
            .setDirectory(getRootDir())
            .build();
    addLanguages(flattenValues(positional.subList(1, positional.size()), false));

    if (!isSubproject && getOptions().scanSubprojects()) {
      String dir = getOptions().subprojectDir();
      if (named.get("subproject_dir") instanceof String d) {
        dir = d;
      }
      scanSubprojects(joinPath(getRootDir(), dir));
    }
  }

  private void scanSubprojects(String dir) {
    ImmutableList<String> names;
    try {
      names = getFileAccessor().listDirectories(dir);
    } catch (IOException ex) {
      logger.atFine().log("no subprojects directory %s: %s", dir, ex.getMessage());
      return;
    }
    for (String name : names) {
      IntrospectionInterpreter sub =
          new IntrospectionInterpreter(
              getFileAccessor(), getOptions(), joinPath(dir, name), getVisitors(), true);
      try {
        sub.analyze();
      } catch (IOException | SyntaxError.Exception ex) {
        addDiagnostic(
            Diagnostic.warning(
                Location.fromFile(joinPath(dir, name)),
                "Unable to analyze subproject " + name + ": " + ex.getMessage()));
        continue;
      }
      sub.getDiagnostics().forEach(this::addDiagnostic);
      ProjectInfo info = sub.getProject();
      if (info != null) {
        subprojects.add(info);
      }
    }
  }

  private void addLanguages(List<Object> langs) {
    for (Object lang : langs) {
      if (lang instanceof String s) {
        languages.add(Ascii.toLowerCase(s));
      }
    }
  }

  private void dependency(
      CallExpression call, ImmutableList<Object> positional, ImmutableMap<String, Object> named) {
    Object required = named.get("required");
    dependencies.add(
        Dependency.create(
            firstString(positional),
            strings(named.get("version")),
            required == null || Boolean.TRUE.equals(required),
            isConditional(),
            call));
  }

  private Object target(
      CallExpression call, ImmutableList<Object> positional, ImmutableMap<String, Object> named) {
    String name = call.getFunctionName();
    String kind = name;
    if (name.equals("build_target") && named.get("target_type") instanceof String type) {
      kind = type;
    }
    List<Object> sources = new ArrayList<>();
    if (positional.size() > 1) {
      sources.addAll(positional.subList(1, positional.size()));
    }
    for (String key : ImmutableList.of("sources", "input")) {
      if (named.containsKey(key)) {
        sources.add(named.get(key));
      }
    }
    targets.add(
        BuildTarget.create(
            firstString(positional),
            kind,
            getSubdir(),
            strings(sources),
            named,
            isConditional(),
            call));
    return new ObjectPlaceholder(name, firstString(positional), call);
  }

  /** Returns the strings in a value, flattening arrays and dropping everything else. */
  private static ImmutableList<String> strings(@Nullable Object value) {
    if (value == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> out = ImmutableList.builder();
    for (Object x : flattenValues(ImmutableList.of(value), false)) {
      if (x instanceof String s) {
        out.add(s);
      }
    }
    return out.build();
  }

  /** Parses {@code name=value} strings; a later setting of a name wins. */
  private static ImmutableMap<String, String> optionsDict(List<String> settings) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String setting : settings) {
      int eq = setting.indexOf('=');
      if (eq > 0) {
        result.put(setting.substring(0, eq).trim(), setting.substring(eq + 1).trim());
      }
    }
    return ImmutableMap.copyOf(result);
  }
}
