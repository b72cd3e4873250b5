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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.mesonlang.java.analysis.BuildTarget;
import net.mesonlang.java.analysis.Dependency;
import net.mesonlang.java.analysis.Diagnostic;
import net.mesonlang.java.analysis.IntrospectionInterpreter;
import net.mesonlang.java.analysis.ProjectInfo;
import net.mesonlang.java.eval.ObjectPlaceholder;

/** Renders the results of introspection as JSON. Unknown values are rendered as null. */
final class IntrospectionJson {

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  private IntrospectionJson() {}

  static String toJson(IntrospectionInterpreter interp) {
    JsonObject root = new JsonObject();
    ProjectInfo project = interp.getProject();
    root.add("project", project == null ? JsonNull.INSTANCE : project(project));
    JsonArray targets = new JsonArray();
    for (BuildTarget t : interp.getTargets()) {
      targets.add(target(t));
    }
    root.add("targets", targets);
    JsonArray deps = new JsonArray();
    for (Dependency d : interp.getDependencies()) {
      deps.add(dependency(d));
    }
    root.add("dependencies", deps);
    JsonArray diagnostics = new JsonArray();
    for (Diagnostic d : interp.getDiagnostics()) {
      diagnostics.add(d.toString());
    }
    root.add("diagnostics", diagnostics);
    return GSON.toJson(root);
  }

  private static JsonObject project(ProjectInfo p) {
    JsonObject obj = new JsonObject();
    obj.addProperty("name", p.name());
    obj.addProperty("version", p.version());
    obj.add("languages", strings(p.languages()));
    obj.add("licenses", strings(p.licenses()));
    JsonObject options = new JsonObject();
    p.defaultOptions().forEach(options::addProperty);
    obj.add("default_options", options);
    obj.addProperty("directory", p.directory());
    JsonArray subprojects = new JsonArray();
    for (ProjectInfo sub : p.subprojects()) {
      subprojects.add(project(sub));
    }
    obj.add("subprojects", subprojects);
    return obj;
  }

  private static JsonObject target(BuildTarget t) {
    JsonObject obj = new JsonObject();
    obj.addProperty("name", t.name());
    obj.addProperty("type", t.kind());
    obj.addProperty("subdir", t.subdir());
    obj.add("sources", strings(t.sources()));
    JsonObject kwargs = new JsonObject();
    t.keywordArguments().forEach((k, v) -> kwargs.add(k, value(v)));
    obj.add("keyword_arguments", kwargs);
    obj.addProperty("conditional", t.conditional());
    obj.addProperty("location", t.node().getStartLocation().toString());
    return obj;
  }

  private static JsonObject dependency(Dependency d) {
    JsonObject obj = new JsonObject();
    obj.addProperty("name", d.name());
    obj.add("version", strings(d.versionConstraints()));
    obj.addProperty("required", d.required());
    obj.addProperty("conditional", d.conditional());
    obj.addProperty("location", d.node().getStartLocation().toString());
    return obj;
  }

  private static JsonArray strings(List<String> list) {
    JsonArray array = new JsonArray();
    list.forEach(array::add);
    return array;
  }

  /** Converts a resolved value to JSON. */
  static JsonElement value(@Nullable Object v) {
    if (v instanceof String s) {
      return new JsonPrimitive(s);
    } else if (v instanceof Long n) {
      return new JsonPrimitive(n);
    } else if (v instanceof Boolean b) {
      return new JsonPrimitive(b);
    } else if (v instanceof List<?> list) {
      JsonArray array = new JsonArray();
      for (Object x : list) {
        array.add(value(x));
      }
      return array;
    } else if (v instanceof Map<?, ?> map) {
      JsonObject obj = new JsonObject();
      map.forEach((k, x) -> obj.add(k.toString(), value(x)));
      return obj;
    } else if (v instanceof ObjectPlaceholder placeholder) {
      JsonObject obj = new JsonObject();
      obj.addProperty("object", placeholder.getKind());
      obj.addProperty("name", placeholder.getName());
      return obj;
    }
    return JsonNull.INSTANCE;
  }
}
