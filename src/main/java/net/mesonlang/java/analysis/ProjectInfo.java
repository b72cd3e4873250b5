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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** The metadata declared by the {@code project()} call of a project. */
@AutoValue
public abstract class ProjectInfo {

  /** The descriptive name of the project. */
  public abstract String name();

  /** The version, or "undefined" if none is given or it is not a known string. */
  public abstract String version();

  /** The languages declared by {@code project()} and {@code add_languages()}, lower case. */
  public abstract ImmutableList<String> languages();

  public abstract ImmutableList<String> licenses();

  /** The {@code default_options}, as option name to value. */
  public abstract ImmutableMap<String, String> defaultOptions();

  /** The directory of the project, relative to the top-level project; empty for the latter. */
  public abstract String directory();

  /** The projects found in the subprojects directory of a top-level project. */
  public abstract ImmutableList<ProjectInfo> subprojects();

  static Builder builder() {
    return new AutoValue_ProjectInfo.Builder()
        .setVersion("undefined")
        .setLicenses(ImmutableList.of())
        .setDefaultOptions(ImmutableMap.of())
        .setDirectory("");
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setName(String name);

    abstract Builder setVersion(String version);

    abstract ImmutableList.Builder<String> languagesBuilder();

    abstract Builder setLicenses(ImmutableList<String> licenses);

    abstract Builder setDefaultOptions(ImmutableMap<String, String> options);

    abstract Builder setDirectory(String directory);

    abstract ImmutableList.Builder<ProjectInfo> subprojectsBuilder();

    abstract ProjectInfo build();
  }
}
