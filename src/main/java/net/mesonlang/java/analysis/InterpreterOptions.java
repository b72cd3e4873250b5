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
import com.google.common.base.Preconditions;

/** Options that control how build files are located and interpreted. */
@AutoValue
public abstract class InterpreterOptions {

  public static final InterpreterOptions DEFAULT = builder().build();

  /** The name of the build file in each directory. */
  public abstract String buildFileName();

  /** The directory, relative to the project root, that holds subprojects. */
  public abstract String subprojectDir();

  /** Whether the introspection interpreter also analyzes each directory under subprojectDir. */
  public abstract boolean scanSubprojects();

  public static Builder builder() {
    return new AutoValue_InterpreterOptions.Builder()
        .buildFileName("meson.build")
        .subprojectDir("subprojects")
        .scanSubprojects(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link InterpreterOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder buildFileName(String name);

    public abstract Builder subprojectDir(String dir);

    public abstract Builder scanSubprojects(boolean scan);

    abstract InterpreterOptions autoBuild();

    public InterpreterOptions build() {
      InterpreterOptions options = autoBuild();
      Preconditions.checkArgument(
          !options.buildFileName().isEmpty() && !options.buildFileName().contains("/"),
          "invalid build file name: %s",
          options.buildFileName());
      return options;
    }
  }
}
