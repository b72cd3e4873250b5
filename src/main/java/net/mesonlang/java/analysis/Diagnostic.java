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
import java.util.Locale;
import net.mesonlang.java.syntax.Location;

/** A non-fatal problem found while interpreting build files. */
@AutoValue
public abstract class Diagnostic {

  /** How serious a diagnostic is. */
  public enum Severity {
    WARNING,
    ERROR;

    @Override
    public String toString() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public abstract Severity severity();

  public abstract Location location();

  public abstract String message();

  public static Diagnostic create(Severity severity, Location location, String message) {
    return new AutoValue_Diagnostic(severity, location, message);
  }

  public static Diagnostic warning(Location location, String message) {
    return create(Severity.WARNING, location, message);
  }

  public static Diagnostic error(Location location, String message) {
    return create(Severity.ERROR, location, message);
  }

  @Override
  public final String toString() {
    return location() + ": " + severity() + ": " + message();
  }
}
