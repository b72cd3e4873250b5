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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/** A {@link SourceFileAccessor} for a source tree on the local file system. */
public final class FilesystemFileAccessor implements SourceFileAccessor {

  private final Path root;

  public FilesystemFileAccessor(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  private Path resolve(String path) {
    return path.isEmpty() ? root : root.resolve(path);
  }

  @Override
  public String canonicalDirectory(String path) throws IOException {
    Path dir = resolve(path).toRealPath();
    if (!Files.isDirectory(dir)) {
      throw new IOException("not a directory: " + dir);
    }
    return dir.toString();
  }

  @Override
  public boolean isFile(String path) {
    return Files.isRegularFile(resolve(path));
  }

  @Override
  public byte[] readFile(String path) throws IOException {
    return Files.readAllBytes(resolve(path));
  }

  @Override
  public ImmutableList<String> listDirectories(String path) throws IOException {
    try (Stream<Path> entries = Files.list(resolve(path))) {
      return entries
          .filter(Files::isDirectory)
          .map(p -> p.getFileName().toString())
          .sorted()
          .collect(ImmutableList.toImmutableList());
    }
  }

  @Override
  public String toString() {
    return root.toString();
  }
}
