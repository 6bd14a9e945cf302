/*
 * Copyright 2025 The Lemmata Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lemmata.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Striped;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes IR and NameMapping artifacts as JSON files.
 *
 * <p>An ArtifactSink may be shared by builds running on different threads. Writes to the same path
 * are serialized, and each file is replaced atomically so readers never see a partial artifact.
 */
public final class ArtifactSink {
  private static final Logger log = LogManager.getLogger(ArtifactSink.class);

  private static final ObjectMapper COMPACT = new ObjectMapper();
  private static final ObjectMapper INDENTED =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Path outputDir;
  private final boolean indent;
  private final Striped<Lock> locks = Striped.lock(16);

  @GuardedBy("this")
  private final Set<Path> written = new LinkedHashSet<>();

  public ArtifactSink(Path outputDir, boolean indent) {
    this.outputDir = outputDir;
    this.indent = indent;
  }

  /** Returns the JSON serialization of an artifact. */
  public static String render(Object artifact, boolean indent) {
    try {
      return (indent ? INDENTED : COMPACT).writeValueAsString(artifact);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Writes {@code ir} to {@code <package>.ir.json} and returns the path written. */
  public Path writeIr(IrArtifact ir) throws IOException {
    return write(ir.packageName + ".ir.json", ir);
  }

  /**
   * Writes a name mapping (from each raw spelling to its canonical spelling) to {@code
   * <package>.names.json} and returns the path written.
   */
  public Path writeNameMapping(String packageName, Map<String, String> mapping)
      throws IOException {
    return write(packageName + ".names.json", mapping);
  }

  /** Returns the paths written so far, in the order they were first written. */
  public synchronized ImmutableSet<Path> written() {
    return ImmutableSet.copyOf(written);
  }

  private Path write(String fileName, Object artifact) throws IOException {
    Path path = outputDir.resolve(fileName).toAbsolutePath().normalize();
    String json = render(artifact, indent);
    Lock lock = locks.get(path);
    lock.lock();
    try {
      Files.createDirectories(path.getParent());
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      Files.writeString(tmp, json, StandardCharsets.UTF_8);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      lock.unlock();
    }
    synchronized (this) {
      written.add(path);
    }
    log.debug("Wrote {} ({} chars)", path, json.length());
    return path;
  }
}
