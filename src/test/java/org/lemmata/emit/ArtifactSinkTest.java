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

import static com.google.common.truth.Truth.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lemmata.build.BuildOptions;
import org.lemmata.build.LogicPackage;
import org.lemmata.build.PackageBuilder;
import org.lemmata.library.Hilbert;

@RunWith(JUnit4.class)
public class ArtifactSinkTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  public void writesIrAndNameMapping() throws Exception {
    PackageBuilder builder = new PackageBuilder();
    LogicPackage pkg = builder.build(Hilbert.spec());
    Path dir = tmp.getRoot().toPath().resolve("out");
    ArtifactSink sink = builder.newSink(dir);
    builder.write(pkg, sink);

    Path ir = dir.resolve("hilbert.ir.json");
    Path names = dir.resolve("hilbert.names.json");
    assertThat(sink.written()).containsExactly(ir, names).inOrder();

    JsonNode irJson = mapper.readTree(Files.readString(ir, StandardCharsets.UTF_8));
    assertThat(irJson.get("package").asText()).isEqualTo("hilbert");
    assertThat(irJson.get("statements").size()).isEqualTo(pkg.assertions.size());

    JsonNode namesJson = mapper.readTree(Files.readString(names, StandardCharsets.UTF_8));
    assertThat(namesJson.get("→").asText()).isEqualTo("->");
    assertThat(namesJson.get("φ").asText()).isEqualTo("ph");
    assertThat(Files.exists(dir.resolve("hilbert.ir.json.tmp"))).isFalse();
  }

  @Test
  public void indentation() throws Exception {
    PackageBuilder builder =
        new PackageBuilder(BuildOptions.builder().indentArtifacts(true).build());
    ArtifactSink sink = builder.newSink(tmp.getRoot().toPath());
    Path path = sink.writeNameMapping("m", ImmutableMap.of("→", "->"));
    String text = Files.readString(path, StandardCharsets.UTF_8);
    assertThat(text).contains("\n");
    assertThat(mapper.readTree(text).get("→").asText()).isEqualTo("->");
    assertThat(ArtifactSink.render(ImmutableMap.of("a", "b"), false)).isEqualTo("{\"a\":\"b\"}");
  }

  @Test
  public void concurrentWritesToOnePath() throws Exception {
    IrArtifact ir = new PackageBuilder().build(Hilbert.spec()).toIr();
    ArtifactSink sink = new ArtifactSink(tmp.getRoot().toPath(), false);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<Path>> results = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        results.add(executor.submit(() -> sink.writeIr(ir)));
      }
      for (Future<Path> result : results) {
        result.get();
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(sink.written()).hasSize(1);
    Path path = sink.written().iterator().next();
    assertThat(Files.readString(path, StandardCharsets.UTF_8))
        .isEqualTo(ArtifactSink.render(ir, false));
  }
}
