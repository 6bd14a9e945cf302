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
package org.lemmata.build;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The labels visible to a build, each with the package that defines it. Labels are unique across
 * a package and its transitive imports; reaching the same upstream label through two import paths
 * is not a collision.
 */
final class LabelSpace {
  private final String packageName;
  private final Map<String, String> origins = new LinkedHashMap<>();

  LabelSpace(String packageName) {
    this.packageName = packageName;
  }

  /** Records an upstream label; fails if a different package has already defined it. */
  void claimImported(String label, String origin) {
    String prev = origins.putIfAbsent(label, origin);
    if (prev != null && !prev.equals(origin)) {
      throw duplicate(label, prev, origin);
    }
  }

  /** Records a label defined by this package; fails if the label has been seen before. */
  void claimOwn(String label) {
    String prev = origins.putIfAbsent(label, packageName);
    if (prev != null) {
      throw duplicate(label, prev, packageName);
    }
  }

  private ExportPolicyError duplicate(String label, String prev, String origin) {
    return new ExportPolicyError(
        ExportPolicyError.Kind.DUPLICATE_LABEL,
        packageName,
        label,
        String.format("'%s' is defined by both %s and %s", label, prev, origin));
  }

  ImmutableMap<String, String> origins() {
    return ImmutableMap.copyOf(origins);
  }
}
