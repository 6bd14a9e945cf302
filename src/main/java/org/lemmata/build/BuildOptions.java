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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Properties;
import org.lemmata.symbol.ResolutionPolicy;

/** Settings that affect how packages are built and how their artifacts are written. */
public final class BuildOptions {
  /** The property that sets {@link #resolutionPolicy}: {@code strict} or {@code permissive}. */
  public static final String RESOLUTION_POLICY = "lemmata.resolutionPolicy";

  /** The property that sets {@link #indentArtifacts}: {@code true} or {@code false}. */
  public static final String INDENT_ARTIFACTS = "lemmata.indentArtifacts";

  public static final BuildOptions DEFAULT = builder().build();

  public final ResolutionPolicy resolutionPolicy;

  /** If true, JSON artifacts are pretty-printed. */
  public final boolean indentArtifacts;

  private BuildOptions(Builder builder) {
    this.resolutionPolicy = builder.resolutionPolicy;
    this.indentArtifacts = builder.indentArtifacts;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options read from {@code properties}; settings that are not present keep their default
   * values.
   */
  public static BuildOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String policy = properties.getProperty(RESOLUTION_POLICY);
    if (policy != null) {
      Optional<ResolutionPolicy> parsed =
          Enums.getIfPresent(ResolutionPolicy.class, Ascii.toUpperCase(policy.trim()));
      checkArgument(parsed.isPresent(), "Invalid %s: '%s'", RESOLUTION_POLICY, policy);
      builder.resolutionPolicy(parsed.get());
    }
    String indent = properties.getProperty(INDENT_ARTIFACTS);
    if (indent != null) {
      String value = Ascii.toLowerCase(indent.trim());
      checkArgument(
          value.equals("true") || value.equals("false"),
          "Invalid %s: '%s'",
          INDENT_ARTIFACTS,
          indent);
      builder.indentArtifacts(value.equals("true"));
    }
    return builder.build();
  }

  public static BuildOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  public Builder toBuilder() {
    return builder().resolutionPolicy(resolutionPolicy).indentArtifacts(indentArtifacts);
  }

  @Override
  public String toString() {
    return String.format(
        "BuildOptions(resolutionPolicy=%s, indentArtifacts=%s)", resolutionPolicy, indentArtifacts);
  }

  /** Accumulates settings for a new BuildOptions. */
  public static final class Builder {
    private ResolutionPolicy resolutionPolicy = ResolutionPolicy.STRICT;
    private boolean indentArtifacts;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder resolutionPolicy(ResolutionPolicy resolutionPolicy) {
      this.resolutionPolicy = resolutionPolicy;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder indentArtifacts(boolean indentArtifacts) {
      this.indentArtifacts = indentArtifacts;
      return this;
    }

    public BuildOptions build() {
      return new BuildOptions(this);
    }
  }
}
