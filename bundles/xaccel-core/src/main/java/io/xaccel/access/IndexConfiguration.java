/*
 * Copyright (c) 2023, Sirix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.xaccel.access;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.xaccel.exception.XAccelIOException;
import io.xaccel.settings.Fixed;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Holds the settings of an index build. Instances are immutable and created through a
 * {@link Builder}.
 */
public final class IndexConfiguration {

  /**
   * System property to configure the default backend, {@code interval} or {@code adjacency}.
   */
  public static final String BACKEND_PROPERTY = "xaccel.backend";

  /** Default number of randomly sampled context nodes during verification. */
  public static final int DEFAULT_VERIFICATION_SAMPLE_SIZE = 100;

  /** Default seed of the verification sampling. */
  public static final long DEFAULT_VERIFICATION_SEED = 42L;

  /** Child tags of DBLP publications which are not turned into nodes by default. */
  public static final ImmutableSet<String> DEFAULT_SKIPPED_FIELDS = ImmutableSet.of("mdate", "orcid");

  private final BackendKind backendKind;

  private final int numberingOrigin;

  private final boolean windowPruning;

  private final boolean verifyOnBuild;

  private final int verificationSampleSize;

  private final long verificationSeed;

  private final ImmutableSet<String> skippedFields;

  private IndexConfiguration(final Builder builder) {
    backendKind = builder.backendKind;
    numberingOrigin = builder.numberingOrigin;
    windowPruning = builder.windowPruning;
    verifyOnBuild = builder.verifyOnBuild;
    verificationSampleSize = builder.verificationSampleSize;
    verificationSeed = builder.verificationSeed;
    skippedFields = builder.skippedFields;
  }

  /**
   * Get the default configuration.
   *
   * @return configuration with all defaults
   */
  public static IndexConfiguration defaults() {
    return new Builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Get a builder initialized with the settings of this configuration.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder().backend(backendKind)
                        .numberingOrigin(numberingOrigin)
                        .windowPruning(windowPruning)
                        .verifyOnBuild(verifyOnBuild)
                        .verificationSampleSize(verificationSampleSize)
                        .verificationSeed(verificationSeed)
                        .skippedFields(skippedFields);
  }

  public BackendKind getBackendKind() {
    return backendKind;
  }

  public int getNumberingOrigin() {
    return numberingOrigin;
  }

  public boolean isWindowPruning() {
    return windowPruning;
  }

  public boolean isVerifyOnBuild() {
    return verifyOnBuild;
  }

  public int getVerificationSampleSize() {
    return verificationSampleSize;
  }

  public long getVerificationSeed() {
    return verificationSeed;
  }

  public ImmutableSet<String> getSkippedFields() {
    return skippedFields;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof IndexConfiguration other)) {
      return false;
    }
    return backendKind == other.backendKind && numberingOrigin == other.numberingOrigin
        && windowPruning == other.windowPruning && verifyOnBuild == other.verifyOnBuild
        && verificationSampleSize == other.verificationSampleSize && verificationSeed == other.verificationSeed
        && skippedFields.equals(other.skippedFields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(backendKind, numberingOrigin, windowPruning, verifyOnBuild, verificationSampleSize,
        verificationSeed, skippedFields);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("backend", backendKind)
                      .add("numberingOrigin", numberingOrigin)
                      .add("windowPruning", windowPruning)
                      .add("verifyOnBuild", verifyOnBuild)
                      .add("verificationSampleSize", verificationSampleSize)
                      .add("verificationSeed", verificationSeed)
                      .add("skippedFields", skippedFields)
                      .toString();
  }

  /**
   * Serializing a {@link IndexConfiguration} to a json file.
   *
   * @param config to be serialized
   * @param file the target file
   * @throws XAccelIOException if an I/O error occurs
   */
  public static void serialize(final IndexConfiguration config, final Path file) throws XAccelIOException {
    try (final Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        final JsonWriter jsonWriter = new JsonWriter(writer)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name("backend").value(config.backendKind.name());
      jsonWriter.name("numberingOrigin").value(config.numberingOrigin);
      jsonWriter.name("windowPruning").value(config.windowPruning);
      jsonWriter.name("verifyOnBuild").value(config.verifyOnBuild);
      jsonWriter.name("verificationSampleSize").value(config.verificationSampleSize);
      jsonWriter.name("verificationSeed").value(config.verificationSeed);
      jsonWriter.name("skippedFields").beginArray();
      for (final String field : config.skippedFields) {
        jsonWriter.value(field);
      }
      jsonWriter.endArray();
      jsonWriter.endObject();
    } catch (final IOException e) {
      throw new XAccelIOException(e);
    }
  }

  /**
   * Generate an {@link IndexConfiguration} out of a json file. Settings missing in the file keep
   * their default.
   *
   * @param file the json file
   * @return a new {@link IndexConfiguration}
   * @throws XAccelIOException if an I/O error occurs or the file is malformed
   */
  public static IndexConfiguration deserialize(final Path file) throws XAccelIOException {
    try (final Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        final JsonReader jsonReader = new JsonReader(reader)) {
      final Builder builder = new Builder();
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        switch (name) {
          case "backend" -> builder.backend(BackendKind.fromString(jsonReader.nextString()));
          case "numberingOrigin" -> builder.numberingOrigin(jsonReader.nextInt());
          case "windowPruning" -> builder.windowPruning(jsonReader.nextBoolean());
          case "verifyOnBuild" -> builder.verifyOnBuild(jsonReader.nextBoolean());
          case "verificationSampleSize" -> builder.verificationSampleSize(jsonReader.nextInt());
          case "verificationSeed" -> builder.verificationSeed(jsonReader.nextLong());
          case "skippedFields" -> {
            final ImmutableSet.Builder<String> fields = ImmutableSet.builder();
            jsonReader.beginArray();
            while (jsonReader.hasNext()) {
              fields.add(jsonReader.nextString());
            }
            jsonReader.endArray();
            builder.skippedFields(fields.build());
          }
          default -> jsonReader.skipValue();
        }
      }
      jsonReader.endObject();
      return builder.build();
    } catch (final IOException | IllegalArgumentException | IllegalStateException e) {
      throw new XAccelIOException("Failed to read index configuration from " + file, e);
    }
  }

  /**
   * Builder to build an {@link IndexConfiguration} instance.
   */
  public static final class Builder {

    private BackendKind backendKind = defaultBackend();

    private int numberingOrigin = (int) Fixed.DEFAULT_NUMBERING_ORIGIN.getStandardProperty();

    private boolean windowPruning = true;

    private boolean verifyOnBuild;

    private int verificationSampleSize = DEFAULT_VERIFICATION_SAMPLE_SIZE;

    private long verificationSeed = DEFAULT_VERIFICATION_SEED;

    private ImmutableSet<String> skippedFields = DEFAULT_SKIPPED_FIELDS;

    private static BackendKind defaultBackend() {
      final String property = System.getProperty(BACKEND_PROPERTY);
      return property == null || property.isBlank() ? BackendKind.INTERVAL : BackendKind.fromString(property);
    }

    /**
     * Select the backend which answers axis queries.
     *
     * @param backendKind the backend
     * @return this builder instance
     */
    public Builder backend(final BackendKind backendKind) {
      this.backendKind = requireNonNull(backendKind);
      return this;
    }

    /**
     * Set the first pre- and post-order rank (default: 1).
     *
     * @param origin {@code 0} or {@code 1}
     * @return this builder instance
     */
    public Builder numberingOrigin(final int origin) {
      checkArgument(origin == 0 || origin == 1, "Numbering origin must be 0 or 1!");
      numberingOrigin = origin;
      return this;
    }

    /**
     * Narrow interval scans by level and subtree size (default: yes).
     *
     * @param windowPruning enable pruning
     * @return this builder instance
     */
    public Builder windowPruning(final boolean windowPruning) {
      this.windowPruning = windowPruning;
      return this;
    }

    /**
     * Cross-check both backends right after building (default: no).
     *
     * @param verifyOnBuild enable verification
     * @return this builder instance
     */
    public Builder verifyOnBuild(final boolean verifyOnBuild) {
      this.verifyOnBuild = verifyOnBuild;
      return this;
    }

    public Builder verificationSampleSize(final int sampleSize) {
      checkArgument(sampleSize >= 0, "Sample size must be >= 0!");
      verificationSampleSize = sampleSize;
      return this;
    }

    public Builder verificationSeed(final long seed) {
      verificationSeed = seed;
      return this;
    }

    /**
     * Set the DBLP publication child tags which are not turned into nodes.
     *
     * @param fields tag names
     * @return this builder instance
     */
    public Builder skippedFields(final Set<String> fields) {
      skippedFields = ImmutableSet.copyOf(fields);
      return this;
    }

    public IndexConfiguration build() {
      return new IndexConfiguration(this);
    }
  }
}
