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

import com.google.common.collect.ImmutableSet;
import io.xaccel.exception.XAccelIOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the {@link IndexConfiguration} and its json representation.
 */
public final class IndexConfigurationTest {

  @TempDir
  Path directory;

  @Test
  public void testDefaults() {
    final IndexConfiguration config = IndexConfiguration.builder().backend(BackendKind.INTERVAL).build();
    assertEquals(1, config.getNumberingOrigin());
    assertTrue(config.isWindowPruning());
    assertFalse(config.isVerifyOnBuild());
    assertEquals(IndexConfiguration.DEFAULT_VERIFICATION_SAMPLE_SIZE, config.getVerificationSampleSize());
    assertEquals(ImmutableSet.of("mdate", "orcid"), config.getSkippedFields());
  }

  @Test
  public void testSerializeAndDeserialize() throws XAccelIOException {
    final IndexConfiguration config = IndexConfiguration.builder()
                                                        .backend(BackendKind.ADJACENCY)
                                                        .numberingOrigin(0)
                                                        .windowPruning(false)
                                                        .verifyOnBuild(true)
                                                        .verificationSampleSize(10)
                                                        .verificationSeed(-3L)
                                                        .skippedFields(ImmutableSet.of("ee"))
                                                        .build();
    final Path file = directory.resolve("index.json");
    IndexConfiguration.serialize(config, file);
    assertEquals(config, IndexConfiguration.deserialize(file));
    assertEquals(config, config.toBuilder().build());
  }

  @Test
  public void testMissingSettingsKeepDefaults() throws IOException, XAccelIOException {
    final Path file = directory.resolve("partial.json");
    Files.writeString(file, "{\"backend\": \"adjacency\", \"unknown\": [1, 2]}", StandardCharsets.UTF_8);
    final IndexConfiguration config = IndexConfiguration.deserialize(file);
    assertEquals(BackendKind.ADJACENCY, config.getBackendKind());
    assertTrue(config.isWindowPruning());
    assertEquals(IndexConfiguration.DEFAULT_SKIPPED_FIELDS, config.getSkippedFields());
  }

  @Test
  public void testMalformedFile() throws IOException {
    final Path file = directory.resolve("broken.json");
    Files.writeString(file, "{\"backend\": \"btree\"}", StandardCharsets.UTF_8);
    assertThrows(XAccelIOException.class, () -> IndexConfiguration.deserialize(file));
    assertThrows(XAccelIOException.class, () -> IndexConfiguration.deserialize(directory.resolve("missing.json")));
  }

  @Test
  public void testInvalidOrigin() {
    assertThrows(IllegalArgumentException.class, () -> IndexConfiguration.builder().numberingOrigin(5));
  }
}
