/*
 * Copyright 2025 CmdrData
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cmdrdata.plugins.googlegenai;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.cmdrdata.core.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unit tests for VersionCompatibility.
 */
class VersionCompatibilityTest {

  @Test
  void testSupportedVersionHasNoWarnings() {
    VersionCompatibility compatibility = new VersionCompatibility(() -> "1.4.0", 17);

    assertEquals("1.4.0", compatibility.getGenaiVersion());
    assertTrue(compatibility.isGenaiSupported());
    assertTrue(compatibility.isJavaSupported());
    assertTrue(compatibility.getWarnings().isEmpty());
  }

  @Test
  void testMissingLibrary() {
    VersionCompatibility compatibility = new VersionCompatibility(() -> null, 21);

    assertNull(compatibility.getGenaiVersion());
    assertFalse(compatibility.isGenaiSupported());
    assertEquals(1, compatibility.getWarnings().size());
    assertTrue(compatibility.getWarnings().get(0).startsWith("google-genai not found"));
  }

  @Test
  void testVersionBelowMinimum() {
    VersionCompatibility compatibility = new VersionCompatibility(() -> "0.9.0", 17);

    assertFalse(compatibility.isGenaiSupported());
    assertEquals("google-genai version 0.9.0 is below minimum supported version 1.0.0. Please upgrade.",
        compatibility.getWarnings().get(0));
  }

  @Test
  void testNewerThanTestedIsSupportedWithWarning() {
    VersionCompatibility compatibility = new VersionCompatibility(() -> "2.1.0", 17);

    assertTrue(compatibility.isGenaiSupported());
    assertTrue(compatibility.getWarnings().get(0).contains("is newer than tested version 1.99.0"));
  }

  @Test
  void testOldJavaIsReported() {
    VersionCompatibility compatibility = new VersionCompatibility(() -> "1.0.0", 11);

    assertFalse(compatibility.isJavaSupported());
    assertEquals(1, compatibility.getWarnings().size());
    assertTrue(compatibility.getWarnings().get(0).startsWith("Java 11"));
  }

  @Test
  void testCompatibilityInfoJson() {
    CompatibilityInfo info = new VersionCompatibility(() -> "1.2.0", 17).getCompatibilityInfo();

    JsonNode json = JsonUtils.toJsonNode(info);

    assertEquals("google-genai", json.get("library").asText());
    assertEquals("1.2.0", json.get("version").asText());
    assertTrue(json.get("supported").asBoolean());
    assertEquals("1.0.0", json.get("min_version").asText());
    assertEquals("1.99.0", json.get("max_tested_version").asText());
    assertEquals("17", json.get("java_version").asText());
    assertTrue(json.get("java_supported").asBoolean());
  }

  @Test
  void testCompareVersions() {
    assertEquals(0, VersionCompatibility.compareVersions("1.0.0", "1.0"));
    assertTrue(VersionCompatibility.compareVersions("1.10.0", "1.9.3") > 0);
    assertTrue(VersionCompatibility.compareVersions("0.9.9", "1.0.0") < 0);
    assertEquals(0, VersionCompatibility.compareVersions("1.2.0-SNAPSHOT", "1.2.0"));
    assertEquals(0, VersionCompatibility.compareVersions("1.2.0rc1", "1.2.0"));
  }

  @Test
  void testDetectsInstalledLibrary() {
    VersionCompatibility compatibility = new VersionCompatibility();

    assertTrue(compatibility.isJavaSupported());
    assertDoesNotThrow(VersionCompatibility::checkCompatibility);
  }
}
