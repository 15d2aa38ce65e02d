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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.genai.types.HttpOptions;

/**
 * Unit tests for TrackedGeminiOptions.
 */
class TrackedGeminiOptionsTest {

  private static TrackedGeminiOptions.Builder builder(Map<String, String> env) {
    return TrackedGeminiOptions.builder(env::get);
  }

  @Test
  void testReadsEnvironment() {
    Map<String, String> env = new HashMap<>();
    env.put("GOOGLE_API_KEY", "google-key");
    env.put("CMDRDATA_API_KEY", "tk-123");
    env.put("CMDRDATA_ENDPOINT", "https://ingest.example.com/events");
    env.put("CMDRDATA_TIMEOUT_MS", "2500");

    TrackedGeminiOptions options = builder(env).build();

    assertEquals("google-key", options.getApiKey());
    assertEquals("tk-123", options.getCmdrdataApiKey());
    assertEquals("https://ingest.example.com/events", options.getCmdrdataEndpoint());
    assertEquals(Duration.ofMillis(2500), options.getTrackingTimeout());
    assertEquals("us-central1", options.getLocation());
    assertFalse(options.isVertexAI());
    assertFalse(options.isMetricsEnabled());
    assertNotNull(options.getCustomerResolver());
  }

  @Test
  void testGeminiApiKeyFallbackAndDefaults() {
    TrackedGeminiOptions options = builder(Map.of("GEMINI_API_KEY", "legacy-key", "CMDRDATA_API_KEY", "tk")).build();

    assertEquals("legacy-key", options.getApiKey());
    assertEquals(TrackedGeminiOptions.DEFAULT_ENDPOINT, options.getCmdrdataEndpoint());
    assertEquals(Duration.ofMillis(TrackedGeminiOptions.DEFAULT_TRACKING_TIMEOUT_MS), options.getTrackingTimeout());
  }

  @Test
  void testGoogleApiKeyTakesPrecedence() {
    TrackedGeminiOptions options = builder(
        Map.of("GOOGLE_API_KEY", "new", "GEMINI_API_KEY", "legacy", "CMDRDATA_API_KEY", "tk")).build();

    assertEquals("new", options.getApiKey());
  }

  @Test
  void testExplicitValuesOverrideEnvironment() {
    TrackedGeminiOptions options = builder(Map.of("GOOGLE_API_KEY", "env-key", "CMDRDATA_API_KEY", "env-tk"))
        .apiKey("explicit-key").cmdrdataApiKey("explicit-tk").trackingTimeout(100).metricsEnabled(true).build();

    assertEquals("explicit-key", options.getApiKey());
    assertEquals("explicit-tk", options.getCmdrdataApiKey());
    assertEquals(Duration.ofMillis(100), options.getTrackingTimeout());
    assertTrue(options.isMetricsEnabled());
  }

  @Test
  void testMissingGoogleKeyFails() {
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> builder(Map.of("CMDRDATA_API_KEY", "tk")).build());

    assertTrue(e.getMessage().startsWith("Google API key is required"));
  }

  @Test
  void testMissingCmdrdataKeyFails() {
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> builder(Map.of("GOOGLE_API_KEY", "k")).build());

    assertTrue(e.getMessage().startsWith("CmdrData API key is required"));
  }

  @Test
  void testVertexAiNeedsProjectOrKey() {
    Map<String, String> env = Map.of("GOOGLE_GENAI_USE_VERTEXAI", "true", "CMDRDATA_API_KEY", "tk");

    assertThrows(IllegalStateException.class, () -> builder(env).build());

    TrackedGeminiOptions options = builder(env).project("my-project").location("europe-west4").build();
    assertTrue(options.isVertexAI());
    assertNull(options.getApiKey());
    assertEquals("my-project", options.getProject());
    assertEquals("europe-west4", options.getLocation());
  }

  @Test
  void testInvalidTrackingTimeout() {
    assertThrows(IllegalStateException.class, () -> builder(
        Map.of("GOOGLE_API_KEY", "k", "CMDRDATA_API_KEY", "tk", "CMDRDATA_TIMEOUT_MS", "soon")));
    assertThrows(IllegalStateException.class,
        () -> builder(Map.of("GOOGLE_API_KEY", "k", "CMDRDATA_API_KEY", "tk")).trackingTimeout(0).build());
  }

  @Test
  void testNullResolverFails() {
    assertThrows(IllegalStateException.class,
        () -> builder(Map.of("GOOGLE_API_KEY", "k", "CMDRDATA_API_KEY", "tk")).customerResolver(null).build());
  }

  @Test
  void testHttpOptions() {
    TrackedGeminiOptions plain = builder(Map.of("GOOGLE_API_KEY", "k", "CMDRDATA_API_KEY", "tk")).build();
    assertNull(plain.toHttpOptions());

    HttpOptions httpOptions = builder(Map.of("GOOGLE_API_KEY", "k", "CMDRDATA_API_KEY", "tk"))
        .apiVersion("v1").baseUrl("http://localhost:9999/").timeout(3000).build().toHttpOptions();
    assertEquals("v1", httpOptions.apiVersion().orElse(null));
    assertEquals("http://localhost:9999/", httpOptions.baseUrl().orElse(null));
    assertEquals(3000, httpOptions.timeout().orElse(null));
  }
}
