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
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.cmdrdata.core.CallContext;
import com.cmdrdata.core.CallOptions;
import com.cmdrdata.core.CustomerContext;
import com.cmdrdata.core.CustomerId;
import com.cmdrdata.core.ErrorInfo;
import com.cmdrdata.core.ErrorKind;
import com.cmdrdata.core.UsageEvent;
import com.cmdrdata.core.UsageSink;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.GenerateContentResponseUsageMetadata;

/**
 * Unit tests for GenerateContentExtractor.
 */
@ExtendWith(MockitoExtension.class)
class GenerateContentExtractorTest {

  private static final Instant START = Instant.parse("2025-06-01T10:00:00Z");

  @Mock
  private UsageSink sink;

  private final List<UsageEvent> events = new ArrayList<>();
  private final GenerateContentExtractor extractor = new GenerateContentExtractor();

  /**
   * A response shaped like the SDK's, with a candidate.
   */
  public static class FakeCandidate {
    public Optional<String> finishReason() {
      return Optional.of("STOP");
    }

    public Optional<List<String>> safetyRatings() {
      return Optional.of(List.of("HARM_CATEGORY_HARASSMENT:NEGLIGIBLE"));
    }
  }

  public static class FakeResponse {
    public Optional<GenerateContentResponseUsageMetadata> usageMetadata() {
      return Optional.of(GenerateContentResponseUsageMetadata.builder().promptTokenCount(3).candidatesTokenCount(4)
          .build());
    }

    public Optional<List<FakeCandidate>> candidates() {
      return Optional.of(List.of(new FakeCandidate()));
    }
  }

  @AfterEach
  void tearDown() {
    CustomerContext.clear();
  }

  private void captureEvents() {
    doAnswer(invocation -> events.add(invocation.getArgument(0))).when(sink).recordUsage(any());
  }

  private static CallContext.Builder context(CallOptions options, Object... args) {
    return CallContext.builder().requestId("req-1").methodPath(GeminiTracking.GENERATE_CONTENT)
        .args(new ArrayList<>(List.of(args))).options(options).startTime(START).endTime(START.plusMillis(300));
  }

  private static GenerateContentResponse response(int prompt, int candidates) {
    return GenerateContentResponse.builder().responseId("resp-42").modelVersion("gemini-2.0-flash-001")
        .usageMetadata(GenerateContentResponseUsageMetadata.builder().promptTokenCount(prompt)
            .candidatesTokenCount(candidates).totalTokenCount(prompt + candidates).build())
        .build();
  }

  @Test
  void testRecordsPromptAndCandidateTokens() {
    captureEvents();

    extractor.extract(response(15, 25), context(CallOptions.forCustomer("customer-123"), "gemini-2.0-flash")
        .build(), sink);

    assertEquals(1, events.size());
    UsageEvent event = events.get(0);
    assertEquals("customer-123", event.getCustomerId());
    assertEquals("google", event.getProvider());
    assertEquals("gemini-2.0-flash", event.getModel());
    assertEquals("google/gemini-2.0-flash", event.getOperationId());
    assertEquals(15, event.getInputTokens());
    assertEquals(25, event.getOutputTokens());
    assertEquals(40, event.getTotalTokens());
    assertEquals("resp-42", event.getMetadata().get("response_id"));
    assertEquals("gemini-2.0-flash-001", event.getMetadata().get("model_version"));
    assertEquals("req-1", event.getRequestId());
    assertEquals(300L, event.getLatencyMs());
    assertFalse(event.isErrorOccurred());
  }

  @Test
  void testResponseWithoutUsageRecordsNothing() {
    GenerateContentResponse response = GenerateContentResponse.builder().responseId("resp-1").build();

    extractor.extract(response, context(CallOptions.forCustomer("customer-123"), "gemini-2.0-flash").build(), sink);

    verifyNoInteractions(sink);
  }

  @Test
  void testModelsPrefixIsStripped() {
    captureEvents();
    CallContext context = context(CallOptions.forCustomer("c")).keywordArgs(Map.of("model", "models/gemini-pro"))
        .build();

    extractor.extract(response(1, 1), context, sink);

    assertEquals("gemini-pro", events.get(0).getModel());
  }

  @Test
  void testFailureRecordsErrorWithZeroTokens() {
    captureEvents();
    CallContext context = context(CallOptions.forCustomer("c"), "gemini-pro")
        .error(new ErrorInfo(ErrorKind.TRANSPORT_ERROR, "429", "quota exceeded")).build();

    extractor.extract(null, context, sink);

    UsageEvent event = events.get(0);
    assertTrue(event.isErrorOccurred());
    assertEquals(ErrorKind.TRANSPORT_ERROR, event.getErrorType());
    assertEquals("429", event.getErrorCode());
    assertEquals("quota exceeded", event.getErrorMessage());
    assertEquals(0, event.getInputTokens());
    assertEquals(0, event.getOutputTokens());
  }

  @Test
  void testMissingCustomerRecordsNothing() {
    extractor.extract(response(1, 1), context(CallOptions.defaults(), "gemini-pro").build(), sink);

    verifyNoInteractions(sink);
  }

  @Test
  void testExplicitNoneDoesNotFallBackToAmbientCustomer() {
    CustomerContext.set("ambient");
    CallOptions options = CallOptions.builder().customerId(CustomerId.none()).build();

    extractor.extract(response(1, 1), context(options, "gemini-pro").build(), sink);

    verifyNoInteractions(sink);
  }

  @Test
  void testAmbientCustomerIsUsedWhenUnset() {
    captureEvents();
    CustomerContext.set("ambient");

    extractor.extract(response(1, 1), context(CallOptions.defaults(), "gemini-pro").build(), sink);

    assertEquals("ambient", events.get(0).getCustomerId());
  }

  @Test
  void testCallerMetadataWins() {
    captureEvents();
    CallOptions options = CallOptions.builder().customerId("c")
        .metadata(Map.of("response_id", "override", "team", "search")).build();

    extractor.extract(response(1, 1), context(options, "gemini-pro").build(), sink);

    Map<String, Object> metadata = events.get(0).getMetadata();
    assertEquals("override", metadata.get("response_id"));
    assertEquals("search", metadata.get("team"));
  }

  @Test
  void testFirstCandidateContributesFinishReasonAndSafetyRatings() {
    captureEvents();

    extractor.extract(new FakeResponse(), context(CallOptions.forCustomer("c"), "gemini-pro").build(), sink);

    UsageEvent event = events.get(0);
    assertEquals(3, event.getInputTokens());
    assertEquals(4, event.getOutputTokens());
    assertNull(event.getTotalTokens());
    assertEquals("STOP", event.getMetadata().get("finish_reason"));
    assertEquals(List.of("HARM_CATEGORY_HARASSMENT:NEGLIGIBLE"), event.getMetadata().get("safety_ratings"));
  }

  @Test
  void testSinkFailureIsContained() {
    doThrow(new IllegalStateException("sink down")).when(sink).recordUsage(any());

    assertDoesNotThrow(() -> extractor.extract(response(1, 1),
        context(CallOptions.forCustomer("c"), "gemini-pro").build(), sink));
  }

  @Test
  void testFailureHasNoCountTokensOperation() {
    captureEvents();
    CallContext context = context(CallOptions.forCustomer("c"), "gemini-pro")
        .error(new ErrorInfo(ErrorKind.SDK_ERROR, null, "bad request")).build();

    extractor.extract(null, context, sink);

    assertFalse(events.get(0).getMetadata().containsKey("operation"));
  }

  @Test
  void testSinkErrorIsContained() {
    doThrow(new OutOfMemoryError("sink exhausted")).when(sink).recordUsage(any());

    assertDoesNotThrow(() -> extractor.extract(response(1, 1),
        context(CallOptions.forCustomer("c"), "gemini-pro").build(), sink));
  }

  @Test
  void testCustomResolver() {
    captureEvents();
    GenerateContentExtractor tenantExtractor = new GenerateContentExtractor(override -> "tenant-7");

    tenantExtractor.extract(response(2, 3), context(CallOptions.defaults(), "gemini-pro").build(), sink);

    assertEquals("tenant-7", events.get(0).getCustomerId());
  }
}
