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

package com.cmdrdata.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.cmdrdata.core.TestClients.StatusException;
import com.cmdrdata.core.TestClients.TickingClock;

/**
 * Unit tests for TrackedMethod.
 */
@ExtendWith(MockitoExtension.class)
class TrackedMethodTest {

  private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

  @Mock
  private UsageExtractor extractor;

  @Mock
  private UsageSink sink;

  @AfterEach
  void tearDown() {
    CustomerContext.clear();
  }

  private TrackedMethod tracked(Invocable delegate) {
    return new TrackedMethod(delegate, "models.generateContent", extractor, sink,
        new TickingClock(START, Duration.ofMillis(40)));
  }

  @Test
  void testSuccessPassesResultAndContext() throws Exception {
    TrackedMethod method = tracked((args, kwargs) -> "result:" + args.get(0));

    Object result = method.invoke(new ArrayList<>(List.of("gemini-pro")), new HashMap<>());

    assertEquals("result:gemini-pro", result);
    ArgumentCaptor<CallContext> captor = ArgumentCaptor.forClass(CallContext.class);
    verify(extractor, times(1)).extract(eq("result:gemini-pro"), captor.capture(), same(sink));
    CallContext context = captor.getValue();
    assertTrue(context.isSuccess());
    assertEquals(START, context.getStartTime());
    assertEquals(START.plusMillis(40), context.getEndTime());
    assertEquals(40, context.getLatencyMs());
    assertEquals(List.of("gemini-pro"), context.getArgs());
    assertNotNull(context.getRequestId());
    assertTrue(context.getCustomerOverride().isUnset());
  }

  @Test
  void testEachCallGetsFreshRequestId() throws Exception {
    TrackedMethod method = tracked((args, kwargs) -> "ok");

    method.call();
    method.call();

    ArgumentCaptor<CallContext> captor = ArgumentCaptor.forClass(CallContext.class);
    verify(extractor, times(2)).extract(any(), captor.capture(), any());
    assertNotEquals(captor.getAllValues().get(0).getRequestId(), captor.getAllValues().get(1).getRequestId());
  }

  @Test
  void testFailureRethrowsSameException() {
    StatusException failure = new StatusException(429, "quota exceeded");
    TrackedMethod method = tracked((args, kwargs) -> {
      throw failure;
    });

    StatusException thrown = assertThrows(StatusException.class, () -> method.call("gemini-pro"));

    assertSame(failure, thrown);
    ArgumentCaptor<CallContext> captor = ArgumentCaptor.forClass(CallContext.class);
    verify(extractor, times(1)).extract(isNull(), captor.capture(), same(sink));
    CallContext context = captor.getValue();
    assertEquals(CallOutcome.FAILURE, context.getOutcome());
    assertEquals(new ErrorInfo(ErrorKind.TRANSPORT_ERROR, "429", "quota exceeded"), context.getError());
  }

  @Test
  void testErrorsAreRethrownUnwrapped() {
    AssertionError failure = new AssertionError("fatal");
    TrackedMethod method = tracked((args, kwargs) -> {
      throw failure;
    });

    assertSame(failure, assertThrows(AssertionError.class, method::call));
    verify(extractor).extract(isNull(), any(), any());
  }

  @Test
  void testExtractorFailureIsSwallowed() throws Exception {
    doThrow(new IllegalStateException("extractor broke")).when(extractor).extract(any(), any(), any());
    TrackedMethod method = tracked((args, kwargs) -> "ok");

    assertEquals("ok", method.call());
  }

  @Test
  void testExtractorErrorIsSwallowed() throws Exception {
    doThrow(new AssertionError("extractor bug")).when(extractor).extract(any(), any(), any());
    TrackedMethod method = tracked((args, kwargs) -> "real");

    assertEquals("real", method.call());
    verify(extractor, times(1)).extract(eq("real"), any(), same(sink));
  }

  @Test
  void testExtractorErrorDoesNotReplaceUpstreamError() {
    doThrow(new NoClassDefFoundError("com/example/Missing")).when(extractor).extract(any(), any(), any());
    IllegalStateException failure = new IllegalStateException("upstream");
    TrackedMethod method = tracked((args, kwargs) -> {
      throw failure;
    });

    IllegalStateException thrown = assertThrows(IllegalStateException.class, method::call);

    assertSame(failure, thrown);
    verify(extractor, times(1)).extract(isNull(), any(), same(sink));
  }

  @Test
  void testExtractorFailureDoesNotReplaceUpstreamError() {
    doThrow(new IllegalStateException("extractor broke")).when(extractor).extract(any(), any(), any());
    TrackedMethod method = tracked((args, kwargs) -> {
      throw new IllegalArgumentException("upstream");
    });

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, method::call);

    assertEquals("upstream", thrown.getMessage());
  }

  @Test
  void testTrackUsageFalseSkipsExtractor() throws Exception {
    TrackedMethod method = tracked((args, kwargs) -> kwargs.keySet().toString());

    Object result = method.callWithKeywords(Map.of("track_usage", false, "temperature", 0.5));

    assertEquals("[temperature]", result);
    verifyNoInteractions(extractor);
  }

  @Test
  void testReservedKeywordsAreNotForwarded() throws Exception {
    List<Map<String, Object>> forwarded = new ArrayList<>();
    TrackedMethod method = tracked((args, kwargs) -> {
      forwarded.add(new HashMap<>(kwargs));
      return null;
    });

    method.callWithKeywords(Map.of("customer_id", "X", "metadata", Map.of("k", "v"), "model", "m"));

    assertEquals(List.of(Map.of("model", "m")), forwarded);
    ArgumentCaptor<CallContext> captor = ArgumentCaptor.forClass(CallContext.class);
    verify(extractor).extract(isNull(), captor.capture(), any());
    assertEquals(CustomerId.of("X"), captor.getValue().getCustomerOverride());
    assertEquals(Map.of("k", "v"), captor.getValue().getMetadataOverride());
  }

  @Test
  void testKeywordOptionsWinOverPositionalOptions() throws Exception {
    TrackedMethod method = tracked((args, kwargs) -> args.size());

    Object size = method.callWithKeywords(Map.of("customer_id", "keyword"), "a",
        CallOptions.builder().customerId("positional").metadata(Map.of("src", "pos")).build());

    assertEquals(1, size);
    ArgumentCaptor<CallContext> captor = ArgumentCaptor.forClass(CallContext.class);
    verify(extractor).extract(eq(1), captor.capture(), any());
    assertEquals(CustomerId.of("keyword"), captor.getValue().getCustomerOverride());
    assertEquals(Map.of("src", "pos"), captor.getValue().getMetadataOverride());
  }

  @Test
  void testScopedOptionsApplyWithoutExplicitOptions() {
    TrackedMethod method = tracked((args, kwargs) -> "ok");

    CallOptions.runWith(CallOptions.untracked(), () -> method.call());

    verifyNoInteractions(extractor);
  }

  @Test
  void testExplicitNoneCustomerOverride() throws Exception {
    Map<String, Object> keywords = new HashMap<>();
    keywords.put("customer_id", null);
    TrackedMethod method = tracked((args, kwargs) -> "ok");

    method.callWithKeywords(keywords);

    ArgumentCaptor<CallContext> captor = ArgumentCaptor.forClass(CallContext.class);
    verify(extractor).extract(any(), captor.capture(), any());
    assertTrue(captor.getValue().getCustomerOverride().isNone());
  }

  @Test
  void testNameAndToString() {
    Invocable delegate = (args, kwargs) -> null;
    TrackedMethod method = new TrackedMethod(delegate, "a.b.op", extractor, sink,
        Clock.fixed(START, ZoneOffset.UTC));

    assertEquals("op", method.getName());
    assertEquals("a.b.op", method.getMethodPath());
    assertSame(delegate, method.getDelegate());
    assertSame(extractor, method.getExtractor());
    assertTrue(method.getSignatures().isEmpty());
    assertTrue(method.toString().startsWith("TrackedMethod(a.b.op"));
  }

  @Test
  void testArgumentsAreCopiedBeforeForwarding() throws Exception {
    List<Object> original = new ArrayList<>(Arrays.asList("a", CallOptions.untracked()));
    TrackedMethod method = tracked((args, kwargs) -> args.size());

    assertEquals(1, method.invoke(original, null));
    assertEquals(2, original.size());
  }
}
