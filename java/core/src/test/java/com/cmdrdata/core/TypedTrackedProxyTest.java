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

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.cmdrdata.core.TestClients.RecordingExtractor;
import com.cmdrdata.core.TestClients.RecordingSink;

/**
 * Unit tests for TrackedProxy.forInterface.
 */
class TypedTrackedProxyTest {

  public interface ChatClient {
    Completions completions();

    String version();
  }

  public interface Completions {
    String create(String model, String prompt) throws IOException;

    int count(String prompt);
  }

  static class FakeCompletions implements Completions {
    final AtomicInteger createCalls = new AtomicInteger();

    @Override
    public String create(String model, String prompt) throws IOException {
      createCalls.incrementAndGet();
      if ("offline".equals(model)) {
        throw new IOException("offline");
      }
      return model + ":" + prompt;
    }

    @Override
    public int count(String prompt) {
      return prompt.length();
    }
  }

  static class FakeChatClient implements ChatClient {
    final FakeCompletions completions = new FakeCompletions();

    @Override
    public Completions completions() {
      return completions;
    }

    @Override
    public String version() {
      return "1.2.3";
    }

    @Override
    public String toString() {
      return "FakeChatClient";
    }
  }

  private FakeChatClient target;
  private RecordingSink sink;
  private RecordingExtractor extractor;
  private ChatClient client;

  @BeforeEach
  void setUp() {
    target = new FakeChatClient();
    sink = new RecordingSink();
    extractor = new RecordingExtractor();
    client = TrackedProxy.forInterface(ChatClient.class, target, sink,
        InterceptionTable.builder().track("completions.create", extractor).build());
  }

  @Test
  void testTrackedMethodThroughTypedNamespace() throws IOException {
    String result = client.completions().create("m1", "hi");

    assertEquals("m1:hi", result);
    assertEquals(1, target.completions.createCalls.get());
    assertEquals(1, extractor.contexts.size());
    assertEquals("completions.create", extractor.contexts.get(0).getMethodPath());
    assertEquals(1, sink.events.size());
  }

  @Test
  void testNamespaceProxyIsMemoized() {
    assertSame(client.completions(), client.completions());
    assertNotSame(target.completions, client.completions());
  }

  @Test
  void testUntrackedMethodsForward() {
    assertEquals("1.2.3", client.version());
    assertEquals(5, client.completions().count("hello"));
    assertTrue(extractor.contexts.isEmpty());
  }

  @Test
  void testDeclaredCheckedExceptionIsRethrownUnchanged() {
    IOException e = assertThrows(IOException.class, () -> client.completions().create("offline", "hi"));

    assertEquals("offline", e.getMessage());
    assertEquals(1, extractor.contexts.size());
    assertTrue(extractor.contexts.get(0).isFailure());
  }

  @Test
  void testToStringNamesTarget() {
    assertEquals("TrackedProxy(FakeChatClient)", client.toString());
  }

  @Test
  void testNonInterfaceTypeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TrackedProxy.forInterface(FakeChatClient.class, target, sink, InterceptionTable.empty()));
  }
}
