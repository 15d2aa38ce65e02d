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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ResultFields.
 */
class ResultFieldsTest {

  /**
   * Accessors in the style of generated SDK types.
   */
  public static class SdkUsage {
    public Optional<Integer> promptTokenCount() {
      return Optional.of(15);
    }

    public Optional<Integer> candidatesTokenCount() {
      return Optional.empty();
    }
  }

  public static class SdkResponse {
    public Optional<SdkUsage> usageMetadata() {
      return Optional.of(new SdkUsage());
    }

    public Optional<List<String>> candidates() {
      return Optional.of(List.of("first", "second"));
    }
  }

  public static class BeanResponse {
    public int getTotalTokens() {
      return 9;
    }

    public boolean isCached() {
      return true;
    }
  }

  public static class FieldResponse {
    public final Integer totalTokens = 11;
  }

  public static class ThrowingResponse {
    public Object usageMetadata() {
      throw new IllegalStateException("not loaded");
    }
  }

  @Test
  void testReadsSdkStyleAccessorsAndUnwrapsOptional() {
    SdkResponse response = new SdkResponse();

    assertEquals(15, ResultFields.readPath(response, "usageMetadata.promptTokenCount"));
    assertNull(ResultFields.readPath(response, "usageMetadata.candidatesTokenCount"));
    assertEquals(0, ResultFields.readInt(ResultFields.read(response, "usageMetadata"), "candidatesTokenCount"));
  }

  @Test
  void testReadsBeanGettersAndFields() {
    assertEquals(9, ResultFields.readInt(new BeanResponse(), "totalTokens"));
    assertEquals(Boolean.TRUE, ResultFields.read(new BeanResponse(), "cached"));
    assertEquals(11, ResultFields.readInteger(new FieldResponse(), "totalTokens"));
  }

  @Test
  void testReadsMaps() {
    Map<String, Object> response = Map.of("usageMetadata", Map.of("promptTokenCount", 4));

    assertEquals(4, ResultFields.readPath(response, "usageMetadata.promptTokenCount"));
    assertTrue(ResultFields.has(response, "usageMetadata"));
    assertFalse(ResultFields.has(response, "candidates"));
  }

  @Test
  void testMissingFieldsAndNullSourceReadAsAbsent() {
    assertNull(ResultFields.read(null, "usageMetadata"));
    assertNull(ResultFields.read(new BeanResponse(), "usageMetadata"));
    assertNull(ResultFields.readString(new BeanResponse(), "responseId"));
    assertEquals(0, ResultFields.readInt(null, "totalTokens"));
  }

  @Test
  void testFirstElement() {
    assertEquals("first", ResultFields.first(ResultFields.read(new SdkResponse(), "candidates")));
    assertEquals("a", ResultFields.first(new String[]{"a", "b"}));
    assertNull(ResultFields.first(List.of()));
    assertNull(ResultFields.first(null));
    assertNull(ResultFields.first("scalar"));
  }

  @Test
  void testAccessorExceptionsPropagate() {
    assertThrows(IllegalStateException.class, () -> ResultFields.read(new ThrowingResponse(), "usageMetadata"));
  }
}
