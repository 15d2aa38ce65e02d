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

package com.cmdrdata.core.sink;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmdrdata.core.UsageEvent;
import com.cmdrdata.core.UsageSink;

/**
 * Forwards each event to several sinks. A failing sink does not keep the
 * event from the others.
 */
public class CompositeUsageSink implements UsageSink, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(CompositeUsageSink.class);

  private final List<UsageSink> sinks;

  public CompositeUsageSink(UsageSink... sinks) {
    this(Arrays.asList(sinks));
  }

  public CompositeUsageSink(List<? extends UsageSink> sinks) {
    this.sinks = Collections.unmodifiableList(new ArrayList<>(sinks));
  }

  @Override
  public void recordUsage(UsageEvent event) {
    for (UsageSink sink : sinks) {
      try {
        sink.recordUsage(event);
      } catch (Exception e) {
        logger.warn("Usage sink {} failed for event {}: {}", sink, event.getRequestId(), e.getMessage());
      }
    }
  }

  public List<UsageSink> getSinks() {
    return sinks;
  }

  @Override
  public void close() {
    for (UsageSink sink : sinks) {
      if (sink instanceof AutoCloseable) {
        BackgroundUsageSink.closeQuietly((AutoCloseable) sink);
      }
    }
  }
}
