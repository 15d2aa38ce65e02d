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

import java.lang.reflect.Method;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TrackedMethod wraps one client method with usage tracking.
 *
 * <p>
 * Each call strips the reserved {@link CallOptions}, mints a correlation id,
 * times the real call and hands the outcome to the {@link UsageExtractor}.
 * The real result is returned unchanged and the real error is rethrown
 * unchanged; failures of the extractor or the sink are logged and dropped.
 */
public class TrackedMethod implements Invocable {

  private static final Logger logger = LoggerFactory.getLogger(TrackedMethod.class);

  private final Invocable delegate;
  private final String methodPath;
  private final UsageExtractor extractor;
  private final UsageSink sink;
  private final Clock clock;

  /**
   * Creates a new TrackedMethod.
   *
   * @param delegate
   *            the real method
   * @param methodPath
   *            the dotted path of the method
   * @param extractor
   *            the extractor invoked after each call
   * @param sink
   *            the sink handed to the extractor
   */
  public TrackedMethod(Invocable delegate, String methodPath, UsageExtractor extractor, UsageSink sink) {
    this(delegate, methodPath, extractor, sink, Clock.systemUTC());
  }

  /**
   * Creates a new TrackedMethod with an explicit clock.
   *
   * @param delegate
   *            the real method
   * @param methodPath
   *            the dotted path of the method
   * @param extractor
   *            the extractor invoked after each call
   * @param sink
   *            the sink handed to the extractor
   * @param clock
   *            the clock for the call timestamps
   */
  public TrackedMethod(Invocable delegate, String methodPath, UsageExtractor extractor, UsageSink sink,
      Clock clock) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.methodPath = Objects.requireNonNull(methodPath, "methodPath");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Object invoke(List<Object> args, Map<String, Object> keywordArgs) throws Exception {
    List<Object> positional = args != null ? new ArrayList<>(args) : new ArrayList<>();
    Map<String, Object> keywords = keywordArgs != null ? new LinkedHashMap<>(keywordArgs) : new LinkedHashMap<>();

    CallOptions base = CallOptions.current();
    if (!positional.isEmpty() && positional.get(positional.size() - 1) instanceof CallOptions) {
      base = (CallOptions) positional.remove(positional.size() - 1);
    }
    CallOptions options = CallOptions.extract(base, keywords);

    CallContext.Builder context = CallContext.builder().requestId(UUID.randomUUID().toString())
        .methodPath(methodPath).args(positional).keywordArgs(keywords).options(options);
    Instant startTime = clock.instant();
    context.startTime(startTime);

    Object result;
    try {
      result = delegate.invoke(positional, keywords);
    } catch (Throwable t) {
      context.endTime(clock.instant()).error(ErrorClassifier.classify(t));
      track(null, context.build());
      throw t;
    }

    context.endTime(clock.instant());
    track(result, context.build());
    return result;
  }

  private void track(Object result, CallContext context) {
    if (!context.getOptions().isTrackUsage()) {
      logger.debug("Tracking disabled for call {} to {}", context.getRequestId(), methodPath);
      return;
    }
    try {
      extractor.extract(result, context, sink);
    } catch (Throwable t) {
      if (context.isFailure()) {
        logger.warn("Failed to track error for {}: {}", methodPath, t.toString());
      } else {
        logger.warn("Failed to track usage for {}: {}", methodPath, t.toString());
      }
    }
  }

  /**
   * Returns the simple method name, the last segment of the path.
   *
   * @return the method name
   */
  @Override
  public String getName() {
    return methodPath.substring(methodPath.lastIndexOf('.') + 1);
  }

  public String getMethodPath() {
    return methodPath;
  }

  public Invocable getDelegate() {
    return delegate;
  }

  public UsageExtractor getExtractor() {
    return extractor;
  }

  /**
   * Returns the reflective signatures of the wrapped method.
   *
   * @return the overloads, empty when the delegate is not a reflective method
   */
  public List<Method> getSignatures() {
    if (delegate instanceof BoundMethod) {
      return ((BoundMethod) delegate).getOverloads();
    }
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return "TrackedMethod(" + methodPath + " -> " + delegate + ")";
  }
}
