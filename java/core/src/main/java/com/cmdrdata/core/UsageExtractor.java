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

/**
 * UsageExtractor turns the outcome of one tracked call into a
 * {@link UsageEvent} and hands it to the sink.
 *
 * <p>
 * An extractor is invoked at most once per call, after the real method has
 * returned or thrown. The context carries the method path, the forwarded
 * arguments, the caller's {@link CallOptions}, the timestamps and, on failure,
 * the {@link ErrorInfo}. Implementations should contain their own failures;
 * anything that still escapes is logged and dropped by {@link TrackedMethod}.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * UsageExtractor extractor = (result, context, sink) -> sink.recordUsage(UsageEvent.builder()
 * 		.customerId("customer-123").provider("acme").model("m1").fromContext(context).build());
 * }
 * </pre>
 */
@FunctionalInterface
public interface UsageExtractor {

  /**
   * Extracts usage from a call outcome.
   *
   * @param result
   *            the value returned by the real method, or null if it failed
   * @param context
   *            the per-call context
   * @param sink
   *            the sink to record the usage event with
   */
  void extract(Object result, CallContext context, UsageSink sink);
}
