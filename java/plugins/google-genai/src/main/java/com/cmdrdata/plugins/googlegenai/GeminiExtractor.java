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

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmdrdata.core.CallContext;
import com.cmdrdata.core.CustomerResolver;
import com.cmdrdata.core.UsageEvent;
import com.cmdrdata.core.UsageExtractor;
import com.cmdrdata.core.UsageSink;

/**
 * Base class for extractors of Google GenAI results.
 *
 * <p>
 * Resolves the customer, the model and the call's error fields, lets the
 * subclass fill in the quantities, merges the caller's metadata on top and
 * records the event. Calls without an effective customer are not recorded.
 */
public abstract class GeminiExtractor implements UsageExtractor {

  private static final Logger logger = LoggerFactory.getLogger(GeminiExtractor.class);

  private final CustomerResolver customerResolver;

  /**
   * Creates a new GeminiExtractor.
   *
   * @param customerResolver
   *            resolves the customer billed for a call
   */
  protected GeminiExtractor(CustomerResolver customerResolver) {
    this.customerResolver = Objects.requireNonNull(customerResolver, "customerResolver");
  }

  @Override
  public final void extract(Object result, CallContext context, UsageSink sink) {
    try {
      String customerId = customerResolver.resolve(context.getCustomerOverride());
      if (customerId == null || customerId.isEmpty()) {
        logger.warn("No customer_id provided for tracking {}", context.getMethodPath());
        return;
      }

      UsageEvent.Builder event = UsageEvent.builder().customerId(customerId).provider(GeminiTracking.PROVIDER)
          .model(GeminiTracking.modelOf(context)).fromContext(context);
      baseMetadata(event);

      if (context.isSuccess() && !extractUsage(result, event)) {
        logger.debug("No usage reported by {} for call {}", context.getMethodPath(), context.getRequestId());
        return;
      }

      Map<String, Object> metadataOverride = context.getMetadataOverride();
      if (metadataOverride != null) {
        metadataOverride.forEach(event::putMetadata);
      }

      sink.recordUsage(event.build());
    } catch (Throwable t) {
      logger.warn("Failed to extract usage data from {}: {}", context.getMethodPath(), t.toString());
    }
  }

  /**
   * Adds metadata recorded for every call of this operation, successful or
   * not. Does nothing by default.
   *
   * @param event
   *            the event being built
   */
  protected void baseMetadata(UsageEvent.Builder event) {
  }

  /**
   * Fills in quantities and metadata from a successful result.
   *
   * @param result
   *            the value returned by the real method, may be null
   * @param event
   *            the event being built
   * @return false if the result carries no usage and nothing should be
   *         recorded
   */
  protected abstract boolean extractUsage(Object result, UsageEvent.Builder event);
}
