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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmdrdata.core.UsageEvent;
import com.cmdrdata.core.UsageSink;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

/**
 * MetricsUsageSink records usage events as OpenTelemetry metrics.
 *
 * <p>
 * This sink tracks:
 * <ul>
 * <li>Request counts per provider, model and method</li>
 * <li>Latency histograms</li>
 * <li>Input/output token counts</li>
 * <li>Error counts per error kind</li>
 * </ul>
 */
public class MetricsUsageSink implements UsageSink {

  private static final Logger logger = LoggerFactory.getLogger(MetricsUsageSink.class);
  private static final String METER_NAME = "cmdrdata";

  public static final String METRIC_REQUESTS = "cmdrdata/usage/requests";
  public static final String METRIC_LATENCY = "cmdrdata/usage/latency";
  public static final String METRIC_INPUT_TOKENS = "cmdrdata/usage/input/tokens";
  public static final String METRIC_OUTPUT_TOKENS = "cmdrdata/usage/output/tokens";
  public static final String METRIC_ERRORS = "cmdrdata/usage/errors";

  static final AttributeKey<String> PROVIDER = AttributeKey.stringKey("provider");
  static final AttributeKey<String> MODEL = AttributeKey.stringKey("model");
  static final AttributeKey<String> METHOD = AttributeKey.stringKey("method");
  static final AttributeKey<String> STATUS = AttributeKey.stringKey("status");
  static final AttributeKey<String> ERROR_KIND = AttributeKey.stringKey("errorKind");

  private final LongCounter requestCounter;
  private final LongHistogram latencyHistogram;
  private final LongCounter inputTokensCounter;
  private final LongCounter outputTokensCounter;
  private final LongCounter errorCounter;

  /**
   * Creates a MetricsUsageSink on the global OpenTelemetry meter provider.
   */
  public MetricsUsageSink() {
    this(GlobalOpenTelemetry.getMeter(METER_NAME));
  }

  /**
   * Creates a MetricsUsageSink on the given meter.
   *
   * @param meter
   *            the meter to create instruments on
   */
  public MetricsUsageSink(Meter meter) {
    requestCounter = meter.counterBuilder(METRIC_REQUESTS).setDescription("Counts tracked API calls.")
        .setUnit("1").build();

    latencyHistogram = meter.histogramBuilder(METRIC_LATENCY)
        .setDescription("Latencies of tracked API calls.").setUnit("ms").ofLongs().build();

    inputTokensCounter = meter.counterBuilder(METRIC_INPUT_TOKENS)
        .setDescription("Counts input tokens of tracked API calls.").setUnit("1").build();

    outputTokensCounter = meter.counterBuilder(METRIC_OUTPUT_TOKENS)
        .setDescription("Counts output tokens of tracked API calls.").setUnit("1").build();

    errorCounter = meter.counterBuilder(METRIC_ERRORS).setDescription("Counts failed tracked API calls.")
        .setUnit("1").build();

    logger.debug("MetricsUsageSink initialized with OpenTelemetry metrics");
  }

  @Override
  public void recordUsage(UsageEvent event) {
    String status = event.isErrorOccurred() ? "failure" : "success";

    Attributes baseAttrs = Attributes.builder().put(PROVIDER, truncate(event.getProvider(), 256))
        .put(MODEL, truncate(event.getModel(), 1024)).put(METHOD, truncate(event.getMethodPath(), 1024))
        .put(STATUS, status).build();

    requestCounter.add(1, baseAttrs);

    Long latencyMs = event.getLatencyMs();
    if (latencyMs != null) {
      latencyHistogram.record(latencyMs, baseAttrs);
    }

    if (event.getInputTokens() > 0) {
      inputTokensCounter.add(event.getInputTokens(), baseAttrs);
    }
    if (event.getOutputTokens() > 0) {
      outputTokensCounter.add(event.getOutputTokens(), baseAttrs);
    }

    if (event.isErrorOccurred()) {
      AttributesBuilder errorAttrs = baseAttrs.toBuilder();
      if (event.getErrorType() != null) {
        errorAttrs.put(ERROR_KIND, event.getErrorType().getValue());
      }
      errorCounter.add(1, errorAttrs.build());
    }
  }

  private static String truncate(String value, int maxLength) {
    if (value == null) {
      return "";
    }
    if (value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
