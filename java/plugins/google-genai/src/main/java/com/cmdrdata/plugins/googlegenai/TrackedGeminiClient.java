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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmdrdata.core.CallOptions;
import com.cmdrdata.core.CustomerContext;
import com.cmdrdata.core.InterceptionTable;
import com.cmdrdata.core.TrackedProxy;
import com.cmdrdata.core.UsageSink;
import com.cmdrdata.core.sink.BackgroundUsageSink;
import com.cmdrdata.core.sink.CompositeUsageSink;
import com.cmdrdata.core.sink.HttpUsageSink;
import com.cmdrdata.core.sink.MetricsUsageSink;
import com.google.genai.Client;
import com.google.genai.types.CountTokensConfig;
import com.google.genai.types.CountTokensResponse;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;

/**
 * A Google GenAI client whose {@code models.generateContent} and
 * {@code models.countTokens} calls are billed to a customer.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * try (TrackedGeminiClient client = TrackedGeminiClient.create()) { // Uses GOOGLE_API_KEY and CMDRDATA_API_KEY
 * 	GenerateContentResponse response = client.generateContent("gemini-2.5-flash", "Hello, world!", null,
 * 			CallOptions.forCustomer("customer-123"));
 * }
 * }
 * </pre>
 *
 * <p>
 * Everything else the SDK offers is reachable untracked through
 * {@link #getProxy()} or {@link #getClient()}.
 */
public class TrackedGeminiClient implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TrackedGeminiClient.class);

  private final Client client;
  private final UsageSink sink;
  private final TrackedProxy proxy;

  TrackedGeminiClient(Client client, UsageSink sink, InterceptionTable table) {
    this.client = Objects.requireNonNull(client, "client");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.proxy = new TrackedProxy(client, sink, table);
  }

  /**
   * Creates a tracked client configured from the environment.
   *
   * @return the tracked client
   */
  public static TrackedGeminiClient create() {
    return create(TrackedGeminiOptions.builder().build());
  }

  /**
   * Creates a tracked client from options.
   *
   * @param options
   *            the client and tracking options
   * @return the tracked client
   */
  public static TrackedGeminiClient create(TrackedGeminiOptions options) {
    VersionCompatibility.checkOnce();
    logger.debug("Creating tracked Gemini client (vertexAI={})", options.isVertexAI());
    return new TrackedGeminiClient(createClient(options), createSink(options),
        GeminiTracking.trackMethods(options.getCustomerResolver()));
  }

  /**
   * Wraps an existing GenAI client. The sink is not closed by
   * {@link #close()} unless it is {@link AutoCloseable}.
   *
   * @param client
   *            the GenAI client
   * @param sink
   *            the sink receiving usage events
   * @return the tracked client
   */
  public static TrackedGeminiClient wrap(Client client, UsageSink sink) {
    VersionCompatibility.checkOnce();
    return new TrackedGeminiClient(client, sink, GeminiTracking.trackMethods(CustomerContext.resolver()));
  }

  static Client createClient(TrackedGeminiOptions options) {
    Client.Builder builder = Client.builder();

    if (options.isVertexAI()) {
      builder.vertexAI(true);
      if (options.getProject() != null) {
        builder.project(options.getProject());
      }
      if (options.getLocation() != null) {
        builder.location(options.getLocation());
      }
      // Vertex AI can also use API key for express mode
      if (options.getApiKey() != null) {
        builder.apiKey(options.getApiKey());
      }
    } else {
      builder.apiKey(options.getApiKey());
    }

    HttpOptions httpOptions = options.toHttpOptions();
    if (httpOptions != null) {
      builder.httpOptions(httpOptions);
    }

    return builder.build();
  }

  static UsageSink createSink(TrackedGeminiOptions options) {
    UsageSink http = new BackgroundUsageSink(new HttpUsageSink(options.getCmdrdataEndpoint(),
        options.getCmdrdataApiKey(), options.getTrackingTimeout()));
    if (!options.isMetricsEnabled()) {
      return http;
    }
    return new CompositeUsageSink(http, new MetricsUsageSink());
  }

  /**
   * Generates content, recording token usage for the call's customer.
   *
   * @param model
   *            the model name
   * @param text
   *            the prompt
   * @param config
   *            the generation config, may be null
   * @param options
   *            the tracking options, may be null for the ambient ones
   * @return the SDK response
   */
  public GenerateContentResponse generateContent(String model, String text, GenerateContentConfig config,
      CallOptions options) {
    return (GenerateContentResponse) proxy.callPath(GeminiTracking.GENERATE_CONTENT, null,
        trackingArgs(options, model, text, config));
  }

  /**
   * Counts the tokens of a prompt, recording them as input usage.
   *
   * @param model
   *            the model name
   * @param text
   *            the prompt
   * @param config
   *            the count config, may be null
   * @param options
   *            the tracking options, may be null for the ambient ones
   * @return the SDK response
   */
  public CountTokensResponse countTokens(String model, String text, CountTokensConfig config, CallOptions options) {
    return (CountTokensResponse) proxy.callPath(GeminiTracking.COUNT_TOKENS, null,
        trackingArgs(options, model, text, config));
  }

  private static Object[] trackingArgs(CallOptions options, Object... args) {
    if (options == null) {
      return args;
    }
    Object[] withOptions = new Object[args.length + 1];
    System.arraycopy(args, 0, withOptions, 0, args.length);
    withOptions[args.length] = options;
    return withOptions;
  }

  /**
   * Returns the tracking proxy over the whole SDK surface.
   *
   * @return the root proxy
   */
  public TrackedProxy getProxy() {
    return proxy;
  }

  public Client getClient() {
    return client;
  }

  public UsageSink getSink() {
    return sink;
  }

  /**
   * Flushes and closes the usage sink.
   */
  @Override
  public void close() {
    if (sink instanceof AutoCloseable) {
      try {
        ((AutoCloseable) sink).close();
      } catch (Exception e) {
        logger.warn("Failed to close usage sink: {}", e.getMessage());
      }
    }
  }

  @Override
  public String toString() {
    return "TrackedGeminiClient(" + proxy + ")";
  }
}
