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

import java.time.Duration;
import java.util.function.Function;

import com.cmdrdata.core.CustomerContext;
import com.cmdrdata.core.CustomerResolver;
import com.google.genai.types.HttpOptions;

/**
 * Options for creating a {@link TrackedGeminiClient}.
 *
 * <p>
 * The wrapped client can be configured to use either:
 * <ul>
 * <li>Gemini Developer API (default): Set the API key</li>
 * <li>Vertex AI API: Set project, location, and enable vertexAI</li>
 * </ul>
 * Usage events are posted to the CmdrData endpoint with the CmdrData API key.
 * Defaults come from the environment variables {@code GOOGLE_API_KEY},
 * {@code GOOGLE_CLOUD_PROJECT}, {@code GOOGLE_CLOUD_LOCATION},
 * {@code GOOGLE_GENAI_USE_VERTEXAI}, {@code CMDRDATA_API_KEY},
 * {@code CMDRDATA_ENDPOINT} and {@code CMDRDATA_TIMEOUT_MS}.
 */
public class TrackedGeminiOptions {

  public static final String DEFAULT_ENDPOINT = "https://api.cmdrdata.ai/api/events";
  public static final int DEFAULT_TRACKING_TIMEOUT_MS = 5000;

  private final String apiKey;
  private final String project;
  private final String location;
  private final boolean vertexAI;
  private final String apiVersion;
  private final String baseUrl;
  private final int timeout;
  private final String cmdrdataApiKey;
  private final String cmdrdataEndpoint;
  private final int trackingTimeout;
  private final boolean metricsEnabled;
  private final CustomerResolver customerResolver;

  private TrackedGeminiOptions(Builder builder) {
    this.apiKey = builder.apiKey;
    this.project = builder.project;
    this.location = builder.location;
    this.vertexAI = builder.vertexAI;
    this.apiVersion = builder.apiVersion;
    this.baseUrl = builder.baseUrl;
    this.timeout = builder.timeout;
    this.cmdrdataApiKey = builder.cmdrdataApiKey;
    this.cmdrdataEndpoint = builder.cmdrdataEndpoint;
    this.trackingTimeout = builder.trackingTimeout;
    this.metricsEnabled = builder.metricsEnabled;
    this.customerResolver = builder.customerResolver;
  }

  /**
   * Creates a new builder with defaults from the process environment.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder(System::getenv);
  }

  static Builder builder(Function<String, String> environment) {
    return new Builder(environment);
  }

  /**
   * Gets the Google API key.
   *
   * @return the API key
   */
  public String getApiKey() {
    return apiKey;
  }

  /**
   * Gets the Google Cloud project ID (for Vertex AI).
   *
   * @return the project ID
   */
  public String getProject() {
    return project;
  }

  /**
   * Gets the Google Cloud location (for Vertex AI).
   *
   * @return the location
   */
  public String getLocation() {
    return location;
  }

  /**
   * Returns whether to use Vertex AI backend.
   *
   * @return true if using Vertex AI, false for Gemini Developer API
   */
  public boolean isVertexAI() {
    return vertexAI;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Gets the GenAI request timeout in milliseconds.
   *
   * @return the timeout in milliseconds, 0 for the SDK default
   */
  public int getTimeout() {
    return timeout;
  }

  public String getCmdrdataApiKey() {
    return cmdrdataApiKey;
  }

  public String getCmdrdataEndpoint() {
    return cmdrdataEndpoint;
  }

  /**
   * Gets the timeout for posting one usage event.
   *
   * @return the timeout
   */
  public Duration getTrackingTimeout() {
    return Duration.ofMillis(trackingTimeout);
  }

  /**
   * Returns whether usage events are also recorded as OpenTelemetry metrics.
   *
   * @return true if metrics are enabled
   */
  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public CustomerResolver getCustomerResolver() {
    return customerResolver;
  }

  /**
   * Converts these options to HttpOptions for the Google GenAI SDK.
   *
   * @return HttpOptions, or null when nothing is overridden
   */
  public HttpOptions toHttpOptions() {
    if (apiVersion == null && baseUrl == null && timeout <= 0) {
      return null;
    }
    HttpOptions.Builder builder = HttpOptions.builder();
    if (apiVersion != null) {
      builder.apiVersion(apiVersion);
    }
    if (baseUrl != null) {
      builder.baseUrl(baseUrl);
    }
    if (timeout > 0) {
      builder.timeout(timeout);
    }
    return builder.build();
  }

  /**
   * Builder for TrackedGeminiOptions.
   */
  public static class Builder {
    private String apiKey;
    private String project;
    private String location;
    private boolean vertexAI;
    private String apiVersion;
    private String baseUrl;
    private int timeout;
    private String cmdrdataApiKey;
    private String cmdrdataEndpoint;
    private int trackingTimeout;
    private boolean metricsEnabled;
    private CustomerResolver customerResolver = CustomerContext.resolver();

    private Builder(Function<String, String> environment) {
      // GOOGLE_API_KEY takes precedence over GEMINI_API_KEY (legacy)
      apiKey = environment.apply("GOOGLE_API_KEY");
      if (apiKey == null || apiKey.isEmpty()) {
        apiKey = environment.apply("GEMINI_API_KEY");
      }
      project = environment.apply("GOOGLE_CLOUD_PROJECT");
      String envLocation = environment.apply("GOOGLE_CLOUD_LOCATION");
      location = envLocation != null ? envLocation : "us-central1";
      vertexAI = "true".equalsIgnoreCase(environment.apply("GOOGLE_GENAI_USE_VERTEXAI"));

      cmdrdataApiKey = environment.apply("CMDRDATA_API_KEY");
      String envEndpoint = environment.apply("CMDRDATA_ENDPOINT");
      cmdrdataEndpoint = envEndpoint != null && !envEndpoint.isEmpty() ? envEndpoint : DEFAULT_ENDPOINT;
      trackingTimeout = parseTimeout(environment.apply("CMDRDATA_TIMEOUT_MS"));
    }

    private static int parseTimeout(String value) {
      if (value == null || value.isEmpty()) {
        return DEFAULT_TRACKING_TIMEOUT_MS;
      }
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalStateException("CMDRDATA_TIMEOUT_MS must be an integer, got '" + value + "'", e);
      }
    }

    /**
     * Sets the API key for Gemini Developer API.
     *
     * @param apiKey
     *            the API key
     * @return this builder
     */
    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder project(String project) {
      this.project = project;
      return this;
    }

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    /**
     * Sets whether to use Vertex AI backend.
     *
     * @param vertexAI
     *            true to use Vertex AI, false for Gemini Developer API
     * @return this builder
     */
    public Builder vertexAI(boolean vertexAI) {
      this.vertexAI = vertexAI;
      return this;
    }

    /**
     * Sets the API version.
     *
     * @param apiVersion
     *            the API version (e.g., "v1", "v1beta")
     * @return this builder
     */
    public Builder apiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /**
     * Sets the GenAI request timeout in milliseconds.
     *
     * @param timeout
     *            the timeout in milliseconds
     * @return this builder
     */
    public Builder timeout(int timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets the CmdrData API key used to authenticate usage events.
     *
     * @param cmdrdataApiKey
     *            the CmdrData API key
     * @return this builder
     */
    public Builder cmdrdataApiKey(String cmdrdataApiKey) {
      this.cmdrdataApiKey = cmdrdataApiKey;
      return this;
    }

    public Builder cmdrdataEndpoint(String cmdrdataEndpoint) {
      this.cmdrdataEndpoint = cmdrdataEndpoint;
      return this;
    }

    /**
     * Sets the timeout for posting one usage event, in milliseconds.
     *
     * @param trackingTimeout
     *            the timeout in milliseconds
     * @return this builder
     */
    public Builder trackingTimeout(int trackingTimeout) {
      this.trackingTimeout = trackingTimeout;
      return this;
    }

    public Builder metricsEnabled(boolean metricsEnabled) {
      this.metricsEnabled = metricsEnabled;
      return this;
    }

    /**
     * Sets how the billed customer is resolved when a call has no
     * {@code customer_id} override.
     *
     * @param customerResolver
     *            the resolver
     * @return this builder
     */
    public Builder customerResolver(CustomerResolver customerResolver) {
      this.customerResolver = customerResolver;
      return this;
    }

    /**
     * Builds the TrackedGeminiOptions.
     *
     * @return the built options
     */
    public TrackedGeminiOptions build() {
      if (!vertexAI && (apiKey == null || apiKey.isEmpty())) {
        throw new IllegalStateException("Google API key is required for Gemini Developer API. "
            + "Set GOOGLE_API_KEY or GEMINI_API_KEY environment variable, "
            + "or provide it in options, or enable vertexAI mode.");
      }
      if (vertexAI && (project == null || project.isEmpty()) && (apiKey == null || apiKey.isEmpty())) {
        throw new IllegalStateException(
            "For Vertex AI, either set GOOGLE_CLOUD_PROJECT and GOOGLE_CLOUD_LOCATION "
                + "environment variables, or provide an API key for express mode.");
      }
      if (cmdrdataApiKey == null || cmdrdataApiKey.isEmpty()) {
        throw new IllegalStateException(
            "CmdrData API key is required. Set CMDRDATA_API_KEY environment variable or provide it in options.");
      }
      if (trackingTimeout <= 0) {
        throw new IllegalStateException("Tracking timeout must be positive, got " + trackingTimeout);
      }
      if (customerResolver == null) {
        throw new IllegalStateException("Customer resolver must not be null");
      }
      return new TrackedGeminiOptions(this);
    }
  }
}
