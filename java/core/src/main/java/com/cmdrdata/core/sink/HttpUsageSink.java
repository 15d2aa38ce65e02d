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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmdrdata.core.CmdrDataException;
import com.cmdrdata.core.JsonUtils;
import com.cmdrdata.core.UsageEvent;
import com.cmdrdata.core.UsageSink;

/**
 * HTTP sink that posts usage events to the CmdrData ingestion endpoint.
 *
 * <p>
 * Calls block until the endpoint answers, so this sink is normally wrapped in
 * a {@link BackgroundUsageSink}.
 */
public class HttpUsageSink implements UsageSink {

  private static final Logger logger = LoggerFactory.getLogger(HttpUsageSink.class);

  private final URI endpoint;
  private final String apiKey;
  private final Duration timeout;
  private final HttpClient httpClient;

  /**
   * Creates a new HTTP usage sink.
   *
   * @param endpoint
   *            the ingestion URL
   * @param apiKey
   *            the CmdrData API key, sent as a bearer token
   * @param timeout
   *            the request timeout
   */
  public HttpUsageSink(String endpoint, String apiKey, Duration timeout) {
    this(endpoint, apiKey, timeout, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
  }

  /**
   * Creates a new HTTP usage sink on the given client.
   *
   * @param endpoint
   *            the ingestion URL
   * @param apiKey
   *            the CmdrData API key, sent as a bearer token
   * @param timeout
   *            the request timeout
   * @param httpClient
   *            the HTTP client
   */
  public HttpUsageSink(String endpoint, String apiKey, Duration timeout, HttpClient httpClient) {
    if (endpoint == null || endpoint.isEmpty()) {
      throw new IllegalArgumentException("endpoint is required");
    }
    if (apiKey == null || apiKey.isEmpty()) {
      throw new IllegalArgumentException("apiKey is required");
    }
    this.endpoint = URI.create(endpoint);
    this.apiKey = apiKey;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  @Override
  public void recordUsage(UsageEvent event) {
    String json = JsonUtils.toJson(event);

    HttpRequest request = HttpRequest.newBuilder().uri(endpoint).header("Content-Type", "application/json")
        .header("Accept", "application/json").header("Authorization", "Bearer " + apiKey)
        .POST(HttpRequest.BodyPublishers.ofString(json)).timeout(timeout).build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new CmdrDataException("Failed to send usage event: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CmdrDataException("Interrupted while sending usage event", e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      logger.warn("Failed to send usage event to {}: status={}, body={}", endpoint, status, response.body());
      throw CmdrDataException.builder().message("Failed to send usage event: HTTP " + status)
          .errorCode("HTTP_" + status).details(response.body()).build();
    }

    logger.debug("Usage event sent: requestId={}", event.getRequestId());
  }

  public URI getEndpoint() {
    return endpoint;
  }

  @Override
  public String toString() {
    return "HttpUsageSink(" + endpoint + ")";
  }
}
