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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * UsageEvent is the normalized record of one tracked call: who is billed,
 * which model was used, how many tokens went in and out, and how the call
 * went.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class UsageEvent {

  @JsonProperty("customer_id")
  private final String customerId;

  @JsonProperty("provider")
  private final String provider;

  @JsonProperty("model")
  private final String model;

  @JsonProperty("input_tokens")
  private final int inputTokens;

  @JsonProperty("output_tokens")
  private final int outputTokens;

  @JsonProperty("total_tokens")
  private final Integer totalTokens;

  @JsonProperty("metadata")
  private final Map<String, Object> metadata;

  @JsonProperty("request_id")
  private final String requestId;

  @JsonProperty("method")
  private final String methodPath;

  @JsonProperty("request_start_time")
  private final Instant requestStartTime;

  @JsonProperty("request_end_time")
  private final Instant requestEndTime;

  @JsonProperty("error_occurred")
  private final boolean errorOccurred;

  @JsonProperty("error_type")
  private final ErrorKind errorType;

  @JsonProperty("error_code")
  private final String errorCode;

  @JsonProperty("error_message")
  private final String errorMessage;

  private UsageEvent(Builder builder) {
    this.customerId = builder.customerId;
    this.provider = builder.provider;
    this.model = builder.model;
    this.inputTokens = builder.inputTokens;
    this.outputTokens = builder.outputTokens;
    this.totalTokens = builder.totalTokens;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    this.requestId = builder.requestId;
    this.methodPath = builder.methodPath;
    this.requestStartTime = builder.requestStartTime;
    this.requestEndTime = builder.requestEndTime;
    this.errorOccurred = builder.errorOccurred;
    this.errorType = builder.errorType;
    this.errorCode = builder.errorCode;
    this.errorMessage = builder.errorMessage;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public String getCustomerId() {
    return customerId;
  }

  public String getProvider() {
    return provider;
  }

  public String getModel() {
    return model;
  }

  /**
   * Returns the provider-qualified operation id, e.g.
   * {@code google/gemini-2.5-flash}.
   *
   * @return the operation id
   */
  @JsonProperty("operation_id")
  public String getOperationId() {
    return provider != null ? provider + "/" + model : model;
  }

  public int getInputTokens() {
    return inputTokens;
  }

  public int getOutputTokens() {
    return outputTokens;
  }

  /**
   * Returns the total reported by the provider.
   *
   * @return the total, or null if the provider reported none
   */
  public Integer getTotalTokens() {
    return totalTokens;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public String getRequestId() {
    return requestId;
  }

  public String getMethodPath() {
    return methodPath;
  }

  public Instant getRequestStartTime() {
    return requestStartTime;
  }

  public Instant getRequestEndTime() {
    return requestEndTime;
  }

  /**
   * Returns the call latency.
   *
   * @return the latency in milliseconds, or null without timestamps
   */
  @JsonProperty("latency_ms")
  public Long getLatencyMs() {
    if (requestStartTime == null || requestEndTime == null) {
      return null;
    }
    return requestEndTime.toEpochMilli() - requestStartTime.toEpochMilli();
  }

  public boolean isErrorOccurred() {
    return errorOccurred;
  }

  public ErrorKind getErrorType() {
    return errorType;
  }

  public String getErrorCode() {
    return errorCode;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  @JsonIgnore
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.customerId = customerId;
    builder.provider = provider;
    builder.model = model;
    builder.inputTokens = inputTokens;
    builder.outputTokens = outputTokens;
    builder.totalTokens = totalTokens;
    builder.metadata = new LinkedHashMap<>(metadata);
    builder.requestId = requestId;
    builder.methodPath = methodPath;
    builder.requestStartTime = requestStartTime;
    builder.requestEndTime = requestEndTime;
    builder.errorOccurred = errorOccurred;
    builder.errorType = errorType;
    builder.errorCode = errorCode;
    builder.errorMessage = errorMessage;
    return builder;
  }

  @Override
  public String toString() {
    return "UsageEvent{customerId=" + customerId + ", operation=" + getOperationId() + ", inputTokens="
        + inputTokens + ", outputTokens=" + outputTokens + ", requestId=" + requestId + ", errorOccurred="
        + errorOccurred + "}";
  }

  /**
   * Builder for UsageEvent.
   */
  public static class Builder {
    private String customerId;
    private String provider;
    private String model;
    private int inputTokens;
    private int outputTokens;
    private Integer totalTokens;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private String requestId;
    private String methodPath;
    private Instant requestStartTime;
    private Instant requestEndTime;
    private boolean errorOccurred;
    private ErrorKind errorType;
    private String errorCode;
    private String errorMessage;

    public Builder customerId(String customerId) {
      this.customerId = customerId;
      return this;
    }

    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder inputTokens(int inputTokens) {
      this.inputTokens = inputTokens;
      return this;
    }

    public Builder outputTokens(int outputTokens) {
      this.outputTokens = outputTokens;
      return this;
    }

    public Builder totalTokens(Integer totalTokens) {
      this.totalTokens = totalTokens;
      return this;
    }

    /**
     * Replaces the metadata.
     *
     * @param metadata
     *            the metadata, null for none
     * @return this builder
     */
    public Builder metadata(Map<String, Object> metadata) {
      this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
      return this;
    }

    /**
     * Adds one metadata entry. Null values are skipped.
     *
     * @param key
     *            the key
     * @param value
     *            the value
     * @return this builder
     */
    public Builder putMetadata(String key, Object value) {
      if (value != null) {
        this.metadata.put(key, value);
      }
      return this;
    }

    public Builder requestId(String requestId) {
      this.requestId = requestId;
      return this;
    }

    public Builder methodPath(String methodPath) {
      this.methodPath = methodPath;
      return this;
    }

    public Builder requestStartTime(Instant requestStartTime) {
      this.requestStartTime = requestStartTime;
      return this;
    }

    public Builder requestEndTime(Instant requestEndTime) {
      this.requestEndTime = requestEndTime;
      return this;
    }

    public Builder errorOccurred(boolean errorOccurred) {
      this.errorOccurred = errorOccurred;
      return this;
    }

    public Builder errorType(ErrorKind errorType) {
      this.errorType = errorType;
      return this;
    }

    public Builder errorCode(String errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    /**
     * Copies correlation id, method path, timestamps and error fields from a
     * call context.
     *
     * @param context
     *            the call context
     * @return this builder
     */
    public Builder fromContext(CallContext context) {
      this.requestId = context.getRequestId();
      this.methodPath = context.getMethodPath();
      this.requestStartTime = context.getStartTime();
      this.requestEndTime = context.getEndTime();
      this.errorOccurred = context.isFailure();
      ErrorInfo error = context.getError();
      if (error != null) {
        this.errorType = error.getKind();
        this.errorCode = error.getCode();
        this.errorMessage = error.getMessage();
      }
      return this;
    }

    public UsageEvent build() {
      return new UsageEvent(this);
    }
  }
}
