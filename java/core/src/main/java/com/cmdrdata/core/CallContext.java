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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CallContext describes one invocation of a tracked method: its correlation
 * id, the forwarded arguments, the caller's options, its timing and its
 * outcome.
 */
public final class CallContext {

  private final String requestId;
  private final String methodPath;
  private final List<Object> args;
  private final Map<String, Object> keywordArgs;
  private final CallOptions options;
  private final Instant startTime;
  private final Instant endTime;
  private final CallOutcome outcome;
  private final ErrorInfo error;

  private CallContext(Builder builder) {
    this.requestId = Objects.requireNonNull(builder.requestId, "requestId");
    this.methodPath = Objects.requireNonNull(builder.methodPath, "methodPath");
    this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
    this.keywordArgs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.keywordArgs));
    this.options = builder.options != null ? builder.options : CallOptions.defaults();
    this.startTime = Objects.requireNonNull(builder.startTime, "startTime");
    this.endTime = Objects.requireNonNull(builder.endTime, "endTime");
    this.error = builder.error;
    this.outcome = builder.error != null ? CallOutcome.FAILURE : CallOutcome.SUCCESS;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the correlation id minted for this call.
   *
   * @return the request id
   */
  public String getRequestId() {
    return requestId;
  }

  /**
   * Returns the dotted path of the called method, e.g.
   * {@code models.generateContent}.
   *
   * @return the method path
   */
  public String getMethodPath() {
    return methodPath;
  }

  /**
   * Returns the positional arguments forwarded to the method.
   *
   * @return the positional arguments
   */
  public List<Object> getArgs() {
    return args;
  }

  /**
   * Returns the keyword arguments forwarded to the method, reserved keywords
   * removed.
   *
   * @return the keyword arguments
   */
  public Map<String, Object> getKeywordArgs() {
    return keywordArgs;
  }

  public CallOptions getOptions() {
    return options;
  }

  public CustomerId getCustomerOverride() {
    return options.getCustomerId();
  }

  /**
   * Returns the caller's metadata override.
   *
   * @return the metadata, or null
   */
  public Map<String, Object> getMetadataOverride() {
    return options.getMetadata();
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  /**
   * Returns the wall-clock duration of the call.
   *
   * @return the latency in milliseconds
   */
  public long getLatencyMs() {
    return Duration.between(startTime, endTime).toMillis();
  }

  public CallOutcome getOutcome() {
    return outcome;
  }

  public boolean isSuccess() {
    return outcome == CallOutcome.SUCCESS;
  }

  public boolean isFailure() {
    return outcome == CallOutcome.FAILURE;
  }

  /**
   * Returns the error classification.
   *
   * @return the error, or null on success
   */
  public ErrorInfo getError() {
    return error;
  }

  @Override
  public String toString() {
    return "CallContext{requestId=" + requestId + ", methodPath=" + methodPath + ", outcome=" + outcome
        + ", latencyMs=" + getLatencyMs() + (error != null ? ", error=" + error : "") + "}";
  }

  /**
   * Builder for CallContext.
   */
  public static class Builder {
    private String requestId;
    private String methodPath;
    private List<Object> args = Collections.emptyList();
    private Map<String, Object> keywordArgs = Collections.emptyMap();
    private CallOptions options;
    private Instant startTime;
    private Instant endTime;
    private ErrorInfo error;

    public Builder requestId(String requestId) {
      this.requestId = requestId;
      return this;
    }

    public Builder methodPath(String methodPath) {
      this.methodPath = methodPath;
      return this;
    }

    public Builder args(List<Object> args) {
      this.args = args != null ? args : Collections.emptyList();
      return this;
    }

    public Builder keywordArgs(Map<String, Object> keywordArgs) {
      this.keywordArgs = keywordArgs != null ? keywordArgs : Collections.emptyMap();
      return this;
    }

    public Builder options(CallOptions options) {
      this.options = options;
      return this;
    }

    public Builder startTime(Instant startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(Instant endTime) {
      this.endTime = endTime;
      return this;
    }

    /**
     * Marks the call as failed.
     *
     * @param error
     *            the error classification
     * @return this builder
     */
    public Builder error(ErrorInfo error) {
      this.error = error;
      return this;
    }

    public CallContext build() {
      return new CallContext(this);
    }
  }
}
