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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CallOptions are the reserved call-site arguments understood by a tracked
 * method. They are never forwarded to the wrapped client.
 *
 * <p>
 * Options reach a tracked method in one of three ways, the first found wins
 * per option:
 * <ol>
 * <li>as keyword arguments named {@value #CUSTOMER_ID}, {@value #TRACK_USAGE}
 * and {@value #METADATA}</li>
 * <li>as a trailing positional {@code CallOptions} argument</li>
 * <li>as the thread's scoped options, see {@link #runWith(CallOptions, Supplier)}
 * (the only way for interface-typed proxies)</li>
 * </ol>
 */
public final class CallOptions {

  private static final Logger logger = LoggerFactory.getLogger(CallOptions.class);

  public static final String CUSTOMER_ID = "customer_id";
  public static final String TRACK_USAGE = "track_usage";
  public static final String METADATA = "metadata";

  /**
   * The keyword argument names stripped before forwarding.
   */
  public static final Set<String> RESERVED_KEYWORDS = Set.of(CUSTOMER_ID, TRACK_USAGE, METADATA);

  private static final CallOptions DEFAULTS = new Builder().build();
  private static final ThreadLocal<CallOptions> SCOPED = new ThreadLocal<>();

  private final CustomerId customerId;
  private final boolean trackUsage;
  private final Map<String, Object> metadata;

  private CallOptions(Builder builder) {
    this.customerId = builder.customerId;
    this.trackUsage = builder.trackUsage;
    this.metadata = builder.metadata != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
        : null;
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
   * Returns the default options: customer unset, tracking on, no metadata.
   *
   * @return the default options
   */
  public static CallOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Shortcut for options billing a given customer.
   *
   * @param customerId
   *            the customer id, null for an explicit "no customer"
   * @return the options
   */
  public static CallOptions forCustomer(String customerId) {
    return builder().customerId(customerId).build();
  }

  /**
   * Shortcut for options disabling tracking.
   *
   * @return the options
   */
  public static CallOptions untracked() {
    return builder().trackUsage(false).build();
  }

  /**
   * Returns the options scoped to the current thread.
   *
   * @return the scoped options, or the defaults
   */
  public static CallOptions current() {
    CallOptions scoped = SCOPED.get();
    return scoped != null ? scoped : DEFAULTS;
  }

  /**
   * Runs a body with scoped options, restoring the previous scope afterwards.
   *
   * @param options
   *            the options for calls made by the body
   * @param body
   *            the body to run
   * @param <T>
   *            the result type
   * @return the body's result
   */
  public static <T> T runWith(CallOptions options, Supplier<T> body) {
    CallOptions previous = SCOPED.get();
    SCOPED.set(options);
    try {
      return body.get();
    } finally {
      if (previous == null) {
        SCOPED.remove();
      } else {
        SCOPED.set(previous);
      }
    }
  }

  /**
   * Removes the reserved keywords from a keyword argument map and merges them
   * over base options.
   *
   * @param base
   *            the options to start from
   * @param keywordArgs
   *            the mutable keyword arguments, modified in place
   * @return the merged options
   */
  public static CallOptions extract(CallOptions base, Map<String, Object> keywordArgs) {
    CallOptions start = base != null ? base : DEFAULTS;
    if (keywordArgs == null || keywordArgs.isEmpty()) {
      return start;
    }
    boolean hasCustomer = keywordArgs.containsKey(CUSTOMER_ID);
    boolean hasTrack = keywordArgs.containsKey(TRACK_USAGE);
    boolean hasMetadata = keywordArgs.containsKey(METADATA);
    if (!hasCustomer && !hasTrack && !hasMetadata) {
      return start;
    }

    Builder builder = start.toBuilder();
    if (hasCustomer) {
      builder.customerId(toCustomerId(keywordArgs.remove(CUSTOMER_ID)));
    }
    if (hasTrack) {
      builder.trackUsage(toBoolean(keywordArgs.remove(TRACK_USAGE)));
    }
    if (hasMetadata) {
      builder.metadata(toMetadata(keywordArgs.remove(METADATA)));
    }
    return builder.build();
  }

  private static CustomerId toCustomerId(Object value) {
    if (value instanceof CustomerId) {
      return (CustomerId) value;
    }
    return CustomerId.of(value != null ? String.valueOf(value) : null);
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return value != null && Boolean.parseBoolean(String.valueOf(value));
  }

  private static Map<String, Object> toMetadata(Object value) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      logger.warn("Ignoring '{}' keyword of type {}, expected a map", METADATA, value.getClass().getName());
      return null;
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    ((Map<?, ?>) value).forEach((k, v) -> metadata.put(String.valueOf(k), v));
    return metadata;
  }

  public CustomerId getCustomerId() {
    return customerId;
  }

  public boolean isTrackUsage() {
    return trackUsage;
  }

  /**
   * Returns the caller's metadata override.
   *
   * @return the metadata, or null if none was given
   */
  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /**
   * Creates a builder initialised with these options.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.customerId = customerId;
    builder.trackUsage = trackUsage;
    builder.metadata = metadata;
    return builder;
  }

  @Override
  public String toString() {
    return "CallOptions{customerId=" + customerId + ", trackUsage=" + trackUsage + ", metadata=" + metadata + "}";
  }

  /**
   * Builder for CallOptions.
   */
  public static class Builder {
    private CustomerId customerId = CustomerId.unset();
    private boolean trackUsage = true;
    private Map<String, Object> metadata;

    /**
     * Sets an explicit customer id.
     *
     * @param customerId
     *            the customer id, null for an explicit "no customer"
     * @return this builder
     */
    public Builder customerId(String customerId) {
      this.customerId = CustomerId.of(customerId);
      return this;
    }

    public Builder customerId(CustomerId customerId) {
      this.customerId = customerId != null ? customerId : CustomerId.unset();
      return this;
    }

    public Builder trackUsage(boolean trackUsage) {
      this.trackUsage = trackUsage;
      return this;
    }

    public Builder metadata(Map<String, Object> metadata) {
      this.metadata = metadata;
      return this;
    }

    public CallOptions build() {
      return new CallOptions(this);
    }
  }
}
