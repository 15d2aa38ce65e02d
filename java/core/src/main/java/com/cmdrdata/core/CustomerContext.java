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

import java.util.function.Supplier;

/**
 * CustomerContext holds the ambient customer id of the current thread.
 *
 * <p>
 * Calls made without a {@code customer_id} override are billed to this
 * customer. An explicit {@link CustomerId#none()} override never falls back to
 * it.
 *
 * <pre>
 * {@code
 * CustomerContext.runWith("customer-123", () -> client.callPath("models.generateContent", null, model, prompt, null));
 * }
 * </pre>
 */
public final class CustomerContext {

  private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

  private CustomerContext() {
    // Utility class
  }

  /**
   * Sets the ambient customer id for the current thread.
   *
   * @param customerId
   *            the customer id, or null to clear it
   */
  public static void set(String customerId) {
    if (customerId == null) {
      CURRENT.remove();
    } else {
      CURRENT.set(customerId);
    }
  }

  /**
   * Returns the ambient customer id of the current thread.
   *
   * @return the customer id, or null if none is set
   */
  public static String get() {
    return CURRENT.get();
  }

  /**
   * Clears the ambient customer id of the current thread.
   */
  public static void clear() {
    CURRENT.remove();
  }

  /**
   * Runs a body with an ambient customer id, restoring the previous one
   * afterwards.
   *
   * @param customerId
   *            the customer id
   * @param body
   *            the body to run
   * @param <T>
   *            the result type
   * @return the body's result
   */
  public static <T> T runWith(String customerId, Supplier<T> body) {
    String previous = CURRENT.get();
    set(customerId);
    try {
      return body.get();
    } finally {
      set(previous);
    }
  }

  /**
   * Runs a body with an ambient customer id, restoring the previous one
   * afterwards.
   *
   * @param customerId
   *            the customer id
   * @param body
   *            the body to run
   */
  public static void runWith(String customerId, Runnable body) {
    runWith(customerId, () -> {
      body.run();
      return null;
    });
  }

  /**
   * Resolves the effective customer id: an explicit override wins, an explicit
   * none yields null, and an unset override falls back to the ambient id.
   *
   * @param override
   *            the call-site override, null is treated as unset
   * @return the effective customer id, or null
   */
  public static String resolve(CustomerId override) {
    if (override == null || override.isUnset()) {
      return CURRENT.get();
    }
    return override.getValue();
  }

  /**
   * Returns a resolver backed by this context.
   *
   * @return the resolver
   */
  public static CustomerResolver resolver() {
    return CustomerContext::resolve;
  }
}
