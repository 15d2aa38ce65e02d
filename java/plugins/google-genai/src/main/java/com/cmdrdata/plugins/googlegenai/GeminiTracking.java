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

import com.cmdrdata.core.CallContext;
import com.cmdrdata.core.CustomerContext;
import com.cmdrdata.core.CustomerResolver;
import com.cmdrdata.core.InterceptionTable;

/**
 * Tracking configuration for the Google GenAI Java SDK.
 */
public final class GeminiTracking {

  /**
   * Provider name reported in usage events.
   */
  public static final String PROVIDER = "google";

  public static final String GENERATE_CONTENT = "models.generateContent";
  public static final String COUNT_TOKENS = "models.countTokens";

  static final String UNKNOWN_MODEL = "unknown";
  private static final String MODEL_PREFIX = "models/";

  private GeminiTracking() {
    // Utility class
  }

  /**
   * Returns the default interception table, resolving customers through
   * {@link CustomerContext}.
   *
   * @return the table tracking {@code generateContent} and {@code countTokens}
   */
  public static InterceptionTable trackMethods() {
    return trackMethods(CustomerContext.resolver());
  }

  /**
   * Returns the default interception table with a custom customer resolver.
   *
   * @param customerResolver
   *            the customer resolver
   * @return the table tracking {@code generateContent} and {@code countTokens}
   */
  public static InterceptionTable trackMethods(CustomerResolver customerResolver) {
    return InterceptionTable.builder().track(GENERATE_CONTENT, new GenerateContentExtractor(customerResolver))
        .track(COUNT_TOKENS, new CountTokensExtractor(customerResolver)).build();
  }

  /**
   * Determines the model of a call: the {@code model} keyword argument, else the
   * first positional string argument.
   *
   * @param context
   *            the call context
   * @return the normalized model name, {@code "unknown"} if there is none
   */
  public static String modelOf(CallContext context) {
    Object model = context.getKeywordArgs().get("model");
    if (model == null) {
      for (Object arg : context.getArgs()) {
        if (arg instanceof String) {
          model = arg;
          break;
        }
      }
    }
    return normalizeModel(model);
  }

  /**
   * Strips the {@code models/} resource prefix from a model name.
   *
   * @param model
   *            the model name, may be null
   * @return the bare model name, {@code "unknown"} for null
   */
  public static String normalizeModel(Object model) {
    if (model == null) {
      return UNKNOWN_MODEL;
    }
    String name = model.toString();
    return name.startsWith(MODEL_PREFIX) ? name.substring(MODEL_PREFIX.length()) : name;
  }
}
