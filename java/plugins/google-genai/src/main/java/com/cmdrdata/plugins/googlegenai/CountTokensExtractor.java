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

import com.cmdrdata.core.CustomerContext;
import com.cmdrdata.core.CustomerResolver;
import com.cmdrdata.core.ResultFields;
import com.cmdrdata.core.UsageEvent;

/**
 * Extracts usage from {@code models.countTokens} responses. The counted
 * tokens are billed as input; output is always zero.
 */
public class CountTokensExtractor extends GeminiExtractor {

  static final String OPERATION = "count_tokens";

  public CountTokensExtractor() {
    this(CustomerContext.resolver());
  }

  public CountTokensExtractor(CustomerResolver customerResolver) {
    super(customerResolver);
  }

  @Override
  protected void baseMetadata(UsageEvent.Builder event) {
    event.putMetadata("operation", OPERATION);
  }

  @Override
  protected boolean extractUsage(Object response, UsageEvent.Builder event) {
    Integer totalTokens = ResultFields.readInteger(response, "totalTokens");
    if (totalTokens != null) {
      event.inputTokens(totalTokens);
      event.putMetadata("total_tokens", totalTokens);
    }
    event.outputTokens(0);
    return true;
  }
}
