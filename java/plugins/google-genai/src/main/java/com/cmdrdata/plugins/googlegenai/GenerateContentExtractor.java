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
 * Extracts usage from {@code models.generateContent} responses.
 *
 * <p>
 * Token counts come from {@code usageMetadata}; a response without it is not
 * recorded. The first candidate contributes its finish reason and safety
 * ratings to the event metadata.
 */
public class GenerateContentExtractor extends GeminiExtractor {

  public GenerateContentExtractor() {
    this(CustomerContext.resolver());
  }

  public GenerateContentExtractor(CustomerResolver customerResolver) {
    super(customerResolver);
  }

  @Override
  protected boolean extractUsage(Object response, UsageEvent.Builder event) {
    Object usage = ResultFields.read(response, "usageMetadata");
    if (usage == null) {
      return false;
    }

    event.inputTokens(ResultFields.readInt(usage, "promptTokenCount"))
        .outputTokens(ResultFields.readInt(usage, "candidatesTokenCount"))
        .totalTokens(ResultFields.readInteger(usage, "totalTokenCount"));

    event.putMetadata("response_id", ResultFields.readString(response, "responseId"));
    event.putMetadata("model_version", ResultFields.readString(response, "modelVersion"));

    Object candidate = ResultFields.first(ResultFields.read(response, "candidates"));
    if (candidate != null) {
      event.putMetadata("finish_reason", ResultFields.readString(candidate, "finishReason"));
      event.putMetadata("safety_ratings", ResultFields.read(candidate, "safetyRatings"));
    }
    return true;
  }
}
