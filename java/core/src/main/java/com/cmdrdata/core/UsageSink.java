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

/**
 * UsageSink consumes usage events.
 *
 * <p>
 * It is called on the caller's thread right after a tracked call, so an
 * implementation doing I/O must hand the event off instead of blocking, see
 * {@link com.cmdrdata.core.sink.BackgroundUsageSink}.
 */
@FunctionalInterface
public interface UsageSink {

  /**
   * Records a usage event.
   *
   * @param event
   *            the event
   */
  void recordUsage(UsageEvent event);
}
