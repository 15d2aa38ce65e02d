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
 * Carries a checked exception thrown by a wrapped client method through the
 * unchecked {@link Invocable#call} surface. The original exception is always
 * available as the cause.
 */
public class UpstreamCallException extends CmdrDataException {

  /**
   * Creates a new UpstreamCallException.
   *
   * @param methodPath
   *            the dotted path of the failed method
   * @param cause
   *            the checked exception thrown by the wrapped method
   */
  public UpstreamCallException(String methodPath, Exception cause) {
    super("Call to " + methodPath + " failed: " + cause.getMessage(), cause, "UPSTREAM_ERROR", null);
  }
}
