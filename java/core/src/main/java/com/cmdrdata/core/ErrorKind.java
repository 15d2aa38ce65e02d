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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of an error raised by a wrapped method.
 */
public enum ErrorKind {

  /**
   * The error exposes a transport status code (HTTP or gRPC).
   */
  TRANSPORT_ERROR("transport_error"),

  /**
   * Any other error raised by the client SDK.
   */
  SDK_ERROR("sdk_error");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the wire name of this kind.
   *
   * @return the wire name, e.g. "sdk_error"
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
