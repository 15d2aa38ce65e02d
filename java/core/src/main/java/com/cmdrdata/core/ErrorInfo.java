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

import java.util.Objects;

/**
 * ErrorInfo describes why a tracked call failed.
 */
public final class ErrorInfo {

  private final ErrorKind kind;
  private final String code;
  private final String message;

  /**
   * Creates a new ErrorInfo.
   *
   * @param kind
   *            the error kind
   * @param code
   *            the transport status code, null for SDK errors
   * @param message
   *            the error's string form
   */
  public ErrorInfo(ErrorKind kind, String code, String message) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.code = code;
    this.message = message;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Returns the transport status code.
   *
   * @return the code, or null if the error carried none
   */
  public String getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ErrorInfo)) {
      return false;
    }
    ErrorInfo other = (ErrorInfo) o;
    return kind == other.kind && Objects.equals(code, other.code) && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, code, message);
  }

  @Override
  public String toString() {
    return "ErrorInfo{kind=" + kind + ", code=" + code + ", message=" + message + "}";
  }
}
