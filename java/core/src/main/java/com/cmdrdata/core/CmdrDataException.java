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
 * CmdrDataException is the base exception for all errors raised by the
 * tracking layer itself. Errors raised by a wrapped client are never converted
 * into this type, except for checked exceptions surfaced through
 * {@link UpstreamCallException}.
 */
public class CmdrDataException extends RuntimeException {

  private final String errorCode;
  private final Object details;

  /**
   * Creates a new CmdrDataException.
   *
   * @param message
   *            the error message
   */
  public CmdrDataException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new CmdrDataException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public CmdrDataException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new CmdrDataException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public CmdrDataException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Creates a builder for CmdrDataException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for CmdrDataException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private String errorCode;
    private Object details;

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder errorCode(String errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public CmdrDataException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new CmdrDataException(message, cause, errorCode, details);
    }
  }
}
