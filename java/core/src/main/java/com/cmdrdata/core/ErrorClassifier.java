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

import java.lang.reflect.Method;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ErrorClassifier maps an exception raised by a wrapped method to an
 * {@link ErrorInfo}.
 *
 * <p>
 * Errors exposing a status code accessor are transport errors. The accessor
 * is found by name, so any SDK works without a compile-time dependency: the
 * Google GenAI SDK's {@code ApiException.code()}, HTTP client exceptions with
 * {@code getStatusCode()}, or gRPC exceptions through
 * {@code getStatus().getCode()}. Everything else is an SDK error without a
 * code.
 */
public final class ErrorClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ErrorClassifier.class);

  private static final String[] CODE_ACCESSORS = {"code", "getCode", "statusCode", "getStatusCode"};

  private ErrorClassifier() {
    // Utility class
  }

  /**
   * Classifies an error.
   *
   * @param error
   *            the error thrown by the wrapped method
   * @return the classification
   */
  public static ErrorInfo classify(Throwable error) {
    String message = messageOf(error);
    Method accessor = ReflectiveMembers.findNoArgMethod(error.getClass(), CODE_ACCESSORS);
    Object owner = error;
    if (accessor == null) {
      Object status = readStatus(error);
      if (status != null) {
        accessor = ReflectiveMembers.findNoArgMethod(status.getClass(), CODE_ACCESSORS);
        owner = status;
      }
    }
    if (accessor == null) {
      return new ErrorInfo(ErrorKind.SDK_ERROR, null, message);
    }
    try {
      Object code = ReflectiveMembers.invoke(accessor, owner, new Object[0]);
      return new ErrorInfo(ErrorKind.TRANSPORT_ERROR, code != null ? String.valueOf(code) : null, message);
    } catch (Exception e) {
      logger.debug("Status code accessor of {} failed: {}", error.getClass().getName(), e.getMessage());
      return new ErrorInfo(ErrorKind.SDK_ERROR, null, message);
    }
  }

  /**
   * Returns the string form of an error: its message, or its class name when
   * it has none.
   *
   * @param error
   *            the error
   * @return the string form
   */
  public static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getName();
  }

  private static Object readStatus(Throwable error) {
    Method status = ReflectiveMembers.findNoArgMethod(error.getClass(), "getStatus", "status");
    if (status == null) {
      return null;
    }
    try {
      Object value = ReflectiveMembers.invoke(status, error, new Object[0]);
      return ReflectiveMembers.isScalar(value) ? null : value;
    } catch (Exception e) {
      return null;
    }
  }
}
