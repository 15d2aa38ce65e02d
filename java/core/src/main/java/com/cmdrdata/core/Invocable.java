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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invocable is a callable member handle taking positional and keyword
 * arguments.
 *
 * <p>
 * {@link #invoke(List, Map)} throws whatever the underlying method throws.
 * The {@code call} conveniences rethrow unchecked exceptions unchanged and
 * carry checked ones in an {@link UpstreamCallException}.
 */
@FunctionalInterface
public interface Invocable {

  /**
   * Invokes the member.
   *
   * @param args
   *            the positional arguments
   * @param keywordArgs
   *            the keyword arguments, bound by parameter name
   * @return the result
   * @throws Exception
   *             the exception thrown by the member
   */
  Object invoke(List<Object> args, Map<String, Object> keywordArgs) throws Exception;

  /**
   * Calls the member with positional arguments.
   *
   * @param args
   *            the positional arguments
   * @return the result
   */
  default Object call(Object... args) {
    return callWithKeywords(null, args);
  }

  /**
   * Calls the member with keyword and positional arguments.
   *
   * @param keywordArgs
   *            the keyword arguments, may be null
   * @param args
   *            the positional arguments
   * @return the result
   */
  default Object callWithKeywords(Map<String, ?> keywordArgs, Object... args) {
    List<Object> positional = args != null ? new ArrayList<>(Arrays.asList(args)) : new ArrayList<>();
    Map<String, Object> keywords = keywordArgs != null ? new LinkedHashMap<>(keywordArgs) : new LinkedHashMap<>();
    try {
      return invoke(positional, keywords);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new UpstreamCallException(getName(), e);
    }
  }

  /**
   * Returns a name identifying the member in messages.
   *
   * @return the member name
   */
  default String getName() {
    return getClass().getSimpleName();
  }
}
