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
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * BoundMethod is the overload set of a public method bound to its receiver.
 *
 * <p>
 * A call picks the first overload, fewest parameters first, whose parameters
 * accept the arguments: positional arguments fill the leading parameters and
 * keyword arguments fill the rest by parameter name. Keyword binding needs
 * classes compiled with {@code -parameters}; without parameter names only
 * positional calls match. Varargs are passed as an explicit array.
 */
public final class BoundMethod implements Invocable {

  private final Object target;
  private final String name;
  private final List<Method> overloads;

  BoundMethod(Object target, String name, List<Method> overloads) {
    this.target = target;
    this.name = name;
    this.overloads = Collections.unmodifiableList(new ArrayList<>(overloads));
  }

  @Override
  public Object invoke(List<Object> args, Map<String, Object> keywordArgs) throws Exception {
    List<Object> positional = args != null ? args : Collections.emptyList();
    Map<String, Object> keywords = keywordArgs != null ? keywordArgs : Collections.emptyMap();
    for (Method overload : overloads) {
      Object[] bound = bind(overload, positional, keywords);
      if (bound != null) {
        return ReflectiveMembers.invoke(overload, target, bound);
      }
    }
    throw new IllegalArgumentException("No overload of " + getName() + " accepts " + positional.size()
        + " positional argument(s) and keyword(s) " + keywords.keySet());
  }

  private static Object[] bind(Method method, List<Object> args, Map<String, Object> keywordArgs) {
    Parameter[] parameters = method.getParameters();
    if (args.size() + keywordArgs.size() != parameters.length) {
      return null;
    }
    Object[] values = new Object[parameters.length];
    for (int i = 0; i < parameters.length; i++) {
      Object value;
      if (i < args.size()) {
        value = args.get(i);
      } else if (parameters[i].isNamePresent() && keywordArgs.containsKey(parameters[i].getName())) {
        value = keywordArgs.get(parameters[i].getName());
      } else {
        return null;
      }
      if (!ReflectiveMembers.isAssignable(parameters[i].getType(), value)) {
        return null;
      }
      values[i] = value;
    }
    return values;
  }

  /**
   * Checks whether one of the overloads takes no arguments, which makes the
   * member usable as a namespace accessor.
   *
   * @return true if a zero-argument overload exists
   */
  public boolean hasNoArgOverload() {
    return !overloads.isEmpty() && overloads.get(0).getParameterCount() == 0;
  }

  public Object getTarget() {
    return target;
  }

  /**
   * Returns the qualified name, e.g. {@code Models.generateContent}.
   *
   * @return the qualified name
   */
  @Override
  public String getName() {
    return target.getClass().getSimpleName() + "." + name;
  }

  /**
   * Returns the overloads, fewest parameters first.
   *
   * @return the reflective methods
   */
  public List<Method> getOverloads() {
    return overloads;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BoundMethod)) {
      return false;
    }
    BoundMethod other = (BoundMethod) o;
    return target == other.target && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(target) + name.hashCode();
  }

  @Override
  public String toString() {
    return "BoundMethod(" + getName() + ")";
  }
}
