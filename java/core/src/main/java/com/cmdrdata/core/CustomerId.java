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
 * A customer id override as given at the call site. It has three states:
 * <ul>
 * <li>{@link #unset()} - nothing was passed, the ambient default applies</li>
 * <li>{@link #none()} - an explicit "no customer", the ambient default is not
 * consulted</li>
 * <li>{@link #of(String)} - an explicit customer id</li>
 * </ul>
 */
public final class CustomerId {

  private enum State {
    UNSET, NONE, VALUE
  }

  private static final CustomerId UNSET = new CustomerId(State.UNSET, null);
  private static final CustomerId NONE = new CustomerId(State.NONE, null);

  private final State state;
  private final String value;

  private CustomerId(State state, String value) {
    this.state = state;
    this.value = value;
  }

  public static CustomerId unset() {
    return UNSET;
  }

  public static CustomerId none() {
    return NONE;
  }

  /**
   * Creates an explicit override.
   *
   * @param value
   *            the customer id; null means an explicit "no customer"
   * @return the override
   */
  public static CustomerId of(String value) {
    return value == null ? NONE : new CustomerId(State.VALUE, value);
  }

  public boolean isUnset() {
    return state == State.UNSET;
  }

  public boolean isNone() {
    return state == State.NONE;
  }

  public boolean isPresent() {
    return state == State.VALUE;
  }

  /**
   * Returns the explicit id.
   *
   * @return the id, or null when unset or none
   */
  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CustomerId)) {
      return false;
    }
    CustomerId other = (CustomerId) o;
    return state == other.state && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, value);
  }

  @Override
  public String toString() {
    switch (state) {
      case UNSET :
        return "CustomerId(unset)";
      case NONE :
        return "CustomerId(none)";
      default :
        return "CustomerId(" + value + ")";
    }
  }
}
