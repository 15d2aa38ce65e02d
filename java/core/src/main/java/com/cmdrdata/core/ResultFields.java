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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * ResultFields reads well-known fields of API results without compiling
 * against the result types.
 *
 * <p>
 * A field {@code usageMetadata} is read, in order, from an accessor
 * {@code usageMetadata()}, {@code getUsageMetadata()} or
 * {@code isUsageMetadata()}, a public field, or a map entry. {@code Optional}
 * values are unwrapped, so an empty optional reads as absent. Exceptions
 * thrown by an accessor propagate.
 */
public final class ResultFields {

  private ResultFields() {
    // Utility class
  }

  /**
   * Reads a field.
   *
   * @param source
   *            the object to read from, may be null
   * @param name
   *            the field name
   * @return the value, or null if the source is null or has no such field
   */
  public static Object read(Object source, String name) {
    if (source == null) {
      return null;
    }
    if (source instanceof Map) {
      return unwrap(((Map<?, ?>) source).get(name));
    }
    String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
    Method accessor = ReflectiveMembers.findNoArgMethod(source.getClass(), name, "get" + capitalized,
        "is" + capitalized);
    if (accessor != null) {
      try {
        return unwrap(ReflectiveMembers.invoke(accessor, source, new Object[0]));
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new CmdrDataException("Failed to read '" + name + "' of '" + source.getClass().getSimpleName() + "'",
            e);
      }
    }
    Field field = ReflectiveMembers.findField(source.getClass(), name);
    return field != null ? unwrap(ReflectiveMembers.readField(field, source)) : null;
  }

  /**
   * Reads a dotted path of fields, e.g. {@code usageMetadata.promptTokenCount}.
   *
   * @param source
   *            the object to read from
   * @param path
   *            the dotted path
   * @return the value, or null if any step is absent
   */
  public static Object readPath(Object source, String path) {
    Object current = source;
    for (String segment : path.split("\\.")) {
      current = read(current, segment);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  /**
   * Checks whether a field is present.
   *
   * @param source
   *            the object to read from
   * @param name
   *            the field name
   * @return true if the field exists and is neither null nor empty
   */
  public static boolean has(Object source, String name) {
    return read(source, name) != null;
  }

  /**
   * Reads an integer field.
   *
   * @param source
   *            the object to read from
   * @param name
   *            the field name
   * @return the value, or 0 if absent or not a number
   */
  public static int readInt(Object source, String name) {
    Integer value = readInteger(source, name);
    return value != null ? value : 0;
  }

  /**
   * Reads an integer field.
   *
   * @param source
   *            the object to read from
   * @param name
   *            the field name
   * @return the value, or null if absent or not a number
   */
  public static Integer readInteger(Object source, String name) {
    Object value = read(source, name);
    return value instanceof Number ? ((Number) value).intValue() : null;
  }

  /**
   * Reads a field and converts it to a string.
   *
   * @param source
   *            the object to read from
   * @param name
   *            the field name
   * @return the string form, or null if absent
   */
  public static String readString(Object source, String name) {
    Object value = read(source, name);
    return value != null ? String.valueOf(value) : null;
  }

  /**
   * Returns the first element of a list or array value.
   *
   * @param value
   *            a list, an array, or null
   * @return the first element, or null if there is none
   */
  public static Object first(Object value) {
    if (value instanceof List) {
      List<?> list = (List<?>) value;
      return list.isEmpty() ? null : unwrap(list.get(0));
    }
    if (value != null && value.getClass().isArray()) {
      return Array.getLength(value) == 0 ? null : unwrap(Array.get(value, 0));
    }
    return null;
  }

  private static Object unwrap(Object value) {
    if (value instanceof Optional) {
      return ((Optional<?>) value).orElse(null);
    }
    if (value instanceof OptionalInt) {
      OptionalInt optional = (OptionalInt) value;
      return optional.isPresent() ? optional.getAsInt() : null;
    }
    if (value instanceof OptionalLong) {
      OptionalLong optional = (OptionalLong) value;
      return optional.isPresent() ? optional.getAsLong() : null;
    }
    if (value instanceof OptionalDouble) {
      OptionalDouble optional = (OptionalDouble) value;
      return optional.isPresent() ? optional.getAsDouble() : null;
    }
    return value;
  }
}
