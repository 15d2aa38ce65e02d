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

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reflection helpers behind the duck-typed member access of
 * {@link TrackedProxy} and {@link ResultFields}.
 *
 * <p>
 * Only public members are visible. Members declared by non-public classes
 * (lambdas, anonymous classes, generated value classes) are made accessible
 * before use.
 */
final class ReflectiveMembers {

  private static final Comparator<Method> OVERLOAD_ORDER = Comparator.comparingInt(Method::getParameterCount)
      .thenComparing(Method::toGenericString);

  private ReflectiveMembers() {
    // Utility class
  }

  /**
   * Looks up a member: the public field {@code name} if there is one, then
   * the entry {@code name} when the target is a {@link Map}, otherwise the
   * public methods named {@code name} bound to the target.
   *
   * @param target
   *            the object to inspect
   * @param name
   *            the member name
   * @return the field value or a {@link BoundMethod}
   * @throws MemberNotFoundException
   *             if the target has no such member
   */
  static Object lookup(Object target, String name) {
    Field field = findField(target.getClass(), name);
    if (field != null) {
      return readField(field, target);
    }
    if (target instanceof Map && ((Map<?, ?>) target).containsKey(name)) {
      return ((Map<?, ?>) target).get(name);
    }
    List<Method> methods = findMethods(target.getClass(), name);
    if (!methods.isEmpty()) {
      return new BoundMethod(target, name, methods);
    }
    throw new MemberNotFoundException(target.getClass().getSimpleName(), name);
  }

  static Field findField(Class<?> type, String name) {
    try {
      Field field = type.getField(name);
      field.trySetAccessible();
      return field;
    } catch (NoSuchFieldException e) {
      return null;
    }
  }

  static List<Method> findMethods(Class<?> type, String name) {
    List<Method> methods = new ArrayList<>();
    for (Method method : type.getMethods()) {
      if (method.getName().equals(name) && !method.isBridge() && !method.isSynthetic()) {
        methods.add(accessible(method));
      }
    }
    methods.sort(OVERLOAD_ORDER);
    return methods;
  }

  /**
   * Finds the first public no-argument instance method among candidate names.
   *
   * @param type
   *            the class to inspect
   * @param names
   *            the candidate method names, in order of preference
   * @return the method, or null if none exists
   */
  static Method findNoArgMethod(Class<?> type, String... names) {
    for (String name : names) {
      try {
        Method method = type.getMethod(name);
        if (!Modifier.isStatic(method.getModifiers()) && method.getReturnType() != void.class) {
          return accessible(method);
        }
      } catch (NoSuchMethodException e) {
        // try the next candidate
      }
    }
    return null;
  }

  /**
   * Returns a variant of the method that can be invoked from here: the method
   * itself when its class is public or can be opened, else the same signature
   * declared by a public supertype.
   */
  private static Method accessible(Method method) {
    if (Modifier.isPublic(method.getDeclaringClass().getModifiers()) || method.trySetAccessible()) {
      return method;
    }
    Method inherited = fromPublicSupertype(method.getDeclaringClass(), method);
    return inherited != null ? inherited : method;
  }

  private static Method fromPublicSupertype(Class<?> type, Method method) {
    List<Class<?>> supertypes = new ArrayList<>(List.of(type.getInterfaces()));
    if (type.getSuperclass() != null) {
      supertypes.add(type.getSuperclass());
    }
    for (Class<?> supertype : supertypes) {
      if (Modifier.isPublic(supertype.getModifiers())) {
        try {
          return supertype.getMethod(method.getName(), method.getParameterTypes());
        } catch (NoSuchMethodException e) {
          // not declared on this branch
        }
      }
      Method found = fromPublicSupertype(supertype, method);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  static Object readField(Field field, Object target) {
    try {
      return field.get(Modifier.isStatic(field.getModifiers()) ? null : target);
    } catch (IllegalAccessException e) {
      throw new CmdrDataException("Cannot read field '" + field.getName() + "' of '"
          + target.getClass().getSimpleName() + "'", e);
    }
  }

  /**
   * Assigns a public, non-final field of the target, or puts an entry when
   * the target is a {@link Map} without such a field.
   *
   * @param target
   *            the object to modify
   * @param name
   *            the field name
   * @param value
   *            the new value
   * @throws MemberNotFoundException
   *             if the target has no such field
   */
  @SuppressWarnings("unchecked")
  static void writeField(Object target, String name, Object value) {
    Field field = findField(target.getClass(), name);
    if (field == null && target instanceof Map) {
      ((Map<String, Object>) target).put(name, value);
      return;
    }
    if (field == null) {
      throw new MemberNotFoundException(target.getClass().getSimpleName(), name);
    }
    if (Modifier.isFinal(field.getModifiers())) {
      throw new CmdrDataException("Field '" + name + "' of '" + target.getClass().getSimpleName()
          + "' is read-only");
    }
    try {
      field.set(Modifier.isStatic(field.getModifiers()) ? null : target, value);
    } catch (IllegalAccessException e) {
      throw new CmdrDataException("Cannot write field '" + name + "' of '"
          + target.getClass().getSimpleName() + "'", e);
    }
  }

  /**
   * Returns the names of the public fields and methods of an object, plus its
   * entry keys when it is a {@link Map}, sorted.
   *
   * @param target
   *            the object to inspect
   * @return the member names
   */
  static Set<String> memberNames(Object target) {
    Class<?> type = target.getClass();
    Set<String> names = new TreeSet<>();
    if (target instanceof Map) {
      for (Object key : ((Map<?, ?>) target).keySet()) {
        names.add(String.valueOf(key));
      }
    }
    for (Field field : type.getFields()) {
      names.add(field.getName());
    }
    for (Method method : type.getMethods()) {
      if (!method.isSynthetic()) {
        names.add(method.getName());
      }
    }
    return names;
  }

  /**
   * Invokes a method and rethrows whatever the method itself threw.
   *
   * @param method
   *            the method
   * @param target
   *            the receiver
   * @param args
   *            the arguments
   * @return the method's result
   * @throws Exception
   *             the exception thrown by the method
   */
  static Object invoke(Method method, Object target, Object[] args) throws Exception {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new CmdrDataException("Invocation of '" + method.getName() + "' failed", cause);
    } catch (IllegalAccessException e) {
      throw new CmdrDataException("Cannot access method '" + method.getName() + "' of '"
          + target.getClass().getSimpleName() + "'", e);
    }
  }

  /**
   * Checks whether a value is a scalar rather than a structured object.
   *
   * @param value
   *            the value
   * @return true for null, strings, numbers, booleans, characters, enums and
   *         classes
   */
  static boolean isScalar(Object value) {
    return value == null || value instanceof CharSequence || value instanceof Number || value instanceof Boolean
        || value instanceof Character || value instanceof Enum || value instanceof Class;
  }

  /**
   * Checks whether an argument can be passed for a parameter type.
   *
   * @param parameterType
   *            the declared parameter type
   * @param arg
   *            the argument
   * @return true if the argument is assignable, boxing included
   */
  static boolean isAssignable(Class<?> parameterType, Object arg) {
    if (arg == null) {
      return !parameterType.isPrimitive();
    }
    if (parameterType.isPrimitive()) {
      return wrapperOf(parameterType).isInstance(arg);
    }
    return parameterType.isInstance(arg);
  }

  private static Class<?> wrapperOf(Class<?> primitive) {
    if (primitive == int.class) {
      return Integer.class;
    } else if (primitive == long.class) {
      return Long.class;
    } else if (primitive == boolean.class) {
      return Boolean.class;
    } else if (primitive == double.class) {
      return Double.class;
    } else if (primitive == float.class) {
      return Float.class;
    } else if (primitive == short.class) {
      return Short.class;
    } else if (primitive == byte.class) {
      return Byte.class;
    } else if (primitive == char.class) {
      return Character.class;
    }
    return Void.class;
  }
}
