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

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Invocation handler behind {@link TrackedProxy#forInterface}. Handles are
 * resolved per interface method and memoized the same way
 * {@link TrackedProxy#resolve(String)} does per member name.
 */
final class TrackingInvocationHandler implements InvocationHandler {

  private static final Object PASSTHROUGH = new Object();

  private final Object target;
  private final UsageSink sink;
  private final InterceptionTable table;
  private final String pathPrefix;
  private final Clock clock;
  private final ConcurrentMap<Method, Object> resolved = new ConcurrentHashMap<>();

  private TrackingInvocationHandler(Object target, UsageSink sink, InterceptionTable table, String pathPrefix,
      Clock clock) {
    this.target = target;
    this.sink = sink;
    this.table = table != null ? table : InterceptionTable.empty();
    this.pathPrefix = pathPrefix;
    this.clock = clock;
  }

  static <T> T create(Class<T> type, T target, UsageSink sink, InterceptionTable table, String pathPrefix,
      Clock clock) {
    return type.cast(newProxy(type, target, sink, table, pathPrefix, clock));
  }

  private static Object newProxy(Class<?> type, Object target, UsageSink sink, InterceptionTable table,
      String pathPrefix, Clock clock) {
    if (!type.isInterface()) {
      throw new IllegalArgumentException(type.getName() + " is not an interface");
    }
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(sink, "sink");
    return Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type},
        new TrackingInvocationHandler(target, sink, table, pathPrefix, clock));
  }

  @Override
  public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
    if (method.getDeclaringClass() == Object.class) {
      switch (method.getName()) {
        case "toString" :
          return "TrackedProxy(" + target + ")";
        case "hashCode" :
          return System.identityHashCode(proxy);
        case "equals" :
          return proxy == args[0];
        default :
          return ReflectiveMembers.invoke(method, target, args);
      }
    }

    Object handle = resolved.get(method);
    if (handle == null) {
      Object created = createHandle(method);
      Object winner = resolved.putIfAbsent(method, created);
      handle = winner != null ? winner : created;
    }

    if (handle instanceof TrackedMethod) {
      List<Object> positional = args != null ? new ArrayList<>(Arrays.asList(args)) : new ArrayList<>();
      return ((TrackedMethod) handle).invoke(positional, new LinkedHashMap<>());
    }
    if (handle == PASSTHROUGH) {
      return ReflectiveMembers.invoke(method, target, args);
    }
    return handle;
  }

  private Object createHandle(Method method) throws Exception {
    String name = method.getName();
    UsageExtractor extractor = table.lookup(name);
    if (extractor != null) {
      Invocable real = (args, keywordArgs) -> ReflectiveMembers.invoke(method, target, args.toArray());
      return new TrackedMethod(real, pathPrefix + name, extractor, sink, clock);
    }
    if (table.hasChildren(name) && method.getParameterCount() == 0 && method.getReturnType().isInterface()) {
      Object namespace = ReflectiveMembers.invoke(method, target, null);
      if (namespace != null) {
        return newProxy(method.getReturnType(), namespace, sink, table.child(name), pathPrefix + name + ".",
            clock);
      }
    }
    return PASSTHROUGH;
  }
}
