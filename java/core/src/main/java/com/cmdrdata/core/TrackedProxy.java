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
import java.lang.reflect.Modifier;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TrackedProxy forwards member access to a wrapped client and adds usage
 * tracking to the methods named in its {@link InterceptionTable}.
 *
 * <p>
 * {@link #resolve(String)} decides once per member name what the proxy hands
 * out:
 * <ul>
 * <li>a {@link TrackedMethod} for a method whose name is a key of the
 * table</li>
 * <li>a child TrackedProxy for a namespace member (a public field, or a
 * zero-argument accessor method) with keys below {@code name + "."}</li>
 * <li>the member itself otherwise: a field value, or a {@link BoundMethod}
 * for an untracked method</li>
 * </ul>
 * The decision is memoized for the proxy's lifetime. Missing members are never
 * memoized.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * TrackedProxy client = new TrackedProxy(genaiClient, sink,
 * 		InterceptionTable.builder().track("models.generateContent", extractor).build());
 *
 * Object response = client.callPath("models.generateContent", Map.of("customer_id", "customer-123"),
 * 		"gemini-2.5-flash", "Hello", null);
 * }
 * </pre>
 *
 * <p>
 * For clients reached through an interface, {@link #forInterface} returns an
 * implementation of that interface instead.
 */
public class TrackedProxy {

  private static final Logger logger = LoggerFactory.getLogger(TrackedProxy.class);

  /**
   * Prefix of member names stored on the proxy itself instead of the target.
   */
  public static final String RESERVED_PREFIX = "_";

  private static final Object NULL_MEMBER = new Object();
  private static final Set<String> OWN_MEMBERS = ownMemberNames();

  private final Object target;
  private final UsageSink sink;
  private final InterceptionTable table;
  private final String pathPrefix;
  private final Clock clock;
  private final ConcurrentMap<String, Object> resolved = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Object> ownAttributes = new ConcurrentHashMap<>();

  /**
   * Creates a new TrackedProxy.
   *
   * @param target
   *            the client to wrap
   * @param sink
   *            the sink receiving usage events
   * @param table
   *            the methods to track, null for none
   */
  public TrackedProxy(Object target, UsageSink sink, InterceptionTable table) {
    this(target, sink, table, Clock.systemUTC());
  }

  /**
   * Creates a new TrackedProxy with an explicit clock.
   *
   * @param target
   *            the client to wrap
   * @param sink
   *            the sink receiving usage events
   * @param table
   *            the methods to track, null for none
   * @param clock
   *            the clock for call timestamps
   */
  public TrackedProxy(Object target, UsageSink sink, InterceptionTable table, Clock clock) {
    this(target, sink, table, "", clock);
  }

  private TrackedProxy(Object target, UsageSink sink, InterceptionTable table, String pathPrefix, Clock clock) {
    this.target = Objects.requireNonNull(target, "target");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.table = table != null ? table : InterceptionTable.empty();
    this.pathPrefix = pathPrefix;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates an implementation of an interface that forwards to the target and
   * tracks the methods named in the table.
   *
   * @param type
   *            the interface implemented by the target
   * @param target
   *            the client to wrap
   * @param sink
   *            the sink receiving usage events
   * @param table
   *            the methods to track
   * @param <T>
   *            the interface type
   * @return the tracking implementation
   */
  public static <T> T forInterface(Class<T> type, T target, UsageSink sink, InterceptionTable table) {
    return TrackingInvocationHandler.create(type, target, sink, table, "", Clock.systemUTC());
  }

  /**
   * Resolves a member name to the handle this proxy hands out for it.
   *
   * @param name
   *            the member name
   * @return a {@link TrackedMethod}, a child {@code TrackedProxy}, or the
   *         member itself
   * @throws MemberNotFoundException
   *             if the target has no such member
   */
  public Object resolve(String name) {
    Objects.requireNonNull(name, "name");
    if (name.startsWith(RESERVED_PREFIX)) {
      Object own = ownAttributes.get(name);
      if (own != null) {
        return unmask(own);
      }
    }

    Object cached = resolved.get(name);
    if (cached != null) {
      return unmask(cached);
    }

    Object handle = mask(createHandle(name));
    Object winner = resolved.putIfAbsent(name, handle);
    return unmask(winner != null ? winner : handle);
  }

  private Object createHandle(String name) {
    Object member = ReflectiveMembers.lookup(target, name);

    UsageExtractor extractor = table.lookup(name);
    if (extractor != null && member instanceof Invocable) {
      logger.debug("Tracking calls to {}", pathPrefix + name);
      return new TrackedMethod((Invocable) member, pathPrefix + name, extractor, sink, clock);
    }

    if (table.hasChildren(name)) {
      Object namespace = member;
      if (member instanceof BoundMethod && ((BoundMethod) member).hasNoArgOverload()) {
        namespace = ((BoundMethod) member).call();
      }
      if (!(namespace instanceof BoundMethod) && !ReflectiveMembers.isScalar(namespace)) {
        logger.debug("Proxying namespace {}", pathPrefix + name);
        return new TrackedProxy(namespace, sink, table.child(name), pathPrefix + name + ".", clock);
      }
    }

    return member;
  }

  /**
   * Assigns a member. Reserved names (starting with {@value #RESERVED_PREFIX})
   * are stored on the proxy; all others are written to the target.
   *
   * @param name
   *            the member name
   * @param value
   *            the value
   * @throws MemberNotFoundException
   *             if the target has no such field
   */
  public void set(String name, Object value) {
    Objects.requireNonNull(name, "name");
    if (name.startsWith(RESERVED_PREFIX)) {
      ownAttributes.put(name, mask(value));
    } else {
      ReflectiveMembers.writeField(target, name, value);
    }
  }

  /**
   * Lists the names available on this proxy: its own operations and the
   * target's members, sorted and deduplicated.
   *
   * @return the member names
   */
  public List<String> memberNames() {
    Set<String> names = new TreeSet<>(OWN_MEMBERS);
    names.addAll(ReflectiveMembers.memberNames(target));
    return Collections.unmodifiableList(new ArrayList<>(names));
  }

  /**
   * Calls a method of this level with positional arguments.
   *
   * @param name
   *            the method name
   * @param args
   *            the positional arguments, optionally ending with
   *            {@link CallOptions}
   * @return the method's result
   */
  public Object call(String name, Object... args) {
    return invocable(name).call(args);
  }

  /**
   * Calls a method of this level with keyword and positional arguments.
   *
   * @param name
   *            the method name
   * @param keywordArgs
   *            the keyword arguments, including reserved options
   * @param args
   *            the positional arguments
   * @return the method's result
   */
  public Object callWithKeywords(String name, Map<String, ?> keywordArgs, Object... args) {
    return invocable(name).callWithKeywords(keywordArgs, args);
  }

  /**
   * Calls a method through a dotted path, e.g. {@code models.generateContent}.
   * Intermediate members without tracked descendants are navigated untracked.
   *
   * @param path
   *            the dotted method path
   * @param keywordArgs
   *            the keyword arguments, may be null
   * @param args
   *            the positional arguments
   * @return the method's result
   */
  public Object callPath(String path, Map<String, ?> keywordArgs, Object... args) {
    String[] segments = path.split("\\.");
    TrackedProxy current = this;
    for (int i = 0; i < segments.length - 1; i++) {
      Object next = current.resolve(segments[i]);
      if (next instanceof TrackedProxy) {
        current = (TrackedProxy) next;
      } else if (!ReflectiveMembers.isScalar(next) && !(next instanceof Invocable)) {
        current = new TrackedProxy(next, sink, InterceptionTable.empty(), current.pathPrefix + segments[i] + ".",
            clock);
      } else {
        throw new CmdrDataException("Member '" + segments[i] + "' of '" + current.getTargetType()
            + "' cannot be navigated");
      }
    }
    return current.callWithKeywords(segments[segments.length - 1], keywordArgs, args);
  }

  /**
   * Resolves a namespace member to its child proxy.
   *
   * @param name
   *            the member name
   * @return the child proxy
   * @throws CmdrDataException
   *             if the member is not a tracked namespace
   */
  public TrackedProxy namespace(String name) {
    Object handle = resolve(name);
    if (handle instanceof TrackedProxy) {
      return (TrackedProxy) handle;
    }
    throw new CmdrDataException("Member '" + name + "' of '" + getTargetType() + "' is not a tracked namespace");
  }

  private Invocable invocable(String name) {
    Object handle = resolve(name);
    if (handle instanceof Invocable) {
      return (Invocable) handle;
    }
    throw new CmdrDataException("Member '" + name + "' of '" + getTargetType() + "' is not callable");
  }

  /**
   * Returns the wrapped client.
   *
   * @return the target
   */
  public Object getTarget() {
    return target;
  }

  /**
   * Returns the table scoped to this proxy's level.
   *
   * @return the table
   */
  public InterceptionTable getTable() {
    return table;
  }

  private String getTargetType() {
    return target.getClass().getSimpleName();
  }

  private static Object mask(Object value) {
    return value != null ? value : NULL_MEMBER;
  }

  private static Object unmask(Object value) {
    return value == NULL_MEMBER ? null : value;
  }

  private static Set<String> ownMemberNames() {
    Set<String> names = new TreeSet<>();
    for (Method method : TrackedProxy.class.getDeclaredMethods()) {
      int modifiers = method.getModifiers();
      if (Modifier.isPublic(modifiers) && !Modifier.isStatic(modifiers)) {
        names.add(method.getName());
      }
    }
    return Collections.unmodifiableSet(names);
  }

  @Override
  public String toString() {
    return "TrackedProxy(" + target + ")";
  }
}
