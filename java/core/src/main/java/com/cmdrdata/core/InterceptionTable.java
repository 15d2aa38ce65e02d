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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * InterceptionTable maps dotted method paths to the {@link UsageExtractor}
 * that tracks them.
 *
 * <p>
 * A path such as {@code "models.generateContent"} names the method
 * {@code generateContent} reached through the member {@code models} of the
 * wrapped client. The table is resolved into a tree when it is built: every
 * level knows its own exact keys and, for each first segment, the derived
 * table holding the suffixes below it. A dotted key is therefore only honoured
 * at the nesting level matching its prefix.
 *
 * <p>
 * Tables are immutable.
 */
public final class InterceptionTable {

  private static final InterceptionTable EMPTY = new InterceptionTable(Collections.emptyMap());

  private final Map<String, UsageExtractor> entries;
  private final Map<String, UsageExtractor> methods;
  private final Map<String, InterceptionTable> children;

  private InterceptionTable(Map<String, UsageExtractor> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));

    Map<String, UsageExtractor> ownMethods = new HashMap<>();
    Map<String, Map<String, UsageExtractor>> nested = new LinkedHashMap<>();
    for (Map.Entry<String, UsageExtractor> entry : entries.entrySet()) {
      String path = entry.getKey();
      int dot = path.indexOf('.');
      if (dot < 0) {
        ownMethods.put(path, entry.getValue());
      } else {
        nested.computeIfAbsent(path.substring(0, dot), k -> new LinkedHashMap<>()).put(path.substring(dot + 1),
            entry.getValue());
      }
    }

    Map<String, InterceptionTable> childTables = new HashMap<>();
    for (Map.Entry<String, Map<String, UsageExtractor>> entry : nested.entrySet()) {
      childTables.put(entry.getKey(), new InterceptionTable(entry.getValue()));
    }
    this.methods = Collections.unmodifiableMap(ownMethods);
    this.children = Collections.unmodifiableMap(childTables);
  }

  /**
   * Returns the empty table.
   *
   * @return a table tracking nothing
   */
  public static InterceptionTable empty() {
    return EMPTY;
  }

  /**
   * Creates a table from a path to extractor mapping.
   *
   * @param entries
   *            the dotted paths and their extractors
   * @return the table
   * @throws IllegalArgumentException
   *             if a path is empty, has an empty segment, or maps to null
   */
  public static InterceptionTable of(Map<String, ? extends UsageExtractor> entries) {
    Builder builder = builder();
    if (entries != null) {
      entries.forEach(builder::track);
    }
    return builder.build();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the extractor registered for a method at this level.
   *
   * @param name
   *            the undotted member name
   * @return the extractor, or null if the name is not tracked here
   */
  public UsageExtractor lookup(String name) {
    return methods.get(name);
  }

  /**
   * Checks whether a member name is an exact key at this level.
   *
   * @param name
   *            the member name
   * @return true if calls to this member are tracked
   */
  public boolean isTracked(String name) {
    return methods.containsKey(name);
  }

  /**
   * Checks whether any key lives below {@code name + "."}.
   *
   * @param name
   *            the member name
   * @return true if the member is a namespace with tracked descendants
   */
  public boolean hasChildren(String name) {
    return children.containsKey(name);
  }

  /**
   * Returns the derived table for a namespace member, holding the key
   * suffixes after {@code name + "."}.
   *
   * @param name
   *            the member name
   * @return the derived table, empty if nothing is tracked below the name
   */
  public InterceptionTable child(String name) {
    InterceptionTable child = children.get(name);
    return child != null ? child : EMPTY;
  }

  /**
   * Returns all dotted paths of this table, sorted.
   *
   * @return the paths
   */
  public Set<String> paths() {
    return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
  }

  /**
   * Returns the table as an unmodifiable map.
   *
   * @return the dotted paths and their extractors
   */
  public Map<String, UsageExtractor> asMap() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public String toString() {
    return "InterceptionTable" + paths();
  }

  /**
   * Builder for InterceptionTable.
   */
  public static class Builder {
    private final Map<String, UsageExtractor> entries = new LinkedHashMap<>();

    /**
     * Registers an extractor for a dotted method path.
     *
     * @param path
     *            the dotted method path
     * @param extractor
     *            the extractor
     * @return this builder
     */
    public Builder track(String path, UsageExtractor extractor) {
      validatePath(path);
      if (extractor == null) {
        throw new IllegalArgumentException("No extractor given for path '" + path + "'");
      }
      entries.put(path, extractor);
      return this;
    }

    /**
     * Registers every entry of another table.
     *
     * @param table
     *            the table to copy
     * @return this builder
     */
    public Builder trackAll(InterceptionTable table) {
      if (table != null) {
        entries.putAll(table.entries);
      }
      return this;
    }

    public InterceptionTable build() {
      return entries.isEmpty() ? EMPTY : new InterceptionTable(entries);
    }

    private static void validatePath(String path) {
      if (path == null || path.isEmpty()) {
        throw new IllegalArgumentException("Method path must not be empty");
      }
      for (String segment : path.split("\\.", -1)) {
        if (segment.isEmpty()) {
          throw new IllegalArgumentException("Method path '" + path + "' has an empty segment");
        }
      }
    }
  }
}
