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

package com.cmdrdata.plugins.googlegenai;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * VersionCompatibility checks the installed Google GenAI SDK against the
 * versions this library is known to work with.
 *
 * <p>
 * The check is advisory: problems are reported as warnings and logged, never
 * thrown.
 */
public final class VersionCompatibility {

  private static final Logger logger = LoggerFactory.getLogger(VersionCompatibility.class);

  public static final String LIBRARY = "google-genai";
  public static final String MIN_VERSION = "1.0.0";
  public static final String MAX_TESTED_VERSION = "1.99.0";
  public static final int MIN_JAVA_VERSION = 17;

  private static final String CLIENT_CLASS = "com.google.genai.Client";
  private static final String POM_PROPERTIES = "META-INF/maven/com.google.genai/google-genai/pom.properties";
  private static final AtomicBoolean checked = new AtomicBoolean();

  private final String genaiVersion;
  private final int javaVersion;
  private final List<String> warnings;

  /**
   * Probes the SDK on the classpath and the running JVM.
   */
  public VersionCompatibility() {
    this(VersionCompatibility::detectGenaiVersion, Runtime.version().feature());
  }

  VersionCompatibility(Supplier<String> versionProbe, int javaVersion) {
    this.genaiVersion = versionProbe.get();
    this.javaVersion = javaVersion;
    this.warnings = Collections.unmodifiableList(computeWarnings());
  }

  private List<String> computeWarnings() {
    List<String> result = new ArrayList<>();
    if (genaiVersion == null) {
      result.add(LIBRARY + " not found. Add com.google.genai:google-genai to the classpath to track Gemini calls.");
    } else if (compareVersions(genaiVersion, MIN_VERSION) < 0) {
      result.add(LIBRARY + " version " + genaiVersion + " is below minimum supported version " + MIN_VERSION
          + ". Please upgrade.");
    } else if (compareVersions(genaiVersion, MAX_TESTED_VERSION) > 0) {
      result.add(LIBRARY + " version " + genaiVersion + " is newer than tested version " + MAX_TESTED_VERSION
          + ". Usage tracking may not work as expected.");
    }
    if (javaVersion < MIN_JAVA_VERSION) {
      result.add("Java " + javaVersion + " is below minimum supported version " + MIN_JAVA_VERSION + ".");
    }
    return result;
  }

  /**
   * Returns the detected SDK version.
   *
   * @return the version, or null if the SDK is not on the classpath
   */
  public String getGenaiVersion() {
    return genaiVersion;
  }

  /**
   * Returns whether the detected SDK is at least {@value #MIN_VERSION}.
   *
   * @return true if supported
   */
  public boolean isGenaiSupported() {
    return genaiVersion != null && compareVersions(genaiVersion, MIN_VERSION) >= 0;
  }

  public boolean isJavaSupported() {
    return javaVersion >= MIN_JAVA_VERSION;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  /**
   * Logs every warning at WARN.
   */
  public void logWarnings() {
    for (String warning : warnings) {
      logger.warn(warning);
    }
  }

  public CompatibilityInfo getCompatibilityInfo() {
    return new CompatibilityInfo(LIBRARY, genaiVersion, isGenaiSupported(), MIN_VERSION, MAX_TESTED_VERSION,
        Integer.toString(javaVersion), isJavaSupported());
  }

  /**
   * Checks the installed SDK and logs any warnings.
   *
   * @return true if the SDK and the JVM are supported
   */
  public static boolean checkCompatibility() {
    VersionCompatibility compatibility = new VersionCompatibility();
    compatibility.logWarnings();
    return compatibility.isGenaiSupported() && compatibility.isJavaSupported();
  }

  /**
   * Runs {@link #checkCompatibility()} the first time it is called in this JVM.
   */
  static void checkOnce() {
    if (checked.compareAndSet(false, true)) {
      checkCompatibility();
    }
  }

  /**
   * Detects the SDK version from its jar manifest, falling back to the Maven
   * {@code pom.properties} packaged in the jar.
   *
   * @return the version, or null if the SDK is not on the classpath or has no
   *         version information
   */
  static String detectGenaiVersion() {
    Class<?> clientClass;
    try {
      clientClass = Class.forName(CLIENT_CLASS, false, VersionCompatibility.class.getClassLoader());
    } catch (ClassNotFoundException e) {
      return null;
    }

    Package sdkPackage = clientClass.getPackage();
    if (sdkPackage != null && sdkPackage.getImplementationVersion() != null) {
      return sdkPackage.getImplementationVersion();
    }

    ClassLoader loader = clientClass.getClassLoader();
    if (loader == null) {
      return null;
    }
    try (InputStream in = loader.getResourceAsStream(POM_PROPERTIES)) {
      if (in == null) {
        return null;
      }
      Properties properties = new Properties();
      properties.load(in);
      return properties.getProperty("version");
    } catch (IOException e) {
      logger.debug("Failed to read {}: {}", POM_PROPERTIES, e.getMessage());
      return null;
    }
  }

  /**
   * Compares two dotted versions numerically. Qualifiers such as
   * {@code -SNAPSHOT} are ignored and missing components count as 0.
   *
   * @param left
   *            the first version
   * @param right
   *            the second version
   * @return negative, zero or positive as left is older, equal or newer
   */
  static int compareVersions(String left, String right) {
    int[] a = parseVersion(left);
    int[] b = parseVersion(right);
    for (int i = 0; i < Math.max(a.length, b.length); i++) {
      int x = i < a.length ? a[i] : 0;
      int y = i < b.length ? b[i] : 0;
      if (x != y) {
        return Integer.compare(x, y);
      }
    }
    return 0;
  }

  private static int[] parseVersion(String version) {
    String release = version.split("[-+]", 2)[0];
    String[] parts = release.split("\\.");
    int[] numbers = new int[parts.length];
    for (int i = 0; i < parts.length; i++) {
      String digits = parts[i].replaceAll("\\D.*$", "");
      numbers[i] = digits.isEmpty() ? 0 : Integer.parseInt(digits);
    }
    return numbers;
  }
}
