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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the SDK and runtime versions found by
 * {@link VersionCompatibility}.
 */
public final class CompatibilityInfo {

  @JsonProperty("library")
  private final String library;

  @JsonProperty("version")
  private final String version;

  @JsonProperty("supported")
  private final boolean supported;

  @JsonProperty("min_version")
  private final String minVersion;

  @JsonProperty("max_tested_version")
  private final String maxTestedVersion;

  @JsonProperty("java_version")
  private final String javaVersion;

  @JsonProperty("java_supported")
  private final boolean javaSupported;

  CompatibilityInfo(String library, String version, boolean supported, String minVersion, String maxTestedVersion,
      String javaVersion, boolean javaSupported) {
    this.library = library;
    this.version = version;
    this.supported = supported;
    this.minVersion = minVersion;
    this.maxTestedVersion = maxTestedVersion;
    this.javaVersion = javaVersion;
    this.javaSupported = javaSupported;
  }

  public String getLibrary() {
    return library;
  }

  /**
   * Returns the detected SDK version.
   *
   * @return the version, or null if the SDK was not found
   */
  public String getVersion() {
    return version;
  }

  public boolean isSupported() {
    return supported;
  }

  public String getMinVersion() {
    return minVersion;
  }

  public String getMaxTestedVersion() {
    return maxTestedVersion;
  }

  public String getJavaVersion() {
    return javaVersion;
  }

  public boolean isJavaSupported() {
    return javaSupported;
  }

  @Override
  public String toString() {
    return "CompatibilityInfo{library=" + library + ", version=" + version + ", supported=" + supported
        + ", javaVersion=" + javaVersion + ", javaSupported=" + javaSupported + "}";
  }
}
