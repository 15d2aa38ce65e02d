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

/**
 * Thrown when a proxied target has no public field or method with the
 * requested name.
 */
public class MemberNotFoundException extends CmdrDataException {

  private final String targetType;
  private final String memberName;

  /**
   * Creates a new MemberNotFoundException.
   *
   * @param targetType
   *            the simple name of the target's class
   * @param memberName
   *            the missing member name
   */
  public MemberNotFoundException(String targetType, String memberName) {
    super("'" + targetType + "' object has no member '" + memberName + "'", null, "MEMBER_NOT_FOUND", null);
    this.targetType = targetType;
    this.memberName = memberName;
  }

  public String getTargetType() {
    return targetType;
  }

  public String getMemberName() {
    return memberName;
  }
}
