// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.blockplan.compiler;

import java.util.Objects;

/**
 * Names one hard rule of a room type: the owning type, the rule family (a rule kind or a size,
 * entry-count or orientation family) and a detail such as the targets.
 */
public final class RuleReference {
  public RuleReference(String roomType, String family, String detail) {
    this.roomType = roomType;
    this.family = family;
    this.detail = detail == null ? "" : detail;
  }

  public String getRoomType() {
    return roomType;
  }

  public String getFamily() {
    return family;
  }

  public String getDetail() {
    return detail;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RuleReference)) {
      return false;
    }
    RuleReference other = (RuleReference) o;
    return roomType.equals(other.roomType) && family.equals(other.family)
        && detail.equals(other.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(roomType, family, detail);
  }

  @Override
  public String toString() {
    return detail.isEmpty() ? roomType + " " + family : roomType + " " + family + " " + detail;
  }

  private final String roomType;
  private final String family;
  private final String detail;
}
