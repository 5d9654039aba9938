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

package com.blockplan.rules;

import java.util.Objects;

/** A rule target: either one room type or a {@link SpaceGroup}. */
public final class RuleTarget {
  private static final String GROUP_PREFIX = "group:";

  public static RuleTarget ofType(String typeId) {
    if (typeId == null || typeId.isEmpty()) {
      throw new LayoutConfigurationException("RuleTarget.ofType", "empty room type id");
    }
    return new RuleTarget(typeId, null);
  }

  public static RuleTarget ofGroup(SpaceGroup group) {
    return new RuleTarget(null, Objects.requireNonNull(group));
  }

  /** Parses {@code "lab"} as a type target and {@code "group:CLINICAL"} as a group target. */
  public static RuleTarget parse(String text) {
    if (text != null && text.startsWith(GROUP_PREFIX)) {
      String name = text.substring(GROUP_PREFIX.length());
      for (SpaceGroup group : SpaceGroup.values()) {
        if (group.name().equalsIgnoreCase(name)) {
          return ofGroup(group);
        }
      }
      throw new LayoutConfigurationException(
          "RuleTarget.parse", "unknown space group '" + name + "'");
    }
    return ofType(text);
  }

  private RuleTarget(String typeId, SpaceGroup group) {
    this.typeId = typeId;
    this.group = group;
  }

  public boolean isGroup() {
    return group != null;
  }

  /** Returns the room type id, or null for group targets. */
  public String getTypeId() {
    return typeId;
  }

  /** Returns the group, or null for type targets. */
  public SpaceGroup getGroup() {
    return group;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RuleTarget)) {
      return false;
    }
    RuleTarget other = (RuleTarget) o;
    return Objects.equals(typeId, other.typeId) && group == other.group;
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeId, group);
  }

  @Override
  public String toString() {
    return isGroup() ? GROUP_PREFIX + group.name() : typeId;
  }

  private final String typeId;
  private final SpaceGroup group;
}
