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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from room type id to its {@link RoomTypeRule}.
 *
 * <p>Iteration follows registration order.
 */
public final class RuleRegistry {
  /** Builder for {@link RuleRegistry}. */
  public static final class Builder {
    private Builder() {}

    public Builder add(RoomTypeRule rule) {
      if (rules.containsKey(rule.getId())) {
        throw new LayoutConfigurationException(
            "RuleRegistry", "duplicate room type '" + rule.getId() + "'");
      }
      rules.put(rule.getId(), rule);
      return this;
    }

    public RuleRegistry build() {
      return new RuleRegistry(rules);
    }

    private final Map<String, RoomTypeRule> rules = new LinkedHashMap<>();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private RuleRegistry(Map<String, RoomTypeRule> rules) {
    this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
  }

  public boolean contains(String typeId) {
    return rules.containsKey(typeId);
  }

  public Optional<RoomTypeRule> find(String typeId) {
    return Optional.ofNullable(rules.get(typeId));
  }

  /** Returns the rule of a registered type. */
  public RoomTypeRule get(String typeId) {
    RoomTypeRule rule = rules.get(typeId);
    if (rule == null) {
      throw new LayoutConfigurationException("RuleRegistry", "unknown room type '" + typeId + "'");
    }
    return rule;
  }

  public Collection<RoomTypeRule> all() {
    return rules.values();
  }

  /** Returns the ids of the registered types belonging to a group. */
  public List<String> typesIn(SpaceGroup group) {
    List<String> result = new ArrayList<>();
    for (RoomTypeRule rule : rules.values()) {
      if (group.contains(rule)) {
        result.add(rule.getId());
      }
    }
    return result;
  }

  public int size() {
    return rules.size();
  }

  private final Map<String, RoomTypeRule> rules;
}
