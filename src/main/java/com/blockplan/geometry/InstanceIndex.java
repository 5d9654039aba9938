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

package com.blockplan.geometry;

import com.blockplan.rules.RuleTarget;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered set of room instances with a type to instances lookup.
 *
 * <p>Every rule that names a room type or a group is resolved through this index, so rules always
 * apply to expanded instances.
 */
public final class InstanceIndex {
  InstanceIndex(List<RoomInstance> instances) {
    Map<String, List<RoomInstance>> byType = new LinkedHashMap<>();
    for (RoomInstance instance : instances) {
      byType.computeIfAbsent(instance.getTypeId(), k -> new ArrayList<>()).add(instance);
    }
    for (Map.Entry<String, List<RoomInstance>> e : byType.entrySet()) {
      e.setValue(Collections.unmodifiableList(e.getValue()));
    }
    this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
    this.byType = Collections.unmodifiableMap(byType);
  }

  public List<RoomInstance> all() {
    return instances;
  }

  public int size() {
    return instances.size();
  }

  public boolean isEmpty() {
    return instances.isEmpty();
  }

  /** Returns the instances of a type, empty when the type was requested with count 0. */
  public List<RoomInstance> instancesOf(String typeId) {
    List<RoomInstance> result = byType.get(typeId);
    return result == null ? Collections.<RoomInstance>emptyList() : result;
  }

  /** Returns every instance matched by a target, in index order and without duplicates. */
  public List<RoomInstance> resolve(RuleTarget target) {
    if (!target.isGroup()) {
      return instancesOf(target.getTypeId());
    }
    List<RoomInstance> result = new ArrayList<>();
    for (RoomInstance instance : instances) {
      if (target.getGroup().contains(instance.getRule())) {
        result.add(instance);
      }
    }
    return result;
  }

  /** Resolves several targets, keeping the first occurrence of each instance. */
  public List<RoomInstance> resolveAll(List<RuleTarget> targets) {
    Set<RoomInstance> result = new LinkedHashSet<>();
    for (RuleTarget target : targets) {
      result.addAll(resolve(target));
    }
    return new ArrayList<>(result);
  }

  /** Returns the instances whose circulation role makes them corridors. */
  public List<RoomInstance> corridors() {
    List<RoomInstance> result = new ArrayList<>();
    for (RoomInstance instance : instances) {
      if (instance.getRule().getCirculationRole().isCorridor()) {
        result.add(instance);
      }
    }
    return result;
  }

  public Set<String> typeIds() {
    return byType.keySet();
  }

  private final List<RoomInstance> instances;
  private final Map<String, List<RoomInstance>> byType;
}
