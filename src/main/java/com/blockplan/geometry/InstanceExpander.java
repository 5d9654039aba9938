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

import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.RoomTypeRule;
import com.blockplan.rules.RuleRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/** Turns a room inventory (type id to requested count) into uniquely identified instances. */
public final class InstanceExpander {
  private static final Logger logger = Logger.getLogger(InstanceExpander.class.getName());

  private InstanceExpander() {}

  /**
   * Expands the inventory in its iteration order.
   *
   * <p>A type with count N yields instances 0..N-1. A zero count yields nothing. Types absent from
   * the registry are expanded with an unconstrained rule.
   *
   * @throws LayoutConfigurationException if a count is negative
   */
  public static InstanceIndex expand(Map<String, Integer> inventory, RuleRegistry registry) {
    List<RoomInstance> instances = new ArrayList<>();
    for (Map.Entry<String, Integer> entry : inventory.entrySet()) {
      String typeId = entry.getKey();
      int count = entry.getValue() == null ? 0 : entry.getValue();
      if (count < 0) {
        throw new LayoutConfigurationException(
            "InstanceExpander", "negative count " + count + " for '" + typeId + "'");
      }
      if (count == 0) {
        logger.fine("Room type '" + typeId + "' requested with count 0");
        continue;
      }
      RoomTypeRule rule;
      if (registry.contains(typeId)) {
        rule = registry.get(typeId);
      } else {
        logger.warning("No rules for room type '" + typeId + "', only generic constraints apply");
        rule = RoomTypeRule.unconstrained(typeId);
      }
      for (int i = 0; i < count; ++i) {
        instances.add(new RoomInstance(rule, i));
      }
    }
    logger.info("Expanded inventory into " + instances.size() + " room instances");
    return new InstanceIndex(instances);
  }
}
