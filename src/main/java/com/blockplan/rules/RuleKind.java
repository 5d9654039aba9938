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

/**
 * Closed set of targeted rule kinds understood by the constraint compiler.
 *
 * <p>Every kind states whether it needs at least one target and how it uses a distance threshold.
 * Rule files naming any other kind are rejected when the registry is read.
 */
public enum RuleKind {
  ENTRY_FROM(true, DistanceUse.UNUSED),
  ENTRY_NOT_FROM(true, DistanceUse.UNUSED),
  ENTRY_WITHIN_DISTANCE(true, DistanceUse.REQUIRED),
  ENTRY_NOT_WITHIN_DISTANCE(true, DistanceUse.REQUIRED),
  ENTRY_OPPOSITE_ENDS(false, DistanceUse.UNUSED),
  DIRECT_ADJACENCY(true, DistanceUse.UNUSED),
  PREFERRED_ADJACENCY(true, DistanceUse.UNUSED),
  SEPARATION(true, DistanceUse.OPTIONAL),
  NEAR_SPACE(true, DistanceUse.OPTIONAL),
  NOT_WITHIN_DISTANCE(true, DistanceUse.REQUIRED),
  PREFER_NEAR_CENTER(false, DistanceUse.UNUSED),
  VISIBLE_FROM(true, DistanceUse.OPTIONAL),
  HIDDEN_FROM(true, DistanceUse.OPTIONAL);

  /** How a kind consumes the distance threshold of a rule. */
  public enum DistanceUse {
    UNUSED,
    OPTIONAL,
    REQUIRED,
  }

  RuleKind(boolean requiresTargets, DistanceUse distanceUse) {
    this.requiresTargets = requiresTargets;
    this.distanceUse = distanceUse;
  }

  public boolean requiresTargets() {
    return requiresTargets;
  }

  public DistanceUse getDistanceUse() {
    return distanceUse;
  }

  /** Returns true for the kinds that place or forbid doors. */
  public boolean isEntryRule() {
    return name().startsWith("ENTRY_");
  }

  /** Parses a kind name, rejecting anything outside the closed set. */
  public static RuleKind parse(String name) {
    for (RuleKind kind : values()) {
      if (kind.name().equalsIgnoreCase(name)) {
        return kind;
      }
    }
    throw new LayoutConfigurationException("RuleKind.parse", "unknown rule kind '" + name + "'");
  }

  private final boolean requiresTargets;
  private final DistanceUse distanceUse;
}
