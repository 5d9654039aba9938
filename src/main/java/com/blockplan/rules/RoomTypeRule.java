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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable rule record of one room type.
 *
 * <p>Holds the size bounds, orientation, entry-count tiers, clearances and the targeted rules
 * (entries, adjacency, distances, visibility) of the type. Scalability notes are carried as
 * metadata and never become constraints.
 */
public final class RoomTypeRule {
  /** Builder for {@link RoomTypeRule}. */
  public static final class Builder {
    private Builder(String id) {
      this.id = id;
    }

    public Builder setCategory(RoomCategory value) {
      category = value;
      return this;
    }

    public Builder setCirculationRole(CirculationRole value) {
      circulationRole = value;
      return this;
    }

    public Builder setSize(SizeRule value) {
      size = value;
      return this;
    }

    /** Shortcut for a size rule holding only an explicit minimum. */
    public Builder setMinimumSize(int width, int length) {
      size = SizeRule.newBuilder().setMinimum(Dimensions.of(width, length)).build();
      return this;
    }

    public Builder setOrientation(OrientationRule value) {
      orientation = Optional.of(value);
      return this;
    }

    public Builder addEntryCount(EntryCountTier tier) {
      entryCounts.add(tier);
      return this;
    }

    public Builder setClearance(ClearanceRule value) {
      clearance = value;
      return this;
    }

    public Builder addRule(SpatialRule rule) {
      rules.add(rule);
      return this;
    }

    public Builder setScalability(String notes) {
      scalability = notes == null ? "" : notes;
      return this;
    }

    public RoomTypeRule build() {
      if (id == null || id.isEmpty()) {
        throw new LayoutConfigurationException("RoomTypeRule", "missing room type id");
      }
      return new RoomTypeRule(this);
    }

    private final String id;
    private RoomCategory category = RoomCategory.CLINICAL;
    private CirculationRole circulationRole = CirculationRole.DESTINATION;
    private SizeRule size = SizeRule.unspecified();
    private Optional<OrientationRule> orientation = Optional.empty();
    private final List<EntryCountTier> entryCounts = new ArrayList<>();
    private ClearanceRule clearance = ClearanceRule.none();
    private final List<SpatialRule> rules = new ArrayList<>();
    private String scalability = "";
  }

  public static Builder newBuilder(String id) {
    return new Builder(id);
  }

  /** Returns a rule with no constraints, used for inventory types missing from the registry. */
  public static RoomTypeRule unconstrained(String id) {
    return newBuilder(id).build();
  }

  private RoomTypeRule(Builder builder) {
    this.id = builder.id;
    this.category = builder.category;
    this.circulationRole = builder.circulationRole;
    this.size = builder.size;
    this.orientation = builder.orientation;
    this.entryCounts = Collections.unmodifiableList(new ArrayList<>(builder.entryCounts));
    this.clearance = builder.clearance;
    this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
    this.scalability = builder.scalability;
  }

  public String getId() {
    return id;
  }

  public RoomCategory getCategory() {
    return category;
  }

  public CirculationRole getCirculationRole() {
    return circulationRole;
  }

  public SizeRule getSize() {
    return size;
  }

  public Optional<OrientationRule> getOrientation() {
    return orientation;
  }

  public List<EntryCountTier> getEntryCounts() {
    return entryCounts;
  }

  public ClearanceRule getClearance() {
    return clearance;
  }

  /** Returns all targeted rules in declaration order. */
  public List<SpatialRule> getRules() {
    return rules;
  }

  /** Returns the rules of one kind in declaration order. */
  public List<SpatialRule> rulesOf(RuleKind kind) {
    List<SpatialRule> result = new ArrayList<>();
    for (SpatialRule rule : rules) {
      if (rule.getKind() == kind) {
        result.add(rule);
      }
    }
    return result;
  }

  public List<SpatialRule> getDirectAdjacency() {
    return rulesOf(RuleKind.DIRECT_ADJACENCY);
  }

  public List<SpatialRule> getPreferredAdjacency() {
    return rulesOf(RuleKind.PREFERRED_ADJACENCY);
  }

  public List<SpatialRule> getSeparation() {
    return rulesOf(RuleKind.SEPARATION);
  }

  public List<SpatialRule> getEntryRules() {
    List<SpatialRule> result = new ArrayList<>();
    for (SpatialRule rule : rules) {
      if (rule.getKind().isEntryRule()) {
        result.add(rule);
      }
    }
    return result;
  }

  public String getScalability() {
    return scalability;
  }

  @Override
  public String toString() {
    return id + "(" + category + ", " + rules.size() + " rules)";
  }

  private final String id;
  private final RoomCategory category;
  private final CirculationRole circulationRole;
  private final SizeRule size;
  private final Optional<OrientationRule> orientation;
  private final List<EntryCountTier> entryCounts;
  private final ClearanceRule clearance;
  private final List<SpatialRule> rules;
  private final String scalability;
}
