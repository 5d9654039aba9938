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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * One targeted rule of a room type, tagged by its {@link RuleKind}.
 *
 * <p>A hard rule must hold in every accepted layout. A soft rule is turned into a weighted penalty.
 * An absent distance means the value is unresolved in the source rule set; the compiler then uses
 * the kind's default or skips the rule.
 */
public final class SpatialRule {
  /** Builder in the style of the generated protobuf builders. */
  public static final class Builder {
    private Builder(RuleKind kind) {
      this.kind = kind;
    }

    public Builder addTarget(RuleTarget target) {
      targets.add(target);
      return this;
    }

    public Builder addTargets(RuleTarget... more) {
      targets.addAll(Arrays.asList(more));
      return this;
    }

    public Builder addTargetType(String typeId) {
      return addTarget(RuleTarget.ofType(typeId));
    }

    public Builder setHard(boolean value) {
      hard = value;
      return this;
    }

    public Builder setDistance(int inches) {
      distance = OptionalInt.of(inches);
      return this;
    }

    public Builder clearDistance() {
      distance = OptionalInt.empty();
      return this;
    }

    public Builder setWeight(long value) {
      weight = value;
      return this;
    }

    public SpatialRule build() {
      if (kind.requiresTargets() && targets.isEmpty()) {
        throw new LayoutConfigurationException(kind.name(), "rule needs at least one target");
      }
      if (distance.isPresent() && distance.getAsInt() < 0) {
        throw new LayoutConfigurationException(
            kind.name(), "negative distance " + distance.getAsInt());
      }
      if (weight < 1) {
        throw new LayoutConfigurationException(kind.name(), "weight must be positive: " + weight);
      }
      return new SpatialRule(this);
    }

    private final RuleKind kind;
    private final List<RuleTarget> targets = new ArrayList<>();
    private boolean hard = true;
    private OptionalInt distance = OptionalInt.empty();
    private long weight = 1;
  }

  public static Builder newBuilder(RuleKind kind) {
    return new Builder(kind);
  }

  private SpatialRule(Builder builder) {
    this.kind = builder.kind;
    this.targets = Collections.unmodifiableList(new ArrayList<>(builder.targets));
    this.hard = builder.hard;
    this.distance = builder.distance;
    this.weight = builder.weight;
  }

  public RuleKind getKind() {
    return kind;
  }

  public List<RuleTarget> getTargets() {
    return targets;
  }

  public boolean isHard() {
    return hard;
  }

  public OptionalInt getDistance() {
    return distance;
  }

  public long getWeight() {
    return weight;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(hard ? "hard " : "soft ").append(kind).append(' ').append(targets);
    if (distance.isPresent()) {
      sb.append(" d=").append(distance.getAsInt());
    }
    return sb.toString();
  }

  private final RuleKind kind;
  private final List<RuleTarget> targets;
  private final boolean hard;
  private final OptionalInt distance;
  private final long weight;
}
