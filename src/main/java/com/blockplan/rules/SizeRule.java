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
 * Dimension bounds of a room type.
 *
 * <p>Explicit ideal, minimum and maximum sizes are all optional. Tiers carry the size variants
 * of the source rule set (for example compact, enhanced and elite sterilization rooms). A rule
 * marked unresolved has sizes still to be decided and is skipped by the compiler.
 */
public final class SizeRule {
  private static final SizeRule UNSPECIFIED = newBuilder().build();

  /** Builder for {@link SizeRule}. */
  public static final class Builder {
    private Builder() {}

    public Builder setIdeal(Dimensions value) {
      ideal = Optional.of(value);
      return this;
    }

    public Builder setMinimum(Dimensions value) {
      minimum = Optional.of(value);
      return this;
    }

    public Builder setMaximum(Dimensions value) {
      maximum = Optional.of(value);
      return this;
    }

    public Builder addTier(SizeTier tier) {
      tiers.add(tier);
      return this;
    }

    public Builder setUnresolved(boolean value) {
      unresolved = value;
      return this;
    }

    public SizeRule build() {
      if (minimum.isPresent() && maximum.isPresent()) {
        Dimensions min = minimum.get();
        Dimensions max = maximum.get();
        if (min.getWidth() > max.getWidth() || min.getLength() > max.getLength()) {
          throw new LayoutConfigurationException(
              "SizeRule", "minimum " + min + " exceeds maximum " + max);
        }
      }
      return new SizeRule(this);
    }

    private Optional<Dimensions> ideal = Optional.empty();
    private Optional<Dimensions> minimum = Optional.empty();
    private Optional<Dimensions> maximum = Optional.empty();
    private final List<SizeTier> tiers = new ArrayList<>();
    private boolean unresolved;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns a size rule with no bounds at all. */
  public static SizeRule unspecified() {
    return UNSPECIFIED;
  }

  private SizeRule(Builder builder) {
    this.ideal = builder.ideal;
    this.minimum = builder.minimum;
    this.maximum = builder.maximum;
    this.tiers = Collections.unmodifiableList(new ArrayList<>(builder.tiers));
    this.unresolved = builder.unresolved;
  }

  public Optional<Dimensions> getIdeal() {
    return ideal;
  }

  public Optional<Dimensions> getMinimum() {
    return minimum;
  }

  public Optional<Dimensions> getMaximum() {
    return maximum;
  }

  public List<SizeTier> getTiers() {
    return tiers;
  }

  public boolean isUnresolved() {
    return unresolved;
  }

  private final Optional<Dimensions> ideal;
  private final Optional<Dimensions> minimum;
  private final Optional<Dimensions> maximum;
  private final List<SizeTier> tiers;
  private final boolean unresolved;
}
