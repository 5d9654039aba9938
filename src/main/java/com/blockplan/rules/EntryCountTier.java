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

import java.util.OptionalInt;

/** Bounds on the number of doors of a room, optionally tied to a treatment-room count range. */
public final class EntryCountTier {
  public EntryCountTier(TreatmentRange range, int minEntries, OptionalInt maxEntries) {
    if (minEntries < 0) {
      throw new LayoutConfigurationException("EntryCountTier", "negative minimum " + minEntries);
    }
    if (maxEntries.isPresent() && maxEntries.getAsInt() < minEntries) {
      throw new LayoutConfigurationException(
          "EntryCountTier", "maximum " + maxEntries.getAsInt() + " below minimum " + minEntries);
    }
    this.range = range;
    this.minEntries = minEntries;
    this.maxEntries = maxEntries;
  }

  public static EntryCountTier exactly(int entries) {
    return new EntryCountTier(TreatmentRange.any(), entries, OptionalInt.of(entries));
  }

  public TreatmentRange getRange() {
    return range;
  }

  public int getMinEntries() {
    return minEntries;
  }

  public OptionalInt getMaxEntries() {
    return maxEntries;
  }

  @Override
  public String toString() {
    return range + "->" + minEntries + ".." + (maxEntries.isPresent() ? maxEntries.getAsInt() : "");
  }

  private final TreatmentRange range;
  private final int minEntries;
  private final OptionalInt maxEntries;
}
