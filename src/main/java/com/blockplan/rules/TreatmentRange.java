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

/**
 * Range of treatment-room counts a tiered value applies to. Either bound may be open; a range
 * with both bounds open is a constant tier that applies regardless of the count.
 */
public final class TreatmentRange {
  private static final TreatmentRange ANY =
      new TreatmentRange(OptionalInt.empty(), OptionalInt.empty());

  public static TreatmentRange any() {
    return ANY;
  }

  public static TreatmentRange of(OptionalInt min, OptionalInt max) {
    if (min.isPresent() && max.isPresent() && min.getAsInt() > max.getAsInt()) {
      throw new LayoutConfigurationException(
          "TreatmentRange", "min " + min.getAsInt() + " exceeds max " + max.getAsInt());
    }
    if (!min.isPresent() && !max.isPresent()) {
      return ANY;
    }
    return new TreatmentRange(min, max);
  }

  public static TreatmentRange between(int min, int max) {
    return of(OptionalInt.of(min), OptionalInt.of(max));
  }

  public static TreatmentRange atLeast(int min) {
    return of(OptionalInt.of(min), OptionalInt.empty());
  }

  private TreatmentRange(OptionalInt min, OptionalInt max) {
    this.min = min;
    this.max = max;
  }

  /** Returns true when the range has no bounds. */
  public boolean isConstant() {
    return !min.isPresent() && !max.isPresent();
  }

  public boolean matches(int treatmentRooms) {
    return (!min.isPresent() || treatmentRooms >= min.getAsInt())
        && (!max.isPresent() || treatmentRooms <= max.getAsInt());
  }

  public OptionalInt getMin() {
    return min;
  }

  public OptionalInt getMax() {
    return max;
  }

  @Override
  public String toString() {
    if (isConstant()) {
      return "any";
    }
    return "[" + (min.isPresent() ? min.getAsInt() : "") + ".."
        + (max.isPresent() ? max.getAsInt() : "") + "]";
  }

  private final OptionalInt min;
  private final OptionalInt max;
}
