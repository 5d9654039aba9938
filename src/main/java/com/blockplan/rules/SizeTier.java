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

/** A size variant of a room type, optionally tied to a treatment-room count range. */
public final class SizeTier {
  public SizeTier(String label, TreatmentRange range, OptionalInt width, OptionalInt length) {
    this.label = label == null ? "" : label;
    this.range = range;
    this.width = width;
    this.length = length;
    if (!isPositive(width) || !isPositive(length)) {
      throw new LayoutConfigurationException("SizeTier " + label, "non-positive dimension");
    }
  }

  public static SizeTier of(String label, TreatmentRange range, int width, int length) {
    return new SizeTier(label, range, OptionalInt.of(width), OptionalInt.of(length));
  }

  private static boolean isPositive(OptionalInt value) {
    return !value.isPresent() || value.getAsInt() > 0;
  }

  public String getLabel() {
    return label;
  }

  public TreatmentRange getRange() {
    return range;
  }

  public OptionalInt getWidth() {
    return width;
  }

  public OptionalInt getLength() {
    return length;
  }

  @Override
  public String toString() {
    return label + range + "(" + (width.isPresent() ? width.getAsInt() : "?") + "x"
        + (length.isPresent() ? length.getAsInt() : "?") + ")";
  }

  private final String label;
  private final TreatmentRange range;
  private final OptionalInt width;
  private final OptionalInt length;
}
