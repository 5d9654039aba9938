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

/** Resolved width and length bounds of one room type, each bound optional. */
public final class SizeBounds {
  private static final SizeBounds NONE =
      new SizeBounds(OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty(),
          OptionalInt.empty());

  public SizeBounds(
      OptionalInt minWidth, OptionalInt minLength, OptionalInt maxWidth, OptionalInt maxLength) {
    this.minWidth = minWidth;
    this.minLength = minLength;
    this.maxWidth = maxWidth;
    this.maxLength = maxLength;
  }

  public static SizeBounds none() {
    return NONE;
  }

  public OptionalInt getMinWidth() {
    return minWidth;
  }

  public OptionalInt getMinLength() {
    return minLength;
  }

  public OptionalInt getMaxWidth() {
    return maxWidth;
  }

  public OptionalInt getMaxLength() {
    return maxLength;
  }

  @Override
  public String toString() {
    return "[" + text(minWidth) + ".." + text(maxWidth) + "]x[" + text(minLength) + ".."
        + text(maxLength) + "]";
  }

  private static String text(OptionalInt value) {
    return value.isPresent() ? Integer.toString(value.getAsInt()) : "";
  }

  private final OptionalInt minWidth;
  private final OptionalInt minLength;
  private final OptionalInt maxWidth;
  private final OptionalInt maxLength;
}
