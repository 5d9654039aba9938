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

/** Door clearance requirements of a room type. */
public final class ClearanceRule {
  private static final ClearanceRule NONE =
      new ClearanceRule(OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty());

  public ClearanceRule(
      OptionalInt adaClearWidth, OptionalInt adaRequiredEntries, OptionalInt idealClearWidth) {
    this.adaClearWidth = adaClearWidth;
    this.adaRequiredEntries = adaRequiredEntries;
    this.idealClearWidth = idealClearWidth;
  }

  public static ClearanceRule none() {
    return NONE;
  }

  /** Clear door width required for accessibility, in inches. */
  public OptionalInt getAdaClearWidth() {
    return adaClearWidth;
  }

  /** Number of doors that must be accessible. */
  public OptionalInt getAdaRequiredEntries() {
    return adaRequiredEntries;
  }

  /** Preferred clear width; carried as metadata. */
  public OptionalInt getIdealClearWidth() {
    return idealClearWidth;
  }

  /** Half the ADA clear width rounded up, or 0: how far a door center stays from a wall end. */
  public int doorInset() {
    return adaClearWidth.isPresent() ? (adaClearWidth.getAsInt() + 1) / 2 : 0;
  }

  private final OptionalInt adaClearWidth;
  private final OptionalInt adaRequiredEntries;
  private final OptionalInt idealClearWidth;
}
