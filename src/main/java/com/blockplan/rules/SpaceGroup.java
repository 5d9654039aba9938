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
 * Coarse group of room types that a rule can target instead of naming every type.
 *
 * <p>Membership is derived from the category and circulation role of each registered type.
 */
public enum SpaceGroup {
  CLINICAL,
  PUBLIC,
  PRIVATE,
  CORRIDORS,
  PATIENT_FACING;

  /** Returns true if a room type with the given rule belongs to this group. */
  public boolean contains(RoomTypeRule rule) {
    switch (this) {
      case CLINICAL:
        return rule.getCategory() == RoomCategory.CLINICAL;
      case PUBLIC:
      case PATIENT_FACING:
        return rule.getCategory() == RoomCategory.PUBLIC;
      case PRIVATE:
        return rule.getCategory() == RoomCategory.PRIVATE;
      case CORRIDORS:
        return rule.getCirculationRole().isCorridor();
    }
    throw new IllegalStateException("Unhandled space group " + this);
  }
}
