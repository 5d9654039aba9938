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

package com.blockplan.geometry;

import com.google.ortools.sat.CpModel;
import java.util.HashMap;
import java.util.Map;

/** Lazily created gap variables, shared per unordered pair of instances. */
public final class GapTable {
  public GapTable(CpModel model, FloorPlate floor, LayoutVariables variables) {
    this.model = model;
    this.floor = floor;
    this.variables = variables;
    this.gaps = new HashMap<>();
  }

  /** Returns the gap total between two distinct instances, creating it on first use. */
  public ManhattanGap get(RoomInstance a, RoomInstance b) {
    if (a == b) {
      throw new IllegalArgumentException("No gap between " + a + " and itself");
    }
    String key = key(a, b);
    ManhattanGap gap = gaps.get(key);
    if (gap == null) {
      gap = ManhattanGap.between(model, variables.rectangle(a), variables.rectangle(b), floor);
      gaps.put(key, gap);
    }
    return gap;
  }

  public int size() {
    return gaps.size();
  }

  private static String key(RoomInstance a, RoomInstance b) {
    return a.getId().compareTo(b.getId()) <= 0
        ? a.getId() + "|" + b.getId()
        : b.getId() + "|" + a.getId();
  }

  private final CpModel model;
  private final FloorPlate floor;
  private final LayoutVariables variables;
  private final Map<String, ManhattanGap> gaps;
}
