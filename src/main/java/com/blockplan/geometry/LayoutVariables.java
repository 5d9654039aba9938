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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** All geometry variables of one model, keyed by room instance in expansion order. */
public final class LayoutVariables {
  LayoutVariables() {
    this.rectangles = new LinkedHashMap<>();
    this.doors = new LinkedHashMap<>();
  }

  void put(RoomInstance instance, RectangleVariable rectangle, List<DoorSlot> slots) {
    rectangles.put(instance, rectangle);
    doors.put(instance, Collections.unmodifiableList(new ArrayList<>(slots)));
  }

  public RectangleVariable rectangle(RoomInstance instance) {
    RectangleVariable rect = rectangles.get(instance);
    if (rect == null) {
      throw new IllegalArgumentException("No variables allocated for " + instance);
    }
    return rect;
  }

  public List<DoorSlot> doors(RoomInstance instance) {
    List<DoorSlot> slots = doors.get(instance);
    return slots == null ? Collections.<DoorSlot>emptyList() : slots;
  }

  public Collection<RectangleVariable> rectangles() {
    return Collections.unmodifiableCollection(rectangles.values());
  }

  private final Map<RoomInstance, RectangleVariable> rectangles;
  private final Map<RoomInstance, List<DoorSlot>> doors;
}
