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

package com.blockplan.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Immutable list of solved rooms in instance order. */
public final class LayoutSolution {
  public LayoutSolution(List<PlacedRoom> rooms) {
    this.rooms = Collections.unmodifiableList(new ArrayList<>(rooms));
  }

  public List<PlacedRoom> getRooms() {
    return rooms;
  }

  public Optional<PlacedRoom> find(String instanceId) {
    for (PlacedRoom room : rooms) {
      if (room.getId().equals(instanceId)) {
        return Optional.of(room);
      }
    }
    return Optional.empty();
  }

  public List<PlacedRoom> roomsOf(String roomType) {
    List<PlacedRoom> result = new ArrayList<>();
    for (PlacedRoom room : rooms) {
      if (room.getRoomType().equals(roomType)) {
        result.add(room);
      }
    }
    return result;
  }

  private final List<PlacedRoom> rooms;
}
