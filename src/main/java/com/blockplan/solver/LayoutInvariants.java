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

import com.blockplan.geometry.FloorPlate;
import java.util.ArrayList;
import java.util.List;

/** Checks the structural properties every solved layout must have. */
public final class LayoutInvariants {
  private LayoutInvariants() {}

  /**
   * Returns a description of every violation: rooms outside the floor, overlapping rooms, doors
   * off their room's perimeter, or two doors of a room on the same point. An empty list means
   * the layout is sound.
   */
  public static List<String> check(FloorPlate floor, LayoutSolution solution) {
    List<String> violations = new ArrayList<>();
    List<PlacedRoom> rooms = solution.getRooms();
    for (PlacedRoom room : rooms) {
      if (room.getX() < 0 || room.getY() < 0 || room.getRight() > floor.getWidth()
          || room.getTop() > floor.getHeight()) {
        violations.add(room + " leaves the floor plate " + floor);
      }
      for (PlacedDoor door : room.getDoors()) {
        if (!room.isOnPerimeter(door.getX(), door.getY())) {
          violations.add(door + " of " + room.getId() + " is off the perimeter");
        }
      }
      List<PlacedDoor> doors = room.getDoors();
      for (int i = 0; i < doors.size(); ++i) {
        for (int j = i + 1; j < doors.size(); ++j) {
          if (doors.get(i).getX() == doors.get(j).getX()
              && doors.get(i).getY() == doors.get(j).getY()) {
            violations.add(doors.get(i) + " and " + doors.get(j) + " of " + room.getId()
                + " share a point");
          }
        }
      }
    }
    for (int i = 0; i < rooms.size(); ++i) {
      for (int j = i + 1; j < rooms.size(); ++j) {
        PlacedRoom a = rooms.get(i);
        PlacedRoom b = rooms.get(j);
        boolean overlapX = a.getX() < b.getRight() && b.getX() < a.getRight();
        boolean overlapY = a.getY() < b.getTop() && b.getY() < a.getTop();
        if (overlapX && overlapY) {
          violations.add(a.getId() + " overlaps " + b.getId());
        }
      }
    }
    return violations;
  }
}
