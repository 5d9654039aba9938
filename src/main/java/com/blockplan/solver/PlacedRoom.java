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

/** A solved room: lower-left corner, size and active doors, in inches. */
public final class PlacedRoom {
  public PlacedRoom(String roomType, int instanceIndex, int x, int y, int width, int height,
      List<PlacedDoor> doors) {
    this.roomType = roomType;
    this.instanceIndex = instanceIndex;
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.doors = Collections.unmodifiableList(new ArrayList<>(doors));
  }

  public String getRoomType() {
    return roomType;
  }

  public int getInstanceIndex() {
    return instanceIndex;
  }

  public String getId() {
    return roomType + "#" + instanceIndex;
  }

  public int getX() {
    return x;
  }

  public int getY() {
    return y;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public int getRight() {
    return x + width;
  }

  public int getTop() {
    return y + height;
  }

  public List<PlacedDoor> getDoors() {
    return doors;
  }

  /** Manhattan gap to another room, 0 when they touch or overlap. */
  public int gapTo(PlacedRoom other) {
    int dx = Math.max(0, Math.max(other.x - getRight(), x - other.getRight()));
    int dy = Math.max(0, Math.max(other.y - getTop(), y - other.getTop()));
    return dx + dy;
  }

  /** Length of the wall segment shared with another room, 0 when none. */
  public int sharedWallWith(PlacedRoom other) {
    if (getRight() == other.x || other.getRight() == x) {
      return Math.max(0, Math.min(getTop(), other.getTop()) - Math.max(y, other.y));
    }
    if (getTop() == other.y || other.getTop() == y) {
      return Math.max(0, Math.min(getRight(), other.getRight()) - Math.max(x, other.x));
    }
    return 0;
  }

  /** Returns true if the point lies on this room's boundary. */
  public boolean isOnPerimeter(int px, int py) {
    boolean onVertical = (px == x || px == getRight()) && py >= y && py <= getTop();
    boolean onHorizontal = (py == y || py == getTop()) && px >= x && px <= getRight();
    return onVertical || onHorizontal;
  }

  @Override
  public String toString() {
    return getId() + " at (" + x + "," + y + ") " + width + "x" + height;
  }

  private final String roomType;
  private final int instanceIndex;
  private final int x;
  private final int y;
  private final int width;
  private final int height;
  private final List<PlacedDoor> doors;
}
