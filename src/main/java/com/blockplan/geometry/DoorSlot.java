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

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.IntVar;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A potential door of a room instance.
 *
 * <p>When active, exactly one side literal is true and the door point lies on that wall of the
 * owner's rectangle. An inactive slot keeps its coordinates within the floor plate and nothing
 * else.
 */
public final class DoorSlot {
  DoorSlot(RoomInstance owner, int slot, IntVar x, IntVar y, BoolVar active,
      Map<Side, BoolVar> sides) {
    this.owner = owner;
    this.slot = slot;
    this.x = x;
    this.y = y;
    this.active = active;
    this.sides = Collections.unmodifiableMap(new EnumMap<>(sides));
  }

  public RoomInstance getOwner() {
    return owner;
  }

  public int getSlot() {
    return slot;
  }

  public IntVar getX() {
    return x;
  }

  public IntVar getY() {
    return y;
  }

  public BoolVar getActive() {
    return active;
  }

  /** Returns the literal stating that the door sits on the given wall of its owner. */
  public BoolVar onSide(Side side) {
    return sides.get(side);
  }

  /** Coordinate fixed by a wall: x for vertical walls, y for horizontal ones. */
  public IntVar across(Side side) {
    return side.isVertical() ? x : y;
  }

  /** Coordinate that varies along a wall. */
  public IntVar along(Side side) {
    return side.isVertical() ? y : x;
  }

  public String getName() {
    return owner.getId() + ".door" + slot;
  }

  @Override
  public String toString() {
    return getName();
  }

  private final RoomInstance owner;
  private final int slot;
  private final IntVar x;
  private final IntVar y;
  private final BoolVar active;
  private final Map<Side, BoolVar> sides;
}
