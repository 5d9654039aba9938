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

import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.SizeBounds;
import com.blockplan.rules.TierResolver;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Creates the rectangle and door variables of every room instance.
 *
 * <p>Widths and heights take their domains from the floor plate and the resolved size bounds.
 * The x and y interval ends are bounded by the floor plate, which keeps every room inside it.
 * When {@code relaxSizeDomains} is set, size bounds are left out of the domains so that they can
 * be enforced by gated constraints instead.
 */
public final class GeometryAllocator {
  private static final Logger logger = Logger.getLogger(GeometryAllocator.class.getName());

  public GeometryAllocator(
      CpModel model, FloorPlate floor, int doorsPerRoom, boolean relaxSizeDomains) {
    if (doorsPerRoom < 0) {
      throw new LayoutConfigurationException(
          "GeometryAllocator", "negative door slot count " + doorsPerRoom);
    }
    this.model = model;
    this.floor = floor;
    this.doorsPerRoom = doorsPerRoom;
    this.relaxSizeDomains = relaxSizeDomains;
  }

  public int getDoorsPerRoom() {
    return doorsPerRoom;
  }

  /**
   * Allocates variables for all instances of the index.
   *
   * @throws LayoutConfigurationException if a minimum size exceeds the floor plate or the maximum
   */
  public LayoutVariables allocate(InstanceIndex index, TierResolver resolver) {
    LayoutVariables variables = new LayoutVariables();
    for (RoomInstance instance : index.all()) {
      SizeBounds bounds = resolver.resolveSize(instance.getRule());
      checkBounds(instance, bounds);
      RectangleVariable rect = allocateRoom(instance, bounds);
      variables.put(instance, rect, allocateDoors(instance, rect));
    }
    logger.fine("Allocated " + index.size() + " rectangles with " + doorsPerRoom
        + " door slots each");
    return variables;
  }

  private void checkBounds(RoomInstance instance, SizeBounds bounds) {
    if (bounds.getMinWidth().isPresent() && bounds.getMinWidth().getAsInt() > floor.getWidth()) {
      throw new LayoutConfigurationException("GeometryAllocator",
          "minimum width " + bounds.getMinWidth().getAsInt() + " of '" + instance.getTypeId()
              + "' exceeds floor width " + floor.getWidth());
    }
    if (bounds.getMinLength().isPresent()
        && bounds.getMinLength().getAsInt() > floor.getHeight()) {
      throw new LayoutConfigurationException("GeometryAllocator",
          "minimum length " + bounds.getMinLength().getAsInt() + " of '" + instance.getTypeId()
              + "' exceeds floor height " + floor.getHeight());
    }
    if (bounds.getMinWidth().isPresent() && bounds.getMaxWidth().isPresent()
        && bounds.getMinWidth().getAsInt() > bounds.getMaxWidth().getAsInt()) {
      throw new LayoutConfigurationException("GeometryAllocator",
          "minimum width of '" + instance.getTypeId() + "' exceeds its maximum " + bounds);
    }
    if (bounds.getMinLength().isPresent() && bounds.getMaxLength().isPresent()
        && bounds.getMinLength().getAsInt() > bounds.getMaxLength().getAsInt()) {
      throw new LayoutConfigurationException("GeometryAllocator",
          "minimum length of '" + instance.getTypeId() + "' exceeds its maximum " + bounds);
    }
  }

  private RectangleVariable allocateRoom(RoomInstance instance, SizeBounds bounds) {
    String name = instance.getId();
    long minWidth = 1;
    long maxWidth = floor.getWidth();
    long minHeight = 1;
    long maxHeight = floor.getHeight();
    if (!relaxSizeDomains) {
      if (bounds.getMinWidth().isPresent()) {
        minWidth = bounds.getMinWidth().getAsInt();
      }
      if (bounds.getMaxWidth().isPresent()) {
        maxWidth = Math.min(maxWidth, bounds.getMaxWidth().getAsInt());
      }
      if (bounds.getMinLength().isPresent()) {
        minHeight = bounds.getMinLength().getAsInt();
      }
      if (bounds.getMaxLength().isPresent()) {
        maxHeight = Math.min(maxHeight, bounds.getMaxLength().getAsInt());
      }
    }
    IntVar x = model.newIntVar(0, floor.getWidth() - minWidth, name + ".x");
    IntVar y = model.newIntVar(0, floor.getHeight() - minHeight, name + ".y");
    IntVar width = model.newIntVar(minWidth, maxWidth, name + ".width");
    IntVar height = model.newIntVar(minHeight, maxHeight, name + ".height");
    IntVar right = model.newIntVar(minWidth, floor.getWidth(), name + ".right");
    IntVar top = model.newIntVar(minHeight, floor.getHeight(), name + ".top");
    IntervalVar xInterval = model.newIntervalVar(x, width, right, name + ".xInterval");
    IntervalVar yInterval = model.newIntervalVar(y, height, top, name + ".yInterval");
    return new RectangleVariable(
        instance, x, y, width, height, right, top, xInterval, yInterval, bounds);
  }

  private List<DoorSlot> allocateDoors(RoomInstance instance, RectangleVariable rect) {
    int inset = instance.getRule().getClearance().doorInset();
    List<DoorSlot> slots = new ArrayList<>();
    for (int k = 0; k < doorsPerRoom; ++k) {
      String name = instance.getId() + ".door" + k;
      IntVar x = model.newIntVar(0, floor.getWidth(), name + ".x");
      IntVar y = model.newIntVar(0, floor.getHeight(), name + ".y");
      BoolVar active = model.newBoolVar(name + ".active");
      Map<Side, BoolVar> sides = new EnumMap<>(Side.class);
      LinearArgument[] sideVars = new LinearArgument[Side.values().length];
      for (Side side : Side.values()) {
        BoolVar on = model.newBoolVar(name + "." + side.name().toLowerCase());
        sides.put(side, on);
        sideVars[side.ordinal()] = on;
      }
      model.addEquality(LinearExpr.sum(sideVars), active);
      DoorSlot slot = new DoorSlot(instance, k, x, y, active, sides);
      for (Side side : Side.values()) {
        BoolVar on = sides.get(side);
        model.addEquality(slot.across(side), rect.wall(side)).onlyEnforceIf(on);
        model.addGreaterOrEqual(slot.along(side), rect.spanStart(side, inset)).onlyEnforceIf(on);
        model.addLessOrEqual(slot.along(side), rect.spanEnd(side, inset)).onlyEnforceIf(on);
      }
      if (k > 0) {
        model.addImplication(active, slots.get(k - 1).getActive());
      }
      slots.add(slot);
    }
    for (int j = 0; j < slots.size(); ++j) {
      for (int k = j + 1; k < slots.size(); ++k) {
        separateDoors(slots.get(j), slots.get(k), Math.max(1, 2 * inset));
      }
    }
    return slots;
  }

  // Two active doors never share a point, and doors on the same wall keep their centers at
  // least spacing apart.
  private void separateDoors(DoorSlot first, DoorSlot second, int spacing) {
    String name = first.getName() + "~" + second.getName();
    Literal[] bothActive = new Literal[] {first.getActive(), second.getActive()};
    BoolVar xApart = model.newBoolVar(name + ".xApart");
    model.addDifferent(first.getX(), second.getX()).onlyEnforceIf(xApart);
    BoolVar yApart = model.newBoolVar(name + ".yApart");
    model.addDifferent(first.getY(), second.getY()).onlyEnforceIf(yApart);
    model.addBoolOr(new Literal[] {xApart, yApart}).onlyEnforceIf(bothActive);
    for (Side side : Side.values()) {
      Literal[] sameWall = new Literal[] {first.onSide(side), second.onSide(side)};
      BoolVar before = model.newBoolVar(name + "." + side.name().toLowerCase() + ".before");
      model.addLessOrEqual(LinearExpr.affine(first.along(side), 1, spacing), second.along(side))
          .onlyEnforceIf(before);
      BoolVar after = model.newBoolVar(name + "." + side.name().toLowerCase() + ".after");
      model.addLessOrEqual(LinearExpr.affine(second.along(side), 1, spacing), first.along(side))
          .onlyEnforceIf(after);
      model.addBoolOr(new Literal[] {before, after}).onlyEnforceIf(sameWall);
    }
  }

  private final CpModel model;
  private final FloorPlate floor;
  private final int doorsPerRoom;
  private final boolean relaxSizeDomains;
}
