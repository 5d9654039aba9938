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
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.Literal;

/**
 * Four literals, one per side of the first rectangle, each stating that the second rectangle
 * touches that side along a wall segment of at least {@code minimumShared} inches.
 */
public final class SharedBoundary {
  public static SharedBoundary create(
      CpModel model, RectangleVariable a, RectangleVariable b, int minimumShared) {
    if (minimumShared < 1) {
      throw new IllegalArgumentException("Shared wall must be positive: " + minimumShared);
    }
    String name = "share(" + a.getOwner().getId() + "," + b.getOwner().getId() + ")";
    BoolVar[] sides = new BoolVar[Side.values().length];
    for (Side side : Side.values()) {
      BoolVar lit = model.newBoolVar(name + "." + side.name().toLowerCase());
      model.addEquality(a.wall(side), b.wall(side.opposite())).onlyEnforceIf(lit);
      // Both walls are at least minimumShared long and each starts minimumShared before the
      // other ends, so their overlap is at least minimumShared.
      model.addLessOrEqual(a.spanStart(side, minimumShared), b.spanEnd(side, 0))
          .onlyEnforceIf(lit);
      model.addLessOrEqual(b.spanStart(side, minimumShared), a.spanEnd(side, 0))
          .onlyEnforceIf(lit);
      model.addLessOrEqual(a.spanStart(side, minimumShared), a.spanEnd(side, 0))
          .onlyEnforceIf(lit);
      model.addLessOrEqual(b.spanStart(side, minimumShared), b.spanEnd(side, 0))
          .onlyEnforceIf(lit);
      sides[side.ordinal()] = lit;
    }
    return new SharedBoundary(sides);
  }

  private SharedBoundary(BoolVar[] sides) {
    this.sides = sides;
  }

  /** Literal stating that the second rectangle lies against {@code side} of the first. */
  public BoolVar onSide(Side side) {
    return sides[side.ordinal()];
  }

  /** The four side literals, for a disjunction. */
  public Literal[] literals() {
    return sides.clone();
  }

  private final BoolVar[] sides;
}
