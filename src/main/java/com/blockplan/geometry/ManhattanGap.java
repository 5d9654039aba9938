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
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;

/**
 * Manhattan gap between two rectangles.
 *
 * <p>Each component is the positive part of one edge difference, {@code max(0, diff)}, so the
 * total is exactly 0 when the rectangles touch or overlap on both axes and otherwise the distance
 * along the separated axes. Both upper and lower bounds on the total are therefore sound.
 */
public final class ManhattanGap {
  /** Creates the gap variables between {@code a} and {@code b}. */
  public static ManhattanGap between(
      CpModel model, RectangleVariable a, RectangleVariable b, FloorPlate floor) {
    String name = "gap(" + a.getOwner().getId() + "," + b.getOwner().getId() + ")";
    IntVar rightOf = positivePart(model, b.getX(), a.getRight(), floor.getWidth(),
        name + ".rightOf");
    IntVar leftOf = positivePart(model, a.getX(), b.getRight(), floor.getWidth(),
        name + ".leftOf");
    IntVar above = positivePart(model, b.getY(), a.getTop(), floor.getHeight(), name + ".above");
    IntVar below = positivePart(model, a.getY(), b.getTop(), floor.getHeight(), name + ".below");
    IntVar total = model.newIntVar(0, floor.maxGap(), name);
    model.addEquality(total, LinearExpr.sum(new LinearArgument[] {rightOf, leftOf, above, below}));
    return new ManhattanGap(a, b, rightOf, leftOf, above, below, total);
  }

  // max(0, start - end), with start of the far rectangle and end of the near one.
  private static IntVar positivePart(
      CpModel model, IntVar start, IntVar end, long bound, String name) {
    IntVar part = model.newIntVar(0, bound, name);
    LinearExpr diff = LinearExpr.newBuilder().add(start).addTerm(end, -1).build();
    model.addMaxEquality(part, new LinearArgument[] {LinearExpr.constant(0), diff});
    return part;
  }

  private ManhattanGap(RectangleVariable a, RectangleVariable b, IntVar rightOf, IntVar leftOf,
      IntVar above, IntVar below, IntVar total) {
    this.a = a;
    this.b = b;
    this.rightOf = rightOf;
    this.leftOf = leftOf;
    this.above = above;
    this.below = below;
    this.total = total;
  }

  public RectangleVariable getFirst() {
    return a;
  }

  public RectangleVariable getSecond() {
    return b;
  }

  /** Distance by which the second rectangle lies right of the first. */
  public IntVar getRightOf() {
    return rightOf;
  }

  public IntVar getLeftOf() {
    return leftOf;
  }

  public IntVar getAbove() {
    return above;
  }

  public IntVar getBelow() {
    return below;
  }

  /** Sum of the four components. */
  public IntVar getTotal() {
    return total;
  }

  private final RectangleVariable a;
  private final RectangleVariable b;
  private final IntVar rightOf;
  private final IntVar leftOf;
  private final IntVar above;
  private final IntVar below;
  private final IntVar total;
}
