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

import com.blockplan.rules.SizeBounds;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearExpr;

/**
 * Position and size variables of one room instance: lower-left corner (x, y), width along x and
 * height along y, all in inches.
 */
public final class RectangleVariable {
  RectangleVariable(
      RoomInstance owner,
      IntVar x,
      IntVar y,
      IntVar width,
      IntVar height,
      IntVar right,
      IntVar top,
      IntervalVar xInterval,
      IntervalVar yInterval,
      SizeBounds bounds) {
    this.owner = owner;
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.right = right;
    this.top = top;
    this.xInterval = xInterval;
    this.yInterval = yInterval;
    this.bounds = bounds;
  }

  public RoomInstance getOwner() {
    return owner;
  }

  public IntVar getX() {
    return x;
  }

  public IntVar getY() {
    return y;
  }

  public IntVar getWidth() {
    return width;
  }

  public IntVar getHeight() {
    return height;
  }

  public IntervalVar getXInterval() {
    return xInterval;
  }

  public IntervalVar getYInterval() {
    return yInterval;
  }

  /** Size bounds resolved for the owner, whether or not they are part of the domains. */
  public SizeBounds getBounds() {
    return bounds;
  }

  /** x + width, the end of the x interval. */
  public IntVar getRight() {
    return right;
  }

  /** y + height, the end of the y interval. */
  public IntVar getTop() {
    return top;
  }

  /** 2x + width, the x coordinate of the center in doubled units. */
  public LinearExpr doubledCenterX() {
    return LinearExpr.newBuilder().addTerm(x, 2).add(width).build();
  }

  /** 2y + height, the y coordinate of the center in doubled units. */
  public LinearExpr doubledCenterY() {
    return LinearExpr.newBuilder().addTerm(y, 2).add(height).build();
  }

  /** Returns the fixed coordinate of a wall: x for LEFT, x + width for RIGHT, and so on. */
  public IntVar wall(Side side) {
    switch (side) {
      case LEFT:
        return x;
      case RIGHT:
        return right;
      case BOTTOM:
        return y;
      case TOP:
        return top;
    }
    throw new IllegalStateException("Unhandled side " + side);
  }

  /** Start of the span covered by a wall, offset by {@code inset}. */
  public LinearExpr spanStart(Side side, long inset) {
    return LinearExpr.affine(side.isVertical() ? y : x, 1, inset);
  }

  /** End of the span covered by a wall, offset by {@code -inset}. */
  public LinearExpr spanEnd(Side side, long inset) {
    return LinearExpr.affine(side.isVertical() ? top : right, 1, -inset);
  }

  @Override
  public String toString() {
    return "rect(" + owner.getId() + ")";
  }

  private final RoomInstance owner;
  private final IntVar x;
  private final IntVar y;
  private final IntVar width;
  private final IntVar height;
  private final IntVar right;
  private final IntVar top;
  private final IntervalVar xInterval;
  private final IntervalVar yInterval;
  private final SizeBounds bounds;
}
