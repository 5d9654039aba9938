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

/** A wall of a rectangle. LEFT and RIGHT walls run along y, BOTTOM and TOP walls along x. */
public enum Side {
  LEFT,
  RIGHT,
  BOTTOM,
  TOP;

  public Side opposite() {
    switch (this) {
      case LEFT:
        return RIGHT;
      case RIGHT:
        return LEFT;
      case BOTTOM:
        return TOP;
      case TOP:
        return BOTTOM;
    }
    throw new IllegalStateException("Unhandled side " + this);
  }

  /** Returns true for walls parallel to the y axis. */
  public boolean isVertical() {
    return this == LEFT || this == RIGHT;
  }
}
