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

/** The bounded rectangular floor, [0, width] x [0, height] in inches. */
public final class FloorPlate {
  public FloorPlate(int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new LayoutConfigurationException(
          "FloorPlate", "dimensions must be positive: " + width + "x" + height);
    }
    this.width = width;
    this.height = height;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  /** Largest Manhattan gap two rooms on this floor can have. */
  public int maxGap() {
    return width + height;
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }

  private final int width;
  private final int height;
}
