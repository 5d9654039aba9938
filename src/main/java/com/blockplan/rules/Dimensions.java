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

package com.blockplan.rules;

/** A (width, length) pair in inches. Width runs along x, length along y. */
public final class Dimensions {
  public static Dimensions of(int width, int length) {
    if (width <= 0 || length <= 0) {
      throw new LayoutConfigurationException(
          "Dimensions", "non-positive size " + width + "x" + length);
    }
    return new Dimensions(width, length);
  }

  private Dimensions(int width, int length) {
    this.width = width;
    this.length = length;
  }

  public int getWidth() {
    return width;
  }

  public int getLength() {
    return length;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Dimensions)) {
      return false;
    }
    Dimensions other = (Dimensions) o;
    return width == other.width && length == other.length;
  }

  @Override
  public int hashCode() {
    return 31 * width + length;
  }

  @Override
  public String toString() {
    return width + "x" + length;
  }

  private final int width;
  private final int length;
}
