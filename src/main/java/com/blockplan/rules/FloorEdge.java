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

/** Edge of the floor plate used as the reference for orientation rules. */
public enum FloorEdge {
  /** The y = 0 edge. */
  FRONT,
  /** The y = height edge. */
  BACK,
  /** The x = 0 edge. */
  LEFT,
  /** The x = width edge. */
  RIGHT;

  /** Returns true if the edge runs along the x axis. */
  public boolean isHorizontal() {
    return this == FRONT || this == BACK;
  }
}
