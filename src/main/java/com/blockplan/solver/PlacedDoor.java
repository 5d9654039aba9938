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

import java.util.Optional;

/** An active door of a solved room. */
public final class PlacedDoor {
  public PlacedDoor(int slot, int x, int y, Optional<String> connectedTo) {
    this.slot = slot;
    this.x = x;
    this.y = y;
    this.connectedTo = connectedTo;
  }

  public int getSlot() {
    return slot;
  }

  public int getX() {
    return x;
  }

  public int getY() {
    return y;
  }

  /** Id of the instance the door opens onto, when an entry rule connected it. */
  public Optional<String> getConnectedTo() {
    return connectedTo;
  }

  @Override
  public String toString() {
    return "door" + slot + "(" + x + "," + y + ")"
        + (connectedTo.isPresent() ? "->" + connectedTo.get() : "");
  }

  private final int slot;
  private final int x;
  private final int y;
  private final Optional<String> connectedTo;
}
