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

package com.blockplan.compiler;

import com.blockplan.geometry.DoorSlot;
import com.blockplan.geometry.RoomInstance;
import com.google.ortools.sat.BoolVar;

/** Literal stating that a door slot opens onto a target instance. */
public final class DoorConnection {
  DoorConnection(DoorSlot slot, RoomInstance target, BoolVar literal) {
    this.slot = slot;
    this.target = target;
    this.literal = literal;
  }

  public DoorSlot getSlot() {
    return slot;
  }

  public RoomInstance getTarget() {
    return target;
  }

  public BoolVar getLiteral() {
    return literal;
  }

  private final DoorSlot slot;
  private final RoomInstance target;
  private final BoolVar literal;
}
