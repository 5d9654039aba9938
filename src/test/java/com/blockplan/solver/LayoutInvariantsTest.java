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

import static com.google.common.truth.Truth.assertThat;

import com.blockplan.geometry.FloorPlate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests the structural checks on solved layouts. */
public final class LayoutInvariantsTest {
  private static final FloorPlate FLOOR = new FloorPlate(200, 150);

  private static PlacedRoom room(String type, int x, int y, int w, int h, PlacedDoor... doors) {
    return new PlacedRoom(type, 0, x, y, w, h, Arrays.asList(doors));
  }

  @Test
  public void testCheck_soundLayout() throws Exception {
    final LayoutSolution solution = new LayoutSolution(Arrays.asList(
        room("lab", 0, 0, 96, 72, new PlacedDoor(0, 96, 30, Optional.of("corridor#0"))),
        room("corridor", 96, 0, 48, 150)));
    assertThat(LayoutInvariants.check(FLOOR, solution)).isEmpty();
  }

  @Test
  public void testCheck_overlapOutsideAndDoorOffWall() throws Exception {
    final LayoutSolution solution = new LayoutSolution(Arrays.asList(
        room("lab", 0, 0, 96, 72, new PlacedDoor(0, 50, 30, Optional.<String>empty())),
        room("office", 90, 10, 120, 40)));
    assertThat(LayoutInvariants.check(FLOOR, solution)).hasSize(3);
  }

  @Test
  public void testCheck_doorsOnSamePoint() throws Exception {
    final LayoutSolution solution = new LayoutSolution(Collections.singletonList(
        room("lab", 100, 0, 96, 72, new PlacedDoor(0, 196, 0, Optional.<String>empty()),
            new PlacedDoor(1, 196, 0, Optional.<String>empty()))));
    assertThat(LayoutInvariants.check(FLOOR, solution)).hasSize(1);
  }

  @Test
  public void testPlacedRoom_gapAndSharedWall() throws Exception {
    final PlacedRoom a = room("a", 0, 0, 50, 50);
    final PlacedRoom b = room("b", 50, 20, 30, 60);
    final PlacedRoom c = room("c", 100, 100, 10, 10);
    assertThat(a.gapTo(b)).isEqualTo(0);
    assertThat(a.sharedWallWith(b)).isEqualTo(30);
    assertThat(a.gapTo(c)).isEqualTo(100);
    assertThat(a.sharedWallWith(c)).isEqualTo(0);
    assertThat(LayoutInvariants.check(FLOOR, new LayoutSolution(Collections.singletonList(c))))
        .isEmpty();
  }
}
