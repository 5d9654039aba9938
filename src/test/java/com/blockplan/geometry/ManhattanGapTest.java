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

import static com.google.common.truth.Truth.assertThat;

import com.blockplan.rules.RoomTypeRule;
import com.blockplan.rules.RuleRegistry;
import com.blockplan.rules.TierResolver;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests the exact Manhattan gap encoding on fixed rectangles. */
public final class ManhattanGapTest {
  private static final FloorPlate FLOOR = new FloorPlate(200, 150);

  private CpModel model;
  private RectangleVariable a;
  private RectangleVariable b;
  private GapTable gaps;
  private RoomInstance first;
  private RoomInstance second;

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
    model = new CpModel();
    RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("a").build())
        .add(RoomTypeRule.newBuilder("b").build())
        .build();
    Map<String, Integer> inventory = new LinkedHashMap<>();
    inventory.put("a", 1);
    inventory.put("b", 1);
    InstanceIndex index = InstanceExpander.expand(inventory, registry);
    LayoutVariables variables = new GeometryAllocator(model, FLOOR, 0, false)
        .allocate(index, new TierResolver(OptionalInt.empty()));
    first = index.all().get(0);
    second = index.all().get(1);
    a = variables.rectangle(first);
    b = variables.rectangle(second);
    gaps = new GapTable(model, FLOOR, variables);
  }

  private long gapWith(int ax, int ay, int aw, int ah, int bx, int by, int bw, int bh) {
    place(a, ax, ay, aw, ah);
    place(b, bx, by, bw, bh);
    final ManhattanGap gap = gaps.get(first, second);
    final CpSolver solver = new CpSolver();
    final CpSolverStatus status = solver.solve(model);
    assertThat(status).isEqualTo(CpSolverStatus.OPTIMAL);
    return solver.value(gap.getTotal());
  }

  private void place(RectangleVariable rect, int x, int y, int w, int h) {
    model.addEquality(rect.getX(), x);
    model.addEquality(rect.getY(), y);
    model.addEquality(rect.getWidth(), w);
    model.addEquality(rect.getHeight(), h);
  }

  @Test
  public void testGap_separatedAlongX() throws Exception {
    assertThat(gapWith(0, 0, 50, 50, 80, 0, 40, 40)).isEqualTo(30);
  }

  @Test
  public void testGap_separatedAlongBothAxes() throws Exception {
    assertThat(gapWith(0, 0, 50, 50, 80, 90, 40, 40)).isEqualTo(70);
  }

  @Test
  public void testGap_secondOnTheLeftAndBelow() throws Exception {
    assertThat(gapWith(100, 100, 20, 20, 0, 0, 60, 70)).isEqualTo(70);
  }

  @Test
  public void testGap_touchingWallIsZero() throws Exception {
    assertThat(gapWith(0, 0, 50, 50, 50, 10, 40, 40)).isEqualTo(0);
  }

  @Test
  public void testGap_touchingCornerIsZero() throws Exception {
    assertThat(gapWith(0, 0, 50, 50, 50, 50, 40, 40)).isEqualTo(0);
  }

  @Test
  public void testGapTable_sharesVariablesPerPair() throws Exception {
    assertThat(gaps.get(first, second)).isSameInstanceAs(gaps.get(second, first));
    assertThat(gaps.size()).isEqualTo(1);
  }
}
