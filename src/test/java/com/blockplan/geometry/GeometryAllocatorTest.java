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
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.blockplan.rules.ClearanceRule;
import com.blockplan.rules.Dimensions;
import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.RoomTypeRule;
import com.blockplan.rules.RuleRegistry;
import com.blockplan.rules.SizeRule;
import com.blockplan.rules.SizeTier;
import com.blockplan.rules.TierResolver;
import com.blockplan.rules.TreatmentRange;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests rectangle domains, configuration checks and door slot placement. */
public final class GeometryAllocatorTest {
  private static final FloorPlate FLOOR = new FloorPlate(200, 150);
  private static final TierResolver NO_TIERS = new TierResolver(OptionalInt.empty());

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static InstanceIndex single(RoomTypeRule rule) {
    return InstanceExpander.expand(Collections.singletonMap(rule.getId(), 1),
        RuleRegistry.newBuilder().add(rule).build());
  }

  @Test
  public void testAllocate_minimumSizeInDomain() throws Exception {
    final CpModel model = new CpModel();
    final InstanceIndex index =
        single(RoomTypeRule.newBuilder("lab").setMinimumSize(96, 72).build());
    final LayoutVariables variables =
        new GeometryAllocator(model, FLOOR, 2, false).allocate(index, NO_TIERS);
    final RectangleVariable rect = variables.rectangle(index.all().get(0));
    assertThat(rect.getWidth().getDomain().flattenedIntervals()).isEqualTo(new long[] {96, 200});
    assertThat(rect.getHeight().getDomain().flattenedIntervals()).isEqualTo(new long[] {72, 150});
    assertThat(rect.getX().getDomain().flattenedIntervals()).isEqualTo(new long[] {0, 104});
    assertThat(variables.doors(index.all().get(0))).hasSize(2);
  }

  @Test
  public void testAllocate_relaxedDomainsKeepBounds() throws Exception {
    final CpModel model = new CpModel();
    final InstanceIndex index =
        single(RoomTypeRule.newBuilder("lab").setMinimumSize(96, 72).build());
    final RectangleVariable rect = new GeometryAllocator(model, FLOOR, 0, true)
        .allocate(index, NO_TIERS).rectangle(index.all().get(0));
    assertThat(rect.getWidth().getDomain().flattenedIntervals()).isEqualTo(new long[] {1, 200});
    assertThat(rect.getBounds().getMinWidth().getAsInt()).isEqualTo(96);
  }

  @Test
  public void testAllocate_minimumLargerThanFloor() throws Exception {
    final InstanceIndex index =
        single(RoomTypeRule.newBuilder("lab").setMinimumSize(250, 72).build());
    final LayoutConfigurationException e = assertThrows(LayoutConfigurationException.class,
        () -> new GeometryAllocator(new CpModel(), FLOOR, 2, false).allocate(index, NO_TIERS));
    assertThat(e).hasMessageThat().contains("exceeds floor width");
  }

  @Test
  public void testAllocate_explicitMaximumBelowTierMinimum() throws Exception {
    final RoomTypeRule rule = RoomTypeRule.newBuilder("office")
        .setSize(SizeRule.newBuilder().setMaximum(Dimensions.of(80, 80))
            .addTier(SizeTier.of("large", TreatmentRange.any(), 100, 60))
            .build())
        .build();
    assertThrows(LayoutConfigurationException.class,
        () -> new GeometryAllocator(new CpModel(), FLOOR, 2, false)
            .allocate(single(rule), NO_TIERS));
  }

  @Test
  public void testDoors_activeDoorOnPerimeterWithInset() throws Exception {
    final CpModel model = new CpModel();
    final RoomTypeRule rule = RoomTypeRule.newBuilder("lab")
        .setMinimumSize(96, 72)
        .setClearance(new ClearanceRule(OptionalInt.of(34), OptionalInt.empty(),
            OptionalInt.empty()))
        .build();
    final InstanceIndex index = single(rule);
    final LayoutVariables variables =
        new GeometryAllocator(model, FLOOR, 2, false).allocate(index, NO_TIERS);
    final RoomInstance lab = index.all().get(0);
    final RectangleVariable rect = variables.rectangle(lab);
    final List<DoorSlot> doors = variables.doors(lab);
    model.addEquality(rect.getX(), 20);
    model.addEquality(rect.getY(), 30);
    model.addEquality(rect.getWidth(), 100);
    model.addEquality(rect.getHeight(), 80);
    model.addEquality(doors.get(1).getActive(), 1);
    model.addEquality(doors.get(1).onSide(Side.TOP), 1);
    // Push the door as far left as the inset allows.
    model.minimize(doors.get(1).getX());

    final CpSolver solver = new CpSolver();
    final CpSolverStatus status = solver.solve(model);

    assertThat(status).isEqualTo(CpSolverStatus.OPTIMAL);
    assertThat(solver.booleanValue(doors.get(0).getActive())).isTrue();
    assertThat(solver.value(doors.get(1).getY())).isEqualTo(110);
    assertThat(solver.value(doors.get(1).getX())).isEqualTo(37);
  }

  @Test
  public void testDoors_inactiveSlotHasNoSide() throws Exception {
    final CpModel model = new CpModel();
    final InstanceIndex index = single(RoomTypeRule.newBuilder("closet").build());
    final DoorSlot slot = new GeometryAllocator(model, FLOOR, 1, false)
        .allocate(index, NO_TIERS).doors(index.all().get(0)).get(0);
    model.addEquality(slot.getActive(), 0);
    model.maximize(slot.onSide(Side.LEFT));

    final CpSolver solver = new CpSolver();
    assertThat(solver.solve(model)).isEqualTo(CpSolverStatus.OPTIMAL);
    assertThat(solver.booleanValue(slot.onSide(Side.LEFT))).isFalse();
  }

  private static List<DoorSlot> fixedRoomDoors(CpModel model, ClearanceRule clearance) {
    final InstanceIndex index =
        single(RoomTypeRule.newBuilder("lab").setClearance(clearance).build());
    final LayoutVariables variables =
        new GeometryAllocator(model, FLOOR, 2, false).allocate(index, NO_TIERS);
    final RectangleVariable rect = variables.rectangle(index.all().get(0));
    model.addEquality(rect.getX(), 100);
    model.addEquality(rect.getY(), 0);
    model.addEquality(rect.getWidth(), 96);
    model.addEquality(rect.getHeight(), 72);
    final List<DoorSlot> doors = variables.doors(index.all().get(0));
    model.addEquality(doors.get(1).getActive(), 1);
    return doors;
  }

  @Test
  public void testDoors_activeDoorsNeverShareACorner() throws Exception {
    final CpModel model = new CpModel();
    final List<DoorSlot> doors = fixedRoomDoors(model, ClearanceRule.none());
    // Both doors at the bottom right corner, one on each wall meeting there.
    model.addEquality(doors.get(0).onSide(Side.RIGHT), 1);
    model.addEquality(doors.get(1).onSide(Side.BOTTOM), 1);
    model.addEquality(doors.get(0).getY(), 0);
    model.addEquality(doors.get(1).getX(), 196);

    assertThat(new CpSolver().solve(model)).isEqualTo(CpSolverStatus.INFEASIBLE);
  }

  @Test
  public void testDoors_sameWallKeepsClearWidthApart() throws Exception {
    final CpModel model = new CpModel();
    final List<DoorSlot> doors = fixedRoomDoors(model,
        new ClearanceRule(OptionalInt.of(34), OptionalInt.empty(), OptionalInt.empty()));
    model.addEquality(doors.get(0).onSide(Side.BOTTOM), 1);
    model.addEquality(doors.get(1).onSide(Side.BOTTOM), 1);
    model.addEquality(doors.get(0).getX(), 117);
    model.minimize(doors.get(1).getX());

    final CpSolver solver = new CpSolver();
    assertThat(solver.solve(model)).isEqualTo(CpSolverStatus.OPTIMAL);
    // Door centers sit 34 apart so that both clear openings fit side by side.
    assertThat(solver.value(doors.get(1).getX())).isEqualTo(151);
  }
}
