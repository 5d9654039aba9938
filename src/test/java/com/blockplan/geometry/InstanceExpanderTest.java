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

import com.blockplan.rules.CirculationRole;
import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.RoomCategory;
import com.blockplan.rules.RoomTypeRule;
import com.blockplan.rules.RuleRegistry;
import com.blockplan.rules.RuleTarget;
import com.blockplan.rules.SpaceGroup;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests the expansion of room inventories into instances. */
public final class InstanceExpanderTest {
  private static final RuleRegistry REGISTRY = RuleRegistry.newBuilder()
      .add(RoomTypeRule.newBuilder("treatmentRoom").build())
      .add(RoomTypeRule.newBuilder("lab").build())
      .add(RoomTypeRule.newBuilder("clinicalCorridor")
          .setCirculationRole(CirculationRole.SPINE).build())
      .add(RoomTypeRule.newBuilder("waitingRoom").setCategory(RoomCategory.PUBLIC).build())
      .build();

  private static Map<String, Integer> inventory(Object... pairs) {
    Map<String, Integer> result = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      result.put((String) pairs[i], (Integer) pairs[i + 1]);
    }
    return result;
  }

  @Test
  public void testExpand_countsAndIds() throws Exception {
    final InstanceIndex index =
        InstanceExpander.expand(inventory("treatmentRoom", 3, "lab", 1), REGISTRY);
    assertThat(index.size()).isEqualTo(4);
    final List<String> ids = new ArrayList<>();
    for (RoomInstance instance : index.all()) {
      ids.add(instance.getId());
    }
    assertThat(ids)
        .containsExactly("treatmentRoom#0", "treatmentRoom#1", "treatmentRoom#2", "lab#0")
        .inOrder();
    assertThat(index.instancesOf("treatmentRoom")).hasSize(3);
    assertThat(index.instancesOf("treatmentRoom").get(2).getIndex()).isEqualTo(2);
  }

  @Test
  public void testExpand_zeroCountGivesNoInstances() throws Exception {
    final InstanceIndex index =
        InstanceExpander.expand(inventory("lab", 1, "waitingRoom", 0), REGISTRY);
    assertThat(index.size()).isEqualTo(1);
    assertThat(index.instancesOf("waitingRoom")).isEmpty();
    assertThat(index.resolve(RuleTarget.ofType("waitingRoom"))).isEmpty();
    assertThat(index.typeIds()).containsExactly("lab");
  }

  @Test
  public void testExpand_negativeCountIsRejected() throws Exception {
    assertThrows(LayoutConfigurationException.class,
        () -> InstanceExpander.expand(inventory("lab", -1), REGISTRY));
  }

  @Test
  public void testExpand_unknownTypeIsUnconstrained() throws Exception {
    final InstanceIndex index = InstanceExpander.expand(inventory("storage", 2), REGISTRY);
    assertThat(index.size()).isEqualTo(2);
    assertThat(index.all().get(0).getRule().getRules()).isEmpty();
  }

  @Test
  public void testResolve_groupsAndCorridors() throws Exception {
    final InstanceIndex index = InstanceExpander.expand(
        inventory("treatmentRoom", 2, "clinicalCorridor", 1, "waitingRoom", 1), REGISTRY);
    assertThat(index.resolve(RuleTarget.ofGroup(SpaceGroup.CLINICAL))).hasSize(3);
    assertThat(index.resolve(RuleTarget.ofGroup(SpaceGroup.PATIENT_FACING))).hasSize(1);
    assertThat(index.corridors()).hasSize(1);
    assertThat(index.corridors().get(0).getId()).isEqualTo("clinicalCorridor#0");

    final List<RuleTarget> overlapping = new ArrayList<>();
    overlapping.add(RuleTarget.ofType("treatmentRoom"));
    overlapping.add(RuleTarget.ofGroup(SpaceGroup.CLINICAL));
    assertThat(index.resolveAll(overlapping)).hasSize(3);
  }
}
