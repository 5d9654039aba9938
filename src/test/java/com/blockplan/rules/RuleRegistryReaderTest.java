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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.InputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests reading rule registries from JSON. */
public final class RuleRegistryReaderTest {
  private RuleRegistry registry;

  @BeforeEach
  public void setUp() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/rules/clinic_rules.json")) {
      registry = RuleRegistryReader.read(in);
    }
  }

  @Test
  public void testRead_roomTypesInDocumentOrder() throws Exception {
    assertThat(registry.size()).isEqualTo(5);
    assertThat(registry.typesIn(SpaceGroup.CLINICAL))
        .containsExactly("lab", "sterilization", "clinicalCorridor")
        .inOrder();
    assertThat(registry.typesIn(SpaceGroup.CORRIDORS)).containsExactly("clinicalCorridor");
    assertThat(registry.typesIn(SpaceGroup.PATIENT_FACING))
        .containsExactly("waitingRoom", "patientRestroom");
  }

  @Test
  public void testRead_sizeAndClearance() throws Exception {
    final RoomTypeRule lab = registry.get("lab");
    assertThat(lab.getSize().getMinimum().get().getWidth()).isEqualTo(96);
    assertThat(lab.getSize().getMinimum().get().getLength()).isEqualTo(72);
    assertThat(lab.getSize().getMaximum().isPresent()).isFalse();
    assertThat(lab.getSize().getIdeal().isPresent()).isFalse();
    assertThat(lab.getClearance().getAdaClearWidth().getAsInt()).isEqualTo(34);
    assertThat(lab.getClearance().doorInset()).isEqualTo(17);
    assertThat(lab.getScalability()).isEqualTo("one lab per clinic");
  }

  @Test
  public void testRead_placeholdersAreAbsent() throws Exception {
    final RoomTypeRule waiting = registry.get("waitingRoom");
    assertThat(waiting.getSize().isUnresolved()).isTrue();
    assertThat(waiting.getOrientation().isPresent()).isFalse();
    final SpatialRule separation = waiting.getSeparation().get(0);
    assertThat(separation.getDistance().isPresent()).isFalse();
    assertThat(separation.isHard()).isTrue();
  }

  @Test
  public void testRead_rulesAndTargets() throws Exception {
    final RoomTypeRule sterilization = registry.get("sterilization");
    assertThat(sterilization.getDirectAdjacency()).hasSize(1);
    assertThat(sterilization.getDirectAdjacency().get(0).getTargets())
        .containsExactly(RuleTarget.ofType("lab"));
    final SpatialRule hidden = sterilization.rulesOf(RuleKind.HIDDEN_FROM).get(0);
    assertThat(hidden.isHard()).isFalse();
    assertThat(hidden.getTargets()).containsExactly(RuleTarget.ofGroup(SpaceGroup.PATIENT_FACING));
    assertThat(sterilization.getOrientation().get().isLongAxisHorizontal()).isFalse();
    assertThat(sterilization.getSize().getTiers()).hasSize(2);

    final SpatialRule center = registry.get("waitingRoom").rulesOf(RuleKind.PREFER_NEAR_CENTER)
        .get(0);
    assertThat(center.getWeight()).isEqualTo(3);
    assertThat(center.getTargets()).isEmpty();
  }

  @Test
  public void testParse_rejectsUnknownKind() throws Exception {
    final LayoutConfigurationException e = assertThrows(LayoutConfigurationException.class,
        () -> RuleRegistryReader.parse(
            "{\"roomTypes\": [{\"id\": \"lab\", \"rules\": [{\"kind\": \"NEAR_WINDOW\","
                + " \"targets\": [\"lab\"]}]}]}"));
    assertThat(e).hasMessageThat().contains("NEAR_WINDOW");
  }

  @Test
  public void testParse_rejectsUnknownRuleField() throws Exception {
    assertThrows(LayoutConfigurationException.class,
        () -> RuleRegistryReader.parse(
            "{\"roomTypes\": [{\"id\": \"lab\", \"rules\": [{\"kind\": \"SEPARATION\","
                + " \"targets\": [\"office\"], \"distnace\": 24}]}]}"));
  }

  @Test
  public void testParse_rejectsMalformedNumber() throws Exception {
    final LayoutConfigurationException e = assertThrows(LayoutConfigurationException.class,
        () -> RuleRegistryReader.parse(
            "{\"roomTypes\": [{\"id\": \"lab\", \"rules\": [{\"kind\": \"SEPARATION\","
                + " \"targets\": [\"office\"], \"distance\": \"far\"}]}]}"));
    assertThat(e).hasMessageThat().contains("distance");
  }

  @Test
  public void testParse_rejectsUnknownGroup() throws Exception {
    assertThrows(LayoutConfigurationException.class,
        () -> RuleRegistryReader.parse(
            "{\"roomTypes\": [{\"id\": \"lab\", \"rules\": [{\"kind\": \"SEPARATION\","
                + " \"targets\": [\"group:KITCHENS\"]}]}]}"));
  }

  @Test
  public void testParse_rejectsDuplicateType() throws Exception {
    assertThrows(LayoutConfigurationException.class,
        () -> RuleRegistryReader.parse("{\"roomTypes\": [{\"id\": \"lab\"}, {\"id\": \"lab\"}]}"));
  }

  @Test
  public void testParse_rejectsMissingTargets() throws Exception {
    assertThrows(LayoutConfigurationException.class,
        () -> RuleRegistryReader.parse(
            "{\"roomTypes\": [{\"id\": \"lab\", \"rules\": [{\"kind\": \"DIRECT_ADJACENCY\"}]}]}"));
  }
}
