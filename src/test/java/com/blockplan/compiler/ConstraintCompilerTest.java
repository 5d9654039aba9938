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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.blockplan.geometry.FloorPlate;
import com.blockplan.geometry.GeometryAllocator;
import com.blockplan.geometry.InstanceExpander;
import com.blockplan.geometry.InstanceIndex;
import com.blockplan.geometry.LayoutVariables;
import com.blockplan.geometry.RectangleVariable;
import com.blockplan.rules.AxisRelation;
import com.blockplan.rules.EntryCountTier;
import com.blockplan.rules.FloorEdge;
import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.OrientationRule;
import com.blockplan.rules.RoomTypeRule;
import com.blockplan.rules.RuleKind;
import com.blockplan.rules.RuleRegistry;
import com.blockplan.rules.SpatialRule;
import com.blockplan.rules.TierResolver;
import com.blockplan.rules.TreatmentRange;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntegerVariableProto;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests rule dispatch, skipping and gating in the constraint compiler. */
public final class ConstraintCompilerTest {
  private static final FloorPlate FLOOR = new FloorPlate(200, 150);

  private CpModel model;
  private InstanceIndex index;
  private LayoutVariables variables;
  private ObjectiveAssembler objective;

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
    model = new CpModel();
    objective = new ObjectiveAssembler();
  }

  private ConstraintCompiler compile(RuleRegistry registry, Map<String, Integer> inventory,
      HardRuleGate gate, int doorsPerRoom) {
    final TierResolver resolver = new TierResolver(OptionalInt.empty());
    index = InstanceExpander.expand(inventory, registry);
    variables = new GeometryAllocator(model, FLOOR, doorsPerRoom, gate.usesAssumptions())
        .allocate(index, resolver);
    final ConstraintCompiler compiler = new ConstraintCompiler(model, FLOOR, index, variables,
        resolver, CompilerSettings.getDefaultInstance(), gate, objective);
    compiler.compile();
    return compiler;
  }

  private static Map<String, Integer> rooms(String... typeIds) {
    final Map<String, Integer> result = new LinkedHashMap<>();
    for (String typeId : typeIds) {
      result.put(typeId, 1);
    }
    return result;
  }

  @Test
  public void testCompile_unresolvedDistanceIsSkipped() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("waitingRoom")
            .addRule(SpatialRule.newBuilder(RuleKind.NOT_WITHIN_DISTANCE)
                .addTargetType("sterilization").build())
            .build())
        .add(RoomTypeRule.unconstrained("sterilization"))
        .build();
    final HardRuleGate gate = HardRuleGate.direct();
    final ConstraintCompiler compiler =
        compile(registry, rooms("waitingRoom", "sterilization"), gate, 0);
    assertThat(compiler.getSkippedRules()).isEqualTo(1);
    assertThat(gate.getReferences()).isEmpty();
  }

  @Test
  public void testCompile_targetWithoutInstancesIsSkipped() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("lab")
            .addRule(SpatialRule.newBuilder(RuleKind.DIRECT_ADJACENCY)
                .addTargetType("sterilization").build())
            .build())
        .add(RoomTypeRule.unconstrained("sterilization"))
        .build();
    final Map<String, Integer> inventory = rooms("lab");
    inventory.put("sterilization", 0);
    final ConstraintCompiler compiler = compile(registry, inventory, HardRuleGate.direct(), 0);
    assertThat(compiler.getSkippedRules()).isEqualTo(1);
    assertThat(compiler.getGaps().size()).isEqualTo(0);
  }

  @Test
  public void testCompile_visibilityIsAlwaysSoft() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("nurseStation")
            .addRule(SpatialRule.newBuilder(RuleKind.VISIBLE_FROM).addTargetType("waitingRoom")
                .setHard(true).build())
            .build())
        .add(RoomTypeRule.unconstrained("waitingRoom"))
        .build();
    final HardRuleGate gate = HardRuleGate.direct();
    compile(registry, rooms("nurseStation", "waitingRoom"), gate, 0);
    assertThat(gate.getReferences()).isEmpty();
    assertThat(objective.getPenalties()).hasSize(1);
    assertThat(objective.getPenalties().get(0).getLabel())
        .isEqualTo("nurseStation#0 VISIBLE_FROM waitingRoom#0");
  }

  @Test
  public void testCompile_entryMinimumAboveSlotsIsRejected() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("lobby")
            .addEntryCount(new EntryCountTier(TreatmentRange.any(), 3, OptionalInt.empty()))
            .build())
        .build();
    assertThrows(LayoutConfigurationException.class,
        () -> compile(registry, rooms("lobby"), HardRuleGate.direct(), 2));
  }

  @Test
  public void testCompile_orientationOrdersSides() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("corridor")
            .setOrientation(new OrientationRule(FloorEdge.FRONT, AxisRelation.PERPENDICULAR))
            .build())
        .build();
    compile(registry, rooms("corridor"), HardRuleGate.direct(), 0);
    final RectangleVariable rect = variables.rectangle(index.all().get(0));
    model.maximize(rect.getWidth());

    final CpSolver solver = new CpSolver();
    assertThat(solver.solve(model)).isEqualTo(CpSolverStatus.OPTIMAL);
    assertThat(solver.value(rect.getWidth())).isEqualTo(150);
    assertThat(solver.value(rect.getHeight())).isEqualTo(150);
  }

  @Test
  public void testCompile_assumptionsExplainConflict() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("a")
            .addRule(SpatialRule.newBuilder(RuleKind.DIRECT_ADJACENCY).addTargetType("b").build())
            .addRule(SpatialRule.newBuilder(RuleKind.SEPARATION).addTargetType("b")
                .setDistance(50).build())
            .build())
        .add(RoomTypeRule.unconstrained("b"))
        .build();
    final HardRuleGate gate = HardRuleGate.withAssumptions(model);
    compile(registry, rooms("a", "b"), gate, 0);

    final CpSolver solver = new CpSolver();
    solver.getParameters().setNumWorkers(1);
    assertThat(solver.solve(model)).isEqualTo(CpSolverStatus.INFEASIBLE);
    assertThat(gate.explain(solver.sufficientAssumptionsForInfeasibility()))
        .containsExactly(
            new RuleReference("a", "DIRECT_ADJACENCY", "b"),
            new RuleReference("a", "SEPARATION", "b"));
  }

  @Test
  public void testCompile_mutualAdjacencyRecordsBothRules() throws Exception {
    final RuleRegistry registry = RuleRegistry.newBuilder()
        .add(RoomTypeRule.newBuilder("lab")
            .addRule(SpatialRule.newBuilder(RuleKind.DIRECT_ADJACENCY)
                .addTargetType("sterilization").build())
            .build())
        .add(RoomTypeRule.newBuilder("sterilization")
            .addRule(SpatialRule.newBuilder(RuleKind.DIRECT_ADJACENCY).addTargetType("lab")
                .build())
            .build())
        .build();
    final HardRuleGate gate = HardRuleGate.direct();
    compile(registry, rooms("lab", "sterilization"), gate, 0);
    assertThat(gate.getReferences()).containsExactly(
        new RuleReference("lab", "DIRECT_ADJACENCY", "sterilization"),
        new RuleReference("sterilization", "DIRECT_ADJACENCY", "lab"));
    // One shared boundary for the pair: four side literals.
    int sideLiterals = 0;
    for (IntegerVariableProto variable : model.model().getVariablesList()) {
      if (variable.getName().startsWith("share(")) {
        ++sideLiterals;
      }
    }
    assertThat(sideLiterals).isEqualTo(4);
  }
}
