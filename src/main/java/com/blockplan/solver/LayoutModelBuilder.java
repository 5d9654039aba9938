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

import com.blockplan.compiler.ConstraintCompiler;
import com.blockplan.compiler.HardRuleGate;
import com.blockplan.compiler.ObjectiveAssembler;
import com.blockplan.geometry.GeometryAllocator;
import com.blockplan.geometry.InstanceExpander;
import com.blockplan.geometry.InstanceIndex;
import com.blockplan.geometry.LayoutVariables;
import com.blockplan.rules.RuleRegistry;
import com.blockplan.rules.TierResolver;
import com.google.ortools.sat.CpModel;
import java.util.logging.Logger;

/**
 * Builds a {@link LayoutModel}: expands the inventory, allocates geometry, compiles the rules and
 * assembles the objective.
 *
 * <p>A diagnosis model relaxes size domains, gates every hard rule behind an assumption literal
 * and has no objective.
 */
public final class LayoutModelBuilder {
  private static final Logger logger = Logger.getLogger(LayoutModelBuilder.class.getName());

  public LayoutModelBuilder(RuleRegistry registry) {
    this.registry = registry;
  }

  /**
   * Builds the model that is solved for a layout.
   *
   * @throws com.blockplan.rules.LayoutConfigurationException on malformed inputs or bounds that
   *     cannot be satisfied by any layout
   */
  public LayoutModel build(LayoutRequest request) {
    return build(request, false);
  }

  /** Builds the assumption-gated model used to explain an infeasible request. */
  public LayoutModel buildForDiagnosis(LayoutRequest request) {
    return build(request, true);
  }

  private LayoutModel build(LayoutRequest request, boolean diagnosis) {
    LayoutOptions options = request.getOptions();
    CpModel model = new CpModel();
    InstanceIndex index = InstanceExpander.expand(request.getInventory(), registry);
    TierResolver resolver = new TierResolver(request.getTreatmentRoomCount());
    GeometryAllocator allocator = new GeometryAllocator(
        model, request.getFloor(), options.getMaxDoorsPerRoom(), diagnosis);
    LayoutVariables variables = allocator.allocate(index, resolver);
    HardRuleGate gate = diagnosis ? HardRuleGate.withAssumptions(model) : HardRuleGate.direct();
    ObjectiveAssembler objective = new ObjectiveAssembler();
    ConstraintCompiler compiler = new ConstraintCompiler(model, request.getFloor(), index,
        variables, resolver, options.getCompilerSettings(), gate, objective);
    compiler.compile();
    if (!diagnosis) {
      objective.minimize(model, variables.rectangles(), request.getFloor());
    }
    logger.fine((diagnosis ? "Diagnosis model with " : "Layout model with ") + index.size()
        + " rooms, " + objective.getPenalties().size() + " penalty terms");
    return new LayoutModel(model, request.getFloor(), index, variables,
        compiler.getConnections(), objective.getPenalties(), gate);
  }

  private final RuleRegistry registry;
}
