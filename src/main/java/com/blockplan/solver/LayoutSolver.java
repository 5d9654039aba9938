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

import com.blockplan.compiler.DoorConnection;
import com.blockplan.compiler.PenaltyTerm;
import com.blockplan.compiler.RuleReference;
import com.blockplan.geometry.DoorSlot;
import com.blockplan.geometry.RectangleVariable;
import com.blockplan.geometry.RoomInstance;
import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.RuleRegistry;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Solve driver: builds the model of a request, runs one blocking CP-SAT solve under the time limit
 * and maps the outcome to a {@link LayoutResult}.
 *
 * <p>When the main solve proves infeasibility, a second solve on an assumption-gated model names
 * a set of hard rules that cannot hold together. Native libraries must be loaded with
 * {@code Loader.loadNativeLibraries()} before the first call.
 */
public final class LayoutSolver {
  private static final Logger logger = Logger.getLogger(LayoutSolver.class.getName());

  public LayoutSolver(RuleRegistry registry) {
    this.builder = new LayoutModelBuilder(registry);
  }

  /**
   * Solves one request.
   *
   * @throws IllegalStateException if CP-SAT reports the built model as invalid
   */
  public LayoutResult solve(LayoutRequest request) {
    LayoutModel layout;
    try {
      layout = builder.build(request);
    } catch (LayoutConfigurationException e) {
      logger.warning("Configuration error: " + e.getMessage());
      return LayoutResult.configurationError(e.getMessage());
    }
    LayoutOptions options = request.getOptions();
    CpSolver solver = newSolver(options);
    solver.getParameters().setNumWorkers(options.getNumWorkers());
    CpSolverStatus status = solver.solve(layout.getModel());
    logger.info("Layout solve of " + layout.getIndex().size() + " rooms finished with " + status
        + " in " + solver.wallTime() + "s");
    switch (status) {
      case OPTIMAL:
      case FEASIBLE:
        LayoutSolution solution = extract(layout, solver);
        for (String violation : LayoutInvariants.check(layout.getFloor(), solution)) {
          logger.severe("Layout invariant violated: " + violation);
        }
        return LayoutResult.solved(
            status == CpSolverStatus.OPTIMAL ? LayoutStatus.OPTIMAL : LayoutStatus.FEASIBLE,
            solution, solver.objectiveValue(), penalties(layout, solver));
      case INFEASIBLE:
        return LayoutResult.infeasible(
            options.getDiagnoseInfeasibility()
                ? diagnose(request)
                : Collections.<RuleReference>emptyList());
      case UNKNOWN:
        return LayoutResult.unknown();
      default:
        throw new IllegalStateException(
            "Layout model rejected by the solver (" + status + "): "
                + layout.getModel().validate());
    }
  }

  /** Re-solves with every hard rule behind an assumption and returns a conflicting subset. */
  private List<RuleReference> diagnose(LayoutRequest request) {
    LayoutModel layout = builder.buildForDiagnosis(request);
    CpSolver solver = newSolver(request.getOptions());
    solver.getParameters().setNumWorkers(1);
    CpSolverStatus status = solver.solve(layout.getModel());
    if (status != CpSolverStatus.INFEASIBLE) {
      logger.warning("Infeasibility diagnosis ended with " + status + ", no conflicts reported");
      return Collections.emptyList();
    }
    List<RuleReference> conflicts =
        layout.getGate().explain(solver.sufficientAssumptionsForInfeasibility());
    logger.info("Conflicting hard rules: " + conflicts);
    return conflicts;
  }

  private CpSolver newSolver(LayoutOptions options) {
    CpSolver solver = new CpSolver();
    solver.getParameters()
        .setMaxTimeInSeconds(options.getMaxTimeInSeconds())
        .setRandomSeed(options.getRandomSeed());
    if (options.getLogSearchProgress()) {
      solver.setLogCallback(line -> logger.fine(line));
      solver.getParameters().setLogToStdout(false).setLogSearchProgress(true);
    }
    return solver;
  }

  private static LayoutSolution extract(LayoutModel layout, CpSolver solver) {
    Map<DoorSlot, String> connected = new HashMap<>();
    for (DoorConnection connection : layout.getConnections()) {
      if (!connected.containsKey(connection.getSlot())
          && solver.booleanValue(connection.getLiteral())) {
        connected.put(connection.getSlot(), connection.getTarget().getId());
      }
    }
    List<PlacedRoom> rooms = new ArrayList<>();
    for (RoomInstance instance : layout.getIndex().all()) {
      RectangleVariable rect = layout.getVariables().rectangle(instance);
      List<PlacedDoor> doors = new ArrayList<>();
      for (DoorSlot slot : layout.getVariables().doors(instance)) {
        if (solver.booleanValue(slot.getActive())) {
          doors.add(new PlacedDoor(slot.getSlot(), (int) solver.value(slot.getX()),
              (int) solver.value(slot.getY()), Optional.ofNullable(connected.get(slot))));
        }
      }
      rooms.add(new PlacedRoom(instance.getTypeId(), instance.getIndex(),
          (int) solver.value(rect.getX()), (int) solver.value(rect.getY()),
          (int) solver.value(rect.getWidth()), (int) solver.value(rect.getHeight()), doors));
    }
    return new LayoutSolution(rooms);
  }

  private static Map<String, Long> penalties(LayoutModel layout, CpSolver solver) {
    Map<String, Long> result = new LinkedHashMap<>();
    for (PenaltyTerm term : layout.getPenalties()) {
      result.merge(term.getLabel(), term.getWeight() * solver.value(term.getSlack()), Long::sum);
    }
    return result;
  }

  private final LayoutModelBuilder builder;
}
