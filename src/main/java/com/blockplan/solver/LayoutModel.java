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
import com.blockplan.compiler.HardRuleGate;
import com.blockplan.compiler.PenaltyTerm;
import com.blockplan.geometry.FloorPlate;
import com.blockplan.geometry.InstanceIndex;
import com.blockplan.geometry.LayoutVariables;
import com.google.ortools.sat.CpModel;
import java.util.List;

/** A compiled CP-SAT model with the handles needed to read a solution back. */
public final class LayoutModel {
  LayoutModel(
      CpModel model,
      FloorPlate floor,
      InstanceIndex index,
      LayoutVariables variables,
      List<DoorConnection> connections,
      List<PenaltyTerm> penalties,
      HardRuleGate gate) {
    this.model = model;
    this.floor = floor;
    this.index = index;
    this.variables = variables;
    this.connections = connections;
    this.penalties = penalties;
    this.gate = gate;
  }

  public CpModel getModel() {
    return model;
  }

  public FloorPlate getFloor() {
    return floor;
  }

  public InstanceIndex getIndex() {
    return index;
  }

  public LayoutVariables getVariables() {
    return variables;
  }

  public List<DoorConnection> getConnections() {
    return connections;
  }

  public List<PenaltyTerm> getPenalties() {
    return penalties;
  }

  public HardRuleGate getGate() {
    return gate;
  }

  private final CpModel model;
  private final FloorPlate floor;
  private final InstanceIndex index;
  private final LayoutVariables variables;
  private final List<DoorConnection> connections;
  private final List<PenaltyTerm> penalties;
  private final HardRuleGate gate;
}
