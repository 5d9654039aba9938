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

import com.blockplan.compiler.RuleReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed outcome of {@link LayoutSolver#solve}. A solution, objective and penalty breakdown are
 * present for OPTIMAL and FEASIBLE; conflicting rules for INFEASIBLE; a message for
 * CONFIGURATION_ERROR.
 */
public final class LayoutResult {
  static LayoutResult solved(LayoutStatus status, LayoutSolution solution, double objective,
      Map<String, Long> penalties) {
    return new LayoutResult(status, Optional.of(solution), objective, penalties,
        Collections.<RuleReference>emptyList(), "");
  }

  static LayoutResult infeasible(List<RuleReference> conflicts) {
    return new LayoutResult(LayoutStatus.INFEASIBLE, Optional.<LayoutSolution>empty(), 0,
        Collections.<String, Long>emptyMap(), conflicts, "");
  }

  static LayoutResult unknown() {
    return new LayoutResult(LayoutStatus.UNKNOWN, Optional.<LayoutSolution>empty(), 0,
        Collections.<String, Long>emptyMap(), Collections.<RuleReference>emptyList(),
        "time limit reached without a layout");
  }

  static LayoutResult configurationError(String message) {
    return new LayoutResult(LayoutStatus.CONFIGURATION_ERROR, Optional.<LayoutSolution>empty(),
        0, Collections.<String, Long>emptyMap(), Collections.<RuleReference>emptyList(), message);
  }

  private LayoutResult(LayoutStatus status, Optional<LayoutSolution> solution, double objective,
      Map<String, Long> penalties, List<RuleReference> conflicts, String message) {
    this.status = status;
    this.solution = solution;
    this.objective = objective;
    this.penalties = Collections.unmodifiableMap(new LinkedHashMap<>(penalties));
    this.conflicts = Collections.unmodifiableList(new ArrayList<>(conflicts));
    this.message = message;
  }

  public LayoutStatus getStatus() {
    return status;
  }

  public Optional<LayoutSolution> getSolution() {
    return solution;
  }

  public double getObjectiveValue() {
    return objective;
  }

  /** Weighted penalty per term label, in compilation order. */
  public Map<String, Long> getPenalties() {
    return penalties;
  }

  /** Sum of the weighted penalties. */
  public long getTotalPenalty() {
    long total = 0;
    for (long value : penalties.values()) {
      total += value;
    }
    return total;
  }

  /** Hard rules that together cannot hold, for INFEASIBLE results. May be empty. */
  public List<RuleReference> getConflicts() {
    return conflicts;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    switch (status) {
      case OPTIMAL:
      case FEASIBLE:
        return status + " objective=" + objective + " penalty=" + getTotalPenalty();
      case INFEASIBLE:
        return status + " conflicts=" + conflicts;
      default:
        return status + ": " + message;
    }
  }

  private final LayoutStatus status;
  private final Optional<LayoutSolution> solution;
  private final double objective;
  private final Map<String, Long> penalties;
  private final List<RuleReference> conflicts;
  private final String message;
}
