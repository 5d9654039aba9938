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

/** Outcome of a layout solve. */
public enum LayoutStatus {
  /** Best layout found and proven optimal. */
  OPTIMAL,
  /** A layout satisfying every hard rule, without an optimality proof. */
  FEASIBLE,
  /** The hard rules cannot all hold. */
  INFEASIBLE,
  /** The time limit elapsed before any layout was found. */
  UNKNOWN,
  /** The inputs were rejected before search. */
  CONFIGURATION_ERROR;

  public boolean hasSolution() {
    return this == OPTIMAL || this == FEASIBLE;
  }
}
