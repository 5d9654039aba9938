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

/** Orientation of a room's long axis relative to an edge of the floor plate. */
public final class OrientationRule {
  public OrientationRule(FloorEdge referenceEdge, AxisRelation relation) {
    this.referenceEdge = referenceEdge;
    this.relation = relation;
  }

  public FloorEdge getReferenceEdge() {
    return referenceEdge;
  }

  public AxisRelation getRelation() {
    return relation;
  }

  /** Returns true when the long axis must run along x, i.e. width at least height. */
  public boolean isLongAxisHorizontal() {
    return referenceEdge.isHorizontal() == (relation == AxisRelation.PARALLEL);
  }

  @Override
  public String toString() {
    return relation + " to " + referenceEdge;
  }

  private final FloorEdge referenceEdge;
  private final AxisRelation relation;
}
