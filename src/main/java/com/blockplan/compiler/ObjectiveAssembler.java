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

import com.blockplan.geometry.FloorPlate;
import com.blockplan.geometry.RectangleVariable;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Collects penalty terms and builds the minimized objective
 * {@code penaltyScale * sum(weight * slack) + sum(width + height)}.
 *
 * <p>The tie-break on room sizes never exceeds {@code n * (W + H)}, and the scale is strictly
 * larger, so one unit of penalty always outweighs any change of the tie-break.
 */
public final class ObjectiveAssembler {
  public static final long MIN_PENALTY_SCALE = 1000;

  public ObjectiveAssembler() {
    this.penalties = new ArrayList<>();
  }

  public void add(PenaltyTerm term) {
    penalties.add(term);
  }

  public List<PenaltyTerm> getPenalties() {
    return Collections.unmodifiableList(penalties);
  }

  public static long penaltyScale(int instanceCount, FloorPlate floor) {
    return Math.max(MIN_PENALTY_SCALE, (long) instanceCount * floor.maxGap() + 1);
  }

  /** Builds the objective expression without attaching it to a model. */
  public LinearExpr build(Collection<RectangleVariable> rectangles, FloorPlate floor) {
    long scale = penaltyScale(rectangles.size(), floor);
    LinearExprBuilder objective = LinearExpr.newBuilder();
    for (PenaltyTerm term : penalties) {
      objective.addTerm(term.getSlack(), scale * term.getWeight());
    }
    for (RectangleVariable rect : rectangles) {
      objective.add(rect.getWidth()).add(rect.getHeight());
    }
    return objective.build();
  }

  /** Sets the objective of {@code model} to minimize the assembled expression. */
  public void minimize(
      CpModel model, Collection<RectangleVariable> rectangles, FloorPlate floor) {
    model.minimize(build(rectangles, floor));
  }

  private final List<PenaltyTerm> penalties;
}
