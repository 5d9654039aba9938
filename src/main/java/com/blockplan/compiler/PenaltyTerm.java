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

import com.google.ortools.sat.IntVar;

/** A non-negative slack of a soft rule, multiplied by the rule weight in the objective. */
public final class PenaltyTerm {
  public PenaltyTerm(String label, IntVar slack, long weight, RuleReference source) {
    if (weight < 1) {
      throw new IllegalArgumentException("Penalty weight must be positive: " + weight);
    }
    this.label = label;
    this.slack = slack;
    this.weight = weight;
    this.source = source;
  }

  public String getLabel() {
    return label;
  }

  public IntVar getSlack() {
    return slack;
  }

  public long getWeight() {
    return weight;
  }

  public RuleReference getSource() {
    return source;
  }

  @Override
  public String toString() {
    return label + " x" + weight;
  }

  private final String label;
  private final IntVar slack;
  private final long weight;
  private final RuleReference source;
}
