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

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Posts the constraints of hard rules.
 *
 * <p>A direct gate leaves constraints unconditional. An assumption gate enforces every constraint
 * of a rule only if that rule's literal is true, and adds the literal as a model assumption, so
 * that an infeasible solve can name a sufficient set of conflicting rules.
 */
public final class HardRuleGate {
  public static HardRuleGate direct() {
    return new HardRuleGate(null);
  }

  public static HardRuleGate withAssumptions(CpModel model) {
    return new HardRuleGate(model);
  }

  private HardRuleGate(CpModel model) {
    this.model = model;
    this.literals = new LinkedHashMap<>();
    this.byIndex = new HashMap<>();
    this.references = new LinkedHashSet<>();
  }

  public boolean usesAssumptions() {
    return model != null;
  }

  /** Records {@code constraint} as part of {@code rule}. */
  public void enforce(Constraint constraint, RuleReference rule) {
    references.add(rule);
    if (model != null) {
      constraint.onlyEnforceIf(literal(rule));
    }
  }

  private BoolVar literal(RuleReference rule) {
    BoolVar lit = literals.get(rule);
    if (lit == null) {
      lit = model.newBoolVar("assume[" + rule + "]");
      model.addAssumption(lit);
      literals.put(rule, lit);
      byIndex.put(lit.getIndex(), rule);
    }
    return lit;
  }

  /** Returns every hard rule that posted at least one constraint, in first-use order. */
  public Set<RuleReference> getReferences() {
    return Collections.unmodifiableSet(references);
  }

  /** Maps the assumption indices reported by the solver back to rules. */
  public List<RuleReference> explain(List<Integer> assumptionIndices) {
    List<RuleReference> result = new ArrayList<>();
    for (Integer index : assumptionIndices) {
      RuleReference rule = byIndex.get(index);
      if (rule != null) {
        result.add(rule);
      }
    }
    return result;
  }

  private final CpModel model;
  private final Map<RuleReference, BoolVar> literals;
  private final Map<Integer, RuleReference> byIndex;
  private final Set<RuleReference> references;
}
