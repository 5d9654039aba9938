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

import com.blockplan.geometry.DoorSlot;
import com.blockplan.geometry.FloorPlate;
import com.blockplan.geometry.GapTable;
import com.blockplan.geometry.InstanceIndex;
import com.blockplan.geometry.LayoutVariables;
import com.blockplan.geometry.RectangleVariable;
import com.blockplan.geometry.RoomInstance;
import com.blockplan.geometry.SharedBoundary;
import com.blockplan.geometry.Side;
import com.blockplan.rules.Dimensions;
import com.blockplan.rules.EntryCountTier;
import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.rules.OrientationRule;
import com.blockplan.rules.RoomTypeRule;
import com.blockplan.rules.RuleKind;
import com.blockplan.rules.RuleTarget;
import com.blockplan.rules.SizeBounds;
import com.blockplan.rules.SpatialRule;
import com.blockplan.rules.TierResolver;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;
import com.google.ortools.sat.NoOverlap2dConstraint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Translates the rules of every room instance into CP-SAT constraints and penalty terms.
 *
 * <p>Hard rules are posted through a {@link HardRuleGate}. Soft rules add a non-negative slack to
 * the {@link ObjectiveAssembler}. Rules whose targets have no instances, or whose distance is
 * unresolved where one is required, are skipped with a log entry.
 */
public final class ConstraintCompiler {
  private static final Logger logger = Logger.getLogger(ConstraintCompiler.class.getName());

  public ConstraintCompiler(
      CpModel model,
      FloorPlate floor,
      InstanceIndex index,
      LayoutVariables variables,
      TierResolver resolver,
      CompilerSettings settings,
      HardRuleGate gate,
      ObjectiveAssembler objective) {
    this.model = model;
    this.floor = floor;
    this.index = index;
    this.variables = variables;
    this.resolver = resolver;
    this.settings = settings;
    this.gate = gate;
    this.objective = objective;
    this.gaps = new GapTable(model, floor, variables);
    this.connections = new LinkedHashMap<>();
    this.compiledPairs = new HashMap<>();
  }

  /** Compiles the global constraints and the rules of every instance. */
  public void compile() {
    addNonOverlap();
    for (RoomInstance instance : index.all()) {
      compileSize(instance);
      compileOrientation(instance);
      compileEntryCount(instance);
      for (SpatialRule rule : instance.getRule().getRules()) {
        compileRule(instance, rule);
      }
    }
    logger.info("Compiled " + gate.getReferences().size() + " hard rules, "
        + objective.getPenalties().size() + " penalty terms, " + gaps.size() + " gaps, "
        + skipped + " skipped rules");
  }

  public GapTable getGaps() {
    return gaps;
  }

  /** Door connection literals created by entry rules. */
  public List<DoorConnection> getConnections() {
    return Collections.unmodifiableList(new ArrayList<>(connections.values()));
  }

  public int getSkippedRules() {
    return skipped;
  }

  private void addNonOverlap() {
    NoOverlap2dConstraint noOverlap = model.addNoOverlap2D();
    for (RectangleVariable rect : variables.rectangles()) {
      noOverlap.addRectangle(rect.getXInterval(), rect.getYInterval());
    }
  }

  // Size bounds are posted explicitly so that they stay gated when domains are relaxed.
  private void compileSize(RoomInstance instance) {
    RoomTypeRule type = instance.getRule();
    RectangleVariable rect = variables.rectangle(instance);
    SizeBounds bounds = rect.getBounds();
    RuleReference minimum = new RuleReference(type.getId(), "MINIMUM_SIZE", bounds.toString());
    RuleReference maximum = new RuleReference(type.getId(), "MAXIMUM_SIZE", bounds.toString());
    if (bounds.getMinWidth().isPresent()) {
      gate.enforce(
          model.addGreaterOrEqual(rect.getWidth(), bounds.getMinWidth().getAsInt()), minimum);
    }
    if (bounds.getMinLength().isPresent()) {
      gate.enforce(
          model.addGreaterOrEqual(rect.getHeight(), bounds.getMinLength().getAsInt()), minimum);
    }
    if (bounds.getMaxWidth().isPresent()) {
      gate.enforce(
          model.addLessOrEqual(rect.getWidth(), bounds.getMaxWidth().getAsInt()), maximum);
    }
    if (bounds.getMaxLength().isPresent()) {
      gate.enforce(
          model.addLessOrEqual(rect.getHeight(), bounds.getMaxLength().getAsInt()), maximum);
    }

    Optional<Dimensions> ideal = type.getSize().getIdeal();
    if (ideal.isPresent() && !type.getSize().isUnresolved()) {
      RuleReference source = new RuleReference(type.getId(), "IDEAL_SIZE", "");
      penalize(deviation(rect.getWidth(), ideal.get().getWidth(), instance.getId() + ".dw"), 1,
          source, instance.getId() + " IDEAL_SIZE width");
      penalize(deviation(rect.getHeight(), ideal.get().getLength(), instance.getId() + ".dh"), 1,
          source, instance.getId() + " IDEAL_SIZE length");
    }
  }

  private void compileOrientation(RoomInstance instance) {
    Optional<OrientationRule> orientation = instance.getRule().getOrientation();
    if (!orientation.isPresent()) {
      return;
    }
    RectangleVariable rect = variables.rectangle(instance);
    RuleReference ref =
        new RuleReference(instance.getTypeId(), "ORIENTATION", orientation.get().toString());
    if (orientation.get().isLongAxisHorizontal()) {
      gate.enforce(model.addGreaterOrEqual(rect.getWidth(), rect.getHeight()), ref);
    } else {
      gate.enforce(model.addGreaterOrEqual(rect.getHeight(), rect.getWidth()), ref);
    }
  }

  private void compileEntryCount(RoomInstance instance) {
    RoomTypeRule type = instance.getRule();
    List<DoorSlot> slots = variables.doors(instance);
    Optional<EntryCountTier> tier = resolver.resolveEntryCount(type);
    int min = tier.isPresent() ? tier.get().getMinEntries() : 0;
    OptionalInt max = tier.isPresent() ? tier.get().getMaxEntries() : OptionalInt.empty();
    OptionalInt ada = type.getClearance().getAdaRequiredEntries();
    if (ada.isPresent() && ada.getAsInt() > min) {
      min = ada.getAsInt();
    }
    if (max.isPresent() && max.getAsInt() < min) {
      throw new LayoutConfigurationException("ConstraintCompiler", "'" + type.getId()
          + "' requires " + min + " accessible entries but allows at most " + max.getAsInt());
    }
    if (min > slots.size()) {
      throw new LayoutConfigurationException("ConstraintCompiler", "'" + type.getId()
          + "' requires " + min + " entries but rooms have " + slots.size() + " door slots");
    }
    boolean capsSlots = max.isPresent() && max.getAsInt() < slots.size();
    if (min == 0 && !capsSlots) {
      return;
    }
    LinearArgument[] actives = new LinearArgument[slots.size()];
    for (int i = 0; i < slots.size(); ++i) {
      actives[i] = slots.get(i).getActive();
    }
    LinearExpr count = LinearExpr.sum(actives);
    RuleReference ref = new RuleReference(type.getId(), "ENTRY_COUNT",
        min + ".." + (max.isPresent() ? Integer.toString(max.getAsInt()) : ""));
    if (min > 0) {
      gate.enforce(model.addGreaterOrEqual(count, min), ref);
    }
    if (capsSlots) {
      gate.enforce(model.addLessOrEqual(count, max.getAsInt()), ref);
    }
  }

  private void compileRule(RoomInstance instance, SpatialRule rule) {
    RuleKind kind = rule.getKind();
    if (kind.getDistanceUse() == RuleKind.DistanceUse.REQUIRED && !rule.getDistance().isPresent()) {
      skip(instance, rule, "distance unresolved");
      return;
    }
    List<RoomInstance> targets = targetsOf(instance, rule);
    if (kind.requiresTargets() && targets.isEmpty()) {
      skip(instance, rule, "no target instances");
      return;
    }
    RuleReference ref = reference(instance, rule);
    switch (kind) {
      case ENTRY_FROM:
        compileEntryFrom(instance, rule, targets, ref);
        break;
      case ENTRY_NOT_FROM:
        compileEntryNotFrom(instance, rule, targets, ref);
        break;
      case ENTRY_WITHIN_DISTANCE:
        compileWithinAny(instance, rule, targets, ref);
        break;
      case ENTRY_NOT_WITHIN_DISTANCE:
      case NOT_WITHIN_DISTANCE:
        compileApart(instance, rule, targets, rule.getDistance().getAsInt(), ref);
        break;
      case SEPARATION:
        compileApart(instance, rule, targets,
            rule.getDistance().orElse(settings.getDefaultSeparation()), ref);
        break;
      case ENTRY_OPPOSITE_ENDS:
        compileOppositeEnds(instance, rule, ref);
        break;
      case DIRECT_ADJACENCY:
        compileDirectAdjacency(instance, rule, targets, ref);
        break;
      case PREFERRED_ADJACENCY:
        softOnly(instance, rule);
        for (RoomInstance target : targets) {
          penalize(gaps.get(instance, target).getTotal(), rule.getWeight(), ref,
              label(instance, rule, target));
        }
        break;
      case NEAR_SPACE:
        compileNear(instance, rule, targets, ref);
        break;
      case PREFER_NEAR_CENTER:
        compileNearCenter(instance, rule, targets, ref);
        break;
      case VISIBLE_FROM:
        softOnly(instance, rule);
        for (RoomInstance target : targets) {
          penalize(excess(instance, target, rule.getDistance().orElse(0)), rule.getWeight(), ref,
              label(instance, rule, target));
        }
        break;
      case HIDDEN_FROM:
        softOnly(instance, rule);
        for (RoomInstance target : targets) {
          penalize(
              shortfall(instance, target,
                  rule.getDistance().orElse(settings.getDefaultVisibilityGap())),
              rule.getWeight(), ref, label(instance, rule, target));
        }
        break;
    }
  }

  private void compileEntryFrom(
      RoomInstance instance, SpatialRule rule, List<RoomInstance> targets, RuleReference ref) {
    List<DoorSlot> slots = requireSlots(instance, rule);
    if (slots.isEmpty()) {
      return;
    }
    List<Literal> options = new ArrayList<>();
    for (DoorSlot slot : slots) {
      for (RoomInstance target : targets) {
        options.add(connects(slot, target));
      }
    }
    if (rule.isHard()) {
      gate.enforce(model.addBoolOr(options), ref);
    } else {
      BoolVar violated = model.newBoolVar(instance.getId() + ".violated." + rule.getKind());
      options.add(violated);
      model.addBoolOr(options);
      penalize(violated, rule.getWeight(), ref, label(instance, rule, null));
    }
  }

  // The door lies on the target's facing wall, within the target's span.
  private BoolVar connects(DoorSlot slot, RoomInstance target) {
    String key = slot.getName() + "->" + target.getId();
    DoorConnection existing = connections.get(key);
    if (existing != null) {
      return existing.getLiteral();
    }
    BoolVar lit = model.newBoolVar(key);
    model.addImplication(lit, slot.getActive());
    RectangleVariable other = variables.rectangle(target);
    int inset = slot.getOwner().getRule().getClearance().doorInset();
    for (Side side : Side.values()) {
      Literal[] when = new Literal[] {lit, slot.onSide(side)};
      model.addEquality(slot.across(side), other.wall(side.opposite())).onlyEnforceIf(when);
      model.addGreaterOrEqual(slot.along(side), other.spanStart(side, inset)).onlyEnforceIf(when);
      model.addLessOrEqual(slot.along(side), other.spanEnd(side, inset)).onlyEnforceIf(when);
    }
    connections.put(key, new DoorConnection(slot, target, lit));
    return lit;
  }

  private void compileEntryNotFrom(
      RoomInstance instance, SpatialRule rule, List<RoomInstance> targets, RuleReference ref) {
    int inset = instance.getRule().getClearance().doorInset();
    for (DoorSlot slot : variables.doors(instance)) {
      for (RoomInstance target : targets) {
        RectangleVariable other = variables.rectangle(target);
        String name = slot.getName() + "!->" + target.getId();
        BoolVar violated = rule.isHard() ? null : model.newBoolVar(name + ".violated");
        for (Side side : Side.values()) {
          String sideName = name + "." + side.name().toLowerCase();
          BoolVar offWall = model.newBoolVar(sideName + ".offWall");
          model.addDifferent(slot.across(side), other.wall(side.opposite()))
              .onlyEnforceIf(offWall);
          BoolVar before = model.newBoolVar(sideName + ".before");
          model.addLessOrEqual(LinearExpr.affine(slot.along(side), 1, inset),
              other.spanStart(side, 0)).onlyEnforceIf(before);
          BoolVar after = model.newBoolVar(sideName + ".after");
          model.addGreaterOrEqual(LinearExpr.affine(slot.along(side), 1, -inset),
              other.spanEnd(side, 0)).onlyEnforceIf(after);
          if (violated == null) {
            Constraint clear = model.addBoolOr(new Literal[] {offWall, before, after});
            clear.onlyEnforceIf(slot.onSide(side));
            gate.enforce(clear, ref);
          } else {
            model.addBoolOr(new Literal[] {offWall, before, after, violated})
                .onlyEnforceIf(slot.onSide(side));
          }
        }
        if (violated != null) {
          penalize(violated, rule.getWeight(), ref, label(instance, rule, target));
        }
      }
    }
  }

  private void compileWithinAny(
      RoomInstance instance, SpatialRule rule, List<RoomInstance> targets, RuleReference ref) {
    int distance = rule.getDistance().getAsInt();
    if (rule.isHard()) {
      List<Literal> options = new ArrayList<>();
      for (RoomInstance target : targets) {
        BoolVar close = model.newBoolVar(instance.getId() + ".within." + target.getId());
        model.addLessOrEqual(gaps.get(instance, target).getTotal(), distance)
            .onlyEnforceIf(close);
        options.add(close);
      }
      gate.enforce(model.addBoolOr(options), ref);
    } else {
      LinearArgument[] excesses = new LinearArgument[targets.size()];
      for (int i = 0; i < targets.size(); ++i) {
        excesses[i] = excess(instance, targets.get(i), distance);
      }
      IntVar best = model.newIntVar(0, floor.maxGap(), instance.getId() + ".nearestExcess");
      model.addMinEquality(best, excesses);
      penalize(best, rule.getWeight(), ref, label(instance, rule, null));
    }
  }

  private void compileApart(RoomInstance instance, SpatialRule rule, List<RoomInstance> targets,
      int distance, RuleReference ref) {
    for (RoomInstance target : targets) {
      if (rule.isHard()) {
        gate.enforce(
            model.addGreaterOrEqual(gaps.get(instance, target).getTotal(), distance), ref);
      } else {
        penalize(shortfall(instance, target, distance), rule.getWeight(), ref,
            label(instance, rule, target));
      }
    }
  }

  private void compileNear(
      RoomInstance instance, SpatialRule rule, List<RoomInstance> targets, RuleReference ref) {
    if (rule.isHard()) {
      if (!rule.getDistance().isPresent()) {
        skip(instance, rule, "distance unresolved");
        return;
      }
      for (RoomInstance target : targets) {
        gate.enforce(model.addLessOrEqual(
            gaps.get(instance, target).getTotal(), rule.getDistance().getAsInt()), ref);
      }
    } else {
      for (RoomInstance target : targets) {
        penalize(excess(instance, target, rule.getDistance().orElse(0)), rule.getWeight(), ref,
            label(instance, rule, target));
      }
    }
  }

  private void compileOppositeEnds(RoomInstance instance, SpatialRule rule, RuleReference ref) {
    List<DoorSlot> slots = requireSlots(instance, rule);
    if (slots.isEmpty()) {
      return;
    }
    if (slots.size() < 2) {
      throw new LayoutConfigurationException("ConstraintCompiler", "'" + instance.getTypeId()
          + "' needs doors at opposite ends but rooms have a single door slot");
    }
    String name = instance.getId() + ".uses";
    Map<Side, BoolVar> uses = new LinkedHashMap<>();
    for (Side side : Side.values()) {
      LinearArgument[] onSide = new LinearArgument[slots.size()];
      for (int i = 0; i < slots.size(); ++i) {
        onSide[i] = slots.get(i).onSide(side);
      }
      BoolVar used = model.newBoolVar(name + "." + side.name().toLowerCase());
      model.addMaxEquality(used, onSide);
      uses.put(side, used);
    }
    BoolVar leftRight = model.newBoolVar(name + ".leftRight");
    model.addBoolAnd(new Literal[] {uses.get(Side.LEFT), uses.get(Side.RIGHT)})
        .onlyEnforceIf(leftRight);
    BoolVar bottomTop = model.newBoolVar(name + ".bottomTop");
    model.addBoolAnd(new Literal[] {uses.get(Side.BOTTOM), uses.get(Side.TOP)})
        .onlyEnforceIf(bottomTop);
    if (rule.isHard()) {
      gate.enforce(model.addBoolOr(new Literal[] {leftRight, bottomTop}), ref);
    } else {
      BoolVar violated = model.newBoolVar(instance.getId() + ".violated." + rule.getKind());
      model.addBoolOr(new Literal[] {leftRight, bottomTop, violated});
      penalize(violated, rule.getWeight(), ref, label(instance, rule, null));
    }
  }

  // A pair is compiled once per hardness. A hard rule reaching an already compiled pair from the
  // other side gates the same constraints under its own reference.
  private void compileDirectAdjacency(
      RoomInstance instance, SpatialRule rule, List<RoomInstance> targets, RuleReference ref) {
    for (RoomInstance target : targets) {
      String key = pairKey(rule, instance, target);
      List<Constraint> posted = compiledPairs.get(key);
      if (posted != null) {
        for (Constraint constraint : posted) {
          gate.enforce(constraint, ref);
        }
        continue;
      }
      posted = new ArrayList<>();
      compiledPairs.put(key, posted);
      IntVar gap = gaps.get(instance, target).getTotal();
      SharedBoundary shared = SharedBoundary.create(model, variables.rectangle(instance),
          variables.rectangle(target), settings.getMinimumSharedWall());
      if (rule.isHard()) {
        posted.add(model.addEquality(gap, 0));
        posted.add(model.addBoolOr(shared.literals()));
        for (Constraint constraint : posted) {
          gate.enforce(constraint, ref);
        }
      } else {
        BoolVar violated =
            model.newBoolVar(instance.getId() + ".apart." + target.getId() + ".violated");
        model.addEquality(gap, 0).onlyEnforceIf(violated.not());
        model.addBoolOr(shared.literals()).onlyEnforceIf(violated.not());
        penalize(violated, rule.getWeight(), ref, label(instance, rule, target));
      }
    }
  }

  // Penalizes |n * c - sum(c_i)| per axis, with centers in doubled units.
  private void compileNearCenter(
      RoomInstance instance, SpatialRule rule, List<RoomInstance> targets, RuleReference ref) {
    softOnly(instance, rule);
    List<RoomInstance> anchors = targets;
    if (anchors.isEmpty()) {
      anchors = new ArrayList<>(index.corridors());
      anchors.remove(instance);
    }
    if (anchors.isEmpty()) {
      skip(instance, rule, "no reference rooms or corridors");
      return;
    }
    int n = anchors.size();
    RectangleVariable rect = variables.rectangle(instance);
    LinearExprBuilder dx = LinearExpr.newBuilder().addTerm(rect.doubledCenterX(), n);
    LinearExprBuilder dy = LinearExpr.newBuilder().addTerm(rect.doubledCenterY(), n);
    for (RoomInstance anchor : anchors) {
      dx.addTerm(variables.rectangle(anchor).doubledCenterX(), -1);
      dy.addTerm(variables.rectangle(anchor).doubledCenterY(), -1);
    }
    IntVar devX = model.newIntVar(0, 2L * n * floor.getWidth(), instance.getId() + ".centerDx");
    model.addAbsEquality(devX, dx);
    IntVar devY = model.newIntVar(0, 2L * n * floor.getHeight(), instance.getId() + ".centerDy");
    model.addAbsEquality(devY, dy);
    penalize(devX, rule.getWeight(), ref, label(instance, rule, null) + " x");
    penalize(devY, rule.getWeight(), ref, label(instance, rule, null) + " y");
  }

  private List<DoorSlot> requireSlots(RoomInstance instance, SpatialRule rule) {
    List<DoorSlot> slots = variables.doors(instance);
    if (slots.isEmpty() && rule.isHard()) {
      throw new LayoutConfigurationException("ConstraintCompiler",
          rule.getKind() + " of '" + instance.getTypeId() + "' needs door slots");
    }
    if (slots.isEmpty()) {
      skip(instance, rule, "no door slots");
    }
    return slots;
  }

  // max(0, gap - distance)
  private IntVar excess(RoomInstance instance, RoomInstance target, int distance) {
    IntVar gap = gaps.get(instance, target).getTotal();
    IntVar result = model.newIntVar(0, floor.maxGap(), gap.getName() + ".over" + distance);
    model.addMaxEquality(result,
        new LinearArgument[] {LinearExpr.constant(0), LinearExpr.affine(gap, 1, -distance)});
    return result;
  }

  // max(0, distance - gap)
  private IntVar shortfall(RoomInstance instance, RoomInstance target, int distance) {
    IntVar gap = gaps.get(instance, target).getTotal();
    IntVar result = model.newIntVar(0, distance, gap.getName() + ".under" + distance);
    model.addMaxEquality(result,
        new LinearArgument[] {LinearExpr.constant(0), LinearExpr.affine(gap, -1, distance)});
    return result;
  }

  // |value - target|
  private IntVar deviation(IntVar value, int target, String name) {
    IntVar result = model.newIntVar(0, Math.max(target, floor.maxGap()), name);
    model.addAbsEquality(result, LinearExpr.affine(value, 1, -target));
    return result;
  }

  private void penalize(IntVar slack, long weight, RuleReference source, String label) {
    objective.add(new PenaltyTerm(label, slack, weight, source));
  }

  private void softOnly(RoomInstance instance, SpatialRule rule) {
    if (rule.isHard()) {
      logger.fine(rule.getKind() + " of '" + instance.getTypeId()
          + "' is a preference, the hard flag is ignored");
    }
  }

  private void skip(RoomInstance instance, SpatialRule rule, String reason) {
    ++skipped;
    logger.info("Skipping " + rule + " of " + instance.getId() + ": " + reason);
  }

  private List<RoomInstance> targetsOf(RoomInstance instance, SpatialRule rule) {
    List<RoomInstance> targets = index.resolveAll(rule.getTargets());
    targets.remove(instance);
    return targets;
  }

  private static RuleReference reference(RoomInstance instance, SpatialRule rule) {
    StringBuilder detail = new StringBuilder();
    for (RuleTarget target : rule.getTargets()) {
      if (detail.length() > 0) {
        detail.append(',');
      }
      detail.append(target);
    }
    return new RuleReference(instance.getTypeId(), rule.getKind().name(), detail.toString());
  }

  private static String pairKey(SpatialRule rule, RoomInstance a, RoomInstance b) {
    String first = a.getId().compareTo(b.getId()) <= 0 ? a.getId() : b.getId();
    String second = first.equals(a.getId()) ? b.getId() : a.getId();
    return rule.getKind() + (rule.isHard() ? "|hard|" : "|soft|") + first + "|" + second;
  }

  private static String label(RoomInstance instance, SpatialRule rule, RoomInstance target) {
    return instance.getId() + " " + rule.getKind() + (target == null ? "" : " " + target.getId());
  }

  private final CpModel model;
  private final FloorPlate floor;
  private final InstanceIndex index;
  private final LayoutVariables variables;
  private final TierResolver resolver;
  private final CompilerSettings settings;
  private final HardRuleGate gate;
  private final ObjectiveAssembler objective;
  private final GapTable gaps;
  private final Map<String, DoorConnection> connections;
  private final Map<String, List<Constraint>> compiledPairs;
  private int skipped;
}
