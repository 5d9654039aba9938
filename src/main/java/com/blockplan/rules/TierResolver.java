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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Selects the size bounds and entry-count bounds of a room type for one project.
 *
 * <p>Tiered values depend on the total treatment-room count supplied by the caller. Without it,
 * only tiers that carry no treatment-room range are considered.
 */
public final class TierResolver {
  private static final Logger logger = Logger.getLogger(TierResolver.class.getName());

  public TierResolver(OptionalInt treatmentRooms) {
    this.treatmentRooms = treatmentRooms;
  }

  public OptionalInt getTreatmentRooms() {
    return treatmentRooms;
  }

  /**
   * Resolves size bounds. The minimum is the explicit minimum if any, else the smallest width and
   * length among the candidate tiers. The maximum is the explicit maximum if any, else the largest
   * among the candidate tiers. Unresolved size rules give no bounds.
   */
  public SizeBounds resolveSize(RoomTypeRule rule) {
    SizeRule size = rule.getSize();
    if (size.isUnresolved()) {
      logger.info("Skipping size rule of '" + rule.getId() + "': dimensions unresolved");
      return SizeBounds.none();
    }
    List<SizeTier> candidates = candidateTiers(size.getTiers());
    OptionalInt minWidth;
    OptionalInt minLength;
    if (size.getMinimum().isPresent()) {
      minWidth = OptionalInt.of(size.getMinimum().get().getWidth());
      minLength = OptionalInt.of(size.getMinimum().get().getLength());
    } else {
      minWidth = candidates.stream().filter(t -> t.getWidth().isPresent())
          .mapToInt(t -> t.getWidth().getAsInt()).min();
      minLength = candidates.stream().filter(t -> t.getLength().isPresent())
          .mapToInt(t -> t.getLength().getAsInt()).min();
    }
    OptionalInt maxWidth;
    OptionalInt maxLength;
    if (size.getMaximum().isPresent()) {
      maxWidth = OptionalInt.of(size.getMaximum().get().getWidth());
      maxLength = OptionalInt.of(size.getMaximum().get().getLength());
    } else {
      maxWidth = candidates.stream().filter(t -> t.getWidth().isPresent())
          .mapToInt(t -> t.getWidth().getAsInt()).max();
      maxLength = candidates.stream().filter(t -> t.getLength().isPresent())
          .mapToInt(t -> t.getLength().getAsInt()).max();
    }
    if (!minWidth.isPresent() && !minLength.isPresent() && !size.getTiers().isEmpty()) {
      logger.info("Size tiers of '" + rule.getId() + "' give no usable minimum");
    }
    return new SizeBounds(minWidth, minLength, maxWidth, maxLength);
  }

  /**
   * Resolves entry-count bounds: the first tier matching the treatment-room count, else the first
   * constant tier. Returns empty when no tier applies.
   */
  public Optional<EntryCountTier> resolveEntryCount(RoomTypeRule rule) {
    EntryCountTier constant = null;
    for (EntryCountTier tier : rule.getEntryCounts()) {
      if (tier.getRange().isConstant()) {
        if (constant == null) {
          constant = tier;
        }
      } else if (treatmentRooms.isPresent() && tier.getRange().matches(treatmentRooms.getAsInt())) {
        return Optional.of(tier);
      }
    }
    if (constant == null && !rule.getEntryCounts().isEmpty()) {
      logger.info(
          "No entry-count tier of '" + rule.getId() + "' applies to treatment rooms="
              + (treatmentRooms.isPresent() ? treatmentRooms.getAsInt() : "unknown"));
    }
    return Optional.ofNullable(constant);
  }

  private List<SizeTier> candidateTiers(List<SizeTier> tiers) {
    List<SizeTier> matching = new ArrayList<>();
    List<SizeTier> generic = new ArrayList<>();
    for (SizeTier tier : tiers) {
      if (tier.getRange().isConstant()) {
        generic.add(tier);
      } else if (treatmentRooms.isPresent() && tier.getRange().matches(treatmentRooms.getAsInt())) {
        matching.add(tier);
      }
    }
    if (!matching.isEmpty()) {
      return matching;
    }
    if (!generic.isEmpty()) {
      return generic;
    }
    return tiers;
  }

  private final OptionalInt treatmentRooms;
}
