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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Reads a {@link RuleRegistry} from its JSON form.
 *
 * <p>The document is validated completely before any room type is registered: unknown rule
 * kinds, enum values and malformed numbers raise a {@link LayoutConfigurationException}. Optional
 * numeric fields holding {@code null} or the placeholder {@code "TBD"} are read as absent.
 */
public final class RuleRegistryReader {
  private static final Logger logger = Logger.getLogger(RuleRegistryReader.class.getName());
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String PLACEHOLDER = "TBD";

  private RuleRegistryReader() {}

  public static RuleRegistry read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      RuleRegistry registry = read(in);
      logger.info("Loaded " + registry.size() + " room types from " + path);
      return registry;
    } catch (IOException e) {
      throw new LayoutConfigurationException("Cannot read rule registry " + path, e);
    }
  }

  public static RuleRegistry read(InputStream in) throws IOException {
    return fromTree(MAPPER.readTree(in));
  }

  public static RuleRegistry parse(String json) {
    try {
      return fromTree(MAPPER.readTree(json));
    } catch (IOException e) {
      throw new LayoutConfigurationException("Malformed rule registry JSON", e);
    }
  }

  static RuleRegistry fromTree(JsonNode root) {
    if (root == null || !root.has("roomTypes") || !root.get("roomTypes").isArray()) {
      throw new LayoutConfigurationException("RuleRegistryReader", "missing 'roomTypes' array");
    }
    RuleRegistry.Builder registry = RuleRegistry.newBuilder();
    for (JsonNode typeNode : root.get("roomTypes")) {
      registry.add(readRoomType(typeNode));
    }
    return registry.build();
  }

  private static RoomTypeRule readRoomType(JsonNode node) {
    String id = requiredText(node, "id", "roomTypes[]");
    RoomTypeRule.Builder builder = RoomTypeRule.newBuilder(id);
    if (isPresent(node, "category")) {
      builder.setCategory(parseEnum(RoomCategory.class, node.get("category").asText(), id));
    }
    if (isPresent(node, "circulationRole")) {
      builder.setCirculationRole(
          parseEnum(CirculationRole.class, node.get("circulationRole").asText(), id));
    }
    if (isPresent(node, "size")) {
      builder.setSize(readSize(node.get("size"), id));
    }
    if (isPresent(node, "orientation") && !isPlaceholder(node.get("orientation"))) {
      JsonNode o = node.get("orientation");
      builder.setOrientation(
          new OrientationRule(
              parseEnum(FloorEdge.class, requiredText(o, "referenceEdge", id), id),
              parseEnum(AxisRelation.class, requiredText(o, "relation", id), id)));
    }
    if (isPresent(node, "entryCount")) {
      for (JsonNode tier : node.get("entryCount")) {
        OptionalInt min = optionalInt(tier, "min", id);
        builder.addEntryCount(
            new EntryCountTier(readRange(tier, id), min.orElse(0), optionalInt(tier, "max", id)));
      }
    }
    if (isPresent(node, "clearance")) {
      JsonNode c = node.get("clearance");
      builder.setClearance(
          new ClearanceRule(
              optionalInt(c, "adaClearWidth", id),
              optionalInt(c, "adaRequiredEntries", id),
              optionalInt(c, "idealClearWidth", id)));
    }
    if (isPresent(node, "rules")) {
      for (JsonNode ruleNode : node.get("rules")) {
        builder.addRule(readRule(ruleNode, id));
      }
    }
    if (isPresent(node, "scalability")) {
      builder.setScalability(node.get("scalability").asText());
    }
    return builder.build();
  }

  private static SizeRule readSize(JsonNode node, String id) {
    SizeRule.Builder size = SizeRule.newBuilder();
    if (isPlaceholder(node)) {
      return size.setUnresolved(true).build();
    }
    readDimensions(node, "ideal", id).ifPresent(size::setIdeal);
    readDimensions(node, "minimum", id).ifPresent(size::setMinimum);
    readDimensions(node, "maximum", id).ifPresent(size::setMaximum);
    if (isPresent(node, "tiers")) {
      for (JsonNode tier : node.get("tiers")) {
        size.addTier(
            new SizeTier(
                tier.path("label").asText(""),
                readRange(tier, id),
                optionalInt(tier, "width", id),
                optionalInt(tier, "length", id)));
      }
    }
    if (node.path("unresolved").asBoolean(false)) {
      size.setUnresolved(true);
    }
    return size.build();
  }

  private static Optional<Dimensions> readDimensions(JsonNode parent, String field, String id) {
    if (!isPresent(parent, field) || isPlaceholder(parent.get(field))) {
      return Optional.empty();
    }
    JsonNode node = parent.get(field);
    OptionalInt width = optionalInt(node, "width", id);
    OptionalInt length = optionalInt(node, "length", id);
    if (!width.isPresent() || !length.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(Dimensions.of(width.getAsInt(), length.getAsInt()));
  }

  private static TreatmentRange readRange(JsonNode node, String id) {
    return TreatmentRange.of(
        optionalInt(node, "treatmentRoomsMin", id), optionalInt(node, "treatmentRoomsMax", id));
  }

  private static SpatialRule readRule(JsonNode node, String id) {
    RuleKind kind = RuleKind.parse(requiredText(node, "kind", id));
    SpatialRule.Builder rule = SpatialRule.newBuilder(kind);
    if (isPresent(node, "targets")) {
      for (JsonNode target : node.get("targets")) {
        rule.addTarget(RuleTarget.parse(target.asText()));
      }
    }
    if (node.has("hard")) {
      rule.setHard(node.get("hard").asBoolean());
    }
    OptionalInt distance = optionalInt(node, "distance", id);
    if (distance.isPresent()) {
      rule.setDistance(distance.getAsInt());
    }
    if (isPresent(node, "weight")) {
      JsonNode weight = node.get("weight");
      if (!weight.canConvertToLong()) {
        throw new LayoutConfigurationException(id, "weight is not an integer: " + weight);
      }
      rule.setWeight(weight.asLong());
    }
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      String field = it.next().getKey();
      if (!isKnownRuleField(field)) {
        throw new LayoutConfigurationException(id, "unknown field '" + field + "' in " + kind);
      }
    }
    return rule.build();
  }

  private static boolean isKnownRuleField(String field) {
    switch (field) {
      case "kind":
      case "targets":
      case "hard":
      case "distance":
      case "weight":
      case "comment":
        return true;
      default:
        return false;
    }
  }

  private static OptionalInt optionalInt(JsonNode parent, String field, String id) {
    if (!isPresent(parent, field) || isPlaceholder(parent.get(field))) {
      return OptionalInt.empty();
    }
    JsonNode value = parent.get(field);
    if (!value.isIntegralNumber() || !value.canConvertToInt()) {
      throw new LayoutConfigurationException(id, "'" + field + "' is not an integer: " + value);
    }
    return OptionalInt.of(value.asInt());
  }

  private static String requiredText(JsonNode node, String field, String where) {
    if (!isPresent(node, field) || !node.get(field).isTextual()) {
      throw new LayoutConfigurationException(where, "missing text field '" + field + "'");
    }
    return node.get(field).asText();
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String text, String where) {
    for (E value : type.getEnumConstants()) {
      if (value.name().equalsIgnoreCase(text)) {
        return value;
      }
    }
    throw new LayoutConfigurationException(
        where, "unknown " + type.getSimpleName() + " '" + text + "'");
  }

  private static boolean isPresent(JsonNode node, String field) {
    return node.has(field) && !node.get(field).isNull();
  }

  private static boolean isPlaceholder(JsonNode node) {
    return node.isTextual() && PLACEHOLDER.equalsIgnoreCase(node.asText());
  }
}
