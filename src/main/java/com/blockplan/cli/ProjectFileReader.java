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

package com.blockplan.cli;

import com.blockplan.rules.LayoutConfigurationException;
import com.blockplan.solver.LayoutOptions;
import com.blockplan.solver.LayoutRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads a project file: floor plate, room inventory, treatment-room count and solver options.
 *
 * <p>When {@code treatmentRoomCount} is absent and {@code treatmentRoomType} names an inventory
 * entry, the count of that entry is used.
 */
public final class ProjectFileReader {
  private static final Logger logger = Logger.getLogger(ProjectFileReader.class.getName());
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ProjectFileReader() {}

  public static LayoutRequest read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return fromTree(MAPPER.readTree(in));
    } catch (IOException e) {
      throw new LayoutConfigurationException("Cannot read project file " + path, e);
    }
  }

  public static LayoutRequest parse(String json) {
    try {
      return fromTree(MAPPER.readTree(json));
    } catch (IOException e) {
      throw new LayoutConfigurationException("Malformed project JSON", e);
    }
  }

  static LayoutRequest fromTree(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new LayoutConfigurationException("ProjectFileReader", "project must be an object");
    }
    JsonNode floor = root.path("floor");
    LayoutRequest.Builder request = LayoutRequest.newBuilder()
        .setFloor(requiredInt(floor, "width"), requiredInt(floor, "height"));

    JsonNode rooms = root.path("rooms");
    if (!rooms.isObject()) {
      throw new LayoutConfigurationException("ProjectFileReader", "missing 'rooms' object");
    }
    for (Iterator<Map.Entry<String, JsonNode>> it = rooms.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!entry.getValue().canConvertToInt()) {
        throw new LayoutConfigurationException("ProjectFileReader",
            "count of '" + entry.getKey() + "' is not an integer: " + entry.getValue());
      }
      request.putRoom(entry.getKey(), entry.getValue().asInt());
    }

    if (root.hasNonNull("treatmentRoomCount")) {
      request.setTreatmentRoomCount(requiredInt(root, "treatmentRoomCount"));
    } else if (root.hasNonNull("treatmentRoomType")) {
      String type = root.get("treatmentRoomType").asText();
      if (rooms.has(type)) {
        int count = rooms.get(type).asInt();
        logger.info("Treatment-room count " + count + " taken from inventory entry '" + type
            + "'");
        request.setTreatmentRoomCount(count);
      } else {
        logger.info("Treatment-room type '" + type + "' is not in the inventory, tiers without"
            + " a range apply");
      }
    }

    if (root.has("options")) {
      request.setOptions(readOptions(root.get("options")));
    }
    return request.build();
  }

  private static LayoutOptions readOptions(JsonNode node) {
    LayoutOptions.Builder options = LayoutOptions.newBuilder();
    if (node.has("maxTimeInSeconds")) {
      options.setMaxTimeInSeconds(node.get("maxTimeInSeconds").asDouble());
    }
    if (node.has("numWorkers")) {
      options.setNumWorkers(requiredInt(node, "numWorkers"));
    }
    if (node.has("randomSeed")) {
      options.setRandomSeed(requiredInt(node, "randomSeed"));
    }
    if (node.has("logSearchProgress")) {
      options.setLogSearchProgress(node.get("logSearchProgress").asBoolean());
    }
    if (node.has("maxDoorsPerRoom")) {
      options.setMaxDoorsPerRoom(requiredInt(node, "maxDoorsPerRoom"));
    }
    if (node.has("defaultSeparation")) {
      options.setDefaultSeparation(requiredInt(node, "defaultSeparation"));
    }
    if (node.has("defaultVisibilityGap")) {
      options.setDefaultVisibilityGap(requiredInt(node, "defaultVisibilityGap"));
    }
    if (node.has("minimumSharedWall")) {
      options.setMinimumSharedWall(requiredInt(node, "minimumSharedWall"));
    }
    if (node.has("diagnoseInfeasibility")) {
      options.setDiagnoseInfeasibility(node.get("diagnoseInfeasibility").asBoolean());
    }
    try {
      return options.build();
    } catch (IllegalArgumentException e) {
      throw new LayoutConfigurationException("Invalid solver options", e);
    }
  }

  private static int requiredInt(JsonNode parent, String field) {
    JsonNode value = parent.get(field);
    if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
      throw new LayoutConfigurationException(
          "ProjectFileReader", "'" + field + "' must be an integer");
    }
    return value.asInt();
  }
}
