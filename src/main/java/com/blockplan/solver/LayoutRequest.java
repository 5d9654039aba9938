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

import com.blockplan.geometry.FloorPlate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/** Floor plate, room inventory, optional treatment-room count and options of one solve. */
public final class LayoutRequest {
  /** Builder for {@link LayoutRequest}. */
  public static final class Builder {
    private Builder() {}

    public Builder setFloor(FloorPlate value) {
      floor = value;
      return this;
    }

    public Builder setFloor(int width, int height) {
      return setFloor(new FloorPlate(width, height));
    }

    /** Requests {@code count} instances of a room type; inventory order is kept. */
    public Builder putRoom(String typeId, int count) {
      inventory.put(typeId, count);
      return this;
    }

    public Builder putAllRooms(Map<String, Integer> rooms) {
      inventory.putAll(rooms);
      return this;
    }

    public Builder setTreatmentRoomCount(int value) {
      treatmentRoomCount = OptionalInt.of(value);
      return this;
    }

    public Builder setOptions(LayoutOptions value) {
      options = value;
      return this;
    }

    public LayoutRequest build() {
      if (floor == null) {
        throw new IllegalStateException("A floor plate is required");
      }
      return new LayoutRequest(this);
    }

    private FloorPlate floor;
    private final Map<String, Integer> inventory = new LinkedHashMap<>();
    private OptionalInt treatmentRoomCount = OptionalInt.empty();
    private LayoutOptions options = LayoutOptions.getDefaultInstance();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private LayoutRequest(Builder builder) {
    this.floor = builder.floor;
    this.inventory = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inventory));
    this.treatmentRoomCount = builder.treatmentRoomCount;
    this.options = builder.options;
  }

  public FloorPlate getFloor() {
    return floor;
  }

  public Map<String, Integer> getInventory() {
    return inventory;
  }

  public OptionalInt getTreatmentRoomCount() {
    return treatmentRoomCount;
  }

  public LayoutOptions getOptions() {
    return options;
  }

  private final FloorPlate floor;
  private final Map<String, Integer> inventory;
  private final OptionalInt treatmentRoomCount;
  private final LayoutOptions options;
}
