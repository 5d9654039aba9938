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

package com.blockplan.geometry;

import com.blockplan.rules.RoomTypeRule;

/** One placed copy of a room type. Instances are created by {@link InstanceExpander} only. */
public final class RoomInstance {
  RoomInstance(RoomTypeRule rule, int index) {
    this.rule = rule;
    this.index = index;
    this.id = rule.getId() + "#" + index;
  }

  public RoomTypeRule getRule() {
    return rule;
  }

  public String getTypeId() {
    return rule.getId();
  }

  public int getIndex() {
    return index;
  }

  /** Returns the unique id, {@code <type>#<index>}. */
  public String getId() {
    return id;
  }

  @Override
  public String toString() {
    return id;
  }

  private final RoomTypeRule rule;
  private final int index;
  private final String id;
}
