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

import com.blockplan.compiler.CompilerSettings;

/**
 * Solver knobs of one layout request.
 *
 * <p>Defaults: 30 second time limit, 8 workers, seed 0, no search log, 4 door slots per room,
 * 24 inch separation, 120 inch visibility gap, 24 inch minimum shared wall, infeasibility
 * diagnosis enabled.
 */
public final class LayoutOptions {
  /** Builder for {@link LayoutOptions}. */
  public static final class Builder {
    private Builder() {}

    public Builder setMaxTimeInSeconds(double value) {
      maxTimeInSeconds = value;
      return this;
    }

    public Builder setNumWorkers(int value) {
      numWorkers = value;
      return this;
    }

    public Builder setRandomSeed(int value) {
      randomSeed = value;
      return this;
    }

    public Builder setLogSearchProgress(boolean value) {
      logSearchProgress = value;
      return this;
    }

    public Builder setMaxDoorsPerRoom(int value) {
      maxDoorsPerRoom = value;
      return this;
    }

    public Builder setDefaultSeparation(int value) {
      defaultSeparation = value;
      return this;
    }

    public Builder setDefaultVisibilityGap(int value) {
      defaultVisibilityGap = value;
      return this;
    }

    public Builder setMinimumSharedWall(int value) {
      minimumSharedWall = value;
      return this;
    }

    public Builder setDiagnoseInfeasibility(boolean value) {
      diagnoseInfeasibility = value;
      return this;
    }

    public LayoutOptions build() {
      if (maxTimeInSeconds <= 0) {
        throw new IllegalArgumentException("Time limit must be positive: " + maxTimeInSeconds);
      }
      if (numWorkers < 1) {
        throw new IllegalArgumentException("Need at least one worker: " + numWorkers);
      }
      if (maxDoorsPerRoom < 0) {
        throw new IllegalArgumentException("Negative door slot count: " + maxDoorsPerRoom);
      }
      return new LayoutOptions(this);
    }

    private double maxTimeInSeconds = 30.0;
    private int numWorkers = 8;
    private int randomSeed = 0;
    private boolean logSearchProgress = false;
    private int maxDoorsPerRoom = 4;
    private int defaultSeparation = 24;
    private int defaultVisibilityGap = 120;
    private int minimumSharedWall = 24;
    private boolean diagnoseInfeasibility = true;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static LayoutOptions getDefaultInstance() {
    return DEFAULT;
  }

  private LayoutOptions(Builder builder) {
    this.maxTimeInSeconds = builder.maxTimeInSeconds;
    this.numWorkers = builder.numWorkers;
    this.randomSeed = builder.randomSeed;
    this.logSearchProgress = builder.logSearchProgress;
    this.maxDoorsPerRoom = builder.maxDoorsPerRoom;
    this.compilerSettings = CompilerSettings.newBuilder()
        .setDefaultSeparation(builder.defaultSeparation)
        .setDefaultVisibilityGap(builder.defaultVisibilityGap)
        .setMinimumSharedWall(builder.minimumSharedWall)
        .build();
    this.diagnoseInfeasibility = builder.diagnoseInfeasibility;
  }

  public double getMaxTimeInSeconds() {
    return maxTimeInSeconds;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  public int getRandomSeed() {
    return randomSeed;
  }

  public boolean getLogSearchProgress() {
    return logSearchProgress;
  }

  public int getMaxDoorsPerRoom() {
    return maxDoorsPerRoom;
  }

  public CompilerSettings getCompilerSettings() {
    return compilerSettings;
  }

  public boolean getDiagnoseInfeasibility() {
    return diagnoseInfeasibility;
  }

  private static final LayoutOptions DEFAULT = newBuilder().build();

  private final double maxTimeInSeconds;
  private final int numWorkers;
  private final int randomSeed;
  private final boolean logSearchProgress;
  private final int maxDoorsPerRoom;
  private final CompilerSettings compilerSettings;
  private final boolean diagnoseInfeasibility;
}
