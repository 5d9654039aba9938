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

/** Default distances used by the compiler when a rule leaves them open. */
public final class CompilerSettings {
  /** Builder for {@link CompilerSettings}. */
  public static final class Builder {
    private Builder() {}

    public Builder setDefaultSeparation(int inches) {
      defaultSeparation = inches;
      return this;
    }

    public Builder setDefaultVisibilityGap(int inches) {
      defaultVisibilityGap = inches;
      return this;
    }

    public Builder setMinimumSharedWall(int inches) {
      minimumSharedWall = inches;
      return this;
    }

    public CompilerSettings build() {
      if (defaultSeparation < 0 || defaultVisibilityGap < 0) {
        throw new IllegalArgumentException("Default distances must be non-negative");
      }
      if (minimumSharedWall < 1) {
        throw new IllegalArgumentException("Minimum shared wall must be positive");
      }
      return new CompilerSettings(this);
    }

    private int defaultSeparation = 24;
    private int defaultVisibilityGap = 120;
    private int minimumSharedWall = 24;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static CompilerSettings getDefaultInstance() {
    return newBuilder().build();
  }

  private CompilerSettings(Builder builder) {
    this.defaultSeparation = builder.defaultSeparation;
    this.defaultVisibilityGap = builder.defaultVisibilityGap;
    this.minimumSharedWall = builder.minimumSharedWall;
  }

  public int getDefaultSeparation() {
    return defaultSeparation;
  }

  public int getDefaultVisibilityGap() {
    return defaultVisibilityGap;
  }

  public int getMinimumSharedWall() {
    return minimumSharedWall;
  }

  private final int defaultSeparation;
  private final int defaultVisibilityGap;
  private final int minimumSharedWall;
}
