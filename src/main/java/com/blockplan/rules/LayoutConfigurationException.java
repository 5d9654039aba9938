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

/**
 * Thrown when a rule, an inventory entry or a floor plate cannot produce a valid model.
 *
 * <p>These errors are always raised before the solver is invoked.
 */
public class LayoutConfigurationException extends RuntimeException {
  public LayoutConfigurationException(String msg) {
    super(msg);
  }

  public LayoutConfigurationException(String where, String msg) {
    super(where + ": " + msg);
  }

  public LayoutConfigurationException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
