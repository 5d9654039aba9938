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
import com.blockplan.rules.RuleRegistry;
import com.blockplan.rules.RuleRegistryReader;
import com.blockplan.solver.LayoutRequest;
import com.blockplan.solver.LayoutResult;
import com.blockplan.solver.LayoutSolver;
import com.blockplan.solver.PlacedDoor;
import com.blockplan.solver.PlacedRoom;
import com.google.ortools.Loader;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.logging.Logger;

/** Solves a project file against a rule registry and prints the rooms and their doors. */
public final class LayoutCli {
  private static final Logger logger = Logger.getLogger(LayoutCli.class.getName());

  private LayoutCli() {}

  public static void main(String[] args) {
    Loader.loadNativeLibraries();
    System.exit(run(args, System.out));
  }

  /** Returns 0 when a layout was found, 1 otherwise. */
  static int run(String[] args, PrintStream out) {
    if (args.length != 2) {
      out.println("usage: LayoutCli <rules.json> <project.json>");
      return 1;
    }
    RuleRegistry registry;
    LayoutRequest request;
    try {
      registry = RuleRegistryReader.read(Paths.get(args[0]));
      request = ProjectFileReader.read(Paths.get(args[1]));
    } catch (LayoutConfigurationException e) {
      logger.warning(e.getMessage());
      out.println("CONFIGURATION_ERROR: " + e.getMessage());
      return 1;
    }
    LayoutResult result = new LayoutSolver(registry).solve(request);
    print(result, out);
    return result.getStatus().hasSolution() ? 0 : 1;
  }

  static void print(LayoutResult result, PrintStream out) {
    out.println(result);
    if (result.getSolution().isPresent()) {
      for (PlacedRoom room : result.getSolution().get().getRooms()) {
        StringBuilder line = new StringBuilder(room.toString());
        for (PlacedDoor door : room.getDoors()) {
          line.append(' ').append(door);
        }
        out.println(line);
      }
    }
    for (int i = 0; i < result.getConflicts().size(); ++i) {
      out.println("  conflict " + (i + 1) + ": " + result.getConflicts().get(i));
    }
  }
}
