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

import static com.google.common.truth.Truth.assertThat;

import com.google.ortools.Loader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the command line entry point on the bundled fixtures. */
public final class LayoutCliTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static String resource(String name) throws Exception {
    return Paths.get(LayoutCliTest.class.getResource(name).toURI()).toString();
  }

  @Test
  public void testRun_usage() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final int code = LayoutCli.run(new String[] {"rules.json"},
        new PrintStream(bytes, true, StandardCharsets.UTF_8.name()));
    assertThat(code).isEqualTo(1);
    assertThat(bytes.toString(StandardCharsets.UTF_8.name())).startsWith("usage:");
  }

  @Test
  public void testRun_missingFile() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final int code = LayoutCli.run(new String[] {"/nonexistent/rules.json", "project.json"},
        new PrintStream(bytes, true, StandardCharsets.UTF_8.name()));
    assertThat(code).isEqualTo(1);
    assertThat(bytes.toString(StandardCharsets.UTF_8.name())).contains("CONFIGURATION_ERROR");
  }

  @Test
  public void testRun_smallClinic() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final String[] args = {
      resource("/rules/clinic_rules.json"), resource("/projects/small_clinic.json")
    };
    final int code = LayoutCli.run(args,
        new PrintStream(bytes, true, StandardCharsets.UTF_8.name()));
    final String output = bytes.toString(StandardCharsets.UTF_8.name());
    assertThat(code).isEqualTo(0);
    assertThat(output).contains("lab#0 at (");
    assertThat(output).contains("sterilization#0 at (");
    assertThat(output).contains("treatmentRoom#5 at (");
    assertThat(output).doesNotContain("waitingRoom");
  }
}
