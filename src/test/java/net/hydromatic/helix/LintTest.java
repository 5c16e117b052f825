/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.helix;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

/** Runs lint-like checks on the source code. Also tests those checks. */
public class LintTest {
  private static final String LICENSE_LINE =
      " * Licensed to Julian Hyde under one or more contributor license";

  /** Returns the Java source files under the "src" directory. */
  private static List<Path> javaFiles() throws IOException {
    final Path src = Paths.get("src");
    assumeTrue(Files.isDirectory(src), "not run from the project root");
    try (Stream<Path> paths = Files.walk(src)) {
      return paths
          .filter(path -> path.toString().endsWith(".java"))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  /** Checks the lines of one source file, adding a message for each
   * problem. */
  static void lint(String fileName, List<String> lines,
      List<String> messages) {
    if (lines.size() < 2
        || !lines.get(0).equals("/*")
        || !lines.get(1).equals(LICENSE_LINE)) {
      messages.add(fileName + ":1: missing license header");
    }
    final String endMarker = "// End " + fileName;
    if (lines.isEmpty() || !lines.get(lines.size() - 1).equals(endMarker)) {
      messages.add(fileName + ": must end with '" + endMarker + "'");
    }
    String lastStatic = "";
    String lastNonStatic = "";
    for (int i = 0; i < lines.size(); i++) {
      final String line = lines.get(i);
      final String where = fileName + ":" + (i + 1) + ": ";
      if (line.length() > 80) {
        messages.add(where + "line longer than 80 characters");
      }
      if (line.contains("\t")) {
        messages.add(where + "tab");
      }
      if (line.endsWith(" ")) {
        messages.add(where + "trailing space");
      }
      if (line.startsWith("import ")) {
        final boolean isStatic = line.startsWith("import static ");
        if (isStatic && !lastNonStatic.isEmpty()) {
          messages.add(where + "static import after non-static import");
        }
        final String name = line.replace(";", "");
        if (name.compareTo(isStatic ? lastStatic : lastNonStatic) < 0) {
          messages.add(where + "import out of order");
        }
        if (isStatic) {
          lastStatic = name;
        } else {
          lastNonStatic = name;
        }
      }
    }
  }

  @Test
  void testLint() throws IOException {
    final List<String> messages = new ArrayList<>();
    for (Path file : javaFiles()) {
      lint(file.getFileName().toString(),
          Files.readAllLines(file, UTF_8), messages);
    }
    assertThat(messages, empty());
  }

  /** Tests that the checks find problems. */
  @Test
  void testLintFindsProblems() {
    final List<String> lines =
        List.of("package x;",
            "",
            "import java.util.List;",
            "import static java.util.Objects.requireNonNull;",
            "import java.util.ArrayList;",
            "",
            "class Bad {\t",
            "}",
            "// End Bad.java");
    final List<String> messages = new ArrayList<>();
    lint("Bad.java", lines, messages);
    assertThat(messages,
        is(
            List.of("Bad.java:1: missing license header",
                "Bad.java:4: static import after non-static import",
                "Bad.java:5: import out of order",
                "Bad.java:7: tab")));

    final List<String> messages2 = new ArrayList<>();
    lint("Good.java",
        List.of("/*", LICENSE_LINE, " */", "package x;", "// End Bad.java"),
        messages2);
    assertThat(messages2,
        is(List.of("Good.java: must end with '// End Good.java'")));
  }
}

// End LintTest.java
