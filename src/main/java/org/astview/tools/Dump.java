/*
 * Copyright 2025 The AstView Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.astview.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.astview.compiler.AstTreeSession;
import org.astview.compiler.CompileError;
import org.astview.tree.TreeNode;
import org.astview.tree.TreePrinter;
import org.codehaus.groovy.control.CompilePhase;
import org.jspecify.annotations.Nullable;

/**
 * A simple command-line tool that compiles a single Groovy file to a given phase and prints its AST
 * tree. The phase may be given by name (e.g. {@code semantic_analysis}) or number; it defaults to
 * {@code CLASS_GENERATION}.
 */
public class Dump {
  private Dump() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: dump <fileName> [<phase>]");
      System.exit(1);
    }
  }

  /** Parses a phase given by name or by number; returns null if {@code arg} is neither. */
  static @Nullable CompilePhase parsePhase(String arg) {
    String trimmed = arg.trim();
    if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
      for (CompilePhase phase : CompilePhase.values()) {
        if (String.valueOf(phase.getPhaseNumber()).equals(trimmed)) {
          return phase;
        }
      }
      return null;
    }
    try {
      return CompilePhase.valueOf(trimmed.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  public static void main(String[] args) throws IOException {
    boolean showProperties = Boolean.parseBoolean(System.getProperty("properties", "false"));
    checkUsage(args.length == 1 || args.length == 2);
    Path file = Path.of(args[0]);
    CompilePhase phase = (args.length == 2) ? parsePhase(args[1]) : CompilePhase.CLASS_GENERATION;
    checkUsage(phase != null);
    String source = Files.readString(file, StandardCharsets.UTF_8);
    TreePrinter printer = showProperties ? TreePrinter.withProperties() : TreePrinter.labelsOnly();
    try {
      TreeNode root = new AstTreeSession().compile(source, phase);
      System.out.printf("/* %s THROUGH %s */\n", file.getFileName(), phase);
      System.out.print(printer.print(root));
    } catch (CompileError e) {
      System.out.printf("/* %s ERRORS\n  %s\n*/\n", file.getFileName(), e.getMessage());
      System.exit(2);
    }
  }
}
