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

package org.astview.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import groovy.lang.GroovyClassLoader;
import groovy.lang.GroovyCodeSource;
import java.util.logging.Logger;
import org.astview.adapter.NodeAdapter;
import org.astview.tree.TreeNode;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilePhase;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.Phases;

/**
 * Compiles Groovy source text to a chosen phase and returns the AST as a {@link TreeNode}.
 *
 * <p>The tree's root has one child for the script's top-level statements (if there is a statement
 * block) followed by one child for each class the source declares, in the order the compiler
 * presents them; see {@link DeclarationMaterializer} for the shape of each class's subtree.
 *
 * <p>Each call to {@link #compile} builds a new tree; nothing but the {@link NodeAdapter} is shared
 * between calls.
 */
public class AstTreeSession {
  private static final Logger logger = Logger.getLogger(AstTreeSession.class.getName());

  /** The code base given to the compiler for all scripts. */
  static final String CODE_BASE = "/groovy/script";

  private final NodeAdapter adapter;
  private final CompilerConfiguration configuration;

  /** Creates a session that uses the standard label mappings and the default configuration. */
  public AstTreeSession() {
    this(NodeAdapter.standard());
  }

  public AstTreeSession(NodeAdapter adapter) {
    this(adapter, CompilerConfiguration.DEFAULT);
  }

  public AstTreeSession(NodeAdapter adapter, CompilerConfiguration configuration) {
    checkArgument(adapter != null, "Null: adapter");
    checkArgument(configuration != null, "Null: configuration");
    this.adapter = adapter;
    this.configuration = configuration;
  }

  /** Compiles {@code script} through the given phase and returns the resulting tree. */
  public TreeNode compile(String script, CompilePhase phase) {
    return compile(script, phase.getPhaseNumber());
  }

  /**
   * Compiles {@code script} through {@code compilePhase} (one of the {@link Phases} constants) and
   * returns the resulting tree.
   *
   * @throws CompileError if the script cannot be compiled that far
   * @throws IllegalArgumentException if {@code compilePhase} is not a valid phase
   */
  public TreeNode compile(String script, int compilePhase) {
    checkArgument(
        compilePhase >= Phases.INITIALIZATION && compilePhase <= Phases.FINALIZATION,
        "Invalid compile phase %s",
        compilePhase);
    String scriptName = "script" + System.currentTimeMillis() + ".groovy";
    GroovyClassLoader classLoader = new GroovyClassLoader();
    GroovyCodeSource codeSource = new GroovyCodeSource(script, scriptName, CODE_BASE);
    CompilationUnit cu =
        new CompilationUnit(configuration, codeSource.getCodeSource(), classLoader);
    DeclarationMaterializer operation = new DeclarationMaterializer(adapter);
    cu.addPhaseOperation(operation, compilePhase);
    cu.addSource(codeSource.getName(), script);
    logger.fine(() -> String.format("Compiling %s through phase %s", scriptName, compilePhase));
    try {
      cu.compile(compilePhase);
    } catch (CompilationFailedException e) {
      throw CompileError.from(e);
    }
    return operation.root();
  }
}
