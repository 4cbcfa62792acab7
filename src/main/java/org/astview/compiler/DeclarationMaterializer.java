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

import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;
import org.astview.adapter.NodeAdapter;
import org.astview.tree.TreeNode;
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.AnnotationNode;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ConstructorNode;
import org.codehaus.groovy.ast.FieldNode;
import org.codehaus.groovy.ast.MethodNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.PropertyNode;
import org.codehaus.groovy.classgen.GeneratorContext;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.SourceUnit;
import org.jspecify.annotations.Nullable;

/**
 * The compiler callback that adds a subtree for each class in the compilation unit to a shared
 * root.
 *
 * <p>Each class's subtree has a node for the class itself, with up to five grouping children
 * ({@value #CONSTRUCTORS}, {@value #METHODS}, {@value #FIELDS}, {@value #PROPERTIES}, {@value
 * #ANNOTATIONS}); a group is only added if the class has at least one member of that sort. Method
 * and constructor bodies and field and property initializers are expanded with a {@link
 * TreeBuildingVisitor}. Annotations are shown without their arguments.
 *
 * <p>The first call also adds the script's top-level statements, ahead of the first class.
 *
 * <p>The compiler may invoke {@link #call} concurrently. Each class's subtree is built unattached and
 * then appended to the root while holding the root's lock; the statement block is added under the
 * same lock, so it is always the root's first content.
 */
public class DeclarationMaterializer implements CompilationUnit.IPrimaryClassNodeOperation {
  private static final Logger logger = Logger.getLogger(DeclarationMaterializer.class.getName());

  public static final String ROOT = "root";
  public static final String CONSTRUCTORS = "Constructors";
  public static final String METHODS = "Methods";
  public static final String FIELDS = "Fields";
  public static final String PROPERTIES = "Properties";
  public static final String ANNOTATIONS = "Annotations";

  private final NodeAdapter adapter;
  /** Appended to only while holding its own lock. */
  private final TreeNode root = new TreeNode(ROOT);

  /** Set by whichever call adds the module's statement block. */
  private final AtomicBoolean sourceCollected = new AtomicBoolean();

  public DeclarationMaterializer(NodeAdapter adapter) {
    checkArgument(adapter != null, "Null: adapter");
    this.adapter = adapter;
  }

  /**
   * The root to which each class's subtree is added. Only read it once the compilation that drives
   * this materializer has finished.
   */
  public TreeNode root() {
    return root;
  }

  /**
   * Returns true the first time it is called and false afterwards, even if called concurrently.
   */
  @VisibleForTesting
  boolean claimStatementBlock() {
    return sourceCollected.compareAndSet(false, true);
  }

  @Override
  public void call(SourceUnit source, GeneratorContext context, ClassNode classNode) {
    logger.fine(() -> "Materializing " + classNode.getName());
    TreeNode classTree = materialize(classNode);
    synchronized (root) {
      if (claimStatementBlock()) {
        ModuleNode ast = source.getAST();
        if (ast != null) {
          addAll(root, build(ast.getStatementBlock()));
        }
      }
      root.add(classTree);
    }
  }

  /** Returns an unattached subtree for {@code classNode} and its members. */
  private TreeNode materialize(ClassNode classNode) {
    TreeNode classTree = adapter.make(classNode);

    List<ConstructorNode> constructors = classNode.getDeclaredConstructors();
    if (!constructors.isEmpty()) {
      TreeNode group = classTree.add(new TreeNode(CONSTRUCTORS));
      for (ConstructorNode constructor : constructors) {
        addAll(group.add(adapter.make(constructor)), build(constructor.getCode()));
      }
    }

    List<MethodNode> methods = classNode.getMethods();
    if (!methods.isEmpty()) {
      TreeNode group = classTree.add(new TreeNode(METHODS));
      for (MethodNode method : methods) {
        addAll(group.add(adapter.make(method)), build(method.getCode()));
      }
    }

    List<FieldNode> fields = classNode.getFields();
    if (!fields.isEmpty()) {
      TreeNode group = classTree.add(new TreeNode(FIELDS));
      for (FieldNode field : fields) {
        addAll(group.add(adapter.make(field)), build(field.getInitialExpression()));
      }
    }

    List<PropertyNode> properties = classNode.getProperties();
    if (!properties.isEmpty()) {
      TreeNode group = classTree.add(new TreeNode(PROPERTIES));
      for (PropertyNode property : properties) {
        FieldNode field = property.getField();
        TreeNode propertyTree = group.add(adapter.make(property));
        if (field != null) {
          addAll(propertyTree, build(field.getInitialExpression()));
        }
      }
    }

    List<AnnotationNode> annotations = classNode.getAnnotations();
    if (!annotations.isEmpty()) {
      TreeNode group = classTree.add(new TreeNode(ANNOTATIONS));
      for (AnnotationNode annotation : annotations) {
        group.add(adapter.make(annotation));
      }
    }
    return classTree;
  }

  /**
   * Returns the nodes built by walking {@code code} with a new TreeBuildingVisitor, or an empty list
   * if {@code code} is null.
   */
  private List<TreeNode> build(@Nullable ASTNode code) {
    return (code == null) ? List.of() : TreeBuildingVisitor.build(adapter, code);
  }

  private static void addAll(TreeNode parent, List<TreeNode> children) {
    children.forEach(parent::add);
  }
}
