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

package org.astview.adapter;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import groovy.lang.Writable;
import groovy.text.GStringTemplateEngine;
import groovy.text.Template;
import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.io.IOException;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.astview.tree.TreeNode;
import org.astview.tree.TreeProperty;
import org.codehaus.groovy.GroovyBugError;
import org.codehaus.groovy.ast.ASTNode;
import org.jspecify.annotations.Nullable;

/**
 * Converts a single AST node to a {@link TreeNode}: a label rendered from the node's template in a
 * {@link LabelMappingTable}, and a table of the node's readable JavaBeans properties.
 *
 * <p>A NodeAdapter never throws while adapting a node. Properties whose getters fail are reported
 * with a null value, and templates that fail are replaced by the class's simple name.
 */
public final class NodeAdapter {
  private static final Logger logger = Logger.getLogger(NodeAdapter.class.getName());

  /** The name under which the node is bound when a label template is rendered. */
  public static final String TEMPLATE_VARIABLE = "expression";

  private static final Comparator<TreeProperty> BY_NAME = Comparator.comparing(TreeProperty::name);

  private final LabelMappingTable mappings;
  private final GStringTemplateEngine engine = new GStringTemplateEngine();

  /** Compiled templates, keyed by template text. */
  private final Map<String, Template> templates = new ConcurrentHashMap<>();

  public NodeAdapter(LabelMappingTable mappings) {
    checkArgument(mappings != null, "Null: mappings");
    this.mappings = mappings;
  }

  /** Returns an adapter using the process-wide {@link LabelMappingTable#standard} mappings. */
  public static NodeAdapter standard() {
    return new NodeAdapter(LabelMappingTable.standard());
  }

  /** Returns a new, unattached TreeNode for {@code node}. */
  public TreeNode make(ASTNode node) {
    return new TreeNode(label(node), propertyTable(node));
  }

  /**
   * Returns the display label for {@code node}: the rendering of its class's template if the
   * mapping table has one, otherwise the class's simple name.
   */
  public String label(ASTNode node) {
    Class<?> nodeClass = node.getClass();
    String template = mappings.template(nodeClass.getName());
    if (template == null) {
      return simpleName(nodeClass);
    }
    try {
      return render(template, node);
    } catch (IOException | ClassNotFoundException | RuntimeException e) {
      logger.log(
          Level.WARNING,
          String.format("Label template for %s failed: %s", nodeClass.getName(), template),
          e);
      return simpleName(nodeClass);
    }
  }

  private String render(String templateText, ASTNode node)
      throws IOException, ClassNotFoundException {
    Template template = templates.get(templateText);
    if (template == null) {
      template = engine.createTemplate(templateText);
      templates.putIfAbsent(templateText, template);
    }
    Writable writable = template.make(ImmutableMap.of(TEMPLATE_VARIABLE, node));
    StringWriter result = new StringWriter();
    writable.writeTo(result);
    return result.toString();
  }

  /**
   * Returns the simple name of {@code nodeClass}, or for an anonymous class its binary name
   * without the package.
   */
  static String simpleName(Class<?> nodeClass) {
    String name = nodeClass.getSimpleName();
    if (!name.isEmpty()) {
      return name;
    }
    name = nodeClass.getName();
    return name.substring(name.lastIndexOf('.') + 1);
  }

  /**
   * Returns one row for each readable property of {@code node}, sorted by property name. Values are
   * read afresh on each call.
   */
  public ImmutableList<TreeProperty> propertyTable(ASTNode node) {
    BeanInfo beanInfo;
    try {
      beanInfo = Introspector.getBeanInfo(node.getClass());
    } catch (IntrospectionException e) {
      logger.log(Level.WARNING, "Cannot introspect " + node.getClass().getName(), e);
      return ImmutableList.of();
    }
    List<TreeProperty> rows = new ArrayList<>();
    for (PropertyDescriptor descriptor : beanInfo.getPropertyDescriptors()) {
      Method getter = descriptor.getReadMethod();
      if (getter == null) {
        continue;
      }
      Class<?> type = descriptor.getPropertyType();
      if (type == null) {
        type = getter.getReturnType();
      }
      rows.add(
          new TreeProperty(descriptor.getName(), read(node, getter), type.getSimpleName()));
    }
    rows.sort(BY_NAME);
    return ImmutableList.copyOf(rows);
  }

  /** Calls {@code getter} on {@code node} and returns the result as a String. */
  private static @Nullable String read(ASTNode node, Method getter) {
    Object value;
    try {
      value = getter.invoke(node);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof GroovyBugError) {
        // Some getters assert that the compiler has already filled in the field they return,
        // which isn't true in every phase.
        logger.fine(() -> String.format("%s before initialization: %s", getter, cause));
      } else {
        logger.log(Level.FINE, "Failed to read " + getter, cause);
      }
      return null;
    } catch (IllegalAccessException | RuntimeException e) {
      logger.log(Level.FINE, "Failed to read " + getter, e);
      return null;
    }
    if (value instanceof Object[] array) {
      return Arrays.toString(array);
    }
    return String.valueOf(value);
  }
}
