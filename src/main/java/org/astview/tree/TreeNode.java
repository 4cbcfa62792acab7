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

package org.astview.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * A node of the generic tree produced from a compiled AST: a display label, a table of properties
 * sorted by name, and an ordered list of children.
 *
 * <p>A TreeNode is owned by the node it was appended to. The {@link #parent} link is only for
 * navigation; it is set by {@link #add} and never changed afterwards.
 */
public final class TreeNode {
  private final String label;
  private final ImmutableList<TreeProperty> properties;
  private final List<TreeNode> children = new ArrayList<>();
  private @Nullable TreeNode parent;

  /** Creates a node with no properties, such as a grouping node or a root. */
  public TreeNode(String label) {
    this(label, ImmutableList.of());
  }

  public TreeNode(String label, List<TreeProperty> properties) {
    this.label = checkNotNull(label);
    this.properties = ImmutableList.copyOf(properties);
  }

  public String label() {
    return label;
  }

  /** The property table, in ascending order of name. */
  public ImmutableList<TreeProperty> properties() {
    return properties;
  }

  /** Returns the property with the given name, or null if there is none. */
  public @Nullable TreeProperty property(String name) {
    for (TreeProperty p : properties) {
      if (p.name().equals(name)) {
        return p;
      }
    }
    return null;
  }

  /** The children of this node, in the order they were added. */
  public List<TreeNode> children() {
    return Collections.unmodifiableList(children);
  }

  public @Nullable TreeNode parent() {
    return parent;
  }

  /**
   * Appends {@code child} as the last child of this node. The child must not already have a
   * parent.
   */
  @CanIgnoreReturnValue
  public TreeNode add(TreeNode child) {
    checkArgument(child.parent == null, "%s already has a parent", child);
    checkArgument(child != this, "Cannot add %s to itself", child);
    children.add(child);
    child.parent = this;
    return child;
  }

  /** Returns the labels of this node's children. */
  public ImmutableList<String> childLabels() {
    return children.stream().map(TreeNode::label).collect(ImmutableList.toImmutableList());
  }

  /** Returns the first child with the given label, or null if there is none. */
  public @Nullable TreeNode child(String label) {
    for (TreeNode child : children) {
      if (child.label.equals(label)) {
        return child;
      }
    }
    return null;
  }

  /** Returns all nodes below this one in pre-order; does not include this node. */
  public Stream<TreeNode> descendants() {
    return children.stream().flatMap(c -> Stream.concat(Stream.of(c), c.descendants()));
  }

  @Override
  public String toString() {
    return label;
  }
}
