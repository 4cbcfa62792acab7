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

/**
 * Renders a {@link TreeNode} as indented text, one node per line, with two spaces of indentation
 * per level. If property output is enabled each node's properties follow it on lines of their own,
 * prefixed with {@code "- "}.
 */
public final class TreePrinter {
  private final boolean includeProperties;

  private TreePrinter(boolean includeProperties) {
    this.includeProperties = includeProperties;
  }

  /** A printer that shows only labels. */
  public static TreePrinter labelsOnly() {
    return new TreePrinter(false);
  }

  /** A printer that shows each node's property table under its label. */
  public static TreePrinter withProperties() {
    return new TreePrinter(true);
  }

  public String print(TreeNode root) {
    StringBuilder sb = new StringBuilder();
    print(root, 0, sb);
    return sb.toString();
  }

  private void print(TreeNode node, int depth, StringBuilder sb) {
    indent(depth, sb).append(node.label()).append('\n');
    if (includeProperties) {
      for (TreeProperty p : node.properties()) {
        indent(depth + 1, sb).append("- ").append(p).append('\n');
      }
    }
    for (TreeNode child : node.children()) {
      print(child, depth + 1, sb);
    }
  }

  private static StringBuilder indent(int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
    return sb;
  }
}
