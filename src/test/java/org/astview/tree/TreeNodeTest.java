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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TreeNodeTest {

  @Test
  public void childrenKeepInsertionOrder() {
    TreeNode root = new TreeNode("root");
    TreeNode a = root.add(new TreeNode("a"));
    TreeNode b = root.add(new TreeNode("b"));
    TreeNode c = root.add(new TreeNode("c"));
    assertThat(root.children()).containsExactly(a, b, c).inOrder();
    assertThat(root.childLabels()).containsExactly("a", "b", "c").inOrder();
    assertThat(a.parent()).isSameInstanceAs(root);
    assertThat(root.parent()).isNull();
  }

  @Test
  public void childrenAreReadOnly() {
    TreeNode root = new TreeNode("root");
    root.add(new TreeNode("a"));
    assertThrows(UnsupportedOperationException.class, () -> root.children().clear());
  }

  @Test
  public void nodeCanOnlyBeAddedOnce() {
    TreeNode first = new TreeNode("first");
    TreeNode second = new TreeNode("second");
    TreeNode child = first.add(new TreeNode("child"));
    assertThrows(IllegalArgumentException.class, () -> second.add(child));
    assertThrows(IllegalArgumentException.class, () -> first.add(first));
    assertThat(second.children()).isEmpty();
  }

  @Test
  public void propertyLookup() {
    TreeNode node =
        new TreeNode(
            "x",
            ImmutableList.of(
                new TreeProperty("name", "x", "String"), new TreeProperty("text", null, "String")));
    assertThat(node.property("name").value()).isEqualTo("x");
    assertThat(node.property("text").value()).isNull();
    assertThat(node.property("missing")).isNull();
    assertThat(new TreeNode("group").properties()).isEmpty();
  }

  @Test
  public void descendantsArePreOrder() {
    TreeNode root = new TreeNode("root");
    TreeNode a = root.add(new TreeNode("a"));
    a.add(new TreeNode("a1"));
    a.add(new TreeNode("a2"));
    root.add(new TreeNode("b")).add(new TreeNode("b1"));
    assertThat(root.descendants().map(TreeNode::label).collect(toImmutableList()))
        .containsExactly("a", "a1", "a2", "b", "b1")
        .inOrder();
    assertThat(root.child("b").childLabels()).containsExactly("b1");
    assertThat(root.child("c")).isNull();
  }
}
