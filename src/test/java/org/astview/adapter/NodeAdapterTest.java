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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.astview.tree.TreeNode;
import org.astview.tree.TreeProperty;
import org.codehaus.groovy.GroovyBugError;
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.expr.ArgumentListExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NodeAdapterTest {

  /** A node with getters that fail in the ways a compiler node's getters can. */
  public static class FragileNode extends ASTNode {
    private String state = "initial";

    public void setState(String state) {
      this.state = state;
    }

    public String getState() {
      return state;
    }

    public String getUnset() {
      throw new GroovyBugError("FragileNode#getUnset called before the value is set");
    }

    public int getBroken() {
      throw new IllegalStateException("broken");
    }
  }

  private static final NodeAdapter PLAIN = new NodeAdapter(LabelMappingTable.empty());

  private static NodeAdapter adapter(String className, String template) {
    return new NodeAdapter(LabelMappingTable.of(ImmutableMap.of(className, template)));
  }

  private static ImmutableList<String> names(ImmutableList<TreeProperty> table) {
    return table.stream().map(TreeProperty::name).collect(toImmutableList());
  }

  @Test
  public void unmappedLabelIsSimpleName() {
    assertThat(PLAIN.label(new ConstantExpression(1))).isEqualTo("ConstantExpression");
    assertThat(PLAIN.label(new FragileNode())).isEqualTo("FragileNode");
  }

  @Test
  public void mappedLabelIsRendered() {
    NodeAdapter adapter =
        adapter(VariableExpression.class.getName(), "Variable - $expression.name");
    assertThat(adapter.label(new VariableExpression("x"))).isEqualTo("Variable - x");
    // The same compiled template is used for the next node.
    assertThat(adapter.label(new VariableExpression("y"))).isEqualTo("Variable - y");
  }

  @Test
  public void lookupUsesExactClassName() {
    NodeAdapter adapter = adapter("org.codehaus.groovy.ast.expr.TupleExpression", "Tuple!");
    assertThat(adapter.label(new ArgumentListExpression())).isEqualTo("ArgumentListExpression");
  }

  @Test
  public void failingTemplateFallsBackToSimpleName() {
    NodeAdapter adapter =
        adapter(ConstantExpression.class.getName(), "Constant - ${expression.noSuchThing}");
    assertThat(adapter.label(new ConstantExpression(1))).isEqualTo("ConstantExpression");
  }

  @Test
  public void anonymousClassLabel() {
    ASTNode node = new ASTNode() {};
    assertThat(PLAIN.label(node)).startsWith("NodeAdapterTest$");
  }

  @Test
  public void propertyTableIsSorted() {
    ImmutableList<TreeProperty> table = PLAIN.propertyTable(new VariableExpression("x"));
    assertThat(names(table)).isInStrictOrder();
    assertThat(table).contains(new TreeProperty("name", "x", "String"));
    assertThat(names(table)).containsAtLeast("class", "lineNumber", "text");
  }

  @Test
  public void failedReadsBecomeNull() {
    ImmutableList<TreeProperty> table = PLAIN.propertyTable(new FragileNode());
    assertThat(names(table)).isInStrictOrder();
    assertThat(table)
        .containsAtLeast(
            new TreeProperty("broken", null, "int"),
            new TreeProperty("state", "initial", "String"),
            new TreeProperty("unset", null, "String"));
  }

  @Test
  public void propertiesAreReadOnEachCall() {
    FragileNode node = new FragileNode();
    assertThat(PLAIN.propertyTable(node)).contains(new TreeProperty("state", "initial", "String"));
    node.setState("changed");
    assertThat(PLAIN.propertyTable(node)).contains(new TreeProperty("state", "changed", "String"));
  }

  @Test
  public void make() {
    NodeAdapter adapter = adapter(ConstantExpression.class.getName(), "Const $expression.value");
    TreeNode node = adapter.make(new ConstantExpression("hello"));
    assertThat(node.label()).isEqualTo("Const hello");
    assertThat(node.property("value").value()).isEqualTo("hello");
    assertThat(node.property("value").type()).isEqualTo("Object");
    assertThat(node.children()).isEmpty();
    assertThat(node.parent()).isNull();
  }

  @Test
  public void nullMappingsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new NodeAdapter(null));
  }
}
