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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TreePrinterTest {

  private static TreeNode sampleTree() {
    TreeNode root = new TreeNode("root");
    TreeNode block = root.add(new TreeNode("BlockStatement"));
    TreeNode binary =
        block.add(
            new TreeNode(
                "BinaryExpression",
                ImmutableList.of(
                    new TreeProperty("lineNumber", "1", "int"),
                    new TreeProperty("text", "(x = 1)", "String"))));
    binary.add(new TreeNode("VariableExpression"));
    binary.add(new TreeNode("ConstantExpression"));
    root.add(new TreeNode("ClassNode"));
    return root;
  }

  @Test
  public void labelsOnly() {
    assertThat(TreePrinter.labelsOnly().print(sampleTree()))
        .isEqualTo(
            "root\n"
                + "  BlockStatement\n"
                + "    BinaryExpression\n"
                + "      VariableExpression\n"
                + "      ConstantExpression\n"
                + "  ClassNode\n");
  }

  @Test
  public void withProperties() {
    assertThat(TreePrinter.withProperties().print(sampleTree()))
        .isEqualTo(
            "root\n"
                + "  BlockStatement\n"
                + "    BinaryExpression\n"
                + "      - lineNumber=1 (int)\n"
                + "      - text=(x = 1) (String)\n"
                + "      VariableExpression\n"
                + "      ConstantExpression\n"
                + "  ClassNode\n");
  }
}
