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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.astview.adapter.NodeAdapter;
import org.astview.tree.TreeNode;
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.CodeVisitorSupport;
import org.codehaus.groovy.ast.expr.ArgumentListExpression;
import org.codehaus.groovy.ast.expr.ArrayExpression;
import org.codehaus.groovy.ast.expr.AttributeExpression;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.BitwiseNegationExpression;
import org.codehaus.groovy.ast.expr.BooleanExpression;
import org.codehaus.groovy.ast.expr.CastExpression;
import org.codehaus.groovy.ast.expr.ClassExpression;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ClosureListExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.ConstructorCallExpression;
import org.codehaus.groovy.ast.expr.DeclarationExpression;
import org.codehaus.groovy.ast.expr.ElvisOperatorExpression;
import org.codehaus.groovy.ast.expr.FieldExpression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.LambdaExpression;
import org.codehaus.groovy.ast.expr.ListExpression;
import org.codehaus.groovy.ast.expr.MapEntryExpression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.MethodPointerExpression;
import org.codehaus.groovy.ast.expr.MethodReferenceExpression;
import org.codehaus.groovy.ast.expr.NotExpression;
import org.codehaus.groovy.ast.expr.PostfixExpression;
import org.codehaus.groovy.ast.expr.PrefixExpression;
import org.codehaus.groovy.ast.expr.PropertyExpression;
import org.codehaus.groovy.ast.expr.RangeExpression;
import org.codehaus.groovy.ast.expr.SpreadExpression;
import org.codehaus.groovy.ast.expr.SpreadMapExpression;
import org.codehaus.groovy.ast.expr.StaticMethodCallExpression;
import org.codehaus.groovy.ast.expr.TernaryExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.codehaus.groovy.ast.expr.UnaryMinusExpression;
import org.codehaus.groovy.ast.expr.UnaryPlusExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.AssertStatement;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.BreakStatement;
import org.codehaus.groovy.ast.stmt.CaseStatement;
import org.codehaus.groovy.ast.stmt.CatchStatement;
import org.codehaus.groovy.ast.stmt.ContinueStatement;
import org.codehaus.groovy.ast.stmt.DoWhileStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.ForStatement;
import org.codehaus.groovy.ast.stmt.IfStatement;
import org.codehaus.groovy.ast.stmt.ReturnStatement;
import org.codehaus.groovy.ast.stmt.SwitchStatement;
import org.codehaus.groovy.ast.stmt.SynchronizedStatement;
import org.codehaus.groovy.ast.stmt.ThrowStatement;
import org.codehaus.groovy.ast.stmt.TryCatchStatement;
import org.codehaus.groovy.ast.stmt.WhileStatement;
import org.codehaus.groovy.classgen.BytecodeExpression;
import org.jspecify.annotations.Nullable;

/**
 * A Groovy code visitor that builds a {@link TreeNode} for each statement or expression it walks.
 *
 * <p>Each callback materializes a node only when the visited node's class is exactly the callback's
 * {@link NodeKind}; otherwise it just continues the default walk, so that a node reached through
 * several callbacks (e.g. an ArgumentListExpression, which is also visited as a TupleExpression)
 * appears in the tree once. Nodes whose kind no callback claims are left out, but anything below
 * them that is claimed still appears, attached to the nearest materialized ancestor.
 *
 * <p>A TreeBuildingVisitor holds the state of one walk and should not be reused or shared.
 */
public class TreeBuildingVisitor extends CodeVisitorSupport {
  private final NodeAdapter adapter;

  /** Nodes materialized with no materialized ancestor, in the order they were visited. */
  private final List<TreeNode> roots = new ArrayList<>();

  /** The node that new nodes are attached to, or null while the walk is at the top level. */
  private @Nullable TreeNode currentNode;

  public TreeBuildingVisitor(NodeAdapter adapter) {
    checkArgument(adapter != null, "Null: adapter");
    this.adapter = adapter;
  }

  /**
   * Walks {@code node} with a new visitor and returns the top-level nodes it produced (usually zero
   * or one).
   */
  public static ImmutableList<TreeNode> build(NodeAdapter adapter, ASTNode node) {
    TreeBuildingVisitor visitor = new TreeBuildingVisitor(adapter);
    node.visit(visitor);
    return visitor.roots();
  }

  /** The nodes materialized so far that have no materialized ancestor. */
  public ImmutableList<TreeNode> roots() {
    return ImmutableList.copyOf(roots);
  }

  /** Returns the first top-level node, or null if nothing was materialized. */
  public @Nullable TreeNode result() {
    return roots.isEmpty() ? null : roots.get(0);
  }

  /**
   * If {@code node} is exactly of the given kind, adds a TreeNode for it below the current node and
   * calls {@code descend} with that TreeNode as the current node; otherwise just calls {@code
   * descend}.
   */
  private <T extends ASTNode> void visit(T node, NodeKind kind, Consumer<T> descend) {
    if (!kind.matches(node)) {
      descend.accept(node);
      return;
    }
    TreeNode parent = currentNode;
    TreeNode child = adapter.make(node);
    if (parent == null) {
      roots.add(child);
    } else {
      parent.add(child);
    }
    currentNode = child;
    try {
      descend.accept(node);
    } finally {
      currentNode = parent;
    }
  }

  @Override
  public void visitBlockStatement(BlockStatement node) {
    visit(node, NodeKind.BLOCK, super::visitBlockStatement);
  }

  @Override
  public void visitForLoop(ForStatement node) {
    visit(node, NodeKind.FOR_LOOP, super::visitForLoop);
  }

  @Override
  public void visitWhileLoop(WhileStatement node) {
    visit(node, NodeKind.WHILE_LOOP, super::visitWhileLoop);
  }

  @Override
  public void visitDoWhileLoop(DoWhileStatement node) {
    visit(node, NodeKind.DO_WHILE_LOOP, super::visitDoWhileLoop);
  }

  @Override
  public void visitIfElse(IfStatement node) {
    visit(node, NodeKind.IF_ELSE, super::visitIfElse);
  }

  @Override
  public void visitExpressionStatement(ExpressionStatement node) {
    visit(node, NodeKind.EXPRESSION_STATEMENT, super::visitExpressionStatement);
  }

  @Override
  public void visitReturnStatement(ReturnStatement node) {
    visit(node, NodeKind.RETURN, super::visitReturnStatement);
  }

  @Override
  public void visitAssertStatement(AssertStatement node) {
    visit(node, NodeKind.ASSERT, super::visitAssertStatement);
  }

  @Override
  public void visitTryCatchFinally(TryCatchStatement node) {
    visit(node, NodeKind.TRY_CATCH_FINALLY, super::visitTryCatchFinally);
  }

  @Override
  public void visitCatchStatement(CatchStatement node) {
    visit(node, NodeKind.CATCH, super::visitCatchStatement);
  }

  @Override
  public void visitSwitch(SwitchStatement node) {
    visit(node, NodeKind.SWITCH, super::visitSwitch);
  }

  @Override
  public void visitCaseStatement(CaseStatement node) {
    visit(node, NodeKind.CASE, super::visitCaseStatement);
  }

  @Override
  public void visitBreakStatement(BreakStatement node) {
    visit(node, NodeKind.BREAK, super::visitBreakStatement);
  }

  @Override
  public void visitContinueStatement(ContinueStatement node) {
    visit(node, NodeKind.CONTINUE, super::visitContinueStatement);
  }

  @Override
  public void visitSynchronizedStatement(SynchronizedStatement node) {
    visit(node, NodeKind.SYNCHRONIZED, super::visitSynchronizedStatement);
  }

  @Override
  public void visitThrowStatement(ThrowStatement node) {
    visit(node, NodeKind.THROW, super::visitThrowStatement);
  }

  @Override
  public void visitMethodCallExpression(MethodCallExpression node) {
    visit(node, NodeKind.METHOD_CALL, super::visitMethodCallExpression);
  }

  @Override
  public void visitStaticMethodCallExpression(StaticMethodCallExpression node) {
    visit(node, NodeKind.STATIC_METHOD_CALL, super::visitStaticMethodCallExpression);
  }

  @Override
  public void visitConstructorCallExpression(ConstructorCallExpression node) {
    visit(node, NodeKind.CONSTRUCTOR_CALL, super::visitConstructorCallExpression);
  }

  @Override
  public void visitBinaryExpression(BinaryExpression node) {
    visit(node, NodeKind.BINARY, super::visitBinaryExpression);
  }

  @Override
  public void visitTernaryExpression(TernaryExpression node) {
    visit(node, NodeKind.TERNARY, super::visitTernaryExpression);
  }

  @Override
  public void visitShortTernaryExpression(ElvisOperatorExpression node) {
    visit(node, NodeKind.ELVIS, super::visitShortTernaryExpression);
  }

  @Override
  public void visitPostfixExpression(PostfixExpression node) {
    visit(node, NodeKind.POSTFIX, super::visitPostfixExpression);
  }

  @Override
  public void visitPrefixExpression(PrefixExpression node) {
    visit(node, NodeKind.PREFIX, super::visitPrefixExpression);
  }

  @Override
  public void visitBooleanExpression(BooleanExpression node) {
    visit(node, NodeKind.BOOLEAN, super::visitBooleanExpression);
  }

  @Override
  public void visitNotExpression(NotExpression node) {
    visit(node, NodeKind.NOT, super::visitNotExpression);
  }

  @Override
  public void visitClosureExpression(ClosureExpression node) {
    visit(node, NodeKind.CLOSURE, super::visitClosureExpression);
  }

  @Override
  public void visitLambdaExpression(LambdaExpression node) {
    visit(node, NodeKind.LAMBDA, super::visitLambdaExpression);
  }

  @Override
  public void visitTupleExpression(TupleExpression node) {
    visit(node, NodeKind.TUPLE, super::visitTupleExpression);
  }

  @Override
  public void visitListExpression(ListExpression node) {
    visit(node, NodeKind.LIST, super::visitListExpression);
  }

  @Override
  public void visitArrayExpression(ArrayExpression node) {
    visit(node, NodeKind.ARRAY, super::visitArrayExpression);
  }

  @Override
  public void visitMapExpression(MapExpression node) {
    visit(node, NodeKind.MAP, super::visitMapExpression);
  }

  @Override
  public void visitMapEntryExpression(MapEntryExpression node) {
    visit(node, NodeKind.MAP_ENTRY, super::visitMapEntryExpression);
  }

  @Override
  public void visitRangeExpression(RangeExpression node) {
    visit(node, NodeKind.RANGE, super::visitRangeExpression);
  }

  @Override
  public void visitSpreadExpression(SpreadExpression node) {
    visit(node, NodeKind.SPREAD, super::visitSpreadExpression);
  }

  @Override
  public void visitSpreadMapExpression(SpreadMapExpression node) {
    visit(node, NodeKind.SPREAD_MAP, super::visitSpreadMapExpression);
  }

  @Override
  public void visitMethodPointerExpression(MethodPointerExpression node) {
    visit(node, NodeKind.METHOD_POINTER, super::visitMethodPointerExpression);
  }

  @Override
  public void visitMethodReferenceExpression(MethodReferenceExpression node) {
    visit(node, NodeKind.METHOD_REFERENCE, super::visitMethodReferenceExpression);
  }

  @Override
  public void visitUnaryMinusExpression(UnaryMinusExpression node) {
    visit(node, NodeKind.UNARY_MINUS, super::visitUnaryMinusExpression);
  }

  @Override
  public void visitUnaryPlusExpression(UnaryPlusExpression node) {
    visit(node, NodeKind.UNARY_PLUS, super::visitUnaryPlusExpression);
  }

  @Override
  public void visitBitwiseNegationExpression(BitwiseNegationExpression node) {
    visit(node, NodeKind.BITWISE_NEGATION, super::visitBitwiseNegationExpression);
  }

  @Override
  public void visitCastExpression(CastExpression node) {
    visit(node, NodeKind.CAST, super::visitCastExpression);
  }

  @Override
  public void visitConstantExpression(ConstantExpression node) {
    visit(node, NodeKind.CONSTANT, super::visitConstantExpression);
  }

  @Override
  public void visitClassExpression(ClassExpression node) {
    visit(node, NodeKind.CLASS, super::visitClassExpression);
  }

  @Override
  public void visitVariableExpression(VariableExpression node) {
    visit(node, NodeKind.VARIABLE, super::visitVariableExpression);
  }

  @Override
  public void visitDeclarationExpression(DeclarationExpression node) {
    visit(node, NodeKind.DECLARATION, super::visitDeclarationExpression);
  }

  @Override
  public void visitPropertyExpression(PropertyExpression node) {
    visit(node, NodeKind.PROPERTY, super::visitPropertyExpression);
  }

  @Override
  public void visitAttributeExpression(AttributeExpression node) {
    visit(node, NodeKind.ATTRIBUTE, super::visitAttributeExpression);
  }

  @Override
  public void visitFieldExpression(FieldExpression node) {
    visit(node, NodeKind.FIELD, super::visitFieldExpression);
  }

  @Override
  public void visitGStringExpression(GStringExpression node) {
    visit(node, NodeKind.GSTRING, super::visitGStringExpression);
  }

  @Override
  public void visitArgumentlistExpression(ArgumentListExpression node) {
    visit(node, NodeKind.ARGUMENT_LIST, super::visitArgumentlistExpression);
  }

  @Override
  public void visitClosureListExpression(ClosureListExpression node) {
    visit(node, NodeKind.CLOSURE_LIST, super::visitClosureListExpression);
  }

  @Override
  public void visitBytecodeExpression(BytecodeExpression node) {
    visit(node, NodeKind.BYTECODE, super::visitBytecodeExpression);
  }
}
