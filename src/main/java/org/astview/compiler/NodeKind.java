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

import org.codehaus.groovy.ast.ASTNode;
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
 * The kinds of AST node that {@link TreeBuildingVisitor} turns into tree nodes, one for each
 * statement or expression callback of Groovy's {@link org.codehaus.groovy.ast.GroovyCodeVisitor}.
 *
 * <p>A kind matches a node only if the node's class is exactly the kind's class. Groovy's default
 * walk routes some nodes through the callbacks of their superclasses (an ArgumentListExpression is
 * also passed to {@code visitTupleExpression}, a DeclarationExpression to {@code
 * visitBinaryExpression}); requiring an exact match means only one callback claims each node.
 */
public enum NodeKind {
  BLOCK(BlockStatement.class),
  FOR_LOOP(ForStatement.class),
  WHILE_LOOP(WhileStatement.class),
  DO_WHILE_LOOP(DoWhileStatement.class),
  IF_ELSE(IfStatement.class),
  EXPRESSION_STATEMENT(ExpressionStatement.class),
  RETURN(ReturnStatement.class),
  ASSERT(AssertStatement.class),
  TRY_CATCH_FINALLY(TryCatchStatement.class),
  CATCH(CatchStatement.class),
  SWITCH(SwitchStatement.class),
  CASE(CaseStatement.class),
  BREAK(BreakStatement.class),
  CONTINUE(ContinueStatement.class),
  SYNCHRONIZED(SynchronizedStatement.class),
  THROW(ThrowStatement.class),
  METHOD_CALL(MethodCallExpression.class),
  STATIC_METHOD_CALL(StaticMethodCallExpression.class),
  CONSTRUCTOR_CALL(ConstructorCallExpression.class),
  BINARY(BinaryExpression.class),
  TERNARY(TernaryExpression.class),
  ELVIS(ElvisOperatorExpression.class),
  POSTFIX(PostfixExpression.class),
  PREFIX(PrefixExpression.class),
  BOOLEAN(BooleanExpression.class),
  NOT(NotExpression.class),
  CLOSURE(ClosureExpression.class),
  LAMBDA(LambdaExpression.class),
  TUPLE(TupleExpression.class),
  LIST(ListExpression.class),
  ARRAY(ArrayExpression.class),
  MAP(MapExpression.class),
  MAP_ENTRY(MapEntryExpression.class),
  RANGE(RangeExpression.class),
  SPREAD(SpreadExpression.class),
  SPREAD_MAP(SpreadMapExpression.class),
  METHOD_POINTER(MethodPointerExpression.class),
  METHOD_REFERENCE(MethodReferenceExpression.class),
  UNARY_MINUS(UnaryMinusExpression.class),
  UNARY_PLUS(UnaryPlusExpression.class),
  BITWISE_NEGATION(BitwiseNegationExpression.class),
  CAST(CastExpression.class),
  CONSTANT(ConstantExpression.class),
  CLASS(ClassExpression.class),
  VARIABLE(VariableExpression.class),
  DECLARATION(DeclarationExpression.class),
  PROPERTY(PropertyExpression.class),
  ATTRIBUTE(AttributeExpression.class),
  FIELD(FieldExpression.class),
  GSTRING(GStringExpression.class),
  ARGUMENT_LIST(ArgumentListExpression.class),
  CLOSURE_LIST(ClosureListExpression.class),
  // BytecodeExpression is abstract and only ever reaches visitBytecodeExpression, so any subclass
  // matches.
  BYTECODE(BytecodeExpression.class) {
    @Override
    public boolean matches(ASTNode node) {
      return node instanceof BytecodeExpression;
    }
  };

  private final Class<? extends ASTNode> nodeClass;

  NodeKind(Class<? extends ASTNode> nodeClass) {
    this.nodeClass = nodeClass;
  }

  /** The AST class this kind corresponds to. */
  public Class<? extends ASTNode> nodeClass() {
    return nodeClass;
  }

  /** Returns true if {@code node} should be materialized by this kind's callback. */
  public boolean matches(ASTNode node) {
    return node.getClass() == nodeClass;
  }

  /** Returns the kind that matches {@code node}, or null if no kind does. */
  public static @Nullable NodeKind of(ASTNode node) {
    for (NodeKind kind : values()) {
      if (kind.matches(node)) {
        return kind;
      }
    }
    return null;
  }
}
