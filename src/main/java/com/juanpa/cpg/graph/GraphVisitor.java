// File: src/main/java/com/juanpa/cpg/graph/GraphVisitor.java
package com.juanpa.cpg.graph;

import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.graph.statements.*;

/**
 * Interface for the Visitor pattern that allows graph traversal.
 * Each `visit` method corresponds to a specific node type.
 */
public interface GraphVisitor<R>
{
	// --- Declarations ---
	R visitTranslationUnit(TranslationUnitDeclaration declaration);

	R visitNamespaceDeclaration(NamespaceDeclaration declaration);

	R visitRecordDeclaration(RecordDeclaration declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitMethodDeclaration(MethodDeclaration declaration);

	R visitConstructorDeclaration(ConstructorDeclaration declaration);

	R visitVariableDeclaration(VariableDeclaration declaration);

	R visitParameterDeclaration(ParameterDeclaration declaration);

	R visitFieldDeclaration(FieldDeclaration declaration);

	// --- Statements ---
	R visitCompoundStatement(CompoundStatement statement);

	R visitDeclarationStatement(DeclarationStatement statement);

	R visitLabelStatement(LabelStatement statement);

	R visitGotoStatement(GotoStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitSwitchStatement(SwitchStatement statement);

	R visitCaseStatement(CaseStatement statement);

	R visitDefaultStatement(DefaultStatement statement);

	R visitTryStatement(TryStatement statement);

	R visitCatchClause(CatchClause clause);

	R visitReturnStatement(ReturnStatement statement);

	R visitEmptyStatement(EmptyStatement statement);

	// --- Expressions ---
	R visitBinaryOperator(BinaryOperator expression);

	R visitUnaryOperator(UnaryOperator expression);

	R visitCallExpression(CallExpression expression);

	R visitMemberCallExpression(MemberCallExpression expression);

	R visitMemberExpression(MemberExpression expression);

	R visitLiteral(Literal<?> expression);

	R visitCastExpression(CastExpression expression);

	R visitConstructExpression(ConstructExpression expression);

	R visitArraySubscriptionExpression(ArraySubscriptionExpression expression);

	R visitArrayCreationExpression(ArrayCreationExpression expression);

	R visitConditionalExpression(ConditionalExpression expression);

	R visitInitializerListExpression(InitializerListExpression expression);

	R visitDeclaredReferenceExpression(DeclaredReferenceExpression expression);
}
