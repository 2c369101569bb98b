// File: src/main/java/com/juanpa/cpg/graph/NodeBuilder.java
package com.juanpa.cpg.graph;

import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.graph.statements.*;
import com.juanpa.cpg.semantics.PrimitiveType;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.TypeGraph;

import java.util.List;

/**
 * Creates graph nodes for one translation unit and wires up the type dependencies between them.
 * Node constructors themselves never touch scopes, bindings or the type graph.
 */
public class NodeBuilder
{
	private final TypeGraph typeGraph;

	public NodeBuilder(TypeGraph typeGraph)
	{
		this.typeGraph = typeGraph;
	}

	public TypeGraph getTypeGraph()
	{
		return typeGraph;
	}

	private <T extends HasType> T typed(T node, Type type)
	{
		typeGraph.register(node);
		if (type != null)
		{
			typeGraph.setType(node, type);
		}
		return node;
	}

	// --- Declarations ---

	public VariableDeclaration newVariableDeclaration(String name, Type type, String code, boolean inferType)
	{
		VariableDeclaration variable = new VariableDeclaration(name, code);
		variable.setInferTypeFromInitializer(inferType);
		return typed(variable, type);
	}

	public ParameterDeclaration newParameterDeclaration(String name, Type type, boolean variadic, String code)
	{
		return typed(new ParameterDeclaration(name, variadic, code), type);
	}

	public FieldDeclaration newFieldDeclaration(String name, Type type, List<String> modifiers, String code)
	{
		return typed(new FieldDeclaration(name, modifiers, code), type);
	}

	public FunctionDeclaration newFunctionDeclaration(String name, Type returnType, String code)
	{
		return typed(new FunctionDeclaration(name, code), returnType);
	}

	public MethodDeclaration newMethodDeclaration(String name, String code, boolean isStatic, RecordDeclaration record)
	{
		return typed(new MethodDeclaration(name, code, isStatic, record), null);
	}

	public ConstructorDeclaration newConstructorDeclaration(String name, String code, RecordDeclaration record, boolean implicit)
	{
		return typed(new ConstructorDeclaration(name, code, record, implicit), null);
	}

	public RecordDeclaration newRecordDeclaration(String name, String kind, List<Type> superTypes, String code)
	{
		return new RecordDeclaration(name, kind, superTypes, code);
	}

	public NamespaceDeclaration newNamespaceDeclaration(String name, String code)
	{
		return new NamespaceDeclaration(name, code);
	}

	/**
	 * Sets the initializer of a variable and lets the variable observe the initializer's type.
	 */
	public void initialize(VariableDeclaration variable, Expression initializer)
	{
		variable.setInitializer(initializer);
		if (initializer != null)
		{
			typeGraph.addTypeObserver(initializer, variable);
		}
	}

	public void initialize(FieldDeclaration field, Expression initializer)
	{
		field.setInitializer(initializer);
	}

	// --- Statements ---

	public DeclarationStatement newDeclarationStatement(Declaration declaration, String code)
	{
		DeclarationStatement statement = new DeclarationStatement(code);
		statement.setSingleDeclaration(declaration);
		return statement;
	}

	public CompoundStatement newCompoundStatement(String code)
	{
		return new CompoundStatement(code);
	}

	public LabelStatement newLabelStatement(String label, String code)
	{
		return new LabelStatement(label, code);
	}

	public GotoStatement newGotoStatement(LabelStatement target, String code)
	{
		GotoStatement statement = new GotoStatement(code);
		statement.setTargetLabel(target);
		return statement;
	}

	public IfStatement newIfStatement(Expression condition, Statement thenStatement, Statement elseStatement, String code)
	{
		IfStatement statement = new IfStatement(code);
		statement.setCondition(condition);
		statement.setThenStatement(thenStatement);
		statement.setElseStatement(elseStatement);
		return statement;
	}

	public SwitchStatement newSwitchStatement(Expression selector, CompoundStatement body, String code)
	{
		SwitchStatement statement = new SwitchStatement(code);
		statement.setSelector(selector);
		statement.setStatement(body);
		return statement;
	}

	public CaseStatement newCaseStatement(Expression caseExpression, String code)
	{
		CaseStatement statement = new CaseStatement(code);
		statement.setCaseExpression(caseExpression);
		return statement;
	}

	public DefaultStatement newDefaultStatement(String code)
	{
		return new DefaultStatement(code);
	}

	public TryStatement newTryStatement(String code)
	{
		return new TryStatement(code);
	}

	public CatchClause newCatchClause(String code)
	{
		return new CatchClause(code);
	}

	public ReturnStatement newReturnStatement(Expression value, String code)
	{
		ReturnStatement statement = new ReturnStatement(code);
		statement.setReturnValue(value);
		return statement;
	}

	public EmptyStatement newEmptyStatement(String code)
	{
		return new EmptyStatement(code);
	}

	// --- Expressions ---

	/**
	 * Creates a binary operator. Comparisons and logical operators are boolean; every other
	 * operator, including assignment, takes the type of its left-hand side.
	 */
	public BinaryOperator newBinaryOperator(String operatorCode, Expression lhs, Expression rhs, String code)
	{
		BinaryOperator operator = typed(new BinaryOperator(operatorCode, code), null);
		operator.setLhs(lhs);
		operator.setRhs(rhs);
		if (operator.isComparisonOrLogical())
		{
			typeGraph.setType(operator, new PrimitiveType("bool"));
		}
		else if (lhs != null)
		{
			typeGraph.addTypeObserver(lhs, operator);
		}
		return operator;
	}

	public UnaryOperator newUnaryOperator(String operatorCode, boolean postfix, boolean prefix, Expression input, String code)
	{
		UnaryOperator operator = typed(new UnaryOperator(operatorCode, postfix, prefix, code), null);
		operator.setInput(input);
		if (operatorCode.equals("!"))
		{
			typeGraph.setType(operator, new PrimitiveType("bool"));
		}
		else if (input != null)
		{
			typeGraph.addTypeObserver(input, operator);
		}
		return operator;
	}

	public CallExpression newCallExpression(String name, String fqn, Type type, String code)
	{
		return typed(new CallExpression(name, fqn, code), type);
	}

	/**
	 * Creates a member call whose FQN follows the type of the member's base.
	 */
	public MemberCallExpression newMemberCallExpression(MemberExpression member, Type type, String code)
	{
		MemberCallExpression call = typed(new MemberCallExpression(member.getName(), member.getName(), code), type);
		call.setMember(member);
		if (member.getBase() != null)
		{
			typeGraph.addTypeObserver(member.getBase(), call);
		}
		return call;
	}

	public MemberExpression newMemberExpression(Expression base, String memberName, String operatorCode, String code)
	{
		MemberExpression member = typed(new MemberExpression(memberName, operatorCode, code), null);
		member.setBase(base);
		if (base != null)
		{
			typeGraph.addTypeObserver(base, member);
			member.setRefersTo(member.resolveField());
		}
		return member;
	}

	public <T> Literal<T> newLiteral(T value, Type type, String code)
	{
		return typed(new Literal<>(value, code), type);
	}

	public CastExpression newCastExpression(Type castType, Expression expression, String code)
	{
		CastExpression cast = typed(new CastExpression(code), null);
		cast.setExpression(expression);
		cast.setCastType(castType);
		typeGraph.setType(cast, castType);
		return cast;
	}

	public ConstructExpression newConstructExpression(Type type, RecordDeclaration instantiates, String code)
	{
		ConstructExpression construct = typed(new ConstructExpression(code), type);
		construct.setInstantiates(instantiates);
		return construct;
	}

	public ArraySubscriptionExpression newArraySubscriptionExpression(Expression array, Expression subscript, String code)
	{
		ArraySubscriptionExpression expression = typed(new ArraySubscriptionExpression(code), null);
		expression.setArrayExpression(array);
		expression.setSubscriptExpression(subscript);
		typeGraph.addTypeObserver(array, expression);
		return expression;
	}

	public ArrayCreationExpression newArrayCreationExpression(Type type, String code)
	{
		return typed(new ArrayCreationExpression(code), type);
	}

	public ConditionalExpression newConditionalExpression(Expression condition, Expression thenExpr, Expression elseExpr, Type type, String code)
	{
		ConditionalExpression expression = typed(new ConditionalExpression(code), type);
		expression.setCondition(condition);
		expression.setThenExpr(thenExpr);
		expression.setElseExpr(elseExpr);
		if (type == null && thenExpr != null)
		{
			typeGraph.addTypeObserver(thenExpr, expression);
		}
		return expression;
	}

	public InitializerListExpression newInitializerListExpression(Type type, String code)
	{
		return typed(new InitializerListExpression(code), type);
	}

	/**
	 * Creates a reference to a name that may not be resolved yet.
	 */
	public DeclaredReferenceExpression newDeclaredReferenceExpression(String name, Type type, String code)
	{
		return typed(new DeclaredReferenceExpression(name, code), type);
	}

	/**
	 * Creates a reference to a known declaration. The reference observes the declaration's type.
	 */
	public DeclaredReferenceExpression newReference(Declaration declaration, String code)
	{
		DeclaredReferenceExpression reference = typed(new DeclaredReferenceExpression(declaration.getName(), code), null);
		reference.setRefersTo(declaration);
		if (declaration instanceof HasType)
		{
			typeGraph.addTypeObserver((HasType) declaration, reference);
		}
		return reference;
	}

	public void setType(HasType node, Type type)
	{
		typeGraph.setType(node, type);
	}
}
