// File: src/main/java/com/juanpa/cpg/graph/GraphPrinter.java
package com.juanpa.cpg.graph;

import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.graph.statements.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a lowered graph as indented, C-like text. Statements render to whole lines, expressions
 * render inline.
 */
public class GraphPrinter implements GraphVisitor<String>
{
	private static final String INDENT = "    ";
	private int indentLevel = 0;

	public static String print(Node node)
	{
		GraphPrinter printer = new GraphPrinter();
		if (node instanceof Expression)
		{
			return node.accept(printer);
		}
		return printer.statement(node);
	}

	private String indent()
	{
		return INDENT.repeat(Math.max(0, indentLevel));
	}

	private String line(String text)
	{
		return indent() + text + "\n";
	}

	/**
	 * Renders a statement position. Bare expressions get their own line.
	 */
	private String statement(Node node)
	{
		if (node == null)
		{
			return line(";");
		}
		if (node instanceof Expression)
		{
			return line(node.accept(this) + ";");
		}
		return node.accept(this);
	}

	private String nested(Node node)
	{
		indentLevel++;
		try
		{
			return statement(node);
		}
		finally
		{
			indentLevel--;
		}
	}

	private String inline(Expression expression)
	{
		return expression == null ? "<null>" : expression.accept(this);
	}

	private String arguments(List<Expression> arguments)
	{
		return arguments.stream().map(this::inline).collect(Collectors.joining(", "));
	}

	private String variable(VariableDeclaration declaration)
	{
		String text = declaration.getType().getTypeName() + " " + declaration.getName();
		if (declaration.getInitializer() != null)
		{
			text += " = " + inline(declaration.getInitializer());
		}
		return text;
	}

	// --- Declarations ---

	@Override
	public String visitTranslationUnit(TranslationUnitDeclaration declaration)
	{
		StringBuilder sb = new StringBuilder(line("// translation unit " + declaration.getName()));
		for (Declaration child : declaration.getDeclarations())
		{
			sb.append(statement(child));
		}
		return sb.toString();
	}

	@Override
	public String visitNamespaceDeclaration(NamespaceDeclaration declaration)
	{
		StringBuilder sb = new StringBuilder(line("namespace " + declaration.getName() + " {"));
		for (Declaration child : declaration.getDeclarations())
		{
			sb.append(nested(child));
		}
		return sb.append(line("}")).toString();
	}

	@Override
	public String visitRecordDeclaration(RecordDeclaration declaration)
	{
		String bases = declaration.getSuperTypes().isEmpty() ? "" :
				" : " + declaration.getSuperTypes().stream().map(t -> t.getTypeName()).collect(Collectors.joining(", "));
		StringBuilder sb = new StringBuilder(line(declaration.getKind() + " " + declaration.getName() + bases + " {"));
		for (RecordDeclaration record : declaration.getRecords())
		{
			sb.append(nested(record));
		}
		for (FieldDeclaration field : declaration.getFields())
		{
			sb.append(nested(field));
		}
		for (ConstructorDeclaration constructor : declaration.getConstructors())
		{
			sb.append(nested(constructor));
		}
		for (MethodDeclaration method : declaration.getMethods())
		{
			sb.append(nested(method));
		}
		return sb.append(line("};")).toString();
	}

	private String function(FunctionDeclaration declaration, String prefix)
	{
		String parameters = declaration.getParameters().stream()
				.map(p -> p.isVariadic() ? "..." : p.getType().getTypeName() + " " + p.getName())
				.collect(Collectors.joining(", "));
		String header = prefix + declaration.getName() + "(" + parameters + ")";
		if (!declaration.hasBody())
		{
			return line(header + ";");
		}
		return line(header) + statement(declaration.getBody());
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		return function(declaration, declaration.getType().getTypeName() + " ");
	}

	@Override
	public String visitMethodDeclaration(MethodDeclaration declaration)
	{
		return function(declaration, (declaration.isStatic() ? "static " : "") + declaration.getType().getTypeName() + " ");
	}

	@Override
	public String visitConstructorDeclaration(ConstructorDeclaration declaration)
	{
		return function(declaration, declaration.isImplicit() ? "/* implicit */ " : "");
	}

	@Override
	public String visitVariableDeclaration(VariableDeclaration declaration)
	{
		return line(variable(declaration) + ";");
	}

	@Override
	public String visitParameterDeclaration(ParameterDeclaration declaration)
	{
		return line(variable(declaration) + ";");
	}

	@Override
	public String visitFieldDeclaration(FieldDeclaration declaration)
	{
		String modifiers = declaration.getModifiers().isEmpty() ? "" : String.join(" ", declaration.getModifiers()) + " ";
		String text = modifiers + declaration.getType().getTypeName() + " " + declaration.getName();
		if (declaration.getInitializer() != null)
		{
			text += " = " + inline(declaration.getInitializer());
		}
		return line(text + ";");
	}

	// --- Statements ---

	@Override
	public String visitCompoundStatement(CompoundStatement statement)
	{
		StringBuilder sb = new StringBuilder(line("{"));
		for (Statement child : statement.getStatements())
		{
			sb.append(nested(child));
		}
		return sb.append(line("}")).toString();
	}

	@Override
	public String visitDeclarationStatement(DeclarationStatement statement)
	{
		StringBuilder sb = new StringBuilder();
		for (Declaration declaration : statement.getDeclarations())
		{
			sb.append(statement(declaration));
		}
		return sb.toString();
	}

	@Override
	public String visitLabelStatement(LabelStatement statement)
	{
		indentLevel--;
		String label = line(statement.getLabel() + ":");
		indentLevel++;
		return label + (statement.getSubStatement() == null ? "" : statement(statement.getSubStatement()));
	}

	@Override
	public String visitGotoStatement(GotoStatement statement)
	{
		return line("goto " + statement.getLabelName() + ";");
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		StringBuilder sb = new StringBuilder(line("if (" + inline(statement.getCondition()) + ")"));
		sb.append(nested(statement.getThenStatement()));
		if (statement.getElseStatement() != null)
		{
			sb.append(line("else"));
			sb.append(nested(statement.getElseStatement()));
		}
		return sb.toString();
	}

	@Override
	public String visitSwitchStatement(SwitchStatement statement)
	{
		return line("switch (" + inline(statement.getSelector()) + ")") + statement(statement.getStatement());
	}

	@Override
	public String visitCaseStatement(CaseStatement statement)
	{
		return line("case " + inline(statement.getCaseExpression()) + ":");
	}

	@Override
	public String visitDefaultStatement(DefaultStatement statement)
	{
		return line("default:");
	}

	@Override
	public String visitTryStatement(TryStatement statement)
	{
		StringBuilder sb = new StringBuilder(line("try"));
		sb.append(statement(statement.getTryBlock()));
		for (CatchClause clause : statement.getCatchClauses())
		{
			sb.append(statement(clause));
		}
		if (statement.getFinallyBlock() != null)
		{
			sb.append(line("finally")).append(statement(statement.getFinallyBlock()));
		}
		return sb.toString();
	}

	@Override
	public String visitCatchClause(CatchClause clause)
	{
		String parameter = clause.getParameter() == null ? "" :
				clause.getParameter().getType().getTypeName() + " " + clause.getParameter().getName();
		return line("catch (" + parameter + ")") + statement(clause.getBody());
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		return line(statement.getReturnValue() == null ? "return;" : "return " + inline(statement.getReturnValue()) + ";");
	}

	@Override
	public String visitEmptyStatement(EmptyStatement statement)
	{
		return line(statement.getName().isEmpty() ? ";" : "; // " + statement.getName());
	}

	// --- Expressions ---

	@Override
	public String visitBinaryOperator(BinaryOperator expression)
	{
		String text = inline(expression.getLhs()) + " " + expression.getOperatorCode() + " " + inline(expression.getRhs());
		return expression.isAssignment() ? text : "(" + text + ")";
	}

	@Override
	public String visitUnaryOperator(UnaryOperator expression)
	{
		String input = inline(expression.getInput());
		return expression.isPostfix() ? input + expression.getOperatorCode() : expression.getOperatorCode() + input;
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		return expression.getFqn() + "(" + arguments(expression.getArguments()) + ")";
	}

	@Override
	public String visitMemberCallExpression(MemberCallExpression expression)
	{
		return inline(expression.getMember()) + "(" + arguments(expression.getArguments()) + ")";
	}

	@Override
	public String visitMemberExpression(MemberExpression expression)
	{
		return inline(expression.getBase()) + expression.getOperatorCode() + expression.getName();
	}

	@Override
	public String visitLiteral(Literal<?> expression)
	{
		if (!expression.hasValue())
		{
			return "undef";
		}
		if (expression.getValue() instanceof String)
		{
			return "\"" + expression.getValue() + "\"";
		}
		return expression.getValue().toString();
	}

	@Override
	public String visitCastExpression(CastExpression expression)
	{
		return "((" + expression.getCastType().getTypeName() + ") " + inline(expression.getExpression()) + ")";
	}

	@Override
	public String visitConstructExpression(ConstructExpression expression)
	{
		return expression.getType().getTypeName() + "{" + arguments(expression.getArguments()) + "}";
	}

	@Override
	public String visitArraySubscriptionExpression(ArraySubscriptionExpression expression)
	{
		return inline(expression.getArrayExpression()) + "[" + inline(expression.getSubscriptExpression()) + "]";
	}

	@Override
	public String visitArrayCreationExpression(ArrayCreationExpression expression)
	{
		return "new " + expression.getType().getRoot().getTypeName() + "[" + arguments(expression.getDimensions()) + "]";
	}

	@Override
	public String visitConditionalExpression(ConditionalExpression expression)
	{
		return "(" + inline(expression.getCondition()) + " ? " + inline(expression.getThenExpr()) + " : " + inline(expression.getElseExpr()) + ")";
	}

	@Override
	public String visitInitializerListExpression(InitializerListExpression expression)
	{
		return "{" + arguments(expression.getInitializers()) + "}";
	}

	@Override
	public String visitDeclaredReferenceExpression(DeclaredReferenceExpression expression)
	{
		return expression.getName();
	}
}
