package com.juanpa.cpg.graph;

import com.juanpa.cpg.graph.declarations.FunctionDeclaration;
import com.juanpa.cpg.graph.declarations.ParameterDeclaration;
import com.juanpa.cpg.graph.declarations.TranslationUnitDeclaration;
import com.juanpa.cpg.graph.declarations.VariableDeclaration;
import com.juanpa.cpg.graph.expressions.Literal;
import com.juanpa.cpg.graph.statements.CompoundStatement;
import com.juanpa.cpg.graph.statements.EmptyStatement;
import com.juanpa.cpg.graph.statements.LabelStatement;
import com.juanpa.cpg.semantics.PrimitiveType;
import com.juanpa.cpg.semantics.TypeGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GraphPrinterTest
{
	private NodeBuilder builder;

	@BeforeEach
	void setUp()
	{
		builder = new NodeBuilder(new TypeGraph());
	}

	@Test
	void printsFunctionWithIndentedBody()
	{
		FunctionDeclaration function = builder.newFunctionDeclaration("inc", new PrimitiveType("int"), null);
		ParameterDeclaration a = builder.newParameterDeclaration("a", new PrimitiveType("int"), false, null);
		function.addParameter(a);
		CompoundStatement body = builder.newCompoundStatement(null);
		body.addStatement(builder.newReturnStatement(
				builder.newBinaryOperator("+", builder.newReference(a, "a"), builder.newLiteral(1L, new PrimitiveType("int"), "1"), "a + 1"), null));
		function.setBody(body);

		assertEquals("int inc(int a)\n{\n    return (a + 1);\n}\n", GraphPrinter.print(function));
	}

	@Test
	void labelsAreOutdentedAndGotosNameThem()
	{
		CompoundStatement body = builder.newCompoundStatement(null);
		LabelStatement loop = builder.newLabelStatement("loop", null);
		CompoundStatement block = builder.newCompoundStatement(null);
		block.addStatement(builder.newGotoStatement(loop, null));
		loop.setSubStatement(block);
		body.addStatement(loop);

		assertEquals("{\nloop:\n    {\n        goto loop;\n    }\n}\n", GraphPrinter.print(body));
	}

	@Test
	void prototypesAndVariadicParametersPrintOnOneLine()
	{
		FunctionDeclaration printf = builder.newFunctionDeclaration("printf", new PrimitiveType("i32"), null);
		printf.addParameter(builder.newParameterDeclaration("0", new PrimitiveType("ptr"), false, null));
		printf.addParameter(builder.newParameterDeclaration("va_args", null, true, null));
		TranslationUnitDeclaration unit = new TranslationUnitDeclaration("m.ll", null);
		unit.addDeclaration(printf);

		assertEquals("// translation unit m.ll\ni32 printf(ptr 0, ...);\n", GraphPrinter.print(unit));
	}

	@Test
	void literalsWithoutValueAreUndefined()
	{
		Literal<Object> undef = builder.newLiteral(null, new PrimitiveType("i32"), "undef");
		Literal<String> text = builder.newLiteral("hi", new PrimitiveType("char*"), "\"hi\"");

		assertEquals("undef", GraphPrinter.print(undef));
		assertEquals("\"hi\"", GraphPrinter.print(text));
	}

	@Test
	void namedEmptyStatementsKeepTheirNameAsComment()
	{
		EmptyStatement resume = new EmptyStatement("resume { ptr, i32 } %lp");
		resume.setName("resume");
		VariableDeclaration x = builder.newVariableDeclaration("x", new PrimitiveType("i64"), null, false);
		builder.initialize(x, builder.newLiteral(3L, new PrimitiveType("i64"), "3"));

		assertEquals("; // resume\n", GraphPrinter.print(resume));
		assertEquals("i64 x = 3;\n", GraphPrinter.print(x));
	}
}
