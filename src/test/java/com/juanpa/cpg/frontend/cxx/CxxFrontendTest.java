package com.juanpa.cpg.frontend.cxx;

import com.juanpa.cpg.frontend.cxx.ast.*;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.Literal;
import com.juanpa.cpg.graph.expressions.MemberCallExpression;
import com.juanpa.cpg.graph.statements.CompoundStatement;
import com.juanpa.cpg.graph.statements.ReturnStatement;
import com.juanpa.cpg.semantics.FunctionPointerType;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CxxFrontendTest
{
	private ErrorReporter reporter;
	private CxxFrontend frontend;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter();
		reporter.setEcho(false);
		frontend = new CxxFrontend(LoweringConfig.defaults(), reporter);
	}

	@Test
	void classGetsThisFieldAndImplicitConstructor()
	{
		// class A { int x; };
		SimpleDeclaration classA = record(CompositeTypeSpecifier.Key.CLASS, "A",
				variable("int", "x", ""));

		RecordDeclaration a = translate(classA).getRecord("A");

		assertEquals("class", a.getKind());
		assertEquals(2, a.getFields().size());
		FieldDeclaration self = a.getFields().get(0);
		assertEquals("this", self.getName());
		assertSame(a, ((ObjectType) self.getType()).getRecordDeclaration());
		assertEquals("x", a.getFields().get(1).getName());
		assertEquals("int", a.getFields().get(1).getType().getTypeName());

		assertEquals(1, a.getConstructors().size());
		ConstructorDeclaration constructor = a.getConstructors().get(0);
		assertTrue(constructor.isImplicit());
		assertEquals("A", constructor.getType().getTypeName());
	}

	@Test
	void memberFunctionsBecomeMethodsOrConstructors()
	{
		// struct B { B(int v); void run(); };
		SimpleDeclaration structB = record(CompositeTypeSpecifier.Key.STRUCT, "B",
				prototype("", "B", List.of(parameter("int", "v"))),
				prototype("void", "run", List.of()));

		RecordDeclaration b = translate(structB).getRecord("B");

		assertTrue(b.getFields().isEmpty());
		assertEquals(1, b.getConstructors().size());
		ConstructorDeclaration constructor = b.getConstructors().get(0);
		assertFalse(constructor.isImplicit());
		assertEquals(1, constructor.getParameters().size());
		assertEquals("B", constructor.getType().getTypeName());

		assertEquals(1, b.getMethods().size());
		MethodDeclaration run = b.getMethods().get(0);
		assertEquals("run", run.getName());
		assertEquals("void", run.getType().getTypeName());
		assertSame(b, run.getRecordDeclaration());
	}

	@Test
	void qualifiedFunctionDefinitionBecomesMethodOfItsRecord()
	{
		// struct C {}; int C::get() { return 1; }
		SimpleDeclaration structC = record(CompositeTypeSpecifier.Key.STRUCT, "C");
		FunctionDefinition get = new FunctionDefinition("int C::get() { return 1; }", new NamedTypeSpecifier("int"),
				function("C::get", List.of(), false),
				new CompoundStmt("{ return 1; }", List.of(new ReturnStmt("return 1;", new LiteralExpr("1", 1L, "int")))));

		TranslationUnitDeclaration unit = translate(structC, get);

		MethodDeclaration method = (MethodDeclaration) unit.getFunction("get");
		assertSame(unit.getRecord("C"), method.getRecordDeclaration());
		assertEquals("int", method.getType().getTypeName());
		ReturnStatement ret = (ReturnStatement) ((CompoundStatement) method.getBody()).getStatements().get(0);
		assertEquals(1L, ((Literal<?>) ret.getReturnValue()).getValue());
	}

	@Test
	void methodOfUnknownRecordIsReported()
	{
		FunctionDefinition orphan = new FunctionDefinition("void Missing::run() {}", new NamedTypeSpecifier("void"),
				function("Missing::run", List.of(), false), new CompoundStmt("{}", List.of()));

		MethodDeclaration method = (MethodDeclaration) translate(orphan).getFunction("run");

		assertNull(method.getRecordDeclaration());
		assertFalse(reporter.getDiagnostics().isEmpty());
	}

	@Test
	void functionPointerIsFieldInRecordAndVariableAtTopLevel()
	{
		// struct H { void (*callback)(int); }; void (*handler)(int);
		SimpleDeclaration structH = record(CompositeTypeSpecifier.Key.STRUCT, "H",
				new SimpleDeclaration("void (*callback)(int);", new NamedTypeSpecifier("void"),
						List.of(functionPointer("(*callback)(int)", new Declarator("*callback", "callback", "*", null)))));
		SimpleDeclaration handler = new SimpleDeclaration("void (*handler)(int);", new NamedTypeSpecifier("void"),
				List.of(functionPointer("(*handler)(int)", null)));

		TranslationUnitDeclaration unit = translate(structH, handler);

		FieldDeclaration callback = unit.getRecord("H").getField("callback");
		assertNotNull(callback);
		FunctionPointerType callbackType = (FunctionPointerType) callback.getType();
		assertEquals("void", callbackType.getReturnType().getTypeName());
		assertEquals("int", callbackType.getParameters().get(0).getTypeName());

		VariableDeclaration global = unit.getDeclarationsByType(VariableDeclaration.class).get(0);
		assertEquals("handler", global.getName());
		assertInstanceOf(FunctionPointerType.class, global.getType());
	}

	@Test
	void namespacesPrefixRecordNames()
	{
		// namespace ns { struct P {}; P origin; }
		NamespaceDefinition ns = new NamespaceDefinition("namespace ns { ... }", "ns", List.of(
				record(CompositeTypeSpecifier.Key.STRUCT, "P"),
				variable("P", "origin", "")));

		TranslationUnitDeclaration unit = translate(ns);

		NamespaceDeclaration namespace = (NamespaceDeclaration) unit.getDeclarations().get(0);
		assertEquals("ns", namespace.getName());
		RecordDeclaration p = (RecordDeclaration) namespace.getDeclarations().get(0);
		assertEquals("ns::P", p.getName());
		VariableDeclaration origin = (VariableDeclaration) namespace.getDeclarations().get(1);
		assertSame(p, ((ObjectType) origin.getType()).getRecordDeclaration());
	}

	@Test
	void recordDeclaredLaterIsBoundToEarlierUses()
	{
		// Widget *w; class Widget {};
		SimpleDeclaration w = variable("Widget", "w", "*");
		SimpleDeclaration widget = record(CompositeTypeSpecifier.Key.CLASS, "Widget");

		TranslationUnitDeclaration unit = translate(w, widget);

		VariableDeclaration variable = unit.getDeclarationsByType(VariableDeclaration.class).get(0);
		ObjectType type = (ObjectType) variable.getType();
		assertEquals("Widget*", type.getTypeName());
		assertSame(unit.getRecord("Widget"), type.getRecordDeclaration());
	}

	@Test
	void memberCallsResolveTheirMethod()
	{
		// struct S { int size(); }; int main() { S s; return s.size(); }
		SimpleDeclaration structS = record(CompositeTypeSpecifier.Key.STRUCT, "S", prototype("int", "size", List.of()));
		FunctionCallExpr call = new FunctionCallExpr("s.size()",
				new FieldReference("s.size", new IdExpression("s"), "size", false), List.of());
		FunctionDefinition main = new FunctionDefinition("int main() { ... }", new NamedTypeSpecifier("int"),
				function("main", List.of(), false),
				new CompoundStmt("{ ... }", List.of(
						new DeclarationStmt("S s;", variable("S", "s", "")),
						new ReturnStmt("return s.size();", call))));

		TranslationUnitDeclaration unit = translate(structS, main);

		CompoundStatement body = (CompoundStatement) unit.getFunction("main").getBody();
		MemberCallExpression lowered = (MemberCallExpression) ((ReturnStatement) body.getStatements().get(1)).getReturnValue();
		assertEquals("S.size", lowered.getFqn());
		assertSame(unit.getRecord("S").getMethods().get(0), lowered.getInvokes().get(0));
		assertEquals("int", lowered.getType().getTypeName());
	}

	@Test
	void variadicPrototypeGetsVaArgsParameter()
	{
		// int printf(const char *fmt, ...);
		SimpleDeclaration printf = new SimpleDeclaration("int printf(const char *fmt, ...);", new NamedTypeSpecifier("int"),
				List.of(function("printf", List.of(new ParameterDecl("const char *fmt", new NamedTypeSpecifier("const char"),
						new Declarator("*fmt", "fmt", "*", null))), true)));

		FunctionDeclaration declaration = translate(printf).getFunction("printf");

		assertEquals(2, declaration.getParameters().size());
		assertEquals("char*", declaration.getParameters().get(0).getType().getTypeName());
		assertTrue(declaration.getParameters().get(1).isVariadic());
		assertEquals(1, declaration.getParameters().get(1).getArgumentIndex());
	}

	private TranslationUnitDeclaration translate(CxxDeclaration... declarations)
	{
		return frontend.translate(new CxxTranslationUnit("test.cpp", List.of(declarations)));
	}

	private static SimpleDeclaration record(CompositeTypeSpecifier.Key key, String name, CxxDeclaration... members)
	{
		CompositeTypeSpecifier specifier = new CompositeTypeSpecifier(key.name().toLowerCase() + " " + name + " { ... }",
				key, name, List.of(), List.of(members));
		return new SimpleDeclaration(specifier.getRawSignature() + ";", specifier, List.of());
	}

	private static SimpleDeclaration variable(String typeName, String name, String pointerOperators)
	{
		return new SimpleDeclaration(typeName + " " + pointerOperators + name + ";", new NamedTypeSpecifier(typeName),
				List.of(new Declarator(pointerOperators + name, name, pointerOperators, null)));
	}

	private static SimpleDeclaration prototype(String returnType, String name, List<ParameterDecl> parameters)
	{
		return new SimpleDeclaration(returnType + " " + name + "(...);", new NamedTypeSpecifier(returnType),
				List.of(function(name, parameters, false)));
	}

	private static FunctionDeclarator function(String name, List<ParameterDecl> parameters, boolean varArgs)
	{
		return new FunctionDeclarator(name + "(...)", name, "", parameters, varArgs, null, null);
	}

	private static FunctionDeclarator functionPointer(String raw, Declarator nested)
	{
		return new FunctionDeclarator(raw, "", "", List.of(new ParameterDecl("int", new NamedTypeSpecifier("int"), null)),
				false, nested, null);
	}

	private static ParameterDecl parameter(String typeName, String name)
	{
		return new ParameterDecl(typeName + " " + name, new NamedTypeSpecifier(typeName), new Declarator(name, name, "", null));
	}
}
