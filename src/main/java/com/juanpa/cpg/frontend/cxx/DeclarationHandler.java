// File: src/main/java/com/juanpa/cpg/frontend/cxx/DeclarationHandler.java
package com.juanpa.cpg.frontend.cxx;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.cxx.ast.*;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.statements.Statement;
import com.juanpa.cpg.semantics.FunctionPointerType;
import com.juanpa.cpg.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers top level and member declarations: simple declarations, function definitions and
 * namespace definitions.
 */
public class DeclarationHandler extends Handler<Declaration, CxxDeclaration, CxxFrontend>
{
	public DeclarationHandler(CxxFrontend lang)
	{
		super(() -> null, lang);
		map.put(SimpleDeclaration.class, ctx -> firstOf(handleSimpleDeclaration((SimpleDeclaration) ctx)));
		map.put(FunctionDefinition.class, ctx -> handleFunctionDefinition((FunctionDefinition) ctx));
		map.put(NamespaceDefinition.class, ctx -> handleNamespaceDefinition((NamespaceDefinition) ctx));
		map.put(VisibilityLabel.class, ctx -> null);
	}

	private static Declaration firstOf(List<Declaration> declarations)
	{
		return declarations.isEmpty() ? null : declarations.get(0);
	}

	/**
	 * Lowers a declaration into every declaration it introduces. A simple declaration may
	 * introduce several, e.g. {@code struct S {} s, *p;} yields the record and two variables.
	 */
	public List<Declaration> lowerAll(CxxDeclaration declaration)
	{
		if (declaration instanceof SimpleDeclaration)
		{
			return handleSimpleDeclaration((SimpleDeclaration) declaration);
		}
		Declaration result = handle(declaration);
		return result == null ? Collections.emptyList() : Collections.singletonList(result);
	}

	/**
	 * Lowers the specifier (if it defines a record) and every declarator, then applies the
	 * specifier type to each declared entity.
	 */
	public List<Declaration> handleSimpleDeclaration(SimpleDeclaration ctx)
	{
		Debug.log("Lowering declaration %s", ctx.getRawSignature());
		List<Declaration> result = new ArrayList<>();
		String typeName = lang.typeNameOf(ctx.getSpecifier());

		if (ctx.getSpecifier() instanceof CompositeTypeSpecifier)
		{
			Declaration record = lang.getDeclaratorHandler().handle(ctx.getSpecifier());
			lang.getScopeManager().addDeclaration(record);
			result.add(record);
		}

		for (Declarator declarator : ctx.getDeclarators())
		{
			Declaration declaration = lang.getDeclaratorHandler().handle(declarator);
			if (declaration == null)
			{
				continue;
			}
			if (declaration instanceof ValueDeclaration)
			{
				applySpecifierType((ValueDeclaration) declaration, typeName, declarator);
			}
			if (declaration instanceof FunctionDeclaration)
			{
				// a prototype, only its definition has a body
				lang.getScopeManager().addDeclaration(declaration);
			}
			result.add(declaration);
		}
		return result;
	}

	private void applySpecifierType(ValueDeclaration declaration, String typeName, Declarator declarator)
	{
		if (declaration.getType() instanceof FunctionPointerType)
		{
			FunctionPointerType pointer = (FunctionPointerType) declaration.getType();
			lang.getBuilder().setType(declaration, new FunctionPointerType(lang.typeOf(typeName, ""), pointer.getParameters()));
		}
		else if (declaration instanceof FunctionDeclaration)
		{
			lang.getBuilder().setType(declaration, lang.typeOf(typeName, declarator.getPointerOperators()));
		}
		else
		{
			lang.getBuilder().setType(declaration, lang.typeOf(typeName, DeclaratorHandler.adjustmentOf(declarator)));
		}
	}

	/**
	 * Lowers the declarator of a definition into a function or method, then lowers its body
	 * inside the function scope, with the parameters visible by name.
	 */
	private Declaration handleFunctionDefinition(FunctionDefinition ctx)
	{
		Declaration declared = lang.getDeclaratorHandler().handle(ctx.getDeclarator());
		if (!(declared instanceof FunctionDeclaration))
		{
			lang.getErrorReporter().error("Function definition without function declarator", ctx.getRawSignature());
			return declared;
		}

		FunctionDeclaration function = (FunctionDeclaration) declared;
		function.setCode(ctx.getRawSignature());
		lang.getBuilder().setType(function, lang.typeOf(lang.typeNameOf(ctx.getSpecifier()), ctx.getDeclarator().getPointerOperators()));
		lang.getScopeManager().addDeclaration(function);

		lang.getScopeManager().enterScope(function);
		for (ParameterDeclaration parameter : function.getParameters())
		{
			lang.getScopeManager().addDeclaration(parameter);
		}
		if (ctx.getBody() != null)
		{
			Statement body = lang.getStatementHandler().handle(ctx.getBody());
			function.setBody(body);
		}
		lang.getScopeManager().leaveScope(function);
		return function;
	}

	/**
	 * A namespace opens a scope whose name prefixes every record declared inside it.
	 */
	private Declaration handleNamespaceDefinition(NamespaceDefinition ctx)
	{
		String name = lang.getScopeManager().getCurrentNamePrefixWithDelimiter() + ctx.getName();
		NamespaceDeclaration namespace = lang.getBuilder().newNamespaceDeclaration(name, ctx.getRawSignature());
		lang.getScopeManager().addDeclaration(namespace);

		lang.getScopeManager().enterScope(namespace);
		for (CxxDeclaration declaration : ctx.getDeclarations())
		{
			lowerAll(declaration);
		}
		lang.getScopeManager().leaveScope(namespace);
		return namespace;
	}
}
