// File: src/main/java/com/juanpa/cpg/frontend/cxx/DeclaratorHandler.java
package com.juanpa.cpg.frontend.cxx;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.cxx.ast.*;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.Expression;
import com.juanpa.cpg.semantics.FunctionPointerType;
import com.juanpa.cpg.semantics.ScopeKind;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.UnknownType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lowers declarators and record definitions into declarations.
 * Declarator types stay unknown here; the enclosing declaration applies the specifier type.
 */
public class DeclaratorHandler extends Handler<Declaration, CxxNode, CxxFrontend>
{
	private static final Pattern FUNCTION_POINTER_NAME = Pattern.compile("\\((\\*|.+\\*)(?<name>[^)]*)");

	public DeclaratorHandler(CxxFrontend lang)
	{
		super(() -> null, lang);
		map.put(Declarator.class, ctx -> handleDeclarator((Declarator) ctx));
		map.put(ArrayDeclarator.class, ctx -> handleDeclarator((Declarator) ctx));
		map.put(FunctionDeclarator.class, ctx -> handleFunctionDeclarator((FunctionDeclarator) ctx));
		map.put(CompositeTypeSpecifier.class, ctx -> handleCompositeTypeSpecifier((CompositeTypeSpecifier) ctx));
	}

	/**
	 * @return The type adjustment a declarator adds to its specifier, e.g. {@code *} or {@code []}.
	 */
	public static String adjustmentOf(Declarator declarator)
	{
		String adjustment = declarator.getPointerOperators();
		if (declarator instanceof ArrayDeclarator)
		{
			adjustment += "[]";
		}
		return adjustment;
	}

	/**
	 * A plain declarator is a variable, unless its name is qualified, then it is a field.
	 */
	private ValueDeclaration handleDeclarator(Declarator ctx)
	{
		String name = ctx.getName();
		String code = ctx.getRawSignature();
		Expression initializer = ctx.getInitializer() == null ? null : lang.getExpressionHandler().handle(ctx.getInitializer());

		ValueDeclaration declaration;
		if (name.contains(lang.getNamespaceDelimiter()))
		{
			FieldDeclaration field = lang.getBuilder().newFieldDeclaration(name, UnknownType.getUnknownType(), new ArrayList<>(), code);
			lang.getBuilder().initialize(field, initializer);
			declaration = field;
		}
		else
		{
			VariableDeclaration variable = lang.getBuilder().newVariableDeclaration(name, UnknownType.getUnknownType(), code, false);
			lang.getBuilder().initialize(variable, initializer);
			declaration = variable;
		}

		lang.getScopeManager().addDeclaration(declaration);
		return declaration;
	}

	/**
	 * Lowers a function declarator into a function, or into a method if its name is qualified
	 * with a record ({@code Record::method}). Parameters are declared in the function's own scope,
	 * followed by a synthetic {@code va_args} parameter for variadic functions.
	 */
	private ValueDeclaration handleFunctionDeclarator(FunctionDeclarator ctx)
	{
		// without a name this declares a function pointer, not a function
		String name = ctx.getName();
		if (name.isEmpty())
		{
			return handleFunctionPointer(ctx);
		}

		String code = ctx.getRawSignature();
		String delimiter = lang.getNamespaceDelimiter();
		FunctionDeclaration declaration;
		int split = name.lastIndexOf(delimiter);
		if (split >= 0)
		{
			String recordName = name.substring(0, split);
			String methodName = name.substring(split + delimiter.length());
			RecordDeclaration record = lang.findRecord(recordName);
			if (record == null)
			{
				lang.getErrorReporter().warning("Method " + methodName + " belongs to unknown record " + recordName, code);
			}
			declaration = lang.getBuilder().newMethodDeclaration(methodName, code, false, record);
		}
		else
		{
			declaration = lang.getBuilder().newFunctionDeclaration(name, UnknownType.getUnknownType(), code);
		}

		lang.getScopeManager().enterScope(declaration);
		int i = 0;
		for (ParameterDecl param : ctx.getParameters())
		{
			ParameterDeclaration argument = handleParameter(param);
			argument.setArgumentIndex(i);
			// adding it to the function scope also makes it a parameter of the function
			lang.getScopeManager().addDeclaration(argument);
			i++;
		}

		if (ctx.takesVarArgs())
		{
			ParameterDeclaration varargs = lang.getBuilder().newParameterDeclaration("va_args", UnknownType.getUnknownType(), true, "");
			varargs.setArgumentIndex(i);
			lang.getScopeManager().addDeclaration(varargs);
		}
		lang.getScopeManager().leaveScope(declaration);
		return declaration;
	}

	private ParameterDeclaration handleParameter(ParameterDecl param)
	{
		Declarator declarator = param.getDeclarator();
		String name = declarator == null ? "" : declarator.getName();
		String adjustment = declarator == null ? "" : adjustmentOf(declarator);
		Type type = lang.typeOf(lang.typeNameOf(param.getSpecifier()), adjustment);
		return lang.getBuilder().newParameterDeclaration(name, type, false, param.getRawSignature());
	}

	/**
	 * A function pointer is a local variable inside a function, a field inside a record and a
	 * global variable otherwise. Its return type is filled in with the specifier type later.
	 */
	private ValueDeclaration handleFunctionPointer(FunctionDeclarator ctx)
	{
		String code = ctx.getRawSignature();
		Expression initializer = ctx.getInitializer() == null ? null : lang.getExpressionHandler().handle(ctx.getInitializer());
		List<Type> parameterTypes = ctx.getParameters().stream()
				.map(param -> lang.typeOf(lang.typeNameOf(param.getSpecifier()),
						param.getDeclarator() == null ? "" : adjustmentOf(param.getDeclarator())))
				.collect(Collectors.toList());
		Type type = new FunctionPointerType(UnknownType.getUnknownType(), parameterTypes);

		String name = ctx.getNestedDeclarator() == null ? "" : ctx.getNestedDeclarator().getName();
		if (name.isEmpty() && code != null)
		{
			Matcher matcher = FUNCTION_POINTER_NAME.matcher(code);
			if (matcher.find())
			{
				name = matcher.group("name").strip();
			}
		}

		boolean inFunction = lang.getScopeManager().getCurrentFunction() != null;
		boolean inRecord = lang.getScopeManager().getFirstScopeThat(scope -> scope.getKind() == ScopeKind.RECORD) != null;
		ValueDeclaration result;
		if (!inFunction && inRecord)
		{
			FieldDeclaration field = lang.getBuilder().newFieldDeclaration(name, type, Collections.emptyList(), code);
			lang.getBuilder().initialize(field, initializer);
			result = field;
		}
		else
		{
			VariableDeclaration variable = lang.getBuilder().newVariableDeclaration(name, type, code, false);
			lang.getBuilder().initialize(variable, initializer);
			result = variable;
		}
		lang.getScopeManager().addDeclaration(result);
		return result;
	}

	/**
	 * Lowers a struct, union or class definition. Classes get an implicit {@code this} field,
	 * member functions become methods (or constructors, if named like the record), member
	 * variables become fields, and a default constructor is synthesized if none was declared.
	 */
	private RecordDeclaration handleCompositeTypeSpecifier(CompositeTypeSpecifier ctx)
	{
		String kind = ctx.getKey().name().toLowerCase();
		String prefix = lang.getScopeManager().getCurrentNamePrefixWithDelimiter();
		String className = prefix + ctx.getName();

		List<Type> superTypes = new ArrayList<>();
		for (String base : ctx.getBaseSpecifiers())
		{
			RecordDeclaration baseRecord = lang.findRecord(base);
			String qualified = baseRecord != null ? baseRecord.getName() : prefix + base;
			superTypes.add(lang.typeOf(qualified, ""));
		}

		RecordDeclaration recordDeclaration = lang.getBuilder().newRecordDeclaration(className, kind, superTypes, ctx.getRawSignature());
		lang.addRecord(recordDeclaration);
		lang.getScopeManager().enterScope(recordDeclaration);

		if (ctx.getKey() == CompositeTypeSpecifier.Key.CLASS)
		{
			FieldDeclaration thisDeclaration = lang.getBuilder().newFieldDeclaration("this",
					lang.typeOf(className, ""), new ArrayList<>(), "this");
			lang.getScopeManager().addDeclaration(thisDeclaration);
		}

		for (CxxDeclaration member : ctx.getMembers())
		{
			if (member instanceof VisibilityLabel)
			{
				continue;
			}
			for (Declaration declaration : lang.getDeclarationHandler().lowerAll(member))
			{
				addMember(recordDeclaration, ctx.getName(), declaration);
			}
		}

		if (recordDeclaration.getConstructors().isEmpty())
		{
			ConstructorDeclaration constructorDeclaration = lang.getBuilder().newConstructorDeclaration(
					recordDeclaration.getName(), recordDeclaration.getName(), recordDeclaration, true);
			lang.getBuilder().setType(constructorDeclaration, lang.typeOf(className, ""));
			lang.getScopeManager().addDeclaration(constructorDeclaration);
		}

		lang.getScopeManager().leaveScope(recordDeclaration);
		return recordDeclaration;
	}

	private void addMember(RecordDeclaration record, String simpleName, Declaration declaration)
	{
		if (declaration instanceof FunctionDeclaration)
		{
			lang.getScopeManager().removeDeclaration(declaration);
			MethodDeclaration method = MethodDeclaration.from((FunctionDeclaration) declaration, record);
			if (declaration.getName().equals(simpleName))
			{
				ConstructorDeclaration constructor = ConstructorDeclaration.from(method);
				lang.getBuilder().setType(constructor, lang.typeOf(record.getName(), ""));
				lang.getScopeManager().addDeclaration(constructor);
			}
			else
			{
				lang.getTypeGraph().register(method);
				lang.getScopeManager().addDeclaration(method);
			}
		}
		else if (declaration instanceof VariableDeclaration)
		{
			lang.getScopeManager().removeDeclaration(declaration);
			FieldDeclaration field = FieldDeclaration.from((VariableDeclaration) declaration);
			lang.getTypeGraph().register(field);
			lang.getScopeManager().addDeclaration(field);
		}
		// fields and nested records were added to the record scope while lowering the member
	}
}
