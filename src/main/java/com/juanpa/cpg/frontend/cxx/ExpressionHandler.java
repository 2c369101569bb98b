// File: src/main/java/com/juanpa/cpg/frontend/cxx/ExpressionHandler.java
package com.juanpa.cpg.frontend.cxx;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.cxx.ast.*;
import com.juanpa.cpg.graph.declarations.Declaration;
import com.juanpa.cpg.graph.declarations.FunctionDeclaration;
import com.juanpa.cpg.graph.declarations.MethodDeclaration;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;
import com.juanpa.cpg.graph.declarations.ValueDeclaration;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.semantics.FunctionPointerType;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.TypeParser;
import com.juanpa.cpg.semantics.UnknownType;
import com.juanpa.cpg.util.Debug;

public class ExpressionHandler extends Handler<Expression, CxxExpression, CxxFrontend>
{
	public ExpressionHandler(CxxFrontend lang)
	{
		super(() -> new Literal<>(null, null), lang);
		map.put(IdExpression.class, ctx -> handleIdExpression((IdExpression) ctx));
		map.put(LiteralExpr.class, ctx -> handleLiteral((LiteralExpr) ctx));
		map.put(BinaryExpr.class, ctx -> handleBinaryExpression((BinaryExpr) ctx));
		map.put(UnaryExpr.class, ctx -> handleUnaryExpression((UnaryExpr) ctx));
		map.put(FieldReference.class, ctx -> handleFieldReference((FieldReference) ctx));
		map.put(FunctionCallExpr.class, ctx -> handleFunctionCall((FunctionCallExpr) ctx));
	}

	/**
	 * Resolves a name through the open scopes. A name that is not declared yet becomes an
	 * unresolved reference of unknown type.
	 */
	private Expression handleIdExpression(IdExpression ctx)
	{
		Declaration declaration = lang.getScopeManager().lookup(ctx.getName());
		if (declaration instanceof ValueDeclaration)
		{
			return lang.getBuilder().newReference(declaration, ctx.getRawSignature());
		}
		Debug.log("Could not resolve %s (yet)", ctx.getName());
		return lang.getBuilder().newDeclaredReferenceExpression(ctx.getName(), UnknownType.getUnknownType(), ctx.getRawSignature());
	}

	private Expression handleLiteral(LiteralExpr ctx)
	{
		return lang.getBuilder().newLiteral(ctx.getValue(), TypeParser.createFrom(ctx.getTypeName()), ctx.getRawSignature());
	}

	private Expression handleBinaryExpression(BinaryExpr ctx)
	{
		Expression lhs = handle(ctx.getLhs());
		Expression rhs = handle(ctx.getRhs());
		return lang.getBuilder().newBinaryOperator(ctx.getOperator(), lhs, rhs, ctx.getRawSignature());
	}

	private Expression handleUnaryExpression(UnaryExpr ctx)
	{
		Expression input = handle(ctx.getOperand());
		return lang.getBuilder().newUnaryOperator(ctx.getOperator(), ctx.isPostfix(), !ctx.isPostfix(), input, ctx.getRawSignature());
	}

	private Expression handleFieldReference(FieldReference ctx)
	{
		Expression base = handle(ctx.getOwner());
		return lang.getBuilder().newMemberExpression(base, ctx.getFieldName(), ctx.isPointerDereference() ? "->" : ".", ctx.getRawSignature());
	}

	/**
	 * Calls on a field reference become member calls whose FQN follows the type of the base.
	 * Other calls are resolved by name; calls through a function pointer take its return type.
	 */
	private Expression handleFunctionCall(FunctionCallExpr ctx)
	{
		String code = ctx.getRawSignature();
		CallExpression call;

		if (ctx.getFunction() instanceof FieldReference)
		{
			MemberExpression member = (MemberExpression) handleFieldReference((FieldReference) ctx.getFunction());
			MethodDeclaration method = findMethod(member);
			call = lang.getBuilder().newMemberCallExpression(member, method == null ? UnknownType.getUnknownType() : method.getType(), code);
			if (method != null)
			{
				call.addInvoke(method);
			}
		}
		else
		{
			String name = ctx.getFunction() instanceof IdExpression
					? ((IdExpression) ctx.getFunction()).getName()
					: lang.getCodeFromRawNode(ctx.getFunction());
			Declaration declaration = lang.getScopeManager().lookup(name);
			Type type = UnknownType.getUnknownType();
			if (declaration instanceof FunctionDeclaration)
			{
				type = ((FunctionDeclaration) declaration).getType();
			}
			else if (declaration instanceof ValueDeclaration && ((ValueDeclaration) declaration).getType() instanceof FunctionPointerType)
			{
				type = ((FunctionPointerType) ((ValueDeclaration) declaration).getType()).getReturnType();
			}

			call = lang.getBuilder().newCallExpression(name, name, type, code);
			if (declaration instanceof FunctionDeclaration)
			{
				call.addInvoke((FunctionDeclaration) declaration);
			}
		}

		for (CxxExpression argument : ctx.getArguments())
		{
			call.addArgument(handle(argument));
		}
		return call;
	}

	private MethodDeclaration findMethod(MemberExpression member)
	{
		Type baseType = member.getBase() == null ? null : member.getBase().getType();
		if (!(baseType instanceof ObjectType))
		{
			return null;
		}
		RecordDeclaration record = ((ObjectType) baseType).getRecordDeclaration();
		if (record == null)
		{
			return null;
		}
		for (MethodDeclaration method : record.getMethods())
		{
			if (method.getName().equals(member.getName()))
			{
				return method;
			}
		}
		return null;
	}
}
