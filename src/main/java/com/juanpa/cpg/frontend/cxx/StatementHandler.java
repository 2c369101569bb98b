// File: src/main/java/com/juanpa/cpg/frontend/cxx/StatementHandler.java
package com.juanpa.cpg.frontend.cxx;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.cxx.ast.*;
import com.juanpa.cpg.graph.declarations.Declaration;
import com.juanpa.cpg.graph.expressions.Expression;
import com.juanpa.cpg.graph.statements.CompoundStatement;
import com.juanpa.cpg.graph.statements.DeclarationStatement;
import com.juanpa.cpg.graph.statements.EmptyStatement;
import com.juanpa.cpg.graph.statements.Statement;

import java.util.List;

public class StatementHandler extends Handler<Statement, CxxStatement, CxxFrontend>
{
	public StatementHandler(CxxFrontend lang)
	{
		super(() -> new EmptyStatement(null), lang);
		map.put(CompoundStmt.class, ctx -> handleCompoundStatement((CompoundStmt) ctx));
		map.put(ExpressionStmt.class, ctx -> lang.getExpressionHandler().handle(((ExpressionStmt) ctx).getExpression()));
		map.put(DeclarationStmt.class, ctx -> handleDeclarationStatement((DeclarationStmt) ctx));
		map.put(ReturnStmt.class, ctx -> handleReturnStatement((ReturnStmt) ctx));
	}

	private Statement handleCompoundStatement(CompoundStmt ctx)
	{
		CompoundStatement compound = lang.getBuilder().newCompoundStatement(ctx.getRawSignature());
		lang.getScopeManager().enterScope(compound);
		for (CxxStatement statement : ctx.getStatements())
		{
			Statement lowered = handle(statement);
			if (lowered != null)
			{
				compound.addStatement(lowered);
			}
		}
		lang.getScopeManager().leaveScope(compound);
		return compound;
	}

	private Statement handleDeclarationStatement(DeclarationStmt ctx)
	{
		List<Declaration> declarations = lang.getDeclarationHandler().handleSimpleDeclaration(ctx.getDeclaration());
		DeclarationStatement statement = new DeclarationStatement(ctx.getRawSignature());
		for (Declaration declaration : declarations)
		{
			statement.addDeclaration(declaration);
		}
		return statement;
	}

	private Statement handleReturnStatement(ReturnStmt ctx)
	{
		Expression value = ctx.getReturnValue() == null ? null : lang.getExpressionHandler().handle(ctx.getReturnValue());
		return lang.getBuilder().newReturnStatement(value, ctx.getRawSignature());
	}
}
