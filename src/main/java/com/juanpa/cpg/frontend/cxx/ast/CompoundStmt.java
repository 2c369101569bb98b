package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CompoundStmt extends CxxStatement
{
	private final List<CxxStatement> statements;

	public CompoundStmt(String rawSignature, List<CxxStatement> statements)
	{
		super(rawSignature);
		this.statements = new ArrayList<>(statements);
	}

	public List<CxxStatement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}
}
