package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FunctionCallExpr extends CxxExpression
{
	private final CxxExpression function;
	private final List<CxxExpression> arguments;

	public FunctionCallExpr(String rawSignature, CxxExpression function, List<CxxExpression> arguments)
	{
		super(rawSignature);
		this.function = function;
		this.arguments = new ArrayList<>(arguments);
	}

	/**
	 * @return The called expression, an {@link IdExpression} or a {@link FieldReference}.
	 */
	public CxxExpression getFunction()
	{
		return function;
	}

	public List<CxxExpression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}
}
