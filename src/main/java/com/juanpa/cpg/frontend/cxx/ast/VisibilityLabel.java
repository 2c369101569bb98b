package com.juanpa.cpg.frontend.cxx.ast;

/**
 * {@code public:}, {@code protected:} or {@code private:} inside a record body.
 */
public class VisibilityLabel extends CxxDeclaration
{
	public VisibilityLabel(String rawSignature)
	{
		super(rawSignature);
	}
}
