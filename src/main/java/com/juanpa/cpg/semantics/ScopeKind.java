package com.juanpa.cpg.semantics;

public enum ScopeKind
{
	GLOBAL,
	NAMESPACE,
	RECORD,
	FUNCTION,
	BLOCK,
	TRY
}
