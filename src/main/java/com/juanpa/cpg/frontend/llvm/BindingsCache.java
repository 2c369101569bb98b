// File: src/main/java/com/juanpa/cpg/frontend/llvm/BindingsCache.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.graph.declarations.ValueDeclaration;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps IR symbol names ({@code %x}, {@code %3}, {@code @global}) to the declaration that defines
 * them. Every use of a register is resolved through this cache, so all uses share the one
 * declaration created when the defining instruction was lowered.
 */
public class BindingsCache
{
	private final Map<String, ValueDeclaration> bindings = new HashMap<>();

	public void bind(String symbolName, ValueDeclaration declaration)
	{
		bindings.put(symbolName, declaration);
	}

	/**
	 * @return The declaration bound to the symbol, or null.
	 */
	public ValueDeclaration resolve(String symbolName)
	{
		return bindings.get(symbolName);
	}

	public boolean contains(String symbolName)
	{
		return bindings.containsKey(symbolName);
	}

	/**
	 * Forgets every function-local binding ({@code %} symbols) and keeps the globals.
	 */
	public void clearLocals()
	{
		bindings.keySet().removeIf(symbol -> symbol.startsWith("%"));
	}

	public Map<String, ValueDeclaration> asMap()
	{
		return Collections.unmodifiableMap(bindings);
	}
}
