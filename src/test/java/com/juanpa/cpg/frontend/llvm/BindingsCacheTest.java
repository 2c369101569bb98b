package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.graph.declarations.VariableDeclaration;
import com.juanpa.cpg.graph.statements.LabelStatement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BindingsCacheTest
{
	@Test
	void clearingLocalsKeepsGlobals()
	{
		BindingsCache cache = new BindingsCache();
		VariableDeclaration global = new VariableDeclaration("counter", null);
		VariableDeclaration local = new VariableDeclaration("x", null);
		cache.bind("@counter", global);
		cache.bind("%x", local);

		cache.clearLocals();

		assertSame(global, cache.resolve("@counter"));
		assertNull(cache.resolve("%x"));
		assertEquals(1, cache.asMap().size());
	}

	@Test
	void rebindingReplacesTheDeclaration()
	{
		BindingsCache cache = new BindingsCache();
		VariableDeclaration first = new VariableDeclaration("1", null);
		VariableDeclaration second = new VariableDeclaration("1", null);

		cache.bind("%1", first);
		cache.bind("%1", second);

		assertSame(second, cache.resolve("%1"));
	}

	@Test
	void labelsAreCreatedOncePerBlock()
	{
		LabelMap labels = new LabelMap();

		LabelStatement first = labels.getOrCreate("loop", name -> new LabelStatement(name, null));
		LabelStatement again = labels.getOrCreate("loop", name -> new LabelStatement(name, null));

		assertSame(first, again);
		assertEquals(1, labels.size());
		labels.clear();
		assertNull(labels.get("loop"));
	}
}
