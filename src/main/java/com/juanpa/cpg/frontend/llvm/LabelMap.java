// File: src/main/java/com/juanpa/cpg/frontend/llvm/LabelMap.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.graph.statements.LabelStatement;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The labels of the function currently being lowered, one per basic block name. A label is
 * created the first time its block is referenced or lowered and shared by every later reference.
 */
public class LabelMap
{
	private final Map<String, LabelStatement> labels = new LinkedHashMap<>();

	public LabelStatement getOrCreate(String blockName, Function<String, LabelStatement> factory)
	{
		return labels.computeIfAbsent(blockName, factory);
	}

	public LabelStatement get(String blockName)
	{
		return labels.get(blockName);
	}

	public int size()
	{
		return labels.size();
	}

	public void clear()
	{
		labels.clear();
	}
}
