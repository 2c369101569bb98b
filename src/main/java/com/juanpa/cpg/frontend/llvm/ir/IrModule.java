// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrModule.java
package com.juanpa.cpg.frontend.llvm.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One IR module, the unit of translation of the SSA frontend.
 */
public class IrModule
{
	private final String name;
	private final List<IrType> structTypes = new ArrayList<>();
	private final List<IrGlobal> globals = new ArrayList<>();
	private final List<IrFunction> functions = new ArrayList<>();

	public IrModule(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return The named struct types of the module, in definition order.
	 */
	public List<IrType> getStructTypes()
	{
		return Collections.unmodifiableList(structTypes);
	}

	public void addStructType(IrType structType)
	{
		structTypes.add(structType);
	}

	public List<IrGlobal> getGlobals()
	{
		return Collections.unmodifiableList(globals);
	}

	public void addGlobal(IrGlobal global)
	{
		globals.add(global);
	}

	public List<IrFunction> getFunctions()
	{
		return Collections.unmodifiableList(functions);
	}

	public IrFunction addFunction(IrFunction function)
	{
		functions.add(function);
		return function;
	}
}
