package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.llvm.ir.IrModule;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads an SSA IR file into the in-memory IR model.
 */
public interface ModuleReader
{
	/**
	 * @throws IOException if the file cannot be read or does not contain a valid module.
	 */
	IrModule read(Path path) throws IOException;
}
