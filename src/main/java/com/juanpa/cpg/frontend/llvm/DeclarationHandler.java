// File: src/main/java/com/juanpa/cpg/frontend/llvm/DeclarationHandler.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.statements.CompoundStatement;
import com.juanpa.cpg.graph.statements.LabelStatement;
import com.juanpa.cpg.semantics.UnknownType;
import com.juanpa.cpg.util.Debug;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lowers the module-level entities of the IR: struct types, globals and functions.
 */
public class DeclarationHandler extends Handler<Declaration, Object, LlvmIrFrontend>
{
	public DeclarationHandler(LlvmIrFrontend lang)
	{
		super(() -> null, lang);
		map.put(IrType.class, type -> handleStructureType((IrType) type));
		map.put(IrGlobal.class, global -> handleGlobal((IrGlobal) global));
		map.put(IrFunction.class, function -> handleFunctionSignature((IrFunction) function));
	}

	/**
	 * Lowers a struct type into a record with one field {@code field_<n>} per element.
	 * The record is registered before its fields are lowered, so typed pointers to the struct
	 * inside its own fields resolve to it.
	 */
	public RecordDeclaration handleStructureType(IrType structType)
	{
		if (structType.getKind() != IrType.Kind.STRUCT)
		{
			lang.getErrorReporter().warning("Expected a struct type, got " + structType.getName(), structType.getName());
			return null;
		}

		String name = lang.recordNameOf(structType);
		Optional<RecordDeclaration> existing = lang.getRecordForName(name);
		if (existing.isPresent())
		{
			return existing.get();
		}

		Debug.log("Lowering struct type %s as record %s", structType.getName(), name);
		RecordDeclaration record = lang.getBuilder().newRecordDeclaration(name, "struct", Collections.emptyList(), structType.getName());
		lang.addRecord(record);
		lang.getTranslationUnit().addDeclaration(record);

		lang.getScopeManager().enterScope(record);
		List<IrType> fields = structType.getFields();
		for (int i = 0; i < fields.size(); i++)
		{
			FieldDeclaration field = lang.getBuilder().newFieldDeclaration("field_" + i, lang.typeFrom(fields.get(i)), Collections.emptyList(), null);
			lang.getScopeManager().addDeclaration(field);
		}
		lang.getScopeManager().leaveScope(record);
		return record;
	}

	/**
	 * Lowers a global into a variable bound as {@code @name}. Its type is a pointer to the stored
	 * value, as it is used in the IR.
	 */
	private VariableDeclaration handleGlobal(IrGlobal global)
	{
		VariableDeclaration declaration = lang.getBuilder().newVariableDeclaration(global.getName(), lang.typeOf(global), global.getCode(), false);
		if (global.getInitializer() != null)
		{
			lang.getBuilder().initialize(declaration, lang.getExpressionHandler().handle(global.getInitializer()));
		}
		lang.getScopeManager().addDeclaration(declaration);
		lang.getBindingsCache().bind(lang.symbolNameOf(global), declaration);
		return declaration;
	}

	/**
	 * Lowers the signature of a function: its return type and parameters. Variadic functions get
	 * a trailing synthetic {@code va_args} parameter.
	 */
	private FunctionDeclaration handleFunctionSignature(IrFunction irFunction)
	{
		FunctionDeclaration function = lang.getBuilder().newFunctionDeclaration(irFunction.getName(), lang.typeFrom(irFunction.getReturnType()), irFunction.getCode());
		lang.getScopeManager().addDeclaration(function);
		lang.registerFunction(irFunction, function);

		lang.getScopeManager().enterScope(function);
		for (IrArgument argument : irFunction.getArguments())
		{
			ParameterDeclaration parameter = lang.getBuilder().newParameterDeclaration(lang.nameOf(argument), lang.typeOf(argument), false, argument.getCode());
			parameter.setArgumentIndex(argument.getIndex());
			lang.getScopeManager().addDeclaration(parameter);
		}
		if (irFunction.isVariadic())
		{
			ParameterDeclaration variadic = lang.getBuilder().newParameterDeclaration("va_args", UnknownType.getUnknownType(), true, "...");
			variadic.setArgumentIndex(irFunction.getArguments().size());
			lang.getScopeManager().addDeclaration(variadic);
		}
		lang.getScopeManager().leaveScope(function);
		return function;
	}

	/**
	 * Lowers the blocks of a defined function into its body: one label per block, whose sub
	 * statement holds the block's statements. Merge instructions are materialized last.
	 */
	void handleFunctionBody(IrFunction irFunction, FunctionDeclaration function)
	{
		Debug.log("Lowering body of %s", irFunction.getName());
		Debug.indent();
		lang.resetFunctionState(irFunction);
		lang.getScopeManager().enterScope(function);

		for (ParameterDeclaration parameter : function.getParameters())
		{
			lang.getScopeManager().addDeclaration(parameter);
			if (!parameter.isVariadic())
			{
				lang.getBindingsCache().bind("%" + parameter.getName(), parameter);
			}
		}

		CompoundStatement body = lang.getBuilder().newCompoundStatement(null);
		function.setBody(body);
		for (IrBasicBlock block : irFunction.getBlocks())
		{
			LabelStatement label = lang.labelFor(block);
			label.setSubStatement(lang.getStatementHandler().handle(block));
			body.addStatement(label);
		}

		for (LlvmIrFrontend.PendingPhi phi : lang.getPendingPhis())
		{
			lang.getStatementHandler().handlePhi(phi, body);
		}

		lang.getScopeManager().leaveScope(function);
		Debug.dedent();
	}
}
