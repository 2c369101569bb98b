// File: src/main/java/com/juanpa/cpg/frontend/llvm/BytedecoModuleReader.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.util.Debug;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.SizeTPointer;
import org.bytedeco.llvm.LLVM.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Parses textual or bitcode IR with the LLVM C API and copies it into the IR model.
 * LLVM handles are only compared by address, so every converted value and type is cached under
 * the address of its handle. Instructions are created for the whole function before their
 * operands are filled in, which lets merge instructions refer to values defined further down.
 */
public class BytedecoModuleReader implements ModuleReader
{
	private static final Map<Integer, Opcode> OPCODES = new HashMap<>();

	static
	{
		OPCODES.put(LLVMRet, Opcode.RET);
		OPCODES.put(LLVMBr, Opcode.BR);
		OPCODES.put(LLVMSwitch, Opcode.SWITCH);
		OPCODES.put(LLVMIndirectBr, Opcode.INDIRECTBR);
		OPCODES.put(LLVMInvoke, Opcode.INVOKE);
		OPCODES.put(LLVMUnreachable, Opcode.UNREACHABLE);
		OPCODES.put(LLVMCallBr, Opcode.CALLBR);
		OPCODES.put(LLVMResume, Opcode.RESUME);
		OPCODES.put(LLVMCleanupRet, Opcode.CLEANUPRET);
		OPCODES.put(LLVMCatchRet, Opcode.CATCHRET);
		OPCODES.put(LLVMCatchSwitch, Opcode.CATCHSWITCH);
		OPCODES.put(LLVMFNeg, Opcode.FNEG);
		OPCODES.put(LLVMAdd, Opcode.ADD);
		OPCODES.put(LLVMFAdd, Opcode.FADD);
		OPCODES.put(LLVMSub, Opcode.SUB);
		OPCODES.put(LLVMFSub, Opcode.FSUB);
		OPCODES.put(LLVMMul, Opcode.MUL);
		OPCODES.put(LLVMFMul, Opcode.FMUL);
		OPCODES.put(LLVMUDiv, Opcode.UDIV);
		OPCODES.put(LLVMSDiv, Opcode.SDIV);
		OPCODES.put(LLVMFDiv, Opcode.FDIV);
		OPCODES.put(LLVMURem, Opcode.UREM);
		OPCODES.put(LLVMSRem, Opcode.SREM);
		OPCODES.put(LLVMFRem, Opcode.FREM);
		OPCODES.put(LLVMShl, Opcode.SHL);
		OPCODES.put(LLVMLShr, Opcode.LSHR);
		OPCODES.put(LLVMAShr, Opcode.ASHR);
		OPCODES.put(LLVMAnd, Opcode.AND);
		OPCODES.put(LLVMOr, Opcode.OR);
		OPCODES.put(LLVMXor, Opcode.XOR);
		OPCODES.put(LLVMAlloca, Opcode.ALLOCA);
		OPCODES.put(LLVMLoad, Opcode.LOAD);
		OPCODES.put(LLVMStore, Opcode.STORE);
		OPCODES.put(LLVMGetElementPtr, Opcode.GETELEMENTPTR);
		OPCODES.put(LLVMFence, Opcode.FENCE);
		OPCODES.put(LLVMAtomicCmpXchg, Opcode.ATOMICCMPXCHG);
		OPCODES.put(LLVMAtomicRMW, Opcode.ATOMICRMW);
		OPCODES.put(LLVMTrunc, Opcode.TRUNC);
		OPCODES.put(LLVMZExt, Opcode.ZEXT);
		OPCODES.put(LLVMSExt, Opcode.SEXT);
		OPCODES.put(LLVMFPToUI, Opcode.FPTOUI);
		OPCODES.put(LLVMFPToSI, Opcode.FPTOSI);
		OPCODES.put(LLVMUIToFP, Opcode.UITOFP);
		OPCODES.put(LLVMSIToFP, Opcode.SITOFP);
		OPCODES.put(LLVMFPTrunc, Opcode.FPTRUNC);
		OPCODES.put(LLVMFPExt, Opcode.FPEXT);
		OPCODES.put(LLVMPtrToInt, Opcode.PTRTOINT);
		OPCODES.put(LLVMIntToPtr, Opcode.INTTOPTR);
		OPCODES.put(LLVMBitCast, Opcode.BITCAST);
		OPCODES.put(LLVMAddrSpaceCast, Opcode.ADDRSPACECAST);
		OPCODES.put(LLVMICmp, Opcode.ICMP);
		OPCODES.put(LLVMFCmp, Opcode.FCMP);
		OPCODES.put(LLVMPHI, Opcode.PHI);
		OPCODES.put(LLVMCall, Opcode.CALL);
		OPCODES.put(LLVMSelect, Opcode.SELECT);
		OPCODES.put(LLVMUserOp1, Opcode.USEROP1);
		OPCODES.put(LLVMUserOp2, Opcode.USEROP2);
		OPCODES.put(LLVMVAArg, Opcode.VAARG);
		OPCODES.put(LLVMExtractElement, Opcode.EXTRACTELEMENT);
		OPCODES.put(LLVMInsertElement, Opcode.INSERTELEMENT);
		OPCODES.put(LLVMShuffleVector, Opcode.SHUFFLEVECTOR);
		OPCODES.put(LLVMExtractValue, Opcode.EXTRACTVALUE);
		OPCODES.put(LLVMInsertValue, Opcode.INSERTVALUE);
		OPCODES.put(LLVMFreeze, Opcode.FREEZE);
		OPCODES.put(LLVMLandingPad, Opcode.LANDINGPAD);
		OPCODES.put(LLVMCatchPad, Opcode.CATCHPAD);
		OPCODES.put(LLVMCleanupPad, Opcode.CLEANUPPAD);
	}

	private final Map<Long, IrType> types = new HashMap<>();
	private final Map<Long, IrValue> values = new HashMap<>();
	private IrModule module;

	@Override
	public IrModule read(Path path) throws IOException
	{
		types.clear();
		values.clear();

		LLVMContextRef context = LLVMContextCreate();
		LLVMModuleRef mod = new LLVMModuleRef();
		try
		{
			BytePointer error = new BytePointer((Pointer) null);
			LLVMMemoryBufferRef buffer = new LLVMMemoryBufferRef();
			if (LLVMCreateMemoryBufferWithContentsOfFile(new BytePointer(path.toString()), buffer, error) != 0)
			{
				String message = error.getString();
				LLVMDisposeMessage(error);
				throw new IOException("Could not read " + path + ": " + message);
			}

			// the parser takes ownership of the buffer
			if (LLVMParseIRInContext(context, buffer, mod, error) != 0)
			{
				String message = error.getString();
				LLVMDisposeMessage(error);
				throw new IOException("Could not parse " + path + ": " + message);
			}

			Debug.log("Parsed IR module %s", path);
			return convertModule(mod, path.getFileName().toString());
		}
		finally
		{
			if (mod.address() != 0)
			{
				LLVMDisposeModule(mod);
			}
			LLVMContextDispose(context);
		}
	}

	private IrModule convertModule(LLVMModuleRef mod, String name)
	{
		module = new IrModule(name);

		List<LLVMValueRef> globalRefs = new ArrayList<>();
		for (LLVMValueRef global = LLVMGetFirstGlobal(mod); global != null && !global.isNull(); global = LLVMGetNextGlobal(global))
		{
			IrGlobal irGlobal = new IrGlobal(valueName(global), typeOf(LLVMGlobalGetValueType(global)), print(global));
			values.put(global.address(), irGlobal);
			module.addGlobal(irGlobal);
			globalRefs.add(global);
		}

		List<LLVMValueRef> functionRefs = new ArrayList<>();
		for (LLVMValueRef function = LLVMGetFirstFunction(mod); function != null && !function.isNull(); function = LLVMGetNextFunction(function))
		{
			LLVMTypeRef functionType = LLVMGlobalGetValueType(function);
			IrFunction irFunction = new IrFunction(valueName(function), typeOf(LLVMGetReturnType(functionType)), null);
			irFunction.setVariadic(LLVMIsFunctionVarArg(functionType) != 0);
			values.put(function.address(), irFunction);
			module.addFunction(irFunction);
			functionRefs.add(function);
		}

		// initializers may refer to functions and other globals, so they come last
		for (LLVMValueRef global : globalRefs)
		{
			LLVMValueRef initializer = LLVMGetInitializer(global);
			if (initializer != null && !initializer.isNull())
			{
				((IrGlobal) values.get(global.address())).setInitializer(valueOf(initializer));
			}
		}

		for (LLVMValueRef function : functionRefs)
		{
			convertFunction(function, (IrFunction) values.get(function.address()));
		}
		return module;
	}

	private void convertFunction(LLVMValueRef function, IrFunction irFunction)
	{
		int numParams = LLVMCountParams(function);
		for (int i = 0; i < numParams; i++)
		{
			LLVMValueRef param = LLVMGetParam(function, i);
			IrArgument argument = irFunction.addArgument(valueName(param), typeOf(LLVMTypeOf(param)));
			argument.setCode(print(param));
			values.put(param.address(), argument);
		}

		// first pass: blocks and instruction shells
		Map<IrInstruction, LLVMValueRef> instructions = new HashMap<>();
		List<IrInstruction> ordered = new ArrayList<>();
		for (LLVMBasicBlockRef block = LLVMGetFirstBasicBlock(function); block != null && !block.isNull(); block = LLVMGetNextBasicBlock(block))
		{
			BytePointer blockName = LLVMGetBasicBlockName(block);
			IrBasicBlock irBlock = irFunction.addBlock(blockName == null ? "" : blockName.getString());
			if (irBlock.getName().isEmpty())
			{
				// the printed block starts with its slot label, e.g. "3:  ; preds = %1"
				irBlock.setCode(print(LLVMBasicBlockAsValue(block)).split("\n", 2)[0]);
			}
			values.put(LLVMBasicBlockAsValue(block).address(), irBlock);

			for (LLVMValueRef instr = LLVMGetFirstInstruction(block); instr != null && !instr.isNull(); instr = LLVMGetNextInstruction(instr))
			{
				Opcode opcode = OPCODES.getOrDefault(LLVMGetInstructionOpcode(instr), Opcode.UNKNOWN);
				IrInstruction irInstruction = new IrInstruction(opcode, valueName(instr), typeOf(LLVMTypeOf(instr)), print(instr));
				irBlock.addInstruction(irInstruction);
				values.put(instr.address(), irInstruction);
				instructions.put(irInstruction, instr);
				ordered.add(irInstruction);
			}
		}

		// second pass: operands and instruction specific details
		for (IrInstruction irInstruction : ordered)
		{
			fillInstruction(irInstruction, instructions.get(irInstruction));
		}
	}

	private void fillInstruction(IrInstruction irInstruction, LLVMValueRef instr)
	{
		switch (irInstruction.getOpcode())
		{
			case PHI:
			{
				int incoming = LLVMCountIncoming(instr);
				for (int i = 0; i < incoming; i++)
				{
					IrValue block = valueOf(LLVMBasicBlockAsValue(LLVMGetIncomingBlock(instr, i)));
					irInstruction.addIncoming(valueOf(LLVMGetIncomingValue(instr, i)), (IrBasicBlock) block);
				}
				return;
			}
			case LANDINGPAD:
			{
				int clauses = LLVMGetNumClauses(instr);
				for (int i = 0; i < clauses; i++)
				{
					irInstruction.addClause(valueOf(LLVMGetClause(instr, i)));
				}
				return;
			}
			default:
				break;
		}

		int numOperands = LLVMGetNumOperands(instr);
		for (int i = 0; i < numOperands; i++)
		{
			irInstruction.addOperand(valueOf(LLVMGetOperand(instr, i)));
		}

		switch (irInstruction.getOpcode())
		{
			case ICMP:
			{
				int predicate = LLVMGetICmpPredicate(instr) - LLVMIntEQ;
				if (predicate >= 0 && predicate < IntPredicate.values().length)
				{
					irInstruction.setIntPredicate(IntPredicate.values()[predicate]);
				}
				break;
			}
			case FCMP:
			{
				int predicate = LLVMGetFCmpPredicate(instr) - LLVMRealPredicateFalse;
				if (predicate >= 0 && predicate < RealPredicate.values().length)
				{
					irInstruction.setRealPredicate(RealPredicate.values()[predicate]);
				}
				break;
			}
			case ATOMICRMW:
			{
				int operation = LLVMGetAtomicRMWBinOp(instr) - LLVMAtomicRMWBinOpXchg;
				boolean known = operation >= 0 && operation < AtomicRmwOp.UNKNOWN.ordinal();
				irInstruction.setRmwOp(known ? AtomicRmwOp.values()[operation] : AtomicRmwOp.UNKNOWN);
				break;
			}
			case EXTRACTVALUE:
			case INSERTVALUE:
			{
				int numIndices = LLVMGetNumIndices(instr);
				IntPointer indexPointer = LLVMGetIndices(instr);
				int[] indices = new int[numIndices];
				for (int i = 0; i < numIndices; i++)
				{
					indices[i] = indexPointer.get(i);
				}
				irInstruction.setIndices(indices);
				break;
			}
			case SHUFFLEVECTOR:
			{
				int[] mask = new int[LLVMGetNumMaskElements(instr)];
				for (int i = 0; i < mask.length; i++)
				{
					mask[i] = LLVMGetMaskValue(instr, i);
				}
				irInstruction.setMask(mask);
				break;
			}
			case GETELEMENTPTR:
				irInstruction.setSourceElementType(typeOf(LLVMGetGEPSourceElementType(instr)));
				break;
			default:
				break;
		}
	}

	// --- Values ---

	private IrValue valueOf(LLVMValueRef value)
	{
		if (value == null || value.isNull())
		{
			return null;
		}
		IrValue known = values.get(value.address());
		if (known != null)
		{
			return known;
		}

		IrValue converted;
		if (LLVMIsConstant(value) != 0)
		{
			converted = constantOf(value);
		}
		else
		{
			// metadata and inline asm operands
			converted = new IrValue(valueName(value), typeOf(LLVMTypeOf(value)), print(value));
		}
		values.put(value.address(), converted);
		return converted;
	}

	private IrConstant constantOf(LLVMValueRef value)
	{
		IrType type = typeOf(LLVMTypeOf(value));
		String code = print(value);

		if (isA(LLVMIsAConstantInt(value)))
		{
			long intValue = type.getBitWidth() == 1 ? LLVMConstIntGetZExtValue(value) : LLVMConstIntGetSExtValue(value);
			return new IrConstant(IrConstant.Kind.INT, intValue, type, code);
		}
		if (isA(LLVMIsAConstantFP(value)))
		{
			int[] losesInfo = new int[1];
			return new IrConstant(IrConstant.Kind.FLOAT, LLVMConstRealGetDouble(value, losesInfo), type, code);
		}
		if (LLVMIsPoison(value) != 0)
		{
			return new IrConstant(IrConstant.Kind.POISON, null, type, code);
		}
		if (LLVMIsUndef(value) != 0)
		{
			return new IrConstant(IrConstant.Kind.UNDEF, null, type, code);
		}
		if (isA(LLVMIsAConstantPointerNull(value)))
		{
			return new IrConstant(IrConstant.Kind.NULL, null, type, code);
		}
		if (isA(LLVMIsAConstantAggregateZero(value)))
		{
			return new IrConstant(IrConstant.Kind.ZERO, null, type, code);
		}
		if (isA(LLVMIsAConstantDataSequential(value)))
		{
			if (LLVMIsConstantString(value) != 0)
			{
				SizeTPointer length = new SizeTPointer(1);
				BytePointer string = LLVMGetAsString(value, length);
				byte[] bytes = new byte[(int) length.get()];
				string.get(bytes);
				return new IrConstant(IrConstant.Kind.STRING, new String(bytes, StandardCharsets.UTF_8), type, code);
			}
			IrConstant sequence = new IrConstant(type.getKind() == IrType.Kind.VECTOR ? IrConstant.Kind.VECTOR : IrConstant.Kind.ARRAY, null, type, code);
			for (int i = 0; i < type.getLength(); i++)
			{
				sequence.addElement(valueOf(LLVMGetAggregateElement(value, i)));
			}
			return sequence;
		}
		if (isA(LLVMIsAConstantStruct(value)) || isA(LLVMIsAConstantArray(value)) || isA(LLVMIsAConstantVector(value)))
		{
			IrConstant.Kind kind = isA(LLVMIsAConstantStruct(value)) ? IrConstant.Kind.STRUCT
					: isA(LLVMIsAConstantArray(value)) ? IrConstant.Kind.ARRAY : IrConstant.Kind.VECTOR;
			IrConstant aggregate = new IrConstant(kind, null, type, code);
			int numOperands = LLVMGetNumOperands(value);
			for (int i = 0; i < numOperands; i++)
			{
				aggregate.addElement(valueOf(LLVMGetOperand(value, i)));
			}
			return aggregate;
		}

		// constant expressions and block addresses are kept as text
		return new IrConstant(IrConstant.Kind.OTHER, code, type, code);
	}

	private static boolean isA(LLVMValueRef cast)
	{
		return cast != null && !cast.isNull();
	}

	private static String valueName(LLVMValueRef value)
	{
		BytePointer name = LLVMGetValueName(value);
		return name == null || name.isNull() ? "" : name.getString();
	}

	private static String print(LLVMValueRef value)
	{
		BytePointer printed = LLVMPrintValueToString(value);
		try
		{
			return printed.getString().strip();
		}
		finally
		{
			LLVMDisposeMessage(printed);
		}
	}

	// --- Types ---

	private IrType typeOf(LLVMTypeRef type)
	{
		if (type == null || type.isNull())
		{
			return null;
		}
		IrType known = types.get(type.address());
		if (known != null)
		{
			return known;
		}

		IrType converted;
		int kind = LLVMGetTypeKind(type);
		if (kind == LLVMIntegerTypeKind)
		{
			converted = IrType.integer(LLVMGetIntTypeWidth(type));
		}
		else if (kind == LLVMHalfTypeKind || kind == LLVMBFloatTypeKind || kind == LLVMFloatTypeKind || kind == LLVMDoubleTypeKind
				|| kind == LLVMX86_FP80TypeKind || kind == LLVMFP128TypeKind || kind == LLVMPPC_FP128TypeKind)
		{
			converted = IrType.floating(printType(type));
		}
		else if (kind == LLVMPointerTypeKind)
		{
			converted = IrType.pointer();
		}
		else if (kind == LLVMVectorTypeKind || kind == LLVMScalableVectorTypeKind)
		{
			converted = IrType.vector(typeOf(LLVMGetElementType(type)), LLVMGetVectorSize(type));
		}
		else if (kind == LLVMArrayTypeKind)
		{
			converted = IrType.array(typeOf(LLVMGetElementType(type)), LLVMGetArrayLength(type));
		}
		else if (kind == LLVMStructTypeKind)
		{
			return structOf(type);
		}
		else if (kind == LLVMVoidTypeKind)
		{
			converted = IrType.voidType();
		}
		else if (kind == LLVMLabelTypeKind)
		{
			converted = IrType.label();
		}
		else if (kind == LLVMFunctionTypeKind)
		{
			converted = IrType.function(typeOf(LLVMGetReturnType(type)));
		}
		else
		{
			converted = IrType.other(printType(type));
		}
		types.put(type.address(), converted);
		return converted;
	}

	private IrType structOf(LLVMTypeRef type)
	{
		int numFields = LLVMCountStructElementTypes(type);
		if (LLVMIsLiteralStruct(type) != 0)
		{
			List<IrType> fields = new ArrayList<>();
			for (int i = 0; i < numFields; i++)
			{
				fields.add(typeOf(LLVMStructGetTypeAtIndex(type, i)));
			}
			IrType literal = IrType.literalStruct(fields);
			types.put(type.address(), literal);
			return literal;
		}

		// cached before the fields, a struct may point to itself
		IrType struct = IrType.struct(LLVMGetStructName(type).getString(), new ArrayList<>());
		types.put(type.address(), struct);
		for (int i = 0; i < numFields; i++)
		{
			struct.addField(typeOf(LLVMStructGetTypeAtIndex(type, i)));
		}
		module.addStructType(struct);
		return struct;
	}

	private static String printType(LLVMTypeRef type)
	{
		BytePointer printed = LLVMPrintTypeToString(type);
		try
		{
			return printed.getString();
		}
		finally
		{
			LLVMDisposeMessage(printed);
		}
	}
}
