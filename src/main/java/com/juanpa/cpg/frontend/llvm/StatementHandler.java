// File: src/main/java/com/juanpa/cpg/frontend/llvm/StatementHandler.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.graph.NodeBuilder;
import com.juanpa.cpg.graph.declarations.FunctionDeclaration;
import com.juanpa.cpg.graph.declarations.VariableDeclaration;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.graph.statements.*;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.semantics.PrimitiveType;
import com.juanpa.cpg.semantics.TranslationException;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.TypeParser;
import com.juanpa.cpg.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers basic blocks and instructions into statements.
 * Every instruction that produces a named result becomes a {@link DeclarationStatement} of a
 * variable named after the result register, initialized with the instruction's expression.
 */
public class StatementHandler extends Handler<Statement, IrValue, LlvmIrFrontend>
{
	public StatementHandler(LlvmIrFrontend lang)
	{
		super(() -> new EmptyStatement(null), lang);
		map.put(IrInstruction.class, value -> handleInstruction((IrInstruction) value));
		map.put(IrBasicBlock.class, value -> handleBasicBlock((IrBasicBlock) value));
	}

	private NodeBuilder builder()
	{
		return lang.getBuilder();
	}

	private Expression operand(IrInstruction instruction, int index)
	{
		return lang.getOperandValueAtIndex(instruction, index);
	}

	/**
	 * Lowers the instructions of a block in order. Merge instructions only declare their register
	 * here and are materialized once the whole function is lowered.
	 */
	private CompoundStatement handleBasicBlock(IrBasicBlock block)
	{
		CompoundStatement compound = builder().newCompoundStatement(block.getCode());
		for (IrInstruction instruction : block.getInstructions())
		{
			Debug.log("Lowering instruction %s", instruction);
			if (instruction.getOpcode() == Opcode.PHI)
			{
				registerPhi(instruction);
				continue;
			}
			compound.addStatement(handle(instruction));
		}
		return compound;
	}

	private Statement handleInstruction(IrInstruction instruction)
	{
		Opcode opcode = instruction.getOpcode();
		if (opcode.isBinaryOperator())
		{
			return handleBinaryInstruction(instruction);
		}
		if (opcode.isCast())
		{
			return lang.declarationOrNot(lang.getExpressionHandler().handleCastInstruction(instruction), instruction);
		}

		String code = instruction.getCode();
		switch (opcode)
		{
			case RET:
				return builder().newReturnStatement(instruction.getNumOperands() == 0 ? null : operand(instruction, 0), code);
			case BR:
				return handleBrStatement(instruction);
			case SWITCH:
				return handleSwitchStatement(instruction);
			case INDIRECTBR:
				return handleIndirectbrStatement(instruction);
			case CALL:
			case INVOKE:
				return handleFunctionCall(instruction);
			case UNREACHABLE:
				return builder().newEmptyStatement(code);
			case FNEG:
				return lang.declarationOrNot(builder().newUnaryOperator("-", false, true, operand(instruction, 0), code), instruction);
			case ALLOCA:
				return handleAlloca(instruction);
			case LOAD:
				return lang.declarationOrNot(builder().newUnaryOperator("*", false, true, operand(instruction, 0), code), instruction);
			case STORE:
				return handleStore(instruction);
			case EXTRACTVALUE:
			case GETELEMENTPTR:
				return lang.declarationOrNot(lang.getExpressionHandler().handleGetElementPtr(instruction), instruction);
			case ICMP:
				return handleIntegerComparison(instruction);
			case FCMP:
				return handleFloatComparison(instruction);
			case SELECT:
				return lang.declarationOrNot(lang.getExpressionHandler().handleSelect(instruction), instruction);
			case USEROP1:
			case USEROP2:
				lang.getErrorReporter().info("userop instruction is not a real instruction. Replacing it with empty statement", code);
				return builder().newEmptyStatement(code);
			case VAARG:
				return handleVaArg(instruction);
			case EXTRACTELEMENT:
				return lang.declarationOrNot(builder().newArraySubscriptionExpression(operand(instruction, 0), operand(instruction, 1), code), instruction);
			case INSERTELEMENT:
				return handleInsertelement(instruction);
			case SHUFFLEVECTOR:
				return handleShufflevector(instruction);
			case INSERTVALUE:
				return handleInsertValue(instruction);
			case ATOMICCMPXCHG:
				return handleAtomiccmpxchg(instruction);
			case ATOMICRMW:
				return handleAtomicrmw(instruction);
			case RESUME:
			{
				// ends a chain of catch clauses, nothing to model
				EmptyStatement empty = builder().newEmptyStatement(code);
				empty.setName("resume");
				return empty;
			}
			case LANDINGPAD:
				return handleLandingpad(instruction);
			case PHI:
				// only reachable when an instruction is lowered outside of its block
				registerPhi(instruction);
				return builder().newEmptyStatement(code);
			default:
				lang.getErrorReporter().error("Cannot parse " + opcode.name().toLowerCase() + " instruction yet", code);
				return builder().newEmptyStatement(code);
		}
	}

	// --- Arithmetic and comparisons ---

	private Statement handleBinaryInstruction(IrInstruction instruction)
	{
		switch (instruction.getOpcode())
		{
			case ADD:
			case FADD:
				return handleBinaryOperator(instruction, "+", false, false);
			case SUB:
			case FSUB:
				return handleBinaryOperator(instruction, "-", false, false);
			case MUL:
			case FMUL:
				return handleBinaryOperator(instruction, "*", false, false);
			case UDIV:
				return handleBinaryOperator(instruction, "/", true, false);
			case SDIV:
			case FDIV:
				return handleBinaryOperator(instruction, "/", false, false);
			case UREM:
				return handleBinaryOperator(instruction, "%", true, false);
			case SREM:
			case FREM:
				return handleBinaryOperator(instruction, "%", false, false);
			case SHL:
				return handleBinaryOperator(instruction, "<<", false, false);
			case LSHR:
				return handleBinaryOperator(instruction, ">>", true, false);
			case ASHR:
				return handleBinaryOperator(instruction, ">>", false, false);
			case AND:
				return handleBinaryOperator(instruction, "&", false, false);
			case OR:
				return handleBinaryOperator(instruction, "|", false, false);
			case XOR:
				return handleBinaryOperator(instruction, "^", false, false);
			default:
				lang.getErrorReporter().error("Not a binary operator: " + instruction.getOpcode(), instruction.getCode());
				return builder().newEmptyStatement(instruction.getCode());
		}
	}

	private Statement handleIntegerComparison(IrInstruction instruction)
	{
		IntPredicate predicate = instruction.getIntPredicate();
		if (predicate == null)
		{
			lang.getErrorReporter().error("icmp without predicate", instruction.getCode());
			return builder().newEmptyStatement(instruction.getCode());
		}
		switch (predicate)
		{
			case EQ:
				return handleBinaryOperator(instruction, "==", false, false);
			case NE:
				return handleBinaryOperator(instruction, "!=", false, false);
			case UGT:
				return handleBinaryOperator(instruction, ">", true, false);
			case UGE:
				return handleBinaryOperator(instruction, ">=", true, false);
			case ULT:
				return handleBinaryOperator(instruction, "<", true, false);
			case ULE:
				return handleBinaryOperator(instruction, "<=", true, false);
			case SGT:
				return handleBinaryOperator(instruction, ">", false, false);
			case SGE:
				return handleBinaryOperator(instruction, ">=", false, false);
			case SLT:
				return handleBinaryOperator(instruction, "<", false, false);
			default:
				return handleBinaryOperator(instruction, "<=", false, false);
		}
	}

	/**
	 * Lowers {@code fcmp}. The constant predicates become boolean literals without touching the
	 * operands; ordered/unordered checks are calls to {@code isunordered}.
	 */
	private Statement handleFloatComparison(IrInstruction instruction)
	{
		RealPredicate predicate = instruction.getRealPredicate();
		if (predicate == null)
		{
			lang.getErrorReporter().error("fcmp without predicate", instruction.getCode());
			return builder().newEmptyStatement(instruction.getCode());
		}
		switch (predicate)
		{
			case FALSE:
				return lang.declarationOrNot(builder().newLiteral(false, TypeParser.createFrom("i1"), "false"), instruction);
			case TRUE:
				return lang.declarationOrNot(builder().newLiteral(true, TypeParser.createFrom("i1"), "true"), instruction);
			case OEQ:
				return handleBinaryOperator(instruction, "==", false, false);
			case OGT:
				return handleBinaryOperator(instruction, ">", false, false);
			case OGE:
				return handleBinaryOperator(instruction, ">=", false, false);
			case OLT:
				return handleBinaryOperator(instruction, "<", false, false);
			case OLE:
				return handleBinaryOperator(instruction, "<=", false, false);
			case ONE:
				return handleBinaryOperator(instruction, "!=", false, false);
			case ORD:
				return handleBinaryOperator(instruction, "ord", false, false);
			case UNO:
				return handleBinaryOperator(instruction, "uno", false, false);
			case UEQ:
				return handleBinaryOperator(instruction, "==", false, true);
			case UGT:
				return handleBinaryOperator(instruction, ">", false, true);
			case UGE:
				return handleBinaryOperator(instruction, ">=", false, true);
			case ULT:
				return handleBinaryOperator(instruction, "<", false, true);
			case ULE:
				return handleBinaryOperator(instruction, "<=", false, true);
			default:
				return handleBinaryOperator(instruction, "!=", false, true);
		}
	}

	/**
	 * Builds {@code op1 <op> op2}. Unsigned operators cast their operands to the unsigned variant
	 * of the operand type; for a logical shift only the shifted value is cast. Unordered float
	 * comparisons become {@code isunordered(op1, op2) || (op1 <op> op2)}.
	 */
	private Statement handleBinaryOperator(IrInstruction instruction, String op, boolean unsigned, boolean unordered)
	{
		String code = instruction.getCode();
		Expression op1 = operand(instruction, 0);
		Expression op2 = operand(instruction, 1);
		Expression result;

		if (op.equals("uno"))
		{
			result = isUnordered(op1, op2, code);
		}
		else if (op.equals("ord"))
		{
			result = builder().newUnaryOperator("!", false, true, isUnordered(op1, op2, code), code);
		}
		else
		{
			Expression lhs = op1;
			Expression rhs = op2;
			if (unsigned)
			{
				lhs = unsignedCast(op1, code);
				if (instruction.getOpcode() != Opcode.LSHR)
				{
					rhs = unsignedCast(op2, code);
				}
			}
			result = builder().newBinaryOperator(op, lhs, rhs, code);
			if (unordered)
			{
				result = builder().newBinaryOperator("||", isUnordered(op1, op2, code), result, code);
			}
		}

		return lang.declarationOrNot(result, instruction);
	}

	private CallExpression isUnordered(Expression op1, Expression op2, String code)
	{
		CallExpression call = builder().newCallExpression("isunordered", "isunordered", TypeParser.createFrom("i1"), code);
		call.addArgument(op1);
		call.addArgument(op2);
		return call;
	}

	private CastExpression unsignedCast(Expression expression, String code)
	{
		Type unsignedType = TypeParser.createFrom(TypeParser.unsignedVariantOf(expression.getType().getTypeName()));
		return builder().newCastExpression(unsignedType, expression, code);
	}

	// --- Memory ---

	/**
	 * An {@code alloca} reserves a block of memory, the closest equivalent is an array creation.
	 * The size operand defaults to 1 in the IR, so it is always present.
	 */
	private Statement handleAlloca(IrInstruction instruction)
	{
		ArrayCreationExpression array = builder().newArrayCreationExpression(lang.typeOf(instruction), instruction.getCode());
		if (instruction.getNumOperands() > 0)
		{
			array.addDimension(operand(instruction, 0));
		}
		return lang.declarationOrNot(array, instruction);
	}

	/**
	 * A {@code store} is an assignment through a dereferenced pointer, {@code *ptr = value}.
	 */
	private Statement handleStore(IrInstruction instruction)
	{
		String code = instruction.getCode();
		UnaryOperator dereference = builder().newUnaryOperator("*", false, true, operand(instruction, 1), code);
		return builder().newBinaryOperator("=", dereference, operand(instruction, 0), code);
	}

	/**
	 * A {@code va_arg} is a call to {@code va_arg(list, type)}, mirroring the C macro.
	 */
	private Statement handleVaArg(IrInstruction instruction)
	{
		String code = instruction.getCode();
		Type expectedType = lang.typeOf(instruction);
		CallExpression call = builder().newCallExpression("va_arg", "va_arg", expectedType, code);
		call.addArgument(operand(instruction, 0));
		call.addArgument(builder().newLiteral(expectedType, expectedType, code));
		return lang.declarationOrNot(call, instruction);
	}

	// --- Control flow ---

	private GotoStatement gotoBlock(IrValue target, String code)
	{
		if (!(target instanceof IrBasicBlock))
		{
			throw new TranslationException("Branch target is not a basic block: " + target);
		}
		return builder().newGotoStatement(lang.labelFor((IrBasicBlock) target), code);
	}

	/**
	 * A conditional {@code br} becomes {@code if (cond) goto then; else goto else;}, an
	 * unconditional one a single goto.
	 */
	private Statement handleBrStatement(IrInstruction instruction)
	{
		String code = instruction.getCode();
		if (instruction.getNumOperands() == 3)
		{
			Expression condition = operand(instruction, 0);
			GotoStatement elseGoto = gotoBlock(instruction.getOperand(1), code);
			GotoStatement thenGoto = gotoBlock(instruction.getOperand(2), code);
			return builder().newIfStatement(condition, thenGoto, elseGoto, code);
		}
		else if (instruction.getNumOperands() == 1)
		{
			return gotoBlock(instruction.getOperand(0), code);
		}
		throw new TranslationException("Wrong number of operands in br statement: " + instruction.getNumOperands());
	}

	/**
	 * A {@code switch} becomes a switch statement with a case and goto per value/target pair,
	 * followed by a default case for the mandatory default target.
	 */
	private Statement handleSwitchStatement(IrInstruction instruction)
	{
		int numOps = instruction.getNumOperands();
		String code = instruction.getCode();
		if (numOps < 2 || numOps % 2 != 0)
		{
			throw new TranslationException("Switch statement without operand and default branch");
		}

		Expression selector = operand(instruction, 0);
		CompoundStatement cases = builder().newCompoundStatement(code);
		for (int idx = 2; idx < numOps; idx += 2)
		{
			cases.addStatement(builder().newCaseStatement(operand(instruction, idx), code));
			cases.addStatement(gotoBlock(instruction.getOperand(idx + 1), code));
		}
		cases.addStatement(builder().newDefaultStatement(code));
		cases.addStatement(gotoBlock(instruction.getOperand(1), code));
		return builder().newSwitchStatement(selector, cases, code);
	}

	/**
	 * An {@code indirectbr} becomes a switch on the address with one case per possible target.
	 * Each case is keyed by the block address of its target.
	 */
	private Statement handleIndirectbrStatement(IrInstruction instruction)
	{
		int numOps = instruction.getNumOperands();
		String code = instruction.getCode();
		if (numOps < 2)
		{
			throw new TranslationException("Indirectbr statement without address and at least one target");
		}

		Expression address = operand(instruction, 0);
		CompoundStatement cases = builder().newCompoundStatement(code);
		for (int idx = 1; idx < numOps; idx++)
		{
			GotoStatement gotoStatement = gotoBlock(instruction.getOperand(idx), code);
			String blockAddress = "blockaddress(" + gotoStatement.getLabelName() + ")";
			cases.addStatement(builder().newCaseStatement(builder().newLiteral(blockAddress, TypeParser.createFrom("ptr"), code), code));
			cases.addStatement(gotoStatement);
		}
		return builder().newSwitchStatement(address, cases, code);
	}

	// --- Calls and exceptions ---

	/**
	 * Lowers {@code call} and {@code invoke}. The callee is the last operand. An invoke is wrapped
	 * in a try statement: the try block holds the call and a goto to the normal target, the single
	 * catch clause jumps to the unwind target.
	 */
	private Statement handleFunctionCall(IrInstruction instruction)
	{
		String code = instruction.getCode();
		int max = instruction.getNumOperands() - 1;
		if (max < 0)
		{
			throw new TranslationException("Call without callee");
		}

		IrValue callee = instruction.getOperand(max);
		String calledFuncName = callee.getName();
		if (calledFuncName.isEmpty())
		{
			// called through a local value
			calledFuncName = operand(instruction, max).getName();
		}

		LabelStatement catchLabel = null;
		LabelStatement continueLabel = null;
		boolean invoke = instruction.getOpcode() == Opcode.INVOKE;
		if (invoke)
		{
			if (max < 2)
			{
				throw new TranslationException("Invoke without normal and unwind destination");
			}
			catchLabel = gotoBlock(instruction.getOperand(max - 1), code).getTargetLabel();
			continueLabel = gotoBlock(instruction.getOperand(max - 2), code).getTargetLabel();
			max -= 2;
			Debug.log("Invoke: continues at %s, exceptions continue at %s", continueLabel.getLabel(), catchLabel.getLabel());
		}

		CallExpression call = builder().newCallExpression(calledFuncName, calledFuncName, lang.typeOf(instruction), code);
		lang.getExpressionHandler().addArguments(call, instruction, 0, max);
		if (callee instanceof IrFunction)
		{
			FunctionDeclaration function = lang.getFunction((IrFunction) callee);
			if (function != null)
			{
				call.addInvoke(function);
			}
		}

		if (!invoke)
		{
			return lang.declarationOrNot(call, instruction);
		}

		TryStatement tryStatement = builder().newTryStatement(code);
		lang.getScopeManager().enterScope(tryStatement);
		CompoundStatement tryBlock = builder().newCompoundStatement(code);
		tryBlock.addStatement(lang.declarationOrNot(call, instruction));
		tryBlock.addStatement(builder().newGotoStatement(continueLabel, code));
		tryStatement.setTryBlock(tryBlock);
		lang.getScopeManager().leaveScope(tryStatement);

		CatchClause catchClause = builder().newCatchClause(code);
		CompoundStatement catchBody = builder().newCompoundStatement(code);
		catchBody.addStatement(builder().newGotoStatement(catchLabel, code));
		catchClause.setBody(catchBody);
		tryStatement.addCatchClause(catchClause);
		return tryStatement;
	}

	/**
	 * A {@code landingpad} becomes a catch clause whose exception variable has the union of all
	 * caught types, {@code ...} standing for catch-all. Filter clauses cannot be represented and
	 * are skipped.
	 */
	private Statement handleLandingpad(IrInstruction instruction)
	{
		String code = instruction.getCode();
		List<String> caught = new ArrayList<>();
		for (IrValue clause : instruction.getClauses())
		{
			if (clause.getType() != null && clause.getType().getKind() == IrType.Kind.ARRAY)
			{
				lang.getErrorReporter().warning("Filter clauses of landingpad are not supported, skipping", clause.getCode());
			}
			else if (clause instanceof IrConstant && ((IrConstant) clause).getKind() == IrConstant.Kind.NULL)
			{
				caught.add("...");
			}
			else
			{
				caught.add(clause.getName());
			}
		}
		String catchType = String.join(" | ", caught);

		String name = lang.nameOf(instruction);
		VariableDeclaration exception = builder().newVariableDeclaration("e_" + name, TypeParser.createFrom(catchType), code, false);
		lang.getScopeManager().addDeclaration(exception);
		if (!name.isEmpty())
		{
			lang.getBindingsCache().bind(lang.symbolNameOf(instruction), exception);
		}

		CatchClause catchClause = builder().newCatchClause(code);
		catchClause.setParameter(exception);
		catchClause.setBody(builder().newCompoundStatement(code));
		catchClause.setName(catchType);
		return catchClause;
	}

	// --- Vectors and aggregates ---

	/**
	 * An {@code insertelement} copies the vector and assigns the element in the copy.
	 */
	private Statement handleInsertelement(IrInstruction instruction)
	{
		String code = instruction.getCode();
		CompoundStatement compound = builder().newCompoundStatement(code);

		Statement copy = lang.declarationOrNot(operand(instruction, 0), instruction);
		compound.addStatement(copy);

		Expression array = copyReference(copy, code);
		ArraySubscriptionExpression element = builder().newArraySubscriptionExpression(array, operand(instruction, 2), code);
		compound.addStatement(builder().newBinaryOperator("=", element, operand(instruction, 1), code));
		return compound;
	}

	/**
	 * @return A reference to the variable declared by {@code copy}, or the copied expression itself
	 * if no variable was declared.
	 */
	private Expression copyReference(Statement copy, String code)
	{
		if (copy instanceof DeclarationStatement)
		{
			return builder().newReference(((DeclarationStatement) copy).getSingleDeclaration(), code);
		}
		return (Expression) copy;
	}

	/**
	 * A {@code shufflevector} becomes an initializer list. Every mask value selects an element of
	 * the first vector, of the second vector (offset by the first vector's length), or, if it is out
	 * of range or undefined, an undefined value of the element type.
	 */
	private Statement handleShufflevector(IrInstruction instruction)
	{
		String code = instruction.getCode();
		Type elementType = lang.typeOf(instruction).dereference();

		Expression array1 = operand(instruction, 0);
		int array1Length = lengthOf(instruction.getOperand(0));
		Expression array2 = operand(instruction, 1);
		int array2Length = array2 instanceof Literal && !((Literal<?>) array2).hasValue() ? 0 : lengthOf(instruction.getOperand(1));

		InitializerListExpression list = builder().newInitializerListExpression(lang.typeOf(instruction), code);
		for (int maskValue : instruction.getMask())
		{
			if (maskValue >= 0 && maskValue < array1Length)
			{
				list.addInitializer(builder().newArraySubscriptionExpression(array1, indexLiteral(maskValue, code), code));
			}
			else if (maskValue >= array1Length && maskValue < array1Length + array2Length)
			{
				list.addInitializer(builder().newArraySubscriptionExpression(array2, indexLiteral(maskValue - array1Length, code), code));
			}
			else
			{
				list.addInitializer(builder().newLiteral(null, elementType, code));
			}
		}
		return lang.declarationOrNot(list, instruction);
	}

	private int lengthOf(IrValue vector)
	{
		return vector.getType() == null ? 0 : vector.getType().getLength();
	}

	private Literal<Long> indexLiteral(long index, String code)
	{
		return builder().newLiteral(index, new PrimitiveType("i32"), code);
	}

	/**
	 * An {@code insertvalue} into a constant aggregate whose index path only runs through
	 * constructions replaces the argument of the innermost construction in place. Otherwise the
	 * aggregate is copied into the result and the nested element is assigned in the copy,
	 * {@code copy.field_a[b] = value}.
	 */
	private Statement handleInsertValue(IrInstruction instruction)
	{
		String code = instruction.getCode();
		int[] indices = instruction.getIndices();
		Expression aggregate = operand(instruction, 0);
		Expression valueToSet = operand(instruction, 1);

		int depth = indices.length;
		if (aggregate instanceof ConstructExpression)
		{
			ConstructExpression construct = (ConstructExpression) aggregate;
			for (int i = 0; i < indices.length; i++)
			{
				int index = indices[i];
				int size = construct.getArguments().size();
				if (index > size || (index == size && i < indices.length - 1))
				{
					lang.getErrorReporter().error("Index " + index + " out of bounds of constant aggregate", code);
					depth = i;
					break;
				}
				if (i == indices.length - 1)
				{
					construct.setArgument(index, valueToSet);
					return lang.declarationOrNot(aggregate, instruction);
				}
				Expression element = construct.getArguments().get(index);
				if (!(element instanceof ConstructExpression))
				{
					break;
				}
				construct = (ConstructExpression) element;
			}
		}

		Statement copy = lang.declarationOrNot(aggregate, instruction);
		Expression base = copyReference(copy, code);
		IrType baseType = instruction.getOperand(0).getType();
		for (int i = 0; i < depth; i++)
		{
			int index = indices[i];
			if (baseType != null && baseType.getKind() == IrType.Kind.STRUCT)
			{
				if (lang.recordFor(baseType) == null)
				{
					lang.getErrorReporter().error("Could not find structure type with name " + baseType.getName() + ", cannot continue", code);
					break;
				}
				base = lang.getExpressionHandler().member(base, baseType, index, code);
				baseType = elementOf(baseType, index);
			}
			else
			{
				base = builder().newArraySubscriptionExpression(base, indexLiteral(index, code), code);
				baseType = baseType == null ? null : baseType.getElementType();
			}
		}

		CompoundStatement compound = builder().newCompoundStatement(code);
		compound.addStatement(copy);
		compound.addStatement(builder().newBinaryOperator("=", base, valueToSet, code));
		return compound;
	}

	private IrType elementOf(IrType aggregate, int index)
	{
		if (aggregate.getKind() == IrType.Kind.STRUCT)
		{
			return index < aggregate.getFields().size() ? aggregate.getFields().get(index) : null;
		}
		return aggregate.getElementType();
	}

	// --- Atomics ---

	/**
	 * Lowers {@code cmpxchg} into
	 * <pre>
	 * result = {*ptr, *ptr == cmp}   // only if the result is used
	 * if (*ptr == cmp) *ptr = new;
	 * </pre>
	 */
	private Statement handleAtomiccmpxchg(IrInstruction instruction)
	{
		String code = instruction.getCode();
		CompoundStatement compound = builder().newCompoundStatement(code);
		compound.setName("atomiccmpxchg");

		Expression ptr = operand(instruction, 0);
		Expression cmp = operand(instruction, 1);
		Expression value = operand(instruction, 2);

		UnaryOperator ptrDeref = builder().newUnaryOperator("*", false, true, ptr, code);
		BinaryOperator cmpExpr = builder().newBinaryOperator("==", ptrDeref, cmp, code);

		if (!lang.nameOf(instruction).isEmpty())
		{
			Type targetType = lang.typeOf(instruction);
			ConstructExpression construct = builder().newConstructExpression(targetType,
					targetType instanceof ObjectType ? ((ObjectType) targetType).getRecordDeclaration() : null, code);
			construct.addArgument(ptrDeref);
			construct.addArgument(cmpExpr);
			compound.addStatement(lang.declarationOrNot(construct, instruction));
		}

		BinaryOperator assignment = builder().newBinaryOperator("=", ptrDeref, value, code);
		compound.addStatement(builder().newIfStatement(cmpExpr, assignment, null, code));
		return compound;
	}

	/**
	 * Lowers {@code atomicrmw} into {@code *ptr = f(*ptr, value)}. If the result is used, the old
	 * value is declared first.
	 */
	private Statement handleAtomicrmw(IrInstruction instruction)
	{
		String code = instruction.getCode();
		AtomicRmwOp operation = instruction.getRmwOp();
		Expression ptr = operand(instruction, 0);
		Expression value = operand(instruction, 1);
		Type type = value.getType();

		UnaryOperator ptrDeref = builder().newUnaryOperator("*", false, true, ptr, code);
		Expression rhs;
		switch (operation == null ? AtomicRmwOp.UNKNOWN : operation)
		{
			case XCHG:
				rhs = value;
				break;
			case ADD:
			case FADD:
				rhs = builder().newBinaryOperator("+", ptrDeref, value, code);
				break;
			case SUB:
			case FSUB:
				rhs = builder().newBinaryOperator("-", ptrDeref, value, code);
				break;
			case AND:
				rhs = builder().newBinaryOperator("&", ptrDeref, value, code);
				break;
			case NAND:
				rhs = builder().newUnaryOperator("~", false, true, builder().newBinaryOperator("|", ptrDeref, value, code), code);
				break;
			case OR:
				rhs = builder().newBinaryOperator("|", ptrDeref, value, code);
				break;
			case XOR:
				rhs = builder().newBinaryOperator("^", ptrDeref, value, code);
				break;
			case MAX:
			case FMAX:
			case MIN:
			case FMIN:
			{
				String operatorCode = operation == AtomicRmwOp.MIN || operation == AtomicRmwOp.FMIN ? "<" : ">";
				BinaryOperator condition = builder().newBinaryOperator(operatorCode, ptrDeref, value, code);
				rhs = builder().newConditionalExpression(condition, ptrDeref, value, type, code);
				break;
			}
			case UMAX:
			case UMIN:
			{
				String operatorCode = operation == AtomicRmwOp.UMIN ? "<" : ">";
				BinaryOperator condition = builder().newBinaryOperator(operatorCode, unsignedCast(ptrDeref, type, code), unsignedCast(value, type, code), code);
				rhs = builder().newConditionalExpression(condition, ptrDeref, value, type, code);
				break;
			}
			default:
				throw new TranslationException("atomicrmw operation " + operation + " not supported");
		}

		BinaryOperator exchange = builder().newBinaryOperator("=", ptrDeref, rhs, code);
		exchange.setName("atomicrmw");

		if (lang.nameOf(instruction).isEmpty())
		{
			return exchange;
		}
		CompoundStatement compound = builder().newCompoundStatement(code);
		compound.addStatement(lang.declarationOrNot(ptrDeref, instruction));
		compound.addStatement(exchange);
		return compound;
	}

	private CastExpression unsignedCast(Expression expression, Type type, String code)
	{
		Type unsignedType = TypeParser.createFrom(TypeParser.unsignedVariantOf(type.getTypeName()));
		return builder().newCastExpression(unsignedType, expression, code);
	}

	// --- Merge instructions ---

	/**
	 * Declares the register of a merge instruction right away, so uses in later blocks resolve to
	 * it. Where the declaration ends up is decided by {@link #handlePhi}.
	 */
	private void registerPhi(IrInstruction instruction)
	{
		VariableDeclaration declaration = builder().newVariableDeclaration(lang.nameOf(instruction), lang.typeOf(instruction), instruction.getCode(), false);
		lang.getScopeManager().addDeclaration(declaration);
		lang.getBindingsCache().bind(lang.symbolNameOf(instruction), declaration);
		lang.addPendingPhi(instruction, declaration);
	}

	/**
	 * Materializes a merge instruction once all blocks of its function are lowered.
	 * With a single predecessor block the declaration is placed before that block's terminator.
	 * With several, it is placed at the start of the function body and every predecessor assigns
	 * its incoming value before its terminator.
	 *
	 * @throws TranslationException if the predecessors belong to different functions.
	 */
	void handlePhi(LlvmIrFrontend.PendingPhi phi, CompoundStatement functionBody)
	{
		IrInstruction instruction = phi.instruction;
		String code = instruction.getCode();
		List<IrBasicBlock> incomingBlocks = instruction.getIncomingBlocks();

		IrFunction blocksFunction = null;
		for (IrBasicBlock block : incomingBlocks)
		{
			if (blocksFunction == null)
			{
				blocksFunction = block.getParent();
			}
			else if (blocksFunction != block.getParent())
			{
				throw new TranslationException("The basic blocks of the phi instruction " + code + " are in different functions.");
			}
		}
		if (blocksFunction != null && blocksFunction != lang.getCurrentIrFunction())
		{
			throw new TranslationException("The basic blocks of the phi instruction " + code + " belong to another function.");
		}

		Map<LabelStatement, IrValue> incoming = new LinkedHashMap<>();
		for (int i = 0; i < incomingBlocks.size(); i++)
		{
			incoming.put(lang.labelFor(incomingBlocks.get(i)), instruction.getOperand(i));
		}

		VariableDeclaration declaration = phi.declaration;
		if (incoming.size() == 1)
		{
			Map.Entry<LabelStatement, IrValue> only = incoming.entrySet().iterator().next();
			builder().initialize(declaration, lang.getExpressionHandler().handle(only.getValue()));
			insertBeforeTerminator(only.getKey(), builder().newDeclarationStatement(declaration, code));
			return;
		}

		functionBody.insertStatement(0, builder().newDeclarationStatement(declaration, code));
		for (Map.Entry<LabelStatement, IrValue> entry : incoming.entrySet())
		{
			Expression value = lang.getExpressionHandler().handle(entry.getValue());
			BinaryOperator assignment = builder().newBinaryOperator("=", builder().newReference(declaration, code), value, code);
			insertBeforeTerminator(entry.getKey(), assignment);
		}
	}

	private void insertBeforeTerminator(LabelStatement label, Statement statement)
	{
		CompoundStatement block = lang.blockOf(label);
		if (block == null)
		{
			lang.getErrorReporter().warning("Predecessor block " + label.getLabel() + " was never lowered", statement.getCode());
			return;
		}
		block.insertBeforeTerminator(statement);
	}
}
