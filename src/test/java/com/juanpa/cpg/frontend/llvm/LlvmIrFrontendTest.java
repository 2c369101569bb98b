package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.BinaryOperator;
import com.juanpa.cpg.graph.expressions.DeclaredReferenceExpression;
import com.juanpa.cpg.graph.expressions.Literal;
import com.juanpa.cpg.graph.expressions.UnaryOperator;
import com.juanpa.cpg.graph.statements.*;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.semantics.TranslationException;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LlvmIrFrontendTest
{
	private static final IrType I1 = IrType.integer(1);
	private static final IrType I32 = IrType.integer(32);

	private ErrorReporter reporter;
	private LlvmIrFrontend frontend;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter();
		reporter.setEcho(false);
		frontend = new LlvmIrFrontend(LoweringConfig.defaults(), reporter);
	}

	@Test
	void phiWithSeveralPredecessorsIsDeclaredUpFrontAndAssignedInEachPredecessor()
	{
		IrModule module = new IrModule("phi");
		IrFunction function = module.addFunction(new IrFunction("choose", I32, "define i32 @choose(i1 %c)"));
		IrArgument c = function.addArgument("c", I1);
		IrBasicBlock entry = function.addBlock("entry");
		IrBasicBlock then = function.addBlock("then");
		IrBasicBlock otherwise = function.addBlock("else");
		IrBasicBlock merge = function.addBlock("merge");
		entry.addInstruction(new IrInstruction(Opcode.BR, "", IrType.voidType(), "br i1 %c, label %then, label %else")
				.addOperand(c).addOperand(otherwise).addOperand(then));
		then.addInstruction(jump(merge));
		otherwise.addInstruction(jump(merge));
		IrInstruction phi = merge.addInstruction(new IrInstruction(Opcode.PHI, "r", I32, "%r = phi i32 [ 1, %then ], [ 2, %else ]")
				.addIncoming(IrConstant.ofInt(1, I32), then)
				.addIncoming(IrConstant.ofInt(2, I32), otherwise));
		merge.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret i32 %r").addOperand(phi));

		FunctionDeclaration choose = frontend.translate(module).getFunction("choose");

		List<Statement> body = ((CompoundStatement) choose.getBody()).getStatements();
		assertEquals(5, body.size());
		VariableDeclaration r = (VariableDeclaration) ((DeclarationStatement) body.get(0)).getSingleDeclaration();
		assertEquals("r", r.getName());
		assertEquals("i32", r.getType().getTypeName());
		assertNull(r.getInitializer());

		List<Statement> thenBlock = blockOf(body.get(2)).getStatements();
		assertEquals(2, thenBlock.size());
		BinaryOperator assignment = (BinaryOperator) thenBlock.get(0);
		assertSame(r, ((DeclaredReferenceExpression) assignment.getLhs()).getRefersTo());
		assertEquals(1L, ((Literal<?>) assignment.getRhs()).getValue());
		assertInstanceOf(GotoStatement.class, thenBlock.get(1));

		BinaryOperator elseAssignment = (BinaryOperator) blockOf(body.get(3)).getStatements().get(0);
		assertEquals(2L, ((Literal<?>) elseAssignment.getRhs()).getValue());

		ReturnStatement ret = (ReturnStatement) blockOf(body.get(4)).getStatements().get(0);
		assertSame(r, ((DeclaredReferenceExpression) ret.getReturnValue()).getRefersTo());
	}

	@Test
	void phiWithSinglePredecessorIsInitializedBeforeItsTerminator()
	{
		IrModule module = new IrModule("phi");
		IrFunction function = module.addFunction(new IrFunction("single", I32, "define i32 @single()"));
		IrBasicBlock entry = function.addBlock("entry");
		IrBasicBlock next = function.addBlock("next");
		entry.addInstruction(jump(next));
		IrInstruction phi = next.addInstruction(new IrInstruction(Opcode.PHI, "v", I32, "%v = phi i32 [ 7, %entry ]")
				.addIncoming(IrConstant.ofInt(7, I32), entry));
		next.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret i32 %v").addOperand(phi));

		FunctionDeclaration single = frontend.translate(module).getFunction("single");

		List<Statement> body = ((CompoundStatement) single.getBody()).getStatements();
		assertEquals(2, body.size());
		List<Statement> entryBlock = blockOf(body.get(0)).getStatements();
		assertEquals(2, entryBlock.size());
		VariableDeclaration v = (VariableDeclaration) ((DeclarationStatement) entryBlock.get(0)).getSingleDeclaration();
		assertEquals(7L, ((Literal<?>) v.getInitializer()).getValue());
		assertInstanceOf(GotoStatement.class, entryBlock.get(1));
	}

	@Test
	void phiWithPredecessorOfAnotherFunctionAbortsTheUnit()
	{
		IrModule module = new IrModule("phi");
		IrFunction other = module.addFunction(new IrFunction("other", IrType.voidType(), "define void @other()"));
		IrBasicBlock foreign = other.addBlock("foreign");
		foreign.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret void"));

		IrFunction function = module.addFunction(new IrFunction("broken", I32, "define i32 @broken()"));
		IrBasicBlock entry = function.addBlock("entry");
		IrInstruction phi = entry.addInstruction(new IrInstruction(Opcode.PHI, "p", I32, "%p = phi i32 [ 0, %foreign ]")
				.addIncoming(IrConstant.ofInt(0, I32), foreign));
		entry.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret i32 %p").addOperand(phi));

		assertThrows(TranslationException.class, () -> frontend.translate(module));
		assertNull(frontend.getLabelMap().get("foreign"));
		assertEquals(1, frontend.getLabelMap().size());
	}

	@Test
	void structTypesBecomeRecordsWithIndexedFields()
	{
		IrModule module = new IrModule("structs");
		IrType node = IrType.struct("struct.node", List.of(I32));
		module.addStructType(node);

		TranslationUnitDeclaration unit = frontend.translate(module);

		RecordDeclaration record = unit.getRecord("struct.node");
		assertNotNull(record);
		assertEquals("struct", record.getKind());
		assertEquals(1, record.getFields().size());
		assertEquals("field_0", record.getFields().get(0).getName());
		assertEquals("i32", record.getFields().get(0).getType().getTypeName());
	}

	@Test
	void globalsAreTypedAsPointersAndResolvedByLoads()
	{
		IrModule module = new IrModule("globals");
		IrGlobal counter = new IrGlobal("counter", I32, "@counter = global i32 0");
		counter.setInitializer(IrConstant.ofInt(0, I32));
		module.addGlobal(counter);
		IrFunction function = module.addFunction(new IrFunction("read", I32, "define i32 @read()"));
		IrBasicBlock entry = function.addBlock("entry");
		IrInstruction load = entry.addInstruction(new IrInstruction(Opcode.LOAD, "v", I32, "%v = load i32, ptr @counter").addOperand(counter));
		entry.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret i32 %v").addOperand(load));

		TranslationUnitDeclaration unit = frontend.translate(module);

		VariableDeclaration global = unit.getDeclarationsByType(VariableDeclaration.class).get(0);
		assertEquals("counter", global.getName());
		assertEquals("i32*", global.getType().getTypeName());
		assertEquals(0L, ((Literal<?>) global.getInitializer()).getValue());

		Statement first = blockOf(((CompoundStatement) unit.getFunction("read").getBody()).getStatements().get(0)).getStatements().get(0);
		VariableDeclaration v = (VariableDeclaration) ((DeclarationStatement) first).getSingleDeclaration();
		UnaryOperator dereference = (UnaryOperator) v.getInitializer();
		assertSame(global, ((DeclaredReferenceExpression) dereference.getInput()).getRefersTo());
		assertEquals("i32", dereference.getType().getTypeName());
	}

	@Test
	void variadicFunctionsGetTrailingVaArgsParameter()
	{
		IrModule module = new IrModule("variadic");
		IrFunction printf = module.addFunction(new IrFunction("printf", I32, "declare i32 @printf(ptr, ...)"));
		printf.addArgument("", IrType.pointer());
		printf.setVariadic(true);

		FunctionDeclaration declaration = frontend.translate(module).getFunction("printf");

		List<ParameterDeclaration> parameters = declaration.getParameters();
		assertEquals(2, parameters.size());
		assertEquals("0", parameters.get(0).getName());
		assertTrue(parameters.get(1).isVariadic());
		assertEquals("va_args", parameters.get(1).getName());
		assertEquals(1, parameters.get(1).getArgumentIndex());
		assertFalse(declaration.hasBody());
	}

	@Test
	void unnamedValuesAreNamedAfterTheirSlot()
	{
		IrInstruction instruction = new IrInstruction(Opcode.ADD, "", I32, "  %4 = add i32 %2, 1");
		IrInstruction store = new IrInstruction(Opcode.STORE, "", IrType.voidType(), "store i32 %4, ptr %1");

		assertEquals("4", frontend.nameOf(instruction));
		assertEquals("%4", frontend.symbolNameOf(instruction));
		assertEquals("", frontend.nameOf(store));
	}

	@Test
	void localBindingsDoNotLeakIntoTheNextFunction()
	{
		IrModule module = new IrModule("locals");
		IrFunction first = module.addFunction(new IrFunction("first", IrType.voidType(), "define void @first()"));
		IrBasicBlock firstEntry = first.addBlock("entry");
		IrInstruction x = firstEntry.addInstruction(new IrInstruction(Opcode.ADD, "x", I32, "%x = add i32 1, 2")
				.addOperand(IrConstant.ofInt(1, I32)).addOperand(IrConstant.ofInt(2, I32)));
		firstEntry.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret void"));

		IrFunction second = module.addFunction(new IrFunction("second", I32, "define i32 @second()"));
		IrBasicBlock secondEntry = second.addBlock("entry");
		secondEntry.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret i32 %x").addOperand(x));

		TranslationUnitDeclaration unit = frontend.translate(module);

		Statement ret = blockOf(((CompoundStatement) unit.getFunction("second").getBody()).getStatements().get(0)).getStatements().get(0);
		DeclaredReferenceExpression reference = (DeclaredReferenceExpression) ((ReturnStatement) ret).getReturnValue();
		assertFalse(reference.isResolved());
		assertFalse(frontend.getBindingsCache().contains("%x"));
	}

	@Test
	void literalStructTypesGetSyntheticRecords()
	{
		IrModule module = new IrModule("literal");
		IrType pair = IrType.literalStruct(List.of(I32, IrType.pointer()));
		IrFunction function = module.addFunction(new IrFunction("make", pair, "declare { i32, ptr } @make()"));

		TranslationUnitDeclaration unit = frontend.translate(module);

		ObjectType type = (ObjectType) unit.getFunction("make").getType();
		assertEquals("literal_i32_ptr", type.getName());
		assertNotNull(type.getRecordDeclaration());
		assertSame(type.getRecordDeclaration(), unit.getRecord("literal_i32_ptr"));
	}

	private static IrInstruction jump(IrBasicBlock target)
	{
		return new IrInstruction(Opcode.BR, "", IrType.voidType(), "br label %" + target.getName()).addOperand(target);
	}

	private static CompoundStatement blockOf(Statement label)
	{
		return (CompoundStatement) ((LabelStatement) label).getSubStatement();
	}
}
