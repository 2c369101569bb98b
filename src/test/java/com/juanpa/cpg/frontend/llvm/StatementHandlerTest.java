package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.graph.declarations.FunctionDeclaration;
import com.juanpa.cpg.graph.declarations.TranslationUnitDeclaration;
import com.juanpa.cpg.graph.declarations.VariableDeclaration;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.graph.statements.*;
import com.juanpa.cpg.semantics.TranslationException;
import com.juanpa.cpg.util.Diagnostic;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatementHandlerTest
{
	private static final IrType I1 = IrType.integer(1);
	private static final IrType I32 = IrType.integer(32);
	private static final IrType DOUBLE = IrType.floating("double");
	private static final IrType PTR = IrType.pointer();

	private IrModule module;
	private IrFunction function;
	private IrBasicBlock entry;
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		module = new IrModule("test");
		function = module.addFunction(new IrFunction("f", IrType.voidType(), "define void @f()"));
		entry = function.addBlock("entry");
		reporter = new ErrorReporter();
		reporter.setEcho(false);
	}

	@Test
	void unsignedComparisonCastsBothOperands()
	{
		IrArgument a = function.addArgument("a", I32);
		IrArgument b = function.addArgument("b", I32);
		entry.addInstruction(new IrInstruction(Opcode.ICMP, "c", I1, "%c = icmp ult i32 %a, %b")
				.setIntPredicate(IntPredicate.ULT).addOperand(a).addOperand(b));

		Statement statement = lowerEntry().getStatements().get(0);

		VariableDeclaration c = declaredBy(statement);
		assertEquals("i1", c.getType().getTypeName());
		BinaryOperator comparison = (BinaryOperator) c.getInitializer();
		assertEquals("<", comparison.getOperatorCode());
		assertEquals("ui32", ((CastExpression) comparison.getLhs()).getCastType().getTypeName());
		assertEquals("ui32", ((CastExpression) comparison.getRhs()).getCastType().getTypeName());
	}

	@Test
	void logicalShiftRightOnlyCastsTheShiftedValue()
	{
		IrArgument a = function.addArgument("a", I32);
		IrArgument b = function.addArgument("b", I32);
		entry.addInstruction(new IrInstruction(Opcode.LSHR, "s", I32, "%s = lshr i32 %a, %b").addOperand(a).addOperand(b));

		BinaryOperator shift = (BinaryOperator) declaredBy(lowerEntry().getStatements().get(0)).getInitializer();

		assertEquals(">>", shift.getOperatorCode());
		assertInstanceOf(CastExpression.class, shift.getLhs());
		assertInstanceOf(DeclaredReferenceExpression.class, shift.getRhs());
	}

	@Test
	void unorderedComparisonsCallIsUnordered()
	{
		IrArgument a = function.addArgument("a", DOUBLE);
		IrArgument b = function.addArgument("b", DOUBLE);
		entry.addInstruction(new IrInstruction(Opcode.FCMP, "u", I1, "%u = fcmp uno double %a, %b")
				.setRealPredicate(RealPredicate.UNO).addOperand(a).addOperand(b));
		entry.addInstruction(new IrInstruction(Opcode.FCMP, "q", I1, "%q = fcmp ueq double %a, %b")
				.setRealPredicate(RealPredicate.UEQ).addOperand(a).addOperand(b));

		List<Statement> statements = lowerEntry().getStatements();

		CallExpression uno = (CallExpression) declaredBy(statements.get(0)).getInitializer();
		assertEquals("isunordered", uno.getFqn());
		assertEquals(2, uno.getArguments().size());

		BinaryOperator ueq = (BinaryOperator) declaredBy(statements.get(1)).getInitializer();
		assertEquals("||", ueq.getOperatorCode());
		assertEquals("isunordered", ((CallExpression) ueq.getLhs()).getFqn());
		assertEquals("==", ((BinaryOperator) ueq.getRhs()).getOperatorCode());
	}

	@Test
	void constantFloatPredicatesBecomeBooleanLiterals()
	{
		IrArgument a = function.addArgument("a", DOUBLE);
		entry.addInstruction(new IrInstruction(Opcode.FCMP, "t", I1, "%t = fcmp true double %a, %a")
				.setRealPredicate(RealPredicate.TRUE).addOperand(a).addOperand(a));

		Literal<?> literal = (Literal<?>) declaredBy(lowerEntry().getStatements().get(0)).getInitializer();

		assertEquals(Boolean.TRUE, literal.getValue());
	}

	@Test
	void storeBecomesAssignmentThroughPointer()
	{
		IrArgument p = function.addArgument("p", PTR);
		entry.addInstruction(new IrInstruction(Opcode.STORE, "", IrType.voidType(), "store i32 1, ptr %p")
				.addOperand(IrConstant.ofInt(1, I32)).addOperand(p));

		BinaryOperator store = (BinaryOperator) lowerEntry().getStatements().get(0);

		assertEquals("=", store.getOperatorCode());
		UnaryOperator target = (UnaryOperator) store.getLhs();
		assertEquals("*", target.getOperatorCode());
		assertEquals(1L, ((Literal<?>) store.getRhs()).getValue());
	}

	@Test
	void atomicrmwWithUsedResultDeclaresOldValueFirst()
	{
		IrArgument p = function.addArgument("p", PTR);
		entry.addInstruction(new IrInstruction(Opcode.ATOMICRMW, "old", I32, "%old = atomicrmw add ptr %p, i32 1 seq_cst")
				.setRmwOp(AtomicRmwOp.ADD).addOperand(p).addOperand(IrConstant.ofInt(1, I32)));

		CompoundStatement compound = (CompoundStatement) lowerEntry().getStatements().get(0);

		assertEquals(2, compound.getStatements().size());
		UnaryOperator oldValue = (UnaryOperator) declaredBy(compound.getStatements().get(0)).getInitializer();
		assertEquals("*", oldValue.getOperatorCode());
		BinaryOperator exchange = (BinaryOperator) compound.getStatements().get(1);
		assertEquals("atomicrmw", exchange.getName());
		assertEquals("+", ((BinaryOperator) exchange.getRhs()).getOperatorCode());
	}

	@Test
	void atomicrmwWithUnusedResultIsASingleAssignment()
	{
		IrArgument p = function.addArgument("p", PTR);
		entry.addInstruction(new IrInstruction(Opcode.ATOMICRMW, "", I32, "atomicrmw umax ptr %p, i32 7 seq_cst")
				.setRmwOp(AtomicRmwOp.UMAX).addOperand(p).addOperand(IrConstant.ofInt(7, I32)));

		BinaryOperator exchange = (BinaryOperator) lowerEntry().getStatements().get(0);

		ConditionalExpression max = (ConditionalExpression) exchange.getRhs();
		BinaryOperator condition = (BinaryOperator) max.getCondition();
		assertEquals(">", condition.getOperatorCode());
		assertEquals("ui32", ((CastExpression) condition.getLhs()).getCastType().getTypeName());
	}

	@Test
	void unknownAtomicrmwOperationAbortsTheUnit()
	{
		IrArgument p = function.addArgument("p", PTR);
		entry.addInstruction(new IrInstruction(Opcode.ATOMICRMW, "x", I32, "%x = atomicrmw uinc_wrap ptr %p, i32 1 seq_cst")
				.setRmwOp(AtomicRmwOp.UNKNOWN).addOperand(p).addOperand(IrConstant.ofInt(1, I32)));

		assertThrows(TranslationException.class, this::lowerEntry);
	}

	@Test
	void cmpxchgBuildsResultPairAndConditionalStore()
	{
		IrArgument p = function.addArgument("p", PTR);
		IrType pair = IrType.literalStruct(List.of(I32, I1));
		entry.addInstruction(new IrInstruction(Opcode.ATOMICCMPXCHG, "res", pair, "%res = cmpxchg ptr %p, i32 0, i32 1 seq_cst seq_cst")
				.addOperand(p).addOperand(IrConstant.ofInt(0, I32)).addOperand(IrConstant.ofInt(1, I32)));

		CompoundStatement compound = (CompoundStatement) lowerEntry().getStatements().get(0);

		assertEquals("atomiccmpxchg", compound.getName());
		ConstructExpression result = (ConstructExpression) declaredBy(compound.getStatements().get(0)).getInitializer();
		assertEquals(2, result.getArguments().size());
		assertEquals("literal_i32_i1", result.getInstantiates().getName());
		IfStatement store = (IfStatement) compound.getStatements().get(1);
		assertEquals("==", ((BinaryOperator) store.getCondition()).getOperatorCode());
		assertEquals("=", ((BinaryOperator) store.getThenStatement()).getOperatorCode());
		assertNull(store.getElseStatement());
	}

	@Test
	void insertvalueIntoRegisterCopiesAndAssignsField()
	{
		IrType pair = IrType.struct("pair", List.of(I32, I32));
		module.addStructType(pair);
		IrArgument agg = function.addArgument("agg", pair);
		entry.addInstruction(new IrInstruction(Opcode.INSERTVALUE, "agg2", pair, "%agg2 = insertvalue %pair %agg, i32 5, 1")
				.addOperand(agg).addOperand(IrConstant.ofInt(5, I32)).setIndices(1));

		CompoundStatement compound = (CompoundStatement) lowerEntry().getStatements().get(0);

		VariableDeclaration copy = declaredBy(compound.getStatements().get(0));
		assertEquals("agg2", copy.getName());
		BinaryOperator assignment = (BinaryOperator) compound.getStatements().get(1);
		MemberExpression field = (MemberExpression) assignment.getLhs();
		assertEquals("field_1", field.getName());
		assertNotNull(field.getRefersTo());
		assertSame(copy, ((DeclaredReferenceExpression) field.getBase()).getRefersTo());
	}

	@Test
	void insertvalueIntoConstantReplacesConstructorArgument()
	{
		IrType pair = IrType.struct("pair", List.of(I32, I32));
		module.addStructType(pair);
		IrConstant constant = new IrConstant(IrConstant.Kind.STRUCT, null, pair, "%pair { i32 1, i32 2 }");
		constant.addElement(IrConstant.ofInt(1, I32));
		constant.addElement(IrConstant.ofInt(2, I32));
		entry.addInstruction(new IrInstruction(Opcode.INSERTVALUE, "v", pair, "%v = insertvalue %pair { i32 1, i32 2 }, i32 5, 1")
				.addOperand(constant).addOperand(IrConstant.ofInt(5, I32)).setIndices(1));

		ConstructExpression construct = (ConstructExpression) declaredBy(lowerEntry().getStatements().get(0)).getInitializer();

		assertEquals(1L, ((Literal<?>) construct.getArguments().get(0)).getValue());
		assertEquals(5L, ((Literal<?>) construct.getArguments().get(1)).getValue());
	}

	@Test
	void insertvalueOutOfBoundsOfConstantIsReported()
	{
		IrType pair = IrType.struct("pair", List.of(I32, I32));
		module.addStructType(pair);
		IrConstant constant = new IrConstant(IrConstant.Kind.STRUCT, null, pair, "%pair { i32 1, i32 2 }");
		constant.addElement(IrConstant.ofInt(1, I32));
		constant.addElement(IrConstant.ofInt(2, I32));
		entry.addInstruction(new IrInstruction(Opcode.INSERTVALUE, "v", pair, "%v = insertvalue %pair { i32 1, i32 2 }, i32 5, 3")
				.addOperand(constant).addOperand(IrConstant.ofInt(5, I32)).setIndices(3));

		List<Statement> statements = ((CompoundStatement) lowerEntry().getStatements().get(0)).getStatements();

		assertTrue(reporter.hasErrors());
		assertEquals("v", declaredBy(statements.get(0)).getName());
	}

	@Test
	void insertvalueIntoArrayOfConstantAssignsElementOfDeclaredCopy()
	{
		IrType array = IrType.array(I32, 2);
		IrType outer = IrType.struct("outer", List.of(I32, array));
		module.addStructType(outer);
		IrConstant elements = new IrConstant(IrConstant.Kind.ARRAY, null, array, "[2 x i32] [i32 1, i32 2]");
		elements.addElement(IrConstant.ofInt(1, I32));
		elements.addElement(IrConstant.ofInt(2, I32));
		IrConstant constant = new IrConstant(IrConstant.Kind.STRUCT, null, outer, "%outer { i32 0, [2 x i32] [i32 1, i32 2] }");
		constant.addElement(IrConstant.ofInt(0, I32));
		constant.addElement(elements);
		IrInstruction insert = entry.addInstruction(new IrInstruction(Opcode.INSERTVALUE, "r", outer,
				"%r = insertvalue %outer { i32 0, [2 x i32] [i32 1, i32 2] }, i32 5, 1, 0")
				.addOperand(constant).addOperand(IrConstant.ofInt(5, I32)).setIndices(1, 0));
		entry.addInstruction(new IrInstruction(Opcode.EXTRACTVALUE, "s", I32, "%s = extractvalue %outer %r, 0")
				.addOperand(insert).setIndices(0));

		List<Statement> statements = lowerEntry().getStatements();

		CompoundStatement compound = (CompoundStatement) statements.get(0);
		VariableDeclaration r = declaredBy(compound.getStatements().get(0));
		assertEquals("r", r.getName());
		assertInstanceOf(ConstructExpression.class, r.getInitializer());
		BinaryOperator assignment = (BinaryOperator) compound.getStatements().get(1);
		ArraySubscriptionExpression element = (ArraySubscriptionExpression) assignment.getLhs();
		assertEquals(0L, ((Literal<?>) element.getSubscriptExpression()).getValue());
		MemberExpression field = (MemberExpression) element.getArrayExpression();
		assertEquals("field_1", field.getName());
		assertSame(r, ((DeclaredReferenceExpression) field.getBase()).getRefersTo());

		MemberExpression use = (MemberExpression) declaredBy(statements.get(1)).getInitializer();
		assertSame(r, ((DeclaredReferenceExpression) use.getBase()).getRefersTo());
		assertFalse(reporter.hasErrors());
	}

	@Test
	void cmpxchgWithoutResultOnlyStores()
	{
		IrArgument p = function.addArgument("p", PTR);
		IrType pair = IrType.literalStruct(List.of(I32, I1));
		entry.addInstruction(new IrInstruction(Opcode.ATOMICCMPXCHG, "", pair, "cmpxchg ptr %p, i32 0, i32 1 seq_cst seq_cst")
				.addOperand(p).addOperand(IrConstant.ofInt(0, I32)).addOperand(IrConstant.ofInt(1, I32)));

		CompoundStatement compound = (CompoundStatement) lowerEntry().getStatements().get(0);

		assertEquals(1, compound.getStatements().size());
		assertInstanceOf(IfStatement.class, compound.getStatements().get(0));
	}

	@Test
	void shufflevectorSelectsFromBothVectorsAndFillsUndefined()
	{
		IrType vec2 = IrType.vector(I32, 2);
		IrArgument a = function.addArgument("a", vec2);
		IrArgument b = function.addArgument("b", vec2);
		entry.addInstruction(new IrInstruction(Opcode.SHUFFLEVECTOR, "s", IrType.vector(I32, 3),
				"%s = shufflevector <2 x i32> %a, <2 x i32> %b, <3 x i32> <i32 0, i32 3, i32 5>")
				.addOperand(a).addOperand(b).setMask(0, 3, 5));

		InitializerListExpression list = (InitializerListExpression) declaredBy(lowerEntry().getStatements().get(0)).getInitializer();

		assertEquals(3, list.getInitializers().size());
		ArraySubscriptionExpression first = (ArraySubscriptionExpression) list.getInitializers().get(0);
		assertEquals("a", first.getArrayExpression().getName());
		ArraySubscriptionExpression second = (ArraySubscriptionExpression) list.getInitializers().get(1);
		assertEquals("b", second.getArrayExpression().getName());
		assertEquals(1L, ((Literal<?>) second.getSubscriptExpression()).getValue());
		Literal<?> third = (Literal<?>) list.getInitializers().get(2);
		assertFalse(third.hasValue());
		assertEquals("i32", third.getType().getTypeName());
	}

	@Test
	void shufflevectorWithUndefinedSecondVectorOnlyUsesTheFirst()
	{
		IrType vec2 = IrType.vector(I32, 2);
		IrArgument a = function.addArgument("a", vec2);
		entry.addInstruction(new IrInstruction(Opcode.SHUFFLEVECTOR, "s", vec2,
				"%s = shufflevector <2 x i32> %a, <2 x i32> undef, <2 x i32> <i32 1, i32 2>")
				.addOperand(a).addOperand(IrConstant.undef(vec2)).setMask(1, 2));

		InitializerListExpression list = (InitializerListExpression) declaredBy(lowerEntry().getStatements().get(0)).getInitializer();

		assertInstanceOf(ArraySubscriptionExpression.class, list.getInitializers().get(0));
		assertFalse(((Literal<?>) list.getInitializers().get(1)).hasValue());
	}

	@Test
	void getelementptrTakesAddressOfStructField()
	{
		IrType pair = IrType.struct("pair", List.of(I32, I32));
		module.addStructType(pair);
		IrArgument p = function.addArgument("p", PTR);
		entry.addInstruction(new IrInstruction(Opcode.GETELEMENTPTR, "f1", PTR, "%f1 = getelementptr %pair, ptr %p, i32 0, i32 1")
				.addOperand(p).addOperand(IrConstant.ofInt(0, I32)).addOperand(IrConstant.ofInt(1, I32))
				.setSourceElementType(pair));

		UnaryOperator address = (UnaryOperator) declaredBy(lowerEntry().getStatements().get(0)).getInitializer();

		assertEquals("&", address.getOperatorCode());
		MemberExpression field = (MemberExpression) address.getInput();
		assertEquals("field_1", field.getName());
		assertEquals("i32", field.getType().getTypeName());
		assertInstanceOf(ArraySubscriptionExpression.class, field.getBase());
	}

	@Test
	void unsupportedInstructionIsReportedAndReplaced()
	{
		entry.addInstruction(new IrInstruction(Opcode.FENCE, "", IrType.voidType(), "fence seq_cst"));

		Statement statement = lowerEntry().getStatements().get(0);

		assertInstanceOf(EmptyStatement.class, statement);
		assertTrue(reporter.hasErrors());
		Diagnostic diagnostic = reporter.getDiagnostics().stream()
				.filter(d -> d.getSeverity() == Diagnostic.Severity.ERROR)
				.findFirst()
				.orElseThrow();
		assertEquals("fence seq_cst", diagnostic.getConstruct());
	}

	@Test
	void switchHasCaseAndGotoPerTargetFollowedByDefault()
	{
		IrArgument x = function.addArgument("x", I32);
		IrBasicBlock one = function.addBlock("one");
		IrBasicBlock otherwise = function.addBlock("otherwise");
		entry.addInstruction(new IrInstruction(Opcode.SWITCH, "", IrType.voidType(), "switch i32 %x, label %otherwise [ i32 1, label %one ]")
				.addOperand(x).addOperand(otherwise).addOperand(IrConstant.ofInt(1, I32)).addOperand(one));
		one.addInstruction(ret());
		otherwise.addInstruction(ret());

		SwitchStatement switchStatement = (SwitchStatement) blockStatements(lower(), 0).get(0);

		List<Statement> cases = switchStatement.getStatement().getStatements();
		assertEquals(4, cases.size());
		assertEquals(1L, ((Literal<?>) ((CaseStatement) cases.get(0)).getCaseExpression()).getValue());
		assertEquals("one", ((GotoStatement) cases.get(1)).getLabelName());
		assertInstanceOf(DefaultStatement.class, cases.get(2));
		assertEquals("otherwise", ((GotoStatement) cases.get(3)).getLabelName());
	}

	@Test
	void switchWithoutDefaultTargetAbortsTheUnit()
	{
		IrArgument x = function.addArgument("x", I32);
		IrBasicBlock one = function.addBlock("one");
		entry.addInstruction(new IrInstruction(Opcode.SWITCH, "", IrType.voidType(), "switch i32 %x")
				.addOperand(x).addOperand(one).addOperand(IrConstant.ofInt(1, I32)));
		one.addInstruction(ret());

		assertThrows(TranslationException.class, this::lower);
	}

	@Test
	void indirectbrSwitchesOverBlockAddresses()
	{
		IrArgument address = function.addArgument("addr", PTR);
		IrBasicBlock left = function.addBlock("left");
		IrBasicBlock right = function.addBlock("right");
		entry.addInstruction(new IrInstruction(Opcode.INDIRECTBR, "", IrType.voidType(), "indirectbr ptr %addr, [label %left, label %right]")
				.addOperand(address).addOperand(left).addOperand(right));
		left.addInstruction(ret());
		right.addInstruction(ret());

		SwitchStatement switchStatement = (SwitchStatement) blockStatements(lower(), 0).get(0);

		List<Statement> cases = switchStatement.getStatement().getStatements();
		assertEquals(4, cases.size());
		assertEquals("blockaddress(left)", ((Literal<?>) ((CaseStatement) cases.get(0)).getCaseExpression()).getValue());
		assertEquals("right", ((GotoStatement) cases.get(3)).getLabelName());
	}

	@Test
	void conditionalBranchJumpsToThenAndElseTargets()
	{
		IrArgument c = function.addArgument("c", I1);
		IrBasicBlock yes = function.addBlock("yes");
		IrBasicBlock no = function.addBlock("no");
		entry.addInstruction(new IrInstruction(Opcode.BR, "", IrType.voidType(), "br i1 %c, label %yes, label %no")
				.addOperand(c).addOperand(no).addOperand(yes));
		yes.addInstruction(ret());
		no.addInstruction(ret());

		IfStatement branch = (IfStatement) blockStatements(lower(), 0).get(0);

		assertEquals("c", branch.getCondition().getName());
		assertEquals("yes", ((GotoStatement) branch.getThenStatement()).getLabelName());
		assertEquals("no", ((GotoStatement) branch.getElseStatement()).getLabelName());
	}

	@Test
	void branchWithTwoOperandsAbortsTheUnit()
	{
		IrArgument c = function.addArgument("c", I1);
		IrBasicBlock next = function.addBlock("next");
		entry.addInstruction(new IrInstruction(Opcode.BR, "", IrType.voidType(), "br i1 %c, label %next")
				.addOperand(c).addOperand(next));
		next.addInstruction(ret());

		assertThrows(TranslationException.class, this::lower);
	}

	@Test
	void invokeIsWrappedInTryWithCatchJumpingToLandingPad()
	{
		IrFunction mayThrow = module.addFunction(new IrFunction("may_throw", I32, "declare i32 @may_throw()"));
		IrBasicBlock cont = function.addBlock("cont");
		IrBasicBlock lpad = function.addBlock("lpad");
		IrInstruction invoke = entry.addInstruction(new IrInstruction(Opcode.INVOKE, "r", I32,
				"%r = invoke i32 @may_throw() to label %cont unwind label %lpad")
				.addOperand(cont).addOperand(lpad).addOperand(mayThrow));
		cont.addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret i32 %r").addOperand(invoke));
		IrInstruction landingpad = lpad.addInstruction(new IrInstruction(Opcode.LANDINGPAD, "lp", IrType.literalStruct(List.of(PTR, I32)),
				"%lp = landingpad { ptr, i32 } catch ptr null")
				.addClause(IrConstant.nullPointer(PTR)));
		lpad.addInstruction(new IrInstruction(Opcode.RESUME, "", IrType.voidType(), "resume { ptr, i32 } %lp").addOperand(landingpad));

		TranslationUnitDeclaration unit = lower();

		TryStatement tryStatement = (TryStatement) blockStatements(unit, 0).get(0);
		List<Statement> tryBlock = tryStatement.getTryBlock().getStatements();
		CallExpression call = (CallExpression) declaredBy(tryBlock.get(0)).getInitializer();
		assertEquals("may_throw", call.getFqn());
		assertSame(unit.getFunction("may_throw"), call.getInvokes().get(0));
		assertEquals("cont", ((GotoStatement) tryBlock.get(1)).getLabelName());

		CatchClause catchClause = tryStatement.getCatchClauses().get(0);
		assertEquals("lpad", ((GotoStatement) catchClause.getBody().getStatements().get(0)).getLabelName());

		List<Statement> landing = blockStatements(unit, 2);
		CatchClause handler = (CatchClause) landing.get(0);
		assertEquals("e_lp", handler.getParameter().getName());
		assertEquals("...", handler.getName());
		assertEquals("resume", landing.get(1).getName());
	}

	@Test
	void landingpadJoinsCaughtTypesAndSkipsFilters()
	{
		IrGlobal typeInfo = new IrGlobal("_ZTIi", PTR, "@_ZTIi = external constant ptr");
		IrConstant filter = new IrConstant(IrConstant.Kind.ARRAY, null, IrType.array(PTR, 1), "[1 x ptr] [ptr @_ZTIi]");
		entry.addInstruction(new IrInstruction(Opcode.LANDINGPAD, "lp", IrType.literalStruct(List.of(PTR, I32)),
				"%lp = landingpad { ptr, i32 } catch ptr @_ZTIi filter [1 x ptr] [ptr @_ZTIi] catch ptr null")
				.addClause(typeInfo).addClause(filter).addClause(IrConstant.nullPointer(PTR)));

		CatchClause handler = (CatchClause) lowerEntry().getStatements().get(0);

		assertEquals("_ZTIi | ...", handler.getName());
		assertEquals(Diagnostic.Severity.WARNING, reporter.getDiagnostics().stream()
				.filter(d -> d.getMessage().contains("Filter"))
				.findFirst().orElseThrow().getSeverity());
	}

	@Test
	void branchesToTheSameBlockShareItsLabel()
	{
		IrArgument c = function.addArgument("c", I1);
		IrBasicBlock detour = function.addBlock("detour");
		IrBasicBlock exit = function.addBlock("exit");
		entry.addInstruction(new IrInstruction(Opcode.BR, "", IrType.voidType(), "br i1 %c, label %detour, label %exit")
				.addOperand(c).addOperand(exit).addOperand(detour));
		detour.addInstruction(new IrInstruction(Opcode.BR, "", IrType.voidType(), "br label %exit").addOperand(exit));
		exit.addInstruction(ret());

		TranslationUnitDeclaration unit = lower();

		LabelStatement exitLabel = (LabelStatement) ((CompoundStatement) unit.getFunction("f").getBody()).getStatements().get(2);
		IfStatement branch = (IfStatement) blockStatements(unit, 0).get(0);
		GotoStatement jump = (GotoStatement) blockStatements(unit, 1).get(0);
		assertSame(exitLabel, ((GotoStatement) branch.getElseStatement()).getTargetLabel());
		assertSame(exitLabel, jump.getTargetLabel());
	}

	@Test
	void everyUseOfARegisterRefersToItsSingleDeclaration()
	{
		IrArgument a = function.addArgument("a", I32);
		IrInstruction sum = entry.addInstruction(new IrInstruction(Opcode.ADD, "sum", I32, "%sum = add i32 %a, 1")
				.addOperand(a).addOperand(IrConstant.ofInt(1, I32)));
		entry.addInstruction(new IrInstruction(Opcode.MUL, "sq", I32, "%sq = mul i32 %sum, %sum")
				.addOperand(sum).addOperand(sum));

		List<Statement> statements = lowerEntry().getStatements();

		VariableDeclaration declaration = declaredBy(statements.get(0));
		BinaryOperator square = (BinaryOperator) declaredBy(statements.get(1)).getInitializer();
		assertSame(declaration, ((DeclaredReferenceExpression) square.getLhs()).getRefersTo());
		assertSame(declaration, ((DeclaredReferenceExpression) square.getRhs()).getRefersTo());
	}

	private static IrInstruction ret()
	{
		return new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret void");
	}

	private TranslationUnitDeclaration lower()
	{
		return new LlvmIrFrontend(LoweringConfig.defaults(), reporter).translate(module);
	}

	/**
	 * Terminates the entry block, lowers the module and returns the statements of the entry block.
	 */
	private CompoundStatement lowerEntry()
	{
		entry.addInstruction(ret());
		TranslationUnitDeclaration unit = lower();
		return block(unit, 0);
	}

	private static CompoundStatement block(TranslationUnitDeclaration unit, int index)
	{
		FunctionDeclaration f = unit.getFunction("f");
		List<Statement> labels = ((CompoundStatement) f.getBody()).getStatements();
		return (CompoundStatement) ((LabelStatement) labels.get(index)).getSubStatement();
	}

	private static List<Statement> blockStatements(TranslationUnitDeclaration unit, int index)
	{
		return block(unit, index).getStatements();
	}

	private static VariableDeclaration declaredBy(Statement statement)
	{
		return (VariableDeclaration) ((DeclarationStatement) statement).getSingleDeclaration();
	}
}
