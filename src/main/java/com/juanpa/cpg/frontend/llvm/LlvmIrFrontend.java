// File: src/main/java/com/juanpa/cpg/frontend/llvm/LlvmIrFrontend.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.LanguageFrontend;
import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.expressions.Expression;
import com.juanpa.cpg.graph.statements.CompoundStatement;
import com.juanpa.cpg.graph.statements.LabelStatement;
import com.juanpa.cpg.graph.statements.Statement;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.semantics.PrimitiveType;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.TypeParser;
import com.juanpa.cpg.semantics.UnknownType;
import com.juanpa.cpg.util.Debug;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lowers one SSA IR module into a translation unit.
 * Registers become variables, basic blocks become labels, and merge instructions are dissolved
 * into declarations and assignments at the end of their predecessor blocks.
 */
public class LlvmIrFrontend extends LanguageFrontend
{
	private static final Pattern SLOT_ASSIGNMENT = Pattern.compile("^\\s*%(\\d+)\\s*=");
	private static final Pattern SLOT_BLOCK = Pattern.compile("^\\s*(\\d+):");
	private static final Pattern SLOT_OPERAND = Pattern.compile("%(\\d+)\\s*$");

	private final BindingsCache bindingsCache = new BindingsCache();
	private final LabelMap labelMap = new LabelMap();
	private final List<PendingPhi> pendingPhis = new ArrayList<>();
	private final Map<IrFunction, FunctionDeclaration> functions = new IdentityHashMap<>();

	private final StatementHandler statementHandler;
	private final ExpressionHandler expressionHandler;
	private final DeclarationHandler declarationHandler;

	private TranslationUnitDeclaration translationUnit;
	private IrFunction currentFunction;

	/**
	 * A merge instruction whose declaration already exists but whose incoming values are only
	 * wired in once all blocks of its function are lowered.
	 */
	static final class PendingPhi
	{
		final IrInstruction instruction;
		final VariableDeclaration declaration;

		PendingPhi(IrInstruction instruction, VariableDeclaration declaration)
		{
			this.instruction = instruction;
			this.declaration = declaration;
		}
	}

	public LlvmIrFrontend(LoweringConfig config, ErrorReporter errorReporter)
	{
		super(config, errorReporter);
		this.statementHandler = new StatementHandler(this);
		this.expressionHandler = new ExpressionHandler(this);
		this.declarationHandler = new DeclarationHandler(this);
	}

	/**
	 * Lowers a whole module. Records come first, then globals, then every function signature,
	 * and finally the function bodies, so calls and references can be resolved regardless of
	 * definition order.
	 *
	 * @throws com.juanpa.cpg.semantics.TranslationException if the module is malformed.
	 */
	public TranslationUnitDeclaration translate(IrModule module)
	{
		Debug.log("Lowering module %s", module.getName());
		translationUnit = new TranslationUnitDeclaration(module.getName(), null);
		scopeManager.resetToGlobal(translationUnit);

		for (IrType structType : module.getStructTypes())
		{
			declarationHandler.handle(structType);
		}
		for (IrGlobal global : module.getGlobals())
		{
			declarationHandler.handle(global);
		}
		for (IrFunction function : module.getFunctions())
		{
			declarationHandler.handle(function);
		}
		for (IrFunction function : module.getFunctions())
		{
			if (!function.isDeclaration())
			{
				declarationHandler.handleFunctionBody(function, functions.get(function));
			}
		}
		return translationUnit;
	}

	// --- Per-function state ---

	/**
	 * Forgets the labels, local bindings and pending merge instructions of the previous function.
	 */
	void resetFunctionState(IrFunction function)
	{
		labelMap.clear();
		bindingsCache.clearLocals();
		pendingPhis.clear();
		currentFunction = function;
	}

	void addPendingPhi(IrInstruction instruction, VariableDeclaration declaration)
	{
		pendingPhis.add(new PendingPhi(instruction, declaration));
	}

	List<PendingPhi> getPendingPhis()
	{
		return Collections.unmodifiableList(pendingPhis);
	}

	IrFunction getCurrentIrFunction()
	{
		return currentFunction;
	}

	// --- Names ---

	/**
	 * Recovers the slot number of an unnamed value from its printed form.
	 *
	 * @return The slot number as a string, or an empty string if the value has none (e.g. a
	 * store, whose result is never named).
	 */
	public String guessSlotNumber(IrValue value)
	{
		String code = value.getCode();
		if (code != null)
		{
			Pattern pattern = value instanceof IrBasicBlock ? SLOT_BLOCK : value instanceof IrArgument ? SLOT_OPERAND : SLOT_ASSIGNMENT;
			Matcher matcher = pattern.matcher(code.strip().split("\n", 2)[0]);
			if (matcher.find())
			{
				return matcher.group(1);
			}
		}
		if (value instanceof IrArgument)
		{
			return String.valueOf(((IrArgument) value).getIndex());
		}
		return "";
	}

	/**
	 * @return The name of a value, falling back to its slot number; empty if it has neither.
	 */
	public String nameOf(IrValue value)
	{
		return value.getName().isEmpty() ? guessSlotNumber(value) : value.getName();
	}

	/**
	 * @return The symbol under which uses refer to the value, e.g. {@code %x}, {@code %4} or
	 * {@code @g}; empty if the value has no name.
	 */
	public String symbolNameOf(IrValue value)
	{
		String name = nameOf(value);
		if (name.isEmpty())
		{
			return "";
		}
		return (value.isGlobalSymbol() ? "@" : "%") + name;
	}

	/**
	 * Returns the label of a basic block, creating it on first use.
	 */
	public LabelStatement labelFor(IrBasicBlock block)
	{
		String labelName = nameOf(block);
		if (labelName.isEmpty() && block.getParent() != null)
		{
			labelName = "bb" + block.getParent().getBlocks().indexOf(block);
		}
		String finalName = labelName;
		return labelMap.getOrCreate(labelName, name -> builder.newLabelStatement(finalName, block.getCode()));
	}

	// --- Types ---

	public Type typeOf(IrValue value)
	{
		if (value instanceof IrGlobal)
		{
			return typeFrom(((IrGlobal) value).getValueType()).reference("*");
		}
		return typeFrom(value.getType());
	}

	/**
	 * Translates an IR type. Struct types are backed by their record; literal structs get a
	 * synthetic record named after their field types, created on first use.
	 */
	public Type typeFrom(IrType irType)
	{
		if (irType == null)
		{
			return UnknownType.getUnknownType();
		}

		switch (irType.getKind())
		{
			case INTEGER:
			case FLOAT:
			case VOID:
			case LABEL:
				return new PrimitiveType(irType.getName());
			case POINTER:
				return irType.getElementType() == null ? new PrimitiveType("ptr") : typeFrom(irType.getElementType()).reference("*");
			case VECTOR:
			case ARRAY:
				return typeFrom(irType.getElementType()).reference("[]");
			case STRUCT:
			{
				String name = recordNameOf(irType);
				RecordDeclaration record = getRecordForName(name).orElse(null);
				if (record == null && irType.isLiteralStruct())
				{
					record = declarationHandler.handleStructureType(irType);
				}
				return new ObjectType(name, "", record);
			}
			case FUNCTION:
				return typeFrom(irType.getElementType());
			default:
				return TypeParser.createFrom(irType.getName());
		}
	}

	/**
	 * @return The record name of a struct type: its own name, or {@code literal_<field types>}.
	 */
	public String recordNameOf(IrType structType)
	{
		if (!structType.isLiteralStruct())
		{
			return structType.getStructName();
		}
		return "literal_" + structType.getFields().stream()
				.map(field -> typeFrom(field).getTypeName())
				.collect(Collectors.joining("_"));
	}

	/**
	 * @return The record backing a struct type, or null if the type is no struct or is unknown.
	 */
	public RecordDeclaration recordFor(IrType structType)
	{
		if (structType == null || structType.getKind() != IrType.Kind.STRUCT)
		{
			return null;
		}
		Type type = typeFrom(structType);
		return type instanceof ObjectType ? ((ObjectType) type).getRecordDeclaration() : null;
	}

	// --- Lowering helpers shared by the handlers ---

	/**
	 * Lowers the operand at {@code index} of an instruction into an expression.
	 */
	public Expression getOperandValueAtIndex(IrInstruction instruction, int index)
	{
		return expressionHandler.handle(instruction.getOperand(index));
	}

	/**
	 * Wraps the expression computed by an instruction into a declaration of the instruction's
	 * result register, registered in the current scope and in the bindings cache. Instructions
	 * without a result register yield the bare expression.
	 */
	public Statement declarationOrNot(Expression rhs, IrValue value)
	{
		String name = nameOf(value);
		if (name.isEmpty())
		{
			return rhs;
		}

		VariableDeclaration declaration = builder.newVariableDeclaration(name, typeOf(value), value.getCode(), false);
		builder.initialize(declaration, rhs);
		scopeManager.addDeclaration(declaration);
		bindingsCache.bind(symbolNameOf(value), declaration);
		return builder.newDeclarationStatement(declaration, value.getCode());
	}

	void registerFunction(IrFunction irFunction, FunctionDeclaration declaration)
	{
		functions.put(irFunction, declaration);
	}

	/**
	 * @return The declaration lowered for an IR function, or null.
	 */
	public FunctionDeclaration getFunction(IrFunction irFunction)
	{
		return functions.get(irFunction);
	}

	CompoundStatement blockOf(LabelStatement label)
	{
		return label.getSubStatement() instanceof CompoundStatement ? (CompoundStatement) label.getSubStatement() : null;
	}

	@Override
	public String getCodeFromRawNode(Object astNode)
	{
		if (astNode instanceof IrValue)
		{
			return ((IrValue) astNode).getCode();
		}
		return astNode == null ? null : astNode.toString();
	}

	public TranslationUnitDeclaration getTranslationUnit()
	{
		return translationUnit;
	}

	public BindingsCache getBindingsCache()
	{
		return bindingsCache;
	}

	public LabelMap getLabelMap()
	{
		return labelMap;
	}

	public StatementHandler getStatementHandler()
	{
		return statementHandler;
	}

	public ExpressionHandler getExpressionHandler()
	{
		return expressionHandler;
	}

	public DeclarationHandler getDeclarationHandler()
	{
		return declarationHandler;
	}
}
