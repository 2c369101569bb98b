// File: src/main/java/com/juanpa/cpg/frontend/llvm/ExpressionHandler.java
package com.juanpa.cpg.frontend.llvm;

import com.juanpa.cpg.frontend.Handler;
import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.graph.NodeBuilder;
import com.juanpa.cpg.graph.declarations.Declaration;
import com.juanpa.cpg.graph.declarations.FieldDeclaration;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;
import com.juanpa.cpg.graph.declarations.ValueDeclaration;
import com.juanpa.cpg.graph.expressions.*;
import com.juanpa.cpg.semantics.PrimitiveType;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.UnknownType;
import com.juanpa.cpg.util.Debug;

import java.util.List;

/**
 * Lowers operands (constants and references to other values) and the instructions that map to a
 * single expression: casts, element pointer computations and selects.
 */
public class ExpressionHandler extends Handler<Expression, IrValue, LlvmIrFrontend>
{
	public ExpressionHandler(LlvmIrFrontend lang)
	{
		super(() -> new Literal<>(null, null), lang);
		map.put(IrConstant.class, value -> handleConstant((IrConstant) value));
		map.put(IrValue.class, this::handleReference);
	}

	private NodeBuilder builder()
	{
		return lang.getBuilder();
	}

	/**
	 * Resolves a use of a named value through the bindings cache, falling back to the scopes.
	 * A value that cannot be resolved becomes an unresolved reference and is reported.
	 */
	private Expression handleReference(IrValue value)
	{
		String symbolName = lang.symbolNameOf(value);
		ValueDeclaration bound = lang.getBindingsCache().resolve(symbolName);
		if (bound != null)
		{
			return builder().newReference(bound, value.getCode());
		}

		if (value instanceof IrFunction && lang.getFunction((IrFunction) value) != null)
		{
			return builder().newReference(lang.getFunction((IrFunction) value), value.getCode());
		}

		String name = lang.nameOf(value);
		Declaration declaration = name.isEmpty() ? null : lang.getScopeManager().lookup(name);
		if (declaration != null)
		{
			return builder().newReference(declaration, value.getCode());
		}

		lang.getErrorReporter().info("Could not resolve reference to " + symbolName, value.getCode());
		return builder().newDeclaredReferenceExpression(name, lang.typeOf(value), value.getCode());
	}

	private Expression handleConstant(IrConstant constant)
	{
		Type type = lang.typeOf(constant);
		String code = constant.getCode();
		switch (constant.getKind())
		{
			case INT:
				if (constant.getType() != null && constant.getType().getBitWidth() == 1)
				{
					return builder().newLiteral(((Number) constant.getValue()).longValue() != 0, type, code);
				}
				return builder().newLiteral(((Number) constant.getValue()).longValue(), type, code);
			case FLOAT:
				return builder().newLiteral(((Number) constant.getValue()).doubleValue(), type, code);
			case STRING:
				return builder().newLiteral((String) constant.getValue(), type, code);
			case NULL:
			case UNDEF:
			case POISON:
				return builder().newLiteral(null, type, code);
			case ZERO:
				return zeroValue(constant.getType(), code);
			case STRUCT:
			{
				ConstructExpression construct = builder().newConstructExpression(type, lang.recordFor(constant.getType()), code);
				for (IrValue element : constant.getElements())
				{
					construct.addArgument(handle(element));
				}
				return construct;
			}
			case ARRAY:
			case VECTOR:
			{
				InitializerListExpression list = builder().newInitializerListExpression(type, code);
				for (IrValue element : constant.getElements())
				{
					list.addInitializer(handle(element));
				}
				return list;
			}
			default:
				lang.getErrorReporter().info("Constant expression kept as text", code);
				return builder().newLiteral(code, type, code);
		}
	}

	/**
	 * Builds the value of a {@code zeroinitializer}: zero scalars, null pointers, and aggregates of
	 * those.
	 */
	private Expression zeroValue(IrType irType, String code)
	{
		Type type = lang.typeFrom(irType);
		if (irType == null)
		{
			return builder().newLiteral(null, type, code);
		}
		switch (irType.getKind())
		{
			case INTEGER:
				return irType.getBitWidth() == 1 ? builder().newLiteral(false, type, code) : builder().newLiteral(0L, type, code);
			case FLOAT:
				return builder().newLiteral(0.0, type, code);
			case STRUCT:
			{
				ConstructExpression construct = builder().newConstructExpression(type, lang.recordFor(irType), code);
				for (IrType field : irType.getFields())
				{
					construct.addArgument(zeroValue(field, code));
				}
				return construct;
			}
			case ARRAY:
			case VECTOR:
			{
				InitializerListExpression list = builder().newInitializerListExpression(type, code);
				for (int i = 0; i < irType.getLength(); i++)
				{
					list.addInitializer(zeroValue(irType.getElementType(), code));
				}
				return list;
			}
			default:
				return builder().newLiteral(null, type, code);
		}
	}

	/**
	 * Lowers a cast instruction into a cast of its operand to the instruction's type.
	 */
	public Expression handleCastInstruction(IrInstruction instruction)
	{
		CastExpression cast = builder().newCastExpression(lang.typeOf(instruction), lang.getOperandValueAtIndex(instruction, 0), instruction.getCode());
		cast.setName(instruction.getOpcode().name().toLowerCase());
		return cast;
	}

	/**
	 * Lowers {@code getelementptr} and {@code extractvalue} into chains of member accesses and
	 * array subscripts. Struct steps access {@code field_<n>} of the struct's record. The result
	 * of {@code getelementptr} is the address of the accessed element.
	 */
	public Expression handleGetElementPtr(IrInstruction instruction)
	{
		String code = instruction.getCode();
		Expression base = lang.getOperandValueAtIndex(instruction, 0);
		IrType baseType;
		boolean isGep = instruction.getOpcode() == Opcode.GETELEMENTPTR;

		if (isGep)
		{
			// the first index steps over the pointer itself
			if (instruction.getNumOperands() < 2)
			{
				return base;
			}
			base = subscript(base, lang.getOperandValueAtIndex(instruction, 1), code);
			baseType = instruction.getSourceElementType();
			if (baseType != null)
			{
				builder().setType(base, lang.typeFrom(baseType));
			}
			for (int i = 2; i < instruction.getNumOperands(); i++)
			{
				IrValue index = instruction.getOperand(i);
				if (baseType != null && baseType.getKind() == IrType.Kind.STRUCT)
				{
					if (!(index instanceof IrConstant) || ((IrConstant) index).getKind() != IrConstant.Kind.INT)
					{
						lang.getErrorReporter().warning("Struct index of getelementptr is not a constant", code);
						return builder().newUnaryOperator("&", false, true, base, code);
					}
					int fieldIndex = ((Number) ((IrConstant) index).getValue()).intValue();
					base = member(base, baseType, fieldIndex, code);
					baseType = fieldIndex < baseType.getFields().size() ? baseType.getFields().get(fieldIndex) : null;
				}
				else
				{
					base = subscript(base, lang.getOperandValueAtIndex(instruction, i), code);
					baseType = baseType == null ? null : baseType.getElementType();
					if (baseType != null)
					{
						builder().setType(base, lang.typeFrom(baseType));
					}
				}
			}
			return builder().newUnaryOperator("&", false, true, base, code);
		}

		baseType = instruction.getOperand(0).getType();
		for (int fieldIndex : instruction.getIndices())
		{
			if (baseType != null && baseType.getKind() == IrType.Kind.STRUCT)
			{
				base = member(base, baseType, fieldIndex, code);
				baseType = fieldIndex < baseType.getFields().size() ? baseType.getFields().get(fieldIndex) : null;
			}
			else
			{
				base = subscript(base, builder().newLiteral((long) fieldIndex, new PrimitiveType("i32"), code), code);
				baseType = baseType == null ? null : baseType.getElementType();
				if (baseType != null)
				{
					builder().setType(base, lang.typeFrom(baseType));
				}
			}
		}
		return base;
	}

	/**
	 * Accesses the field at {@code fieldIndex} of the record backing {@code structType}.
	 */
	MemberExpression member(Expression base, IrType structType, int fieldIndex, String code)
	{
		RecordDeclaration record = lang.recordFor(structType);
		FieldDeclaration field = null;
		if (record == null)
		{
			lang.getErrorReporter().warning("Could not find structure type with name " + structType.getName(), code);
		}
		else
		{
			field = record.getField("field_" + fieldIndex);
			if (field == null && fieldIndex < record.getFields().size())
			{
				field = record.getFields().get(fieldIndex);
			}
		}

		String fieldName = field != null ? field.getName() : "field_" + fieldIndex;
		MemberExpression member = builder().newMemberExpression(base, fieldName, ".", code);
		if (field != null)
		{
			member.setRefersTo(field);
			builder().setType(member, field.getType());
		}
		else
		{
			builder().setType(member, UnknownType.getUnknownType());
		}
		Debug.log("Accessing %s of %s", fieldName, structType.getName());
		return member;
	}

	private ArraySubscriptionExpression subscript(Expression array, Expression index, String code)
	{
		return builder().newArraySubscriptionExpression(array, index, code);
	}

	/**
	 * Lowers {@code select} into a conditional expression.
	 */
	public Expression handleSelect(IrInstruction instruction)
	{
		return builder().newConditionalExpression(
				lang.getOperandValueAtIndex(instruction, 0),
				lang.getOperandValueAtIndex(instruction, 1),
				lang.getOperandValueAtIndex(instruction, 2),
				lang.typeOf(instruction),
				instruction.getCode());
	}

	/**
	 * Lowers all operands of an instruction from {@code from} (inclusive) to {@code to} (exclusive).
	 */
	void addArguments(CallExpression call, IrInstruction instruction, int from, int to)
	{
		List<IrValue> operands = instruction.getOperands();
		for (int i = from; i < to && i < operands.size(); i++)
		{
			call.addArgument(handle(operands.get(i)));
		}
	}
}
