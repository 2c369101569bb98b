// File: src/main/java/com/juanpa/cpg/frontend/cxx/CxxFrontend.java
package com.juanpa.cpg.frontend.cxx;

import com.juanpa.cpg.frontend.LanguageFrontend;
import com.juanpa.cpg.frontend.cxx.ast.CompositeTypeSpecifier;
import com.juanpa.cpg.frontend.cxx.ast.CxxDeclaration;
import com.juanpa.cpg.frontend.cxx.ast.CxxNode;
import com.juanpa.cpg.frontend.cxx.ast.CxxTranslationUnit;
import com.juanpa.cpg.frontend.cxx.ast.DeclSpecifier;
import com.juanpa.cpg.frontend.cxx.ast.NamedTypeSpecifier;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;
import com.juanpa.cpg.graph.declarations.TranslationUnitDeclaration;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.TypeParser;
import com.juanpa.cpg.util.Debug;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;

/**
 * Lowers a C++-family translation unit: declarators, records, namespaces and function bodies.
 * Names are resolved in a single pass, so a reference to something declared further down stays
 * unresolved and its type is fixed up once the declaration appears.
 */
public class CxxFrontend extends LanguageFrontend
{
	private final DeclaratorHandler declaratorHandler;
	private final DeclarationHandler declarationHandler;
	private final StatementHandler statementHandler;
	private final ExpressionHandler expressionHandler;

	private TranslationUnitDeclaration translationUnit;

	public CxxFrontend(LoweringConfig config, ErrorReporter errorReporter)
	{
		super(config, errorReporter);
		this.declaratorHandler = new DeclaratorHandler(this);
		this.declarationHandler = new DeclarationHandler(this);
		this.statementHandler = new StatementHandler(this);
		this.expressionHandler = new ExpressionHandler(this);
	}

	public TranslationUnitDeclaration translate(CxxTranslationUnit unit)
	{
		Debug.log("Lowering translation unit %s", unit.getName());
		translationUnit = new TranslationUnitDeclaration(unit.getName(), null);
		scopeManager.resetToGlobal(translationUnit);

		for (CxxDeclaration declaration : unit.getDeclarations())
		{
			declarationHandler.lowerAll(declaration);
		}
		return translationUnit;
	}

	/**
	 * Builds the type named by a specifier plus a declarator's adjustment, bound to its record if
	 * the record is already known.
	 */
	public Type typeOf(String typeName, String typeAdjustment)
	{
		Type type = TypeParser.createFrom(typeName + typeAdjustment);
		if (type instanceof ObjectType)
		{
			RecordDeclaration record = findRecord(type.getName());
			if (record != null)
			{
				return new ObjectType(record.getName(), type.getTypeAdjustment(), record);
			}
		}
		return type;
	}

	/**
	 * Looks a record name up relative to the current namespace, moving outwards one level at a time.
	 */
	public RecordDeclaration findRecord(String name)
	{
		String delimiter = getNamespaceDelimiter();
		String prefix = scopeManager.getCurrentNamePrefixWithDelimiter();
		while (true)
		{
			RecordDeclaration record = getRecordForName(prefix + name).orElse(null);
			if (record != null || prefix.isEmpty())
			{
				return record;
			}
			String outer = prefix.substring(0, prefix.length() - delimiter.length());
			int cut = outer.lastIndexOf(delimiter);
			prefix = cut < 0 ? "" : outer.substring(0, cut + delimiter.length());
		}
	}

	/**
	 * @return The type name a specifier stands for; a record definition stands for its qualified name.
	 */
	public String typeNameOf(DeclSpecifier specifier)
	{
		if (specifier instanceof NamedTypeSpecifier)
		{
			return ((NamedTypeSpecifier) specifier).getTypeName();
		}
		if (specifier instanceof CompositeTypeSpecifier)
		{
			return scopeManager.getCurrentNamePrefixWithDelimiter() + ((CompositeTypeSpecifier) specifier).getName();
		}
		return "";
	}

	public String getNamespaceDelimiter()
	{
		return scopeManager.getNamespaceDelimiter();
	}

	@Override
	public String getCodeFromRawNode(Object astNode)
	{
		if (astNode instanceof CxxNode)
		{
			return ((CxxNode) astNode).getRawSignature();
		}
		return astNode == null ? null : astNode.toString();
	}

	public TranslationUnitDeclaration getTranslationUnit()
	{
		return translationUnit;
	}

	public DeclaratorHandler getDeclaratorHandler()
	{
		return declaratorHandler;
	}

	public DeclarationHandler getDeclarationHandler()
	{
		return declarationHandler;
	}

	public StatementHandler getStatementHandler()
	{
		return statementHandler;
	}

	public ExpressionHandler getExpressionHandler()
	{
		return expressionHandler;
	}
}
