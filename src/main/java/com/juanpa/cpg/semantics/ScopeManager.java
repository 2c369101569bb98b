// File: src/main/java/com/juanpa/cpg/semantics/ScopeManager.java
package com.juanpa.cpg.semantics;

import com.juanpa.cpg.graph.Node;
import com.juanpa.cpg.graph.declarations.*;
import com.juanpa.cpg.graph.statements.TryStatement;
import com.juanpa.cpg.util.Debug;

import java.util.function.Predicate;

/**
 * Manages the stack of lexical scopes while a translation unit is lowered.
 * Lookups walk from the innermost scope outwards and return null for unknown names; callers are
 * expected to cope with unresolved references.
 */
public class ScopeManager
{
	private final String namespaceDelimiter;
	private Scope globalScope;
	private Scope currentScope;
	private TranslationUnitDeclaration translationUnit;

	public ScopeManager(String namespaceDelimiter)
	{
		this.namespaceDelimiter = namespaceDelimiter;
		resetToGlobal(null);
	}

	/**
	 * Drops every open scope and starts over with a fresh global scope for the given unit.
	 */
	public void resetToGlobal(TranslationUnitDeclaration translationUnit)
	{
		this.translationUnit = translationUnit;
		this.globalScope = new Scope(ScopeKind.GLOBAL, translationUnit, null, "");
		this.currentScope = globalScope;
	}

	/**
	 * Opens a new scope owned by {@code owner}. The kind follows from the owner: functions,
	 * records, namespaces and try statements open their own kind, everything else a block scope.
	 */
	public Scope enterScope(Node owner)
	{
		ScopeKind kind;
		String scopedName = currentScope.getScopedName();
		if (owner instanceof FunctionDeclaration)
		{
			kind = ScopeKind.FUNCTION;
		}
		else if (owner instanceof RecordDeclaration)
		{
			kind = ScopeKind.RECORD;
			scopedName = owner.getName();
		}
		else if (owner instanceof NamespaceDeclaration)
		{
			kind = ScopeKind.NAMESPACE;
			scopedName = owner.getName();
		}
		else if (owner instanceof TryStatement)
		{
			kind = ScopeKind.TRY;
		}
		else
		{
			kind = ScopeKind.BLOCK;
		}

		currentScope = new Scope(kind, owner, currentScope, scopedName);
		Debug.log("Entered %s", currentScope);
		Debug.indent();
		return currentScope;
	}

	/**
	 * Closes the innermost scope.
	 *
	 * @throws IllegalStateException if the innermost scope is not owned by {@code owner}.
	 */
	public Scope leaveScope(Node owner)
	{
		if (currentScope == globalScope || currentScope.getOwner() != owner)
		{
			throw new IllegalStateException("Cannot leave scope of " + owner + ", innermost scope is " + currentScope);
		}
		Scope left = currentScope;
		currentScope = currentScope.getParent();
		Debug.dedent();
		Debug.log("Left %s", left);
		return left;
	}

	/**
	 * Registers a declaration in the innermost scope and attaches it to the structural owner of
	 * that scope (function parameters, record members, namespace and unit members).
	 */
	public void addDeclaration(Declaration declaration)
	{
		currentScope.define(declaration);
		Node owner = currentScope.getOwner();

		switch (currentScope.getKind())
		{
			case FUNCTION:
				if (declaration instanceof ParameterDeclaration && owner instanceof FunctionDeclaration)
				{
					FunctionDeclaration function = (FunctionDeclaration) owner;
					if (!function.getParameters().contains(declaration))
					{
						function.addParameter((ParameterDeclaration) declaration);
					}
				}
				break;
			case RECORD:
				addToRecord((RecordDeclaration) owner, declaration);
				break;
			case NAMESPACE:
				((NamespaceDeclaration) owner).addDeclaration(declaration);
				break;
			case GLOBAL:
				if (translationUnit != null)
				{
					translationUnit.addDeclaration(declaration);
				}
				break;
			default:
				break;
		}
	}

	private void addToRecord(RecordDeclaration record, Declaration declaration)
	{
		if (declaration instanceof FieldDeclaration && !record.getFields().contains(declaration))
		{
			record.addField((FieldDeclaration) declaration);
		}
		else if (declaration instanceof ConstructorDeclaration && !record.getConstructors().contains(declaration))
		{
			record.addConstructor((ConstructorDeclaration) declaration);
		}
		else if (declaration instanceof MethodDeclaration
				&& !(declaration instanceof ConstructorDeclaration)
				&& !record.getMethods().contains(declaration))
		{
			record.addMethod((MethodDeclaration) declaration);
		}
		else if (declaration instanceof RecordDeclaration && !record.getRecords().contains(declaration))
		{
			record.addRecord((RecordDeclaration) declaration);
		}
	}

	/**
	 * Removes a declaration from the innermost scope and from its record, if it was a member.
	 */
	public void removeDeclaration(Declaration declaration)
	{
		currentScope.remove(declaration);
		if (currentScope.getOwner() instanceof RecordDeclaration)
		{
			RecordDeclaration record = (RecordDeclaration) currentScope.getOwner();
			if (declaration instanceof FieldDeclaration)
			{
				record.removeField((FieldDeclaration) declaration);
			}
			else if (declaration instanceof MethodDeclaration)
			{
				record.removeMethod((MethodDeclaration) declaration);
			}
		}
	}

	/**
	 * Resolves a name, searching from the innermost scope outwards.
	 *
	 * @return The declaration, or null if the name is not (yet) declared.
	 */
	public Declaration lookup(String name)
	{
		Scope scope = currentScope;
		while (scope != null)
		{
			Declaration declaration = scope.resolve(name);
			if (declaration != null)
			{
				return declaration;
			}
			scope = scope.getParent();
		}
		return null;
	}

	public Declaration resolveInCurrentScope(String name)
	{
		return currentScope.resolve(name);
	}

	/**
	 * Walks from the innermost scope outwards.
	 *
	 * @return The first scope matching the predicate, or null.
	 */
	public Scope getFirstScopeThat(Predicate<Scope> predicate)
	{
		Scope scope = currentScope;
		while (scope != null)
		{
			if (predicate.test(scope))
			{
				return scope;
			}
			scope = scope.getParent();
		}
		return null;
	}

	public FunctionDeclaration getCurrentFunction()
	{
		Scope scope = getFirstScopeThat(s -> s.getKind() == ScopeKind.FUNCTION);
		return scope == null ? null : (FunctionDeclaration) scope.getOwner();
	}

	public RecordDeclaration getCurrentRecord()
	{
		Scope scope = getFirstScopeThat(s -> s.getKind() == ScopeKind.RECORD);
		return scope == null ? null : (RecordDeclaration) scope.getOwner();
	}

	/**
	 * @return The qualified name of the enclosing namespace or record followed by the delimiter,
	 * or an empty string at top level.
	 */
	public String getCurrentNamePrefixWithDelimiter()
	{
		String prefix = currentScope.getScopedName();
		return prefix.isEmpty() ? "" : prefix + namespaceDelimiter;
	}

	public String getNamespaceDelimiter()
	{
		return namespaceDelimiter;
	}

	public Scope getCurrentScope()
	{
		return currentScope;
	}

	public Scope getGlobalScope()
	{
		return globalScope;
	}

	public TranslationUnitDeclaration getTranslationUnit()
	{
		return translationUnit;
	}
}
