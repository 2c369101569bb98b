// File: src/main/java/com/juanpa/cpg/graph/declarations/RecordDeclaration.java
package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.semantics.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unified representation of struct, union and class definitions. Members keep their declaration
 * order.
 */
public class RecordDeclaration extends Declaration
{
	private final String kind; // "struct", "union" or "class"
	private final List<Type> superTypes;
	private final List<FieldDeclaration> fields = new ArrayList<>();
	private final List<MethodDeclaration> methods = new ArrayList<>();
	private final List<ConstructorDeclaration> constructors = new ArrayList<>();
	private final List<RecordDeclaration> records = new ArrayList<>();

	public RecordDeclaration(String name, String kind, List<Type> superTypes, String code)
	{
		super(name, code);
		this.kind = kind;
		this.superTypes = new ArrayList<>(superTypes);
	}

	public String getKind()
	{
		return kind;
	}

	public List<Type> getSuperTypes()
	{
		return Collections.unmodifiableList(superTypes);
	}

	public List<FieldDeclaration> getFields()
	{
		return Collections.unmodifiableList(fields);
	}

	public void addField(FieldDeclaration field)
	{
		fields.add(field);
	}

	public boolean removeField(FieldDeclaration field)
	{
		return fields.remove(field);
	}

	/**
	 * Looks up a field by name.
	 *
	 * @return The field, or null if this record has no field with that name.
	 */
	public FieldDeclaration getField(String name)
	{
		for (FieldDeclaration field : fields)
		{
			if (field.getName().equals(name))
			{
				return field;
			}
		}
		return null;
	}

	public List<MethodDeclaration> getMethods()
	{
		return Collections.unmodifiableList(methods);
	}

	public void addMethod(MethodDeclaration method)
	{
		methods.add(method);
	}

	public boolean removeMethod(MethodDeclaration method)
	{
		return methods.remove(method);
	}

	public List<ConstructorDeclaration> getConstructors()
	{
		return Collections.unmodifiableList(constructors);
	}

	public void addConstructor(ConstructorDeclaration constructor)
	{
		constructors.add(constructor);
	}

	public List<RecordDeclaration> getRecords()
	{
		return Collections.unmodifiableList(records);
	}

	public void addRecord(RecordDeclaration record)
	{
		records.add(record);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitRecordDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "RecordDeclaration[" + kind + " " + getName() + "]";
	}
}
