package org.vexpand.ast;

import org.vexpand.error.InternalCompilerError;

import java.util.Arrays;
import java.util.List;

/**
 * Literal vector of constants, e.g. {@code [1, 2, 3]}. Also used as the compile-time index of a
 * {@link MemoryVectorNode}.
 */
public final class StaticVectorNode extends Node
{
	private final int[] values;

	public StaticVectorNode(SourcePosition sourcePos, int... values)
	{
		super(sourcePos, List.of());
		this.values = values.clone();
	}

	public StaticVectorNode(SourcePosition sourcePos, List<Integer> values)
	{
		super(sourcePos, List.of());
		this.values = values.stream().mapToInt(Integer::intValue).toArray();
	}

	public int size()
	{
		return values.length;
	}

	public int getValue(int index)
	{
		if (index < 0 || index >= values.length)
		{
			throw new InternalCompilerError(getSourcePos(), "static vector element " + index + " out of range, size is " + values.length);
		}
		return values[index];
	}

	public int[] getValues()
	{
		return values.clone();
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitStaticVector(this, arg);
	}

	@Override
	public String toString()
	{
		return "StaticVector: " + Arrays.toString(values);
	}
}
