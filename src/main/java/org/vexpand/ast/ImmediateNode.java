package org.vexpand.ast;

import java.util.List;

public final class ImmediateNode extends Node
{
	private final int value;

	public ImmediateNode(SourcePosition sourcePos, int value)
	{
		super(sourcePos, List.of());
		this.value = value;
	}

	public int getValue()
	{
		return value;
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitImmediate(this, arg);
	}

	@Override
	public String toString()
	{
		return "Immediate: " + value;
	}
}
