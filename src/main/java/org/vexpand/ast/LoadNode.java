package org.vexpand.ast;

import java.util.List;

/**
 * Read of one memory cell at an absolute address.
 */
public final class LoadNode extends Node
{
	private final int varAddr;

	public LoadNode(SourcePosition sourcePos, int varAddr)
	{
		super(sourcePos, List.of());
		this.varAddr = varAddr;
	}

	public int getVarAddr()
	{
		return varAddr;
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitLoad(this, arg);
	}

	@Override
	public String toString()
	{
		return "Load: addr " + varAddr;
	}
}
