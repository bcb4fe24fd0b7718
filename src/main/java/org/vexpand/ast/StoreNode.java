package org.vexpand.ast;

import java.util.List;

/**
 * Write of one memory cell at an absolute address.
 */
public final class StoreNode extends Node
{
	private final int varAddr;

	public StoreNode(SourcePosition sourcePos, int varAddr)
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
		return visitor.visitStore(this, arg);
	}

	@Override
	public String toString()
	{
		return "Store: addr " + varAddr;
	}
}
