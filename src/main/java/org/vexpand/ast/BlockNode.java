package org.vexpand.ast;

import java.util.List;

/**
 * Ordered container of statements. It has no memory size of its own.
 */
public final class BlockNode extends Node
{
	public BlockNode(SourcePosition sourcePos, List<? extends Node> statements)
	{
		super(sourcePos, statements);
	}

	public BlockNode(SourcePosition sourcePos)
	{
		this(sourcePos, List.of());
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitBlock(this, arg);
	}

	@Override
	public String toString()
	{
		return "Block";
	}
}
