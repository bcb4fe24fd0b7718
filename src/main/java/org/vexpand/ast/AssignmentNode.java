package org.vexpand.ast;

import java.util.List;

/**
 * {@code target = value}. The target is a memory reference, the value any expression of the
 * same memory size.
 */
public final class AssignmentNode extends Node
{
	public AssignmentNode(SourcePosition sourcePos, Node target, Node value)
	{
		super(sourcePos, List.of(target, value));
	}

	public Node getTarget()
	{
		return getChild(0);
	}

	public Node getValue()
	{
		return getChild(1);
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitAssignment(this, arg);
	}

	@Override
	public String toString()
	{
		return "Assignment";
	}
}
