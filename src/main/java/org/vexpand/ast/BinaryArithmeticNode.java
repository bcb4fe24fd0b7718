package org.vexpand.ast;

import java.util.List;
import java.util.Objects;

/**
 * Element-wise binary operation. Both operands must span the same number of cells.
 */
public final class BinaryArithmeticNode extends Node
{
	private final BinaryOperator op;

	public BinaryArithmeticNode(SourcePosition sourcePos, BinaryOperator op, Node left, Node right)
	{
		super(sourcePos, List.of(left, right));
		this.op = Objects.requireNonNull(op, "op");
	}

	public BinaryOperator getOp()
	{
		return op;
	}

	public Node getLeft()
	{
		return getChild(0);
	}

	public Node getRight()
	{
		return getChild(1);
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitBinaryArithmetic(this, arg);
	}

	@Override
	public String toString()
	{
		return "BinaryArithmetic: " + op.getSymbol();
	}
}
