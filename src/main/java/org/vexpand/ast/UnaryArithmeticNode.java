package org.vexpand.ast;

import java.util.List;
import java.util.Objects;

/**
 * Element-wise unary operation.
 */
public final class UnaryArithmeticNode extends Node
{
	private final UnaryOperator op;

	public UnaryArithmeticNode(SourcePosition sourcePos, UnaryOperator op, Node operand)
	{
		super(sourcePos, List.of(operand));
		this.op = Objects.requireNonNull(op, "op");
	}

	public UnaryOperator getOp()
	{
		return op;
	}

	public Node getOperand()
	{
		return getChild(0);
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitUnaryArithmetic(this, arg);
	}

	@Override
	public String toString()
	{
		return "UnaryArithmetic: " + op.getSymbol();
	}
}
