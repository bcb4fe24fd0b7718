// File: src/main/java/org/vexpand/expand/TreeExpander.java
package org.vexpand.expand;

import org.vexpand.ast.*;
import org.vexpand.error.InternalCompilerError;
import org.vexpand.error.SizeMismatchException;
import org.vexpand.layout.MemoryLayout;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a statement into an equivalent tree in which every node works on a single memory
 * cell or a single immediate value.
 * <p>
 * {@link #expand(Node, int)} lowers element {@code elementIndex} of the expression rooted at the
 * node. Only an assignment iterates over elements: it builds one scalar assignment per element
 * and lowers its target and value at that element. Arithmetic nodes forward the index they
 * receive to their operands; vector leaves turn into the cell (or literal) selected by it.
 * Containers forward the index untouched to their children.
 * <p>
 * The input tree is never modified. Each call returns newly built nodes, except for nodes that
 * are already scalar and have nothing left to expand.
 */
public class TreeExpander implements NodeVisitor<Node, Integer>
{
	private final ExpansionTrace trace;
	private int depth = 0;

	public TreeExpander()
	{
		this(ExpansionTrace.NONE);
	}

	public TreeExpander(ExpansionTrace trace)
	{
		this.trace = trace;
	}

	/**
	 * Expands a top-level statement.
	 */
	public Node expandStatement(Node statement)
	{
		return expand(statement, 0);
	}

	public Node expand(Node node, int elementIndex)
	{
		depth++;
		try
		{
			return node.accept(this, elementIndex);
		}
		finally
		{
			depth--;
		}
	}

	@Override
	public Node visitBlock(BlockNode node, Integer index)
	{
		List<Node> children = new ArrayList<>(node.getChildCount());
		for (Node child : node.getChildren())
		{
			children.add(expand(child, index));
		}
		return new BlockNode(node.getSourcePos(), children);
	}

	@Override
	public Node visitAssignment(AssignmentNode node, Integer index)
	{
		int lSize = MemoryLayout.sizeOf(node.getTarget());
		int rSize = MemoryLayout.sizeOf(node.getValue());

		// consistency check
		if (lSize != rSize)
		{
			throw new SizeMismatchException(node.getSourcePos(), lSize, rSize);
		}

		Node target = asWriteTarget(node.getTarget());
		Node value = node.getValue();
		if (trace.isEnabled())
		{
			trace.record(depth, "expand Assignment at " + node.getSourcePos() + " into " + lSize + " element assignment(s)");
		}

		List<Node> assignments = new ArrayList<>(lSize);
		for (int i = 0; i < lSize; i++)
		{
			Node scalarTarget = expand(target, i);
			Node scalarValue = expand(value, i);
			assignments.add(new AssignmentNode(node.getSourcePos(), scalarTarget, scalarValue));
		}
		return new BlockNode(node.getSourcePos(), assignments);
	}

	@Override
	public Node visitBinaryArithmetic(BinaryArithmeticNode node, Integer index)
	{
		int lSize = MemoryLayout.sizeOf(node.getLeft());
		int rSize = MemoryLayout.sizeOf(node.getRight());

		if (lSize != rSize)
		{
			throw new SizeMismatchException(node.getSourcePos(), lSize, rSize);
		}

		Node left = expand(node.getLeft(), index);
		Node right = expand(node.getRight(), index);
		return new BinaryArithmeticNode(node.getSourcePos(), node.getOp(), left, right);
	}

	@Override
	public Node visitUnaryArithmetic(UnaryArithmeticNode node, Integer index)
	{
		Node operand = expand(node.getOperand(), index);
		return new UnaryArithmeticNode(node.getSourcePos(), node.getOp(), operand);
	}

	@Override
	public Node visitStaticVector(StaticVectorNode node, Integer index)
	{
		ImmediateNode immediate = new ImmediateNode(node.getSourcePos(), node.getValue(index));
		if (trace.isEnabled())
		{
			trace.record(depth, node + " [" + index + "] -> " + immediate);
		}
		return immediate;
	}

	@Override
	public Node visitMemoryVector(MemoryVectorNode node, Integer index)
	{
		int size = MemoryLayout.sizeOf(node);
		if (index < 0 || index >= size)
		{
			throw new InternalCompilerError(node.getSourcePos(), "element " + index + " out of range for " + node + ", resolved size is " + size);
		}

		Node scalar;
		if (node.hasConstantIndex())
		{
			int address = Math.addExact(MemoryLayout.addressOf(node), index);
			scalar = node.isWrite()
					? new StoreNode(node.getSourcePos(), address)
					: new LoadNode(node.getSourcePos(), address);
		}
		else
		{
			// address only known at run time, keep the index expression
			Node scalarIndex = expandScalarIndex(node, node.getIndex());
			scalar = node.isWrite()
					? new ArrayWriteNode(node.getSourcePos(), node.getArrayName(), node.getArrayAddr(), node.getArraySize(), scalarIndex)
					: new ArrayReadNode(node.getSourcePos(), node.getArrayName(), node.getArrayAddr(), node.getArraySize(), scalarIndex);
		}
		if (trace.isEnabled())
		{
			trace.record(depth, node + " [" + index + "] -> " + scalar);
		}
		return scalar;
	}

	@Override
	public Node visitImmediate(ImmediateNode node, Integer index)
	{
		return node;
	}

	@Override
	public Node visitLoad(LoadNode node, Integer index)
	{
		return node;
	}

	@Override
	public Node visitStore(StoreNode node, Integer index)
	{
		return node;
	}

	@Override
	public Node visitArrayRead(ArrayReadNode node, Integer index)
	{
		Node scalarIndex = expandScalarIndex(node, node.getIndex());
		return new ArrayReadNode(node.getSourcePos(), node.getArrayName(), node.getArrayAddr(), node.getArraySize(), scalarIndex);
	}

	@Override
	public Node visitArrayWrite(ArrayWriteNode node, Integer index)
	{
		Node scalarIndex = expandScalarIndex(node, node.getIndex());
		return new ArrayWriteNode(node.getSourcePos(), node.getArrayName(), node.getArrayAddr(), node.getArraySize(), scalarIndex);
	}

	// A run-time index selects one cell, so it must lower to a single scalar.
	private Node expandScalarIndex(Node owner, Node indexExpr)
	{
		if (MemoryLayout.sizeOf(indexExpr) != 1)
		{
			throw new InternalCompilerError(owner.getSourcePos(), "dynamic index of " + owner + " is not a scalar");
		}
		return expand(indexExpr, 0);
	}

	/**
	 * The assignment target as a write reference. Already lowered targets are kept as they are.
	 */
	private static Node asWriteTarget(Node target)
	{
		if (target instanceof MemoryVectorNode memory)
		{
			return memory.withAccess(Access.WRITE);
		}
		if (target instanceof StoreNode || target instanceof ArrayWriteNode)
		{
			return target;
		}
		throw new InternalCompilerError(target.getSourcePos(), "assignment target is not a memory reference: " + target);
	}
}
