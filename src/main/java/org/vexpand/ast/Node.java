// File: src/main/java/org/vexpand/ast/Node.java
package org.vexpand.ast;

import org.vexpand.error.InternalCompilerError;

import java.util.List;
import java.util.Objects;

/**
 * Base class of every node in the tree handed to the expansion pass.
 * <p>
 * A node exclusively owns its ordered children; the tree has no sharing and no cycles.
 * Nodes are immutable: passes that rewrite the tree build new nodes from the rewritten
 * children instead of patching child lists in place, so a parent is never observed with a
 * partially replaced child list.
 * <p>
 * {@link #toString()} describes the node itself, not its sub-tree; use
 * {@code org.vexpand.util.TreePrinter} for a full dump.
 */
public abstract sealed class Node
		permits BlockNode, AssignmentNode, BinaryArithmeticNode, UnaryArithmeticNode,
		MemoryVectorNode, StaticVectorNode, ImmediateNode, LoadNode, StoreNode,
		ArrayReadNode, ArrayWriteNode
{
	private final SourcePosition sourcePos;
	private final List<Node> children;

	protected Node(SourcePosition sourcePos, List<? extends Node> children)
	{
		this.sourcePos = Objects.requireNonNull(sourcePos, "sourcePos");
		this.children = List.copyOf(children);
	}

	public SourcePosition getSourcePos()
	{
		return sourcePos;
	}

	public List<Node> getChildren()
	{
		return children;
	}

	public int getChildCount()
	{
		return children.size();
	}

	public Node getChild(int index)
	{
		if (index < 0 || index >= children.size())
		{
			throw new InternalCompilerError(sourcePos, "node " + this + " has no child " + index);
		}
		return children.get(index);
	}

	/**
	 * True for nodes that stand for exactly one memory cell or one constant value by
	 * construction, whatever their children.
	 */
	public boolean isScalar()
	{
		return false;
	}

	public abstract <R, P> R accept(NodeVisitor<R, P> visitor, P arg);
}
