// File: src/main/java/org/vexpand/ast/NodeVisitor.java
package org.vexpand.ast;

/**
 * Visitor over the closed family of {@link Node} variants.
 * Adding a variant adds a method here, so every pass over the tree fails to compile until it
 * handles the new node.
 *
 * @param <R> the result type of the visit methods
 * @param <P> an extra argument threaded through the traversal (use {@code Void} when unused)
 */
public interface NodeVisitor<R, P>
{
	// --- Containers and statements ---
	R visitBlock(BlockNode node, P arg);

	R visitAssignment(AssignmentNode node, P arg);

	// --- Arithmetic ---
	R visitBinaryArithmetic(BinaryArithmeticNode node, P arg);

	R visitUnaryArithmetic(UnaryArithmeticNode node, P arg);

	// --- Vector-granularity leaves ---
	R visitMemoryVector(MemoryVectorNode node, P arg);

	R visitStaticVector(StaticVectorNode node, P arg);

	// --- Scalar-granularity nodes ---
	R visitImmediate(ImmediateNode node, P arg);

	R visitLoad(LoadNode node, P arg);

	R visitStore(StoreNode node, P arg);

	R visitArrayRead(ArrayReadNode node, P arg);

	R visitArrayWrite(ArrayWriteNode node, P arg);
}
