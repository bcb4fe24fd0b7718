package org.vexpand.expand;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.vexpand.ast.*;
import org.vexpand.error.InternalCompilerError;
import org.vexpand.error.InvalidRangeException;
import org.vexpand.error.SizeMismatchException;
import org.vexpand.util.TreePrinter;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;
import static org.vexpand.TestTrees.*;

/**
 * Unit tests for the tree expansion engine.
 */
class TreeExpanderTest {

	private TreeExpander expander;

	@BeforeEach
	void setUp() {
		expander = new TreeExpander();
	}

	private static void assertStore(int address, Node node) {
		StoreNode store = assertInstanceOf(StoreNode.class, node);
		assertEquals(address, store.getVarAddr());
	}

	private static void assertLoad(int address, Node node) {
		LoadNode load = assertInstanceOf(LoadNode.class, node);
		assertEquals(address, load.getVarAddr());
	}

	// ========== Assignment ==========

	@Nested
	class Assignments {

		@Test
		void testRangeToRangeAssignment() {
			// v[0:2] = w[0:2] with v at 10 and w at 20
			Node statement = assign(mem("v", 10, 3, 0, 2), mem("w", 20, 3, 0, 2));

			BlockNode block = assertInstanceOf(BlockNode.class, expander.expandStatement(statement));

			assertEquals(3, block.getChildCount());
			for (int i = 0; i < 3; i++) {
				AssignmentNode element = assertInstanceOf(AssignmentNode.class, block.getChild(i));
				assertStore(10 + i, element.getTarget());
				assertLoad(20 + i, element.getValue());
			}
		}

		@Test
		void testExpandedTreeDump() {
			Node statement = assign(mem("v", 10, 3, 0, 2), mem("w", 20, 3, 0, 2));

			String expected = String.join("\n",
					"Block",
					"  Assignment",
					"    Store: addr 10",
					"    Load: addr 20",
					"  Assignment",
					"    Store: addr 11",
					"    Load: addr 21",
					"  Assignment",
					"    Store: addr 12",
					"    Load: addr 22",
					"");
			assertEquals(expected, TreePrinter.print(expander.expandStatement(statement)));
		}

		@Test
		void testSizeMismatchCarriesBothSizes() {
			Node statement = assign(pos(7, 3), mem("a", 0, 3), mem("b", 3, 2));

			SizeMismatchException e = assertThrows(SizeMismatchException.class, () -> expander.expandStatement(statement));
			assertEquals(3, e.getLeftSize());
			assertEquals(2, e.getRightSize());
			assertEquals(pos(7, 3), e.getSourcePos());
			assertEquals("Inconsistent size! Left size: 3, right size: 2", e.getMessage());
		}

		@Test
		void testOffsetRangesPairRelativeElements() {
			// v[2:4] = w[5:7]
			Node statement = assign(mem("v", 100, 8, 2, 4), mem("w", 200, 8, 5, 7));

			Node block = expander.expandStatement(statement);

			assertEquals(3, block.getChildCount());
			for (int i = 0; i < 3; i++) {
				assertStore(102 + i, block.getChild(i).getChild(0));
				assertLoad(205 + i, block.getChild(i).getChild(1));
			}
		}

		@Test
		void testWholeArrayFromLiteral() {
			Node statement = assign(mem("v", 4, 3), vec(7, 8, 9));

			Node block = expander.expandStatement(statement);

			assertEquals(3, block.getChildCount());
			for (int i = 0; i < 3; i++) {
				assertStore(4 + i, block.getChild(i).getChild(0));
				ImmediateNode value = assertInstanceOf(ImmediateNode.class, block.getChild(i).getChild(1));
				assertEquals(7 + i, value.getValue());
			}
		}

		@Test
		void testScalarAssignmentStaysSingle() {
			Node block = expander.expandStatement(assign(mem("x", 5, 1), imm(3)));

			assertEquals(1, block.getChildCount());
			assertStore(5, block.getChild(0).getChild(0));
		}

		@Test
		void testElementAssignmentsKeepSourcePosition() {
			Node block = expander.expandStatement(assign(pos(12, 4), mem("v", 0, 2), vec(1, 2)));

			assertEquals(pos(12, 4), block.getSourcePos());
			assertEquals(pos(12, 4), block.getChild(1).getSourcePos());
		}

		@Test
		void testNonMemoryTargetIsInvariantViolation() {
			Node statement = assign(imm(1), imm(2));

			assertThrows(InternalCompilerError.class, () -> expander.expandStatement(statement));
		}
	}

	// ========== Read/write polarity ==========

	@Test
	void testReadReferenceBecomesLoad() {
		assertLoad(13, expander.expand(mem("v", 10, 5), 3));
	}

	@Test
	void testWriteReferenceBecomesStore() {
		MemoryVectorNode target = mem("v", 10, 5).withAccess(Access.WRITE);

		assertStore(13, expander.expand(target, 3));
	}

	@Test
	void testRangeElementAddress() {
		// element i of v[lo:hi] is at base + lo + i
		MemoryVectorNode range = mem("v", 10, 8, 2, 5);

		assertLoad(12, expander.expand(range, 0));
		assertLoad(15, expander.expand(range, 3));
	}

	@Test
	void testElementOutOfRangeIsInvariantViolation() {
		assertThrows(InternalCompilerError.class, () -> expander.expand(mem("v", 10, 3), 3));
		assertThrows(InternalCompilerError.class, () -> expander.expand(mem("v", 10, 8, 4), 1));
		assertThrows(InternalCompilerError.class, () -> expander.expand(vec(1, 2), 2));
	}

	// ========== Arithmetic ==========

	@Test
	void testBinaryArithmeticIsExpandedPerElement() {
		// a = b + [1, 2]
		Node statement = assign(mem("a", 0, 2), binary(BinaryOperator.ADD, mem("b", 10, 2), vec(1, 2)));

		Node block = expander.expandStatement(statement);

		assertEquals(2, block.getChildCount());
		for (int i = 0; i < 2; i++) {
			AssignmentNode element = (AssignmentNode) block.getChild(i);
			assertStore(i, element.getTarget());
			BinaryArithmeticNode sum = assertInstanceOf(BinaryArithmeticNode.class, element.getValue());
			assertEquals(BinaryOperator.ADD, sum.getOp());
			assertLoad(10 + i, sum.getLeft());
			assertEquals(i + 1, ((ImmediateNode) sum.getRight()).getValue());
		}
	}

	@Test
	void testBinaryArithmeticUsesCallerIndex() {
		Node product = binary(BinaryOperator.MULT, mem("a", 0, 4), mem("b", 10, 4));

		BinaryArithmeticNode element = (BinaryArithmeticNode) expander.expand(product, 2);

		assertLoad(2, element.getLeft());
		assertLoad(12, element.getRight());
	}

	@Test
	void testBinaryArithmeticMismatch() {
		Node statement = assign(mem("a", 0, 2), binary(BinaryOperator.SUB, mem("b", 10, 2), vec(1, 2, 3)));

		assertThrows(SizeMismatchException.class, () -> expander.expandStatement(statement));
	}

	@Test
	void testMismatchInsideOperandFailsBeforeExpansion() {
		Node sum = new BinaryArithmeticNode(pos(3, 1), BinaryOperator.SUB, mem("b", 10, 2), vec(1, 2, 3));
		Node statement = assign(mem("a", 0, 2), sum);
		StringWriter out = new StringWriter();
		TreeExpander traced = new TreeExpander(ExpansionTrace.to(out));

		SizeMismatchException e = assertThrows(SizeMismatchException.class, () -> traced.expandStatement(statement));

		assertEquals(pos(3, 1), e.getSourcePos());
		assertEquals("", out.toString());
	}

	@Test
	void testUnaryArithmetic() {
		Node statement = assign(mem("a", 0, 2), unary(UnaryOperator.SUB, mem("b", 10, 2)));

		Node block = expander.expandStatement(statement);

		UnaryArithmeticNode negation = assertInstanceOf(UnaryArithmeticNode.class, block.getChild(1).getChild(1));
		assertEquals(UnaryOperator.SUB, negation.getOp());
		assertLoad(11, negation.getOperand());
	}

	@Test
	void testNestedArithmetic() {
		// a = abs(b - c) * [2, 2, 2]
		Node value = binary(BinaryOperator.MULT,
				unary(UnaryOperator.ABS, binary(BinaryOperator.SUB, mem("b", 10, 3), mem("c", 20, 3))),
				vec(2, 2, 2));
		Node block = expander.expandStatement(assign(mem("a", 0, 3), value));

		assertEquals(3, block.getChildCount());
		for (Node element : block.getChildren()) {
			assertTrue(ScalarizationChecker.isScalarized(element));
		}
		BinaryArithmeticNode last = (BinaryArithmeticNode) block.getChild(2).getChild(1);
		BinaryArithmeticNode difference = (BinaryArithmeticNode) last.getLeft().getChild(0);
		assertLoad(12, difference.getLeft());
		assertLoad(22, difference.getRight());
	}

	// ========== Containers ==========

	@Test
	void testBlockExpandsEveryStatementInOrder() {
		Node program = block(
				assign(mem("a", 0, 2), vec(1, 2)),
				assign(mem("b", 2, 1), imm(5)));

		BlockNode expanded = assertInstanceOf(BlockNode.class, expander.expandStatement(program));

		assertEquals(2, expanded.getChildCount());
		assertEquals(2, expanded.getChild(0).getChildCount());
		assertEquals(1, expanded.getChild(1).getChildCount());
		assertStore(2, expanded.getChild(1).getChild(0).getChild(0));
		assertTrue(ScalarizationChecker.isScalarized(expanded));
	}

	@Test
	void testEmptyBlock() {
		Node expanded = expander.expandStatement(block());

		assertInstanceOf(BlockNode.class, expanded);
		assertEquals(0, expanded.getChildCount());
	}

	// ========== Dynamic indexes ==========

	@Test
	void testDynamicIndexReadBecomesArrayRead() {
		// a = v[i]
		Node statement = assign(mem("a", 0, 1), memAt("v", 10, 5, mem("i", 30, 1)));

		Node element = expander.expandStatement(statement).getChild(0);

		ArrayReadNode read = assertInstanceOf(ArrayReadNode.class, element.getChild(1));
		assertEquals(10, read.getArrayAddr());
		assertEquals(5, read.getArraySize());
		assertLoad(30, read.getIndex());
	}

	@Test
	void testDynamicIndexWriteBecomesArrayWrite() {
		// v[i + 1] = 4
		Node index = binary(BinaryOperator.ADD, mem("i", 30, 1), imm(1));
		Node statement = assign(memAt("v", 10, 5, index), imm(4));

		Node element = expander.expandStatement(statement).getChild(0);

		ArrayWriteNode write = assertInstanceOf(ArrayWriteNode.class, element.getChild(0));
		BinaryArithmeticNode expandedIndex = assertInstanceOf(BinaryArithmeticNode.class, write.getIndex());
		assertLoad(30, expandedIndex.getLeft());
		assertTrue(ScalarizationChecker.isScalarized(element));
	}

	@Test
	void testVectorDynamicIndexIsInvariantViolation() {
		Node statement = assign(mem("a", 0, 1), memAt("v", 10, 5, mem("idx", 30, 2)));

		assertThrows(InternalCompilerError.class, () -> expander.expandStatement(statement));
	}

	@Test
	void testLoweredReadWithVectorIndexIsInvariantViolation() {
		Node read = new ArrayReadNode(pos(), "v", 0, 4, mem("idx", 30, 2));

		assertThrows(InternalCompilerError.class, () -> expander.expand(read, 0));
	}

	@Test
	void testLoweredWriteWithVectorIndexIsInvariantViolation() {
		Node statement = assign(new ArrayWriteNode(pos(), "v", 0, 4, vec(1, 2)), imm(5));

		assertThrows(InternalCompilerError.class, () -> expander.expandStatement(statement));
	}

	@Test
	void testLoweredReadKeepsScalarIndex() {
		Node read = new ArrayReadNode(pos(), "v", 0, 4, mem("i", 30, 1));

		ArrayReadNode expanded = assertInstanceOf(ArrayReadNode.class, expander.expand(read, 0));
		assertLoad(30, expanded.getIndex());
	}

	// ========== Address arithmetic ==========

	@Test
	void testHugeRangeAssignmentIsRangeError() {
		Node statement = assign(mem("v", 0, 10, 0, Integer.MAX_VALUE), mem("w", 0, 10, 0, Integer.MAX_VALUE));

		assertThrows(InvalidRangeException.class, () -> expander.expandStatement(statement));
	}

	@Test
	void testLastAddressableCell() {
		Node block = expander.expandStatement(assign(mem("v", Integer.MAX_VALUE - 1, 2), vec(1, 2)));

		assertStore(Integer.MAX_VALUE - 1, block.getChild(0).getChild(0));
		assertStore(Integer.MAX_VALUE, block.getChild(1).getChild(0));
	}

	// ========== Ownership and side effects ==========

	@Test
	void testInputTreeIsNotModified() {
		MemoryVectorNode target = mem("v", 10, 3);
		AssignmentNode statement = assign(target, vec(1, 2, 3));
		String before = TreePrinter.print(statement);

		expander.expandStatement(statement);

		assertEquals(before, TreePrinter.print(statement));
		assertFalse(target.isWrite());
		assertSame(target, statement.getTarget());
	}

	@Test
	void testExpandingTwiceGivesSameTree() {
		Node statement = assign(mem("v", 10, 3, 0, 2), binary(BinaryOperator.ADD, mem("w", 20, 3), vec(1, 2, 3)));

		assertEquals(TreePrinter.print(expander.expandStatement(statement)), TreePrinter.print(expander.expandStatement(statement)));
	}

	@Test
	void testLoweredAssignmentExpandsAgain() {
		Node once = expander.expandStatement(assign(mem("v", 10, 2), mem("w", 20, 2)));

		Node again = expander.expandStatement(once.getChild(1));

		assertEquals(1, again.getChildCount());
		assertStore(11, again.getChild(0).getChild(0));
		assertLoad(21, again.getChild(0).getChild(1));
	}

	@Test
	void testTraceDoesNotChangeResult() {
		Node statement = assign(mem("v", 10, 3, 0, 2), mem("w", 20, 3, 0, 2));
		StringWriter out = new StringWriter();
		ExpansionTrace trace = ExpansionTrace.to(out);

		Node traced = new TreeExpander(trace).expandStatement(statement);
		trace.flush();

		assertEquals(TreePrinter.print(expander.expandStatement(statement)), TreePrinter.print(traced));
		assertTrue(out.toString().contains("expand Assignment at 1:1 into 3 element assignment(s)"));
		assertTrue(out.toString().contains("[2] -> Store: addr 12"));
		assertTrue(out.toString().contains("[2] -> Load: addr 22"));
	}

	@Test
	void testTraceOnlyEnabledWithSink() {
		assertFalse(ExpansionTrace.NONE.isEnabled());
		assertTrue(ExpansionTrace.to(new StringWriter()).isEnabled());
	}
}
