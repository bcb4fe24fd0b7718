package org.vexpand;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vexpand.dto.NodeDTO;
import org.vexpand.dto.NodeKind;
import org.vexpand.dto.ProgramDTO;
import org.vexpand.dto.TreeSerializer;
import org.vexpand.util.Debug;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the command-line driver.
 */
class MainTest {

	@TempDir
	Path tempDir;

	@AfterEach
	void tearDown() {
		Debug.ENABLE_DEBUG = false;
	}

	private Path copyResource(String name) throws IOException {
		Path target = tempDir.resolve(name);
		try (InputStream in = MainTest.class.getResourceAsStream("/trees/" + name)) {
			assertNotNull(in, "missing test resource " + name);
			Files.copy(in, target);
		}
		return target;
	}

	@Test
	void testWritesExpandedTreeNextToInput() throws IOException {
		Path input = copyResource("vector_assignment.json");

		assertEquals(0, Main.run(new String[]{input.toString()}));

		Path output = tempDir.resolve("vector_assignment.expanded.json");
		assertTrue(Files.exists(output));
		ProgramDTO program = new TreeSerializer().read(Files.readString(output));
		assertEquals("vector_assignment", program.name);
		NodeDTO block = program.statements.get(0);
		assertEquals(NodeKind.BLOCK, block.kind);
		assertEquals(3, block.children.size());
		assertEquals(NodeKind.STORE, block.children.get(2).children.get(0).kind);
		assertEquals(12, block.children.get(2).children.get(0).address);
		assertEquals(22, block.children.get(2).children.get(1).address);
	}

	@Test
	void testExplicitOutputAndTraceFile() throws IOException {
		Path input = copyResource("arithmetic.json");
		Path output = tempDir.resolve("out/result.json");
		Path trace = tempDir.resolve("trace/expansion.txt");

		assertEquals(0, Main.run(new String[]{"-o", output.toString(), "-t", trace.toString(), input.toString()}));

		assertTrue(Files.exists(output));
		String traceText = Files.readString(trace);
		assertTrue(traceText.contains("statement at 1:1"));
		assertTrue(traceText.contains("expand Assignment at 1:1 into 2 element assignment(s)"));
	}

	@Test
	void testCheckOnlyWritesNothing() throws IOException {
		Path input = copyResource("vector_assignment.json");

		assertEquals(0, Main.run(new String[]{"-k", input.toString()}));

		assertFalse(Files.exists(tempDir.resolve("vector_assignment.expanded.json")));
	}

	@Test
	void testSizeMismatchFails() throws IOException {
		Path input = copyResource("size_mismatch.json");

		assertEquals(1, Main.run(new String[]{input.toString()}));

		assertFalse(Files.exists(tempDir.resolve("size_mismatch.expanded.json")));
	}

	@Test
	void testMissingInputFile() {
		assertEquals(2, Main.run(new String[]{tempDir.resolve("nope.json").toString()}));
	}

	@Test
	void testMalformedJson() throws IOException {
		Path input = tempDir.resolve("broken.json");
		Files.writeString(input, "{\"statements\": [");

		assertEquals(2, Main.run(new String[]{input.toString()}));
	}

	@Test
	void testNullLiteralValueIsMalformed() throws IOException {
		Path input = tempDir.resolve("null_value.json");
		Files.writeString(input, "{\"statements\":[{\"kind\":\"assignment\",\"children\":["
				+ "{\"kind\":\"memory\",\"address\":0,\"size\":2},{\"kind\":\"static\",\"values\":[1,null]}]}]}");

		assertEquals(2, Main.run(new String[]{input.toString()}));

		assertFalse(Files.exists(tempDir.resolve("null_value.expanded.json")));
	}

	@Test
	void testHelp() {
		assertEquals(0, Main.run(new String[]{"--help"}));
		assertEquals(2, Main.run(new String[]{"--bogus"}));
	}
}
