package org.metricshub.jdynamo;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jdynamo.util.ModelFileSource;

public class CliTest {

	private ByteArrayOutputStream outBytes;
	private ByteArrayOutputStream errBytes;
	private PrintStream out;
	private PrintStream err;

	@Before
	public void setUp() throws Exception {
		outBytes = new ByteArrayOutputStream();
		errBytes = new ByteArrayOutputStream();
		out = new PrintStream(outBytes, true, StandardCharsets.UTF_8.name());
		err = new PrintStream(errBytes, true, StandardCharsets.UTF_8.name());
	}

	private static String model(String name) throws Exception {
		return Paths.get(CliTest.class.getResource("/models/" + name).toURI()).toString();
	}

	private String output() {
		return new String(outBytes.toByteArray(), StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
	}

	@Test
	public void testDumpSyntaxByDefault() throws Exception {
		Cli cli = Cli.create(new String[] { model("population.dyn") }, out, err);
		assertTrue(cli.getSettings().isDumpSyntaxTree());
		String tree = output();
		assertTrue(tree, tree.startsWith("File main\n Model main\n"));
		assertTrue(tree, tree.contains("    Ident POP\n   BasicLit FLOAT 1.65E9\n"));
		assertTrue(tree, tree.contains("   TableFwd (5 values)\n"));
		assertTrue(tree, tree.contains("    Ident timespec\n"));
		assertTrue(tree, tree.contains("     Ident start\n     BasicLit FLOAT 1900.000000\n"));
		assertTrue(tree, tree.contains("     Ident end\n     BasicLit FLOAT 2100.000000\n"));
		assertTrue(tree, tree.contains("     Ident dt\n     BasicLit FLOAT 0.200000\n"));
		assertTrue(tree, tree.contains("     Ident save_step\n     BasicLit FLOAT 10.000000\n"));
		assertFalse(tree, tree.contains("Ident DT\n"));
		assertEquals(0, errBytes.size());
	}

	@Test
	public void testModelFileOption() throws Exception {
		Cli cli = Cli.create(new String[] { "--no-timespec", "-f", model("population.dyn") }, out, err);
		assertTrue(cli.getModelSource() instanceof ModelFileSource);
		String tree = output();
		assertTrue(tree, tree.contains("    Ident DT\n"));
		assertFalse(tree, tree.contains("timespec"));
	}

	@Test
	public void testDumpTokens() throws Exception {
		Cli.create(new String[] { "--dump-tokens", model("population.dyn") }, out, err);
		String[] lines = output().split("\n");
		assertEquals("(ident N)", lines[0]);
		assertEquals("(ident POP)", lines[1]);
		assertEquals("(op =)", lines[2]);
		assertEquals("(num 1.65E9)", lines[3]);
		assertEquals("(semi ;)", lines[4]);
		assertEquals("(eof )", lines[lines.length - 1]);
		assertFalse("tokens only", output().contains("File main"));
	}

	@Test
	public void testDumpTokensAndSyntax() throws Exception {
		Cli.create(new String[] { "--dump-tokens", "--dump-syntax", model("population.dyn") }, out, err);
		String all = output();
		assertTrue(all, all.startsWith("(ident N)\n"));
		assertTrue(all, all.contains("(eof )\nFile main\n"));
	}

	@Test
	public void testErrorsAreCollected() throws Exception {
		try {
			Cli.create(new String[] { model("broken.dyn") }, out, err);
			fail("DynamoParseException expected");
		} catch (DynamoParseException e) {
			assertEquals(2, e.getErrorCount());
			assertTrue(e.getDiagnostics().get(0), e.getDiagnostics().get(0).endsWith("broken.dyn:3:7: expected '=', not '2'"));
			assertTrue(
					e.getDiagnostics().get(1),
					e.getDiagnostics().get(1).endsWith("broken.dyn:4:9: expected float literal in table def, not 'x'"));
		}
		assertEquals("nothing is printed for a broken model", 0, outBytes.size());
	}

	@Test
	public void testUsage() throws Exception {
		Cli cli = Cli.create(new String[] { "-h" }, out, err);
		assertNull(cli.getModelSource());
		assertTrue(output().startsWith("Usage:\n"));
		assertTrue(output().contains("--dump-tokens"));
	}

	@Test
	public void testUsageWithoutArguments() throws Exception {
		Cli.create(new String[0], out, err);
		assertTrue(output().startsWith("Usage:\n"));
	}

	@Test
	public void testTabWidth() throws Exception {
		Cli cli = new Cli(out, err);
		cli.parse(new String[] { "--tab-width", "4", "model.dyn" });
		assertEquals(4, cli.getSettings().getTabWidth());
		assertEquals("model.dyn", cli.getModelSource().getDescription());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBadTabWidth() {
		new Cli(out, err).parse(new String[] { "--tab-width", "wide", "model.dyn" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownParameter() {
		new Cli(out, err).parse(new String[] { "--fast", "model.dyn" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTwoModels() {
		new Cli(out, err).parse(new String[] { "-f", "a.dyn", "b.dyn" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testExtraArgument() {
		new Cli(out, err).parse(new String[] { "a.dyn", "b.dyn" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingModel() {
		new Cli(out, err).parse(new String[] { "--dump-tokens" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingOptionValue() {
		new Cli(out, err).parse(new String[] { "-f" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testHelpWithOtherArguments() {
		new Cli(out, err).parse(new String[] { "-h", "model.dyn" });
	}
}
