package org.metricshub.jdynamo;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jdynamo.frontend.Token;
import org.metricshub.jdynamo.frontend.TokenKind;
import org.metricshub.jdynamo.frontend.ast.AssignStmt;
import org.metricshub.jdynamo.frontend.ast.AstNode;
import org.metricshub.jdynamo.frontend.ast.AstVisitor;
import org.metricshub.jdynamo.frontend.ast.BasicLit;
import org.metricshub.jdynamo.frontend.ast.CompositeLit;
import org.metricshub.jdynamo.frontend.ast.DynamoFile;
import org.metricshub.jdynamo.frontend.ast.Ident;
import org.metricshub.jdynamo.frontend.ast.KeyValueExpr;
import org.metricshub.jdynamo.frontend.ast.ModelDecl;
import org.metricshub.jdynamo.frontend.ast.Role;
import org.metricshub.jdynamo.frontend.ast.TableFwdExpr;
import org.metricshub.jdynamo.frontend.ast.VarDecl;
import org.metricshub.jdynamo.util.DynamoLogger;
import org.metricshub.jdynamo.util.DynamoSettings;
import org.metricshub.jdynamo.util.ModelSource;

public class DynamoTest {

	private static final String MODEL = "* POP\nN POPN=100\nT TAB=1/2\nC DT=.5\n";

	private static String dump(AstNode node) throws UnsupportedEncodingException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
		node.dump(ps);
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
	}

	@Test
	public void testDump() throws Exception {
		DynamoFile file = new Dynamo().parse("pop.dyn", MODEL);
		String expected = "File main\n"
				+ " Model main\n"
				+ "  Assign\n"
				+ "   VarDecl (initial)\n"
				+ "    Ident POPN\n"
				+ "   BasicLit FLOAT 100\n"
				+ "  Assign\n"
				+ "   VarDecl (table)\n"
				+ "    Ident TAB\n"
				+ "   TableFwd (2 values)\n"
				+ "    BasicLit FLOAT 1\n"
				+ "    BasicLit FLOAT 2\n"
				+ "  Assign\n"
				+ "   VarDecl\n"
				+ "    Ident timespec\n"
				+ "   CompositeLit\n"
				+ "    KeyValue\n"
				+ "     Ident start\n"
				+ "     BasicLit FLOAT 0.000000\n"
				+ "    KeyValue\n"
				+ "     Ident end\n"
				+ "     BasicLit FLOAT 0.000000\n"
				+ "    KeyValue\n"
				+ "     Ident dt\n"
				+ "     BasicLit FLOAT 0.500000\n"
				+ "    KeyValue\n"
				+ "     Ident save_step\n"
				+ "     BasicLit FLOAT 1.000000\n";
		assertEquals(expected, dump(file));
	}

	@Test
	public void testVisitor() {
		DynamoFile file = new Dynamo().parse("pop.dyn", MODEL);
		final Map<Role, Integer> roles = new EnumMap<Role, Integer>(Role.class);
		AstVisitor<Integer> counter = new AstVisitor<Integer>() {
			private int visitChildren(AstNode node) {
				int n = 1;
				for (AstNode child : node.children()) {
					n += child.accept(this);
				}
				return n;
			}

			@Override
			public Integer visitFile(DynamoFile f) {
				return visitChildren(f);
			}

			@Override
			public Integer visitModel(ModelDecl model) {
				return visitChildren(model);
			}

			@Override
			public Integer visitAssign(AssignStmt assign) {
				return visitChildren(assign);
			}

			@Override
			public Integer visitVarDecl(VarDecl decl) {
				if (decl.getRole() != null) {
					Integer old = roles.get(decl.getRole());
					roles.put(decl.getRole(), old == null ? 1 : old + 1);
				}
				return visitChildren(decl);
			}

			@Override
			public Integer visitBasicLit(BasicLit lit) {
				return 1;
			}

			@Override
			public Integer visitCompositeLit(CompositeLit lit) {
				return visitChildren(lit);
			}

			@Override
			public Integer visitKeyValue(KeyValueExpr entry) {
				return visitChildren(entry);
			}

			@Override
			public Integer visitTableFwd(TableFwdExpr table) {
				return visitChildren(table);
			}

			@Override
			public Integer visitIdent(Ident ident) {
				return 1;
			}
		};

		// same count as the lines of the dump
		assertEquals(Integer.valueOf(28), file.accept(counter));
		assertEquals(Integer.valueOf(1), roles.get(Role.INITIAL));
		assertEquals(Integer.valueOf(1), roles.get(Role.TABLE));
		assertNull("DT went into the timespec", roles.get(Role.CONSTANT));
	}

	@Test
	public void testTokenize() {
		List<Token> tokens = new Dynamo().tokenize("pop.dyn", MODEL);
		assertEquals("(ident N)", tokens.get(0).toString());
		assertEquals(TokenKind.EOF, tokens.get(tokens.size() - 1).getKind());
	}

	@Test
	public void testParseModelSource() throws IOException {
		DynamoFile file = new Dynamo().parse(ModelSource.of("inline", "*\nC K=2\n"));
		assertNotNull(file.getModel("main").findAssign("K"));
	}

	@Test
	public void testCommandLineDescription() {
		Dynamo dynamo = new Dynamo();
		dynamo.getSettings().setErrorStream(new PrintStream(new ByteArrayOutputStream()));
		try {
			dynamo.parse("*\nC K\n");
			fail("DynamoParseException expected");
		} catch (DynamoParseException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith(ModelSource.DESCRIPTION_COMMAND_LINE_MODEL + ":2:4: expected '=', not ';'"));
		}
	}

	@Test
	public void testLastResult() {
		Dynamo dynamo = new Dynamo();
		assertNull(dynamo.getLastResult());
		dynamo.tryParse("a.dyn", "*\nC K=1\n");
		assertTrue(dynamo.getLastResult().isSuccess());
		assertEquals(0, dynamo.getLastResult().getErrorCount());
		assertEquals("", dynamo.getLastResult().getDiagnostics());
	}

	@Test
	public void testRoleTags() {
		assertEquals(Role.STOCK, Role.forTag("l"));
		assertEquals(Role.TABLE, Role.forTag("T"));
		assertNull(Role.forTag("Q"));
		assertNull(Role.forTag("CC"));
		assertEquals("aux", Role.AUXILIARY.getTypeName());
	}

	@Test
	public void testSettings() {
		DynamoSettings settings = new DynamoSettings();
		assertEquals(DynamoSettings.DEFAULT_TAB_WIDTH, settings.getTabWidth());
		assertTrue(settings.isExtractTimespec());
		settings.setTabWidth(4);
		assertEquals(4, settings.getTabWidth());
		try {
			settings.setTabWidth(0);
			fail("IllegalArgumentException expected");
		} catch (IllegalArgumentException e) {
			assertEquals(4, settings.getTabWidth());
		}
	}

	@Test
	public void testLoggerKeepsSlf4jQuiet() {
		assertEquals(DynamoTest.class.getName(), DynamoLogger.getLogger(DynamoTest.class).getName());
		assertEquals("WARN", System.getProperty("slf4j.internal.verbosity"));
	}
}
