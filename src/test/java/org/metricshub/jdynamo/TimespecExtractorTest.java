package org.metricshub.jdynamo;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jdynamo.frontend.ParseResult;
import org.metricshub.jdynamo.frontend.ast.AssignStmt;
import org.metricshub.jdynamo.frontend.ast.BasicLit;
import org.metricshub.jdynamo.frontend.ast.CompositeLit;
import org.metricshub.jdynamo.frontend.ast.Expr;
import org.metricshub.jdynamo.frontend.ast.Ident;
import org.metricshub.jdynamo.frontend.ast.LiteralKind;
import org.metricshub.jdynamo.frontend.ast.ModelDecl;
import org.metricshub.jdynamo.frontend.ast.Role;
import org.metricshub.jdynamo.frontend.ast.Stmt;
import org.metricshub.jdynamo.frontend.ast.TableFwdExpr;
import org.metricshub.jdynamo.frontend.ast.Timespec;
import org.metricshub.jdynamo.frontend.ast.VarDecl;
import org.metricshub.jdynamo.semantic.ConstEvaluator;
import org.metricshub.jdynamo.semantic.SemanticException;
import org.metricshub.jdynamo.semantic.TimespecExtractor;
import org.metricshub.jdynamo.util.DynamoSettings;

public class TimespecExtractorTest {

	private Dynamo dynamo;

	@Before
	public void setUp() {
		DynamoSettings settings = new DynamoSettings();
		settings.setErrorStream(new PrintStream(new ByteArrayOutputStream()));
		dynamo = new Dynamo(settings);
	}

	private ModelDecl parseMain(String src) {
		return dynamo.parse("test.dyn", src).getModel("main");
	}

	private static List<String> names(ModelDecl model) {
		List<String> names = new ArrayList<String>();
		for (Stmt stmt : model.getBody()) {
			names.add(((AssignStmt) stmt).getName());
		}
		return names;
	}

	private static String value(CompositeLit lit, String key) {
		return ((BasicLit) lit.get(key)).getValue();
	}

	@Test
	public void testControlVariablesAreExtracted() {
		ModelDecl model = parseMain("*\nC TIME=0;C LENGTH=10;C DT=0.5;C SAVPER=1;C POPN=100;");
		assertEquals(Arrays.asList("POPN", "timespec"), names(model));
		assertEquals(new Timespec(0, 10, 0.5, 1), model.getTimespec());
		assertTrue(model.isTimespecResolved());

		AssignStmt ts = model.findAssign(TimespecExtractor.TIMESPEC);
		assertNull("the timespec has no type tag", ts.getLhs().getRole());
		assertEquals(Expr.Kind.COMPOSITE_LIT, ts.getRhs().getKind());
		CompositeLit lit = (CompositeLit) ts.getRhs();
		assertEquals(4, lit.getElts().size());
		assertEquals("start", lit.getElts().get(0).getKey().getName());
		assertEquals("end", lit.getElts().get(1).getKey().getName());
		assertEquals("dt", lit.getElts().get(2).getKey().getName());
		assertEquals("save_step", lit.getElts().get(3).getKey().getName());
		assertEquals("0.000000", value(lit, "start"));
		assertEquals("10.000000", value(lit, "end"));
		assertEquals("0.500000", value(lit, "dt"));
		assertEquals("1.000000", value(lit, "save_step"));
	}

	@Test
	public void testDefaults() {
		ModelDecl model = parseMain("*\nC X=1\n");
		assertEquals(Arrays.asList("X", "timespec"), names(model));
		assertEquals(Timespec.DEFAULT, model.getTimespec());
		CompositeLit lit = (CompositeLit) model.findAssign("timespec").getRhs();
		assertEquals("0.000000", value(lit, "start"));
		assertEquals("0.000000", value(lit, "end"));
		assertEquals("1.000000", value(lit, "dt"));
		assertEquals("1.000000", value(lit, "save_step"));
	}

	@Test
	public void testEmptyModelStillGetsTimespec() {
		ModelDecl model = parseMain("* nothing\n");
		assertEquals(Arrays.asList("timespec"), names(model));
	}

	@Test
	public void testNamesAreCaseInsensitive() {
		ModelDecl model = parseMain("*\nc time=5\nC Length=20\nc dt=.25\n");
		assertEquals(Arrays.asList("timespec"), names(model));
		assertEquals(new Timespec(5, 20, 0.25, 1), model.getTimespec());
	}

	@Test
	public void testOrderOfOtherStatementsIsKept() {
		ModelDecl model = parseMain("*\nC A=1\nC TIME=0\nT B=1/2\nC DT=1\nN C=3\n");
		assertEquals(Arrays.asList("A", "B", "C", "timespec"), names(model));
	}

	@Test
	public void testLastAssignmentWins() {
		ModelDecl model = parseMain("*\nC DT=1\nC DT=.1\n");
		assertEquals(0.1, model.getTimespec().getDt(), 0);
	}

	@Test
	public void testExtractionCanBeDisabled() {
		DynamoSettings settings = new DynamoSettings();
		settings.setExtractTimespec(false);
		ModelDecl model = new Dynamo(settings).parse("test.dyn", "*\nC TIME=0\nC X=1\n").getModel("main");
		assertEquals(Arrays.asList("TIME", "X"), names(model));
		assertFalse(model.isTimespecResolved());
		assertNull(model.getTimespec());
	}

	@Test
	public void testNoExtractionWhenModelHasErrors() {
		ParseResult result = dynamo.tryParse("test.dyn", "*\nC TIME=0\nC X 1\n");
		assertEquals(1, result.getErrorCount());
		ModelDecl model = result.getFile().getModel("main");
		assertEquals(Arrays.asList("TIME"), names(model));
		assertFalse(model.isTimespecResolved());
	}

	@Test
	public void testInvalidLiteral() {
		ParseResult result = dynamo.tryParse("test.dyn", "*\nC DT=.\n");
		assertEquals(
				Arrays.asList("test.dyn:2:3: extractTimespec: constEval(DT): invalid float literal '.'"),
				result.getDiagnosticLines());
		assertFalse(result.getFile().getModel("main").isTimespecResolved());
	}

	@Test
	public void testTableIsNotAConstant() {
		ParseResult result = dynamo.tryParse("test.dyn", "*\nT LENGTH=1/2\n");
		assertEquals(1, result.getErrorCount());
		assertTrue(
				result.getDiagnostics(),
				result.getDiagnosticLines().get(0).startsWith("test.dyn:2:3: extractTimespec: constEval(LENGTH): not a constant expression"));
	}

	@Test
	public void testSecondRunIsRejected() {
		ModelDecl model = parseMain("*\nC DT=2\n");
		try {
			TimespecExtractor.extract(model);
			fail("SemanticException expected");
		} catch (SemanticException e) {
			assertEquals("timespec already extracted for model main", e.getMessage());
		}
	}

	@Test
	public void testExtractOnHandBuiltModel() {
		List<Stmt> body = new ArrayList<Stmt>();
		body.add(new AssignStmt(new VarDecl(Ident.of("SAVPER"), Role.CONSTANT), BasicLit.ofDouble(5)));
		body.add(new AssignStmt(new VarDecl(Ident.of("K"), Role.CONSTANT), BasicLit.ofDouble(2)));
		ModelDecl model = new ModelDecl(Ident.of("main"), body);

		ModelDecl extracted = TimespecExtractor.extract(model);
		assertEquals(Arrays.asList("K", "timespec"), names(extracted));
		assertEquals(5, extracted.getTimespec().getSaveStep(), 0);
		// the input model is left untouched
		assertEquals(Arrays.asList("SAVPER", "K"), names(model));
		assertFalse(model.isTimespecResolved());
	}

	@Test
	public void testIsControlVariable() {
		assertTrue(TimespecExtractor.isControlVariable("TIME"));
		assertTrue(TimespecExtractor.isControlVariable("savper"));
		assertTrue(TimespecExtractor.isControlVariable("Dt"));
		assertFalse(TimespecExtractor.isControlVariable("TIMES"));
		assertFalse(TimespecExtractor.isControlVariable("timespec"));
	}

	@Test
	public void testConstEvaluator() {
		assertEquals(1650000000d, ConstEvaluator.eval(new BasicLit(0, LiteralKind.FLOAT, "1.65E9")), 0);
		assertEquals(0.5, ConstEvaluator.eval(BasicLit.ofDouble(0.5)), 0);
		try {
			ConstEvaluator.eval(new TableFwdExpr(Collections.singletonList(BasicLit.ofDouble(1))));
			fail("SemanticException expected");
		} catch (SemanticException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith("not a constant expression"));
		}
	}
}
