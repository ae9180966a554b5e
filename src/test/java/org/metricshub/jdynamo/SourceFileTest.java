package org.metricshub.jdynamo;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.jdynamo.frontend.Diagnostics;
import org.metricshub.jdynamo.frontend.Position;
import org.metricshub.jdynamo.frontend.SourceFile;

public class SourceFileTest {

	@Test
	public void testPositions() {
		SourceFile file = new SourceFile("m.dyn", "ab\ncd\n\nef");
		assertEquals(4, file.getLineCount());
		assertEquals("m.dyn:1:1", file.position(0).toString());
		assertEquals("m.dyn:1:3", file.position(2).toString());
		assertEquals("m.dyn:2:1", file.position(3).toString());
		assertEquals("m.dyn:2:2", file.position(4).toString());
		assertEquals("m.dyn:3:1", file.position(6).toString());
		assertEquals("m.dyn:4:2", file.position(8).toString());
		assertEquals("end of input", "m.dyn:4:3", file.position(9).toString());
	}

	@Test
	public void testUnknownPosition() {
		SourceFile file = new SourceFile("m.dyn", "abc");
		Position pos = file.position(-1);
		assertFalse(pos.isValid());
		assertEquals("m.dyn", pos.toString());
		assertEquals("-", new Position(null, 0, 0).toString());
	}

	@Test
	public void testLineText() {
		SourceFile file = new SourceFile("m.dyn", "first\nsecond\n");
		assertEquals("first", file.lineText(1));
		assertEquals("second", file.lineText(2));
		assertEquals("", file.lineText(3));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLineTextOutOfRange() {
		new SourceFile("m.dyn", "one").lineText(2);
	}

	@Test
	public void testExcerpt() {
		SourceFile file = new SourceFile("m.dyn", "*\nC X=?\n");
		assertEquals("C X=?\n    ^\n", file.excerpt(file.position(6), 8));
	}

	@Test
	public void testExcerptExpandsTabs() {
		SourceFile file = new SourceFile("m.dyn", "\tX\n");
		assertEquals("        X\n        ^\n", file.excerpt(file.position(1), 8));
		assertEquals("    X\n    ^\n", file.excerpt(file.position(1), 4));
	}

	@Test
	public void testDiagnostics() {
		SourceFile file = new SourceFile("m.dyn", "*\nC X\n");
		Diagnostics diagnostics = new Diagnostics(file);
		assertFalse(diagnostics.hasErrors());
		diagnostics.error(4, "expected '=', not '%s'", ";");
		diagnostics.error(-1, "no position");
		assertTrue(diagnostics.hasErrors());
		assertEquals(2, diagnostics.getErrorCount());
		assertEquals("m.dyn:2:3: expected '=', not ';'\nm.dyn: no position\n", diagnostics.getText());
	}
}
