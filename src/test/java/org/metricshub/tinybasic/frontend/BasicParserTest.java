package org.metricshub.tinybasic.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.tinybasic.frontend.ast.Command;
import org.metricshub.tinybasic.frontend.ast.CommandStatement;
import org.metricshub.tinybasic.frontend.ast.IfStatement;
import org.metricshub.tinybasic.frontend.ast.InputStatement;
import org.metricshub.tinybasic.frontend.ast.Line;
import org.metricshub.tinybasic.frontend.ast.RelationOperator;
import org.metricshub.tinybasic.frontend.ast.RemStatement;
import org.metricshub.tinybasic.frontend.ast.SimpleStatement;
import org.metricshub.tinybasic.frontend.ast.StatementKind;

public class BasicParserTest {

	private final BasicParser parser = new BasicParser();

	private String expression(String text) {
		return parser.parseExpression(text).toString();
	}

	private String parseError(String line) {
		return assertThrows(ParserException.class, () -> parser.parseLine(line)).getMessage();
	}

	@Test
	public void testPrecedence() {
		assertEquals("(2 + (3 * 4))", expression("2 + 3 * 4"));
		assertEquals("((2 + 3) * 4)", expression("(2 + 3) * 4"));
		assertEquals("((2 * 3) + 4)", expression("2*3+4"));
	}

	@Test
	public void testLeftAssociativity() {
		assertEquals("((10 - 2) - 3)", expression("10 - 2 - 3"));
		assertEquals("((16 / 4) / 2)", expression("16 / 4 / 2"));
	}

	@Test
	public void testUnaryBindsTighterThanBinary() {
		assertEquals("((-2) * 3)", expression("-2 * 3"));
		assertEquals("(-(-A))", expression("--A"));
		assertEquals("(A - (+B))", expression("A - +B"));
	}

	@Test
	public void testExpressionMustSpanText() {
		assertThrows(ParserException.class, () -> parser.parseExpression("1 +"));
		assertThrows(ParserException.class, () -> parser.parseExpression("1 2"));
		assertThrows(ParserException.class, () -> parser.parseExpression("(1"));
	}

	@Test
	public void testNumberedLine() {
		Line line = parser.parseLine("10 PRINT \"A=\", A");
		assertEquals(10, line.getNumber());
		assertEquals(StatementKind.PRINT, line.getStatement().kind());
		assertEquals("10 PRINT \"A=\", A", line.toString());
		assertEquals("10 PRINT \"A=\", A", line.getSource());
	}

	@Test
	public void testImmediateLine() {
		Line line = parser.parseLine("LET X = Y * 2");
		assertTrue(line.isImmediate());
		assertEquals("LET X = (Y * 2)", line.toString());
	}

	@Test
	public void testBlankAndDeletionLines() {
		assertNull(parser.parseLine("   "));
		Line deletion = parser.parseLine("30");
		assertTrue(deletion.isDeletion());
		assertEquals(30, deletion.getNumber());
	}

	@Test
	public void testNestedIf() {
		Line line = parser.parseLine("20 IF A < 3 THEN IF B >= 1 THEN GOTO 100");
		IfStatement outer = (IfStatement) line.getStatement();
		assertEquals(RelationOperator.LESS_THAN, outer.getRelation());
		IfStatement inner = (IfStatement) outer.getThen();
		assertEquals(RelationOperator.GREATER_THAN_OR_EQUAL, inner.getRelation());
		assertEquals(StatementKind.GOTO, inner.getThen().kind());
		assertEquals("20 IF A < 3 THEN IF B >= 1 THEN GOTO 100", line.toString());
	}

	@Test
	public void testAlternateNotEqual() {
		IfStatement statement = (IfStatement) parser.parseLine("IF A >< B THEN END").getStatement();
		assertEquals(RelationOperator.NOT_EQUAL, statement.getRelation());
		assertSame(SimpleStatement.END, statement.getThen());
	}

	@Test
	public void testInputAndJumps() {
		InputStatement input = (InputStatement) parser.parseLine("INPUT A, B, Z").getStatement();
		assertEquals(Arrays.asList('A', 'B', 'Z'), input.getVariables());
		assertEquals("GOTO (X + 10)", parser.parseLine("GOTO X + 10").toString());
		assertEquals(StatementKind.GOSUB, parser.parseLine("GOSUB 200").getStatement().kind());
	}

	@Test
	public void testRemAndCls() {
		RemStatement rem = (RemStatement) parser.parseLine("10 REM hi there").getStatement();
		assertEquals("hi there", rem.getComment());
		assertSame(SimpleStatement.CLS, parser.parseLine("CLS").getStatement());
	}

	@Test
	public void testCommands() {
		for (Command command : Command.values()) {
			Line line = parser.parseLine(command.name());
			assertSame(CommandStatement.of(command), line.getStatement());
		}
		assertEquals("LIST is only allowed in immediate mode (column 4)", parseError("10 LIST"));
		assertTrue(parseError("IF 1 = 1 THEN RUN").startsWith("RUN is only allowed in immediate mode"));
	}

	@Test
	public void testLineNumberRange() {
		assertTrue(parseError("0 PRINT 1").startsWith("Line number must be between 1 and 32767. Got 0"));
		assertTrue(parseError("40000 END").startsWith("Line number must be between 1 and 32767. Got 40000"));
		assertEquals(Line.MAX_NUMBER, parser.parseLine("32767 END").getNumber());
	}

	@Test
	public void testSyntaxErrors() {
		assertEquals("Expecting end of line. Found: NUMBER (5) (column 11)", parseError("10 RETURN 5"));
		assertEquals("Expecting =. Found: NUMBER (1) (column 7)", parseError("LET A 1"));
		assertEquals("Invalid variable name AB (column 5)", parseError("LET AB = 1"));
		assertEquals("Expecting statement keyword. Found: WORD (let) (column 1)", parseError("let a = 1"));
		assertEquals("Expecting string or expression. Found: end of line (column 6)", parseError("PRINT"));
		assertEquals("Expecting THEN. Found: KW_GOTO (GOTO) (column 10)", parseError("IF A = 1 GOTO 10"));
		assertTrue(parseError("IF A THEN END").startsWith("Expecting relation operator"));
		assertTrue(parseError("PRINT 1 < 2").startsWith("Expecting end of line"));
		assertTrue(parseError("INPUT A,").startsWith("Expecting variable"));
	}
}
