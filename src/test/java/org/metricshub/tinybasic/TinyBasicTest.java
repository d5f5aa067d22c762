package org.metricshub.tinybasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.tinybasic.TinyBasicTestSupport.basicTest;

import java.io.EOFException;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.tinybasic.backend.ExecutionState;
import org.metricshub.tinybasic.frontend.LexerException;
import org.metricshub.tinybasic.frontend.ParserException;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.BufferedIoBridge;
import org.metricshub.tinybasic.jrt.RuntimeErrorKind;

public class TinyBasicTest {

	private BufferedIoBridge bridge;
	private TinyBasic basic;

	@Before
	public void setUp() {
		bridge = new BufferedIoBridge();
		basic = new TinyBasic(bridge);
	}

	private void type(String... lines) throws Exception {
		for (String line : lines) {
			basic.accept(line);
		}
	}

	@Test
	public void testCountingLoop() throws Exception {
		basicTest("count to three")
				.program("10 LET A=1", "20 PRINT A", "30 LET A=A+1", "40 IF A<4 THEN GOTO 20", "50 END")
				.expectLines("1", "2", "3")
				.runAndAssert();
	}

	@Test
	public void testInputThenPrint() throws Exception {
		basicTest("input binds the variable")
				.program("10 INPUT A", "20 PRINT A")
				.input("7")
				.expectLines("7")
				.runAndAssert();
	}

	@Test
	public void testSequentialFallthrough() throws Exception {
		basicTest("lines typed out of order run in numeric order")
				.program("30 PRINT \"C\"", "10 PRINT \"A\"", "20 PRINT \"B\"")
				.expectLines("A", "B", "C")
				.runAndAssert();
	}

	@Test
	public void testIfGotoJumpsOnlyWhenTrue() throws Exception {
		basicTest("true condition jumps")
				.program("10 IF 1 = 1 THEN GOTO 50", "20 PRINT \"FELL\"", "50 PRINT \"JUMPED\"")
				.expectLines("JUMPED")
				.runAndAssert();
		basicTest("false condition falls through")
				.program("10 IF 1 = 2 THEN GOTO 50", "20 PRINT \"FELL\"", "50 PRINT \"JUMPED\"")
				.expectLines("FELL", "JUMPED")
				.runAndAssert();
	}

	@Test
	public void testNestedIf() throws Exception {
		basicTest("each IF level gates its own statement")
				.program(
						"10 LET A = 2",
						"20 IF A > 1 THEN IF A < 3 THEN PRINT \"MID\"",
						"30 IF A > 1 THEN IF A > 3 THEN PRINT \"HIGH\"",
						"40 PRINT \"DONE\"")
				.expectLines("MID", "DONE")
				.runAndAssert();
	}

	@Test
	public void testPrintItemsAreConcatenated() throws Exception {
		basicTest("print list")
				.program("10 LET X = 6", "20 PRINT \"X=\", X, \" Y=\", X * 7")
				.expectLines("X=6 Y=42")
				.runAndAssert();
	}

	@Test
	public void testRemIsNoOp() throws Exception {
		basicTest("remarks are skipped")
				.program("10 REM PRINT \"NOT ME\"", "20 PRINT \"ME\"")
				.expectLines("ME")
				.runAndAssert();
	}

	@Test
	public void testArithmeticWrapsAround() throws Exception {
		basicTest("32-bit overflow wraps")
				.program("10 LET A = 2147483647", "20 PRINT A + 1")
				.expectLines("-2147483648")
				.runAndAssert();
	}

	@Test
	public void testRuntimeErrorStopsRun() throws Exception {
		basicTest("undefined line")
				.program("10 PRINT \"ONE\"", "20 GOTO 99", "30 PRINT \"TWO\"")
				.expectThrow(BasicRuntimeException.class)
				.runAndAssert();
		basicTest("return without gosub")
				.program("10 RETURN")
				.expectThrow(BasicRuntimeException.class)
				.runAndAssert();
		basicTest("bad source line")
				.program("10 PRINT \"OPEN")
				.expectThrow(LexerException.class)
				.runAndAssert();
	}

	@Test
	public void testInputExhausted() throws Exception {
		basicTest("input ends while waiting")
				.program("10 INPUT A, B")
				.input("1")
				.expectThrow(EOFException.class)
				.runAndAssert();
	}

	@Test
	public void testInputPrompts() throws Exception {
		TinyBasicTestSupport.TestResult result = basicTest("prompts")
				.program("10 INPUT A, B", "20 PRINT A - B")
				.input("10", "4")
				.expectLines("6")
				.run();
		result.assertExpected();
		assertEquals(Arrays.asList("A? ", "B? "), result.prompts());
	}

	@Test
	public void testImmediateStatement() throws Exception {
		type("PRINT 2 + 3 * 4", "LET A = 9", "PRINT A");
		assertEquals("14\n9\n", bridge.getOutput());
		assertEquals(0, basic.getProgram().size());
	}

	@Test
	public void testImmediateGotoRunsProgram() throws Exception {
		type("10 PRINT \"GO\"", "20 END", "GOTO 10");
		assertEquals("GO\n", bridge.getOutput());
		assertEquals(ExecutionState.HALTED, basic.getState());
	}

	@Test
	public void testImmediateRuntimeError() throws Exception {
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> basic.accept("PRINT 1 / 0"));
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, e.getKind());
		assertEquals(-1, e.getLineNumber());
		assertTrue(e.describe().startsWith("DIVISION_BY_ZERO in immediate mode"));
		assertEquals(ExecutionState.HALTED, basic.getState());
		assertEquals("", bridge.getOutput());
	}

	@Test
	public void testReplaceLine() throws Exception {
		type("10 PRINT 1", "10 PRINT 2");
		assertEquals(1, basic.getProgram().size());
		type("RUN");
		assertEquals("2\n", bridge.getOutput());
	}

	@Test
	public void testDeleteLine() throws Exception {
		type("10 PRINT 1", "20 PRINT 2", "10", "LIST");
		assertEquals("20 PRINT 2\n", bridge.getOutput());
	}

	@Test
	public void testParseErrorKeepsEarlierLines() throws Exception {
		type("10 PRINT 1");
		assertThrows(ParserException.class, () -> basic.accept("20 PRINT ("));
		assertThrows(ParserException.class, () -> basic.accept("10 LET A"));
		assertEquals("10 PRINT 1", basic.listing());
	}

	@Test
	public void testListOrdersAndTrims() throws Exception {
		type("  30 END  ", "10 LET A = 1", "20 PRINT A", "LIST");
		assertEquals("10 LET A = 1\n20 PRINT A\n30 END\n", bridge.getOutput());
	}

	@Test
	public void testListEmptyProgram() throws Exception {
		type("LIST");
		assertEquals("", bridge.getOutput());
	}

	@Test
	public void testNewClearsProgramButKeepsVariables() throws Exception {
		type("LET A = 5", "10 PRINT A", "NEW", "LIST");
		assertEquals("", bridge.getOutput());
		assertTrue(basic.getProgram().isEmpty());
		assertEquals(5, basic.getEnvironment().get('A'));
	}

	@Test
	public void testRunKeepsVariables() throws Exception {
		type("LET A = 5", "10 PRINT A", "RUN");
		assertEquals("5\n", bridge.getOutput());
	}

	@Test
	public void testHelp() throws Exception {
		type("HELP");
		assertEquals(TinyBasic.HELP_TEXT, bridge.getOutput());
		assertTrue(bridge.getOutput().contains("GOSUB <expression>"));
	}

	@Test
	public void testClsClearsOutput() throws Exception {
		type("PRINT \"BEFORE\"", "CLS", "PRINT \"AFTER\"");
		assertEquals("AFTER\n", bridge.getOutput());
		assertEquals(1, bridge.getClearCount());
	}

	@Test
	public void testSaveThenLoad() throws Exception {
		type("20 PRINT 2", "10 PRINT 1", "SAVE");
		assertEquals("10 PRINT 1\n20 PRINT 2", bridge.getStoredProgram());
		type("NEW", "LOAD");
		assertEquals("program loaded\n", bridge.getOutput());
		assertEquals(2, basic.getProgram().size());
	}

	@Test
	public void testLoadWithoutProgram() throws Exception {
		type("LOAD");
		assertEquals("no program to load\n", bridge.getOutput());
	}

	@Test
	public void testLoadReportsRejectedLines() throws Exception {
		bridge.setStoredProgram("10 PRINT 1\n\nPRINT 2\r\n20 PRINT @\n30 END\n");
		type("LOAD");
		assertEquals(
				"PRINT 2: Program lines must start with a line number (column 1)\n"
						+ "20 PRINT @: Invalid character: '@' (column 10)\n"
						+ "program loaded\n",
				bridge.getOutput());
		assertEquals("10 PRINT 1\n30 END", basic.listing());
	}

	@Test
	public void testLoadProgramReplacesStore() {
		basic.loadProgram("10 PRINT 1\n20 PRINT 2");
		List<String> errors = basic.loadProgram("5 END");
		assertTrue(errors.isEmpty());
		assertEquals("5 END", basic.listing());
	}

	@Test
	public void testAcceptRoutesInput() throws Exception {
		type("10 INPUT A", "20 PRINT A * 2");
		assertEquals(ExecutionState.AWAITING_INPUT, basic.accept("RUN"));
		assertThrows(IllegalStateException.class, () -> basic.submitLine("30 END"));
		assertEquals(ExecutionState.HALTED, basic.accept("21"));
		assertEquals("42\n", bridge.getOutput());
	}

	@Test
	public void testAbandonDuringInput() throws Exception {
		type("10 INPUT A", "20 PRINT A");
		basic.run();
		assertEquals(ExecutionState.AWAITING_INPUT, basic.getState());
		basic.abandon();
		assertEquals(ExecutionState.HALTED, basic.getState());
		type("LIST");
		assertEquals("10 INPUT A\n20 PRINT A\n", bridge.getOutput());
	}

	@Test
	public void testBlankLineIgnored() throws Exception {
		assertEquals(ExecutionState.HALTED, basic.accept("   "));
		assertTrue(basic.getProgram().isEmpty());
		assertEquals("", bridge.getOutput());
	}

	@Test
	public void testInterpretersAreIndependent() throws Exception {
		BufferedIoBridge otherBridge = new BufferedIoBridge();
		TinyBasic other = new TinyBasic(otherBridge);
		type("LET A = 1");
		other.accept("LET A = 2");
		assertEquals(1, basic.getEnvironment().get('A'));
		assertEquals(2, other.getEnvironment().get('A'));
		assertNotSame(basic.getProgram(), other.getProgram());
	}

	@Test
	public void testExecute() throws Exception {
		assertEquals("3\n", TinyBasic.execute("10 INPUT A, B\n20 PRINT A + B", "1", "2"));
		assertThrows(ParserException.class, () -> TinyBasic.execute("10 PRINT 1\n20 BOGUS"));
		assertThrows(EOFException.class, () -> TinyBasic.execute("10 INPUT A"));
	}
}
