package org.metricshub.tinybasic.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.tinybasic.frontend.BasicParser;
import org.metricshub.tinybasic.intermediate.Program;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.BufferedIoBridge;
import org.metricshub.tinybasic.jrt.RuntimeErrorKind;
import org.metricshub.tinybasic.util.BasicSettings;

public class ExecutorTest {

	private final BasicParser parser = new BasicParser();
	private Program program;
	private Environment environment;
	private BufferedIoBridge io;
	private BasicSettings settings;

	@Before
	public void setUp() {
		program = new Program();
		environment = new Environment();
		io = new BufferedIoBridge();
		settings = new BasicSettings();
	}

	private Executor load(String... lines) {
		for (String line : lines) {
			program.insertOrReplace(parser.parseLine(line));
		}
		return new Executor(program, environment, io, settings);
	}

	private BasicRuntimeException runtimeError(Executor executor) {
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, executor::run);
		assertEquals(ExecutionState.HALTED, executor.getState());
		return e;
	}

	@Test
	public void testEmptyProgramHalts() {
		assertEquals(ExecutionState.HALTED, load().run());
		assertEquals("", io.getOutput());
	}

	@Test
	public void testInputSuspendsAndResumes() {
		Executor executor = load("10 PRINT \"START\"", "20 INPUT A, B", "30 PRINT A + B");
		assertEquals(ExecutionState.AWAITING_INPUT, executor.run());
		assertEquals("START\n", io.getOutput());
		assertEquals(Arrays.asList('A', 'B'), executor.getPendingInput());
		assertEquals(Arrays.asList("A? "), io.getPrompts());

		assertEquals(ExecutionState.AWAITING_INPUT, executor.provideInput("3"));
		assertEquals(Arrays.asList('B'), executor.getPendingInput());
		assertEquals(Arrays.asList("A? ", "B? "), io.getPrompts());

		assertEquals(ExecutionState.HALTED, executor.provideInput(" -5 "));
		assertEquals("START\n-2\n", io.getOutput());
		assertEquals(3, environment.get('A'));
		assertEquals(-5, environment.get('B'));
	}

	@Test
	public void testInvalidInput() {
		Executor executor = load("10 PRINT \"X\"", "20 INPUT A");
		executor.run();
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> executor.provideInput("abc"));
		assertEquals(RuntimeErrorKind.INVALID_INPUT, e.getKind());
		assertEquals(20, e.getLineNumber());
		assertEquals(ExecutionState.HALTED, executor.getState());
		assertTrue(executor.getPendingInput().isEmpty());
	}

	@Test
	public void testProvideInputWithoutInput() {
		Executor executor = load("10 END");
		assertThrows(IllegalStateException.class, () -> executor.provideInput("1"));
	}

	@Test
	public void testEchoInput() {
		settings.setEchoInput(true);
		Executor executor = load("10 INPUT A", "20 PRINT A");
		executor.run();
		executor.provideInput("7");
		assertEquals("A? 7\n7\n", io.getOutput());
	}

	@Test
	public void testNestedGosub() {
		Executor executor = load(
				"10 GOSUB 100",
				"20 PRINT \"BACK\"",
				"30 END",
				"100 PRINT \"IN 100\"",
				"110 GOSUB 200",
				"120 PRINT \"AFTER 200\"",
				"130 RETURN",
				"200 PRINT \"IN 200\"",
				"210 RETURN");
		assertEquals(ExecutionState.HALTED, executor.run());
		assertEquals("IN 100\nIN 200\nAFTER 200\nBACK\n", io.getOutput());
		assertEquals(0, executor.getCallDepth());
	}

	@Test
	public void testComputedGoto() {
		Executor executor = load("10 LET X = 10", "20 GOTO X + 20", "25 PRINT \"NO\"", "30 PRINT \"YES\"");
		executor.run();
		assertEquals("YES\n", io.getOutput());
	}

	@Test
	public void testUndefinedLine() {
		BasicRuntimeException e = runtimeError(load("10 PRINT 1", "20 GOTO 99", "30 PRINT 3"));
		assertEquals(RuntimeErrorKind.UNDEFINED_LINE, e.getKind());
		assertEquals(20, e.getLineNumber());
		assertEquals("Undefined line 99", e.getMessage());
		assertEquals("1\n", io.getOutput());
	}

	@Test
	public void testUndefinedGosubTarget() {
		BasicRuntimeException e = runtimeError(load("10 GOSUB 500"));
		assertEquals(RuntimeErrorKind.UNDEFINED_LINE, e.getKind());
	}

	@Test
	public void testReturnWithoutGosub() {
		BasicRuntimeException e = runtimeError(load("10 PRINT 1", "20 RETURN"));
		assertEquals(RuntimeErrorKind.RETURN_WITHOUT_GOSUB, e.getKind());
		assertEquals(20, e.getLineNumber());
	}

	@Test
	public void testCallStackOverflow() {
		settings.setMaxGosubDepth(3);
		BasicRuntimeException e = runtimeError(load("10 GOSUB 10"));
		assertEquals(RuntimeErrorKind.CALL_STACK_OVERFLOW, e.getKind());
		assertEquals(10, e.getLineNumber());
	}

	@Test
	public void testPrintHasNoPartialOutput() {
		BasicRuntimeException e = runtimeError(load("10 PRINT \"X\", 1 / 0, \"Y\""));
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, e.getKind());
		assertEquals("", io.getOutput());
	}

	@Test
	public void testIfThenFallsThrough() {
		Executor executor = load("10 IF 2 > 1 THEN PRINT \"YES\"", "20 IF 2 < 1 THEN PRINT \"NO\"", "30 PRINT \"END\"");
		executor.run();
		assertEquals("YES\nEND\n", io.getOutput());
	}

	@Test
	public void testEndStopsImmediately() {
		Executor executor = load("10 PRINT 1", "20 END", "30 PRINT 3");
		assertEquals(ExecutionState.HALTED, executor.run());
		assertEquals("1\n", io.getOutput());
	}

	@Test
	public void testSlicing() {
		settings.setStepsPerSlice(2);
		Executor executor = load("10 LET A = 1", "20 LET A = A + 1", "30 LET A = A + 1", "40 PRINT A");
		assertEquals(ExecutionState.RUNNING, executor.run());
		assertEquals(30, executor.getProgramCounter());
		assertEquals("", io.getOutput());
		assertEquals(ExecutionState.HALTED, executor.resume());
		assertEquals("3\n", io.getOutput());
	}

	@Test
	public void testClearScreen() {
		Executor executor = load("10 PRINT \"A\"", "20 CLS", "30 PRINT \"B\"");
		executor.run();
		assertEquals("B\n", io.getOutput());
		assertEquals(1, io.getClearCount());
	}

	@Test
	public void testImmediateStatements() {
		Executor executor = load("100 PRINT \"SUB\"", "110 RETURN", "120 PRINT \"NEVER\"");
		assertEquals(ExecutionState.HALTED, executor.execute(parser.parseLine("PRINT 1 + 1").getStatement()));
		assertEquals(ExecutionState.HALTED, executor.execute(parser.parseLine("GOSUB 100").getStatement()));
		assertEquals("2\nSUB\n", io.getOutput());

		BasicRuntimeException e = assertThrows(
				BasicRuntimeException.class,
				() -> executor.execute(parser.parseLine("GOTO 5").getStatement()));
		assertEquals(-1, e.getLineNumber());
		assertEquals(ExecutionState.HALTED, executor.getState());
	}

	@Test
	public void testAbandon() {
		Executor executor = load("10 INPUT A", "20 PRINT A");
		executor.run();
		assertThrows(IllegalStateException.class, () -> executor.execute(parser.parseLine("PRINT 1").getStatement()));
		executor.abandon();
		assertEquals(ExecutionState.HALTED, executor.getState());
		assertEquals(Program.NO_LINE, executor.getProgramCounter());
		assertTrue(executor.getPendingInput().isEmpty());
	}

	@Test
	public void testVariablesSurviveRuns() {
		Executor executor = load("10 LET A = A + 1");
		executor.run();
		executor.run();
		assertEquals(2, environment.get('A'));
	}
}
