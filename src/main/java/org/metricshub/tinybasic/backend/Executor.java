package org.metricshub.tinybasic.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * TinyBasic
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.metricshub.tinybasic.frontend.ast.IfStatement;
import org.metricshub.tinybasic.frontend.ast.InputStatement;
import org.metricshub.tinybasic.frontend.ast.JumpStatement;
import org.metricshub.tinybasic.frontend.ast.LetStatement;
import org.metricshub.tinybasic.frontend.ast.Line;
import org.metricshub.tinybasic.frontend.ast.PrintItem;
import org.metricshub.tinybasic.frontend.ast.PrintStatement;
import org.metricshub.tinybasic.frontend.ast.Statement;
import org.metricshub.tinybasic.intermediate.Program;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.IoBridge;
import org.metricshub.tinybasic.jrt.RuntimeErrorKind;
import org.metricshub.tinybasic.util.BasicLogger;
import org.metricshub.tinybasic.util.BasicSettings;
import org.slf4j.Logger;

/**
 * The TinyBasic virtual machine: walks the statements of a {@link Program}
 * one line at a time.
 * <p>
 * The executor holds the program counter, the GOSUB return stack and the
 * variables of the INPUT statement in progress. It never blocks: when an
 * INPUT needs a value, {@link #run()} (or whichever call was driving the
 * program) returns {@link ExecutionState#AWAITING_INPUT}, and the host feeds
 * the text through {@link #provideInput(String)}, which resumes the program
 * right after the INPUT. Output already written is never written again.
 * <p>
 * Runtime errors halt the executor, then propagate as
 * {@link BasicRuntimeException}s carrying the offending line number.
 * <p>
 * An executor is not thread-safe. The program must not be edited while the
 * state is anything but {@link ExecutionState#HALTED}.
 */
public class Executor {

	private static final Logger LOGGER = BasicLogger.getLogger(Executor.class);

	private final Program program;
	private final Environment environment;
	private final Evaluator evaluator;
	private final IoBridge io;
	private final BasicSettings settings;

	private ExecutionState state = ExecutionState.HALTED;
	private int programCounter = Program.NO_LINE;
	private int currentLine = Program.NO_LINE;
	private Deque<Integer> callStack = new ArrayDeque<Integer>();
	private Deque<Character> pendingInput = new ArrayDeque<Character>();
	private int inputLine = Program.NO_LINE;

	/**
	 * @param program the statements to run
	 * @param environment the variables, kept across runs
	 * @param io where output and prompts go
	 * @param settings GOSUB depth, slicing and echo options
	 */
	public Executor(Program program, Environment environment, IoBridge io, BasicSettings settings) {
		this.program = program;
		this.environment = environment;
		this.evaluator = new Evaluator(environment);
		this.io = io;
		this.settings = settings == null ? BasicSettings.DEFAULT_SETTINGS : settings;
	}

	/**
	 * Starts the program from its first line, with an empty call stack.
	 * Anything in progress is abandoned first.
	 *
	 * @return {@link ExecutionState#HALTED}, {@link ExecutionState#AWAITING_INPUT},
	 *         or {@link ExecutionState#RUNNING} if the slice was exhausted
	 * @throws BasicRuntimeException if the program fails
	 */
	public ExecutionState run() {
		abandon();
		LOGGER.debug("Running program of {} line(s)", program.size());
		programCounter = program.firstLine();
		state = ExecutionState.RUNNING;
		return loop();
	}

	/**
	 * Executes a statement that has no line number. A GOTO or GOSUB carries
	 * on into the stored program; anything else halts once done.
	 *
	 * @param statement the immediate statement
	 * @return the state once the statement (and any program it jumped into)
	 *         halts or suspends
	 * @throws BasicRuntimeException if the statement fails
	 * @throws IllegalStateException if a program is running or waiting for input
	 */
	public ExecutionState execute(Statement statement) {
		if (state != ExecutionState.HALTED) {
			throw new IllegalStateException("Cannot execute a statement while " + state);
		}
		abandon();
		state = ExecutionState.RUNNING;
		currentLine = Line.IMMEDIATE;
		try {
			programCounter = step(statement, Line.IMMEDIATE);
		} catch (RuntimeException e) {
			halt();
			throw e;
		}
		return loop();
	}

	/**
	 * Continues a program that returned {@link ExecutionState#RUNNING} because
	 * its slice of steps was used up.
	 *
	 * @return the new state
	 * @throws BasicRuntimeException if the program fails
	 */
	public ExecutionState resume() {
		return loop();
	}

	/**
	 * Binds the next variable of the pending INPUT statement. Once every
	 * variable is bound, execution resumes at the line following the INPUT.
	 *
	 * @param text the input line typed by the user
	 * @return {@link ExecutionState#AWAITING_INPUT} while variables remain,
	 *         otherwise the state reached by the resumed program
	 * @throws BasicRuntimeException with {@link RuntimeErrorKind#INVALID_INPUT}
	 *         if the text is not an integer, or any error of the resumed program
	 * @throws IllegalStateException if no INPUT is pending
	 */
	public ExecutionState provideInput(String text) {
		if (state != ExecutionState.AWAITING_INPUT) {
			throw new IllegalStateException("No INPUT is pending, state is " + state);
		}
		char variable = pendingInput.peek();
		int value;
		try {
			value = Integer.parseInt(text == null ? "" : text.trim());
		} catch (NumberFormatException e) {
			halt();
			throw new BasicRuntimeException(
					RuntimeErrorKind.INVALID_INPUT,
					inputLine,
					"Expecting an integer for " + variable + ". Got: \"" + text + "\"",
					e);
		}
		environment.set(variable, value);
		pendingInput.poll();
		if (settings.isEchoInput()) {
			io.write(variable + "? " + text.trim() + "\n");
		}
		if (!pendingInput.isEmpty()) {
			io.setPrompt(pendingInput.peek() + "? ");
			return state;
		}
		state = ExecutionState.RUNNING;
		programCounter = next(inputLine);
		return loop();
	}

	/**
	 * Discards the run in progress, if any: call stack, pending input and
	 * program counter. Variables and program are kept.
	 */
	public void abandon() {
		if (state != ExecutionState.HALTED) {
			LOGGER.debug("Abandoning run at {} ({})", BasicLogger.where(currentLine), state);
		}
		state = ExecutionState.HALTED;
		programCounter = Program.NO_LINE;
		currentLine = Program.NO_LINE;
		callStack = new ArrayDeque<Integer>();
		pendingInput = new ArrayDeque<Character>();
		inputLine = Program.NO_LINE;
	}

	public ExecutionState getState() {
		return state;
	}

	/**
	 * @return the next line to execute, or {@link Program#NO_LINE}
	 */
	public int getProgramCounter() {
		return programCounter;
	}

	/**
	 * @return the variables the current INPUT still waits for
	 */
	public List<Character> getPendingInput() {
		return new ArrayList<Character>(pendingInput);
	}

	/**
	 * @return the number of GOSUB not yet matched by a RETURN
	 */
	public int getCallDepth() {
		return callStack.size();
	}

	private void halt() {
		if (state != ExecutionState.HALTED) {
			LOGGER.debug("Program halted after {}", BasicLogger.where(currentLine));
		}
		state = ExecutionState.HALTED;
		programCounter = Program.NO_LINE;
		pendingInput.clear();
	}

	private ExecutionState loop() {
		int budget = settings.getStepsPerSlice();
		int steps = 0;
		try {
			while (state == ExecutionState.RUNNING) {
				if (programCounter == Program.NO_LINE) {
					// falling off the end is an implicit END
					halt();
					break;
				}
				if (budget > 0 && steps++ >= budget) {
					break;
				}
				currentLine = programCounter;
				Statement statement = program.get(currentLine);
				if (statement == null) {
					throw new BasicRuntimeException(
							RuntimeErrorKind.UNDEFINED_LINE,
							currentLine,
							"Line " + currentLine + " no longer exists");
				}
				LOGGER.trace("{}: {}", currentLine, statement);
				programCounter = step(statement, currentLine);
			}
		} catch (RuntimeException e) {
			halt();
			throw e;
		}
		return state;
	}

	/**
	 * Performs one statement.
	 *
	 * @return the line to execute next, or {@link Program#NO_LINE} to halt
	 */
	private int step(Statement statement, int line) {
		switch (statement.kind()) {
		case PRINT:
			print((PrintStatement) statement, line);
			return next(line);
		case IF: {
			IfStatement ifStatement = (IfStatement) statement;
			int left = evaluator.evaluate(ifStatement.getLeft(), line);
			int right = evaluator.evaluate(ifStatement.getRight(), line);
			if (Evaluator.compare(left, ifStatement.getRelation(), right)) {
				return step(ifStatement.getThen(), line);
			}
			return next(line);
		}
		case INPUT: {
			InputStatement input = (InputStatement) statement;
			pendingInput = new ArrayDeque<Character>(input.getVariables());
			inputLine = line;
			state = ExecutionState.AWAITING_INPUT;
			io.setPrompt(pendingInput.peek() + "? ");
			return line;
		}
		case LET: {
			LetStatement let = (LetStatement) statement;
			environment.set(let.getVariable(), evaluator.evaluate(let.getValue(), line));
			return next(line);
		}
		case GOTO:
			return target((JumpStatement) statement, line);
		case GOSUB: {
			int target = target((JumpStatement) statement, line);
			if (callStack.size() >= settings.getMaxGosubDepth()) {
				throw new BasicRuntimeException(
						RuntimeErrorKind.CALL_STACK_OVERFLOW,
						line,
						"More than " + settings.getMaxGosubDepth() + " nested GOSUB");
			}
			callStack.push(next(line));
			return target;
		}
		case RETURN:
			if (callStack.isEmpty()) {
				throw new BasicRuntimeException(RuntimeErrorKind.RETURN_WITHOUT_GOSUB, line, "RETURN without GOSUB");
			}
			return callStack.pop();
		case END:
			return Program.NO_LINE;
		case REM:
			return next(line);
		case CLS:
			io.clear();
			return next(line);
		case COMMAND:
			throw new IllegalStateException("Command " + statement + " must be handled by the interpreter");
		default:
			throw new Error("Unhandled statement kind: " + statement.kind());
		}
	}

	private int next(int line) {
		return line == Line.IMMEDIATE ? Program.NO_LINE : program.nextLineAfter(line);
	}

	private int target(JumpStatement jump, int line) {
		int target = evaluator.evaluate(jump.getTarget(), line);
		if (!program.contains(target)) {
			throw new BasicRuntimeException(RuntimeErrorKind.UNDEFINED_LINE, line, "Undefined line " + target);
		}
		return target;
	}

	/**
	 * Evaluates every item before writing, so a failing item leaves no
	 * partial output behind.
	 */
	private void print(PrintStatement print, int line) {
		StringBuilder text = new StringBuilder();
		for (PrintItem item : print.getItems()) {
			if (item.isText()) {
				text.append(item.getText());
			} else {
				text.append(evaluator.evaluate(item.getExpression(), line));
			}
		}
		text.append('\n');
		io.write(text.toString());
	}
}
