package org.metricshub.tinybasic;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.tinybasic.backend.Environment;
import org.metricshub.tinybasic.backend.ExecutionState;
import org.metricshub.tinybasic.backend.Executor;
import org.metricshub.tinybasic.frontend.BasicParser;
import org.metricshub.tinybasic.frontend.ParserException;
import org.metricshub.tinybasic.frontend.ast.Command;
import org.metricshub.tinybasic.frontend.ast.CommandStatement;
import org.metricshub.tinybasic.frontend.ast.Line;
import org.metricshub.tinybasic.frontend.ast.Statement;
import org.metricshub.tinybasic.frontend.ast.StatementKind;
import org.metricshub.tinybasic.intermediate.Program;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.BufferedIoBridge;
import org.metricshub.tinybasic.jrt.IoBridge;
import org.metricshub.tinybasic.util.BasicLogger;
import org.metricshub.tinybasic.util.BasicSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of TinyBasic programs.
 * This entry point is used both when TinyBasic is embedded as a library and
 * when invoked from the command line.
 * <p>
 * An instance owns one program, one set of variables and one
 * {@link Executor}. Source lines are submitted one at a time:
 * <ul>
 * <li>a numbered line is stored, replacing any line with the same number;
 * <li>a bare line number deletes that line;
 * <li>an unnumbered line is executed at once (immediate mode), including
 * the commands RUN, LIST, NEW, HELP, LOAD and SAVE.
 * </ul>
 * Nothing here blocks on input except {@link #runToCompletion()}: a program
 * reaching INPUT returns {@link ExecutionState#AWAITING_INPUT} and waits for
 * {@link #provideInput(String)}. Interactive drivers can simply hand every
 * typed line to {@link #accept(String)}.
 * <p>
 * Parse errors only affect the line being submitted. Runtime errors halt the
 * program and propagate as {@link BasicRuntimeException}.
 */
public class TinyBasic {

	private static final Logger LOGGER = BasicLogger.getLogger(TinyBasic.class);

	static final String HELP_TEXT = "PRINT <expression|\"text\">[, <expression|\"text\">...]\n"
			+ "INPUT <variable>[, <variable>...]\n"
			+ "IF <expression> <relation> <expression> THEN <statement>\n"
			+ "LET <variable> = <expression>\n"
			+ "GOTO <expression>\n"
			+ "GOSUB <expression>\n"
			+ "RETURN\n"
			+ "END\n"
			+ "REM <comment>\n"
			+ "CLS\n"
			+ "LIST\n"
			+ "RUN\n"
			+ "NEW\n"
			+ "LOAD\n"
			+ "SAVE\n"
			+ "HELP\n";

	private final IoBridge io;
	private final BasicSettings settings;
	private final Program program = new Program();
	private final Environment environment = new Environment();
	private final BasicParser parser = new BasicParser();
	private final Executor executor;

	/**
	 * Create a new interpreter with the default settings.
	 *
	 * @param io the host surface
	 */
	public TinyBasic(IoBridge io) {
		this(io, null);
	}

	/**
	 * Create a new interpreter: empty program, all variables zero.
	 *
	 * @param io the host surface
	 * @param settings the settings, or {@code null} for the defaults
	 */
	public TinyBasic(IoBridge io, BasicSettings settings) {
		this.io = io;
		this.settings = settings == null ? BasicSettings.DEFAULT_SETTINGS : settings;
		this.executor = new Executor(program, environment, io, this.settings);
	}

	/**
	 * Runs a whole program with canned input and returns what it printed.
	 *
	 * @param programText numbered program lines, separated by newlines
	 * @param input lines answered, in order, to the INPUT statements
	 * @return the output of the program
	 * @throws ParserException if a line of the program does not parse
	 * @throws BasicRuntimeException if the program fails
	 * @throws IOException if the program asks for more input than supplied
	 */
	public static String execute(String programText, String... input) throws IOException {
		BufferedIoBridge bridge = new BufferedIoBridge(input);
		TinyBasic basic = new TinyBasic(bridge);
		List<String> errors = basic.loadProgram(programText);
		if (!errors.isEmpty()) {
			throw new ParserException(errors.get(0), -1);
		}
		basic.runToCompletion();
		return bridge.getOutput();
	}

	/**
	 * Hands one line typed by the user to the interpreter: the answer to the
	 * pending INPUT if there is one, a source line otherwise.
	 *
	 * @param text the typed line
	 * @return the state after processing the line
	 * @throws IOException if LOAD or SAVE fail
	 */
	public ExecutionState accept(String text) throws IOException {
		if (executor.getState() == ExecutionState.AWAITING_INPUT) {
			return provideInput(text);
		}
		return submitLine(text);
	}

	/**
	 * Parses one source line, then stores, deletes or executes it.
	 *
	 * @param text the source line
	 * @return the state after processing the line
	 * @throws ParserException if the line does not parse; nothing is changed
	 * @throws BasicRuntimeException if an immediate statement fails
	 * @throws IOException if LOAD or SAVE fail
	 * @throws IllegalStateException if a program is running or waiting for input
	 */
	public ExecutionState submitLine(String text) throws IOException {
		if (executor.getState() != ExecutionState.HALTED) {
			throw new IllegalStateException("Cannot submit a source line while " + executor.getState());
		}
		Line line = parser.parseLine(text);
		if (line == null) {
			return executor.getState();
		}
		if (line.isDeletion()) {
			program.remove(line.getNumber());
			return executor.getState();
		}
		if (!line.isImmediate()) {
			if (program.insertOrReplace(line) != null) {
				LOGGER.debug("Replaced line {}", line.getNumber());
			}
			return executor.getState();
		}
		Statement statement = line.getStatement();
		if (statement.kind() == StatementKind.COMMAND) {
			return command(((CommandStatement) statement).getCommand());
		}
		return executor.execute(statement);
	}

	private ExecutionState command(Command command) throws IOException {
		LOGGER.debug("Command {}", command);
		switch (command) {
		case RUN:
			return executor.run();
		case LIST:
			if (!program.isEmpty()) {
				io.write(program.listing() + "\n");
			}
			break;
		case NEW:
			executor.abandon();
			program.clear();
			break;
		case HELP:
			io.write(HELP_TEXT);
			break;
		case LOAD: {
			String source = io.loadProgram();
			if (source == null) {
				io.write("no program to load\n");
				break;
			}
			for (String error : loadProgram(source)) {
				io.write(error + "\n");
			}
			io.write("program loaded\n");
			break;
		}
		case SAVE:
			io.saveProgram(program.listing());
			break;
		default:
			throw new Error("Unhandled command: " + command);
		}
		return executor.getState();
	}

	/**
	 * Replaces the program with the given text. Blank lines are skipped;
	 * every other line must be numbered. Lines that fail to parse are left
	 * out and reported, the others are kept.
	 *
	 * @param source the program text
	 * @return one message per rejected line, empty if all lines were loaded
	 */
	public List<String> loadProgram(String source) {
		executor.abandon();
		program.clear();
		List<String> errors = new ArrayList<String>();
		String[] lines = source.split("\r?\n");
		for (String text : lines) {
			try {
				Line line = parser.parseLine(text);
				if (line == null) {
					continue;
				}
				if (line.isImmediate()) {
					throw new ParserException("Program lines must start with a line number", 1);
				}
				if (line.isDeletion()) {
					program.remove(line.getNumber());
				} else {
					program.insertOrReplace(line);
				}
			} catch (ParserException e) {
				LOGGER.warn("Rejected program line '{}': {}", text, e.getMessage());
				errors.add(text.trim() + ": " + e.getMessage());
			}
		}
		LOGGER.debug("Loaded {} line(s), {} rejected", program.size(), errors.size());
		return Collections.unmodifiableList(errors);
	}

	/**
	 * Starts the stored program from its first line.
	 *
	 * @return the state once the program halts, suspends, or uses up its slice
	 * @throws BasicRuntimeException if the program fails
	 */
	public ExecutionState run() {
		return executor.run();
	}

	/**
	 * Continues a program that returned {@link ExecutionState#RUNNING}.
	 *
	 * @return the new state
	 */
	public ExecutionState resume() {
		return executor.resume();
	}

	/**
	 * Supplies the value of the next variable of the pending INPUT.
	 *
	 * @param text the typed line
	 * @return the new state
	 * @throws BasicRuntimeException if the text is not an integer or the
	 *         resumed program fails
	 */
	public ExecutionState provideInput(String text) {
		return executor.provideInput(text);
	}

	/**
	 * Discards any run in progress.
	 */
	public void abandon() {
		executor.abandon();
	}

	/**
	 * Runs the program from its first line and blocks until it halts,
	 * reading INPUT values from {@link IoBridge#readLine()}.
	 *
	 * @return {@link ExecutionState#HALTED}
	 * @throws IOException if input ends while the program waits for it
	 */
	public ExecutionState runToCompletion() throws IOException {
		ExecutionState state = executor.run();
		while (state != ExecutionState.HALTED) {
			if (state == ExecutionState.RUNNING) {
				state = executor.resume();
				continue;
			}
			String text = io.readLine();
			if (text == null) {
				executor.abandon();
				throw new EOFException("Input exhausted while the program waits for INPUT");
			}
			state = executor.provideInput(text);
		}
		return state;
	}

	/**
	 * @return the program as LIST shows it
	 */
	public String listing() {
		return program.listing();
	}

	public ExecutionState getState() {
		return executor.getState();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getProgram() {
		return program;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Environment getEnvironment() {
		return environment;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Executor getExecutor() {
		return executor;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public BasicSettings getSettings() {
		return settings;
	}
}
