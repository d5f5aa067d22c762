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
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import org.metricshub.tinybasic.backend.ExecutionState;
import org.metricshub.tinybasic.frontend.ParserException;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.ConsoleIoBridge;
import org.metricshub.tinybasic.util.BasicSettings;

/**
 * Command-line interface for TinyBasic.
 * <p>
 * With a program file, the program is loaded and run to completion, reading
 * INPUT values from stdin. Without one, or with <code>-i</code>, an
 * interactive session starts: every typed line is handed to
 * {@link TinyBasic#accept(String)}.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "tinybasic.jar";
		}
		JAR_NAME = myName;
	}

	private final BasicSettings settings = new BasicSettings();
	private final PrintStream out;
	private final PrintStream err;

	private String programFile;
	private boolean interactive;
	private boolean listOnly;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which program input is read
	 * @param out stream where program output is written
	 * @param err stream where rejected program lines are reported
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link BasicSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public BasicSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program file given on the command line, or {@code null}
	 */
	public String getProgramFile() {
		return programFile;
	}

	public boolean isInteractive() {
		return interactive;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("Empty argument #" + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// positional program file
				setProgramFile(arg);
			} else if (arg.equals("-f")) {
				// -f filename : program to load (and target of LOAD/SAVE)
				checkParameterHasArgument(args, argIdx);
				setProgramFile(args[++argIdx]);
			} else if (arg.equals("-i")) {
				// -i : interactive session, after loading the program if any
				interactive = true;
			} else if (arg.equals("--list")) {
				// --list : print the loaded program and exit
				listOnly = true;
			} else if (arg.equals("--echo")) {
				// --echo : write INPUT answers back to the output
				settings.setEchoInput(true);
			} else if (arg.equals("--max-gosub-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxGosubDepth(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--steps-per-slice")) {
				checkParameterHasArgument(args, argIdx);
				settings.setStepsPerSlice(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : usage, alone on the command line
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("-h and -? cannot be combined with other arguments");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}
		if (listOnly && programFile == null) {
			throw new IllegalArgumentException("--list requires a program file");
		}
		if (programFile == null) {
			interactive = true;
		}
	}

	private void setProgramFile(String file) {
		if (programFile != null) {
			throw new IllegalArgumentException("Only one program file may be given, got " + programFile + " and " + file);
		}
		programFile = file;
		settings.setProgramFile(file);
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got " + value, e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the program file cannot be read, or input ends
	 *         while a non-interactive program waits for INPUT
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		ConsoleIoBridge bridge = new ConsoleIoBridge(settings);
		TinyBasic basic = new TinyBasic(bridge, settings);

		if (programFile != null) {
			String source = bridge.loadProgram();
			if (source == null) {
				throw new FileNotFoundException(programFile);
			}
			List<String> errors = basic.loadProgram(source);
			if (!errors.isEmpty()) {
				for (String error : errors) {
					err.println(error);
				}
				throw new ParserException(errors.size() + " line(s) rejected in " + programFile, -1);
			}
			if (listOnly) {
				out.println(basic.listing());
				return;
			}
			if (!interactive) {
				basic.runToCompletion();
				return;
			}
		}
		interact(basic, bridge);
	}

	/**
	 * Read-eval loop: prompt, read a line, hand it to the interpreter, report
	 * errors and carry on until input ends.
	 */
	private void interact(TinyBasic basic, ConsoleIoBridge bridge) throws IOException {
		bridge.write(settings.getBanner() + "\n");
		while (true) {
			if (basic.getState() != ExecutionState.AWAITING_INPUT) {
				bridge.setPrompt(settings.getPrompt());
			}
			String line = bridge.readLine();
			if (line == null) {
				basic.abandon();
				return;
			}
			try {
				ExecutionState state = basic.accept(line);
				while (state == ExecutionState.RUNNING) {
					state = basic.resume();
				}
			} catch (ParserException e) {
				bridge.write(e.getMessage() + "\n");
			} catch (BasicRuntimeException e) {
				bridge.write(e.describe() + "\n");
			} catch (IOException e) {
				bridge.write("I/O error: " + e.getMessage() + "\n");
			}
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f program-file | program-file]" +
								" [-i]" +
								" [--list]" +
								" [--echo]" +
								" [--max-gosub-depth N]" +
								" [--steps-per-slice N]");
		dest.println();
		dest.println(" -f filename = Load and run the program in filename (also used by LOAD and SAVE).");
		dest.println(" -i = Start an interactive session after loading the program.");
		dest.println(" --list = Print the loaded program and exit.");
		dest.println(" --echo = Write INPUT answers back to the output.");
		dest.println(" --max-gosub-depth N = Maximum number of nested GOSUB (default 1024).");
		dest.println(" --steps-per-slice N = Statements executed before yielding to the host (default 0, unlimited).");
		dest.println();
		dest.println(" Without a program file, an interactive session starts. Type HELP for the statements.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for program input
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if execution fails
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (BasicRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Invalid arguments: " + e.getMessage() + " (see -h for usage)");
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
