package org.metricshub.tinybasic;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.tinybasic.jrt.BufferedIoBridge;
import org.metricshub.tinybasic.util.BasicSettings;

/**
 * Fluent helpers for TinyBasic tests. A test describes the program lines it
 * types, the lines answered to INPUT, and either the expected output or the
 * expected exception, then calls {@link TinyBasicTestBuilder#runAndAssert()}.
 */
public final class TinyBasicTestSupport {

	private TinyBasicTestSupport() {}

	/**
	 * Creates a builder for a test that submits lines to a {@link TinyBasic}
	 * instance backed by a {@link BufferedIoBridge} and runs the program.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static TinyBasicTestBuilder basicTest(String description) {
		return new TinyBasicTestBuilder(description);
	}

	/**
	 * Outcome of one configured test: captured output, prompts, and the
	 * exception thrown, if any.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final List<String> prompts;
		private final Throwable thrownException;
		private final List<String> expectedLines;
		private final Class<? extends Throwable> expectedException;

		TestResult(
				String description,
				String output,
				List<String> prompts,
				Throwable thrownException,
				List<String> expectedLines,
				Class<? extends Throwable> expectedException) {
			this.description = description;
			this.output = output;
			this.prompts = prompts;
			this.thrownException = thrownException;
			this.expectedLines = expectedLines;
			this.expectedException = expectedException;
		}

		public String output() {
			return output;
		}

		/**
		 * @return the output split into lines, without the trailing newline
		 */
		public List<String> lines() {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.endsWith("\n") ? output.substring(0, output.length() - 1) : output;
			return Arrays.asList(normalized.split("\n", -1));
		}

		public List<String> prompts() {
			return prompts;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Verifies the output or the thrown exception against the expectations
		 * defined in the builder.
		 */
		public void assertExpected() {
			if (expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				if (!expectedException.isInstance(thrownException)) {
					AssertionError error = new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName());
					error.initCause(thrownException);
					throw error;
				}
				return;
			}
			if (thrownException != null) {
				AssertionError error = new AssertionError("Unexpected exception for " + description + ": " + thrownException);
				error.initCause(thrownException);
				throw error;
			}
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, lines());
			}
		}
	}

	/**
	 * Fluent builder for a TinyBasic program test.
	 */
	public static final class TinyBasicTestBuilder {
		private final String description;
		private final List<String> programLines = new ArrayList<String>();
		private final List<String> inputLines = new ArrayList<String>();
		private BasicSettings settings;
		private List<String> expectedLines;
		private Class<? extends Throwable> expectedException;

		private TinyBasicTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * Adds source lines, submitted in order as if typed by the user.
		 *
		 * @param lines the numbered program lines
		 * @return this builder for method chaining
		 */
		public TinyBasicTestBuilder program(String... lines) {
			programLines.addAll(Arrays.asList(lines));
			return this;
		}

		/**
		 * Adds lines answered, in order, to the INPUT statements.
		 *
		 * @param lines the input lines
		 * @return this builder for method chaining
		 */
		public TinyBasicTestBuilder input(String... lines) {
			inputLines.addAll(Arrays.asList(lines));
			return this;
		}

		public TinyBasicTestBuilder settings(BasicSettings settingsParam) {
			this.settings = settingsParam;
			return this;
		}

		/**
		 * Sets the expected output, one element per printed line.
		 *
		 * @param lines the expected lines
		 * @return this builder for method chaining
		 */
		public TinyBasicTestBuilder expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return this;
		}

		/**
		 * Expects the test to fail with the given exception type, either while
		 * the lines are submitted or while the program runs.
		 *
		 * @param exceptionClass the expected exception type
		 * @return this builder for method chaining
		 */
		public TinyBasicTestBuilder expectThrow(Class<? extends Throwable> exceptionClass) {
			this.expectedException = exceptionClass;
			return this;
		}

		/**
		 * Submits the program lines, runs the program to completion and captures
		 * the result without asserting it.
		 *
		 * @return the captured result
		 */
		public TestResult run() {
			BufferedIoBridge bridge = new BufferedIoBridge(inputLines.toArray(new String[0]));
			TinyBasic basic = new TinyBasic(bridge, settings);
			Throwable thrown = null;
			try {
				for (String line : programLines) {
					basic.submitLine(line);
				}
				basic.runToCompletion();
			} catch (Exception e) {
				thrown = e;
			}
			return new TestResult(description, bridge.getOutput(), bridge.getPrompts(), thrown, expectedLines, expectedException);
		}

		public void runAndAssert() {
			run().assertExpected();
		}
	}
}
