package org.metricshub.tinybasic.util;

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
import java.io.InputStream;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a TinyBasic interpreter instance.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when embedding TinyBasic programmatically, from within Java code.
 */
public class BasicSettings {

	/**
	 * Settings used when an interpreter is created without any.
	 */
	public static final BasicSettings DEFAULT_SETTINGS = new BasicSettings();

	/**
	 * Where interactive input is read from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Prompt shown by the interactive loop when no INPUT is pending.
	 */
	private String prompt = "> ";

	/**
	 * Greeting written when the interactive loop starts.
	 */
	private String banner = "Ready!";

	/**
	 * Whether INPUT writes <code>VAR? text</code> back to the output
	 * once a value has been supplied;
	 * <code>false</code> by default.
	 */
	private boolean echoInput = false;

	/**
	 * Maximum number of pending GOSUB return addresses.
	 */
	private int maxGosubDepth = 1024;

	/**
	 * Number of statements executed before the executor hands control back
	 * to the host with a RUNNING state. <code>0</code> means unlimited.
	 */
	private int stepsPerSlice = 0;

	/**
	 * File used by LOAD and SAVE with the console bridge.
	 */
	private String programFile = "program.bas";

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("prompt = ").append(getPrompt()).append(newLine);
		desc.append("banner = ").append(getBanner()).append(newLine);
		desc.append("echoInput = ").append(isEchoInput()).append(newLine);
		desc.append("maxGosubDepth = ").append(getMaxGosubDepth()).append(newLine);
		desc.append("stepsPerSlice = ").append(getStepsPerSlice()).append(newLine);
		desc.append("programFile = ").append(getProgramFile()).append(newLine);

		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public String getPrompt() {
		return prompt;
	}

	public void setPrompt(String prompt) {
		this.prompt = prompt;
	}

	public String getBanner() {
		return banner;
	}

	public void setBanner(String banner) {
		this.banner = banner;
	}

	public boolean isEchoInput() {
		return echoInput;
	}

	public void setEchoInput(boolean echoInput) {
		this.echoInput = echoInput;
	}

	public int getMaxGosubDepth() {
		return maxGosubDepth;
	}

	/**
	 * @param maxGosubDepth a strictly positive depth
	 */
	public void setMaxGosubDepth(int maxGosubDepth) {
		if (maxGosubDepth <= 0) {
			throw new IllegalArgumentException("maxGosubDepth must be positive, got " + maxGosubDepth);
		}
		this.maxGosubDepth = maxGosubDepth;
	}

	public int getStepsPerSlice() {
		return stepsPerSlice;
	}

	/**
	 * @param stepsPerSlice <code>0</code> for unlimited, otherwise the number of
	 *        statements per slice
	 */
	public void setStepsPerSlice(int stepsPerSlice) {
		if (stepsPerSlice < 0) {
			throw new IllegalArgumentException("stepsPerSlice must not be negative, got " + stepsPerSlice);
		}
		this.stepsPerSlice = stepsPerSlice;
	}

	public String getProgramFile() {
		return programFile;
	}

	public void setProgramFile(String programFile) {
		this.programFile = programFile;
	}
}
