package org.metricshub.tinybasic.jrt;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * In-memory {@link IoBridge}: output goes to a buffer, input lines are taken
 * from a queue and the "saved" program is kept in a field. Used when running
 * TinyBasic from Java code without a terminal.
 */
public class BufferedIoBridge implements IoBridge {

	private final StringBuilder output = new StringBuilder();
	private final Deque<String> inputLines = new ArrayDeque<String>();
	private final List<String> prompts = new ArrayList<String>();
	private int clearCount;
	private String storedProgram;

	/**
	 * @param inputLines lines returned, in order, by {@link #readLine()}
	 */
	public BufferedIoBridge(String... inputLines) {
		addInput(inputLines);
	}

	/**
	 * Queues more input lines.
	 *
	 * @param lines lines to append to the input queue
	 * @return this bridge
	 */
	public BufferedIoBridge addInput(String... lines) {
		inputLines.addAll(Arrays.asList(lines));
		return this;
	}

	@Override
	public void write(String text) {
		output.append(text);
	}

	@Override
	public String readLine() {
		return inputLines.poll();
	}

	@Override
	public void clear() {
		output.setLength(0);
		clearCount++;
	}

	@Override
	public void setPrompt(String prompt) {
		prompts.add(prompt);
	}

	@Override
	public String loadProgram() {
		return storedProgram;
	}

	@Override
	public void saveProgram(String source) {
		storedProgram = source;
	}

	/**
	 * @return everything written since construction or the last {@link #clear()}
	 */
	public String getOutput() {
		return output.toString();
	}

	/**
	 * @return every prompt advertised so far, oldest first
	 */
	public List<String> getPrompts() {
		return Collections.unmodifiableList(prompts);
	}

	public int getClearCount() {
		return clearCount;
	}

	/**
	 * @return the text last handed to {@link #saveProgram(String)}, or the one
	 *         set with {@link #setStoredProgram(String)}
	 */
	public String getStoredProgram() {
		return storedProgram;
	}

	public void setStoredProgram(String storedProgram) {
		this.storedProgram = storedProgram;
	}
}
