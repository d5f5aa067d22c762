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

import java.io.IOException;

/**
 * The narrow boundary between the interpreter and whatever surface the
 * host offers (a terminal, a browser page, a test buffer).
 * <p>
 * The executor itself only ever calls {@link #write(String)},
 * {@link #clear()} and {@link #setPrompt(String)}. It never blocks on
 * {@link #readLine()}: an INPUT statement suspends the run instead, and the
 * driver decides when and how to obtain the text it feeds back.
 */
public interface IoBridge {

	/**
	 * Appends text to the output surface. Line breaks are part of the text.
	 *
	 * @param text the text to append
	 */
	void write(String text);

	/**
	 * Obtains one line of input, without its line terminator.
	 *
	 * @return the line, or {@code null} once input is exhausted
	 * @throws IOException if reading fails
	 */
	String readLine() throws IOException;

	/**
	 * Resets the output surface (CLS).
	 */
	void clear();

	/**
	 * Advises the host of the prompt to show before the next line is read.
	 *
	 * @param prompt the prompt text
	 */
	void setPrompt(String prompt);

	/**
	 * Obtains a whole program text (LOAD).
	 *
	 * @return the program text, or {@code null} if none is available
	 * @throws IOException if the program cannot be read
	 */
	String loadProgram() throws IOException;

	/**
	 * Stores a whole program text (SAVE).
	 *
	 * @param source the program listing
	 * @throws IOException if the program cannot be written
	 */
	void saveProgram(String source) throws IOException;
}
