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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.metricshub.tinybasic.util.BasicSettings;

/**
 * {@link IoBridge} over the streams of a {@link BasicSettings} instance,
 * typically stdin and stdout. LOAD and SAVE use the settings' program file.
 */
public class ConsoleIoBridge implements IoBridge {

	/** ANSI: cursor home, then erase the whole screen. */
	private static final String CLEAR_SCREEN = "\033[H\033[2J";

	private final PrintStream out;
	private final BufferedReader in;
	private final Path programFile;

	/**
	 * @param settings provides the input and output streams and the program file
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public ConsoleIoBridge(BasicSettings settings) {
		this.out = settings.getOutputStream();
		this.in = new BufferedReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
		this.programFile = Paths.get(settings.getProgramFile());
	}

	@Override
	public void write(String text) {
		out.print(text);
		out.flush();
	}

	@Override
	public String readLine() throws IOException {
		return in.readLine();
	}

	@Override
	public void clear() {
		write(CLEAR_SCREEN);
	}

	@Override
	public void setPrompt(String prompt) {
		write(prompt);
	}

	@Override
	public String loadProgram() throws IOException {
		if (!Files.isRegularFile(programFile)) {
			return null;
		}
		return new String(Files.readAllBytes(programFile), StandardCharsets.UTF_8);
	}

	@Override
	public void saveProgram(String source) throws IOException {
		Files.write(programFile, (source + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * @return the file used by LOAD and SAVE
	 */
	public Path getProgramFile() {
		return programFile;
	}
}
