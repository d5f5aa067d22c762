package org.metricshub.tinybasic.intermediate;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.metricshub.tinybasic.frontend.ast.Line;
import org.metricshub.tinybasic.frontend.ast.Statement;

/**
 * The stored program: statements keyed by line number, in ascending order
 * whatever the order in which they were typed.
 * <p>
 * Jump targets are plain key lookups and sequential execution asks for the
 * smallest line number greater than the current one.
 */
public class Program {

	/** Returned by {@link #firstLine()} and {@link #nextLineAfter(int)} when there is no such line. */
	public static final int NO_LINE = -1;

	private final TreeMap<Integer, Line> lines = new TreeMap<Integer, Line>();

	/**
	 * Stores a numbered line, replacing any line with the same number.
	 *
	 * @param line a numbered, non-deletion line
	 * @return the line previously stored under that number, or {@code null}
	 */
	public Line insertOrReplace(Line line) {
		if (line.isImmediate() || line.isDeletion()) {
			throw new IllegalArgumentException("Only numbered statements can be stored: " + line);
		}
		return lines.put(line.getNumber(), line);
	}

	/**
	 * @param lineNumber the line to delete
	 * @return whether a line was removed
	 */
	public boolean remove(int lineNumber) {
		return lines.remove(lineNumber) != null;
	}

	/**
	 * @param lineNumber a line number
	 * @return the statement stored at that exact line, or {@code null}
	 */
	public Statement get(int lineNumber) {
		Line line = lines.get(lineNumber);
		return line == null ? null : line.getStatement();
	}

	public boolean contains(int lineNumber) {
		return lines.containsKey(lineNumber);
	}

	/**
	 * @return the lowest line number, or {@link #NO_LINE} for an empty program
	 */
	public int firstLine() {
		return lines.isEmpty() ? NO_LINE : lines.firstKey();
	}

	/**
	 * @param lineNumber any line number, stored or not
	 * @return the smallest stored line number strictly greater than the
	 *         argument, or {@link #NO_LINE} at the end of the program
	 */
	public int nextLineAfter(int lineNumber) {
		Integer next = lines.higherKey(lineNumber);
		return next == null ? NO_LINE : next;
	}

	public int size() {
		return lines.size();
	}

	public boolean isEmpty() {
		return lines.isEmpty();
	}

	public void clear() {
		lines.clear();
	}

	/**
	 * @return the stored lines in ascending order
	 */
	public List<Line> getLines() {
		return Collections.unmodifiableList(new ArrayList<Line>(lines.values()));
	}

	/**
	 * Renders the program the way LIST shows it: the trimmed source of each
	 * line, one per line, without a trailing newline.
	 *
	 * @return the program text
	 */
	public String listing() {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<Integer, Line> entry : lines.entrySet()) {
			if (sb.length() > 0) {
				sb.append('\n');
			}
			sb.append(entry.getValue().getSource().trim());
		}
		return sb.toString();
	}
}
