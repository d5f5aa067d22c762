package org.metricshub.tinybasic.frontend.ast;

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

/**
 * One parsed source line: an optional line number and its statement.
 * <p>
 * Three shapes exist:
 * <ul>
 * <li>a numbered line with a statement, to be stored in the program;
 * <li>a bare line number, which deletes that line from the program;
 * <li>an immediate line, without number, executed at once.
 * </ul>
 */
public final class Line {

	/** Line number reported for immediate statements. */
	public static final int IMMEDIATE = -1;

	/** Highest accepted line number. */
	public static final int MAX_NUMBER = 32767;

	private final int number;
	private final Statement statement;
	private final String source;

	/**
	 * @param number the line number, or {@link #IMMEDIATE}
	 * @param statement the statement, or {@code null} for a deletion line
	 * @param source the original text of the line
	 */
	public Line(int number, Statement statement, String source) {
		this.number = number;
		this.statement = statement;
		this.source = source;
	}

	public int getNumber() {
		return number;
	}

	public Statement getStatement() {
		return statement;
	}

	public String getSource() {
		return source;
	}

	public boolean isImmediate() {
		return number == IMMEDIATE;
	}

	public boolean isDeletion() {
		return statement == null;
	}

	@Override
	public String toString() {
		if (isImmediate()) {
			return String.valueOf(statement);
		}
		return isDeletion() ? Integer.toString(number) : number + " " + statement;
	}
}
