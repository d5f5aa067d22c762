package org.metricshub.tinybasic.frontend;

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
 * Thrown when a line of TinyBasic source does not follow the grammar.
 * <p>
 * A parser exception is local to the line being parsed: the program store
 * is left untouched, so the caller may simply discard or re-request the line.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int column;

	/**
	 * @param msg description of the problem
	 * @param column 1-based column of the offending token, or {@code -1}
	 */
	public ParserException(String msg, int column) {
		super(column > 0 ? msg + " (column " + column + ")" : msg);
		this.column = column;
	}

	/**
	 * Builds the usual "expecting X, found Y" message.
	 *
	 * @param expected the construct the parser was looking for
	 * @param found the offending token
	 */
	public ParserException(String expected, Token found) {
		this("Expecting " + expected + ". Found: " + found.describe(), found.getColumn());
	}

	/**
	 * Returns the column associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the 1-based column of the offending token
	 */
	public int getColumn() {
		return column;
	}
}
