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
 * One lexical unit of a TinyBasic source line.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final int value;
	private final int column;

	Token(TokenKind kind, String text, int value, int column) {
		this.kind = kind;
		this.text = text;
		this.value = value;
		this.column = column;
	}

	public TokenKind getKind() {
		return kind;
	}

	/**
	 * @return the source text of the token; for a string literal, its content
	 *         without the quotes; for a remark, the comment text
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the numeric value of a {@link TokenKind#NUMBER} token, 0 otherwise
	 */
	public int getValue() {
		return value;
	}

	/**
	 * @return the 1-based column where the token starts
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * @return a short human readable description, used in error messages
	 */
	public String describe() {
		switch (kind) {
		case EOL:
			return "end of line";
		case STRING:
			return "string \"" + text + "\"";
		default:
			return kind.name() + " (" + text + ")";
		}
	}

	@Override
	public String toString() {
		return kind + "@" + column + "[" + text + "]";
	}
}
