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

import org.metricshub.tinybasic.frontend.ast.Line;

/**
 * A runtime exception thrown by the TinyBasic executor. It is provided
 * to conveniently distinguish between TinyBasic runtime
 * exceptions and other runtime exceptions.
 * <p>
 * The program is halted by the time this exception reaches the caller.
 */
public class BasicRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final RuntimeErrorKind kind;

	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for BasicRuntimeException.
	 * </p>
	 *
	 * @param kind what went wrong
	 * @param lineno the line being executed, or {@link Line#IMMEDIATE}
	 * @param msg a {@link java.lang.String} object
	 */
	public BasicRuntimeException(RuntimeErrorKind kind, int lineno, String msg) {
		super(msg);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	public BasicRuntimeException(RuntimeErrorKind kind, int lineno, String msg, Throwable cause) {
		super(msg, cause);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	public RuntimeErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * the error happened in an immediate statement.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the message prefixed with the line it happened on
	 */
	public String describe() {
		if (lineNumber == Line.IMMEDIATE) {
			return kind + " in immediate mode: " + getMessage();
		}
		return kind + " at line " + lineNumber + ": " + getMessage();
	}
}
