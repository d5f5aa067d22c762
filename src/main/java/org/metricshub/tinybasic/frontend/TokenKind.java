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

/** Lexer token values. */
public enum TokenKind {
	EOL,
	NUMBER,
	STRING,
	WORD,
	REMARK,

	PLUS,
	MINUS,
	MULT,
	DIVIDE,
	OPEN_PAREN,
	CLOSE_PAREN,
	COMMA,

	EQ,
	LT,
	GT,
	LE,
	GE,
	NE,

	KW_PRINT,
	KW_IF,
	KW_THEN,
	KW_INPUT,
	KW_LET,
	KW_GOTO,
	KW_GOSUB,
	KW_RETURN,
	KW_END,
	KW_REM,
	KW_CLS,

	KW_RUN,
	KW_LIST,
	KW_NEW,
	KW_HELP,
	KW_LOAD,
	KW_SAVE
}
