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
 * One element of a PRINT list: either a string literal or an expression.
 */
public final class PrintItem {

	private final String text;
	private final Expression expression;

	private PrintItem(String text, Expression expression) {
		this.text = text;
		this.expression = expression;
	}

	public static PrintItem text(String text) {
		return new PrintItem(text, null);
	}

	public static PrintItem expression(Expression expression) {
		return new PrintItem(null, expression);
	}

	public boolean isText() {
		return text != null;
	}

	/**
	 * @return the string literal, or {@code null} for an expression item
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the expression, or {@code null} for a string literal item
	 */
	public Expression getExpression() {
		return expression;
	}

	@Override
	public String toString() {
		return isText() ? "\"" + text + "\"" : expression.toString();
	}
}
