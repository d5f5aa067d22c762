package org.metricshub.tinybasic;

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

import org.metricshub.tinybasic.backend.Environment;
import org.metricshub.tinybasic.backend.Evaluator;
import org.metricshub.tinybasic.frontend.BasicParser;
import org.metricshub.tinybasic.frontend.ast.Line;

/**
 * Utility class to evaluate standalone TinyBasic expressions.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	/**
	 * Evaluates an expression with every variable at zero.
	 *
	 * @param expression the expression text, such as <code>2 + 3 * 4</code>
	 * @return its value
	 */
	public static int eval(String expression) {
		return eval(expression, new Environment());
	}

	/**
	 * Evaluates an expression against the given variables.
	 *
	 * @param expression the expression text
	 * @param environment the variables to read
	 * @return its value
	 * @throws org.metricshub.tinybasic.frontend.ParserException if the text is
	 *         not exactly one expression
	 * @throws org.metricshub.tinybasic.jrt.BasicRuntimeException on a division
	 *         by zero
	 */
	public static int eval(String expression, Environment environment) {
		BasicParser parser = new BasicParser();
		return new Evaluator(environment).evaluate(parser.parseExpression(expression), Line.IMMEDIATE);
	}
}
