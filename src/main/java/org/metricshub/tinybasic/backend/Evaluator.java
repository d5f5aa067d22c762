package org.metricshub.tinybasic.backend;

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

import org.metricshub.tinybasic.frontend.ast.BinaryExpression;
import org.metricshub.tinybasic.frontend.ast.Expression;
import org.metricshub.tinybasic.frontend.ast.LiteralExpression;
import org.metricshub.tinybasic.frontend.ast.RelationOperator;
import org.metricshub.tinybasic.frontend.ast.UnaryExpression;
import org.metricshub.tinybasic.frontend.ast.UnaryOperator;
import org.metricshub.tinybasic.frontend.ast.VariableExpression;
import org.metricshub.tinybasic.jrt.BasicRuntimeException;
import org.metricshub.tinybasic.jrt.RuntimeErrorKind;

/**
 * Computes the value of expressions against an {@link Environment}.
 * <p>
 * Arithmetic is on 32-bit <code>int</code>: it wraps on overflow and
 * division truncates toward zero.
 */
public class Evaluator {

	private final Environment environment;

	public Evaluator(Environment environment) {
		this.environment = environment;
	}

	/**
	 * @param expression the expression to evaluate
	 * @param lineNumber line reported if the evaluation fails
	 * @return the value of the expression
	 * @throws BasicRuntimeException on a division by zero
	 */
	public int evaluate(Expression expression, int lineNumber) {
		switch (expression.kind()) {
		case LITERAL:
			return ((LiteralExpression) expression).getValue();
		case VARIABLE:
			return environment.get(((VariableExpression) expression).getName());
		case UNARY: {
			UnaryExpression unary = (UnaryExpression) expression;
			int operand = evaluate(unary.getOperand(), lineNumber);
			return unary.getOperator() == UnaryOperator.MINUS ? -operand : operand;
		}
		case BINARY: {
			BinaryExpression binary = (BinaryExpression) expression;
			int left = evaluate(binary.getLeft(), lineNumber);
			int right = evaluate(binary.getRight(), lineNumber);
			switch (binary.getOperator()) {
			case ADD:
				return left + right;
			case SUBTRACT:
				return left - right;
			case MULTIPLY:
				return left * right;
			case DIVIDE:
				if (right == 0) {
					throw new BasicRuntimeException(
							RuntimeErrorKind.DIVISION_BY_ZERO,
							lineNumber,
							"Division by zero in " + binary);
				}
				return left / right;
			default:
				throw new Error("Unhandled operator: " + binary.getOperator());
			}
		}
		default:
			throw new Error("Unhandled expression kind: " + expression.kind());
		}
	}

	/**
	 * @param left value on the left of the relation
	 * @param relation the comparison to apply
	 * @param right value on the right of the relation
	 * @return the outcome of the comparison
	 */
	public static boolean compare(int left, RelationOperator relation, int right) {
		switch (relation) {
		case EQUAL:
			return left == right;
		case NOT_EQUAL:
			return left != right;
		case LESS_THAN:
			return left < right;
		case LESS_THAN_OR_EQUAL:
			return left <= right;
		case GREATER_THAN:
			return left > right;
		case GREATER_THAN_OR_EQUAL:
			return left >= right;
		default:
			throw new Error("Unhandled relation: " + relation);
		}
	}
}
