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
 * <code>IF left relation right THEN statement</code>.
 * The THEN clause is exactly one statement, possibly another IF.
 */
public final class IfStatement extends Statement {

	private final Expression left;
	private final RelationOperator relation;
	private final Expression right;
	private final Statement then;

	public IfStatement(Expression left, RelationOperator relation, Expression right, Statement then) {
		this.left = left;
		this.relation = relation;
		this.right = right;
		this.then = then;
	}

	public Expression getLeft() {
		return left;
	}

	public RelationOperator getRelation() {
		return relation;
	}

	public Expression getRight() {
		return right;
	}

	public Statement getThen() {
		return then;
	}

	@Override
	public StatementKind kind() {
		return StatementKind.IF;
	}

	@Override
	public String toString() {
		return "IF " + left + " " + relation.getSymbol() + " " + right + " THEN " + then;
	}
}
