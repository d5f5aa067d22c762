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
 * Statements without any operand: RETURN, END and CLS.
 */
public final class SimpleStatement extends Statement {

	public static final SimpleStatement RETURN = new SimpleStatement(StatementKind.RETURN);
	public static final SimpleStatement END = new SimpleStatement(StatementKind.END);
	public static final SimpleStatement CLS = new SimpleStatement(StatementKind.CLS);

	private final StatementKind kind;

	private SimpleStatement(StatementKind kind) {
		this.kind = kind;
	}

	@Override
	public StatementKind kind() {
		return kind;
	}

	@Override
	public String toString() {
		return kind.name();
	}
}
