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
 * GOTO or GOSUB. The target is an expression evaluated when the statement
 * runs, so <code>GOTO X+10</code> is a legal computed jump.
 */
public final class JumpStatement extends Statement {

	private final boolean subroutine;
	private final Expression target;

	/**
	 * @param subroutine {@code true} for GOSUB, {@code false} for GOTO
	 * @param target expression giving the destination line number
	 */
	public JumpStatement(boolean subroutine, Expression target) {
		this.subroutine = subroutine;
		this.target = target;
	}

	public Expression getTarget() {
		return target;
	}

	@Override
	public StatementKind kind() {
		return subroutine ? StatementKind.GOSUB : StatementKind.GOTO;
	}

	@Override
	public String toString() {
		return (subroutine ? "GOSUB " : "GOTO ") + target;
	}
}
