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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>INPUT var [, var]...</code>
 */
public final class InputStatement extends Statement {

	private final List<Character> variables;

	public InputStatement(List<Character> variables) {
		this.variables = Collections.unmodifiableList(new ArrayList<Character>(variables));
	}

	/**
	 * @return the variables to bind, in input order
	 */
	public List<Character> getVariables() {
		return variables;
	}

	@Override
	public StatementKind kind() {
		return StatementKind.INPUT;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("INPUT ");
		for (int i = 0; i < variables.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(variables.get(i));
		}
		return sb.toString();
	}
}
