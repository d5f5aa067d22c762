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

import java.util.Arrays;

/**
 * The 26 integer variables <code>A</code> to <code>Z</code>.
 * <p>
 * Every slot starts at zero when the environment is created and is only
 * changed by LET and INPUT. Each interpreter owns its own environment.
 */
public class Environment {

	/** Number of variables. */
	public static final int SIZE = 26;

	private final int[] values = new int[SIZE];

	/**
	 * @param name a variable letter, <code>A</code> to <code>Z</code>
	 * @return its current value
	 */
	public int get(char name) {
		return values[slot(name)];
	}

	/**
	 * @param name a variable letter, <code>A</code> to <code>Z</code>
	 * @param value the new value
	 */
	public void set(char name, int value) {
		values[slot(name)] = value;
	}

	private static int slot(char name) {
		if (name < 'A' || name > 'Z') {
			throw new IllegalArgumentException("Not a variable name: " + name);
		}
		return name - 'A';
	}

	@Override
	public String toString() {
		return Arrays.toString(values);
	}
}
