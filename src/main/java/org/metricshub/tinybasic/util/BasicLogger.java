package org.metricshub.tinybasic.util;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of the interpreter.
 * <p>
 * Loading this class silences SLF4J's report of its own provider lookup,
 * so an embedding host without a binding sees no noise on stderr.
 */
public final class BasicLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private BasicLogger() {}

	/**
	 * @param clazz the class that logs
	 * @return the SLF4J logger named after {@code clazz}
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Renders a line number for log messages.
	 *
	 * @param lineNumber a program line, or {@link Line#IMMEDIATE}
	 * @return <code>line 20</code>, or <code>immediate mode</code>
	 */
	public static String where(int lineNumber) {
		return lineNumber == Line.IMMEDIATE ? "immediate mode" : "line " + lineNumber;
	}
}
