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

import java.util.EnumMap;
import java.util.Map;

/**
 * An immediate-mode command such as RUN or LIST. The parser never lets one
 * of these into a numbered line, so the executor never sees them.
 */
public final class CommandStatement extends Statement {

	private static final Map<Command, CommandStatement> INSTANCES = new EnumMap<Command, CommandStatement>(Command.class);

	static {
		for (Command command : Command.values()) {
			INSTANCES.put(command, new CommandStatement(command));
		}
	}

	private final Command command;

	private CommandStatement(Command command) {
		this.command = command;
	}

	public static CommandStatement of(Command command) {
		return INSTANCES.get(command);
	}

	public Command getCommand() {
		return command;
	}

	@Override
	public StatementKind kind() {
		return StatementKind.COMMAND;
	}

	@Override
	public String toString() {
		return command.name();
	}
}
