package org.metricshub.ttgen.intermediate;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Ttgen
 * ჻჻჻჻჻჻
 * Copyright (C) 2010 - 2025 MetricsHub
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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The postfix program of one expression line.
 * <p>
 * The parser appends one tuple per completed operand or operator, so that
 * reading the queue from left to right against an operand stack evaluates the
 * expression. The queue is append-only while the parser runs, and is only read
 * (through {@link #top()}) afterwards.
 */
public class PostfixTuples {

	private final List<Tuple> queue = new ArrayList<Tuple>();

	/**
	 * <p>
	 * pushVariable.
	 * </p>
	 *
	 * @param id variable id assigned by the {@link VariableRegistry}
	 * @param name variable name, kept for {@link #dump(PrintStream)}
	 */
	public void pushVariable(int id, String name) {
		assert id >= 0;
		queue.add(Tuple.variable(id, name));
	}

	/**
	 * <p>
	 * apply.
	 * </p>
	 *
	 * @param operator a binary operator
	 */
	public void apply(Operator operator) {
		queue.add(Tuple.apply(operator));
	}

	/**
	 * <p>
	 * not.
	 * </p>
	 */
	public void not() {
		queue.add(Tuple.not());
	}

	/**
	 * @return a position tracker set on the first tuple
	 */
	public PositionTracker top() {
		return new PositionTracker(Collections.unmodifiableList(queue));
	}

	public int size() {
		return queue.size();
	}

	public boolean isEmpty() {
		return queue.isEmpty();
	}

	/**
	 * Prints one tuple per line, prefixed by its index.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		for (int i = 0; i < queue.size(); i++) {
			ps.println(i + " : " + queue.get(i));
		}
	}

	/**
	 * Renders the program on a single line, e.g. {@code A B AND NOT}.
	 *
	 * @param registry registry that resolves variable ids to names
	 * @return the postfix text
	 */
	public String toPostfixString(VariableRegistry registry) {
		StringBuilder sb = new StringBuilder();
		for (Tuple tuple : queue) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			switch (tuple.getOpcode()) {
			case PUSH_VARIABLE:
				sb.append(registry.getName(tuple.getVariableId()));
				break;
			case APPLY:
				sb.append(tuple.getOperator().name());
				break;
			case NOT:
				sb.append("NOT");
				break;
			default:
				throw new Error("Unknown opcode " + tuple.getOpcode());
			}
		}
		return sb.toString();
	}
}
