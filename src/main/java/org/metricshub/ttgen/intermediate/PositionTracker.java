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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * Marks a position within the tuple list (queue).
 */
public class PositionTracker {

	private int idx = 0;
	private final List<Tuple> queue;
	private Tuple tuple;

	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "PositionTracker must iterate over the shared tuple list")
	PositionTracker(List<Tuple> queue) {
		this.queue = queue;
		this.tuple = queue.isEmpty() ? null : queue.get(idx);
	}

	public boolean isEOF() {
		return idx >= queue.size();
	}

	public void next() {
		assert tuple != null;
		++idx;
		tuple = idx < queue.size() ? queue.get(idx) : null;
	}

	@Override
	public String toString() {
		return "[" + idx + "]-->" + tuple;
	}

	public Opcode opcode() {
		return tuple.getOpcode();
	}

	public int variableArg() {
		if (tuple.getOpcode() == Opcode.PUSH_VARIABLE) {
			return tuple.getVariableId();
		}
		throw new Error("No variable argument, tuple = " + tuple);
	}

	public Operator operatorArg() {
		if (tuple.getOpcode() == Opcode.APPLY) {
			return tuple.getOperator();
		}
		throw new Error("No operator argument, tuple = " + tuple);
	}
}
