package org.metricshub.ttgen.backend;

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

import org.metricshub.ttgen.ErrorKind;

/**
 * Fixed-capacity operand stack used by the {@link TruthEvaluator}.
 * Every access is bounds-checked and reported as an {@link EvaluationException}.
 */
class EvaluationStack {

	private final boolean[] values;
	private int sp = 0;

	EvaluationStack(int capacity) {
		values = new boolean[capacity];
	}

	void push(boolean value) {
		if (sp >= values.length) {
			throw new EvaluationException(ErrorKind.STACK_OVERFLOW, "stack overflow");
		}
		values[sp++] = value;
	}

	boolean pop() {
		if (sp <= 0) {
			throw new EvaluationException(ErrorKind.STACK_UNDERFLOW, "stack underflow");
		}
		return values[--sp];
	}

	/**
	 * Fails with a stack underflow unless at least {@code n} values are present.
	 */
	void require(int n) {
		if (sp < n) {
			throw new EvaluationException(ErrorKind.STACK_UNDERFLOW, "stack underflow");
		}
	}

	int size() {
		return sp;
	}

	void clear() {
		sp = 0;
	}
}
