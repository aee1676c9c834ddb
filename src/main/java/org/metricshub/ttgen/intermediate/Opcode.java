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
public enum Opcode {
	/**
	 * Pushes the value of a variable, taken from the truth assignment,
	 * onto the operand stack.
	 * <p>
	 * Argument: variable id
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: x ...
	 */
	PUSH_VARIABLE(0),
	/**
	 * Pops two items off the operand stack, applies a binary operator
	 * and pushes the result.
	 * <p>
	 * Argument: operator
	 * <p>
	 * Stack before: b a ...<br/>
	 * Stack after: (a op b) ...
	 */
	APPLY(Operator.ARITY),
	/**
	 * Replaces the top-of-stack with its negation.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: !x ...
	 */
	NOT(1);

	private final int arity;

	Opcode(int arity) {
		this.arity = arity;
	}

	/**
	 * @return the number of operand stack items consumed by this opcode
	 */
	public int getArity() {
		return arity;
	}
}
