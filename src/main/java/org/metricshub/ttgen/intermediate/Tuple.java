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

/**
 * Represents a single node of the postfix program produced by
 * {@link PostfixTuples}. While {@code PostfixTuples} manages the list of
 * tuples, this class models one instruction and its single operand: a
 * variable id for {@link Opcode#PUSH_VARIABLE}, an {@link Operator} for
 * {@link Opcode#APPLY}, nothing for {@link Opcode#NOT}.
 *
 * @see PostfixTuples
 */
final class Tuple {

	private final Opcode opcode;
	private final int variableId;
	private final String variableName;
	private final Operator operator;

	private Tuple(Opcode opcode, int variableId, String variableName, Operator operator) {
		this.opcode = opcode;
		this.variableId = variableId;
		this.variableName = variableName;
		this.operator = operator;
	}

	static Tuple variable(int id, String name) {
		return new Tuple(Opcode.PUSH_VARIABLE, id, name, null);
	}

	static Tuple apply(Operator operator) {
		return new Tuple(Opcode.APPLY, -1, null, operator);
	}

	static Tuple not() {
		return new Tuple(Opcode.NOT, -1, null, null);
	}

	Opcode getOpcode() {
		return opcode;
	}

	int getVariableId() {
		return variableId;
	}

	Operator getOperator() {
		return operator;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(opcode.name());
		switch (opcode) {
		case PUSH_VARIABLE:
			sb.append(", ").append(variableId).append(" (\"").append(variableName).append("\")");
			break;
		case APPLY:
			sb.append(", ").append(operator.name());
			break;
		default:
			break;
		}
		return sb.toString();
	}
}
