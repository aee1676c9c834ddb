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
import org.metricshub.ttgen.intermediate.Opcode;
import org.metricshub.ttgen.intermediate.Operator;
import org.metricshub.ttgen.intermediate.PositionTracker;
import org.metricshub.ttgen.intermediate.PostfixTuples;
import org.metricshub.ttgen.util.TtgenLogger;
import org.slf4j.Logger;

/**
 * Evaluates a postfix program for one truth assignment.
 * <p>
 * A truth assignment is a bitmask: bit {@code k} holds the value of the
 * variable with id {@code k}. Evaluation has no side effect beyond the private
 * operand stack, which is reset on every call, so the result only depends on
 * the program and the assignment. An instance is not thread-safe.
 */
public class TruthEvaluator {

	private static final Logger LOG = TtgenLogger.getLogger(TruthEvaluator.class);

	private final EvaluationStack operandStack;

	/**
	 * @param stackCapacity maximum depth of the operand stack
	 */
	public TruthEvaluator(int stackCapacity) {
		if (stackCapacity < 1) {
			throw new IllegalArgumentException("stack capacity must be positive: " + stackCapacity);
		}
		operandStack = new EvaluationStack(stackCapacity);
	}

	/**
	 * Traverse the tuples, executing their associated opcodes.
	 *
	 * @param tuples the postfix program
	 * @param assignment the truth assignment
	 * @return the value of the expression
	 * @throws EvaluationException on stack overflow, stack underflow, or when
	 *         other than exactly one value remains at the end
	 */
	public boolean evaluate(PostfixTuples tuples, long assignment) {
		operandStack.clear();
		PositionTracker position = tuples.top();
		while (!position.isEOF()) {
			Opcode opcode = position.opcode();
			switch (opcode) {
			case PUSH_VARIABLE: {
				// arg[0] = variable id
				int id = position.variableArg();
				operandStack.push(((assignment >>> id) & 1L) != 0);
				break;
			}
			case APPLY: {
				// arg[0] = operator
				// stack[0] = right operand
				// stack[1] = left operand
				Operator operator = position.operatorArg();
				operandStack.require(opcode.getArity());
				boolean b = operandStack.pop();
				boolean a = operandStack.pop();
				operandStack.push(operator.apply(a, b));
				break;
			}
			case NOT: {
				// stack[0] = operand
				operandStack.require(opcode.getArity());
				operandStack.push(!operandStack.pop());
				break;
			}
			default:
				throw new Error("invalid opcode: " + opcode);
			}
			position.next();
		}
		if (operandStack.size() != 1) {
			LOG.debug("{} values left on the stack after evaluation", operandStack.size());
			throw new EvaluationException(
					ErrorKind.MALFORMED_EXPRESSION,
					operandStack.size() == 0 ? "empty expression" : "stack not empty");
		}
		return operandStack.pop();
	}
}
