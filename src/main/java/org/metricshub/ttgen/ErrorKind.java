package org.metricshub.ttgen;

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
 * The kinds of failure that can abort the processing of an input line.
 * <p>
 * All kinds are recoverable (processing resumes at the next line) except
 * {@link #VARIABLE_CAPACITY_EXCEEDED}, which the command line treats as fatal.
 */
public enum ErrorKind {
	/** The lexer found a character that cannot start any token. */
	UNEXPECTED_CHARACTER(false),
	/** Unbalanced {@code (} or {@code )}. */
	MISMATCHED_PARENTHESES(false),
	/** The variable order marker appeared after the first token of a line. */
	EMBEDDED_ORDER_MARKER(false),
	/** Something other than a variable name followed the variable order marker. */
	NON_VARIABLE_IN_ORDER_DIRECTIVE(false),
	/** The parser side stack or the evaluation stack is full. */
	STACK_OVERFLOW(false),
	/** An operator or NOT found too few operands on the evaluation stack. */
	STACK_UNDERFLOW(false),
	/** Operands and operators out of order, or not exactly one value left after evaluation. */
	MALFORMED_EXPRESSION(false),
	/** The expression has more variables than the table enumeration allows. */
	TABLE_TOO_LARGE(false),
	/** More distinct variable names than the registry can hold. */
	VARIABLE_CAPACITY_EXCEEDED(true);

	private final boolean fatal;

	ErrorKind(boolean fatal) {
		this.fatal = fatal;
	}

	/**
	 * @return {@code true} if no further input line should be processed after
	 *         a failure of this kind
	 */
	public boolean isFatal() {
		return fatal;
	}
}
