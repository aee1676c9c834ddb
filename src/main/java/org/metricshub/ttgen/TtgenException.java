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
 * Base class of every failure raised while tokenizing, parsing or evaluating
 * one input line. It is provided to conveniently distinguish between Ttgen
 * failures and other runtime exceptions.
 */
public class TtgenException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private int lineNumber;

	/**
	 * <p>
	 * Constructor for TtgenException.
	 * </p>
	 *
	 * @param kind the kind of failure
	 * @param msg a {@link java.lang.String} object
	 */
	public TtgenException(ErrorKind kind, String msg) {
		super(msg);
		this.kind = kind;
		this.lineNumber = -1;
	}

	/**
	 * <p>
	 * Constructor for TtgenException.
	 * </p>
	 *
	 * @param kind the kind of failure
	 * @param lineno 1-based number of the offending input line
	 * @param msg a {@link java.lang.String} object
	 */
	public TtgenException(ErrorKind kind, int lineno, String msg) {
		super(msg);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Attaches the input line number once the failure has unwound to the line
	 * driver. A line number that is already known is kept.
	 *
	 * @param lineno 1-based number of the offending input line
	 * @return this exception
	 */
	public TtgenException atLine(int lineno) {
		if (lineNumber < 0) {
			lineNumber = lineno;
		}
		return this;
	}
}
