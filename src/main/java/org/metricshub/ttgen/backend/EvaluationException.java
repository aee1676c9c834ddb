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
import org.metricshub.ttgen.TtgenException;

/**
 * Thrown when a postfix program cannot be evaluated, or its table cannot be
 * enumerated.
 * <p>
 * Apart from {@link ErrorKind#STACK_OVERFLOW} on deeply nested input and
 * {@link ErrorKind#TABLE_TOO_LARGE}, these failures reveal a postfix program
 * that the parser accepted but that is not a valid expression, such as
 * {@code A B} or {@code A AND}.
 */
public class EvaluationException extends TtgenException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param kind the kind of failure
	 * @param msg a {@link java.lang.String} object
	 */
	public EvaluationException(ErrorKind kind, String msg) {
		super(kind, msg);
	}
}
