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
 * Thrown when more distinct variable names are registered than the
 * {@link org.metricshub.ttgen.intermediate.VariableRegistry} can hold.
 * <p>
 * The registry has no eviction policy, so the caller decides whether to stop
 * (the command line does) or to discard the registry and carry on.
 */
public class VariableCapacityException extends TtgenException {

	private static final long serialVersionUID = 1L;

	private final int capacity;

	private final String rejectedName;

	/**
	 * @param capacity maximum number of variables the registry accepts
	 * @param rejectedName the name that could not be registered
	 */
	public VariableCapacityException(int capacity, String rejectedName) {
		super(ErrorKind.VARIABLE_CAPACITY_EXCEEDED, "maximum of " + capacity + " variables");
		this.capacity = capacity;
		this.rejectedName = rejectedName;
	}

	public int getCapacity() {
		return capacity;
	}

	public String getRejectedName() {
		return rejectedName;
	}
}
