package org.metricshub.ttgen.util;

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
import java.io.InputStream;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single Ttgen invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Ttgen programmatically, from within Java code.
 */
public class TtgenSettings {

	/** Hard upper bound of the variable id space: one bit per variable in a {@code long}. */
	public static final int VAR_MAX = 64;

	/** Upper bound accepted for {@link #setMaxTableVariables(int)}. */
	public static final int TABLE_VARIABLES_LIMIT = 30;

	/**
	 * Where expression lines are read from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Where truth tables are printed;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Where per-line diagnostics are printed;
	 * <code>System.err</code> by default.
	 */
	private PrintStream errorStream = System.err;

	/** Symbol printed for a true value. */
	private char trueSymbol = 'T';

	/** Symbol printed for a false value. */
	private char falseSymbol = 'F';

	/**
	 * Maximum number of distinct variable names a registry accepts
	 * before failing with a fatal capacity error.
	 */
	private int maxVariables = VAR_MAX;

	/**
	 * Maximum number of variables for which a table is enumerated.
	 * The table has 2^n rows.
	 */
	private int maxTableVariables = 24;

	/**
	 * Capacity of both the parser operator stack and the evaluation stack.
	 */
	private int stackCapacity = 128;

	/** Whether to print the postfix program of each expression before its table. */
	private boolean dumpIntermediate = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("symbols = ").append(trueSymbol).append('/').append(falseSymbol).append(newLine);
		desc.append("maxVariables = ").append(maxVariables).append(newLine);
		desc.append("maxTableVariables = ").append(maxTableVariables).append(newLine);
		desc.append("stackCapacity = ").append(stackCapacity).append(newLine);
		desc.append("dumpIntermediate = ").append(dumpIntermediate).append(newLine);

		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream errorStream) {
		this.errorStream = errorStream;
	}

	public char getTrueSymbol() {
		return trueSymbol;
	}

	public char getFalseSymbol() {
		return falseSymbol;
	}

	/**
	 * Sets the two-symbol alphabet used to render truth values.
	 *
	 * @param trueSymbol symbol for true
	 * @param falseSymbol symbol for false
	 */
	public void setSymbols(char trueSymbol, char falseSymbol) {
		if (trueSymbol == falseSymbol) {
			throw new IllegalArgumentException("true and false symbols must differ");
		}
		this.trueSymbol = trueSymbol;
		this.falseSymbol = falseSymbol;
	}

	public int getMaxVariables() {
		return maxVariables;
	}

	public void setMaxVariables(int maxVariables) {
		if (maxVariables < 1 || maxVariables > VAR_MAX) {
			throw new IllegalArgumentException("maximum variables must be between 1 and " + VAR_MAX);
		}
		this.maxVariables = maxVariables;
	}

	public int getMaxTableVariables() {
		return maxTableVariables;
	}

	public void setMaxTableVariables(int maxTableVariables) {
		if (maxTableVariables < 0 || maxTableVariables > TABLE_VARIABLES_LIMIT) {
			throw new IllegalArgumentException(
					"maximum table variables must be between 0 and " + TABLE_VARIABLES_LIMIT);
		}
		this.maxTableVariables = maxTableVariables;
	}

	public int getStackCapacity() {
		return stackCapacity;
	}

	public void setStackCapacity(int stackCapacity) {
		if (stackCapacity < 1) {
			throw new IllegalArgumentException("stack size must be at least 1");
		}
		this.stackCapacity = stackCapacity;
	}

	public boolean isDumpIntermediate() {
		return dumpIntermediate;
	}

	public void setDumpIntermediate(boolean dumpIntermediate) {
		this.dumpIntermediate = dumpIntermediate;
	}
}
