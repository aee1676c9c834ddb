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

import java.io.PrintStream;
import java.util.List;
import org.metricshub.ttgen.ErrorKind;
import org.metricshub.ttgen.intermediate.PostfixTuples;
import org.metricshub.ttgen.util.TtgenLogger;
import org.metricshub.ttgen.util.TtgenSettings;
import org.slf4j.Logger;

/**
 * Enumerates every truth assignment of an expression and prints its truth
 * table.
 * <p>
 * Rows go from the all-true assignment down to the all-false one, counting
 * down from {@code 2^n - 1} to {@code 0}. The first column is the most
 * significant digit of that counter, so it changes slowest. Columns follow the
 * variable ids, left to right, and the result comes last:
 *
 * <pre>
 * A B  A XOR B
 * T T  F
 * T F  T
 * F T  T
 * F F  F
 * </pre>
 *
 * The program is evaluated once before anything is printed, so that a
 * structural failure aborts the table before its header.
 */
public class TableDriver {

	private static final Logger LOG = TtgenLogger.getLogger(TableDriver.class);

	private final TruthEvaluator evaluator;
	private final char trueSymbol;
	private final char falseSymbol;
	private final int maxTableVariables;

	/**
	 * @param evaluator evaluator used for every row
	 * @param trueSymbol symbol printed for true
	 * @param falseSymbol symbol printed for false
	 * @param maxTableVariables largest number of variables that is enumerated
	 */
	public TableDriver(TruthEvaluator evaluator, char trueSymbol, char falseSymbol, int maxTableVariables) {
		if (maxTableVariables < 0 || maxTableVariables > TtgenSettings.TABLE_VARIABLES_LIMIT) {
			throw new IllegalArgumentException("unsupported table size: " + maxTableVariables);
		}
		this.evaluator = evaluator;
		this.trueSymbol = trueSymbol;
		this.falseSymbol = falseSymbol;
		this.maxTableVariables = maxTableVariables;
	}

	/**
	 * Checks that the table can be enumerated and that the program is a valid
	 * expression.
	 *
	 * @param numVars number of variables (columns)
	 * @param tuples the postfix program
	 * @throws EvaluationException if the table must not be printed
	 */
	public void check(int numVars, PostfixTuples tuples) {
		if (numVars > maxTableVariables) {
			throw new EvaluationException(
					ErrorKind.TABLE_TOO_LARGE,
					"too many variables for a truth table: " + numVars + " (maximum " + maxTableVariables + ")");
		}
		// any structural failure shows regardless of the assignment
		evaluator.evaluate(tuples, 0L);
	}

	/**
	 * Prints the header and all rows of the table, followed by nothing: the
	 * caller owns the separator.
	 *
	 * @param variableNames column names, in variable id order
	 * @param tuples the postfix program
	 * @param heading heading of the result column
	 * @param out where to print
	 * @throws EvaluationException if the table cannot be printed; nothing has
	 *         been printed then
	 */
	public void printTable(List<String> variableNames, PostfixTuples tuples, String heading, PrintStream out) {
		int numVars = variableNames.size();
		check(numVars, tuples);

		StringBuilder line = new StringBuilder();
		for (String name : variableNames) {
			line.append(name).append(' ');
		}
		line.append(' ').append(heading);
		out.println(line);

		long rows = 1L << numVars;
		LOG.debug("Printing {} rows for {} variables", rows, numVars);
		for (long counter = rows - 1; counter >= 0; counter--) {
			long assignment = assignmentForRow(counter, numVars);
			line.setLength(0);
			for (int id = 0; id < numVars; id++) {
				line.append(symbol(((assignment >>> id) & 1L) != 0));
				pad(line, variableNames.get(id).length() - 1);
				line.append(' ');
			}
			line.append(' ').append(symbol(evaluator.evaluate(tuples, assignment)));
			out.println(line);
		}
	}

	/**
	 * Computes the result column only, in row order.
	 *
	 * @param numVars number of variables
	 * @param tuples the postfix program
	 * @return one result per row, first row (all true) first
	 * @throws EvaluationException if the table cannot be enumerated
	 */
	public boolean[] truthColumn(int numVars, PostfixTuples tuples) {
		check(numVars, tuples);
		int rows = 1 << numVars;
		boolean[] column = new boolean[rows];
		for (int row = 0; row < rows; row++) {
			column[row] = evaluator.evaluate(tuples, assignmentForRow(rows - 1L - row, numVars));
		}
		return column;
	}

	/**
	 * Maps a row counter to a truth assignment. Digit {@code n - 1 - k} of the
	 * counter becomes bit {@code k} of the assignment, i.e. the value of the
	 * variable with id {@code k}.
	 *
	 * @param counter row counter, in {@code [0, 2^numVars)}
	 * @param numVars number of variables
	 * @return the truth assignment of the row
	 */
	static long assignmentForRow(long counter, int numVars) {
		if (numVars == 0) {
			return 0L;
		}
		return Long.reverse(counter) >>> (Long.SIZE - numVars);
	}

	/**
	 * @param value a truth value
	 * @return the symbol that renders it
	 */
	public char symbol(boolean value) {
		return value ? trueSymbol : falseSymbol;
	}

	private static void pad(StringBuilder sb, int count) {
		for (int i = 0; i < count; i++) {
			sb.append(' ');
		}
	}
}
