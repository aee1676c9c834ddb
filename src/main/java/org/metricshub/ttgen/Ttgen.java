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

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.ttgen.backend.TableDriver;
import org.metricshub.ttgen.backend.TruthEvaluator;
import org.metricshub.ttgen.frontend.ExpressionLexer;
import org.metricshub.ttgen.frontend.ExpressionParser;
import org.metricshub.ttgen.frontend.ParsedLine;
import org.metricshub.ttgen.frontend.TokenKind;
import org.metricshub.ttgen.intermediate.PostfixTuples;
import org.metricshub.ttgen.intermediate.VariableRegistry;
import org.metricshub.ttgen.util.TtgenLogger;
import org.metricshub.ttgen.util.TtgenSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and evaluation of boolean expressions.
 * This entry point is used both when Ttgen is executed as a library and when
 * invoked from the command line.
 * <p>
 * Each input line goes through the following steps:
 * <ul>
 * <li>Tokenize and parse the line, producing a postfix program
 * ({@link ExpressionParser}).
 * <li>Enumerate every truth assignment of its variables and evaluate the
 * program for each of them ({@link TableDriver}, {@link TruthEvaluator}).
 * </ul>
 * Lines are independent of each other: the variables of a line are forgotten
 * once its table is printed. The only exception is a variable order directive
 * ({@code / B A}), whose names are registered first, in that order, on every
 * following line until the next directive.
 * <p>
 * An instance keeps the declared variable order between calls and is not
 * thread-safe.
 */
public class Ttgen {

	private static final Logger LOG = TtgenLogger.getLogger(Ttgen.class);

	private final TtgenSettings settings;
	private final VariableRegistry registry;
	private final ExpressionParser parser;
	private final TableDriver tableDriver;

	/** Names of the last variable order directive. */
	private List<String> declaredOrder = Collections.emptyList();

	/**
	 * Create a new instance of Ttgen with default settings.
	 */
	public Ttgen() {
		this(new TtgenSettings());
	}

	/**
	 * Create a new instance of Ttgen.
	 *
	 * @param settings the settings; the streams are only used by {@link #invoke()}
	 */
	public Ttgen(TtgenSettings settings) {
		this.settings = settings;
		this.registry = new VariableRegistry(settings.getMaxVariables());
		this.parser = new ExpressionParser(settings.getStackCapacity());
		this.tableDriver = new TableDriver(
				new TruthEvaluator(settings.getStackCapacity()),
				settings.getTrueSymbol(),
				settings.getFalseSymbol(),
				settings.getMaxTableVariables());
	}

	/**
	 * Parses one line against a fresh variable registry, seeded with the
	 * declared variable order. A directive line replaces the declared order;
	 * a directive that fails leaves no declared order.
	 *
	 * @param line the input line
	 * @return the parsed line
	 * @throws TtgenException if the line is not a valid expression or directive
	 */
	public ParsedLine compile(String line) {
		registry.reset(declaredOrder);
		ParsedLine parsed;
		try {
			parsed = parser.parse(line, registry);
		} catch (TtgenException e) {
			if (isDirective(line)) {
				declaredOrder = Collections.emptyList();
			}
			throw e;
		}
		if (parsed.getType() == ParsedLine.Type.DIRECTIVE) {
			declaredOrder = parsed.getDeclaredOrder();
		} else if (parsed.getType() == ParsedLine.Type.EXPRESSION && LOG.isDebugEnabled()) {
			LOG.debug("Postfix program: {}", parsed.getTuples().toPostfixString(registry));
		}
		return parsed;
	}

	private static boolean isDirective(String line) {
		return new ExpressionLexer(line).nextToken().getKind() == TokenKind.ORDER_MARKER;
	}

	/**
	 * @return the variables of the last compiled line, in column order
	 */
	public List<String> getVariableNames() {
		return new ArrayList<String>(registry.getNames());
	}

	/**
	 * @return the names of the variable order directive in effect, if any
	 */
	public List<String> getDeclaredOrder() {
		return declaredOrder;
	}

	/**
	 * Processes one line and renders its output as {@link #invoke()} would
	 * print it on the output stream.
	 *
	 * @param line an expression or directive
	 * @return the table followed by its blank separator line, or an empty
	 *         string for a directive or blank line
	 * @throws TtgenException if the line fails
	 */
	public String table(String line) {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8.name())) {
			processLine(line, out);
			out.flush();
			return buffer.toString(StandardCharsets.UTF_8.name());
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Evaluates an expression for every truth assignment.
	 *
	 * @param expression the expression
	 * @return the result column, from the all-true row to the all-false row
	 * @throws TtgenException if the expression fails
	 * @throws IllegalArgumentException if the line is a directive or blank
	 */
	public boolean[] truthColumn(String expression) {
		ParsedLine parsed = compile(expression);
		if (parsed.getType() != ParsedLine.Type.EXPRESSION) {
			throw new IllegalArgumentException("Not an expression: " + expression);
		}
		return tableDriver.truthColumn(registry.size(), parsed.getTuples());
	}

	/**
	 * Processes one line: prints the table of an expression, followed by a
	 * blank line, or records a directive.
	 *
	 * @param line the input line
	 * @param out where to print
	 * @throws TtgenException if the line fails; nothing has been printed then
	 */
	public void processLine(String line, PrintStream out) {
		ParsedLine parsed = compile(line);
		if (parsed.getType() != ParsedLine.Type.EXPRESSION) {
			return;
		}
		PostfixTuples tuples = parsed.getTuples();
		if (settings.isDumpIntermediate()) {
			tableDriver.check(registry.size(), tuples);
			tuples.dump(out);
		}
		tableDriver.printTable(registry.getNames(), tuples, parsed.getSource(), out);
		out.println();
	}

	/**
	 * Reads lines from the input stream of the settings until the end of the
	 * input, printing tables on the output stream and diagnostics on the
	 * error stream. A failed line is reported and followed by a blank line on
	 * the output stream, then processing resumes with the next line. A fatal
	 * failure stops the processing.
	 *
	 * @return 0 once the end of the input is reached, 1 after a fatal failure
	 * @throws IOException upon an error reading the input
	 */
	public int invoke() throws IOException {
		PrintStream out = settings.getOutputStream();
		PrintStream err = settings.getErrorStream();
		BufferedReader reader = new BufferedReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
		String line;
		int lineNumber = 0;
		while ((line = reader.readLine()) != null) {
			lineNumber++;
			try {
				processLine(line, out);
			} catch (TtgenException e) {
				e.atLine(lineNumber);
				err.println(formatDiagnostic(e));
				if (e.getKind().isFatal()) {
					LOG.debug("Stopping at line {}: {}", lineNumber, e.getMessage());
					out.flush();
					return 1;
				}
				out.println();
			}
		}
		out.flush();
		return 0;
	}

	/**
	 * @param e a failure
	 * @return the one-line diagnostic for the failure
	 */
	public static String formatDiagnostic(TtgenException e) {
		if (e.getLineNumber() >= 0) {
			return "error (line " + e.getLineNumber() + "): " + e.getMessage();
		}
		return "error: " + e.getMessage();
	}
}
