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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.ttgen.util.TtgenLogger;
import org.metricshub.ttgen.util.TtgenSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for Ttgen.
 * <p>
 * Expressions are read from the standard input, one per line, and their truth
 * tables are printed on the standard output.
 */
public final class Cli {

	private static final Logger LOG = TtgenLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "ttgen.jar";
		}
		JAR_NAME = myName;
	}

	private final TtgenSettings settings = new TtgenSettings();
	private final PrintStream out;

	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which expression lines are read
	 * @param out stream where truth tables are written
	 * @param err stream where diagnostics are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link TtgenSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TtgenSettings getSettings() {
		return settings;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-b") || arg.equals("--binary")) {
				// -b/--binary : print 1 and 0 instead of T and F
				settings.setSymbols('1', '0');
			} else if (arg.equals("--dump-intermediate")) {
				// --dump-intermediate : print the postfix program before each table
				settings.setDumpIntermediate(true);
			} else if (arg.equals("--max-vars")) {
				// --max-vars N : capacity of the variable registry
				checkParameterHasArgument(args, argIdx);
				settings.setMaxVariables(parseInt(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--max-table-vars")) {
				// --max-table-vars N : largest table that is enumerated
				checkParameterHasArgument(args, argIdx);
				settings.setMaxTableVariables(parseInt(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--stack-size")) {
				// --stack-size N : capacity of the operator and evaluation stacks
				checkParameterHasArgument(args, argIdx);
				settings.setStackCapacity(parseInt(args[argIdx], args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}
		LOG.debug("Settings:\n{}", settings.toDescriptionString());
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the process exit status
	 * @throws Exception if reading the input fails
	 */
	public int run() throws Exception {
		if (printUsage) {
			usage(out);
			return 0;
		}
		return new Ttgen(settings).invoke();
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-b|--binary]" +
								" [--dump-intermediate]" +
								" [--max-vars N]" +
								" [--max-table-vars N]" +
								" [--stack-size N]" +
								" < expressions");
		dest.println();
		dest.println("Reads one boolean expression per line and prints its truth table.");
		dest.println("Operators: NOT (!), OR (|), AND (&), XOR (^), NAND, NOR, IMPLIES (->), EQUIV (=).");
		dest.println("Binary operators have equal precedence and associate to the left; NOT binds tighter.");
		dest.println("A line such as '/ B A' declares the column order of the following lines.");
		dest.println();
		dest.println(" -b, --binary = Print 1 and 0 instead of T and F.");
		dest.println(" --dump-intermediate = Print the postfix program before each table.");
		dest.println(" --max-vars N = Maximum number of distinct variables (1-" + TtgenSettings.VAR_MAX + ", default 64).");
		dest
				.println(
						" --max-table-vars N = Maximum number of variables of a table (0-"
								+ TtgenSettings.TABLE_VARIABLES_LIMIT
								+ ", default 24).");
		dest.println(" --stack-size N = Capacity of the operator and evaluation stacks (default 128).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments and executes the CLI.
	 *
	 * @param args command-line arguments
	 * @param is input stream for expression lines
	 * @param os output stream for truth tables
	 * @param es error stream for diagnostic messages
	 * @return the process exit status
	 * @throws Exception if execution fails
	 */
	public static int create(String[] args, InputStream is, PrintStream os, PrintStream es) throws Exception {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		return cli.run();
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int status;
		try {
			Cli cli = new Cli();
			cli.parse(args);
			status = cli.run();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			status = 1;
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			status = 1;
		}
		System.exit(status);
	}
}
