package org.metricshub.ttgen;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.ttgen.TtgenTestSupport.TestResult;
import org.metricshub.ttgen.util.TtgenSettings;

public class CliTest {

	@Test
	public void testXorTable() throws Exception {
		TtgenTestSupport
				.cliTest("A XOR B prints the full table")
				.input("A XOR B")
				.expectLines("A B  A XOR B", "T T  F", "T F  T", "F T  T", "F F  F", "")
				.runAndAssert();
	}

	@Test
	public void testSymbolicOperators() throws Exception {
		TtgenTestSupport
				.cliTest("a -> b uses the symbolic IMPLIES")
				.input("a -> b")
				.expectLines("a b  a -> b", "T T  T", "T F  F", "F T  T", "F F  T", "")
				.runAndAssert();
	}

	@Test
	public void testColumnsArePaddedToNameWidth() throws Exception {
		TtgenTestSupport
				.cliTest("cells are left-aligned under long names")
				.input("rain & wet")
				.expectLines(
						"rain wet  rain & wet",
						"T    T    T",
						"T    F    F",
						"F    T    F",
						"F    F    F",
						"")
				.runAndAssert();
	}

	@Test
	public void testEachLineHasItsOwnVariables() throws Exception {
		TtgenTestSupport
				.cliTest("variables do not leak from one line to the next")
				.input("A OR B", "C")
				.expectLines("A B  A OR B", "T T  T", "T F  T", "F T  T", "F F  F", "", "C  C", "T  T", "F  F", "")
				.runAndAssert();
	}

	@Test
	public void testVariableOrderDirective() throws Exception {
		TtgenTestSupport
				.cliTest("/ B A orders the columns of the next lines")
				.input("/ B A", "A AND B", "A NAND B")
				.expectLines(
						"B A  A AND B",
						"T T  T",
						"T F  F",
						"F T  F",
						"F F  F",
						"",
						"B A  A NAND B",
						"T T  F",
						"T F  T",
						"F T  T",
						"F F  T",
						"")
				.runAndAssert();
	}

	@Test
	public void testDirectiveAppendsUndeclaredVariables() throws Exception {
		TtgenTestSupport
				.cliTest("variables missing from the directive come after the declared ones")
				.input("/ C", "A NOR C")
				.expectLines(
						"C A  A NOR C",
						"T T  F",
						"T F  F",
						"F T  F",
						"F F  T",
						"")
				.runAndAssert();
	}

	@Test
	public void testEmptyDirectiveClearsTheOrder() throws Exception {
		TtgenTestSupport
				.cliTest("a bare / forgets the declared order")
				.input("/ B A", "/", "A EQUIV B")
				.expectLines("A B  A EQUIV B", "T T  T", "T F  F", "F T  F", "F F  T", "")
				.runAndAssert();
	}

	@Test
	public void testBlankLinesAreIgnored() throws Exception {
		TtgenTestSupport
				.cliTest("blank lines print nothing")
				.input("", "   \t", "x")
				.expectLines("x  x", "T  T", "F  F", "")
				.runAndAssert();
	}

	@Test
	public void testMismatchedParenthesesContinues() throws Exception {
		TtgenTestSupport
				.cliTest("unbalanced parentheses are reported and the next line is processed")
				.input("(A AND B", "A AND B)", "!p")
				.expectLines("", "", "p  !p", "T  F", "F  T", "")
				.expectErrors("error (line 1): mismatched parentheses", "error (line 2): mismatched parentheses")
				.runAndAssert();
	}

	@Test
	public void testUnexpectedCharacter() throws Exception {
		TtgenTestSupport
				.cliTest("A $ B is rejected")
				.input("A $ B")
				.expectLines("")
				.expectErrors("error (line 1): unexpected character '$'")
				.runAndAssert();
	}

	@Test
	public void testNonAsciiCharacters() throws Exception {
		TtgenTestSupport
				.cliTest("only ASCII letters make names and operator words")
				.input("A \uD83D\uDE00 B", "p \u0131mp q", "p imp q")
				.expectLines("", "", "p q  p imp q", "T T  T", "T F  F", "F T  T", "F F  T", "")
				.expectErrors(
						"error (line 1): unexpected character '\uD83D\uDE00'",
						"error (line 2): unexpected character '\u0131'")
				.runAndAssert();
	}

	@Test
	public void testEmbeddedOrderMarker() throws Exception {
		TtgenTestSupport
				.cliTest("/ after the first token is rejected")
				.input("A / B")
				.expectLines("")
				.expectErrors("error (line 1): variable order marker '/' can not be embedded in expressions")
				.runAndAssert();
	}

	@Test
	public void testNonVariableInDirective() throws Exception {
		TtgenTestSupport
				.cliTest("operators are not allowed in a directive")
				.input("/ A AND B", "B OR A")
				.expectLines("", "B A  B OR A", "T T  T", "T F  T", "F T  T", "F F  F", "")
				.expectErrors("error (line 1): non-variable \"AND\" in variable order directive")
				.runAndAssert();
	}

	@Test
	public void testMalformedExpressions() throws Exception {
		TtgenTestSupport
				.cliTest("operands and operators must alternate")
				.input("A AND", "A B", "()", "A B AND", "AND A B", "A NOT", "x OR y")
				.expectLines("", "", "", "", "", "", "x y  x OR y", "T T  T", "T F  T", "F T  T", "F F  F", "")
				.expectErrors(
						"error (line 1): syntax error at end of line",
						"error (line 2): syntax error at \"B\"",
						"error (line 3): syntax error at \")\"",
						"error (line 4): syntax error at \"B\"",
						"error (line 5): syntax error at \"AND\"",
						"error (line 6): syntax error at \"NOT\"")
				.runAndAssert();
	}

	@Test
	public void testStackOverflow() throws Exception {
		TtgenTestSupport
				.cliTest("nesting deeper than the stack is rejected")
				.args("--stack-size", "4")
				.input("(((((A)))))", "((A))")
				.expectLines("", "A  ((A))", "T  T", "F  F", "")
				.expectErrors("error (line 1): stack overflow")
				.runAndAssert();
	}

	@Test
	public void testTableTooLarge() throws Exception {
		TtgenTestSupport
				.cliTest("tables above the enumeration bound are refused")
				.args("--max-table-vars", "2")
				.input("a | b | c", "a | b")
				.expectLines("", "a b  a | b", "T T  T", "T F  T", "F T  T", "F F  F", "")
				.expectErrors("error (line 1): too many variables for a truth table: 3 (maximum 2)")
				.runAndAssert();
	}

	@Test
	public void testVariableCapacityIsFatal() throws Exception {
		TtgenTestSupport
				.cliTest("exceeding the variable capacity stops the program")
				.args("--max-vars", "2")
				.input("a & b & c", "a & b")
				.expect("")
				.expectErrors("error (line 1): maximum of 2 variables")
				.expectExit(1)
				.runAndAssert();
	}

	@Test
	public void testBinaryAlphabet() throws Exception {
		TtgenTestSupport
				.cliTest("-b prints 1 and 0")
				.args("-b")
				.input("NOT A AND B")
				.expectLines("A B  NOT A AND B", "1 1  0", "1 0  0", "0 1  1", "0 0  0", "")
				.runAndAssert();
	}

	@Test
	public void testDumpIntermediate() throws Exception {
		TtgenTestSupport
				.cliTest("--dump-intermediate prints the postfix program first")
				.args("--dump-intermediate")
				.input("!(x ^ y)")
				.expectLines(
						"0 : PUSH_VARIABLE, 0 (\"x\")",
						"1 : PUSH_VARIABLE, 1 (\"y\")",
						"2 : APPLY, XOR",
						"3 : NOT",
						"x y  !(x ^ y)",
						"T T  T",
						"T F  F",
						"F T  F",
						"F F  T",
						"")
				.runAndAssert();
	}

	@Test
	public void testEmptyInput() throws Exception {
		TtgenTestSupport.cliTest("end of input right away").rawInput("").expect("").runAndAssert();
	}

	@Test
	public void testLastLineWithoutNewline() throws Exception {
		TtgenTestSupport
				.cliTest("a final line without terminator is processed")
				.rawInput("q")
				.expectLines("q  q", "T  T", "F  F", "")
				.runAndAssert();
	}

	@Test
	public void testUsage() throws Exception {
		TestResult result = TtgenTestSupport.cliTest("-h prints usage").args("-h").run();
		assertEquals(0, result.exitCode());
		assertTrue(result.output().startsWith("Usage:"));
		assertTrue(result.output().contains("--dump-intermediate"));
	}

	@Test
	public void testParseCommandLineArguments() {
		TtgenSettings settings = Cli
				.parseCommandLineArguments(new String[] { "--binary", "--stack-size", "8", "--max-table-vars", "0" })
				.getSettings();
		assertEquals('1', settings.getTrueSymbol());
		assertEquals('0', settings.getFalseSymbol());
		assertEquals(8, settings.getStackCapacity());
		assertEquals(0, settings.getMaxTableVariables());
		assertEquals(TtgenSettings.VAR_MAX, settings.getMaxVariables());
		assertFalse(settings.isDumpIntermediate());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(
				"unknown switch",
				IllegalArgumentException.class,
				() -> TtgenTestSupport.cliTest("unknown switch").args("--frobnicate").run());
		assertThrows(
				"missing value",
				IllegalArgumentException.class,
				() -> TtgenTestSupport.cliTest("missing value").args("--max-vars").run());
		assertThrows(
				"not a number",
				IllegalArgumentException.class,
				() -> TtgenTestSupport.cliTest("not a number").args("--stack-size", "deep").run());
		assertThrows(
				"out of range",
				IllegalArgumentException.class,
				() -> TtgenTestSupport.cliTest("out of range").args("--max-vars", "65").run());
		assertThrows(
				"-h with other switches",
				IllegalArgumentException.class,
				() -> TtgenTestSupport.cliTest("-h with other switches").args("-b", "-h").run());
	}
}
