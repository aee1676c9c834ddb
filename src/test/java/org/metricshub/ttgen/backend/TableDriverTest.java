package org.metricshub.ttgen.backend;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.ttgen.ErrorKind;
import org.metricshub.ttgen.intermediate.Operator;
import org.metricshub.ttgen.intermediate.PostfixTuples;

public class TableDriverTest {

	private final TableDriver driver = new TableDriver(new TruthEvaluator(128), 'T', 'F', 24);

	/** a0 OR a1 OR ... OR a(n-1) */
	private static PostfixTuples disjunction(int n) {
		PostfixTuples tuples = new PostfixTuples();
		tuples.pushVariable(0, "a0");
		for (int i = 1; i < n; i++) {
			tuples.pushVariable(i, "a" + i);
			tuples.apply(Operator.OR);
		}
		return tuples;
	}

	private static List<String> names(int n) {
		List<String> names = new ArrayList<String>();
		for (int i = 0; i < n; i++) {
			names.add("a" + i);
		}
		return names;
	}

	private String print(List<String> names, PostfixTuples tuples, String heading) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
			driver.printTable(names, tuples, heading, out);
		}
		return bytes.toString(StandardCharsets.UTF_8.name()).replace("\r\n", "\n");
	}

	@Test
	public void testAssignmentForRow() {
		// first column is the most significant digit of the counter
		assertEquals(1L, TableDriver.assignmentForRow(4L, 3));
		assertEquals(4L, TableDriver.assignmentForRow(1L, 3));
		assertEquals(7L, TableDriver.assignmentForRow(7L, 3));
		assertEquals(0L, TableDriver.assignmentForRow(0L, 3));
		assertEquals(0L, TableDriver.assignmentForRow(0L, 0));
		assertEquals(2L, TableDriver.assignmentForRow(2L, 3));
		assertEquals(-1L, TableDriver.assignmentForRow(-1L, 64));
	}

	@Test
	public void testRowCount() throws Exception {
		for (int n = 1; n <= 12; n++) {
			String table = print(names(n), disjunction(n), "h");
			String[] lines = table.split("\n");
			assertEquals("rows for " + n + " variables", (1 << n) + 1, lines.length);
			assertTrue(lines[1].endsWith(" T"));
			assertTrue("only the all-false row is false", lines[lines.length - 1].endsWith(" F"));
			assertTrue(lines[lines.length - 2].endsWith(" T"));
		}
	}

	@Test
	public void testFirstColumnChangesSlowest() throws Exception {
		PostfixTuples tuples = new PostfixTuples();
		tuples.pushVariable(0, "p");
		tuples.pushVariable(1, "q");
		tuples.pushVariable(2, "r");
		tuples.apply(Operator.AND);
		tuples.apply(Operator.IMPLIES);
		String expected = "p q r  p -> q & r\n"
				+ "T T T  T\n"
				+ "T T F  F\n"
				+ "T F T  F\n"
				+ "T F F  F\n"
				+ "F T T  T\n"
				+ "F T F  T\n"
				+ "F F T  T\n"
				+ "F F F  T\n";
		assertEquals(expected, print(Arrays.asList("p", "q", "r"), tuples, "p -> q & r"));
	}

	@Test
	public void testTruthColumn() {
		boolean[] column = driver.truthColumn(2, disjunction(2));
		assertArrayEquals(new boolean[] { true, true, true, false }, column);
		assertEquals(1 << 16, driver.truthColumn(16, disjunction(16)).length);
	}

	@Test
	public void testTooLargeTablePrintsNothing() throws Exception {
		TableDriver small = new TableDriver(new TruthEvaluator(128), '1', '0', 3);
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
		EvaluationException e = assertThrows(
				EvaluationException.class,
				() -> small.printTable(names(4), disjunction(4), "h", out));
		assertEquals(ErrorKind.TABLE_TOO_LARGE, e.getKind());
		assertEquals("too many variables for a truth table: 4 (maximum 3)", e.getMessage());
		assertEquals(0, bytes.size());
		assertEquals('1', small.symbol(true));
		assertEquals('0', small.symbol(false));
	}

	@Test
	public void testMalformedProgramPrintsNothing() throws Exception {
		PostfixTuples tuples = new PostfixTuples();
		tuples.pushVariable(0, "a");
		tuples.apply(Operator.XOR);
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
		assertThrows(EvaluationException.class, () -> driver.printTable(names(1), tuples, "a ^", out));
		assertEquals(0, bytes.size());
	}

	@Test
	public void testUnsupportedLimit() {
		assertThrows(IllegalArgumentException.class, () -> new TableDriver(new TruthEvaluator(1), 'T', 'F', 31));
	}
}
