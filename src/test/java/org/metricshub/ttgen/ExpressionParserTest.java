package org.metricshub.ttgen;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.ttgen.frontend.ExpressionParser;
import org.metricshub.ttgen.frontend.LexerException;
import org.metricshub.ttgen.frontend.ParsedLine;
import org.metricshub.ttgen.frontend.ParserException;
import org.metricshub.ttgen.intermediate.VariableRegistry;

public class ExpressionParserTest {

	private ExpressionParser parser;
	private VariableRegistry registry;

	@Before
	public void setUp() {
		parser = new ExpressionParser(128);
		registry = new VariableRegistry(64);
	}

	private String postfix(String line) {
		registry.clear();
		ParsedLine parsed = parser.parse(line, registry);
		assertEquals(ParsedLine.Type.EXPRESSION, parsed.getType());
		return parsed.getTuples().toPostfixString(registry);
	}

	@Test
	public void testBinaryOperatorsAreLeftAssociative() {
		assertEquals("A B OR C AND", postfix("A OR B AND C"));
		assertEquals("A B AND C OR", postfix("A AND B OR C"));
		assertEquals("A B IMPLIES C IMPLIES", postfix("A -> B -> C"));
	}

	@Test
	public void testParenthesesOverrideOrder() {
		assertEquals("A B C AND OR", postfix("A OR (B AND C)"));
		assertEquals("A B OR C D XOR AND", postfix("(A | B) & (C ^ D)"));
	}

	@Test
	public void testNotBindsTighterThanBinaryOperators() {
		assertEquals("A NOT B AND", postfix("NOT A AND B"));
		assertEquals("A B NOT AND C OR", postfix("A AND !B OR C"));
		assertEquals("A B AND NOT", postfix("NOT (A AND B)"));
		assertEquals("A NOT NOT", postfix("!!A"));
	}

	@Test
	public void testVariablesGetFirstSeenIds() {
		assertEquals("z a AND z OR", postfix("z AND a OR z"));
		assertEquals(Arrays.asList("z", "a"), registry.getNames());
	}

	@Test
	public void testDirective() {
		registry.lookupOrInsert("stale");
		ParsedLine parsed = parser.parse("/ B A B", registry);
		assertEquals(ParsedLine.Type.DIRECTIVE, parsed.getType());
		assertNull(parsed.getTuples());
		assertEquals(Arrays.asList("B", "A"), parsed.getDeclaredOrder());
		assertEquals(Arrays.asList("B", "A"), registry.getNames());
	}

	@Test
	public void testBlankLine() {
		ParsedLine parsed = parser.parse("   ", registry);
		assertEquals(ParsedLine.Type.BLANK, parsed.getType());
		assertEquals("", parsed.getSource());
		assertNull(parsed.getTuples());

		parsed = parser.parse(" !(x) ", registry);
		assertEquals("!(x)", parsed.getSource());
		assertFalse(parsed.getTuples().isEmpty());
		assertEquals(2, parsed.getTuples().size());
	}

	@Test
	public void testErrors() {
		assertEquals(
				ErrorKind.MISMATCHED_PARENTHESES,
				assertThrows(ParserException.class, () -> parser.parse("(A AND B", registry)).getKind());
		assertEquals(
				ErrorKind.MISMATCHED_PARENTHESES,
				assertThrows(ParserException.class, () -> parser.parse("A AND B)", registry)).getKind());
		assertEquals(
				ErrorKind.EMBEDDED_ORDER_MARKER,
				assertThrows(ParserException.class, () -> parser.parse("A / B", registry)).getKind());
		assertEquals(
				ErrorKind.NON_VARIABLE_IN_ORDER_DIRECTIVE,
				assertThrows(ParserException.class, () -> parser.parse("/ A (", registry)).getKind());
		assertEquals(
				ErrorKind.NON_VARIABLE_IN_ORDER_DIRECTIVE,
				assertThrows(ParserException.class, () -> parser.parse("/ A /", registry)).getKind());

		LexerException lexerException = assertThrows(LexerException.class, () -> parser.parse("A # B", registry));
		assertEquals(ErrorKind.UNEXPECTED_CHARACTER, lexerException.getKind());
		assertEquals('#', lexerException.getCodePoint());
		assertEquals(2, lexerException.getColumn());
	}

	private String syntaxError(String line) {
		ParserException e = assertThrows(ParserException.class, () -> parser.parse(line, registry));
		assertEquals(ErrorKind.MALFORMED_EXPRESSION, e.getKind());
		return e.getMessage();
	}

	@Test
	public void testOperandsAndOperatorsMustAlternate() {
		assertEquals("syntax error at \"B\"", syntaxError("A B AND"));
		assertEquals("syntax error at \"AND\"", syntaxError("AND A B"));
		assertEquals("syntax error at \"NOT\"", syntaxError("A NOT"));
		assertEquals("syntax error at end of line", syntaxError("A AND"));
		assertEquals("syntax error at \"B\"", syntaxError("A B"));
		assertEquals("syntax error at \")\"", syntaxError("()"));
		assertEquals("syntax error at \")\"", syntaxError("A AND ()"));
		assertEquals("syntax error at \"(\"", syntaxError("A (B)"));
		assertEquals("syntax error at \"|\"", syntaxError("A & | B"));
		assertEquals("syntax error at end of line", syntaxError("NOT"));
		assertEquals("A B NOT NOT AND", postfix("A AND NOT !B"));
		assertEquals("A B OR NOT", postfix("!((A) | (B))"));
	}

	@Test
	public void testOperatorStackIsBounded() {
		ExpressionParser small = new ExpressionParser(2);
		assertEquals(ParsedLine.Type.EXPRESSION, small.parse("!!A", registry).getType());
		registry.clear();
		ParserException e = assertThrows(ParserException.class, () -> small.parse("!!!A", registry));
		assertEquals(ErrorKind.STACK_OVERFLOW, e.getKind());
		// pending binary operators are popped before the next one is pushed
		registry.clear();
		assertEquals(ParsedLine.Type.EXPRESSION, small.parse("a & b & c & d & e", registry).getType());
	}

	@Test
	public void testVariableCapacity() {
		VariableRegistry tiny = new VariableRegistry(2);
		VariableCapacityException e = assertThrows(
				VariableCapacityException.class,
				() -> parser.parse("a AND b AND c", tiny));
		assertEquals(ErrorKind.VARIABLE_CAPACITY_EXCEEDED, e.getKind());
		assertTrue(e.getKind().isFatal());
		assertEquals("c", e.getRejectedName());
		assertEquals("maximum of 2 variables", e.getMessage());
	}
}
