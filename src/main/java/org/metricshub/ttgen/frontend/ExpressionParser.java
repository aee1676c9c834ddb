package org.metricshub.ttgen.frontend;

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

import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.ttgen.ErrorKind;
import org.metricshub.ttgen.intermediate.PostfixTuples;
import org.metricshub.ttgen.intermediate.VariableRegistry;
import org.metricshub.ttgen.util.TtgenLogger;
import org.slf4j.Logger;

/**
 * Converts one input line into a postfix program, using the two-stack
 * (shunting-yard) technique.
 * <p>
 * Grammar:
 * <ul>
 * <li>All binary operators have the same precedence and associate to the left:
 * {@code A OR B AND C} is {@code (A OR B) AND C}.
 * <li>{@code NOT} (or {@code !}) binds tighter than any binary operator and
 * applies to the primary that follows it: {@code NOT A AND B} is
 * {@code (NOT A) AND B}.
 * <li>Parentheses override the above.
 * </ul>
 * A line whose first token is the order marker {@code /} is a variable order
 * directive instead: the registry is cleared, then every following variable
 * name is registered in turn.
 * <p>
 * Operands and binary operators must alternate: a variable, {@code NOT} or
 * {@code (} is only accepted where an operand is expected, a binary operator
 * or {@code )} only after a complete operand, and the line must end after an
 * operand. Anything else ({@code A B}, {@code A AND}, {@code A B AND},
 * {@code AND A B}, {@code A NOT}, {@code ()}) is a syntax error.
 */
public class ExpressionParser {

	private static final Logger LOG = TtgenLogger.getLogger(ExpressionParser.class);

	private final int stackCapacity;

	private ExpressionLexer lexer;
	private Token token;

	/**
	 * @param stackCapacity maximum number of pending operators and parentheses
	 */
	public ExpressionParser(int stackCapacity) {
		if (stackCapacity < 1) {
			throw new IllegalArgumentException("stack capacity must be positive: " + stackCapacity);
		}
		this.stackCapacity = stackCapacity;
	}

	/**
	 * Reads the next token into {@link #token}, rejecting unknown characters.
	 */
	private Token lexer() {
		token = lexer.nextToken();
		if (token.getKind() == TokenKind.UNKNOWN) {
			throw new LexerException(token.getText().codePointAt(0), token.getColumn());
		}
		LOG.trace("token {}", token);
		return token;
	}

	/**
	 * Parses one line.
	 *
	 * @param line the input line
	 * @param registry registry that resolves variable names to ids; it is
	 *        cleared and repopulated when the line is a directive
	 * @return the parsed line
	 * @throws LexerException on a character that cannot start a token
	 * @throws ParserException on a syntax error, mismatched parentheses, a
	 *         misplaced order marker, a non-variable in a directive, or a full
	 *         operator stack
	 * @throws org.metricshub.ttgen.VariableCapacityException if the registry is full
	 */
	public ParsedLine parse(String line, VariableRegistry registry) {
		String source = line.trim();
		lexer = new ExpressionLexer(line);
		lexer();
		if (token.getKind() == TokenKind.EOF) {
			return ParsedLine.blank(source);
		}
		if (token.getKind() == TokenKind.ORDER_MARKER) {
			return DIRECTIVE(source, registry);
		}
		return EXPRESSION(source, registry);
	}

	// / name name ...
	private ParsedLine DIRECTIVE(String source, VariableRegistry registry) {
		registry.clear();
		while (lexer().getKind() != TokenKind.EOF) {
			if (token.getKind() != TokenKind.VARIABLE) {
				throw new ParserException(
						ErrorKind.NON_VARIABLE_IN_ORDER_DIRECTIVE,
						"non-variable \"" + token.getText() + "\" in variable order directive");
			}
			registry.lookupOrInsert(token.getText());
		}
		LOG.debug("Variable order declared: {}", registry.getNames());
		return ParsedLine.directive(source, registry.getNames());
	}

	private ParsedLine EXPRESSION(String source, VariableRegistry registry) {
		PostfixTuples tuples = new PostfixTuples();
		Deque<Token> stack = new ArrayDeque<Token>();
		boolean expectOperand = true;

		for (; token.getKind() != TokenKind.EOF; lexer()) {
			switch (token.getKind()) {
			case VARIABLE:
				checkOperandExpected(expectOperand);
				tuples.pushVariable(registry.lookupOrInsert(token.getText()), token.getText());
				expectOperand = false;
				break;
			case OPERATOR:
				checkOperatorExpected(expectOperand);
				// equal precedence, left associative: resolve whatever is pending first
				while (!stack.isEmpty() && isPendingOperator(stack.peek())) {
					output(stack.pop(), tuples);
				}
				push(stack, token);
				expectOperand = true;
				break;
			case NOT:
			case OPEN_PAREN:
				checkOperandExpected(expectOperand);
				push(stack, token);
				break;
			case CLOSE_PAREN:
				checkOperatorExpected(expectOperand);
				while (!stack.isEmpty() && stack.peek().getKind() != TokenKind.OPEN_PAREN) {
					output(stack.pop(), tuples);
				}
				if (stack.isEmpty()) {
					throw new ParserException(ErrorKind.MISMATCHED_PARENTHESES, "mismatched parentheses");
				}
				stack.pop();
				break;
			case ORDER_MARKER:
				throw new ParserException(
						ErrorKind.EMBEDDED_ORDER_MARKER,
						"variable order marker '/' can not be embedded in expressions");
			default:
				throw new Error("Unexpected token " + token);
			}
		}

		if (expectOperand) {
			throw new ParserException(ErrorKind.MALFORMED_EXPRESSION, "syntax error at end of line");
		}
		while (!stack.isEmpty()) {
			if (stack.peek().getKind() == TokenKind.OPEN_PAREN) {
				throw new ParserException(ErrorKind.MISMATCHED_PARENTHESES, "mismatched parentheses");
			}
			output(stack.pop(), tuples);
		}
		return ParsedLine.expression(source, tuples);
	}

	// VARIABLE, NOT or (
	private void checkOperandExpected(boolean expectOperand) {
		if (!expectOperand) {
			throw syntaxError();
		}
	}

	// binary operator or )
	private void checkOperatorExpected(boolean expectOperand) {
		if (expectOperand) {
			throw syntaxError();
		}
	}

	private ParserException syntaxError() {
		return new ParserException(ErrorKind.MALFORMED_EXPRESSION, "syntax error at \"" + token.getText() + "\"");
	}

	private static boolean isPendingOperator(Token t) {
		return t.getKind() == TokenKind.OPERATOR || t.getKind() == TokenKind.NOT;
	}

	private void push(Deque<Token> stack, Token t) {
		if (stack.size() >= stackCapacity) {
			throw new ParserException(ErrorKind.STACK_OVERFLOW, "stack overflow");
		}
		stack.push(t);
	}

	private static void output(Token t, PostfixTuples tuples) {
		if (t.getKind() == TokenKind.OPERATOR) {
			tuples.apply(t.getOperator());
		} else {
			assert t.getKind() == TokenKind.NOT;
			tuples.not();
		}
	}
}
