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

import org.metricshub.ttgen.intermediate.Operator;

/**
 * Splits one input line into tokens.
 * <p>
 * Recognized, in priority order:
 * <ol>
 * <li>{@code (} and {@code )}
 * <li>the variable order marker {@code /}
 * <li>{@code !} and the symbolic operators ({@code | & ^ -> =}), longest match first
 * <li>words made of ASCII letters, digits, {@code _} and {@code '}: {@code NOT}, an
 * operator name (case-insensitive) or else a variable name
 * </ol>
 * Anything else produces an {@link TokenKind#UNKNOWN} token holding the
 * offending character, a surrogate pair included. The lexer itself never fails: it is up to the parser to
 * reject unknown tokens.
 */
public class ExpressionLexer {

	/** The word spelling of unary negation. */
	public static final String NOT_WORD = "NOT";

	private final String line;
	private int c;

	/**
	 * @param line the line to tokenize, with or without its line terminator
	 */
	public ExpressionLexer(String line) {
		this.line = line;
		this.c = 0;
	}

	/**
	 * Skip spaces, tabs and line terminators
	 */
	private void skipWhitespaces() {
		while (c < line.length()) {
			char ch = line.charAt(c);
			if (ch != ' ' && ch != '\t' && ch != '\n' && ch != '\r') {
				break;
			}
			c++;
		}
	}

	private static boolean isWordChar(char ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9') || ch == '_' || ch == '\'';
	}

	/**
	 * Returns the next token. Once the end of the line is reached, every call
	 * returns an {@link TokenKind#EOF} token.
	 *
	 * @return the next token, never {@code null}
	 */
	public Token nextToken() {
		skipWhitespaces();
		int start = c;
		if (c >= line.length()) {
			return new Token(TokenKind.EOF, "", start);
		}
		char ch = line.charAt(c);
		if (ch == '(') {
			c++;
			return new Token(TokenKind.OPEN_PAREN, "(", start);
		}
		if (ch == ')') {
			c++;
			return new Token(TokenKind.CLOSE_PAREN, ")", start);
		}
		if (ch == '/') {
			c++;
			return new Token(TokenKind.ORDER_MARKER, "/", start);
		}
		if (ch == '!') {
			c++;
			return new Token(TokenKind.NOT, "!", start);
		}
		Operator symbolic = Operator.matchSymbol(line, c);
		if (symbolic != null) {
			c += symbolic.getSymbol().length();
			return new Token(TokenKind.OPERATOR, symbolic.getSymbol(), symbolic, start);
		}

		while (c < line.length() && isWordChar(line.charAt(c))) {
			c++;
		}
		if (c == start) {
			// not a valid operator or variable name
			c += Character.charCount(line.codePointAt(c));
			return new Token(TokenKind.UNKNOWN, line.substring(start, c), start);
		}

		String word = line.substring(start, c);
		if (NOT_WORD.equalsIgnoreCase(word)) {
			return new Token(TokenKind.NOT, word, start);
		}
		Operator operator = Operator.fromWord(word);
		if (operator != null) {
			return new Token(TokenKind.OPERATOR, word, operator, start);
		}
		// only remaining possibility is a variable
		return new Token(TokenKind.VARIABLE, word, start);
	}
}
