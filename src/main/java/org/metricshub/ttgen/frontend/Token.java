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
 * One token of an input line, as returned by {@link ExpressionLexer}.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final Operator operator;
	private final int column;

	Token(TokenKind kind, String text, int column) {
		this(kind, text, null, column);
	}

	Token(TokenKind kind, String text, Operator operator, int column) {
		assert (kind == TokenKind.OPERATOR) == (operator != null);
		this.kind = kind;
		this.text = text;
		this.operator = operator;
		this.column = column;
	}

	public TokenKind getKind() {
		return kind;
	}

	/**
	 * @return the matched text; empty for {@link TokenKind#EOF}
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the resolved operator, or {@code null} unless the kind is
	 *         {@link TokenKind#OPERATOR}
	 */
	public Operator getOperator() {
		return operator;
	}

	/**
	 * @return 0-based offset of the token in its line
	 */
	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return kind == TokenKind.EOF ? kind.name() : kind + "(" + text + ")";
	}
}
