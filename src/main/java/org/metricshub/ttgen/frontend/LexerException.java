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

import org.metricshub.ttgen.ErrorKind;
import org.metricshub.ttgen.TtgenException;

/**
 * Thrown when a line contains a character that cannot start any token.
 */
public class LexerException extends TtgenException {

	private static final long serialVersionUID = 1L;

	private final int codePoint;
	private final int column;

	/**
	 * @param codePoint the offending character
	 * @param column 0-based offset of the character in its line
	 */
	public LexerException(int codePoint, int column) {
		super(ErrorKind.UNEXPECTED_CHARACTER, "unexpected character '" + new String(Character.toChars(codePoint)) + "'");
		this.codePoint = codePoint;
		this.column = column;
	}

	/**
	 * @return the Unicode code point of the offending character
	 */
	public int getCodePoint() {
		return codePoint;
	}

	public int getColumn() {
		return column;
	}
}
