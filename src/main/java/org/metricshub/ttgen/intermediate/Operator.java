package org.metricshub.ttgen.intermediate;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The closed set of binary operators.
 * <p>
 * All binary operators share a single precedence level and associate to the
 * left. Unary NOT is not an operator of this table: it binds tighter than any
 * of them and is handled by its own token and opcode.
 */
public enum Operator {
	OR("|") {
		@Override
		public boolean apply(boolean a, boolean b) {
			return a || b;
		}
	},
	AND("&") {
		@Override
		public boolean apply(boolean a, boolean b) {
			return a && b;
		}
	},
	XOR("^") {
		@Override
		public boolean apply(boolean a, boolean b) {
			return a != b;
		}
	},
	NAND(null) {
		@Override
		public boolean apply(boolean a, boolean b) {
			return !(a && b);
		}
	},
	NOR(null) {
		@Override
		public boolean apply(boolean a, boolean b) {
			return !(a || b);
		}
	},
	IMPLIES("->", "IMP") {
		@Override
		public boolean apply(boolean a, boolean b) {
			return !a || b;
		}
	},
	EQUIV("=", "EQU") {
		@Override
		public boolean apply(boolean a, boolean b) {
			return a == b;
		}
	};

	/** Arity shared by every operator of this table. */
	public static final int ARITY = 2;

	/**
	 * Contains a mapping of upper-cased operator words (canonical names and
	 * short aliases) to their operator.
	 */
	private static final Map<String, Operator> WORDS = new HashMap<String, Operator>();

	/** Symbolic spellings, longest first so that a scan can stop at the first hit. */
	private static final List<Operator> SYMBOLIC;

	static {
		List<Operator> symbolic = new ArrayList<Operator>();
		for (Operator operator : values()) {
			WORDS.put(operator.name(), operator);
			if (operator.alias != null) {
				WORDS.put(operator.alias, operator);
			}
			if (operator.symbol != null) {
				symbolic.add(operator);
			}
		}
		symbolic.sort(Comparator.comparingInt((Operator o) -> o.symbol.length()).reversed());
		SYMBOLIC = Collections.unmodifiableList(symbolic);
	}

	private final String symbol;
	private final String alias;

	Operator(String symbol) {
		this(symbol, null);
	}

	Operator(String symbol, String alias) {
		this.symbol = symbol;
		this.alias = alias;
	}

	/**
	 * Computes this operator's truth rule.
	 *
	 * @param a left operand
	 * @param b right operand
	 * @return the result
	 */
	public abstract boolean apply(boolean a, boolean b);

	/**
	 * @return the symbolic short form, or {@code null} when the operator only
	 *         has a word spelling
	 */
	public String getSymbol() {
		return symbol;
	}

	/**
	 * Case-insensitive lookup of an operator word. Only ASCII letters are
	 * folded, so that no other character can turn into an operator name.
	 *
	 * @param word the word to look up
	 * @return the operator, or {@code null} if the word is not an operator name
	 */
	public static Operator fromWord(String word) {
		return WORDS.get(asciiUpperCase(word));
	}

	static String asciiUpperCase(String word) {
		char[] chars = word.toCharArray();
		for (int i = 0; i < chars.length; i++) {
			if (chars[i] >= 'a' && chars[i] <= 'z') {
				chars[i] = (char) (chars[i] - ('a' - 'A'));
			}
		}
		return new String(chars);
	}

	/**
	 * Finds the longest symbolic operator spelling starting at {@code offset}.
	 *
	 * @param text the text to scan
	 * @param offset where the symbol must start
	 * @return the operator, or {@code null} if no symbol starts there
	 */
	public static Operator matchSymbol(CharSequence text, int offset) {
		for (Operator operator : SYMBOLIC) {
			String s = operator.symbol;
			if (offset + s.length() <= text.length()
					&& s.contentEquals(text.subSequence(offset, offset + s.length()))) {
				return operator;
			}
		}
		return null;
	}
}
