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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.ttgen.intermediate.PostfixTuples;

/**
 * Result of parsing one input line: an expression, a variable order
 * directive, or nothing at all for a blank line.
 */
public final class ParsedLine {

	/** What the line turned out to be. */
	public enum Type {
		EXPRESSION,
		DIRECTIVE,
		BLANK
	}

	private final Type type;
	private final String source;
	private final PostfixTuples tuples;
	private final List<String> declaredOrder;

	private ParsedLine(Type type, String source, PostfixTuples tuples, List<String> declaredOrder) {
		this.type = type;
		this.source = source;
		this.tuples = tuples;
		this.declaredOrder = declaredOrder;
	}

	static ParsedLine expression(String source, PostfixTuples tuples) {
		return new ParsedLine(Type.EXPRESSION, source, tuples, Collections.<String>emptyList());
	}

	static ParsedLine directive(String source, List<String> declaredOrder) {
		return new ParsedLine(
				Type.DIRECTIVE,
				source,
				null,
				Collections.unmodifiableList(new ArrayList<String>(declaredOrder)));
	}

	static ParsedLine blank(String source) {
		return new ParsedLine(Type.BLANK, source, null, Collections.<String>emptyList());
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the line text, trimmed
	 */
	public String getSource() {
		return source;
	}

	/**
	 * @return the postfix program; {@code null} unless this is an expression
	 */
	public PostfixTuples getTuples() {
		return tuples;
	}

	/**
	 * @return the variable names declared by a directive, in order; empty otherwise
	 */
	public List<String> getDeclaredOrder() {
		return declaredOrder;
	}
}
