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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.ttgen.VariableCapacityException;

/**
 * Assigns dense ids, in first-seen order, to variable names.
 * <p>
 * Variable names are case-sensitive. Id {@code k} is also the bit position of
 * the variable in a truth assignment, and the column of the variable in the
 * printed table.
 */
public class VariableRegistry {

	private final int capacity;

	private final List<String> names = new ArrayList<String>();
	private final Map<String, Integer> ids = new HashMap<String, Integer>();

	/**
	 * @param capacity maximum number of distinct names
	 */
	public VariableRegistry(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
	}

	/**
	 * Returns the id of the given name, registering it if necessary.
	 *
	 * @param name variable name
	 * @return the id of the variable
	 * @throws VariableCapacityException if the name is new and the registry is full
	 */
	public int lookupOrInsert(String name) {
		Integer id = ids.get(name);
		if (id != null) {
			return id;
		}
		if (names.size() == capacity) {
			throw new VariableCapacityException(capacity, name);
		}
		int newId = names.size();
		names.add(name);
		ids.put(name, newId);
		return newId;
	}

	/**
	 * @param name variable name
	 * @return the id of the variable, or {@code -1} if not registered
	 */
	public int lookup(String name) {
		Integer id = ids.get(name);
		return id == null ? -1 : id;
	}

	public String getName(int id) {
		return names.get(id);
	}

	/**
	 * @return the registered names, in id order
	 */
	public List<String> getNames() {
		return Collections.unmodifiableList(names);
	}

	public int size() {
		return names.size();
	}

	public int getCapacity() {
		return capacity;
	}

	/** Releases every id. */
	public void clear() {
		names.clear();
		ids.clear();
	}

	/**
	 * Clears this registry, then registers the given names in order.
	 *
	 * @param orderedNames names that receive ids 0, 1, ...
	 */
	public void reset(List<String> orderedNames) {
		clear();
		for (String name : orderedNames) {
			lookupOrInsert(name);
		}
	}
}
