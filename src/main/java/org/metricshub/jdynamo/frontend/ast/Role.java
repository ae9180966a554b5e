package org.metricshub.jdynamo.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jdynamo
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import java.util.Locale;

/**
 * What a declared variable is to the simulation, given by the one-letter
 * type tag that starts its statement.
 */
public enum Role {
	/** Level, integrated over simulated time. */
	STOCK('L', "stock"),
	/** Initial value of a stock. */
	INITIAL('N', "initial"),
	CONSTANT('C', "const"),
	/** Rate of change of one or more stocks. */
	FLOW('R', "flow"),
	/** Computed within the time step, never integrated. */
	AUXILIARY('A', "aux"),
	/** Lookup table. */
	TABLE('T', "table");

	private final char tag;
	private final String typeName;

	Role(char tag, String typeName) {
		this.tag = tag;
		this.typeName = typeName;
	}

	public char getTag() {
		return tag;
	}

	/**
	 * @return the name code generators know this role by
	 */
	public String getTypeName() {
		return typeName;
	}

	/**
	 * Maps a type tag, in any case, to its role.
	 *
	 * @param tag the tag text
	 * @return the role, or {@code null} if the text is not a type tag
	 */
	public static Role forTag(String tag) {
		if (tag == null || tag.length() != 1) {
			return null;
		}
		char c = tag.toUpperCase(Locale.ROOT).charAt(0);
		for (Role role : values()) {
			if (role.tag == c) {
				return role;
			}
		}
		return null;
	}
}
