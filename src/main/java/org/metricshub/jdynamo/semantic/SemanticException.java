package org.metricshub.jdynamo.semantic;

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

/**
 * A model that parsed but cannot be given a meaning, such as a timespec
 * parameter that is not a constant.
 */
public class SemanticException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int offset;

	/**
	 * @param msg description of the problem
	 */
	public SemanticException(String msg) {
		this(-1, msg, null);
	}

	/**
	 * @param offset source offset of the offending node, or -1
	 * @param msg description of the problem
	 * @param cause underlying cause, may be {@code null}
	 */
	public SemanticException(int offset, String msg, Throwable cause) {
		super(msg, cause);
		this.offset = offset;
	}

	/**
	 * Returns the source offset associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending offset or {@code -1}
	 */
	public int getOffset() {
		return offset;
	}
}
