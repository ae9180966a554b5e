package org.metricshub.jdynamo.frontend;

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
 * A resolved source location: file name, 1-based line and 1-based column.
 * A line of 0 means the location is unknown, only the file is.
 */
public final class Position {

	private final String filename;
	private final int line;
	private final int column;

	public Position(String filename, int line, int column) {
		this.filename = filename;
		this.line = line;
		this.column = column;
	}

	public String getFilename() {
		return filename;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean isValid() {
		return line > 0;
	}

	/**
	 * Renders <code>file:line:column</code>, or only the file name when the
	 * location is unknown.
	 */
	@Override
	public String toString() {
		String s = filename == null || filename.isEmpty() ? "-" : filename;
		if (isValid()) {
			s = s + ":" + line + ":" + column;
		}
		return s;
	}
}
