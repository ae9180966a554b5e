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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered buffer of <code>position: message</code> lines with a running error
 * count. One instance is shared by the scanner and the parser of a single
 * parse; nothing in it is global.
 */
public final class Diagnostics {

	private final SourceFile file;
	private final List<String> lines = new ArrayList<String>();
	private final StringBuilder text = new StringBuilder();

	public Diagnostics(SourceFile file) {
		this.file = file;
	}

	/**
	 * Records an error at a source offset.
	 *
	 * @param offset offset of the offending token, negative if unknown
	 * @param format {@link String#format(String, Object...)} pattern
	 * @param args pattern arguments
	 */
	public void error(int offset, String format, Object... args) {
		String line = file.position(offset) + ": " + String.format(format, args);
		lines.add(line);
		text.append(line).append('\n');
	}

	public int getErrorCount() {
		return lines.size();
	}

	public boolean hasErrors() {
		return !lines.isEmpty();
	}

	/**
	 * @return the recorded lines, in production order
	 */
	public List<String> getLines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * @return all recorded lines, each terminated by a newline
	 */
	public String getText() {
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getText();
	}
}
