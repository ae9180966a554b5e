package org.metricshub.jdynamo;

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
 * Thrown when a model has scan, syntax or semantic errors. The message is
 * the concatenation of every diagnostic line, in the order they were found.
 */
public class DynamoParseException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int errorCount;
	private final List<String> diagnostics;

	/**
	 * @param diagnostics the <code>position: message</code> lines, at least one
	 */
	public DynamoParseException(List<String> diagnostics) {
		super(join(diagnostics));
		this.errorCount = diagnostics.size();
		this.diagnostics = Collections.unmodifiableList(new ArrayList<String>(diagnostics));
	}

	public int getErrorCount() {
		return errorCount;
	}

	public List<String> getDiagnostics() {
		return diagnostics;
	}

	private static String join(List<String> lines) {
		StringBuilder sb = new StringBuilder();
		for (String line : lines) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}
}
