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

import java.util.List;
import org.metricshub.jdynamo.frontend.ast.DynamoFile;

/**
 * What {@link DynamoParser#parse()} produced: the tree and the diagnostics.
 * With a non-zero error count the tree must not be used.
 */
public final class ParseResult {

	private final DynamoFile file;
	private final Diagnostics diagnostics;

	ParseResult(DynamoFile file, Diagnostics diagnostics) {
		this.file = file;
		this.diagnostics = diagnostics;
	}

	/**
	 * @return the tree, possibly partial when {@link #getErrorCount()} is not 0
	 */
	public DynamoFile getFile() {
		return file;
	}

	public int getErrorCount() {
		return diagnostics.getErrorCount();
	}

	public boolean isSuccess() {
		return diagnostics.getErrorCount() == 0;
	}

	/**
	 * @return the <code>position: message</code> lines, in the order they were found
	 */
	public List<String> getDiagnosticLines() {
		return diagnostics.getLines();
	}

	/**
	 * @return all diagnostic lines, each terminated by a newline
	 */
	public String getDiagnostics() {
		return diagnostics.getText();
	}
}
