package org.metricshub.jdynamo.util;

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

import java.io.PrintStream;

/**
 * Settings used while parsing DYNAMO models.
 */
public interface DynamoCompileSettings {

	/**
	 * @return the stream fatal scan errors are printed to, with their source line and caret
	 */
	PrintStream getErrorStream();

	/**
	 * @return number of columns a tab occupies when the caret line is aligned
	 */
	int getTabWidth();

	/**
	 * @return {@code true} to move TIME, LENGTH, DT and SAVPER into the synthesized timespec
	 */
	boolean isExtractTimespec();

	/**
	 * @return {@code true} to dump the syntax tree
	 */
	boolean isDumpSyntaxTree();

	/**
	 * @return {@code true} to dump the token stream
	 */
	boolean isDumpTokens();
}
