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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of the model front end.
 * <p>
 * Nothing is logged above debug: problems in a model are reported through
 * the diagnostics, never through the log. The loggers in use are:
 * <ul>
 * <li>{@code frontend.Scanner}: fatal scan errors (debug)</li>
 * <li>{@code frontend.DynamoParser}: parse summary (debug), discarded tokens
 * (trace)</li>
 * <li>{@code semantic.TimespecExtractor}: the resolved timespec (debug)</li>
 * <li>{@code Cli}: the effective settings (debug)</li>
 * </ul>
 * SLF4J's own initialization chatter is kept at WARN unless the property is
 * already set.
 */
public final class DynamoLogger {

	static final String VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(VERBOSITY_PROPERTY) == null) {
			System.setProperty(VERBOSITY_PROPERTY, "WARN");
		}
	}

	private DynamoLogger() {}

	/**
	 * @param clazz front-end class the logger is named after
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
