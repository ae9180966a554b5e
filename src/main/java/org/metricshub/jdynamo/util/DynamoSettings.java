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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single parse.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jdynamo programmatically, from within Java code.
 */
public class DynamoSettings implements DynamoCompileSettings {

	/** Default width of a tab character in caret lines. */
	public static final int DEFAULT_TAB_WIDTH = 8;

	/**
	 * Where fatal scan errors are printed.
	 * By default, this is {@link System#err}.
	 */
	private PrintStream errorStream = System.err;

	/**
	 * Width of a tab when aligning the caret under an offending column.
	 */
	private int tabWidth = DEFAULT_TAB_WIDTH;

	/**
	 * Whether the timespec pass runs on the <code>main</code> model;
	 * <code>true</code> by default.
	 */
	private boolean extractTimespec = true;

	private boolean dumpSyntaxTree = false;

	private boolean dumpTokens = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("tabWidth = ").append(getTabWidth()).append(newLine);
		desc.append("extractTimespec = ").append(isExtractTimespec()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);
		desc.append("dumpTokens = ").append(isDumpTokens()).append(newLine);

		return desc.toString();
	}

	/** {@inheritDoc} */
	@Override
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	/**
	 * @param errorStream where fatal scan errors are printed
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream errorStream) {
		this.errorStream = errorStream;
	}

	/** {@inheritDoc} */
	@Override
	public int getTabWidth() {
		return tabWidth;
	}

	/**
	 * @param tabWidth width of a tab in caret lines, at least 1
	 */
	public void setTabWidth(int tabWidth) {
		if (tabWidth < 1) {
			throw new IllegalArgumentException("tab width must be positive, not " + tabWidth);
		}
		this.tabWidth = tabWidth;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isExtractTimespec() {
		return extractTimespec;
	}

	public void setExtractTimespec(boolean extractTimespec) {
		this.extractTimespec = extractTimespec;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}
}
