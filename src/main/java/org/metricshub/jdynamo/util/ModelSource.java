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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one DYNAMO model content source.
 * This is usually either a string handed over by the caller,
 * or a model file given as a path with a "-f" command line switch.
 * <p>
 * The description is only used to label diagnostics.
 */
public class ModelSource {

	/** Constant <code>DESCRIPTION_COMMAND_LINE_MODEL="&lt;command-line-supplied-model&gt;"</code> */
	public static final String DESCRIPTION_COMMAND_LINE_MODEL = "<command-line-supplied-model>";

	private String description;
	private Reader reader;

	/**
	 * <p>
	 * Constructor for ModelSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public ModelSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source that serves the given text.
	 *
	 * @param description name used in diagnostics
	 * @param content the model text
	 * @return a new {@link ModelSource}
	 */
	public static ModelSource of(String description, String content) {
		return new ModelSource(description, new StringReader(content));
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the model contents.
	 *
	 * @return The reader which contains the model contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole content of this source.
	 *
	 * @return the model text
	 * @throws IOException if the underlying reader fails
	 */
	public String readContent() throws IOException {
		StringBuilder content = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader r = getReader()) {
			int n;
			while ((n = r.read(buffer)) >= 0) {
				content.append(buffer, 0, n);
			}
		}
		return content.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
