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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.List;
import org.metricshub.jdynamo.frontend.Diagnostics;
import org.metricshub.jdynamo.frontend.DynamoParser;
import org.metricshub.jdynamo.frontend.ParseResult;
import org.metricshub.jdynamo.frontend.Scanner;
import org.metricshub.jdynamo.frontend.SourceFile;
import org.metricshub.jdynamo.frontend.Token;
import org.metricshub.jdynamo.frontend.ast.DynamoFile;
import org.metricshub.jdynamo.util.DynamoSettings;
import org.metricshub.jdynamo.util.ModelSource;

/**
 * Entry point into the scanning, parsing and timespec extraction of a
 * DYNAMO model.
 * This entry point is used both when Jdynamo is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Scan the model text into tokens, inserting statement terminators at
 * line ends.
 * <li>Parse the tokens into an abstract syntax tree, recovering from
 * malformed statements.
 * <li>Move TIME, LENGTH, DT and SAVPER of the <code>main</code> model into
 * one synthesized <code>timespec</code> assignment.
 * </ul>
 * The resulting {@link DynamoFile} is meant for a code generator.
 * <p>
 * An instance holds no state besides its settings and the last result, so
 * separate instances may parse in parallel.
 */
public class Dynamo {

	private final DynamoSettings settings;

	/**
	 * The last {@link ParseResult}, successful or not.
	 */
	private ParseResult lastResult;

	/**
	 * Create a new instance with default settings.
	 */
	public Dynamo() {
		this(new DynamoSettings());
	}

	/**
	 * @param settings the settings to parse with
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Dynamo(DynamoSettings settings) {
		this.settings = settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DynamoSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the result of the last parse.
	 *
	 * @return the last {@link ParseResult}, or {@code null} if nothing was parsed yet
	 */
	public ParseResult getLastResult() {
		return lastResult;
	}

	/**
	 * Parses a model given as a string.
	 *
	 * @param name name used in diagnostics
	 * @param content the model text
	 * @return the syntax tree
	 * @throws DynamoParseException if the model has errors
	 */
	public DynamoFile parse(String name, String content) {
		ParseResult result = tryParse(name, content);
		if (!result.isSuccess()) {
			throw new DynamoParseException(result.getDiagnosticLines());
		}
		return result.getFile();
	}

	/**
	 * Parses a model given as a string, under the command-line description.
	 *
	 * @param content the model text
	 * @return the syntax tree
	 * @throws DynamoParseException if the model has errors
	 */
	public DynamoFile parse(String content) {
		return parse(ModelSource.DESCRIPTION_COMMAND_LINE_MODEL, content);
	}

	/**
	 * Reads and parses a model source.
	 *
	 * @param source the model
	 * @return the syntax tree
	 * @throws IOException if the source cannot be read
	 * @throws DynamoParseException if the model has errors
	 */
	public DynamoFile parse(ModelSource source) throws IOException {
		return parse(source.getDescription(), source.readContent());
	}

	/**
	 * Parses a model without throwing on errors.
	 *
	 * @param name name used in diagnostics
	 * @param content the model text
	 * @return the tree together with the error count and diagnostics
	 */
	public ParseResult tryParse(String name, String content) {
		DynamoParser parser = new DynamoParser(new SourceFile(name, content), settings);
		lastResult = parser.parse();
		return lastResult;
	}

	/**
	 * Scans a model without parsing it.
	 *
	 * @param name name used in diagnostics
	 * @param content the model text
	 * @return every token, the final EOF included
	 */
	public List<Token> tokenize(String name, String content) {
		SourceFile file = new SourceFile(name, content);
		return new Scanner(file, new Diagnostics(file), settings).scanAll();
	}
}
