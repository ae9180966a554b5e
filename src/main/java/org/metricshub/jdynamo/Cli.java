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
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.metricshub.jdynamo.frontend.Token;
import org.metricshub.jdynamo.frontend.ast.DynamoFile;
import org.metricshub.jdynamo.util.DynamoLogger;
import org.metricshub.jdynamo.util.DynamoSettings;
import org.metricshub.jdynamo.util.ModelFileSource;
import org.metricshub.jdynamo.util.ModelSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jdynamo.
 */
public final class Cli {

	private static final Logger LOG = DynamoLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jdynamo.jar";
		}
		JAR_NAME = myName;
	}

	private final DynamoSettings settings = new DynamoSettings();
	private final PrintStream out;

	private ModelSource modelSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream where the syntax tree or tokens are written
	 * @param err stream where fatal scan errors are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link DynamoSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DynamoSettings getSettings() {
		return settings;
	}

	/**
	 * @return the model to parse, {@code null} before {@link #parse(String[])} or when printing usage
	 */
	public ModelSource getModelSource() {
		return modelSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the model file name
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load model from file
				checkParameterHasArgument(args, argIdx);
				setModelSource(new ModelFileSource(args[++argIdx]));
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--dump-tokens")) {
				settings.setDumpTokens(true);
			} else if (arg.equals("--no-timespec")) {
				settings.setExtractTimespec(false);
			} else if (arg.equals("--tab-width")) {
				checkParameterHasArgument(args, argIdx);
				String width = args[++argIdx];
				try {
					settings.setTabWidth(Integer.parseInt(width));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("--tab-width needs a number, not '" + width + "'", e);
				}
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx < args.length) {
			setModelSource(new ModelFileSource(args[argIdx++]));
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
		if (modelSource == null) {
			throw new IllegalArgumentException("Model file not provided.");
		}
		if (!settings.isDumpTokens()) {
			// the tree is what we print unless tokens were asked for
			settings.setDumpSyntaxTree(true);
		}
	}

	private void setModelSource(ModelSource source) {
		if (modelSource != null) {
			throw new IllegalArgumentException("Only one model can be parsed at a time.");
		}
		modelSource = source;
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the model cannot be read
	 * @throws DynamoParseException if the model has errors
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		LOG.debug("settings:\n{}", settings.toDescriptionString());

		Dynamo dynamo = new Dynamo(settings);
		String content = modelSource.readContent();
		if (settings.isDumpTokens()) {
			for (Token tok : dynamo.tokenize(modelSource.getDescription(), content)) {
				out.println(tok);
			}
		}
		if (settings.isDumpSyntaxTree()) {
			DynamoFile file = dynamo.parse(modelSource.getDescription(), content);
			file.dump(out);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [--dump-syntax]" +
								" [--dump-tokens]" +
								" [--no-timespec]" +
								" [--tab-width n]" +
								" [-f model-filename | model-filename]");
		dest.println();
		dest.println(" -f filename = Parse the model in filename.");
		dest.println(" --dump-syntax = Print the syntax tree (default unless --dump-tokens is given).");
		dest.println(" --dump-tokens = Print the token stream.");
		dest.println(" --no-timespec = Keep TIME, LENGTH, DT and SAVPER as ordinary constants.");
		dest.println(" --tab-width n = Columns per tab when pointing at errors (default 8).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments, executes the CLI, and returns the configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the tree or tokens
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if the model cannot be read
	 */
	public static Cli create(String[] args, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (DynamoParseException e) {
			System.err.printf("%d parse errors:\n%s", e.getErrorCount(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
