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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jdynamo.util.DynamoCompileSettings;
import org.metricshub.jdynamo.util.DynamoLogger;
import org.slf4j.Logger;

/**
 * Turns the text of a DYNAMO model into {@link Token}s, one at a time.
 * <p>
 * The scanner is a state machine: {@link #next()} steps the current
 * {@link State} until at least one token is queued. Statement terminators are
 * inserted automatically when a line ends right after a value-like token
 * (see {@link TokenKind#endsStatement()}), so model lines do not need an
 * explicit <code>;</code>.
 * <p>
 * Malformed input never throws: the error is recorded in the
 * {@link Diagnostics}, printed with the offending line and a caret to the
 * configured error stream, and the stream ends with {@link TokenKind#EOF}.
 */
public class Scanner {

	private static final Logger LOG = DynamoLogger.getLogger(Scanner.class);

	private static final int EOF_CHAR = -1;

	private static final String OPERATORS = ",+-*/|&=(){}[]:";

	private static final Set<String> KEYWORDS = new HashSet<String>();

	static {
		KEYWORDS.add("kind");
		KEYWORDS.add("import");
		KEYWORDS.add("package");
		KEYWORDS.add("model");
		KEYWORDS.add("interface");
		KEYWORDS.add("specializes");
	}

	/** Scanner states. */
	enum State {
		BEGIN,
		STATEMENT,
		COMMENT,
		BLOCK_COMMENT,
		KIND_DECL,
		LITERAL,
		NUMBER,
		IDENTIFIER,
		OPERATOR,
		DONE
	}

	private final SourceFile file;
	private final String s;
	private final Diagnostics diagnostics;
	private final PrintStream errorStream;
	private final int tabWidth;

	// at most two tokens are queued by a single step
	private final Deque<Token> pending = new ArrayDeque<Token>(2);

	private State state = State.BEGIN;
	private int pos;
	private int start;
	private boolean semi;
	private boolean failed;
	private Token eof;

	/**
	 * <p>
	 * Constructor for Scanner.
	 * </p>
	 *
	 * @param file the model to scan
	 * @param diagnostics where fatal scan errors are recorded
	 * @param settings error stream and tab width used to print fatal errors
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the diagnostics buffer is shared with the parser on purpose")
	public Scanner(SourceFile file, Diagnostics diagnostics, DynamoCompileSettings settings) {
		this.file = file;
		this.s = file.getContent();
		this.diagnostics = diagnostics;
		this.errorStream = settings.getErrorStream();
		this.tabWidth = settings.getTabWidth();
	}

	/**
	 * Produces the next token. Once {@link TokenKind#EOF} has been returned,
	 * every further call returns it again.
	 *
	 * @return the next token, never {@code null}
	 */
	public Token next() {
		while (pending.isEmpty()) {
			if (state == State.DONE) {
				return eof;
			}
			state = step(state);
		}
		return pending.poll();
	}

	/**
	 * Scans the whole input.
	 *
	 * @return every token, the final {@link TokenKind#EOF} included
	 */
	public List<Token> scanAll() {
		List<Token> tokens = new ArrayList<Token>();
		Token tok;
		do {
			tok = next();
			tokens.add(tok);
		} while (tok.getKind() != TokenKind.EOF);
		return tokens;
	}

	/**
	 * Whether the scan stopped on a fatal error.
	 *
	 * @return {@code true} if the input could not be scanned to its end
	 */
	public boolean isFailed() {
		return failed;
	}

	private State step(State current) {
		switch (current) {
		case BEGIN:
			return begin();
		case STATEMENT:
			return statement();
		case COMMENT:
			return comment();
		case BLOCK_COMMENT:
			return blockComment();
		case KIND_DECL:
			return delimited('`', TokenKind.KIND_DECL, "unterminated kind declaration");
		case LITERAL:
			return delimited('"', TokenKind.LITERAL, "unterminated literal");
		case NUMBER:
			return number();
		case IDENTIFIER:
			return identifier();
		case OPERATOR:
			return operator();
		default:
			throw new IllegalStateException("no transition out of " + current);
		}
	}

	private State begin() {
		int c = peek();
		if (c != '*') {
			return fatal(0, "programs must begin with a '*', not %s", describe(c));
		}
		pos++;
		// the title line is a comment
		return State.COMMENT;
	}

	private State statement() {
		start = pos;
		int c = peek();
		if (c == EOF_CHAR) {
			if (semi) {
				emit(TokenKind.TERMINATOR);
			}
			emit(TokenKind.EOF);
			eof = pending.peekLast();
			return State.DONE;
		}
		if (c == '/') {
			int after = peekAt(pos + 1);
			if (after == '/') {
				pos += 2;
				return State.COMMENT;
			}
			if (after == '*') {
				pos += 2;
				return State.BLOCK_COMMENT;
			}
			return State.OPERATOR;
		}
		if (c == '`') {
			return State.KIND_DECL;
		}
		if (c == ';') {
			pos++;
			emit(TokenKind.TERMINATOR);
			return State.STATEMENT;
		}
		if (isSpace(c)) {
			pos++;
			if (c == '\n' && semi) {
				emit(TokenKind.TERMINATOR);
			}
			return State.STATEMENT;
		}
		if (isDigit(c) || c == '.') {
			return State.NUMBER;
		}
		if (c == '"') {
			return State.LITERAL;
		}
		if (isOperator(c)) {
			return State.OPERATOR;
		}
		if (isIdentifierStart(c)) {
			return State.IDENTIFIER;
		}
		return fatal(pos, "unrecognized character %s", describe(c));
	}

	private State comment() {
		// the newline is left for STATEMENT, it may end a statement
		while (peek() != EOF_CHAR && peek() != '\n') {
			pos++;
		}
		return State.STATEMENT;
	}

	private State blockComment() {
		while (peek() != EOF_CHAR) {
			if (peek() == '*' && peekAt(pos + 1) == '/') {
				pos += 2;
				return State.STATEMENT;
			}
			pos++;
		}
		return State.STATEMENT;
	}

	private State delimited(char delim, TokenKind kind, String unterminated) {
		int open = pos;
		pos++;
		start = pos;
		while (peek() != EOF_CHAR && peek() != delim) {
			pos++;
		}
		if (peek() != delim) {
			return fatal(open, unterminated);
		}
		emit(kind);
		pos++;
		return State.STATEMENT;
	}

	private State number() {
		acceptDigits();
		if (peek() == '.') {
			pos++;
			acceptDigits();
		}
		if (peek() == 'e' || peek() == 'E') {
			pos++;
			if (peek() == '+' || peek() == '-') {
				pos++;
			}
			acceptDigits();
		}
		emit(TokenKind.NUMBER);
		return State.STATEMENT;
	}

	private State identifier() {
		while (peek() != EOF_CHAR && isIdentifierPart(peek())) {
			pos++;
		}
		if (KEYWORDS.contains(s.substring(start, pos))) {
			emit(TokenKind.KEYWORD);
		} else {
			emit(TokenKind.IDENTIFIER);
		}
		return State.STATEMENT;
	}

	private State operator() {
		TokenKind kind;
		switch (s.charAt(pos)) {
		case '{':
			kind = TokenKind.LBRACKET;
			break;
		case '}':
			kind = TokenKind.RBRACKET;
			break;
		case '(':
			kind = TokenKind.LPAREN;
			break;
		case ')':
			kind = TokenKind.RPAREN;
			break;
		case '[':
			kind = TokenKind.LSQUARE;
			break;
		case ']':
			kind = TokenKind.RSQUARE;
			break;
		default:
			kind = TokenKind.OPERATOR;
		}
		pos++;
		emit(kind);
		return State.STATEMENT;
	}

	private void emit(TokenKind kind) {
		pending.add(new Token(start, s.substring(start, pos), kind));
		start = pos;
		semi = kind.endsStatement();
	}

	private State fatal(int offset, String format, Object... args) {
		String message = String.format(format, args);
		diagnostics.error(offset, "%s", message);
		LOG.debug("fatal scan error in {} at offset {}: {}", file.getName(), offset, message);

		Position p = file.position(offset);
		errorStream.print(p + ": error: " + message + "\n");
		errorStream.print(file.excerpt(p, tabWidth));

		failed = true;
		start = pos;
		semi = false;
		pending.add(new Token(offset, "", TokenKind.EOF));
		eof = pending.peekLast();
		return State.DONE;
	}

	private void acceptDigits() {
		while (isDigit(peek())) {
			pos++;
		}
	}

	private int peek() {
		return peekAt(pos);
	}

	private int peekAt(int index) {
		return index < s.length() ? s.charAt(index) : EOF_CHAR;
	}

	private static String describe(int c) {
		if (c == EOF_CHAR) {
			return "end of input";
		}
		return String.format("U+%04X '%c'", c, c);
	}

	/**
	 * Whitespace in the Unicode sense, no-break spaces included.
	 */
	private static boolean isSpace(int c) {
		return c != EOF_CHAR && (Character.isWhitespace(c) || Character.isSpaceChar(c));
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	static boolean isOperator(int c) {
		return c != EOF_CHAR && OPERATORS.indexOf(c) >= 0;
	}

	private static boolean isIdentifierStart(int c) {
		return !(isDigit(c) || isSpace(c) || isOperator(c) || Character.isISOControl(c));
	}

	private static boolean isIdentifierPart(int c) {
		return !(isSpace(c) || isOperator(c) || c == ';' || Character.isISOControl(c));
	}
}
