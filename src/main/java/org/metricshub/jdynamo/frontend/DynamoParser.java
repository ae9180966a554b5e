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
import java.util.Locale;
import org.metricshub.jdynamo.frontend.ast.AssignStmt;
import org.metricshub.jdynamo.frontend.ast.BasicLit;
import org.metricshub.jdynamo.frontend.ast.DynamoFile;
import org.metricshub.jdynamo.frontend.ast.Expr;
import org.metricshub.jdynamo.frontend.ast.Ident;
import org.metricshub.jdynamo.frontend.ast.LiteralKind;
import org.metricshub.jdynamo.frontend.ast.ModelDecl;
import org.metricshub.jdynamo.frontend.ast.Role;
import org.metricshub.jdynamo.frontend.ast.Stmt;
import org.metricshub.jdynamo.frontend.ast.TableFwdExpr;
import org.metricshub.jdynamo.frontend.ast.VarDecl;
import org.metricshub.jdynamo.semantic.SemanticException;
import org.metricshub.jdynamo.semantic.TimespecExtractor;
import org.metricshub.jdynamo.util.DynamoCompileSettings;
import org.metricshub.jdynamo.util.DynamoLogger;
import org.slf4j.Logger;

/**
 * Converts a DYNAMO model into a syntax tree.
 * <p>
 * The grammar, with case-insensitive type tags:
 *
 * <pre>
 * MODEL     : { STATEMENT | ';' }
 * STATEMENT : TYPE_TAG ID '=' RHS TERMINATOR
 * TYPE_TAG  : 'L' | 'N' | 'C' | 'R' | 'A' | 'T'
 * RHS       : NUMBER          (L, N, C, R, A)
 *           | TABLE_DEF       (T)
 * TABLE_DEF : NUMBER { '/' NUMBER }
 * </pre>
 *
 * Errors never stop the parse. They are recorded in the {@link Diagnostics}
 * and the rest of the failing statement is discarded, up to its terminator or
 * to the end of its line. A model line that does not start with a one-letter
 * identifier ends the model instead.
 * <p>
 * When the model parsed cleanly, {@link TimespecExtractor} runs on it.
 */
public class DynamoParser {

	private static final Logger LOG = DynamoLogger.getLogger(DynamoParser.class);

	private final SourceFile file;
	private final DynamoCompileSettings settings;
	private final Diagnostics diagnostics;
	private final TokenCursor lex;

	/** Last consumed token. */
	private Token last;

	/**
	 * <p>
	 * Constructor for DynamoParser.
	 * </p>
	 *
	 * @param file the model to parse
	 * @param settings parse settings
	 */
	public DynamoParser(SourceFile file, DynamoCompileSettings settings) {
		this.file = file;
		this.settings = settings;
		this.diagnostics = new Diagnostics(file);
		this.lex = new TokenCursor(new Scanner(file, diagnostics, settings));
	}

	/**
	 * Parses the whole source. A parser instance parses once.
	 *
	 * @return the tree, with the number of errors and their description
	 */
	public ParseResult parse() {
		Ident name = Ident.of(TimespecExtractor.MAIN_MODEL);
		ModelDecl model = declModel(name);
		DynamoFile result = new DynamoFile(name, Collections.singletonList(model));

		LOG
				.debug(
						"{}: {} statements, {} errors",
						file.getName(),
						model.getBody().size(),
						diagnostics.getErrorCount());
		return new ParseResult(result, diagnostics);
	}

	private ModelDecl declModel(Ident name) {
		List<Stmt> body = new ArrayList<Stmt>();
		outer: while (true) {
			Token tok = lex.peek();
			switch (tok.getKind()) {
			case EOF:
				break outer;
			case TERMINATOR:
				advance();
				continue;
			case IDENTIFIER:
				if (tok.getText().length() == 1) {
					statement(body);
					continue;
				}
				// fall through
			default:
				error(tok, "expected 1 char ident, not '%s'", text(tok));
				break outer;
			}
		}

		ModelDecl model = new ModelDecl(name, body);
		if (settings.isExtractTimespec()
				&& TimespecExtractor.MAIN_MODEL.equals(name.getName())
				&& !diagnostics.hasErrors()) {
			try {
				model = TimespecExtractor.extract(model);
			} catch (SemanticException e) {
				diagnostics.error(e.getOffset(), "extractTimespec: %s", e.getMessage());
			}
		}
		return model;
	}

	private void statement(List<Stmt> body) {
		Token typeTok = advance();
		Role role = Role.forTag(typeTok.getText());
		if (role == null) {
			error(typeTok, "unknown type: %s", typeTok.getText().toUpperCase(Locale.ROOT));
			discardStatement();
			return;
		}

		VarDecl decl = varDecl(role);
		if (decl == null || !consumeEqual()) {
			discardStatement();
			return;
		}

		Expr rhs = role == Role.TABLE ? tableDef() : expr();
		if (rhs == null) {
			discardStatement();
			return;
		}
		// a table definition consumes its own terminator
		if (role != Role.TABLE && !endOfStatement()) {
			discardStatement();
			return;
		}
		body.add(new AssignStmt(decl, rhs));
	}

	private VarDecl varDecl(Role role) {
		Token nameTok = lex.peek();
		if (nameTok.getKind() != TokenKind.IDENTIFIER) {
			error(nameTok, "expected identifier, not '%s'", text(nameTok));
			return null;
		}
		advance();
		return new VarDecl(new Ident(nameTok.getOffset(), nameTok.getText()), role);
	}

	private boolean consumeEqual() {
		Token tok = lex.peek();
		if (!tok.is(TokenKind.OPERATOR, "=")) {
			error(tok, "expected '=', not '%s'", text(tok));
			return false;
		}
		advance();
		return true;
	}

	private Expr expr() {
		Token tok = lex.peek();
		if (tok.getKind() != TokenKind.NUMBER) {
			error(tok, "expected number, not '%s'", text(tok));
			return null;
		}
		advance();
		return floatLit(tok);
	}

	private Expr tableDef() {
		List<BasicLit> ys = new ArrayList<BasicLit>();
		while (true) {
			Token tok = lex.peek();
			if (tok.getKind() != TokenKind.NUMBER) {
				error(tok, "expected float literal in table def, not '%s'", text(tok));
				return null;
			}
			advance();
			ys.add(floatLit(tok));

			Token sep = lex.peek();
			if (sep.is(TokenKind.OPERATOR, "/")) {
				advance();
			} else if (sep.getKind() == TokenKind.TERMINATOR) {
				advance();
				break;
			} else if (sep.getKind() == TokenKind.EOF) {
				break;
			} else {
				error(sep, "expected '/' in table def, not '%s'", text(sep));
				return null;
			}
		}
		return new TableFwdExpr(ys);
	}

	private boolean endOfStatement() {
		Token tok = lex.peek();
		if (tok.getKind() == TokenKind.TERMINATOR) {
			advance();
			return true;
		}
		if (tok.getKind() == TokenKind.EOF) {
			return true;
		}
		error(tok, "expected end of statement, not '%s'", text(tok));
		return false;
	}

	/**
	 * Discards the rest of a failed statement: everything up to and including
	 * the next terminator, stopping early at the end of input or before a
	 * token on a later line than the last consumed one.
	 */
	private void discardStatement() {
		int line = line(last);
		while (true) {
			Token tok = lex.peek();
			if (tok.getKind() == TokenKind.EOF) {
				return;
			}
			if (tok.getKind() == TokenKind.TERMINATOR) {
				advance();
				return;
			}
			if (line(tok) > line) {
				return;
			}
			LOG.trace("discard: {}", tok);
			advance();
		}
	}

	private Token advance() {
		last = lex.next();
		return last;
	}

	private int line(Token tok) {
		return file.position(tok.getOffset()).getLine();
	}

	private void error(Token tok, String format, Object... args) {
		diagnostics.error(tok.getOffset(), format, args);
	}

	private static BasicLit floatLit(Token tok) {
		return new BasicLit(tok.getOffset(), LiteralKind.FLOAT, tok.getText());
	}

	private static String text(Token tok) {
		switch (tok.getKind()) {
		case EOF:
			return "EOF";
		case TERMINATOR:
			return ";";
		default:
			return tok.getText();
		}
	}
}
