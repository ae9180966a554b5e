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

/**
 * Lexer token kinds.
 */
public enum TokenKind {
	EOF("eof"),
	IDENTIFIER("ident"),
	NUMBER("num"),
	TERMINATOR("semi"),
	OPERATOR("op"),
	KIND_DECL("kind"),
	KEYWORD("keyword"),
	LITERAL("lit"),
	LBRACKET("lbrac"),
	RBRACKET("rbrac"),
	LPAREN("lparen"),
	RPAREN("rparen"),
	LSQUARE("lsquare"),
	RSQUARE("rsquare");

	private final String shortName;

	TokenKind(String shortName) {
		this.shortName = shortName;
	}

	/**
	 * Whether a newline (or the end of input) directly after a token of this
	 * kind ends the statement.
	 *
	 * @return {@code true} for value-like tokens and closing brackets
	 */
	public boolean endsStatement() {
		switch (this) {
		case IDENTIFIER:
		case NUMBER:
		case KIND_DECL:
		case LITERAL:
		case RBRACKET:
		case RPAREN:
		case RSQUARE:
			return true;
		default:
			return false;
		}
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return shortName;
	}
}
