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
 * A run of consecutive characters of the model source, classified by kind.
 * The text is the exact slice of the source starting at {@link #getOffset()}.
 */
public final class Token {

	private final int offset;
	private final String text;
	private final TokenKind kind;

	public Token(int offset, String text, TokenKind kind) {
		this.offset = offset;
		this.text = text;
		this.kind = kind;
	}

	/**
	 * @return zero-based character offset of the first character of this token
	 */
	public int getOffset() {
		return offset;
	}

	public String getText() {
		return text;
	}

	public TokenKind getKind() {
		return kind;
	}

	/**
	 * @param kindParam kind to check
	 * @param textParam text to check
	 * @return whether this token is of the given kind and spelled exactly as given
	 */
	public boolean is(TokenKind kindParam, String textParam) {
		return kind == kindParam && text.equals(textParam);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		String val = kind == TokenKind.TERMINATOR ? ";" : text;
		return "(" + kind + " " + val + ")";
	}
}
