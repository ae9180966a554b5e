package org.metricshub.jdynamo.frontend.ast;

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

import java.util.Locale;

/**
 * A literal, kept as the raw text found in the source.
 */
public final class BasicLit extends Expr {

	private final int offset;
	private final LiteralKind literalKind;
	private final String value;

	public BasicLit(int offset, LiteralKind literalKind, String value) {
		this.offset = offset;
		this.literalKind = literalKind;
		this.value = value;
	}

	/**
	 * Creates a synthesized float literal, printed with six decimals.
	 *
	 * @param v the value
	 * @return a new {@link BasicLit} with no source position
	 */
	public static BasicLit ofDouble(double v) {
		return new BasicLit(NO_POS, LiteralKind.FLOAT, String.format(Locale.ROOT, "%f", v));
	}

	public int getOffset() {
		return offset;
	}

	public LiteralKind getLiteralKind() {
		return literalKind;
	}

	/**
	 * @return the literal text, as written
	 */
	public String getValue() {
		return value;
	}

	/**
	 * @return the value of this float literal
	 * @throws NumberFormatException when the text is not a usable number, like a lone <code>.</code>
	 */
	public double doubleValue() {
		return Double.parseDouble(value);
	}

	@Override
	public Kind getKind() {
		return Kind.BASIC_LIT;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBasicLit(this);
	}

	@Override
	public String toString() {
		return "BasicLit " + literalKind + " " + value;
	}
}
