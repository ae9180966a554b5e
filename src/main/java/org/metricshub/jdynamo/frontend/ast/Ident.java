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

/**
 * A name, optionally placed in the source.
 * <p>
 * {@link #getDecl()} is a back reference to the declaration the name
 * resolves to. No pass of this front end resolves names, so it stays
 * {@code null} unless a later stage sets it.
 */
public final class Ident extends Expr {

	private final int offset;
	private final String name;
	private VarDecl decl;

	public Ident(int offset, String name) {
		this.offset = offset;
		this.name = name;
	}

	/**
	 * Creates a name with no source position, for synthesized nodes.
	 *
	 * @param name the name
	 * @return a new {@link Ident}
	 */
	public static Ident of(String name) {
		return new Ident(NO_POS, name);
	}

	/**
	 * @return source offset, or {@link #NO_POS} for synthesized names
	 */
	public int getOffset() {
		return offset;
	}

	public String getName() {
		return name;
	}

	public VarDecl getDecl() {
		return decl;
	}

	public void setDecl(VarDecl decl) {
		this.decl = decl;
	}

	@Override
	public Kind getKind() {
		return Kind.IDENT;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIdent(this);
	}

	@Override
	public String toString() {
		return "Ident " + name;
	}
}
