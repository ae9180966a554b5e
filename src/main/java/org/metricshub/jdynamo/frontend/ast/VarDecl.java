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

import java.util.Collections;
import java.util.List;

/**
 * The declared side of an assignment: a name and its {@link Role}.
 */
public final class VarDecl extends AstNode {

	private final Ident name;
	private final Role role;

	public VarDecl(Ident name, Role role) {
		this.name = name;
		this.role = role;
	}

	public Ident getName() {
		return name;
	}

	/**
	 * @return the role, {@code null} for synthesized declarations such as the timespec
	 */
	public Role getRole() {
		return role;
	}

	@Override
	public List<? extends AstNode> children() {
		return Collections.singletonList(name);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitVarDecl(this);
	}

	@Override
	public String toString() {
		return role == null ? "VarDecl" : "VarDecl (" + role.getTypeName() + ")";
	}
}
