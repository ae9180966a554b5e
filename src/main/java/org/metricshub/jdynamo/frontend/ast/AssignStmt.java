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

import java.util.Arrays;
import java.util.List;

/**
 * <code>lhs = rhs</code>.
 */
public final class AssignStmt extends Stmt {

	private final VarDecl lhs;
	private final Expr rhs;

	public AssignStmt(VarDecl lhs, Expr rhs) {
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public VarDecl getLhs() {
		return lhs;
	}

	public Expr getRhs() {
		return rhs;
	}

	/**
	 * @return the assigned variable's name
	 */
	public String getName() {
		return lhs.getName().getName();
	}

	@Override
	public Kind getKind() {
		return Kind.ASSIGN;
	}

	@Override
	public List<? extends AstNode> children() {
		return Arrays.asList(lhs, rhs);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitAssign(this);
	}

	@Override
	public String toString() {
		return "Assign";
	}
}
