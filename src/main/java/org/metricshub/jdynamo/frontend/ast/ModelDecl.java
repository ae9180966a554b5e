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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named model and its statements.
 * <p>
 * Instances are not modified: the timespec pass builds a new
 * {@link ModelDecl} with {@link #withTimespec(List, Timespec)}.
 */
public final class ModelDecl extends AstNode {

	private final Ident name;
	private final List<Stmt> body;
	private final Timespec timespec;

	public ModelDecl(Ident name, List<Stmt> body) {
		this(name, body, null);
	}

	private ModelDecl(Ident name, List<Stmt> body, Timespec timespec) {
		this.name = name;
		this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
		this.timespec = timespec;
	}

	public Ident getName() {
		return name;
	}

	public List<Stmt> getBody() {
		return body;
	}

	/**
	 * @return the timespec resolved for this model, {@code null} until the timespec pass ran
	 */
	public Timespec getTimespec() {
		return timespec;
	}

	public boolean isTimespecResolved() {
		return timespec != null;
	}

	/**
	 * @param newBody statements of the processed model
	 * @param resolved the timespec its body now carries
	 * @return a copy of this model with the given body and timespec
	 */
	public ModelDecl withTimespec(List<Stmt> newBody, Timespec resolved) {
		return new ModelDecl(name, newBody, resolved);
	}

	/**
	 * @param varName variable name, compared exactly
	 * @return the first assignment to that name, {@code null} if none
	 */
	public AssignStmt findAssign(String varName) {
		for (Stmt stmt : body) {
			if (stmt.getKind() == Stmt.Kind.ASSIGN && ((AssignStmt) stmt).getName().equals(varName)) {
				return (AssignStmt) stmt;
			}
		}
		return null;
	}

	@Override
	public List<? extends AstNode> children() {
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitModel(this);
	}

	@Override
	public String toString() {
		return "Model " + name.getName();
	}
}
