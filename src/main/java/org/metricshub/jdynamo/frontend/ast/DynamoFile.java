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
 * Root of the syntax tree of one source unit.
 */
public final class DynamoFile extends AstNode {

	private final Ident name;
	private final List<ModelDecl> decls;

	public DynamoFile(Ident name, List<ModelDecl> decls) {
		this.name = name;
		this.decls = Collections.unmodifiableList(new ArrayList<ModelDecl>(decls));
	}

	public Ident getName() {
		return name;
	}

	public List<ModelDecl> getDecls() {
		return decls;
	}

	/**
	 * @param modelName name of the model
	 * @return the model declared under that name, {@code null} if none
	 */
	public ModelDecl getModel(String modelName) {
		for (ModelDecl m : decls) {
			if (m.getName().getName().equals(modelName)) {
				return m;
			}
		}
		return null;
	}

	@Override
	public List<? extends AstNode> children() {
		return decls;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFile(this);
	}

	@Override
	public String toString() {
		return "File " + name.getName();
	}
}
