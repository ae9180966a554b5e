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
 * An ordered set of keyed values, like the synthesized <code>timespec</code>.
 */
public final class CompositeLit extends Expr {

	private final List<KeyValueExpr> elts;

	public CompositeLit(List<KeyValueExpr> elts) {
		this.elts = Collections.unmodifiableList(new ArrayList<KeyValueExpr>(elts));
	}

	public List<KeyValueExpr> getElts() {
		return elts;
	}

	/**
	 * @param key entry name
	 * @return the value stored under that key, {@code null} if absent
	 */
	public Expr get(String key) {
		for (KeyValueExpr kv : elts) {
			if (kv.getKey().getName().equals(key)) {
				return kv.getValue();
			}
		}
		return null;
	}

	@Override
	public Kind getKind() {
		return Kind.COMPOSITE_LIT;
	}

	@Override
	public List<? extends AstNode> children() {
		return elts;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitCompositeLit(this);
	}

	@Override
	public String toString() {
		return "CompositeLit";
	}
}
