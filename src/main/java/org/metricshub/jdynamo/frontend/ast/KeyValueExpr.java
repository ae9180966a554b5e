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
 * One <code>key: value</code> entry of a {@link CompositeLit}.
 */
public final class KeyValueExpr extends AstNode {

	private final Ident key;
	private final Expr value;

	public KeyValueExpr(Ident key, Expr value) {
		this.key = key;
		this.value = value;
	}

	public Ident getKey() {
		return key;
	}

	public Expr getValue() {
		return value;
	}

	@Override
	public List<? extends AstNode> children() {
		return Arrays.asList(key, value);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitKeyValue(this);
	}

	@Override
	public String toString() {
		return "KeyValue";
	}
}
