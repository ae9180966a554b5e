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
 * The y-values of a lookup table, in order.
 * <p>
 * The x-range and spacing of the table are not part of this node: they are
 * given by whatever later expression looks the table up.
 */
public final class TableFwdExpr extends Expr {

	private final List<BasicLit> ys;

	/**
	 * @param ys y-values, at least one
	 */
	public TableFwdExpr(List<BasicLit> ys) {
		if (ys.isEmpty()) {
			throw new IllegalArgumentException("a table needs at least one value");
		}
		this.ys = Collections.unmodifiableList(new ArrayList<BasicLit>(ys));
	}

	public List<BasicLit> getYs() {
		return ys;
	}

	@Override
	public Kind getKind() {
		return Kind.TABLE_FWD;
	}

	@Override
	public List<? extends AstNode> children() {
		return ys;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitTableFwd(this);
	}

	@Override
	public String toString() {
		return "TableFwd (" + ys.size() + " values)";
	}
}
