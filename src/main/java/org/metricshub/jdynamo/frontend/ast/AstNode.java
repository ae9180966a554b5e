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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * Base of every syntax tree node.
 */
public abstract class AstNode {

	/** No source offset. */
	public static final int NO_POS = -1;

	AstNode() {}

	/**
	 * Dispatches to the visitor method for this node's variant.
	 *
	 * @param <R> visitor result type
	 * @param visitor the visitor
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(AstVisitor<R> visitor);

	/**
	 * @return the direct children of this node, in source order
	 */
	public List<? extends AstNode> children() {
		return Collections.emptyList();
	}

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node, and of its children, indented
	 * by one space per level.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (AstNode child : children()) {
			child.dump(ps, lvl + 1);
		}
	}
}
