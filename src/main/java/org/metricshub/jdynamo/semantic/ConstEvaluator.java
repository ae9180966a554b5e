package org.metricshub.jdynamo.semantic;

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

import org.metricshub.jdynamo.frontend.ast.BasicLit;
import org.metricshub.jdynamo.frontend.ast.Expr;
import org.metricshub.jdynamo.frontend.ast.LiteralKind;

/**
 * Evaluates constant expressions to a {@code double}. Pure: the tree is only
 * read.
 */
public final class ConstEvaluator {

	private ConstEvaluator() {}

	/**
	 * @param expr expression to fold
	 * @return its value
	 * @throws SemanticException if the expression is not a usable constant
	 */
	public static double eval(Expr expr) {
		if (expr == null) {
			throw new SemanticException("missing expression");
		}
		switch (expr.getKind()) {
		case BASIC_LIT:
			return evalLiteral((BasicLit) expr);
		default:
			throw new SemanticException("not a constant expression: " + expr);
		}
	}

	private static double evalLiteral(BasicLit lit) {
		if (lit.getLiteralKind() != LiteralKind.FLOAT) {
			throw new SemanticException(lit.getOffset(), "not a number: " + lit.getValue(), null);
		}
		try {
			return lit.doubleValue();
		} catch (NumberFormatException e) {
			throw new SemanticException(lit.getOffset(), "invalid float literal '" + lit.getValue() + "'", e);
		}
	}
}
