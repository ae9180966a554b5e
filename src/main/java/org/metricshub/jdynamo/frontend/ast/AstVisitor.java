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
 * One method per node variant. Code generators implement this to walk the
 * tree produced by the parser.
 *
 * @param <R> result type
 */
public interface AstVisitor<R> {

	R visitFile(DynamoFile file);

	R visitModel(ModelDecl model);

	R visitAssign(AssignStmt assign);

	R visitVarDecl(VarDecl decl);

	R visitBasicLit(BasicLit lit);

	R visitCompositeLit(CompositeLit lit);

	R visitKeyValue(KeyValueExpr entry);

	R visitTableFwd(TableFwdExpr table);

	R visitIdent(Ident ident);
}
