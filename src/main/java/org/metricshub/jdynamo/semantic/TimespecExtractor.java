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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.jdynamo.frontend.ast.AssignStmt;
import org.metricshub.jdynamo.frontend.ast.BasicLit;
import org.metricshub.jdynamo.frontend.ast.CompositeLit;
import org.metricshub.jdynamo.frontend.ast.Ident;
import org.metricshub.jdynamo.frontend.ast.KeyValueExpr;
import org.metricshub.jdynamo.frontend.ast.ModelDecl;
import org.metricshub.jdynamo.frontend.ast.Stmt;
import org.metricshub.jdynamo.frontend.ast.Timespec;
import org.metricshub.jdynamo.frontend.ast.VarDecl;
import org.metricshub.jdynamo.util.DynamoLogger;
import org.slf4j.Logger;

/**
 * Moves the simulation control constants of a model into a single
 * <code>timespec</code> assignment.
 * <p>
 * DYNAMO models set their time frame with ordinary constants:
 * <code>TIME</code> (start), <code>LENGTH</code> (end), <code>DT</code>
 * (time step) and <code>SAVPER</code> (save interval). These are folded to
 * numbers, removed from the body, and replaced by
 * <code>timespec = { start, end, dt, save_step }</code> appended last.
 */
public final class TimespecExtractor {

	private static final Logger LOG = DynamoLogger.getLogger(TimespecExtractor.class);

	/** Name of the synthesized assignment. */
	public static final String TIMESPEC = "timespec";

	/** Name of the only model the pass applies to. */
	public static final String MAIN_MODEL = "main";

	private TimespecExtractor() {}

	/**
	 * Whether the variable is one of TIME, LENGTH, SAVPER and DT, in any case.
	 *
	 * @param name variable name
	 * @return {@code true} for a simulation control variable
	 */
	public static boolean isControlVariable(String name) {
		switch (name.toUpperCase(Locale.ROOT)) {
		case "TIME":
		case "LENGTH":
		case "SAVPER":
		case "DT":
			return true;
		default:
			return false;
		}
	}

	/**
	 * Runs the pass.
	 *
	 * @param model a model that has not been through this pass yet
	 * @return the model with its new body and resolved {@link Timespec}
	 * @throws SemanticException if a control variable is not a constant, or
	 *         the model was already processed
	 */
	public static ModelDecl extract(ModelDecl model) {
		if (model.isTimespecResolved()) {
			throw new SemanticException(
					model.getName().getOffset(),
					"timespec already extracted for model " + model.getName().getName(),
					null);
		}

		Timespec spec = Timespec.DEFAULT;
		List<Stmt> body = new ArrayList<Stmt>();
		for (Stmt stmt : model.getBody()) {
			if (stmt.getKind() != Stmt.Kind.ASSIGN) {
				body.add(stmt);
				continue;
			}
			AssignStmt assign = (AssignStmt) stmt;
			String name = assign.getName();
			if (!isControlVariable(name)) {
				body.add(stmt);
				continue;
			}
			double value;
			try {
				value = ConstEvaluator.eval(assign.getRhs());
			} catch (SemanticException e) {
				throw new SemanticException(
						assign.getLhs().getName().getOffset(),
						"constEval(" + name + "): " + e.getMessage(),
						e);
			}
			switch (name.toUpperCase(Locale.ROOT)) {
			case "TIME":
				spec = spec.withStart(value);
				break;
			case "LENGTH":
				spec = spec.withEnd(value);
				break;
			case "SAVPER":
				spec = spec.withSaveStep(value);
				break;
			default:
				spec = spec.withDt(value);
			}
		}

		body.add(timespecAssign(spec));
		LOG.debug("model {}: {}", model.getName().getName(), spec);
		return model.withTimespec(body, spec);
	}

	/**
	 * Builds <code>timespec = { start, end, dt, save_step }</code>.
	 *
	 * @param spec resolved values
	 * @return the assignment
	 */
	static AssignStmt timespecAssign(Timespec spec) {
		List<KeyValueExpr> elts = new ArrayList<KeyValueExpr>();
		elts.add(new KeyValueExpr(Ident.of("start"), BasicLit.ofDouble(spec.getStart())));
		elts.add(new KeyValueExpr(Ident.of("end"), BasicLit.ofDouble(spec.getEnd())));
		elts.add(new KeyValueExpr(Ident.of("dt"), BasicLit.ofDouble(spec.getDt())));
		elts.add(new KeyValueExpr(Ident.of("save_step"), BasicLit.ofDouble(spec.getSaveStep())));
		return new AssignStmt(new VarDecl(Ident.of(TIMESPEC), null), new CompositeLit(elts));
	}
}
