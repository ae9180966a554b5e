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
 * Resolved simulation time configuration of a model.
 */
public final class Timespec {

	/** Used for every parameter the model does not set. */
	public static final Timespec DEFAULT = new Timespec(0, 0, 1, 1);

	private final double start;
	private final double end;
	private final double dt;
	private final double saveStep;

	public Timespec(double start, double end, double dt, double saveStep) {
		this.start = start;
		this.end = end;
		this.dt = dt;
		this.saveStep = saveStep;
	}

	public double getStart() {
		return start;
	}

	public double getEnd() {
		return end;
	}

	public double getDt() {
		return dt;
	}

	public double getSaveStep() {
		return saveStep;
	}

	public Timespec withStart(double v) {
		return new Timespec(v, end, dt, saveStep);
	}

	public Timespec withEnd(double v) {
		return new Timespec(start, v, dt, saveStep);
	}

	public Timespec withDt(double v) {
		return new Timespec(start, end, v, saveStep);
	}

	public Timespec withSaveStep(double v) {
		return new Timespec(start, end, dt, v);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Timespec)) {
			return false;
		}
		Timespec other = (Timespec) o;
		return Double.compare(start, other.start) == 0
				&& Double.compare(end, other.end) == 0
				&& Double.compare(dt, other.dt) == 0
				&& Double.compare(saveStep, other.saveStep) == 0;
	}

	@Override
	public int hashCode() {
		int h = Double.hashCode(start);
		h = 31 * h + Double.hashCode(end);
		h = 31 * h + Double.hashCode(dt);
		return 31 * h + Double.hashCode(saveStep);
	}

	@Override
	public String toString() {
		return "Timespec{start=" + start + ", end=" + end + ", dt=" + dt + ", saveStep=" + saveStep + "}";
	}
}
