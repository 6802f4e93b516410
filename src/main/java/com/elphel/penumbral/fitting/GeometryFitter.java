/**
 **
 ** GeometryFitter - Nelder-Mead fit of the aperture array position, blur and charging
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GeometryFitter.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.penumbral.fitting;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.common.ReconstructionParameters;

/**
 * Minimizes {@link MultiApertureObjective} starting from an explicit simplex. The objective is
 * +infinity over large parts of the parameter space, so the simplex has to start around the
 * expected solution and its vertices are built here for each fit mode.
 */
public class GeometryFitter {
	private static final Logger LOGGER = LoggerFactory.getLogger(GeometryFitter.class);

	private final ReconstructionParameters params;

	public GeometryFitter(ReconstructionParameters params) {
		this.params = params;
	}

	/**
	 * Initial simplex around the expected center
	 * @param mode fit mode, defines the vector layout
	 * @param x center x guess (cm)
	 * @param y center y guess (cm)
	 * @param r_img aperture image radius (cm), position step scale
	 * @param blur_scale expected source size on the detector (cm), blur step scale
	 * @param template geometry to take the remaining parameters (charge, r0) from
	 * @return getNumParameters()+1 vertices, the first one is the starting point
	 */
	public double [][] initialSimplex(
			FitMode          mode,
			double           x,
			double           y,
			double           r_img,
			double           blur_scale,
			ApertureGeometry template) {
		double r = r_img, s = blur_scale;
		double [][] positions = {
				{x + r / 2, y,         s / 3},
				{x - r / 2, y + r / 2, s / 3},
				{x - r / 2, y - r / 2, s / 3},
				{x,         y,         s / 2},
				{x,         y,         s / 3}};
		double q0 = params.initial_charge, dq = params.initial_charge_step;
		double acc2 = 2 * params.expected_magnification_accuracy;
		double [][] simplex = new double [mode.getNumParameters() + 1][];
		switch (mode) {
		case POSITION_BLUR:
			for (int i = 0; i < simplex.length; i++) {
				simplex[i] = positions[i].clone();
			}
			break;
		case POSITION_BLUR_CHARGE:
			for (int i = 0; i < 4; i++) {
				simplex[i] = new double [] {positions[i][0], positions[i][1], positions[i][2], q0};
			}
			simplex[4] = new double [] {x, y, s / 3, q0 + dq};
			break;
		case POSITION_BLUR_RADIUS:
			double r0 = template.aperture_radius;
			for (int i = 0; i < 4; i++) {
				simplex[i] = new double [] {positions[i][0], positions[i][1], positions[i][2], r0};
			}
			simplex[4] = new double [] {x, y, s / 3, 1.1 * r0};
			break;
		case POSITION_BLUR_CHARGE_AFFINE:
			for (int i = 0; i < 4; i++) {
				simplex[i] = new double [] {positions[i][0], positions[i][1], positions[i][2], q0, 1.0, 0.0, 1.0};
			}
			simplex[4] = new double [] {x, y, s / 3, q0 + dq, 1.0,        0.0,  1.0};
			simplex[5] = new double [] {x, y, s / 3, q0,      1.0 + acc2, 0.0,  1.0};
			simplex[6] = new double [] {x, y, s / 3, q0,      1.0,        acc2, 1.0};
			simplex[7] = new double [] {x, y, s / 3, q0,      1.0,        0.0,  1.0 + acc2};
			break;
		}
		return simplex;
	}

	/**
	 * Run the simplex minimization. When the evaluation limit is reached the best point seen
	 * so far is used.
	 * @param objective multi-aperture objective
	 * @param mode fit mode
	 * @param simplex initial vertices, see {@link #initialSimplex}
	 * @param template source of the parameters the mode does not adjust
	 * @return fit result, not feasible if no finite objective value was found
	 */
	public FitResult fit(
			MultiApertureObjective objective,
			FitMode                mode,
			double [][]            simplex,
			ApertureGeometry       template) {
		final MultivariateFunction function = objective.bind(mode, template);
		final double [] best_point = simplex[0].clone();
		final double [] best_value = {Double.POSITIVE_INFINITY};
		final int [] num_evaluations = {0};
		MultivariateFunction tracked = new MultivariateFunction() {
			@Override
			public double value(double [] point) {
				num_evaluations[0]++;
				double v = function.value(point);
				if (v < best_value[0]) {
					best_value[0] = v;
					System.arraycopy(point, 0, best_point, 0, point.length);
				}
				return v;
			}
		};
		SimplexOptimizer optimizer = new SimplexOptimizer(
				new SimpleValueChecker(params.simplex_relative_tolerance, params.simplex_absolute_tolerance));
		boolean converged = true;
		double [] solution;
		try {
			PointValuePair pvp = optimizer.optimize(
					new MaxEval(params.simplex_max_evaluations),
					new ObjectiveFunction(tracked),
					GoalType.MINIMIZE,
					new InitialGuess(simplex[0]),
					new NelderMeadSimplex(simplex));
			solution = (pvp.getValue() <= best_value[0]) ? pvp.getPoint() : best_point;
		} catch (TooManyEvaluationsException e) {
			LOGGER.warn("Simplex fit ("+mode+") did not converge in "+params.simplex_max_evaluations+
					" evaluations, using the best point found");
			converged = false;
			solution = best_point;
		}
		ApertureGeometry geometry = mode.unpack(solution, template);
		ObjectiveValue ov = objective.evaluate(geometry);
		FitResult result = new FitResult(geometry, mode, ov.value, num_evaluations[0], ov.minimum, ov.maximum, converged);
		if (params.debug_level > 0) {
			LOGGER.debug("fit: "+mode.format(solution)+", value = "+ov.value);
		}
		return result;
	}
}
