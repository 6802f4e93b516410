/**
 **
 ** GeometryFitterTest - tests of the simplex geometry fit
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GeometryFitterTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.elphel.penumbral.aperture.ChargedApertureBrightness;
import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.DoubleArrays;
import com.elphel.penumbral.common.ReconstructionParameters;

class GeometryFitterTest {
	private final ReconstructionParameters params = new ReconstructionParameters();
	private final ApertureGeometry         template = new ApertureGeometry(0, 0, 0, 0, 0.1);

	@Test
	void positionBlurSimplex() {
		double [][] simplex = new GeometryFitter(params).initialSimplex(FitMode.POSITION_BLUR, 1.0, 2.0, 0.2, 0.03, template);
		assertEquals(4, simplex.length);
		assertArrayEquals(new double [] {1.1, 2.0, 0.01}, simplex[0], 1e-12);
		assertArrayEquals(new double [] {0.9, 2.1, 0.01}, simplex[1], 1e-12);
		assertArrayEquals(new double [] {0.9, 1.9, 0.01}, simplex[2], 1e-12);
		assertArrayEquals(new double [] {1.0, 2.0, 0.015}, simplex[3], 1e-12);
	}

	@Test
	void chargeSimplexStepsTheChargeInTheLastVertex() {
		double [][] simplex = new GeometryFitter(params).initialSimplex(FitMode.POSITION_BLUR_CHARGE, 0, 0, 0.2, 0.03, template);
		assertEquals(5, simplex.length);
		for (int i = 0; i < 4; i++) {
			assertEquals(params.initial_charge, simplex[i][3], 0.0);
		}
		assertEquals(params.initial_charge + params.initial_charge_step, simplex[4][3], 1e-15);
	}

	@Test
	void affineSimplexIsNotDegenerate() {
		double [][] simplex = new GeometryFitter(params).initialSimplex(FitMode.POSITION_BLUR_CHARGE_AFFINE, 0, 0, 0.2, 0.03, template);
		assertEquals(8, simplex.length);
		for (double [] vertex : simplex) {
			assertEquals(7, vertex.length);
		}
		Jama.Matrix edges = new Jama.Matrix(7, 7);
		for (int i = 1; i < 8; i++) {
			for (int j = 0; j < 7; j++) {
				edges.set(i - 1, j, simplex[i][j] - simplex[0][j]);
			}
		}
		assertTrue(Math.abs(edges.det()) > 0);
	}

	@Test
	void radiusSimplex() {
		double [][] simplex = new GeometryFitter(params).initialSimplex(FitMode.POSITION_BLUR_RADIUS, 0, 0, 0.2, 0.03, template);
		assertEquals(0.1,  simplex[0][3], 0.0);
		assertEquals(0.11, simplex[4][3], 1e-15);
	}

	@Test
	void fitFindsTheCenter() {
		PenumbraModel model = new PenumbraModel(new ChargedApertureBrightness(), 100);
		double [] x = DoubleArrays.linspace(-0.5, 0.5, 41);
		double [] y = DoubleArrays.linspace(-0.5, 0.5, 41);
		double [][] counts = MultiApertureObjectiveTest.syntheticCounts(model, x, y, 2.0, 22.0);
		MultiApertureObjective objective = new MultiApertureObjective(model, x, y, counts,
				MultiApertureObjectiveTest.S0, MultiApertureObjectiveTest.R_IMG, MultiApertureObjectiveTest.VIEW_RADIUS,
				MultiApertureObjectiveTest.E_MIN, MultiApertureObjectiveTest.E_MAX, params);
		GeometryFitter fitter = new GeometryFitter(params);
		double [][] simplex = fitter.initialSimplex(FitMode.POSITION_BLUR, 0.0, 0.0, MultiApertureObjectiveTest.R_IMG, 0.03, template);
		FitResult result = fitter.fit(objective, FitMode.POSITION_BLUR, simplex, template);
		assertTrue(result.isFeasible());
		double pitch = x[1] - x[0];
		assertEquals(MultiApertureObjectiveTest.X0, result.geometry.x0, pitch);
		assertEquals(MultiApertureObjectiveTest.Y0, result.geometry.y0, pitch);
		assertEquals(2.0,  result.minimum, 0.5);
		assertEquals(22.0, result.maximum, 2.0);
		assertTrue(result.evaluations > 0);
	}

	@Test
	void nothingFeasibleGivesAnInfeasibleResult() {
		params.simplex_max_evaluations = 50;
		PenumbraModel model = new PenumbraModel(new ChargedApertureBrightness(), 100);
		double [] x = DoubleArrays.linspace(-0.5, 0.5, 11);
		MultiApertureObjective objective = new MultiApertureObjective(model, x, x, new double [11][11],
				10.0, 0.2, 0.6, 2.0, 7.0, params);
		GeometryFitter fitter = new GeometryFitter(params);
		double [][] simplex = fitter.initialSimplex(FitMode.POSITION_BLUR, 5.0, 5.0, 0.2, 0.03, template);
		FitResult result = fitter.fit(objective, FitMode.POSITION_BLUR, simplex, template);
		assertFalse(result.isFeasible());
		assertFalse(result.converged);
	}
}
