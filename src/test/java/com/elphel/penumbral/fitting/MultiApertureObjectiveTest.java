/**
 **
 ** MultiApertureObjectiveTest - tests of the aperture array objective
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiApertureObjectiveTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.elphel.penumbral.aperture.ChargedApertureBrightness;
import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.DoubleArrays;
import com.elphel.penumbral.common.ReconstructionParameters;

class MultiApertureObjectiveTest {
	static final double R0 =          0.1;
	static final double R_IMG =       0.2;
	static final double VIEW_RADIUS = 0.6;
	static final double S0 =          10.0; // only the central aperture fits
	static final double E_MIN =       2.0;
	static final double E_MAX =       7.0;
	static final double X0 =          0.05;
	static final double Y0 =         -0.03;
	static final double DELTA =       0.01;

	private PenumbraModel            model;
	private ReconstructionParameters params;
	private double []                x;
	private double []                y;

	/**
	 * Noiseless image of one aperture, 2 counts of background and 22 in the umbra
	 */
	static double [][] syntheticCounts(PenumbraModel model, double [] x, double [] y, double minimum, double maximum) {
		double [][] counts = new double [x.length][y.length];
		for (int i = 0; i < x.length; i++) {
			for (int j = 0; j < y.length; j++) {
				double r = Math.hypot(x[i] - X0, y[j] - Y0);
				counts[i][j] = model.penumbra(new double [] {r}, DELTA, 0.0, R0, R_IMG, minimum, maximum, E_MIN, E_MAX)[0];
			}
		}
		return counts;
	}

	@BeforeEach
	void setUp() {
		model = new PenumbraModel(new ChargedApertureBrightness(), 100);
		params = new ReconstructionParameters();
		x = DoubleArrays.linspace(-0.5, 0.5, 41);
		y = DoubleArrays.linspace(-0.5, 0.5, 41);
	}

	private MultiApertureObjective objective(double [][] counts) {
		return new MultiApertureObjective(model, x, y, counts, S0, R_IMG, VIEW_RADIUS, E_MIN, E_MAX, params);
	}

	@Test
	void trueGeometryRecoversTheCountLevels() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		assertEquals(1, objective.getNumApertures());
		ObjectiveValue ov = objective.evaluate(new ApertureGeometry(X0, Y0, DELTA, 0.0, R0));
		assertTrue(ov.isFeasible());
		assertEquals(2.0,  ov.minimum, 1e-6);
		assertEquals(22.0, ov.maximum, 1e-6);
		assertTrue(ov.num_included > 100);
	}

	@Test
	void trueGeometryIsBetterThanAShiftedOne() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		double best =    objective.evaluate(new ApertureGeometry(X0, Y0, DELTA, 0.0, R0)).value;
		double shifted = objective.evaluate(new ApertureGeometry(X0 + 0.03, Y0, DELTA, 0.0, R0)).value;
		double blurred = objective.evaluate(new ApertureGeometry(X0, Y0, 4 * DELTA, 0.0, R0)).value;
		assertTrue(best < shifted);
		assertTrue(best < blurred);
	}

	@Test
	void moreBlurDoesNotPay() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		double best = objective.evaluate(new ApertureGeometry(X0, Y0, DELTA, 0.0, R0)).value;
		for (double delta : new double [] {0.0, 2 * DELTA, 3 * DELTA, 4 * DELTA}) {
			ObjectiveValue ov = objective.evaluate(new ApertureGeometry(X0, Y0, delta, 0.0, R0));
			assertTrue(ov.isFeasible());
			assertTrue(best < ov.value, "delta = "+delta+": "+ov.value+" <= "+best);
		}
	}

	@Test
	void widerRangeDoesNotPay() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		ApertureGeometry truth = new ApertureGeometry(X0, Y0, DELTA, 0.0, R0);
		objective.setRange(2.0, 22.0);
		double exact = objective.evaluate(truth).value;
		objective.setRange(1.0, 30.0);
		assertTrue(exact < objective.evaluate(truth).value);
	}

	@Test
	void knownRangeGivesTheSameValueAtTheTruth() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		ApertureGeometry truth = new ApertureGeometry(X0, Y0, DELTA, 0.0, R0);
		double estimated = objective.evaluate(truth).value;
		objective.setRange(2.0, 22.0);
		ObjectiveValue known = objective.evaluate(truth);
		assertEquals(estimated, known.value, 1e-6 * Math.abs(estimated));
		assertEquals(2.0, known.minimum, 0.0);
	}

	@Test
	void impossibleGeometriesAreInfeasibleWhateverTheData() {
		double [][] garbage = new double [x.length][y.length];
		for (double [] row : garbage) Arrays.fill(row, Double.NaN);
		MultiApertureObjective objective = objective(garbage);
		assertSame(ObjectiveValue.INFEASIBLE, objective.evaluate(new ApertureGeometry(0.0, 0.0, DELTA, -0.01, R0)));
		assertSame(ObjectiveValue.INFEASIBLE, objective.evaluate(new ApertureGeometry(VIEW_RADIUS + 0.01, 0.0, DELTA, 0.0, R0)));
		assertSame(ObjectiveValue.INFEASIBLE, objective.evaluate(new ApertureGeometry(0.0, -VIEW_RADIUS - 0.01, DELTA, 0.0, R0)));
		assertEquals(Double.POSITIVE_INFINITY, objective.value(FitMode.POSITION_BLUR_CHARGE,
				new double [] {0.0, 0.0, DELTA, -1.0}, new ApertureGeometry(0, 0, 0, 0, R0)));
	}

	@Test
	void blurOutOfDomainIsInfeasible() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		assertFalse(objective.evaluate(new ApertureGeometry(X0, Y0, -0.001, 0.0, R0)).isFeasible());
		assertFalse(objective.evaluate(new ApertureGeometry(X0, Y0, R_IMG / 4, 0.0, R0)).isFeasible());
	}

	@Test
	void invertedContrastIsInfeasible() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 22.0, 2.0));
		assertFalse(objective.evaluate(new ApertureGeometry(X0, Y0, DELTA, 0.0, R0)).isFeasible());
	}

	@Test
	void evaluationsAreCounted() {
		MultiApertureObjective objective = objective(syntheticCounts(model, x, y, 2.0, 22.0));
		objective.evaluate(new ApertureGeometry(X0, Y0, DELTA, 0.0, R0));
		objective.bind(FitMode.POSITION_BLUR, new ApertureGeometry(0, 0, 0, 0, R0)).value(new double [] {X0, Y0, DELTA});
		assertEquals(2, objective.getNumEvaluations());
	}

	@Test
	void countsShouldMatchTheGrid() {
		assertThrows(IllegalArgumentException.class, () -> objective(new double [3][3]));
	}
}
