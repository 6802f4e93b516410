/**
 **
 ** MultiApertureObjective - compares detector counts with the modeled image of
 ** the whole hexagonal aperture array
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiApertureObjective.java is free software: you can redistribute it and/or modify
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

import java.util.List;

import org.apache.commons.math3.analysis.MultivariateFunction;

import com.elphel.penumbral.aperture.HexLattice;
import com.elphel.penumbral.aperture.PenumbraDomainException;
import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.PolynomialApproximation;
import com.elphel.penumbral.common.ReconstructionParameters;

/*
 * value = sum_included((exp - teo)^2 / sigma2) - 2 * n_included   - gaussian error model
 *       - 2 * n_included
 *       + ((a - 1)^2 + 2*b^2 + (c - 1)^2) / (4 * accuracy^2)      - distortion prior
 *       + Q / charge_prior_scale                                   - charging prior
 *       + log(1 + 1 / contrast)                                   - degenerate range term
 * where teo = minimum + (maximum - minimum) * sum_apertures(penumbra) and
 * sigma2 = 1 + sum_apertures(penumbra) + (noise * sum_apertures(penumbra))^2 and
 * contrast = maximum / max(minimum, floor) - 1. The range term only grows when the contrast
 * vanishes, a wider range of a well-resolved image gains next to nothing.
 *
 * Every infeasible or numerically broken case returns +infinity, so the simplex just
 * retracts from it.
 */
public class MultiApertureObjective {
	private final PenumbraModel   model;
	private final double []       x;     // pixel centers, first index
	private final double []       y;     // pixel centers, second index
	private final double [][]     exp;   // measured counts [ix][iy]
	private final double          r_img;
	private final double          view_radius;
	private final double          e_min;
	private final double          e_max;
	private final List<double []> offsets;
	private final double          non_statistical_noise;
	private final double          magnification_accuracy;
	private final double          charge_prior_scale;
	private final double          range_floor;
	private double                minimum = Double.NaN; // NaN - estimate from the data
	private double                maximum = Double.NaN;
	private int                   num_evaluations = 0;

	/**
	 * @param model single-aperture forward model
	 * @param x pixel center x coordinates (cm)
	 * @param y pixel center y coordinates (cm)
	 * @param exp measured counts, [x.length][y.length]
	 * @param s0 aperture image pitch (cm)
	 * @param r_img radius of one aperture image (cm)
	 * @param view_radius radius of the usable detector area (cm)
	 * @param e_min lower bound of the particle energy band at the aperture (MeV)
	 * @param e_max upper bound of the particle energy band at the aperture (MeV)
	 * @param params noise model, priors and lattice extent
	 */
	public MultiApertureObjective(
			PenumbraModel            model,
			double []                x,
			double []                y,
			double [][]              exp,
			double                   s0,
			double                   r_img,
			double                   view_radius,
			double                   e_min,
			double                   e_max,
			ReconstructionParameters params) {
		if ((exp.length != x.length) || (exp[0].length != y.length)) {
			throw new IllegalArgumentException("Counts array "+exp.length+"x"+exp[0].length+
					" does not match the grid "+x.length+"x"+y.length);
		}
		this.model =                  model;
		this.x =                      x;
		this.y =                      y;
		this.exp =                    exp;
		this.r_img =                  r_img;
		this.view_radius =            view_radius;
		this.e_min =                  e_min;
		this.e_max =                  e_max;
		this.offsets =                HexLattice.getOffsets(s0, r_img, view_radius, params.lattice_half_extent);
		this.non_statistical_noise =  params.non_statistical_noise;
		this.magnification_accuracy = params.expected_magnification_accuracy;
		this.charge_prior_scale =     params.charge_prior_scale;
		this.range_floor =            params.range_floor;
	}

	/**
	 * Use known count levels instead of estimating them for each geometry
	 * @param minimum counts at zero brightness, NaN to estimate
	 * @param maximum counts at full brightness, NaN to estimate
	 */
	public void setRange(double minimum, double maximum) {
		this.minimum = minimum;
		this.maximum = maximum;
	}

	public int getNumApertures() {
		return offsets.size();
	}

	public int getNumEvaluations() {
		return num_evaluations;
	}

	public double value(FitMode mode, double [] vector, ApertureGeometry template) {
		return evaluate(mode.unpack(vector, template)).value;
	}

	/**
	 * Objective function of the optimizer vector of the selected mode
	 */
	public MultivariateFunction bind(final FitMode mode, final ApertureGeometry template) {
		return new MultivariateFunction() {
			@Override
			public double value(double [] point) {
				return evaluate(mode.unpack(point, template)).value;
			}
		};
	}

	/**
	 * Normalized (no background, unit aperture brightness) model image of the aperture array
	 * @param g geometry
	 * @param include output, pixels covered by at least one aperture image, [x.length][y.length]
	 * @return model image or null if the model can not be evaluated
	 */
	public double [][] modelImage(ApertureGeometry g, boolean [][] include) {
		int nx = x.length, ny = y.length;
		double [][] teo = new double [nx][ny];
		double [][] x_eff = new double [nx][ny];
		double [][] y_eff = new double [nx][ny];
		for (int i = 0; i < nx; i++) {
			double dx = x[i] - g.x0;
			for (int j = 0; j < ny; j++) {
				double dy = y[j] - g.y0;
				x_eff[i][j] = g.a * dx + g.b * dy;
				y_eff[i][j] = g.b * dx + g.c * dy;
			}
		}
		int [] sel_i = new int [nx * ny];
		int [] sel_j = new int [nx * ny];
		double [] r_sel = new double [nx * ny];
		for (double [] offset : offsets) {
			int n = 0;
			for (int i = 0; i < nx; i++) {
				for (int j = 0; j < ny; j++) {
					double r_rel = Math.hypot(x_eff[i][j] - offset[0], y_eff[i][j] - offset[1]);
					if (r_rel <= r_img) {
						sel_i[n] = i;
						sel_j[n] = j;
						r_sel[n] = r_rel;
						n++;
					}
				}
			}
			if (n == 0) continue;
			double [] r_rel = new double [n];
			System.arraycopy(r_sel, 0, r_rel, 0, n);
			double [] penumbra;
			try {
				penumbra = model.penumbra(r_rel, g.delta, g.charge, g.aperture_radius, r_img, 0.0, 1.0, e_min, e_max);
			} catch (PenumbraDomainException e) {
				return null;
			}
			for (int k = 0; k < n; k++) {
				double v = teo[sel_i[k]][sel_j[k]] + penumbra[k];
				if (!Double.isFinite(v)) {
					return null;
				}
				teo[sel_i[k]][sel_j[k]] = v;
				include[sel_i[k]][sel_j[k]] = true;
			}
		}
		return teo;
	}

	public ObjectiveValue evaluate(ApertureGeometry g) {
		num_evaluations++;
		if ((g.charge < 0) || (Math.abs(g.x0) > view_radius) || (Math.abs(g.y0) > view_radius)) {
			return ObjectiveValue.INFEASIBLE; // and reject impossible ones
		}
		int nx = x.length, ny = y.length;
		boolean [][] include = new boolean [nx][ny];
		double [][] teo = modelImage(g, include);
		if (teo == null) {
			return ObjectiveValue.INFEASIBLE;
		}
		int n_pix = nx * ny;
		double [] teo_flat =    new double [n_pix];
		double [] exp_flat =    new double [n_pix];
		double [] sigma2 =      new double [n_pix];
		double [] weight =      new double [n_pix];
		int num_included = 0;
		for (int i = 0; i < nx; i++) {
			for (int j = 0; j < ny; j++) {
				int k = i * ny + j;
				double t = teo[i][j];
				teo_flat[k] = t;
				exp_flat[k] = exp[i][j];
				sigma2[k] = 1.0 + t + (non_statistical_noise * t) * (non_statistical_noise * t);
				if (include[i][j]) {
					weight[k] = 1.0 / sigma2[k];
					num_included++;
				}
			}
		}
		if (num_included == 0) {
			return ObjectiveValue.INFEASIBLE;
		}
		double min = this.minimum, max = this.maximum;
		if (Double.isNaN(min) || Double.isNaN(max)) { // if the max and min are unspecified
			double [] line = PolynomialApproximation.linearRegression(teo_flat, exp_flat, weight);
			if (line == null) {
				return ObjectiveValue.INFEASIBLE;
			}
			min = line[1];
			max = line[1] + line[0];
		}
		if (!(min <= max)) {
			return ObjectiveValue.INFEASIBLE;
		}
		double error = 0.0;
		for (int k = 0; k < n_pix; k++) {
			if (weight[k] > 0) {
				double d = exp_flat[k] - (min + teo_flat[k] * (max - min));
				error += d * d / sigma2[k];
			}
		}
		error -= 2 * num_included;
		double contrast = max / Math.max(min, range_floor) - 1.0;
		if (!(contrast > 0)) {
			return ObjectiveValue.INFEASIBLE;
		}
		double penalty =
				- 2 * num_included
				+ ((g.a - 1) * (g.a - 1) + 2 * g.b * g.b + (g.c - 1) * (g.c - 1)) /
					(4 * magnification_accuracy * magnification_accuracy)
				+ g.charge / charge_prior_scale
				+ Math.log1p(1.0 / contrast);
		double value = error + penalty;
		if (Double.isNaN(value)) {
			return ObjectiveValue.INFEASIBLE;
		}
		return new ObjectiveValue(value, min, max, num_included);
	}
}
