/**
 **
 ** GelfgatDeconvolver - Poisson maximum-likelihood deconvolution with a uniform background
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GelfgatDeconvolver.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.reconstruction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.common.DoubleArrays;

/**
 * Expectation-maximization deconvolution (V. I. Gelfgat et al., 1993) of Poisson counts
 * <pre>
 * mu = b + conv_full(g, q)
 * g_j <- g_j * sum_i(q_ij * y_i / mu_i) / sum_i(q_ij)   over the used pixels i
 * b   <- b * sum_i(y_i / mu_i) / m
 * </pre>
 * The subtracted background is added back so y are Poisson counts, b starts from that background.
 * Multiplicative updates keep the source pixels that start at zero dark, so illegal pixels are
 * zeroed once at the start.
 */
public class GelfgatDeconvolver implements Deconvolver {
	private static final Logger LOGGER = LoggerFactory.getLogger(GelfgatDeconvolver.class);

	private final int max_iterations;
	private final int debug_level;

	public GelfgatDeconvolver(int max_iterations, int debug_level) {
		this.max_iterations = max_iterations;
		this.debug_level =    debug_level;
	}

	@Override
	public DeconvolutionResult deconvolve(
			double [][]  counts,
			double       background,
			double [][]  kernel,
			double [][]  initial_guess,
			double       threshold,
			boolean [][] data_mask,
			boolean [][] illegal_mask) {
		int ni = counts.length, nj = counts[0].length;
		int ns = ni - kernel.length + 1, ms = nj - kernel[0].length + 1;
		if ((illegal_mask.length != ns) || (illegal_mask[0].length != ms)) {
			throw new IllegalArgumentException("Source mask "+illegal_mask.length+"x"+illegal_mask[0].length+
					" does not match "+ns+"x"+ms+" (image "+ni+"x"+nj+", kernel "+kernel.length+"x"+kernel[0].length+")");
		}
		int m = DoubleArrays.count(data_mask);
		if (m == 0) {
			throw new IllegalArgumentException("No data pixels to deconvolve");
		}
		double [][] y =    new double [ni][nj];
		double [][] used = new double [ni][nj];
		double y_total = 0;
		for (int i = 0; i < ni; i++) {
			for (int j = 0; j < nj; j++) {
				if (data_mask[i][j]) {
					y[i][j] = Math.max(counts[i][j] + background, 0.0);
					used[i][j] = 1.0;
					y_total += y[i][j];
				}
			}
		}
		double [][] g = new double [ns][ms];
		if (y_total == 0) {
			return new DeconvolutionResult(g, 0.0, 0.0, 0);
		}

		// start from the back-projection of the rough model
		double d_min = DoubleArrays.min(initial_guess);
		double [][] d = new double [ni][nj];
		for (int i = 0; i < ni; i++) {
			for (int j = 0; j < nj; j++) {
				d[i][j] = initial_guess[i][j] - d_min;
			}
		}
		g = DoubleArrays.backProject(d, kernel);
		double g_total = 0;
		for (int i = 0; i < ns; i++) {
			for (int j = 0; j < ms; j++) {
				if (illegal_mask[i][j] || !(g[i][j] > 0)) g[i][j] = 0.0;
				g_total += g[i][j];
			}
		}
		if (!(g_total > 0) || !Double.isFinite(g_total)) {
			for (int i = 0; i < ns; i++) {
				for (int j = 0; j < ms; j++) {
					g[i][j] = illegal_mask[i][j] ? 0.0 : 1.0;
				}
			}
		}
		double [][] sensitivity = DoubleArrays.backProject(used, kernel);
		double b = (background > 0) ? background : (0.01 * y_total / m);
		double model_total = maskedSum(DoubleArrays.convolveFull(g, kernel), data_mask);
		if (model_total > 0) {
			g = DoubleArrays.scale(g, Math.max(y_total - b * m, 0.1 * y_total) / model_total);
		}

		double [][] mu = null;
		double likelihood_prev = Double.NEGATIVE_INFINITY;
		int iteration = 0;
		while (true) {
			mu = DoubleArrays.convolveFull(g, kernel);
			double likelihood = 0;
			for (int i = 0; i < ni; i++) {
				for (int j = 0; j < nj; j++) {
					mu[i][j] = Math.max(mu[i][j] + b, Double.MIN_NORMAL);
					if (data_mask[i][j]) {
						likelihood += ((y[i][j] > 0) ? (y[i][j] * Math.log(mu[i][j])) : 0.0) - mu[i][j];
					}
				}
			}
			if (debug_level > 1) {
				LOGGER.debug("iteration "+iteration+": L = "+likelihood+", b = "+b);
			}
			if ((iteration > 0) && ((likelihood - likelihood_prev) / y_total < threshold)) {
				break;
			}
			if (iteration >= max_iterations) {
				LOGGER.warn("Deconvolution stopped after "+max_iterations+" iterations without converging");
				break;
			}
			likelihood_prev = likelihood;
			iteration++;

			double [][] ratio = new double [ni][nj];
			double ratio_total = 0;
			for (int i = 0; i < ni; i++) {
				for (int j = 0; j < nj; j++) {
					if (data_mask[i][j]) {
						ratio[i][j] = y[i][j] / mu[i][j];
						ratio_total += ratio[i][j];
					}
				}
			}
			double [][] back = DoubleArrays.backProject(ratio, kernel);
			for (int i = 0; i < ns; i++) {
				for (int j = 0; j < ms; j++) {
					g[i][j] = (sensitivity[i][j] > 0) ? (g[i][j] * back[i][j] / sensitivity[i][j]) : 0.0;
				}
			}
			b *= ratio_total / m;
		}
		double chi2 = 0;
		for (int i = 0; i < ni; i++) {
			for (int j = 0; j < nj; j++) {
				if (data_mask[i][j]) {
					double e = mu[i][j] - y[i][j];
					chi2 += e * e / mu[i][j];
				}
			}
		}
		if (debug_level > 0) {
			LOGGER.debug("Deconvolution: "+iteration+" iterations, chi2/n = "+(chi2 / m)+", background = "+b);
		}
		return new DeconvolutionResult(g, chi2, b, iteration);
	}

	private static double maskedSum(double [][] data, boolean [][] mask) {
		double s = 0;
		for (int i = 0; i < data.length; i++) {
			for (int j = 0; j < data[i].length; j++) {
				if (mask[i][j]) s += data[i][j];
			}
		}
		return s;
	}
}
