/**
 **
 ** DoubleArrays - interpolation, convolution and reduction helpers for
 ** double[] and double[][] images
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DoubleArrays.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.common;

/*
 * 2-d arrays are indexed [ix][iy] everywhere in this project (x is the first index)
 */
public class DoubleArrays {

	/**
	 * Evenly spaced samples, both ends included
	 * @param start first value
	 * @param stop last value
	 * @param num number of samples (>= 2)
	 * @return array of num values
	 */
	public static double [] linspace(double start, double stop, int num) {
		double [] result = new double [num];
		if (num == 1) {
			result[0] = start;
			return result;
		}
		double step = (stop - start)/(num - 1);
		for (int i = 0; i < num; i++) {
			result[i] = start + i * step;
		}
		result[num - 1] = stop;
		return result;
	}

	/**
	 * Values start, start+step, ... strictly below stop
	 */
	public static double [] arange(double start, double stop, double step) {
		int num = (int) Math.ceil((stop - start) / step);
		if (num < 0) num = 0;
		double [] result = new double [num];
		for (int i = 0; i < num; i++) {
			result[i] = start + i * step;
		}
		return result;
	}

	/**
	 * Piecewise-linear interpolation of a sampled function.
	 * Below the first sample the first value is used, above the last one - right.
	 * Repeated abscissas are allowed (step functions), value right of the step is used.
	 * @param x points to evaluate
	 * @param xp non-decreasing sample abscissas
	 * @param fp sample values
	 * @param right value beyond xp[xp.length-1]
	 * @return interpolated values, same length as x
	 */
	public static double [] interp(double [] x, double [] xp, double [] fp, double right) {
		double [] result = new double [x.length];
		for (int i = 0; i < x.length; i++) {
			result[i] = interp(x[i], xp, fp, right);
		}
		return result;
	}

	public static double interp(double x, double [] xp, double [] fp, double right) {
		int n = xp.length;
		if (Double.isNaN(x)) return Double.NaN;
		if (x < xp[0])       return fp[0];
		if (x > xp[n - 1])   return right;
		if (x == xp[n - 1])  return fp[n - 1];
		// last index with xp[j] <= x
		int lo = 0, hi = n - 1;
		while (hi - lo > 1) {
			int mid = (lo + hi) >>> 1;
			if (xp[mid] <= x) lo = mid;
			else              hi = mid;
		}
		double dx = xp[hi] - xp[lo];
		if (dx <= 0) return fp[hi];
		return fp[lo] + (fp[hi] - fp[lo]) * (x - xp[lo]) / dx;
	}

	/**
	 * 1-d discrete convolution, central part of the length of the longer argument
	 * (kernel is expected to have odd length)
	 */
	public static double [] convolveSame(double [] data, double [] kernel) {
		int n = data.length;
		int m = kernel.length;
		double [] full = new double [n + m - 1];
		for (int i = 0; i < n; i++) {
			if (data[i] == 0.0) continue;
			for (int j = 0; j < m; j++) {
				full[i + j] += data[i] * kernel[j];
			}
		}
		int len = Math.max(n, m);
		int start = (Math.min(n, m) - 1) / 2;
		double [] result = new double [len];
		System.arraycopy(full, start, result, 0, len);
		return result;
	}

	/**
	 * Full 2-d convolution, result size is (na + nk - 1) in each direction
	 */
	public static double [][] convolveFull(double [][] data, double [][] kernel) {
		int nx = data.length, ny = data[0].length;
		int kx = kernel.length, ky = kernel[0].length;
		double [][] result = new double [nx + kx - 1][ny + ky - 1];
		for (int i = 0; i < nx; i++) {
			for (int j = 0; j < ny; j++) {
				double d = data[i][j];
				if (d == 0.0) continue;
				for (int u = 0; u < kx; u++) {
					double [] kernel_row = kernel[u];
					double [] result_row = result[i + u];
					for (int v = 0; v < ky; v++) {
						result_row[j + v] += d * kernel_row[v];
					}
				}
			}
		}
		return result;
	}

	/**
	 * Adjoint of {@link #convolveFull(double[][], double[][])}: for each position of the
	 * kernel completely inside the image sum kernel-weighted image values.
	 * Result size is (ni - nk + 1) in each direction.
	 */
	public static double [][] backProject(double [][] image, double [][] kernel) {
		int kx = kernel.length, ky = kernel[0].length;
		int nx = image.length - kx + 1, ny = image[0].length - ky + 1;
		double [][] result = new double [nx][ny];
		for (int i = 0; i < nx; i++) {
			for (int j = 0; j < ny; j++) {
				double s = 0.0;
				for (int u = 0; u < kx; u++) {
					double [] kernel_row = kernel[u];
					double [] image_row = image[i + u];
					for (int v = 0; v < ky; v++) {
						s += kernel_row[v] * image_row[j + v];
					}
				}
				result[i][j] = s;
			}
		}
		return result;
	}

	public static double max(double [] data) {
		double m = Double.NEGATIVE_INFINITY;
		for (double d : data) if (d > m) m = d;
		return m;
	}

	public static double max(double [][] data) {
		double m = Double.NEGATIVE_INFINITY;
		for (double [] row : data) for (double d : row) if (d > m) m = d;
		return m;
	}

	public static double min(double [][] data) {
		double m = Double.POSITIVE_INFINITY;
		for (double [] row : data) for (double d : row) if (d < m) m = d;
		return m;
	}

	public static double sum(double [][] data) {
		double s = 0.0;
		for (double [] row : data) for (double d : row) s += d;
		return s;
	}

	public static int count(boolean [][] mask) {
		int n = 0;
		for (boolean [] row : mask) for (boolean b : row) if (b) n++;
		return n;
	}

	/**
	 * Weighted average of the image, weights are 0/1
	 * @return NaN if no pixel is selected
	 */
	public static double average(double [][] data, boolean [][] selection) {
		double s = 0.0;
		int n = 0;
		for (int i = 0; i < data.length; i++) {
			for (int j = 0; j < data[i].length; j++) {
				if (selection[i][j]) {
					s += data[i][j];
					n++;
				}
			}
		}
		return (n > 0) ? (s / n) : Double.NaN;
	}

	public static double [] flatten(double [][] data) {
		int nx = data.length, ny = data[0].length;
		double [] result = new double [nx * ny];
		for (int i = 0; i < nx; i++) {
			System.arraycopy(data[i], 0, result, i * ny, ny);
		}
		return result;
	}

	public static double [][] scale(double [][] data, double k) {
		double [][] result = new double [data.length][];
		for (int i = 0; i < data.length; i++) {
			result[i] = new double [data[i].length];
			for (int j = 0; j < data[i].length; j++) {
				result[i][j] = data[i][j] * k;
			}
		}
		return result;
	}
}
