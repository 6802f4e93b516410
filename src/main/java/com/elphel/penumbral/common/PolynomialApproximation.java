/**
 **
 ** PolynomialApproximation - weighted least-squares polynomial fits
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PolynomialApproximation.java is free software: you can redistribute it and/or modify
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

import Jama.LUDecomposition;
import Jama.Matrix;

public class PolynomialApproximation {

	/**
	 * Weighted polynomial approximation f(x) = sum(c[k]*x^k), k = 0..N
	 * @param x argument samples
	 * @param f function samples
	 * @param w sample weights, samples with w <= 0 are skipped
	 * @param N polynomial degree
	 * @return coefficients c[0]..c[N], or null if the normal equations are singular
	 */
	public static double [] polynomialApproximation1d(
			double [] x,
			double [] f,
			double [] w,
			int       N){
		double [] S = new double [2 * N + 1];
		double [] SF = new double [N + 1];
		for (int i = 0; i < x.length; i++){
			double wxn = w[i];
			if (!(wxn > 0.0)) continue; // save time on masked out samples
			for (int j = 0; j <= N; j++){
				S[j]  += wxn;
				SF[j] += wxn * f[i];
				wxn *= x[i];
			}
			for (int j = N + 1; j <= 2 * N; j++){
				S[j] += wxn;
				wxn *= x[i];
			}
		}
		double [][] aM = new double [N + 1][N + 1];
		double [][] aB = new double [N + 1][1];
		for (int i = 0; i <= N; i++) {
			aB[i][0] = SF[i];
			for (int j = 0; j <= N; j++) aM[i][j] = S[i + j];
		}
		Matrix M = new Matrix(aM, N + 1, N + 1);
		Matrix B = new Matrix(aB, N + 1, 1);
		LUDecomposition lu = new LUDecomposition(M);
		if (!lu.isNonsingular()) {
			return null;
		}
		return lu.solve(B).getColumnPackedCopy();
	}

	/**
	 * Weighted straight line f = slope * x + intercept
	 * @return {slope, intercept} or null if x does not vary over the weighted samples
	 */
	public static double [] linearRegression(double [] x, double [] f, double [] w) {
		double [] c = polynomialApproximation1d(x, f, w, 1);
		if (c == null) {
			return null;
		}
		return new double [] {c[1], c[0]};
	}
}
