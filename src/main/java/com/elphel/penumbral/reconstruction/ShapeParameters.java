/**
 **
 ** ShapeParameters - low order shape moments of a brightness map
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShapeParameters.java is free software: you can redistribute it and/or modify
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

import Jama.EigenvalueDecomposition;
import Jama.Matrix;

/**
 * P0 - rms radius around the centroid, P1 - centroid offset from the grid origin,
 * P2 - ellipticity from the spread of the second moment eigenvalues. Angles are in radians
 * counterclockwise from x.
 */
public class ShapeParameters {
	public final double p0;
	public final double p1;
	public final double theta1;
	public final double p2;
	public final double theta2;

	public ShapeParameters(double p0, double p1, double theta1, double p2, double theta2) {
		this.p0 =     p0;
		this.p1 =     p1;
		this.theta1 = theta1;
		this.p2 =     p2;
		this.theta2 = theta2;
	}

	public static ShapeParameters calculate(double [] x, double [] y, double [][] brightness) {
		double s = 0, sx = 0, sy = 0;
		for (int i = 0; i < x.length; i++) {
			for (int j = 0; j < y.length; j++) {
				double w = brightness[i][j];
				s +=  w;
				sx += w * x[i];
				sy += w * y[j];
			}
		}
		if (!(s != 0) || !Double.isFinite(s)) {
			throw new IllegalArgumentException("Brightness map has no weight");
		}
		double mux = sx / s, muy = sy / s;
		double mxx = 0, mxy = 0, myy = 0;
		for (int i = 0; i < x.length; i++) {
			double dx = x[i] - mux;
			for (int j = 0; j < y.length; j++) {
				double dy = y[j] - muy;
				double w = brightness[i][j];
				mxx += w * dx * dx;
				mxy += w * dx * dy;
				myy += w * dy * dy;
			}
		}
		mxx /= s;
		mxy /= s;
		myy /= s;
		Matrix moments = new Matrix(new double [][] {{mxx, mxy}, {mxy, myy}});
		EigenvalueDecomposition eig = moments.eig(); // symmetric - eigenvalues ascending
		double [] lambda = eig.getRealEigenvalues();
		Matrix v = eig.getV();
		double p2 = Math.sqrt(Math.max(0.0, lambda[1] - lambda[0]));
		double theta2 = Math.atan2(v.get(1, 1), v.get(0, 1));
		return new ShapeParameters(
				Math.sqrt(mxx + myy),
				Math.hypot(mux, muy),
				Math.atan2(muy, mux),
				p2,
				theta2);
	}

	public static ShapeParameters calculate(BrightnessMap map) {
		return calculate(map.source.getXCenters(), map.source.getYCenters(), map.brightness);
	}

	@Override
	public String toString() {
		return String.format("P0 = %.2f um, P1 = %.2f um = %.1f%%, theta = %.1f deg, P2 = %.2f um = %.1f%%, theta = %.1f deg",
				p0 / 1e-4, p1 / 1e-4, p1 / p0 * 100, Math.toDegrees(theta1),
				p2 / 1e-4, p2 / p0 * 100, Math.toDegrees(theta2));
	}
}
