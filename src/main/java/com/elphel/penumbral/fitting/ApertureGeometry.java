/**
 **
 ** ApertureGeometry - position, blur, charging and distortion of the penumbral image array
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ApertureGeometry.java is free software: you can redistribute it and/or modify
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

/**
 * Affine distortion maps detector offsets from the center to the undistorted frame:
 * <pre>
 * x_eff = a * (x - x0) + b * (y - y0)
 * y_eff = b * (x - x0) + c * (y - y0)
 * </pre>
 */
public final class ApertureGeometry {
	public final double x0;              // cm, center of the central aperture image
	public final double y0;              // cm
	public final double delta;           // cm, source blur on the detector
	public final double charge;          // aperture charging
	public final double aperture_radius; // cm, r0 - aperture image radius
	public final double a;
	public final double b;
	public final double c;

	public ApertureGeometry(
			double x0,
			double y0,
			double delta,
			double charge,
			double aperture_radius,
			double a,
			double b,
			double c) {
		this.x0 =              x0;
		this.y0 =              y0;
		this.delta =           delta;
		this.charge =          charge;
		this.aperture_radius = aperture_radius;
		this.a =               a;
		this.b =               b;
		this.c =               c;
	}

	/**
	 * Undistorted geometry
	 */
	public ApertureGeometry(
			double x0,
			double y0,
			double delta,
			double charge,
			double aperture_radius) {
		this(x0, y0, delta, charge, aperture_radius, 1.0, 0.0, 1.0);
	}

	public boolean isAffine() {
		return (a != 1.0) || (b != 0.0) || (c != 1.0);
	}

	@Override
	public String toString() {
		String s = String.format("(x0, y0) = (%.4f, %.4f) cm, delta = %.5f cm, Q = %.4f, r0 = %.4f cm",
				x0, y0, delta, charge, aperture_radius);
		if (isAffine()) {
			s += String.format(", a = %.5f, b = %.5f, c = %.5f", a, b, c);
		}
		return s;
	}
}
