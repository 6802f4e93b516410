/**
 **
 ** PortBasis - detector plane axes of a diagnostic port
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PortBasis.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Orthonormal basis of a port looking along (theta, phi): z points out of the detector plane
 * towards the port, y is tilted from z by -90 degrees of polar angle, x = y cross z.
 */
public class PortBasis {
	/** polar and azimuthal angles (deg) of TIM1..TIM6, NaN - unknown */
	public static final double [][] TIM_LOCATIONS = {
			{Double.NaN, Double.NaN},
			{ 37.38, 162.00},
			{Double.NaN, Double.NaN},
			{ 63.44, 342.00},
			{100.81, 270.00},
			{Double.NaN, Double.NaN}};

	private final Vector3D x_axis;
	private final Vector3D y_axis;
	private final Vector3D z_axis;

	public PortBasis(double theta_deg, double phi_deg) {
		double theta = Math.toRadians(theta_deg), phi = Math.toRadians(phi_deg);
		this.z_axis = spherical(1.0, theta, phi);
		this.y_axis = spherical(1.0, theta - Math.PI / 2, phi);
		this.x_axis = y_axis.crossProduct(z_axis);
	}

	/**
	 * @param tim port number, 1-based
	 * @return basis, with NaN axes if the port location is unknown
	 */
	public static PortBasis forPort(int tim) {
		if ((tim < 1) || (tim > TIM_LOCATIONS.length)) {
			return new PortBasis(Double.NaN, Double.NaN);
		}
		return new PortBasis(TIM_LOCATIONS[tim - 1][0], TIM_LOCATIONS[tim - 1][1]);
	}

	public boolean isKnown() {
		return !z_axis.isNaN();
	}

	/**
	 * Project a vector given in spherical coordinates
	 * @param r length
	 * @param theta_deg polar angle (deg)
	 * @param phi_deg azimuthal angle (deg)
	 * @return {x, y, z} in the detector basis, z out of the page
	 */
	public double [] project(double r, double theta_deg, double phi_deg) {
		Vector3D v = spherical(r, Math.toRadians(theta_deg), Math.toRadians(phi_deg));
		return new double [] {x_axis.dotProduct(v), y_axis.dotProduct(v), z_axis.dotProduct(v)};
	}

	private static Vector3D spherical(double r, double theta, double phi) {
		return new Vector3D(
				r * Math.sin(theta) * Math.cos(phi),
				r * Math.sin(theta) * Math.sin(phi),
				r * Math.cos(theta));
	}
}
