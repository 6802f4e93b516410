/**
 **
 ** DiameterConverter - track diameter as a function of particle energy and etch time
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DiameterConverter.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.tracks;

/**
 * Monotonic (decreasing in energy) relation between the incident particle energy and
 * the diameter of the etched track.
 */
public interface DiameterConverter {
	/**
	 * @param energy incident energy (MeV)
	 * @param etch_hours etch time (h)
	 * @return track diameter (um)
	 */
	double diameter(double energy, double etch_hours);

	/**
	 * Inverse of {@link #diameter(double, double)}
	 * @param diameter track diameter (um)
	 * @param etch_hours etch time (h)
	 * @return incident energy (MeV)
	 */
	double energy(double diameter, double etch_hours);
}
