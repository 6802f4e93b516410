/**
 **
 ** AnalyticBrightness - zero source size radial brightness of a single aperture image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  AnalyticBrightness.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.aperture;

public interface AnalyticBrightness {
	/**
	 * Radial brightness profile of a point source imaged through one aperture
	 * @param aperture_radius radius of the aperture image on the detector (cm)
	 * @param charge aperture charging parameter (>= 0)
	 * @param e_min lower bound of the particle energy band (MeV)
	 * @param e_max upper bound of the particle energy band (MeV)
	 * @return {radius samples (non-decreasing), brightness samples}, brightness is 0 beyond the last sample
	 */
	double [][] getBrightness(
			double aperture_radius,
			double charge,
			double e_min,
			double e_max);
}
