/**
 **
 ** HexLattice - offsets of the apertures of a hexagonal array, as seen on the detector
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  HexLattice.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;

public class HexLattice {
	public static final int DEFAULT_HALF_EXTENT = 6; // rows/columns -6..6

	/**
	 * Aperture image offsets whose whole image disk fits inside the view radius.
	 * Rows are sqrt(3)/2*s0 apart, odd rows are shifted by s0/2.
	 * @param s0 aperture image pitch on the detector (cm)
	 * @param r_img radius of one aperture image (cm)
	 * @param view_radius radius of the usable detector area (cm)
	 * @param half_extent number of rows and columns to consider on each side of the center
	 * @return list of {dx, dy}, the center aperture first if it fits
	 */
	public static List<double []> getOffsets(
			double s0,
			double r_img,
			double view_radius,
			int    half_extent) {
		if (!(s0 > 0)) {
			throw new IllegalArgumentException("Aperture pitch should be positive, got "+s0);
		}
		List<double []> offsets = new ArrayList<double []>();
		for (int i = 0; i <= 2 * half_extent; i++) { // center row first
			int row = ((i & 1) == 0) ? (i / 2) : -(i + 1) / 2;
			double dy = row * Math.sqrt(3) / 2 * s0;
			for (int j = 0; j <= 2 * half_extent; j++) {
				int col = ((j & 1) == 0) ? (j / 2) : -(j + 1) / 2;
				double dx = (2 * col + Math.floorMod(row, 2)) * s0 / 2;
				if (Math.hypot(dx, dy) + r_img <= view_radius) {
					offsets.add(new double [] {dx, dy});
				}
			}
		}
		return offsets;
	}

	public static List<double []> getOffsets(double s0, double r_img, double view_radius) {
		return getOffsets(s0, r_img, view_radius, DEFAULT_HALF_EXTENT);
	}
}
