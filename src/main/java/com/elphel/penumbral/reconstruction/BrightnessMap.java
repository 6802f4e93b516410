/**
 **
 ** BrightnessMap - reconstructed source brightness of one energy cut
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BrightnessMap.java is free software: you can redistribute it and/or modify
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

import com.elphel.penumbral.fitting.FitResult;
import com.elphel.penumbral.tracks.EnergyCut;

public class BrightnessMap {
	public final CoordinateGrid source;     // source plane grid (cm)
	public final double [][]    brightness; // non-negative, max = 1
	public final EnergyCut      cut;
	public final FitResult      fit;
	public final double         chi2_per_pixel;
	public final int            num_tracks;

	public BrightnessMap(
			CoordinateGrid source,
			double [][]    brightness,
			EnergyCut      cut,
			FitResult      fit,
			double         chi2_per_pixel,
			int            num_tracks) {
		this.source =         source;
		this.brightness =     brightness;
		this.cut =            cut;
		this.fit =            fit;
		this.chi2_per_pixel = chi2_per_pixel;
		this.num_tracks =     num_tracks;
	}

	/**
	 * @return {x, y} of the brightest source pixel center
	 */
	public double [] getPeak() {
		int bi = 0, bj = 0;
		for (int i = 0; i < brightness.length; i++) {
			for (int j = 0; j < brightness[i].length; j++) {
				if (brightness[i][j] > brightness[bi][bj]) {
					bi = i;
					bj = j;
				}
			}
		}
		return new double [] {source.getXCenters()[bi], source.getYCenters()[bj]};
	}
}
