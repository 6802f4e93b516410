/**
 **
 ** EnergyCut - energy band and the matching track diameter band
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EnergyCut.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;

/**
 * Energies "out" are measured behind the filter in front of the detector, "in" are the energies at
 * the aperture (out + filter loss, clipped to [0, max_energy]) that drive aperture charging.
 */
public final class EnergyCut {
	public static final double [][] SYNTHETIC_CUTS = {{0.0, 5.0}};
	public static final double [][] STANDARD_CUTS =  {{0.0, 13.0}, {0.0, 5.0}, {5.0, 9.0}, {9.0, 13.0}};

	public final double e_out_min; // MeV
	public final double e_out_max; // MeV
	public final double e_in_min;  // MeV
	public final double e_in_max;  // MeV
	public final double d_min;     // um, included
	public final double d_max;     // um, excluded

	public EnergyCut(
			double e_out_min,
			double e_out_max,
			double e_in_min,
			double e_in_max,
			double d_min,
			double d_max) {
		this.e_out_min = e_out_min;
		this.e_out_max = e_out_max;
		this.e_in_min =  e_in_min;
		this.e_in_max =  e_in_max;
		this.d_min =     d_min;
		this.d_max =     d_max;
	}

	/**
	 * Diameter bounds are swapped relative to the energy ones, higher energy makes smaller tracks
	 */
	public static EnergyCut create(
			double            e_min,
			double            e_max,
			double            etch_hours,
			DiameterConverter converter,
			double            filter_loss,
			double            max_energy) {
		return new EnergyCut(
				e_min,
				e_max,
				clip(e_min + filter_loss, 0.0, max_energy),
				clip(e_max + filter_loss, 0.0, max_energy),
				converter.diameter(e_max, etch_hours),
				converter.diameter(e_min, etch_hours));
	}

	/**
	 * Synthetic track lists have all diameters equal, they get a single cut
	 */
	public static List<EnergyCut> createCuts(
			boolean           synthetic,
			double            etch_hours,
			DiameterConverter converter,
			double            filter_loss,
			double            max_energy) {
		List<EnergyCut> cuts = new ArrayList<EnergyCut>();
		for (double [] bounds : (synthetic ? SYNTHETIC_CUTS : STANDARD_CUTS)) {
			cuts.add(create(bounds[0], bounds[1], etch_hours, converter, filter_loss, max_energy));
		}
		return cuts;
	}

	private static double clip(double v, double lo, double hi) {
		return Math.max(lo, Math.min(hi, v));
	}

	@Override
	public String toString() {
		return String.format("E = [%.1f, %.1f) MeV, d = [%.2f, %.2f) um", e_out_min, e_out_max, d_min, d_max);
	}
}
