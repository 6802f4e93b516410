/**
 **
 ** ShotRecord - one row of the shot catalog
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShotRecord.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.readers;

/**
 * Distances follow the catalog units: aperture radius and separation in um, L1 in cm,
 * offset in um, flow in km/s. Angles are in degrees.
 */
public class ShotRecord {
	public final String shot;             // shot number, non-numeric ids are synthetic data
	public final int    tim;              // diagnostic port number
	public final double aperture_radius;  // um
	public final double aperture_spacing; // um, 0 - unknown
	public final double aperture_distance;// cm, L1
	public final double magnification;
	public final double rotation;         // deg
	public final String etch_time;        // as in the catalog, e.g. "5 h"
	public final double offset_r;         // um
	public final double offset_theta;     // deg
	public final double offset_phi;       // deg
	public final double flow_r;           // km/s
	public final double flow_theta;       // deg
	public final double flow_phi;         // deg

	public ShotRecord(
			String shot,
			int    tim,
			double aperture_radius,
			double aperture_spacing,
			double aperture_distance,
			double magnification,
			double rotation,
			String etch_time,
			double offset_r,
			double offset_theta,
			double offset_phi,
			double flow_r,
			double flow_theta,
			double flow_phi) {
		this.shot =              shot;
		this.tim =               tim;
		this.aperture_radius =   aperture_radius;
		this.aperture_spacing =  aperture_spacing;
		this.aperture_distance = aperture_distance;
		this.magnification =     magnification;
		this.rotation =          rotation;
		this.etch_time =         etch_time;
		this.offset_r =          offset_r;
		this.offset_theta =      offset_theta;
		this.offset_phi =        offset_phi;
		this.flow_r =            flow_r;
		this.flow_theta =        flow_theta;
		this.flow_phi =          flow_phi;
	}

	/**
	 * Shot with only the fields needed for the reconstruction, no offset/flow data
	 */
	public ShotRecord(
			String shot,
			int    tim,
			double aperture_radius,
			double aperture_spacing,
			double aperture_distance,
			double magnification,
			double rotation,
			String etch_time) {
		this(shot, tim, aperture_radius, aperture_spacing, aperture_distance, magnification, rotation, etch_time,
				Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
	}

	/**
	 * @return etch time in hours, "5 h" -> 5.0
	 */
	public double getEtchHours() {
		String s = etch_time.trim();
		while (s.endsWith("h") || s.endsWith(" ")) {
			s = s.substring(0, s.length() - 1);
		}
		return Double.parseDouble(s.trim());
	}

	/**
	 * Real shots have numeric ids, synthetic data sets use descriptive names
	 */
	public boolean isRealData() {
		return shot.matches("[0-9]+");
	}

	@Override
	public String toString() {
		return "shot "+shot+", TIM"+tim+", etch "+etch_time;
	}
}
