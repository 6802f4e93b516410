/**
 **
 ** ShotGeometry - aperture array geometry of one shot in detector units
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShotGeometry.java is free software: you can redistribute it and/or modify
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

import com.elphel.penumbral.common.ReconstructionParameters;
import com.elphel.penumbral.readers.ShotRecord;

/**
 * Everything here is in cm on the detector plane unless noted. The view radius comes from the
 * track positions of the shot, so a geometry is created per loaded track file.
 */
public class ShotGeometry {
	public final double aperture_radius;  // rA, cm
	public final double aperture_spacing; // sA, cm
	public final double magnification;    // M
	public final double rotation;         // rad
	public final double etch_hours;
	public final double r0;               // aperture image radius (M + 1) * rA
	public final double s0;               // aperture image pitch (M + 1) * sA
	public final double r_img;            // evaluated image radius
	public final double view_radius;      // usable detector radius
	public final int    num_bins;         // detector/image grid size
	public final double blur_scale;       // expected source image size, M * object_size

	public ShotGeometry(
			double aperture_radius,
			double aperture_spacing,
			double magnification,
			double rotation,
			double etch_hours,
			double view_radius,
			ReconstructionParameters params) {
		if (!(magnification > 0)) {
			throw new IllegalArgumentException("Magnification should be positive, got "+magnification);
		}
		if (!(aperture_radius > 0)) {
			throw new IllegalArgumentException("Aperture radius should be positive, got "+aperture_radius);
		}
		if (!(view_radius > 0)) {
			throw new IllegalArgumentException("View radius should be positive, got "+view_radius);
		}
		if (!(aperture_spacing >= 0)) {
			throw new IllegalArgumentException("Aperture spacing can not be negative, got "+aperture_spacing);
		}
		if (aperture_spacing == 0) {
			aperture_spacing = 6 * params.default_view_radius / (magnification + 1);
		}
		this.aperture_radius =  aperture_radius;
		this.aperture_spacing = aperture_spacing;
		this.magnification =    magnification;
		this.rotation =         rotation;
		this.etch_hours =       etch_hours;
		this.view_radius =      view_radius;
		this.r0 =               (magnification + 1) * aperture_radius;
		this.s0 =               (magnification + 1) * aperture_spacing;
		this.blur_scale =       params.object_size * magnification;
		this.r_img =            params.spread * r0 + blur_scale;
		this.num_bins =         Math.min(params.max_bins, (int) (params.resolution / blur_scale * r_img));
		if (num_bins < 2) {
			throw new IllegalArgumentException("Resolution "+params.resolution+" gives only "+num_bins+" bins");
		}
	}

	/**
	 * @param record catalog row (um, deg)
	 * @param view_radius detector radius covered by the tracks (cm)
	 */
	public static ShotGeometry create(ShotRecord record, double view_radius, ReconstructionParameters params) {
		return new ShotGeometry(
				record.aperture_radius / 1.0e4,
				record.aperture_spacing / 1.0e4,
				record.magnification,
				Math.toRadians(record.rotation),
				record.getEtchHours(),
				view_radius,
				params);
	}

	@Override
	public String toString() {
		return String.format("M = %.2f, r0 = %.4f cm, s0 = %.4f cm, r_img = %.4f cm, view radius = %.3f cm, %d bins",
				magnification, r0, s0, r_img, view_radius, num_bins);
	}
}
