/**
 **
 ** PenumbraModel - radial profile of a single-aperture penumbral image of a
 ** finite (Gaussian) source
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PenumbraModel.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import com.elphel.penumbral.common.DoubleArrays;

/**
 * Forward model of one penumbral image. The point-source profile from {@link AnalyticBrightness}
 * is blurred with a Gaussian of width delta along the radius; blur below one radial bin
 * (r_max / num_bins) is treated as a point source.
 * <p>
 * Not thread safe: the last normalized profile is cached since all apertures of the array and all
 * kernel sub-pixel samples request the same one.
 */
public class PenumbraModel {
	private final AnalyticBrightness analytic_brightness;
	private final int                num_bins;

	private double []   cached_key =     null;
	private double [][] cached_profile = null;

	public PenumbraModel(AnalyticBrightness analytic_brightness, int num_bins) {
		if (num_bins < 2) {
			throw new IllegalArgumentException("Need at least 2 radial bins, got "+num_bins);
		}
		this.analytic_brightness = analytic_brightness;
		this.num_bins =            num_bins;
	}

	public int getNumBins() {
		return num_bins;
	}

	/**
	 * Expected brightness at the given distances from the aperture center
	 * @param r distances from the aperture image center (cm)
	 * @param delta source blur width (cm, >= 0)
	 * @param charge aperture charging
	 * @param r0 aperture image radius (cm)
	 * @param r_max radius of the evaluated field of view (cm), must exceed 4*delta
	 * @param minimum value for the background (zero brightness)
	 * @param maximum value for the umbra (full brightness)
	 * @param e_min lower bound of the particle energy band (MeV)
	 * @param e_max upper bound of the particle energy band (MeV)
	 * @return minimum + (maximum - minimum) * normalized profile, minimum beyond the profile support
	 * @throws PenumbraDomainException if delta is negative (or NaN) or too large for r_max
	 */
	public double [] penumbra(
			double [] r,
			double    delta,
			double    charge,
			double    r0,
			double    r_max,
			double    minimum,
			double    maximum,
			double    e_min,
			double    e_max) {
		double [][] profile = getProfile(delta, charge, r0, r_max, e_min, e_max);
		double [] w = DoubleArrays.interp(r, profile[0], profile[1], 0.0);
		for (int i = 0; i < w.length; i++) {
			w[i] = minimum + (maximum - minimum) * w[i];
		}
		return w;
	}

	/**
	 * Normalized radial profile, shared with the cache so callers must not modify it
	 * @return {radii, brightness in [0, 1]}
	 */
	double [][] getProfile(
			double    delta,
			double    charge,
			double    r0,
			double    r_max,
			double    e_min,
			double    e_max) {
		double [] key = {delta, charge, r0, r_max, e_min, e_max};
		if ((cached_key != null) && Arrays.equals(key, cached_key)) {
			return cached_profile;
		}
		double [][] rn = analytic_brightness.getBrightness(r0, charge, e_min, e_max);
		double [] r_point;
		double [] penumbra;
		if (4 * delta >= r_max) { // source size is over 1/4 of the image radius
			throw new PenumbraDomainException("delta is too big compared to r_max: 4*"+delta+"/"+r_max+" >= 1");
		} else if (4 * delta >= r_max / num_bins) { // blur is wider than a bin - gaussian kernel
			int half_size = Math.max(1, (int) (4 * delta / r_max * num_bins)); // rounding may give 0 at the bin limit
			double [] r_kernel = DoubleArrays.linspace(-4 * delta, 4 * delta, 2 * half_size + 1);
			double step = r_kernel[1] - r_kernel[0];
			double [] n_kernel = new double [r_kernel.length];
			for (int i = 0; i < r_kernel.length; i++) {
				n_kernel[i] = Math.exp(-r_kernel[i] * r_kernel[i] / (delta * delta));
			}
			r_point = DoubleArrays.arange(-4 * delta, r_max + 4 * delta, step); // rebin to the kernel spacing
			if (r_point.length < n_kernel.length) {
				throw new PenumbraDomainException("Blur kernel ("+n_kernel.length+") is longer than the profile ("+r_point.length+")");
			}
			double [] n_point = DoubleArrays.interp(r_point, rn[0], rn[1], 0.0);
			penumbra = DoubleArrays.convolveSame(n_point, n_kernel);
		} else if (delta >= 0) { // point source
			r_point = DoubleArrays.linspace(0.0, r_max, num_bins);
			penumbra = DoubleArrays.interp(r_point, rn[0], rn[1], 0.0);
		} else {
			throw new PenumbraDomainException("delta can not be negative: "+delta);
		}
		double p_max = DoubleArrays.max(penumbra);
		if (!(p_max > 0)) {
			throw new PenumbraDomainException("Penumbral profile is empty within r_max = "+r_max);
		}
		double [] normalized = new double [penumbra.length];
		for (int i = 0; i < penumbra.length; i++) {
			normalized[i] = penumbra[i] / p_max;
		}
		cached_key = key;
		cached_profile = new double [][] {r_point, normalized};
		return cached_profile;
	}
}
