/**
 **
 ** ChargedApertureBrightness - point-source brightness through an aperture
 ** with a charged edge deflecting particles outwards
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ChargedApertureBrightness.java is free software: you can redistribute it and/or modify
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

/*
 * A particle crossing the aperture at the normalized radius rho (0 - center, 1 - edge) lands at
 *   r(rho) = r0 * rho + Q / E * atanh(rho)
 * The log-divergent term is the field of the charged aperture edge. Particles are uniform over the
 * aperture area, so the image brightness is rho / (r * dr/drho), averaged over the energy band.
 * Not thread safe - the last result is cached, the objective requests the same profile for every
 * aperture of the array.
 */
public class ChargedApertureBrightness implements AnalyticBrightness {
	public int    num_rho =       1000;  // samples over the aperture radius
	public int    num_energies =    12;  // samples over the energy band
	public double min_energy =     0.1;  // MeV, lower energies are clipped to this
	public double extent =         3.0;  // profile is sampled up to extent * r0
	public int    num_samples =    600;  // radial samples of the result

	private double []   cached_key =    null;
	private double [][] cached_result = null;

	public ChargedApertureBrightness() {
	}

	public ChargedApertureBrightness(
			int    num_rho,
			int    num_energies,
			double min_energy,
			double extent,
			int    num_samples) {
		this.num_rho =      num_rho;
		this.num_energies = num_energies;
		this.min_energy =   min_energy;
		this.extent =       extent;
		this.num_samples =  num_samples;
	}

	@Override
	public double [][] getBrightness(
			double aperture_radius,
			double charge,
			double e_min,
			double e_max) {
		double [] key = {aperture_radius, charge, e_min, e_max};
		if ((cached_key != null) && Arrays.equals(key, cached_key)) {
			return cached_result;
		}
		double [][] result = (charge == 0.0) ?
				stepProfile(aperture_radius) :
				chargedProfile(aperture_radius, charge, e_min, e_max);
		cached_key = key;
		cached_result = result;
		return result;
	}

	double [][] stepProfile(double r0) {
		return new double [][] {
			{0.0, r0,  r0,  extent * r0},
			{1.0, 1.0, 0.0, 0.0}};
	}

	double [][] chargedProfile(double r0, double charge, double e_min, double e_max) {
		if (charge < 0) {
			throw new IllegalArgumentException("Aperture charge can not be negative: "+charge);
		}
		double lo = Math.max(Math.min(e_min, e_max), min_energy);
		double hi = Math.max(Math.max(e_min, e_max), min_energy);
		double [] energies = (hi > lo) ? DoubleArrays.linspace(lo, hi, num_energies) : new double [] {lo};
		double [] r_out = DoubleArrays.linspace(0.0, extent * r0, num_samples);
		double [] n_out = new double [num_samples];
		double [] r_rho = new double [num_rho];
		double [] n_rho = new double [num_rho];
		for (double energy : energies) {
			double k = charge / energy;
			for (int i = 0; i < num_rho; i++) {
				double rho = (i + 0.5) / num_rho;
				double r = r0 * rho + k * atanh(rho);
				double drdrho = r0 + k / (1.0 - rho * rho);
				r_rho[i] = r;
				n_rho[i] = rho / (r * drdrho);
			}
			for (int i = 0; i < num_samples; i++) {
				n_out[i] += DoubleArrays.interp(r_out[i], r_rho, n_rho, 0.0);
			}
		}
		double n_max = DoubleArrays.max(n_out);
		for (int i = 0; i < num_samples; i++) {
			n_out[i] /= n_max;
		}
		return new double [][] {r_out, n_out};
	}

	static double atanh(double x) {
		return 0.5 * Math.log((1.0 + x) / (1.0 - x));
	}
}
