/**
 **
 ** EtchDiameterModel - empirical energy-to-diameter relation for etched plastic detectors
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EtchDiameterModel.java is free software: you can redistribute it and/or modify
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

/*
 * d(E, tau) = 2 * vB * tau / (1 + (E / Ec)^n)
 * Stopped particles (E -> 0) leave a pit as wide as the bulk etch can make it, fast ones fade out.
 */
public class EtchDiameterModel implements DiameterConverter {
	public double bulk_etch_rate =      2.66; // um/h
	public double critical_energy =      1.5; // MeV
	public double exponent =             1.3;

	public EtchDiameterModel() {
	}

	public EtchDiameterModel(double bulk_etch_rate, double critical_energy, double exponent) {
		if (!(bulk_etch_rate > 0) || !(critical_energy > 0) || !(exponent > 0)) {
			throw new IllegalArgumentException("Etch model parameters should be positive");
		}
		this.bulk_etch_rate =  bulk_etch_rate;
		this.critical_energy = critical_energy;
		this.exponent =        exponent;
	}

	@Override
	public double diameter(double energy, double etch_hours) {
		double e = Math.max(energy, 0.0);
		return 2 * bulk_etch_rate * etch_hours / (1.0 + Math.pow(e / critical_energy, exponent));
	}

	@Override
	public double energy(double diameter, double etch_hours) {
		double d_max = 2 * bulk_etch_rate * etch_hours;
		if (diameter >= d_max) return 0.0;
		if (diameter <= 0.0)   return Double.POSITIVE_INFINITY;
		return critical_energy * Math.pow(d_max / diameter - 1.0, 1.0 / exponent);
	}
}
