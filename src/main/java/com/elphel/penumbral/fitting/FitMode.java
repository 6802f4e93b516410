/**
 **
 ** FitMode - which geometry parameters are adjusted by the fit
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FitMode.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.fitting;

/**
 * Each mode defines the layout of the optimizer vector. Parameters that are not in the vector are
 * taken from the template geometry supplied by the caller.
 */
public enum FitMode {
	/** x0, y0, delta, charge */
	POSITION_BLUR_CHARGE (new String [] {"x0", "y0", "delta", "charge"}) {
		@Override
		public ApertureGeometry unpack(double [] v, ApertureGeometry t) {
			return new ApertureGeometry(v[0], v[1], v[2], v[3], t.aperture_radius, t.a, t.b, t.c);
		}
		@Override
		public double [] pack(ApertureGeometry g) {
			return new double [] {g.x0, g.y0, g.delta, g.charge};
		}
	},
	/** x0, y0, delta, charge is known */
	POSITION_BLUR (new String [] {"x0", "y0", "delta"}) {
		@Override
		public ApertureGeometry unpack(double [] v, ApertureGeometry t) {
			return new ApertureGeometry(v[0], v[1], v[2], t.charge, t.aperture_radius, t.a, t.b, t.c);
		}
		@Override
		public double [] pack(ApertureGeometry g) {
			return new double [] {g.x0, g.y0, g.delta};
		}
	},
	/** x0, y0, delta, aperture image radius, no charging */
	POSITION_BLUR_RADIUS (new String [] {"x0", "y0", "delta", "r0"}) {
		@Override
		public ApertureGeometry unpack(double [] v, ApertureGeometry t) {
			return new ApertureGeometry(v[0], v[1], v[2], 0.0, v[3], t.a, t.b, t.c);
		}
		@Override
		public double [] pack(ApertureGeometry g) {
			return new double [] {g.x0, g.y0, g.delta, g.aperture_radius};
		}
	},
	/** x0, y0, delta, charge and the affine distortion a, b, c */
	POSITION_BLUR_CHARGE_AFFINE (new String [] {"x0", "y0", "delta", "charge", "a", "b", "c"}) {
		@Override
		public ApertureGeometry unpack(double [] v, ApertureGeometry t) {
			return new ApertureGeometry(v[0], v[1], v[2], v[3], t.aperture_radius, v[4], v[5], v[6]);
		}
		@Override
		public double [] pack(ApertureGeometry g) {
			return new double [] {g.x0, g.y0, g.delta, g.charge, g.a, g.b, g.c};
		}
	};

	private final String [] parameter_names;

	FitMode(String [] parameter_names) {
		this.parameter_names = parameter_names;
	}

	public int getNumParameters() {
		return parameter_names.length;
	}

	/**
	 * Build the geometry from an optimizer vector
	 * @param v vector of getNumParameters() values
	 * @param template source of the parameters this mode does not adjust
	 */
	public abstract ApertureGeometry unpack(double [] v, ApertureGeometry template);

	public abstract double [] pack(ApertureGeometry g);

	public String format(double [] v) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < parameter_names.length; i++) {
			if (i > 0) sb.append(", ");
			sb.append(parameter_names[i]).append(" = ").append(v[i]);
		}
		return sb.toString();
	}
}
