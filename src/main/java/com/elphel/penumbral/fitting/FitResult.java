/**
 **
 ** FitResult - fitted aperture array geometry
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FitResult.java is free software: you can redistribute it and/or modify
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

public class FitResult {
	public final ApertureGeometry geometry;
	public final FitMode          mode;
	public final double           value;       // objective value at the best point
	public final int              evaluations;
	public final double           minimum;     // fitted background counts
	public final double           maximum;     // fitted umbra counts
	public final boolean          converged;   // false if the evaluation limit was hit

	public FitResult(
			ApertureGeometry geometry,
			FitMode          mode,
			double           value,
			int              evaluations,
			double           minimum,
			double           maximum,
			boolean          converged) {
		this.geometry =    geometry;
		this.mode =        mode;
		this.value =       value;
		this.evaluations = evaluations;
		this.minimum =     minimum;
		this.maximum =     maximum;
		this.converged =   converged;
	}

	public boolean isFeasible() {
		return value < Double.POSITIVE_INFINITY;
	}

	@Override
	public String toString() {
		return mode+": "+geometry+", value = "+value+", range = ["+minimum+", "+maximum+"], "+
				evaluations+" evaluations"+(converged ? "" : " (not converged)");
	}
}
