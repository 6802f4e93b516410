/**
 **
 ** ObjectiveValue - badness of fit with the count levels it was evaluated with
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ObjectiveValue.java is free software: you can redistribute it and/or modify
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

public final class ObjectiveValue {
	public static final ObjectiveValue INFEASIBLE =
			new ObjectiveValue(Double.POSITIVE_INFINITY, Double.NaN, Double.NaN, 0);

	public final double value;     // residual + penalty
	public final double minimum;   // counts at zero brightness (background)
	public final double maximum;   // counts at full brightness (umbra)
	public final int    num_included;

	public ObjectiveValue(double value, double minimum, double maximum, int num_included) {
		this.value =        value;
		this.minimum =      minimum;
		this.maximum =      maximum;
		this.num_included = num_included;
	}

	public boolean isFeasible() {
		return value < Double.POSITIVE_INFINITY;
	}
}
