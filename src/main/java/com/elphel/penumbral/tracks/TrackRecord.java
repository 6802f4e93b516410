/**
 **
 ** TrackRecord - one detected particle track
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackRecord.java is free software: you can redistribute it and/or modify
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

public final class TrackRecord {
	public final double x;           // cm, detector plane
	public final double y;           // cm, detector plane
	public final double diameter;    // um
	public final double contrast;    // %, "cn"
	public final double contrast_a;  // %, "ca"
	public final double eccentricity;// %

	public TrackRecord(
			double x,
			double y,
			double diameter,
			double contrast,
			double contrast_a,
			double eccentricity) {
		this.x =            x;
		this.y =            y;
		this.diameter =     diameter;
		this.contrast =     contrast;
		this.contrast_a =   contrast_a;
		this.eccentricity = eccentricity;
	}

	@Override
	public String toString() {
		return "TrackRecord x = "+x+" y = "+y+" d = "+diameter+" cn = "+contrast+" ca = "+contrast_a+" e = "+eccentricity;
	}
}
