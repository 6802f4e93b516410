/**
 **
 ** ShotResult - reconstruction results of one catalog row
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShotResult.java is free software: you can redistribute it and/or modify
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

import java.util.Collections;
import java.util.List;

import com.elphel.penumbral.fitting.FitResult;
import com.elphel.penumbral.readers.ShotRecord;

public class ShotResult {
	public final ShotRecord          record;
	public final ShotGeometry        geometry;
	public final List<BrightnessMap> maps;         // accepted cuts in cut order
	public final List<FitResult>     fits;         // fits of all cuts that had tracks
	public final ShapeParameters     shape;        // of the first map, null if there are no maps
	public final double []           offset;       // {x, y, z} cm, z out of the page, NaN if unknown
	public final double []           flow;         // {x, y, z} cm/ns
	public final double [][]         xray_image;   // companion x-ray image, null if absent

	public ShotResult(
			ShotRecord          record,
			ShotGeometry        geometry,
			List<BrightnessMap> maps,
			List<FitResult>     fits,
			ShapeParameters     shape,
			double []           offset,
			double []           flow,
			double [][]         xray_image) {
		this.record =     record;
		this.geometry =   geometry;
		this.maps =       Collections.unmodifiableList(maps);
		this.fits =       Collections.unmodifiableList(fits);
		this.shape =      shape;
		this.offset =     offset;
		this.flow =       flow;
		this.xray_image = xray_image;
	}

	public ShotResult withXrayImage(double [][] xray_image) {
		return new ShotResult(record, geometry, maps, fits, shape, offset, flow, xray_image);
	}

	public boolean hasMaps() {
		return !maps.isEmpty();
	}
}
