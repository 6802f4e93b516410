/**
 **
 ** PenumbralKernel - point-spread function of one aperture sampled on the kernel grid
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PenumbralKernel.java is free software: you can redistribute it and/or modify
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

import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.DoubleArrays;

public class PenumbralKernel {
	private final CoordinateGrid grid;
	private final double [][]    values; // sums to 1

	private PenumbralKernel(CoordinateGrid grid, double [][] values) {
		this.grid =   grid;
		this.values = values;
	}

	/**
	 * Zero-blur single aperture image averaged over supersample x supersample sub-pixel positions
	 * and normalized to unit sum
	 * @param model forward model
	 * @param grid kernel grid, see {@link CoordinateGrid#kernel}
	 * @param charge aperture charging
	 * @param r0 aperture image radius (cm)
	 * @param r_img evaluated radius (cm)
	 * @param e_min lower energy at the aperture (MeV)
	 * @param e_max upper energy at the aperture (MeV)
	 * @param supersample sub-pixel samples in each direction
	 */
	public static PenumbralKernel create(
			PenumbraModel  model,
			CoordinateGrid grid,
			double         charge,
			double         r0,
			double         r_img,
			double         e_min,
			double         e_max,
			int            supersample) {
		int nx = grid.getNumX(), ny = grid.getNumY();
		double dx = grid.getPitchX(), dy = grid.getPitchY();
		double [] xc = grid.getXCenters(), yc = grid.getYCenters();
		double [][] kernel = new double [nx][ny];
		double [] r = new double [nx * ny];
		for (int sx = 0; sx < supersample; sx++) {
			double ox = (sx - (supersample - 1) / 2.0) * dx / supersample;
			for (int sy = 0; sy < supersample; sy++) {
				double oy = (sy - (supersample - 1) / 2.0) * dy / supersample;
				for (int i = 0; i < nx; i++) {
					for (int j = 0; j < ny; j++) {
						r[i * ny + j] = Math.hypot(xc[i] + ox, yc[j] + oy);
					}
				}
				double [] p = model.penumbra(r, 0.0, charge, r0, r_img, 0.0, 1.0, e_min, e_max);
				for (int i = 0; i < nx; i++) {
					for (int j = 0; j < ny; j++) {
						kernel[i][j] += p[i * ny + j];
					}
				}
			}
		}
		double total = DoubleArrays.sum(kernel);
		if (!(total > 0)) {
			throw new IllegalStateException("Penumbral kernel is empty");
		}
		return new PenumbralKernel(grid, DoubleArrays.scale(kernel, 1.0 / total));
	}

	public CoordinateGrid getGrid() {
		return grid;
	}

	public double [][] getValues() {
		return values;
	}

	public int getSize() {
		return values.length;
	}
}
