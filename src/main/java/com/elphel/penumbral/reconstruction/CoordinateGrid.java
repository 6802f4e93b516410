/**
 **
 ** CoordinateGrid - regular square-pixel grid of the detector, image, kernel or source plane
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CoordinateGrid.java is free software: you can redistribute it and/or modify
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

import com.elphel.penumbral.common.DoubleArrays;
import com.elphel.penumbral.tracks.TrackList;

/**
 * Bin edges and centers of a regular 2-d grid. Image and kernel grids of one energy cut share
 * the same pixel pitch, the source grid is the kernel-trimmed image grid divided by the
 * magnification.
 */
public class CoordinateGrid {
	private final double [] x_edges;
	private final double [] y_edges;
	private final double [] x_centers;
	private final double [] y_centers;

	public CoordinateGrid(double [] x_edges, double [] y_edges) {
		if ((x_edges.length < 2) || (y_edges.length < 2)) {
			throw new IllegalArgumentException("Grid needs at least one bin in each direction");
		}
		this.x_edges =   x_edges;
		this.y_edges =   y_edges;
		this.x_centers = centers(x_edges);
		this.y_centers = centers(y_edges);
	}

	/**
	 * Whole detector, centered at 0,0
	 */
	public static CoordinateGrid detector(double view_radius, int num_bins) {
		return new CoordinateGrid(
				DoubleArrays.linspace(-view_radius, view_radius, num_bins + 1),
				DoubleArrays.linspace(-view_radius, view_radius, num_bins + 1));
	}

	/**
	 * Window holding one aperture image centered at (x0, y0)
	 */
	public static CoordinateGrid image(double x0, double y0, double r_img, int num_bins) {
		return new CoordinateGrid(
				DoubleArrays.linspace(x0 - r_img, x0 + r_img, num_bins + 1),
				DoubleArrays.linspace(y0 - r_img, y0 + r_img, num_bins + 1));
	}

	/**
	 * Odd number of pixels covering 2*spread*r0
	 */
	public static int kernelSize(double spread, double r0, double pitch) {
		int kernel_size = (int) (2 * spread * r0 / pitch) + 1;
		if ((kernel_size % 2) == 0) {
			kernel_size++;
		}
		return kernel_size;
	}

	/**
	 * Kernel grid with the image pitch, measured from the aperture image center
	 */
	public static CoordinateGrid kernel(CoordinateGrid image, int kernel_size) {
		double dx = image.getPitchX(), dy = image.getPitchY();
		return new CoordinateGrid(
				DoubleArrays.linspace(-dx * kernel_size / 2, dx * kernel_size / 2, kernel_size + 1),
				DoubleArrays.linspace(-dy * kernel_size / 2, dy * kernel_size / 2, kernel_size + 1));
	}

	/**
	 * Image edges trimmed by kernel_size/2 on each side, scaled to the source plane.
	 * Full convolution of a source-sized array with the kernel has the image size.
	 */
	public static CoordinateGrid source(CoordinateGrid image, int kernel_size, double magnification) {
		int trim = kernel_size / 2;
		int nx = image.x_edges.length - 2 * trim;
		int ny = image.y_edges.length - 2 * trim;
		if ((nx < 2) || (ny < 2)) {
			throw new IllegalArgumentException("Kernel of "+kernel_size+" pixels does not fit in the image of "+
					image.getNumX()+"x"+image.getNumY()+" pixels");
		}
		double [] x_edges = new double [nx];
		double [] y_edges = new double [ny];
		for (int i = 0; i < nx; i++) x_edges[i] = image.x_edges[i + trim] / magnification;
		for (int i = 0; i < ny; i++) y_edges[i] = image.y_edges[i + trim] / magnification;
		return new CoordinateGrid(x_edges, y_edges);
	}

	public int getNumX()              {return x_centers.length;}
	public int getNumY()              {return y_centers.length;}
	public double [] getXEdges()      {return x_edges;}
	public double [] getYEdges()      {return y_edges;}
	public double [] getXCenters()    {return x_centers;}
	public double [] getYCenters()    {return y_centers;}
	public double getPitchX()         {return x_edges[1] - x_edges[0];}
	public double getPitchY()         {return y_edges[1] - y_edges[0];}

	/**
	 * Distance of each pixel center from a point
	 * @return [num_x][num_y] array
	 */
	public double [][] distance(double xc, double yc) {
		double [][] r = new double [x_centers.length][y_centers.length];
		for (int i = 0; i < x_centers.length; i++) {
			for (int j = 0; j < y_centers.length; j++) {
				r[i][j] = Math.hypot(x_centers[i] - xc, y_centers[j] - yc);
			}
		}
		return r;
	}

	/**
	 * Count tracks in the bins of this grid shifted by (dx, dy). Bins are half-open except the
	 * last one in each direction that also includes its right edge.
	 * @return [num_x][num_y] counts
	 */
	public double [][] histogram(TrackList tracks, double dx, double dy) {
		double [][] counts = new double [x_centers.length][y_centers.length];
		accumulateHistogram(counts, tracks, dx, dy);
		return counts;
	}

	public double [][] histogram(TrackList tracks) {
		return histogram(tracks, 0.0, 0.0);
	}

	public void accumulateHistogram(double [][] counts, TrackList tracks, double dx, double dy) {
		for (int n = 0; n < tracks.size(); n++) {
			int i = binIndex(x_edges, tracks.getX(n) - dx);
			if (i < 0) continue;
			int j = binIndex(y_edges, tracks.getY(n) - dy);
			if (j < 0) continue;
			counts[i][j] += 1.0;
		}
	}

	/**
	 * @return bin index or -1 if outside
	 */
	static int binIndex(double [] edges, double v) {
		int last = edges.length - 1;
		if (!(v >= edges[0]) || (v > edges[last])) return -1;
		if (v == edges[last]) return last - 1;
		int lo = 0, hi = last;
		while (hi - lo > 1) {
			int mid = (lo + hi) >>> 1;
			if (edges[mid] <= v) lo = mid;
			else                 hi = mid;
		}
		return lo;
	}

	private static double [] centers(double [] edges) {
		double [] c = new double [edges.length - 1];
		for (int i = 0; i < c.length; i++) {
			c[i] = (edges[i] + edges[i + 1]) / 2;
		}
		return c;
	}
}
