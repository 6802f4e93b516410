/**
 **
 ** DataMask - detector-space pixels used by the deconvolution
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DataMask.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.InsufficientDataException;
import org.apache.commons.math3.geometry.euclidean.twod.Euclidean2D;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.geometry.euclidean.twod.hull.ConvexHull2D;
import org.apache.commons.math3.geometry.euclidean.twod.hull.MonotoneChain;
import org.apache.commons.math3.geometry.partitioning.Region;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import com.elphel.penumbral.common.DoubleArrays;

/**
 * A pixel is used when its counts are finite, when it is reached by some but not almost all of
 * the source pixels, and when it either has counts or lies inside the convex hull of the pixels
 * that have them.
 */
public class DataMask {
	private final boolean [][] mask;
	private final double [][]  reach; // normalized to max = 1
	private final double       low;
	private final double       high;

	private DataMask(boolean [][] mask, double [][] reach, double low, double high) {
		this.mask =  mask;
		this.reach = reach;
		this.low =   low;
		this.high =  high;
	}

	/**
	 * @param counts combined counts on the image grid
	 * @param image image grid
	 * @param kernel normalized kernel values
	 * @param source source grid
	 * @param low_quantile lower reach bound as a quantile of the max-normalized kernel
	 * @param high_quantile upper reach bound
	 */
	public static DataMask create(
			double [][]    counts,
			CoordinateGrid image,
			double [][]    kernel,
			CoordinateGrid source,
			double         low_quantile,
			double         high_quantile) {
		double k_max = DoubleArrays.max(kernel);
		double [] k_flat = DoubleArrays.flatten(kernel);
		for (int i = 0; i < k_flat.length; i++) {
			k_flat[i] /= k_max;
		}
		Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
		double low =  percentile.evaluate(k_flat, 100 * low_quantile);
		double high = percentile.evaluate(k_flat, 100 * high_quantile);

		double [][] ones = new double [source.getNumX()][source.getNumY()];
		for (double [] row : ones) Arrays.fill(row, 1.0);
		double [][] reach = DoubleArrays.convolveFull(ones, kernel);
		reach = DoubleArrays.scale(reach, 1.0 / DoubleArrays.max(reach));

		int nx = counts.length, ny = counts[0].length;
		if ((reach.length != nx) || (reach[0].length != ny)) {
			throw new IllegalArgumentException("Kernel reach "+reach.length+"x"+reach[0].length+
					" does not match the image "+nx+"x"+ny);
		}
		boolean [][] mask = new boolean [nx][ny];
		for (int i = 0; i < nx; i++) {
			for (int j = 0; j < ny; j++) {
				mask[i][j] = Double.isFinite(counts[i][j]) && (reach[i][j] > low) && (reach[i][j] < high);
			}
		}
		cropToHull(mask, counts, image);
		return new DataMask(mask, reach, low, high);
	}

	/**
	 * Remove zero-count pixels outside the convex hull of the nonzero-count pixel centers.
	 * When the hull is degenerate (fewer than 3 non-collinear pixels) all zero-count pixels go.
	 */
	static void cropToHull(boolean [][] mask, double [][] counts, CoordinateGrid grid) {
		double [] xc = grid.getXCenters(), yc = grid.getYCenters();
		List<Vector2D> points = new ArrayList<Vector2D>();
		for (int i = 0; i < xc.length; i++) {
			for (int j = 0; j < yc.length; j++) {
				if (counts[i][j] > 0) {
					points.add(new Vector2D(xc[i], yc[j]));
				}
			}
		}
		Region<Euclidean2D> hull = null;
		if (points.size() >= 3) {
			try {
				ConvexHull2D convex_hull = new MonotoneChain(false).generate(points);
				hull = convex_hull.createRegion();
			} catch (InsufficientDataException | ConvergenceException e) {
				hull = null; // collinear
			}
		}
		for (int i = 0; i < xc.length; i++) {
			for (int j = 0; j < yc.length; j++) {
				if (mask[i][j] && (counts[i][j] == 0)) {
					mask[i][j] = (hull != null) &&
							(hull.checkPoint(new Vector2D(xc[i], yc[j])) != Region.Location.OUTSIDE);
				}
			}
		}
	}

	public boolean [][] getMask() {
		return mask;
	}

	public double [][] getReach() {
		return reach;
	}

	public double getLow() {
		return low;
	}

	public double getHigh() {
		return high;
	}

	public int getNumIncluded() {
		return DoubleArrays.count(mask);
	}
}
