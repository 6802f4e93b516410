/**
 **
 ** TrackList - immutable column storage of detected particle tracks
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackList.java is free software: you can redistribute it and/or modify
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

import java.util.List;

/**
 * Tracks are stored as float columns (there may be millions of them). Every transformation
 * returns a new list, the arrays handed to the constructor are owned by the list.
 */
public class TrackList {
	private final float [] x;            // cm
	private final float [] y;            // cm
	private final float [] diameter;     // um
	private final float [] contrast;     // %, "cn"
	private final float [] contrast_a;   // %, "ca"
	private final float [] eccentricity; // %

	public TrackList(
			float [] x,
			float [] y,
			float [] diameter,
			float [] contrast,
			float [] contrast_a,
			float [] eccentricity) {
		int n = x.length;
		if ((y.length != n) || (diameter.length != n) || (contrast.length != n) ||
				(contrast_a.length != n) || (eccentricity.length != n)) {
			throw new IllegalArgumentException("Track columns have different lengths");
		}
		this.x =            x;
		this.y =            y;
		this.diameter =     diameter;
		this.contrast =     contrast;
		this.contrast_a =   contrast_a;
		this.eccentricity = eccentricity;
	}

	public static TrackList fromRecords(List<TrackRecord> records) {
		int n = records.size();
		float [][] columns = new float [6][n];
		for (int i = 0; i < n; i++) {
			TrackRecord tr = records.get(i);
			columns[0][i] = (float) tr.x;
			columns[1][i] = (float) tr.y;
			columns[2][i] = (float) tr.diameter;
			columns[3][i] = (float) tr.contrast;
			columns[4][i] = (float) tr.contrast_a;
			columns[5][i] = (float) tr.eccentricity;
		}
		return new TrackList(columns[0], columns[1], columns[2], columns[3], columns[4], columns[5]);
	}

	public int size() {
		return x.length;
	}

	public double getX(int i)            {return x[i];}
	public double getY(int i)            {return y[i];}
	public double getDiameter(int i)     {return diameter[i];}
	public double getContrast(int i)     {return contrast[i];}
	public double getEccentricity(int i) {return eccentricity[i];}

	public TrackRecord get(int i) {
		return new TrackRecord(x[i], y[i], diameter[i], contrast[i], contrast_a[i], eccentricity[i]);
	}

	public TrackList select(boolean [] keep) {
		int n = 0;
		for (int i = 0; i < keep.length; i++) if (keep[i]) n++;
		float [][] columns = new float [6][n];
		int k = 0;
		for (int i = 0; i < x.length; i++) if (keep[i]) {
			columns[0][k] = x[i];
			columns[1][k] = y[i];
			columns[2][k] = diameter[i];
			columns[3][k] = contrast[i];
			columns[4][k] = contrast_a[i];
			columns[5][k] = eccentricity[i];
			k++;
		}
		return new TrackList(columns[0], columns[1], columns[2], columns[3], columns[4], columns[5]);
	}

	/**
	 * Rotate positions counterclockwise around the detector origin
	 * @param angle rotation angle (radians)
	 */
	public TrackList rotated(double angle) {
		double ca = Math.cos(angle), sa = Math.sin(angle);
		float [] xr = new float [x.length];
		float [] yr = new float [x.length];
		for (int i = 0; i < x.length; i++) {
			xr[i] = (float) (ca * x[i] - sa * y[i]);
			yr[i] = (float) (sa * x[i] + ca * y[i]);
		}
		return new TrackList(xr, yr, diameter, contrast, contrast_a, eccentricity);
	}

	public TrackList shifted(double dx, double dy) {
		float [] xs = new float [x.length];
		float [] ys = new float [x.length];
		for (int i = 0; i < x.length; i++) {
			xs[i] = (float) (x[i] + dx);
			ys[i] = (float) (y[i] + dy);
		}
		return new TrackList(xs, ys, diameter, contrast, contrast_a, eccentricity);
	}

	/**
	 * Scanner output of real data has contrasts and diameters with an offset, move their minimums to 0
	 * (both contrasts are shifted by the minimum of "cn")
	 */
	public TrackList withZeroedContrastAndDiameter() {
		if (x.length == 0) return this;
		float cn_min = min(contrast);
		float d_min =  min(diameter);
		float [] cn = new float [x.length];
		float [] ca = new float [x.length];
		float [] d =  new float [x.length];
		for (int i = 0; i < x.length; i++) {
			cn[i] = contrast[i] -   cn_min;
			ca[i] = contrast_a[i] - cn_min;
			d[i] =  diameter[i] -   d_min;
		}
		return new TrackList(x, y, d, cn, ca, eccentricity);
	}

	/**
	 * Well-defined tracks
	 * @return contrast < max_contrast and eccentricity < max_eccentricity
	 */
	public boolean [] qualityMask(double max_contrast, double max_eccentricity) {
		boolean [] mask = new boolean [x.length];
		for (int i = 0; i < x.length; i++) {
			mask[i] = (contrast[i] < max_contrast) && (eccentricity[i] < max_eccentricity);
		}
		return mask;
	}

	/**
	 * @return selection & (d_min <= diameter < d_max)
	 */
	public boolean [] diameterMask(boolean [] selection, double d_min, double d_max) {
		boolean [] mask = new boolean [x.length];
		for (int i = 0; i < x.length; i++) {
			mask[i] = selection[i] && (diameter[i] >= d_min) && (diameter[i] < d_max);
		}
		return mask;
	}

	public double maxX() {
		return (x.length > 0) ? max(x) : Double.NaN;
	}

	public double maxY() {
		return (y.length > 0) ? max(y) : Double.NaN;
	}

	/**
	 * Centroid of the selected tracks
	 * @return {mean x, mean y}, NaN if nothing is selected
	 */
	public double [] centroid(boolean [] selection) {
		double sx = 0, sy = 0;
		int n = 0;
		for (int i = 0; i < x.length; i++) if (selection[i]) {
			sx += x[i];
			sy += y[i];
			n++;
		}
		return new double [] {sx / n, sy / n};
	}

	public double diameterStd() {
		int n = diameter.length;
		if (n == 0) return 0.0;
		double s = 0, s2 = 0;
		for (float d : diameter) s += d;
		double mean = s / n;
		for (float d : diameter) s2 += (d - mean) * (d - mean);
		return Math.sqrt(s2 / n);
	}

	private static float min(float [] data) {
		float m = Float.POSITIVE_INFINITY;
		for (float d : data) if (d < m) m = d;
		return m;
	}

	private static float max(float [] data) {
		float m = Float.NEGATIVE_INFINITY;
		for (float d : data) if (d > m) m = d;
		return m;
	}
}
