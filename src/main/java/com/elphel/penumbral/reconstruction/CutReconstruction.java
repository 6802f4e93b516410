/**
 **
 ** CutReconstruction - source reconstruction from the tracks of one energy cut
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CutReconstruction.java is free software: you can redistribute it and/or modify
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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.aperture.HexLattice;
import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.DoubleArrays;
import com.elphel.penumbral.common.ReconstructionParameters;
import com.elphel.penumbral.fitting.ApertureGeometry;
import com.elphel.penumbral.fitting.FitMode;
import com.elphel.penumbral.fitting.FitResult;
import com.elphel.penumbral.fitting.GeometryFitter;
import com.elphel.penumbral.fitting.MultiApertureObjective;
import com.elphel.penumbral.tracks.EnergyCut;
import com.elphel.penumbral.tracks.TrackList;

/**
 * Steps for one cut:
 * <ol>
 * <li>histogram the tracks on the detector grid and fit the aperture array geometry, with the
 * charge when it is not known yet, with the charge of the previous cut otherwise</li>
 * <li>fold all aperture images onto one image grid around the fitted center</li>
 * <li>build the penumbral kernel, the initial guess and the data mask</li>
 * <li>deconvolve, reject results with chi2 per data pixel over the limit</li>
 * </ol>
 */
public class CutReconstruction {
	private static final Logger LOGGER = LoggerFactory.getLogger(CutReconstruction.class);

	private final ReconstructionParameters params;
	private final ShotGeometry             geometry;
	private final PenumbraModel            model;
	private final Deconvolver              deconvolver;
	private final CoordinateGrid           detector;

	public static class Outcome {
		public final FitResult     fit; // null if the cut had no tracks
		public final BrightnessMap map; // null if the cut was rejected

		Outcome(FitResult fit, BrightnessMap map) {
			this.fit = fit;
			this.map = map;
		}
	}

	public CutReconstruction(
			ReconstructionParameters params,
			ShotGeometry             geometry,
			PenumbraModel            model,
			Deconvolver              deconvolver,
			CoordinateGrid           detector) {
		this.params =      params;
		this.geometry =    geometry;
		this.model =       model;
		this.deconvolver = deconvolver;
		this.detector =    detector;
	}

	/**
	 * @param tracks centered quality tracks of this cut
	 * @param cut energy cut
	 * @param previous geometry fitted for the previous cut of the shot, null to fit the charge
	 * @return fitted geometry (also for rejected reconstructions) and the brightness map
	 */
	public Outcome reconstruct(TrackList tracks, EnergyCut cut, ApertureGeometry previous) {
		if (tracks.size() <= 0) {
			LOGGER.warn("No tracks found in this cut.");
			return new Outcome(null, null);
		}
		LOGGER.info(cut+": "+tracks.size()+" tracks");
		double [][] counts = detector.histogram(tracks);
		FitResult fit = fitGeometry(counts, cut, previous);
		if (!fit.isFeasible()) {
			LOGGER.warn("Could not find adequate fit.");
			return new Outcome(fit, null);
		}
		ApertureGeometry g = fit.geometry;
		LOGGER.info(String.format("n = %.4g, (x0, y0) = (%.3f, %.3f), delta = %.3f um, Q = %.3f cm/MeV, M = %.2f",
				DoubleArrays.sum(counts), g.x0, g.y0, g.delta / geometry.magnification / 1e-4, g.charge,
				geometry.magnification));

		CoordinateGrid image = CoordinateGrid.image(g.x0, g.y0, geometry.r_img, geometry.num_bins);
		double [][] combined = foldApertures(image, tracks);

		int kernel_size = CoordinateGrid.kernelSize(params.spread, geometry.r0, image.getPitchX());
		CoordinateGrid kernel_grid = CoordinateGrid.kernel(image, kernel_size);
		CoordinateGrid source = CoordinateGrid.source(image, kernel_size, geometry.magnification);
		double [][] kernel = PenumbralKernel.create(
				model, kernel_grid, g.charge, geometry.r0, geometry.r_img,
				cut.e_in_min, cut.e_in_max, params.kernel_supersample).getValues();

		double [][] distance = image.distance(g.x0, g.y0);
		int ni = image.getNumX(), nj = image.getNumY();
		boolean [][] outside = new boolean [ni][nj];
		boolean [][] inside =  new boolean [ni][nj];
		for (int i = 0; i < ni; i++) {
			for (int j = 0; j < nj; j++) {
				outside[i][j] = distance[i][j] > (geometry.r_img + geometry.r0) / 2;
				inside[i][j] =  distance[i][j] < geometry.r0 / 2;
			}
		}
		double background = DoubleArrays.average(combined, outside);
		double umbra =      DoubleArrays.average(combined, inside);
		if (Double.isNaN(background)) background = 0.0;
		double [] d_flat = model.penumbra(
				DoubleArrays.flatten(distance), g.delta, g.charge, geometry.r0, geometry.r_img,
				background, umbra, cut.e_in_min, cut.e_in_max);
		double [][] initial_guess = new double [ni][nj];
		for (int i = 0; i < ni; i++) {
			System.arraycopy(d_flat, i * nj, initial_guess[i], 0, nj);
		}

		DataMask data_mask = DataMask.create(
				combined, image, kernel, source, params.reach_low_quantile, params.reach_high_quantile);
		int num_data = data_mask.getNumIncluded();
		if (num_data == 0) {
			LOGGER.warn("Could not find adequate fit.");
			return new Outcome(fit, null);
		}
		boolean [][] illegal = illegalMask(source);

		double [][] net = new double [ni][nj];
		for (int i = 0; i < ni; i++) {
			for (int j = 0; j < nj; j++) {
				net[i][j] = combined[i][j] - background;
			}
		}
		DeconvolutionResult result = deconvolver.deconvolve(
				net, background, kernel, initial_guess, params.threshold, data_mask.getMask(), illegal);
		double chi2_per_pixel = result.chi2 / num_data;
		if (!(chi2_per_pixel < params.chi2_threshold)) { // NaN is rejected too
			LOGGER.warn("Could not find adequate fit.");
			if (params.debug_level > 0) {
				LOGGER.debug("chi2 per data pixel = "+chi2_per_pixel);
			}
			return new Outcome(fit, null);
		}
		double [][] brightness = new double [result.brightness.length][];
		for (int i = 0; i < brightness.length; i++) {
			brightness[i] = new double [result.brightness[i].length];
			for (int j = 0; j < brightness[i].length; j++) {
				brightness[i][j] = Math.max(0.0, result.brightness[i][j]);
			}
		}
		double b_max = DoubleArrays.max(brightness);
		if (!(b_max > 0)) {
			LOGGER.warn("Reconstructed brightness is empty for "+cut);
			return new Outcome(fit, null);
		}
		return new Outcome(
				fit,
				new BrightnessMap(source, DoubleArrays.scale(brightness, 1.0 / b_max), cut, fit, chi2_per_pixel, tracks.size()));
	}

	FitResult fitGeometry(double [][] counts, EnergyCut cut, ApertureGeometry previous) {
		MultiApertureObjective objective = new MultiApertureObjective(
				model,
				detector.getXCenters(),
				detector.getYCenters(),
				counts,
				geometry.s0,
				geometry.r_img,
				geometry.view_radius,
				cut.e_in_min,
				cut.e_in_max,
				params);
		GeometryFitter fitter = new GeometryFitter(params);
		FitMode mode;
		ApertureGeometry template;
		double x0, y0;
		if (previous == null) {
			mode = params.fit_affine ? FitMode.POSITION_BLUR_CHARGE_AFFINE : FitMode.POSITION_BLUR_CHARGE;
			template = new ApertureGeometry(0.0, 0.0, 0.0, 0.0, geometry.r0);
			x0 = 0.0;
			y0 = 0.0;
		} else {
			mode = FitMode.POSITION_BLUR;
			template = previous;
			x0 = previous.x0;
			y0 = previous.y0;
		}
		double [][] simplex = fitter.initialSimplex(mode, x0, y0, geometry.r_img, geometry.blur_scale, template);
		FitResult fit = fitter.fit(objective, mode, simplex, template);
		LOGGER.debug(fit.toString());
		return fit;
	}

	/**
	 * Histogram of the tracks of all apertures shifted onto the central one
	 */
	double [][] foldApertures(CoordinateGrid image, TrackList tracks) {
		double [][] combined = new double [image.getNumX()][image.getNumY()];
		List<double []> offsets = HexLattice.getOffsets(
				geometry.s0, geometry.r_img, geometry.view_radius, params.lattice_half_extent);
		for (double [] offset : offsets) {
			image.accumulateHistogram(combined, tracks, offset[0], offset[1]);
		}
		return combined;
	}

	/**
	 * Source pixels outside the circle inscribed in the source grid plus one pixel
	 */
	static boolean [][] illegalMask(CoordinateGrid source) {
		double [] xs = source.getXCenters(), ys = source.getYCenters();
		int nx = xs.length, ny = ys.length;
		double xc = (xs[0] + xs[nx - 1]) / 2, yc = (ys[0] + ys[ny - 1]) / 2;
		double radius = (xs[nx - 1] - xs[0]) / 2 + source.getPitchX();
		boolean [][] illegal = new boolean [nx][ny];
		for (int i = 0; i < nx; i++) {
			for (int j = 0; j < ny; j++) {
				illegal[i][j] = Math.hypot(xs[i] - xc, ys[j] - yc) >= radius;
			}
		}
		return illegal;
	}
}
