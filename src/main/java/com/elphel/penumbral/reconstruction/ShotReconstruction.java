/**
 **
 ** ShotReconstruction - reconstruction of all energy cuts of one track file
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShotReconstruction.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.aperture.AnalyticBrightness;
import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.ReconstructionParameters;
import com.elphel.penumbral.fitting.ApertureGeometry;
import com.elphel.penumbral.fitting.FitResult;
import com.elphel.penumbral.readers.ShotRecord;
import com.elphel.penumbral.tracks.DiameterConverter;
import com.elphel.penumbral.tracks.EnergyCut;
import com.elphel.penumbral.tracks.TrackList;

/**
 * Prepares the tracks of a shot (rotation, real data corrections, centering) and runs the energy
 * cuts in order. The charge fitted by the first successful geometry fit is kept for the later
 * cuts of the same shot, each of them starts at the previous center.
 */
public class ShotReconstruction {
	private static final Logger LOGGER = LoggerFactory.getLogger(ShotReconstruction.class);

	private final ReconstructionParameters params;
	private final AnalyticBrightness       analytic_brightness;
	private final DiameterConverter        diameter_converter;
	private final Deconvolver              deconvolver;

	public ShotReconstruction(
			ReconstructionParameters params,
			AnalyticBrightness       analytic_brightness,
			DiameterConverter        diameter_converter,
			Deconvolver              deconvolver) {
		this.params =              params.clone();
		this.analytic_brightness = analytic_brightness;
		this.diameter_converter =  diameter_converter;
		this.deconvolver =         deconvolver;
	}

	public ShotResult reconstruct(ShotRecord record, TrackList raw_tracks) {
		if (raw_tracks.size() == 0) {
			throw new IllegalArgumentException("Track list of "+record+" is empty");
		}
		double view_radius = Math.max(raw_tracks.maxX(), raw_tracks.maxY());
		ShotGeometry geometry = ShotGeometry.create(record, view_radius, params);
		LOGGER.info(geometry.toString());

		TrackList tracks = prepareTracks(record, raw_tracks, geometry);
		boolean [] quality = tracks.qualityMask(params.max_contrast, params.max_eccentricity);
		TrackList good = tracks.select(quality);
		List<BrightnessMap> maps = new ArrayList<BrightnessMap>();
		List<FitResult> fits = new ArrayList<FitResult>();
		if (good.size() == 0) {
			LOGGER.warn("No tracks pass the contrast and eccentricity limits for "+record);
		} else {
			double [] center = good.centroid(all(good.size()));
			good = good.shifted(-center[0], -center[1]);
			boolean synthetic = tracks.diameterStd() == 0;
			List<EnergyCut> cuts = EnergyCut.createCuts(
					synthetic, geometry.etch_hours, diameter_converter, params.filter_loss, params.max_energy);

			PenumbraModel model = new PenumbraModel(analytic_brightness, geometry.num_bins);
			CoordinateGrid detector = CoordinateGrid.detector(geometry.view_radius, geometry.num_bins);
			CutReconstruction cut_reconstruction = new CutReconstruction(params, geometry, model, deconvolver, detector);
			ApertureGeometry previous = null;
			boolean [] everything = all(good.size());
			for (EnergyCut cut : cuts) {
				TrackList cut_tracks = good.select(good.diameterMask(everything, cut.d_min, cut.d_max));
				CutReconstruction.Outcome outcome = cut_reconstruction.reconstruct(cut_tracks, cut, previous);
				if (outcome.fit != null) {
					fits.add(outcome.fit);
					if (outcome.fit.isFeasible()) {
						previous = outcome.fit.geometry;
					}
				}
				if (outcome.map != null) {
					maps.add(outcome.map);
				}
			}
		}

		ShapeParameters shape = null;
		if (!maps.isEmpty()) {
			shape = ShapeParameters.calculate(maps.get(0));
			LOGGER.info(shape.toString());
		}
		PortBasis basis = PortBasis.forPort(record.tim);
		double [] offset = basis.project(record.offset_r * 1e-4, record.offset_theta, record.offset_phi); // cm
		double [] flow =   basis.project(record.flow_r * 1e-4,   record.flow_theta,   record.flow_phi);   // cm/ns
		return new ShotResult(record, geometry, maps, fits, shape, offset, flow, null);
	}

	/**
	 * Rotate by the detector rotation plus the 180 degree flip of the aperture imaging, move the
	 * contrast and diameter minimums of real data to zero
	 */
	TrackList prepareTracks(ShotRecord record, TrackList raw_tracks, ShotGeometry geometry) {
		TrackList tracks = raw_tracks.rotated(geometry.rotation + Math.PI);
		if (record.isRealData()) {
			tracks = tracks.withZeroedContrastAndDiameter();
		}
		return tracks;
	}

	private static boolean [] all(int n) {
		boolean [] b = new boolean [n];
		Arrays.fill(b, true);
		return b;
	}
}
