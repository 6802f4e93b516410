/**
 **
 ** CutReconstructionTest - end-to-end tests of one energy cut
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CutReconstructionTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.elphel.penumbral.aperture.ChargedApertureBrightness;
import com.elphel.penumbral.aperture.HexLattice;
import com.elphel.penumbral.aperture.PenumbraModel;
import com.elphel.penumbral.common.DoubleArrays;
import com.elphel.penumbral.common.ReconstructionParameters;
import com.elphel.penumbral.fitting.ApertureGeometry;
import com.elphel.penumbral.fitting.FitMode;
import com.elphel.penumbral.tracks.EnergyCut;
import com.elphel.penumbral.tracks.EtchDiameterModel;
import com.elphel.penumbral.tracks.TrackList;

/**
 * A point source behind a single uncharged aperture: r0 = 0.11 cm, M = 10, 66 detector bins
 * over a 1.2 cm wide detector.
 */
class CutReconstructionTest {
	static final double X0 =          0.03;
	static final double Y0 =         -0.02;
	static final double M =           10.0;
	static final double VIEW_RADIUS = 0.6;

	private ReconstructionParameters params;
	private ShotGeometry             geometry;
	private EnergyCut                cut;

	static ReconstructionParameters testParameters() {
		ReconstructionParameters params = new ReconstructionParameters();
		params.object_size = 50e-4;
		params.resolution = 20;
		params.threshold = 1e-6;
		params.deconvolution_max_iterations = 300;
		return params;
	}

	@BeforeEach
	void setUp() {
		params = testParameters();
		geometry = new ShotGeometry(0.01, 0.1, M, 0.0, 5.0, VIEW_RADIUS, params);
		cut = EnergyCut.createCuts(true, 5.0, new EtchDiameterModel(), params.filter_loss, params.max_energy).get(0);
	}

	private CutReconstruction reconstruction(ShotGeometry geometry, Deconvolver deconvolver) {
		return new CutReconstruction(
				params,
				geometry,
				new PenumbraModel(new ChargedApertureBrightness(), geometry.num_bins),
				deconvolver,
				CoordinateGrid.detector(geometry.view_radius, geometry.num_bins));
	}

	private CutReconstruction reconstruction() {
		return reconstruction(geometry, new GelfgatDeconvolver(params.deconvolution_max_iterations, 0));
	}

	/**
	 * Accepts anything and returns a single bright pixel in the middle of the source
	 */
	private static Deconvolver stub(final double chi2) {
		return (counts, background, kernel, initial_guess, threshold, data_mask, illegal_mask) -> {
			double [][] g = new double [illegal_mask.length][illegal_mask[0].length];
			g[g.length / 2][g[0].length / 2] = 7.0;
			return new DeconvolutionResult(g, chi2, background, 1);
		};
	}

	@Test
	void pointSourceIsRecovered() {
		assertEquals(66, geometry.num_bins);
		TrackList tracks = SyntheticTracks.disk(new Random(1), 5000, X0, Y0, geometry.r0);
		CutReconstruction.Outcome outcome = reconstruction().reconstruct(tracks, cut, null);

		assertNotNull(outcome.fit);
		assertTrue(outcome.fit.isFeasible());
		assertEquals(FitMode.POSITION_BLUR_CHARGE, outcome.fit.mode);
		double pitch = 2 * VIEW_RADIUS / geometry.num_bins;
		ApertureGeometry g = outcome.fit.geometry;
		assertEquals(X0, g.x0, pitch);
		assertEquals(Y0, g.y0, pitch);
		assertTrue(g.delta < pitch, "delta = "+g.delta);
		assertTrue(g.charge >= 0.0);

		BrightnessMap map = outcome.map;
		assertNotNull(map);
		assertSame(cut, map.cut);
		assertEquals(5000, map.num_tracks);
		assertEquals(1.0, DoubleArrays.max(map.brightness), 0.0);
		assertTrue(DoubleArrays.min(map.brightness) >= 0.0);
		assertTrue(map.chi2_per_pixel < params.chi2_threshold);
		double [] peak = map.getPeak();
		assertEquals(X0 / M, peak[0], 1.5 * map.source.getPitchX());
		assertEquals(Y0 / M, peak[1], 1.5 * map.source.getPitchY());
	}

	@Test
	void reconstructionIsRepeatable() {
		TrackList tracks = SyntheticTracks.disk(new Random(2), 3000, X0, Y0, geometry.r0);
		CutReconstruction.Outcome first =  reconstruction().reconstruct(tracks, cut, null);
		CutReconstruction.Outcome second = reconstruction().reconstruct(tracks, cut, null);
		assertEquals(first.fit.geometry.x0, second.fit.geometry.x0, 0.0);
		assertEquals(first.fit.geometry.charge, second.fit.geometry.charge, 0.0);
		assertEquals(first.map == null, second.map == null);
		if (first.map != null) {
			for (int i = 0; i < first.map.brightness.length; i++) {
				assertArrayEquals(first.map.brightness[i], second.map.brightness[i], 0.0);
			}
		}
	}

	@Test
	void uniformBackgroundIsFitted() {
		Random rnd = new Random(3);
		double per_pixel = 20.0;
		int num_background = (int) (per_pixel * geometry.num_bins * geometry.num_bins);
		TrackList tracks = SyntheticTracks.concat(
				SyntheticTracks.disk(rnd, 20000, X0, Y0, geometry.r0),
				SyntheticTracks.uniform(rnd, num_background, VIEW_RADIUS));
		CutReconstruction.Outcome outcome = reconstruction().reconstruct(tracks, cut, null);

		assertTrue(outcome.fit.isFeasible());
		assertEquals(per_pixel, outcome.fit.minimum, 0.08 * per_pixel);
		BrightnessMap map = outcome.map;
		assertNotNull(map);
		double [] peak = map.getPeak();
		double [] xs = map.source.getXCenters(), ys = map.source.getYCenters();
		double far_radius = 5 * map.source.getPitchX();
		double sum = 0;
		int n = 0;
		for (int i = 0; i < xs.length; i++) {
			for (int j = 0; j < ys.length; j++) {
				if (Math.hypot(xs[i] - peak[0], ys[j] - peak[1]) > far_radius) {
					sum += map.brightness[i][j];
					n++;
				}
			}
		}
		assertTrue(n > 0);
		assertTrue(sum / n < 0.25, "mean brightness away from the source = "+(sum / n));
	}

	@Test
	void poorDeconvolutionIsRejected() {
		TrackList tracks = SyntheticTracks.disk(new Random(4), 3000, X0, Y0, geometry.r0);
		CutReconstruction.Outcome outcome = reconstruction(geometry, stub(1e9)).reconstruct(tracks, cut, null);
		assertTrue(outcome.fit.isFeasible());
		assertNull(outcome.map);
		outcome = reconstruction(geometry, stub(Double.NaN)).reconstruct(tracks, cut, null);
		assertNull(outcome.map);
	}

	@Test
	void knownChargeIsKept() {
		TrackList tracks = SyntheticTracks.disk(new Random(5), 3000, X0, Y0, geometry.r0);
		ApertureGeometry previous = new ApertureGeometry(X0 + 0.01, Y0 - 0.01, 0.005, 0.0, geometry.r0);
		CutReconstruction.Outcome outcome = reconstruction(geometry, stub(0.0)).reconstruct(tracks, cut, previous);
		assertEquals(FitMode.POSITION_BLUR, outcome.fit.mode);
		assertEquals(0.0, outcome.fit.geometry.charge, 0.0);
		assertEquals(X0, outcome.fit.geometry.x0, 2 * VIEW_RADIUS / geometry.num_bins);
		assertNotNull(outcome.map);
		assertEquals(1.0, DoubleArrays.max(outcome.map.brightness), 0.0);
	}

	@Test
	void emptyCutHasNoFit() {
		TrackList none = SyntheticTracks.disk(new Random(6), 0, X0, Y0, geometry.r0);
		CutReconstruction.Outcome outcome = reconstruction(geometry, stub(0.0)).reconstruct(none, cut, null);
		assertNull(outcome.fit);
		assertNull(outcome.map);
	}

	@Test
	void aperturesAreFoldedOntoTheCenter() {
		ShotGeometry lattice = new ShotGeometry(0.01, 0.02, M, 0.0, 5.0, VIEW_RADIUS, params);
		List<double []> offsets = HexLattice.getOffsets(lattice.s0, lattice.r_img, VIEW_RADIUS, params.lattice_half_extent);
		assertEquals(13, offsets.size());
		double [][] xy = new double [offsets.size()][];
		for (int i = 0; i < xy.length; i++) {
			xy[i] = new double [] {offsets.get(i)[0] + 0.001, offsets.get(i)[1] + 0.001};
		}
		CoordinateGrid image = CoordinateGrid.image(0.0, 0.0, lattice.r_img, lattice.num_bins);
		double [][] combined = reconstruction(lattice, stub(0.0)).foldApertures(image, SyntheticTracks.points(xy));
		assertEquals(13.0, DoubleArrays.sum(combined), 0.0);
		assertEquals(13.0, DoubleArrays.max(combined), 0.0);
	}

	@Test
	void sourceOutsideTheInscribedCircleIsIllegal() {
		CoordinateGrid source = new CoordinateGrid(DoubleArrays.linspace(-1.0, 1.0, 21), DoubleArrays.linspace(-1.0, 1.0, 21));
		boolean [][] illegal = CutReconstruction.illegalMask(source);
		assertTrue(illegal[0][0]);
		assertTrue(illegal[19][0]);
		assertFalse(illegal[10][10]);
		assertFalse(illegal[0][10]);
		assertFalse(illegal[10][19]);
	}
}
