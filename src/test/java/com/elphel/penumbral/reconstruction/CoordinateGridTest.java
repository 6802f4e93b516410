/**
 **
 ** CoordinateGridTest - tests of the grids and the track histograms
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CoordinateGridTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.elphel.penumbral.common.DoubleArrays;
import com.elphel.penumbral.tracks.TrackList;

class CoordinateGridTest {

	@Test
	void binsAreHalfOpenExceptTheLast() {
		double [] edges = {-1.0, -0.5, 0.0, 0.5, 1.0};
		assertEquals(0,  CoordinateGrid.binIndex(edges, -1.0));
		assertEquals(2,  CoordinateGrid.binIndex(edges, 0.0));
		assertEquals(3,  CoordinateGrid.binIndex(edges, 0.5));
		assertEquals(3,  CoordinateGrid.binIndex(edges, 1.0));
		assertEquals(-1, CoordinateGrid.binIndex(edges, 1.0001));
		assertEquals(-1, CoordinateGrid.binIndex(edges, -1.0001));
		assertEquals(-1, CoordinateGrid.binIndex(edges, Double.NaN));
	}

	@Test
	void histogramCountsTracksInside() {
		CoordinateGrid detector = CoordinateGrid.detector(1.0, 4);
		TrackList tracks = SyntheticTracks.points(new double [][] {
				{1.0, 1.0}, {-1.0, -1.0}, {0.25, -0.75}, {0.3, -0.6}, {2.0, 0.0}});
		double [][] counts = detector.histogram(tracks);
		assertEquals(1.0, counts[3][3], 0.0);
		assertEquals(1.0, counts[0][0], 0.0);
		assertEquals(2.0, counts[2][0], 0.0);
		assertEquals(4.0, DoubleArrays.sum(counts), 0.0);
	}

	@Test
	void shiftedHistogramMovesTheBins() {
		CoordinateGrid detector = CoordinateGrid.detector(1.0, 4);
		TrackList tracks = SyntheticTracks.points(new double [][] {{0.75, 0.25}});
		double [][] counts = detector.histogram(tracks, 0.5, 0.0);
		assertEquals(1.0, counts[2][2], 0.0);
		double [][] both = new double [4][4];
		detector.accumulateHistogram(both, tracks, 0.0, 0.0);
		detector.accumulateHistogram(both, tracks, 0.5, 0.0);
		assertEquals(1.0, both[3][2], 0.0);
		assertEquals(1.0, both[2][2], 0.0);
	}

	@Test
	void kernelSizeIsOdd() {
		assertEquals(5,  CoordinateGrid.kernelSize(1.0, 1.0, 0.5));
		assertEquals(9,  CoordinateGrid.kernelSize(1.0, 1.0, 0.25));
		assertEquals(47, CoordinateGrid.kernelSize(1.05, 0.11, 0.331 / 66));
	}

	@Test
	void sourceConvolvedWithKernelCoversTheImage() {
		CoordinateGrid image = CoordinateGrid.image(0.3, -0.2, 1.0, 20);
		assertEquals(0.1, image.getPitchX(), 1e-12);
		int k = CoordinateGrid.kernelSize(1.0, 0.4, image.getPitchX());
		assertEquals(9, k);
		CoordinateGrid kernel = CoordinateGrid.kernel(image, k);
		assertEquals(k, kernel.getNumX());
		assertEquals(0.0, kernel.getXCenters()[k / 2], 1e-12);
		CoordinateGrid source = CoordinateGrid.source(image, k, 10.0);
		assertEquals(20, source.getNumX() + k - 1);
		assertEquals(image.getXEdges()[4] / 10.0, source.getXEdges()[0], 1e-15);
		assertEquals(image.getPitchY() / 10.0, source.getPitchY(), 1e-12);
		assertThrows(IllegalArgumentException.class, () -> CoordinateGrid.source(image, 21, 10.0));
	}

	@Test
	void distanceFromAPoint() {
		CoordinateGrid grid = new CoordinateGrid(new double [] {0, 1, 2}, new double [] {0, 2});
		assertArrayEquals(new double [] {0.5, 1.5}, grid.getXCenters(), 0.0);
		double [][] r = grid.distance(0.5, 0.0);
		assertEquals(1.0, r[0][0], 1e-15);
		assertEquals(Math.sqrt(2), r[1][0], 1e-15);
	}
}
