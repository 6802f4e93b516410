/**
 **
 ** ResultSaverTest - tests of the TIFF output
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResultSaverTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elphel.penumbral.readers.ShotRecord;
import com.elphel.penumbral.tracks.EnergyCut;

import ij.IJ;
import ij.ImagePlus;
import ij.process.ImageProcessor;

class ResultSaverTest {
	private final ShotRecord record = new ShotRecord("95520", 2, 1000, 2000, 4.21, 14.0, 0.0, "5 h");

	private static BrightnessMap map() {
		CoordinateGrid source = new CoordinateGrid(new double [] {-3e-4, -1e-4, 1e-4, 3e-4}, new double [] {-2e-4, 0.0, 2e-4});
		double [][] brightness = {{0.1, 0.2}, {0.3, 1.0}, {0.5, 0.6}};
		EnergyCut cut = new EnergyCut(0.0, 5.0, 2.0, 7.0, 4.0, 26.6);
		return new BrightnessMap(source, brightness, cut, null, 1.1, 1000);
	}

	@Test
	void fileNameHasShotPortDiametersAndEtch() {
		assertEquals("95520 TIM2 4.0-26.6 5.0h.tif", ResultSaver.getFileName(record, map()));
	}

	@Test
	void imageHasYUp() {
		ImagePlus imp = ResultSaver.toImagePlus("test", map());
		assertEquals(3, imp.getWidth());
		assertEquals(2, imp.getHeight());
		ImageProcessor ip = imp.getProcessor();
		assertEquals(0.1f, ip.getPixelValue(0, 1), 0.0f);
		assertEquals(0.2f, ip.getPixelValue(0, 0), 0.0f);
		assertEquals(1.0f, ip.getPixelValue(1, 0), 0.0f);
		assertEquals(2.0, imp.getCalibration().pixelWidth, 1e-9);
		String unit = imp.getCalibration().getUnit();
		assertTrue(unit.equals("um") || unit.equals("\u00B5m"), unit);
	}

	@Test
	void savesOneTiffPerMap(@TempDir Path dir) throws IOException {
		BrightnessMap map = map();
		ShotResult result = new ShotResult(record, null, Collections.singletonList(map), Collections.emptyList(),
				null, new double [3], new double [3], null);
		List<Path> paths = new ResultSaver(dir.resolve("results")).save(result);
		assertEquals(1, paths.size());
		assertTrue(Files.isRegularFile(paths.get(0)));
		ImagePlus imp = IJ.openImage(paths.get(0).toString());
		assertEquals(3, imp.getWidth());
		assertEquals(1.0f, imp.getProcessor().getPixelValue(1, 0), 0.0f);
	}
}
