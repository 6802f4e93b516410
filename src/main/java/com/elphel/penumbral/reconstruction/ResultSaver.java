/**
 **
 ** ResultSaver - stores brightness maps as calibrated 32-bit TIFF files
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResultSaver.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.readers.ShotRecord;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.measure.Calibration;
import ij.process.FloatProcessor;

public class ResultSaver {
	private static final Logger LOGGER = LoggerFactory.getLogger(ResultSaver.class);

	private final Path directory;

	public ResultSaver(Path directory) {
		this.directory = directory;
	}

	/**
	 * @return "shot TIMn dlo-dhi etchh.tif"
	 */
	public static String getFileName(ShotRecord record, BrightnessMap map) {
		return String.format(Locale.ROOT, "%s TIM%d %.1f-%.1f %sh.tif",
				record.shot, record.tim, map.cut.d_min, map.cut.d_max, Double.toString(record.getEtchHours()));
	}

	/**
	 * Image with x to the right and y up, pixel size in um, origin at the source plane origin
	 */
	public static ImagePlus toImagePlus(String title, BrightnessMap map) {
		int width = map.source.getNumX(), height = map.source.getNumY();
		float [] pixels = new float [width * height];
		for (int i = 0; i < width; i++) {
			for (int j = 0; j < height; j++) {
				pixels[(height - 1 - j) * width + i] = (float) map.brightness[i][j];
			}
		}
		FloatProcessor fp = new FloatProcessor(width, height, pixels);
		fp.resetMinAndMax();
		ImagePlus imp = new ImagePlus(title, fp);
		Calibration cal = imp.getCalibration();
		cal.setUnit("um");
		cal.pixelWidth =  map.source.getPitchX() / 1e-4;
		cal.pixelHeight = map.source.getPitchY() / 1e-4;
		cal.xOrigin = -map.source.getXEdges()[0] / map.source.getPitchX();
		cal.yOrigin = map.source.getYEdges()[height] / map.source.getPitchY();
		cal.setInvertY(true);
		return imp;
	}

	public List<Path> save(ShotResult result) throws IOException {
		Files.createDirectories(directory);
		List<Path> paths = new ArrayList<Path>();
		for (BrightnessMap map : result.maps) {
			String name = getFileName(result.record, map);
			Path path = directory.resolve(name);
			ImagePlus imp = toImagePlus(name, map);
			FileSaver fs = new FileSaver(imp);
			if (!fs.saveAsTiff(path.toString())) {
				throw new IOException("Failed to save "+path);
			}
			LOGGER.info("Saved "+path);
			paths.add(path);
		}
		return paths;
	}
}
