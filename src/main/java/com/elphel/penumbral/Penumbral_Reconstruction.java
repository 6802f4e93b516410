/**
 **
 ** Penumbral_Reconstruction - ImageJ plugin running the reconstruction of a shot catalog
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Penumbral_Reconstruction.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.common.ReconstructionParameters;
import com.elphel.penumbral.reconstruction.BrightnessMap;
import com.elphel.penumbral.reconstruction.ReconstructionBatch;
import com.elphel.penumbral.reconstruction.ResultSaver;
import com.elphel.penumbral.reconstruction.ShotResult;

import ij.IJ;
import ij.ImagePlus;
import ij.io.OpenDialog;
import ij.plugin.PlugIn;

/**
 * Asks for the parameters and the shot catalog, reconstructs all shots and shows the first
 * brightness map of each of them.
 */
public class Penumbral_Reconstruction implements PlugIn {
	private static final Logger LOGGER = LoggerFactory.getLogger(Penumbral_Reconstruction.class);

	static ReconstructionParameters PARAMETERS = new ReconstructionParameters(); // kept between runs

	/**
	 * @param arg path to the catalog, empty to select it in a dialog
	 */
	@Override
	public void run(String arg) {
		if (!PARAMETERS.showDialog("Penumbral reconstruction parameters")) return;
		String path = ((arg != null) && !arg.isEmpty()) ? arg : new OpenDialog("Select shot catalog", null).getPath();
		if (path == null) return;
		List<ShotResult> results;
		try {
			results = new ReconstructionBatch(PARAMETERS).run(Paths.get(path));
		} catch (IOException e) {
			LOGGER.error("Failed to read shot catalog "+path, e);
			IJ.error("Penumbral reconstruction", "Failed to read "+path+":\n"+e.getMessage());
			return;
		}
		for (ShotResult result : results) {
			if (!result.hasMaps()) {
				IJ.log(result.record+": no brightness map");
				continue;
			}
			BrightnessMap map = result.maps.get(0);
			ImagePlus imp = ResultSaver.toImagePlus(ResultSaver.getFileName(result.record, map), map);
			imp.show();
			if (result.shape != null) {
				IJ.log(result.record+": "+result.shape);
			}
		}
	}
}
