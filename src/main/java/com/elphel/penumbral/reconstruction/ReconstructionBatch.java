/**
 **
 ** ReconstructionBatch - reconstructs every shot of a catalog
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ReconstructionBatch.java is free software: you can redistribute it and/or modify
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
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.aperture.AnalyticBrightness;
import com.elphel.penumbral.aperture.ChargedApertureBrightness;
import com.elphel.penumbral.common.EProperties;
import com.elphel.penumbral.common.ReconstructionParameters;
import com.elphel.penumbral.readers.CompanionImageReader;
import com.elphel.penumbral.readers.ShotCatalogReader;
import com.elphel.penumbral.readers.ShotRecord;
import com.elphel.penumbral.readers.TrackFileReader;
import com.elphel.penumbral.tracks.DiameterConverter;
import com.elphel.penumbral.tracks.EtchDiameterModel;
import com.elphel.penumbral.tracks.TrackList;

/**
 * Processes catalog rows one after another. A row without a track file or with a failing
 * reconstruction is logged and skipped, only a malformed catalog stops the batch.
 */
public class ReconstructionBatch {
	private static final Logger LOGGER = LoggerFactory.getLogger(ReconstructionBatch.class);

	public static final String PROPERTIES_PREFIX = "PENUMBRAL.";

	private final ReconstructionParameters params;
	private final ShotReconstruction       shot_reconstruction;
	private final TrackFileReader          track_reader;

	public ReconstructionBatch(
			ReconstructionParameters params,
			AnalyticBrightness       analytic_brightness,
			DiameterConverter        diameter_converter,
			Deconvolver              deconvolver) {
		this.params = params.clone();
		this.shot_reconstruction = new ShotReconstruction(this.params, analytic_brightness, diameter_converter, deconvolver);
		this.track_reader = new TrackFileReader(this.params.track_header_line, this.params.track_skip_line);
	}

	public ReconstructionBatch(ReconstructionParameters params) {
		this(params,
				new ChargedApertureBrightness(),
				new EtchDiameterModel(),
				new GelfgatDeconvolver(params.deconvolution_max_iterations, params.debug_level));
	}

	public List<ShotResult> run(Path catalog) throws IOException {
		return run(ShotCatalogReader.read(catalog));
	}

	public List<ShotResult> run(List<ShotRecord> records) {
		Path scan_directory = Paths.get(params.scan_directory);
		ResultSaver saver = params.save_results ? new ResultSaver(Paths.get(params.results_directory)) : null;
		List<ShotResult> results = new ArrayList<ShotResult>();
		for (ShotRecord record : records) {
			Path track_file;
			try {
				track_file = TrackFileReader.findTrackFile(scan_directory, record);
			} catch (IOException e) {
				LOGGER.error("Failed to list "+scan_directory+" for "+record+": "+e.getMessage());
				continue;
			}
			if (track_file == null) {
				LOGGER.warn("Could not find text file for TIM {} on shot {}", record.tim, record.shot);
				continue;
			}
			LOGGER.info("Beginning reconstruction for TIM {} on shot {}", record.tim, record.shot);
			try {
				TrackList tracks = track_reader.read(track_file);
				ShotResult result = shot_reconstruction.reconstruct(record, tracks);
				result = result.withXrayImage(CompanionImageReader.read(scan_directory, record));
				results.add(result);
				if (saver != null) {
					try {
						saver.save(result);
					} catch (IOException e) {
						LOGGER.error("Failed to save the results of "+record, e);
					}
				}
			} catch (IOException | RuntimeException e) {
				LOGGER.error("Reconstruction of "+record+" failed", e);
			}
		}
		return results;
	}

	/**
	 * @param args catalog.csv [parameters.properties]
	 */
	public static void main(String [] args) throws IOException {
		if ((args.length < 1) || (args.length > 2)) {
			System.err.println("Usage: ReconstructionBatch catalog.csv [parameters.properties]");
			System.exit(1);
		}
		ReconstructionParameters params = new ReconstructionParameters();
		if (args.length > 1) {
			params.getProperties(PROPERTIES_PREFIX, EProperties.load(Paths.get(args[1])));
		}
		List<ShotResult> results = new ReconstructionBatch(params).run(Paths.get(args[0]));
		for (ShotResult result : results) {
			LOGGER.info(result.record+": "+result.maps.size()+" brightness maps"+
					((result.shape != null) ? (", "+result.shape) : ""));
		}
	}
}
