/**
 **
 ** CompanionImageReader - optional x-ray image recorded by the same port
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CompanionImageReader.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.readers;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CompanionImageReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(CompanionImageReader.class);

	public static final int [] XRAY_PORTS = {2, 4, 5}; // ports with an x-ray imager, file index = position + 1

	/**
	 * @return file name for the port, null if the port has no x-ray imager or the shot is not numeric
	 */
	public static String getFileName(ShotRecord record) {
		if (!record.isRealData()) {
			return null;
		}
		for (int i = 0; i < XRAY_PORTS.length; i++) {
			if (XRAY_PORTS[i] == record.tim) {
				return String.format(Locale.ROOT, "KoDI_xray_data1 - %d-TIM%d-%d.mat.csv", Long.parseLong(record.shot), record.tim, i + 1);
			}
		}
		return null;
	}

	/**
	 * Read the comma-separated x-ray image
	 * @return image rows or null if there is no readable image
	 */
	public static double [][] read(Path directory, ShotRecord record) {
		String name = getFileName(record);
		if (name == null) {
			LOGGER.debug("No x-ray imager for "+record);
			return null;
		}
		Path path = directory.resolve(name);
		if (!Files.isRegularFile(path)) {
			LOGGER.debug("No x-ray image "+path);
			return null;
		}
		List<double []> rows = new ArrayList<double []>();
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.trim().isEmpty()) continue;
				String [] fields = line.split(",");
				double [] row = new double [fields.length];
				for (int i = 0; i < fields.length; i++) {
					row[i] = Double.parseDouble(fields[i].trim());
				}
				if (!rows.isEmpty() && (row.length != rows.get(0).length)) {
					LOGGER.debug("Ragged x-ray image "+path);
					return null;
				}
				rows.add(row);
			}
		} catch (IOException | NumberFormatException e) {
			LOGGER.debug("Could not read x-ray image "+path+": "+e.getMessage());
			return null;
		}
		return rows.isEmpty() ? null : rows.toArray(new double [0][]);
	}
}
