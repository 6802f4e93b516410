/**
 **
 ** ShotCatalogReader - reads the comma-separated list of shots to reconstruct
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShotCatalogReader.java is free software: you can redistribute it and/or modify
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ShotCatalogReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(ShotCatalogReader.class);

	public static final String SHOT =              "Shot number";
	public static final String TIM =               "TIM";
	public static final String APERTURE_RADIUS =   "Aperture Radius";
	public static final String APERTURE_SPACING =  "Aperture Separation";
	public static final String APERTURE_DISTANCE = "L1";
	public static final String MAGNIFICATION =     "Magnification";
	public static final String ROTATION =          "Rotation";
	public static final String ETCH_TIME =         "Etch time";
	public static final String R_OFFSET =          "Offset (um)";
	public static final String THETA_OFFSET =      "Offset theta (deg)";
	public static final String PHI_OFFSET =        "Offset phi (deg)";
	public static final String R_FLOW =            "Flow (km/s)";
	public static final String THETA_FLOW =        "Flow theta (deg)";
	public static final String PHI_FLOW =          "Flow phi (deg)";

	public static final String [] REQUIRED_COLUMNS = {
			SHOT, TIM, APERTURE_RADIUS, APERTURE_SPACING, APERTURE_DISTANCE, MAGNIFICATION, ROTATION, ETCH_TIME};

	/**
	 * Read all rows. Offset and flow columns are optional (NaN when missing or empty).
	 * @param path catalog file with a header line
	 * @return shot records in file order
	 * @throws IOException if the file can not be read, a required column is missing or a value
	 *         can not be parsed
	 */
	public static List<ShotRecord> read(Path path) throws IOException {
		List<ShotRecord> records = new ArrayList<ShotRecord>();
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String header = reader.readLine();
			if (header == null) {
				throw new IOException("Shot catalog "+path+" is empty");
			}
			if (header.startsWith("\uFEFF")) {
				header = header.substring(1);
			}
			List<String> names = splitLine(header);
			Map<String, Integer> columns = new HashMap<String, Integer>();
			for (int i = 0; i < names.size(); i++) {
				columns.put(names.get(i).trim(), i);
			}
			for (String name : REQUIRED_COLUMNS) {
				if (!columns.containsKey(name)) {
					throw new IOException("Shot catalog "+path+" has no column \""+name+"\"");
				}
			}
			int line_number = 1;
			String line;
			while ((line = reader.readLine()) != null) {
				line_number++;
				if (line.trim().isEmpty()) continue;
				List<String> fields = splitLine(line);
				try {
					records.add(new ShotRecord(
							required(fields, columns, SHOT),
							(int) Double.parseDouble(required(fields, columns, TIM)),
							parseDouble(required(fields, columns, APERTURE_RADIUS)),
							parseDouble(required(fields, columns, APERTURE_SPACING)),
							parseDouble(required(fields, columns, APERTURE_DISTANCE)),
							parseDouble(required(fields, columns, MAGNIFICATION)),
							parseDouble(required(fields, columns, ROTATION)),
							required(fields, columns, ETCH_TIME),
							optional(fields, columns, R_OFFSET),
							optional(fields, columns, THETA_OFFSET),
							optional(fields, columns, PHI_OFFSET),
							optional(fields, columns, R_FLOW),
							optional(fields, columns, THETA_FLOW),
							optional(fields, columns, PHI_FLOW)));
				} catch (IllegalArgumentException e) { // NumberFormatException included
					throw new IOException("Shot catalog "+path+", line "+line_number+": "+e.getMessage(), e);
				}
			}
		}
		LOGGER.info("Read "+records.size()+" shots from "+path);
		return records;
	}

	private static String required(List<String> fields, Map<String, Integer> columns, String name) {
		int index = columns.get(name);
		if ((index >= fields.size()) || fields.get(index).trim().isEmpty()) {
			throw new IllegalArgumentException("missing value of \""+name+"\"");
		}
		return fields.get(index).trim();
	}

	private static double optional(List<String> fields, Map<String, Integer> columns, String name) {
		Integer index = columns.get(name);
		if ((index == null) || (index >= fields.size()) || fields.get(index).trim().isEmpty()) {
			return Double.NaN;
		}
		return parseDouble(fields.get(index).trim());
	}

	private static double parseDouble(String s) {
		return Double.parseDouble(s.trim());
	}

	/**
	 * Split a comma-separated line, double quotes protect commas
	 */
	static List<String> splitLine(String line) {
		List<String> fields = new ArrayList<String>();
		StringBuilder sb = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (c == '"') {
				if (quoted && (i + 1 < line.length()) && (line.charAt(i + 1) == '"')) {
					sb.append('"');
					i++;
				} else {
					quoted = !quoted;
				}
			} else if ((c == ',') && !quoted) {
				fields.add(sb.toString());
				sb.setLength(0);
			} else {
				sb.append(c);
			}
		}
		fields.add(sb.toString());
		return fields;
	}
}
