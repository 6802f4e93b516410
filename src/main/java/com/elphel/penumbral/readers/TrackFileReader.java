/**
 **
 ** TrackFileReader - reads scanner track lists
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackFileReader.java is free software: you can redistribute it and/or modify
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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.penumbral.tracks.TrackList;

/**
 * Track list is a whitespace-separated table in Latin-1 encoding. The column names are on a
 * fixed line after the scanner preamble, one more fixed line (units/metadata) is skipped.
 */
public class TrackFileReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(TrackFileReader.class);

	public static final String X_COLUMN =            "x(cm)";
	public static final String Y_COLUMN =            "y(cm)";
	public static final String DIAMETER_COLUMN =     "d(";   // "d(µm)", prefix to survive encoding mismatches
	public static final String CONTRAST_COLUMN =     "cn(%)";
	public static final String CONTRAST_A_COLUMN =   "ca(%)";
	public static final String ECCENTRICITY_COLUMN = "e(%)";

	private final int header_line; // 0-based
	private final int skip_line;   // 0-based, counted in the whole file

	public TrackFileReader(int header_line, int skip_line) {
		this.header_line = header_line;
		this.skip_line =   skip_line;
	}

	/**
	 * Find the track file of a shot: a ".txt" file whose name contains the shot id, "tim" with
	 * the port number (any case) and the etch time without spaces
	 * @param directory directory with the scanner output
	 * @param record catalog row
	 * @return the first matching file in name order, null if there is none
	 */
	public static Path findTrackFile(Path directory, ShotRecord record) throws IOException {
		if (!Files.isDirectory(directory)) {
			LOGGER.warn("Scan directory "+directory+" does not exist");
			return null;
		}
		String tim = "tim"+record.tim;
		String etch = record.etch_time.replace(" ", "");
		List<Path> candidates = new ArrayList<Path>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
			for (Path path : stream) {
				String name = path.getFileName().toString();
				if (name.endsWith(".txt") && name.contains(record.shot) &&
						name.toLowerCase(Locale.ROOT).contains(tim) && name.contains(etch)) {
					candidates.add(path);
				}
			}
		}
		if (candidates.isEmpty()) {
			return null;
		}
		Collections.sort(candidates);
		return candidates.get(0);
	}

	public TrackList read(Path path) throws IOException {
		int [] columns = null;
		int num_columns = 0;
		List<float []> rows = new ArrayList<float []>();
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
			String line;
			int line_number = -1;
			while ((line = reader.readLine()) != null) {
				line_number++;
				if ((line_number < header_line) || (line_number == skip_line)) {
					continue;
				}
				String trimmed = line.trim();
				if (line_number == header_line) {
					String [] names = trimmed.split("\\s+");
					num_columns = names.length;
					columns = new int [] {
							findColumn(names, X_COLUMN, path),
							findColumn(names, Y_COLUMN, path),
							findColumn(names, DIAMETER_COLUMN, path),
							findColumn(names, CONTRAST_COLUMN, path),
							findColumn(names, CONTRAST_A_COLUMN, path),
							findColumn(names, ECCENTRICITY_COLUMN, path)};
					continue;
				}
				if (trimmed.isEmpty()) continue;
				String [] fields = trimmed.split("\\s+");
				if (fields.length < num_columns) {
					throw new IOException(path+", line "+(line_number + 1)+": expected "+num_columns+
							" columns, got "+fields.length);
				}
				float [] row = new float [columns.length];
				try {
					for (int i = 0; i < columns.length; i++) {
						row[i] = Float.parseFloat(fields[columns[i]]);
					}
				} catch (NumberFormatException e) {
					throw new IOException(path+", line "+(line_number + 1)+": "+e.getMessage(), e);
				}
				rows.add(row);
			}
		}
		if (columns == null) {
			throw new IOException(path+" is shorter than its "+(header_line + 1)+"-line preamble");
		}
		int n = rows.size();
		float [][] data = new float [columns.length][n];
		for (int k = 0; k < n; k++) {
			float [] row = rows.get(k);
			for (int i = 0; i < columns.length; i++) {
				data[i][k] = row[i];
			}
		}
		LOGGER.debug("Read "+n+" tracks from "+path);
		return new TrackList(data[0], data[1], data[2], data[3], data[4], data[5]);
	}

	private static int findColumn(String [] names, String name, Path path) throws IOException {
		for (int i = 0; i < names.length; i++) {
			if (name.endsWith("(") ? names[i].startsWith(name) : names[i].equals(name)) {
				return i;
			}
		}
		throw new IOException(path+" has no column \""+name+"\"");
	}
}
