/**
 **
 ** TrackFileReaderTest - tests of the scanner track file reader
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackFileReaderTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elphel.penumbral.tracks.TrackList;

class TrackFileReaderTest {
	static final String COLUMNS = "  x(cm)  y(cm)  d(µm)  cn(%)  ca(%)  e(%)  ar(%)";

	/**
	 * Scanner file with the column names on line 20 and units on line 24 (0-based)
	 */
	static List<String> trackFile(List<String> rows) {
		List<String> lines = new ArrayList<String>();
		for (int i = 0; i < 20; i++) {
			lines.add("preamble line "+i);
		}
		lines.add(COLUMNS);
		lines.add(rows.get(0));
		lines.add(rows.get(1));
		lines.add(rows.get(2));
		lines.add("  cm cm um % % % %");
		lines.addAll(rows.subList(3, rows.size()));
		return lines;
	}

	@Test
	void readsColumnsByName(@TempDir Path dir) throws IOException {
		List<String> rows = new ArrayList<String>();
		for (int i = 0; i < 5; i++) {
			rows.add(String.format(Locale.ROOT, "%.3f %.3f %.2f %d %d %d 0", 0.1 * i, -0.2 * i, 10.0 + i, 5 + i, 6 + i, 2 * i));
		}
		Path path = dir.resolve("95520_TIM2_5h.txt");
		Files.write(path, trackFile(rows), StandardCharsets.ISO_8859_1);
		TrackList tracks = new TrackFileReader(20, 24).read(path);
		assertEquals(5, tracks.size());
		assertEquals(0.3, tracks.getX(3), 1e-6);
		assertEquals(-0.8, tracks.getY(4), 1e-6);
		assertEquals(12.0, tracks.getDiameter(2), 1e-6);
		assertEquals(9.0, tracks.getContrast(4), 0.0);
		assertEquals(7.0, tracks.get(1).contrast_a, 0.0);
		assertEquals(6.0, tracks.getEccentricity(3), 0.0);
	}

	@Test
	void shortRowFails(@TempDir Path dir) throws IOException {
		List<String> rows = new ArrayList<String>();
		for (int i = 0; i < 4; i++) rows.add("0.1 0.2 10 5 6 2 0");
		rows.add("0.1 0.2");
		Path path = dir.resolve("tracks.txt");
		Files.write(path, trackFile(rows), StandardCharsets.ISO_8859_1);
		assertThrows(IOException.class, () -> new TrackFileReader(20, 24).read(path));
	}

	@Test
	void missingPreambleFails(@TempDir Path dir) throws IOException {
		Path path = dir.resolve("tracks.txt");
		Files.write(path, List.of("x(cm) y(cm)"), StandardCharsets.ISO_8859_1);
		assertThrows(IOException.class, () -> new TrackFileReader(20, 24).read(path));
	}

	@Test
	void findsTheFileOfTheShot(@TempDir Path dir) throws IOException {
		Files.createFile(dir.resolve("95520_TIM4_5h.txt"));
		Files.createFile(dir.resolve("95520_tim2_3h.txt"));
		Files.createFile(dir.resolve("95520_tim2_5h_b.txt"));
		Files.createFile(dir.resolve("95520_tim2_5h_a.txt"));
		Files.createFile(dir.resolve("95520_tim2_5h.csv"));
		ShotRecord record = new ShotRecord("95520", 2, 1000, 2000, 4.21, 14, 0, "5 h");
		assertEquals(dir.resolve("95520_tim2_5h_a.txt"), TrackFileReader.findTrackFile(dir, record));
		assertNull(TrackFileReader.findTrackFile(dir, new ShotRecord("95521", 2, 1000, 2000, 4.21, 14, 0, "5 h")));
		assertNull(TrackFileReader.findTrackFile(dir.resolve("none"), record));
	}
}
