/**
 **
 ** CompanionImageReaderTest - tests of the x-ray image reader
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CompanionImageReaderTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompanionImageReaderTest {
	private final ShotRecord tim4 = new ShotRecord("95520", 4, 1000, 2000, 4.21, 14, 0, "5 h");

	@Test
	void fileNames() {
		assertEquals("KoDI_xray_data1 - 95520-TIM4-2.mat.csv", CompanionImageReader.getFileName(tim4));
		assertNull(CompanionImageReader.getFileName(new ShotRecord("95520", 3, 1000, 2000, 4.21, 14, 0, "5 h")));
		assertNull(CompanionImageReader.getFileName(new ShotRecord("disk", 2, 1000, 2000, 4.21, 14, 0, "5 h")));
	}

	@Test
	void readsTheImage(@TempDir Path dir) throws IOException {
		Files.write(dir.resolve(CompanionImageReader.getFileName(tim4)),
				Arrays.asList("1,2,3", "4, 5, 6"), StandardCharsets.UTF_8);
		double [][] image = CompanionImageReader.read(dir, tim4);
		assertEquals(2, image.length);
		assertArrayEquals(new double [] {4, 5, 6}, image[1], 0.0);
	}

	@Test
	void unreadableImagesAreAbsent(@TempDir Path dir) throws IOException {
		assertNull(CompanionImageReader.read(dir, tim4));
		Files.write(dir.resolve(CompanionImageReader.getFileName(tim4)),
				Arrays.asList("1,2,3", "4,5"), StandardCharsets.UTF_8);
		assertNull(CompanionImageReader.read(dir, tim4));
		Files.write(dir.resolve(CompanionImageReader.getFileName(tim4)),
				Arrays.asList("1,x,3"), StandardCharsets.UTF_8);
		assertNull(CompanionImageReader.read(dir, tim4));
	}
}
