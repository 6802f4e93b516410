/**
 **
 ** FitModeTest - tests of the optimizer vector layouts
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FitModeTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.penumbral.fitting;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FitModeTest {
	private final ApertureGeometry template = new ApertureGeometry(1.0, 2.0, 0.01, 0.2, 0.15, 1.01, 0.02, 0.99);

	@Test
	void positionBlurKeepsChargeAndDistortion() {
		ApertureGeometry g = FitMode.POSITION_BLUR.unpack(new double [] {0.1, 0.2, 0.03}, template);
		assertEquals(0.1,  g.x0, 0.0);
		assertEquals(0.03, g.delta, 0.0);
		assertEquals(0.2,  g.charge, 0.0);
		assertEquals(1.01, g.a, 0.0);
		assertArrayEquals(new double [] {0.1, 0.2, 0.03}, FitMode.POSITION_BLUR.pack(g), 0.0);
	}

	@Test
	void radiusModeHasNoCharge() {
		ApertureGeometry g = FitMode.POSITION_BLUR_RADIUS.unpack(new double [] {0.1, 0.2, 0.03, 0.12}, template);
		assertEquals(0.0,  g.charge, 0.0);
		assertEquals(0.12, g.aperture_radius, 0.0);
	}

	@Test
	void affineModeAdjustsSevenParameters() {
		FitMode mode = FitMode.POSITION_BLUR_CHARGE_AFFINE;
		assertEquals(7, mode.getNumParameters());
		double [] v = {0.1, 0.2, 0.03, 0.05, 1.0, 0.0, 1.0};
		ApertureGeometry g = mode.unpack(v, template);
		assertFalse(g.isAffine());
		assertEquals(0.15, g.aperture_radius, 0.0);
		assertTrue(template.isAffine());
		assertEquals("x0 = 0.1, y0 = 0.2", FitMode.POSITION_BLUR_CHARGE.format(v).substring(0, 18));
	}
}
