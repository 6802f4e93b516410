/**
 **
 ** DeconvolutionResult - source brightness recovered by a deconvolver
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DeconvolutionResult.java is free software: you can redistribute it and/or modify
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

public class DeconvolutionResult {
	public final double [][] brightness; // source grid, [ix][iy]
	public final double      chi2;       // over the used data pixels
	public final double      background; // fitted uniform component, counts per pixel
	public final int         iterations;

	public DeconvolutionResult(double [][] brightness, double chi2, double background, int iterations) {
		this.brightness = brightness;
		this.chi2 =       chi2;
		this.background = background;
		this.iterations = iterations;
	}
}
