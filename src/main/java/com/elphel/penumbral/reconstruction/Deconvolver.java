/**
 **
 ** Deconvolver - statistical deconvolution of the combined penumbral image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Deconvolver.java is free software: you can redistribute it and/or modify
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

public interface Deconvolver {
	/**
	 * Recover the source brightness from counts blurred by the kernel
	 * @param counts background-subtracted counts on the image grid
	 * @param background level subtracted from the counts, restores their Poisson statistics
	 * @param kernel normalized kernel, image size = source size + kernel size - 1
	 * @param initial_guess rough model of the counts on the image grid
	 * @param threshold relative likelihood improvement to stop at
	 * @param data_mask image pixels that may be used, others never contribute
	 * @param illegal_mask source pixels that must stay dark
	 * @return source-grid brightness and the chi-squared over the used pixels
	 */
	DeconvolutionResult deconvolve(
			double [][]  counts,
			double       background,
			double [][]  kernel,
			double [][]  initial_guess,
			double       threshold,
			boolean [][] data_mask,
			boolean [][] illegal_mask);
}
