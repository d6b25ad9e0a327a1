/*-
 * #%L
 * Pan-sharpening of multispectral rasters with a high resolution
 * panchromatic band (Gram-Schmidt, principal component substitution).
 * %%
 * Copyright (C) 2012 - 2025 Multiview Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.pansharp.process.sharpening;

import java.util.concurrent.ExecutorService;

import net.preibisch.pansharp.raster.Raster;

public interface Sharpener
{
	/**
	 * Sharpens all bands of a multispectral raster to the resolution of a panchromatic band.
	 *
	 * @param img - the multispectral raster, coarser than the pan band
	 * @param pan - a single band panchromatic raster
	 * @return the sharpened raster on the grid of the pan band, with the band names of img
	 */
	Raster sharpen( Raster img, Raster pan );

	/**
	 * @param service - the executor service to use, null creates one per call
	 */
	void setExecutorService( ExecutorService service );

	SharpenerType getType();
}
