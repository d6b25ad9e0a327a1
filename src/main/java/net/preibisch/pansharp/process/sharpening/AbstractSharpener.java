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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.pansharp.Threads;
import net.preibisch.pansharp.process.resampling.Resampler;
import net.preibisch.pansharp.raster.Raster;

/**
 * Validates the inputs, resamples the multispectral raster to the pan grid and
 * manages the executor service of one sharpening call.
 */
public abstract class AbstractSharpener implements Sharpener
{
	private static final Logger LOG = LoggerFactory.getLogger( AbstractSharpener.class );

	protected ExecutorService service = null;

	@Override
	public void setExecutorService( final ExecutorService service ) { this.service = service; }

	@Override
	public Raster sharpen( final Raster img, final Raster pan )
	{
		if ( pan.numBands() != 1 )
			throw new SharpeningParameterException( "The panchromatic raster must have exactly one band, got " + pan.getBandNames() );

		// a sharpened raster is already on the pan grid, sharpening it again is an error
		if ( !( img.nominalScale() > pan.nominalScale() ) )
			throw new SharpeningParameterException(
					"The image (" + img.nominalScale() + ") is not coarser than the pan band (" + pan.nominalScale() + "), was it sharpened already?" );

		validate( img, pan );

		final ExecutorService taskExecutor = service == null ? Threads.createFixedExecutorService() : service;

		try
		{
			LOG.info( "{}: sharpening {} with {}", getType(), img, pan );

			final long time = System.currentTimeMillis();
			final Raster result = fuse( img, pan.zeroMin(), taskExecutor );

			LOG.info( "{}: done after {} ms.", getType(), System.currentTimeMillis() - time );

			return result;
		}
		finally
		{
			if ( service == null )
				taskExecutor.shutdown();
		}
	}

	/**
	 * Checks algorithm specific parameters before anything is computed.
	 *
	 * @param img - the multispectral raster
	 * @param pan - the pan raster
	 */
	protected void validate( final Raster img, final Raster pan ) {}

	/**
	 * @param img - the multispectral raster at its own resolution
	 * @param pan - the pan raster, zero-min
	 * @param service - the executor service
	 * @return the sharpened raster
	 */
	protected abstract Raster fuse( Raster img, Raster pan, ExecutorService service );

	public static Raster resampleToPan( final Raster img, final Raster pan, final ExecutorService service )
	{
		return Resampler.resample( img, pan, service );
	}

	/**
	 * @param img - the multispectral raster
	 * @param pan - the pan raster
	 * @return how many pan pixels fit along one multispectral pixel
	 */
	public static double resolutionRatio( final Raster img, final Raster pan )
	{
		return img.nominalScale() / pan.nominalScale();
	}
}
