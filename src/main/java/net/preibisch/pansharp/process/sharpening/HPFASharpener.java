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

import java.util.Arrays;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * High-pass filter addition (Gangkofner et al. 2008). The pan band is filtered with a square
 * kernel that has {@code width^2 - 1} in the center and {@code -1} everywhere else, normalized
 * by {@code width^2 - 1}, and the result is added to every band.
 */
public class HPFASharpener extends AbstractSharpener
{
	private static final Logger LOG = LoggerFactory.getLogger( HPFASharpener.class );

	final Integer kernelWidth;

	/**
	 * @param kernelWidth - odd width of the kernel, at least 3, null computes it from the resolution ratio
	 */
	public HPFASharpener( final Integer kernelWidth )
	{
		this.kernelWidth = kernelWidth;
	}

	public HPFASharpener()
	{
		this( null );
	}

	@Override
	public SharpenerType getType() { return SharpenerType.HPFA; }

	@Override
	protected void validate( final Raster img, final Raster pan )
	{
		if ( kernelWidth != null && ( kernelWidth < 3 || kernelWidth % 2 == 0 ) )
			throw new SharpeningParameterException( "The kernel width must be odd and at least 3, got " + kernelWidth );
	}

	/**
	 * @return {@code 2 * ratio + 1} with the ratio rounded, so the kernel is always odd
	 */
	public static int defaultKernelWidth( final Raster img, final Raster pan )
	{
		return 2 * (int)Math.max( 1, Math.round( resolutionRatio( img, pan ) ) ) + 1;
	}

	@Override
	protected Raster fuse( final Raster img, final Raster pan, final ExecutorService service )
	{
		final int width = kernelWidth == null ? defaultKernelWidth( img, pan ) : kernelWidth;
		final double norm = width * width - 1;

		LOG.debug( "High-pass kernel width: {}", width );

		final Raster ms = resampleToPan( img, pan, service );
		final RandomAccessibleInterval< FloatType > windowSum = RasterTools.windowSum( pan.getBand( 0 ), width / 2, service );

		// center weight (w^2 - 1) and -1 for all others equals w^2 * center - sum of the window
		final RandomAccessibleInterval< FloatType > highPass = RasterTools.compute(
				Arrays.asList( pan.getBand( 0 ), windowSum ),
				v -> ( ( norm + 1 ) * v[ 0 ] - v[ 1 ] ) / norm,
				service );

		return RasterTools.combine( ms, pan.withBands( Arrays.asList( "highpass" ), Arrays.asList( highPass ) ), v -> v[ 0 ] + v[ 1 ], service );
	}
}
