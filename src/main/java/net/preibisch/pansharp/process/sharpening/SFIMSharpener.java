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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Smoothing filter-based intensity modulation, every band is multiplied by the ratio of the
 * pan band and a mean-filtered pan band.
 */
public class SFIMSharpener extends AbstractSharpener
{
	private static final Logger LOG = LoggerFactory.getLogger( SFIMSharpener.class );

	@Override
	public SharpenerType getType() { return SharpenerType.SFIM; }

	public static int smoothingRadius( final Raster img, final Raster pan )
	{
		return (int)Math.max( 1, Math.round( resolutionRatio( img, pan ) / 2.0 ) );
	}

	@Override
	protected Raster fuse( final Raster img, final Raster pan, final ExecutorService service )
	{
		final int radius = smoothingRadius( img, pan );
		final double windowSize = ( 2 * radius + 1 ) * ( 2 * radius + 1 );

		LOG.debug( "Smoothing radius: {}", radius );

		final Raster ms = resampleToPan( img, pan, service );
		final RandomAccessibleInterval< FloatType > windowSum = RasterTools.windowSum( pan.getBand( 0 ), radius, service );

		final ArrayList< RandomAccessibleInterval< FloatType > > bands = new ArrayList<>();

		for ( final RandomAccessibleInterval< FloatType > band : ms.getBands() )
			bands.add( RasterTools.compute(
					Arrays.asList( band, pan.getBand( 0 ), windowSum ),
					v -> v[ 0 ] * v[ 1 ] / ( v[ 2 ] / windowSize ),
					service ) );

		return ms.withBands( ms.getBandNames(), bands );
	}
}
