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
 * Brovey transform, every band is scaled by the ratio of the pan band and the
 * (weighted) intensity of all bands.
 */
public class BroveySharpener extends AbstractSharpener
{
	private static final Logger LOG = LoggerFactory.getLogger( BroveySharpener.class );

	final double[] weights;

	/**
	 * @param weights - weight of each band for the intensity, null means equal weights
	 */
	public BroveySharpener( final double[] weights )
	{
		this.weights = weights == null ? null : weights.clone();
	}

	public BroveySharpener()
	{
		this( null );
	}

	@Override
	public SharpenerType getType() { return SharpenerType.BROVEY; }

	@Override
	protected void validate( final Raster img, final Raster pan )
	{
		if ( weights != null && weights.length != img.numBands() )
			throw new SharpeningParameterException( "Got " + weights.length + " weights for " + img.numBands() + " bands " + img.getBandNames() );
	}

	@Override
	protected Raster fuse( final Raster img, final Raster pan, final ExecutorService service )
	{
		LOG.debug( "Intensity weights: {}", weights == null ? "equal" : Arrays.toString( weights ) );

		// intensity at the multispectral resolution, then resampled like the bands
		final Raster intensity = resampleToPan( BandSeriesUtils.weightedIntensity( img, weights, service ), pan, service );
		final Raster ms = resampleToPan( img, pan, service );

		final ArrayList< RandomAccessibleInterval< FloatType > > bands = new ArrayList<>();

		for ( final RandomAccessibleInterval< FloatType > band : ms.getBands() )
			bands.add( RasterTools.compute(
					Arrays.asList( band, intensity.getBand( 0 ), pan.getBand( 0 ) ),
					v -> v[ 0 ] / v[ 1 ] * v[ 2 ],
					service ) );

		return ms.withBands( ms.getBandNames(), bands );
	}
}
