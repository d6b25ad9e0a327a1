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
import java.util.List;
import java.util.concurrent.ExecutorService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

public class BandSeriesUtils
{
	public static String intensityBandName = "intensity";

	/**
	 * @param raster - a multi band raster
	 * @return one single band raster per band, in band order
	 */
	public static List< Raster > toBandSequence( final Raster raster )
	{
		final ArrayList< Raster > sequence = new ArrayList<>();

		for ( int b = 0; b < raster.numBands(); ++b )
			sequence.add( raster.select( b ) );

		return sequence;
	}

	/**
	 * Joins rasters on the same grid into one raster, the properties are taken from the first raster.
	 *
	 * @param sequence - the rasters, band names must be unique over all of them
	 * @return the joined raster
	 */
	public static Raster fromBandSequence( final List< Raster > sequence )
	{
		if ( sequence.isEmpty() )
			throw new IllegalArgumentException( "Cannot join an empty band sequence." );

		final Raster first = sequence.get( 0 );
		final ArrayList< String > names = new ArrayList<>();
		final ArrayList< RandomAccessibleInterval< FloatType > > bands = new ArrayList<>();

		for ( final Raster raster : sequence )
		{
			if ( !first.sameGrid( raster ) )
				throw new IllegalArgumentException( "Cannot join " + raster + " and " + first + ", they are not on the same grid." );

			names.addAll( raster.getBandNames() );
			bands.addAll( raster.getBands() );
		}

		return first.withBands( names, bands );
	}

	public static Raster fromBandSequence( final Raster... sequence )
	{
		return fromBandSequence( Arrays.asList( sequence ) );
	}

	/**
	 * @param raster - the raster
	 * @param weights - one weight per band, null means 1/n for every band
	 * @param service - the executor service
	 * @return a single band raster {@code sum( band_i * weight_i )}
	 */
	public static Raster weightedIntensity( final Raster raster, final double[] weights, final ExecutorService service )
	{
		final int n = raster.numBands();
		final double[] w;

		if ( weights == null )
		{
			w = new double[ n ];
			Arrays.fill( w, 1.0 / n );
		}
		else if ( weights.length != n )
		{
			throw new SharpeningParameterException( "Got " + weights.length + " weights for " + n + " bands " + raster.getBandNames() );
		}
		else
		{
			w = weights.clone();
		}

		final RandomAccessibleInterval< FloatType > intensity = RasterTools.compute( raster.getBands(), values ->
		{
			double sum = 0;

			for ( int b = 0; b < w.length; ++b )
				sum += values[ b ] * w[ b ];

			return sum;
		}, service );

		return raster.withBands( Arrays.asList( intensityBandName ), Arrays.asList( intensity ) );
	}

	/**
	 * @param raster - the raster
	 * @param service - the executor service
	 * @return a single band raster holding the mean of all bands, {@code NaN} where any band is masked
	 */
	public static Raster meanIntensity( final Raster raster, final ExecutorService service )
	{
		return weightedIntensity( raster, null, service );
	}
}
