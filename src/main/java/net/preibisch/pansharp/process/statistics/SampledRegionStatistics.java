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
package net.preibisch.pansharp.process.statistics;

import java.util.function.Consumer;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.StorelessCovariance;
import org.apache.commons.math3.stat.descriptive.StorelessUnivariateStatistic;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.summary.Sum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RealInterval;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.raster.Raster;

/**
 * Computes region statistics from a regular grid of sample points in world
 * coordinates. The sample points are the centers of square cells of size
 * {@code scale} that tile the region, every sample point reads the nearest
 * pixel of the raster. Sample points outside of the raster and {@code NaN}
 * pixels are ignored.
 */
public class SampledRegionStatistics implements RegionStatistics
{
	private static final Logger LOG = LoggerFactory.getLogger( SampledRegionStatistics.class );

	@Override
	public double[] reduceImage( final Raster raster, final Reducer reducer, final ReductionParameters params )
	{
		final int n = raster.numBands();
		final StorelessUnivariateStatistic[] stats = new StorelessUnivariateStatistic[ n ];

		for ( int b = 0; b < n; ++b )
			stats[ b ] = createStatistic( reducer );

		final long numSamples = forEachSample( raster, params, values ->
		{
			for ( int b = 0; b < n; ++b )
				if ( !Double.isNaN( values[ b ] ) )
					stats[ b ].increment( values[ b ] );
		});

		final double[] result = new double[ n ];

		for ( int b = 0; b < n; ++b )
		{
			if ( stats[ b ].getN() == 0 )
				throw new RegionStatisticsException( "No valid pixels for band '" + raster.getBandName( b ) + "' in " + numSamples + " sample points (" + params + ")." );

			result[ b ] = stats[ b ].getResult();
		}

		LOG.debug( "{} of {}: {} ({} sample points)", reducer, raster.getBandNames(), result, numSamples );

		return result;
	}

	@Override
	public RealMatrix covariance( final Raster raster, final ReductionParameters params )
	{
		final int n = raster.numBands();
		final StorelessCovariance covariance = new StorelessCovariance( n, true );
		final long[] count = new long[ 1 ];

		forEachSample( raster, params, values ->
		{
			if ( allValid( values ) )
			{
				covariance.increment( values );
				++count[ 0 ];
			}
		});

		if ( count[ 0 ] < 2 )
			throw new RegionStatisticsException( "Covariance of " + raster.getBandNames() + " needs at least 2 valid pixels, found " + count[ 0 ] + " (" + params + ")." );

		LOG.debug( "Covariance of {} from {} pixels.", raster.getBandNames(), count[ 0 ] );

		return covariance.getCovarianceMatrix();
	}

	@Override
	public RealMatrix centeredCovariance( final Raster raster, final ReductionParameters params )
	{
		final int n = raster.numBands();
		final double[][] sums = new double[ n ][ n ];
		final long[] count = new long[ 1 ];

		forEachSample( raster, params, values ->
		{
			if ( allValid( values ) )
			{
				for ( int i = 0; i < n; ++i )
					for ( int j = i; j < n; ++j )
						sums[ i ][ j ] += values[ i ] * values[ j ];

				++count[ 0 ];
			}
		});

		if ( count[ 0 ] < 2 )
			throw new RegionStatisticsException( "Centered covariance of " + raster.getBandNames() + " needs at least 2 valid pixels, found " + count[ 0 ] + " (" + params + ")." );

		final RealMatrix matrix = MatrixUtils.createRealMatrix( n, n );

		for ( int i = 0; i < n; ++i )
			for ( int j = i; j < n; ++j )
			{
				final double c = sums[ i ][ j ] / ( count[ 0 ] - 1 );
				matrix.setEntry( i, j, c );
				matrix.setEntry( j, i, c );
			}

		LOG.debug( "Centered covariance of {} from {} pixels.", raster.getBandNames(), count[ 0 ] );

		return matrix;
	}

	@Override
	public Histogram histogram( final Raster raster, final int band, final ReductionParameters params, final int numBuckets )
	{
		if ( numBuckets < 1 )
			throw new IllegalArgumentException( "numBuckets must be at least 1, got " + numBuckets );

		final Raster single = raster.select( band );
		final double[] minMax = new double[] { Double.MAX_VALUE, -Double.MAX_VALUE };

		forEachSample( single, params, values ->
		{
			if ( !Double.isNaN( values[ 0 ] ) )
			{
				minMax[ 0 ] = Math.min( minMax[ 0 ], values[ 0 ] );
				minMax[ 1 ] = Math.max( minMax[ 1 ], values[ 0 ] );
			}
		});

		if ( minMax[ 0 ] > minMax[ 1 ] )
			throw new RegionStatisticsException( "No valid pixels for band '" + raster.getBandName( band ) + "' (" + params + ")." );

		final double min = minMax[ 0 ];
		final double width = ( minMax[ 1 ] - min ) / numBuckets;

		final double[] sums = new double[ numBuckets ];
		final long[] counts = new long[ numBuckets ];

		forEachSample( single, params, values ->
		{
			final double v = values[ 0 ];

			if ( !Double.isNaN( v ) )
			{
				final int bucket = width > 0 ? Math.min( numBuckets - 1, (int)( ( v - min ) / width ) ) : 0;
				sums[ bucket ] += v;
				++counts[ bucket ];
			}
		});

		final double[] means = new double[ numBuckets ];

		for ( int i = 0; i < numBuckets; ++i )
			means[ i ] = counts[ i ] > 0 ? sums[ i ] / counts[ i ] : min + ( i + 0.5 ) * width;

		return new Histogram( min, width, means, counts );
	}

	protected static StorelessUnivariateStatistic createStatistic( final Reducer reducer )
	{
		switch ( reducer )
		{
		case MEAN:
			return new Mean();
		case STDDEV:
			return new StandardDeviation( true );
		case VARIANCE:
			return new Variance( true );
		case SUM:
			return new Sum();
		default:
			throw new IllegalArgumentException( "Unknown reducer: " + reducer );
		}
	}

	protected static boolean allValid( final double[] values )
	{
		for ( final double v : values )
			if ( Double.isNaN( v ) )
				return false;

		return true;
	}

	/**
	 * Visits all sample points of the region. The consumer receives the values of all bands at the
	 * nearest pixel, {@code NaN} where the sample point is outside of the raster.
	 *
	 * @param raster - the raster
	 * @param params - region, scale and pixel budget, defaults are taken from the raster
	 * @param consumer - receives the band values of each sample point, the array is reused
	 * @return the number of sample points
	 */
	protected long forEachSample( final Raster raster, final ReductionParameters params, final Consumer< double[] > consumer )
	{
		final ReductionParameters resolved = params.resolve( raster );
		final RealInterval region = resolved.getRegion();
		final double scale = resolved.getScale();

		final long nx = numCells( region.realMax( 0 ) - region.realMin( 0 ), scale );
		final long ny = numCells( region.realMax( 1 ) - region.realMin( 1 ), scale );

		if ( (double)nx * (double)ny > resolved.getMaxPixels() )
			throw new RegionStatisticsException( "Region contains " + ( nx * ny ) + " sample points, more than maxPixels=" + resolved.getMaxPixels() + " (" + resolved + ")." );

		final int n = raster.numBands();
		final Interval interval = raster.getInterval();
		final AffineTransform2D worldToPixel = raster.getTransform().inverse();

		@SuppressWarnings( "unchecked" )
		final RandomAccess< FloatType >[] ras = new RandomAccess[ n ];

		for ( int b = 0; b < n; ++b )
			ras[ b ] = raster.getBand( b ).randomAccess();

		final double[] world = new double[ 2 ];
		final double[] pixel = new double[ 2 ];
		final long[] position = new long[ 2 ];
		final double[] values = new double[ n ];

		for ( long y = 0; y < ny; ++y )
			for ( long x = 0; x < nx; ++x )
			{
				world[ 0 ] = region.realMin( 0 ) + ( x + 0.5 ) * scale;
				world[ 1 ] = region.realMin( 1 ) + ( y + 0.5 ) * scale;

				worldToPixel.apply( world, pixel );

				position[ 0 ] = Math.round( pixel[ 0 ] );
				position[ 1 ] = Math.round( pixel[ 1 ] );

				if ( position[ 0 ] < interval.min( 0 ) || position[ 0 ] > interval.max( 0 ) ||
					 position[ 1 ] < interval.min( 1 ) || position[ 1 ] > interval.max( 1 ) )
				{
					for ( int b = 0; b < n; ++b )
						values[ b ] = Double.NaN;
				}
				else
				{
					for ( int b = 0; b < n; ++b )
					{
						ras[ b ].setPosition( position );
						values[ b ] = ras[ b ].get().getRealDouble();
					}
				}

				consumer.accept( values );
			}

		return nx * ny;
	}

	// cells that are cut by the region border by less than a millionth of their size are not sampled
	protected static long numCells( final double extent, final double scale )
	{
		return Math.max( 1, (long)Math.ceil( extent / scale - 1e-6 ) );
	}
}
