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
package net.preibisch.pansharp.process.resampling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.pansharp.raster.ImagePortion;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Resamples a raster onto the pixel grid of another raster. Every target pixel center is
 * mapped into the pixel space of the source and interpolated on the border-extended source.
 * Target pixels outside of the source footprint are {@code NaN}.
 */
public class Resampler
{
	private static final Logger LOG = LoggerFactory.getLogger( Resampler.class );

	public enum Method { NEAREST, BILINEAR }

	public static Method defaultMethod = Method.BILINEAR;

	public static Raster resample( final Raster source, final Raster targetGrid, final ExecutorService service )
	{
		return resample( source, targetGrid, defaultMethod, service );
	}

	public static Raster resample( final Raster source, final Raster targetGrid, final Method method, final ExecutorService service )
	{
		return resample( source, targetGrid.getInterval(), targetGrid.getTransform(), method, service );
	}

	/**
	 * @param source - the raster to resample
	 * @param targetInterval - the pixel interval of the target grid
	 * @param targetTransform - the pixel-to-world transformation of the target grid
	 * @param method - the interpolation
	 * @param service - the executor service
	 * @return the resampled raster with the band names and properties of the source
	 */
	public static Raster resample(
			final Raster source,
			final Interval targetInterval,
			final AffineTransform2D targetTransform,
			final Method method,
			final ExecutorService service )
	{
		if ( Intervals.equals( source.getInterval(), targetInterval ) &&
			 Arrays.equals( source.getTransform().getRowPackedCopy(), targetTransform.getRowPackedCopy() ) )
			return source;

		LOG.debug( "Resampling {} onto {}x{}px @ {} ({})", source, targetInterval.dimension( 0 ), targetInterval.dimension( 1 ), targetTransform, method );

		// target pixel -> world -> source pixel
		final AffineTransform2D targetToSource = source.getTransform().inverse();
		targetToSource.concatenate( targetTransform );

		final Interval sourceInterval = source.getInterval();
		final ArrayList< RandomAccessibleInterval< FloatType > > bands = new ArrayList<>();

		for ( final RandomAccessibleInterval< FloatType > band : source.getBands() )
		{
			final Img< FloatType > out = ArrayImgs.floats( targetInterval.dimensionsAsLongArray() );
			final RandomAccessible< FloatType > extended = Views.extendBorder( band );
			final InterpolatorFactory< FloatType, RandomAccessible< FloatType > > factory = createInterpolatorFactory( method );

			final ArrayList< Callable< Void > > tasks = new ArrayList<>();

			for ( final ImagePortion portion : RasterTools.divideIntoPortions( out.size() ) )
			{
				tasks.add( () ->
				{
					final Cursor< FloatType > cursor = out.localizingCursor();
					final RealRandomAccess< FloatType > ir = Views.interpolate( extended, factory ).realRandomAccess();

					final double[] t = new double[ 2 ];
					final double[] s = new double[ 2 ];

					cursor.jumpFwd( portion.getStartPosition() );

					for ( long l = 0; l < portion.getLoopSize(); ++l )
					{
						cursor.fwd();

						t[ 0 ] = cursor.getDoublePosition( 0 ) + targetInterval.min( 0 );
						t[ 1 ] = cursor.getDoublePosition( 1 ) + targetInterval.min( 1 );

						targetToSource.apply( t, s );

						if ( isInside( s, sourceInterval ) )
						{
							ir.setPosition( s );
							cursor.get().set( ir.get() );
						}
						else
						{
							cursor.get().set( Float.NaN );
						}
					}

					return null;
				});
			}

			RasterTools.execTasks( tasks, service, "resample band" );

			bands.add( Views.translate( out, targetInterval.minAsLongArray() ) );
		}

		return new Raster( source.getBandNames(), bands, targetTransform, source.getProperties() );
	}

	protected static InterpolatorFactory< FloatType, RandomAccessible< FloatType > > createInterpolatorFactory( final Method method )
	{
		if ( method == Method.NEAREST )
			return new NearestNeighborInterpolatorFactory< FloatType >();
		else
			return new NLinearInterpolatorFactory< FloatType >();
	}

	// inside the outer pixel edges of the source
	protected static boolean isInside( final double[] s, final Interval interval )
	{
		for ( int d = 0; d < 2; ++d )
			if ( s[ d ] < interval.min( d ) - 0.5 || s[ d ] > interval.max( d ) + 0.5 )
				return false;

		return true;
	}
}
