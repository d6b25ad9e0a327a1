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
package net.preibisch.pansharp.raster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Vector;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.pansharp.Threads;

/**
 * Multithreaded per-pixel arithmetic on bands. All results are materialized
 * into {@code float} array images, translated to the interval of their input,
 * so that chained operations do not re-evaluate their inputs.
 */
public class RasterTools
{
	/**
	 * Computes one output value from the values of all input bands at the same pixel.
	 */
	public interface PixelFunction
	{
		double apply( double[] values );
	}

	/**
	 * Computes several output values from the values of all input bands at the same pixel.
	 */
	public interface VectorFunction
	{
		void apply( double[] values, double[] result );
	}

	public static RandomAccessibleInterval< FloatType > constant( final Interval interval, final float value )
	{
		final Img< FloatType > img = ArrayImgs.floats( interval.dimensionsAsLongArray() );

		for ( final FloatType t : img )
			t.set( value );

		return restoreMin( img, interval );
	}

	public static RandomAccessibleInterval< FloatType > compute(
			final List< ? extends RandomAccessibleInterval< FloatType > > inputs,
			final PixelFunction function,
			final ExecutorService service )
	{
		final List< RandomAccessibleInterval< FloatType > > result = computeVector(
				inputs,
				1,
				( values, out ) -> out[ 0 ] = function.apply( values ),
				service );

		return result.get( 0 );
	}

	/**
	 * Evaluates a function for every pixel of a set of bands, splitting the image into portions
	 * that are processed by the given service.
	 *
	 * @param inputs - input bands, all with the same interval
	 * @param numOutputs - how many output bands the function writes
	 * @param function - the per-pixel function
	 * @param service - the executor service
	 * @return the output bands, on the interval of the inputs
	 */
	public static List< RandomAccessibleInterval< FloatType > > computeVector(
			final List< ? extends RandomAccessibleInterval< FloatType > > inputs,
			final int numOutputs,
			final VectorFunction function,
			final ExecutorService service )
	{
		final Interval interval = inputs.get( 0 );
		final long[] dim = interval.dimensionsAsLongArray();

		final ArrayList< Img< FloatType > > outputs = new ArrayList<>();

		for ( int i = 0; i < numOutputs; ++i )
			outputs.add( ArrayImgs.floats( dim ) );

		final ArrayList< RandomAccessibleInterval< FloatType > > zeroMinInputs = new ArrayList<>();

		for ( final RandomAccessibleInterval< FloatType > input : inputs )
			zeroMinInputs.add( Views.isZeroMin( input ) ? input : Views.zeroMin( input ) );

		final Vector< ImagePortion > portions = divideIntoPortions( outputs.get( 0 ).size() );
		final ArrayList< Callable< Void > > tasks = new ArrayList<>();

		for ( final ImagePortion portion : portions )
		{
			tasks.add( () ->
			{
				final Cursor< FloatType > cursor = outputs.get( 0 ).localizingCursor();
				final ArrayList< RandomAccess< FloatType > > inRAs = new ArrayList<>();
				final ArrayList< RandomAccess< FloatType > > outRAs = new ArrayList<>();

				for ( final RandomAccessibleInterval< FloatType > input : zeroMinInputs )
					inRAs.add( input.randomAccess() );

				for ( int i = 1; i < numOutputs; ++i )
					outRAs.add( outputs.get( i ).randomAccess() );

				final double[] values = new double[ inRAs.size() ];
				final double[] result = new double[ numOutputs ];

				cursor.jumpFwd( portion.getStartPosition() );

				for ( long l = 0; l < portion.getLoopSize(); ++l )
				{
					cursor.fwd();

					for ( int i = 0; i < values.length; ++i )
					{
						final RandomAccess< FloatType > ra = inRAs.get( i );
						ra.setPosition( cursor );
						values[ i ] = ra.get().getRealDouble();
					}

					function.apply( values, result );

					cursor.get().set( (float)result[ 0 ] );

					for ( int i = 1; i < numOutputs; ++i )
					{
						final RandomAccess< FloatType > ra = outRAs.get( i - 1 );
						ra.setPosition( cursor );
						ra.get().set( (float)result[ i ] );
					}
				}

				return null;
			});
		}

		execTasks( tasks, service, "compute pixels" );

		final ArrayList< RandomAccessibleInterval< FloatType > > result = new ArrayList<>();

		for ( final Img< FloatType > output : outputs )
			result.add( restoreMin( output, interval ) );

		return result;
	}

	/**
	 * Applies {@code a op b} band by band. {@code b} either has a single band that is combined
	 * with every band of {@code a}, or the same number of bands as {@code a}.
	 *
	 * @param a - first operand, defines grid and band names of the result
	 * @param b - second operand on the same grid
	 * @param op - the operation
	 * @param service - the executor service
	 * @return the combined raster
	 */
	public static Raster combine( final Raster a, final Raster b, final PixelFunction op, final ExecutorService service )
	{
		if ( b.numBands() != 1 && b.numBands() != a.numBands() )
			throw new IllegalArgumentException( "Cannot combine " + a.numBands() + " bands with " + b.numBands() + " bands." );

		final ArrayList< RandomAccessibleInterval< FloatType > > result = new ArrayList<>();

		for ( int i = 0; i < a.numBands(); ++i )
		{
			final RandomAccessibleInterval< FloatType > other = b.numBands() == 1 ? b.getBand( 0 ) : b.getBand( i );
			result.add( compute( Arrays.asList( a.getBand( i ), other ), op, service ) );
		}

		return a.withBands( a.getBandNames(), result );
	}

	/**
	 * @param raster - the input
	 * @param scales - multiplicative factor per band
	 * @param offsets - additive offset per band, applied after scaling
	 * @param service - the executor service
	 * @return a raster where every band b is {@code band * scales[b] + offsets[b]}
	 */
	public static Raster linear( final Raster raster, final double[] scales, final double[] offsets, final ExecutorService service )
	{
		final ArrayList< RandomAccessibleInterval< FloatType > > result = new ArrayList<>();

		for ( int i = 0; i < raster.numBands(); ++i )
		{
			final double scale = scales[ i ];
			final double offset = offsets[ i ];

			result.add( compute( Arrays.asList( raster.getBand( i ) ), v -> v[ 0 ] * scale + offset, service ) );
		}

		return raster.withBands( raster.getBandNames(), result );
	}

	/**
	 * Sums the values in a square window around every pixel, the border of the input is mirrored.
	 *
	 * @param input - the band
	 * @param span - the window is 2*span+1 pixels wide
	 * @param service - the executor service
	 * @return the window sums, on the interval of the input
	 */
	public static RandomAccessibleInterval< FloatType > windowSum( final RandomAccessibleInterval< FloatType > input, final int span, final ExecutorService service )
	{
		final RandomAccessible< FloatType > source = Views.extendMirrorSingle( Views.isZeroMin( input ) ? input : Views.zeroMin( input ) );
		final Img< FloatType > output = ArrayImgs.floats( input.dimensionsAsLongArray() );

		final Vector< ImagePortion > portions = divideIntoPortions( output.size() );
		final ArrayList< Callable< Void > > tasks = new ArrayList<>();

		for ( final ImagePortion portion : portions )
		{
			tasks.add( () ->
			{
				final Cursor< FloatType > out = output.localizingCursor();
				final RandomAccess< FloatType > ra = source.randomAccess();
				final long[] position = new long[ 2 ];

				out.jumpFwd( portion.getStartPosition() );

				for ( long l = 0; l < portion.getLoopSize(); ++l )
				{
					out.fwd();
					out.localize( position );

					// the window includes its center pixel
					double sum = 0;

					for ( long dy = -span; dy <= span; ++dy )
						for ( long dx = -span; dx <= span; ++dx )
						{
							ra.setPosition( position[ 0 ] + dx, 0 );
							ra.setPosition( position[ 1 ] + dy, 1 );
							sum += ra.get().get();
						}

					out.get().set( (float)sum );
				}

				return null;
			});
		}

		execTasks( tasks, service, "compute window sums" );

		return restoreMin( output, input );
	}

	/**
	 * @param img - a zero-min image
	 * @param interval - an interval with the same dimensions
	 * @return the image translated to the min of the interval
	 */
	public static RandomAccessibleInterval< FloatType > restoreMin( final RandomAccessibleInterval< FloatType > img, final Interval interval )
	{
		if ( Views.isZeroMin( interval ) )
			return img;
		else
			return Views.translate( img, interval.minAsLongArray() );
	}

	public static Vector< ImagePortion > divideIntoPortions( final long imageSize )
	{
		int numPortions;

		if ( imageSize <= Threads.numThreads() )
			numPortions = (int)imageSize;
		else
			numPortions = Math.max( Threads.numThreads(), (int)( imageSize / ( 64l*64l ) ) );

		final Vector< ImagePortion > portions = new Vector< ImagePortion >();

		if ( imageSize == 0 )
			return portions;

		long threadChunkSize = imageSize / numPortions;

		while ( threadChunkSize == 0 )
		{
			--numPortions;
			threadChunkSize = imageSize / numPortions;
		}

		long threadChunkMod = imageSize % numPortions;

		for ( int portionID = 0; portionID < numPortions; ++portionID )
		{
			// move to the starting position of the current thread
			final long startPosition = portionID * threadChunkSize;

			// the last thread may has to run longer if the number of pixels cannot be divided by the number of threads
			final long loopSize;
			if ( portionID == numPortions - 1 )
				loopSize = threadChunkSize + threadChunkMod;
			else
				loopSize = threadChunkSize;

			portions.add( new ImagePortion( startPosition, loopSize ) );
		}

		return portions;
	}

	/**
	 * Runs all tasks and returns their results in task order. A {@link RuntimeException} thrown
	 * by a task is rethrown unchanged.
	 *
	 * @param tasks - the tasks
	 * @param service - the executor service
	 * @param jobDescription - used in error messages
	 * @param <T> - result type
	 * @return the results
	 */
	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final ExecutorService service, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>();

		try
		{
			// invokeAll() returns when all tasks are complete
			for ( final Future< T > future : service.invokeAll( tasks ) )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while trying to " + jobDescription, e );
		}
		catch ( final ExecutionException e )
		{
			if ( e.getCause() instanceof RuntimeException )
				throw (RuntimeException)e.getCause();

			throw new RuntimeException( "Failed to " + jobDescription + ": " + e.getCause(), e.getCause() );
		}

		return results;
	}
}
