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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.pansharp.Threads;

public class RasterToolsTest
{
	ExecutorService service;

	@Before
	public void setUp()
	{
		service = Threads.createFixedExecutorService();
	}

	@After
	public void tearDown()
	{
		service.shutdown();
	}

	@Test
	public void testPortionsCoverImage()
	{
		for ( final long size : new long[] { 0, 1, 3, 4097, 100000 } )
		{
			long next = 0;

			for ( final ImagePortion portion : RasterTools.divideIntoPortions( size ) )
			{
				assertEquals( next, portion.getStartPosition() );
				next += portion.getLoopSize();
			}

			assertEquals( size, next );
		}
	}

	@Test
	public void testCombineBroadcastsSingleBand()
	{
		final Raster a = RasterFixtures.create( 100, 70, 1, ( b, x, y ) -> b * 1000 + x + y, "B1", "B2" );
		final Raster b = RasterFixtures.create( 100, 70, 1, ( band, x, y ) -> x, "pan" );

		final Raster sum = RasterTools.combine( a, b, v -> v[ 0 ] + v[ 1 ], service );

		assertEquals( Arrays.asList( "B1", "B2" ), sum.getBandNames() );
		assertEquals( 2 * 17 + 5, RasterFixtures.value( sum, 0, 17, 5 ), 0 );
		assertEquals( 1000 + 2 * 99 + 69, RasterFixtures.value( sum, 1, 99, 69 ), 0 );
	}

	@Test
	public void testLinear()
	{
		final Raster a = RasterFixtures.constant( 3, 3, 1, new double[] { 2, 4 }, "B1", "B2" );
		final Raster result = RasterTools.linear( a, new double[] { 3, 0.5 }, new double[] { 1, -2 }, service );

		assertEquals( 7, RasterFixtures.value( result, 0, 1, 1 ), 0 );
		assertEquals( 0, RasterFixtures.value( result, 1, 2, 0 ), 0 );
	}

	@Test
	public void testComputeKeepsInterval()
	{
		final RandomAccessibleInterval< FloatType > band = Views.translate( ArrayImgs.floats( 5, 4 ), -3, 8 );
		final RandomAccessibleInterval< FloatType > result = RasterTools.compute( Arrays.asList( band ), v -> v[ 0 ] + 1, service );

		assertTrue( Intervals.equals( band, result ) );

		for ( final FloatType t : Views.iterable( result ) )
			assertEquals( 1, t.get(), 0 );
	}

	@Test
	public void testWindowSumOfConstant()
	{
		final RandomAccessibleInterval< FloatType > ones = RasterTools.constant( Intervals.createMinSize( 0, 0, 6, 5 ), 1 );

		// mirrored border, every window is full
		for ( final FloatType t : Views.iterable( RasterTools.windowSum( ones, 1, service ) ) )
			assertEquals( 9, t.get(), 0 );

		for ( final FloatType t : Views.iterable( RasterTools.windowSum( ones, 2, service ) ) )
			assertEquals( 25, t.get(), 0 );
	}

	@Test
	public void testWindowSumMirrorsBorderOfTranslatedInput()
	{
		final Img< FloatType > img = ArrayImgs.floats( 4, 4 );
		final Cursor< FloatType > c = img.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();
			c.get().set( c.getIntPosition( 0 ) + 10 * c.getIntPosition( 1 ) );
		}

		final RandomAccessibleInterval< FloatType > sums = RasterTools.windowSum( Views.translate( img, 2, 3 ), 1, service );

		assertEquals( 2, sums.min( 0 ) );
		assertEquals( 3, sums.min( 1 ) );

		final RandomAccess< FloatType > ra = sums.randomAccess();

		// corner: x and y in { 1, 0, 1 }
		ra.setPosition( new long[] { 2, 3 } );
		assertEquals( 66, ra.get().get(), 1e-5 );

		// interior: x in { 0, 1, 2 }, y in { 1, 2, 3 }
		ra.setPosition( new long[] { 3, 5 } );
		assertEquals( 9 * ( 1 + 20 ), ra.get().get(), 1e-5 );
	}

	@Test
	public void testExecTasksRethrowsTaskException()
	{
		final List< Callable< Void > > tasks = new ArrayList<>();
		final IllegalStateException failure = new IllegalStateException( "task failed" );

		tasks.add( () -> null );
		tasks.add( () -> { throw failure; } );

		try
		{
			RasterTools.execTasks( tasks, service, "run test tasks" );
			fail( "expected the task exception" );
		}
		catch ( final IllegalStateException e )
		{
			assertSame( failure, e );
		}
	}
}
