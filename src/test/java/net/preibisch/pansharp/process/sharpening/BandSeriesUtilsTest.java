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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.preibisch.pansharp.Threads;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterFixtures;

public class BandSeriesUtilsTest
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
	public void testBandSequenceKeepsOrder()
	{
		final Raster raster = RasterFixtures.constant( 3, 3, 1, new double[] { 1, 2, 3 }, "B4", "B2", "B3" ).setProperty( "id", "scene" );
		final List< Raster > sequence = BandSeriesUtils.toBandSequence( raster );

		assertEquals( 3, sequence.size() );
		assertEquals( Arrays.asList( "B2" ), sequence.get( 1 ).getBandNames() );
		assertEquals( 2, RasterFixtures.value( sequence.get( 1 ), 0, 0, 0 ), 0 );

		final Raster joined = BandSeriesUtils.fromBandSequence( sequence );

		assertEquals( raster.getBandNames(), joined.getBandNames() );
		assertEquals( "scene", joined.getProperty( "id" ) );
		assertTrue( joined.sameGrid( raster ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testJoinDifferentGrids()
	{
		BandSeriesUtils.fromBandSequence(
				RasterFixtures.constant( 3, 3, 1, new double[] { 1 }, "B1" ),
				RasterFixtures.constant( 3, 3, 2, new double[] { 1 }, "B2" ) );
	}

	@Test
	public void testWeightedIntensity()
	{
		final Raster raster = RasterFixtures.constant( 3, 3, 1, new double[] { 100, 200 }, "B1", "B2" );
		final Raster intensity = BandSeriesUtils.weightedIntensity( raster, new double[] { 0.25, 0.5 }, service );

		assertEquals( Arrays.asList( BandSeriesUtils.intensityBandName ), intensity.getBandNames() );
		assertEquals( 125, RasterFixtures.value( intensity, 0, 2, 2 ), 1e-5 );
	}

	@Test
	public void testEqualWeightsByDefault()
	{
		final Raster raster = RasterFixtures.constant( 3, 3, 1, new double[] { 10, 20, 60 }, "B1", "B2", "B3" );

		assertEquals( 30, RasterFixtures.value( BandSeriesUtils.weightedIntensity( raster, null, service ), 0, 1, 1 ), 1e-5 );
		assertEquals( 30, RasterFixtures.value( BandSeriesUtils.meanIntensity( raster, service ), 0, 0, 2 ), 1e-5 );
	}

	@Test
	public void testMaskedPixelMasksIntensity()
	{
		final Raster raster = RasterFixtures.create( 3, 3, 1, ( b, x, y ) -> ( b == 1 && x == 1 && y == 1 ) ? Double.NaN : 1, "B1", "B2" );

		assertTrue( Double.isNaN( RasterFixtures.value( BandSeriesUtils.meanIntensity( raster, service ), 0, 1, 1 ) ) );
	}

	@Test( expected = SharpeningParameterException.class )
	public void testWeightCountMismatch()
	{
		BandSeriesUtils.weightedIntensity( RasterFixtures.constant( 3, 3, 1, new double[] { 1, 2 }, "B1", "B2" ), new double[] { 1, 1, 1 }, service );
	}
}
