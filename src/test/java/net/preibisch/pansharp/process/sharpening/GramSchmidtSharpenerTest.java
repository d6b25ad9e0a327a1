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
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.preibisch.pansharp.Threads;
import net.preibisch.pansharp.process.resampling.Resampler;
import net.preibisch.pansharp.process.statistics.DegenerateStatisticsException;
import net.preibisch.pansharp.process.statistics.ReductionParameters;
import net.preibisch.pansharp.process.statistics.SampledRegionStatistics;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterFixtures;

public class GramSchmidtSharpenerTest
{
	ExecutorService service;

	// 30m multispectral and 15m pan over the same 120m x 120m
	final Raster img = RasterFixtures.random( 11, 4, 4, 30, "B2", "B3", "B4" );
	final Raster pan = RasterFixtures.random( 12, 8, 8, 15, "B8" );

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
	public void testBandCountAndGrid()
	{
		final Raster sharpened = new GramSchmidtSharpener().sharpen( img, pan );

		assertEquals( img.getBandNames(), sharpened.getBandNames() );
		assertTrue( sharpened.sameGrid( pan ) );

		for ( int b = 0; b < 3; ++b )
			for ( int y = 0; y < 8; ++y )
				for ( int x = 0; x < 8; ++x )
					assertTrue( Double.isFinite( RasterFixtures.value( sharpened, b, x, y ) ) );
	}

	@Test
	public void testNoDetailWhenPanEqualsSimulatedPan()
	{
		final Raster resampled = Resampler.resample( img, pan, service );
		final Raster panSim = BandSeriesUtils.meanIntensity( resampled, service ).rename( "B8" );

		final Raster sharpened = new GramSchmidtSharpener().sharpen( img, panSim );

		assertEquals( 0, RasterFixtures.maxAbsDifference( resampled, sharpened ), 1e-4 );
	}

	@Test
	public void testOrthogonalizationChain()
	{
		final GramSchmidtSharpener gs = new GramSchmidtSharpener();
		final Raster ms = Resampler.resample( img, pan, service );
		final Raster panSim = BandSeriesUtils.meanIntensity( ms, service );
		final ReductionParameters params = new ReductionParameters().resolve( ms );

		final GramSchmidtSharpener.GramSchmidtBands bands = gs.orthogonalize( ms, panSim, params, service );

		assertEquals( 4, bands.size() );
		assertEquals( Arrays.asList( "GS1" ), bands.getBands().get( 1 ).getBandNames() );

		// GS[i] = ms_i - g_i * GS[i-1] is uncorrelated with GS[i-1]
		for ( int i = 1; i < bands.size(); ++i )
			assertEquals( 0, gs.coefficient( bands.getBands().get( i ), bands.getBands().get( i - 1 ), params ), 1e-4 );
	}

	@Test
	public void testCoefficientIsNotSymmetric()
	{
		final GramSchmidtSharpener gs = new GramSchmidtSharpener();
		final Raster a = RasterFixtures.random( 5, 6, 6, 1, "a" );
		final Raster b = RasterFixtures.create( 6, 6, 1, ( band, x, y ) -> 2 * RasterFixtures.value( a, 0, x, y ), "b" );
		final ReductionParameters params = new ReductionParameters();

		// cov( a, b ) / var( b ) versus cov( b, a ) / var( a )
		assertEquals( 0.5, gs.coefficient( a, b, params ), 1e-6 );
		assertEquals( 2.0, gs.coefficient( b, a, params ), 1e-6 );
	}

	@Test( expected = DegenerateStatisticsException.class )
	public void testConstantImage()
	{
		new GramSchmidtSharpener().sharpen( RasterFixtures.constant( 4, 4, 30, new double[] { 10, 10, 10 }, "B2", "B3", "B4" ), pan );
	}

	@Test( expected = SharpeningParameterException.class )
	public void testSharpenedImageCannotBeSharpenedAgain()
	{
		final GramSchmidtSharpener gs = new GramSchmidtSharpener();
		gs.sharpen( gs.sharpen( img, pan ), pan );
	}

	@Test( expected = SharpeningParameterException.class )
	public void testPanMustHaveOneBand()
	{
		new GramSchmidtSharpener().sharpen( img, RasterFixtures.random( 1, 8, 8, 15, "B8", "B9" ) );
	}

	@Test
	public void testDetailIsWeightedByBandCoefficient()
	{
		final GramSchmidtSharpener gs = new GramSchmidtSharpener();
		final Raster sharpened = gs.sharpen( img, pan );

		final Raster ms = Resampler.resample( img, pan, service );
		final Raster panSim = BandSeriesUtils.meanIntensity( ms, service ).rename( "panSim" );
		final ReductionParameters params = new ReductionParameters().resolve( ms );

		final GramSchmidtSharpener.GramSchmidtBands bands = gs.orthogonalize( ms, panSim, params, service );
		final Raster panMatch = new HistogramMatcher( new SampledRegionStatistics() ).match( pan, panSim, params, service );

		// GS[0] is the substituted band, output band b uses the coefficient of GS[b+1]
		for ( int b = 0; b < 3; ++b )
		{
			final double g = gs.coefficient( bands.getBands().get( b + 1 ), panSim, params );

			for ( int y = 0; y < 8; ++y )
				for ( int x = 0; x < 8; ++x )
				{
					final double detail = RasterFixtures.value( panMatch, 0, x, y ) - RasterFixtures.value( panSim, 0, x, y );
					final double expected = RasterFixtures.value( ms, b, x, y ) + g * detail;

					assertEquals( expected, RasterFixtures.value( sharpened, b, x, y ), 1e-3 );
				}
		}
	}
}
