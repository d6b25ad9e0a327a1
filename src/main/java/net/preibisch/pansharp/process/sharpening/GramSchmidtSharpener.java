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
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.process.statistics.DegenerateStatisticsException;
import net.preibisch.pansharp.process.statistics.ReductionParameters;
import net.preibisch.pansharp.process.statistics.RegionStatistics;
import net.preibisch.pansharp.process.statistics.SampledRegionStatistics;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Gram-Schmidt sharpening (Hallabia et al. 2014). A simulated pan band (the mean of all
 * multispectral bands) starts a sequence of orthogonalized bands, the histogram-matched pan
 * band replaces it, and the difference between real and simulated pan is added to every band
 * weighted by its regression coefficient on the simulated pan band.
 */
public class GramSchmidtSharpener extends AbstractSharpener
{
	private static final Logger LOG = LoggerFactory.getLogger( GramSchmidtSharpener.class );

	/**
	 * The orthogonalized bands of one call and the reduction parameters all of their
	 * coefficients are computed with.
	 */
	public static class GramSchmidtBands
	{
		final ReductionParameters params;
		final ArrayList< Raster > bands = new ArrayList<>();

		public GramSchmidtBands( final ReductionParameters params, final Raster first )
		{
			this.params = params;
			this.bands.add( first );
		}

		public ReductionParameters getParams() { return params; }
		public List< Raster > getBands() { return bands; }
		public Raster last() { return bands.get( bands.size() - 1 ); }
		public int size() { return bands.size(); }
		public void add( final Raster band ) { bands.add( band ); }
	}

	final ReductionParameters params;
	final RegionStatistics stats;
	final HistogramMatcher matcher;

	public GramSchmidtSharpener( final ReductionParameters params, final RegionStatistics stats )
	{
		this.params = params;
		this.stats = stats;
		this.matcher = new HistogramMatcher( stats );
	}

	public GramSchmidtSharpener( final ReductionParameters params )
	{
		this( params, new SampledRegionStatistics() );
	}

	public GramSchmidtSharpener()
	{
		this( new ReductionParameters() );
	}

	@Override
	public SharpenerType getType() { return SharpenerType.GS; }

	@Override
	protected Raster fuse( final Raster img, final Raster pan, final ExecutorService service )
	{
		final Raster ms = resampleToPan( img, pan, service );
		final ReductionParameters resolved = params.resolve( ms );

		LOG.info( "Reduction parameters: {}", resolved );

		// NaN outside of the image footprint
		final Raster panSim = BandSeriesUtils.meanIntensity( ms, service ).rename( "panSim" );

		final GramSchmidtBands gs = orthogonalize( ms, panSim, resolved, service );

		final Raster panMatch = matcher.match( pan, panSim, resolved, service );
		final Raster detail = RasterTools.combine( panMatch, panSim, v -> v[ 0 ] - v[ 1 ], service );

		// the substituted band at index 0 receives no coefficient, only GS[1..n] map to output bands
		final ArrayList< RandomAccessibleInterval< FloatType > > sharpened = new ArrayList<>();

		for ( int i = 1; i < gs.size(); ++i )
		{
			final double g = coefficient( gs.getBands().get( i ), panSim, resolved );

			LOG.debug( "Detail coefficient of '{}': {}", ms.getBandName( i - 1 ), g );

			sharpened.add( RasterTools.combine( ms.select( i - 1 ), detail, v -> v[ 0 ] + g * v[ 1 ], service ).getBand( 0 ) );
		}

		return ms.withBands( img.getBandNames(), sharpened );
	}

	/**
	 * Builds GS[0] = panSim and GS[i] = ms_i - g_i * GS[i-1], strictly in band order.
	 *
	 * @param ms - the resampled multispectral bands
	 * @param panSim - the simulated pan band
	 * @param params - resolved reduction parameters
	 * @param service - the executor service
	 * @return the n+1 orthogonalized bands
	 */
	public GramSchmidtBands orthogonalize( final Raster ms, final Raster panSim, final ReductionParameters params, final ExecutorService service )
	{
		final GramSchmidtBands gs = new GramSchmidtBands( params, panSim );

		for ( final Raster band : BandSeriesUtils.toBandSequence( ms ) )
		{
			final Raster previous = gs.last();
			final double g = coefficient( band, previous, gs.getParams() );

			LOG.debug( "GS coefficient of '{}': {}", band.getBandName( 0 ), g );

			gs.add( RasterTools.combine( band, previous, v -> v[ 0 ] - g * v[ 1 ], service ).rename( "GS" + gs.size() ) );
		}

		return gs;
	}

	/**
	 * @param band - single band raster
	 * @param reference - single band raster on the same grid
	 * @param params - resolved reduction parameters
	 * @return {@code cov( band, reference ) / var( reference )}
	 */
	public double coefficient( final Raster band, final Raster reference, final ReductionParameters params )
	{
		final RealMatrix covariance = stats.covariance(
				BandSeriesUtils.fromBandSequence( band.rename( "band" ), reference.rename( "reference" ) ),
				params );

		final double cov = covariance.getEntry( 0, 1 );
		final double var = covariance.getEntry( 1, 1 );

		if ( !( var > 0 ) || Double.isInfinite( var ) || Double.isNaN( cov ) )
			throw new DegenerateStatisticsException( "Variance of '" + reference.getBandName( 0 ) + "' is " + var + ", the Gram-Schmidt coefficient of '" + band.getBandName( 0 ) + "' is undefined." );

		return cov / var;
	}
}
