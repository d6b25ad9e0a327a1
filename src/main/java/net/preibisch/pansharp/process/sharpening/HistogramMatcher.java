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

import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.pansharp.process.statistics.DegenerateStatisticsException;
import net.preibisch.pansharp.process.statistics.ReductionParameters;
import net.preibisch.pansharp.process.statistics.RegionStatistics;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Linear histogram matching, rescales every band of a target raster so that its mean and
 * standard deviation match the reference.
 */
public class HistogramMatcher
{
	private static final Logger LOG = LoggerFactory.getLogger( HistogramMatcher.class );

	final RegionStatistics stats;

	public HistogramMatcher( final RegionStatistics stats )
	{
		this.stats = stats;
	}

	/**
	 * Computes {@code (target - mean(target)) * stddev(reference) / stddev(target) + mean(reference)}
	 * for every band.
	 *
	 * @param target - the raster to rescale
	 * @param reference - a single band, or as many bands as the target
	 * @param params - where the statistics of both rasters are computed
	 * @param service - the executor service
	 * @return the rescaled target, with the band names of the target
	 */
	public Raster match( final Raster target, final Raster reference, final ReductionParameters params, final ExecutorService service )
	{
		if ( reference.numBands() != 1 && reference.numBands() != target.numBands() )
			throw new SharpeningParameterException( "Cannot match " + target.numBands() + " bands to a reference with " + reference.numBands() + " bands." );

		final double[] offsetTarget = stats.mean( target, params );
		final double[] offsetRef = stats.mean( reference, params );
		final double[] stdTarget = stats.stddev( target, params );
		final double[] stdRef = stats.stddev( reference, params );

		final int n = target.numBands();
		final double[] scales = new double[ n ];
		final double[] offsets = new double[ n ];

		for ( int b = 0; b < n; ++b )
		{
			final int r = reference.numBands() == 1 ? 0 : b;

			if ( !( stdTarget[ b ] > 0 ) || Double.isInfinite( stdTarget[ b ] ) )
				throw new DegenerateStatisticsException( "Standard deviation of band '" + target.getBandName( b ) + "' is " + stdTarget[ b ] + ", cannot match its histogram." );

			scales[ b ] = stdRef[ r ] / stdTarget[ b ];
			offsets[ b ] = offsetRef[ r ] - offsetTarget[ b ] * scales[ b ];

			LOG.debug( "Histogram match '{}' -> '{}': scale={}, offset={}", target.getBandName( b ), reference.getBandName( r ), scales[ b ], offsets[ b ] );
		}

		return RasterTools.linear( target, scales, offsets, service );
	}
}
