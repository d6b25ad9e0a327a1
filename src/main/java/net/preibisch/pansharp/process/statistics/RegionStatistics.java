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

import org.apache.commons.math3.linear.RealMatrix;

import net.preibisch.pansharp.raster.Raster;

/**
 * Reduces the pixels of a raster inside a region to statistics. Implementations
 * never return {@code NaN} for a band without valid pixels, they throw a
 * {@link RegionStatisticsException} instead.
 */
public interface RegionStatistics
{
	/**
	 * @param raster - the raster
	 * @param reducer - which statistic
	 * @param params - region, scale and pixel budget
	 * @return one value per band
	 */
	double[] reduceImage( Raster raster, Reducer reducer, ReductionParameters params );

	default double[] mean( final Raster raster, final ReductionParameters params ) { return reduceImage( raster, Reducer.MEAN, params ); }
	default double[] stddev( final Raster raster, final ReductionParameters params ) { return reduceImage( raster, Reducer.STDDEV, params ); }
	default double[] variance( final Raster raster, final ReductionParameters params ) { return reduceImage( raster, Reducer.VARIANCE, params ); }
	default double[] sum( final Raster raster, final ReductionParameters params ) { return reduceImage( raster, Reducer.SUM, params ); }

	/**
	 * @param raster - the raster, pixels where any band is masked are ignored
	 * @param params - region, scale and pixel budget
	 * @return the (bias corrected) covariance matrix of all bands
	 */
	RealMatrix covariance( Raster raster, ReductionParameters params );

	/**
	 * @param raster - a raster that has already been mean-centered over the same region
	 * @param params - region, scale and pixel budget
	 * @return sum of the products of all band pairs divided by (n-1)
	 */
	RealMatrix centeredCovariance( Raster raster, ReductionParameters params );

	/**
	 * @param raster - the raster
	 * @param band - index of the band
	 * @param params - region, scale and pixel budget
	 * @param numBuckets - number of equal width buckets between min and max
	 * @return the histogram
	 */
	Histogram histogram( Raster raster, int band, ReductionParameters params, int numBuckets );
}
