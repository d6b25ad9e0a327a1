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

import net.imglib2.FinalRealInterval;
import net.imglib2.RealInterval;
import net.preibisch.pansharp.raster.Raster;

/**
 * Where and how densely image statistics are sampled. All statistics of one
 * sharpening run must use the same (resolved) instance, otherwise the
 * coefficients computed from them are not consistent.
 */
public class ReductionParameters
{
	public static double defaultMaxPixels = 1e12;

	final RealInterval region;
	final Double scale;
	final double maxPixels;

	/**
	 * @param region - world region to sample, null means the footprint of the raster
	 * @param scale - distance of sample points in world units, null means the nominal scale of the raster
	 * @param maxPixels - maximal number of sample points
	 */
	public ReductionParameters( final RealInterval region, final Double scale, final double maxPixels )
	{
		if ( region != null && region.numDimensions() != 2 )
			throw new IllegalArgumentException( "The region must be 2d." );

		if ( scale != null && !( scale > 0 ) )
			throw new IllegalArgumentException( "The scale must be positive, got " + scale );

		if ( !( maxPixels >= 1 ) )
			throw new IllegalArgumentException( "maxPixels must be at least 1, got " + maxPixels );

		this.region = region == null ? null : new FinalRealInterval( region );
		this.scale = scale;
		this.maxPixels = maxPixels;
	}

	public ReductionParameters( final RealInterval region, final Double scale )
	{
		this( region, scale, defaultMaxPixels );
	}

	public ReductionParameters()
	{
		this( null, null, defaultMaxPixels );
	}

	public RealInterval getRegion() { return region; }
	public Double getScale() { return scale; }
	public double getMaxPixels() { return maxPixels; }

	public boolean isResolved() { return region != null && scale != null; }

	/**
	 * Fills in the defaults that depend on a raster.
	 *
	 * @param raster - the raster that defines the default region and scale
	 * @return parameters with region and scale set
	 */
	public ReductionParameters resolve( final Raster raster )
	{
		if ( isResolved() )
			return this;

		return new ReductionParameters(
				region == null ? raster.footprint() : region,
				scale == null ? raster.nominalScale() : scale,
				maxPixels );
	}

	@Override
	public String toString()
	{
		return "region=" + ( region == null ? "footprint" : "[" + region.realMin( 0 ) + ", " + region.realMin( 1 ) + "] -> [" + region.realMax( 0 ) + ", " + region.realMax( 1 ) + "]" ) +
				", scale=" + ( scale == null ? "nominal" : scale ) +
				", maxPixels=" + maxPixels;
	}
}
