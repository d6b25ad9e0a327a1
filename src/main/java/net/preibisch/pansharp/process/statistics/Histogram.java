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

import java.util.Arrays;

/**
 * Equal width histogram of one band. The mean of an empty bucket is the bucket center.
 */
public class Histogram
{
	final double min, bucketWidth;
	final double[] bucketMeans;
	final long[] counts;

	public Histogram( final double min, final double bucketWidth, final double[] bucketMeans, final long[] counts )
	{
		this.min = min;
		this.bucketWidth = bucketWidth;
		this.bucketMeans = bucketMeans;
		this.counts = counts;
	}

	public double getMin() { return min; }
	public double getBucketWidth() { return bucketWidth; }
	public int numBuckets() { return counts.length; }
	public double[] getBucketMeans() { return bucketMeans; }
	public long[] getCounts() { return counts; }

	public long totalCount()
	{
		return Arrays.stream( counts ).sum();
	}

	@Override
	public String toString()
	{
		return "Histogram min=" + min + ", width=" + bucketWidth + ", counts=" + Arrays.toString( counts );
	}
}
