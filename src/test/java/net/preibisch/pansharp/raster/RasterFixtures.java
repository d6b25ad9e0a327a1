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
import java.util.Random;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Synthetic in-memory rasters for tests.
 */
public class RasterFixtures
{
	public interface PixelValue
	{
		double value( int band, long x, long y );
	}

	public static Raster create( final int width, final int height, final double scale, final PixelValue f, final String... names )
	{
		final ArrayList< RandomAccessibleInterval< FloatType > > bands = new ArrayList<>();

		for ( int b = 0; b < names.length; ++b )
		{
			final Img< FloatType > img = ArrayImgs.floats( width, height );
			final Cursor< FloatType > c = img.localizingCursor();

			while ( c.hasNext() )
			{
				c.fwd();
				c.get().setReal( f.value( b, c.getLongPosition( 0 ), c.getLongPosition( 1 ) ) );
			}

			bands.add( img );
		}

		return Raster.create( Arrays.asList( names ), bands, scale, 0, 0 );
	}

	public static Raster constant( final int width, final int height, final double scale, final double[] values, final String... names )
	{
		return create( width, height, scale, ( b, x, y ) -> values[ b ], names );
	}

	public static Raster random( final long seed, final int width, final int height, final double scale, final String... names )
	{
		final Random rnd = new Random( seed );
		final double[][][] values = new double[ names.length ][ width ][ height ];

		for ( int b = 0; b < names.length; ++b )
			for ( int x = 0; x < width; ++x )
				for ( int y = 0; y < height; ++y )
					values[ b ][ x ][ y ] = 10 + rnd.nextInt( 90 );

		return create( width, height, scale, ( b, x, y ) -> values[ b ][ (int)x ][ (int)y ], names );
	}

	/**
	 * @return the value at (x,y) relative to the min of the raster interval
	 */
	public static double value( final Raster raster, final int band, final long x, final long y )
	{
		final RandomAccess< FloatType > ra = raster.getBand( band ).randomAccess();
		ra.setPosition( new long[] { raster.getInterval().min( 0 ) + x, raster.getInterval().min( 1 ) + y } );

		return ra.get().getRealDouble();
	}

	public static double maxAbsDifference( final Raster a, final Raster b )
	{
		double max = 0;

		for ( int band = 0; band < a.numBands(); ++band )
			for ( long y = 0; y < a.getInterval().dimension( 1 ); ++y )
				for ( long x = 0; x < a.getInterval().dimension( 0 ); ++x )
					max = Math.max( max, Math.abs( value( a, band, x, y ) - value( b, band, x, y ) ) );

		return max;
	}
}
