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
import java.util.concurrent.ExecutorService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Hue-saturation-value substitution of a three band (red, green, blue) raster, the value
 * is replaced by the pan band.
 */
public class IHSSharpener extends AbstractSharpener
{
	@Override
	public SharpenerType getType() { return SharpenerType.IHS; }

	@Override
	protected void validate( final Raster img, final Raster pan )
	{
		if ( img.numBands() != 3 )
			throw new SharpeningParameterException( "IHS sharpening needs exactly 3 bands (red, green, blue), got " + img.getBandNames() );
	}

	@Override
	protected Raster fuse( final Raster img, final Raster pan, final ExecutorService service )
	{
		final Raster ms = resampleToPan( img, pan, service );

		final ArrayList< RandomAccessibleInterval< FloatType > > inputs = new ArrayList<>( ms.getBands() );
		inputs.add( pan.getBand( 0 ) );

		return ms.withBands( ms.getBandNames(), RasterTools.computeVector( inputs, 3, ( values, rgb ) ->
		{
			if ( Double.isNaN( values[ 0 ] ) || Double.isNaN( values[ 1 ] ) || Double.isNaN( values[ 2 ] ) )
			{
				rgb[ 0 ] = rgb[ 1 ] = rgb[ 2 ] = Double.NaN;
				return;
			}

			final double[] hsv = new double[ 3 ];

			rgbToHsv( values[ 0 ], values[ 1 ], values[ 2 ], hsv );
			hsvToRgb( hsv[ 0 ], hsv[ 1 ], values[ 3 ], rgb );
		}, service ) );
	}

	/**
	 * @param hsv - hue in [0,1), saturation in [0,1] and value (the largest of r, g, b)
	 */
	public static void rgbToHsv( final double r, final double g, final double b, final double[] hsv )
	{
		final double max = Math.max( r, Math.max( g, b ) );
		final double min = Math.min( r, Math.min( g, b ) );
		final double delta = max - min;

		double h = 0;

		if ( delta > 0 )
		{
			if ( max == r )
				h = ( ( g - b ) / delta ) / 6.0;
			else if ( max == g )
				h = ( ( b - r ) / delta + 2.0 ) / 6.0;
			else
				h = ( ( r - g ) / delta + 4.0 ) / 6.0;

			if ( h < 0 )
				h += 1.0;
		}

		hsv[ 0 ] = h;
		hsv[ 1 ] = max > 0 ? delta / max : 0;
		hsv[ 2 ] = max;
	}

	public static void hsvToRgb( final double h, final double s, final double v, final double[] rgb )
	{
		final double h6 = ( h - Math.floor( h ) ) * 6.0;
		final int sector = Math.min( 5, (int)Math.floor( h6 ) );
		final double f = h6 - sector;

		final double p = v * ( 1 - s );
		final double q = v * ( 1 - s * f );
		final double t = v * ( 1 - s * ( 1 - f ) );

		switch ( sector )
		{
		case 0: rgb[ 0 ] = v; rgb[ 1 ] = t; rgb[ 2 ] = p; break;
		case 1: rgb[ 0 ] = q; rgb[ 1 ] = v; rgb[ 2 ] = p; break;
		case 2: rgb[ 0 ] = p; rgb[ 1 ] = v; rgb[ 2 ] = t; break;
		case 3: rgb[ 0 ] = p; rgb[ 1 ] = q; rgb[ 2 ] = v; break;
		case 4: rgb[ 0 ] = t; rgb[ 1 ] = p; rgb[ 2 ] = v; break;
		default: rgb[ 0 ] = v; rgb[ 1 ] = p; rgb[ 2 ] = q; break;
		}
	}
}
