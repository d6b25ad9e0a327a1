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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterFixtures;

public class IHSSharpenerTest
{
	@Test
	public void testValueIsReplacedByPan()
	{
		final Raster img = RasterFixtures.constant( 4, 4, 30, new double[] { 100, 50, 25 }, "red", "green", "blue" );
		final Raster pan = RasterFixtures.constant( 8, 8, 15, new double[] { 200 }, "pan" );

		final Raster sharpened = new IHSSharpener().sharpen( img, pan );

		assertEquals( img.getBandNames(), sharpened.getBandNames() );
		assertEquals( 200, RasterFixtures.value( sharpened, 0, 5, 2 ), 1e-3 );
		assertEquals( 100, RasterFixtures.value( sharpened, 1, 5, 2 ), 1e-3 );
		assertEquals( 50, RasterFixtures.value( sharpened, 2, 5, 2 ), 1e-3 );
	}

	@Test
	public void testHsvRoundTrip()
	{
		final double[][] colors = { { 0.2, 0.4, 0.9 }, { 0.9, 0.1, 0.3 }, { 0.5, 0.5, 0.5 }, { 0.1, 0.8, 0.2 }, { 0, 0, 0 } };

		for ( final double[] rgb : colors )
		{
			final double[] hsv = new double[ 3 ];
			final double[] back = new double[ 3 ];

			IHSSharpener.rgbToHsv( rgb[ 0 ], rgb[ 1 ], rgb[ 2 ], hsv );
			IHSSharpener.hsvToRgb( hsv[ 0 ], hsv[ 1 ], hsv[ 2 ], back );

			assertArrayEquals( rgb, back, 1e-12 );
		}
	}

	@Test( expected = SharpeningParameterException.class )
	public void testNeedsThreeBands()
	{
		new IHSSharpener().sharpen(
				RasterFixtures.constant( 4, 4, 30, new double[] { 1, 2 }, "B1", "B2" ),
				RasterFixtures.constant( 8, 8, 15, new double[] { 1 }, "pan" ) );
	}
}
