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
package net.preibisch.pansharp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.preibisch.pansharp.process.sharpening.SharpeningParameterException;
import net.preibisch.pansharp.raster.RasterFixtures;

public class PlatformTest
{
	@Test
	public void testForCollection()
	{
		assertEquals( Platform.LANDSAT_7, Platform.forCollection( "LANDSAT/LE07/C01/T1_RT_TOA" ) );
		assertEquals( Platform.LANDSAT_8, Platform.forCollection( "LANDSAT/LO08/C01/T2" ) );
		assertEquals( "B8", Platform.LANDSAT_7.getPanBand() );
		assertTrue( Platform.LANDSAT_7.getSharpenableBands().contains( "B1" ) );
		assertTrue( !Platform.LANDSAT_8.getSharpenableBands().contains( "B1" ) );
	}

	@Test( expected = SharpeningParameterException.class )
	public void testUnsupportedCollection()
	{
		Platform.forCollection( "COPERNICUS/S2" );
	}

	@Test( expected = SharpeningParameterException.class )
	public void testRasterWithoutCollection()
	{
		Platform.forRaster( RasterFixtures.constant( 2, 2, 30, new double[] { 1 }, "B2" ) );
	}
}
