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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import net.preibisch.pansharp.process.sharpening.SharpeningParameterException;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterFixtures;

public class PanSharpeningTest
{
	static Raster landsat8()
	{
		return RasterFixtures.create( 4, 4, 30, ( b, x, y ) -> ( x == 0 && y == 0 ) ? Double.NaN : 10 * ( b + 1 ),
				"B1", "B2", "B3", "B4", "B5", "B6", "B7" )
				.setProperty( Platform.collectionProperty, "LANDSAT/LC08/C01/T1_TOA" )
				.setProperty( "CLOUD_COVER", 3.5 );
	}

	static Raster pan()
	{
		return RasterFixtures.constant( 8, 8, 15, new double[] { 20 }, "B8" );
	}

	@Test
	public void testSharpenLandsat8()
	{
		final Raster sharpened = PanSharpening.panSharpen( landsat8(), pan(), "SM", Arrays.asList( "MSE", "rase" ), "test", null );

		assertEquals( Arrays.asList( "B2", "B3", "B4", "B5", "B6", "B7" ), sharpened.getBandNames() );
		assertEquals( 8, sharpened.getInterval().dimension( 0 ) );
		assertEquals( 15, sharpened.nominalScale(), 1e-9 );

		// B2 is 20, pan is 20
		assertEquals( 20, RasterFixtures.value( sharpened, 0, 5, 5 ), 1e-4 );
		// B7 is 70
		assertEquals( 45, RasterFixtures.value( sharpened, 5, 5, 5 ), 1e-4 );

		for ( int b = 0; b < sharpened.numBands(); ++b )
			assertTrue( Double.isNaN( RasterFixtures.value( sharpened, b, 0, 0 ) ) );

		assertEquals( 3.5, sharpened.getProperty( "CLOUD_COVER" ) );
		assertEquals( "LANDSAT/LC08/C01/T1_TOA", sharpened.getProperty( Platform.collectionProperty ) );

		@SuppressWarnings( "unchecked" )
		final Map< String, Double > mse = (Map< String, Double >)sharpened.getProperty( "test:MSE" );

		assertEquals( sharpened.getBandNames(), new ArrayList<>( mse.keySet() ) );
		assertTrue( sharpened.getProperty( "test:RASE" ) instanceof Double );
		assertFalse( Double.isNaN( (Double)sharpened.getProperty( "test:RASE" ) ) );
	}

	@Test
	public void testDefaultPrefix()
	{
		final Raster sharpened = PanSharpening.panSharpen( landsat8(), pan(), Platform.LANDSAT_8, "SimpleMean", Arrays.asList( "MSE" ), null, null );

		assertTrue( sharpened.getProperties().containsKey( PanSharpening.defaultPrefix + ":MSE" ) );
	}

	@Test
	public void testUnknownMethodFailsBeforeComputing()
	{
		try
		{
			PanSharpening.panSharpen( landsat8(), pan(), Platform.LANDSAT_8, "GramSchmit" );
			fail( "expected an unknown sharpener" );
		}
		catch ( final SharpeningParameterException e )
		{
			assertTrue( e.getMessage(), e.getMessage().contains( "GramSchmidt" ) );
		}
	}

	@Test( expected = SharpeningParameterException.class )
	public void testMissingPanBand()
	{
		PanSharpening.panSharpen( landsat8(), pan().rename( "B9" ), Platform.LANDSAT_8, "SM" );
	}

	@Test( expected = SharpeningParameterException.class )
	public void testNoSharpenableBands()
	{
		PanSharpening.panSharpen( landsat8().select( "B1" ), pan(), Platform.LANDSAT_8, "SM" );
	}

	@Test
	public void testSeveralScenes()
	{
		final List< Raster > sharpened = PanSharpening.panSharpen(
				Arrays.asList( landsat8(), landsat8() ), Arrays.asList( pan(), pan() ), Platform.LANDSAT_8, "SFIM", null, null, null );

		assertEquals( 2, sharpened.size() );
		assertEquals( 6, sharpened.get( 1 ).numBands() );
	}
}
