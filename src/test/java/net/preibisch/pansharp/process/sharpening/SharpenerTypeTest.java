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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.preibisch.pansharp.process.statistics.ReductionParameters;

public class SharpenerTypeTest
{
	@Test
	public void testNamesAndAliases()
	{
		assertEquals( SharpenerType.GS, SharpenerType.forName( "gs" ) );
		assertEquals( SharpenerType.GS, SharpenerType.forName( "GramSchmidt" ) );
		assertEquals( SharpenerType.PCA, SharpenerType.forName( "PCS" ) );
		assertEquals( SharpenerType.SM, SharpenerType.forName( "simplemean" ) );
		assertEquals( SharpenerType.HPFA, SharpenerType.forName( " hpfa " ) );
		assertEquals( SharpenerType.SFIM, SharpenerType.forName( "SFIM" ) );
	}

	@Test
	public void testUnknownNameListsCloseMatches()
	{
		try
		{
			SharpenerType.forName( "Brovy" );
			fail( "expected an unknown sharpener" );
		}
		catch ( final SharpeningParameterException e )
		{
			assertTrue( e.getMessage(), e.getMessage().contains( "did you mean [BROVEY]" ) );
		}
	}

	@Test
	public void testCreate()
	{
		final ReductionParameters params = new ReductionParameters( null, 60.0 );

		for ( final SharpenerType type : SharpenerType.values() )
			assertEquals( type, type.create( params ).getType() );

		assertTrue( SharpenerType.GS.create( null ) instanceof GramSchmidtSharpener );
		assertEquals( PCASharpener.defaultSubstituteIndex, ( (PCASharpener)SharpenerType.PCA.create( params ) ).getSubstituteIndex() );
	}
}
