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
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import net.preibisch.pansharp.process.statistics.ReductionParameters;
import util.NameTools;

public enum SharpenerType
{
	GS( "GramSchmidt", "Gram-Schmidt" ),
	PCA( "PCS", "PrincipalComponents" ),
	SM( "SimpleMean", "Mean" ),
	BROVEY(),
	IHS( "HSV" ),
	HPFA( "HighPassFilterAddition", "HPF" ),
	SFIM( "SmoothingFilter" );

	final List< String > aliases;

	SharpenerType( final String... aliases )
	{
		this.aliases = Arrays.asList( aliases );
	}

	public List< String > getAliases() { return aliases; }

	/**
	 * Creates a sharpener with default settings.
	 *
	 * @param params - reduction parameters for the statistical sharpeners, null means defaults
	 * @return the sharpener
	 */
	public Sharpener create( final ReductionParameters params )
	{
		final ReductionParameters p = params == null ? new ReductionParameters() : params;

		switch ( this )
		{
		case GS:
			return new GramSchmidtSharpener( p );
		case PCA:
			return new PCASharpener( PCASharpener.defaultSubstituteIndex, p );
		case SM:
			return new SimpleMeanSharpener();
		case BROVEY:
			return new BroveySharpener( null );
		case IHS:
			return new IHSSharpener();
		case HPFA:
			return new HPFASharpener( null );
		case SFIM:
			return new SFIMSharpener();
		default:
			throw new IllegalStateException( "No sharpener for " + this );
		}
	}

	/**
	 * @param name - the name or an alias of a sharpener, case insensitive
	 * @return the type
	 * @throws SharpeningParameterException if the name is unknown, the message lists close matches
	 */
	public static SharpenerType forName( final String name )
	{
		if ( name == null )
			throw new SharpeningParameterException( "No sharpener name given, available: " + allNames() );

		final String query = name.trim().toLowerCase( Locale.ROOT );

		for ( final SharpenerType type : values() )
		{
			if ( type.name().toLowerCase( Locale.ROOT ).equals( query ) )
				return type;

			for ( final String alias : type.aliases )
				if ( alias.toLowerCase( Locale.ROOT ).equals( query ) )
					return type;
		}

		throw new SharpeningParameterException( NameTools.notFoundMessage( name, "sharpener", allNames() ) );
	}

	public static List< String > allNames()
	{
		final ArrayList< String > names = new ArrayList<>();

		for ( final SharpenerType type : values() )
		{
			names.add( type.name() );
			names.addAll( type.aliases );
		}

		return names;
	}
}
