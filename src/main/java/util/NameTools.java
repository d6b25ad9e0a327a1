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
package util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class NameTools
{
	public static double minSimilarity = 0.6;
	public static int maxMatches = 3;

	/**
	 * @param name - the name that was not found
	 * @param options - all valid names
	 * @return up to {@link #maxMatches} options that are similar to the name, most similar first
	 */
	public static List< String > closeMatches( final String name, final Collection< String > options )
	{
		final String query = name.toLowerCase( Locale.ROOT );
		final ArrayList< String > matches = new ArrayList<>();

		for ( final String option : options )
			if ( similarity( query, option.toLowerCase( Locale.ROOT ) ) >= minSimilarity )
				matches.add( option );

		return matches.stream()
				.sorted( Comparator.comparingDouble( ( String o ) -> similarity( query, o.toLowerCase( Locale.ROOT ) ) ).reversed() )
				.limit( maxMatches )
				.collect( Collectors.toList() );
	}

	/**
	 * @param name - the name that was not found
	 * @param kind - what was looked up, e.g. "sharpener"
	 * @param options - all valid names
	 * @return an error message listing the close matches (if any) and all options
	 */
	public static String notFoundMessage( final String name, final String kind, final Collection< String > options )
	{
		final List< String > matches = closeMatches( name, options );

		if ( matches.isEmpty() )
			return "Unknown " + kind + " '" + name + "', available: " + options;
		else
			return "Unknown " + kind + " '" + name + "', did you mean " + matches + "? Available: " + options;
	}

	/**
	 * @return 1 - levenshtein distance / length of the longer string
	 */
	public static double similarity( final String a, final String b )
	{
		final int maxLength = Math.max( a.length(), b.length() );

		if ( maxLength == 0 )
			return 1.0;

		return 1.0 - (double)levenshtein( a, b ) / maxLength;
	}

	public static int levenshtein( final String a, final String b )
	{
		int[] previous = new int[ b.length() + 1 ];
		int[] current = new int[ b.length() + 1 ];

		for ( int j = 0; j <= b.length(); ++j )
			previous[ j ] = j;

		for ( int i = 1; i <= a.length(); ++i )
		{
			current[ 0 ] = i;

			for ( int j = 1; j <= b.length(); ++j )
			{
				final int cost = a.charAt( i - 1 ) == b.charAt( j - 1 ) ? 0 : 1;
				current[ j ] = Math.min( Math.min( current[ j - 1 ] + 1, previous[ j ] + 1 ), previous[ j - 1 ] + cost );
			}

			final int[] tmp = previous;
			previous = current;
			current = tmp;
		}

		return previous[ b.length() ];
	}
}
