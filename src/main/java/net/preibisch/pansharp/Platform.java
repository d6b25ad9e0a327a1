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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import net.preibisch.pansharp.process.sharpening.SharpeningParameterException;
import net.preibisch.pansharp.raster.Raster;

/**
 * Satellite platforms with a panchromatic band, the bands that can be sharpened with it and
 * the collections they are distributed in.
 */
public enum Platform
{
	LANDSAT_7(
			Arrays.asList( "B1", "B2", "B3", "B4", "B5", "B7" ),
			"B8",
			Arrays.asList(
					"LANDSAT/LE07/C01/T1_TOA", "LANDSAT/LE07/C01/T1_RT_TOA", "LANDSAT/LE07/C01/T2_TOA",
					"LANDSAT/LE07/C01/T1_RT", "LANDSAT/LE07/C01/T1", "LANDSAT/LE07/C01/T2" ) ),
	LANDSAT_8(
			Arrays.asList( "B2", "B3", "B4", "B5", "B6", "B7" ),
			"B8",
			Arrays.asList(
					"LANDSAT/LC08/C01/T1_TOA", "LANDSAT/LC08/C01/T1_RT_TOA", "LANDSAT/LC08/C01/T2_TOA",
					"LANDSAT/LC08/C01/T1_RT", "LANDSAT/LO08/C01/T1", "LANDSAT/LC08/C01/T1",
					"LANDSAT/LO08/C01/T2", "LANDSAT/LC08/C01/T2" ) );

	/** the raster property that holds the collection id */
	public static String collectionProperty = "collection";

	final List< String > sharpenableBands;
	final String panBand;
	final List< String > collections;

	Platform( final List< String > sharpenableBands, final String panBand, final List< String > collections )
	{
		this.sharpenableBands = Collections.unmodifiableList( sharpenableBands );
		this.panBand = panBand;
		this.collections = Collections.unmodifiableList( collections );
	}

	public List< String > getSharpenableBands() { return sharpenableBands; }
	public String getPanBand() { return panBand; }
	public List< String > getCollections() { return collections; }

	/**
	 * @param collectionId - e.g. LANDSAT/LC08/C01/T1_TOA
	 * @return the platform
	 * @throws SharpeningParameterException if no supported platform distributes this collection
	 */
	public static Platform forCollection( final String collectionId )
	{
		for ( final Platform platform : values() )
			if ( platform.collections.contains( collectionId ) )
				return platform;

		throw new SharpeningParameterException( "Sharpening is not supported for collection '" + collectionId + "', supported are: " + allCollections() );
	}

	/**
	 * @param raster - a raster with the {@link #collectionProperty} set
	 * @return the platform of the raster
	 */
	public static Platform forRaster( final Raster raster )
	{
		final Object collection = raster.getProperty( collectionProperty );

		if ( collection == null )
			throw new SharpeningParameterException( "Raster " + raster + " has no '" + collectionProperty + "' property, cannot determine its platform." );

		return forCollection( collection.toString() );
	}

	public static List< String > allCollections()
	{
		final ArrayList< String > all = new ArrayList<>();

		for ( final Platform platform : values() )
			all.addAll( platform.collections );

		return all;
	}
}
