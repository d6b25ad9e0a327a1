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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import net.imglib2.FinalInterval;
import net.imglib2.FinalRealInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealInterval;
import net.imglib2.realtransform.AffineTransform2D;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * An ordered list of named 2d bands that share one pixel grid.
 * <p>
 * The grid is described by an affine transformation that maps pixel centers
 * to world coordinates, its linear part defines the nominal scale. Masked
 * pixels are {@link Float#NaN}. Band order is meaningful and is preserved
 * by all operations that do not explicitly select or substitute bands.
 */
public class Raster
{
	final List< String > bandNames;
	final List< RandomAccessibleInterval< FloatType > > bands;
	final AffineTransform2D transform;
	final Interval interval;
	final Map< String, Object > properties;

	public Raster(
			final List< String > bandNames,
			final List< ? extends RandomAccessibleInterval< FloatType > > bands,
			final AffineTransform2D transform,
			final Map< String, Object > properties )
	{
		if ( bandNames.size() != bands.size() )
			throw new IllegalArgumentException( "Number of band names (" + bandNames.size() + ") does not match number of bands (" + bands.size() + ")." );

		if ( bands.isEmpty() )
			throw new IllegalArgumentException( "A raster needs at least one band." );

		if ( new HashSet<>( bandNames ).size() != bandNames.size() )
			throw new IllegalArgumentException( "Band names must be unique: " + bandNames );

		final RandomAccessibleInterval< FloatType > first = bands.get( 0 );

		if ( first.numDimensions() != 2 )
			throw new IllegalArgumentException( "Only 2d bands are supported, got " + first.numDimensions() + "d." );

		for ( final RandomAccessibleInterval< FloatType > band : bands )
			if ( !Intervals.equals( first, band ) )
				throw new IllegalArgumentException( "All bands must share the same interval." );

		this.bandNames = Collections.unmodifiableList( new ArrayList<>( bandNames ) );
		this.bands = Collections.unmodifiableList( new ArrayList<>( bands ) );
		this.transform = transform.copy();
		this.interval = new FinalInterval( first );
		this.properties = properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>( properties );
	}

	public Raster(
			final List< String > bandNames,
			final List< ? extends RandomAccessibleInterval< FloatType > > bands,
			final AffineTransform2D transform )
	{
		this( bandNames, bands, transform, null );
	}

	/**
	 * Creates a raster on a north-up grid.
	 *
	 * @param bandNames - the names of the bands
	 * @param bands - the pixel data, all with the same interval
	 * @param scale - the pixel size in world units
	 * @param originX - world x of the outer corner of pixel (0,0)
	 * @param originY - world y of the outer corner of pixel (0,0)
	 * @return the new raster
	 */
	public static Raster create(
			final List< String > bandNames,
			final List< ? extends RandomAccessibleInterval< FloatType > > bands,
			final double scale,
			final double originX,
			final double originY )
	{
		return new Raster( bandNames, bands, gridTransform( scale, originX, originY ) );
	}

	public static AffineTransform2D gridTransform( final double scale, final double originX, final double originY )
	{
		final AffineTransform2D t = new AffineTransform2D();
		t.set( scale, 0, originX + scale / 2.0, 0, scale, originY + scale / 2.0 );
		return t;
	}

	public int numBands() { return bands.size(); }
	public List< String > getBandNames() { return bandNames; }
	public List< RandomAccessibleInterval< FloatType > > getBands() { return bands; }
	public RandomAccessibleInterval< FloatType > getBand( final int index ) { return bands.get( index ); }
	public String getBandName( final int index ) { return bandNames.get( index ); }
	public Interval getInterval() { return interval; }
	public Map< String, Object > getProperties() { return Collections.unmodifiableMap( properties ); }
	public Object getProperty( final String key ) { return properties.get( key ); }

	/**
	 * @return a copy of the pixel-to-world transformation
	 */
	public AffineTransform2D getTransform() { return transform.copy(); }

	public RandomAccessibleInterval< FloatType > getBand( final String name )
	{
		return bands.get( indexOf( name ) );
	}

	public int indexOf( final String name )
	{
		final int index = bandNames.indexOf( name );

		if ( index < 0 )
			throw new IllegalArgumentException( "Band '" + name + "' not found, available bands: " + bandNames );

		return index;
	}

	/**
	 * @return the nominal pixel size in world units, i.e. the square root of the area of one pixel
	 */
	public double nominalScale()
	{
		return Math.sqrt( Math.abs( transform.get( 0, 0 ) * transform.get( 1, 1 ) - transform.get( 0, 1 ) * transform.get( 1, 0 ) ) );
	}

	/**
	 * @return the world bounding box of the outer pixel edges
	 */
	public RealInterval footprint()
	{
		final double[] min = new double[] { Double.MAX_VALUE, Double.MAX_VALUE };
		final double[] max = new double[] { -Double.MAX_VALUE, -Double.MAX_VALUE };

		final double[] corner = new double[ 2 ];
		final double[] world = new double[ 2 ];

		for ( int cx = 0; cx < 2; ++cx )
			for ( int cy = 0; cy < 2; ++cy )
			{
				corner[ 0 ] = ( cx == 0 ) ? interval.min( 0 ) - 0.5 : interval.max( 0 ) + 0.5;
				corner[ 1 ] = ( cy == 0 ) ? interval.min( 1 ) - 0.5 : interval.max( 1 ) + 0.5;

				transform.apply( corner, world );

				for ( int d = 0; d < 2; ++d )
				{
					min[ d ] = Math.min( min[ d ], world[ d ] );
					max[ d ] = Math.max( max[ d ], world[ d ] );
				}
			}

		return new FinalRealInterval( min, max );
	}

	/**
	 * @param other - another raster
	 * @return true if both rasters have the same pixel interval and pixel-to-world transformation
	 */
	public boolean sameGrid( final Raster other )
	{
		return Intervals.equals( interval, other.interval ) &&
				Arrays.equals( transform.getRowPackedCopy(), other.transform.getRowPackedCopy() );
	}

	public Raster select( final int... indices )
	{
		final ArrayList< String > names = new ArrayList<>();
		final ArrayList< RandomAccessibleInterval< FloatType > > selected = new ArrayList<>();

		for ( final int i : indices )
		{
			names.add( bandNames.get( i ) );
			selected.add( bands.get( i ) );
		}

		return new Raster( names, selected, transform, properties );
	}

	public Raster select( final List< String > names )
	{
		final int[] indices = new int[ names.size() ];

		for ( int i = 0; i < indices.length; ++i )
			indices[ i ] = indexOf( names.get( i ) );

		return select( indices );
	}

	public Raster select( final String... names )
	{
		return select( Arrays.asList( names ) );
	}

	public Raster rename( final List< String > names )
	{
		return new Raster( names, bands, transform, properties );
	}

	public Raster rename( final String... names )
	{
		return rename( Arrays.asList( names ) );
	}

	/**
	 * @param names - new band names
	 * @param newBands - new pixel data on the same grid
	 * @return a raster with the grid and properties of this raster but different bands
	 */
	public Raster withBands( final List< String > names, final List< ? extends RandomAccessibleInterval< FloatType > > newBands )
	{
		return new Raster( names, newBands, transform, properties );
	}

	/**
	 * @param index - band to replace
	 * @param name - name of the new band
	 * @param band - pixel data of the new band on the same grid
	 * @return a raster with one band replaced, all other bands keep their position
	 */
	public Raster replaceBand( final int index, final String name, final RandomAccessibleInterval< FloatType > band )
	{
		final ArrayList< String > names = new ArrayList<>( bandNames );
		final ArrayList< RandomAccessibleInterval< FloatType > > newBands = new ArrayList<>( bands );

		names.set( index, name );
		newBands.set( index, band );

		return new Raster( names, newBands, transform, properties );
	}

	public Raster setProperty( final String key, final Object value )
	{
		final LinkedHashMap< String, Object > newProperties = new LinkedHashMap<>( properties );
		newProperties.put( key, value );

		return new Raster( bandNames, bands, transform, newProperties );
	}

	/**
	 * @param sources - rasters whose properties are copied, later sources overwrite earlier ones
	 * @return a raster with the bands of this raster and the merged properties
	 */
	public Raster copyProperties( final Raster... sources )
	{
		final LinkedHashMap< String, Object > newProperties = new LinkedHashMap<>();

		for ( final Raster source : sources )
			newProperties.putAll( source.properties );

		newProperties.putAll( properties );

		return new Raster( bandNames, bands, transform, newProperties );
	}

	public Raster zeroMin()
	{
		if ( Views.isZeroMin( interval ) )
			return this;

		final ArrayList< RandomAccessibleInterval< FloatType > > zeroMinBands = new ArrayList<>();

		for ( final RandomAccessibleInterval< FloatType > band : bands )
			zeroMinBands.add( Views.zeroMin( band ) );

		final AffineTransform2D t = transform.copy();
		final AffineTransform2D shift = new AffineTransform2D();
		shift.set( 1, 0, interval.min( 0 ), 0, 1, interval.min( 1 ) );
		t.concatenate( shift );

		return new Raster( bandNames, zeroMinBands, t, properties );
	}

	@Override
	public String toString()
	{
		return "Raster " + bandNames + " " + interval.dimension( 0 ) + "x" + interval.dimension( 1 ) + "px @ " + nominalScale();
	}
}
