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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.pansharp.process.quality.QualityMetric;
import net.preibisch.pansharp.process.resampling.Resampler;
import net.preibisch.pansharp.process.sharpening.Sharpener;
import net.preibisch.pansharp.process.sharpening.SharpenerType;
import net.preibisch.pansharp.process.sharpening.SharpeningParameterException;
import net.preibisch.pansharp.process.statistics.ReductionParameters;
import net.preibisch.pansharp.process.statistics.RegionStatistics;
import net.preibisch.pansharp.process.statistics.SampledRegionStatistics;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Sharpens the sharpenable bands of a scene of a known platform, masks the result like the
 * input and optionally stores quality metrics as properties of the result.
 */
public class PanSharpening
{
	private static final Logger LOG = LoggerFactory.getLogger( PanSharpening.class );

	public static String defaultPrefix = "pansharp";

	/**
	 * @param ms - the multispectral bands of the scene
	 * @param pan - a raster that contains the pan band of the platform
	 * @param platform - the platform, defines which bands are sharpened
	 * @param method - name or alias of a {@link SharpenerType}
	 * @param qa - names of {@link QualityMetric}s to compute, may be null or empty
	 * @param prefix - metric i is stored as property {@code prefix:METRIC}
	 * @param params - where statistics are computed, null means defaults
	 * @return the sharpened bands, masked where the input is masked
	 */
	public static Raster panSharpen(
			final Raster ms,
			final Raster pan,
			final Platform platform,
			final String method,
			final List< String > qa,
			final String prefix,
			final ReductionParameters params )
	{
		// resolve all names before anything is computed
		final Sharpener sharpener = SharpenerType.forName( method ).create( params );
		final List< QualityMetric > metrics = qa == null ? new ArrayList<>() : QualityMetric.forNames( qa );

		final ArrayList< String > bands = new ArrayList<>();

		for ( final String band : platform.getSharpenableBands() )
			if ( ms.getBandNames().contains( band ) )
				bands.add( band );

		if ( bands.isEmpty() )
			throw new SharpeningParameterException( "None of the sharpenable bands " + platform.getSharpenableBands() + " of " + platform + " is in " + ms.getBandNames() );

		if ( !pan.getBandNames().contains( platform.getPanBand() ) )
			throw new SharpeningParameterException( "Pan band '" + platform.getPanBand() + "' of " + platform + " is not in " + pan.getBandNames() );

		final Raster source = ms.select( bands );
		final Raster panBand = pan.select( platform.getPanBand() );

		LOG.info( "Pan-sharpening {} of {} with {}", bands, platform, sharpener.getType() );

		final ExecutorService service = Threads.createFixedExecutorService();
		sharpener.setExecutorService( service );

		try
		{
			Raster sharpened = sharpener.sharpen( source, panBand ).copyProperties( source, panBand );

			final Raster sourceOnPanGrid = Resampler.resample( source, sharpened, service );
			sharpened = RasterTools.combine( sharpened, sourceOnPanGrid, v -> Double.isNaN( v[ 1 ] ) ? Double.NaN : v[ 0 ], service );

			final RegionStatistics stats = new SampledRegionStatistics();

			for ( final QualityMetric metric : metrics )
			{
				final Map< String, Double > values = metric.compute( source, sharpened, params, stats, service );
				final String property = ( prefix == null ? defaultPrefix : prefix ) + ":" + metric.name();

				sharpened = sharpened.setProperty( property, metric.isImageWise() ? values.get( metric.name() ) : values );

				LOG.info( "{} = {}", property, values );
			}

			return sharpened;
		}
		finally
		{
			service.shutdown();
		}
	}

	/**
	 * The platform is taken from the {@link Platform#collectionProperty} of the multispectral raster.
	 */
	public static Raster panSharpen(
			final Raster ms,
			final Raster pan,
			final String method,
			final List< String > qa,
			final String prefix,
			final ReductionParameters params )
	{
		return panSharpen( ms, pan, Platform.forRaster( ms ), method, qa, prefix, params );
	}

	public static Raster panSharpen( final Raster ms, final Raster pan, final Platform platform, final String method )
	{
		return panSharpen( ms, pan, platform, method, null, defaultPrefix, null );
	}

	/**
	 * Sharpens several scenes one after the other.
	 *
	 * @param scenes - multispectral rasters
	 * @param pans - the matching pan rasters, same order
	 * @return the sharpened scenes in input order
	 */
	public static List< Raster > panSharpen(
			final List< Raster > scenes,
			final List< Raster > pans,
			final Platform platform,
			final String method,
			final List< String > qa,
			final String prefix,
			final ReductionParameters params )
	{
		if ( scenes.size() != pans.size() )
			throw new IllegalArgumentException( "Got " + scenes.size() + " multispectral and " + pans.size() + " pan rasters." );

		final ArrayList< Raster > result = new ArrayList<>();

		for ( int i = 0; i < scenes.size(); ++i )
			result.add( panSharpen( scenes.get( i ), pans.get( i ), platform, method, qa, prefix, params ) );

		return result;
	}
}
