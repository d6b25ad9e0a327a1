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
package net.preibisch.pansharp.process.quality;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.pansharp.process.resampling.Resampler;
import net.preibisch.pansharp.process.sharpening.SharpeningParameterException;
import net.preibisch.pansharp.process.statistics.ReductionParameters;
import net.preibisch.pansharp.process.statistics.RegionStatistics;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;
import util.NameTools;

/**
 * Quality assessment between an original and a modified raster (Vaiopoulos 2011, Wang and Bovik 2002).
 * Band-wise metrics return one value per band of the modified raster, RASE and ERGAS return a single
 * value keyed by the name of the metric.
 */
public enum QualityMetric
{
	/** mean squared error, 0 is no error */
	MSE,
	/** root mean squared error, 0 is no error */
	RMSE,
	/** relative average spectral error (image-wise), 0 is no error */
	RASE,
	/** dimensionless global relative error of synthesis (image-wise), 0 is no error */
	ERGAS,
	/** difference in variance, 0 is no change */
	DIV,
	/** 1 - mean(modified) / mean(original), 0 is no bias */
	BIAS,
	/** correlation coefficient, 1 is perfect correlation */
	CC,
	/** change in mean luminance, 1 is no change */
	CML,
	/** change in contrast, 1 is no change */
	CMC,
	/** universal image quality index CC * CMC * CML, 1 is identical */
	UIQI;

	private static final Logger LOG = LoggerFactory.getLogger( QualityMetric.class );

	public boolean isImageWise() { return this == RASE || this == ERGAS; }

	/**
	 * @param original - the reference, resampled (bilinear) onto the grid of the modified raster
	 * @param modified - the raster to assess, same number of bands as the original
	 * @param params - where statistics are computed, null or unset fields are taken from the modified raster
	 * @param stats - the statistics engine
	 * @param service - the executor service
	 * @return the metric per band of the modified raster, or a single entry for image-wise metrics
	 */
	public Map< String, Double > compute(
			final Raster original,
			final Raster modified,
			final ReductionParameters params,
			final RegionStatistics stats,
			final ExecutorService service )
	{
		if ( original.numBands() != modified.numBands() )
			throw new IllegalArgumentException( "Cannot compare " + original.getBandNames() + " to " + modified.getBandNames() );

		final Raster x = Resampler.resample( original, modified, Resampler.Method.BILINEAR, service );
		final Raster y = modified;
		final ReductionParameters resolved = ( params == null ? new ReductionParameters() : params ).resolve( y );

		final double[] values;

		switch ( this )
		{
		case MSE:
			values = mse( x, y, resolved, stats, service );
			break;
		case RMSE:
			values = mse( x, y, resolved, stats, service );
			for ( int b = 0; b < values.length; ++b )
				values[ b ] = Math.sqrt( values[ b ] );
			break;
		case RASE:
		{
			final double mse = Arrays.stream( mse( x, y, resolved, stats, service ) ).average().getAsDouble();
			final double xbar = Arrays.stream( stats.mean( x, resolved ) ).average().getAsDouble();
			values = new double[] { Math.sqrt( mse ) * 100.0 / xbar };
			break;
		}
		case ERGAS:
		{
			final double h = modified.nominalScale();
			final double l = original.nominalScale();
			final double[] msek = mse( x, y, resolved, stats, service );
			final double[] xbark = stats.mean( x, resolved );

			double sum = 0;
			for ( int b = 0; b < msek.length; ++b )
				sum += msek[ b ] / xbark[ b ];

			values = new double[] { 100.0 * h / l * Math.sqrt( sum / msek.length ) };
			break;
		}
		case DIV:
		{
			final double[] varX = stats.variance( x, resolved );
			final double[] varY = stats.variance( y, resolved );
			values = new double[ varX.length ];
			for ( int b = 0; b < values.length; ++b )
				values[ b ] = 1.0 - varY[ b ] / varX[ b ];
			break;
		}
		case BIAS:
		{
			final double[] xbar = stats.mean( x, resolved );
			final double[] ybar = stats.mean( y, resolved );
			values = new double[ xbar.length ];
			for ( int b = 0; b < values.length; ++b )
				values[ b ] = 1.0 - ybar[ b ] / xbar[ b ];
			break;
		}
		case CC:
			values = cc( x, y, resolved, stats, service );
			break;
		case CML:
			values = cml( x, y, resolved, stats );
			break;
		case CMC:
			values = cmc( x, y, resolved, stats );
			break;
		case UIQI:
		{
			final double[] cc = cc( x, y, resolved, stats, service );
			final double[] cmc = cmc( x, y, resolved, stats );
			final double[] cml = cml( x, y, resolved, stats );
			values = new double[ cc.length ];
			for ( int b = 0; b < values.length; ++b )
				values[ b ] = cc[ b ] * cmc[ b ] * cml[ b ];
			break;
		}
		default:
			throw new IllegalStateException( "Unknown metric " + this );
		}

		final LinkedHashMap< String, Double > result = new LinkedHashMap<>();

		if ( isImageWise() )
			result.put( name(), values[ 0 ] );
		else
			for ( int b = 0; b < values.length; ++b )
				result.put( y.getBandName( b ), values[ b ] );

		LOG.debug( "{}: {}", this, result );

		return result;
	}

	protected static double[] mse( final Raster x, final Raster y, final ReductionParameters params, final RegionStatistics stats, final ExecutorService service )
	{
		final Raster squaredError = RasterTools.combine( y, x, v -> ( v[ 1 ] - v[ 0 ] ) * ( v[ 1 ] - v[ 0 ] ), service );

		return stats.mean( squaredError, params );
	}

	protected static double[] cc( final Raster x, final Raster y, final ReductionParameters params, final RegionStatistics stats, final ExecutorService service )
	{
		final double[] xbar = stats.mean( x, params );
		final double[] ybar = stats.mean( y, params );
		final int n = xbar.length;

		final double[] ones = new double[ n ];
		final double[] negX = new double[ n ];
		final double[] negY = new double[ n ];

		for ( int b = 0; b < n; ++b )
		{
			ones[ b ] = 1;
			negX[ b ] = -xbar[ b ];
			negY[ b ] = -ybar[ b ];
		}

		final Raster xc = RasterTools.linear( x, ones, negX, service );
		final Raster yc = RasterTools.linear( y, ones, negY, service );

		final double[] numerator = stats.sum( RasterTools.combine( xc, yc, v -> v[ 0 ] * v[ 1 ], service ), params );
		final double[] xDenom = stats.sum( RasterTools.combine( xc, xc, v -> v[ 0 ] * v[ 1 ], service ), params );
		final double[] yDenom = stats.sum( RasterTools.combine( yc, yc, v -> v[ 0 ] * v[ 1 ], service ), params );

		final double[] cc = new double[ n ];

		for ( int b = 0; b < n; ++b )
			cc[ b ] = numerator[ b ] / Math.sqrt( xDenom[ b ] * yDenom[ b ] );

		return cc;
	}

	protected static double[] cml( final Raster x, final Raster y, final ReductionParameters params, final RegionStatistics stats )
	{
		final double[] xbar = stats.mean( x, params );
		final double[] ybar = stats.mean( y, params );
		final double[] cml = new double[ xbar.length ];

		for ( int b = 0; b < cml.length; ++b )
			cml[ b ] = 2 * xbar[ b ] * ybar[ b ] / ( xbar[ b ] * xbar[ b ] + ybar[ b ] * ybar[ b ] );

		return cml;
	}

	protected static double[] cmc( final Raster x, final Raster y, final ReductionParameters params, final RegionStatistics stats )
	{
		final double[] varX = stats.variance( x, params );
		final double[] varY = stats.variance( y, params );
		final double[] sdX = stats.stddev( x, params );
		final double[] sdY = stats.stddev( y, params );
		final double[] cmc = new double[ varX.length ];

		for ( int b = 0; b < cmc.length; ++b )
			cmc[ b ] = 2 * sdX[ b ] * sdY[ b ] / ( varX[ b ] + varY[ b ] );

		return cmc;
	}

	/**
	 * @param name - name of a metric, case insensitive
	 * @return the metric
	 * @throws SharpeningParameterException if there is no such metric, the message lists close matches
	 */
	public static QualityMetric forName( final String name )
	{
		for ( final QualityMetric metric : values() )
			if ( metric.name().equals( name.trim().toUpperCase( Locale.ROOT ) ) )
				return metric;

		final ArrayList< String > options = new ArrayList<>();

		for ( final QualityMetric metric : values() )
			options.add( metric.name() );

		throw new SharpeningParameterException( NameTools.notFoundMessage( name, "quality metric", options ) );
	}

	public static List< QualityMetric > forNames( final List< String > names )
	{
		final ArrayList< QualityMetric > metrics = new ArrayList<>();

		for ( final String name : names )
			metrics.add( forName( name ) );

		return metrics;
	}

	public static List< QualityMetric > forNames( final String... names )
	{
		return forNames( Arrays.asList( names ) );
	}
}
