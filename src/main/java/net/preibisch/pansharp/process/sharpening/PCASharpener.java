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
import java.util.concurrent.ExecutorService;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.pansharp.process.linalg.CommonsMathLinearAlgebra;
import net.preibisch.pansharp.process.linalg.EigenSystem;
import net.preibisch.pansharp.process.linalg.LinearAlgebra;
import net.preibisch.pansharp.process.statistics.DegenerateStatisticsException;
import net.preibisch.pansharp.process.statistics.ReductionParameters;
import net.preibisch.pansharp.process.statistics.RegionStatistics;
import net.preibisch.pansharp.process.statistics.SampledRegionStatistics;
import net.preibisch.pansharp.raster.Raster;
import net.preibisch.pansharp.raster.RasterTools;

/**
 * Principal component substitution. The mean-centered bands are projected onto the eigenvectors
 * of their covariance matrix, one component is replaced by the histogram-matched pan band and the
 * projection is inverted with the same eigenvectors.
 */
public class PCASharpener extends AbstractSharpener
{
	private static final Logger LOG = LoggerFactory.getLogger( PCASharpener.class );

	public static int defaultSubstituteIndex = 1;

	// components with a smaller eigenvalue (relative to the largest) carry no signal to match against
	public static double minRelativeEigenvalue = 1e-10;

	final int substituteIndex;
	final ReductionParameters params;
	final RegionStatistics stats;
	final LinearAlgebra linearAlgebra;
	final HistogramMatcher matcher;

	/**
	 * @param substituteIndex - which principal component (1-based, ordered by eigenvalue) is replaced by the pan band
	 * @param params - where statistics are computed
	 * @param stats - the statistics engine
	 * @param linearAlgebra - eigen-decomposition and solver
	 */
	public PCASharpener( final int substituteIndex, final ReductionParameters params, final RegionStatistics stats, final LinearAlgebra linearAlgebra )
	{
		this.substituteIndex = substituteIndex;
		this.params = params;
		this.stats = stats;
		this.linearAlgebra = linearAlgebra;
		this.matcher = new HistogramMatcher( stats );
	}

	public PCASharpener( final int substituteIndex, final ReductionParameters params )
	{
		this( substituteIndex, params, new SampledRegionStatistics(), new CommonsMathLinearAlgebra() );
	}

	public PCASharpener( final int substituteIndex )
	{
		this( substituteIndex, new ReductionParameters() );
	}

	public PCASharpener()
	{
		this( defaultSubstituteIndex );
	}

	public int getSubstituteIndex() { return substituteIndex; }

	@Override
	public SharpenerType getType() { return SharpenerType.PCA; }

	@Override
	protected void validate( final Raster img, final Raster pan )
	{
		if ( substituteIndex < 1 || substituteIndex > img.numBands() )
			throw new SharpeningParameterException( "substituteIndex must be in [1, " + img.numBands() + "], got " + substituteIndex );
	}

	@Override
	protected Raster fuse( final Raster img, final Raster pan, final ExecutorService service )
	{
		final int n = img.numBands();
		final Raster ms = resampleToPan( img, pan, service );
		final ReductionParameters resolved = params.resolve( ms );

		LOG.info( "Reduction parameters: {}", resolved );

		final double[] mean = stats.mean( ms, resolved );
		final double[] ones = new double[ n ];
		final double[] negativeMean = new double[ n ];

		for ( int b = 0; b < n; ++b )
		{
			ones[ b ] = 1;
			negativeMean[ b ] = -mean[ b ];
		}

		final Raster centered = RasterTools.linear( ms, ones, negativeMean, service );
		final RealMatrix covariance = stats.centeredCovariance( centered, resolved );

		// nothing below may start before the decomposition is available
		final EigenSystem eigen = linearAlgebra.eigenDecompose( covariance );
		final double[] eigenvalues = eigen.getEigenvalues();

		LOG.debug( "Eigenvalues of {}: {}", img.getBandNames(), eigenvalues );

		if ( !( eigenvalues[ substituteIndex - 1 ] > minRelativeEigenvalue * eigenvalues[ 0 ] ) )
			throw new DegenerateStatisticsException(
					"Principal component " + substituteIndex + " has eigenvalue " + eigenvalues[ substituteIndex - 1 ] + " (largest is " + eigenvalues[ 0 ] + "), it cannot be replaced by the pan band." );

		final Raster components = project( centered, eigen.getEigenvectors(), service );

		final Raster panMatch = matcher.match( pan, components.select( substituteIndex - 1 ), resolved, service );
		final Raster substituted = components.replaceBand( substituteIndex - 1, "PC" + substituteIndex, panMatch.getBand( 0 ) );

		final Raster reconstructedCentered = reconstruct( substituted, eigen.getEigenvectors(), service ).rename( img.getBandNames() );

		return RasterTools.linear( reconstructedCentered, ones, mean, service );
	}

	/**
	 * Computes {@code components = E * x} for the band vector x of every pixel.
	 *
	 * @param centered - the mean-centered bands
	 * @param eigenvectors - eigenvectors as rows, ordered by eigenvalue
	 * @param service - the executor service
	 * @return the principal components, named PC1..PCn
	 */
	public Raster project( final Raster centered, final RealMatrix eigenvectors, final ExecutorService service )
	{
		final int n = centered.numBands();
		final List< RandomAccessibleInterval< FloatType > > components = applyMatrix( centered, eigenvectors, service );

		final ArrayList< String > names = new ArrayList<>();

		for ( int i = 1; i <= n; ++i )
			names.add( "PC" + i );

		return centered.withBands( names, components );
	}

	/**
	 * Solves {@code E * x = components} for every pixel, the bands keep the names of the components.
	 *
	 * @param components - principal components, possibly with one of them substituted
	 * @param eigenvectors - the same eigenvectors the components were projected with
	 * @param service - the executor service
	 * @return the mean-centered bands
	 */
	public Raster reconstruct( final Raster components, final RealMatrix eigenvectors, final ExecutorService service )
	{
		final int n = components.numBands();

		// one solve for all pixels
		final RealMatrix inverse = linearAlgebra.solve( eigenvectors, MatrixUtils.createRealIdentityMatrix( n ) );

		return components.withBands( components.getBandNames(), applyMatrix( components, inverse, service ) );
	}

	protected static List< RandomAccessibleInterval< FloatType > > applyMatrix( final Raster raster, final RealMatrix matrix, final ExecutorService service )
	{
		final int n = raster.numBands();
		final double[][] m = matrix.getData();

		if ( m.length != n || m[ 0 ].length != n )
			throw new IllegalArgumentException( "Matrix is " + m.length + "x" + m[ 0 ].length + ", raster has " + n + " bands." );

		LOG.debug( "Applying matrix {}", Arrays.deepToString( m ) );

		// all output bands in one pass, the per-pixel products are independent
		return RasterTools.computeVector( raster.getBands(), n, ( values, result ) ->
		{
			for ( int i = 0; i < n; ++i )
			{
				double sum = 0;

				for ( int j = 0; j < n; ++j )
					sum += m[ i ][ j ] * values[ j ];

				result[ i ] = sum;
			}
		}, service );
	}
}
