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
package net.preibisch.pansharp.process.linalg;

import java.util.Arrays;
import java.util.Comparator;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.pansharp.process.statistics.DegenerateStatisticsException;

public class CommonsMathLinearAlgebra implements LinearAlgebra
{
	private static final Logger LOG = LoggerFactory.getLogger( CommonsMathLinearAlgebra.class );

	@Override
	public EigenSystem eigenDecompose( final RealMatrix symmetric )
	{
		if ( !symmetric.isSquare() )
			throw new IllegalArgumentException( "Matrix must be square, got " + symmetric.getRowDimension() + "x" + symmetric.getColumnDimension() );

		final EigenDecomposition eigen;

		try
		{
			eigen = new EigenDecomposition( symmetric );
		}
		catch ( final MathIllegalArgumentException e )
		{
			throw new DegenerateStatisticsException( "Eigen-decomposition failed: " + e.getMessage(), e );
		}

		if ( eigen.hasComplexEigenvalues() )
			throw new DegenerateStatisticsException( "Matrix has complex eigenvalues, it is not a covariance matrix." );

		final int n = symmetric.getRowDimension();
		final double[] values = eigen.getRealEigenvalues();

		// commons-math already sorts descending for symmetric input, make it explicit
		final Integer[] order = new Integer[ n ];

		for ( int i = 0; i < n; ++i )
			order[ i ] = i;

		Arrays.sort( order, Comparator.comparingDouble( ( Integer i ) -> values[ i ] ).reversed() );

		final double[] sortedValues = new double[ n ];
		final RealMatrix rows = MatrixUtils.createRealMatrix( n, n );

		for ( int i = 0; i < n; ++i )
		{
			sortedValues[ i ] = values[ order[ i ] ];
			rows.setRow( i, eigen.getEigenvector( order[ i ] ).toArray() );
		}

		LOG.debug( "Eigenvalues: {}", sortedValues );

		return new EigenSystem( sortedValues, rows );
	}

	@Override
	public RealMatrix solve( final RealMatrix a, final RealMatrix b )
	{
		final DecompositionSolver solver = new LUDecomposition( a ).getSolver();

		if ( !solver.isNonSingular() )
			throw new DegenerateStatisticsException( "Matrix is singular, cannot solve the linear system." );

		try
		{
			return solver.solve( b );
		}
		catch ( final SingularMatrixException e )
		{
			throw new DegenerateStatisticsException( "Matrix is singular, cannot solve the linear system.", e );
		}
	}
}
