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

import org.apache.commons.math3.linear.RealMatrix;

public interface LinearAlgebra
{
	/**
	 * @param symmetric - a symmetric matrix, e.g. a covariance matrix
	 * @return eigenvalues sorted descending with their eigenvectors as rows
	 */
	EigenSystem eigenDecompose( RealMatrix symmetric );

	/**
	 * Solves {@code a * x = b} for x.
	 *
	 * @param a - square coefficient matrix
	 * @param b - right hand side, one system per column
	 * @return x
	 */
	RealMatrix solve( RealMatrix a, RealMatrix b );
}
