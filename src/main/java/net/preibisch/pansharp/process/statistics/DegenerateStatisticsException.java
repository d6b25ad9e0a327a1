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
package net.preibisch.pansharp.process.statistics;

/**
 * A statistic that is used as a denominator is zero or not finite (e.g. the
 * variance of a constant band), or a matrix that has to be inverted is singular.
 */
public class DegenerateStatisticsException extends RuntimeException
{
	private static final long serialVersionUID = -2291473468152337560L;

	public DegenerateStatisticsException( final String message )
	{
		super( message );
	}

	public DegenerateStatisticsException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
