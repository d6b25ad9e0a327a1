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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class Threads
{
	/**
	 * @return num threads for the executorService that processes image portions
	 */
	public static int numThreads() { return Math.max( 4, Runtime.getRuntime().availableProcessors() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }
}
