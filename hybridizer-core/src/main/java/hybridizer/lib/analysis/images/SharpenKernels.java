/*-
 * #%L
 * This file is part of Hybridizer.
 * %%
 * Copyright (C) 2026 Hybridizer developers
 * %%
 * Hybridizer is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Hybridizer is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Hybridizer.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package hybridizer.lib.analysis.images;

/**
 * Helper class for creating the 3x3 kernels used to sharpen an image before 
 * extracting its high-frequency content.
 * <p>
 * All kernels derive from the identity-minus-Laplacian template
 * <pre>
 *  0 -1  0
 * -1  5 -1
 *  0 -1  0
 * </pre>
 * with only the centre weight scaled.
 * 
 * @author Hybridizer developers
 */
public class SharpenKernels {
	
	/**
	 * Width and height of every sharpen kernel.
	 */
	public static final int KERNEL_SIZE = 3;
	
	private static final int CENTER = 4;
	
	private static final float[] IDENTITY_MINUS_LAPLACIAN = {
			 0, -1,  0,
			-1,  5, -1,
			 0, -1,  0
	};
	
	private SharpenKernels() {
		throw new AssertionError();
	}
	
	/**
	 * Create a 3x3 kernel, in row-major order, with the centre weight of the 
	 * identity-minus-Laplacian template multiplied by {@code amount}.
	 * <p>
	 * An amount of 1 gives the unmodified template, while 0 gives a pure negative Laplacian.
	 * 
	 * @param amount scale factor for the centre weight
	 * @return a new array of 9 weights
	 * @throws IllegalArgumentException if the amount is not finite
	 */
	public static float[] createKernel(double amount) throws IllegalArgumentException {
		if (!Double.isFinite(amount))
			throw new IllegalArgumentException("Sharpen amount must be finite, but was " + amount);
		float[] kernel = IDENTITY_MINUS_LAPLACIAN.clone();
		kernel[CENTER] = (float)(kernel[CENTER] * amount);
		return kernel;
	}
	
	/**
	 * Get the factor that kernel weights are multiplied by before filtering.
	 * <p>
	 * This is the reciprocal of the sum of weights, or 1 if the weights sum to zero. 
	 * Applying it means that regions of constant intensity are unchanged by filtering 
	 * whenever possible.
	 * 
	 * @param kernel
	 * @return
	 */
	public static double getScale(float[] kernel) {
		double sum = 0;
		for (float k : kernel)
			sum += k;
		return sum == 0 ? 1.0 : 1.0 / sum;
	}
	
	/**
	 * Create a copy of a kernel with all weights multiplied by {@link #getScale(float[])}.
	 * @param kernel
	 * @return
	 */
	public static float[] normalize(float[] kernel) {
		double scale = getScale(kernel);
		float[] output = new float[kernel.length];
		for (int i = 0; i < kernel.length; i++)
			output[i] = (float)(kernel[i] * scale);
		return output;
	}

}
