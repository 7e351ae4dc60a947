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

package hybridizer.opencv.processing;

import java.util.Objects;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybridizer.lib.analysis.images.SharpenKernels;
import hybridizer.lib.common.ColorTools;
import hybridizer.lib.images.ByteImage;
import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;
import hybridizer.opencv.tools.OpenCVTools;

/**
 * Spatial filters used to separate the low and high frequency content of an image.
 * <p>
 * <b>Important notes:</b>
 * <ul>
 *     <li>The input image is unchanged and a new output image is created.</li>
 *     <li>Outputs are always RGBA, with gray and RGB inputs converted first.</li>
 *     <li>Pixels beyond the image boundary are assumed to equal the nearest edge pixel.</li>
 * </ul>
 * Filtering is performed with 32-bit floating point precision, with results rounded 
 * and clipped back to 8-bit.
 * 
 * @author Hybridizer developers
 */
public class SpatialFilters {
	
	private static final Logger logger = LoggerFactory.getLogger(SpatialFilters.class);
	
	private SpatialFilters() {
		throw new AssertionError();
	}
	
	/**
	 * Apply a Gaussian low-pass filter to every channel of an image, including alpha.
	 * 
	 * @param image the input image
	 * @param sigma Gaussian standard deviation, in pixels; if 0, the image is returned unfiltered
	 * @return the filtered RGBA image
	 * @throws IllegalArgumentException if sigma is negative or not finite
	 */
	public static ByteImage lowPass(ByteImage image, double sigma) throws IllegalArgumentException {
		Objects.requireNonNull(image, "Image must not be null");
		checkSigma(sigma);
		var rgba = ByteImages.toRGBA(image);
		if (sigma == 0)
			return rgba;
		logger.debug("Low-pass filtering {} with sigma={}", image, sigma);
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.imageToMat(rgba);
			mat.convertTo(mat, opencv_core.CV_32F);
			OpenCVTools.gaussianFilter(mat, sigma, OpenCVTools.DEFAULT_BORDER_TYPE);
			return OpenCVTools.matToImage(mat, ChannelLayout.RGBA);
		}
	}
	
	/**
	 * Apply a 3x3 kernel to every channel of an image.
	 * <p>
	 * Weights are divided by their sum before filtering, unless the sum is zero. 
	 * This means that regions of constant intensity are preserved whenever the kernel permits.
	 * 
	 * @param image the input image
	 * @param kernel 9 weights in row-major order
	 * @return the filtered RGBA image
	 * @throws IllegalArgumentException if the kernel does not contain 9 finite weights
	 * @see SharpenKernels#createKernel(double)
	 * @see SharpenKernels#getScale(float[])
	 */
	public static ByteImage sharpen(ByteImage image, float[] kernel) throws IllegalArgumentException {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(kernel, "Kernel must not be null");
		int size = SharpenKernels.KERNEL_SIZE;
		if (kernel.length != size * size)
			throw new IllegalArgumentException("Kernel must have " + (size * size) + " weights, but has " + kernel.length);
		for (float k : kernel) {
			if (!Float.isFinite(k))
				throw new IllegalArgumentException("Kernel weights must be finite");
		}
		var rgba = ByteImages.toRGBA(image);
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.imageToMat(rgba);
			mat.convertTo(mat, opencv_core.CV_32F);
			var matKernel = OpenCVTools.createKernel(SharpenKernels.normalize(kernel), size, size);
			OpenCVTools.filter2D(mat, matKernel, OpenCVTools.DEFAULT_BORDER_TYPE);
			return OpenCVTools.matToImage(mat, ChannelLayout.RGBA);
		}
	}
	
	/**
	 * Extract the high-frequency content of an image by subtracting a low-pass filtered copy 
	 * from a sharpened copy.
	 * <p>
	 * Color channels are subtracted with clamping at zero; the alpha channel of the output 
	 * is always 255.
	 * 
	 * @param image the input image
	 * @param sharpenAmount scale factor for the centre weight of the sharpen kernel
	 * @param lowPassSigma Gaussian standard deviation of the low-pass filtered copy
	 * @return the high-pass RGBA image
	 * @throws IllegalArgumentException if sharpenAmount is not finite, or lowPassSigma is negative or not finite
	 * @see #sharpen(ByteImage, float[])
	 * @see #lowPass(ByteImage, double)
	 */
	public static ByteImage highPass(ByteImage image, double sharpenAmount, double lowPassSigma) throws IllegalArgumentException {
		Objects.requireNonNull(image, "Image must not be null");
		checkSigma(lowPassSigma);
		float[] kernel = SharpenKernels.createKernel(sharpenAmount);
		logger.debug("High-pass filtering {} with sharpen amount={}, sigma={}", image, sharpenAmount, lowPassSigma);

		byte[] impulse = ByteImages.getPixels(sharpen(image, kernel));
		byte[] low = ByteImages.getPixels(lowPass(image, lowPassSigma));
		
		int nChannels = ChannelLayout.RGBA.nChannels();
		int nColorChannels = ChannelLayout.RGBA.nColorChannels();
		byte[] output = new byte[impulse.length];
		for (int i = 0; i < output.length; i++) {
			if (i % nChannels >= nColorChannels)
				output[i] = (byte)ColorTools.MAX_8BIT;
			else
				output[i] = (byte)ColorTools.clampSubtract(impulse[i] & 0xFF, low[i] & 0xFF, ColorTools.MAX_8BIT);
		}
		return ByteImages.createImage(output, image.getWidth(), image.getHeight(), ChannelLayout.RGBA);
	}
	
	/**
	 * Check that a Gaussian sigma value can be used for filtering.
	 * @param sigma
	 * @throws IllegalArgumentException if sigma is negative, NaN or infinite
	 */
	static void checkSigma(double sigma) throws IllegalArgumentException {
		if (!Double.isFinite(sigma) || sigma < 0)
			throw new IllegalArgumentException("Gaussian sigma must be a finite value >= 0, but was " + sigma);
	}

}
