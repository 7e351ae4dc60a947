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

package hybridizer.opencv.tools;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybridizer.lib.images.ByteImage;
import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;

/**
 * Collection of static methods to help with using OpenCV from Java.
 * 
 * @author Hybridizer developers
 *
 */
public class OpenCVTools {
	
	private static final Logger logger = LoggerFactory.getLogger(OpenCVTools.class);
	
	/**
	 * Border type used when filtering: pixels outside the image take the value of the nearest edge pixel.
	 */
	public static final int DEFAULT_BORDER_TYPE = opencv_core.BORDER_REPLICATE;
	
	private OpenCVTools() {
		throw new AssertionError();
	}
	
	/**
	 * Convert a {@link ByteImage} to an 8-bit unsigned {@link Mat} with the same number of channels.
	 * <p>
	 * Channel order is unchanged, so RGBA images become RGBA (not BGRA) Mats.
	 * 
	 * @param image
	 * @return a new Mat of type {@code CV_8UC(n)}
	 */
	public static Mat imageToMat(ByteImage image) {
		int nChannels = image.nChannels();
		var mat = new Mat(image.getHeight(), image.getWidth(), opencv_core.CV_8UC(nChannels));
		mat.data().put(ByteImages.getPixels(image));
		return mat;
	}
	
	/**
	 * Convert a {@link Mat} to a {@link ByteImage}.
	 * <p>
	 * Mats that are not already 8-bit unsigned are converted first, which involves rounding 
	 * and clipping values to the range 0-255. The input is not modified.
	 * 
	 * @param mat the input Mat
	 * @param layout the channel layout; this must match the number of channels in the Mat
	 * @return
	 * @throws IllegalArgumentException if the number of channels does not match the layout
	 */
	public static ByteImage matToImage(Mat mat, ChannelLayout layout) throws IllegalArgumentException {
		if (mat.channels() != layout.nChannels())
			throw new IllegalArgumentException("Cannot convert Mat with " + mat.channels() + " channel(s) to " + layout);
		Mat mat2;
		if (mat.depth() != opencv_core.CV_8U) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_8U);
		} else
			mat2 = ensureContinuous(mat, false);
		byte[] pixels = new byte[(int)totalPixels(mat2)];
		mat2.data().get(pixels);
		if (mat2 != mat)
			mat2.close();
		return ByteImages.createImage(pixels, mat.cols(), mat.rows(), layout);
	}
	
	/**
	 * Create a single-channel 32-bit floating point kernel from an array of weights in row-major order.
	 * 
	 * @param weights
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the number of weights is not {@code width * height}
	 */
	public static Mat createKernel(float[] weights, int width, int height) throws IllegalArgumentException {
		if (weights.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " kernel weights, but got " + weights.length);
		var kernel = new Mat(height, width, opencv_core.CV_32F);
		putPixelsFloat(kernel, weights);
		return kernel;
	}
	
	/**
	 * Create a single-channel 64-bit floating point Mat from an array of pixels in row-major order.
	 * 
	 * @param pixels
	 * @param width
	 * @param height
	 * @return
	 */
	public static Mat createDoubleMat(double[] pixels, int width, int height) {
		var mat = new Mat(height, width, opencv_core.CV_64F);
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof DoubleIndexer) {
			((DoubleIndexer) indexer).put(0L, pixels);
		} else
			throw new IllegalArgumentException("Expected a DoubleIndexer, but instead got " + indexer.getClass());
		indexer.release();
		return mat;
	}
	
	/**
	 * Set pixels from a float array.
	 * <p>
	 * There is no real error checking; it is assumed that the pixel array is in the appropriate format.
	 * 
	 * @param mat
	 * @param pixels
	 */
	public static void putPixelsFloat(Mat mat, float[] pixels) {
		Indexer indexer = mat.createIndexer();
		if (indexer instanceof FloatIndexer) {
			((FloatIndexer) indexer).put(0L, pixels);
		} else
			throw new IllegalArgumentException("Expected a FloatIndexer, but instead got " + indexer.getClass());
		indexer.release();
	}
	
	/**
	 * Ensure a {@link Mat} is continuous, creating a copy of the data if necessary.
	 * 
	 * @param mat input Mat, which may or may not be continuous
	 * @param inPlace if true, set {@code mat} to contain the cloned data if required
	 * @return the original mat unchanged if it is already continuous, or cloned data that is continuous if required
	 * @see Mat#isContinuous()
	 */
	public static Mat ensureContinuous(Mat mat, boolean inPlace) {
		if (!mat.isContinuous()) {
			var mat2 = mat.clone();
			if (!inPlace) {
				return mat2;
			}
			mat.put(mat2);
		}
		return mat;
	}
	
	/**
	 * Return the total number of pixels in an image, counting each channel separately.
	 * This is similar to Mat.total(), except that Mat.total() ignores multiple channels.
	 * @param mat
	 * @return
	 */
	static long totalPixels(Mat mat) {
		int nChannels = mat.channels();
		if (nChannels > 0)
			return mat.total() * nChannels;
		return mat.total();
	}
	
	/**
	 * Extract pixels as a double array, with channels interleaved.
	 * @param mat
	 * @param pixels optional array to reuse; if null, a new array will be created
	 * @return
	 */
	public static double[] extractPixels(Mat mat, double[] pixels) {
		if (pixels == null)
			pixels = new double[(int)totalPixels(mat)];
		Mat mat2 = null;
		if (mat.depth() != opencv_core.CV_64F) {
			mat2 = new Mat();
			mat.convertTo(mat2, opencv_core.CV_64F);
			ensureContinuous(mat2, true);
		} else
			mat2 = ensureContinuous(mat, false);
		
		DoubleIndexer idx = mat2.createIndexer();
		idx.get(0L, pixels);
		idx.release();
		
		if (mat2 != mat)
			mat2.close();
		return pixels;
	}
	
	/**
	 * Apply a separable filter to all channels of an image.
	 * @param mat input image, filtered in-place
	 * @param kx horizontal kernel
	 * @param ky vertical kernel
	 * @param borderType OpenCV border type for boundary padding
	 */
	public static void sepFilter2D(Mat mat, Mat kx, Mat ky, int borderType) {
		opencv_imgproc.sepFilter2D(mat, mat, -1, kx, ky, null, 0, borderType);
	}

	/**
	 * Apply a 2D filter to all channels of an image.
	 * <p>
	 * Note that OpenCV computes a correlation, which is identical to convolution for symmetric kernels.
	 * @param mat input image, filtered in-place
	 * @param kernel filter kernel
	 * @param borderType OpenCV border type for boundary padding
	 */
	public static void filter2D(Mat mat, Mat kernel, int borderType) {
		opencv_imgproc.filter2D(mat, mat, -1, kernel, null, 0, borderType);
	}
	
	/**
	 * Apply a 2D Gaussian filter to all channels of an image, as a horizontal pass followed by a vertical pass.
	 * @param mat input image, filtered in-place
	 * @param sigma filter sigma value
	 * @param borderType OpenCV border type for boundary padding
	 */
	public static void gaussianFilter(Mat mat, double sigma, int borderType) {
		int s = (int)Math.ceil(sigma * 4) * 2 + 1;
		logger.trace("Gaussian filter with sigma={}, kernel size={}", sigma, s);
		try (var kernel = opencv_imgproc.getGaussianKernel(s, sigma, opencv_core.CV_32F)) {
			sepFilter2D(mat, kernel, kernel, borderType);
		}
	}

}
