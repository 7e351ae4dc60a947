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
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybridizer.lib.common.ColorTools;
import hybridizer.lib.images.ByteImage;
import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;
import hybridizer.opencv.tools.OpenCVTools;

/**
 * Visualize the frequency content of an image using its discrete Fourier transform.
 * <p>
 * The transform is computed over the full image, without windowing or padding, and 
 * the zero-frequency coefficient remains at the top left of the output.
 * 
 * @author Hybridizer developers
 */
public class FourierSpectrum {
	
	private static final Logger logger = LoggerFactory.getLogger(FourierSpectrum.class);
	
	private FourierSpectrum() {
		throw new AssertionError();
	}
	
	/**
	 * Create a grayscale image of the log-magnitude spectrum of an image.
	 * <p>
	 * The image is first converted to luminance and scaled to the range 0-1. 
	 * The natural log of the magnitude of each Fourier coefficient is then divided by the 
	 * maximum (or 0, if that is larger), scaled to 0-255 and truncated. 
	 * Coefficients with zero or very small magnitudes become 0.
	 * <p>
	 * If no coefficient has a positive log-magnitude, the output is entirely zero.
	 * 
	 * @param image the input image
	 * @return a new gray image with the same width and height as the input
	 */
	public static ByteImage visualize(ByteImage image) {
		Objects.requireNonNull(image, "Image must not be null");
		int width = image.getWidth();
		int height = image.getHeight();
		double[] logMagnitudes = computeLogMagnitudes(image);
		
		double max = 0;
		for (double v : logMagnitudes) {
			if (v > max)
				max = v;
		}
		byte[] output = new byte[logMagnitudes.length];
		if (max == 0 || !Double.isFinite(max)) {
			logger.debug("No positive log-magnitudes for {}, spectrum will be empty", image);
			return ByteImages.createImage(output, width, height, ChannelLayout.GRAY);
		}
		for (int i = 0; i < output.length; i++)
			output[i] = (byte)ColorTools.do8BitRangeCheck(logMagnitudes[i] / max * 255.0);
		return ByteImages.createImage(output, width, height, ChannelLayout.GRAY);
	}
	
	/**
	 * Compute the natural log of the magnitude of each coefficient in the 2D discrete Fourier 
	 * transform of an image's luminance, scaled to the range 0-1.
	 * <p>
	 * Coefficients are returned in row-major order, matching the image dimensions. 
	 * Zero magnitudes give negative infinity.
	 * 
	 * @param image
	 * @return
	 */
	public static double[] computeLogMagnitudes(ByteImage image) {
		var gray = ByteImages.getPixels(ByteImages.toGray(image));
		int width = image.getWidth();
		int height = image.getHeight();
		double[] values = new double[gray.length];
		for (int i = 0; i < gray.length; i++)
			values[i] = (gray[i] & 0xFF) / 255.0;
		
		double[] complex;
		try (var scope = new PointerScope()) {
			Mat mat = OpenCVTools.createDoubleMat(values, width, height);
			Mat spectrum = new Mat();
			opencv_core.dft(mat, spectrum, opencv_core.DFT_COMPLEX_OUTPUT, 0);
			complex = OpenCVTools.extractPixels(spectrum, (double[])null);
		}
		
		double[] logMagnitudes = new double[values.length];
		for (int i = 0; i < logMagnitudes.length; i++)
			logMagnitudes[i] = Math.log(Math.hypot(complex[i*2], complex[i*2+1]));
		return logMagnitudes;
	}

}
