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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.opencv.global.opencv_core;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;

@SuppressWarnings("javadoc")
public class TestOpenCVTools {
	
	@ParameterizedTest
	@EnumSource(ChannelLayout.class)
	public void testImageToMat(ChannelLayout layout) {
		int w = 7, h = 3;
		byte[] data = new byte[w * h * layout.nChannels()];
		new Random(42L).nextBytes(data);
		var img = ByteImages.createImage(data, w, h, layout);
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.imageToMat(img);
			assertEquals(w, mat.cols());
			assertEquals(h, mat.rows());
			assertEquals(layout.nChannels(), mat.channels());
			assertEquals(opencv_core.CV_8U, mat.depth());
			assertEquals(img, OpenCVTools.matToImage(mat, layout));
			
			// Conversion to float and back should be lossless
			mat.convertTo(mat, opencv_core.CV_32F);
			assertEquals(img, OpenCVTools.matToImage(mat, layout));
		}
	}
	
	@Test
	public void testMatToImageRounding() {
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.createKernel(new float[] {300f, -5f, 1.6f, 2.4f}, 4, 1);
			var img = OpenCVTools.matToImage(mat, ChannelLayout.GRAY);
			assertEquals(255, img.getValue(0, 0, 0));
			assertEquals(0, img.getValue(1, 0, 0));
			assertEquals(2, img.getValue(2, 0, 0));
			assertEquals(2, img.getValue(3, 0, 0));
			
			assertThrows(IllegalArgumentException.class, () -> OpenCVTools.matToImage(mat, ChannelLayout.RGB));
		}
	}
	
	@Test
	public void testCreateKernel() {
		assertThrows(IllegalArgumentException.class, () -> OpenCVTools.createKernel(new float[8], 3, 3));
		try (var scope = new PointerScope()) {
			float[] weights = {1, 2, 3, 4, 5, 6};
			var kernel = OpenCVTools.createKernel(weights, 3, 2);
			assertEquals(3, kernel.cols());
			assertEquals(2, kernel.rows());
			assertEquals(opencv_core.CV_32F, kernel.depth());
			assertArrayEquals(new double[] {1, 2, 3, 4, 5, 6}, OpenCVTools.extractPixels(kernel, null));
		}
	}
	
	@Test
	public void testExtractPixels() {
		double[] values = {0.5, -1.0, 2.25, 100.0};
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.createDoubleMat(values, 2, 2);
			double[] output = new double[4];
			assertArrayEquals(values, OpenCVTools.extractPixels(mat, output));
			assertArrayEquals(values, output);
			
			// Non-continuous submatrix
			var col = mat.col(1);
			assertArrayEquals(new double[] {-1.0, 100.0}, OpenCVTools.extractPixels(col, null));
		}
	}
	
	@Test
	public void testGaussianFilter() {
		var img = ByteImages.createFilledImage(9, 6, ChannelLayout.RGB, 10, 100, 250);
		try (var scope = new PointerScope()) {
			var mat = OpenCVTools.imageToMat(img);
			mat.convertTo(mat, opencv_core.CV_32F);
			OpenCVTools.gaussianFilter(mat, 2.0, OpenCVTools.DEFAULT_BORDER_TYPE);
			// Constant images are unchanged with replicated borders
			assertEquals(img, OpenCVTools.matToImage(mat, ChannelLayout.RGB));
		}
	}

}
