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

package hybridizer.lib.images;

import java.util.Arrays;
import java.util.Objects;

/**
 * Create and convert {@link ByteImage ByteImage} instances for basic pixel processing.
 * 
 * @author Hybridizer developers
 *
 */
public class ByteImages {
	
	/**
	 * Rec. 709 luma weights, scaled by 10000.
	 */
	private static final int LUMA_RED = 2126;
	private static final int LUMA_GREEN = 7152;
	private static final int LUMA_BLUE = 722;
	private static final int LUMA_SCALE = 10000;
	
	/**
	 * Get a copy of the interleaved pixel values for the image, in row-major order.
	 * @param image
	 * @return
	 */
	public static byte[] getPixels(ByteImage image) {
		if (image instanceof ByteArrayImage)
			return ((ByteArrayImage)image).getArray(false);
		int w = image.getWidth();
		int h = image.getHeight();
		int nc = image.nChannels();
		byte[] pixels = new byte[w * h * nc];
		int i = 0;
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				for (int c = 0; c < nc; c++)
					pixels[i++] = (byte)image.getValue(x, y, c);
			}
		}
		return pixels;
	}
	
	/**
	 * Create a {@link ByteImage} from interleaved pixel values in row-major order.
	 * <p>
	 * The array is copied, so later changes to it do not affect the image.
	 * 
	 * @param data interleaved pixel values
	 * @param width
	 * @param height
	 * @param layout
	 * @return
	 * @throws IllegalArgumentException if the dimensions are not positive, or the array length does not match
	 */
	public static ByteImage createImage(byte[] data, int width, int height, ChannelLayout layout) throws IllegalArgumentException {
		Objects.requireNonNull(data, "Pixel array must not be null");
		checkDimensions(width, height);
		Objects.requireNonNull(layout, "Channel layout must not be null");
		long expected = (long)width * height * layout.nChannels();
		if (data.length != expected)
			throw new IllegalArgumentException(
					String.format("Expected %d values for a %d x %d %s image, but array has length %d",
							expected, width, height, layout, data.length));
		return new ByteArrayImage(data.clone(), width, height, layout);
	}
	
	/**
	 * Create a {@link ByteImage} where every pixel has the same channel values.
	 * 
	 * @param width
	 * @param height
	 * @param layout
	 * @param values one value per channel, each in the range 0-255
	 * @return
	 * @throws IllegalArgumentException if the number of values does not match the layout
	 */
	public static ByteImage createFilledImage(int width, int height, ChannelLayout layout, int... values) throws IllegalArgumentException {
		checkDimensions(width, height);
		int nc = layout.nChannels();
		if (values.length != nc)
			throw new IllegalArgumentException("Expected " + nc + " channel values for " + layout + ", but got " + values.length);
		byte[] data = new byte[width * height * nc];
		for (int i = 0; i < data.length; i++)
			data[i] = (byte)values[i % nc];
		return new ByteArrayImage(data, width, height, layout);
	}
	
	/**
	 * Convert an image to RGBA.
	 * <p>
	 * Gray values are replicated across the color channels, and a missing alpha channel 
	 * is filled with 255 (fully opaque). RGBA images are returned unchanged.
	 * 
	 * @param image
	 * @return
	 */
	public static ByteImage toRGBA(ByteImage image) {
		var layout = image.getChannelLayout();
		if (layout == ChannelLayout.RGBA)
			return image;
		byte[] input = getPixels(image);
		int n = image.getWidth() * image.getHeight();
		byte[] output = new byte[n * 4];
		int nc = layout.nChannels();
		for (int i = 0; i < n; i++) {
			int ind = i * nc;
			if (layout == ChannelLayout.GRAY) {
				output[i*4] = input[ind];
				output[i*4+1] = input[ind];
				output[i*4+2] = input[ind];
			} else {
				output[i*4] = input[ind];
				output[i*4+1] = input[ind+1];
				output[i*4+2] = input[ind+2];
			}
			output[i*4+3] = (byte)255;
		}
		return new ByteArrayImage(output, image.getWidth(), image.getHeight(), ChannelLayout.RGBA);
	}
	
	/**
	 * Convert an image to a single luminance channel.
	 * <p>
	 * Color images are weighted using Rec. 709 coefficients with integer arithmetic, 
	 * and any alpha channel is ignored. Gray images are returned unchanged.
	 * 
	 * @param image
	 * @return
	 */
	public static ByteImage toGray(ByteImage image) {
		var layout = image.getChannelLayout();
		if (layout == ChannelLayout.GRAY)
			return image;
		byte[] input = getPixels(image);
		int nc = layout.nChannels();
		int n = image.getWidth() * image.getHeight();
		byte[] output = new byte[n];
		for (int i = 0; i < n; i++) {
			int r = input[i*nc] & 0xFF;
			int g = input[i*nc+1] & 0xFF;
			int b = input[i*nc+2] & 0xFF;
			output[i] = (byte)((LUMA_RED * r + LUMA_GREEN * g + LUMA_BLUE * b) / LUMA_SCALE);
		}
		return new ByteArrayImage(output, image.getWidth(), image.getHeight(), ChannelLayout.GRAY);
	}
	
	/**
	 * Check that all images have the same width and height.
	 * 
	 * @param first
	 * @param others
	 * @throws IllegalArgumentException if any image differs in size from the first
	 */
	public static void checkSameSize(ByteImage first, ByteImage... others) throws IllegalArgumentException {
		Objects.requireNonNull(first, "Image must not be null");
		for (var other : others) {
			Objects.requireNonNull(other, "Image must not be null");
			if (!first.hasSameSize(other))
				throw new IllegalArgumentException(
						String.format("Image sizes differ: %d x %d and %d x %d",
								first.getWidth(), first.getHeight(), other.getWidth(), other.getHeight()));
		}
	}
	
	private static void checkDimensions(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image width and height must be > 0, but were " + width + " x " + height);
	}
	
	
	/**
	 * Implementation of a ByteImage backed by an array of interleaved bytes.
	 */
	static class ByteArrayImage implements ByteImage {

		private final byte[] data;
		private final int width;
		private final int height;
		private final ChannelLayout layout;
		
		ByteArrayImage(byte[] data, int width, int height, ChannelLayout layout) {
			this.data = data;
			this.width = width;
			this.height = height;
			this.layout = layout;
		}
		
		@Override
		public int getValue(int x, int y, int c) {
			Objects.checkIndex(x, width);
			Objects.checkIndex(y, height);
			Objects.checkIndex(c, layout.nChannels());
			return data[(y * width + x) * layout.nChannels() + c] & 0xFF;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}
		
		@Override
		public ChannelLayout getChannelLayout() {
			return layout;
		}
		
		byte[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}
		
		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (!(obj instanceof ByteArrayImage other))
				return false;
			return width == other.width && height == other.height && 
					layout == other.layout && Arrays.equals(data, other.data);
		}
		
		@Override
		public int hashCode() {
			return Objects.hash(width, height, layout, Arrays.hashCode(data));
		}
		
		@Override
		public String toString() {
			return "ByteImage (" + width + " x " + height + ", " + layout + ")";
		}

	}
}
