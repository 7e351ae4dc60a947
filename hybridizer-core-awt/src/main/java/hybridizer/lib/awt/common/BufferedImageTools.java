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

package hybridizer.lib.awt.common;

import java.awt.image.BufferedImage;

import hybridizer.lib.common.ColorTools;
import hybridizer.lib.images.ByteImage;
import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;

/**
 * A collection of static methods for converting between {@link BufferedImage} and {@link ByteImage}.
 * 
 * @author Hybridizer developers
 *
 */
public class BufferedImageTools {
	
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Convert a BufferedImage to a ByteImage.
	 * <p>
	 * 8-bit gray images retain a single channel. Other images are converted to (non-premultiplied) 
	 * sRGB, with an alpha channel only if the input has one.
	 * 
	 * @param img
	 * @return
	 */
	public static ByteImage toByteImage(BufferedImage img) {
		int w = img.getWidth();
		int h = img.getHeight();
		if (img.getType() == BufferedImage.TYPE_BYTE_GRAY) {
			int[] samples = img.getRaster().getSamples(0, 0, w, h, 0, (int[])null);
			byte[] data = new byte[samples.length];
			for (int i = 0; i < samples.length; i++)
				data[i] = (byte)samples[i];
			return ByteImages.createImage(data, w, h, ChannelLayout.GRAY);
		}
		var layout = img.getColorModel().hasAlpha() ? ChannelLayout.RGBA : ChannelLayout.RGB;
		int nc = layout.nChannels();
		int[] rgb = img.getRGB(0, 0, w, h, null, 0, w);
		byte[] data = new byte[rgb.length * nc];
		for (int i = 0; i < rgb.length; i++) {
			int val = rgb[i];
			data[i*nc] = (byte)ColorTools.red(val);
			data[i*nc+1] = (byte)ColorTools.green(val);
			data[i*nc+2] = (byte)ColorTools.blue(val);
			if (layout.hasAlpha())
				data[i*nc+3] = (byte)ColorTools.alpha(val);
		}
		return ByteImages.createImage(data, w, h, layout);
	}
	
	/**
	 * Convert a ByteImage to a BufferedImage.
	 * <p>
	 * The output type is {@code TYPE_BYTE_GRAY}, {@code TYPE_INT_RGB} or {@code TYPE_INT_ARGB}, 
	 * depending upon the channel layout.
	 * 
	 * @param image
	 * @return
	 */
	public static BufferedImage toBufferedImage(ByteImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		byte[] data = ByteImages.getPixels(image);
		var layout = image.getChannelLayout();
		if (layout == ChannelLayout.GRAY) {
			var img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
			int[] samples = new int[data.length];
			for (int i = 0; i < data.length; i++)
				samples[i] = data[i] & 0xFF;
			img.getRaster().setSamples(0, 0, w, h, 0, samples);
			return img;
		}
		int nc = layout.nChannels();
		int[] rgb = new int[w * h];
		for (int i = 0; i < rgb.length; i++) {
			int a = layout.hasAlpha() ? data[i*nc+3] : 255;
			rgb[i] = ColorTools.packARGB(a, data[i*nc], data[i*nc+1], data[i*nc+2]);
		}
		var img = new BufferedImage(w, h, layout.hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
		img.setRGB(0, 0, w, h, rgb, 0, w);
		return img;
	}
	
	/**
	 * Remove the alpha channel from an image, if it has one.
	 * @param image
	 * @return the image unchanged if it has no alpha channel, or an RGB copy
	 */
	public static ByteImage removeAlpha(ByteImage image) {
		if (!image.getChannelLayout().hasAlpha())
			return image;
		byte[] data = ByteImages.getPixels(image);
		int n = image.getWidth() * image.getHeight();
		byte[] rgb = new byte[n * 3];
		for (int i = 0; i < n; i++) {
			rgb[i*3] = data[i*4];
			rgb[i*3+1] = data[i*4+1];
			rgb[i*3+2] = data[i*4+2];
		}
		return ByteImages.createImage(rgb, image.getWidth(), image.getHeight(), ChannelLayout.RGB);
	}

}
