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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybridizer.lib.common.ColorTools;
import hybridizer.lib.images.ByteImage;
import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;

/**
 * Combine images by summing their channel values with saturation.
 * <p>
 * Inputs are converted to RGBA before combining. The output alpha channel is always 
 * fully opaque, regardless of the input alpha values.
 * 
 * @author Hybridizer developers
 */
public class Overlays {
	
	private static final Logger logger = LoggerFactory.getLogger(Overlays.class);
	
	private Overlays() {
		throw new AssertionError();
	}
	
	/**
	 * Overlay two images, summing each color channel and clamping at 255.
	 * 
	 * @param a first image
	 * @param b second image
	 * @return a new RGBA image with the same size as the inputs
	 * @throws IllegalArgumentException if the images have different sizes
	 */
	public static ByteImage overlay(ByteImage a, ByteImage b) throws IllegalArgumentException {
		return overlay(new ByteImage[] {a, b});
	}
	
	/**
	 * Overlay three images, summing each color channel and clamping at 255.
	 * <p>
	 * The first two images are summed and clamped before the third is added, so the result 
	 * is identical to {@code overlay(overlay(a, b), c)}.
	 * 
	 * @param a first image
	 * @param b second image
	 * @param c third image
	 * @return a new RGBA image with the same size as the inputs
	 * @throws IllegalArgumentException if the images have different sizes
	 */
	public static ByteImage overlay(ByteImage a, ByteImage b, ByteImage c) throws IllegalArgumentException {
		return overlay(new ByteImage[] {a, b, c});
	}
	
	private static ByteImage overlay(ByteImage[] images) {
		for (var img : images)
			Objects.requireNonNull(img, "Cannot overlay a null image");
		ByteImages.checkSameSize(images[0], images);
		
		int width = images[0].getWidth();
		int height = images[0].getHeight();
		logger.debug("Overlaying {} images ({} x {})", images.length, width, height);
		
		int nChannels = ChannelLayout.RGBA.nChannels();
		int nColorChannels = ChannelLayout.RGBA.nColorChannels();
		byte[] output = ByteImages.getPixels(ByteImages.toRGBA(images[0]));
		for (int k = 1; k < images.length; k++) {
			byte[] next = ByteImages.getPixels(ByteImages.toRGBA(images[k]));
			for (int i = 0; i < output.length; i++) {
				if (i % nChannels >= nColorChannels)
					continue;
				output[i] = (byte)ColorTools.clampAdd(output[i] & 0xFF, next[i] & 0xFF, ColorTools.MAX_8BIT);
			}
		}
		for (int i = nColorChannels; i < output.length; i += nChannels)
			output[i] = (byte)ColorTools.MAX_8BIT;
		return ByteImages.createImage(output, width, height, ChannelLayout.RGBA);
	}

}
