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

/**
 * A minimal interface to provide read-only access to the values of a 2D image 
 * with 8-bit unsigned channels.
 * <p>
 * Implementations are immutable: every transform creates a new image rather than 
 * modifying its input.
 * 
 * @author Hybridizer developers
 * @see ByteImages
 */
public interface ByteImage {
	
	/**
	 * Get the unsigned value of a single channel of a pixel.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @param c channel index
	 * @return value in the range 0-255
	 */
	int getValue(int x, int y, int c);
	
	/**
	 * Width of the image, in pixels.
	 * @return
	 */
	int getWidth();
	
	/**
	 * Height of the image, in pixels.
	 * @return
	 */
	int getHeight();
	
	/**
	 * Arrangement of channels within each pixel.
	 * @return
	 */
	ChannelLayout getChannelLayout();
	
	/**
	 * Number of channels per pixel; equivalent to {@code getChannelLayout().nChannels()}.
	 * @return
	 */
	default int nChannels() {
		return getChannelLayout().nChannels();
	}
	
	/**
	 * Returns true if this image has the same width and height as another image.
	 * Channel layouts are not compared.
	 * @param other
	 * @return
	 */
	default boolean hasSameSize(ByteImage other) {
		return getWidth() == other.getWidth() && getHeight() == other.getHeight();
	}

}
