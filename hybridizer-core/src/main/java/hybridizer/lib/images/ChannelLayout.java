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
 * Supported arrangements of 8-bit channels within a {@link ByteImage}.
 * <p>
 * Channels are always interleaved in the order given by the name, so an RGBA pixel 
 * occupies four consecutive bytes with alpha last.
 * 
 * @author Hybridizer developers
 */
public enum ChannelLayout {
	
	/**
	 * Single grayscale channel.
	 */
	GRAY(1),
	
	/**
	 * Red, green and blue channels.
	 */
	RGB(3),
	
	/**
	 * Red, green, blue and alpha channels.
	 */
	RGBA(4);
	
	private final int nChannels;
	
	ChannelLayout(int nChannels) {
		this.nChannels = nChannels;
	}
	
	/**
	 * Number of interleaved channels per pixel.
	 * @return
	 */
	public int nChannels() {
		return nChannels;
	}
	
	/**
	 * Returns true if the last channel holds transparency.
	 * @return
	 */
	public boolean hasAlpha() {
		return this == RGBA;
	}
	
	/**
	 * Number of channels that hold color (or gray) information, excluding alpha.
	 * @return
	 */
	public int nColorChannels() {
		return hasAlpha() ? nChannels - 1 : nChannels;
	}

}
