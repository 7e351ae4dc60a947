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

package hybridizer.lib.composite;

import java.util.Objects;

import hybridizer.lib.images.ByteImage;
import hybridizer.lib.images.ByteImages;

/**
 * Source images for a hybrid image.
 * <p>
 * There are two variants: a pair of images, where the first provides low frequencies and 
 * the second provides high frequencies, and a triple, which adds a second high-frequency image. 
 * All images in a source must have the same width and height.
 * 
 * @author Hybridizer developers
 * @see #of(ByteImage, ByteImage)
 * @see #of(ByteImage, ByteImage, ByteImage)
 */
public abstract class HybridSources {
	
	private final ByteImage lowFrequencySource;
	private final ByteImage highFrequencySource;
	
	private HybridSources(ByteImage lowFrequencySource, ByteImage highFrequencySource) {
		this.lowFrequencySource = Objects.requireNonNull(lowFrequencySource, "Low-frequency image must not be null");
		this.highFrequencySource = Objects.requireNonNull(highFrequencySource, "High-frequency image must not be null");
	}
	
	/**
	 * Create sources from two images.
	 * @param lowFrequencySource image providing low frequencies
	 * @param highFrequencySource image providing high frequencies
	 * @return
	 * @throws IllegalArgumentException if the images have different sizes
	 */
	public static HybridSources of(ByteImage lowFrequencySource, ByteImage highFrequencySource) throws IllegalArgumentException {
		return new Pair(lowFrequencySource, highFrequencySource);
	}
	
	/**
	 * Create sources from three images.
	 * @param lowFrequencySource image providing low frequencies
	 * @param highFrequencySource first image providing high frequencies
	 * @param secondHighFrequencySource second image providing high frequencies
	 * @return
	 * @throws IllegalArgumentException if the images have different sizes
	 */
	public static HybridSources of(ByteImage lowFrequencySource, ByteImage highFrequencySource, ByteImage secondHighFrequencySource) throws IllegalArgumentException {
		return new Triple(lowFrequencySource, highFrequencySource, secondHighFrequencySource);
	}
	
	/**
	 * Image providing low frequencies.
	 * @return
	 */
	public ByteImage getLowFrequencySource() {
		return lowFrequencySource;
	}
	
	/**
	 * Image providing high frequencies.
	 * @return
	 */
	public ByteImage getHighFrequencySource() {
		return highFrequencySource;
	}
	
	/**
	 * Number of source images (2 or 3).
	 * @return
	 */
	public abstract int nImages();
	
	/**
	 * Width shared by all images.
	 * @return
	 */
	public int getWidth() {
		return lowFrequencySource.getWidth();
	}
	
	/**
	 * Height shared by all images.
	 * @return
	 */
	public int getHeight() {
		return lowFrequencySource.getHeight();
	}
	
	
	/**
	 * Two source images.
	 */
	public static final class Pair extends HybridSources {
		
		private Pair(ByteImage lowFrequencySource, ByteImage highFrequencySource) {
			super(lowFrequencySource, highFrequencySource);
			ByteImages.checkSameSize(lowFrequencySource, highFrequencySource);
		}

		@Override
		public int nImages() {
			return 2;
		}
		
	}
	
	/**
	 * Three source images.
	 */
	public static final class Triple extends HybridSources {
		
		private final ByteImage secondHighFrequencySource;
		
		private Triple(ByteImage lowFrequencySource, ByteImage highFrequencySource, ByteImage secondHighFrequencySource) {
			super(lowFrequencySource, highFrequencySource);
			this.secondHighFrequencySource = Objects.requireNonNull(secondHighFrequencySource, "Second high-frequency image must not be null");
			ByteImages.checkSameSize(lowFrequencySource, highFrequencySource, secondHighFrequencySource);
		}
		
		/**
		 * Second image providing high frequencies.
		 * @return
		 */
		public ByteImage getSecondHighFrequencySource() {
			return secondHighFrequencySource;
		}

		@Override
		public int nImages() {
			return 3;
		}
		
	}

}
