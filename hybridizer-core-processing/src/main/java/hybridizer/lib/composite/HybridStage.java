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

/**
 * Named stages of hybrid image creation.
 * <p>
 * Each stage has a short name that is used as the file name stem when the stage is written.
 * 
 * @author Hybridizer developers
 */
public enum HybridStage {
	
	/**
	 * First source image, before filtering.
	 */
	SOURCE_A("aa"),
	
	/**
	 * Second source image, before filtering.
	 */
	SOURCE_B("bb"),
	
	/**
	 * Optional third source image, before filtering.
	 */
	SOURCE_C("cc"),
	
	/**
	 * Low-pass filtered first image.
	 */
	LOW_PASS_A("a"),
	
	/**
	 * High-pass filtered second image.
	 */
	HIGH_PASS_B("b"),
	
	/**
	 * High-pass filtered third image.
	 */
	HIGH_PASS_C("c"),
	
	/**
	 * Overlay of the unfiltered source images.
	 */
	SOURCE_OVERLAY("tt"),
	
	/**
	 * Final hybrid image.
	 */
	HYBRID("t");
	
	private final String shortName;
	
	HybridStage(String shortName) {
		this.shortName = shortName;
	}
	
	/**
	 * Short name, suitable for use as a file name stem.
	 * @return
	 */
	public String getShortName() {
		return shortName;
	}

}
