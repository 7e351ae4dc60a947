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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import hybridizer.lib.images.ByteImage;
import hybridizer.opencv.processing.FourierSpectrum;

/**
 * The images produced at each stage of hybrid image creation.
 * 
 * @author Hybridizer developers
 * @see HybridImagePipeline
 */
public class HybridResult {
	
	private final HybridParameters parameters;
	private final Map<HybridStage, ByteImage> images;
	
	HybridResult(HybridParameters parameters, Map<HybridStage, ByteImage> images) {
		this.parameters = Objects.requireNonNull(parameters);
		this.images = Collections.unmodifiableMap(new EnumMap<>(images));
	}
	
	/**
	 * Parameters used to create the result.
	 * @return
	 */
	public HybridParameters getParameters() {
		return parameters;
	}
	
	/**
	 * Stages available in this result, in pipeline order.
	 * Stages relating to a third image are only included if one was provided.
	 * @return
	 */
	public List<HybridStage> getStages() {
		return new ArrayList<>(images.keySet());
	}
	
	/**
	 * Returns true if the result contains an image for the specified stage.
	 * @param stage
	 * @return
	 */
	public boolean hasStage(HybridStage stage) {
		return images.containsKey(stage);
	}
	
	/**
	 * Get the image for a specific stage.
	 * @param stage
	 * @return the image
	 * @throws IllegalArgumentException if the stage is not available
	 */
	public ByteImage getImage(HybridStage stage) throws IllegalArgumentException {
		var img = images.get(stage);
		if (img == null)
			throw new IllegalArgumentException("No image available for stage " + stage);
		return img;
	}
	
	/**
	 * Get the final hybrid image.
	 * @return
	 */
	public ByteImage getHybridImage() {
		return getImage(HybridStage.HYBRID);
	}
	
	/**
	 * Create a visualization of the frequency spectrum of the image for a specific stage.
	 * This is computed on demand, and is not cached.
	 * @param stage
	 * @return
	 * @throws IllegalArgumentException if the stage is not available
	 * @see FourierSpectrum#visualize(ByteImage)
	 */
	public ByteImage getSpectrum(HybridStage stage) throws IllegalArgumentException {
		return FourierSpectrum.visualize(getImage(stage));
	}

}
