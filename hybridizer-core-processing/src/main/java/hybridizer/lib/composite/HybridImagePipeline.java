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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybridizer.lib.analysis.images.Overlays;
import hybridizer.lib.images.ByteImage;
import hybridizer.opencv.processing.SpatialFilters;

/**
 * Create hybrid images by combining the low frequencies of one image with the 
 * high frequencies of one or two others.
 * <p>
 * The first source is low-pass filtered, the remaining sources are high-pass filtered, 
 * and the filtered images are then summed with saturation.
 * 
 * @author Hybridizer developers
 */
public class HybridImagePipeline {
	
	private static final Logger logger = LoggerFactory.getLogger(HybridImagePipeline.class);
	
	private HybridImagePipeline() {
		throw new AssertionError();
	}
	
	/**
	 * Create a hybrid image using default parameters.
	 * @param sources
	 * @return
	 * @see HybridParameters#getDefault()
	 */
	public static HybridResult run(HybridSources sources) {
		return run(sources, HybridParameters.getDefault());
	}
	
	/**
	 * Create a hybrid image, retaining the images from all intermediate stages.
	 * 
	 * @param sources the source images
	 * @param params the filter parameters
	 * @return the result, containing the hybrid image and all intermediate stages
	 * @throws IllegalArgumentException if the parameters are invalid
	 */
	public static HybridResult run(HybridSources sources, HybridParameters params) throws IllegalArgumentException {
		Objects.requireNonNull(sources, "Sources must not be null");
		Objects.requireNonNull(params, "Parameters must not be null");
		params.validate();
		
		logger.info("Creating hybrid image from {} sources ({} x {})", sources.nImages(), sources.getWidth(), sources.getHeight());
		logger.debug("Using {}", params);
		long startTime = System.currentTimeMillis();
		
		Map<HybridStage, ByteImage> images = new EnumMap<>(HybridStage.class);
		
		var sourceA = sources.getLowFrequencySource();
		var sourceB = sources.getHighFrequencySource();
		images.put(HybridStage.SOURCE_A, sourceA);
		images.put(HybridStage.SOURCE_B, sourceB);
		
		var lowA = SpatialFilters.lowPass(sourceA, params.getLowPassSigma());
		var highB = SpatialFilters.highPass(sourceB, params.getSharpenAmountB(), params.getHighPassSigma());
		images.put(HybridStage.LOW_PASS_A, lowA);
		images.put(HybridStage.HIGH_PASS_B, highB);
		
		if (sources instanceof HybridSources.Triple triple) {
			var sourceC = triple.getSecondHighFrequencySource();
			var highC = SpatialFilters.highPass(sourceC, params.getSharpenAmountC(), params.getHighPassSigma());
			images.put(HybridStage.SOURCE_C, sourceC);
			images.put(HybridStage.HIGH_PASS_C, highC);
			images.put(HybridStage.SOURCE_OVERLAY, Overlays.overlay(sourceA, sourceB, sourceC));
			images.put(HybridStage.HYBRID, Overlays.overlay(lowA, highB, highC));
		} else {
			images.put(HybridStage.SOURCE_OVERLAY, Overlays.overlay(sourceA, sourceB));
			images.put(HybridStage.HYBRID, Overlays.overlay(lowA, highB));
		}
		
		logger.debug("Hybrid image created in {} ms", System.currentTimeMillis() - startTime);
		return new HybridResult(params, images);
	}

}
