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

/**
 * Parameters controlling how a hybrid image is created.
 * <p>
 * Instances are immutable, and can be created with a {@link Builder} or read from JSON. 
 * Values that are missing from JSON take their defaults.
 * 
 * @author Hybridizer developers
 */
public class HybridParameters {
	
	/**
	 * Default Gaussian sigma for the low-pass filter.
	 */
	public static final double DEFAULT_LOW_PASS_SIGMA = 4.5;
	
	/**
	 * Default sharpen amount for the second (high-frequency) image.
	 */
	public static final double DEFAULT_SHARPEN_AMOUNT_B = 0.545;
	
	/**
	 * Default sharpen amount for the optional third image.
	 */
	public static final double DEFAULT_SHARPEN_AMOUNT_C = 0.0;
	
	private double lowPassSigma = DEFAULT_LOW_PASS_SIGMA;
	private double sharpenAmountB = DEFAULT_SHARPEN_AMOUNT_B;
	private double sharpenAmountC = DEFAULT_SHARPEN_AMOUNT_C;
	private Double highPassSigma;
	
	private HybridParameters() {}
	
	/**
	 * Get the default parameters.
	 * @return
	 */
	public static HybridParameters getDefault() {
		return new HybridParameters();
	}
	
	/**
	 * Gaussian sigma used to low-pass filter the first image.
	 * @return
	 */
	public double getLowPassSigma() {
		return lowPassSigma;
	}
	
	/**
	 * Sharpen amount used to high-pass filter the second image.
	 * @return
	 */
	public double getSharpenAmountB() {
		return sharpenAmountB;
	}
	
	/**
	 * Sharpen amount used to high-pass filter the third image, if there is one.
	 * @return
	 */
	public double getSharpenAmountC() {
		return sharpenAmountC;
	}
	
	/**
	 * Gaussian sigma for the blurred copy subtracted during high-pass filtering.
	 * If this has not been set, the low-pass sigma is returned.
	 * @return
	 */
	public double getHighPassSigma() {
		return highPassSigma == null ? lowPassSigma : highPassSigma;
	}
	
	/**
	 * Create a builder initialized with the values of these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		var builder = new Builder()
				.lowPassSigma(lowPassSigma)
				.sharpenAmountB(sharpenAmountB)
				.sharpenAmountC(sharpenAmountC);
		if (highPassSigma != null)
			builder.highPassSigma(highPassSigma);
		return builder;
	}
	
	/**
	 * Check that the parameter values can be used for filtering.
	 * <p>
	 * This is mostly useful after reading parameters from JSON, since the builder 
	 * validates values as they are set.
	 * 
	 * @return these parameters
	 * @throws IllegalArgumentException if any sigma is negative or not finite, or any sharpen amount is not finite
	 */
	public HybridParameters validate() throws IllegalArgumentException {
		checkSigma("Low-pass sigma", lowPassSigma);
		if (highPassSigma != null)
			checkSigma("High-pass sigma", highPassSigma);
		checkFinite("Sharpen amount B", sharpenAmountB);
		checkFinite("Sharpen amount C", sharpenAmountC);
		return this;
	}
	
	private static void checkSigma(String name, double value) {
		if (!Double.isFinite(value) || value < 0)
			throw new IllegalArgumentException(name + " must be a finite value >= 0, but was " + value);
	}
	
	private static void checkFinite(String name, double value) {
		if (!Double.isFinite(value))
			throw new IllegalArgumentException(name + " must be finite, but was " + value);
	}
	
	@Override
	public String toString() {
		return String.format("HybridParameters [lowPassSigma=%s, sharpenAmountB=%s, sharpenAmountC=%s, highPassSigma=%s]",
				lowPassSigma, sharpenAmountB, sharpenAmountC, getHighPassSigma());
	}

	@Override
	public int hashCode() {
		return Objects.hash(lowPassSigma, sharpenAmountB, sharpenAmountC, getHighPassSigma());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof HybridParameters other))
			return false;
		return Double.compare(lowPassSigma, other.lowPassSigma) == 0 &&
				Double.compare(sharpenAmountB, other.sharpenAmountB) == 0 &&
				Double.compare(sharpenAmountC, other.sharpenAmountC) == 0 &&
				Double.compare(getHighPassSigma(), other.getHighPassSigma()) == 0;
	}
	
	
	/**
	 * Builder for {@link HybridParameters}.
	 */
	public static class Builder {
		
		private final HybridParameters params = new HybridParameters();
		
		/**
		 * Set the Gaussian sigma used to low-pass filter the first image.
		 * @param sigma
		 * @return this builder
		 * @throws IllegalArgumentException if sigma is negative or not finite
		 */
		public Builder lowPassSigma(double sigma) throws IllegalArgumentException {
			checkSigma("Low-pass sigma", sigma);
			params.lowPassSigma = sigma;
			return this;
		}
		
		/**
		 * Set the sharpen amount used to high-pass filter the second image.
		 * @param amount
		 * @return this builder
		 * @throws IllegalArgumentException if the amount is not finite
		 */
		public Builder sharpenAmountB(double amount) throws IllegalArgumentException {
			checkFinite("Sharpen amount B", amount);
			params.sharpenAmountB = amount;
			return this;
		}
		
		/**
		 * Set the sharpen amount used to high-pass filter the third image.
		 * @param amount
		 * @return this builder
		 * @throws IllegalArgumentException if the amount is not finite
		 */
		public Builder sharpenAmountC(double amount) throws IllegalArgumentException {
			checkFinite("Sharpen amount C", amount);
			params.sharpenAmountC = amount;
			return this;
		}
		
		/**
		 * Set the Gaussian sigma for the blurred copy subtracted during high-pass filtering.
		 * If this is not called, the low-pass sigma is used.
		 * @param sigma
		 * @return this builder
		 * @throws IllegalArgumentException if sigma is negative or not finite
		 */
		public Builder highPassSigma(double sigma) throws IllegalArgumentException {
			checkSigma("High-pass sigma", sigma);
			params.highPassSigma = sigma;
			return this;
		}
		
		/**
		 * Build the parameters.
		 * @return a new instance
		 */
		public HybridParameters build() {
			var output = new HybridParameters();
			output.lowPassSigma = params.lowPassSigma;
			output.sharpenAmountB = params.sharpenAmountB;
			output.sharpenAmountC = params.sharpenAmountC;
			output.highPassSigma = params.highPassSigma;
			return output;
		}
		
	}

}
