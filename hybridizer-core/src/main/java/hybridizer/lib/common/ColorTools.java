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

package hybridizer.lib.common;

/**
 * Static functions to help work with 8-bit channel values and packed ARGB ints.
 * <p>
 * The clamped arithmetic methods never wrap around the 8-bit range; results are
 * saturated at zero or at the supplied maximum instead.
 * 
 * @author Hybridizer developers
 *
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Maximum value of an unsigned 8-bit channel.
	 */
	public static final int MAX_8BIT = 255;
	
	/**
	 * Packed int representing red.
	 */
	public static final int RED = packRGB(255, 0, 0);

	/**
	 * Packed int representing green.
	 */
	public static final int GREEN = packRGB(0, 255, 0);

	/**
	 * Packed int representing blue.
	 */
	public static final int BLUE = packRGB(0, 0, 255);
	
	/**
	 * Subtract one channel value from another, clamping at the floor.
	 * <p>
	 * If {@code a < b} the result is 0, otherwise it is {@code min(max, a - b)}.
	 * 
	 * @param a the value to subtract from
	 * @param b the value to subtract
	 * @param max the maximum permitted output value
	 * @return the clamped difference
	 * @see #clampAdd(int, int, int)
	 */
	public static int clampSubtract(int a, int b, int max) {
		if (a < b)
			return 0;
		return Math.min(max, a - b);
	}
	
	/**
	 * Add two channel values, saturating at a maximum.
	 * <p>
	 * The sum is computed as an int, so 8-bit inputs cannot overflow before the check is made.
	 * 
	 * @param a first value
	 * @param b second value
	 * @param max the maximum permitted output value
	 * @return {@code max} if {@code a + b > max}, otherwise {@code a + b}
	 * @see #clampSubtract(int, int, int)
	 */
	public static int clampAdd(int a, int b, int max) {
		int sum = a + b;
		return sum > max ? max : sum;
	}

	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return packARGB(255, r, g, b);
	}

	/**
	 * Make a packed ARGB value from specified input values.
	 * <p>
	 * Input a, r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param a
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packARGB(int a, int r, int g, int b) {
		return ((a & 0xff)<<24) + 
			   ((r & 0xff)<<16) + 
			   ((g & 0xff)<<8) + 
				(b & 0xff);
	}
	
	/**
	 * Clip an input value to be an integer in the range 0-255 (with rounding down).
	 * <p>
	 * NaN is converted to 0.
	 * 
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return v < 0 ? 0 : (v > 255 ? 255 : (int)v);
	}
	
	/**
	 * Extract the 8-bit alpha value from a packed ARGB value.
	 * 
	 * @param argb
	 * @return
	 */
	public static int alpha(int argb) {
		return (argb >> 24) & 0xff;
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}
	
	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return (rgb & 0xff);
	}

}
