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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestColorTools {
	
	@Test
	public void test_clampSubtract() {
		assertEquals(0, ColorTools.clampSubtract(10, 20, 255));
		assertEquals(80, ColorTools.clampSubtract(100, 20, 255));
		assertEquals(0, ColorTools.clampSubtract(0, 255, 255));
		assertEquals(255, ColorTools.clampSubtract(255, 0, 255));
		assertEquals(0, ColorTools.clampSubtract(17, 17, 255));
		
		for (int a = 0; a <= 255; a++) {
			for (int b = 0; b <= 255; b++) {
				int v = ColorTools.clampSubtract(a, b, 255);
				assertTrue(v >= 0 && v <= 255);
				assertEquals(Math.max(0, a - b), v);
			}
		}
	}

	@Test
	public void test_clampAdd() {
		assertEquals(255, ColorTools.clampAdd(200, 100, 255));
		assertEquals(30, ColorTools.clampAdd(10, 20, 255));
		assertEquals(255, ColorTools.clampAdd(255, 255, 255));
		assertEquals(0, ColorTools.clampAdd(0, 0, 255));
		
		for (int a = 0; a <= 255; a++) {
			for (int b = 0; b <= 255; b++) {
				int v = ColorTools.clampAdd(a, b, 255);
				assertEquals(Math.min(255, a + b), v);
				assertEquals(v, ColorTools.clampAdd(b, a, 255));
			}
		}
	}
	
	@Test
	public void test_packRGB() {
		assertEquals(Integer.parseUnsignedInt("ffff0000", 16), ColorTools.RED);
		assertEquals(Integer.parseUnsignedInt("ff00ff00", 16), ColorTools.GREEN);
		assertEquals(Integer.parseUnsignedInt("ff0000ff", 16), ColorTools.BLUE);
		assertEquals(Integer.parseUnsignedInt("ff010203", 16), ColorTools.packRGB(1, 2, 3));
		assertEquals(Integer.parseUnsignedInt("00010203", 16), ColorTools.packARGB(0, 1, 2, 3));
		// Only the lower 8 bits are used
		assertEquals(Integer.parseUnsignedInt("ff000000", 16), ColorTools.packRGB(256, 256, 256));
	}
	
	@Test
	public void test_unpack() {
		int argb = ColorTools.packARGB(10, 20, 30, 40);
		assertEquals(10, ColorTools.alpha(argb));
		assertEquals(20, ColorTools.red(argb));
		assertEquals(30, ColorTools.green(argb));
		assertEquals(40, ColorTools.blue(argb));
		assertEquals(255, ColorTools.alpha(ColorTools.BLUE));
	}
	
	@Test
	public void test_do8BitRangeCheck() {
		assertEquals(0, ColorTools.do8BitRangeCheck(-1.0));
		assertEquals(255, ColorTools.do8BitRangeCheck(256.0));
		assertEquals(128, ColorTools.do8BitRangeCheck(128.0));
		assertEquals(0, ColorTools.do8BitRangeCheck(-0.5));
		assertEquals(254, ColorTools.do8BitRangeCheck(254.9));
		assertEquals(255, ColorTools.do8BitRangeCheck(Double.POSITIVE_INFINITY));
		assertEquals(0, ColorTools.do8BitRangeCheck(Double.NEGATIVE_INFINITY));
		assertEquals(0, ColorTools.do8BitRangeCheck(Double.NaN));
	}

}
