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

package hybridizer.lib.awt.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.awt.image.BufferedImage;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import hybridizer.lib.common.ColorTools;
import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;

@SuppressWarnings("javadoc")
public class TestBufferedImageTools {
	
	@ParameterizedTest
	@EnumSource(ChannelLayout.class)
	public void test_convert(ChannelLayout layout) {
		byte[] data = new byte[6 * 4 * layout.nChannels()];
		new Random(5L).nextBytes(data);
		var img = ByteImages.createImage(data, 6, 4, layout);
		var buffered = BufferedImageTools.toBufferedImage(img);
		assertEquals(6, buffered.getWidth());
		assertEquals(4, buffered.getHeight());
		assertEquals(layout.hasAlpha(), buffered.getColorModel().hasAlpha());
		assertEquals(img, BufferedImageTools.toByteImage(buffered));
	}
	
	@Test
	public void test_toByteImage() {
		var buffered = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
		buffered.setRGB(1, 1, ColorTools.packRGB(10, 20, 30));
		var img = BufferedImageTools.toByteImage(buffered);
		assertEquals(ChannelLayout.RGB, img.getChannelLayout());
		assertEquals(10, img.getValue(1, 1, 0));
		assertEquals(20, img.getValue(1, 1, 1));
		assertEquals(30, img.getValue(1, 1, 2));
		assertEquals(0, img.getValue(0, 0, 0));
		
		buffered = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
		buffered.setRGB(2, 0, ColorTools.packARGB(128, 255, 0, 0));
		img = BufferedImageTools.toByteImage(buffered);
		assertEquals(ChannelLayout.RGBA, img.getChannelLayout());
		assertEquals(128, img.getValue(2, 0, 3));
		assertEquals(255, img.getValue(2, 0, 0));
		assertEquals(0, img.getValue(0, 0, 3));
	}
	
	@Test
	public void test_removeAlpha() {
		var rgba = ByteImages.createFilledImage(2, 2, ChannelLayout.RGBA, 1, 2, 3, 4);
		assertEquals(ByteImages.createFilledImage(2, 2, ChannelLayout.RGB, 1, 2, 3), BufferedImageTools.removeAlpha(rgba));
		var rgb = ByteImages.createFilledImage(2, 2, ChannelLayout.RGB, 1, 2, 3);
		assertSame(rgb, BufferedImageTools.removeAlpha(rgb));
	}

}
