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

package hybridizer.lib.awt.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import hybridizer.lib.images.ByteImages;
import hybridizer.lib.images.ChannelLayout;

@SuppressWarnings("javadoc")
public class TestImageFiles {
	
	@TempDir
	Path tempDir;
	
	@ParameterizedTest
	@EnumSource(ChannelLayout.class)
	public void test_pngLossless(ChannelLayout layout) throws IOException {
		byte[] data = new byte[8 * 5 * layout.nChannels()];
		new Random(1L).nextBytes(data);
		var img = ByteImages.createImage(data, 8, 5, layout);
		var file = tempDir.resolve("image-" + layout + ".png").toFile();
		ImageFiles.write(img, file);
		assertTrue(file.isFile());
		assertEquals(img, ImageFiles.read(file));
	}
	
	@Test
	public void test_jpegDropsAlpha() throws IOException {
		var img = ByteImages.createFilledImage(16, 16, ChannelLayout.RGBA, 200, 100, 50, 0);
		var file = tempDir.resolve("image.JPG").toFile();
		ImageFiles.write(img, file);
		var read = ImageFiles.read(file);
		assertEquals(ChannelLayout.RGB, read.getChannelLayout());
		assertEquals(16, read.getWidth());
		// Lossy, but flat images should be close
		assertTrue(Math.abs(read.getValue(8, 8, 0) - 200) <= 4);
		assertTrue(Math.abs(read.getValue(8, 8, 2) - 50) <= 4);
	}
	
	@Test
	public void test_errors() throws IOException {
		var img = ByteImages.createFilledImage(2, 2, ChannelLayout.GRAY, 0);
		assertThrows(IOException.class, () -> ImageFiles.write(img, tempDir.resolve("image").toFile()));
		assertThrows(IOException.class, () -> ImageFiles.write(img, tempDir.resolve("image.notaformat").toFile()));
		assertThrows(IOException.class, () -> ImageFiles.read(tempDir.resolve("missing.png").toFile()));
		
		var text = tempDir.resolve("text.png");
		Files.writeString(text, "Not an image");
		assertThrows(IOException.class, () -> ImageFiles.read(text.toFile()));
	}
	
	@Test
	public void test_getExtension() {
		assertEquals("png", ImageFiles.getExtension(new File("dir/a.PNG")));
		assertEquals("jpg", ImageFiles.getExtension(new File("a.b.jpg")));
		assertNull(ImageFiles.getExtension(new File("noextension")));
		assertNull(ImageFiles.getExtension(new File(".hidden")));
		assertNull(ImageFiles.getExtension(new File("trailing.")));
	}

}
