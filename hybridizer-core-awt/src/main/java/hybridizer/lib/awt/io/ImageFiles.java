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

import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybridizer.lib.awt.common.BufferedImageTools;
import hybridizer.lib.images.ByteImage;

/**
 * Read and write images using ImageIO.
 * 
 * @author Hybridizer developers
 */
public class ImageFiles {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageFiles.class);
	
	/**
	 * Formats that cannot store an alpha channel.
	 */
	private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "jpeg", "bmp");
	
	private ImageFiles() {
		throw new AssertionError();
	}
	
	/**
	 * Read an image file.
	 * @param file
	 * @return
	 * @throws IOException if the file cannot be read, or its format is not supported
	 */
	public static ByteImage read(File file) throws IOException {
		if (!file.isFile())
			throw new IOException("Image file not found: " + file);
		var img = ImageIO.read(file);
		if (img == null)
			throw new IOException("No image reader found for " + file);
		logger.debug("Read {} x {} image from {}", img.getWidth(), img.getHeight(), file);
		return BufferedImageTools.toByteImage(img);
	}
	
	/**
	 * Write an image file, using the file extension to determine the format.
	 * <p>
	 * If the format cannot store transparency, the alpha channel is discarded.
	 * 
	 * @param image
	 * @param file
	 * @throws IOException if the format is not supported, or the file cannot be written
	 */
	public static void write(ByteImage image, File file) throws IOException {
		String ext = getExtension(file);
		if (ext == null)
			throw new IOException("Cannot determine image format for " + file);
		if (OPAQUE_FORMATS.contains(ext))
			image = BufferedImageTools.removeAlpha(image);
		var img = BufferedImageTools.toBufferedImage(image);
		if (!ImageIO.write(img, ext, file))
			throw new IOException("No image writer found for format '" + ext + "'");
		logger.debug("Wrote {} to {}", image, file);
	}
	
	/**
	 * Get the lower case file extension, without the dot.
	 * @param file
	 * @return the extension, or null if the file name has none
	 */
	static String getExtension(File file) {
		String name = file.getName();
		int ind = name.lastIndexOf('.');
		if (ind <= 0 || ind == name.length() - 1)
			return null;
		return name.substring(ind + 1).toLowerCase(Locale.ROOT);
	}

}
