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

package hybridizer.lib.awt.text;

import java.awt.Color;
import java.awt.Font;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

import hybridizer.lib.awt.common.BufferedImageTools;
import hybridizer.lib.images.ByteImage;

/**
 * Create images containing text, to use as sources for hybrid images.
 * 
 * @author Hybridizer developers
 */
public class TextImages {
	
	/**
	 * Canvas width allowed per character of the longest message.
	 */
	public static final int WIDTH_PER_CHARACTER = 100;
	
	private TextImages() {
		throw new AssertionError();
	}
	
	/**
	 * Get a canvas width large enough for all the messages.
	 * @param messages
	 * @return
	 * @throws IllegalArgumentException if all messages are empty
	 */
	public static int canvasWidth(String... messages) throws IllegalArgumentException {
		int maxLength = 0;
		for (var msg : messages) {
			if (msg != null)
				maxLength = Math.max(maxLength, msg.length());
		}
		if (maxLength == 0)
			throw new IllegalArgumentException("At least one message must contain text");
		return maxLength * WIDTH_PER_CHARACTER;
	}
	
	/**
	 * Draw a message in a bold sans-serif font on a transparent canvas.
	 * 
	 * @param message the text to draw
	 * @param width canvas width
	 * @param height canvas height
	 * @param x left of the text
	 * @param y top of the text
	 * @param fontSize font size, in pixels
	 * @param argb packed ARGB text color
	 * @return an RGBA image
	 */
	public static ByteImage render(String message, int width, int height, int x, int y, float fontSize, int argb) {
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		var g2d = img.createGraphics();
		try {
			g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
			g2d.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 1).deriveFont(fontSize));
			g2d.setColor(new Color(argb, true));
			// drawString expects the baseline
			g2d.drawString(message, x, y + g2d.getFontMetrics().getAscent());
		} finally {
			g2d.dispose();
		}
		return BufferedImageTools.toByteImage(img);
	}

}
