package org.obgrid.grid;

import java.awt.Font;

/** Measures every character as the same width, regardless of font */
public class FixedWidthMeasurer implements TextMeasurer {
	private final int theCharWidth;

	public FixedWidthMeasurer(int charWidth) {
		theCharWidth = charWidth;
	}

	@Override
	public int measure(String text, Font font) {
		return text == null ? 0 : text.length() * theCharWidth;
	}
}
