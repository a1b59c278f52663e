package org.obgrid.grid;

import java.awt.Font;

/** Measures the rendered width of text, used to size {@link SizingPolicy#FIT_HEADER FIT_HEADER} and {@link SizingPolicy#AUTO AUTO} columns */
@FunctionalInterface
public interface TextMeasurer {
	/**
	 * @param text The text to measure
	 * @param font The font the text would be rendered in
	 * @return The width of the rendered text, in pixels
	 */
	int measure(String text, Font font);
}
