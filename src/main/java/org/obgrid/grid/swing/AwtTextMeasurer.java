package org.obgrid.grid.swing;

import java.awt.Font;
import java.awt.font.FontRenderContext;

import org.obgrid.grid.TextMeasurer;

/** Measures text with AWT font metrics. No display is needed. */
public class AwtTextMeasurer implements TextMeasurer {
	/** A measurer using anti-aliased, fractional metrics */
	public static final AwtTextMeasurer INSTANCE = new AwtTextMeasurer(new FontRenderContext(null, true, true));

	private final FontRenderContext theContext;

	/**
	 * @param context The render context to measure in
	 */
	public AwtTextMeasurer(FontRenderContext context) {
		theContext = context;
	}

	@Override
	public int measure(String text, Font font) {
		if (text == null || text.isEmpty())
			return 0;
		return (int) Math.ceil(font.getStringBounds(text, theContext).getWidth());
	}
}
