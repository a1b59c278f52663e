package org.obgrid.grid;

import java.awt.Color;
import java.awt.Font;

/** Supplies the theme values a grid's engine needs. Resolution of themes, styles and palettes is the host's business. */
public interface ThemeProvider {
	/** A theme with a 14-point sans-serif font (bold for headers), black text and a blue accent */
	ThemeProvider DEFAULT = new ThemeProvider() {
		private final Font theHeaderFont = new Font(Font.SANS_SERIF, Font.BOLD, 14);
		private final Font theCellFont = new Font(Font.SANS_SERIF, Font.PLAIN, 14);
		private final Color theAccent = new Color(0x1E, 0x88, 0xE5);

		@Override
		public Font getHeaderFont() {
			return theHeaderFont;
		}

		@Override
		public Font getCellFont() {
			return theCellFont;
		}

		@Override
		public Color getAccentColor() {
			return theAccent;
		}

		@Override
		public Color getForegroundColor() {
			return Color.black;
		}

		@Override
		public String toString() {
			return "default theme";
		}
	};

	/** @return The font used for column headers */
	Font getHeaderFont();

	/** @return The font used for cell text */
	Font getCellFont();

	/** @return The color used for highlights such as the selection and sort indicators */
	Color getAccentColor();

	/** @return The color used for text */
	Color getForegroundColor();
}
