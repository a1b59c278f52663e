package org.obgrid.grid.swing;

import java.awt.Color;
import java.awt.Font;

import javax.swing.UIManager;

import org.obgrid.grid.ThemeProvider;

/** Reads a grid's theme from the current Swing look and feel, falling back to {@link ThemeProvider#DEFAULT} */
public class SwingThemeProvider implements ThemeProvider {
	@Override
	public Font getHeaderFont() {
		Font font = UIManager.getFont("TableHeader.font");
		return font != null ? font : DEFAULT.getHeaderFont();
	}

	@Override
	public Font getCellFont() {
		Font font = UIManager.getFont("Table.font");
		return font != null ? font : DEFAULT.getCellFont();
	}

	@Override
	public Color getAccentColor() {
		Color color = UIManager.getColor("Table.selectionBackground");
		return color != null ? color : DEFAULT.getAccentColor();
	}

	@Override
	public Color getForegroundColor() {
		Color color = UIManager.getColor("Table.foreground");
		return color != null ? color : DEFAULT.getForegroundColor();
	}
}
