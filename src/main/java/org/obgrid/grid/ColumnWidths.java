package org.obgrid.grid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The immutable result of a {@link ColumnLayoutEngine#resolve(java.util.List, int) column layout}: the pixel width of each column */
public final class ColumnWidths {
	/** No columns */
	public static final ColumnWidths EMPTY = new ColumnWidths(Collections.emptyMap(), 0);

	private final Map<String, Integer> theWidths;
	private final int theViewportWidth;
	private final int theTotal;

	ColumnWidths(Map<String, Integer> widths, int viewportWidth) {
		theWidths = Collections.unmodifiableMap(new LinkedHashMap<>(widths));
		theViewportWidth = viewportWidth;
		int total = 0;
		for (int w : widths.values())
			total += w;
		theTotal = total;
	}

	/**
	 * @param columnId The ID of the column
	 * @return The resolved width of the column, or 0 if it is hidden or unknown
	 */
	public int getWidth(String columnId) {
		Integer w = theWidths.get(columnId);
		return w == null ? 0 : w;
	}

	/** @return The sum of all column widths */
	public int getTotal() {
		return theTotal;
	}

	/** @return The viewport width the widths were resolved for */
	public int getViewportWidth() {
		return theViewportWidth;
	}

	/** @return Whether the columns are wider than the viewport, requiring horizontal scrolling */
	public boolean isOverflowing() {
		return theTotal > theViewportWidth;
	}

	/** @return The width of each column by ID, in column order */
	public Map<String, Integer> asMap() {
		return theWidths;
	}

	@Override
	public int hashCode() {
		return theWidths.hashCode() * 17 + theViewportWidth;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ColumnWidths && theViewportWidth == ((ColumnWidths) obj).theViewportWidth
			&& theWidths.equals(((ColumnWidths) obj).theWidths);
	}

	@Override
	public String toString() {
		return theWidths + "/" + theViewportWidth + (isOverflowing() ? " (overflow)" : "");
	}
}
