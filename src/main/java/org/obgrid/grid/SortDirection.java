package org.obgrid.grid;

/** The direction of a column's sort */
public enum SortDirection {
	/** Smallest values first */
	ASCENDING("▲"),
	/** Largest values first */
	DESCENDING("▼");

	private final String theIndicator;

	private SortDirection(String indicator) {
		theIndicator = indicator;
	}

	/** @return The glyph a header displays for a column sorted in this direction */
	public String getIndicator() {
		return theIndicator;
	}

	/** @return The opposite direction */
	public SortDirection reverse() {
		return this == ASCENDING ? DESCENDING : ASCENDING;
	}
}
