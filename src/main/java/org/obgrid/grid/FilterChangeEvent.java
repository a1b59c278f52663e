package org.obgrid.grid;

/** Fired when a grid's filters change */
public class FilterChangeEvent {
	private final FilterState theOldFilter;
	private final FilterState theNewFilter;
	private final int theMatchCount;

	/**
	 * @param oldFilter The previous filters
	 * @param newFilter The new filters
	 * @param matchCount The number of items passing the new filters
	 */
	public FilterChangeEvent(FilterState oldFilter, FilterState newFilter, int matchCount) {
		theOldFilter = oldFilter;
		theNewFilter = newFilter;
		theMatchCount = matchCount;
	}

	/** @return The previous filters */
	public FilterState getOldFilter() {
		return theOldFilter;
	}

	/** @return The new filters */
	public FilterState getNewFilter() {
		return theNewFilter;
	}

	/** @return The number of items passing the new filters */
	public int getMatchCount() {
		return theMatchCount;
	}

	@Override
	public String toString() {
		return "filter " + theOldFilter + "->" + theNewFilter + " (" + theMatchCount + " matches)";
	}
}
