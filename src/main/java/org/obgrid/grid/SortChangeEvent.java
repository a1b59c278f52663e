package org.obgrid.grid;

/** Fired when a grid's sort changes */
public class SortChangeEvent {
	private final SortState theOldSort;
	private final SortState theNewSort;

	/**
	 * @param oldSort The previous sort
	 * @param newSort The new sort
	 */
	public SortChangeEvent(SortState oldSort, SortState newSort) {
		theOldSort = oldSort;
		theNewSort = newSort;
	}

	/** @return The previous sort */
	public SortState getOldSort() {
		return theOldSort;
	}

	/** @return The new sort */
	public SortState getNewSort() {
		return theNewSort;
	}

	@Override
	public String toString() {
		return "sort " + theOldSort + "->" + theNewSort;
	}
}
