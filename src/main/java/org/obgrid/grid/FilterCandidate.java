package org.obgrid.grid;

/** A distinct value offered in a column's filter list, with the number of otherwise-visible items having it */
public final class FilterCandidate {
	/** Display text for the null value */
	public static final String EMPTY_TEXT = "(Empty)";

	private final Object theValue;
	private final String theDisplayText;
	private final int theCount;
	private final boolean isSelected;

	FilterCandidate(Object value, String displayText, int count, boolean selected) {
		theValue = value;
		theDisplayText = displayText;
		theCount = count;
		isSelected = selected;
	}

	/** @return The column value, may be null */
	public Object getValue() {
		return theValue;
	}

	/** @return The text to display for the value */
	public String getDisplayText() {
		return theDisplayText;
	}

	/** @return The number of items with this value that pass all other columns' filters */
	public int getCount() {
		return theCount;
	}

	/** @return Whether this value is accepted by the column's current filter */
	public boolean isSelected() {
		return isSelected;
	}

	@Override
	public String toString() {
		return theDisplayText + " (" + theCount + ")" + (isSelected ? "*" : "");
	}
}
