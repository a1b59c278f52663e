package org.obgrid.grid;

/**
 * Fired when a cell edit is committed
 *
 * @param <R> The type of the grid's items
 */
public class EditCommitEvent<R> {
	private final R theItem;
	private final ColumnModel<R, ?> theColumn;
	private final int theRowIndex;
	private final Object theOldValue;
	private final Object theNewValue;

	EditCommitEvent(R item, ColumnModel<R, ?> column, int rowIndex, Object oldValue, Object newValue) {
		theItem = item;
		theColumn = column;
		theRowIndex = rowIndex;
		theOldValue = oldValue;
		theNewValue = newValue;
	}

	/** @return The item that was written to */
	public R getItem() {
		return theItem;
	}

	/** @return The edited column */
	public ColumnModel<R, ?> getColumn() {
		return theColumn;
	}

	/** @return The index of the row in the effective sequence when the edit was opened */
	public int getRowIndex() {
		return theRowIndex;
	}

	/** @return The value before the edit */
	public Object getOldValue() {
		return theOldValue;
	}

	/** @return The value written */
	public Object getNewValue() {
		return theNewValue;
	}

	@Override
	public String toString() {
		return "committed " + theColumn.getId() + " of " + theItem + ": " + theOldValue + "->" + theNewValue;
	}
}
