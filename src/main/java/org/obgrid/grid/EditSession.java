package org.obgrid.grid;

/**
 * The single open cell edit of a {@link CellEditController}. The session remembers the item it was opened on, which is the item any
 * commit writes to, whatever its container displays by then.
 *
 * @param <R> The type of the grid's items
 */
public class EditSession<R> {
	private final RowContainer<R> theContainer;
	private final int theRowIndex;
	private final ColumnModel<R, ?> theColumn;
	private final R theItem;
	private final Object theOriginalValue;
	private Object thePendingValue;

	EditSession(RowContainer<R> container, ColumnModel<R, ?> column, Object originalValue) {
		theContainer = container;
		theRowIndex = container.getIndex();
		theColumn = column;
		theItem = container.getItem();
		theOriginalValue = originalValue;
		thePendingValue = originalValue;
	}

	/** @return The container the edit was opened in */
	public RowContainer<R> getContainer() {
		return theContainer;
	}

	/** @return The index in the effective sequence of the row when the edit was opened */
	public int getRowIndex() {
		return theRowIndex;
	}

	/** @return The ID of the edited column */
	public String getColumnId() {
		return theColumn.getId();
	}

	/** @return The edited column */
	public ColumnModel<R, ?> getColumn() {
		return theColumn;
	}

	/** @return The item the edit was opened on, which a commit writes to */
	public R getItem() {
		return theItem;
	}

	/** @return The cell value when the edit was opened */
	public Object getOriginalValue() {
		return theOriginalValue;
	}

	/** @return The value the user has entered so far */
	public Object getPendingValue() {
		return thePendingValue;
	}

	void setPendingValue(Object value) {
		thePendingValue = value;
	}

	@Override
	public String toString() {
		return "edit " + theColumn.getId() + "@" + theRowIndex + ": " + theOriginalValue + "->" + thePendingValue;
	}
}
