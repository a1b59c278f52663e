package org.obgrid.grid;

/** Wraps an exception thrown by a column's value getter or setter */
public class ValueAccessException extends RuntimeException {
	private final String theColumnId;
	private final transient Object theItem;

	/**
	 * @param columnId The ID of the column whose accessor failed
	 * @param item The item the accessor was invoked on
	 * @param cause The exception thrown by the accessor
	 */
	public ValueAccessException(String columnId, Object item, Throwable cause) {
		super("Could not access column " + columnId + " of " + item + ": " + cause, cause);
		theColumnId = columnId;
		theItem = item;
	}

	/** @return The ID of the column whose accessor failed */
	public String getColumnId() {
		return theColumnId;
	}

	/** @return The item the accessor was invoked on */
	public Object getItem() {
		return theItem;
	}
}
