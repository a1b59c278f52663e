package org.obgrid.grid;

/**
 * Validates a value entered for a cell before it is written to the item
 *
 * @param <R> The type of the grid's items
 * @param <C> The type of the column's values
 */
@FunctionalInterface
public interface CellValidator<R, C> {
	/**
	 * @param item The item being edited
	 * @param value The value entered by the user
	 * @return null if the value is acceptable, or a message describing why it is not
	 */
	String validate(R item, C value);
}
