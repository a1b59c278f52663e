package org.obgrid.grid;

import java.util.List;

/**
 * Fired when a grid's selection changes
 *
 * @param <R> The type of the grid's items
 */
public class SelectionChangeEvent<R> {
	private final List<R> theAdded;
	private final List<R> theRemoved;
	private final List<R> theSelection;

	SelectionChangeEvent(List<R> added, List<R> removed, List<R> selection) {
		theAdded = added;
		theRemoved = removed;
		theSelection = selection;
	}

	/** @return The newly selected items */
	public List<R> getAdded() {
		return theAdded;
	}

	/** @return The newly deselected items */
	public List<R> getRemoved() {
		return theRemoved;
	}

	/** @return All selected items after the change */
	public List<R> getSelection() {
		return theSelection;
	}

	@Override
	public String toString() {
		return "selection +" + theAdded + " -" + theRemoved;
	}
}
