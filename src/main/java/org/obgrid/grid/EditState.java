package org.obgrid.grid;

/** The states of the {@link CellEditController} */
public enum EditState {
	/** No cell is being edited */
	IDLE,
	/** A cell is being edited */
	EDITING,
	/** The pending value of the edited cell is being validated and written. Transient. */
	COMMITTING,
	/** The edit is being discarded. Transient. */
	CANCELLED;
}
