package org.obgrid.grid;

/** Selection behavior of a grid */
public enum SelectionMode {
	/** Rows cannot be selected */
	NONE,
	/** Selecting a row deselects any other */
	SINGLE,
	/** Selecting a row toggles its membership in the selection */
	MULTIPLE;
}
