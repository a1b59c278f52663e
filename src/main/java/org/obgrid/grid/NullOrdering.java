package org.obgrid.grid;

/** Where null column values are placed in a sorted view, regardless of the sort direction */
public enum NullOrdering {
	/** Nulls before all other values */
	FIRST,
	/** Nulls after all other values */
	LAST;
}
