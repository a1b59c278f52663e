package org.obgrid.grid;

/** How the {@link ColumnLayoutEngine} determines the width of a column */
public enum SizingPolicy {
	/** Sized by content, provisionally by the header until rows have been measured */
	AUTO,
	/** The column's declared {@link ColumnModel#getFixedWidth() fixed width} */
	FIXED,
	/** The measured width of the column's header label */
	FIT_HEADER,
	/** A share, proportional to the column's {@link ColumnModel#getFillWeight() weight}, of the width left over by other columns */
	FILL;
}
