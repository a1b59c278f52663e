package org.obgrid.grid;

/**
 * Thrown when one of the grid's structural invariants is found broken, e.g. two open edit sessions or a row container bound to an index
 * outside the displayed sequence. This always indicates a defect in the grid itself and is never caught by it.
 */
public class GridInvariantException extends IllegalStateException {
	/** @param message The description of the broken invariant */
	public GridInvariantException(String message) {
		super(message);
	}
}
