package org.obgrid.grid;

/**
 * Fired when a cell edit is cancelled, either by the user or because the edited row was recycled
 *
 * @param <R> The type of the grid's items
 */
public class EditCancelEvent<R> {
	private final EditSession<R> theSession;
	private final boolean isForced;

	EditCancelEvent(EditSession<R> session, boolean forced) {
		theSession = session;
		isForced = forced;
	}

	/** @return The cancelled session */
	public EditSession<R> getSession() {
		return theSession;
	}

	/** @return Whether the edit was cancelled by the grid rather than by the user */
	public boolean isForced() {
		return isForced;
	}

	@Override
	public String toString() {
		return (isForced ? "force-cancelled " : "cancelled ") + theSession;
	}
}
