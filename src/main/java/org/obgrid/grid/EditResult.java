package org.obgrid.grid;

/** The outcome of an attempt to {@link CellEditController#commit() commit} a cell edit */
public final class EditResult {
	/** The kinds of edit outcome */
	public enum Kind {
		/** The value was written and the session closed */
		COMMITTED,
		/** The value was rejected by the column's type or validator; the session is still open */
		INVALID,
		/** The column's setter threw an exception; the session is still open */
		FAULT,
		/** There was no session to commit */
		NO_SESSION
	}

	private static final EditResult COMMITTED = new EditResult(Kind.COMMITTED, null, null);
	private static final EditResult NO_SESSION = new EditResult(Kind.NO_SESSION, null, null);

	private final Kind theKind;
	private final String theMessage;
	private final Throwable theFault;

	private EditResult(Kind kind, String message, Throwable fault) {
		theKind = kind;
		theMessage = message;
		theFault = fault;
	}

	/** @return The result of a successful commit */
	public static EditResult committed() {
		return COMMITTED;
	}

	/**
	 * @param message The reason the value was rejected
	 * @return The result of a commit whose value was rejected
	 */
	public static EditResult invalid(String message) {
		return new EditResult(Kind.INVALID, message, null);
	}

	/**
	 * @param fault The exception thrown by the column's setter
	 * @return The result of a commit whose setter failed
	 */
	public static EditResult fault(Throwable fault) {
		return new EditResult(Kind.FAULT, String.valueOf(fault.getMessage()), fault);
	}

	/** @return The result of a commit without a session */
	public static EditResult noSession() {
		return NO_SESSION;
	}

	/** @return The kind of this result */
	public Kind getKind() {
		return theKind;
	}

	/** @return Whether the value was written */
	public boolean isCommitted() {
		return theKind == Kind.COMMITTED;
	}

	/** @return The message to display to the user for a rejected or failed commit, or null */
	public String getMessage() {
		return theMessage;
	}

	/** @return The exception thrown by the setter for a {@link Kind#FAULT FAULT} result, or null */
	public Throwable getFault() {
		return theFault;
	}

	@Override
	public String toString() {
		return theMessage == null ? theKind.name() : (theKind + ": " + theMessage);
	}
}
