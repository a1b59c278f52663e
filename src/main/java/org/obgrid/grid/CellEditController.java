package org.obgrid.grid;

import java.util.Objects;
import java.util.function.Consumer;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;
import org.obgrid.Subscription;

/**
 * <p>
 * Governs in-place cell editing. At most one {@link EditSession} is open at a time.
 * </p>
 * <p>
 * States: {@link EditState#IDLE IDLE} &rarr; {@link EditState#EDITING EDITING} &rarr; either {@link EditState#COMMITTING COMMITTING}
 * &rarr; IDLE, or {@link EditState#CANCELLED CANCELLED} &rarr; IDLE. A commit whose value is rejected or whose setter fails returns to
 * EDITING.
 * </p>
 * <p>
 * The controller listens to its virtualizer: if the container of the open session is re-bound to a different row, the session is
 * cancelled before the container changes, so a pending value is never written to the wrong item. A commit always writes to the item the
 * session was opened on.
 * </p>
 *
 * @param <R> The type of the grid's items
 */
public class CellEditController<R> implements RowVirtualizer.RebindListener<R> {
	private final ColumnSet<R> theColumns;
	private final RowVirtualizer<R> theVirtualizer;
	private final Consumer<? super ValueAccessException> theFaultSink;
	private final Subscription theRebindSub;
	private final SimpleObservable<EditCommitEvent<R>> theCommits;
	private final SimpleObservable<EditCancelEvent<R>> theCancels;
	private EditState theState;
	private EditSession<R> theSession;
	private boolean isReadOnly;

	/**
	 * @param columns The grid's columns
	 * @param virtualizer The virtualizer whose containers are edited
	 * @param faultSink Receives getter faults when opening an edit, may be null
	 */
	public CellEditController(ColumnSet<R> columns, RowVirtualizer<R> virtualizer, Consumer<? super ValueAccessException> faultSink) {
		theColumns = Objects.requireNonNull(columns, "columns");
		theVirtualizer = Objects.requireNonNull(virtualizer, "virtualizer");
		theFaultSink = faultSink;
		theCommits = new SimpleObservable<>();
		theCancels = new SimpleObservable<>();
		theState = EditState.IDLE;
		theRebindSub = virtualizer.addRebindListener(this);
	}

	/** @return The current state of this controller */
	public EditState getState() {
		return theState;
	}

	/** @return The open session, or null if none is open */
	public EditSession<R> getSession() {
		return theSession;
	}

	/** @return Whether an edit session is open */
	public boolean isEditing() {
		return theSession != null;
	}

	/** @return Whether all editing is disabled */
	public boolean isReadOnly() {
		return isReadOnly;
	}

	/**
	 * @param readOnly Whether to disable all editing. Disabling editing cancels any open session.
	 * @return This controller
	 */
	public CellEditController<R> setReadOnly(boolean readOnly) {
		isReadOnly = readOnly;
		if (readOnly && theSession != null)
			cancel();
		return this;
	}

	/** @return An observable firing for each committed edit */
	public Observable<EditCommitEvent<R>> commits() {
		return theCommits.readOnly();
	}

	/** @return An observable firing for each cancelled edit */
	public Observable<EditCancelEvent<R>> cancels() {
		return theCancels.readOnly();
	}

	/**
	 * @param index The index of the row in the effective sequence
	 * @param columnId The ID of the column to edit
	 * @return Whether the edit was opened
	 * @see #beginEdit(RowContainer, String)
	 */
	public boolean beginEdit(int index, String columnId) {
		RowContainer<R> container = theVirtualizer.getContainer(index);
		if (container == null) {
			theColumns.get(columnId); // Unknown columns are still an error
			return false;
		}
		return beginEdit(container, columnId);
	}

	/**
	 * Opens an edit on a cell. The edit is refused if editing is disabled, the container is unbound or holds a group header, or the
	 * column is not editable for the row. If another edit is open, it is committed first, and if that commit fails the new edit is not
	 * opened.
	 *
	 * @param container The container of the row to edit
	 * @param columnId The ID of the column to edit
	 * @return Whether the edit is open
	 * @throws java.util.NoSuchElementException If no such column exists
	 */
	public boolean beginEdit(RowContainer<R> container, String columnId) {
		ColumnModel<R, ?> column = theColumns.get(columnId);
		if (theState == EditState.COMMITTING || theState == EditState.CANCELLED)
			throw new GridInvariantException("Cannot open an edit while another is " + theState);
		if (isReadOnly || !column.isVisible() || !container.isBound() || container.getEntry().isGroupHeader())
			return false;
		if (theSession != null) {
			if (theSession.getContainer() == container && theSession.getColumnId().equals(columnId))
				return true;
		}
		R item = container.getItem();
		Object value;
		try {
			value = column.getValue(item);
		} catch (RuntimeException e) {
			if (theFaultSink != null)
				theFaultSink.accept(new ValueAccessException(columnId, item, e));
			return false;
		}
		if (!((ColumnModel<R, Object>) column).isEditable(item, value))
			return false;
		if (theSession != null && !commit().isCommitted())
			return false;
		if (!container.isBound() || !Objects.equals(container.getItem(), item))
			return false; // The commit caused the container to be re-bound
		theSession = new EditSession<>(container, column, value);
		theState = EditState.EDITING;
		return true;
	}

	/**
	 * @param value The value the user has entered in the editor
	 * @return Whether an edit is open to receive the value
	 */
	public boolean setPendingValue(Object value) {
		if (theSession == null)
			return false;
		theSession.setPendingValue(value);
		return true;
	}

	/**
	 * Validates the pending value of the open edit and writes it to the item the edit was opened on
	 *
	 * @return The result of the commit
	 */
	public EditResult commit() {
		if (theSession == null)
			return EditResult.noSession();
		EditSession<R> session = theSession;
		ColumnModel<R, ?> column = session.getColumn();
		theState = EditState.COMMITTING;
		String error;
		try {
			error = column.validate(session.getItem(), session.getPendingValue());
		} catch (GridInvariantException e) {
			throw e;
		} catch (RuntimeException e) {
			theState = EditState.EDITING;
			return EditResult.fault(e);
		}
		if (error != null) {
			theState = EditState.EDITING;
			return EditResult.invalid(error);
		}
		try {
			column.setValue(session.getItem(), session.getPendingValue());
		} catch (GridInvariantException e) {
			throw e;
		} catch (RuntimeException e) {
			theState = EditState.EDITING;
			return EditResult.fault(e);
		}
		theSession = null;
		theState = EditState.IDLE;
		theCommits.onNext(new EditCommitEvent<>(session.getItem(), column, session.getRowIndex(), session.getOriginalValue(),
			session.getPendingValue()));
		return EditResult.committed();
	}

	/**
	 * Discards the pending value of the open edit and restores the cell's original display
	 *
	 * @return Whether an edit was open
	 */
	public boolean cancel() {
		if (theSession == null)
			return false;
		EditSession<R> session = theSession;
		theVirtualizer.restoreCell(session.getContainer(), session.getColumnId(), session.getOriginalValue());
		close(session, false);
		return true;
	}

	/**
	 * Commits the open edit if focus moved to a different cell
	 *
	 * @param index The index in the effective sequence of the newly focused row
	 * @param columnId The ID of the newly focused column
	 * @return The result of the commit, or null if focus remained in the edited cell
	 */
	public EditResult focusMoved(int index, String columnId) {
		if (theSession == null)
			return EditResult.noSession();
		else if (theSession.getContainer().getIndex() == index && theSession.getColumnId().equals(columnId))
			return null;
		return commit();
	}

	@Override
	public void beforeRebind(RowContainer<R> container, int newIndex, ViewEntry<R> newEntry) {
		if (theSession == null || theSession.getContainer() != container)
			return;
		if (newIndex == theSession.getRowIndex() && newEntry != null && Objects.equals(newEntry.getItem(), theSession.getItem()))
			return; // Same row, refreshed in place
		close(theSession, true);
	}

	/** Cancels any open edit and stops listening to the virtualizer */
	public void dispose() {
		if (theSession != null)
			close(theSession, true);
		theRebindSub.unsubscribe();
	}

	private void close(EditSession<R> session, boolean forced) {
		theSession = null;
		theState = EditState.CANCELLED;
		try {
			theCancels.onNext(new EditCancelEvent<>(session, forced));
		} finally {
			theState = EditState.IDLE;
		}
	}
}
