package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.obgrid.Observable;
import org.obgrid.SimpleObservable;
import org.obgrid.Subscription;
import org.obgrid.collect.CollectionChangeEvent;
import org.obgrid.collect.SimpleObservableList;

/**
 * The ordered, observable set of columns in a grid. Column IDs are unique within the set.
 *
 * @param <R> The type of the grid's items
 */
public class ColumnSet<R> {
	private final SimpleObservableList<ColumnModel<R, ?>> theColumns;
	private final Map<ColumnModel<R, ?>, Subscription> theColumnSubs;
	private final SimpleObservable<ColumnModel<R, ?>> theColumnChanges;

	/** Creates an empty column set */
	public ColumnSet() {
		theColumns = new SimpleObservableList<>();
		theColumnSubs = new IdentityHashMap<>();
		theColumnChanges = new SimpleObservable<>();
	}

	/**
	 * @param columns The initial columns for the set
	 */
	public ColumnSet(List<? extends ColumnModel<R, ?>> columns) {
		this();
		for (ColumnModel<R, ?> column : columns)
			add(column);
	}

	/** @return The number of columns in this set, visible or not */
	public int size() {
		return theColumns.size();
	}

	/**
	 * @param index The index of the column to get
	 * @return The column at the given index
	 */
	public ColumnModel<R, ?> get(int index) {
		return theColumns.get(index);
	}

	/**
	 * @param id The ID of the column to get
	 * @return The column with the given ID
	 * @throws NoSuchElementException If no such column exists in this set
	 */
	public ColumnModel<R, ?> get(String id) throws NoSuchElementException {
		ColumnModel<R, ?> column = find(id);
		if (column == null)
			throw new NoSuchElementException("No such column: " + id);
		return column;
	}

	/**
	 * @param id The ID of the column to find
	 * @return The column with the given ID, or null if no such column exists in this set
	 */
	public ColumnModel<R, ?> find(String id) {
		for (ColumnModel<R, ?> column : theColumns) {
			if (column.getId().equals(id))
				return column;
		}
		return null;
	}

	/**
	 * @param id The ID of the column
	 * @return The index of the column with the given ID, or -1 if no such column exists in this set
	 */
	public int indexOf(String id) {
		for (int i = 0; i < theColumns.size(); i++) {
			if (theColumns.get(i).getId().equals(id))
				return i;
		}
		return -1;
	}

	/** @return All columns in this set, in display order */
	public List<ColumnModel<R, ?>> getAll() {
		return Collections.unmodifiableList(theColumns);
	}

	/** @return The visible columns in this set, in display order */
	public List<ColumnModel<R, ?>> getVisible() {
		List<ColumnModel<R, ?>> visible = new ArrayList<>(theColumns.size());
		for (ColumnModel<R, ?> column : theColumns) {
			if (column.isVisible())
				visible.add(column);
		}
		return Collections.unmodifiableList(visible);
	}

	/**
	 * @param column The column to add at the end of this set
	 * @return This column set
	 */
	public ColumnSet<R> add(ColumnModel<R, ?> column) {
		return add(theColumns.size(), column);
	}

	/**
	 * @param index The index to insert the column at
	 * @param column The column to add
	 * @return This column set
	 * @throws IllegalArgumentException If a column with the same ID is already present
	 */
	public ColumnSet<R> add(int index, ColumnModel<R, ?> column) throws IllegalArgumentException {
		if (find(column.getId()) != null)
			throw new IllegalArgumentException("Duplicate column ID: " + column.getId());
		theColumnSubs.put(column, column.changes().act(c -> theColumnChanges.onNext(c)));
		theColumns.add(index, column);
		return this;
	}

	/**
	 * @param id The ID of the column to remove
	 * @return The removed column
	 * @throws NoSuchElementException If no such column exists in this set
	 */
	public ColumnModel<R, ?> remove(String id) throws NoSuchElementException {
		int index = indexOf(id);
		if (index < 0)
			throw new NoSuchElementException("No such column: " + id);
		ColumnModel<R, ?> removed = theColumns.remove(index);
		Subscription.unsubscribe(theColumnSubs.remove(removed));
		return removed;
	}

	/**
	 * Moves a column to a new position
	 *
	 * @param from The current index of the column
	 * @param to The index to move the column to
	 * @return This column set
	 */
	public ColumnSet<R> move(int from, int to) {
		if (from < 0 || from >= theColumns.size())
			throw new IndexOutOfBoundsException(from + " of " + theColumns.size());
		if (to < 0 || to >= theColumns.size())
			throw new IndexOutOfBoundsException(to + " of " + theColumns.size());
		if (from == to)
			return this;
		ColumnModel<R, ?> column = theColumns.get(from);
		// Keep the column's subscription; it stays in the set
		theColumns.remove(from);
		theColumns.add(to, column);
		return this;
	}

	/** @return An observable firing for each structural change (add, remove, move) to this set */
	public Observable<CollectionChangeEvent<ColumnModel<R, ?>>> changes() {
		return theColumns.changes();
	}

	/** @return An observable firing a column whenever its header or a width-affecting property changes */
	public Observable<ColumnModel<R, ?>> columnChanges() {
		return theColumnChanges.readOnly();
	}

	@Override
	public String toString() {
		return theColumns.toString();
	}
}
