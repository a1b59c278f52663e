package org.obgrid.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, ordered list of {@link SortKey}s. The first key is the primary sort; subsequent keys break ties.
 */
public final class SortState {
	/** The unsorted state */
	public static final SortState NONE = new SortState(Collections.emptyList());

	private final List<SortKey> theKeys;

	private SortState(List<SortKey> keys) {
		theKeys = keys;
	}

	/**
	 * @param columnId The ID of the column to sort by
	 * @param direction The direction to sort in
	 * @return A single-column sort state
	 */
	public static SortState of(String columnId, SortDirection direction) {
		return new SortState(Collections.singletonList(new SortKey(columnId, direction)));
	}

	/**
	 * @param keys The sort keys, primary first
	 * @return A sort state with the given keys
	 * @throws IllegalArgumentException If a column appears more than once
	 */
	public static SortState of(List<SortKey> keys) {
		if (keys.isEmpty())
			return NONE;
		List<SortKey> copy = new ArrayList<>(keys.size());
		for (SortKey key : keys) {
			for (SortKey other : copy) {
				if (other.getColumnId().equals(key.getColumnId()))
					throw new IllegalArgumentException("Column " + key.getColumnId() + " is sorted more than once");
			}
			copy.add(key);
		}
		return new SortState(Collections.unmodifiableList(copy));
	}

	/** @return The sort keys, primary first */
	public List<SortKey> getKeys() {
		return theKeys;
	}

	/** @return Whether this state sorts anything */
	public boolean isActive() {
		return !theKeys.isEmpty();
	}

	/**
	 * @param columnId The ID of the column
	 * @return The direction the given column is sorted in, or null if it is not sorted
	 */
	public SortDirection getDirection(String columnId) {
		for (SortKey key : theKeys) {
			if (key.getColumnId().equals(columnId))
				return key.getDirection();
		}
		return null;
	}

	/**
	 * @param columnId The ID of the column
	 * @return The header indicator for the column's sort: "▲", "▼", or "" if the column is not sorted
	 */
	public String getIndicator(String columnId) {
		SortDirection dir = getDirection(columnId);
		return dir == null ? "" : dir.getIndicator();
	}

	/**
	 * @param columnId The ID of the column to add as the least significant key
	 * @param direction The direction to sort the column in
	 * @return A sort state with this state's keys followed by the given key, replacing any existing key for the column
	 */
	public SortState then(String columnId, SortDirection direction) {
		List<SortKey> keys = new ArrayList<>(theKeys.size() + 1);
		for (SortKey key : theKeys) {
			if (!key.getColumnId().equals(columnId))
				keys.add(key);
		}
		keys.add(new SortKey(columnId, direction));
		return of(keys);
	}

	/**
	 * <p>
	 * Cycles the sort of a column: unsorted &rarr; ascending &rarr; descending &rarr; unsorted.
	 * </p>
	 * <p>
	 * If not additive, the result sorts only by the given column. If additive, other keys are retained and the column is cycled in place
	 * (or appended as the least significant key if it was not sorted).
	 * </p>
	 *
	 * @param columnId The ID of the column to toggle
	 * @param additive Whether to keep the other columns' sort keys
	 * @return The toggled sort state
	 */
	public SortState toggle(String columnId, boolean additive) {
		SortDirection current = getDirection(columnId);
		SortDirection next;
		if (current == null)
			next = SortDirection.ASCENDING;
		else if (current == SortDirection.ASCENDING)
			next = SortDirection.DESCENDING;
		else
			next = null;
		if (!additive)
			return next == null ? NONE : of(columnId, next);
		List<SortKey> keys = new ArrayList<>(theKeys.size() + 1);
		boolean found = false;
		for (SortKey key : theKeys) {
			if (key.getColumnId().equals(columnId)) {
				found = true;
				if (next != null)
					keys.add(new SortKey(columnId, next));
			} else
				keys.add(key);
		}
		if (!found)
			keys.add(new SortKey(columnId, next));
		return of(keys);
	}

	/**
	 * @param columnId The ID of the column to remove
	 * @return A sort state without the given column
	 */
	public SortState without(String columnId) {
		if (getDirection(columnId) == null)
			return this;
		List<SortKey> keys = new ArrayList<>(theKeys);
		keys.removeIf(k -> k.getColumnId().equals(columnId));
		return of(keys);
	}

	@Override
	public int hashCode() {
		return theKeys.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SortState && theKeys.equals(((SortState) obj).theKeys);
	}

	@Override
	public String toString() {
		return theKeys.isEmpty() ? "unsorted" : theKeys.toString();
	}
}
