package org.obgrid.grid;

import java.util.Objects;

/** A single key of a {@link SortState}: a column and the direction to sort its values */
public final class SortKey {
	private final String theColumnId;
	private final SortDirection theDirection;

	/**
	 * @param columnId The ID of the column to sort by
	 * @param direction The direction to sort in
	 */
	public SortKey(String columnId, SortDirection direction) {
		theColumnId = Objects.requireNonNull(columnId, "columnId");
		theDirection = Objects.requireNonNull(direction, "direction");
	}

	/** @return The ID of the column to sort by */
	public String getColumnId() {
		return theColumnId;
	}

	/** @return The direction to sort in */
	public SortDirection getDirection() {
		return theDirection;
	}

	@Override
	public int hashCode() {
		return theColumnId.hashCode() * 7 + theDirection.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof SortKey && theColumnId.equals(((SortKey) obj).theColumnId)
			&& theDirection == ((SortKey) obj).theDirection;
	}

	@Override
	public String toString() {
		return theColumnId + theDirection.getIndicator();
	}
}
